package silencebot.alertmanager;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;

/**
 * 告警指纹计算(与 Prometheus 标签集指纹一致)
 */
public final class Fingerprints {

    private static final long OFFSET_64 = 0xcbf29ce484222325L;
    private static final long PRIME_64 = 0x100000001b3L;
    private static final byte SEPARATOR = (byte) 0xff;

    private Fingerprints() {
    }

    /**
     * 对按名称排序的标签做 FNV-1a 64 位哈希, 名称和值后各追加一个 0xff 分隔字节
     */
    public static String of(Map<String, String> labels) {
        long hash = OFFSET_64;
        for (Map.Entry<String, String> label : new TreeMap<>(labels).entrySet()) {
            hash = add(hash, label.getKey().getBytes(StandardCharsets.UTF_8));
            hash = add(hash, SEPARATOR);
            hash = add(hash, label.getValue().getBytes(StandardCharsets.UTF_8));
            hash = add(hash, SEPARATOR);
        }
        return String.format("%016x", hash);
    }

    private static long add(long hash, byte[] bytes) {
        for (byte b : bytes) {
            hash = add(hash, b);
        }
        return hash;
    }

    private static long add(long hash, byte b) {
        hash ^= b & 0xff;
        return hash * PRIME_64;
    }
}
