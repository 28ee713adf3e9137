package silencebot.matcher;

import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * 标签集工具
 */
public final class LabelSets {

    private LabelSets() {
    }

    /**
     * 按标签名排序渲染为 {a="1", b="2"}, 结果可由 {@link MatcherParser#parseAll} 还原为等值匹配器
     */
    public static String render(Map<String, String> labels) {
        return new TreeMap<>(labels).entrySet().stream()
                .map(e -> e.getKey() + "=\"" + Matcher.escape(e.getValue()) + '"')
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
