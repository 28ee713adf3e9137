package silencebot.silence;

import java.time.Instant;
import java.util.List;

/**
 * 已有静默的来源
 */
public interface SilenceSource {
    /**
     * 列出上游的全部静默, 状态按 now 计算
     */
    List<Silence> listSilences(Instant now);
}
