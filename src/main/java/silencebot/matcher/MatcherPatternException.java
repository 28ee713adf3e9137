package silencebot.matcher;

import com.google.re2j.PatternSyntaxException;
import lombok.Getter;
import silencebot.SilenceBotException;

/**
 * 正则匹配器的表达式无法编译
 */
@Getter
public class MatcherPatternException extends SilenceBotException {

    private final String pattern;

    public MatcherPatternException(String pattern, PatternSyntaxException cause) {
        super("无效的正则表达式: " + pattern, cause);
        this.pattern = pattern;
    }
}
