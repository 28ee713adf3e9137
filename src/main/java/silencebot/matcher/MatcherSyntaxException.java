package silencebot.matcher;

import lombok.Getter;
import silencebot.SilenceBotException;

/**
 * 匹配器语法错误
 */
@Getter
public class MatcherSyntaxException extends SilenceBotException {

    /**
     * 出错的原始文本
     */
    private final String input;

    public MatcherSyntaxException(String reason, String input) {
        super(reason + ": " + input);
        this.input = input;
    }
}
