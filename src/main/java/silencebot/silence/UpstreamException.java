package silencebot.silence;

import silencebot.SilenceBotException;

/**
 * 上游 Alertmanager 调用失败
 */
public class UpstreamException extends SilenceBotException {
    public UpstreamException(String message) {
        super(message);
    }

    public UpstreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
