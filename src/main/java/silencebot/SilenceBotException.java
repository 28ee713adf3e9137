package silencebot;

/**
 * 静默机器人异常基类
 */
public class SilenceBotException extends RuntimeException {
    public SilenceBotException(String message) {
        super(message);
    }

    public SilenceBotException(String message, Throwable cause) {
        super(message, cause);
    }
}
