package silencebot.silence;

import silencebot.SilenceBotException;

/**
 * 当前没有任何告警
 */
public class NoAlertsException extends SilenceBotException {
    public NoAlertsException() {
        super("当前没有任何告警");
    }
}
