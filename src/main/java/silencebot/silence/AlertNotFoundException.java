package silencebot.silence;

import lombok.Getter;
import silencebot.SilenceBotException;

/**
 * 当前告警中没有与指纹匹配的告警
 */
@Getter
public class AlertNotFoundException extends SilenceBotException {

    private final String fingerprint;

    public AlertNotFoundException(String fingerprint) {
        super("未找到指纹对应的告警: " + fingerprint);
        this.fingerprint = fingerprint;
    }
}
