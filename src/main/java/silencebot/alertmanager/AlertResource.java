package silencebot.alertmanager;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.Map;

/**
 * /api/v2/alerts 返回的告警
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AlertResource {
    private String fingerprint;
    private Map<String, String> labels;
}
