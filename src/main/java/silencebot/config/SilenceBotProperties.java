package silencebot.config;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Getter
@Component
public class SilenceBotProperties {

    @Value("${silencebot.alertmanager.url:http://localhost:9093}")
    private String alertmanagerUrl;

    @Value("${silencebot.silence.created-by:alertmanager-bot}")
    private String createdBy;

    @Value("${silencebot.silence.comment:Enacted by administrator command}")
    private String comment;

    @Value("${silencebot.maintenance.default-hours:8}")
    private int maintenanceDefaultHours;

    @Value("${silencebot.maintenance.max-hours:24}")
    private int maintenanceMaxHours;
}
