package silencebot.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import silencebot.alertmanager.AlertmanagerClient;
import silencebot.silence.SilenceFactory;
import silencebot.silence.SilenceService;

import java.time.Clock;

@Slf4j
@Configuration
public class SilenceBotConfiguration {

    @Autowired
    private SilenceBotProperties properties;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SilenceFactory silenceFactory(Clock clock) {
        return new SilenceFactory(clock, properties.getCreatedBy(), properties.getComment());
    }

    @Bean
    public AlertmanagerClient alertmanagerClient() {
        log.info("Alertmanager地址: {}", properties.getAlertmanagerUrl());
        return new AlertmanagerClient(properties.getAlertmanagerUrl());
    }

    @Bean
    public SilenceService silenceService(SilenceFactory silenceFactory, AlertmanagerClient client, Clock clock) {
        if (properties.getMaintenanceDefaultHours() < 1
                || properties.getMaintenanceDefaultHours() > properties.getMaintenanceMaxHours()) {
            throw new IllegalArgumentException("维护窗口默认小时数必须在 [1, "
                    + properties.getMaintenanceMaxHours() + "] 之间");
        }
        return new SilenceService(silenceFactory, client, client, client, clock,
                properties.getMaintenanceDefaultHours(),
                properties.getMaintenanceMaxHours());
    }
}
