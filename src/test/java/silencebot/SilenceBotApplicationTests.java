package silencebot;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import silencebot.config.SilenceBotProperties;
import silencebot.silence.SilenceService;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class SilenceBotApplicationTests {

    @Autowired
    private SilenceService silenceService;

    @Autowired
    private SilenceBotProperties properties;

    @Test
    void contextLoads() {
        assertThat(silenceService).isNotNull();
        assertThat(properties.getAlertmanagerUrl()).isEqualTo("http://localhost:19093");
        assertThat(properties.getMaintenanceMaxHours()).isEqualTo(24);
    }
}
