package silencebot;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@Slf4j
@SpringBootApplication
public class SilenceBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(SilenceBotApplication.class, args);
    }

}
