package nl.infomedics.perio.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClockConfig {

    @Bean
    public Clock clinicClock() {
        return Clock.systemDefaultZone();
    }
}
