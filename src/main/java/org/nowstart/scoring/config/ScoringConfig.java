package org.nowstart.scoring.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ScoringConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
