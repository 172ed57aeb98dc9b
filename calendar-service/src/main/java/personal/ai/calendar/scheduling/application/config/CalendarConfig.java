package personal.ai.calendar.scheduling.application.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Calendar Configuration
 * 모든 날짜/시간 계산은 UTC 기준
 */
@Configuration
@EnableConfigurationProperties(CalendarProperties.class)
public class CalendarConfig {

    @Bean
    public Clock calendarClock() {
        return Clock.systemUTC();
    }
}
