package personal.ai.calendar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Calendar Service Application
 * 제공자별 예약 가능 슬롯 계산과 충돌 없는 예약 처리를 담당하는 스케줄링 엔진
 */
@SpringBootApplication(
    scanBasePackages = {
        "personal.ai.calendar",
        "personal.ai.common"
    }
)
public class CalendarServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(CalendarServiceApplication.class, args);
    }
}
