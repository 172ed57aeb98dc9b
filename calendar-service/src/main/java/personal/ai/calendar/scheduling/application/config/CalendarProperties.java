package personal.ai.calendar.scheduling.application.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Calendar 설정 Properties
 * application.yml의 calendar.* 설정을 바인딩
 */
@Validated
@ConfigurationProperties(prefix = "calendar")
public record CalendarProperties(
        @Valid @DefaultValue Defaults defaults,
        @Valid @DefaultValue Store store
) {
    /**
     * 설정이 없는 제공자에게 처음 조회 시 생성되는 기본 정책
     */
    public record Defaults(
            @Min(1) @DefaultValue("30") int horizonDays,
            @Min(0) @DefaultValue("2") int minNoticeHours
    ) {}

    /**
     * @param type      redis | memory
     * @param keyPrefix Redis 키 접두사
     */
    public record Store(
            @NotBlank @DefaultValue("redis") String type,
            @NotBlank @DefaultValue("calendar") String keyPrefix
    ) {}
}
