package personal.ai.calendar.scheduling.application.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.ai.calendar.scheduling.application.port.in.ManageSettingsUseCase;
import personal.ai.calendar.scheduling.application.port.out.CalendarRepository;
import personal.ai.calendar.scheduling.domain.exception.InvalidDateException;
import personal.ai.calendar.scheduling.domain.model.Booking;
import personal.ai.calendar.scheduling.domain.model.BookingStatus;
import personal.ai.calendar.scheduling.domain.model.DayAvailability;
import personal.ai.calendar.scheduling.domain.model.GlobalSettings;
import personal.ai.calendar.scheduling.domain.model.RecurringRule;
import personal.ai.calendar.scheduling.domain.service.AvailabilityCalculator;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("AvailabilityQueryService 단위 테스트")
class AvailabilityQueryServiceTest {

    private static final String PROVIDER_ID = "provider-1";
    private static final Instant NOW = Instant.parse("2024-01-15T07:30:00Z");
    private static final LocalDate TODAY = LocalDate.of(2024, 1, 15);

    @Mock
    private ManageSettingsUseCase manageSettingsUseCase;
    @Mock
    private CalendarRepository calendarRepository;
    private AvailabilityQueryService availabilityQueryService;

    @BeforeEach
    void setUp() {
        availabilityQueryService = new AvailabilityQueryService(
                manageSettingsUseCase, calendarRepository, new AvailabilityCalculator(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("저장소 데이터와 현재 시각으로 가용 슬롯 계산")
    void getAvailability() {
        // given: 07:30 + 2h = 09:30 경계
        LocalDate tomorrow = TODAY.plusDays(1);
        given(manageSettingsUseCase.getOrCreateSettings(PROVIDER_ID))
                .willReturn(new GlobalSettings(PROVIDER_ID, 30, 2, null, NOW, NOW));
        given(calendarRepository.listRules(PROVIDER_ID)).willReturn(List.of(
                new RecurringRule(PROVIDER_ID, 15, List.of(LocalTime.of(9, 0), LocalTime.of(10, 0)), NOW, NOW),
                new RecurringRule(PROVIDER_ID, 16, List.of(LocalTime.of(9, 0)), NOW, NOW)));
        given(calendarRepository.listOverrides(PROVIDER_ID, TODAY, tomorrow)).willReturn(List.of());
        given(calendarRepository.listBookingsForRange(PROVIDER_ID, TODAY, tomorrow)).willReturn(List.of(
                new Booking(PROVIDER_ID, tomorrow, LocalTime.of(9, 0), "client", BookingStatus.CONFIRMED,
                        Map.of(), NOW, NOW)));

        // when
        List<DayAvailability> result = availabilityQueryService.getAvailability(PROVIDER_ID, TODAY, tomorrow);

        // then
        assertThat(result).containsExactly(new DayAvailability(TODAY, List.of(LocalTime.of(10, 0))));
    }

    @Test
    @DisplayName("역순 범위는 저장소 접근 없이 거부")
    void invertedRange() {
        assertThatThrownBy(() -> availabilityQueryService.getAvailability(PROVIDER_ID, TODAY, TODAY.minusDays(1)))
                .isInstanceOf(InvalidDateException.class);
        verifyNoInteractions(calendarRepository, manageSettingsUseCase);
    }
}
