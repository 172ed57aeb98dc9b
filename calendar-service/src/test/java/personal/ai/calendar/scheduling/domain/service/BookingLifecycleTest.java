package personal.ai.calendar.scheduling.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.ai.calendar.scheduling.adapter.out.persistence.CalendarItemMapper;
import personal.ai.calendar.scheduling.adapter.out.persistence.CalendarPersistenceAdapter;
import personal.ai.calendar.scheduling.adapter.out.store.InMemoryKeyValueStore;
import personal.ai.calendar.scheduling.application.config.CalendarProperties;
import personal.ai.calendar.scheduling.application.service.AvailabilityQueryService;
import personal.ai.calendar.scheduling.application.service.SettingsService;
import personal.ai.calendar.scheduling.domain.exception.SlotAlreadyBookedException;
import personal.ai.calendar.scheduling.domain.model.Booking;
import personal.ai.calendar.scheduling.domain.model.BookingStatus;
import personal.ai.calendar.scheduling.domain.model.DayAvailability;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BookingTransactionManager + In-Memory 저장소 테스트")
class BookingLifecycleTest {

    private static final String PROVIDER_ID = "provider-1";
    private static final LocalDate D1 = LocalDate.of(2024, 1, 15);
    private static final LocalTime T1 = LocalTime.of(9, 0);
    private static final LocalDate D2 = LocalDate.of(2024, 1, 16);
    private static final LocalTime T2 = LocalTime.of(14, 0);

    private CalendarPersistenceAdapter repository;
    private BookingTransactionManager transactionManager;
    private AvailabilityQueryService availabilityQueryService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);
        repository = new CalendarPersistenceAdapter(
                new InMemoryKeyValueStore(),
                new CalendarItemMapper(new ObjectMapper()),
                clock);
        transactionManager = new BookingTransactionManager(repository);

        CalendarProperties properties = new CalendarProperties(
                new CalendarProperties.Defaults(30, 2),
                new CalendarProperties.Store("memory", "calendar"));
        availabilityQueryService = new AvailabilityQueryService(
                new SettingsService(repository, properties), repository, new AvailabilityCalculator(), clock);
    }

    private Booking book(LocalDate date, LocalTime time, String client) {
        return transactionManager.create(
                Booking.request(PROVIDER_ID, date, time, client, Map.of("note", client), BookingStatus.PENDING));
    }

    @Test
    @DisplayName("이동 후 원래 슬롯으로 되돌리면 원래 createdAt이 유지된다")
    void rescheduleRoundTrip() {
        // given
        Booking original = book(D1, T1, "client-1");

        // when
        transactionManager.reschedule(PROVIDER_ID, D1, T1, D2, T2);
        Booking back = transactionManager.reschedule(PROVIDER_ID, D2, T2, D1, T1);

        // then
        assertThat(back.createdAt()).isEqualTo(original.createdAt());
        assertThat(repository.getBooking(PROVIDER_ID, D2, T2)).isEmpty();
        assertThat(repository.getBooking(PROVIDER_ID, D1, T1)).hasValueSatisfying(b -> {
            assertThat(b.clientIdentifier()).isEqualTo("client-1");
            assertThat(b.appointmentDetails()).containsEntry("note", "client-1");
        });
    }

    @Test
    @DisplayName("이동 충돌 시 원래 키의 예약과 대상 키의 예약 모두 변경되지 않는다")
    void rescheduleConflict_BothUnchanged() {
        book(D1, T1, "client-1");
        book(D2, T2, "client-2");

        assertThatThrownBy(() -> transactionManager.reschedule(PROVIDER_ID, D1, T1, D2, T2))
                .isInstanceOf(SlotAlreadyBookedException.class);

        assertThat(repository.getBooking(PROVIDER_ID, D1, T1).orElseThrow().clientIdentifier()).isEqualTo("client-1");
        assertThat(repository.getBooking(PROVIDER_ID, D2, T2).orElseThrow().clientIdentifier()).isEqualTo("client-2");
    }

    @Test
    @DisplayName("두 번째 예약은 충돌하고 첫 예약은 그대로 남는다")
    void secondCreate_Conflict() {
        book(D1, T1, "client-1");

        assertThatThrownBy(() -> book(D1, T1, "client-2"))
                .isInstanceOf(SlotAlreadyBookedException.class);
        assertThat(repository.getBooking(PROVIDER_ID, D1, T1).orElseThrow().clientIdentifier()).isEqualTo("client-1");
    }

    @Test
    @DisplayName("취소된 슬롯은 가용 목록에 다시 나타나지만 같은 키로 재예약하면 충돌")
    void cancelledSlot_ListedButNotRebookable() {
        // given
        repository.putRule(PROVIDER_ID, D1.getDayOfMonth(), List.of(T1));
        book(D1, T1, "client-1");
        assertThat(availabilityQueryService.getAvailability(PROVIDER_ID, D1, D1)).isEmpty();

        // when
        transactionManager.cancel(PROVIDER_ID, D1, T1);

        // then
        List<DayAvailability> reopened = availabilityQueryService.getAvailability(PROVIDER_ID, D1, D1);
        assertThat(reopened).hasSize(1);
        assertThat(reopened.get(0).slots()).containsExactly(T1);
        assertThatThrownBy(() -> book(D1, T1, "client-2"))
                .isInstanceOf(SlotAlreadyBookedException.class);
    }

    @Test
    @DisplayName("두 번 취소해도 같은 결과, 없는 예약 취소는 empty")
    void cancelTwice() {
        book(D1, T1, "client-1");

        Optional<Booking> first = transactionManager.cancel(PROVIDER_ID, D1, T1);
        Optional<Booking> second = transactionManager.cancel(PROVIDER_ID, D1, T1);

        assertThat(first).hasValueSatisfying(b -> assertThat(b.status()).isEqualTo(BookingStatus.CANCELLED));
        assertThat(second).isEqualTo(first);
        assertThat(transactionManager.cancel(PROVIDER_ID, D2, T2)).isEmpty();
    }
}
