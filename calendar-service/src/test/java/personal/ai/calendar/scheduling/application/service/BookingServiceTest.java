package personal.ai.calendar.scheduling.application.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.ai.calendar.scheduling.application.port.in.CreateBookingCommand;
import personal.ai.calendar.scheduling.application.port.in.RescheduleBookingCommand;
import personal.ai.calendar.scheduling.application.port.out.CalendarRepository;
import personal.ai.calendar.scheduling.domain.exception.InvalidBookingStateException;
import personal.ai.calendar.scheduling.domain.exception.InvalidSlotTimeException;
import personal.ai.calendar.scheduling.domain.model.Booking;
import personal.ai.calendar.scheduling.domain.model.BookingStatus;
import personal.ai.calendar.scheduling.domain.service.BookingTransactionManager;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("BookingService 단위 테스트")
class BookingServiceTest {

    private static final String PROVIDER_ID = "provider-1";
    private static final LocalDate DATE = LocalDate.of(2024, 1, 15);
    private static final Instant NOW = Instant.parse("2024-01-10T08:00:00Z");

    @Mock
    private BookingTransactionManager bookingTransactionManager;
    @Mock
    private CalendarRepository calendarRepository;
    @InjectMocks
    private BookingService bookingService;

    @Test
    @DisplayName("예약 생성 시 시간 정규화 후 기본 상태 PENDING으로 요청")
    void create_NormalizesTime() {
        // given
        ArgumentCaptor<Booking> captor = ArgumentCaptor.forClass(Booking.class);
        given(bookingTransactionManager.create(any(Booking.class))).willAnswer(invocation -> invocation.getArgument(0));

        // when
        bookingService.createBooking(CreateBookingCommand.of(PROVIDER_ID, DATE, "14:30", "client-1"));

        // then
        verify(bookingTransactionManager).create(captor.capture());
        Booking request = captor.getValue();
        assertThat(request.time()).isEqualTo(LocalTime.of(14, 30));
        assertThat(request.status()).isEqualTo(BookingStatus.PENDING);
        assertThat(request.createdAt()).isNull();
    }

    @Test
    @DisplayName("잘못된 시간 형식은 저장소 접근 없이 거부")
    void create_InvalidTime() {
        assertThatThrownBy(() -> bookingService.createBooking(CreateBookingCommand.of(PROVIDER_ID, DATE, "9:3", "c")))
                .isInstanceOf(InvalidSlotTimeException.class);
        verifyNoInteractions(bookingTransactionManager);
    }

    @Test
    @DisplayName("CANCELLED 상태로 예약 생성 불가")
    void create_CancelledRejected() {
        CreateBookingCommand command = new CreateBookingCommand(
                PROVIDER_ID, DATE, "0900", "client", Map.of(), BookingStatus.CANCELLED);

        assertThatThrownBy(() -> bookingService.createBooking(command))
                .isInstanceOf(InvalidBookingStateException.class);
    }

    @Test
    @DisplayName("예약 이동 시 양쪽 시간 모두 정규화하여 위임")
    void reschedule_Delegates() {
        LocalDate newDate = DATE.plusDays(1);
        Booking moved = new Booking(PROVIDER_ID, newDate, LocalTime.of(11, 0), "client",
                BookingStatus.PENDING, Map.of(), NOW, NOW);
        given(bookingTransactionManager.reschedule(PROVIDER_ID, DATE, LocalTime.of(9, 0), newDate, LocalTime.of(11, 0)))
                .willReturn(moved);

        Booking result = bookingService.rescheduleBooking(
                new RescheduleBookingCommand(PROVIDER_ID, DATE, "0900", newDate, "11:00"));

        assertThat(result).isEqualTo(moved);
    }

    @Test
    @DisplayName("예약 취소 대상이 없으면 empty")
    void cancel_Missing() {
        given(bookingTransactionManager.cancel(PROVIDER_ID, DATE, LocalTime.of(9, 0))).willReturn(Optional.empty());

        assertThat(bookingService.cancelBooking(PROVIDER_ID, DATE, "09:00")).isEmpty();
    }
}
