package personal.ai.calendar.scheduling.domain.model;

import personal.ai.calendar.scheduling.domain.exception.InvalidBookingStateException;
import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Booking Domain Model
 * 제공자/날짜/시간 조합이 유일 키인 예약 (불변)
 *
 * @param clientIdentifier   예약자 식별자 (예: 휴대폰 번호)
 * @param appointmentDetails 자유 형식 key/value 페이로드
 * @param createdAt          최초 생성 시각, 예약 이동 시에도 유지 (저장 전에는 null)
 * @param updatedAt          마지막 저장 시각 (저장 전에는 null)
 */
public record Booking(
        String providerId,
        LocalDate date,
        LocalTime time,
        String clientIdentifier,
        BookingStatus status,
        Map<String, Object> appointmentDetails,
        Instant createdAt,
        Instant updatedAt) {

    public Booking {
        if (providerId == null || providerId.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Provider ID cannot be null or blank");
        }
        if (date == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking date cannot be null");
        }
        if (time == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking time cannot be null");
        }
        if (clientIdentifier == null || clientIdentifier.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Client identifier cannot be null or blank");
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking status cannot be null");
        }
        appointmentDetails = appointmentDetails == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(appointmentDetails));
    }

    /**
     * 신규 예약 요청 (정적 팩토리 메서드)
     * 타임스탬프는 저장 시점에 저장소가 채운다.
     */
    public static Booking request(String providerId, LocalDate date, LocalTime time,
                                  String clientIdentifier, Map<String, Object> appointmentDetails,
                                  BookingStatus status) {
        if (status == BookingStatus.CANCELLED) {
            throw new InvalidBookingStateException("Cannot create a booking in CANCELLED status");
        }
        return new Booking(providerId, date, time, clientIdentifier, status, appointmentDetails, null, null);
    }

    public boolean isActive() {
        return status.isActive();
    }

    public boolean isAt(LocalDate otherDate, LocalTime otherTime) {
        return date.equals(otherDate) && time.equals(otherTime);
    }

    /**
     * 상태 변경
     *
     * @throws InvalidBookingStateException 허용되지 않은 전이
     */
    public Booking changeStatus(BookingStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidBookingStateException(status, target);
        }
        return new Booking(providerId, date, time, clientIdentifier, target, appointmentDetails, createdAt, updatedAt);
    }

    /**
     * 예약 취소 (이미 취소된 경우 그대로 반환)
     */
    public Booking cancel() {
        if (status == BookingStatus.CANCELLED) {
            return this;
        }
        return changeStatus(BookingStatus.CANCELLED);
    }

    public Booking withDetails(Map<String, Object> details) {
        return new Booking(providerId, date, time, clientIdentifier, status, details, createdAt, updatedAt);
    }

    /**
     * 다른 날짜/시간으로 이동한 사본
     * 예약자, 상세 정보, 상태, createdAt은 그대로 유지한다.
     */
    public Booking moveTo(LocalDate newDate, LocalTime newTime) {
        return new Booking(providerId, newDate, newTime, clientIdentifier, status, appointmentDetails, createdAt, updatedAt);
    }
}
