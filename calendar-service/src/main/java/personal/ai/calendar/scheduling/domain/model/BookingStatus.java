package personal.ai.calendar.scheduling.domain.model;

/**
 * Booking Status Enum
 * PENDING -> CONFIRMED -> CANCELLED, PENDING -> CANCELLED
 */
public enum BookingStatus {
    /**
     * 예약 요청됨 (확정 대기)
     */
    PENDING,

    /**
     * 예약 확정
     */
    CONFIRMED,

    /**
     * 취소됨 (soft delete, 해당 키의 종료 상태)
     */
    CANCELLED;

    /**
     * 슬롯을 점유하는 상태인지 여부 (PENDING, CONFIRMED)
     */
    public boolean isActive() {
        return this != CANCELLED;
    }

    /**
     * 상태 전이 허용 여부
     * 같은 상태로의 전이는 변경 없음으로 허용한다.
     */
    public boolean canTransitionTo(BookingStatus target) {
        if (this == target) {
            return true;
        }
        return switch (this) {
            case PENDING -> target == CONFIRMED || target == CANCELLED;
            case CONFIRMED -> target == CANCELLED;
            case CANCELLED -> false;
        };
    }
}
