package personal.ai.common.exception;

/**
 * 에러 코드 정의
 * 에러 종류(kind)와 코드, 기본 메시지를 함께 관리
 * 전송 계층(HTTP 등) 상태 코드로의 매핑은 경계 계층의 몫이다.
 */
public enum ErrorCode {
    // Common (Cxxx)
    INVALID_INPUT(ErrorKind.VALIDATION, "C001", "잘못된 입력값입니다."),

    // Calendar Settings / Rules / Overrides (Sxxx)
    INVALID_DATE(ErrorKind.VALIDATION, "S001", "날짜 형식이 올바르지 않습니다."),
    INVALID_SLOT_TIME(ErrorKind.VALIDATION, "S002", "시간 형식이 올바르지 않습니다."),
    INVALID_SETTINGS(ErrorKind.VALIDATION, "S003", "캘린더 설정값이 올바르지 않습니다."),
    SETTINGS_NOT_FOUND(ErrorKind.NOT_FOUND, "S004", "캘린더 설정을 찾을 수 없습니다."),
    RULE_NOT_FOUND(ErrorKind.NOT_FOUND, "S005", "반복 규칙을 찾을 수 없습니다."),
    OVERRIDE_NOT_FOUND(ErrorKind.NOT_FOUND, "S006", "날짜 예외 설정을 찾을 수 없습니다."),

    // Booking (Bxxx)
    BOOKING_NOT_FOUND(ErrorKind.NOT_FOUND, "B001", "예약을 찾을 수 없습니다."),
    SLOT_ALREADY_BOOKED(ErrorKind.CONFLICT, "B002", "이미 예약된 시간입니다. 다른 시간을 선택해 주세요."),
    INVALID_BOOKING_STATE(ErrorKind.VALIDATION, "B003", "허용되지 않는 예약 상태 변경입니다."),
    BOOKING_DATA_LOST(ErrorKind.FATAL, "B004", "예약 이동 보상 처리에 실패하여 예약 데이터가 유실되었습니다.");

    private final ErrorKind kind;
    private final String code;
    private final String message;

    ErrorCode(ErrorKind kind, String code, String message) {
        this.kind = kind;
        this.code = code;
        this.message = message;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
