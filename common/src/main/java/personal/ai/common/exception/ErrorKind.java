package personal.ai.common.exception;

/**
 * 도메인 에러 분류
 */
public enum ErrorKind {
    /**
     * 호출자 입력 오류 (재시도 불가, 입력 수정 필요)
     */
    VALIDATION,

    /**
     * 대상 리소스 없음
     */
    NOT_FOUND,

    /**
     * 이미 점유된 리소스 (다른 슬롯 선택 필요)
     */
    CONFLICT,

    /**
     * 데이터 정합성 손상 등 운영자 개입이 필요한 오류
     */
    FATAL
}
