package personal.ai.calendar.scheduling.adapter.out.store;

/**
 * 저장소 접근 실패 (연결 오류, 타임아웃 등)
 * 쓰기 결과가 불확실할 수 있으므로 호출자는 재시도 전에 상태를 다시 읽어야 한다.
 */
public class KeyValueStoreException extends RuntimeException {

    public KeyValueStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
