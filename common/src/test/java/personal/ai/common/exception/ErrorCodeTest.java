package personal.ai.common.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ErrorCode 단위 테스트")
class ErrorCodeTest {

    @Test
    @DisplayName("에러 코드 값은 중복되지 않는다")
    void codesAreUnique() {
        Set<String> codes = Arrays.stream(ErrorCode.values())
                .map(ErrorCode::getCode)
                .collect(Collectors.toSet());

        assertThat(codes).hasSize(ErrorCode.values().length);
    }

    @Test
    @DisplayName("상세 메시지 없이 생성하면 기본 메시지를 사용한다")
    void defaultMessage() {
        BusinessException e = new BusinessException(ErrorCode.SLOT_ALREADY_BOOKED);

        assertThat(e.getMessage()).isEqualTo(ErrorCode.SLOT_ALREADY_BOOKED.getMessage());
        assertThat(e.getErrorCode().getKind()).isEqualTo(ErrorKind.CONFLICT);
    }
}
