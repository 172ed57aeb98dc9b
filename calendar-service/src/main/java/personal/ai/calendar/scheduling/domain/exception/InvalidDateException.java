package personal.ai.calendar.scheduling.domain.exception;

import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

import java.time.LocalDate;

/**
 * Invalid Date Exception
 * 시작일이 종료일보다 늦거나 비어 있는 조회 범위
 */
public class InvalidDateException extends BusinessException {
    public InvalidDateException(LocalDate startDate, LocalDate endDate) {
        super(ErrorCode.INVALID_DATE,
                String.format("Start date must not be after end date: startDate=%s, endDate=%s", startDate, endDate));
    }
}
