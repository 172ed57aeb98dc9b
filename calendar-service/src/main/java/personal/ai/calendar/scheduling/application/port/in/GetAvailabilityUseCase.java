package personal.ai.calendar.scheduling.application.port.in;

import personal.ai.calendar.scheduling.domain.model.DayAvailability;

import java.time.LocalDate;
import java.util.List;

/**
 * Get Availability UseCase (Input Port)
 * 날짜 범위의 예약 가능 슬롯 조회
 */
public interface GetAvailabilityUseCase {

    /**
     * 날짜별 예약 가능 슬롯 조회
     * 최소 사전 예약 시간은 조회 시점의 현재 시각 기준이므로 같은 범위라도 시간이 지나면 결과가 줄어든다.
     * <p>
     * 주의: 취소(CANCELLED)된 예약 행은 슬롯을 점유하지 않으므로 해당 슬롯은 여기서 열린 것으로 반환되지만,
     * 같은 키에 행이 남아 있어 그 슬롯에 대한 createBooking은 항상 SlotAlreadyBookedException으로 실패한다.
     * 호출 측은 취소 이력이 있는 슬롯을 예약 가능 목록에서 걸러내야 한다.
     *
     * @param providerId 캘린더 소유자 ID
     * @param startDate  시작일 (포함)
     * @param endDate    종료일 (포함)
     * @return 슬롯이 하나 이상 남은 날짜만, 날짜/시간 오름차순
     * @throws personal.ai.calendar.scheduling.domain.exception.InvalidDateException startDate가 endDate보다 늦을 때
     */
    List<DayAvailability> getAvailability(String providerId, LocalDate startDate, LocalDate endDate);
}
