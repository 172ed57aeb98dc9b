package personal.ai.calendar.scheduling.domain.model;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * 하루 단위 예약 가능 슬롯 (오름차순)
 */
public record DayAvailability(LocalDate date, List<LocalTime> slots) {

    public DayAvailability {
        slots = List.copyOf(slots);
    }

    /**
     * HH:MM 형식 슬롯 목록
     */
    public List<String> formattedSlots() {
        return slots.stream().map(SlotTimes::format).toList();
    }
}
