package personal.ai.calendar.scheduling.adapter.out.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.ai.calendar.scheduling.adapter.out.store.StoreItem;
import personal.ai.calendar.scheduling.domain.model.Booking;
import personal.ai.calendar.scheduling.domain.model.BookingStatus;
import personal.ai.calendar.scheduling.domain.model.DateOverride;
import personal.ai.calendar.scheduling.domain.model.GlobalSettings;
import personal.ai.calendar.scheduling.domain.model.OverrideType;
import personal.ai.calendar.scheduling.domain.model.RecurringRule;
import personal.ai.calendar.scheduling.domain.model.SlotTimes;
import personal.ai.common.exception.BusinessException;
import personal.ai.common.exception.ErrorCode;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Domain Model <-> StoreItem 변환
 *
 * - 슬롯 목록: "09:00,10:30" (쉼표 구분 HH:MM)
 * - 타임스탬프: ISO-8601 UTC
 * - appointmentDetails: JSON
 */
@Component
@RequiredArgsConstructor
public class CalendarItemMapper {

    private static final String SLOT_DELIMITER = ",";
    private static final TypeReference<LinkedHashMap<String, Object>> DETAILS_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    // ========== Settings ==========

    public StoreItem toItem(GlobalSettings settings) {
        Map<String, String> attributes = baseAttributes(settings.providerId(), settings.createdAt(), settings.updatedAt());
        attributes.put("horizonDays", String.valueOf(settings.horizonDays()));
        attributes.put("minNoticeHours", String.valueOf(settings.minNoticeHours()));
        if (settings.hardCutoffDate() != null) {
            attributes.put("hardCutoffDate", settings.hardCutoffDate().toString());
        }
        return new StoreItem(CalendarKeys.partitionKey(settings.providerId()), CalendarKeys.SETTINGS_SORT_KEY, attributes);
    }

    public GlobalSettings toSettings(StoreItem item) {
        String cutoff = item.attribute("hardCutoffDate");
        return new GlobalSettings(
                item.attribute("providerId"),
                Integer.parseInt(item.attribute("horizonDays")),
                Integer.parseInt(item.attribute("minNoticeHours")),
                cutoff != null ? LocalDate.parse(cutoff) : null,
                instant(item, "createdAt"),
                instant(item, "updatedAt"));
    }

    // ========== Recurring Rules ==========

    public StoreItem toItem(RecurringRule rule) {
        Map<String, String> attributes = baseAttributes(rule.providerId(), rule.createdAt(), rule.updatedAt());
        attributes.put("dayOfMonth", String.valueOf(rule.dayOfMonth()));
        attributes.put("availableSlots", joinSlots(rule.availableSlots()));
        return new StoreItem(CalendarKeys.partitionKey(rule.providerId()), CalendarKeys.ruleKey(rule.dayOfMonth()), attributes);
    }

    public RecurringRule toRule(StoreItem item) {
        return new RecurringRule(
                item.attribute("providerId"),
                Integer.parseInt(item.attribute("dayOfMonth")),
                splitSlots(item.attribute("availableSlots")),
                instant(item, "createdAt"),
                instant(item, "updatedAt"));
    }

    // ========== Date Overrides ==========

    public StoreItem toItem(DateOverride override) {
        Map<String, String> attributes = baseAttributes(override.providerId(), override.createdAt(), override.updatedAt());
        attributes.put("date", override.date().toString());
        attributes.put("type", override.type().name());
        attributes.put("overrideSlots", joinSlots(override.overrideSlots()));
        return new StoreItem(CalendarKeys.partitionKey(override.providerId()), CalendarKeys.overrideKey(override.date()), attributes);
    }

    public DateOverride toOverride(StoreItem item) {
        return new DateOverride(
                item.attribute("providerId"),
                LocalDate.parse(item.attribute("date")),
                OverrideType.valueOf(item.attribute("type")),
                splitSlots(item.attribute("overrideSlots")),
                instant(item, "createdAt"),
                instant(item, "updatedAt"));
    }

    // ========== Bookings ==========

    public StoreItem toItem(Booking booking) {
        Map<String, String> attributes = baseAttributes(booking.providerId(), booking.createdAt(), booking.updatedAt());
        attributes.put("date", booking.date().toString());
        attributes.put("time", SlotTimes.format(booking.time()));
        attributes.put("clientIdentifier", booking.clientIdentifier());
        attributes.put("status", booking.status().name());
        attributes.put("appointmentDetails", writeDetails(booking.appointmentDetails()));
        return new StoreItem(
                CalendarKeys.partitionKey(booking.providerId()),
                CalendarKeys.bookingKey(booking.date(), booking.time()),
                attributes);
    }

    public Booking toBooking(StoreItem item) {
        return new Booking(
                item.attribute("providerId"),
                LocalDate.parse(item.attribute("date")),
                SlotTimes.parse(item.attribute("time")),
                item.attribute("clientIdentifier"),
                BookingStatus.valueOf(item.attribute("status")),
                readDetails(item),
                instant(item, "createdAt"),
                instant(item, "updatedAt"));
    }

    private Map<String, String> baseAttributes(String providerId, Instant createdAt, Instant updatedAt) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("providerId", providerId);
        if (createdAt != null) {
            attributes.put("createdAt", createdAt.toString());
        }
        if (updatedAt != null) {
            attributes.put("updatedAt", updatedAt.toString());
        }
        return attributes;
    }

    private Instant instant(StoreItem item, String attribute) {
        String value = item.attribute(attribute);
        return value != null ? Instant.parse(value) : null;
    }

    private String joinSlots(List<LocalTime> slots) {
        return slots.stream().map(SlotTimes::format).collect(Collectors.joining(SLOT_DELIMITER));
    }

    private List<LocalTime> splitSlots(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return SlotTimes.parseAll(Arrays.asList(value.split(SLOT_DELIMITER)));
    }

    private String writeDetails(Map<String, Object> details) {
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "Appointment details are not serializable: " + e.getOriginalMessage(), e);
        }
    }

    private Map<String, Object> readDetails(StoreItem item) {
        String json = item.attribute("appointmentDetails");
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, DETAILS_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(
                    "Corrupted appointment details: partitionKey=" + item.partitionKey() + ", sortKey=" + item.sortKey(), e);
        }
    }
}
