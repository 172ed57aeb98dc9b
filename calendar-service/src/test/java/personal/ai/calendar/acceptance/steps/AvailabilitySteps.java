package personal.ai.calendar.acceptance.steps;

import io.cucumber.java.en.Given;
import io.cucumber.java.en.Then;
import io.cucumber.java.en.When;
import io.cucumber.spring.ScenarioScope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import personal.ai.calendar.acceptance.support.CalendarTestContext;
import personal.ai.calendar.acceptance.support.MutableClock;
import personal.ai.calendar.scheduling.adapter.out.store.InMemoryKeyValueStore;
import personal.ai.calendar.scheduling.application.port.in.GetAvailabilityUseCase;
import personal.ai.calendar.scheduling.application.port.in.ManageDateOverridesUseCase;
import personal.ai.calendar.scheduling.application.port.in.ManageRecurringRulesUseCase;
import personal.ai.calendar.scheduling.application.port.in.ManageSettingsUseCase;
import personal.ai.calendar.scheduling.application.port.in.PutDateOverrideCommand;
import personal.ai.calendar.scheduling.application.port.in.PutRecurringRuleCommand;
import personal.ai.calendar.scheduling.application.port.in.UpdateSettingsCommand;
import personal.ai.calendar.scheduling.domain.model.DayAvailability;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Availability Acceptance Test Step Definitions
 * 캘린더 설정(규칙, 예외 설정, 정책)과 가용성 조회 시나리오
 */
@Slf4j
@ScenarioScope
@RequiredArgsConstructor
public class AvailabilitySteps {

    private final InMemoryKeyValueStore keyValueStore;
    private final MutableClock clock;
    private final CalendarTestContext context;
    private final ManageSettingsUseCase manageSettingsUseCase;
    private final ManageRecurringRulesUseCase manageRecurringRulesUseCase;
    private final ManageDateOverridesUseCase manageDateOverridesUseCase;
    private final GetAvailabilityUseCase getAvailabilityUseCase;

    static List<String> slots(String joined) {
        return Arrays.stream(joined.split(",")).map(String::strip).toList();
    }

    // ==========================================
    // 배경
    // ==========================================

    @Given("현재 시각이 {string} 인 빈 캘린더가 있다")
    public void 현재_시각이_인_빈_캘린더가_있다(String now) {
        log.info(">>> Given: 캘린더 초기화, now={}", now);
        keyValueStore.clear();
        clock.setInstant(Instant.parse(now));
    }

    @Given("최소 사전 예약 시간은 {int} 시간이다")
    public void 최소_사전_예약_시간은_시간이다(int hours) {
        manageSettingsUseCase.getOrCreateSettings(context.getProviderId());
        manageSettingsUseCase.updateSettings(new UpdateSettingsCommand(context.getProviderId(), null, hours, null));
    }

    @Given("예약 마감일은 {string} 이다")
    public void 예약_마감일은_이다(String cutoff) {
        manageSettingsUseCase.getOrCreateSettings(context.getProviderId());
        manageSettingsUseCase.updateSettings(
                new UpdateSettingsCommand(context.getProviderId(), null, null, LocalDate.parse(cutoff)));
    }

    // ==========================================
    // Given: 규칙 / 예외 설정
    // ==========================================

    @Given("매월 {int}일 규칙 슬롯은 {string} 이다")
    public void 매월_일_규칙_슬롯은_이다(int dayOfMonth, String joinedSlots) {
        manageRecurringRulesUseCase.putRule(
                new PutRecurringRuleCommand(context.getProviderId(), dayOfMonth, slots(joinedSlots)));
    }

    @Given("{string} 날짜는 차단되어 있다")
    public void 날짜는_차단되어_있다(String date) {
        manageDateOverridesUseCase.putOverride(
                PutDateOverrideCommand.blocked(context.getProviderId(), LocalDate.parse(date)));
    }

    @Given("{string} 날짜의 슬롯은 {string} 으로 대체되어 있다")
    public void 날짜의_슬롯은_으로_대체되어_있다(String date, String joinedSlots) {
        manageDateOverridesUseCase.putOverride(
                PutDateOverrideCommand.modified(context.getProviderId(), LocalDate.parse(date), slots(joinedSlots)));
    }

    // ==========================================
    // When / Then: 가용성 조회
    // ==========================================

    @When("{string} 부터 {string} 까지 가용성을 조회한다")
    public void 부터_까지_가용성을_조회한다(String startDate, String endDate) {
        List<DayAvailability> availability = getAvailabilityUseCase.getAvailability(
                context.getProviderId(), LocalDate.parse(startDate), LocalDate.parse(endDate));
        log.info(">>> When: 가용성 조회 결과 days={}", availability.size());
        context.setLastAvailability(availability);
    }

    @Then("{string} 의 가용 슬롯은 {string} 이다")
    public void 의_가용_슬롯은_이다(String date, String joinedSlots) {
        DayAvailability day = context.getLastAvailability().stream()
                .filter(d -> d.date().equals(LocalDate.parse(date)))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No availability for " + date));

        assertThat(day.formattedSlots()).containsExactlyElementsOf(slots(joinedSlots));
    }

    @Then("가용 날짜는 {string} 이다")
    public void 가용_날짜는_이다(String joinedDates) {
        List<LocalDate> expected = slots(joinedDates).stream().map(LocalDate::parse).toList();

        assertThat(context.getLastAvailability()).extracting(DayAvailability::date)
                .containsExactlyElementsOf(expected);
    }

    @Then("가용 날짜가 없다")
    public void 가용_날짜가_없다() {
        assertThat(context.getLastAvailability()).isEmpty();
    }
}
