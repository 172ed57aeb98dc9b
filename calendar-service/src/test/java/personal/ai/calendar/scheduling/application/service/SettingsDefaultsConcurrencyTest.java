package personal.ai.calendar.scheduling.application.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.ai.calendar.scheduling.adapter.out.persistence.CalendarItemMapper;
import personal.ai.calendar.scheduling.adapter.out.persistence.CalendarPersistenceAdapter;
import personal.ai.calendar.scheduling.adapter.out.store.InMemoryKeyValueStore;
import personal.ai.calendar.scheduling.adapter.out.store.StoreItem;
import personal.ai.calendar.scheduling.application.config.CalendarProperties;
import personal.ai.calendar.scheduling.application.port.in.UpdateSettingsCommand;
import personal.ai.calendar.scheduling.domain.model.GlobalSettings;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 기본 설정 지연 생성과 동시 변경이 겹치는 경우
 * 첫 조회(empty)와 기본값 저장 사이에 다른 요청의 생성 + 변경을 끼워 넣는다.
 */
@DisplayName("기본 설정 생성 동시성 테스트")
class SettingsDefaultsConcurrencyTest {

    private static final String PROVIDER_ID = "provider-1";

    private InterleavingStore store;
    private SettingsService settingsService;

    @BeforeEach
    void setUp() {
        store = new InterleavingStore();
        CalendarPersistenceAdapter adapter = new CalendarPersistenceAdapter(
                store,
                new CalendarItemMapper(new ObjectMapper()),
                Clock.fixed(Instant.parse("2024-01-10T08:00:00Z"), ZoneOffset.UTC));
        CalendarProperties properties = new CalendarProperties(
                new CalendarProperties.Defaults(30, 2),
                new CalendarProperties.Store("memory", "calendar"));
        settingsService = new SettingsService(adapter, properties);
    }

    @Test
    @DisplayName("늦게 도착한 기본값 생성이 먼저 반영된 변경을 덮어쓰지 않는다")
    void lateDefaults_DoNotOverwriteUpdate() {
        // given: 요청 A가 설정 없음을 확인한 직후 요청 B가 생성 후 변경
        store.onFirstSettingsMiss(() -> {
            settingsService.getOrCreateSettings(PROVIDER_ID);
            settingsService.updateSettings(new UpdateSettingsCommand(PROVIDER_ID, null, 0, null));
        });

        // when
        GlobalSettings seenByA = settingsService.getOrCreateSettings(PROVIDER_ID);

        // then
        assertThat(seenByA.minNoticeHours()).isZero();
        assertThat(settingsService.getOrCreateSettings(PROVIDER_ID).minNoticeHours()).isZero();
    }

    @Test
    @DisplayName("경합이 없으면 기본값(30일, 2시간)으로 생성")
    void noContention_CreatesDefaults() {
        GlobalSettings created = settingsService.getOrCreateSettings(PROVIDER_ID);

        assertThat(created.horizonDays()).isEqualTo(30);
        assertThat(created.minNoticeHours()).isEqualTo(2);
        assertThat(settingsService.getOrCreateSettings(PROVIDER_ID)).isEqualTo(created);
    }

    /**
     * 설정 조회가 처음 비어 있을 때 한 번만 hook을 실행한 뒤 (이미 낡은) empty를 돌려준다.
     */
    private static class InterleavingStore extends InMemoryKeyValueStore {

        private Runnable hook;

        void onFirstSettingsMiss(Runnable hook) {
            this.hook = hook;
        }

        @Override
        public Optional<StoreItem> get(String partitionKey, String sortKey) {
            Optional<StoreItem> result = super.get(partitionKey, sortKey);
            if (hook != null && result.isEmpty() && "SETTINGS#GLOBAL".equals(sortKey)) {
                Runnable pending = hook;
                hook = null;
                pending.run();
            }
            return result;
        }
    }
}
