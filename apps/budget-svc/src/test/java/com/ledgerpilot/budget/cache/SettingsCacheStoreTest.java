package com.ledgerpilot.budget.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ledgerpilot.budget.ModelFixtures;
import com.ledgerpilot.budget.budget.BudgetContext;
import com.ledgerpilot.budget.model.BudgetSettings;
import com.ledgerpilot.budget.model.DateFormat;
import com.ledgerpilot.budget.remote.BudgetApi;
import com.ledgerpilot.budget.remote.RemoteApiException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SettingsCacheStoreTest {

    private static final String BUDGET = "budget-1";
    private static final BudgetSettings SETTINGS = new BudgetSettings(new DateFormat("MM/DD/YYYY"), ModelFixtures.USD);

    @Mock
    private BudgetApi budgetApi;

    @Mock
    private BudgetContext budgetContext;

    private MutableClock clock;
    private SettingsCacheStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-06-01T12:00:00Z"));
        store = new SettingsCacheStore(budgetApi, budgetContext, Duration.ofHours(24), clock);
    }

    @Test
    void servesCachedValueUntilExpiry() {
        when(budgetApi.getBudgetSettings(BUDGET)).thenReturn(SETTINGS);

        store.getSettings(BUDGET);
        clock.advance(Duration.ofHours(23));
        store.getSettings(BUDGET);
        verify(budgetApi, times(1)).getBudgetSettings(BUDGET);

        clock.advance(Duration.ofHours(1));
        store.getSettings(BUDGET);
        verify(budgetApi, times(2)).getBudgetSettings(BUDGET);
        assertThat(store.expiresAt(BUDGET)).hasValue(Instant.parse("2024-06-03T12:00:00Z"));
    }

    @Test
    void expiredValueIsServedWhenRefetchFails() {
        when(budgetApi.getBudgetSettings(BUDGET))
                .thenReturn(SETTINGS)
                .thenThrow(new RemoteApiException(500, "boom", null));

        store.getSettings(BUDGET);
        clock.advance(Duration.ofDays(2));

        assertThat(store.getSettings(BUDGET)).isEqualTo(SETTINGS);
        assertThat(store.getCurrencyFormat(BUDGET)).hasValue(ModelFixtures.USD);
    }

    @Test
    void coldFailurePropagates() {
        when(budgetApi.getBudgetSettings(BUDGET)).thenThrow(new RemoteApiException(404, "Not found", null));

        assertThatThrownBy(() -> store.getSettings(BUDGET))
                .isInstanceOf(RemoteApiException.class)
                .hasMessageContaining("404");
        assertThat(store.expiresAt(BUDGET)).isEmpty();
    }

    @Test
    void refreshBypassesTheTtl() {
        when(budgetApi.getBudgetSettings(BUDGET)).thenReturn(SETTINGS);

        store.getSettings(BUDGET);
        store.refreshCache(BUDGET);

        verify(budgetApi, times(2)).getBudgetSettings(BUDGET);
    }

    @Test
    void rejectsNonPositiveTtl() {
        assertThatThrownBy(() -> new SettingsCacheStore(budgetApi, budgetContext, Duration.ZERO, clock))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ttl");
    }

    static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
