package com.ledgerpilot.budget.cache;

import static com.ledgerpilot.budget.ModelFixtures.deletedPayee;
import static com.ledgerpilot.budget.ModelFixtures.payee;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ledgerpilot.budget.budget.BudgetContext;
import com.ledgerpilot.budget.model.Payee;
import com.ledgerpilot.budget.remote.BudgetApi;
import com.ledgerpilot.budget.remote.DeltaPage;
import com.ledgerpilot.budget.remote.RemoteApiException;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PayeeCacheStoreTest {

    private static final String BUDGET = "budget-1";

    @Mock
    private BudgetApi budgetApi;

    @Mock
    private BudgetContext budgetContext;

    private PayeeCacheStore store;

    @BeforeEach
    void setUp() {
        store = new PayeeCacheStore(budgetApi, budgetContext);
    }

    @Test
    void firstGetIsFullFetchAndLaterGetsSendTheStoredToken() {
        when(budgetApi.getPayees(BUDGET, OptionalLong.empty()))
                .thenReturn(new DeltaPage<>(List.of(payee("a", "Alpha"), payee("b", "Beta")), 10));
        when(budgetApi.getPayees(BUDGET, OptionalLong.of(10)))
                .thenReturn(new DeltaPage<>(List.of(), 11));

        assertThat(store.get(BUDGET)).extracting(Payee::id).containsExactly("a", "b");
        assertThat(store.get(BUDGET)).extracting(Payee::id).containsExactly("a", "b");

        verify(budgetApi).getPayees(BUDGET, OptionalLong.empty());
        verify(budgetApi).getPayees(BUDGET, OptionalLong.of(10));
        assertThat(store.syncToken(BUDGET)).hasValue(11);
    }

    @Test
    void tombstoneRemovesEntryAndKeepsTheRest() {
        when(budgetApi.getPayees(BUDGET, OptionalLong.empty()))
                .thenReturn(new DeltaPage<>(List.of(payee("a", "Alpha"), payee("b", "Beta")), 1));
        when(budgetApi.getPayees(BUDGET, OptionalLong.of(1)))
                .thenReturn(new DeltaPage<>(List.of(deletedPayee("a")), 2));

        store.get(BUDGET);

        assertThat(store.get(BUDGET)).extracting(Payee::id).containsExactly("b");
    }

    @Test
    void deltaUpsertsChangedItemsAndLeavesUnmentionedOnesAlone() {
        when(budgetApi.getPayees(BUDGET, OptionalLong.empty()))
                .thenReturn(new DeltaPage<>(List.of(payee("a", "Alpha"), payee("b", "Beta")), 1));
        when(budgetApi.getPayees(BUDGET, OptionalLong.of(1)))
                .thenReturn(new DeltaPage<>(List.of(payee("b", "Beta Renamed"), payee("c", "Gamma")), 2));

        store.get(BUDGET);
        List<Payee> merged = store.get(BUDGET);

        assertThat(merged).extracting(Payee::name).containsExactly("Alpha", "Beta Renamed", "Gamma");
    }

    @Test
    void applyingTheSameDeltaTwiceGivesTheSameResult() {
        List<Payee> delta = List.of(deletedPayee("a"), payee("c", "Gamma"));
        when(budgetApi.getPayees(BUDGET, OptionalLong.empty()))
                .thenReturn(new DeltaPage<>(List.of(payee("a", "Alpha"), payee("b", "Beta")), 1));
        when(budgetApi.getPayees(BUDGET, OptionalLong.of(1))).thenReturn(new DeltaPage<>(delta, 2));
        when(budgetApi.getPayees(BUDGET, OptionalLong.of(2))).thenReturn(new DeltaPage<>(delta, 3));

        store.get(BUDGET);
        List<Payee> once = store.get(BUDGET);
        List<Payee> twice = store.get(BUDGET);

        assertThat(twice).isEqualTo(once);
        assertThat(twice).extracting(Payee::id).containsExactly("b", "c");
    }

    @Test
    void storedTokenIsAlwaysTheLastResponseToken() {
        when(budgetApi.getPayees(BUDGET, OptionalLong.empty())).thenReturn(new DeltaPage<>(List.of(), 5));
        when(budgetApi.getPayees(BUDGET, OptionalLong.of(5))).thenReturn(new DeltaPage<>(List.of(), 9));
        when(budgetApi.getPayees(BUDGET, OptionalLong.of(9))).thenReturn(new DeltaPage<>(List.of(), 12));

        store.get(BUDGET);
        store.get(BUDGET);
        store.get(BUDGET);

        assertThat(store.syncToken(BUDGET)).hasValue(12);
        assertThat(store.lastFetched(BUDGET)).isPresent();
    }

    @Test
    void failedDeltaServesTheCachedSnapshot() {
        when(budgetApi.getPayees(BUDGET, OptionalLong.empty()))
                .thenReturn(new DeltaPage<>(List.of(payee("a", "Alpha")), 3));
        when(budgetApi.getPayees(BUDGET, OptionalLong.of(3)))
                .thenThrow(new RemoteApiException(503, "unavailable", null));

        List<Payee> primed = store.get(BUDGET);
        List<Payee> afterFailure = store.get(BUDGET);

        assertThat(afterFailure).isEqualTo(primed);
        assertThat(store.syncToken(BUDGET)).hasValue(3);
    }

    @Test
    void coldFailurePropagatesAndStoresNothing() {
        RemoteApiException failure = new RemoteApiException(401, "Unauthorized", null);
        when(budgetApi.getPayees(BUDGET, OptionalLong.empty())).thenThrow(failure);

        assertThatThrownBy(() -> store.get(BUDGET)).isSameAs(failure);
        assertThat(store.peek(BUDGET)).isEmpty();
        assertThat(store.syncToken(BUDGET)).isEmpty();
        assertThat(store.cachedBudgetIds()).isEmpty();
    }

    @Test
    void invalidateAndRefreshForceAFullFetch() {
        when(budgetApi.getPayees(BUDGET, OptionalLong.empty()))
                .thenReturn(new DeltaPage<>(List.of(payee("a", "Alpha")), 1))
                .thenReturn(new DeltaPage<>(List.of(payee("b", "Beta")), 2))
                .thenReturn(new DeltaPage<>(List.of(payee("c", "Gamma")), 3));

        store.get(BUDGET);
        store.invalidate(BUDGET);
        assertThat(store.get(BUDGET)).extracting(Payee::id).containsExactly("b");
        assertThat(store.refreshCache(BUDGET)).extracting(Payee::id).containsExactly("c");

        verify(budgetApi, times(3)).getPayees(BUDGET, OptionalLong.empty());
        verify(budgetApi, never()).getPayees(eq(BUDGET), eq(OptionalLong.of(1)));
    }

    @Test
    void budgetsAreCachedIndependently() {
        when(budgetApi.getPayees("budget-1", OptionalLong.empty()))
                .thenReturn(new DeltaPage<>(List.of(payee("a", "Alpha")), 1));
        when(budgetApi.getPayees("budget-2", OptionalLong.empty()))
                .thenReturn(new DeltaPage<>(List.of(payee("z", "Zed")), 40));

        store.get("budget-1");
        store.get("budget-2");

        assertThat(store.cachedBudgetIds()).containsExactlyInAnyOrder("budget-1", "budget-2");
        assertThat(store.syncToken("budget-2")).hasValue(40);

        store.reset();
        assertThat(store.cachedBudgetIds()).isEmpty();
    }

    @Test
    void initializeWarmsTheActiveBudgetAndSwallowsFailures() {
        when(budgetContext.getActiveBudgetId()).thenReturn(Optional.of(BUDGET));
        when(budgetApi.getPayees(BUDGET, OptionalLong.empty()))
                .thenThrow(new RemoteApiException(RemoteApiException.NO_RESPONSE, "down", null));

        store.initialize();

        assertThat(store.peek(BUDGET)).isEmpty();
    }

    @Test
    void initializeWithoutActiveBudgetFetchesNothing() {
        when(budgetContext.getActiveBudgetId()).thenReturn(Optional.empty());

        store.initialize();

        verify(budgetApi, never()).getPayees(anyString(), any());
    }

    @Test
    void concurrentColdGetsShareOneFullFetch() throws Exception {
        CountDownLatch fetchStarted = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(budgetApi.getPayees(eq(BUDGET), any())).thenAnswer(invocation -> {
            OptionalLong since = invocation.getArgument(1);
            if (since.isPresent()) {
                return new DeltaPage<>(List.<Payee>of(), since.getAsLong());
            }
            fetchStarted.countDown();
            assertThat(release.await(5, TimeUnit.SECONDS)).isTrue();
            return new DeltaPage<>(List.of(payee("a", "Alpha")), 7);
        });

        CompletableFuture<List<Payee>> first = CompletableFuture.supplyAsync(() -> store.get(BUDGET));
        assertThat(fetchStarted.await(5, TimeUnit.SECONDS)).isTrue();
        CompletableFuture<List<Payee>> second = CompletableFuture.supplyAsync(() -> store.get(BUDGET));
        Thread.sleep(100);
        release.countDown();

        assertThat(first.get(5, TimeUnit.SECONDS)).extracting(Payee::id).containsExactly("a");
        assertThat(second.get(5, TimeUnit.SECONDS)).extracting(Payee::id).containsExactly("a");
        verify(budgetApi, times(1)).getPayees(BUDGET, OptionalLong.empty());
    }

    @Test
    void invalidateDuringADeltaFetchKeepsItsResultOutOfTheCache() throws Exception {
        CountDownLatch deltaStarted = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger fullFetches = new AtomicInteger();
        when(budgetApi.getPayees(eq(BUDGET), any())).thenAnswer(invocation -> {
            OptionalLong since = invocation.getArgument(1);
            if (since.isEmpty()) {
                int n = fullFetches.incrementAndGet();
                return new DeltaPage<>(List.of(payee("a", "Alpha v" + n)), 10L * n);
            }
            deltaStarted.countDown();
            assertThat(release.await(5, TimeUnit.SECONDS)).isTrue();
            return new DeltaPage<>(List.of(payee("b", "Beta")), since.getAsLong() + 1);
        });
        store.get(BUDGET);

        CompletableFuture<List<Payee>> delta = CompletableFuture.supplyAsync(() -> store.get(BUDGET));
        assertThat(deltaStarted.await(5, TimeUnit.SECONDS)).isTrue();
        store.invalidate(BUDGET);
        release.countDown();

        assertThat(delta.get(5, TimeUnit.SECONDS)).extracting(Payee::id).containsExactly("a", "b");
        assertThat(store.peek(BUDGET)).isEmpty();
        assertThat(store.get(BUDGET)).extracting(Payee::name).containsExactly("Alpha v2");
        assertThat(store.syncToken(BUDGET)).hasValue(20);
    }

    @Test
    void refreshDoesNotJoinADeltaFetchStartedBeforeIt() throws Exception {
        CountDownLatch deltaStarted = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger fullFetches = new AtomicInteger();
        when(budgetApi.getPayees(eq(BUDGET), any())).thenAnswer(invocation -> {
            OptionalLong since = invocation.getArgument(1);
            if (since.isEmpty()) {
                int n = fullFetches.incrementAndGet();
                return new DeltaPage<>(List.of(payee("a", "Alpha v" + n)), 10L * n);
            }
            deltaStarted.countDown();
            assertThat(release.await(5, TimeUnit.SECONDS)).isTrue();
            return new DeltaPage<>(List.of(payee("b", "Beta")), since.getAsLong() + 1);
        });
        store.get(BUDGET);

        CompletableFuture<List<Payee>> delta = CompletableFuture.supplyAsync(() -> store.get(BUDGET));
        assertThat(deltaStarted.await(5, TimeUnit.SECONDS)).isTrue();
        CompletableFuture<List<Payee>> refreshed = CompletableFuture.supplyAsync(() -> store.refreshCache(BUDGET));
        Thread.sleep(100);
        assertThat(refreshed).isNotDone();
        release.countDown();

        delta.get(5, TimeUnit.SECONDS);
        assertThat(refreshed.get(5, TimeUnit.SECONDS)).extracting(Payee::name).containsExactly("Alpha v2");
        assertThat(store.syncToken(BUDGET)).hasValue(20);
        verify(budgetApi, times(2)).getPayees(BUDGET, OptionalLong.empty());
    }

    @Test
    void rejectsBlankBudgetId() {
        assertThatThrownBy(() -> store.get(" "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("budgetId");
    }
}
