package com.techportfolio.portfolio.stream;

import com.techportfolio.common.backpressure.BackpressurePolicy;
import com.techportfolio.common.exception.AggregationException;
import com.techportfolio.common.exception.ValidationException;
import com.techportfolio.common.model.PortfolioStatus;
import com.techportfolio.common.model.PortfolioType;
import com.techportfolio.portfolio.aggregation.AggregationEngine;
import com.techportfolio.portfolio.model.PortfolioSummary;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChangeStreamTest {

    private static final Duration TICK = Duration.ofSeconds(5);

    @Mock
    private AggregationEngine aggregationEngine;

    private VirtualTimeScheduler timer;
    private ChangeNotifier notifier;
    private ChangeStream changeStream;
    private final AtomicLong evaluations = new AtomicLong();

    @BeforeEach
    void setUp() {
        timer = VirtualTimeScheduler.create();
        notifier = new ChangeNotifier();
        changeStream = new ChangeStream(aggregationEngine, notifier, TICK, 16, 64, timer);
    }

    @AfterEach
    void tearDown() {
        timer.dispose();
    }

    private void summariesCountEvaluations() {
        when(aggregationEngine.computeSummary(1L)).thenAnswer(inv -> Mono.fromCallable(() ->
            new PortfolioSummary(1L, "Edge Infra", PortfolioType.ENTERPRISE, PortfolioStatus.ACTIVE,
                                 evaluations.incrementAndGet(), BigDecimal.ZERO, LocalDateTime.now())));
    }

    @Test
    @DisplayName("first summary immediately, then one per tick; cancel completes the stream")
    void ticksUntilCancelled() {
        summariesCountEvaluations();
        SummarySubscription subscription = changeStream.subscribe(1L, BackpressurePolicy.buffer(16));

        StepVerifier.create(subscription.summaries())
            .then(timer::advanceTime)
            .expectNextMatches(summary -> summary.technologyCount() == 1)
            .then(() -> timer.advanceTimeBy(TICK))
            .expectNextMatches(summary -> summary.technologyCount() == 2)
            .then(subscription::cancel)
            .then(() -> timer.advanceTimeBy(TICK.multipliedBy(6)))
            .verifyComplete();

        assertThat(subscription.isCancelled()).isTrue();
        verify(aggregationEngine, times(2)).computeSummary(1L);
    }

    @Test
    @DisplayName("a change signal re-evaluates before the next tick; other portfolios' changes are ignored")
    void changeSignalReEvaluates() {
        summariesCountEvaluations();
        SummarySubscription subscription = changeStream.subscribe(1L, BackpressurePolicy.buffer(16));

        StepVerifier.create(subscription.summaries())
            .then(timer::advanceTime)
            .expectNextMatches(summary -> summary.technologyCount() == 1)
            .then(() -> notifier.portfolioChanged(2L))
            .then(() -> notifier.portfolioChanged(1L))
            .expectNextMatches(summary -> summary.technologyCount() == 2)
            .then(subscription::cancel)
            .verifyComplete();

        verify(aggregationEngine, times(2)).computeSummary(1L);
    }

    @Test
    @DisplayName("cancelling one subscription leaves another on the same portfolio running")
    void cancellationIsIsolated() {
        summariesCountEvaluations();
        SummarySubscription first = changeStream.subscribe(1L, BackpressurePolicy.latest());
        SummarySubscription second = changeStream.subscribe(1L, BackpressurePolicy.drop());
        List<PortfolioSummary> firstSeen = new CopyOnWriteArrayList<>();
        List<PortfolioSummary> secondSeen = new CopyOnWriteArrayList<>();

        first.summaries().subscribe(firstSeen::add);
        second.summaries().subscribe(secondSeen::add);
        timer.advanceTime();

        first.cancel();
        timer.advanceTimeBy(TICK.multipliedBy(2));

        assertThat(firstSeen).hasSize(1);
        assertThat(secondSeen).hasSize(3);
        second.cancel();
    }

    @Test
    @DisplayName("ticks on an absent portfolio emit nothing")
    void absentPortfolioEmitsNothing() {
        when(aggregationEngine.computeSummary(1L)).thenReturn(Mono.empty());
        SummarySubscription subscription = changeStream.subscribe(1L, null);

        StepVerifier.create(subscription.summaries())
            .then(timer::advanceTime)
            .then(() -> timer.advanceTimeBy(TICK.multipliedBy(3)))
            .then(subscription::cancel)
            .verifyComplete();

        verify(aggregationEngine, times(4)).computeSummary(1L);
    }

    @Test
    @DisplayName("a failed evaluation terminates the subscription with that error")
    void failureTerminates() {
        when(aggregationEngine.computeSummary(1L))
            .thenReturn(Mono.error(new AggregationException(1L, new IllegalStateException("boom"))));
        SummarySubscription subscription = changeStream.subscribe(1L, BackpressurePolicy.buffer(4));

        StepVerifier.create(subscription.summaries())
            .then(timer::advanceTime)
            .expectError(AggregationException.class)
            .verify();
    }

    @Test
    @DisplayName("cancel disposes the in-flight evaluation")
    void cancelDisposesInFlightEvaluation() {
        AtomicBoolean evaluationCancelled = new AtomicBoolean();
        when(aggregationEngine.computeSummary(1L))
            .thenReturn(Mono.<PortfolioSummary>never().doOnCancel(() -> evaluationCancelled.set(true)));
        SummarySubscription subscription = changeStream.subscribe(1L, BackpressurePolicy.buffer(4));

        StepVerifier.create(subscription.summaries())
            .then(timer::advanceTime)
            .then(subscription::cancel)
            .verifyComplete();

        assertThat(evaluationCancelled).isTrue();
    }

    @Test
    @DisplayName("blank policy parses to the configured buffer capacity")
    void parsePolicyUsesConfiguredCapacity() {
        assertThat(changeStream.parsePolicy("")).isEqualTo(BackpressurePolicy.buffer(16));
        assertThat(changeStream.parsePolicy("drop")).isEqualTo(BackpressurePolicy.drop());
    }

    @Test
    @DisplayName("buffer capacity above the configured maximum is rejected")
    void parsePolicyEnforcesMaximumCapacity() {
        assertThat(changeStream.parsePolicy("buffer:64")).isEqualTo(BackpressurePolicy.buffer(64));
        assertThatThrownBy(() -> changeStream.parsePolicy("buffer:2147483647"))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("64");
    }
}
