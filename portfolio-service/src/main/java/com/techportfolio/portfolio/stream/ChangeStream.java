package com.techportfolio.portfolio.stream;

import com.techportfolio.common.backpressure.BackpressureController;
import com.techportfolio.common.backpressure.BackpressurePolicy;
import com.techportfolio.portfolio.aggregation.AggregationEngine;
import com.techportfolio.portfolio.config.PortfolioProperties;
import com.techportfolio.portfolio.model.PortfolioSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;

/**
 * Turns {@link AggregationEngine#computeSummary} into a live, cancellable subscription.
 *
 * <p>Each call to {@link #subscribe} builds an independent pipeline; nothing is shared
 * between subscribers except the storage pool:
 * <pre>
 *   merge( interval(0, tick), changesOf(id) )
 *     → onBackpressureLatest        coalesce triggers while an evaluation runs
 *     → concatMap(computeSummary)    one evaluation at a time, generation order
 *     → BackpressureController       subscriber's policy
 *     → takeUntilOther(cancel)       prompt, deterministic cancellation
 * </pre>
 *
 * <p>Suspension points: the ticker delay and the storage fetches of each evaluation.
 * Cancelling, or the subscriber going away, disposes the ticker and the in-flight
 * evaluation; its partial join is discarded. A tick on which the portfolio is absent
 * emits nothing. Failures of an evaluation terminate the subscription with that error.
 */
@Component
public class ChangeStream {

    private static final Logger log = LoggerFactory.getLogger(ChangeStream.class);

    private enum Trigger { TICK, CHANGE }

    private final AggregationEngine aggregationEngine;
    private final ChangeNotifier changeNotifier;
    private final Duration tickInterval;
    private final int defaultBufferCapacity;
    private final int maxBufferCapacity;
    private final Scheduler timer;

    @Autowired
    public ChangeStream(AggregationEngine aggregationEngine,
                        ChangeNotifier changeNotifier,
                        PortfolioProperties properties) {
        this(aggregationEngine, changeNotifier, properties.getStream().getTickInterval(),
             properties.getStream().getDefaultBufferCapacity(), properties.getStream().getMaxBufferCapacity(),
             Schedulers.parallel());
    }

    ChangeStream(AggregationEngine aggregationEngine, ChangeNotifier changeNotifier, Duration tickInterval,
                 int defaultBufferCapacity, int maxBufferCapacity, Scheduler timer) {
        this.aggregationEngine     = aggregationEngine;
        this.changeNotifier        = changeNotifier;
        this.tickInterval          = tickInterval;
        this.defaultBufferCapacity = defaultBufferCapacity;
        this.maxBufferCapacity     = maxBufferCapacity;
        this.timer                 = timer;
    }

    /**
     * Parses a {@code ?policy=} value; blank means {@code buffer} with the configured capacity.
     *
     * @throws com.techportfolio.common.exception.ValidationException on an unknown policy
     *         or a capacity above {@code portfolio.stream.max-buffer-capacity}
     */
    public BackpressurePolicy parsePolicy(String value) {
        return BackpressurePolicy.parse(value, defaultBufferCapacity, maxBufferCapacity);
    }

    public SummarySubscription subscribe(Long portfolioId, BackpressurePolicy policy) {
        BackpressurePolicy effective = policy != null ? policy : BackpressurePolicy.buffer(defaultBufferCapacity);
        Sinks.One<Boolean> cancelSignal = Sinks.one();

        Flux<PortfolioSummary> evaluations = Flux.defer(() -> triggers(portfolioId)
            .onBackpressureLatest()
            .concatMap(trigger -> aggregationEngine.computeSummary(portfolioId)
                .doOnNext(summary -> log.debug("SUMMARY_EVALUATED portfolioId={} trigger={} count={} cost={}",
                    portfolioId, trigger, summary.technologyCount(), summary.totalAnnualCost())), 1));

        Flux<PortfolioSummary> summaries = BackpressureController.apply(evaluations, effective)
            .takeUntilOther(cancelSignal.asMono())
            .doOnSubscribe(s -> log.info("SUMMARY_STREAM_OPENED portfolioId={} policy={} tickMs={}",
                portfolioId, effective, tickInterval.toMillis()))
            .doFinally(signal -> log.info("SUMMARY_STREAM_CLOSED portfolioId={} signal={}",
                portfolioId, signal));

        return new SummarySubscription(portfolioId, effective, summaries, cancelSignal);
    }

    private Flux<Trigger> triggers(Long portfolioId) {
        Flux<Trigger> ticks = Flux.interval(Duration.ZERO, tickInterval, timer)
            .map(tick -> Trigger.TICK);
        Flux<Trigger> changes = changeNotifier.changesOf(portfolioId)
            .map(id -> Trigger.CHANGE);
        return Flux.merge(ticks, changes);
    }
}
