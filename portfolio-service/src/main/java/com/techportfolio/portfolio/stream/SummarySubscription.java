package com.techportfolio.portfolio.stream;

import com.techportfolio.common.backpressure.BackpressurePolicy;
import com.techportfolio.portfolio.model.PortfolioSummary;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle returned by {@link ChangeStream#subscribe}: the live summary sequence plus
 * its cancellation switch.
 *
 * <p>{@link #cancel()} completes {@link #summaries()} at once and disposes the ticker
 * and any in-flight fetch. It is idempotent and may be called before the sequence is
 * subscribed, in which case the sequence completes without emitting.
 */
public class SummarySubscription {

    private final Long portfolioId;
    private final BackpressurePolicy policy;
    private final Flux<PortfolioSummary> summaries;
    private final Sinks.One<Boolean> cancelSignal;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    SummarySubscription(Long portfolioId, BackpressurePolicy policy,
                        Flux<PortfolioSummary> summaries, Sinks.One<Boolean> cancelSignal) {
        this.portfolioId  = portfolioId;
        this.policy       = policy;
        this.summaries    = summaries;
        this.cancelSignal = cancelSignal;
    }

    public Flux<PortfolioSummary> summaries() {
        return summaries;
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            cancelSignal.tryEmitValue(Boolean.TRUE);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public Long getPortfolioId() {
        return portfolioId;
    }

    public BackpressurePolicy getPolicy() {
        return policy;
    }
}
