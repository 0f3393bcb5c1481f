package com.techportfolio.common.backpressure;

import com.techportfolio.common.exception.OverflowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Exceptions;
import reactor.core.publisher.BufferOverflowStrategy;
import reactor.core.publisher.Flux;

/**
 * Applies a {@link BackpressurePolicy} between a producer and one subscriber.
 *
 * <p>The returned sequence requests from the producer without bound and absorbs the
 * difference between production and consumption according to the policy, so a slow
 * subscriber never slows the producer and never affects other subscribers of the
 * same producer. Suspension point: none; all policies are purely signal-driven.
 *
 * <ul>
 *   <li>{@code BUFFER(n)}: queues up to {@code n} unread items, then terminates this
 *       subscriber with {@link OverflowException} and cancels its producer.</li>
 *   <li>{@code DROP}: items arriving while the subscriber has no outstanding demand are
 *       discarded. Consumed items are a strictly ordered subsequence of produced items.</li>
 *   <li>{@code LATEST}: holds only the newest undelivered item, overwriting older ones,
 *       so the most recent item is always delivered eventually.</li>
 * </ul>
 *
 * Stateless; policies hold no per-producer state outside the returned sequence.
 */
public final class BackpressureController {

    private static final Logger log = LoggerFactory.getLogger(BackpressureController.class);

    private BackpressureController() {}

    public static <T> Flux<T> apply(Flux<T> source, BackpressurePolicy policy) {
        BackpressurePolicy effective = policy != null ? policy : BackpressurePolicy.defaultPolicy();

        return switch (effective.strategy()) {
            case BUFFER -> buffer(source, effective.capacity());
            case DROP   -> source.onBackpressureDrop(
                dropped -> log.debug("BACKPRESSURE_DROP item={}", dropped));
            case LATEST -> source.onBackpressureLatest();
        };
    }

    private static <T> Flux<T> buffer(Flux<T> source, int capacity) {
        return source
            .onBackpressureBuffer(capacity,
                overflowed -> log.warn("BACKPRESSURE_OVERFLOW capacity={} item={}", capacity, overflowed),
                BufferOverflowStrategy.ERROR)
            .onErrorMap(Exceptions::isOverflow, e -> new OverflowException(capacity, e));
    }
}
