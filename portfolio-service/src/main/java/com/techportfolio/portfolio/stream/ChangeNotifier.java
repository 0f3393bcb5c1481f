package com.techportfolio.portfolio.stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * In-process signal that a portfolio's summary inputs changed. Fed by the write path,
 * consumed by {@link ChangeStream} to re-evaluate immediately instead of waiting for
 * the next tick.
 *
 * <p>Delivery is best-effort: a listener without demand misses the signal and catches
 * up on its next tick.
 */
@Component
public class ChangeNotifier {

    private static final Logger log = LoggerFactory.getLogger(ChangeNotifier.class);

    private final Sinks.Many<Long> changes = Sinks.many().multicast().directBestEffort();

    public void portfolioChanged(Long portfolioId) {
        if (portfolioId == null) {
            return;
        }
        Sinks.EmitResult result = changes.tryEmitNext(portfolioId);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.debug("Change signal not emitted. portfolioId={} result={}", portfolioId, result);
        }
    }

    public Flux<Long> changesOf(Long portfolioId) {
        return changes.asFlux().filter(portfolioId::equals);
    }
}
