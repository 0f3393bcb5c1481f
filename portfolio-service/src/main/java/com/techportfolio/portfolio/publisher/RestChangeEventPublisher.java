package com.techportfolio.portfolio.publisher;

import com.techportfolio.common.event.ChangeEvent;
import com.techportfolio.common.exception.PublishException;
import com.techportfolio.common.publish.ChangeEventPublisher;
import com.techportfolio.common.publish.PublishOutcome;
import com.techportfolio.common.trace.TraceContextUtil;
import com.techportfolio.portfolio.config.PortfolioProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * REST-based implementation of {@link ChangeEventPublisher}.
 *
 * <p>Posts an {@link AuditEnvelope} to the audit sink. Each call is bounded by
 * {@code portfolio.dispatch.timeout}; a timeout, connection error or non-2xx answer
 * becomes a {@code FAILED} outcome and is logged. No reactor thread is ever blocked,
 * and nothing here can fail the write that produced the event.
 */
@Component
public class RestChangeEventPublisher implements ChangeEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(RestChangeEventPublisher.class);

    static final String AUDIT_PATH = "/api/v1/audit/events";

    private final WebClient auditClient;
    private final boolean enabled;
    private final Duration timeout;

    public RestChangeEventPublisher(WebClient auditClient, PortfolioProperties properties) {
        this.auditClient = auditClient;
        this.enabled     = properties.getDispatch().isEnabled();
        this.timeout     = properties.getDispatch().getTimeout();
    }

    @Override
    public Mono<PublishOutcome> publish(ChangeEvent event) {
        if (!enabled) {
            log.debug("Change event dispatch disabled. type={} entityId={}", event.eventType(), event.entityId());
            return Mono.just(PublishOutcome.skipped(event));
        }
        String traceId = event.traceId() != null ? event.traceId() : TraceContextUtil.UNKNOWN;

        return auditClient.post()
            .uri(AUDIT_PATH)
            .header(TraceContextUtil.TRACE_ID_HEADER, traceId)
            .bodyValue(AuditEnvelope.of(event))
            .retrieve()
            .toBodilessEntity()
            .timeout(timeout)
            .map(response -> PublishOutcome.delivered(event, response.getStatusCode().value()))
            .onErrorResume(err -> Mono.just(failure(event, traceId, err)));
    }

    @Override
    public void dispatch(ChangeEvent event) {
        publish(event).subscribe(
            outcome -> log.info("Change event published. traceId={} type={} entityId={} status={}",
                                event.traceId(), outcome.eventType(), outcome.entityId(), outcome.status()),
            err     -> log.warn("Change event dispatch aborted. traceId={} type={}",
                                event.traceId(), event.eventType(), err)
        );
    }

    @Override
    public Mono<List<PublishOutcome>> publishAll(List<ChangeEvent> events) {
        return Flux.fromIterable(events)
            .flatMapSequential(this::publish)
            .collectList();
    }

    private PublishOutcome failure(ChangeEvent event, String traceId, Throwable err) {
        PublishException failure = new PublishException(event.eventType(), event.entityId(), err);
        log.warn("Change event publish failed (non-critical). traceId={} {}", traceId, failure.getMessage());
        int status = err instanceof WebClientResponseException wcre ? wcre.getStatusCode().value() : 0;
        return PublishOutcome.failed(event, status, failure.getMessage());
    }
}
