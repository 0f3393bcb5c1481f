package com.techportfolio.common.publish;

import com.techportfolio.common.event.ChangeEvent;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Best-effort notification of an external collaborator about completed mutations.
 *
 * <p>Implementations MUST be non-blocking and MUST NOT signal errors from
 * {@link #publish(ChangeEvent)}: a failed or timed-out delivery is reported as a
 * {@link PublishOutcome} with status {@code FAILED}. The write that produced the event
 * has already returned to its caller and is never affected by the outcome.
 */
public interface ChangeEventPublisher {

    /**
     * Delivers one event and reports how it went.
     *
     * @param event the completed change
     * @return the delivery outcome; never an error signal
     */
    Mono<PublishOutcome> publish(ChangeEvent event);

    /**
     * Fire-and-forget form of {@link #publish(ChangeEvent)} for the write path.
     * Returns immediately; the outcome is only logged.
     */
    void dispatch(ChangeEvent event);

    /**
     * Publishes a batch. Each event is delivered independently, so one failing event
     * never blocks or fails its siblings. Outcomes keep the order of {@code events}.
     */
    Mono<List<PublishOutcome>> publishAll(List<ChangeEvent> events);
}
