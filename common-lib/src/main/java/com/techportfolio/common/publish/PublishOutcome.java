package com.techportfolio.common.publish;

import com.techportfolio.common.event.ChangeEvent;

/**
 * Result of one delivery attempt.
 *
 * @param eventType  wire event type, e.g. {@code TECHNOLOGY_DELETED}
 * @param entityId   id of the changed entity
 * @param status     delivery status
 * @param httpStatus status code returned by the sink, or {@code 0} when none was received
 * @param detail     failure description for {@code FAILED}, otherwise {@code null}
 */
public record PublishOutcome(
    String eventType,
    Long entityId,
    Status status,
    int httpStatus,
    String detail
) {

    public enum Status { DELIVERED, FAILED, SKIPPED }

    public static PublishOutcome delivered(ChangeEvent event, int httpStatus) {
        return new PublishOutcome(event.eventType(), event.entityId(), Status.DELIVERED, httpStatus, null);
    }

    public static PublishOutcome failed(ChangeEvent event, String detail) {
        return failed(event, 0, detail);
    }

    public static PublishOutcome failed(ChangeEvent event, int httpStatus, String detail) {
        return new PublishOutcome(event.eventType(), event.entityId(), Status.FAILED, httpStatus, detail);
    }

    public static PublishOutcome skipped(ChangeEvent event) {
        return new PublishOutcome(event.eventType(), event.entityId(), Status.SKIPPED, 0, null);
    }

    public boolean isDelivered() {
        return status == Status.DELIVERED;
    }
}
