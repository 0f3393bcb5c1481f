package com.techportfolio.common.event;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable record of a completed mutation, built the moment the write returns
 * and handed once to a {@link com.techportfolio.common.publish.ChangeEventPublisher}.
 *
 * <p>{@code portfolioId} is the portfolio whose summary the change affects: the entity
 * itself for portfolio changes, the owning portfolio for technology changes. It lets
 * live summary streams react to the change without inspecting the snapshot.
 *
 * @param entityId    id of the changed entity
 * @param entityType  portfolio or technology
 * @param changeKind  created, updated or deleted (logical)
 * @param portfolioId portfolio affected by the change
 * @param timestamp   completion time of the mutation
 * @param snapshot    state of the entity after the mutation
 * @param traceId     trace identifier of the request that produced the change
 */
public record ChangeEvent(
    Long entityId,
    EntityType entityType,
    ChangeKind changeKind,
    Long portfolioId,
    Instant timestamp,
    Object snapshot,
    String traceId
) {

    public ChangeEvent {
        Objects.requireNonNull(entityId, "entityId");
        Objects.requireNonNull(entityType, "entityType");
        Objects.requireNonNull(changeKind, "changeKind");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static ChangeEvent of(EntityType entityType, ChangeKind changeKind, Long entityId,
                                 Long portfolioId, Object snapshot, String traceId) {
        return new ChangeEvent(entityId, entityType, changeKind, portfolioId,
                               Instant.now(), snapshot, traceId);
    }

    /**
     * Event type name used on the wire, e.g. {@code PORTFOLIO_CREATED}.
     */
    public String eventType() {
        return entityType.name() + "_" + changeKind.name();
    }
}
