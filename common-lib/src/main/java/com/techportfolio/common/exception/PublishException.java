package com.techportfolio.common.exception;

public class PublishException extends PortfolioException {

    private final String eventType;
    private final Long entityId;

    public PublishException(String eventType, Long entityId, Throwable cause) {
        super(ErrorKind.PUBLISH,
              "Publishing " + eventType + " for entity " + entityId + " failed: " + describe(cause), cause);
        this.eventType = eventType;
        this.entityId = entityId;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    public String getEventType() {
        return eventType;
    }

    public Long getEntityId() {
        return entityId;
    }
}
