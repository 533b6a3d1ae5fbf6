package com.p14n.lineageflow.broadcast;

/**
 * Generic error notice. The message is fixed text; it never carries payloads
 * or exception details.
 */
public record ErrorNotice(String errorType, String message) implements EventPayload {

    public static final String QUEUE_UNAVAILABLE = "queue_unavailable";
    public static final String ITEM_DEAD_LETTERED = "item_dead_lettered";
    public static final String NOTIFICATION_INVALID = "notification_invalid";

    public static ErrorNotice queueUnavailable() {
        return new ErrorNotice(QUEUE_UNAVAILABLE, "The work queue is temporarily unavailable");
    }

    public static ErrorNotice itemDeadLettered() {
        return new ErrorNotice(ITEM_DEAD_LETTERED, "A queue item could not be processed");
    }

    public static ErrorNotice notificationInvalid() {
        return new ErrorNotice(NOTIFICATION_INVALID, "A notification could not be read");
    }

    @Override
    public Topic topic() {
        return Topic.ERROR;
    }
}
