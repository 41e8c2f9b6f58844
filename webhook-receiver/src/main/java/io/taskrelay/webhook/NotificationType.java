package io.taskrelay.webhook;

import io.taskrelay.spec.TaskState;

/**
 * Coarse type of a push notification, derived from the task state it reports.
 */
public enum NotificationType {
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELED("canceled"),
    INPUT_REQUIRED("input_required"),
    WORKING("working"),
    OTHER("other");

    private final String value;

    NotificationType(String value) {
        this.value = value;
    }

    public String asString() {
        return value;
    }

    public static NotificationType of(TaskState state) {
        switch (state) {
            case COMPLETED:
                return COMPLETED;
            case FAILED:
            case REJECTED:
                return FAILED;
            case CANCELED:
                return CANCELED;
            case INPUT_REQUIRED:
            case AUTH_REQUIRED:
                return INPUT_REQUIRED;
            case SUBMITTED:
            case WORKING:
                return WORKING;
            default:
                return OTHER;
        }
    }
}
