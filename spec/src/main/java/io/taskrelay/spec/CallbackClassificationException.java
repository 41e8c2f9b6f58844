package io.taskrelay.spec;

/**
 * A webhook delivery could not be routed or classified.
 */
public class CallbackClassificationException extends TaskRelayException {

    public CallbackClassificationException(String msg) {
        super(FailureKind.CLASSIFICATION, msg);
    }

    public CallbackClassificationException(String msg, Throwable cause) {
        super(FailureKind.CLASSIFICATION, msg, cause);
    }
}
