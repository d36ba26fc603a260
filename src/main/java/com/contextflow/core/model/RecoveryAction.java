package com.contextflow.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * Action chosen by the recovery policy when a phase fails.
 *
 * @param type       what to do
 * @param parameters action parameters (e.g. "max_retries", "backoff")
 * @param reason     why this action was chosen
 * @param timestamp  when the decision was made
 */
public record RecoveryAction(
    Type type,
    Map<String, Object> parameters,
    String reason,
    Instant timestamp
) implements Serializable {

    public enum Type {
        RETRY,
        SKIP,
        ROLLBACK,
        ESCALATE,
        ABORT
    }

    public static final String MAX_RETRIES = "max_retries";
    public static final String BACKOFF = "backoff";

    public RecoveryAction {
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public static RecoveryAction retry(int maxRetries, double backoff, String reason) {
        return new RecoveryAction(Type.RETRY, Map.of(MAX_RETRIES, maxRetries, BACKOFF, backoff), reason, null);
    }

    public static RecoveryAction rollback(int maxRetries, String reason) {
        return new RecoveryAction(Type.ROLLBACK, Map.of(MAX_RETRIES, maxRetries, BACKOFF, 1.0), reason, null);
    }

    public static RecoveryAction skip(String reason) {
        return new RecoveryAction(Type.SKIP, Map.of(), reason, null);
    }

    public static RecoveryAction escalate(String reason) {
        return new RecoveryAction(Type.ESCALATE, Map.of(), reason, null);
    }

    public static RecoveryAction abort(String reason) {
        return new RecoveryAction(Type.ABORT, Map.of(), reason, null);
    }

    public int maxRetries() {
        Object value = parameters.get(MAX_RETRIES);
        return value instanceof Number n ? n.intValue() : 0;
    }

    public double backoff() {
        Object value = parameters.get(BACKOFF);
        return value instanceof Number n ? n.doubleValue() : 1.0;
    }
}
