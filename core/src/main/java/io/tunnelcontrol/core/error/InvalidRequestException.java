package io.tunnelcontrol.core.error;

/**
 * A client-supplied command could not be accepted: missing body, malformed JSON, or a field that
 * fails validation. The message is safe to return to the caller verbatim.
 */
public final class InvalidRequestException extends TunnelControlException {

    private static final long serialVersionUID = 1L;

    private final String field;

    public InvalidRequestException(String message) {
        this(message, null);
    }

    public InvalidRequestException(String message, String field) {
        super(message);
        this.field = field;
    }

    /** The offending request field, or {@code null} when the whole body was rejected. */
    public String field() {
        return field;
    }
}
