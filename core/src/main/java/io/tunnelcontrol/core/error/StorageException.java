package io.tunnelcontrol.core.error;

/** A key-value store could not be read or written. */
public final class StorageException extends TunnelControlException {

    private static final long serialVersionUID = 1L;

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
