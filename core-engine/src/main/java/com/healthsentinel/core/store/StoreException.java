package com.healthsentinel.core.store;

/**
 * Raised when the underlying persistence cannot complete an operation.
 *
 * <p>
 * A store failure affects only the call that raised it; callers processing
 * several entities are expected to catch it per entity.
 * </p>
 *
 * @since 1.0.0
 */
public class StoreException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
