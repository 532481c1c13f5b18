package com.ryuqq.fanout.core.exception;

/**
 * Delivery-path failure raised by a PubSub implementation.
 *
 * <p>Shutdown is never reported through this exception: deliveries abandoned because the
 * PubSub is closing complete normally.</p>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public class PubSubException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public PubSubException(String message) {
        super(message);
    }

    public PubSubException(String message, Throwable cause) {
        super(message, cause);
    }
}
