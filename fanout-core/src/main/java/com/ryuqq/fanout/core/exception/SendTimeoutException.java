package com.ryuqq.fanout.core.exception;

import java.time.Duration;

/**
 * A subscriber did not accept a message copy within the configured send timeout.
 *
 * <p>Fatal to the enclosing publish call: remaining subscribers and remaining messages of that
 * call are not delivered.</p>
 *
 * @author Fanout Team
 * @since 1.0.0
 */
public class SendTimeoutException extends PubSubException {

    private static final long serialVersionUID = 1L;

    private final String messageUuid;
    private final String subscriberId;
    private final Duration timeout;

    public SendTimeoutException(String messageUuid, String subscriberId, Duration timeout) {
        super("Sending message " + messageUuid + " to subscriber " + subscriberId
            + " timed out after " + timeout.toMillis() + "ms");
        this.messageUuid = messageUuid;
        this.subscriberId = subscriberId;
        this.timeout = timeout;
    }

    public String getMessageUuid() {
        return messageUuid;
    }

    public String getSubscriberId() {
        return subscriberId;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
