package io.pulse;

import java.time.Instant;

/**
 * Completion callback bound to a {@link Message} by the transport that delivered it.
 *
 * <p>The transport translates the arguments into its native acknowledgement or
 * negative-acknowledgement call and releases any delivery lease it holds. The
 * callback runs synchronously on the thread that won the {@link Message#ack()} /
 * {@link Message#nack()} race, so it must not block indefinitely.
 *
 * <p>Redelivery after a failed callback is the transport's concern; the message
 * never retries it.
 */
@FunctionalInterface
public interface AckHandler {

    /**
     * Handler that ignores completion. Bound to messages that were decoded but not
     * yet attached to a transport.
     */
    AckHandler NOOP = (ackId, success, receiveTime) -> {
    };

    /**
     * Called exactly once per message.
     *
     * @param ackId       the acknowledgement token issued by the transport, may be {@code null}
     * @param success     {@code true} for ack, {@code false} for nack
     * @param receiveTime the time the message was received, may be {@code null}
     */
    void onComplete(String ackId, boolean success, Instant receiveTime);
}
