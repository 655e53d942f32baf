package com.freelance.jobalerts.pipeline.notify;

import com.freelance.jobalerts.pipeline.model.OutboundMessage;
import com.freelance.jobalerts.pipeline.model.SendResult;

/**
 * Outbound transport for alerts. Implementations report failures through {@link SendResult}
 * and do not throw for expected transport errors.
 */
public interface MessagingChannel extends AutoCloseable {

    String name();

    SendResult send(long recipientId, OutboundMessage message);

    @Override
    default void close() {
    }
}
