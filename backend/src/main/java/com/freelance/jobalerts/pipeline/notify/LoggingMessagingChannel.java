package com.freelance.jobalerts.pipeline.notify;

import com.freelance.jobalerts.pipeline.model.OutboundMessage;
import com.freelance.jobalerts.pipeline.model.SendResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dry-run channel used when no bot token is configured.
 */
public class LoggingMessagingChannel implements MessagingChannel {
    private static final Logger log = LoggerFactory.getLogger(LoggingMessagingChannel.class);

    @Override
    public String name() {
        return "logging";
    }

    @Override
    public SendResult send(long recipientId, OutboundMessage message) {
        log.info(
            "Dry-run alert for recipient {} ({} chars, {} links)",
            recipientId,
            message.text().length(),
            message.links().size()
        );
        return SendResult.ok();
    }
}
