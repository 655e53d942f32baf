package com.freelance.jobalerts.pipeline.notify;

import com.freelance.jobalerts.config.AlertsProperties;
import com.freelance.jobalerts.pipeline.model.DeliveryResult;
import com.freelance.jobalerts.pipeline.model.OutboundMessage;
import com.freelance.jobalerts.pipeline.model.Recipient;
import com.freelance.jobalerts.pipeline.model.SendResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Sends one message to one recipient through the shared throttle. A rate-limit signal pauses
 * only this send before the single retry; transient failures get the same single retry.
 */
@Component
public class FanOutNotifier {
    private static final Logger log = LoggerFactory.getLogger(FanOutNotifier.class);

    private final MessagingChannel channel;
    private final SendThrottle throttle;
    private final AlertsProperties properties;

    public FanOutNotifier(MessagingChannel channel, SendThrottle throttle, AlertsProperties properties) {
        this.channel = channel;
        this.throttle = throttle;
        this.properties = properties;
    }

    public DeliveryResult deliver(Recipient recipient, OutboundMessage message) {
        try {
            SendResult first = attempt(recipient.id(), message);
            if (first.isOk()) {
                return DeliveryResult.delivered(1);
            }
            switch (first.status()) {
                case PERMANENT_FAILURE:
                    return DeliveryResult.rejected(first.reason(), 1);
                case RECIPIENT_UNREACHABLE:
                    return DeliveryResult.failed(first.reason(), 1);
                case RATE_LIMITED:
                    int retryAfter = first.retryAfterSeconds() == null ? 0 : first.retryAfterSeconds();
                    if (retryAfter > properties.getDelivery().getMaxRetryAfterSeconds()) {
                        log.warn("Recipient {} rate limited for {}s, skipping this cycle", recipient.id(), retryAfter);
                        return DeliveryResult.failed("retry_after_exceeds_cap", 1);
                    }
                    throttle.pause(Duration.ofSeconds(retryAfter));
                    break;
                default:
                    break;
            }
            SendResult second = attempt(recipient.id(), message);
            if (second.isOk()) {
                return DeliveryResult.delivered(2);
            }
            if (second.status() == SendResult.Status.PERMANENT_FAILURE) {
                return DeliveryResult.rejected(second.reason(), 2);
            }
            return DeliveryResult.failed(second.reason(), 2);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DeliveryResult.failed("interrupted", 0);
        }
    }

    private SendResult attempt(long recipientId, OutboundMessage message) throws InterruptedException {
        throttle.awaitTurn();
        try {
            SendResult result = channel.send(recipientId, message);
            return result == null ? SendResult.transientFailure("empty_result") : result;
        } catch (RuntimeException e) {
            log.warn("Channel {} failed for recipient {}", channel.name(), recipientId, e);
            return SendResult.transientFailure("channel_exception");
        }
    }
}
