package io.herald.core.delivery;

import io.herald.core.job.DeliverPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides, for one execution session, whether a notification attempt reaches the channel.
 *
 * <p>{@code always} forwards every attempt and {@code never} acknowledges without sending.
 * {@code auto} answers the first attempt with a confirmation prompt and only forwards a later
 * attempt that carries the confirmation flag. A session that ends before that confirmed attempt
 * sends nothing.
 */
public final class DeliveryArbiter {
    private static final Logger LOG = LoggerFactory.getLogger(DeliveryArbiter.class);
    private static final int PREVIEW_LENGTH = 200;

    private final DeliverPolicy policy;
    private final NotificationChannel channel;
    private final String defaultChannel;
    private final String defaultTo;
    private final String jobId;
    private final String sessionId;

    private DeliveryState state = DeliveryState.NOT_ATTEMPTED;
    private boolean confirmed;
    private boolean closed;
    private String pendingPrompt;

    public DeliveryArbiter(
        DeliverPolicy policy,
        NotificationChannel channel,
        String defaultChannel,
        String defaultTo,
        String jobId,
        String sessionId
    ) {
        this.policy = policy == null ? DeliverPolicy.ALWAYS : policy;
        this.channel = channel;
        this.defaultChannel = defaultChannel == null ? "" : defaultChannel;
        this.defaultTo = defaultTo == null ? "" : defaultTo;
        this.jobId = jobId;
        this.sessionId = sessionId;
    }

    public DeliverPolicy policy() {
        return policy;
    }

    public synchronized DeliveryState state() {
        return state;
    }

    public synchronized boolean confirmed() {
        return confirmed;
    }

    public synchronized boolean closed() {
        return closed;
    }

    public DeliveryOutcome attempt(String content, boolean confirm) {
        return attempt(content, confirm, null, null);
    }

    public synchronized DeliveryOutcome attempt(String content, boolean confirm, String channelOverride, String toOverride) {
        if (closed) {
            return outcome(DeliveryStatus.REJECTED, "Error: execution session has ended; message was not sent");
        }
        if (content == null || content.isBlank()) {
            return outcome(DeliveryStatus.REJECTED, "Error: content is required");
        }

        switch (policy) {
            case NEVER -> {
                LOG.debug("Session {} suppressed notification for job {} (deliver=never)", sessionId, jobId);
                return outcome(DeliveryStatus.SUPPRESSED,
                    "Message acknowledged; delivery is disabled for this job (deliver=never), nothing was sent");
            }
            case ALWAYS -> {
                return forward(content, channelOverride, toOverride);
            }
            default -> {
                return arbitrateAuto(content, confirm, channelOverride, toOverride);
            }
        }
    }

    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (state == DeliveryState.AWAITING_CONFIRMATION) {
            LOG.debug("Session {} ended without confirmation; notification for job {} dropped", sessionId, jobId);
        }
    }

    private DeliveryOutcome arbitrateAuto(String content, boolean confirm, String channelOverride, String toOverride) {
        if (state == DeliveryState.NOT_ATTEMPTED) {
            state = DeliveryState.AWAITING_CONFIRMATION;
            pendingPrompt = confirmationPrompt(content);
            LOG.debug("Session {} awaiting send confirmation for job {}", sessionId, jobId);
            return outcome(DeliveryStatus.CONFIRMATION_REQUIRED, pendingPrompt);
        }
        if (!confirm) {
            String prompt = state == DeliveryState.AWAITING_CONFIRMATION ? pendingPrompt : confirmationPrompt(content);
            return outcome(DeliveryStatus.CONFIRMATION_REQUIRED, prompt);
        }
        confirmed = true;
        return forward(content, channelOverride, toOverride);
    }

    private DeliveryOutcome forward(String content, String channelOverride, String toOverride) {
        String targetChannel = channelOverride == null || channelOverride.isBlank() ? defaultChannel : channelOverride.trim();
        String targetTo = toOverride == null || toOverride.isBlank() ? defaultTo : toOverride.trim();
        state = DeliveryState.SENT;
        try {
            channel.deliver(new Notification(targetChannel, targetTo, content, jobId, sessionId));
            LOG.info("Session {} delivered notification for job {} to {}:{}", sessionId, jobId, targetChannel, targetTo);
            return outcome(DeliveryStatus.SENT, "Message sent to " + targetChannel + ":" + targetTo);
        } catch (ChannelException e) {
            LOG.warn("Session {} failed to deliver notification for job {}: {}", sessionId, jobId, e.getMessage());
            return outcome(DeliveryStatus.FAILED, "Error sending message: " + e.getMessage());
        }
    }

    private DeliveryOutcome outcome(DeliveryStatus status, String message) {
        return new DeliveryOutcome(status, state, message);
    }

    private static String confirmationPrompt(String content) {
        String preview = content.length() > PREVIEW_LENGTH ? content.substring(0, PREVIEW_LENGTH) + "..." : content;
        return "[CONFIRM_NEEDED] You requested to send a message. This is a scheduled job with deliver=auto. "
            + "Only send if the alert condition is met. Do not send for routine completion.\n\n"
            + "Preview: \"" + preview + "\"\n\n"
            + "If the alert condition is met, call message again with the same content and confirm_send=true to send. "
            + "If the alert condition is not met, do not call again (message will not be sent).";
    }
}
