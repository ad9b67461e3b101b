package io.herald.core.delivery;

import static org.assertj.core.api.Assertions.assertThat;

import io.herald.core.job.DeliverPolicy;
import org.junit.jupiter.api.Test;

class DeliveryArbiterTest {
    private final RecordingChannel channel = new RecordingChannel("console");

    @Test
    void shouldAcknowledgeWithoutSendingUnderNever() {
        DeliveryArbiter arbiter = arbiter(DeliverPolicy.NEVER);

        DeliveryOutcome first = arbiter.attempt("disk is full", false);
        DeliveryOutcome confirmed = arbiter.attempt("disk is full", true);

        assertThat(first.status()).isEqualTo(DeliveryStatus.SUPPRESSED);
        assertThat(confirmed.status()).isEqualTo(DeliveryStatus.SUPPRESSED);
        assertThat(arbiter.state()).isEqualTo(DeliveryState.NOT_ATTEMPTED);
        assertThat(channel.delivered()).isEmpty();
    }

    @Test
    void shouldForwardEveryAttemptUnderAlways() {
        DeliveryArbiter arbiter = arbiter(DeliverPolicy.ALWAYS);

        DeliveryOutcome first = arbiter.attempt("build finished", false);
        DeliveryOutcome second = arbiter.attempt("deploy finished", false);

        assertThat(first.status()).isEqualTo(DeliveryStatus.SENT);
        assertThat(first.message()).isEqualTo("Message sent to console:ops");
        assertThat(second.sent()).isTrue();
        assertThat(arbiter.state()).isEqualTo(DeliveryState.SENT);
        assertThat(channel.delivered()).extracting(Notification::content)
            .containsExactly("build finished", "deploy finished");
        assertThat(channel.delivered().get(0).jobId()).isEqualTo("job1");
        assertThat(channel.delivered().get(0).sessionId()).isEqualTo("session1");
    }

    @Test
    void shouldSendOnlyAfterConfirmationUnderAuto() {
        DeliveryArbiter arbiter = arbiter(DeliverPolicy.AUTO);

        DeliveryOutcome first = arbiter.attempt("CPU above 90%", false);
        DeliveryOutcome second = arbiter.attempt("CPU above 90%", false);
        assertThat(channel.delivered()).isEmpty();
        DeliveryOutcome third = arbiter.attempt("CPU above 90%", true);

        assertThat(first.status()).isEqualTo(DeliveryStatus.CONFIRMATION_REQUIRED);
        assertThat(first.message()).startsWith("[CONFIRM_NEEDED]").contains("CPU above 90%");
        assertThat(first.state()).isEqualTo(DeliveryState.AWAITING_CONFIRMATION);
        assertThat(second.status()).isEqualTo(DeliveryStatus.CONFIRMATION_REQUIRED);
        assertThat(second.message()).isEqualTo(first.message());
        assertThat(third.status()).isEqualTo(DeliveryStatus.SENT);
        assertThat(arbiter.confirmed()).isTrue();
        assertThat(channel.delivered()).hasSize(1);
    }

    @Test
    void shouldNeverSendOnFirstAutoAttemptEvenWhenConfirmed() {
        DeliveryArbiter arbiter = arbiter(DeliverPolicy.AUTO);

        DeliveryOutcome first = arbiter.attempt("alert", true);

        assertThat(first.status()).isEqualTo(DeliveryStatus.CONFIRMATION_REQUIRED);
        assertThat(channel.delivered()).isEmpty();
        assertThat(arbiter.attempt("alert", true).sent()).isTrue();
    }

    @Test
    void shouldDropUnconfirmedAutoMessageWhenSessionEnds() {
        DeliveryArbiter arbiter = arbiter(DeliverPolicy.AUTO);
        arbiter.attempt("alert", false);

        arbiter.close();
        DeliveryOutcome late = arbiter.attempt("alert", true);

        assertThat(late.status()).isEqualTo(DeliveryStatus.REJECTED);
        assertThat(arbiter.confirmed()).isFalse();
        assertThat(channel.delivered()).isEmpty();
    }

    @Test
    void shouldRequireConfirmationForEachFurtherAutoSend() {
        DeliveryArbiter arbiter = arbiter(DeliverPolicy.AUTO);
        arbiter.attempt("first", false);
        arbiter.attempt("first", true);

        DeliveryOutcome unconfirmed = arbiter.attempt("second", false);
        DeliveryOutcome confirmed = arbiter.attempt("second", true);

        assertThat(unconfirmed.status()).isEqualTo(DeliveryStatus.CONFIRMATION_REQUIRED);
        assertThat(unconfirmed.message()).contains("second");
        assertThat(confirmed.sent()).isTrue();
        assertThat(channel.delivered()).extracting(Notification::content).containsExactly("first", "second");
    }

    @Test
    void shouldReportChannelFailureAndStaySent() {
        channel.failWith("connection refused");
        DeliveryArbiter arbiter = arbiter(DeliverPolicy.ALWAYS);

        DeliveryOutcome outcome = arbiter.attempt("hello", false);

        assertThat(outcome.status()).isEqualTo(DeliveryStatus.FAILED);
        assertThat(outcome.message()).isEqualTo("Error sending message: connection refused");
        assertThat(arbiter.state()).isEqualTo(DeliveryState.SENT);
    }

    @Test
    void shouldTruncateLongPreview() {
        DeliveryArbiter arbiter = arbiter(DeliverPolicy.AUTO);
        String content = "x".repeat(250);

        String prompt = arbiter.attempt(content, false).message();

        assertThat(prompt).contains("\"" + "x".repeat(200) + "...\"");
        assertThat(prompt).doesNotContain("x".repeat(201));
    }

    @Test
    void shouldHonourDestinationOverrides() {
        DeliveryArbiter arbiter = arbiter(DeliverPolicy.ALWAYS);

        arbiter.attempt("hi", false, "webhook", "someone");
        arbiter.attempt("hi again", false, " ", null);

        assertThat(channel.delivered().get(0).channel()).isEqualTo("webhook");
        assertThat(channel.delivered().get(0).to()).isEqualTo("someone");
        assertThat(channel.delivered().get(1).channel()).isEqualTo("console");
        assertThat(channel.delivered().get(1).to()).isEqualTo("ops");
    }

    @Test
    void shouldRejectBlankContent() {
        DeliveryArbiter arbiter = arbiter(DeliverPolicy.AUTO);

        DeliveryOutcome outcome = arbiter.attempt("  ", true);

        assertThat(outcome.status()).isEqualTo(DeliveryStatus.REJECTED);
        assertThat(arbiter.state()).isEqualTo(DeliveryState.NOT_ATTEMPTED);
    }

    private DeliveryArbiter arbiter(DeliverPolicy policy) {
        return new DeliveryArbiter(policy, channel, "console", "ops", "job1", "session1");
    }
}
