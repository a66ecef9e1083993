package com.boomerang.gateway;

import com.boomerang.dispatch.ConversationState;
import com.boomerang.dispatch.RecordingSendClient;
import com.boomerang.observability.GatewayMetrics;
import com.boomerang.security.SignatureAlgorithm;
import com.boomerang.security.SignatureValidator;
import com.boomerang.send.ScriptedTransport;
import com.boomerang.shared.config.BoomerangConfig;
import com.boomerang.shared.model.MediaType;
import com.boomerang.shared.model.MessageReceived;
import com.boomerang.shared.model.OutboundMessage;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;

import static com.boomerang.gateway.GatewayFixtures.APP_SECRET;
import static com.boomerang.gateway.GatewayFixtures.VERIFY_TOKEN;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MessengerGatewayTest {

    private final SignatureValidator signer = new SignatureValidator(APP_SECRET, SignatureAlgorithm.SHA256);

    @TempDir
    Path tempDir;

    @Test
    void verifiesSubscriptionHandshake() {
        var gateway = MessengerGateway.builder(GatewayFixtures.config()).build();

        assertThat(gateway.verifySubscription("subscribe", VERIFY_TOKEN)).isTrue();
        assertThat(gateway.verifySubscription("subscribe", "wrong")).isFalse();
        assertThat(gateway.verifySubscription("unsubscribe", VERIFY_TOKEN)).isFalse();
        assertThat(gateway.verifySubscription(null, null)).isFalse();
    }

    @Test
    void blankVerifyTokenNeverVerifies() {
        var config = GatewayFixtures.config();
        var messenger = config.messenger();
        var gateway = MessengerGateway.builder(config.withMessenger(new BoomerangConfig.MessengerConfig(
                "", messenger.pageAccessToken(), messenger.appSecret(), messenger.signatureAlgorithm(),
                messenger.graphBaseUrl(), messenger.requestTimeoutSeconds()))).build();

        assertThat(gateway.verifySubscription("subscribe", "")).isFalse();
    }

    @Test
    void echoesTextAfterAcknowledging() {
        var transport = new ScriptedTransport();
        var gateway = MessengerGateway.builder(GatewayFixtures.config())
                .bot(new EchoBot())
                .transport(transport)
                .build();
        gateway.start();
        try {
            var body = bytes(GatewayFixtures.textEvent("u1", "hi"));
            var result = gateway.ingest(body, signer.sign(body));

            assertThat(result.status()).isEqualTo(MessengerGateway.Status.ACCEPTED);
            assertThat(result.dispatched()).isEqualTo(1);
            assertThat(gateway.awaitIdle(Duration.ofSeconds(5))).isTrue();

            var mapper = new ObjectMapper();
            assertThat(transport.calls()).extracting(call -> describe(mapper, call.body()))
                    .containsExactly("u1 mark_seen", "u1 typing_on", "u1 text:hi");
        } finally {
            gateway.stop();
        }
    }

    @Test
    void rejectsBadSignatureWithoutDispatching() {
        var metrics = new GatewayMetrics();
        var sendClient = new RecordingSendClient();
        var gateway = MessengerGateway.builder(GatewayFixtures.config())
                .on(MessageReceived.class, (message, reply) -> Optional.of(OutboundMessage.text("x")))
                .sendClient(sendClient)
                .metrics(metrics)
                .build();
        gateway.start();
        try {
            var body = bytes(GatewayFixtures.textEvent("u1", "hi"));
            var tampered = bytes(GatewayFixtures.textEvent("u1", "hI"));

            assertThat(gateway.ingest(tampered, signer.sign(body)).status())
                    .isEqualTo(MessengerGateway.Status.REJECTED_SIGNATURE);
            assertThat(gateway.ingest(body, null).status())
                    .isEqualTo(MessengerGateway.Status.REJECTED_SIGNATURE);
            assertThat(gateway.awaitIdle(Duration.ofSeconds(1))).isTrue();
            assertThat(sendClient.log()).isEmpty();
            assertThat(metrics.webhookRejected().count()).isEqualTo(2.0);
        } finally {
            gateway.stop();
        }
    }

    @Test
    void missingAppSecretRejectsEveryDelivery() {
        var metrics = new GatewayMetrics();
        var sendClient = new RecordingSendClient();
        var gateway = MessengerGateway.builder(BoomerangConfig.defaults())
                .on(MessageReceived.class, (message, reply) -> Optional.of(OutboundMessage.text("x")))
                .sendClient(sendClient)
                .metrics(metrics)
                .build();
        gateway.start();
        try {
            var body = bytes(GatewayFixtures.textEvent("u1", "hi"));
            var unkeyed = new SignatureValidator("anything", SignatureAlgorithm.SHA1);

            assertThat(gateway.ingest(body, null).status())
                    .isEqualTo(MessengerGateway.Status.REJECTED_SIGNATURE);
            assertThat(gateway.ingest(body, unkeyed.sign(body)).status())
                    .isEqualTo(MessengerGateway.Status.REJECTED_SIGNATURE);
            assertThat(gateway.awaitIdle(Duration.ofSeconds(1))).isTrue();
            assertThat(sendClient.log()).isEmpty();
            assertThat(metrics.webhookRejected().count()).isEqualTo(2.0);
        } finally {
            gateway.stop();
        }
    }

    @Test
    void malformedEventsStillAccepted() {
        var gateway = MessengerGateway.builder(GatewayFixtures.config()).sendClient(new RecordingSendClient()).build();
        gateway.start();
        try {
            var body = bytes("{\"object\":\"page\",\"entry\":[{\"id\":\"PAGE\",\"messaging\":[{\"timestamp\":1}]}]}");

            var result = gateway.ingest(body, signer.sign(body));

            assertThat(result.status()).isEqualTo(MessengerGateway.Status.ACCEPTED);
            assertThat(result.dispatched()).isZero();
            assertThat(result.malformed()).isEqualTo(1);
        } finally {
            gateway.stop();
        }
    }

    @Test
    void unavailableBeforeStartAndAfterStop() {
        var sendClient = new RecordingSendClient();
        var gateway = MessengerGateway.builder(GatewayFixtures.config()).sendClient(sendClient).build();
        var body = bytes(GatewayFixtures.textEvent("u1", "hi"));

        assertThat(gateway.ingest(body, signer.sign(body)).status()).isEqualTo(MessengerGateway.Status.UNAVAILABLE);

        gateway.start();
        gateway.stop();

        assertThat(gateway.ingest(body, signer.sign(body)).status()).isEqualTo(MessengerGateway.Status.UNAVAILABLE);
        assertThat(sendClient.isClosed()).isTrue();
        assertThatThrownBy(gateway::start).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> gateway.dispatcher().dispatch(List.of()))
                .isInstanceOf(RejectedExecutionException.class);
    }

    @Test
    void instancesAreIndependent() {
        var firstClient = new RecordingSendClient();
        var secondClient = new RecordingSendClient();
        var first = MessengerGateway.builder(GatewayFixtures.config())
                .on(MessageReceived.class, (m, r) -> Optional.of(OutboundMessage.text("first")))
                .sendClient(firstClient).build();
        var second = MessengerGateway.builder(GatewayFixtures.config())
                .on(MessageReceived.class, (m, r) -> Optional.of(OutboundMessage.text("second")))
                .sendClient(secondClient).build();
        first.start();
        second.start();
        try {
            var body = bytes(GatewayFixtures.textEvent("u1", "hi"));
            first.ingest(body, signer.sign(body));
            second.ingest(body, signer.sign(body));

            assertThat(first.awaitIdle(Duration.ofSeconds(5))).isTrue();
            assertThat(second.awaitIdle(Duration.ofSeconds(5))).isTrue();
            assertThat(first.conversationState("u1")).isEqualTo(ConversationState.IDLE);
            assertThat(first.sendClient()).isSameAs(firstClient);
            assertThat(firstClient.log()).containsExactly("u1:first");
            assertThat(secondClient.log()).containsExactly("u1:second");
        } finally {
            first.stop();
            second.stop();
        }
    }

    @Test
    void hostAttachmentBuildsMediaUnderBaseUrl() throws Exception {
        var file = Files.writeString(tempDir.resolve("report.pdf"), "%PDF");
        var gateway = MessengerGateway.builder(GatewayFixtures.config()).sendClient(new RecordingSendClient()).build();

        var media = gateway.hostAttachment(MediaType.FILE, file);

        assertThat(media.type()).isEqualTo(MediaType.FILE);
        assertThat(media.url()).startsWith("https://bot.example.com/attachments/");
        assertThat(gateway.attachments().size()).isEqualTo(1);
    }

    @Test
    void signatureHeaderFollowsAlgorithm() {
        var gateway = MessengerGateway.builder(GatewayFixtures.config()).build();

        assertThat(gateway.signatureHeaderName()).isEqualTo("X-Hub-Signature-256");
    }

    private static String describe(ObjectMapper mapper, String json) {
        try {
            var node = mapper.readTree(json);
            var recipient = node.path("recipient").path("id").asText();
            if (node.has("sender_action")) return recipient + " " + node.path("sender_action").asText();
            return recipient + " text:" + node.path("message").path("text").asText();
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
