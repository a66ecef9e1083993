package com.boomerang.events;

import com.boomerang.observability.GatewayMetrics;
import com.boomerang.shared.model.AccountLinkingReceived;
import com.boomerang.shared.model.DeliveryConfirmed;
import com.boomerang.shared.model.InboundAttachment;
import com.boomerang.shared.model.MessageEchoed;
import com.boomerang.shared.model.MessageReceived;
import com.boomerang.shared.model.OptinReceived;
import com.boomerang.shared.model.PostbackReceived;
import com.boomerang.shared.model.ReadConfirmed;
import com.boomerang.shared.model.Referral;
import com.boomerang.shared.model.ReferralReceived;
import com.boomerang.shared.model.Update;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a webhook payload ({@code entry[].messaging[]}) into typed updates.
 *
 * <p>The variant is chosen by the first key present, in this order: {@code message},
 * {@code delivery}, {@code read}, {@code postback}, {@code referral}, {@code optin},
 * {@code account_linking}. Events that match none, or lack required fields, are skipped
 * and counted without affecting their siblings.
 */
public class EventParser {

    private static final Logger log = LoggerFactory.getLogger(EventParser.class);

    private final ObjectMapper mapper;
    private final GatewayMetrics metrics;

    public EventParser(ObjectMapper mapper, GatewayMetrics metrics) {
        this.mapper = mapper;
        this.metrics = metrics;
    }

    public ParsedBatch parse(byte[] rawBody) {
        try {
            var root = mapper.readTree(rawBody);
            if (root == null || !root.isObject()) {
                return unreadable("payload is not a JSON object");
            }
            return parse(root);
        } catch (IOException e) {
            return unreadable(e.getMessage());
        }
    }

    public ParsedBatch parse(JsonNode payload) {
        if (!"page".equals(payload.path("object").asText("page"))) {
            log.warn("Webhook payload for object '{}' is not a page subscription",
                    payload.path("object").asText());
        }
        return new ParsedBatch(this, payload, 0);
    }

    private ParsedBatch unreadable(String reason) {
        log.warn("Unreadable webhook payload: {}", reason);
        metrics.malformedEvents().increment();
        return new ParsedBatch(this, MissingNode.getInstance(), 1);
    }

    void skipped(String entryId, String reason) {
        log.warn("Skipping messaging event in entry {}: {}", entryId, reason);
        metrics.malformedEvents().increment();
    }

    Update toUpdate(JsonNode event) throws MalformedEventException {
        var senderId = event.path("sender").path("id").asText("");
        if (senderId.isBlank()) throw new MalformedEventException("missing sender.id");
        var recipientId = event.path("recipient").path("id").asText("");
        var ts = event.path("timestamp");
        if (!ts.isIntegralNumber()) throw new MalformedEventException("missing timestamp");
        long timestamp = ts.asLong();

        Update update;
        if (event.has("message")) {
            var message = event.get("message");
            update = message.path("is_echo").asBoolean(false)
                    ? echo(senderId, recipientId, timestamp, event, message)
                    : message(senderId, recipientId, timestamp, event, message);
        } else if (event.has("delivery")) {
            var delivery = event.get("delivery");
            var mids = new ArrayList<String>();
            delivery.path("mids").forEach(mid -> mids.add(mid.asText()));
            update = new DeliveryConfirmed(senderId, recipientId, timestamp, event,
                    requiredLong(delivery, "watermark"), mids, optionalLong(delivery, "seq"));
        } else if (event.has("read")) {
            var read = event.get("read");
            update = new ReadConfirmed(senderId, recipientId, timestamp, event,
                    requiredLong(read, "watermark"), optionalLong(read, "seq"));
        } else if (event.has("postback")) {
            var postback = event.get("postback");
            var referral = postback.has("referral") ? referral(postback.get("referral")) : null;
            update = new PostbackReceived(senderId, recipientId, timestamp, event,
                    optionalText(postback, "title"), requiredText(postback, "payload"), referral);
        } else if (event.has("referral")) {
            update = new ReferralReceived(senderId, recipientId, timestamp, event,
                    referral(event.get("referral")));
        } else if (event.has("optin")) {
            var optin = event.get("optin");
            var ref = optionalText(optin, "ref");
            if (ref == null) ref = optionalText(optin, "user_ref");
            if (ref == null) throw new MalformedEventException("optin without ref");
            update = new OptinReceived(senderId, recipientId, timestamp, event, ref);
        } else if (event.has("account_linking")) {
            var linking = event.get("account_linking");
            var status = requiredText(linking, "status");
            var code = "unlinked".equals(status) ? null : requiredText(linking, "authorization_code");
            update = new AccountLinkingReceived(senderId, recipientId, timestamp, event, status, code);
        } else {
            throw new MalformedEventException("unknown event shape " + fieldNames(event));
        }

        metrics.updatesParsed(update.type()).increment();
        return update;
    }

    private MessageReceived message(String senderId, String recipientId, long timestamp,
                                    JsonNode event, JsonNode message) throws MalformedEventException {
        var quickReply = message.path("quick_reply").path("payload").asText(null);
        return new MessageReceived(senderId, recipientId, timestamp, event,
                requiredText(message, "mid"), optionalLong(message, "seq"),
                message.path("text").asText(""), attachments(message), quickReply);
    }

    private MessageEchoed echo(String senderId, String recipientId, long timestamp,
                               JsonNode event, JsonNode message) throws MalformedEventException {
        return new MessageEchoed(senderId, recipientId, timestamp, event,
                requiredText(message, "mid"), optionalText(message, "app_id"),
                optionalText(message, "metadata"), message.path("text").asText(""),
                attachments(message));
    }

    private List<InboundAttachment> attachments(JsonNode message) throws MalformedEventException {
        var out = new ArrayList<InboundAttachment>();
        for (var attachment : message.path("attachments")) {
            var type = requiredText(attachment, "type");
            var payload = attachment.path("payload");
            if ("location".equals(type)) {
                var coordinates = payload.path("coordinates");
                if (!coordinates.path("lat").isNumber() || !coordinates.path("long").isNumber()) {
                    throw new MalformedEventException("location attachment without coordinates");
                }
                out.add(new InboundAttachment.Location(
                        coordinates.get("lat").asDouble(), coordinates.get("long").asDouble()));
            } else {
                out.add(new InboundAttachment.Media(type,
                        payload.path("url").asText(attachment.path("url").asText(null))));
            }
        }
        return out;
    }

    private Referral referral(JsonNode node) throws MalformedEventException {
        return new Referral(requiredText(node, "ref"),
                optionalText(node, "source"), optionalText(node, "type"));
    }

    private static String requiredText(JsonNode node, String field) throws MalformedEventException {
        var value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            throw new MalformedEventException("missing " + field);
        }
        return value.asText();
    }

    private static String optionalText(JsonNode node, String field) {
        var value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static long requiredLong(JsonNode node, String field) throws MalformedEventException {
        var value = node.get(field);
        if (value == null || !value.isIntegralNumber()) {
            throw new MalformedEventException("missing " + field);
        }
        return value.asLong();
    }

    private static Long optionalLong(JsonNode node, String field) {
        var value = node.get(field);
        return value != null && value.isIntegralNumber() ? value.asLong() : null;
    }

    private static List<String> fieldNames(JsonNode event) {
        var names = new ArrayList<String>();
        event.fieldNames().forEachRemaining(names::add);
        return names;
    }
}
