package com.boomerang.gateway.http;

import com.boomerang.gateway.MessengerGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class WebhookController {

    private static final Logger log = LoggerFactory.getLogger(WebhookController.class);
    static final String EVENT_RECEIVED = "EVENT_RECEIVED";

    private final MessengerGateway gateway;

    public WebhookController(MessengerGateway gateway) {
        this.gateway = gateway;
    }

    @GetMapping(value = "/webhook", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> verify(@RequestParam(name = "hub.mode", required = false) String mode,
                                         @RequestParam(name = "hub.verify_token", required = false) String token,
                                         @RequestParam(name = "hub.challenge", required = false) String challenge) {
        if (challenge == null || !gateway.verifySubscription(mode, token)) {
            log.warn("Subscription verification failed (mode={})", mode);
            return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
        }
        log.info("Webhook subscription verified");
        return ResponseEntity.ok(challenge);
    }

    @PostMapping(value = "/webhook", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> receive(@RequestBody(required = false) byte[] body,
                                          @RequestHeader HttpHeaders headers) {
        var result = gateway.ingest(body != null ? body : new byte[0],
                headers.getFirst(gateway.signatureHeaderName()));
        return switch (result.status()) {
            case REJECTED_SIGNATURE -> ResponseEntity.status(HttpStatus.FORBIDDEN).build();
            case UNAVAILABLE -> ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
            case ACCEPTED -> {
                if (result.malformed() > 0) {
                    log.info("Accepted {} update(s), skipped {} malformed event(s)",
                            result.dispatched(), result.malformed());
                }
                yield ResponseEntity.ok(EVENT_RECEIVED);
            }
        };
    }
}
