package com.boomerang.gateway.http;

import com.boomerang.gateway.MessengerGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.nio.file.Files;

/** Serves files hosted through the attachment cache to the platform's fetcher. */
@RestController
public class AttachmentController {

    private static final Logger log = LoggerFactory.getLogger(AttachmentController.class);

    private final MessengerGateway gateway;

    public AttachmentController(MessengerGateway gateway) {
        this.gateway = gateway;
    }

    @GetMapping("/attachments/{token}")
    public ResponseEntity<byte[]> serve(@PathVariable String token) {
        var entry = gateway.attachments().claim(token);
        if (entry.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        // path is held from here on; a concurrent sweep only drops the cache entry
        var path = entry.get().path();
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            log.warn("Hosted attachment {} is no longer readable: {}", path, e.getMessage());
            return ResponseEntity.notFound().build();
        }
        var contentType = MediaTypeFactory.getMediaType(new FileSystemResource(path))
                .orElse(MediaType.APPLICATION_OCTET_STREAM);
        return ResponseEntity.ok().contentType(contentType).body(bytes);
    }
}
