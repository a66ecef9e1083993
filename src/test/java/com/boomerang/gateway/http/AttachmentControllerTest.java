package com.boomerang.gateway.http;

import com.boomerang.dispatch.RecordingSendClient;
import com.boomerang.gateway.GatewayFixtures;
import com.boomerang.gateway.MessengerGateway;
import com.boomerang.shared.model.MediaType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class AttachmentControllerTest {

    @TempDir
    Path tempDir;

    private MessengerGateway gateway;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        gateway = MessengerGateway.builder(GatewayFixtures.config()).sendClient(new RecordingSendClient()).build();
        gateway.start();
        mvc = MockMvcBuilders.standaloneSetup(new AttachmentController(gateway)).build();
    }

    @AfterEach
    void tearDown() {
        gateway.stop();
    }

    @Test
    void servesHostedFileOnce() throws Exception {
        var file = Files.write(tempDir.resolve("pixel.png"), new byte[] {(byte) 0x89, 'P', 'N', 'G'});
        var path = pathOf(gateway.hostAttachment(MediaType.IMAGE, file).url());

        mvc.perform(get(path))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Type", "image/png"))
                .andExpect(content().bytes(new byte[] {(byte) 0x89, 'P', 'N', 'G'}));
        mvc.perform(get(path)).andExpect(status().isNotFound());
    }

    @Test
    void unknownTokenIsNotFound() throws Exception {
        mvc.perform(get("/attachments/does-not-exist")).andExpect(status().isNotFound());
    }

    @Test
    void deletedFileIsNotFound() throws Exception {
        var file = Files.writeString(tempDir.resolve("gone.txt"), "bye");
        var path = pathOf(gateway.hostAttachment(MediaType.FILE, file).url());
        Files.delete(file);

        mvc.perform(get(path)).andExpect(status().isNotFound());
    }

    @Test
    void unknownExtensionFallsBackToOctetStream() throws Exception {
        var file = Files.writeString(tempDir.resolve("blob.zzz9"), "data");
        var path = pathOf(gateway.hostAttachment(MediaType.FILE, file).url());

        mvc.perform(get(path))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Type", "application/octet-stream"));
    }

    private static String pathOf(String url) {
        return url.substring("https://bot.example.com".length());
    }
}
