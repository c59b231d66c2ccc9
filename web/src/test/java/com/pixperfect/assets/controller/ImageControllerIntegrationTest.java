package com.pixperfect.assets.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ImageControllerIntegrationTest {

    private static final Path STORAGE_DIR = createStorageDir();

    @DynamicPropertySource
    static void storageProperties(DynamicPropertyRegistry registry) {
        registry.add("assets.storage.directory", STORAGE_DIR::toString);
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private String aliceToken;
    private String bobToken;

    @BeforeEach
    void setUp() throws Exception {
        aliceToken = signupAndLogin("alice-" + UUID.randomUUID());
        bobToken = signupAndLogin("bob-" + UUID.randomUUID());
    }

    @Test
    void uploadListDeleteScenario() throws Exception {
        byte[] payload = fiveHundredBytes();

        JsonNode created = upload(aliceToken, new MockMultipartFile("image", "img.png", "image/png", payload));
        long id = created.get("id").asLong();
        String storageKey = created.get("storageKey").asText();
        assertEquals("Image uploaded successfully", created.get("message").asText());
        assertTrue(created.get("address").asText().endsWith("/uploads/" + storageKey));

        mockMvc.perform(get("/images").header(HttpHeaders.AUTHORIZATION, bearer(aliceToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].id").value(id));

        MvcResult stored = mockMvc.perform(get("/image/{id}/content", id)
                        .header(HttpHeaders.AUTHORIZATION, bearer(aliceToken)))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.IMAGE_PNG))
                .andReturn();
        assertArrayEquals(payload, stored.getResponse().getContentAsByteArray());

        mockMvc.perform(get("/uploads/" + storageKey))
                .andExpect(status().isOk());

        mockMvc.perform(delete("/image/{id}", id).header(HttpHeaders.AUTHORIZATION, bearer(aliceToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Image deleted successfully"));

        mockMvc.perform(get("/image/{id}", id).header(HttpHeaders.AUTHORIZATION, bearer(aliceToken)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("not_found"));
        assertFalse(Files.exists(STORAGE_DIR.resolve(storageKey)));

        // gone for every caller, not just the former owner
        mockMvc.perform(get("/image/{id}", id).header(HttpHeaders.AUTHORIZATION, bearer(bobToken)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("not_found"));
        mockMvc.perform(get("/image/{id}/content", id).header(HttpHeaders.AUTHORIZATION, bearer(bobToken)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("not_found"));
        mockMvc.perform(delete("/image/{id}", id).header(HttpHeaders.AUTHORIZATION, bearer(bobToken)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("not_found"));
        mockMvc.perform(delete("/image/{id}", id).header(HttpHeaders.AUTHORIZATION, bearer(aliceToken)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("not_found"));
    }

    @Test
    void missingTokenIsUnauthenticated() throws Exception {
        mockMvc.perform(get("/images"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("unauthenticated"));
    }

    @Test
    void invalidTokenIsForbidden() throws Exception {
        mockMvc.perform(get("/images").header(HttpHeaders.AUTHORIZATION, "Bearer not-a-token"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("forbidden"));
    }

    @Test
    void otherOwnersAssetLooksMissing() throws Exception {
        JsonNode created = upload(aliceToken, new MockMultipartFile("image", "img.png", "image/png", fiveHundredBytes()));
        long id = created.get("id").asLong();
        String storageKey = created.get("storageKey").asText();

        String missingBody = mockMvc.perform(get("/image/{id}", Long.MAX_VALUE)
                        .header(HttpHeaders.AUTHORIZATION, bearer(bobToken)))
                .andExpect(status().isNotFound())
                .andReturn().getResponse().getContentAsString();
        String foreignBody = mockMvc.perform(get("/image/{id}", id)
                        .header(HttpHeaders.AUTHORIZATION, bearer(bobToken)))
                .andExpect(status().isNotFound())
                .andReturn().getResponse().getContentAsString();
        JsonNode missing = objectMapper.readTree(missingBody);
        JsonNode foreign = objectMapper.readTree(foreignBody);
        assertEquals(missing.get("error"), foreign.get("error"));
        assertEquals(missing.get("message"), foreign.get("message"));

        mockMvc.perform(delete("/image/{id}", id).header(HttpHeaders.AUTHORIZATION, bearer(bobToken)))
                .andExpect(status().isNotFound());
        mockMvc.perform(multipart(HttpMethod.PUT, "/image")
                        .file(new MockMultipartFile("image", "evil.png", "image/png", new byte[]{1, 2, 3}))
                        .param("id", String.valueOf(id))
                        .header(HttpHeaders.AUTHORIZATION, bearer(bobToken)))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/images").header(HttpHeaders.AUTHORIZATION, bearer(bobToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));

        assertTrue(Files.exists(STORAGE_DIR.resolve(storageKey)));
        mockMvc.perform(get("/image/{id}", id).header(HttpHeaders.AUTHORIZATION, bearer(aliceToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.storageKey").value(storageKey));
    }

    @Test
    void invalidTransformParametersWriteNothing() throws Exception {
        long filesBefore = storedFileCount();
        MockMultipartFile image = new MockMultipartFile("image", "img.png", "image/png", png(4, 2));

        mockMvc.perform(multipart("/rotate").file(image).param("degrees", "abc")
                        .header(HttpHeaders.AUTHORIZATION, bearer(aliceToken)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_parameter"));
        mockMvc.perform(multipart("/flip").file(image).param("direction", "diagonal")
                        .header(HttpHeaders.AUTHORIZATION, bearer(aliceToken)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_parameter"));

        assertEquals(filesBefore, storedFileCount());
        mockMvc.perform(get("/images").header(HttpHeaders.AUTHORIZATION, bearer(aliceToken)))
                .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    void uploadWithoutFileIsBadRequest() throws Exception {
        mockMvc.perform(multipart("/upload").param("overlayProps", "{}")
                        .header(HttpHeaders.AUTHORIZATION, bearer(aliceToken)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("No image file provided"));
    }

    @Test
    void rotateStoresTransformedPng() throws Exception {
        MvcResult result = mockMvc.perform(multipart("/rotate")
                        .file(new MockMultipartFile("image", "photo.jpg", "image/png", png(4, 2)))
                        .param("degrees", "90")
                        .header(HttpHeaders.AUTHORIZATION, bearer(aliceToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Image rotated successfully"))
                .andReturn();
        JsonNode created = objectMapper.readTree(result.getResponse().getContentAsString());
        assertTrue(created.get("storageKey").asText().endsWith("-rotated-photo.png"));

        byte[] stored = Files.readAllBytes(STORAGE_DIR.resolve(created.get("storageKey").asText()));
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(stored));
        assertEquals(2, image.getWidth());
        assertEquals(4, image.getHeight());
    }

    @Test
    void flipUndecodableImageIsUnprocessable() throws Exception {
        mockMvc.perform(multipart("/flip")
                        .file(new MockMultipartFile("image", "img.png", "image/png", "not an image".getBytes()))
                        .param("direction", "horizontal")
                        .header(HttpHeaders.AUTHORIZATION, bearer(aliceToken)))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("unprocessable_asset"));
    }

    @Test
    void replaceSwapsBlobAndKeepsOmittedOverlay() throws Exception {
        JsonNode created = upload(aliceToken, new MockMultipartFile("image", "img.png", "image/png", fiveHundredBytes()));
        long id = created.get("id").asLong();
        String oldKey = created.get("storageKey").asText();

        mockMvc.perform(multipart(HttpMethod.PUT, "/image")
                        .file(new MockMultipartFile("image", "next.png", "image/png", new byte[]{1, 2, 3}))
                        .param("id", String.valueOf(id))
                        .param("textOverlay", "{\"content\":\"hello\"}")
                        .header(HttpHeaders.AUTHORIZATION, bearer(aliceToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Image updated successfully"));

        MvcResult result = mockMvc.perform(get("/image/{id}", id).header(HttpHeaders.AUTHORIZATION, bearer(aliceToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.overlayProps").value("{\"x\":10}"))
                .andExpect(jsonPath("$.textOverlay").value("{\"content\":\"hello\"}"))
                .andReturn();
        String newKey = objectMapper.readTree(result.getResponse().getContentAsString()).get("storageKey").asText();
        assertNotEquals(oldKey, newKey);
        assertTrue(newKey.endsWith("-next.png"));
        assertFalse(Files.exists(STORAGE_DIR.resolve(oldKey)));
        assertArrayEquals(new byte[]{1, 2, 3}, Files.readAllBytes(STORAGE_DIR.resolve(newKey)));

        mockMvc.perform(multipart(HttpMethod.PUT, "/image")
                        .param("id", String.valueOf(id))
                        .param("overlayProps", "{\"x\":20}")
                        .header(HttpHeaders.AUTHORIZATION, bearer(aliceToken)))
                .andExpect(status().isOk());
        mockMvc.perform(get("/image/{id}", id).header(HttpHeaders.AUTHORIZATION, bearer(aliceToken)))
                .andExpect(jsonPath("$.storageKey").value(newKey))
                .andExpect(jsonPath("$.overlayProps").value("{\"x\":20}"));
    }

    @Test
    void replaceWithNonNumericIdIsBadRequest() throws Exception {
        mockMvc.perform(multipart(HttpMethod.PUT, "/image")
                        .param("id", "abc")
                        .header(HttpHeaders.AUTHORIZATION, bearer(aliceToken)))
                .andExpect(status().isBadRequest());
    }

    @Test
    void duplicateSignupAndBadLoginAreRejected() throws Exception {
        String username = "carol-" + UUID.randomUUID();
        String body = credentials(username, "secret123");
        mockMvc.perform(post("/signup").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("User created successfully"));
        mockMvc.perform(post("/signup").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Username already exists"));
        mockMvc.perform(post("/login").contentType(MediaType.APPLICATION_JSON)
                        .content(credentials(username, "wrong-password")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid credentials"));
        mockMvc.perform(post("/signup").contentType(MediaType.APPLICATION_JSON)
                        .content(credentials("dave-" + UUID.randomUUID(), "123")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid_parameter"));
    }

    @Test
    void statusPageIsPublic() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(content().string("PixPerfect Backend is running!"));
    }

    private JsonNode upload(String token, MockMultipartFile file) throws Exception {
        MvcResult result = mockMvc.perform(multipart("/upload")
                        .file(file)
                        .param("overlayProps", "{\"x\":10}")
                        .header(HttpHeaders.AUTHORIZATION, bearer(token)))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private String signupAndLogin(String username) throws Exception {
        String body = credentials(username, "secret123");
        mockMvc.perform(post("/signup").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk());
        MvcResult result = mockMvc.perform(post("/login").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString()).get("token").asText();
    }

    private String credentials(String username, String password) throws Exception {
        return objectMapper.writeValueAsString(Map.of("username", username, "password", password));
    }

    private static String bearer(String token) {
        return "Bearer " + token;
    }

    private static long storedFileCount() throws IOException {
        try (Stream<Path> files = Files.list(STORAGE_DIR)) {
            return files.count();
        }
    }

    private static byte[] fiveHundredBytes() {
        byte[] data = new byte[500];
        Arrays.fill(data, (byte) 7);
        byte[] signature = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n'};
        System.arraycopy(signature, 0, data, 0, signature.length);
        return data;
    }

    private static byte[] png(int width, int height) throws IOException {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, "png", out);
        return out.toByteArray();
    }

    private static Path createStorageDir() {
        try {
            return Files.createTempDirectory("assets-it-");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
