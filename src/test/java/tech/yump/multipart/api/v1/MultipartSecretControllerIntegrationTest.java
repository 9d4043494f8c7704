package tech.yump.multipart.api.v1;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import tech.yump.multipart.storage.PartStore;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.is;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test") // Filesystem store with 64 byte parts
class MultipartSecretControllerIntegrationTest {

    // Shared by all tests; every test works on its own base name
    @TempDir
    static Path tempStorageDir;

    @DynamicPropertySource
    static void overrideProperties(DynamicPropertyRegistry registry) {
        registry.add("multipart.store.filesystem.path", () -> tempStorageDir.toAbsolutePath().toString());
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private PartStore partStore;

    private void seed(String name, String json) {
        partStore.upsertPart(name, json.getBytes(StandardCharsets.UTF_8), Map.of());
    }

    private String stored(String name) throws Exception {
        return Files.readString(tempStorageDir.resolve(name + ".json"));
    }

    @Test
    @DisplayName("Adding keys past the part size spills into a new overflow part")
    void addKeys_growsIntoOverflowPart() throws Exception {
        seed("it/grow", "{\"a\":\"1\"}");
        String forty = "x".repeat(40);

        mockMvc.perform(put("/v1/multipart/it/grow")
                        .param("env", "staging")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"b\":\"" + forty + "\",\"c\":\"" + forty + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.baseName", is("it/grow")))
                .andExpect(jsonPath("$.totalKeys", is(3)))
                .andExpect(jsonPath("$.totalParts", is(2)))
                .andExpect(jsonPath("$.createdParts[0]", is("it/grow-1")));

        assertThat(stored("it/grow")).isEqualTo("{\"a\":\"1\",\"b\":\"" + forty + "\"}");
        assertThat(stored("it/grow-1")).isEqualTo("{\"c\":\"" + forty + "\"}");

        Map<String, String> tags = objectMapper.readValue(
                tempStorageDir.resolve(".tags/it/grow-1.json").toFile(), new TypeReference<Map<String, String>>() {});
        assertThat(tags)
                .containsEntry("temp:env", "staging")
                .containsEntry("temp:feature", "multipart_secret_management_v2");

        mockMvc.perform(get("/v1/multipart/keys/it/grow"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalKeys", is(3)))
                .andExpect(jsonPath("$.keys[2]", is("c")));

        mockMvc.perform(get("/v1/multipart/find/it/grow").param("path", "c"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.partIndex", is(1)))
                .andExpect(jsonPath("$.partName", is("it/grow-1")));

        mockMvc.perform(get("/v1/multipart/find/it/grow").param("path", "zzz"))
                .andExpect(status().isNotFound());
    }

    @Test
    void addKeys_existingKey_conflictsAndLeavesPartsUntouched() throws Exception {
        seed("it/conflict", "{\"a\":\"1\"}");

        mockMvc.perform(put("/v1/multipart/it/conflict")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"a\":\"2\",\"b\":\"3\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.title", is("Key Exists")));

        assertThat(stored("it/conflict")).isEqualTo("{\"a\":\"1\"}");
    }

    @Test
    void updateKeys_atPath() throws Exception {
        seed("it/nested", "{\"Db\":{\"User\":\"x\"}}");

        mockMvc.perform(patch("/v1/multipart/it/nested")
                        .param("path", "Db")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"User\":\"y\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalKeys", is(1)));

        assertThat(stored("it/nested")).isEqualTo("{\"Db\":{\"User\":\"y\"}}");

        mockMvc.perform(put("/v1/multipart/it/nested")
                        .param("path", "Missing.Key")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"k\":\"v\"}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void addKeys_missingBase_returnsNotFound() throws Exception {
        mockMvc.perform(put("/v1/multipart/it/absent")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"a\":\"1\"}"))
                .andExpect(status().isNotFound());

        assertThat(Files.exists(tempStorageDir.resolve("it/absent.json"))).isFalse();
    }

    @Test
    void addKeys_tooLargeForAPart_returnsUnprocessable() throws Exception {
        seed("it/large", "{\"a\":\"1\"}");

        mockMvc.perform(put("/v1/multipart/it/large")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"k\":\"" + "x".repeat(100) + "\"}"))
                .andExpect(status().isUnprocessableEntity());
    }

    @Test
    void addKeys_overflowPartName_returnsBadRequest() throws Exception {
        mockMvc.perform(put("/v1/multipart/it/grow-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"a\":\"1\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void partitioningInfo_reflectsConfiguration() throws Exception {
        mockMvc.perform(get("/sys/partitioning"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.backend", is("FILESYSTEM")))
                .andExpect(jsonPath("$.maxPartBytes", is(64)))
                .andExpect(jsonPath("$.maxOverflowParts", is(3)));

        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("OK")));
    }
}
