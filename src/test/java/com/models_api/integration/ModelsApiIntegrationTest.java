package com.models_api.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.models_api.database.TableStore;
import com.models_api.testsupport.Polling;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasItems;
import static org.springframework.http.MediaType.APPLICATION_JSON;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class ModelsApiIntegrationTest {

    @Autowired
    MockMvc mvc;

    @Autowired
    ObjectMapper om;

    @Autowired
    TableStore tableStore;

    @DynamicPropertySource
    static void modelsFolder(DynamicPropertyRegistry registry) {
        Path folder = Path.of(System.getProperty("java.io.tmpdir"), "models-api-it-" + UUID.randomUUID());
        registry.add("models.folder", folder::toString);
    }

    private JsonNode body(MvcResult result) throws Exception {
        return om.readTree(result.getResponse().getContentAsByteArray());
    }

    private String taskStatus(String name) throws Exception {
        return body(mvc.perform(get("/api/models/{name}/task", name)).andReturn()).path("data").path("status").asText();
    }

    private void awaitStatus(String name, String expected) throws Exception {
        Polling.waitUntil(Duration.ofSeconds(20), Duration.ofMillis(50), () -> expected.equals(taskStatus(name)));
    }

    private void create(String name) throws Exception {
        mvc.perform(post("/api/models")
                        .contentType(APPLICATION_JSON)
                        .content(om.writeValueAsString(Map.of("name", name, "type", "demo"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.name").value(name))
                .andExpect(jsonPath("$.data.loaded").value(false));
    }

    @Test
    void demoLifecycleThroughBackgroundTasks() throws Exception {
        create("m1");

        mvc.perform(post("/api/models/m1/input")
                        .contentType(APPLICATION_JSON)
                        .content("""
                                {"data":[{"a":1},{"a":3}]}
                                """))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.data.taskId").isNotEmpty())
                .andExpect(jsonPath("$.metadata.taskId").isNotEmpty());
        awaitStatus("m1", "SUCCESS");

        mvc.perform(get("/api/models/m1/task/result"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.result.rows").value(2));

        mvc.perform(post("/api/models/m1/output")
                        .contentType(APPLICATION_JSON)
                        .content("""
                                {"data":[{"a":10}]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].a_mean").value(2.0));

        mvc.perform(patch("/api/models/m1/metadata")
                        .contentType(APPLICATION_JSON)
                        .content("""
                                {"description":"running means"}
                                """))
                .andExpect(status().isAccepted());
        awaitStatus("m1", "SUCCESS");
        mvc.perform(get("/api/models/m1"))
                .andExpect(jsonPath("$.data.metadata.description").value("running means"));

        mvc.perform(delete("/api/models/m1")).andExpect(status().isAccepted());
        awaitStatus("m1", "SUCCESS");

        mvc.perform(get("/api/models/m1"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("NOT_FOUND"));
    }

    @Test
    void tableInputAndOutput() throws Exception {
        create("m2");
        tableStore.replaceTable("train_rows", List.of(Map.of("a", 2), Map.of("a", 4)));

        mvc.perform(post("/api/models/m2/input/table")
                        .contentType(APPLICATION_JSON)
                        .content("""
                                {"table":"train_rows"}
                                """))
                .andExpect(status().isAccepted());
        awaitStatus("m2", "SUCCESS");

        mvc.perform(post("/api/models/m2/output/table")
                        .contentType(APPLICATION_JSON)
                        .content("""
                                {"table":"train_rows","outputTable":"scored_rows"}
                                """))
                .andExpect(status().isAccepted());
        awaitStatus("m2", "SUCCESS");

        List<Map<String, Object>> scored = tableStore.readTable("scored_rows");
        assertThat(scored).hasSize(2);
        assertThat(scored).allSatisfy(row -> assertThat(row).containsEntry("a_mean", 3.0));
    }

    @Test
    void failuresAreRecordedNotThrown() throws Exception {
        create("m3");

        mvc.perform(post("/api/models/m3/output/task")
                        .contentType(APPLICATION_JSON)
                        .content("""
                                {"data":[{"a":1}]}
                                """))
                .andExpect(status().isAccepted());
        awaitStatus("m3", "FAILURE");

        mvc.perform(get("/api/models/m3/task"))
                .andExpect(jsonPath("$.data.error").value(containsString("not been trained")));
        mvc.perform(put("/api/models/m3/task/cancel"))
                .andExpect(status().isConflict());
        mvc.perform(delete("/api/models/m3/task")).andExpect(status().isOk());
        mvc.perform(get("/api/models/m3/task")).andExpect(status().isNotFound());
    }

    @Test
    void submissionErrorsAreReportedImmediately() throws Exception {
        mvc.perform(post("/api/models/ghost/input")
                        .contentType(APPLICATION_JSON)
                        .content("""
                                {"data":[{"a":1}]}
                                """))
                .andExpect(status().isNotFound());

        mvc.perform(post("/api/models")
                        .contentType(APPLICATION_JSON)
                        .content("""
                                {"name":"m4","type":"unknown"}
                                """))
                .andExpect(status().isBadRequest());

        create("m4");
        mvc.perform(post("/api/models")
                        .contentType(APPLICATION_JSON)
                        .content("""
                                {"name":"m4","type":"demo"}
                                """))
                .andExpect(status().isConflict());

        mvc.perform(get("/api/models"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value(hasItem("m4")));
        mvc.perform(get("/api/models/types"))
                .andExpect(jsonPath("$.data[*].type").value(hasItems("demo", "weka")));
    }
}
