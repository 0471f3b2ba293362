package io.b2mash.boq.boq;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import io.b2mash.boq.TestcontainersConfiguration;
import io.b2mash.boq.testutil.TestJwts;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
@Testcontainers(disabledWithoutDocker = true)
class BoqIntegrationTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private BoqItemRepository itemRepository;
  @Autowired private BoqVersionRepository versionRepository;
  @Autowired private BoqProjectRepository projectRepository;

  @Test
  void deleteVersion_removesItsItemsAndKeepsProject() throws Exception {
    String projectId = createProject("Delete Version Project");
    String versionId = createVersion(projectId, null);
    addItem(projectId, versionId, "flooring", "{\"qty\": 10}");

    mockMvc
        .perform(delete("/api/boq-versions/" + versionId).with(estimator()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.message").exists());

    assertThat(itemRepository.countByVersionId(UUID.fromString(versionId))).isZero();
    assertThat(versionRepository.existsById(UUID.fromString(versionId))).isFalse();
    mockMvc
        .perform(get("/api/boq-projects/" + projectId).with(estimator()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.name").value("Delete Version Project"));
  }

  @Test
  void versionsAreNumberedPerProjectNewestFirst() throws Exception {
    String projectId = createProject("Numbering Project");
    String otherProjectId = createProject("Numbering Other Project");
    createVersion(projectId, null);
    createVersion(projectId, null);
    createVersion(otherProjectId, null);
    createVersion(projectId, null);

    mockMvc
        .perform(get("/api/boq-projects/" + projectId + "/versions").with(estimator()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.versions.length()").value(3))
        .andExpect(jsonPath("$.versions[0].versionNumber").value(3))
        .andExpect(jsonPath("$.versions[2].versionNumber").value(1))
        .andExpect(jsonPath("$.versions[0].status").value("draft"))
        .andExpect(jsonPath("$.versions[0].projectName").value("Numbering Project"));

    mockMvc
        .perform(get("/api/boq-projects/" + otherProjectId + "/versions").with(estimator()))
        .andExpect(jsonPath("$.versions[0].versionNumber").value(1));
  }

  @Test
  void copiedVersionHasEqualContentAndIndependentRows() throws Exception {
    String projectId = createProject("Copy Project");
    String v1 = createVersion(projectId, null);
    String itemId = addItem(projectId, v1, "painting", "{\"area\": 120, \"coats\": 2}");

    String v2 = createVersion(projectId, v1);

    var copyResult =
        mockMvc
            .perform(get("/api/boq-versions/" + v2 + "/items").with(estimator()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.items.length()").value(1))
            .andExpect(jsonPath("$.items[0].estimator").value("painting"))
            .andExpect(jsonPath("$.items[0].tableData.area").value(120))
            .andReturn();
    String copyId = JsonPath.read(copyResult.getResponse().getContentAsString(), "$.items[0].id");
    assertThat(copyId).isNotEqualTo(itemId);

    mockMvc
        .perform(
            put("/api/boq-items/" + copyId)
                .with(estimator())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"tableData": {"area": 80, "coats": 3}}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.tableData.area").value(80));

    mockMvc
        .perform(get("/api/boq-versions/" + v1 + "/items").with(estimator()))
        .andExpect(jsonPath("$.items[0].id").value(itemId))
        .andExpect(jsonPath("$.items[0].tableData.area").value(120));
  }

  @Test
  void copyFromVersionOfAnotherProject_returns400() throws Exception {
    String projectId = createProject("Copy Guard Project");
    String foreignProjectId = createProject("Copy Guard Foreign");
    String foreignVersion = createVersion(foreignProjectId, null);

    mockMvc
        .perform(
            post("/api/boq-versions")
                .with(estimator())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"projectId": "%s", "copyFromVersionId": "%s"}
                    """
                        .formatted(projectId, foreignVersion)))
        .andExpect(status().isBadRequest());
  }

  @Test
  void itemListingsHideRowsNotAddedByUsers() throws Exception {
    String projectId = createProject("Visibility Project");
    String versionId = createVersion(projectId, null);
    addItem(projectId, versionId, "doors", "{\"count\": 4}");

    var hidden =
        new BoqItem(UUID.fromString(projectId), UUID.fromString(versionId), "doors", Map.of());
    ReflectionTestUtils.setField(hidden, "userAdded", false);
    itemRepository.save(hidden);

    mockMvc
        .perform(get("/api/boq-versions/" + versionId + "/items").with(estimator()))
        .andExpect(jsonPath("$.items.length()").value(1))
        .andExpect(jsonPath("$.items[0].userAdded").value(true));
    mockMvc
        .perform(get("/api/boq-projects/" + projectId + "/items").with(estimator()))
        .andExpect(jsonPath("$.items.length()").value(1));
  }

  @Test
  void submittedVersionIsLocked() throws Exception {
    String projectId = createProject("Locked Version Project");
    String versionId = createVersion(projectId, null);
    String itemId = addItem(projectId, versionId, "electrical", "{\"points\": 12}");

    mockMvc
        .perform(
            put("/api/boq-versions/" + versionId)
                .with(estimator())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"status": "submitted"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("submitted"));

    mockMvc
        .perform(
            post("/api/boq-items")
                .with(estimator())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"projectId": "%s", "versionId": "%s", "estimator": "electrical", "tableData": {}}
                    """
                        .formatted(projectId, versionId)))
        .andExpect(status().isBadRequest());
    mockMvc
        .perform(delete("/api/boq-items/" + itemId).with(estimator()))
        .andExpect(status().isBadRequest());
    mockMvc
        .perform(
            put("/api/boq-versions/" + versionId + "/edits")
                .with(estimator())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"editedFields": {"row-1": {"rate": 500}}}
                    """))
        .andExpect(status().isBadRequest());
    mockMvc
        .perform(
            put("/api/boq-versions/" + versionId)
                .with(estimator())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"status": "draft"}
                    """))
        .andExpect(status().isBadRequest());
  }

  @Test
  void editedFieldsRoundTripOnDraftVersion() throws Exception {
    String projectId = createProject("Edits Project");
    String versionId = createVersion(projectId, null);

    mockMvc
        .perform(
            put("/api/boq-versions/" + versionId + "/edits")
                .with(estimator())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"editedFields": {"row-1": {"rate": 500}}}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.editedFields['row-1'].rate").value(500));

    mockMvc
        .perform(get("/api/boq-versions/" + versionId + "/edits").with(estimator()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.editedFields['row-1'].rate").value(500));
  }

  @Test
  void projectStatusMovesForwardOnly() throws Exception {
    String projectId = createProject("Status Project");

    updateProjectStatus(projectId, "finalized").andExpect(status().isOk());
    updateProjectStatus(projectId, "finalized")
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("finalized"));
    updateProjectStatus(projectId, "draft").andExpect(status().isBadRequest());
    updateProjectStatus(projectId, "archived").andExpect(status().isBadRequest());
  }

  @Test
  void deleteProject_cascadesToVersionsAndItems() throws Exception {
    String projectId = createProject("Cascade Project");
    String v1 = createVersion(projectId, null);
    addItem(projectId, v1, "plumbing", "{\"points\": 3}");
    addItem(projectId, null, "plumbing", "{\"points\": 1}");

    mockMvc
        .perform(delete("/api/boq-projects/" + projectId).with(estimator()))
        .andExpect(status().isOk());

    assertThat(projectRepository.existsById(UUID.fromString(projectId))).isFalse();
    assertThat(versionRepository.existsById(UUID.fromString(v1))).isFalse();
    mockMvc
        .perform(get("/api/boq-projects/" + projectId).with(estimator()))
        .andExpect(status().isNotFound());
  }

  @Test
  void unknownIdsReturn404() throws Exception {
    mockMvc
        .perform(get("/api/boq-projects/" + UUID.randomUUID()).with(estimator()))
        .andExpect(status().isNotFound());
    mockMvc
        .perform(get("/api/boq-versions/" + UUID.randomUUID() + "/items").with(estimator()))
        .andExpect(status().isNotFound());
    mockMvc
        .perform(delete("/api/boq-items/" + UUID.randomUUID()).with(estimator()))
        .andExpect(status().isNotFound());
  }

  @Test
  void anonymousCallerIsRejected() throws Exception {
    mockMvc.perform(get("/api/boq-projects")).andExpect(status().isUnauthorized());
  }

  @Test
  void missingProjectIdReturns400() throws Exception {
    mockMvc
        .perform(
            post("/api/boq-items")
                .with(estimator())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"estimator": "flooring", "tableData": {}}
                    """))
        .andExpect(status().isBadRequest());
  }

  // --- Helpers ---

  private String createProject(String name) throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/boq-projects")
                    .with(estimator())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"name": "%s", "client": "Kapoor", "budget": 250000, "location": "Nashik"}
                        """
                            .formatted(name)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.status").value("draft"))
            .andReturn();
    return extractIdFromLocation(result);
  }

  private String createVersion(String projectId, String copyFrom) throws Exception {
    String body =
        copyFrom == null
            ? "{\"projectId\": \"%s\"}".formatted(projectId)
            : "{\"projectId\": \"%s\", \"copyFromVersionId\": \"%s\"}".formatted(projectId, copyFrom);
    var result =
        mockMvc
            .perform(
                post("/api/boq-versions")
                    .with(estimator())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(body))
            .andExpect(status().isCreated())
            .andReturn();
    return extractIdFromLocation(result);
  }

  private String addItem(String projectId, String versionId, String estimator, String tableData)
      throws Exception {
    String version = versionId == null ? "null" : "\"" + versionId + "\"";
    var result =
        mockMvc
            .perform(
                post("/api/boq-items")
                    .with(estimator())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"projectId": "%s", "versionId": %s, "estimator": "%s", "tableData": %s}
                        """
                            .formatted(projectId, version, estimator, tableData)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.userAdded").value(true))
            .andReturn();
    return extractIdFromLocation(result);
  }

  private ResultActions updateProjectStatus(
      String projectId, String status) throws Exception {
    return mockMvc.perform(
        put("/api/boq-projects/" + projectId)
            .with(estimator())
            .contentType(MediaType.APPLICATION_JSON)
            .content(
                """
                {"status": "%s"}
                """
                    .formatted(status)));
  }

  private String extractIdFromLocation(MvcResult result) {
    String location = result.getResponse().getHeader("Location");
    return location.substring(location.lastIndexOf('/') + 1);
  }

  private JwtRequestPostProcessor estimator() {
    return TestJwts.as("user_estimator", "contractor");
  }
}
