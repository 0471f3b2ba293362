package io.b2mash.boq.taxonomy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import io.b2mash.boq.TestcontainersConfiguration;
import io.b2mash.boq.material.MaterialRepository;
import io.b2mash.boq.submission.MaterialSubmissionRepository;
import io.b2mash.boq.template.MaterialTemplateRepository;
import io.b2mash.boq.testutil.TestJwts;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
@Testcontainers(disabledWithoutDocker = true)
class TaxonomyIntegrationTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private MaterialRepository materialRepository;
  @Autowired private MaterialTemplateRepository templateRepository;
  @Autowired private MaterialSubmissionRepository submissionRepository;
  @Autowired private SubcategoryRepository subcategoryRepository;

  @Test
  void deleteCategoryRemovesEverythingUnderItInOneGo() throws Exception {
    String categoryId = createCategory("Cascade Flooring");
    String subcategoryId = createSubcategory("Cascade Vitrified", categoryId);
    String productId = createProduct("Cascade Tile 600x600", subcategoryId);
    String templateId =
        create(
            "/api/material-templates",
            """
            {"name": "Cascade Tile Grout", "code": "CAS-GRT-01", "categoryId": "%s"}
            """
                .formatted(categoryId));
    String shopId =
        create(
            "/api/shops",
            """
            {"name": "Cascade Tile House"}
            """);
    String submissionId =
        create(
            "/api/material-submissions",
            """
            {"templateId": "%s", "shopId": "%s", "rate": 120, "subcategory": "Cascade Vitrified"}
            """
                .formatted(templateId, shopId));

    var approval =
        mockMvc
            .perform(
                post("/api/material-submissions/" + submissionId + "/approve")
                    .with(TestJwts.admin()))
            .andExpect(status().isOk())
            .andReturn();
    String materialId =
        JsonPath.read(approval.getResponse().getContentAsString(), "$.material.id");
    mockMvc
        .perform(get("/api/materials/" + materialId))
        .andExpect(jsonPath("$.material.categoryId").value(categoryId))
        .andExpect(jsonPath("$.material.subcategoryId").value(subcategoryId));

    mockMvc
        .perform(delete("/api/categories/" + categoryId).with(TestJwts.admin()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.message").exists())
        .andExpect(jsonPath("$.category.name").value("Cascade Flooring"));

    UUID category = UUID.fromString(categoryId);
    assertThat(materialRepository.countByCategoryId(category)).isZero();
    assertThat(materialRepository.existsById(UUID.fromString(materialId))).isFalse();
    assertThat(templateRepository.existsById(UUID.fromString(templateId))).isFalse();
    assertThat(submissionRepository.existsById(UUID.fromString(submissionId))).isFalse();
    assertThat(subcategoryRepository.findIdsByCategoryId(category)).isEmpty();

    mockMvc
        .perform(get("/api/categories"))
        .andExpect(jsonPath("$.categories[*].id", not(hasItem(categoryId))));
    mockMvc
        .perform(get("/api/products/" + productId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.product.subcategoryId").doesNotExist());
    mockMvc.perform(get("/api/shops/" + shopId)).andExpect(status().isOk());
  }

  @Test
  void duplicateCategoryNameIsConflict() throws Exception {
    createCategory("Duplicate Roofing");

    mockMvc
        .perform(
            post("/api/categories")
                .with(TestJwts.admin())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": "  Duplicate Roofing "}
                    """))
        .andExpect(status().isConflict());
  }

  @Test
  void renameCategoryKeepsSubcategoriesAttached() throws Exception {
    String categoryId = createCategory("Rename Glazing");
    createSubcategory("Rename Float Glass", categoryId);

    mockMvc
        .perform(
            put("/api/categories/" + categoryId)
                .with(TestJwts.admin())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": "Renamed Glazing"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.category.name").value("Renamed Glazing"));

    mockMvc
        .perform(get("/api/material-subcategories/{name}", "Renamed Glazing"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.subcategories", hasItem("Rename Float Glass")));
  }

  @Test
  void duplicateSubcategoryWithinCategoryIsConflict() throws Exception {
    String first = createCategory("Subcat Dup One");
    String second = createCategory("Subcat Dup Two");
    createSubcategory("Shared Name", first);
    createSubcategory("Shared Name", second);

    mockMvc
        .perform(
            post("/api/subcategories")
                .with(TestJwts.admin())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": "Shared Name", "categoryId": "%s"}
                    """
                        .formatted(first)))
        .andExpect(status().isConflict());
  }

  @Test
  void deleteSubcategoryDetachesProducts() throws Exception {
    String categoryId = createCategory("Detach Hardware");
    String subcategoryId = createSubcategory("Detach Hinges", categoryId);
    String productId = createProduct("Detach Butt Hinge 4in", subcategoryId);

    mockMvc
        .perform(delete("/api/subcategories/" + subcategoryId).with(TestJwts.admin()))
        .andExpect(status().isOk());

    mockMvc
        .perform(get("/api/products/" + productId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.product.name").value("Detach Butt Hinge 4in"))
        .andExpect(jsonPath("$.product.subcategoryId").doesNotExist());
  }

  @Test
  void duplicateProductNameIsConflict() throws Exception {
    createProduct("Duplicate Ball Valve", null);

    mockMvc
        .perform(
            post("/api/products")
                .with(TestJwts.purchaseTeam())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": " Duplicate Ball Valve "}
                    """))
        .andExpect(status().isConflict());
  }

  @Test
  void updateProductMovesItToAnotherSubcategory() throws Exception {
    String categoryId = createCategory("Update Sanitary");
    String basins = createSubcategory("Update Basins", categoryId);
    String taps = createSubcategory("Update Taps", categoryId);
    String productId = createProduct("Update Pillar Cock", basins);
    createProduct("Update Taken Name", taps);

    mockMvc
        .perform(
            put("/api/products/" + productId)
                .with(TestJwts.purchaseTeam())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": "Update Pillar Tap", "subcategoryId": "%s", "description": "chrome"}
                    """
                        .formatted(taps)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.product.name").value("Update Pillar Tap"))
        .andExpect(jsonPath("$.product.subcategoryId").value(taps))
        .andExpect(jsonPath("$.product.description").value("chrome"));

    mockMvc
        .perform(
            put("/api/products/" + productId)
                .with(TestJwts.purchaseTeam())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": "Update Taken Name"}
                    """))
        .andExpect(status().isConflict());
    mockMvc
        .perform(
            put("/api/products/" + UUID.randomUUID())
                .with(TestJwts.purchaseTeam())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": "Update Ghost"}
                    """))
        .andExpect(status().isNotFound());
  }

  @Test
  void deleteProductClearsMaterialReference() throws Exception {
    String productId = createProduct("Delete Gate Valve 25mm", null);
    String shopId =
        create(
            "/api/shops",
            """
            {"name": "Delete Product Plumbers"}
            """);
    String materialId =
        create(
            "/api/materials",
            """
            {"name": "Delete Gate Valve Brass", "shopId": "%s", "productId": "%s"}
            """
                .formatted(shopId, productId));

    mockMvc
        .perform(delete("/api/products/" + productId).with(TestJwts.endUser()))
        .andExpect(status().isForbidden());
    mockMvc
        .perform(delete("/api/products/" + productId).with(TestJwts.purchaseTeam()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.message").value("Product deleted"));

    mockMvc.perform(get("/api/products/" + productId)).andExpect(status().isNotFound());
    var material = materialRepository.findById(UUID.fromString(materialId)).orElseThrow();
    assertThat(material.getProductId()).isNull();
    assertThat(material.getName()).isEqualTo("Delete Gate Valve Brass");
  }

  @Test
  void taxonomyMutationsNeedAdminOrSoftwareTeam() throws Exception {
    mockMvc
        .perform(
            post("/api/categories")
                .with(TestJwts.purchaseTeam())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": "Forbidden Category"}
                    """))
        .andExpect(status().isForbidden());
    mockMvc
        .perform(
            post("/api/categories")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": "Anonymous Category"}
                    """))
        .andExpect(status().isUnauthorized());
    mockMvc
        .perform(
            post("/api/categories")
                .with(TestJwts.as("user_software", "software_team"))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": "Software Team Category"}
                    """))
        .andExpect(status().isCreated());
  }

  @Test
  void blankCategoryNameIsRejected() throws Exception {
    mockMvc
        .perform(
            post("/api/categories")
                .with(TestJwts.admin())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": "   "}
                    """))
        .andExpect(status().isBadRequest());
  }

  @Test
  void unknownCategoryDeleteIs404() throws Exception {
    mockMvc
        .perform(delete("/api/categories/" + UUID.randomUUID()).with(TestJwts.admin()))
        .andExpect(status().isNotFound());
  }

  // --- Helpers ---

  private String createCategory(String name) throws Exception {
    return create(
        "/api/categories",
        """
        {"name": "%s"}
        """
            .formatted(name));
  }

  private String createSubcategory(String name, String categoryId) throws Exception {
    return create(
        "/api/subcategories",
        """
        {"name": "%s", "categoryId": "%s"}
        """
            .formatted(name, categoryId));
  }

  private String createProduct(String name, String subcategoryId) throws Exception {
    String subcategory = subcategoryId != null ? "\"" + subcategoryId + "\"" : "null";
    return create(
        "/api/products",
        """
        {"name": "%s", "subcategoryId": %s, "description": "test product"}
        """
            .formatted(name, subcategory));
  }

  private String create(String path, String body) throws Exception {
    var result =
        mockMvc
            .perform(
                post(path)
                    .with(TestJwts.admin())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(body))
            .andExpect(status().isCreated())
            .andReturn();
    return extractIdFromLocation(result);
  }

  private String extractIdFromLocation(MvcResult result) {
    String location = result.getResponse().getHeader("Location");
    return location.substring(location.lastIndexOf('/') + 1);
  }
}
