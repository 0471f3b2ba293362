package io.b2mash.boq.taxonomy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import io.b2mash.boq.TestcontainersConfiguration;
import io.b2mash.boq.audit.AuditService;
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
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.testcontainers.junit.jupiter.Testcontainers;

/** A failure at the end of a category delete must leave the whole graph in place. */
@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
@Testcontainers(disabledWithoutDocker = true)
class CategoryCascadeRollbackIntegrationTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private CategoryService categoryService;
  @Autowired private CategoryRepository categoryRepository;
  @Autowired private SubcategoryRepository subcategoryRepository;
  @Autowired private ProductRepository productRepository;
  @Autowired private MaterialTemplateRepository templateRepository;
  @Autowired private MaterialSubmissionRepository submissionRepository;
  @Autowired private MaterialRepository materialRepository;

  @MockitoBean private AuditService auditService;

  @Test
  void failedCategoryDeleteRollsBackEveryChildDelete() throws Exception {
    UUID categoryId = UUID.fromString(create("/api/categories", "{\"name\": \"Rollback Roofing\"}"));
    UUID subcategoryId =
        UUID.fromString(
            create(
                "/api/subcategories",
                """
                {"name": "Rollback Sheets", "categoryId": "%s"}
                """
                    .formatted(categoryId)));
    UUID productId =
        UUID.fromString(
            create(
                "/api/products",
                """
                {"name": "Rollback Metal Sheet", "subcategoryId": "%s"}
                """
                    .formatted(subcategoryId)));
    UUID templateId =
        UUID.fromString(
            create(
                "/api/material-templates",
                """
                {"name": "Rollback Sheet Screw", "code": "RBK-SCR-01", "categoryId": "%s"}
                """
                    .formatted(categoryId)));
    String shopId = create("/api/shops", "{\"name\": \"Rollback Roofing Mart\"}");
    UUID submissionId =
        UUID.fromString(
            create(
                "/api/material-submissions",
                """
                {"templateId": "%s", "shopId": "%s", "rate": 12, "subcategory": "Rollback Sheets"}
                """
                    .formatted(templateId, shopId)));
    MvcResult approval =
        mockMvc
            .perform(
                post("/api/material-submissions/" + submissionId + "/approve")
                    .with(TestJwts.admin()))
            .andExpect(status().isOk())
            .andReturn();
    UUID materialId =
        UUID.fromString(
            JsonPath.read(approval.getResponse().getContentAsString(), "$.material.id"));

    doThrow(new IllegalStateException("audit store unavailable"))
        .when(auditService)
        .log(argThat(event -> "category.deleted".equals(event.eventType())));

    assertThatThrownBy(() -> categoryService.deleteCategory(categoryId))
        .isInstanceOf(IllegalStateException.class);

    assertThat(categoryRepository.existsById(categoryId)).isTrue();
    assertThat(subcategoryRepository.existsById(subcategoryId)).isTrue();
    assertThat(templateRepository.existsById(templateId)).isTrue();
    assertThat(submissionRepository.findById(submissionId).orElseThrow().getMaterialId())
        .isEqualTo(materialId);
    var material = materialRepository.findById(materialId).orElseThrow();
    assertThat(material.getCategoryId()).isEqualTo(categoryId);
    assertThat(material.getSubcategoryId()).isEqualTo(subcategoryId);
    assertThat(productRepository.findById(productId).orElseThrow().getSubcategoryId())
        .isEqualTo(subcategoryId);
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
    String location = result.getResponse().getHeader("Location");
    return location.substring(location.lastIndexOf('/') + 1);
  }
}
