package io.b2mash.boq.template;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.boq.audit.AuditService;
import io.b2mash.boq.exception.InvalidStateException;
import io.b2mash.boq.exception.ResourceConflictException;
import io.b2mash.boq.exception.ResourceNotFoundException;
import io.b2mash.boq.material.MaterialRepository;
import io.b2mash.boq.submission.MaterialSubmissionRepository;
import io.b2mash.boq.taxonomy.CategoryRepository;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class MaterialTemplateServiceTest {

  private static final UUID TEMPLATE_ID = UUID.randomUUID();

  @Mock private MaterialTemplateRepository templateRepository;
  @Mock private CategoryRepository categoryRepository;
  @Mock private MaterialSubmissionRepository submissionRepository;
  @Mock private MaterialRepository materialRepository;
  @Mock private AuditService auditService;
  @InjectMocks private MaterialTemplateService service;

  @Test
  void createTemplate_trimsNameAndCode() {
    when(templateRepository.existsByName("Cement")).thenReturn(false);
    when(templateRepository.existsByCode("CEM-01")).thenReturn(false);
    when(templateRepository.saveAndFlush(any(MaterialTemplate.class)))
        .thenAnswer(i -> i.getArgument(0));

    var template = service.createTemplate(" Cement ", " CEM-01", null);

    assertThat(template.getName()).isEqualTo("Cement");
    assertThat(template.getCode()).isEqualTo("CEM-01");
    assertThat(template.getCategoryId()).isNull();
  }

  @Test
  void createTemplate_duplicateCode_throwsConflict() {
    when(templateRepository.existsByName("Cement")).thenReturn(false);
    when(templateRepository.existsByCode("CEM-01")).thenReturn(true);

    assertThatThrownBy(() -> service.createTemplate("Cement", "CEM-01", null))
        .isInstanceOf(ResourceConflictException.class);
    verify(templateRepository, never()).saveAndFlush(any());
  }

  @Test
  void createTemplate_unknownCategory_throwsNotFound() {
    var categoryId = UUID.randomUUID();
    when(categoryRepository.existsById(categoryId)).thenReturn(false);

    assertThatThrownBy(() -> service.createTemplate("Cement", "CEM-01", categoryId))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void createTemplate_blankCode_rejected() {
    assertThatThrownBy(() -> service.createTemplate("Cement", "  ", null))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void updateTemplate_nothingGiven_rejected() {
    assertThatThrownBy(() -> service.updateTemplate(TEMPLATE_ID, " ", null))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void updateTemplate_sameValues_doesNotSave() {
    var template = template("Cement", "CEM-01");
    when(templateRepository.findById(TEMPLATE_ID)).thenReturn(Optional.of(template));

    var result = service.updateTemplate(TEMPLATE_ID, "Cement", "CEM-01");

    assertThat(result).isSameAs(template);
    verify(templateRepository, never()).saveAndFlush(any());
  }

  @Test
  void updateTemplate_codeTakenByAnother_throwsConflict() {
    when(templateRepository.findById(TEMPLATE_ID))
        .thenReturn(Optional.of(template("Cement", "CEM-01")));
    when(templateRepository.existsByCodeAndIdNot("CEM-02", TEMPLATE_ID)).thenReturn(true);

    assertThatThrownBy(() -> service.updateTemplate(TEMPLATE_ID, null, "CEM-02"))
        .isInstanceOf(ResourceConflictException.class);
  }

  @Test
  void deleteTemplate_unlinksSubmissionsBeforeDeletingMaterials() {
    var materialId = UUID.randomUUID();
    when(templateRepository.findById(TEMPLATE_ID))
        .thenReturn(Optional.of(template("Cement", "CEM-01")));
    when(materialRepository.findIdsByTemplateId(TEMPLATE_ID)).thenReturn(List.of(materialId));

    service.deleteTemplate(TEMPLATE_ID);

    var order = inOrder(submissionRepository, materialRepository, templateRepository);
    order.verify(submissionRepository).deleteByTemplateId(TEMPLATE_ID);
    order.verify(submissionRepository).unlinkMaterials(List.of(materialId));
    order.verify(materialRepository).deleteByIdIn(List.of(materialId));
    order.verify(templateRepository).deleteById(TEMPLATE_ID);
  }

  @Test
  void deleteTemplate_withoutMaterials_skipsMaterialDelete() {
    when(templateRepository.findById(TEMPLATE_ID))
        .thenReturn(Optional.of(template("Cement", "CEM-01")));
    when(materialRepository.findIdsByTemplateId(TEMPLATE_ID)).thenReturn(List.of());

    service.deleteTemplate(TEMPLATE_ID);

    verify(materialRepository, never()).deleteByIdIn(anyCollection());
    verify(templateRepository).deleteById(TEMPLATE_ID);
  }

  private static MaterialTemplate template(String name, String code) {
    var template = new MaterialTemplate(name, code, null);
    ReflectionTestUtils.setField(template, "id", TEMPLATE_ID);
    return template;
  }
}
