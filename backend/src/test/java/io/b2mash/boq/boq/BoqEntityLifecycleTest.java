package io.b2mash.boq.boq;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.boq.exception.InvalidStateException;
import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class BoqEntityLifecycleTest {

  @Test
  void newProject_startsAsDraft() {
    var project = new BoqProject("Tower A", "Acme", new BigDecimal("1000.00"), "Pune", "user_1");

    assertThat(project.getStatus()).isEqualTo(BoqProjectStatus.DRAFT);
  }

  @Test
  void changeStatus_forward_applies() {
    var project = new BoqProject("Tower A", null, null, null, "user_1");

    assertThat(project.changeStatus(BoqProjectStatus.SUBMITTED)).isTrue();
    assertThat(project.changeStatus(BoqProjectStatus.FINALIZED)).isTrue();
    assertThat(project.getStatus()).isEqualTo(BoqProjectStatus.FINALIZED);
  }

  @Test
  void changeStatus_sameStatus_isNoOp() {
    var project = new BoqProject("Tower A", null, null, null, "user_1");

    assertThat(project.changeStatus(BoqProjectStatus.DRAFT)).isFalse();
    assertThat(project.getStatus()).isEqualTo(BoqProjectStatus.DRAFT);
  }

  @Test
  void changeStatus_backward_throws() {
    var project = new BoqProject("Tower A", null, null, null, "user_1");
    project.changeStatus(BoqProjectStatus.SUBMITTED);

    assertThatThrownBy(() -> project.changeStatus(BoqProjectStatus.DRAFT))
        .isInstanceOf(InvalidStateException.class);
    assertThat(project.getStatus()).isEqualTo(BoqProjectStatus.SUBMITTED);
  }

  @Test
  void submittedVersion_rejectsEdits() {
    var version = new BoqVersion(UUID.randomUUID(), 1, "Tower A", "Acme");
    version.replaceEditedFields(Map.of("row-1.qty", 12));
    version.changeStatus(BoqVersionStatus.SUBMITTED);

    assertThat(version.isLocked()).isTrue();
    assertThatThrownBy(() -> version.replaceEditedFields(Map.of("row-1.qty", 15)))
        .isInstanceOf(InvalidStateException.class);
    assertThat(version.getEditedFields()).containsEntry("row-1.qty", 12);
  }

  @Test
  void copyTo_keepsContentAndVisibility() {
    var projectId = UUID.randomUUID();
    var item = new BoqItem(projectId, UUID.randomUUID(), "flooring", Map.of("qty", 10));
    var target = UUID.randomUUID();

    var copy = item.copyTo(target);

    assertThat(copy).isNotSameAs(item);
    assertThat(copy.getProjectId()).isEqualTo(projectId);
    assertThat(copy.getVersionId()).isEqualTo(target);
    assertThat(copy.getEstimatorKind()).isEqualTo("flooring");
    assertThat(copy.getPayload()).isEqualTo(item.getPayload());
    assertThat(copy.isUserAdded()).isTrue();

    copy.replacePayload(Map.of("qty", 20));
    assertThat(item.getPayload()).containsEntry("qty", 10);
  }
}
