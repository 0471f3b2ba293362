package io.b2mash.boq.approval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.boq.audit.AuditEventRecord;
import io.b2mash.boq.audit.AuditService;
import io.b2mash.boq.exception.ResourceNotFoundException;
import io.b2mash.boq.shop.Shop;
import io.b2mash.boq.shop.ShopRepository;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ApprovalGateTest {

  private static final UUID SHOP_ID = UUID.randomUUID();

  @Mock private ShopRepository repository;
  @Mock private AuditService auditService;

  private ApprovalGate<Shop> gate;

  @BeforeEach
  void setUp() {
    gate = new ApprovalGate<>(repository, auditService, "Shop", "shop");
  }

  @Test
  void approve_pendingEntry_auditsTransition() {
    var shop = new Shop("Hardware Hub", "supplier_a");
    when(repository.findById(SHOP_ID)).thenReturn(Optional.of(shop));
    when(repository.markApproved(eq(SHOP_ID), any(Instant.class))).thenReturn(1);

    var result = gate.approve(SHOP_ID);

    assertThat(result).isSameAs(shop);
    var captor = ArgumentCaptor.forClass(AuditEventRecord.class);
    verify(auditService).log(captor.capture());
    assertThat(captor.getValue().eventType()).isEqualTo("shop.approved");
    assertThat(captor.getValue().entityId()).isEqualTo(SHOP_ID);
  }

  @Test
  void approve_alreadyApproved_isNoOp() {
    var shop = new Shop("Hardware Hub", "supplier_a");
    when(repository.findById(SHOP_ID)).thenReturn(Optional.of(shop));
    when(repository.markApproved(eq(SHOP_ID), any(Instant.class))).thenReturn(0);

    var result = gate.approve(SHOP_ID);

    assertThat(result).isSameAs(shop);
    verify(auditService, never()).log(any());
  }

  @Test
  void approve_missingEntry_throwsNotFound() {
    when(repository.findById(SHOP_ID)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> gate.approve(SHOP_ID)).isInstanceOf(ResourceNotFoundException.class);
    verify(repository, never()).markApproved(any(), any());
  }

  @Test
  void reject_withoutReason_isAllowed() {
    var shop = new Shop("Hardware Hub", "supplier_a");
    when(repository.findById(SHOP_ID)).thenReturn(Optional.of(shop));

    gate.reject(SHOP_ID, null);

    verify(repository).markRejected(eq(SHOP_ID), isNull(), any(Instant.class));
    verify(auditService).log(any());
  }

  @Test
  void listings_delegateToVisibilityQueries() {
    var approved = new Shop("Visible", "supplier_a");
    var pending = new Shop("Hidden", "supplier_b");
    when(repository.findApproved()).thenReturn(List.of(approved));
    when(repository.findPending()).thenReturn(List.of(pending));

    assertThat(gate.listApproved()).containsExactly(approved);
    assertThat(gate.listPending()).containsExactly(pending);
  }
}
