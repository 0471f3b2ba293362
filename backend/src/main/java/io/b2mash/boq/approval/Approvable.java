package io.b2mash.boq.approval;

import java.util.UUID;

/**
 * A catalog entry that staff approve into, or reject out of, the public catalog. Approval is
 * re-reviewable: a rejected entry may be approved later and vice versa.
 */
public interface Approvable {

  UUID getId();

  boolean isApproved();

  String getApprovalReason();
}
