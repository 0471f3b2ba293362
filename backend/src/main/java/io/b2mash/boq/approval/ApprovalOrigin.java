package io.b2mash.boq.approval;

/** Which producer created an {@link Approvable} entry. */
public enum ApprovalOrigin {
  /** Submitted directly by a supplier or staff member. */
  DIRECT_ENTRY,
  /** Materialized from an approved material submission. */
  SUBMISSION
}
