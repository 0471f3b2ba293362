package io.b2mash.boq.approval;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.NoRepositoryBean;
import org.springframework.data.repository.query.Param;

/**
 * Shared approval queries for every {@link Approvable} entity. The entity must map {@code
 * approved}, {@code approvalReason}, {@code createdAt} and {@code updatedAt}.
 *
 * <p>Transitions are conditional updates evaluated by the database, never read-then-write, so two
 * reviewers racing on the same row cannot both observe a transition.
 */
@NoRepositoryBean
public interface ApprovableRepository<T extends Approvable> extends JpaRepository<T, UUID> {

  /** Returns 1 when the row moved to approved, 0 when it was already approved or is missing. */
  @Modifying(clearAutomatically = true)
  @Query(
      """
      UPDATE #{#entityName} e
      SET e.approved = true, e.approvalReason = NULL, e.updatedAt = :now
      WHERE e.id = :id AND e.approved <> true
      """)
  int markApproved(@Param("id") UUID id, @Param("now") Instant now);

  @Modifying(clearAutomatically = true)
  @Query(
      """
      UPDATE #{#entityName} e
      SET e.approved = false, e.approvalReason = :reason, e.updatedAt = :now
      WHERE e.id = :id
      """)
  int markRejected(
      @Param("id") UUID id, @Param("reason") String reason, @Param("now") Instant now);

  @Query("SELECT e FROM #{#entityName} e WHERE e.approved = true ORDER BY e.createdAt DESC")
  List<T> findApproved();

  @Query("SELECT e FROM #{#entityName} e WHERE e.approved = false ORDER BY e.createdAt ASC")
  List<T> findPending();
}
