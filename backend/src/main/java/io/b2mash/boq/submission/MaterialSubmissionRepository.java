package io.b2mash.boq.submission;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MaterialSubmissionRepository extends JpaRepository<MaterialSubmission, UUID> {

  /**
   * Moves a pending submission to approved. Returns 0 when the submission was already reviewed;
   * concurrent callers serialize on the row lock and only the first sees 1.
   */
  @Modifying(clearAutomatically = true)
  @Query(
      """
      UPDATE MaterialSubmission s
      SET s.approved = true, s.reviewedBy = :reviewer, s.reviewedAt = :now
      WHERE s.id = :id AND s.approved IS NULL
      """)
  int markApproved(
      @Param("id") UUID id, @Param("reviewer") String reviewer, @Param("now") Instant now);

  @Modifying(clearAutomatically = true)
  @Query(
      """
      UPDATE MaterialSubmission s
      SET s.approved = false, s.approvalReason = :reason, s.reviewedBy = :reviewer,
          s.reviewedAt = :now
      WHERE s.id = :id AND s.approved IS NULL
      """)
  int markRejected(
      @Param("id") UUID id,
      @Param("reason") String reason,
      @Param("reviewer") String reviewer,
      @Param("now") Instant now);

  @Modifying(clearAutomatically = true)
  @Query("UPDATE MaterialSubmission s SET s.materialId = :materialId WHERE s.id = :id")
  int linkMaterial(@Param("id") UUID id, @Param("materialId") UUID materialId);

  /** Drops links to materials about to be deleted. */
  @Modifying(clearAutomatically = true)
  @Query("UPDATE MaterialSubmission s SET s.materialId = NULL WHERE s.materialId IN :materialIds")
  int unlinkMaterials(@Param("materialIds") Collection<UUID> materialIds);

  @Query(
      """
      SELECT new io.b2mash.boq.submission.SubmissionWithNames(s, t.name, t.code, sh.name)
      FROM MaterialSubmission s
        JOIN MaterialTemplate t ON s.templateId = t.id
        JOIN Shop sh ON s.shopId = sh.id
      WHERE s.approved IS NULL
      ORDER BY s.submittedAt ASC
      """)
  List<SubmissionWithNames> findPendingWithNames();

  @Query(
      """
      SELECT new io.b2mash.boq.submission.SubmissionWithNames(s, t.name, t.code, sh.name)
      FROM MaterialSubmission s
        JOIN MaterialTemplate t ON s.templateId = t.id
        JOIN Shop sh ON s.shopId = sh.id
      WHERE sh.ownerId = :ownerId
      ORDER BY s.submittedAt DESC
      """)
  List<SubmissionWithNames> findForShopOwnerWithNames(@Param("ownerId") String ownerId);

  @Modifying(clearAutomatically = true)
  @Query(
      """
      DELETE FROM MaterialSubmission s
      WHERE s.templateId IN (SELECT t.id FROM MaterialTemplate t WHERE t.categoryId = :categoryId)
      """)
  int deleteByTemplateCategoryId(@Param("categoryId") UUID categoryId);

  @Modifying(clearAutomatically = true)
  @Query("DELETE FROM MaterialSubmission s WHERE s.templateId = :templateId")
  int deleteByTemplateId(@Param("templateId") UUID templateId);

  @Modifying(clearAutomatically = true)
  @Query("DELETE FROM MaterialSubmission s WHERE s.shopId = :shopId")
  int deleteByShopId(@Param("shopId") UUID shopId);

  long countByTemplateId(UUID templateId);
}
