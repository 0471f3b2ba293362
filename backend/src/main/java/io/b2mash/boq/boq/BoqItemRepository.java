package io.b2mash.boq.boq;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface BoqItemRepository extends JpaRepository<BoqItem, UUID> {

  /** Every item of the version, hidden rows included. Used for copying. */
  List<BoqItem> findByVersionIdOrderByCreatedAtAsc(UUID versionId);

  @Query(
      """
      SELECT i FROM BoqItem i
      WHERE i.versionId = :versionId AND i.userAdded = true
      ORDER BY i.createdAt ASC
      """)
  List<BoqItem> findVisibleByVersionId(@Param("versionId") UUID versionId);

  @Query(
      """
      SELECT i FROM BoqItem i
      WHERE i.projectId = :projectId AND i.userAdded = true
      ORDER BY i.createdAt ASC
      """)
  List<BoqItem> findVisibleByProjectId(@Param("projectId") UUID projectId);

  long countByVersionId(UUID versionId);

  @Modifying(clearAutomatically = true)
  @Query("DELETE FROM BoqItem i WHERE i.versionId = :versionId")
  int deleteByVersionId(@Param("versionId") UUID versionId);

  @Modifying(clearAutomatically = true)
  @Query("DELETE FROM BoqItem i WHERE i.projectId = :projectId")
  int deleteByProjectId(@Param("projectId") UUID projectId);
}
