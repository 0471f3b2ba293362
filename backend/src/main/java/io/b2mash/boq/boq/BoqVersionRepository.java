package io.b2mash.boq.boq;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface BoqVersionRepository extends JpaRepository<BoqVersion, UUID> {

  List<BoqVersion> findByProjectIdOrderByVersionNumberDesc(UUID projectId);

  /** Highest version number of the project, 0 when it has none. */
  @Query(
      "SELECT COALESCE(MAX(v.versionNumber), 0) FROM BoqVersion v WHERE v.projectId = :projectId")
  int findMaxVersionNumber(@Param("projectId") UUID projectId);

  @Modifying(clearAutomatically = true)
  @Query("DELETE FROM BoqVersion v WHERE v.projectId = :projectId")
  int deleteByProjectId(@Param("projectId") UUID projectId);
}
