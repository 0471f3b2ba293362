package io.b2mash.boq.boq;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface BoqProjectRepository extends JpaRepository<BoqProject, UUID> {

  List<BoqProject> findAllByOrderByCreatedAtDesc();

  /** Row lock that serializes version creation for one project. */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT p FROM BoqProject p WHERE p.id = :id")
  Optional<BoqProject> findByIdForUpdate(@Param("id") UUID id);
}
