package io.b2mash.boq.template;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MaterialTemplateRepository extends JpaRepository<MaterialTemplate, UUID> {

  boolean existsByName(String name);

  boolean existsByCode(String code);

  boolean existsByNameAndIdNot(String name, UUID id);

  boolean existsByCodeAndIdNot(String code, UUID id);

  List<MaterialTemplate> findAllByOrderByNameAsc();

  @Modifying(clearAutomatically = true)
  @Query("DELETE FROM MaterialTemplate t WHERE t.categoryId = :categoryId")
  int deleteByCategoryId(@Param("categoryId") UUID categoryId);
}
