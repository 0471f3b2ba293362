package io.b2mash.boq.material;

import io.b2mash.boq.approval.ApprovableRepository;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MaterialRepository extends ApprovableRepository<Material> {

  /** Materials classified under the category or anchored to one of its templates. */
  @Query(
      """
      SELECT m.id FROM Material m
      WHERE m.categoryId = :categoryId
         OR m.templateId IN (SELECT t.id FROM MaterialTemplate t WHERE t.categoryId = :categoryId)
      """)
  List<UUID> findIdsInCategory(@Param("categoryId") UUID categoryId);

  @Query("SELECT m.id FROM Material m WHERE m.templateId = :templateId")
  List<UUID> findIdsByTemplateId(@Param("templateId") UUID templateId);

  @Query("SELECT m.id FROM Material m WHERE m.shopId = :shopId")
  List<UUID> findIdsByShopId(@Param("shopId") UUID shopId);

  long countByCategoryId(UUID categoryId);

  long countByTemplateId(UUID templateId);

  @Modifying(clearAutomatically = true)
  @Query("DELETE FROM Material m WHERE m.id IN :ids")
  int deleteByIdIn(@Param("ids") Collection<UUID> ids);

  @Modifying(clearAutomatically = true)
  @Query(
      """
      UPDATE Material m SET m.subcategoryId = NULL, m.updatedAt = :now
      WHERE m.subcategoryId IN :subcategoryIds
      """)
  int clearSubcategories(
      @Param("subcategoryIds") Collection<UUID> subcategoryIds, @Param("now") Instant now);

  @Modifying(clearAutomatically = true)
  @Query(
      "UPDATE Material m SET m.productId = NULL, m.updatedAt = :now WHERE m.productId = :productId")
  int clearProduct(@Param("productId") UUID productId, @Param("now") Instant now);
}
