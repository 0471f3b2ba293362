package io.b2mash.boq.taxonomy;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ProductRepository extends JpaRepository<Product, UUID> {

  boolean existsByName(String name);

  boolean existsByNameAndIdNot(String name, UUID id);

  List<Product> findAllByOrderByNameAsc();

  /** Products survive a subcategory delete; they only lose the reference. */
  @Modifying(clearAutomatically = true)
  @Query(
      """
      UPDATE Product p SET p.subcategoryId = NULL, p.updatedAt = :now
      WHERE p.subcategoryId IN :subcategoryIds
      """)
  int detachFromSubcategories(
      @Param("subcategoryIds") Collection<UUID> subcategoryIds, @Param("now") Instant now);
}
