package io.b2mash.boq.taxonomy;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SubcategoryRepository extends JpaRepository<Subcategory, UUID> {

  boolean existsByNameAndCategoryId(String name, UUID categoryId);

  Optional<Subcategory> findByNameAndCategoryId(String name, UUID categoryId);

  @Query("SELECT s.id FROM Subcategory s WHERE s.categoryId = :categoryId")
  List<UUID> findIdsByCategoryId(@Param("categoryId") UUID categoryId);

  @Query(
      """
      SELECT new io.b2mash.boq.taxonomy.SubcategoryView(
          s.id, s.name, s.categoryId, c.name, s.createdAt
      )
      FROM Subcategory s JOIN Category c ON s.categoryId = c.id
      ORDER BY c.name, s.name
      """)
  List<SubcategoryView> findAllWithCategoryName();

  @Query(
      """
      SELECT s.name FROM Subcategory s JOIN Category c ON s.categoryId = c.id
      WHERE c.name = :categoryName
      ORDER BY s.name
      """)
  List<String> findNamesByCategoryName(@Param("categoryName") String categoryName);

  @Modifying(clearAutomatically = true)
  @Query("DELETE FROM Subcategory s WHERE s.categoryId = :categoryId")
  int deleteByCategoryId(@Param("categoryId") UUID categoryId);
}
