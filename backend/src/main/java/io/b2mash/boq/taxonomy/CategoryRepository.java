package io.b2mash.boq.taxonomy;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

public interface CategoryRepository extends JpaRepository<Category, UUID> {

  boolean existsByName(String name);

  Optional<Category> findByName(String name);

  List<Category> findAllByOrderByNameAsc();

  @Query("SELECT c.name FROM Category c ORDER BY c.name")
  List<String> findAllNames();
}
