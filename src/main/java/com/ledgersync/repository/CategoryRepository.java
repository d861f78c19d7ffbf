package com.ledgersync.repository;

import com.ledgersync.model.Category;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CategoryRepository extends JpaRepository<Category, String> {
  Optional<Category> findByName(String name);

  List<Category> findAllByOrderByNameAsc();
}
