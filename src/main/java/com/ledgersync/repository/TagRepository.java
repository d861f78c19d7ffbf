package com.ledgersync.repository;

import com.ledgersync.model.Tag;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface TagRepository extends JpaRepository<Tag, String> {
  Optional<Tag> findByName(String name);

  List<Tag> findAllByOrderByNameAsc();
}
