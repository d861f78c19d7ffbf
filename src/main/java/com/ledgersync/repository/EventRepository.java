package com.ledgersync.repository;

import com.ledgersync.model.Event;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface EventRepository extends JpaRepository<Event, String> {
  @Query("select e from Event e where e.legacyId = :reference or e.id = :reference")
  Optional<Event> findByReference(@Param("reference") String reference);
}
