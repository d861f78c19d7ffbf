package com.ledgersync.repository;

import com.ledgersync.model.EventTag;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface EventTagRepository extends JpaRepository<EventTag, String> {
  List<EventTag> findByEventId(String eventId);

  long countByEventId(String eventId);

  @Query("select j.event.id, count(j) from EventTag j group by j.event.id")
  List<Object[]> countGroupedByEvent();

  @Modifying(flushAutomatically = true, clearAutomatically = false)
  @Query("delete from EventTag j where j.event.id = :eventId")
  int deleteByEventId(@Param("eventId") String eventId);
}
