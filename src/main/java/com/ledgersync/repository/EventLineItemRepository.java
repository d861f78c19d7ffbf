package com.ledgersync.repository;

import com.ledgersync.model.EventLineItem;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface EventLineItemRepository extends JpaRepository<EventLineItem, String> {
  List<EventLineItem> findByEventId(String eventId);

  long countByEventId(String eventId);

  boolean existsByLineItemId(String lineItemId);

  @Query("select j.event.id, count(j) from EventLineItem j group by j.event.id")
  List<Object[]> countGroupedByEvent();

  @Modifying(flushAutomatically = true, clearAutomatically = false)
  @Query("delete from EventLineItem j where j.event.id = :eventId")
  int deleteByEventId(@Param("eventId") String eventId);
}
