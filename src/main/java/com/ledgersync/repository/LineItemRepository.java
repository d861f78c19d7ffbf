package com.ledgersync.repository;

import com.ledgersync.model.LineItem;
import com.ledgersync.model.TransactionSource;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface LineItemRepository extends JpaRepository<LineItem, String> {
  List<LineItem> findBySourceAndSourceIdIn(TransactionSource source, Collection<String> sourceIds);

  Optional<LineItem> findBySourceAndSourceId(TransactionSource source, String sourceId);

  @Query("select l from LineItem l where l.id = :reference or l.legacyId = :reference")
  Optional<LineItem> findByReference(@Param("reference") String reference);

  long countBySource(TransactionSource source);
}
