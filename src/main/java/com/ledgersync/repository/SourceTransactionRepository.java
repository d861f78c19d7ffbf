package com.ledgersync.repository;

import com.ledgersync.model.SourceTransaction;
import com.ledgersync.model.TransactionSource;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SourceTransactionRepository extends JpaRepository<SourceTransaction, String> {
  List<SourceTransaction> findBySourceAndSourceIdIn(TransactionSource source, Collection<String> sourceIds);

  List<SourceTransaction> findBySource(TransactionSource source);

  long countBySource(TransactionSource source);
}
