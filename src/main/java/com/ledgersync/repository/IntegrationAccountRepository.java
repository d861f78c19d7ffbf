package com.ledgersync.repository;

import com.ledgersync.model.IntegrationAccount;
import com.ledgersync.model.TransactionSource;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface IntegrationAccountRepository extends JpaRepository<IntegrationAccount, String> {
  Optional<IntegrationAccount> findBySource(TransactionSource source);
}
