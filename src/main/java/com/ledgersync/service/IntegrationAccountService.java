package com.ledgersync.service;

import com.ledgersync.dto.IntegrationAccountResponse;
import com.ledgersync.model.IntegrationAccount;
import com.ledgersync.model.TransactionSource;
import com.ledgersync.repository.IntegrationAccountRepository;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class IntegrationAccountService {
  private final IntegrationAccountRepository accountRepository;
  private final Clock clock;

  public IntegrationAccountService(IntegrationAccountRepository accountRepository, Clock clock) {
    this.accountRepository = accountRepository;
    this.clock = clock;
  }

  @Transactional
  public IntegrationAccount markRefreshed(TransactionSource source, String displayName) {
    IntegrationAccount account = accountRepository.findBySource(source).orElseGet(() -> {
      IntegrationAccount created = new IntegrationAccount();
      created.setSource(source);
      return created;
    });
    String name = displayName == null || displayName.isBlank() ? defaultName(source) : displayName.trim();
    account.setDisplayName(name);
    account.setLastRefreshedAt(clock.instant());
    return accountRepository.save(account);
  }

  @Transactional(readOnly = true)
  public List<IntegrationAccountResponse> list() {
    return accountRepository.findAll().stream()
        .sorted(Comparator.comparing(IntegrationAccount::getSource))
        .map(account -> new IntegrationAccountResponse(
            account.getId(),
            account.getSource(),
            account.getDisplayName(),
            account.getLastRefreshedAt()))
        .toList();
  }

  private static String defaultName(TransactionSource source) {
    String name = source.name().toLowerCase();
    return Character.toUpperCase(name.charAt(0)) + name.substring(1);
  }
}
