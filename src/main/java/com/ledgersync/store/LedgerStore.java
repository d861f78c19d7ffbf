package com.ledgersync.store;

import com.ledgersync.model.TransactionSource;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read access to one copy of the ledger, used to compare the legacy document store with the
 * relational store.
 */
public interface LedgerStore {
  String name();

  Set<String> categoryNames();

  Set<String> tagNames();

  Map<TransactionSource, Long> transactionCounts();

  List<Map<String, Object>> rawDocuments(TransactionSource source);

  Map<String, LineItemSnapshot> lineItems();

  Map<String, EventSnapshot> events();

  List<AccountSnapshot> integrationAccounts();

  List<UserSnapshot> users();
}
