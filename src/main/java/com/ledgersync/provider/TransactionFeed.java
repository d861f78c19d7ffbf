package com.ledgersync.provider;

import com.ledgersync.model.TransactionSource;
import java.util.List;
import java.util.Map;

public interface TransactionFeed {
  TransactionSource source();

  String displayName();

  List<Map<String, Object>> fetch();
}
