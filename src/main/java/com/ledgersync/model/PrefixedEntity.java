package com.ledgersync.model;

public interface PrefixedEntity {
  String getId();

  void setId(String id);

  String idPrefix();
}
