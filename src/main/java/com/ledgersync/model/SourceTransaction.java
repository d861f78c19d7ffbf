package com.ledgersync.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Entity
@EntityListeners(PrefixedIdListener.class)
@Table(
    name = "transactions",
    uniqueConstraints = @UniqueConstraint(name = "uq_transaction_source", columnNames = {"source", "source_id"})
)
@Getter
@Setter
public class SourceTransaction implements PrefixedEntity {
  static final String ID_PREFIX = "txn";

  @Id
  @Column(length = 64)
  private String id;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 32)
  private TransactionSource source;

  @Column(name = "source_id", nullable = false)
  private String sourceId;

  @Column(name = "source_data", columnDefinition = "text", nullable = false)
  private String sourceData;

  @Column(name = "transaction_date", nullable = false)
  private Instant transactionDate;

  @Column(nullable = false)
  private Instant importedAt;

  @PrePersist
  void prePersist() {
    if (importedAt == null) {
      importedAt = Instant.now();
    }
  }

  @Override
  public String idPrefix() {
    return ID_PREFIX;
  }
}
