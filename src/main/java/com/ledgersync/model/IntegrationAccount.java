package com.ledgersync.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Entity
@EntityListeners(PrefixedIdListener.class)
@Table(
    name = "integration_accounts",
    uniqueConstraints = @UniqueConstraint(name = "uq_integration_account_source", columnNames = {"source"})
)
@Getter
@Setter
public class IntegrationAccount implements PrefixedEntity {
  static final String ID_PREFIX = "ia";

  @Id
  @Column(length = 64)
  private String id;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 32)
  private TransactionSource source;

  @Column(name = "display_name", nullable = false)
  private String displayName;

  @Column(name = "last_refreshed_at")
  private Instant lastRefreshedAt;

  @Column
  private Instant createdAt;

  @Column
  private Instant updatedAt;

  @PrePersist
  void prePersist() {
    Instant now = Instant.now();
    if (createdAt == null) {
      createdAt = now;
    }
    updatedAt = now;
  }

  @PreUpdate
  void preUpdate() {
    updatedAt = Instant.now();
  }

  @Override
  public String idPrefix() {
    return ID_PREFIX;
  }
}
