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
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Entity
@EntityListeners(PrefixedIdListener.class)
@Table(
    name = "line_items",
    uniqueConstraints = {
        @UniqueConstraint(name = "uq_line_item_source", columnNames = {"source", "source_id"}),
        @UniqueConstraint(name = "uq_line_item_legacy_id", columnNames = {"legacy_id"})
    }
)
@Getter
@Setter
public class LineItem implements PrefixedEntity {
  static final String ID_PREFIX = "li";

  private static final int DEFAULT_VARCHAR_LIMIT = 255;

  @Id
  @Column(length = 64)
  private String id;

  @Column(nullable = false)
  private Instant date;

  @Column(name = "responsible_party")
  private String responsibleParty;

  @Column(name = "payment_method", nullable = false)
  private String paymentMethod;

  @Column(columnDefinition = "text", nullable = false)
  private String description;

  @Column(nullable = false, precision = 12, scale = 2)
  private BigDecimal amount;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 32)
  private TransactionSource source;

  @Column(name = "source_id", nullable = false)
  private String sourceId;

  @Column(name = "legacy_id", nullable = false)
  private String legacyId;

  @Column(nullable = false)
  private Instant createdAt;

  @Column(nullable = false)
  private Instant updatedAt;

  @PrePersist
  void prePersist() {
    Instant now = Instant.now();
    if (createdAt == null) {
      createdAt = now;
    }
    updatedAt = now;
    normalizeLengths();
  }

  @PreUpdate
  void preUpdate() {
    updatedAt = Instant.now();
    normalizeLengths();
  }

  private void normalizeLengths() {
    responsibleParty = fitColumn(responsibleParty);
    paymentMethod = fitColumn(paymentMethod);
  }

  public static String fitColumn(String value) {
    if (value == null || value.length() <= DEFAULT_VARCHAR_LIMIT) {
      return value;
    }
    return value.substring(0, DEFAULT_VARCHAR_LIMIT);
  }

  @Override
  public String idPrefix() {
    return ID_PREFIX;
  }
}
