package com.ledgersync.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
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
    name = "events",
    uniqueConstraints = @UniqueConstraint(name = "uq_event_legacy_id", columnNames = {"legacy_id"})
)
@Getter
@Setter
public class Event implements PrefixedEntity {
  static final String ID_PREFIX = "evt";

  @Id
  @Column(length = 64)
  private String id;

  @Column(name = "legacy_id", nullable = false)
  private String legacyId;

  @Column(nullable = false)
  private Instant date;

  @Column(columnDefinition = "text", nullable = false)
  private String description;

  @ManyToOne(optional = false)
  @JoinColumn(name = "category_id")
  private Category category;

  @Column(nullable = false, precision = 12, scale = 2)
  private BigDecimal amount;

  @Column(name = "is_duplicate", nullable = false)
  private boolean duplicate;

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
