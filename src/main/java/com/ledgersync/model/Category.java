package com.ledgersync.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
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
    name = "categories",
    uniqueConstraints = @UniqueConstraint(name = "uq_category_name", columnNames = {"name"})
)
@Getter
@Setter
public class Category implements PrefixedEntity {
  static final String ID_PREFIX = "cat";

  @Id
  @Column(length = 64)
  private String id;

  @Column(nullable = false, length = 100)
  private String name;

  @Column(nullable = false)
  private Instant createdAt;

  @Column(nullable = false)
  private Instant updatedAt;

  @PrePersist
  void prePersist() {
    if (createdAt == null) {
      createdAt = Instant.now();
    }
    if (updatedAt == null) {
      updatedAt = createdAt;
    }
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
