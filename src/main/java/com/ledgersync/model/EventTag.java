package com.ledgersync.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Entity
@EntityListeners(PrefixedIdListener.class)
@Table(
    name = "event_tags",
    uniqueConstraints = @UniqueConstraint(name = "uq_event_tag", columnNames = {"event_id", "tag_id"})
)
@Getter
@Setter
public class EventTag implements PrefixedEntity {
  static final String ID_PREFIX = "etag";

  @Id
  @Column(length = 64)
  private String id;

  @ManyToOne(optional = false)
  @JoinColumn(name = "event_id")
  private Event event;

  @ManyToOne(optional = false)
  @JoinColumn(name = "tag_id")
  private Tag tag;

  @Column(nullable = false)
  private Instant createdAt;

  @PrePersist
  void prePersist() {
    if (createdAt == null) {
      createdAt = Instant.now();
    }
  }

  @Override
  public String idPrefix() {
    return ID_PREFIX;
  }
}
