package com.ledgersync.model;

import com.ledgersync.service.IdGenerator;
import jakarta.persistence.PrePersist;
import org.springframework.stereotype.Component;

@Component
public class PrefixedIdListener {
  private final IdGenerator idGenerator;

  public PrefixedIdListener(IdGenerator idGenerator) {
    this.idGenerator = idGenerator;
  }

  @PrePersist
  public void assignId(PrefixedEntity entity) {
    if (entity.getId() == null) {
      entity.setId(idGenerator.generate(entity.idPrefix()));
    }
  }
}
