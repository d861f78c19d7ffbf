package com.ledgersync.service;

import com.ledgersync.dto.EventSubmission;
import com.ledgersync.exception.MissingFieldException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class EventService {
  private final EventResolver eventResolver;
  private final IdGenerator idGenerator;

  public EventService(EventResolver eventResolver, IdGenerator idGenerator) {
    this.eventResolver = eventResolver;
    this.idGenerator = idGenerator;
  }

  @Transactional
  public String submit(EventSubmission submission) {
    if (submission.getName() == null || submission.getName().isBlank()) {
      throw new MissingFieldException("name", "event");
    }
    if (submission.getCategory() == null || submission.getCategory().isBlank()) {
      throw new MissingFieldException("category", "event " + submission.getName());
    }
    if (submission.getDate() == null) {
      throw new MissingFieldException("date", "event " + submission.getName());
    }
    if (submission.getId() == null || submission.getId().isBlank()) {
      submission.setId(idGenerator.generate(EventResolver.EVENT_PREFIX));
    }
    return eventResolver.upsertEvent(submission);
  }
}
