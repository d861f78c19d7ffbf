package com.ledgersync.service;

import com.ledgersync.dto.EventSubmission;
import com.ledgersync.exception.MissingFieldException;
import com.ledgersync.model.Category;
import com.ledgersync.model.Event;
import com.ledgersync.model.EventLineItem;
import com.ledgersync.model.EventTag;
import com.ledgersync.model.LineItem;
import com.ledgersync.model.Tag;
import com.ledgersync.repository.EventLineItemRepository;
import com.ledgersync.repository.EventRepository;
import com.ledgersync.repository.EventTagRepository;
import com.ledgersync.repository.LineItemRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

// Runs in the caller's transaction; missing line items are logged and skipped.
@Component
public class EventResolver {
  private static final Logger log = LoggerFactory.getLogger(EventResolver.class);
  static final String EVENT_PREFIX = "evt";

  private final CategoryService categoryService;
  private final TagService tagService;
  private final EventRepository eventRepository;
  private final LineItemRepository lineItemRepository;
  private final EventLineItemRepository eventLineItemRepository;
  private final EventTagRepository eventTagRepository;

  public EventResolver(CategoryService categoryService,
                       TagService tagService,
                       EventRepository eventRepository,
                       LineItemRepository lineItemRepository,
                       EventLineItemRepository eventLineItemRepository,
                       EventTagRepository eventTagRepository) {
    this.categoryService = categoryService;
    this.tagService = tagService;
    this.eventRepository = eventRepository;
    this.lineItemRepository = lineItemRepository;
    this.eventLineItemRepository = eventLineItemRepository;
    this.eventTagRepository = eventTagRepository;
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public String upsertEvent(EventSubmission submission) {
    String categoryName = submission.getCategory() == null ? "" : submission.getCategory().trim();
    if (categoryName.isEmpty()) {
      throw new MissingFieldException("category", "event " + submission.getId());
    }
    Category category = categoryService.require(categoryName);

    Optional<Event> existing = eventRepository.findByReference(submission.getId());
    Event event = existing.orElseGet(() -> newEvent(submission.getId()));
    if (existing.isPresent()) {
      eventLineItemRepository.deleteByEventId(event.getId());
      eventTagRepository.deleteByEventId(event.getId());
    }

    List<LineItem> lineItems = resolveLineItems(submission);
    boolean duplicate = Boolean.TRUE.equals(submission.getDuplicateTransaction());
    event.setDate(submission.getDate());
    event.setDescription(submission.getName());
    event.setCategory(category);
    event.setDuplicate(duplicate);
    event.setAmount(amountOf(lineItems, duplicate));
    Event saved = eventRepository.save(event);

    List<EventLineItem> lineItemJunctions = new ArrayList<>();
    for (LineItem lineItem : lineItems) {
      EventLineItem junction = new EventLineItem();
      junction.setEvent(saved);
      junction.setLineItem(lineItem);
      lineItemJunctions.add(junction);
    }
    eventLineItemRepository.saveAll(lineItemJunctions);

    List<EventTag> tagJunctions = new ArrayList<>();
    for (String tagName : distinctNames(submission.getTags())) {
      Tag tag = tagService.getOrCreate(tagName);
      EventTag junction = new EventTag();
      junction.setEvent(saved);
      junction.setTag(tag);
      tagJunctions.add(junction);
    }
    eventTagRepository.saveAll(tagJunctions);

    log.debug("Stored event {} with {} line items and {} tags",
        saved.getId(), lineItemJunctions.size(), tagJunctions.size());
    return saved.getId();
  }

  private Event newEvent(String submissionId) {
    Event event = new Event();
    if (submissionId.startsWith(EVENT_PREFIX + "_")) {
      event.setId(submissionId);
    }
    event.setLegacyId(submissionId);
    return event;
  }

  private List<LineItem> resolveLineItems(EventSubmission submission) {
    Map<String, LineItem> resolved = new LinkedHashMap<>();
    for (String reference : distinctNames(submission.getLineItems())) {
      Optional<LineItem> lineItem = lineItemRepository.findByReference(reference);
      if (lineItem.isEmpty()) {
        log.warn("Line item {} referenced by event {} not found, skipping", reference, submission.getId());
        continue;
      }
      resolved.putIfAbsent(lineItem.get().getId(), lineItem.get());
    }
    return new ArrayList<>(resolved.values());
  }

  private static BigDecimal amountOf(List<LineItem> lineItems, boolean duplicate) {
    if (lineItems.isEmpty()) {
      return BigDecimal.ZERO.setScale(2);
    }
    if (duplicate) {
      return lineItems.get(0).getAmount().setScale(2, RoundingMode.HALF_UP);
    }
    return lineItems.stream()
        .map(LineItem::getAmount)
        .reduce(BigDecimal.ZERO, BigDecimal::add)
        .setScale(2, RoundingMode.HALF_UP);
  }

  private static Set<String> distinctNames(List<String> values) {
    Set<String> names = new LinkedHashSet<>();
    if (values == null) {
      return names;
    }
    for (String value : values) {
      if (value != null && !value.isBlank()) {
        names.add(value.trim());
      }
    }
    return names;
  }
}
