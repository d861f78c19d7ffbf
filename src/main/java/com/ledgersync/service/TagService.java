package com.ledgersync.service;

import com.ledgersync.model.Tag;
import com.ledgersync.repository.TagRepository;
import java.util.List;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class TagService {
  private final TagRepository tagRepository;

  public TagService(TagRepository tagRepository) {
    this.tagRepository = tagRepository;
  }

  @Transactional(readOnly = true)
  public List<String> list() {
    return tagRepository.findAllByOrderByNameAsc().stream()
        .map(Tag::getName)
        .toList();
  }

  @Transactional
  public Tag getOrCreate(String name) {
    return tagRepository.findByName(name).orElseGet(() -> {
      Tag tag = new Tag();
      tag.setName(name);
      return tagRepository.save(tag);
    });
  }
}
