package com.ledgersync.service;

import com.ledgersync.dto.CategoryResponse;
import com.ledgersync.exception.CategoryAlreadyExistsException;
import com.ledgersync.exception.CategoryNotFoundException;
import com.ledgersync.exception.MissingFieldException;
import com.ledgersync.model.Category;
import com.ledgersync.repository.CategoryRepository;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class CategoryService {
  private static final Logger log = LoggerFactory.getLogger(CategoryService.class);

  private final CategoryRepository categoryRepository;

  public CategoryService(CategoryRepository categoryRepository) {
    this.categoryRepository = categoryRepository;
  }

  @Transactional(readOnly = true)
  public List<CategoryResponse> list() {
    return categoryRepository.findAllByOrderByNameAsc().stream()
        .map(category -> new CategoryResponse(
            category.getId(),
            category.getName(),
            category.getCreatedAt(),
            category.getUpdatedAt()))
        .toList();
  }

  @Transactional
  public CategoryResponse create(String name) {
    String trimmed = name == null ? "" : name.trim();
    if (trimmed.isEmpty()) {
      throw new MissingFieldException("name", "category");
    }
    if (categoryRepository.findByName(trimmed).isPresent()) {
      throw new CategoryAlreadyExistsException(trimmed);
    }
    Category category = new Category();
    category.setName(trimmed);
    Category saved = categoryRepository.save(category);
    log.info("Created category {} ({})", saved.getName(), saved.getId());
    return new CategoryResponse(saved.getId(), saved.getName(), saved.getCreatedAt(), saved.getUpdatedAt());
  }

  public Category require(String name) {
    return categoryRepository.findByName(name)
        .orElseThrow(() -> new CategoryNotFoundException(name));
  }
}
