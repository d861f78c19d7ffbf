package com.ledgersync.dto;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class CategoryResponse {
  private String id;
  private String name;
  private Instant createdAt;
  private Instant updatedAt;
}
