package com.ledgersync.dto;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class EventSubmission {
  private String id;
  private String name;
  private String category;
  private Instant date;
  private List<String> tags = new ArrayList<>();
  private List<String> lineItems = new ArrayList<>();
  private Boolean duplicateTransaction;
}
