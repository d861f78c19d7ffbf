package com.ledgersync.provider;

import com.ledgersync.exception.UnknownFeedException;
import com.ledgersync.model.TransactionSource;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

@Component
public class FeedRegistry {
  private final Map<TransactionSource, TransactionFeed> feeds = new EnumMap<>(TransactionSource.class);

  public FeedRegistry(ObjectProvider<TransactionFeed> feeds) {
    feeds.orderedStream().forEach(feed -> {
      TransactionFeed previous = this.feeds.putIfAbsent(feed.source(), feed);
      if (previous != null) {
        throw new IllegalStateException("Multiple transaction feeds registered for " + feed.source());
      }
    });
  }

  public TransactionFeed require(TransactionSource source) {
    TransactionFeed feed = feeds.get(source);
    if (feed == null) {
      throw new UnknownFeedException(source);
    }
    return feed;
  }

  public List<TransactionFeed> list() {
    return feeds.values().stream().toList();
  }
}
