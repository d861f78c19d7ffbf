package com.ledgersync.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class IdGeneratorTest {
  private static final String CROCKFORD = "[0-9A-HJKMNP-TV-Z]";

  @Test
  @DisplayName("ids carry the prefix and a 26 character ULID")
  void formatsPrefixedUlid() {
    IdGenerator generator = new IdGenerator(Clock.systemUTC());

    String id = generator.generate("evt");

    assertThat(id).matches("evt_" + CROCKFORD + "{26}");
  }

  @Test
  @DisplayName("time component encodes the clock's epoch milliseconds")
  void encodesTimestamp() {
    Clock clock = Clock.fixed(Instant.ofEpochMilli(0L), ZoneOffset.UTC);
    IdGenerator generator = new IdGenerator(clock);

    assertThat(generator.generate("li")).startsWith("li_0000000000");
  }

  @Test
  @DisplayName("ids created within one millisecond are strictly increasing")
  void monotonicWithinSameMillisecond() {
    Clock clock = Clock.fixed(Instant.parse("2024-01-05T10:00:00Z"), ZoneOffset.UTC);
    IdGenerator generator = new IdGenerator(clock);

    List<String> ids = new ArrayList<>();
    for (int i = 0; i < 1000; i++) {
      ids.add(generator.generate("li"));
    }

    assertThat(ids).isSorted();
    assertThat(new HashSet<>(ids)).hasSize(ids.size());
  }

  @Test
  void laterTimestampsSortAfterEarlierOnes() {
    MutableClock clock = new MutableClock(Instant.parse("2024-01-05T10:00:00Z"));
    IdGenerator generator = new IdGenerator(clock);

    String first = generator.generate("evt");
    clock.advanceMillis(1);
    String second = generator.generate("evt");

    assertThat(second).isGreaterThan(first);
  }

  @Test
  void clockMovingBackwardsStillYieldsIncreasingIds() {
    MutableClock clock = new MutableClock(Instant.parse("2024-01-05T10:00:00Z"));
    IdGenerator generator = new IdGenerator(clock);

    String first = generator.generate("evt");
    clock.advanceMillis(-50);
    String second = generator.generate("evt");

    assertThat(second).isGreaterThan(first);
  }

  @Test
  void rejectsBlankPrefix() {
    IdGenerator generator = new IdGenerator(Clock.systemUTC());

    assertThatThrownBy(() -> generator.generate(" "))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static final class MutableClock extends Clock {
    private Instant now;

    MutableClock(Instant now) {
      this.now = now;
    }

    void advanceMillis(long millis) {
      now = now.plusMillis(millis);
    }

    @Override
    public ZoneOffset getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}
