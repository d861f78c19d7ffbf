package com.ledgersync.service;

import java.security.SecureRandom;
import java.time.Clock;
import org.springframework.stereotype.Component;

/**
 * Generates prefixed, time-sortable identifiers such as {@code evt_01HQ3K5V9ZP7B2M4X6N8R0T1WC}.
 *
 * <p>The suffix is a ULID: 48 bits of epoch milliseconds followed by 80 random bits, encoded as
 * 26 Crockford base32 characters. Ids created in the same millisecond reuse the previous random
 * component plus one, so their string order matches creation order.
 */
@Component
public class IdGenerator {
  private static final char[] ALPHABET = "0123456789ABCDEFGHJKMNPQRSTVWXYZ".toCharArray();
  private static final int TIME_LENGTH = 10;
  private static final int RANDOM_LENGTH = 16;
  private static final long RANDOM_HIGH_MASK = 0xFFFFL;

  private final Clock clock;
  private final SecureRandom random = new SecureRandom();

  private long lastMillis = -1L;
  private long randomHigh;
  private long randomLow;

  public IdGenerator(Clock clock) {
    this.clock = clock;
  }

  public String generate(String prefix) {
    if (prefix == null || prefix.isBlank()) {
      throw new IllegalArgumentException("Id prefix is required");
    }
    return prefix + "_" + nextUlid();
  }

  private synchronized String nextUlid() {
    long now = clock.millis();
    if (now <= lastMillis) {
      if (!increment()) {
        // 80-bit space exhausted for this millisecond; move to the next one
        lastMillis++;
        reseed();
      }
    } else {
      lastMillis = now;
      reseed();
    }
    char[] out = new char[TIME_LENGTH + RANDOM_LENGTH];
    encodeTime(out, lastMillis);
    encodeRandom(out, randomHigh, randomLow);
    return new String(out);
  }

  private void reseed() {
    randomHigh = random.nextInt() & RANDOM_HIGH_MASK;
    randomLow = random.nextLong();
  }

  private boolean increment() {
    randomLow++;
    if (randomLow != 0L) {
      return true;
    }
    randomHigh++;
    return randomHigh <= RANDOM_HIGH_MASK;
  }

  private static void encodeTime(char[] out, long millis) {
    long value = millis;
    for (int i = TIME_LENGTH - 1; i >= 0; i--) {
      out[i] = ALPHABET[(int) (value & 0x1F)];
      value >>>= 5;
    }
  }

  private static void encodeRandom(char[] out, long high, long low) {
    long hi = high;
    long lo = low;
    for (int i = RANDOM_LENGTH - 1; i >= 0; i--) {
      out[TIME_LENGTH + i] = ALPHABET[(int) (lo & 0x1F)];
      lo = (lo >>> 5) | ((hi & 0x1F) << 59);
      hi >>>= 5;
    }
  }
}
