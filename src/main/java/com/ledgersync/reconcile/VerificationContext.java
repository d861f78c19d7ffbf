package com.ledgersync.reconcile;

import com.ledgersync.store.LedgerStore;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Random;

public record VerificationContext(
    LedgerStore legacy,
    LedgerStore relational,
    VerificationMode mode,
    int sampleSize,
    Random random) {

  public List<String> select(Collection<String> keys) {
    List<String> all = new ArrayList<>(keys);
    if (mode == VerificationMode.THOROUGH || all.size() <= sampleSize) {
      return all;
    }
    Collections.shuffle(all, random);
    return all.subList(0, sampleSize);
  }
}
