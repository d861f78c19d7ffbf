package com.ledgersync.reconcile;

import com.ledgersync.store.EventSnapshot;
import java.util.Map;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(3)
public class EventsStage implements ReconciliationStage {
  @Override
  public String name() {
    return "events & relationships";
  }

  @Override
  public void run(VerificationContext context, StageRecorder recorder) {
    Map<String, EventSnapshot> legacy = context.legacy().events();
    Map<String, EventSnapshot> relational = context.relational().events();
    recorder.expectEqual("event count", legacy.size(), relational.size());

    for (String key : context.select(legacy.keySet())) {
      EventSnapshot expected = legacy.get(key);
      EventSnapshot actual = relational.get(key);
      if (actual == null) {
        recorder.fail("event " + key + " missing from relational store");
        continue;
      }
      recorder.expectEqual("event " + key + " description", expected.description(), actual.description());
      recorder.expectEqual("event " + key + " category", expected.category(), actual.category());
      recorder.expectEqual("event " + key + " duplicate flag", expected.duplicate(), actual.duplicate());
      recorder.expectEqual("event " + key + " line items", expected.lineItemCount(), actual.lineItemCount());
      recorder.expectEqual("event " + key + " tags", expected.tagCount(), actual.tagCount());
    }
  }
}
