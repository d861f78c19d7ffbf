package com.ledgersync.reconcile;

import com.ledgersync.store.AccountSnapshot;
import com.ledgersync.store.UserSnapshot;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(4)
public class AccountsStage implements ReconciliationStage {
  @Override
  public String name() {
    return "accounts & users";
  }

  @Override
  public void run(VerificationContext context, StageRecorder recorder) {
    List<AccountSnapshot> legacyAccounts = context.legacy().integrationAccounts();
    List<AccountSnapshot> relationalAccounts = context.relational().integrationAccounts();
    recorder.expectEqual("integration account count", legacyAccounts.size(), relationalAccounts.size());
    Set<AccountSnapshot> relationalSet = new HashSet<>(relationalAccounts);
    for (AccountSnapshot account : legacyAccounts) {
      if (relationalSet.contains(account)) {
        recorder.pass("integration account " + account.source());
      } else {
        recorder.fail("integration account " + account.source() + " (" + account.displayName() + ") not found");
      }
    }

    List<UserSnapshot> legacyUsers = context.legacy().users();
    List<UserSnapshot> relationalUserList = context.relational().users();
    Map<String, UserSnapshot> relationalUsers = byEmail(relationalUserList);
    recorder.expectEqual("user count", legacyUsers.size(), relationalUserList.size());
    for (UserSnapshot user : legacyUsers) {
      if (user.email() == null || user.email().isBlank()) {
        recorder.warn("legacy user without email cannot be matched");
        continue;
      }
      UserSnapshot actual = relationalUsers.get(user.email());
      if (actual == null) {
        recorder.fail("user " + user.email() + " missing from relational store");
        continue;
      }
      recorder.expectEqual("user " + user.email() + " first name", user.firstName(), actual.firstName());
      recorder.expectEqual("user " + user.email() + " last name", user.lastName(), actual.lastName());
    }
  }

  private static Map<String, UserSnapshot> byEmail(List<UserSnapshot> users) {
    Map<String, UserSnapshot> result = new LinkedHashMap<>();
    for (UserSnapshot user : users) {
      if (user.email() != null) {
        result.put(user.email(), user);
      }
    }
    return result;
  }
}
