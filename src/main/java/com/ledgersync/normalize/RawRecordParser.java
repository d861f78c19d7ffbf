package com.ledgersync.normalize;

import static com.ledgersync.normalize.FieldValidator.optionalText;
import static com.ledgersync.normalize.FieldValidator.requireField;
import static com.ledgersync.normalize.FieldValidator.requireObject;
import static com.ledgersync.normalize.FieldValidator.requireText;
import static com.ledgersync.normalize.FieldValidator.validateAmount;
import static com.ledgersync.normalize.FieldValidator.validateDate;
import static com.ledgersync.normalize.FieldValidator.validatePosixTimestamp;

import com.ledgersync.config.SyncProperties;
import com.ledgersync.exception.InvalidAmountException;
import com.ledgersync.exception.MissingFieldException;
import com.ledgersync.model.TransactionSource;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.stereotype.Component;

@Component
public class RawRecordParser {
  private final SyncProperties properties;

  public RawRecordParser(SyncProperties properties) {
    this.properties = properties;
  }

  public RawRecord parse(TransactionSource source, Map<String, Object> document) {
    if (document == null) {
      throw new MissingFieldException("document", source.name().toLowerCase());
    }
    Map<String, Object> copy = new LinkedHashMap<>(document);
    // legacy documents carry store-native ids (ObjectId); keep them as plain text
    copy.computeIfPresent("_id", (key, value) -> value instanceof Number ? value : String.valueOf(value));
    return switch (source) {
      case STRIPE -> parseStripe(copy);
      case VENMO -> parseVenmo(copy);
      case SPLITWISE -> parseSplitwise(copy);
      case CASH -> parseCash(copy);
      case MANUAL -> throw new IllegalArgumentException(
          "Manual transactions are entered directly and have no raw document format");
    };
  }

  private StripeRecord parseStripe(Map<String, Object> doc) {
    String id = sourceId(doc, "stripe transaction");
    String context = "stripe transaction " + id;
    BigDecimal cents = validateAmount(requireField(doc, "amount", context), "amount");
    if (cents.stripTrailingZeros().scale() > 0) {
      throw new InvalidAmountException("amount", doc.get("amount"), "expected integer cents");
    }
    return new StripeRecord(
        id,
        validatePosixTimestamp(requireField(doc, "transacted_at", context), "transacted_at"),
        requireText(doc, "description", context),
        cents,
        optionalText(doc, "account"),
        optionalText(doc, "account_display_name"),
        doc);
  }

  private VenmoRecord parseVenmo(Map<String, Object> doc) {
    String id = sourceId(doc, "venmo transaction");
    String context = "venmo transaction " + id;
    Map<String, Object> actor = requireObject(doc, "actor", context);
    Map<String, Object> target = requireObject(doc, "target", context);
    return new VenmoRecord(
        id,
        validatePosixTimestamp(requireField(doc, "date_created", context), "date_created"),
        requireText(actor, "first_name", context + " actor"),
        requireText(target, "first_name", context + " target"),
        requireText(doc, "payment_type", context).toLowerCase(),
        nullToEmpty(optionalText(doc, "note")),
        validateAmount(requireField(doc, "amount", context), "amount", false),
        doc);
  }

  private SplitwiseRecord parseSplitwise(Map<String, Object> doc) {
    String id = sourceId(doc, "splitwise expense");
    String context = "splitwise expense " + id;
    Object rawUsers = requireField(doc, "users", context);
    if (!(rawUsers instanceof Collection<?> users)) {
      throw new MissingFieldException("users", context);
    }
    List<SplitwiseRecord.Participant> participants = new ArrayList<>();
    for (Object rawUser : users) {
      if (!(rawUser instanceof Map<?, ?> user)) {
        throw new MissingFieldException("users[]", context);
      }
      Map<String, Object> fields = FieldValidator.fieldsOf(user);
      participants.add(new SplitwiseRecord.Participant(
          requireText(fields, "first_name", context + " user"),
          validateAmount(requireField(fields, "net_balance", context + " user"), "net_balance")));
    }
    return new SplitwiseRecord(
        id,
        validateDate(requireField(doc, "date", context), "date", properties.zone()),
        requireText(doc, "description", context),
        participants,
        optionalText(doc, "deleted_at") != null,
        doc);
  }

  private CashRecord parseCash(Map<String, Object> doc) {
    String context = "cash transaction";
    Object date = requireField(doc, "date", context);
    String person = requireText(doc, "person", context);
    String description = requireText(doc, "description", context);
    BigDecimal amount = validateAmount(requireField(doc, "amount", context), "amount", false);
    String id = firstNonBlank(optionalText(doc, "id"), optionalText(doc, "_id"));
    if (id == null) {
      id = cashNaturalKey(String.valueOf(date), person, description, amount);
    }
    return new CashRecord(
        id,
        validateDate(date, "date", properties.zone()),
        person,
        description,
        amount,
        doc);
  }

  // Identical cash submissions map to the same key.
  public static String cashNaturalKey(String date, String person, String description, BigDecimal amount) {
    String material = String.join("|",
        date.trim(),
        person.trim(),
        description.trim(),
        amount.setScale(FieldValidator.AMOUNT_SCALE).toPlainString());
    return UUID.nameUUIDFromBytes(material.getBytes(StandardCharsets.UTF_8)).toString();
  }

  private static String sourceId(Map<String, Object> doc, String context) {
    String id = firstNonBlank(optionalText(doc, "id"), optionalText(doc, "_id"));
    if (id == null) {
      throw new MissingFieldException("id", context);
    }
    return id;
  }

  private static String firstNonBlank(String... values) {
    for (String value : values) {
      if (value != null && !value.isBlank()) {
        return value;
      }
    }
    return null;
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
