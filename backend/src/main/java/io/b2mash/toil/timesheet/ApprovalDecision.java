package io.b2mash.toil.timesheet;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ApprovalDecision {
  APPROVED,
  REJECTED;

  @JsonCreator
  public static ApprovalDecision fromValue(String value) {
    if (value == null) {
      return null;
    }
    return ApprovalDecision.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }

  @JsonValue
  public String toValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
