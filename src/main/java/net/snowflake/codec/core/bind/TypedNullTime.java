package net.snowflake.codec.core.bind;

import java.util.Objects;

/** SQL NULL bound as a temporal type */
public final class TypedNullTime {
  private final TimezoneType timezoneType;

  public TypedNullTime(TimezoneType timezoneType) {
    this.timezoneType = Objects.requireNonNull(timezoneType, "timezoneType");
  }

  public TimezoneType getTimezoneType() {
    return timezoneType;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof TypedNullTime && ((TypedNullTime) o).timezoneType == timezoneType;
  }

  @Override
  public int hashCode() {
    return timezoneType.hashCode();
  }

  @Override
  public String toString() {
    return "TypedNullTime{" + timezoneType + "}";
  }
}
