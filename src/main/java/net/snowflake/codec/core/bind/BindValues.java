package net.snowflake.codec.core.bind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import net.snowflake.codec.jdbc.SnowflakeType;

/** Encoded bind: a wire type and one wire string per value, null entries for SQL NULL. */
public final class BindValues {
  private final SnowflakeType type;
  private final List<String> values;

  public BindValues(SnowflakeType type, List<String> values) {
    this.type = Objects.requireNonNull(type, "type");
    this.values = Collections.unmodifiableList(new ArrayList<>(values));
  }

  static BindValues single(SnowflakeType type, String value) {
    return new BindValues(type, Collections.singletonList(value));
  }

  public SnowflakeType getType() {
    return type;
  }

  public List<String> getValues() {
    return values;
  }

  /**
   * @return the first value, the only one for a scalar bind
   */
  public String getValue() {
    return values.isEmpty() ? null : values.get(0);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof BindValues)) {
      return false;
    }
    BindValues that = (BindValues) o;
    return type == that.type && values.equals(that.values);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, values);
  }

  @Override
  public String toString() {
    return "BindValues{" + type + "=" + values + "}";
  }
}
