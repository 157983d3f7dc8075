package net.snowflake.codec.core.bind;

import java.util.Collection;
import java.util.Objects;
import net.snowflake.codec.jdbc.SnowflakeType;

/**
 * Array of values bound to one parameter for bulk inserts. The values are a Java array or a
 * Collection; the element type is inferred from the values unless it is given explicitly.
 */
public final class ArrayBinding {
  private final Object values;
  private final SnowflakeType type;
  private final TimezoneType timezoneType;

  private ArrayBinding(Object values, SnowflakeType type, TimezoneType timezoneType) {
    Objects.requireNonNull(values, "values");
    if (!values.getClass().isArray() && !(values instanceof Collection)) {
      throw new IllegalArgumentException(
          "array binding needs an array or a collection, got " + values.getClass().getName());
    }
    this.values = values;
    this.type = type;
    this.timezoneType = timezoneType;
  }

  public static ArrayBinding of(Object values) {
    return new ArrayBinding(values, null, null);
  }

  /**
   * @param values array or collection of temporal values
   * @param timezoneType wire type of the temporal values
   * @return the binding
   */
  public static ArrayBinding of(Object values, TimezoneType timezoneType) {
    return new ArrayBinding(values, null, timezoneType);
  }

  /**
   * @param values array or collection
   * @param type wire type of every element, overrides inference
   * @return the binding
   */
  public static ArrayBinding of(Object values, SnowflakeType type) {
    return new ArrayBinding(values, type, null);
  }

  public Object getValues() {
    return values;
  }

  /**
   * @return the explicit element type or null
   */
  public SnowflakeType getType() {
    return type;
  }

  /**
   * @return the temporal wire type or null
   */
  public TimezoneType getTimezoneType() {
    return timezoneType;
  }
}
