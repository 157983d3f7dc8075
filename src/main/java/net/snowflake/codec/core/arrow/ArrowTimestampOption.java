package net.snowflake.codec.core.arrow;

import java.util.Locale;
import net.snowflake.codec.core.SFException;
import net.snowflake.codec.core.SessionParameters;
import net.snowflake.codec.jdbc.ErrorCode;
import org.apache.arrow.vector.types.TimeUnit;

/** Time unit of timestamp columns in rewritten Arrow batches */
public enum ArrowTimestampOption {
  NANOSECOND(TimeUnit.NANOSECOND, 9),
  MICROSECOND(TimeUnit.MICROSECOND, 6),
  MILLISECOND(TimeUnit.MILLISECOND, 3),
  SECOND(TimeUnit.SECOND, 0),
  /** Keep the wire layout (scaled BigInt or epoch/fraction struct) */
  ORIGINAL(null, -1);

  private final TimeUnit timeUnit;
  private final int scale;

  ArrowTimestampOption(TimeUnit timeUnit, int scale) {
    this.timeUnit = timeUnit;
    this.scale = scale;
  }

  public TimeUnit getTimeUnit() {
    return timeUnit;
  }

  /**
   * @return number of fractional second digits kept by this unit
   */
  public int getScale() {
    return scale;
  }

  /**
   * @param name option name, case insensitive; null or empty selects NANOSECOND
   * @return the option
   * @throws SFException if the name is not an option
   */
  public static ArrowTimestampOption fromString(String name) throws SFException {
    if (name == null || name.trim().isEmpty()) {
      return NANOSECOND;
    }
    try {
      return ArrowTimestampOption.valueOf(name.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new SFException(
          ex, ErrorCode.INVALID_PARAMETER_VALUE, SessionParameters.ARROW_TIMESTAMP_OPTION, name);
    }
  }
}
