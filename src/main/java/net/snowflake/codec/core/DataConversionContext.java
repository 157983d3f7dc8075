package net.snowflake.codec.core;

import java.util.Map;
import java.util.TimeZone;
import net.snowflake.codec.core.arrow.ArrowTimestampOption;
import net.snowflake.common.core.SnowflakeDateTimeFormat;

/**
 * Formatter info and conversion flags shared by all values of one result. Implementations are
 * immutable and safe to share between threads.
 */
public interface DataConversionContext {
  /**
   * @return session time zone used for TIMESTAMP_LTZ, never null
   */
  TimeZone getSessionTimeZone();

  /**
   * @return whether fixed point values are returned as BigInteger/BigDecimal
   */
  boolean isHigherPrecision();

  /**
   * @return whether map values of structured types are wrapped in Optional
   */
  boolean isMapValuesNullable();

  /**
   * @return whether text columns of Arrow batches are checked for invalid UTF-8
   */
  boolean isUtf8ValidationEnabled();

  /**
   * @return timestamp unit of rewritten Arrow batches
   */
  ArrowTimestampOption getArrowTimestampOption();

  SnowflakeDateTimeFormat getDateFormatter();

  SnowflakeDateTimeFormat getTimeFormatter();

  SnowflakeDateTimeFormat getTimestampNTZFormatter();

  SnowflakeDateTimeFormat getTimestampLTZFormatter();

  SnowflakeDateTimeFormat getTimestampTZFormatter();

  /**
   * @return session parameters the context was built from
   */
  Map<String, String> getParameters();
}
