package net.snowflake.codec.core.bind;

import net.snowflake.codec.jdbc.SnowflakeType;

/**
 * Wire type of a bound temporal value. A ZonedDateTime, OffsetDateTime or Instant can be sent as
 * any of these, so binds of such values must name one.
 */
public enum TimezoneType {
  NTZ(SnowflakeType.TIMESTAMP_NTZ),
  LTZ(SnowflakeType.TIMESTAMP_LTZ),
  TZ(SnowflakeType.TIMESTAMP_TZ),
  DATE(SnowflakeType.DATE),
  TIME(SnowflakeType.TIME);

  private final SnowflakeType snowflakeType;

  TimezoneType(SnowflakeType snowflakeType) {
    this.snowflakeType = snowflakeType;
  }

  public SnowflakeType toSnowflakeType() {
    return snowflakeType;
  }
}
