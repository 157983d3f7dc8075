package net.snowflake.codec.core;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.TimeZone;
import net.snowflake.codec.jdbc.ErrorCode;
import net.snowflake.codec.jdbc.SnowflakeType;
import net.snowflake.codec.jdbc.SnowflakeUtil;
import net.snowflake.codec.log.SFLogger;
import net.snowflake.codec.log.SFLoggerFactory;
import net.snowflake.common.core.SFTimestamp;
import net.snowflake.common.core.SnowflakeDateTimeFormat;

/**
 * Date, time and timestamp conversions shared by the JSON and Arrow paths.
 *
 * <p>Wire conventions:
 *
 * <ul>
 *   <li>DATE is a number of days since epoch.
 *   <li>TIME is a count of 10^-scale seconds since midnight, or "seconds.fraction".
 *   <li>TIMESTAMP_NTZ/LTZ are "seconds.fraction" or a count of 10^-scale seconds since epoch.
 *   <li>TIMESTAMP_TZ is the TIMESTAMP_NTZ form followed by a space and the offset in minutes plus
 *       1440.
 * </ul>
 */
public final class TemporalCodec {
  private static final SFLogger logger = SFLoggerFactory.getLogger(TemporalCodec.class);

  /** Bias added to the offset in minutes of TIMESTAMP_TZ values */
  public static final int TZ_OFFSET_BIAS = 1440;

  static final long NANOS_PER_SECOND = 1_000_000_000L;
  static final long SECONDS_PER_DAY = 86_400L;
  static final long NANOS_PER_DAY = SECONDS_PER_DAY * NANOS_PER_SECOND;
  private static final BigInteger BI_NANOS_PER_SECOND = BigInteger.valueOf(NANOS_PER_SECOND);

  private static final long[] POWERS_OF_10 = {
    1L,
    10L,
    100L,
    1_000L,
    10_000L,
    100_000L,
    1_000_000L,
    10_000_000L,
    100_000_000L,
    1_000_000_000L,
    10_000_000_000L,
    100_000_000_000L,
    1_000_000_000_000L,
    10_000_000_000_000L,
    100_000_000_000_000L,
    1_000_000_000_000_000L,
    10_000_000_000_000_000L,
    100_000_000_000_000_000L,
    1_000_000_000_000_000_000L
  };

  private TemporalCodec() {}

  /**
   * @param pow exponent between 0 and 18
   * @return 10^pow
   */
  public static long powerOfTen(int pow) {
    if (pow < 0 || pow >= POWERS_OF_10.length) {
      throw new IllegalArgumentException("power of ten out of range: " + pow);
    }
    return POWERS_OF_10[pow];
  }

  // ---------------------------------------------------------------------------------------------
  // decoding
  // ---------------------------------------------------------------------------------------------

  /**
   * @param days days since epoch
   * @return midnight UTC of that day
   */
  public static ZonedDateTime decodeDate(long days) {
    return ZonedDateTime.ofInstant(
        Instant.ofEpochSecond(Math.multiplyExact(days, SECONDS_PER_DAY)), ZoneOffset.UTC);
  }

  public static ZonedDateTime decodeDate(String raw, String fieldName) throws SFException {
    try {
      return decodeDate(Long.parseLong(raw.trim()));
    } catch (NumberFormatException | ArithmeticException | DateTimeException ex) {
      throw invalidValue(ex, SnowflakeType.DATE, SnowflakeUtil.DATE_STR, raw, fieldName);
    }
  }

  /**
   * @param raw "seconds.fraction" or a count of 10^-scale seconds since midnight
   * @param scale fractional second digits of the column
   * @param fieldName name reported in errors
   * @return time of day
   * @throws SFException if the value is not a number or not within a day
   */
  public static LocalTime decodeTime(String raw, int scale, String fieldName) throws SFException {
    try {
      BigDecimal seconds = parseScaledDecimal(raw, scale);
      long nanos = seconds.movePointRight(9).setScale(0, RoundingMode.DOWN).longValueExact();
      return LocalTime.ofNanoOfDay(nanos);
    } catch (NumberFormatException | ArithmeticException | DateTimeException ex) {
      throw invalidValue(ex, SnowflakeType.TIME, SnowflakeUtil.TIME_STR, raw, fieldName);
    }
  }

  /**
   * @param value count of 10^-scale seconds since midnight, as read from a columnar batch
   * @param scale fractional second digits of the column
   * @return time of day
   */
  public static LocalTime decodeTime(long value, int scale) {
    return LocalTime.ofNanoOfDay(scaleTimeNanos(value, scale));
  }

  /**
   * Split a wire timestamp into seconds and nanoseconds. A value with a decimal point is read as
   * seconds and a fraction that is zero padded or truncated to 9 digits. A value without one is a
   * count of 10^-scale seconds.
   *
   * @param raw wire value
   * @param scale fractional second digits of the column
   * @param fieldName name reported in errors
   * @return the instant
   * @throws SFException if the value is not a number
   */
  public static Instant extractTimestamp(String raw, int scale, String fieldName)
      throws SFException {
    try {
      BigDecimal seconds = parseScaledDecimal(raw, scale);
      BigDecimal whole = seconds.setScale(0, RoundingMode.FLOOR);
      long nanos =
          seconds.subtract(whole).movePointRight(9).setScale(0, RoundingMode.DOWN).longValueExact();
      return Instant.ofEpochSecond(whole.longValueExact(), nanos);
    } catch (NumberFormatException | ArithmeticException | DateTimeException ex) {
      throw invalidValue(
          ex, SnowflakeType.TIMESTAMP_NTZ, SnowflakeUtil.TIMESTAMP_STR, raw, fieldName);
    }
  }

  public static ZonedDateTime decodeNtz(String raw, int scale, String fieldName)
      throws SFException {
    return ZonedDateTime.ofInstant(extractTimestamp(raw, scale, fieldName), ZoneOffset.UTC);
  }

  /**
   * @param raw wire value
   * @param scale fractional second digits
   * @param sessionTimeZone session time zone, the JVM default is used when null
   * @param fieldName name reported in errors
   * @return the timestamp in the session zone
   * @throws SFException if the value is not a number
   */
  public static ZonedDateTime decodeLtz(
      String raw, int scale, TimeZone sessionTimeZone, String fieldName) throws SFException {
    return ZonedDateTime.ofInstant(
        extractTimestamp(raw, scale, fieldName), toZoneId(sessionTimeZone));
  }

  /**
   * @param raw "value offset", offset being minutes plus 1440
   * @param scale fractional second digits
   * @param fieldName name reported in errors
   * @return the timestamp with a fixed offset zone
   * @throws SFException if the value does not have two tokens or the offset is not valid
   */
  public static ZonedDateTime decodeTz(String raw, int scale, String fieldName)
      throws SFException {
    String[] tokens = raw.split(" ");
    if (tokens.length != 2) {
      throw new SFException(ErrorCode.INVALID_TIMESTAMP_TZ, fieldName, raw);
    }
    int biasedOffset;
    try {
      biasedOffset = Integer.parseInt(tokens[1]);
    } catch (NumberFormatException ex) {
      throw new SFException(ex, ErrorCode.INVALID_TIMESTAMP_TZ, fieldName, raw);
    }
    Instant instant = extractTimestamp(tokens[0], scale, fieldName);
    return atBiasedOffset(instant, biasedOffset, fieldName, raw);
  }

  /**
   * TIMESTAMP_TZ read from the struct layouts of a columnar batch.
   *
   * @param epochSeconds seconds since epoch
   * @param nanos nanosecond fraction, may be negative
   * @param biasedOffset offset in minutes plus 1440
   * @param fieldName name reported in errors
   * @return the timestamp with a fixed offset zone
   * @throws SFException if the offset is out of range
   */
  public static ZonedDateTime decodeTz(
      long epochSeconds, long nanos, int biasedOffset, String fieldName) throws SFException {
    return atBiasedOffset(
        Instant.ofEpochSecond(epochSeconds, nanos),
        biasedOffset,
        fieldName,
        epochSeconds + "." + nanos + " " + biasedOffset);
  }

  private static ZonedDateTime atBiasedOffset(
      Instant instant, int biasedOffset, String fieldName, String raw) throws SFException {
    try {
      ZoneOffset offset = ZoneOffset.ofTotalSeconds((biasedOffset - TZ_OFFSET_BIAS) * 60);
      return ZonedDateTime.ofInstant(instant, offset);
    } catch (DateTimeException ex) {
      throw new SFException(ex, ErrorCode.INVALID_TIMESTAMP_TZ, fieldName, raw);
    }
  }

  /** Seconds part of a count of 10^-scale seconds */
  public static long extractEpoch(long value, int scale) {
    return value / powerOfTen(scale);
  }

  /** Nanosecond part of a count of 10^-scale seconds, negative for negative values */
  public static long extractFraction(long value, int scale) {
    return (value % powerOfTen(scale)) * powerOfTen(9 - scale);
  }

  /** Count of 10^-scale seconds to nanoseconds */
  public static long scaleTimeNanos(long value, int scale) {
    return value * powerOfTen(9 - scale);
  }

  static ZoneId toZoneId(TimeZone timeZone) {
    return timeZone == null ? ZoneId.systemDefault() : timeZone.toZoneId();
  }

  private static BigDecimal parseScaledDecimal(String raw, int scale) {
    String trimmed = raw.trim();
    BigDecimal value = new BigDecimal(trimmed);
    if (trimmed.indexOf('.') < 0 && scale > 0) {
      value = value.movePointLeft(scale);
    }
    return value;
  }

  // ---------------------------------------------------------------------------------------------
  // session formatted values, used by nested fields of structured types
  // ---------------------------------------------------------------------------------------------

  /**
   * Parse a date formatted with DATE_OUTPUT_FORMAT.
   *
   * @return midnight UTC of the parsed day
   */
  public static ZonedDateTime parseDate(String value, DataConversionContext context, String field)
      throws SFException {
    SFTimestamp timestamp = parseFormatted(context.getDateFormatter(), value, null, field);
    LocalDate date = Instant.ofEpochMilli(timestamp.getTime()).atZone(ZoneOffset.UTC).toLocalDate();
    return date.atStartOfDay(ZoneOffset.UTC);
  }

  /** Parse a time formatted with TIME_OUTPUT_FORMAT. */
  public static LocalTime parseTime(String value, DataConversionContext context, String field)
      throws SFException {
    SFTimestamp timestamp = parseFormatted(context.getTimeFormatter(), value, null, field);
    Instant instant = timestamp.getTimestamp().toInstant();
    long nanosOfDay =
        Math.floorMod(instant.getEpochSecond(), SECONDS_PER_DAY) * NANOS_PER_SECOND
            + instant.getNano();
    return LocalTime.ofNanoOfDay(nanosOfDay);
  }

  /**
   * Parse a timestamp formatted with the output format of its kind.
   *
   * @param type TIMESTAMP_NTZ, TIMESTAMP_LTZ or TIMESTAMP_TZ
   * @param value formatted value
   * @param context session formats and time zone
   * @param field name reported in errors
   * @return the timestamp: UTC for NTZ, session zone for LTZ, parsed zone for TZ
   * @throws SFException if the value does not match the format
   */
  public static ZonedDateTime parseTimestamp(
      SnowflakeType type, String value, DataConversionContext context, String field)
      throws SFException {
    switch (type) {
      case TIMESTAMP_NTZ:
        {
          SFTimestamp ts =
              parseFormatted(
                  context.getTimestampNTZFormatter(), value, TimeZone.getTimeZone("UTC"), field);
          return ZonedDateTime.ofInstant(ts.getTimestamp().toInstant(), ZoneOffset.UTC);
        }
      case TIMESTAMP_LTZ:
        {
          TimeZone tz = context.getSessionTimeZone();
          SFTimestamp ts = parseFormatted(context.getTimestampLTZFormatter(), value, tz, field);
          return ZonedDateTime.ofInstant(ts.getTimestamp().toInstant(), toZoneId(tz));
        }
      case TIMESTAMP_TZ:
        {
          TimeZone tz = context.getSessionTimeZone();
          SFTimestamp ts = parseFormatted(context.getTimestampTZFormatter(), value, tz, field);
          TimeZone parsedZone = ts.getTimeZone() != null ? ts.getTimeZone() : tz;
          ZonedDateTime parsed =
              ZonedDateTime.ofInstant(ts.getTimestamp().toInstant(), toZoneId(parsedZone));
          // same fixed offset zone as the wire form
          return parsed.withZoneSameInstant(parsed.getOffset());
        }
      default:
        throw new SFException(ErrorCode.DATA_TYPE_NOT_SUPPORTED, type.name());
    }
  }

  private static SFTimestamp parseFormatted(
      SnowflakeDateTimeFormat formatter, String value, TimeZone tz, String field)
      throws SFException {
    SFTimestamp timestamp;
    try {
      timestamp = tz == null ? formatter.parse(value) : formatter.parse(value, tz, 0, false);
    } catch (LinkageError error) {
      // snowflake-common's time zone class extends sun.util.calendar.ZoneInfo
      logger.error(
          "Cannot parse {} of field {}, the JVM needs {}",
          value,
          field,
          "--add-exports=java.base/sun.util.calendar=ALL-UNNAMED");
      throw new SFException(
          error,
          ErrorCode.INVALID_VALUE_CONVERT,
          SnowflakeUtil.STRING_STR,
          SnowflakeUtil.TIMESTAMP_STR,
          value,
          SnowflakeUtil.describeField(field));
    }
    if (timestamp == null) {
      logger.debug(
          "Value {} of field {} does not match format {}",
          value,
          field,
          formatter.toSimpleDateTimePattern());
      throw new SFException(
          ErrorCode.INVALID_VALUE_CONVERT,
          SnowflakeUtil.STRING_STR,
          SnowflakeUtil.TIMESTAMP_STR,
          value,
          SnowflakeUtil.describeField(field));
    }
    return timestamp;
  }

  // ---------------------------------------------------------------------------------------------
  // encoding
  // ---------------------------------------------------------------------------------------------

  /**
   * @param value timestamp
   * @return days since epoch of its local date
   */
  public static long encodeDate(ZonedDateTime value) {
    long localSeconds = value.toEpochSecond() + value.getOffset().getTotalSeconds();
    return Math.floorDiv(localSeconds, SECONDS_PER_DAY);
  }

  /**
   * @param value timestamp
   * @return milliseconds since epoch of midnight UTC of its local date
   */
  public static long encodeDateMillis(ZonedDateTime value) {
    return encodeDate(value) * SECONDS_PER_DAY * 1000L;
  }

  /**
   * @return nanoseconds since midnight
   */
  public static long encodeTime(LocalTime value) {
    return value.toNanoOfDay();
  }

  /**
   * @return nanoseconds since epoch, exact for any instant
   */
  public static String encodeTimestamp(Instant value) {
    return epochNanos(value).toString();
  }

  /**
   * @return "nanos offset" with the offset in minutes plus 1440
   */
  public static String encodeTimestampTz(ZonedDateTime value) {
    return encodeTimestamp(value.toInstant()) + " " + biasedOffset(value);
  }

  /**
   * Offset of a timestamp in minutes plus 1440. Sub minute offsets are truncated.
   *
   * @param value timestamp
   * @return biased offset
   */
  public static int biasedOffset(ZonedDateTime value) {
    return value.getOffset().getTotalSeconds() / 60 + TZ_OFFSET_BIAS;
  }

  static BigInteger epochNanos(Instant value) {
    return BigInteger.valueOf(value.getEpochSecond())
        .multiply(BI_NANOS_PER_SECOND)
        .add(BigInteger.valueOf(value.getNano()));
  }

  /**
   * Local date and time of a timestamp as "yyyy-MM-dd HH:mm:ss.fffffffff", with trailing zeros of
   * the fraction removed and no fraction at all when it is zero.
   */
  public static String formatStreamTimestamp(ZonedDateTime value) {
    LocalDateTime local = value.toLocalDateTime();
    StringBuilder sb =
        new StringBuilder(
            String.format(
                "%04d-%02d-%02d %02d:%02d:%02d",
                local.getYear(),
                local.getMonthValue(),
                local.getDayOfMonth(),
                local.getHour(),
                local.getMinute(),
                local.getSecond()));
    int nanos = local.getNano();
    if (nanos != 0) {
      String fraction = String.format("%09d", nanos);
      int end = fraction.length();
      while (fraction.charAt(end - 1) == '0') {
        end--;
      }
      sb.append('.').append(fraction, 0, end);
    }
    return sb.toString();
  }

  /**
   * @return "HH:mm:ss.nnnnnnnnn"
   */
  public static String formatStreamTime(LocalTime value) {
    return String.format(
        "%02d:%02d:%02d.%09d",
        value.getHour(), value.getMinute(), value.getSecond(), value.getNano());
  }

  private static SFException invalidValue(
      Throwable cause, SnowflakeType type, String target, String raw, String fieldName) {
    return new SFException(
        cause,
        ErrorCode.INVALID_VALUE_CONVERT,
        type,
        target,
        raw,
        SnowflakeUtil.describeField(fieldName));
  }
}
