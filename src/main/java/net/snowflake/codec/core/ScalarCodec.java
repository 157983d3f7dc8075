package net.snowflake.codec.core;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.TimeZone;
import net.snowflake.codec.core.structs.StructuredTypeBuilder;
import net.snowflake.codec.jdbc.ErrorCode;
import net.snowflake.codec.jdbc.FieldMetadata;
import net.snowflake.codec.jdbc.SnowflakeType;
import net.snowflake.codec.jdbc.SnowflakeUtil;
import net.snowflake.codec.log.SFLogger;
import net.snowflake.codec.log.SFLoggerFactory;
import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;

/**
 * Converts wire strings of the JSON row format to Java values and back.
 *
 * <p>Decoded types: FIXED is a BigInteger/BigDecimal in higher precision mode and a decimal String
 * otherwise, REAL a Double, BOOLEAN a Boolean, BINARY a byte[], TIME a LocalTime, DATE and the
 * timestamps a ZonedDateTime, and TEXT/VARIANT a String. SQL NULL is always null.
 */
public final class ScalarCodec {
  private static final SFLogger logger = SFLoggerFactory.getLogger(ScalarCodec.class);

  private ScalarCodec() {}

  /**
   * Decode one cell of a JSON row, nested values included.
   *
   * @param field column metadata
   * @param raw wire string, null for SQL NULL
   * @param context session formats and flags
   * @return the Java value
   * @throws SFException if the value cannot be converted
   */
  public static Object decode(FieldMetadata field, String raw, DataConversionContext context)
      throws SFException {
    if (raw == null) {
      return null;
    }
    if (field.getBase().isStructured()) {
      return StructuredTypeBuilder.build(raw, field, context);
    }
    return decodeScalar(
        field.getBase(),
        field.getScale(),
        raw,
        field.getName(),
        context.getSessionTimeZone(),
        context.isHigherPrecision());
  }

  public static Object decodeScalar(
      SnowflakeType type, int scale, String raw, TimeZone locationHint, boolean higherPrecision)
      throws SFException {
    return decodeScalar(type, scale, raw, null, locationHint, higherPrecision);
  }

  /**
   * Decode a flat type.
   *
   * @param type wire type
   * @param scale scale of FIXED and temporal types
   * @param raw wire string, null for SQL NULL
   * @param fieldName name reported in errors
   * @param locationHint session time zone for TIMESTAMP_LTZ
   * @param higherPrecision whether FIXED becomes BigInteger/BigDecimal
   * @return the Java value
   * @throws SFException if the value cannot be converted
   */
  public static Object decodeScalar(
      SnowflakeType type,
      int scale,
      String raw,
      String fieldName,
      TimeZone locationHint,
      boolean higherPrecision)
      throws SFException {
    if (raw == null) {
      return null;
    }
    switch (type) {
      case FIXED:
        return decodeFixed(raw, scale, fieldName, higherPrecision);
      case REAL:
        return decodeReal(raw, fieldName);
      case BOOLEAN:
        return decodeBoolean(raw, fieldName);
      case BINARY:
        return decodeBinary(raw, fieldName);
      case DATE:
        return TemporalCodec.decodeDate(raw, fieldName);
      case TIME:
        return TemporalCodec.decodeTime(raw, scale, fieldName);
      case TIMESTAMP_NTZ:
        return TemporalCodec.decodeNtz(raw, scale, fieldName);
      case TIMESTAMP_LTZ:
        return TemporalCodec.decodeLtz(raw, scale, locationHint, fieldName);
      case TIMESTAMP_TZ:
        return TemporalCodec.decodeTz(raw, scale, fieldName);
      case TEXT:
      case VARIANT:
      case OBJECT:
      case ARRAY:
      case MAP:
        return raw;
      default:
        throw new SFException(ErrorCode.DATA_TYPE_NOT_SUPPORTED, type.name());
    }
  }

  private static Object decodeFixed(
      String raw, int scale, String fieldName, boolean higherPrecision) throws SFException {
    BigDecimal value;
    try {
      value = new BigDecimal(raw.trim());
    } catch (NumberFormatException ex) {
      throw new SFException(
          ex,
          ErrorCode.INVALID_VALUE_CONVERT,
          SnowflakeType.FIXED,
          "number",
          raw,
          SnowflakeUtil.describeField(fieldName));
    }
    if (scale == 0) {
      if (higherPrecision) {
        try {
          return value.toBigIntegerExact();
        } catch (ArithmeticException ex) {
          throw new SFException(
              ex,
              ErrorCode.INVALID_VALUE_CONVERT,
              SnowflakeType.FIXED,
              SnowflakeUtil.BIG_INTEGER_STR,
              raw,
              SnowflakeUtil.describeField(fieldName));
        }
      }
      return raw;
    }
    BigDecimal scaled = value.setScale(scale, RoundingMode.HALF_UP);
    return higherPrecision ? scaled : scaled.toPlainString();
  }

  private static Double decodeReal(String raw, String fieldName) throws SFException {
    try {
      return Double.valueOf(raw.trim());
    } catch (NumberFormatException ex) {
      // the server sends special values in upper case
      switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "nan":
          return Double.NaN;
        case "inf":
        case "infinity":
          return Double.POSITIVE_INFINITY;
        case "-inf":
        case "-infinity":
          return Double.NEGATIVE_INFINITY;
        default:
          throw new SFException(
              ex,
              ErrorCode.INVALID_VALUE_CONVERT,
              SnowflakeType.REAL,
              SnowflakeUtil.DOUBLE_STR,
              raw,
              SnowflakeUtil.describeField(fieldName));
      }
    }
  }

  private static Boolean decodeBoolean(String raw, String fieldName) throws SFException {
    switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "1":
      case "true":
        return Boolean.TRUE;
      case "0":
      case "false":
        return Boolean.FALSE;
      default:
        throw new SFException(
            ErrorCode.INVALID_VALUE_CONVERT,
            SnowflakeType.BOOLEAN,
            SnowflakeUtil.BOOLEAN_STR,
            raw,
            SnowflakeUtil.describeField(fieldName));
    }
  }

  /**
   * @param raw hex text
   * @param fieldName name reported in errors
   * @return decoded bytes
   * @throws SFException if the text is not valid hex
   */
  public static byte[] decodeBinary(String raw, String fieldName) throws SFException {
    try {
      return Hex.decodeHex(raw);
    } catch (DecoderException ex) {
      throw new SFException(ex, ErrorCode.INVALID_BINARY_HEX_FORM, fieldName, raw);
    }
  }

  /**
   * Normalized conversion of a FIXED value, shared by every wire encoding.
   *
   * @param unscaled unscaled integer value
   * @param scale column scale
   * @param higherPrecision whether to return BigInteger/BigDecimal
   * @return BigInteger or BigDecimal in higher precision mode, otherwise the decimal String with
   *     exactly scale fractional digits
   */
  public static Object fixedToValue(BigInteger unscaled, int scale, boolean higherPrecision) {
    if (scale == 0) {
      return higherPrecision ? unscaled : unscaled.toString();
    }
    BigDecimal value = new BigDecimal(unscaled, scale);
    return higherPrecision ? value : value.toPlainString();
  }

  /**
   * Conversion of a FIXED value nested in a structured type.
   *
   * @return Long or Double by default, BigInteger or BigDecimal in higher precision mode
   */
  public static Object fixedToNestedValue(
      BigDecimal value, int scale, boolean higherPrecision, String fieldName) throws SFException {
    try {
      if (scale == 0) {
        BigInteger integer = value.toBigIntegerExact();
        return higherPrecision ? integer : integer.longValueExact();
      }
      return higherPrecision ? value.setScale(scale, RoundingMode.HALF_UP) : value.doubleValue();
    } catch (ArithmeticException ex) {
      throw new SFException(
          ex,
          ErrorCode.INVALID_VALUE_CONVERT,
          SnowflakeType.FIXED,
          higherPrecision ? SnowflakeUtil.BIG_INTEGER_STR : SnowflakeUtil.LONG_STR,
          value.toPlainString(),
          SnowflakeUtil.describeField(fieldName));
    }
  }

  /**
   * Encode a Java value in the wire form {@link #decodeScalar} reads back at scale 9 for TIME and
   * timestamps and at the value's own scale for FIXED.
   *
   * @param value Java value, null for SQL NULL
   * @param type target wire type
   * @return wire string or null
   * @throws SFException if the value cannot be represented as the type
   */
  public static String encodeScalar(Object value, SnowflakeType type) throws SFException {
    if (value == null) {
      return null;
    }
    logger.trace("Encoding {} as {}", value.getClass().getName(), type);
    switch (type) {
      case FIXED:
        if (value instanceof BigDecimal) {
          return ((BigDecimal) value).toPlainString();
        }
        if (value instanceof BigInteger
            || value instanceof Long
            || value instanceof Integer
            || value instanceof Short
            || value instanceof Byte) {
          return value.toString();
        }
        if (value instanceof String) {
          try {
            return new BigDecimal(((String) value).trim()).toPlainString();
          } catch (NumberFormatException ex) {
            throw new SFException(
                ex,
                ErrorCode.INVALID_VALUE_CONVERT,
                SnowflakeUtil.STRING_STR,
                SnowflakeType.FIXED,
                value,
                "");
          }
        }
        break;
      case REAL:
        if (value instanceof Number) {
          return Double.toString(((Number) value).doubleValue());
        }
        break;
      case BOOLEAN:
        if (value instanceof Boolean) {
          return value.toString();
        }
        break;
      case BINARY:
        if (value instanceof byte[]) {
          return Hex.encodeHexString((byte[]) value);
        }
        break;
      case TEXT:
      case VARIANT:
      case OBJECT:
      case ARRAY:
      case MAP:
        if (value instanceof String) {
          return (String) value;
        }
        break;
      case DATE:
        {
          ZonedDateTime zdt = toZonedDateTime(value);
          if (zdt != null) {
            return Long.toString(TemporalCodec.encodeDate(zdt));
          }
          break;
        }
      case TIME:
        if (value instanceof LocalTime) {
          return Long.toString(TemporalCodec.encodeTime((LocalTime) value));
        }
        {
          ZonedDateTime zdt = toZonedDateTime(value);
          if (zdt != null) {
            return Long.toString(TemporalCodec.encodeTime(zdt.toLocalTime()));
          }
          break;
        }
      case TIMESTAMP_NTZ:
      case TIMESTAMP_LTZ:
        {
          ZonedDateTime zdt = toZonedDateTime(value);
          if (zdt != null) {
            return TemporalCodec.encodeTimestamp(zdt.toInstant());
          }
          break;
        }
      case TIMESTAMP_TZ:
        {
          ZonedDateTime zdt = toZonedDateTime(value);
          if (zdt != null) {
            return TemporalCodec.encodeTimestampTz(zdt);
          }
          break;
        }
      default:
        break;
    }
    throw new SFException(
        ErrorCode.DATA_TYPE_NOT_SUPPORTED, value.getClass().getName() + " as " + type);
  }

  /**
   * @return the value as a ZonedDateTime, or null if it is not a supported temporal class
   */
  public static ZonedDateTime toZonedDateTime(Object value) {
    if (value instanceof ZonedDateTime) {
      return (ZonedDateTime) value;
    }
    if (value instanceof OffsetDateTime) {
      return ((OffsetDateTime) value).toZonedDateTime();
    }
    if (value instanceof Instant) {
      return ((Instant) value).atZone(ZoneOffset.UTC);
    }
    return null;
  }
}
