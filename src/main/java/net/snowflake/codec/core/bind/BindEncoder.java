package net.snowflake.codec.core.bind;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import net.snowflake.codec.core.SFException;
import net.snowflake.codec.core.ScalarCodec;
import net.snowflake.codec.core.TemporalCodec;
import net.snowflake.codec.jdbc.ErrorCode;
import net.snowflake.codec.jdbc.SnowflakeType;
import net.snowflake.codec.log.SFLogger;
import net.snowflake.codec.log.SFLoggerFactory;
import org.apache.commons.codec.binary.Hex;

/**
 * Encodes bind parameters into the wire strings of a query request.
 *
 * <p>Temporal values have two encodings. Binds sent with the request use epoch nanoseconds, "nanos
 * offset" for TIMESTAMP_TZ and nanoseconds of day for TIME. Binds uploaded as a stream for bulk
 * inserts use formatted text for TIMESTAMP_TZ and TIME instead.
 */
public final class BindEncoder {
  private static final SFLogger logger = SFLoggerFactory.getLogger(BindEncoder.class);

  private static final long MILLIS_PER_DAY = 86_400_000L;

  private BindEncoder() {}

  /**
   * @param value scalar, Java array, Collection or {@link ArrayBinding}; byte[] is a BINARY scalar
   * @param timezoneType wire type of temporal values, may be null for other values
   * @param stream whether the values are uploaded as a stream
   * @return type tag and wire strings
   * @throws SFException if a value has no wire type
   */
  public static BindValues buildBindParameters(
      Object value, TimezoneType timezoneType, boolean stream) throws SFException {
    if (value instanceof ArrayBinding) {
      ArrayBinding binding = (ArrayBinding) value;
      TimezoneType tz =
          binding.getTimezoneType() != null ? binding.getTimezoneType() : timezoneType;
      return encodeArray(binding.getValues(), binding.getType(), tz, stream);
    }
    if (isArrayBind(value)) {
      return encodeArray(value, null, timezoneType, stream);
    }
    BindValues encoded = encodeValue(value, timezoneType);
    if (stream && value != null && encoded.getValue() != null) {
      // streamed scalars use the same text as streamed array elements
      return BindValues.single(
          encoded.getType(), encodeElement(value, encoded.getType(), true, 0));
    }
    return encoded;
  }

  /**
   * @return true for Java arrays other than byte[] and for collections
   */
  public static boolean isArrayBind(Object value) {
    if (value == null || value instanceof byte[]) {
      return false;
    }
    return value.getClass().isArray() || value instanceof Collection;
  }

  /**
   * Encode a single value.
   *
   * @param value Java value, null or {@link TypedNullTime} for SQL NULL
   * @param timezoneType wire type of temporal values
   * @return type tag and one wire string
   * @throws SFException if the value has no wire type
   */
  public static BindValues encodeValue(Object value, TimezoneType timezoneType)
      throws SFException {
    if (value == null) {
      return BindValues.single(SnowflakeType.TEXT, null);
    }
    if (value instanceof TypedNullTime) {
      return BindValues.single(
          ((TypedNullTime) value).getTimezoneType().toSnowflakeType(), null);
    }
    SnowflakeType type = javaTypeToSnowflakeType(value, timezoneType);
    if (type == null) {
      throw unsupported(value, timezoneType, 0);
    }
    return BindValues.single(type, encodeElement(value, type, false, 0));
  }

  public static BindValues encodeArray(Object array, TimezoneType timezoneType, boolean stream)
      throws SFException {
    return encodeArray(array, null, timezoneType, stream);
  }

  /**
   * Encode an array bind. Arrays with a specific component type use the type of that class;
   * Object[] arrays and collections get the type of their first non null element, and every other
   * element must have the same type. Nulls keep their position.
   *
   * @param array Java array or Collection
   * @param explicitType element type, null to infer it
   * @param timezoneType wire type of temporal elements
   * @param stream whether the values are uploaded as a stream
   * @return type tag and one wire string per element
   * @throws SFException if an element has no wire type or the types are mixed
   */
  public static BindValues encodeArray(
      Object array, SnowflakeType explicitType, TimezoneType timezoneType, boolean stream)
      throws SFException {
    List<Object> elements = toList(array);
    SnowflakeType type = explicitType;
    if (type == null && array.getClass().isArray()) {
      Class<?> componentType = array.getClass().getComponentType();
      if (componentType != Object.class) {
        type = classToSnowflakeType(componentType, timezoneType);
      }
    }
    boolean inferred = type == null;
    for (int i = 0; inferred && i < elements.size(); i++) {
      Object element = elements.get(i);
      if (element == null) {
        continue;
      }
      SnowflakeType elementType =
          element instanceof TypedNullTime
              ? ((TypedNullTime) element).getTimezoneType().toSnowflakeType()
              : javaTypeToSnowflakeType(element, timezoneType);
      if (elementType == null) {
        throw unsupported(element, timezoneType, i);
      }
      if (type == null) {
        type = elementType;
      } else if (elementType != type) {
        logger.warn("Rejected array bind mixing {} and {} at element {}", type, elementType, i);
        throw new SFException(
            ErrorCode.ARRAY_BIND_MIXED_TYPES_NOT_SUPPORTED, String.valueOf(i), elementType, type);
      }
    }
    if (type == null) {
      type = SnowflakeType.TEXT;
    }
    logger.debug(
        "Binding array of {} elements as {}, stream: {}", elements.size(), type, stream);
    List<String> values = new ArrayList<>(elements.size());
    for (int i = 0; i < elements.size(); i++) {
      Object element = elements.get(i);
      if (element == null || element instanceof TypedNullTime) {
        values.add(null);
      } else {
        values.add(encodeElement(element, type, stream, i));
      }
    }
    return new BindValues(type, values);
  }

  /**
   * @param value non null Java value
   * @param timezoneType wire type of temporal values
   * @return the wire type of the value, null if it has none
   */
  public static SnowflakeType javaTypeToSnowflakeType(Object value, TimezoneType timezoneType) {
    if (value == null) {
      return null;
    }
    if (value instanceof TypedNullTime) {
      return ((TypedNullTime) value).getTimezoneType().toSnowflakeType();
    }
    if (isArrayBind(value)) {
      return null;
    }
    return classToSnowflakeType(value.getClass(), timezoneType);
  }

  private static SnowflakeType classToSnowflakeType(Class<?> cls, TimezoneType timezoneType) {
    if (cls == Long.class
        || cls == long.class
        || cls == Integer.class
        || cls == int.class
        || cls == Short.class
        || cls == short.class
        || cls == Byte.class
        || cls == BigInteger.class
        || cls == BigDecimal.class) {
      return SnowflakeType.FIXED;
    }
    if (cls == Double.class || cls == double.class || cls == Float.class || cls == float.class) {
      return SnowflakeType.REAL;
    }
    if (cls == Boolean.class || cls == boolean.class) {
      return SnowflakeType.BOOLEAN;
    }
    if (cls == String.class) {
      return SnowflakeType.TEXT;
    }
    if (cls == byte[].class) {
      return SnowflakeType.BINARY;
    }
    if (cls == LocalDate.class) {
      return SnowflakeType.DATE;
    }
    if (cls == LocalTime.class) {
      return SnowflakeType.TIME;
    }
    if (cls == ZonedDateTime.class || cls == OffsetDateTime.class || cls == Instant.class) {
      return timezoneType == null ? null : timezoneType.toSnowflakeType();
    }
    return null;
  }

  private static String encodeElement(Object value, SnowflakeType type, boolean stream, int index)
      throws SFException {
    switch (type) {
      case REAL:
        if (value instanceof Float) {
          return Float.toString((Float) value);
        }
        return ScalarCodec.encodeScalar(value, type);
      case BOOLEAN:
      case FIXED:
      case TEXT:
      case VARIANT:
      case OBJECT:
      case ARRAY:
      case MAP:
        return ScalarCodec.encodeScalar(value, type);
      case BINARY:
        if (value instanceof byte[]) {
          return Hex.encodeHexString((byte[]) value);
        }
        break;
      case DATE:
        if (value instanceof LocalDate) {
          return Long.toString(((LocalDate) value).toEpochDay() * MILLIS_PER_DAY);
        }
        {
          ZonedDateTime zdt = ScalarCodec.toZonedDateTime(value);
          if (zdt != null) {
            return Long.toString(TemporalCodec.encodeDateMillis(zdt));
          }
          break;
        }
      case TIME:
        {
          LocalTime time = toLocalTime(value);
          if (time != null) {
            return stream
                ? TemporalCodec.formatStreamTime(time)
                : Long.toString(TemporalCodec.encodeTime(time));
          }
          break;
        }
      case TIMESTAMP_NTZ:
      case TIMESTAMP_LTZ:
        {
          ZonedDateTime zdt = ScalarCodec.toZonedDateTime(value);
          if (zdt != null) {
            return TemporalCodec.encodeTimestamp(zdt.toInstant());
          }
          break;
        }
      case TIMESTAMP_TZ:
        {
          ZonedDateTime zdt = ScalarCodec.toZonedDateTime(value);
          if (zdt != null) {
            return stream
                ? TemporalCodec.formatStreamTimestamp(zdt)
                : TemporalCodec.encodeTimestampTz(zdt);
          }
          break;
        }
      default:
        break;
    }
    logger.warn(
        "Rejected bind of {} as {} at element {}", value.getClass().getName(), type, index);
    throw new SFException(
        ErrorCode.DATA_TYPE_NOT_SUPPORTED,
        value.getClass().getName() + " as " + type + " at element " + index);
  }

  private static LocalTime toLocalTime(Object value) {
    if (value instanceof LocalTime) {
      return (LocalTime) value;
    }
    ZonedDateTime zdt = ScalarCodec.toZonedDateTime(value);
    return zdt == null ? null : zdt.toLocalTime();
  }

  private static List<Object> toList(Object array) {
    if (array instanceof Collection) {
      return new ArrayList<>((Collection<?>) array);
    }
    int length = Array.getLength(array);
    List<Object> list = new ArrayList<>(length);
    for (int i = 0; i < length; i++) {
      list.add(Array.get(array, i));
    }
    return list;
  }

  private static SFException unsupported(Object value, TimezoneType timezoneType, int index) {
    String reason =
        timezoneType == null && ScalarCodec.toZonedDateTime(value) != null
            ? " without a timezone type"
            : "";
    logger.warn(
        "Rejected bind of {}{} at element {}", value.getClass().getName(), reason, index);
    return new SFException(
        ErrorCode.DATA_TYPE_NOT_SUPPORTED,
        value.getClass().getName() + reason + " at element " + index);
  }
}
