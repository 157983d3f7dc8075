package net.snowflake.codec.core.structs;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import net.snowflake.codec.core.DataConversionContext;
import net.snowflake.codec.core.SFException;
import net.snowflake.codec.core.ScalarCodec;
import net.snowflake.codec.core.TemporalCodec;
import net.snowflake.codec.jdbc.ErrorCode;
import net.snowflake.codec.jdbc.FieldMetadata;
import net.snowflake.codec.jdbc.SnowflakeType;
import net.snowflake.codec.jdbc.SnowflakeUtil;

/**
 * Value of a structured OBJECT column or field. Holds the attributes as they were read and
 * converts them when a typed getter is called, using the metadata of the attribute and the session
 * formats of the result.
 *
 * <p>Instances are immutable.
 */
public final class SnowflakeObject {
  private final Map<String, Object> values;
  private final FieldMetadata metadata;
  private final DataConversionContext context;

  /**
   * @param values attribute values in declaration order
   * @param metadata OBJECT metadata with one field per attribute
   * @param context session formats and flags
   */
  public SnowflakeObject(
      Map<String, Object> values, FieldMetadata metadata, DataConversionContext context) {
    this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    this.metadata = metadata;
    this.context = context;
  }

  public FieldMetadata getFieldMetadata() {
    return metadata;
  }

  /**
   * @param name attribute name
   * @return metadata of the attribute or null if it was not declared
   */
  public FieldMetadata getFieldMetadata(String name) {
    return metadata.getField(name);
  }

  public Set<String> getFieldNames() {
    return values.keySet();
  }

  public boolean isNull(String name) throws SFException {
    return getRaw(name) == null;
  }

  /**
   * @param name attribute name
   * @return the attribute as stored, before any conversion
   * @throws SFException if there is no such attribute
   */
  public Object getRaw(String name) throws SFException {
    if (!values.containsKey(name)) {
      throw new SFException(ErrorCode.COLUMN_DOES_NOT_EXIST, name, metadata.getName());
    }
    return values.get(name);
  }

  /**
   * Value converted to the Java type of the attribute metadata.
   *
   * @param name attribute name
   * @return converted value
   * @throws SFException if there is no such attribute or it cannot be converted
   */
  public Object getValue(String name) throws SFException {
    Object raw = getRaw(name);
    FieldMetadata field = metadata.getField(name);
    if (raw == null || field == null || field.getBase().isStructured()) {
      return raw;
    }
    switch (field.getBase()) {
      case FIXED:
        return ScalarCodec.fixedToNestedValue(
            toDecimal(name, raw, SnowflakeUtil.BIG_DECIMAL_STR),
            field.getScale(),
            context.isHigherPrecision(),
            name);
      case REAL:
        return getDouble(name);
      case BOOLEAN:
        return getBoolean(name);
      case BINARY:
        return getBytes(name);
      case DATE:
        return getDate(name);
      case TIME:
        return getTime(name);
      case TIMESTAMP_NTZ:
      case TIMESTAMP_LTZ:
      case TIMESTAMP_TZ:
        return getTimestamp(name);
      default:
        return getString(name);
    }
  }

  public String getString(String name) throws SFException {
    Object raw = getRaw(name);
    if (raw == null || raw instanceof String) {
      return (String) raw;
    }
    if (raw instanceof BigDecimal) {
      return ((BigDecimal) raw).toPlainString();
    }
    if (raw instanceof Number || raw instanceof Boolean) {
      return raw.toString();
    }
    throw invalid(name, raw, SnowflakeUtil.STRING_STR);
  }

  public Boolean getBoolean(String name) throws SFException {
    Object raw = getRaw(name);
    if (raw == null || raw instanceof Boolean) {
      return (Boolean) raw;
    }
    if (raw instanceof String) {
      return (Boolean)
          ScalarCodec.decodeScalar(SnowflakeType.BOOLEAN, 0, (String) raw, name, null, false);
    }
    throw invalid(name, raw, SnowflakeUtil.BOOLEAN_STR);
  }

  public Long getLong(String name) throws SFException {
    Object raw = getRaw(name);
    if (raw == null) {
      return null;
    }
    try {
      return toDecimal(name, raw, SnowflakeUtil.LONG_STR).longValueExact();
    } catch (ArithmeticException ex) {
      throw new SFException(
          ex,
          ErrorCode.INVALID_VALUE_CONVERT,
          typeOf(name),
          SnowflakeUtil.LONG_STR,
          SnowflakeUtil.describeValue(raw),
          SnowflakeUtil.describeField(name));
    }
  }

  public Integer getInt(String name) throws SFException {
    Object raw = getRaw(name);
    if (raw == null) {
      return null;
    }
    try {
      return toDecimal(name, raw, SnowflakeUtil.INT_STR).intValueExact();
    } catch (ArithmeticException ex) {
      throw new SFException(
          ex,
          ErrorCode.INVALID_VALUE_CONVERT,
          typeOf(name),
          SnowflakeUtil.INT_STR,
          SnowflakeUtil.describeValue(raw),
          SnowflakeUtil.describeField(name));
    }
  }

  public Double getDouble(String name) throws SFException {
    Object raw = getRaw(name);
    if (raw == null) {
      return null;
    }
    if (raw instanceof Number) {
      return ((Number) raw).doubleValue();
    }
    if (raw instanceof String) {
      return (Double)
          ScalarCodec.decodeScalar(SnowflakeType.REAL, 0, (String) raw, name, null, false);
    }
    throw invalid(name, raw, SnowflakeUtil.DOUBLE_STR);
  }

  public BigInteger getBigInteger(String name) throws SFException {
    Object raw = getRaw(name);
    if (raw == null) {
      return null;
    }
    try {
      return toDecimal(name, raw, SnowflakeUtil.BIG_INTEGER_STR).toBigIntegerExact();
    } catch (ArithmeticException ex) {
      throw new SFException(
          ex,
          ErrorCode.INVALID_VALUE_CONVERT,
          typeOf(name),
          SnowflakeUtil.BIG_INTEGER_STR,
          SnowflakeUtil.describeValue(raw),
          SnowflakeUtil.describeField(name));
    }
  }

  /**
   * @param name attribute name
   * @return decimal value, with the declared scale for FIXED attributes
   * @throws SFException if the attribute is not numeric
   */
  public BigDecimal getBigDecimal(String name) throws SFException {
    Object raw = getRaw(name);
    if (raw == null) {
      return null;
    }
    BigDecimal value = toDecimal(name, raw, SnowflakeUtil.BIG_DECIMAL_STR);
    FieldMetadata field = metadata.getField(name);
    if (field != null && field.getBase() == SnowflakeType.FIXED) {
      return value.setScale(field.getScale(), RoundingMode.HALF_UP);
    }
    return value;
  }

  public byte[] getBytes(String name) throws SFException {
    Object raw = getRaw(name);
    if (raw == null || raw instanceof byte[]) {
      return (byte[]) raw;
    }
    if (raw instanceof String) {
      return ScalarCodec.decodeBinary((String) raw, name);
    }
    throw invalid(name, raw, SnowflakeUtil.BYTES_STR);
  }

  /**
   * @param name attribute name
   * @return timestamp: UTC for TIMESTAMP_NTZ, session zone for TIMESTAMP_LTZ, fixed offset for
   *     TIMESTAMP_TZ
   * @throws SFException if the attribute is not a timestamp
   */
  public ZonedDateTime getTimestamp(String name) throws SFException {
    Object raw = getRaw(name);
    if (raw == null || raw instanceof ZonedDateTime) {
      return (ZonedDateTime) raw;
    }
    if (raw instanceof String) {
      SnowflakeType type = typeOf(name);
      if (type == SnowflakeType.DATE) {
        return TemporalCodec.parseDate((String) raw, context, name);
      }
      return TemporalCodec.parseTimestamp(
          type.isTimestamp() ? type : SnowflakeType.TIMESTAMP_NTZ, (String) raw, context, name);
    }
    throw invalid(name, raw, SnowflakeUtil.TIMESTAMP_STR);
  }

  /**
   * @param name attribute name
   * @return midnight UTC of the date
   * @throws SFException if the attribute is not a date
   */
  public ZonedDateTime getDate(String name) throws SFException {
    Object raw = getRaw(name);
    if (raw == null || raw instanceof ZonedDateTime) {
      return (ZonedDateTime) raw;
    }
    if (raw instanceof String) {
      return TemporalCodec.parseDate((String) raw, context, name);
    }
    throw invalid(name, raw, SnowflakeUtil.DATE_STR);
  }

  public LocalTime getTime(String name) throws SFException {
    Object raw = getRaw(name);
    if (raw == null || raw instanceof LocalTime) {
      return (LocalTime) raw;
    }
    if (raw instanceof String) {
      return TemporalCodec.parseTime((String) raw, context, name);
    }
    throw invalid(name, raw, SnowflakeUtil.TIME_STR);
  }

  public SnowflakeObject getObject(String name) throws SFException {
    Object raw = getRaw(name);
    if (raw == null || raw instanceof SnowflakeObject) {
      return (SnowflakeObject) raw;
    }
    throw invalid(name, raw, SnowflakeUtil.OBJECT_STR);
  }

  /**
   * @param name attribute name
   * @param elementType expected class of the non null elements
   * @param <T> element type
   * @return the list
   * @throws SFException if the attribute is not a list or an element has another type
   */
  @SuppressWarnings("unchecked")
  public <T> List<T> getList(String name, Class<T> elementType) throws SFException {
    Object raw = getRaw(name);
    if (raw == null) {
      return null;
    }
    if (!(raw instanceof List)) {
      throw invalid(name, raw, SnowflakeUtil.LIST_STR);
    }
    for (Object element : (List<?>) raw) {
      if (element != null && !elementType.isInstance(element)) {
        throw invalid(
            name, element, SnowflakeUtil.LIST_STR + "<" + elementType.getSimpleName() + ">");
      }
    }
    return (List<T>) raw;
  }

  /**
   * @param name attribute name
   * @param keyType expected class of the keys
   * @param valueType expected class of the non null values, Optional when map values are nullable
   * @param <K> key type
   * @param <V> value type
   * @return the map
   * @throws SFException if the attribute is not a map or an entry has another type
   */
  @SuppressWarnings("unchecked")
  public <K, V> Map<K, V> getMap(String name, Class<K> keyType, Class<V> valueType)
      throws SFException {
    Object raw = getRaw(name);
    if (raw == null) {
      return null;
    }
    if (!(raw instanceof Map)) {
      throw invalid(name, raw, SnowflakeUtil.MAP_STR);
    }
    String target =
        SnowflakeUtil.MAP_STR
            + "<"
            + keyType.getSimpleName()
            + ","
            + valueType.getSimpleName()
            + ">";
    for (Map.Entry<?, ?> entry : ((Map<?, ?>) raw).entrySet()) {
      if (!keyType.isInstance(entry.getKey())) {
        throw invalid(name, entry.getKey(), target);
      }
      if (entry.getValue() != null && !valueType.isInstance(entry.getValue())) {
        throw invalid(name, entry.getValue(), target);
      }
    }
    return (Map<K, V>) raw;
  }

  /**
   * @return attribute values converted to the Java types of their metadata
   * @throws SFException if an attribute cannot be converted
   */
  public Map<String, Object> toMap() throws SFException {
    Map<String, Object> converted = new LinkedHashMap<>();
    for (String name : values.keySet()) {
      converted.put(name, getValue(name));
    }
    return converted;
  }

  private BigDecimal toDecimal(String name, Object raw, String target) throws SFException {
    if (raw instanceof BigDecimal) {
      return (BigDecimal) raw;
    }
    if (raw instanceof BigInteger) {
      return new BigDecimal((BigInteger) raw);
    }
    if (raw instanceof Long || raw instanceof Integer) {
      return BigDecimal.valueOf(((Number) raw).longValue());
    }
    if (raw instanceof Number) {
      return new BigDecimal(raw.toString());
    }
    if (raw instanceof String) {
      try {
        return new BigDecimal(((String) raw).trim());
      } catch (NumberFormatException ex) {
        throw new SFException(
            ex,
            ErrorCode.INVALID_VALUE_CONVERT,
            typeOf(name),
            target,
            SnowflakeUtil.describeValue(raw),
            SnowflakeUtil.describeField(name));
      }
    }
    throw invalid(name, raw, target);
  }

  private SnowflakeType typeOf(String name) {
    FieldMetadata field = metadata.getField(name);
    return field == null ? SnowflakeType.VARIANT : field.getBase();
  }

  private SFException invalid(String name, Object raw, String target) {
    return new SFException(
        ErrorCode.INVALID_VALUE_CONVERT,
        typeOf(name),
        target,
        SnowflakeUtil.describeValue(raw),
        SnowflakeUtil.describeField(name));
  }

  /** Objects are equal when they have the same attributes with equal converted values. */
  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SnowflakeObject)) {
      return false;
    }
    SnowflakeObject that = (SnowflakeObject) o;
    try {
      return deepEquals(toMap(), that.toMap());
    } catch (SFException ex) {
      return false;
    }
  }

  @Override
  public int hashCode() {
    return values.keySet().hashCode();
  }

  @Override
  public String toString() {
    return "SnowflakeObject{" + metadata.getName() + "=" + values + "}";
  }

  static boolean deepEquals(Object a, Object b) {
    if (a == b) {
      return true;
    }
    if (a == null || b == null) {
      return false;
    }
    if (a instanceof byte[] && b instanceof byte[]) {
      return Arrays.equals((byte[]) a, (byte[]) b);
    }
    if (a instanceof Optional && b instanceof Optional) {
      return deepEquals(((Optional<?>) a).orElse(null), ((Optional<?>) b).orElse(null));
    }
    if (a instanceof List && b instanceof List) {
      List<?> left = (List<?>) a;
      List<?> right = (List<?>) b;
      if (left.size() != right.size()) {
        return false;
      }
      Iterator<?> it = right.iterator();
      for (Object element : left) {
        if (!deepEquals(element, it.next())) {
          return false;
        }
      }
      return true;
    }
    if (a instanceof Map && b instanceof Map) {
      Map<?, ?> left = (Map<?, ?>) a;
      Map<?, ?> right = (Map<?, ?>) b;
      if (!left.keySet().equals(right.keySet())) {
        return false;
      }
      for (Map.Entry<?, ?> entry : left.entrySet()) {
        if (!deepEquals(entry.getValue(), right.get(entry.getKey()))) {
          return false;
        }
      }
      return true;
    }
    return a.equals(b);
  }
}
