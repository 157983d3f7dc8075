package net.snowflake.codec.jdbc;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import net.snowflake.codec.core.SFException;
import net.snowflake.codec.core.structs.SnowflakeObject;

/** Column and field type tags as declared by the server in row type metadata */
public enum SnowflakeType {
  FIXED,
  REAL,
  TEXT,
  BOOLEAN,
  BINARY,
  DATE,
  TIME,
  TIMESTAMP_NTZ,
  TIMESTAMP_LTZ,
  TIMESTAMP_TZ,
  VARIANT,
  OBJECT,
  ARRAY,
  MAP;

  /**
   * Resolve a server type tag, e.g. "fixed" or "timestamp_ltz".
   *
   * @param name type tag, case insensitive
   * @return matching type
   * @throws SFException if the tag is unknown
   */
  public static SnowflakeType fromString(String name) throws SFException {
    if (name == null) {
      throw new SFException(ErrorCode.DATA_TYPE_NOT_SUPPORTED, "null");
    }
    try {
      return SnowflakeType.valueOf(name.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new SFException(ex, ErrorCode.DATA_TYPE_NOT_SUPPORTED, name);
    }
  }

  public boolean isStructured() {
    return this == OBJECT || this == ARRAY || this == MAP;
  }

  public boolean isTimestamp() {
    return this == TIMESTAMP_NTZ || this == TIMESTAMP_LTZ || this == TIMESTAMP_TZ;
  }

  public boolean isTemporal() {
    return isTimestamp() || this == DATE || this == TIME;
  }

  /**
   * Java class a top level column of the given metadata decodes to.
   *
   * @param field column metadata
   * @param higherPrecision whether arbitrary precision numbers are returned
   * @return the class of non null values
   */
  public static Class<?> getJavaType(FieldMetadata field, boolean higherPrecision) {
    switch (field.getBase()) {
      case FIXED:
        if (!higherPrecision) {
          return String.class;
        }
        return field.getScale() == 0 ? BigInteger.class : BigDecimal.class;
      case REAL:
        return Double.class;
      case BOOLEAN:
        return Boolean.class;
      case BINARY:
        return byte[].class;
      case TIME:
        return LocalTime.class;
      case DATE:
      case TIMESTAMP_NTZ:
      case TIMESTAMP_LTZ:
      case TIMESTAMP_TZ:
        return ZonedDateTime.class;
      case OBJECT:
        return field.getFields().isEmpty() ? String.class : SnowflakeObject.class;
      case ARRAY:
        return field.getFields().isEmpty() ? String.class : List.class;
      case MAP:
        return field.getFields().isEmpty() ? String.class : Map.class;
      case TEXT:
      case VARIANT:
      default:
        return String.class;
    }
  }

  /**
   * Java class an element of a structured value (array element, map value, object field) decodes
   * to.
   *
   * @param field element metadata
   * @param higherPrecision whether arbitrary precision numbers are returned
   * @return the class of non null elements
   */
  public static Class<?> getNestedJavaType(FieldMetadata field, boolean higherPrecision) {
    if (field.getBase() == FIXED) {
      if (field.getScale() == 0) {
        return higherPrecision ? BigInteger.class : Long.class;
      }
      return higherPrecision ? BigDecimal.class : Double.class;
    }
    return getJavaType(field, higherPrecision);
  }
}
