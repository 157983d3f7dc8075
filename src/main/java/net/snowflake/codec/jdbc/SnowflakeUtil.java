package net.snowflake.codec.jdbc;

import net.snowflake.codec.log.SFLogger;
import net.snowflake.codec.log.SFLoggerFactory;

public class SnowflakeUtil {
  private static final SFLogger logger = SFLoggerFactory.getLogger(SnowflakeUtil.class);

  public static final String BIG_DECIMAL_STR = "big decimal";
  public static final String BIG_INTEGER_STR = "big integer";
  public static final String DOUBLE_STR = "double";
  public static final String BOOLEAN_STR = "boolean";
  public static final String INT_STR = "int";
  public static final String LONG_STR = "long";
  public static final String STRING_STR = "string";
  public static final String TIME_STR = "time";
  public static final String TIMESTAMP_STR = "timestamp";
  public static final String DATE_STR = "date";
  public static final String BYTES_STR = "byte array";
  public static final String OBJECT_STR = "object";
  public static final String LIST_STR = "list";
  public static final String MAP_STR = "map";

  private SnowflakeUtil() {}

  /**
   * @param fieldName column or attribute name, may be null or empty
   * @return the trailing field clause of a conversion error message, empty without a name
   */
  public static String describeField(String fieldName) {
    return fieldName == null || fieldName.isEmpty() ? "" : ", field=" + fieldName;
  }

  /**
   * System.getProperty wrapper. If System.getProperty raises an SecurityException, it is ignored
   * and returns null.
   *
   * @param property the property name
   * @return the property value if set, otherwise null.
   */
  public static String systemGetProperty(String property) {
    try {
      return System.getProperty(property);
    } catch (SecurityException ex) {
      logger.debug("Security exception raised: {}", ex.getMessage());
      return null;
    }
  }

  /**
   * Render a raw value for an error message, truncated to keep messages readable.
   *
   * @param value raw value
   * @return printable form
   */
  public static String describeValue(Object value) {
    if (value == null) {
      return "null";
    }
    String str =
        value instanceof byte[] ? "byte[" + ((byte[]) value).length + "]" : value.toString();
    return str.length() > 256 ? str.substring(0, 256) + "..." : str;
  }
}
