package net.snowflake.codec.core;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/** Names and server defaults of the session parameters consulted during conversion */
public final class SessionParameters {
  public static final String TIMEZONE = "TIMEZONE";
  public static final String DATE_OUTPUT_FORMAT = "DATE_OUTPUT_FORMAT";
  public static final String TIME_OUTPUT_FORMAT = "TIME_OUTPUT_FORMAT";
  public static final String TIMESTAMP_OUTPUT_FORMAT = "TIMESTAMP_OUTPUT_FORMAT";
  public static final String TIMESTAMP_NTZ_OUTPUT_FORMAT = "TIMESTAMP_NTZ_OUTPUT_FORMAT";
  public static final String TIMESTAMP_LTZ_OUTPUT_FORMAT = "TIMESTAMP_LTZ_OUTPUT_FORMAT";
  public static final String TIMESTAMP_TZ_OUTPUT_FORMAT = "TIMESTAMP_TZ_OUTPUT_FORMAT";
  public static final String ENABLE_HIGHER_PRECISION = "ENABLE_HIGHER_PRECISION";
  public static final String MAP_VALUES_NULLABLE = "MAP_VALUES_NULLABLE";
  public static final String ENABLE_ARROW_UTF8_VALIDATION = "ENABLE_ARROW_UTF8_VALIDATION";
  public static final String ARROW_TIMESTAMP_OPTION = "ARROW_TIMESTAMP_OPTION";

  static final Map<String, String> DEFAULTS;

  static {
    Map<String, String> defaults = new HashMap<>();
    defaults.put(DATE_OUTPUT_FORMAT, "YYYY-MM-DD");
    defaults.put(TIME_OUTPUT_FORMAT, "HH24:MI:SS");
    defaults.put(TIMESTAMP_OUTPUT_FORMAT, "YYYY-MM-DD HH24:MI:SS.FF3 TZHTZM");
    defaults.put(TIMESTAMP_NTZ_OUTPUT_FORMAT, "");
    defaults.put(TIMESTAMP_LTZ_OUTPUT_FORMAT, "");
    defaults.put(TIMESTAMP_TZ_OUTPUT_FORMAT, "");
    DEFAULTS = Collections.unmodifiableMap(defaults);
  }

  private SessionParameters() {}

  /**
   * Value of a parameter, falling back to the server default.
   *
   * @param parameters session parameters, keys are case insensitive
   * @param name parameter name
   * @return the effective value or null
   */
  public static String effectiveParamValue(Map<String, String> parameters, String name) {
    String upperName = name.toUpperCase(Locale.ROOT);
    if (parameters != null) {
      for (Map.Entry<String, String> entry : parameters.entrySet()) {
        if (entry.getKey() != null && entry.getKey().equalsIgnoreCase(upperName)) {
          return entry.getValue();
        }
      }
    }
    return DEFAULTS.get(upperName);
  }

  /**
   * Output format of a timestamp kind: the specialized parameter when set, otherwise
   * TIMESTAMP_OUTPUT_FORMAT.
   *
   * @param parameters session parameters
   * @param specializedName e.g. TIMESTAMP_LTZ_OUTPUT_FORMAT
   * @return the effective SQL format
   */
  public static String timestampFormat(Map<String, String> parameters, String specializedName) {
    String format = effectiveParamValue(parameters, specializedName);
    if (format == null || format.isEmpty()) {
      format = effectiveParamValue(parameters, TIMESTAMP_OUTPUT_FORMAT);
    }
    return format;
  }

  static boolean booleanValue(Map<String, String> parameters, String name, boolean defaultValue) {
    String value = effectiveParamValue(parameters, name);
    return value == null ? defaultValue : Boolean.parseBoolean(value.trim());
  }
}
