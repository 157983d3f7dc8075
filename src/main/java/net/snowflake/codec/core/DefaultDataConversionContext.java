package net.snowflake.codec.core;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.TimeZone;
import net.snowflake.codec.core.arrow.ArrowTimestampOption;
import net.snowflake.codec.log.ArgSupplier;
import net.snowflake.codec.log.SFLogger;
import net.snowflake.codec.log.SFLoggerFactory;
import net.snowflake.common.core.SnowflakeDateTimeFormat;

/** {@link DataConversionContext} built from session parameters */
public final class DefaultDataConversionContext implements DataConversionContext {
  private static final SFLogger logger =
      SFLoggerFactory.getLogger(DefaultDataConversionContext.class);

  private final TimeZone sessionTimeZone;
  private final boolean higherPrecision;
  private final boolean mapValuesNullable;
  private final boolean utf8Validation;
  private final ArrowTimestampOption arrowTimestampOption;
  private final Map<String, String> parameters;

  private final SnowflakeDateTimeFormat dateFormatter;
  private final SnowflakeDateTimeFormat timeFormatter;
  private final SnowflakeDateTimeFormat timestampNTZFormatter;
  private final SnowflakeDateTimeFormat timestampLTZFormatter;
  private final SnowflakeDateTimeFormat timestampTZFormatter;

  private DefaultDataConversionContext(Builder builder) throws SFException {
    this.parameters = Collections.unmodifiableMap(new HashMap<>(builder.parameters));
    this.sessionTimeZone = resolveTimeZone(builder.sessionTimeZone, parameters);
    this.higherPrecision =
        builder.higherPrecision != null
            ? builder.higherPrecision
            : SessionParameters.booleanValue(
                parameters, SessionParameters.ENABLE_HIGHER_PRECISION, false);
    this.mapValuesNullable =
        builder.mapValuesNullable != null
            ? builder.mapValuesNullable
            : SessionParameters.booleanValue(
                parameters, SessionParameters.MAP_VALUES_NULLABLE, false);
    this.utf8Validation =
        builder.utf8Validation != null
            ? builder.utf8Validation
            : SessionParameters.booleanValue(
                parameters, SessionParameters.ENABLE_ARROW_UTF8_VALIDATION, false);
    this.arrowTimestampOption =
        builder.arrowTimestampOption != null
            ? builder.arrowTimestampOption
            : ArrowTimestampOption.fromString(
                SessionParameters.effectiveParamValue(
                    parameters, SessionParameters.ARROW_TIMESTAMP_OPTION));

    String sqlDateFormat =
        SessionParameters.effectiveParamValue(parameters, SessionParameters.DATE_OUTPUT_FORMAT);
    this.dateFormatter = SnowflakeDateTimeFormat.fromSqlFormat(sqlDateFormat);
    logger.debug(
        "Sql date format: {}, java date format: {}",
        sqlDateFormat,
        (ArgSupplier) () -> this.dateFormatter.toSimpleDateTimePattern());

    String sqlTimeFormat =
        SessionParameters.effectiveParamValue(parameters, SessionParameters.TIME_OUTPUT_FORMAT);
    this.timeFormatter = SnowflakeDateTimeFormat.fromSqlFormat(sqlTimeFormat);

    this.timestampNTZFormatter =
        SnowflakeDateTimeFormat.fromSqlFormat(
            SessionParameters.timestampFormat(
                parameters, SessionParameters.TIMESTAMP_NTZ_OUTPUT_FORMAT));
    this.timestampLTZFormatter =
        SnowflakeDateTimeFormat.fromSqlFormat(
            SessionParameters.timestampFormat(
                parameters, SessionParameters.TIMESTAMP_LTZ_OUTPUT_FORMAT));
    this.timestampTZFormatter =
        SnowflakeDateTimeFormat.fromSqlFormat(
            SessionParameters.timestampFormat(
                parameters, SessionParameters.TIMESTAMP_TZ_OUTPUT_FORMAT));
  }

  private static TimeZone resolveTimeZone(TimeZone explicit, Map<String, String> parameters) {
    if (explicit != null) {
      return explicit;
    }
    String tzName = SessionParameters.effectiveParamValue(parameters, SessionParameters.TIMEZONE);
    if (tzName != null && !tzName.isEmpty()) {
      return TimeZone.getTimeZone(tzName);
    }
    return TimeZone.getDefault();
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public TimeZone getSessionTimeZone() {
    return sessionTimeZone;
  }

  @Override
  public boolean isHigherPrecision() {
    return higherPrecision;
  }

  @Override
  public boolean isMapValuesNullable() {
    return mapValuesNullable;
  }

  @Override
  public boolean isUtf8ValidationEnabled() {
    return utf8Validation;
  }

  @Override
  public ArrowTimestampOption getArrowTimestampOption() {
    return arrowTimestampOption;
  }

  @Override
  public SnowflakeDateTimeFormat getDateFormatter() {
    return dateFormatter;
  }

  @Override
  public SnowflakeDateTimeFormat getTimeFormatter() {
    return timeFormatter;
  }

  @Override
  public SnowflakeDateTimeFormat getTimestampNTZFormatter() {
    return timestampNTZFormatter;
  }

  @Override
  public SnowflakeDateTimeFormat getTimestampLTZFormatter() {
    return timestampLTZFormatter;
  }

  @Override
  public SnowflakeDateTimeFormat getTimestampTZFormatter() {
    return timestampTZFormatter;
  }

  @Override
  public Map<String, String> getParameters() {
    return parameters;
  }

  /** Explicit settings win over the matching session parameters */
  public static class Builder {
    private final Map<String, String> parameters = new HashMap<>();
    private TimeZone sessionTimeZone;
    private Boolean higherPrecision;
    private Boolean mapValuesNullable;
    private Boolean utf8Validation;
    private ArrowTimestampOption arrowTimestampOption;

    private Builder() {}

    public Builder parameters(Map<String, String> parameters) {
      if (parameters != null) {
        this.parameters.putAll(parameters);
      }
      return this;
    }

    public Builder parameter(String name, String value) {
      this.parameters.put(name, value);
      return this;
    }

    public Builder sessionTimeZone(TimeZone sessionTimeZone) {
      this.sessionTimeZone = sessionTimeZone;
      return this;
    }

    public Builder higherPrecision(boolean higherPrecision) {
      this.higherPrecision = higherPrecision;
      return this;
    }

    public Builder mapValuesNullable(boolean mapValuesNullable) {
      this.mapValuesNullable = mapValuesNullable;
      return this;
    }

    public Builder utf8Validation(boolean utf8Validation) {
      this.utf8Validation = utf8Validation;
      return this;
    }

    public Builder arrowTimestampOption(ArrowTimestampOption arrowTimestampOption) {
      this.arrowTimestampOption = arrowTimestampOption;
      return this;
    }

    /**
     * @throws SFException if a session parameter has an invalid value
     */
    public DefaultDataConversionContext build() throws SFException {
      return new DefaultDataConversionContext(this);
    }
  }
}
