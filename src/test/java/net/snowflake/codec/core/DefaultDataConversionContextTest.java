package net.snowflake.codec.core;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.TimeZone;
import net.snowflake.codec.core.arrow.ArrowTimestampOption;
import net.snowflake.codec.jdbc.ErrorCode;
import net.snowflake.codec.jdbc.SnowflakeType;
import net.snowflake.common.core.SqlState;
import org.junit.jupiter.api.Test;

public class DefaultDataConversionContextTest {

  @Test
  public void testDefaults() throws SFException {
    DataConversionContext context = DefaultDataConversionContext.builder().build();
    assertThat(context.isHigherPrecision(), is(false));
    assertThat(context.isMapValuesNullable(), is(false));
    assertThat(context.isUtf8ValidationEnabled(), is(false));
    assertThat(context.getArrowTimestampOption(), is(ArrowTimestampOption.NANOSECOND));
    assertThat(context.getSessionTimeZone(), is(TimeZone.getDefault()));
    assertThat(context.getDateFormatter(), notNullValue());
    assertThat(context.getTimestampTZFormatter(), notNullValue());
  }

  @Test
  public void testFlagsFromParameters() throws SFException {
    Map<String, String> parameters = new HashMap<>();
    parameters.put(SessionParameters.TIMEZONE, "America/Los_Angeles");
    parameters.put(SessionParameters.ENABLE_HIGHER_PRECISION, "true");
    parameters.put(SessionParameters.MAP_VALUES_NULLABLE, "true");
    parameters.put(SessionParameters.ENABLE_ARROW_UTF8_VALIDATION, "true");
    parameters.put(SessionParameters.ARROW_TIMESTAMP_OPTION, "microsecond");

    DataConversionContext context =
        DefaultDataConversionContext.builder().parameters(parameters).build();
    assertThat(context.getSessionTimeZone().getID(), is("America/Los_Angeles"));
    assertThat(context.isHigherPrecision(), is(true));
    assertThat(context.isMapValuesNullable(), is(true));
    assertThat(context.isUtf8ValidationEnabled(), is(true));
    assertThat(context.getArrowTimestampOption(), is(ArrowTimestampOption.MICROSECOND));
    assertThat(context.getParameters().get(SessionParameters.TIMEZONE), is("America/Los_Angeles"));
  }

  @Test
  public void testExplicitSettingsWin() throws SFException {
    DataConversionContext context =
        DefaultDataConversionContext.builder()
            .parameter(SessionParameters.TIMEZONE, "America/Los_Angeles")
            .parameter(SessionParameters.ENABLE_HIGHER_PRECISION, "true")
            .sessionTimeZone(TimeZone.getTimeZone("Asia/Tokyo"))
            .higherPrecision(false)
            .arrowTimestampOption(ArrowTimestampOption.ORIGINAL)
            .build();
    assertThat(context.getSessionTimeZone().getID(), is("Asia/Tokyo"));
    assertThat(context.isHigherPrecision(), is(false));
    assertThat(context.getArrowTimestampOption(), is(ArrowTimestampOption.ORIGINAL));
  }

  @Test
  public void testParametersAreReadOnly() throws SFException {
    DataConversionContext context =
        DefaultDataConversionContext.builder().parameter("A", "1").build();
    assertThrows(
        UnsupportedOperationException.class, () -> context.getParameters().put("B", "2"));
  }

  @Test
  public void testUnknownTimestampOption() {
    SFException ex =
        assertThrows(
            SFException.class,
            () ->
                DefaultDataConversionContext.builder()
                    .parameter(SessionParameters.ARROW_TIMESTAMP_OPTION, "fortnight")
                    .build());
    assertThat(ex.getErrorCode(), is(ErrorCode.INVALID_PARAMETER_VALUE));
    assertThat(ex.getSqlState(), is(SqlState.INVALID_PARAMETER_VALUE));
  }

  @Test
  public void testParameterNamesIgnoreDefaultLocale() throws SFException {
    Locale previous = Locale.getDefault();
    Locale.setDefault(new Locale("tr", "TR"));
    try {
      DataConversionContext context =
          DefaultDataConversionContext.builder()
              .parameter("arrow_timestamp_option", "microsecond")
              .parameter("map_values_nullable", "true")
              .build();
      assertThat(context.getArrowTimestampOption(), is(ArrowTimestampOption.MICROSECOND));
      assertThat(context.isMapValuesNullable(), is(true));
      assertThat(SnowflakeType.fromString("timestamp_ltz"), is(SnowflakeType.TIMESTAMP_LTZ));
      assertThat(SnowflakeType.fromString("binary"), is(SnowflakeType.BINARY));
    } finally {
      Locale.setDefault(previous);
    }
  }
}
