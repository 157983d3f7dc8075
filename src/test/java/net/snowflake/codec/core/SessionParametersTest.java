package net.snowflake.codec.core;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class SessionParametersTest {

  @Test
  public void testServerDefaults() {
    assertThat(
        SessionParameters.effectiveParamValue(null, SessionParameters.DATE_OUTPUT_FORMAT),
        is("YYYY-MM-DD"));
    assertThat(
        SessionParameters.effectiveParamValue(
            new HashMap<>(), SessionParameters.TIME_OUTPUT_FORMAT),
        is("HH24:MI:SS"));
    assertThat(
        SessionParameters.effectiveParamValue(null, SessionParameters.TIMEZONE), nullValue());
  }

  @Test
  public void testNamesAreCaseInsensitive() {
    Map<String, String> parameters = new HashMap<>();
    parameters.put("date_output_format", "DD/MM/YYYY");
    assertThat(
        SessionParameters.effectiveParamValue(parameters, SessionParameters.DATE_OUTPUT_FORMAT),
        is("DD/MM/YYYY"));
  }

  @Test
  public void testTimestampFormatFallsBackToGeneralFormat() {
    Map<String, String> parameters = new HashMap<>();
    parameters.put(SessionParameters.TIMESTAMP_OUTPUT_FORMAT, "YYYY-MM-DD HH24:MI");
    parameters.put(SessionParameters.TIMESTAMP_TZ_OUTPUT_FORMAT, "YYYY-MM-DD HH24:MI TZH:TZM");
    assertThat(
        SessionParameters.timestampFormat(
            parameters, SessionParameters.TIMESTAMP_NTZ_OUTPUT_FORMAT),
        is("YYYY-MM-DD HH24:MI"));
    assertThat(
        SessionParameters.timestampFormat(parameters, SessionParameters.TIMESTAMP_TZ_OUTPUT_FORMAT),
        is("YYYY-MM-DD HH24:MI TZH:TZM"));
    assertThat(
        SessionParameters.timestampFormat(null, SessionParameters.TIMESTAMP_LTZ_OUTPUT_FORMAT),
        is("YYYY-MM-DD HH24:MI:SS.FF3 TZHTZM"));
  }

  @Test
  public void testBooleanValue() {
    Map<String, String> parameters = new HashMap<>();
    parameters.put(SessionParameters.ENABLE_HIGHER_PRECISION, " TRUE ");
    assertThat(
        SessionParameters.booleanValue(
            parameters, SessionParameters.ENABLE_HIGHER_PRECISION, false),
        is(true));
    assertThat(
        SessionParameters.booleanValue(parameters, SessionParameters.MAP_VALUES_NULLABLE, true),
        is(true));
  }
}
