package net.snowflake.codec.core;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.TimeZone;
import net.snowflake.codec.jdbc.ErrorCode;
import net.snowflake.codec.jdbc.FieldMetadata;
import net.snowflake.codec.jdbc.SnowflakeType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

public class ScalarCodecTest {
  private static final TimeZone UTC = TimeZone.getTimeZone("UTC");

  private static Object decode(SnowflakeType type, int scale, String raw, boolean hp)
      throws SFException {
    return ScalarCodec.decodeScalar(type, scale, raw, "C1", UTC, hp);
  }

  @ParameterizedTest
  @EnumSource(SnowflakeType.class)
  public void testNullIsNullForEveryType(SnowflakeType type) throws SFException {
    assertThat(decode(type, 0, null, false), nullValue());
    assertThat(decode(type, 0, null, true), nullValue());
    assertThat(ScalarCodec.encodeScalar(null, type), nullValue());
  }

  @Test
  public void testDecodeFixed() throws SFException {
    assertThat(decode(SnowflakeType.FIXED, 0, "123", false), is("123"));
    assertThat(decode(SnowflakeType.FIXED, 0, "123", true), is(BigInteger.valueOf(123)));
    assertThat(decode(SnowflakeType.FIXED, 2, "12.3", false), is("12.30"));
    assertThat(decode(SnowflakeType.FIXED, 2, "12.3", true), is(new BigDecimal("12.30")));
    assertThat(decode(SnowflakeType.FIXED, 2, "-0.5", false), is("-0.50"));
    assertThat(
        decode(SnowflakeType.FIXED, 0, "99999999999999999999999999999999999999", true),
        is(new BigInteger("99999999999999999999999999999999999999")));
  }

  @Test
  public void testDecodeInvalidFixed() {
    SFException ex =
        assertThrows(SFException.class, () -> decode(SnowflakeType.FIXED, 0, "abc", false));
    assertThat(ex.getErrorCode(), is(ErrorCode.INVALID_VALUE_CONVERT));
    assertThrows(SFException.class, () -> decode(SnowflakeType.FIXED, 0, "1.5", true));
  }

  @Test
  public void testDecodeReal() throws SFException {
    assertThat(decode(SnowflakeType.REAL, 0, "1.5", false), is(1.5d));
    assertThat(decode(SnowflakeType.REAL, 0, "-1e308", false), is(-1e308d));
    assertThat(decode(SnowflakeType.REAL, 0, "NaN", false), is(Double.NaN));
    assertThat(decode(SnowflakeType.REAL, 0, "inf", false), is(Double.POSITIVE_INFINITY));
    assertThat(decode(SnowflakeType.REAL, 0, "-INF", false), is(Double.NEGATIVE_INFINITY));
    assertThrows(SFException.class, () -> decode(SnowflakeType.REAL, 0, "one", false));
  }

  @ParameterizedTest
  @CsvSource({"1, true", "0, false", "TRUE, true", "false, false", "True, true"})
  public void testDecodeBoolean(String raw, boolean expected) throws SFException {
    assertThat(decode(SnowflakeType.BOOLEAN, 0, raw, false), is(expected));
  }

  @Test
  public void testDecodeInvalidBoolean() {
    assertThrows(SFException.class, () -> decode(SnowflakeType.BOOLEAN, 0, "yes", false));
  }

  @Test
  public void testDecodeBinary() throws SFException {
    assertArrayEquals(
        new byte[] {0x0a, (byte) 0xff}, (byte[]) decode(SnowflakeType.BINARY, 0, "0aFF", false));
    assertArrayEquals(new byte[0], (byte[]) decode(SnowflakeType.BINARY, 0, "", false));
    SFException ex =
        assertThrows(SFException.class, () -> decode(SnowflakeType.BINARY, 0, "0g", false));
    assertThat(ex.getErrorCode(), is(ErrorCode.INVALID_BINARY_HEX_FORM));
    assertThrows(SFException.class, () -> decode(SnowflakeType.BINARY, 0, "abc", false));
  }

  @Test
  public void testDecodeTextLikeTypes() throws SFException {
    assertThat(decode(SnowflakeType.TEXT, 0, "", false), is(""));
    assertThat(decode(SnowflakeType.VARIANT, 0, "{\"a\":1}", false), is("{\"a\":1}"));
  }

  @Test
  public void testDecodeTemporal() throws SFException {
    assertThat(
        decode(SnowflakeType.DATE, 0, "-1", false),
        is(ZonedDateTime.of(1969, 12, 31, 0, 0, 0, 0, ZoneOffset.UTC)));
    assertThat(
        decode(SnowflakeType.TIME, 3, "3661500", false), is(LocalTime.of(1, 1, 1, 500_000_000)));
    assertThat(
        decode(SnowflakeType.TIMESTAMP_NTZ, 9, "1.000000001", false),
        is(ZonedDateTime.ofInstant(Instant.ofEpochSecond(1, 1), ZoneOffset.UTC)));
    ZonedDateTime ltz =
        (ZonedDateTime)
            ScalarCodec.decodeScalar(
                SnowflakeType.TIMESTAMP_LTZ,
                0,
                "0",
                TimeZone.getTimeZone("Asia/Singapore"),
                false);
    assertThat(ltz.getZone(), is(ZoneId.of("Asia/Singapore")));
  }

  @Test
  public void testDecodeColumn() throws SFException {
    DataConversionContext context =
        DefaultDataConversionContext.builder().sessionTimeZone(UTC).higherPrecision(true).build();
    assertThat(
        ScalarCodec.decode(new FieldMetadata("C1", SnowflakeType.FIXED, 1), "7", context),
        is(new BigDecimal("7.0")));
    // structured column without field metadata stays JSON text
    assertThat(
        ScalarCodec.decode(new FieldMetadata("C2", SnowflakeType.OBJECT), "{\"a\":1}", context),
        is("{\"a\":1}"));
    assertThat(
        ScalarCodec.decode(new FieldMetadata("C3", SnowflakeType.TEXT), null, context),
        nullValue());
  }

  @Test
  public void testDecodeReadsSessionSettings() throws SFException {
    DataConversionContext context = mock(DataConversionContext.class);
    when(context.getSessionTimeZone()).thenReturn(TimeZone.getTimeZone("Europe/Paris"));
    when(context.isHigherPrecision()).thenReturn(false);

    ZonedDateTime ltz =
        (ZonedDateTime)
            ScalarCodec.decode(
                new FieldMetadata("C1", SnowflakeType.TIMESTAMP_LTZ, 3), "0.000", context);
    assertThat(ltz.getZone(), is(ZoneId.of("Europe/Paris")));
    assertThat(
        ScalarCodec.decode(new FieldMetadata("C2", SnowflakeType.FIXED), "42", context), is("42"));
    verify(context, times(2)).getSessionTimeZone();
    verify(context, times(2)).isHigherPrecision();
    verifyNoMoreInteractions(context);
  }

  @Test
  public void testFixedToValue() {
    assertThat(ScalarCodec.fixedToValue(BigInteger.valueOf(12345), 0, false), is("12345"));
    assertThat(ScalarCodec.fixedToValue(BigInteger.valueOf(-5), 1, false), is("-0.5"));
    assertThat(ScalarCodec.fixedToValue(BigInteger.ZERO, 3, false), is("0.000"));
    assertThat(
        ScalarCodec.fixedToValue(BigInteger.ONE, 37, false),
        is("0.0000000000000000000000000000000000001"));
    assertThat(
        ScalarCodec.fixedToValue(BigInteger.valueOf(12345), 2, true),
        is(new BigDecimal("123.45")));
  }

  @Test
  public void testFixedToNestedValue() throws SFException {
    assertThat(ScalarCodec.fixedToNestedValue(new BigDecimal("42"), 0, false, "f"), is(42L));
    assertThat(
        ScalarCodec.fixedToNestedValue(new BigDecimal("42"), 0, true, "f"),
        is(BigInteger.valueOf(42)));
    assertThat(ScalarCodec.fixedToNestedValue(new BigDecimal("1.25"), 2, false, "f"), is(1.25d));
    assertThat(
        ScalarCodec.fixedToNestedValue(new BigDecimal("1.25"), 2, true, "f"),
        is(new BigDecimal("1.25")));
    assertThrows(
        SFException.class,
        () ->
            ScalarCodec.fixedToNestedValue(
                new BigDecimal("99999999999999999999"), 0, false, "f"));
  }

  @Test
  public void testEncodeDecodeFixed() throws SFException {
    BigDecimal value = new BigDecimal("-12.30");
    String wire = ScalarCodec.encodeScalar(value, SnowflakeType.FIXED);
    assertThat(wire, is("-12.30"));
    assertThat(decode(SnowflakeType.FIXED, 2, wire, true), is(value));
    assertThat(ScalarCodec.encodeScalar(7L, SnowflakeType.FIXED), is("7"));
    assertThat(ScalarCodec.encodeScalar("1e3", SnowflakeType.FIXED), is("1000"));
    assertThrows(SFException.class, () -> ScalarCodec.encodeScalar("x", SnowflakeType.FIXED));
  }

  @Test
  public void testEncodeDecodeReal() throws SFException {
    for (double value :
        new double[] {0d, -0.1d, Double.MAX_VALUE, Double.MIN_VALUE, Double.NaN}) {
      String wire = ScalarCodec.encodeScalar(value, SnowflakeType.REAL);
      assertThat(decode(SnowflakeType.REAL, 0, wire, false), is(value));
    }
    assertThat(
        decode(
            SnowflakeType.REAL,
            0,
            ScalarCodec.encodeScalar(Double.POSITIVE_INFINITY, SnowflakeType.REAL),
            false),
        is(Double.POSITIVE_INFINITY));
  }

  @Test
  public void testEncodeDecodeBinaryAndBoolean() throws SFException {
    byte[] bytes = {0, 1, (byte) 0x80, (byte) 0xfe};
    String wire = ScalarCodec.encodeScalar(bytes, SnowflakeType.BINARY);
    assertThat(wire, is("000180fe"));
    assertArrayEquals(bytes, (byte[]) decode(SnowflakeType.BINARY, 0, wire, false));
    assertThat(
        decode(
            SnowflakeType.BOOLEAN, 0, ScalarCodec.encodeScalar(true, SnowflakeType.BOOLEAN), false),
        is(true));
  }

  @Test
  public void testEncodeDecodeTemporal() throws SFException {
    ZonedDateTime tz =
        ZonedDateTime.of(2021, 7, 4, 12, 30, 15, 123_456_789, ZoneOffset.ofHours(2));
    assertThat(
        decode(
            SnowflakeType.TIMESTAMP_TZ,
            9,
            ScalarCodec.encodeScalar(tz, SnowflakeType.TIMESTAMP_TZ),
            false),
        is(tz));

    ZonedDateTime ntz = ZonedDateTime.of(1900, 1, 1, 0, 0, 0, 1, ZoneOffset.UTC);
    assertThat(
        decode(
            SnowflakeType.TIMESTAMP_NTZ,
            9,
            ScalarCodec.encodeScalar(ntz, SnowflakeType.TIMESTAMP_NTZ),
            false),
        is(ntz));

    LocalTime time = LocalTime.of(23, 59, 59, 999_999_999);
    assertThat(
        decode(SnowflakeType.TIME, 9, ScalarCodec.encodeScalar(time, SnowflakeType.TIME), false),
        is(time));

    OffsetDateTime date = OffsetDateTime.of(2020, 3, 5, 1, 0, 0, 0, ZoneOffset.ofHours(9));
    assertThat(
        decode(SnowflakeType.DATE, 0, ScalarCodec.encodeScalar(date, SnowflakeType.DATE), false),
        is(ZonedDateTime.of(2020, 3, 5, 0, 0, 0, 0, ZoneOffset.UTC)));
  }

  @Test
  public void testEncodeUnsupported() {
    SFException ex =
        assertThrows(SFException.class, () -> ScalarCodec.encodeScalar(5, SnowflakeType.BOOLEAN));
    assertThat(ex.getErrorCode(), is(ErrorCode.DATA_TYPE_NOT_SUPPORTED));
    assertThrows(SFException.class, () -> ScalarCodec.encodeScalar(1.5d, SnowflakeType.TEXT));
  }

  @Test
  public void testToZonedDateTime() {
    Instant instant = Instant.ofEpochSecond(1000);
    assertThat(ScalarCodec.toZonedDateTime(instant), is(instant.atZone(ZoneOffset.UTC)));
    assertThat(ScalarCodec.toZonedDateTime("2020-01-01"), nullValue());
  }

  @Test
  public void testErrorMessagesNameTheFieldOnlyWhenKnown() {
    SFException named =
        assertThrows(
            SFException.class,
            () -> ScalarCodec.decodeScalar(SnowflakeType.REAL, 0, "abc", "PRICE", null, false));
    assertThat(named.getMessage().endsWith("value=abc, field=PRICE"), is(true));

    SFException unnamed =
        assertThrows(
            SFException.class,
            () -> ScalarCodec.decodeScalar(SnowflakeType.REAL, 0, "abc", null, false));
    assertThat(unnamed.getMessage().endsWith("value=abc"), is(true));

    SFException encoded =
        assertThrows(
            SFException.class, () -> ScalarCodec.encodeScalar("abc", SnowflakeType.FIXED));
    assertThat(encoded.getErrorCode(), is(ErrorCode.INVALID_VALUE_CONVERT));
    assertThat(encoded.getMessage().contains("field"), is(false));
  }
}
