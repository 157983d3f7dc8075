package net.snowflake.codec.core.arrow;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import net.snowflake.codec.core.SFException;
import net.snowflake.codec.jdbc.ErrorCode;
import net.snowflake.codec.jdbc.FieldMetadata;
import net.snowflake.codec.jdbc.SnowflakeType;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.DateDayVector;
import org.apache.arrow.vector.DecimalVector;
import org.apache.arrow.vector.Float4Vector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.SmallIntVector;
import org.apache.arrow.vector.TinyIntVector;
import org.apache.arrow.vector.VarBinaryVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.types.DateUnit;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.junit.jupiter.api.Test;

public class ArrowScalarConverterTest extends BaseConverterTest {

  @Test
  public void testFixedFromEveryIntegerWidth() throws SFException {
    FieldMetadata integer = field("C1", SnowflakeType.FIXED, 0);
    FieldMetadata decimal = field("C1", SnowflakeType.FIXED, 2);

    try (TinyIntVector tiny =
            new TinyIntVector("C1", fieldType(new ArrowType.Int(8, true), "FIXED"), allocator);
        SmallIntVector small =
            new SmallIntVector(
                "C1", fieldType(new ArrowType.Int(16, true), "FIXED", 2), allocator);
        BigIntVector big =
            new BigIntVector("C1", fieldType(new ArrowType.Int(64, true), "FIXED"), allocator)) {
      tiny.allocateNew(2);
      tiny.setSafe(0, -5);
      tiny.setNull(1);
      tiny.setValueCount(2);
      small.allocateNew(1);
      small.setSafe(0, 12345);
      small.setValueCount(1);
      big.allocateNew(1);
      big.setSafe(0, Long.MAX_VALUE);
      big.setValueCount(1);

      assertThat(ArrowValueConverter.cellToValue(tiny, integer, 0, this), is("-5"));
      assertThat(ArrowValueConverter.cellToValue(tiny, integer, 1, this), nullValue());
      assertThat(ArrowValueConverter.cellToValue(small, decimal, 0, this), is("123.45"));
      assertThat(
          ArrowValueConverter.cellToValue(big, integer, 0, this), is("9223372036854775807"));

      setHigherPrecision(true);
      assertThat(
          ArrowValueConverter.cellToValue(tiny, integer, 0, this), is(BigInteger.valueOf(-5)));
      assertThat(
          ArrowValueConverter.cellToValue(small, decimal, 0, this),
          is(new BigDecimal("123.45")));
    }
  }

  @Test
  public void testFixedFromDecimalVector() throws SFException {
    FieldMetadata decimal = field("C1", SnowflakeType.FIXED, 2);
    try (DecimalVector vector =
        new DecimalVector(
            "C1", fieldType(new ArrowType.Decimal(38, 2, 128), "FIXED", 2), allocator)) {
      vector.allocateNew(2);
      vector.setSafe(0, new BigDecimal("123456789012345678901234567890.12"));
      vector.setNull(1);
      vector.setValueCount(2);

      ArrowVectorConverter converter =
          ArrowVectorConverterUtil.initConverter(vector, decimal, this);
      assertThat(converter.toObject(0), is("123456789012345678901234567890.12"));
      assertThat(converter.toObject(1), nullValue());
      assertThat(
          converter.toBigDecimal(0), is(new BigDecimal("123456789012345678901234567890.12")));
      assertThrows(SFException.class, () -> converter.toLong(0));
      assertThat(converter.toLong(1), is(0L));
    }
  }

  @Test
  public void testFixedNumericAccessors() throws SFException {
    try (IntVector vector =
        new IntVector("C1", fieldType(new ArrowType.Int(32, true), "FIXED", 2), allocator)) {
      vector.allocateNew(2);
      vector.setSafe(0, 12345);
      vector.setSafe(1, -12300);
      vector.setValueCount(2);

      ArrowVectorConverter converter =
          ArrowVectorConverterUtil.initConverter(
              vector, field("C1", SnowflakeType.FIXED, 2), this);
      assertThat(converter.toDouble(0), is(123.45d));
      assertThat(converter.toLong(1), is(-123L));
      SFException ex = assertThrows(SFException.class, () -> converter.toLong(0));
      assertThat(ex.getErrorCode(), is(ErrorCode.INVALID_VALUE_CONVERT));
    }
  }

  @Test
  public void testReal() throws SFException {
    try (Float8Vector doubles =
            new Float8Vector(
                "C1",
                fieldType(new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE), "REAL"),
                allocator);
        Float4Vector floats =
            new Float4Vector(
                "C2",
                fieldType(new ArrowType.FloatingPoint(FloatingPointPrecision.SINGLE), "REAL"),
                allocator)) {
      doubles.allocateNew(2);
      doubles.setSafe(0, 1.5d);
      doubles.setSafe(1, Double.NaN);
      doubles.setValueCount(2);
      floats.allocateNew(1);
      floats.setSafe(0, 0.5f);
      floats.setValueCount(1);

      FieldMetadata real = field("C1", SnowflakeType.REAL, 0);
      assertThat(ArrowValueConverter.cellToValue(doubles, real, 0, this), is(1.5d));
      assertThat(ArrowValueConverter.cellToValue(doubles, real, 1, this), is(Double.NaN));
      assertThat(ArrowValueConverter.cellToValue(floats, real, 0, this), is(0.5d));

      ArrowVectorConverter converter =
          ArrowVectorConverterUtil.initConverter(doubles, real, this);
      assertThat(converter.toBigDecimal(0), is(new BigDecimal("1.5")));
      assertThrows(SFException.class, () -> converter.toBigDecimal(1));
      assertThrows(SFException.class, () -> converter.toLong(0));
    }
  }

  @Test
  public void testTextBooleanAndBinary() throws SFException {
    try (VarCharVector text =
            new VarCharVector("C1", fieldType(ArrowType.Utf8.INSTANCE, "TEXT"), allocator);
        BitVector bits =
            new BitVector("C2", fieldType(ArrowType.Bool.INSTANCE, "BOOLEAN"), allocator);
        VarBinaryVector binary =
            new VarBinaryVector("C3", fieldType(ArrowType.Binary.INSTANCE, "BINARY"), allocator)) {
      text.allocateNew(2);
      text.setSafe(0, "héllo".getBytes(StandardCharsets.UTF_8));
      text.setNull(1);
      text.setValueCount(2);
      bits.allocateNew(2);
      bits.setSafe(0, 1);
      bits.setSafe(1, 0);
      bits.setValueCount(2);
      binary.allocateNew(1);
      binary.setSafe(0, new byte[] {1, (byte) 0xff});
      binary.setValueCount(1);

      assertThat(
          ArrowValueConverter.cellToValue(text, field("C1", SnowflakeType.TEXT, 0), 0, this),
          is("héllo"));
      assertThat(
          ArrowValueConverter.cellToValue(text, field("C1", SnowflakeType.TEXT, 0), 1, this),
          nullValue());
      assertThat(
          ArrowValueConverter.cellToValue(bits, field("C2", SnowflakeType.BOOLEAN, 0), 0, this),
          is(true));
      assertThat(
          ArrowValueConverter.cellToValue(bits, field("C2", SnowflakeType.BOOLEAN, 0), 1, this),
          is(false));
      assertArrayEquals(
          new byte[] {1, (byte) 0xff},
          (byte[])
              ArrowValueConverter.cellToValue(
                  binary, field("C3", SnowflakeType.BINARY, 0), 0, this));
    }
  }

  @Test
  public void testDate() throws SFException {
    try (DateDayVector days =
            new DateDayVector("C1", fieldType(new ArrowType.Date(DateUnit.DAY), "DATE"), allocator);
        IntVector ints =
            new IntVector("C2", fieldType(new ArrowType.Int(32, true), "DATE"), allocator)) {
      days.allocateNew(2);
      days.setSafe(0, -1);
      days.setSafe(1, 0);
      days.setValueCount(2);
      ints.allocateNew(1);
      ints.setSafe(0, 18000);
      ints.setValueCount(1);

      FieldMetadata date = field("C1", SnowflakeType.DATE, 0);
      assertThat(
          ArrowValueConverter.cellToValue(days, date, 0, this),
          is(ZonedDateTime.of(1969, 12, 31, 0, 0, 0, 0, ZoneOffset.UTC)));
      assertThat(
          ArrowValueConverter.cellToValue(days, date, 1, this),
          is(ZonedDateTime.of(1970, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC)));
      ZonedDateTime fromInt = (ZonedDateTime) ArrowValueConverter.cellToValue(ints, date, 0, this);
      assertThat(fromInt.toLocalDate(), is(LocalDate.ofEpochDay(18000)));
      assertThat(ArrowVectorConverterUtil.initConverter(days, date, this).toLong(0), is(-1L));
    }
  }

  @Test
  public void testTime() throws SFException {
    try (IntVector millis =
            new IntVector("C1", fieldType(new ArrowType.Int(32, true), "TIME", 3), allocator);
        BigIntVector nanos =
            new BigIntVector("C2", fieldType(new ArrowType.Int(64, true), "TIME", 9), allocator)) {
      millis.allocateNew(1);
      millis.setSafe(0, 3661500);
      millis.setValueCount(1);
      nanos.allocateNew(1);
      nanos.setSafe(0, 86_399_999_999_999L);
      nanos.setValueCount(1);

      assertThat(
          ArrowValueConverter.cellToValue(millis, field("C1", SnowflakeType.TIME, 3), 0, this),
          is(LocalTime.of(1, 1, 1, 500_000_000)));
      ArrowVectorConverter converter =
          ArrowVectorConverterUtil.initConverter(nanos, field("C2", SnowflakeType.TIME, 9), this);
      assertThat(converter.toObject(0), is(LocalTime.MAX));
      assertThat(converter.toLong(0), is(86_399_999_999_999L));
    }
  }

  @Test
  public void testTypeAndVectorMismatch() {
    try (VarCharVector text =
        new VarCharVector("C1", fieldType(ArrowType.Utf8.INSTANCE, "FIXED"), allocator)) {
      text.allocateNew(1);
      text.setSafe(0, "1".getBytes(StandardCharsets.UTF_8));
      text.setValueCount(1);
      SFException ex =
          assertThrows(
              SFException.class,
              () ->
                  ArrowVectorConverterUtil.initConverter(
                      text, field("C1", SnowflakeType.FIXED, 0), this));
      assertThat(ex.getErrorCode(), is(ErrorCode.DATA_TYPE_NOT_SUPPORTED));
    }
  }

  @Test
  public void testFieldMetadataFromArrowField() throws SFException {
    try (SmallIntVector vector =
        new SmallIntVector("C1", fieldType(new ArrowType.Int(16, true), "fixed", 2), allocator)) {
      FieldMetadata metadata = ArrowVectorConverterUtil.toFieldMetadata(vector.getField());
      assertThat(metadata.getName(), is("C1"));
      assertThat(metadata.getBase(), is(SnowflakeType.FIXED));
      assertThat(metadata.getScale(), is(2));
      assertThat(metadata.getPrecision(), is(38));
      assertThat(
          ArrowVectorConverterUtil.initConverter(vector, metadata, this),
          instanceOf(FixedConverter.class));
    }
    try (IntVector untyped =
        new IntVector("C2", plainFieldType(new ArrowType.Int(32, true)), allocator)) {
      assertThrows(
          SFException.class, () -> ArrowVectorConverterUtil.toFieldMetadata(untyped.getField()));
    }
  }
}
