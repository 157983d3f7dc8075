package net.snowflake.codec.core.arrow.fullvectorconverters;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.charset.StandardCharsets;
import java.util.logging.Level;
import net.snowflake.codec.core.SFException;
import net.snowflake.codec.core.arrow.BaseConverterTest;
import net.snowflake.codec.jdbc.FieldMetadata;
import net.snowflake.codec.jdbc.SnowflakeType;
import net.snowflake.codec.log.JDK14Logger;
import net.snowflake.codec.log.ListHandler;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class VarCharVectorConverterTest extends BaseConverterTest {
  private static final FieldMetadata TEXT = new FieldMetadata("C1", SnowflakeType.TEXT);

  private final ListHandler handler = new ListHandler();
  private Level previousLevel;

  @BeforeEach
  public void attachHandler() {
    previousLevel = JDK14Logger.getLevel();
    JDK14Logger.setLevel(Level.WARNING);
    JDK14Logger.addHandler(handler);
  }

  @AfterEach
  public void detachHandler() {
    JDK14Logger.removeHandler(handler);
    JDK14Logger.setLevel(previousLevel);
  }

  private static byte[] utf8(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }

  @Test
  public void testSanitize() {
    assertThat(VarCharVectorConverter.sanitize(utf8("plain ascii")), nullValue());
    assertThat(VarCharVectorConverter.sanitize(utf8("Zürich 東京")), nullValue());
    assertThat(VarCharVectorConverter.sanitize(new byte[0]), nullValue());
    assertThat(
        VarCharVectorConverter.sanitize(new byte[] {'a', (byte) 0xff, (byte) 0xfe, 'b'}),
        is("a\uFFFDb"));
    // truncated three byte sequence at the end
    assertThat(
        VarCharVectorConverter.sanitize(new byte[] {'x', (byte) 0xe6, (byte) 0x9d}),
        is("x\uFFFD"));
    assertThat(
        VarCharVectorConverter.sanitize(new byte[] {(byte) 0xc3, 'a', (byte) 0xc3}),
        is("\uFFFDa\uFFFD"));
  }

  private VarCharVector vectorWithInvalidRow() {
    VarCharVector vector =
        new VarCharVector("C1", fieldType(ArrowType.Utf8.INSTANCE, "TEXT"), allocator);
    vector.allocateNew(3);
    vector.setSafe(0, utf8("ok"));
    vector.setSafe(1, new byte[] {'b', 'a', 'd', (byte) 0x80});
    vector.setNull(2);
    vector.setValueCount(3);
    return vector;
  }

  @Test
  public void testValidationDisabledKeepsVector() throws SFException, SFArrowException {
    VarCharVector vector = vectorWithInvalidRow();
    try {
      FieldVector result = new VarCharVectorConverter(allocator, vector, TEXT, this).convert();
      assertThat(result, sameInstance((FieldVector) vector));
      assertThat(handler.records.size(), is(0));
    } finally {
      vector.close();
    }
  }

  @Test
  public void testValidationReplacesInvalidBytes() throws SFException, SFArrowException {
    setUtf8Validation(true);
    VarCharVector vector = vectorWithInvalidRow();
    try (FieldVector result =
        new VarCharVectorConverter(allocator, vector, TEXT, this).convert()) {
      assertThat(result, not(sameInstance((FieldVector) vector)));
      VarCharVector converted = (VarCharVector) result;
      assertThat(converted.getValueCount(), is(3));
      assertThat(new String(converted.get(0), StandardCharsets.UTF_8), is("ok"));
      assertThat(new String(converted.get(1), StandardCharsets.UTF_8), is("bad\uFFFD"));
      assertThat(converted.isNull(2), is(true));
      assertThat(handler.records.size(), is(1));
      assertThat(handler.records.get(0).getLevel(), is(Level.WARNING));
    }
  }

  @Test
  public void testConvertOnlyOnce() throws SFException, SFArrowException {
    VarCharVector vector = vectorWithInvalidRow();
    try {
      VarCharVectorConverter converter = new VarCharVectorConverter(allocator, vector, TEXT, this);
      converter.convert();
      SFArrowException ex =
          assertThrows(SFArrowException.class, converter::convert);
      assertThat(ex.getErrorCode(), is(ArrowErrorCode.VECTOR_ALREADY_CONVERTED));
    } finally {
      vector.close();
    }
  }
}
