package net.snowflake.codec.core.arrow.fullvectorconverters;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import net.snowflake.codec.core.DataConversionContext;
import net.snowflake.codec.jdbc.FieldMetadata;
import net.snowflake.codec.log.SFLogger;
import net.snowflake.codec.log.SFLoggerFactory;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.ValueVector;
import org.apache.arrow.vector.VarCharVector;

/**
 * Text columns. When UTF-8 validation is enabled every run of invalid bytes is replaced with
 * U+FFFD, otherwise the vector is kept as is.
 */
public class VarCharVectorConverter extends AbstractFullVectorConverter {
  private static final SFLogger logger = SFLoggerFactory.getLogger(VarCharVectorConverter.class);

  static final char REPLACEMENT_CHARACTER = '\uFFFD';

  public VarCharVectorConverter(
      BufferAllocator allocator,
      ValueVector vector,
      FieldMetadata field,
      DataConversionContext context) {
    super(allocator, vector, field, context);
  }

  @Override
  protected FieldVector convertVector() {
    if (!context.isUtf8ValidationEnabled() || !(vector instanceof VarCharVector)) {
      return (FieldVector) vector;
    }
    VarCharVector source = (VarCharVector) vector;
    int size = source.getValueCount();
    VarCharVector converted = (VarCharVector) source.getField().createVector(allocator);
    converted.allocateNew(size);
    boolean invalidFound = false;
    for (int i = 0; i < size; i++) {
      if (source.isNull(i)) {
        continue;
      }
      byte[] bytes = source.get(i);
      String sanitized = sanitize(bytes);
      if (sanitized != null) {
        invalidFound = true;
        converted.setSafe(i, sanitized.getBytes(StandardCharsets.UTF_8));
      } else {
        converted.setSafe(i, bytes);
      }
    }
    converted.setValueCount(size);
    if (invalidFound) {
      logger.warn(
          "Invalid UTF-8 characters detected while reading query response, column: {}",
          field.getName());
    }
    source.close();
    return converted;
  }

  /**
   * @param bytes UTF-8 text
   * @return the text with each run of invalid bytes replaced by U+FFFD, or null if the text is
   *     valid
   */
  static String sanitize(byte[] bytes) {
    CharsetDecoder decoder =
        StandardCharsets.UTF_8
            .newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
    ByteBuffer in = ByteBuffer.wrap(bytes);
    // a UTF-8 byte never decodes to more than one char, replacements included
    CharBuffer out = CharBuffer.allocate(bytes.length + 1);
    boolean replaced = false;
    int lastReplacement = -1;
    while (true) {
      CoderResult result = decoder.decode(in, out, true);
      if (result.isError()) {
        if (out.position() != lastReplacement) {
          out.put(REPLACEMENT_CHARACTER);
          lastReplacement = out.position();
        }
        replaced = true;
        in.position(in.position() + result.length());
      } else {
        decoder.flush(out);
        break;
      }
    }
    if (!replaced) {
      return null;
    }
    out.flip();
    return out.toString();
  }
}
