package net.snowflake.codec.core.arrow.fullvectorconverters;

import java.time.Instant;
import net.snowflake.codec.core.DataConversionContext;
import net.snowflake.codec.core.SFException;
import net.snowflake.codec.core.TemporalCodec;
import net.snowflake.codec.core.arrow.ArrowTimestampOption;
import net.snowflake.codec.core.arrow.TimestampConverter;
import net.snowflake.codec.jdbc.ErrorCode;
import net.snowflake.codec.jdbc.FieldMetadata;
import net.snowflake.codec.log.SFLogger;
import net.snowflake.codec.log.SFLoggerFactory;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.TimeStampVector;
import org.apache.arrow.vector.ValueVector;
import org.apache.arrow.vector.types.pojo.ArrowType;

/**
 * Timestamp columns to arrow timestamp vectors of the unit selected by {@link
 * ArrowTimestampOption}. TIMESTAMP_LTZ vectors carry the session time zone, TIMESTAMP_TZ vectors
 * UTC and TIMESTAMP_NTZ vectors no time zone.
 */
public class TimestampVectorConverter extends AbstractFullVectorConverter {
  private static final SFLogger logger = SFLoggerFactory.getLogger(TimestampVectorConverter.class);

  private static final String UTC = "UTC";

  private final ArrowTimestampOption option;

  public TimestampVectorConverter(
      BufferAllocator allocator,
      ValueVector vector,
      FieldMetadata field,
      DataConversionContext context,
      ArrowTimestampOption option) {
    super(allocator, vector, field, context);
    this.option = option;
  }

  private String timeZoneId() {
    switch (field.getBase()) {
      case TIMESTAMP_LTZ:
        return context.getSessionTimeZone().getID();
      case TIMESTAMP_TZ:
        return UTC;
      default:
        return null;
    }
  }

  @Override
  protected FieldVector convertVector() throws SFException, SFArrowException {
    if (option == ArrowTimestampOption.ORIGINAL) {
      return (FieldVector) vector;
    }
    TimestampConverter converter = new TimestampConverter(vector, field, context);
    int size = vector.getValueCount();
    String timeZone = timeZoneId();
    logger.debug(
        "Converting column {} of type {} to {} timestamps with time zone {}",
        field.getName(),
        field.getBase(),
        option,
        timeZone);
    FieldVector created =
        targetField(new ArrowType.Timestamp(option.getTimeUnit(), timeZone))
            .createVector(allocator);
    if (!(created instanceof TimeStampVector)) {
      created.close();
      throw new SFArrowException(
          ArrowErrorCode.CONVERT_FAILED,
          "Unexpected vector " + created.getClass().getSimpleName() + " for " + option);
    }
    TimeStampVector converted = (TimeStampVector) created;
    boolean success = false;
    try {
      converted.allocateNew(size);
      for (int i = 0; i < size; i++) {
        Instant instant = converter.toInstant(i);
        if (instant != null) {
          converted.set(i, toUnit(instant));
        }
      }
      converted.setValueCount(size);
      success = true;
    } finally {
      if (!success) {
        converted.close();
      }
    }
    vector.close();
    return converted;
  }

  /**
   * @param instant timestamp value
   * @return the instant as a count of the target unit since epoch, rounded towards negative
   *     infinity
   * @throws SFException if the count does not fit in 64 bits
   */
  long toUnit(Instant instant) throws SFException {
    int scale = option.getScale();
    try {
      long units = Math.multiplyExact(instant.getEpochSecond(), TemporalCodec.powerOfTen(scale));
      return Math.addExact(units, instant.getNano() / TemporalCodec.powerOfTen(9 - scale));
    } catch (ArithmeticException ex) {
      throw new SFException(
          ex, ErrorCode.TOO_HIGH_TIMESTAMP_PRECISION, instant.toString(), field.getName());
    }
  }
}
