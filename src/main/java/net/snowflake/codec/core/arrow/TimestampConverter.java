package net.snowflake.codec.core.arrow;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import net.snowflake.codec.core.DataConversionContext;
import net.snowflake.codec.core.SFException;
import net.snowflake.codec.core.TemporalCodec;
import net.snowflake.codec.jdbc.ErrorCode;
import net.snowflake.codec.jdbc.FieldMetadata;
import net.snowflake.codec.jdbc.SnowflakeType;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.ValueVector;
import org.apache.arrow.vector.complex.StructVector;

/**
 * Converter for the three timestamp types. The server uses one of these layouts:
 *
 * <ul>
 *   <li>BigIntVector of 10^-scale seconds since epoch (NTZ and LTZ, scale up to 7)
 *   <li>struct of epoch seconds and nanosecond fraction (NTZ and LTZ)
 *   <li>struct of 10^-scale seconds and biased time zone offset (TZ, scale up to 3)
 *   <li>struct of epoch seconds, fraction and biased time zone offset (TZ)
 * </ul>
 */
public class TimestampConverter extends AbstractArrowVectorConverter {
  private final ValueVector vector;
  private final BigIntVector epochs;
  private final IntVector fractions;
  private final IntVector timeZoneIndices;
  private final int sfScale;

  /**
   * @param vector BigIntVector or StructVector
   * @param field column or field metadata, one of the timestamp types
   * @param context session formats and flags
   * @throws SFException if the vector layout does not match the type
   */
  public TimestampConverter(ValueVector vector, FieldMetadata field, DataConversionContext context)
      throws SFException {
    super(field, vector, context);
    this.vector = vector;
    this.sfScale = field.getScale();
    if (vector instanceof BigIntVector) {
      epochs = (BigIntVector) vector;
      fractions = null;
      timeZoneIndices = null;
    } else if (vector instanceof StructVector) {
      StructVector structVector = (StructVector) vector;
      epochs = structVector.getChild(FIELD_NAME_EPOCH, BigIntVector.class);
      fractions = structVector.getChild(FIELD_NAME_FRACTION, IntVector.class);
      timeZoneIndices = structVector.getChild(FIELD_NAME_TIME_ZONE_INDEX, IntVector.class);
    } else {
      throw unexpectedLayout();
    }
    if (epochs == null || (field.getBase() == SnowflakeType.TIMESTAMP_TZ) != hasTimeZone()) {
      throw unexpectedLayout();
    }
  }

  private boolean hasTimeZone() {
    return timeZoneIndices != null;
  }

  private SFException unexpectedLayout() {
    return new SFException(
        ErrorCode.DATA_TYPE_NOT_SUPPORTED,
        logicalTypeStr
            + " stored as "
            + vector.getField().getType()
            + " with fields "
            + vector.getField().getChildren()
            + " in column "
            + field.getName());
  }

  @Override
  public boolean isNull(int index) {
    return vector.isNull(index)
        || epochs.isNull(index)
        || (fractions != null && fractions.isNull(index))
        || (timeZoneIndices != null && timeZoneIndices.isNull(index));
  }

  /**
   * @param index index of the value
   * @return the instant, null for SQL NULL
   */
  public Instant toInstant(int index) {
    if (isNull(index)) {
      return null;
    }
    long epoch = epochs.get(index);
    if (fractions != null) {
      return Instant.ofEpochSecond(epoch, fractions.get(index));
    }
    return Instant.ofEpochSecond(
        TemporalCodec.extractEpoch(epoch, sfScale), TemporalCodec.extractFraction(epoch, sfScale));
  }

  /**
   * @param index index of the value
   * @return offset in minutes plus 1440 for TIMESTAMP_TZ, 1440 otherwise
   */
  public int getTimeZoneIndex(int index) {
    return timeZoneIndices == null ? TemporalCodec.TZ_OFFSET_BIAS : timeZoneIndices.get(index);
  }

  @Override
  public Object toObject(int index) throws SFException {
    Instant instant = toInstant(index);
    if (instant == null) {
      return null;
    }
    switch (field.getBase()) {
      case TIMESTAMP_LTZ:
        return ZonedDateTime.ofInstant(instant, context.getSessionTimeZone().toZoneId());
      case TIMESTAMP_TZ:
        return TemporalCodec.decodeTz(
            instant.getEpochSecond(), instant.getNano(), getTimeZoneIndex(index), field.getName());
      default:
        return ZonedDateTime.ofInstant(instant, ZoneOffset.UTC);
    }
  }
}
