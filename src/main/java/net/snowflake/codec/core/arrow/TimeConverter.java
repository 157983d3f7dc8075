package net.snowflake.codec.core.arrow;

import net.snowflake.codec.core.DataConversionContext;
import net.snowflake.codec.core.TemporalCodec;
import net.snowflake.codec.jdbc.FieldMetadata;
import org.apache.arrow.vector.BaseIntVector;
import org.apache.arrow.vector.ValueVector;

/** Convert from arrow BigIntVector or IntVector holding 10^-scale seconds since midnight to TIME */
public class TimeConverter extends AbstractArrowVectorConverter {
  private final BaseIntVector vector;

  public TimeConverter(ValueVector vector, FieldMetadata field, DataConversionContext context) {
    super(field, vector, context);
    this.vector = (BaseIntVector) vector;
  }

  /**
   * @param index index of the value
   * @return nanoseconds since midnight
   */
  @Override
  public long toLong(int index) {
    if (isNull(index)) {
      return 0;
    }
    return TemporalCodec.scaleTimeNanos(vector.getValueAsLong(index), field.getScale());
  }

  @Override
  public Object toObject(int index) {
    return isNull(index)
        ? null
        : TemporalCodec.decodeTime(vector.getValueAsLong(index), field.getScale());
  }
}
