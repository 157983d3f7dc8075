package net.snowflake.codec.core.arrow.fullvectorconverters;

import net.snowflake.codec.core.DataConversionContext;
import net.snowflake.codec.core.SFException;
import net.snowflake.codec.core.TemporalCodec;
import net.snowflake.codec.jdbc.ErrorCode;
import net.snowflake.codec.jdbc.FieldMetadata;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.BaseIntVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.TimeNanoVector;
import org.apache.arrow.vector.ValueVector;
import org.apache.arrow.vector.types.TimeUnit;
import org.apache.arrow.vector.types.pojo.ArrowType;

/** TIME columns of 10^-scale seconds since midnight to a nanosecond time vector */
public class TimeVectorConverter extends AbstractFullVectorConverter {
  private static final int TARGET_SCALE = 9;

  public TimeVectorConverter(
      BufferAllocator allocator,
      ValueVector vector,
      FieldMetadata field,
      DataConversionContext context) {
    super(allocator, vector, field, context);
  }

  @Override
  protected FieldVector convertVector() throws SFException {
    if (vector instanceof TimeNanoVector) {
      return (FieldVector) vector;
    }
    if (!(vector instanceof BaseIntVector)) {
      throw new SFException(
          ErrorCode.DATA_TYPE_NOT_SUPPORTED,
          "TIME stored as arrow " + vector.getField().getType() + " in column " + field.getName());
    }
    int size = vector.getValueCount();
    TimeNanoVector converted =
        (TimeNanoVector)
            targetField(new ArrowType.Time(TimeUnit.NANOSECOND, 64)).createVector(allocator);
    converted.allocateNew(size);
    BaseIntVector srcVector = (BaseIntVector) vector;
    long scalingFactor = TemporalCodec.powerOfTen(TARGET_SCALE - field.getScale());
    for (int i = 0; i < size; i++) {
      if (!vector.isNull(i)) {
        converted.set(i, srcVector.getValueAsLong(i) * scalingFactor);
      }
    }
    converted.setValueCount(size);
    vector.close();
    return converted;
  }
}
