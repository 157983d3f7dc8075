package net.snowflake.codec.core.arrow;

import net.snowflake.codec.core.DataConversionContext;
import net.snowflake.codec.core.TemporalCodec;
import net.snowflake.codec.jdbc.FieldMetadata;
import org.apache.arrow.vector.BaseIntVector;
import org.apache.arrow.vector.DateDayVector;
import org.apache.arrow.vector.ValueVector;

/** Convert from arrow DateDayVector, or an IntVector of days, to DATE */
public class DateConverter extends AbstractArrowVectorConverter {
  private final ValueVector vector;

  public DateConverter(ValueVector vector, FieldMetadata field, DataConversionContext context) {
    super(field, vector, context);
    this.vector = vector;
  }

  /**
   * @param index index of the value
   * @return days since epoch
   */
  @Override
  public long toLong(int index) {
    if (isNull(index)) {
      return 0;
    }
    if (vector instanceof DateDayVector) {
      return ((DateDayVector) vector).get(index);
    }
    return ((BaseIntVector) vector).getValueAsLong(index);
  }

  @Override
  public Object toObject(int index) {
    return isNull(index) ? null : TemporalCodec.decodeDate(toLong(index));
  }
}
