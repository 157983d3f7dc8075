package net.snowflake.codec.core.arrow;

import net.snowflake.codec.core.DataConversionContext;
import net.snowflake.codec.jdbc.FieldMetadata;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.ValueVector;

/** Convert from arrow BitVector to BOOLEAN */
public class BooleanConverter extends AbstractArrowVectorConverter {
  private final BitVector vector;

  public BooleanConverter(ValueVector vector, FieldMetadata field, DataConversionContext context) {
    super(field, vector, context);
    this.vector = (BitVector) vector;
  }

  @Override
  public Object toObject(int index) {
    return isNull(index) ? null : vector.get(index) != 0;
  }

  @Override
  public long toLong(int index) {
    return isNull(index) ? 0 : vector.get(index);
  }
}
