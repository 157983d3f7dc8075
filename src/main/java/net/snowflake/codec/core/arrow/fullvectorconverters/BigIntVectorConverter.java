package net.snowflake.codec.core.arrow.fullvectorconverters;

import net.snowflake.codec.core.DataConversionContext;
import net.snowflake.codec.core.SFException;
import net.snowflake.codec.core.arrow.ArrowVectorConverter;
import net.snowflake.codec.jdbc.FieldMetadata;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.ValueVector;
import org.apache.arrow.vector.types.pojo.ArrowType;

/** FIXED columns of scale 0 to int64 */
public class BigIntVectorConverter extends SimpleArrowFullVectorConverter<BigIntVector> {

  public BigIntVectorConverter(
      BufferAllocator allocator,
      ValueVector vector,
      FieldMetadata field,
      DataConversionContext context) {
    super(allocator, vector, field, context);
  }

  @Override
  protected boolean matchingType() {
    return (vector instanceof BigIntVector);
  }

  @Override
  protected BigIntVector initVector() {
    BigIntVector resultVector =
        (BigIntVector) targetField(new ArrowType.Int(64, true)).createVector(allocator);
    resultVector.allocateNew(vector.getValueCount());
    return resultVector;
  }

  @Override
  protected void convertValue(ArrowVectorConverter from, BigIntVector to, int idx)
      throws SFException {
    to.set(idx, from.toLong(idx));
  }
}
