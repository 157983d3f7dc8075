package net.snowflake.codec.core.arrow.fullvectorconverters;

import net.snowflake.codec.core.DataConversionContext;
import net.snowflake.codec.core.SFException;
import net.snowflake.codec.core.arrow.ArrowVectorConverter;
import net.snowflake.codec.jdbc.FieldMetadata;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.ValueVector;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.pojo.ArrowType;

/** FIXED columns with a scale, and REAL columns, to float64 */
public class FloatVectorConverter extends SimpleArrowFullVectorConverter<Float8Vector> {

  public FloatVectorConverter(
      BufferAllocator allocator,
      ValueVector vector,
      FieldMetadata field,
      DataConversionContext context) {
    super(allocator, vector, field, context);
  }

  @Override
  protected boolean matchingType() {
    return (vector instanceof Float8Vector);
  }

  @Override
  protected Float8Vector initVector() {
    Float8Vector resultVector =
        (Float8Vector)
            targetField(new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE))
                .createVector(allocator);
    resultVector.allocateNew(vector.getValueCount());
    return resultVector;
  }

  @Override
  protected void convertValue(ArrowVectorConverter from, Float8Vector to, int idx)
      throws SFException {
    to.set(idx, from.toDouble(idx));
  }
}
