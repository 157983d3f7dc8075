package net.snowflake.codec.core.arrow.fullvectorconverters;

import net.snowflake.codec.core.DataConversionContext;
import net.snowflake.codec.core.SFException;
import net.snowflake.codec.jdbc.FieldMetadata;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.ValueVector;

public final class ArrowFullVectorConverterUtil {
  private ArrowFullVectorConverterUtil() {}

  /**
   * Pick the converter rewriting a column of a batch.
   *
   * @param allocator allocator of the rewritten vectors
   * @param vector source vector
   * @param field column metadata
   * @param context session formats and flags
   * @return the converter, or null if the column keeps its arrow type
   */
  static ArrowFullVectorConverter converterFor(
      BufferAllocator allocator,
      ValueVector vector,
      FieldMetadata field,
      DataConversionContext context) {
    switch (field.getBase()) {
      case FIXED:
        if (context.isHigherPrecision()) {
          return null;
        }
        if (field.getScale() == 0) {
          return new BigIntVectorConverter(allocator, vector, field, context);
        }
        return new FloatVectorConverter(allocator, vector, field, context);
      case TIME:
        return new TimeVectorConverter(allocator, vector, field, context);
      case TIMESTAMP_NTZ:
      case TIMESTAMP_LTZ:
      case TIMESTAMP_TZ:
        return new TimestampVectorConverter(
            allocator, vector, field, context, context.getArrowTimestampOption());
      case TEXT:
        return new VarCharVectorConverter(allocator, vector, field, context);
      default:
        return null;
    }
  }

  /**
   * Rewrite one column. Columns that keep their arrow type are returned unchanged.
   *
   * @param allocator allocator of the rewritten vectors
   * @param vector source vector, closed when it is rewritten
   * @param field column metadata
   * @param context session formats and flags
   * @return the rewritten vector or the source vector
   * @throws SFException if a value cannot be represented in the target type
   * @throws SFArrowException if the vector cannot be rewritten
   */
  public static FieldVector convert(
      BufferAllocator allocator,
      ValueVector vector,
      FieldMetadata field,
      DataConversionContext context)
      throws SFException, SFArrowException {
    ArrowFullVectorConverter converter = converterFor(allocator, vector, field, context);
    if (converter == null) {
      return (FieldVector) vector;
    }
    return converter.convert();
  }
}
