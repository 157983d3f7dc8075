package net.snowflake.codec.core.arrow.fullvectorconverters;

import net.snowflake.codec.core.DataConversionContext;
import net.snowflake.codec.core.SFException;
import net.snowflake.codec.core.arrow.ArrowVectorConverter;
import net.snowflake.codec.core.arrow.ArrowVectorConverterUtil;
import net.snowflake.codec.jdbc.FieldMetadata;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.ValueVector;

/**
 * Rewrites a vector value by value, reading the source through its row converter.
 *
 * @param <T> target vector type
 */
public abstract class SimpleArrowFullVectorConverter<T extends FieldVector>
    extends AbstractFullVectorConverter {

  protected SimpleArrowFullVectorConverter(
      BufferAllocator allocator,
      ValueVector vector,
      FieldMetadata field,
      DataConversionContext context) {
    super(allocator, vector, field, context);
  }

  protected abstract boolean matchingType();

  protected abstract T initVector();

  protected abstract void convertValue(ArrowVectorConverter from, T to, int idx)
      throws SFException;

  @Override
  protected FieldVector convertVector() throws SFException {
    if (matchingType()) {
      return (FieldVector) vector;
    }
    int size = vector.getValueCount();
    ArrowVectorConverter converter =
        ArrowVectorConverterUtil.initConverter(vector, field, context);
    T converted = initVector();
    boolean success = false;
    try {
      for (int i = 0; i < size; i++) {
        if (!converter.isNull(i)) {
          convertValue(converter, converted, i);
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
}
