package net.snowflake.codec.core.arrow.fullvectorconverters;

import net.snowflake.codec.core.DataConversionContext;
import net.snowflake.codec.core.SFException;
import net.snowflake.codec.jdbc.FieldMetadata;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.ValueVector;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;

public abstract class AbstractFullVectorConverter implements ArrowFullVectorConverter {
  protected final BufferAllocator allocator;
  protected final ValueVector vector;
  protected final FieldMetadata field;
  protected final DataConversionContext context;
  private boolean converted;

  protected AbstractFullVectorConverter(
      BufferAllocator allocator,
      ValueVector vector,
      FieldMetadata field,
      DataConversionContext context) {
    this.allocator = allocator;
    this.vector = vector;
    this.field = field;
    this.context = context;
  }

  protected abstract FieldVector convertVector() throws SFException, SFArrowException;

  @Override
  public FieldVector convert() throws SFException, SFArrowException {
    if (converted) {
      throw new SFArrowException(
          ArrowErrorCode.VECTOR_ALREADY_CONVERTED, "Convert has already been called");
    } else {
      converted = true;
      return convertVector();
    }
  }

  /**
   * Field of the rewritten vector. The name, nullability and custom metadata of the source field
   * are kept.
   */
  protected Field targetField(ArrowType type) {
    Field source = vector.getField();
    return new Field(
        source.getName(),
        new FieldType(source.isNullable(), type, null, source.getMetadata()),
        null);
  }
}
