package net.snowflake.codec.core.arrow;

import net.snowflake.codec.core.DataConversionContext;
import net.snowflake.codec.jdbc.FieldMetadata;
import org.apache.arrow.vector.ValueVector;
import org.apache.arrow.vector.VarBinaryVector;

/** Convert from arrow VarBinaryVector to BINARY */
public class BinaryConverter extends AbstractArrowVectorConverter {
  private final VarBinaryVector vector;

  public BinaryConverter(ValueVector vector, FieldMetadata field, DataConversionContext context) {
    super(field, vector, context);
    this.vector = (VarBinaryVector) vector;
  }

  @Override
  public Object toObject(int index) {
    return isNull(index) ? null : vector.get(index);
  }
}
