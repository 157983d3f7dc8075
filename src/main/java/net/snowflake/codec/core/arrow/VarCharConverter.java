package net.snowflake.codec.core.arrow;

import java.nio.charset.StandardCharsets;
import net.snowflake.codec.core.DataConversionContext;
import net.snowflake.codec.core.SFException;
import net.snowflake.codec.core.structs.StructuredTypeBuilder;
import net.snowflake.codec.jdbc.FieldMetadata;
import org.apache.arrow.vector.ValueVector;
import org.apache.arrow.vector.VarCharVector;

/**
 * Convert from arrow VarCharVector to TEXT and VARIANT. Structured columns sent as JSON text are
 * rebuilt with {@link StructuredTypeBuilder}.
 */
public class VarCharConverter extends AbstractArrowVectorConverter {
  private final VarCharVector vector;

  public VarCharConverter(ValueVector vector, FieldMetadata field, DataConversionContext context) {
    super(field, vector, context);
    this.vector = (VarCharVector) vector;
  }

  public String toText(int index) {
    return isNull(index) ? null : new String(vector.get(index), StandardCharsets.UTF_8);
  }

  @Override
  public Object toObject(int index) throws SFException {
    String text = toText(index);
    if (text != null && field.getBase().isStructured()) {
      return StructuredTypeBuilder.build(text, field, context);
    }
    return text;
  }
}
