package net.snowflake.codec.core.arrow;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.snowflake.codec.core.DataConversionContext;
import net.snowflake.codec.core.SFException;
import net.snowflake.codec.core.structs.SnowflakeObject;
import net.snowflake.codec.jdbc.ErrorCode;
import net.snowflake.codec.jdbc.FieldMetadata;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.complex.StructVector;

/** Convert from arrow StructVector to a structured OBJECT */
public class StructConverter extends AbstractArrowVectorConverter {
  private final StructVector vector;
  private final Map<String, ArrowVectorConverter> converters = new LinkedHashMap<>();

  StructConverter(
      StructVector vector, FieldMetadata field, DataConversionContext context, int depth)
      throws SFException {
    super(field, vector, context);
    this.vector = vector;
    List<FieldVector> children = vector.getChildrenFromFields();
    for (int i = 0; i < field.getFields().size(); i++) {
      FieldMetadata child = field.getFields().get(i);
      FieldVector childVector = vector.getChild(child.getName());
      if (childVector == null && i < children.size()) {
        childVector = children.get(i);
      }
      if (childVector == null) {
        throw new SFException(
            ErrorCode.INVALID_STRUCT_DATA,
            field.getName(),
            "no vector for field " + child.getName());
      }
      converters.put(
          child.getName(),
          ArrowVectorConverterUtil.initConverter(childVector, child, context, true, depth + 1));
    }
  }

  @Override
  public Object toObject(int index) throws SFException {
    if (isNull(index)) {
      return null;
    }
    Map<String, Object> values = new LinkedHashMap<>();
    for (Map.Entry<String, ArrowVectorConverter> entry : converters.entrySet()) {
      values.put(entry.getKey(), entry.getValue().toObject(index));
    }
    return new SnowflakeObject(values, field, context);
  }
}
