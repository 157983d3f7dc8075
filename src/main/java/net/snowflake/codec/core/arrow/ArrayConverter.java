package net.snowflake.codec.core.arrow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.snowflake.codec.core.DataConversionContext;
import net.snowflake.codec.core.SFException;
import net.snowflake.codec.jdbc.FieldMetadata;
import org.apache.arrow.vector.complex.ListVector;

/** Array type converter. */
public class ArrayConverter extends AbstractArrowVectorConverter {
  private final ListVector vector;
  private final ArrowVectorConverter elementConverter;

  ArrayConverter(ListVector vector, FieldMetadata field, DataConversionContext context, int depth)
      throws SFException {
    super(field, vector, context);
    this.vector = vector;
    this.elementConverter =
        ArrowVectorConverterUtil.initConverter(
            vector.getDataVector(), field.getFields().get(0), context, true, depth + 1);
  }

  @Override
  public Object toObject(int index) throws SFException {
    if (isNull(index)) {
      return null;
    }
    int start = vector.getElementStartIndex(index);
    int end = vector.getElementEndIndex(index);
    List<Object> list = new ArrayList<>(end - start);
    for (int i = start; i < end; i++) {
      list.add(elementConverter.toObject(i));
    }
    return Collections.unmodifiableList(list);
  }
}
