package net.snowflake.codec.core.arrow;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import net.snowflake.codec.core.DataConversionContext;
import net.snowflake.codec.core.SFException;
import net.snowflake.codec.core.structs.StructuredTypeBuilder;
import net.snowflake.codec.jdbc.ErrorCode;
import net.snowflake.codec.jdbc.FieldMetadata;
import net.snowflake.codec.jdbc.SnowflakeType;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.complex.MapVector;

/** Arrow MapVector converter. */
public class MapConverter extends AbstractArrowVectorConverter {
  private final MapVector vector;
  private final FieldMetadata keyField;
  private final ArrowVectorConverter keyConverter;
  private final ArrowVectorConverter valueConverter;

  MapConverter(MapVector vector, FieldMetadata field, DataConversionContext context, int depth)
      throws SFException {
    super(field, vector, context);
    this.vector = vector;
    this.keyField = field.getFields().get(0);
    if (keyField.getBase() != SnowflakeType.TEXT && keyField.getBase() != SnowflakeType.FIXED) {
      throw new SFException(
          ErrorCode.UNSUPPORTED_MAP_KEY_TYPE, keyField.getBase(), field.getName());
    }
    List<FieldVector> entries = vector.getDataVector().getChildrenFromFields();
    if (entries.size() != 2) {
      throw new SFException(
          ErrorCode.INVALID_STRUCT_DATA,
          field.getName(),
          "map entries with " + entries.size() + " fields");
    }
    // keys are read as top level values and normalized like JSON object keys
    this.keyConverter =
        ArrowVectorConverterUtil.initConverter(entries.get(0), keyField, context, false, depth + 1);
    this.valueConverter =
        ArrowVectorConverterUtil.initConverter(
            entries.get(1), field.getFields().get(1), context, true, depth + 1);
  }

  @Override
  public Object toObject(int index) throws SFException {
    if (isNull(index)) {
      return null;
    }
    Map<Object, Object> map = new LinkedHashMap<>();
    for (int i = vector.getElementStartIndex(index); i < vector.getElementEndIndex(index); i++) {
      Object key =
          StructuredTypeBuilder.convertMapKey(
              keyText(keyConverter.toObject(i)), keyField, field, context.isHigherPrecision());
      Object value = valueConverter.toObject(i);
      map.put(key, context.isMapValuesNullable() ? Optional.ofNullable(value) : value);
    }
    return Collections.unmodifiableMap(map);
  }

  private String keyText(Object key) throws SFException {
    if (key == null) {
      throw new SFException(ErrorCode.INVALID_STRUCT_DATA, field.getName(), "null map key");
    }
    return key instanceof BigDecimal ? ((BigDecimal) key).toPlainString() : key.toString();
  }
}
