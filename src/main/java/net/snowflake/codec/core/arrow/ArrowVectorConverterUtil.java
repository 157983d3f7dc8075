package net.snowflake.codec.core.arrow;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.snowflake.codec.core.DataConversionContext;
import net.snowflake.codec.core.SFException;
import net.snowflake.codec.core.structs.StructuredTypeBuilder;
import net.snowflake.codec.jdbc.ErrorCode;
import net.snowflake.codec.jdbc.FieldMetadata;
import net.snowflake.codec.jdbc.SnowflakeType;
import org.apache.arrow.vector.BaseIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.DateDayVector;
import org.apache.arrow.vector.DecimalVector;
import org.apache.arrow.vector.FloatingPointVector;
import org.apache.arrow.vector.ValueVector;
import org.apache.arrow.vector.VarBinaryVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.complex.ListVector;
import org.apache.arrow.vector.complex.MapVector;
import org.apache.arrow.vector.complex.StructVector;
import org.apache.arrow.vector.types.Types;
import org.apache.arrow.vector.types.pojo.Field;

public final class ArrowVectorConverterUtil {
  /** Arrow field metadata key holding the Snowflake type */
  public static final String LOGICAL_TYPE = "logicalType";

  public static final String SCALE = "scale";

  public static final String PRECISION = "precision";

  private ArrowVectorConverterUtil() {}

  /**
   * @param field arrow field
   * @return Snowflake type from the field metadata, null if there is none
   * @throws SFException if the type is not known
   */
  public static SnowflakeType getSnowflakeTypeFromFieldMetadata(Field field) throws SFException {
    Map<String, String> customMeta = field.getMetadata();
    if (customMeta != null && customMeta.containsKey(LOGICAL_TYPE)) {
      return SnowflakeType.fromString(customMeta.get(LOGICAL_TYPE));
    }
    return null;
  }

  /**
   * Build field metadata from the custom metadata the server attaches to arrow fields. Children of
   * struct fields become object attributes, the child of a list the array element and the key and
   * value of a map entry the map key and value.
   *
   * @param field arrow field
   * @return metadata tree
   * @throws SFException if a field has no Snowflake type
   */
  public static FieldMetadata toFieldMetadata(Field field) throws SFException {
    SnowflakeType type = getSnowflakeTypeFromFieldMetadata(field);
    if (type == null) {
      throw new SFException(
          ErrorCode.DATA_TYPE_NOT_SUPPORTED,
          field.getType() + " without " + LOGICAL_TYPE + " in column " + field.getName());
    }
    List<FieldMetadata> children = new ArrayList<>();
    if (type.isStructured()) {
      List<Field> arrowChildren = field.getChildren();
      if (type == SnowflakeType.MAP && arrowChildren.size() == 1) {
        // the entries struct
        arrowChildren = arrowChildren.get(0).getChildren();
      }
      for (Field child : arrowChildren) {
        children.add(toFieldMetadata(child));
      }
    }
    return new FieldMetadata(
        field.getName(),
        type.name(),
        field.isNullable(),
        intMetadata(field, PRECISION),
        intMetadata(field, SCALE),
        type,
        children);
  }

  private static int intMetadata(Field field, String key) {
    String value = field.getMetadata() == null ? null : field.getMetadata().get(key);
    return value == null ? 0 : Integer.parseInt(value);
  }

  public static ArrowVectorConverter initConverter(
      ValueVector vector, FieldMetadata field, DataConversionContext context) throws SFException {
    return initConverter(vector, field, context, false, 0);
  }

  /**
   * Given an arrow vector (a single column in a single record batch), return an arrow vector
   * converter. Note, converter is built on top of arrow vector, so that arrow data can be converted
   * back to java data
   *
   * @param vector an arrow vector
   * @param field metadata of the column or nested field
   * @param context session formats and flags
   * @param nested whether the vector holds fields of a structured value
   * @param depth nesting level of the field
   * @return A converter on top of the vector
   * @throws SFException if the vector cannot hold values of the field type
   */
  static ArrowVectorConverter initConverter(
      ValueVector vector,
      FieldMetadata field,
      DataConversionContext context,
      boolean nested,
      int depth)
      throws SFException {
    Types.MinorType type = Types.getMinorTypeForArrowType(vector.getField().getType());
    SnowflakeType st = field.getBase();
    if (st.isStructured()) {
      StructuredTypeBuilder.checkDepth(field, depth);
    }
    switch (st) {
      case FIXED:
        if (vector instanceof DecimalVector || vector instanceof BaseIntVector) {
          return new FixedConverter(vector, field, context, nested);
        }
        break;
      case REAL:
        if (vector instanceof FloatingPointVector) {
          return new RealConverter(vector, field, context);
        }
        break;
      case TEXT:
      case VARIANT:
        if (vector instanceof VarCharVector) {
          return new VarCharConverter(vector, field, context);
        }
        break;
      case BOOLEAN:
        if (vector instanceof BitVector) {
          return new BooleanConverter(vector, field, context);
        }
        break;
      case BINARY:
        if (vector instanceof VarBinaryVector) {
          return new BinaryConverter(vector, field, context);
        }
        break;
      case DATE:
        if (vector instanceof DateDayVector || vector instanceof BaseIntVector) {
          return new DateConverter(vector, field, context);
        }
        break;
      case TIME:
        if (vector instanceof BaseIntVector) {
          return new TimeConverter(vector, field, context);
        }
        break;
      case TIMESTAMP_NTZ:
      case TIMESTAMP_LTZ:
      case TIMESTAMP_TZ:
        return new TimestampConverter(vector, field, context);
      case OBJECT:
        if (vector instanceof StructVector && !field.getFields().isEmpty()) {
          return new StructConverter((StructVector) vector, field, context, depth);
        }
        if (vector instanceof VarCharVector) {
          return new VarCharConverter(vector, field, context);
        }
        break;
      case MAP:
        // MapVector extends ListVector, check it first
        if (vector instanceof MapVector) {
          StructuredTypeBuilder.checkArity(field);
          return new MapConverter((MapVector) vector, field, context, depth);
        }
        if (vector instanceof VarCharVector) {
          return new VarCharConverter(vector, field, context);
        }
        break;
      case ARRAY:
        if (vector instanceof ListVector && !(vector instanceof MapVector)) {
          StructuredTypeBuilder.checkArity(field);
          return new ArrayConverter((ListVector) vector, field, context, depth);
        }
        if (vector instanceof VarCharVector) {
          return new VarCharConverter(vector, field, context);
        }
        break;
      default:
        break;
    }
    throw new SFException(
        ErrorCode.DATA_TYPE_NOT_SUPPORTED,
        st + " stored as arrow " + type + " in column " + field.getName());
  }
}
