package net.snowflake.codec.core.structs;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import net.snowflake.codec.core.DataConversionContext;
import net.snowflake.codec.core.SFException;
import net.snowflake.codec.core.ScalarCodec;
import net.snowflake.codec.core.TemporalCodec;
import net.snowflake.codec.core.json.JsonStructuredParser;
import net.snowflake.codec.jdbc.ErrorCode;
import net.snowflake.codec.jdbc.FieldMetadata;
import net.snowflake.codec.jdbc.SnowflakeType;
import net.snowflake.codec.jdbc.SnowflakeUtil;
import net.snowflake.codec.log.SFLogger;
import net.snowflake.codec.log.SFLoggerFactory;

/**
 * Rebuilds OBJECT, ARRAY and MAP values from their JSON text following the field metadata tree.
 *
 * <p>Objects become {@link SnowflakeObject}: attributes holding arrays, maps or objects are rebuilt
 * right away, scalar attributes keep their raw JSON form and are converted by the typed getters.
 * Array elements and map values are converted to their Java types during the build.
 */
public final class StructuredTypeBuilder {
  private static final SFLogger logger = SFLoggerFactory.getLogger(StructuredTypeBuilder.class);

  private StructuredTypeBuilder() {}

  /**
   * @param raw JSON text, null for SQL NULL
   * @param field metadata of the column
   * @param context session formats and flags
   * @return null, the raw text when the metadata has no fields, or a SnowflakeObject, List or Map
   * @throws SFException if the text does not match the metadata
   */
  public static Object build(String raw, FieldMetadata field, DataConversionContext context)
      throws SFException {
    if (raw == null) {
      return null;
    }
    if (field.getFields().isEmpty()) {
      return raw;
    }
    checkArity(field);
    logger.trace("Building {} value of field {}", field.getBase(), field.getName());
    JsonNode node = JsonStructuredParser.parse(raw, field.getName());
    return buildNested(node, field, context, 0);
  }

  /**
   * Builds the value of a nested node. Scalars use the nested type mapping: FIXED becomes Long or
   * Double, BigInteger or BigDecimal in higher precision mode.
   */
  static Object buildNested(
      JsonNode node, FieldMetadata field, DataConversionContext context, int depth)
      throws SFException {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return null;
    }
    switch (field.getBase()) {
      case OBJECT:
        if (field.getFields().isEmpty()) {
          return rawText(node);
        }
        return buildObject(requireObject(node, field), field, context, depth);
      case ARRAY:
        if (field.getFields().isEmpty()) {
          return rawText(node);
        }
        return buildArray(node, field, context, depth);
      case MAP:
        if (field.getFields().isEmpty()) {
          return rawText(node);
        }
        return buildMap(requireObject(node, field), field, context, depth);
      default:
        return convertScalar(node, field, context);
    }
  }

  static SnowflakeObject buildObject(
      JsonNode node, FieldMetadata field, DataConversionContext context, int depth)
      throws SFException {
    checkDepth(field, depth);
    Map<String, Object> values = new LinkedHashMap<>();
    for (FieldMetadata child : field.getFields()) {
      JsonNode childNode = node.get(child.getName());
      if (childNode == null || childNode.isNull()) {
        values.put(child.getName(), null);
      } else if (child.getBase().isStructured()) {
        checkArity(child);
        values.put(child.getName(), buildNested(childNode, child, context, depth + 1));
      } else {
        values.put(child.getName(), JsonStructuredParser.toRawValue(childNode));
      }
    }
    // attributes the metadata does not describe are kept as plain JSON values
    Iterator<Map.Entry<String, JsonNode>> it = node.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> entry = it.next();
      if (!values.containsKey(entry.getKey())) {
        values.put(entry.getKey(), JsonStructuredParser.toRawValue(entry.getValue()));
      }
    }
    return new SnowflakeObject(values, field, context);
  }

  static List<Object> buildArray(
      JsonNode node, FieldMetadata field, DataConversionContext context, int depth)
      throws SFException {
    checkDepth(field, depth);
    checkArity(field);
    if (!node.isArray()) {
      throw new SFException(
          ErrorCode.INVALID_STRUCT_DATA,
          field.getName(),
          "expected a JSON array: " + SnowflakeUtil.describeValue(node));
    }
    FieldMetadata elementField = field.getFields().get(0);
    List<Object> list = new ArrayList<>(node.size());
    for (JsonNode element : node) {
      list.add(buildNested(element, elementField, context, depth + 1));
    }
    return Collections.unmodifiableList(list);
  }

  static Map<Object, Object> buildMap(
      JsonNode node, FieldMetadata field, DataConversionContext context, int depth)
      throws SFException {
    checkDepth(field, depth);
    checkArity(field);
    FieldMetadata keyField = field.getFields().get(0);
    FieldMetadata valueField = field.getFields().get(1);
    Map<Object, Object> map = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> it = node.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> entry = it.next();
      Object key = convertMapKey(entry.getKey(), keyField, field, context.isHigherPrecision());
      Object value = buildNested(entry.getValue(), valueField, context, depth + 1);
      map.put(key, context.isMapValuesNullable() ? Optional.ofNullable(value) : value);
    }
    return Collections.unmodifiableMap(map);
  }

  /**
   * @param key map key as text
   * @param keyField key metadata, TEXT or FIXED
   * @param mapField metadata of the map, used in errors
   * @param higherPrecision whether FIXED keys are BigInteger instead of Long
   * @return String, Long or BigInteger key
   * @throws SFException if the key type is not supported or the key is not an integer
   */
  public static Object convertMapKey(
      String key, FieldMetadata keyField, FieldMetadata mapField, boolean higherPrecision)
      throws SFException {
    switch (keyField.getBase()) {
      case TEXT:
        return key;
      case FIXED:
        try {
          BigInteger integer = new BigDecimal(key.trim()).toBigIntegerExact();
          return higherPrecision ? integer : integer.longValueExact();
        } catch (NumberFormatException | ArithmeticException ex) {
          throw new SFException(
              ex,
              ErrorCode.INVALID_VALUE_CONVERT,
              SnowflakeType.FIXED,
              SnowflakeUtil.LONG_STR,
              key,
              SnowflakeUtil.describeField(mapField.getName()));
        }
      default:
        throw new SFException(
            ErrorCode.UNSUPPORTED_MAP_KEY_TYPE, keyField.getBase(), mapField.getName());
    }
  }

  /**
   * Converts a scalar JSON node to the Java type of a nested field.
   *
   * @param node non null scalar node
   * @param field field metadata
   * @param context session formats and flags
   * @return Java value
   * @throws SFException if the node cannot be converted
   */
  public static Object convertScalar(
      JsonNode node, FieldMetadata field, DataConversionContext context) throws SFException {
    switch (field.getBase()) {
      case FIXED:
        {
          BigDecimal decimal = JsonStructuredParser.toDecimal(node);
          if (decimal == null) {
            throw invalid(node, field, SnowflakeUtil.BIG_DECIMAL_STR);
          }
          return ScalarCodec.fixedToNestedValue(
              decimal, field.getScale(), context.isHigherPrecision(), field.getName());
        }
      case REAL:
        if (node.isNumber()) {
          return node.doubleValue();
        }
        return ScalarCodec.decodeScalar(
            SnowflakeType.REAL, 0, node.asText(), field.getName(), null, false);
      case BOOLEAN:
        if (node.isBoolean()) {
          return node.booleanValue();
        }
        return ScalarCodec.decodeScalar(
            SnowflakeType.BOOLEAN, 0, node.asText(), field.getName(), null, false);
      case TEXT:
      case VARIANT:
        return rawText(node);
      case BINARY:
        return ScalarCodec.decodeBinary(node.asText(), field.getName());
      case DATE:
        return TemporalCodec.parseDate(node.asText(), context, field.getName());
      case TIME:
        return TemporalCodec.parseTime(node.asText(), context, field.getName());
      case TIMESTAMP_NTZ:
      case TIMESTAMP_LTZ:
      case TIMESTAMP_TZ:
        return TemporalCodec.parseTimestamp(
            field.getBase(), node.asText(), context, field.getName());
      default:
        throw new SFException(
            ErrorCode.DATA_TYPE_NOT_SUPPORTED, field.getBase() + " in field " + field.getName());
    }
  }

  /** JSON text of a node; strings unquoted, numbers in plain notation with their scale. */
  private static String rawText(JsonNode node) {
    if (node.isTextual()) {
      return node.textValue();
    }
    return node.isNumber() ? node.decimalValue().toPlainString() : node.toString();
  }

  /**
   * @throws SFException if an ARRAY does not have exactly one field or a MAP exactly two
   */
  public static void checkArity(FieldMetadata field) throws SFException {
    int count = field.getFields().size();
    if (field.getBase() == SnowflakeType.ARRAY && count != 1) {
      throw new SFException(
          ErrorCode.INVALID_STRUCT_DATA,
          field.getName(),
          "array with " + count + " element fields");
    }
    if (field.getBase() == SnowflakeType.MAP && count != 2) {
      throw new SFException(
          ErrorCode.INVALID_STRUCT_DATA, field.getName(), "map with " + count + " fields");
    }
  }

  /**
   * @throws SFException if the nesting level exceeds {@link FieldMetadata#MAX_STRUCTURED_DEPTH}
   */
  public static void checkDepth(FieldMetadata field, int depth) throws SFException {
    if (depth > FieldMetadata.MAX_STRUCTURED_DEPTH) {
      throw new SFException(
          ErrorCode.INVALID_STRUCT_DATA,
          field.getName(),
          "nesting deeper than " + FieldMetadata.MAX_STRUCTURED_DEPTH);
    }
  }

  private static JsonNode requireObject(JsonNode node, FieldMetadata field) throws SFException {
    if (!node.isObject()) {
      throw new SFException(
          ErrorCode.INVALID_STRUCT_DATA,
          field.getName(),
          "expected a JSON object: " + SnowflakeUtil.describeValue(node));
    }
    return node;
  }

  private static SFException invalid(JsonNode node, FieldMetadata field, String target) {
    return new SFException(
        ErrorCode.INVALID_VALUE_CONVERT,
        field.getBase(),
        target,
        SnowflakeUtil.describeValue(node),
        SnowflakeUtil.describeField(field.getName()));
  }
}
