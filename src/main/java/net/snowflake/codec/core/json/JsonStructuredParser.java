package net.snowflake.codec.core.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.snowflake.codec.core.ObjectMapperFactory;
import net.snowflake.codec.core.SFException;
import net.snowflake.codec.jdbc.ErrorCode;
import net.snowflake.codec.jdbc.SnowflakeUtil;

/** Parses the JSON text of structured values without losing numeric precision. */
public final class JsonStructuredParser {
  private static final ObjectMapper OBJECT_MAPPER = ObjectMapperFactory.getObjectMapper();

  private JsonStructuredParser() {}

  /**
   * @param json JSON text
   * @param fieldName name reported in errors
   * @return parsed tree
   * @throws SFException if the text is not valid JSON
   */
  public static JsonNode parse(String json, String fieldName) throws SFException {
    try {
      return OBJECT_MAPPER.readTree(json);
    } catch (JsonProcessingException ex) {
      throw new SFException(
          ex, ErrorCode.INVALID_STRUCT_DATA, fieldName, SnowflakeUtil.describeValue(json));
    }
  }

  /**
   * Plain Java form of a JSON scalar: String, BigDecimal, BigInteger, Boolean or null. Containers
   * become unmodifiable LinkedHashMap and List instances of the same forms.
   *
   * @param node JSON node
   * @return Java value
   */
  public static Object toRawValue(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return null;
    }
    if (node.isTextual()) {
      return node.textValue();
    }
    if (node.isBoolean()) {
      return node.booleanValue();
    }
    if (node.isIntegralNumber()) {
      return node.bigIntegerValue();
    }
    if (node.isNumber()) {
      return node.decimalValue();
    }
    if (node.isArray()) {
      List<Object> list = new ArrayList<>(node.size());
      for (JsonNode element : node) {
        list.add(toRawValue(element));
      }
      return Collections.unmodifiableList(list);
    }
    if (node.isObject()) {
      Map<String, Object> map = new LinkedHashMap<>();
      Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> entry = fields.next();
        map.put(entry.getKey(), toRawValue(entry.getValue()));
      }
      return Collections.unmodifiableMap(map);
    }
    return node.asText();
  }

  /**
   * @param node numeric or textual node
   * @return exact decimal value, or null if the node holds no number
   */
  public static BigDecimal toDecimal(JsonNode node) {
    if (node.isNumber()) {
      return node.decimalValue();
    }
    if (node.isTextual()) {
      try {
        return new BigDecimal(node.textValue().trim());
      } catch (NumberFormatException ex) {
        return null;
      }
    }
    return null;
  }
}
