package net.snowflake.codec.core;

import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import net.snowflake.codec.jdbc.SnowflakeUtil;
import net.snowflake.codec.log.SFLogger;
import net.snowflake.codec.log.SFLoggerFactory;

/**
 * Factory method used to create ObjectMapper instances. Numbers are always read as BigDecimal or
 * BigInteger so nested fixed point values keep their full precision.
 */
public class ObjectMapperFactory {
  private static final SFLogger logger = SFLoggerFactory.getLogger(ObjectMapperFactory.class);

  // Snowflake allows up to 128M string size and returns base64 encoded value that makes it up to
  // 180M
  public static final int DEFAULT_MAX_JSON_STRING_LEN = 180_000_000;

  public static final String MAX_JSON_STRING_LENGTH_JVM =
      "net.snowflake.codec.objectMapper.maxJsonStringLength";

  private ObjectMapperFactory() {}

  public static ObjectMapper getObjectMapper() {
    ObjectMapper mapper = new ObjectMapper();
    mapper.configure(MapperFeature.OVERRIDE_PUBLIC_ACCESS_MODIFIERS, false);
    mapper.configure(MapperFeature.CAN_OVERRIDE_ACCESS_MODIFIERS, false);
    mapper.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    mapper.enable(DeserializationFeature.USE_BIG_INTEGER_FOR_INTS);
    // keep the scale of decimals, 1.10 stays 1.10
    mapper.configure(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES, false);

    mapper
        .getFactory()
        .setStreamReadConstraints(
            StreamReadConstraints.builder().maxStringLength(maxJsonStringLength()).build());
    return mapper;
  }

  static int maxJsonStringLength() {
    String value = SnowflakeUtil.systemGetProperty(MAX_JSON_STRING_LENGTH_JVM);
    if (value == null) {
      return DEFAULT_MAX_JSON_STRING_LEN;
    }
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException ex) {
      logger.warn(
          "Invalid value {} for {}, using default {}",
          value,
          MAX_JSON_STRING_LENGTH_JVM,
          DEFAULT_MAX_JSON_STRING_LEN);
      return DEFAULT_MAX_JSON_STRING_LEN;
    }
  }
}
