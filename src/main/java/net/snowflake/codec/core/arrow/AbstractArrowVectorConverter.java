package net.snowflake.codec.core.arrow;

import java.math.BigDecimal;
import net.snowflake.codec.core.DataConversionContext;
import net.snowflake.codec.core.SFException;
import net.snowflake.codec.jdbc.ErrorCode;
import net.snowflake.codec.jdbc.FieldMetadata;
import net.snowflake.codec.jdbc.SnowflakeUtil;
import org.apache.arrow.vector.ValueVector;

/**
 * Abstract class of arrow vector converter. For most types, throw invalid convert error. It depends
 * child class to override conversion logic
 */
abstract class AbstractArrowVectorConverter implements ArrowVectorConverter {
  /** Field names of the struct vectors used by timestamp */
  public static final String FIELD_NAME_EPOCH = "epoch"; // seconds since epoch

  /** Timezone index */
  public static final String FIELD_NAME_TIME_ZONE_INDEX = "timezone"; // time zone index

  /** Fraction in nanoseconds */
  public static final String FIELD_NAME_FRACTION = "fraction"; // fraction in nanoseconds

  /** snowflake logical type of the target arrow vector */
  protected final String logicalTypeStr;

  /** value vector */
  private final ValueVector valueVector;

  protected final FieldMetadata field;

  protected final DataConversionContext context;

  /**
   * @param field metadata of the column or nested field read by this converter
   * @param valueVector value vector
   * @param context session formats and flags
   */
  AbstractArrowVectorConverter(
      FieldMetadata field, ValueVector valueVector, DataConversionContext context) {
    this.logicalTypeStr = field.getBase().name();
    this.field = field;
    this.valueVector = valueVector;
    this.context = context;
  }

  @Override
  public boolean isNull(int index) {
    return valueVector.isNull(index);
  }

  @Override
  public long toLong(int index) throws SFException {
    if (isNull(index)) {
      return 0;
    }
    throw invalidConvert(SnowflakeUtil.LONG_STR, index);
  }

  @Override
  public double toDouble(int index) throws SFException {
    if (isNull(index)) {
      return 0;
    }
    throw invalidConvert(SnowflakeUtil.DOUBLE_STR, index);
  }

  @Override
  public BigDecimal toBigDecimal(int index) throws SFException {
    if (isNull(index)) {
      return null;
    }
    throw invalidConvert(SnowflakeUtil.BIG_DECIMAL_STR, index);
  }

  protected SFException invalidConvert(String target, int index) throws SFException {
    return new SFException(
        ErrorCode.INVALID_VALUE_CONVERT,
        logicalTypeStr,
        target,
        SnowflakeUtil.describeValue(toObject(index)),
        SnowflakeUtil.describeField(field.getName()));
  }

  public FieldMetadata getField() {
    return field;
  }
}
