package net.snowflake.codec.core.arrow;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import net.snowflake.codec.core.DataConversionContext;
import net.snowflake.codec.core.SFException;
import net.snowflake.codec.core.ScalarCodec;
import net.snowflake.codec.jdbc.ErrorCode;
import net.snowflake.codec.jdbc.FieldMetadata;
import net.snowflake.codec.jdbc.SnowflakeUtil;
import org.apache.arrow.vector.BaseIntVector;
import org.apache.arrow.vector.DecimalVector;
import org.apache.arrow.vector.ValueVector;

/**
 * Converter for FIXED columns. The server picks the narrowest vector that holds the unscaled values
 * of a column (TinyInt, SmallInt, Int, BigInt or Decimal); every one of them goes through {@link
 * #unscaledValue(int)} and then through the same scale logic as the JSON rows.
 */
public class FixedConverter extends AbstractArrowVectorConverter {
  private final ValueVector vector;
  private final int sfScale;
  private final boolean nested;

  /**
   * @param vector DecimalVector or an integer vector
   * @param field column or field metadata
   * @param context session formats and flags
   * @param nested whether the values are fields of a structured value
   */
  public FixedConverter(
      ValueVector vector, FieldMetadata field, DataConversionContext context, boolean nested) {
    super(field, vector, context);
    this.vector = vector;
    this.sfScale = field.getScale();
    this.nested = nested;
  }

  /**
   * @param index index of the value
   * @return unscaled integer value at the column scale, null for SQL NULL
   */
  public BigInteger unscaledValue(int index) {
    if (vector.isNull(index)) {
      return null;
    }
    if (vector instanceof DecimalVector) {
      return ((DecimalVector) vector)
          .getObject(index)
          .setScale(sfScale, RoundingMode.HALF_UP)
          .unscaledValue();
    }
    return BigInteger.valueOf(((BaseIntVector) vector).getValueAsLong(index));
  }

  @Override
  public Object toObject(int index) throws SFException {
    BigInteger unscaled = unscaledValue(index);
    if (unscaled == null) {
      return null;
    }
    if (nested) {
      return ScalarCodec.fixedToNestedValue(
          new BigDecimal(unscaled, sfScale),
          sfScale,
          context.isHigherPrecision(),
          field.getName());
    }
    return ScalarCodec.fixedToValue(unscaled, sfScale, context.isHigherPrecision());
  }

  @Override
  public long toLong(int index) throws SFException {
    BigInteger unscaled = unscaledValue(index);
    if (unscaled == null) {
      return 0;
    }
    try {
      return new BigDecimal(unscaled, sfScale).longValueExact();
    } catch (ArithmeticException ex) {
      throw new SFException(
          ex,
          ErrorCode.INVALID_VALUE_CONVERT,
          logicalTypeStr,
          SnowflakeUtil.LONG_STR,
          new BigDecimal(unscaled, sfScale).toPlainString(),
          SnowflakeUtil.describeField(field.getName()));
    }
  }

  @Override
  public double toDouble(int index) throws SFException {
    BigDecimal value = toBigDecimal(index);
    return value == null ? 0 : value.doubleValue();
  }

  @Override
  public BigDecimal toBigDecimal(int index) throws SFException {
    BigInteger unscaled = unscaledValue(index);
    return unscaled == null ? null : new BigDecimal(unscaled, sfScale);
  }
}
