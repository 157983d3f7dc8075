package net.snowflake.codec.core.arrow;

import java.math.BigDecimal;
import net.snowflake.codec.core.DataConversionContext;
import net.snowflake.codec.core.SFException;
import net.snowflake.codec.jdbc.FieldMetadata;
import net.snowflake.codec.jdbc.SnowflakeUtil;
import org.apache.arrow.vector.FloatingPointVector;
import org.apache.arrow.vector.ValueVector;

/** Convert from arrow Float8Vector or Float4Vector to REAL */
public class RealConverter extends AbstractArrowVectorConverter {
  private final FloatingPointVector vector;

  public RealConverter(ValueVector vector, FieldMetadata field, DataConversionContext context) {
    super(field, vector, context);
    this.vector = (FloatingPointVector) vector;
  }

  @Override
  public Object toObject(int index) {
    return isNull(index) ? null : vector.getValueAsDouble(index);
  }

  @Override
  public double toDouble(int index) {
    return isNull(index) ? 0 : vector.getValueAsDouble(index);
  }

  @Override
  public BigDecimal toBigDecimal(int index) throws SFException {
    if (isNull(index)) {
      return null;
    }
    double value = vector.getValueAsDouble(index);
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      throw invalidConvert(SnowflakeUtil.BIG_DECIMAL_STR, index);
    }
    return BigDecimal.valueOf(value);
  }
}
