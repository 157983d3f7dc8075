package net.snowflake.codec.core.arrow;

import java.util.ArrayList;
import java.util.List;
import net.snowflake.codec.core.DataConversionContext;
import net.snowflake.codec.core.SFException;
import net.snowflake.codec.core.arrow.fullvectorconverters.ArrowFullVectorConverterUtil;
import net.snowflake.codec.core.arrow.fullvectorconverters.SFArrowException;
import net.snowflake.codec.jdbc.ErrorCode;
import net.snowflake.codec.jdbc.FieldMetadata;
import net.snowflake.codec.log.SFLogger;
import net.snowflake.codec.log.SFLoggerFactory;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.util.TransferPair;

/**
 * Rewrites record batches for callers that consume arrow data directly:
 *
 * <ul>
 *   <li>FIXED columns become int64 (scale 0) or float64, unless higher precision is enabled
 *   <li>TIME columns become nanosecond time vectors
 *   <li>timestamp columns become arrow timestamps of the configured {@link ArrowTimestampOption}
 *   <li>text columns are checked for invalid UTF-8 when validation is enabled
 * </ul>
 *
 * Other columns are transferred unchanged.
 */
public final class ArrowBatchConverter {
  private static final SFLogger logger = SFLoggerFactory.getLogger(ArrowBatchConverter.class);

  private ArrowBatchConverter() {}

  /**
   * @param input source batch, its buffers are moved or released, the caller still closes it
   * @param fields metadata per column, or null to read it from the arrow field metadata
   * @param allocator allocator of the rewritten batch
   * @param context session formats and flags
   * @return the rewritten batch, owned by the caller
   * @throws SFException if a value cannot be represented in its target type, for example a
   *     timestamp out of the nanosecond range
   * @throws SFArrowException if a vector cannot be rewritten
   */
  public static VectorSchemaRoot convertBatch(
      VectorSchemaRoot input,
      List<FieldMetadata> fields,
      BufferAllocator allocator,
      DataConversionContext context)
      throws SFException, SFArrowException {
    List<FieldVector> vectors = input.getFieldVectors();
    if (fields != null && fields.size() != vectors.size()) {
      throw new SFException(
          ErrorCode.INTERNAL_ERROR,
          "batch has " + vectors.size() + " columns but " + fields.size() + " fields");
    }
    int rowCount = input.getRowCount();
    logger.debug(
        "Converting arrow batch with {} columns and {} rows, timestamp option {}",
        vectors.size(),
        rowCount,
        context.getArrowTimestampOption());
    List<FieldVector> converted = new ArrayList<>(vectors.size());
    boolean success = false;
    try {
      for (int i = 0; i < vectors.size(); i++) {
        FieldVector vector = vectors.get(i);
        FieldMetadata field =
            fields == null
                ? ArrowVectorConverterUtil.toFieldMetadata(vector.getField())
                : fields.get(i);
        FieldVector result =
            ArrowFullVectorConverterUtil.convert(allocator, vector, field, context);
        if (result == vector) {
          TransferPair transferPair = vector.getTransferPair(allocator);
          transferPair.transfer();
          result = (FieldVector) transferPair.getTo();
        }
        converted.add(result);
      }
      VectorSchemaRoot output = new VectorSchemaRoot(converted);
      output.setRowCount(rowCount);
      success = true;
      return output;
    } finally {
      if (!success) {
        for (FieldVector vector : converted) {
          vector.close();
        }
      }
    }
  }
}
