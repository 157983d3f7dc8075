package net.snowflake.codec.core.arrow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.snowflake.codec.core.DataConversionContext;
import net.snowflake.codec.core.SFException;
import net.snowflake.codec.jdbc.ErrorCode;
import net.snowflake.codec.jdbc.FieldMetadata;
import net.snowflake.codec.log.SFLogger;
import net.snowflake.codec.log.SFLoggerFactory;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;

/**
 * Row at a time view of an Arrow record batch. An instance keeps one converter per column and can
 * be used to read all rows of the batch; the static methods read a single cell or row.
 *
 * <p>Instances are not thread safe when the underlying vectors are modified, reading disjoint rows
 * from several threads is fine.
 */
public class ArrowValueConverter {
  private static final SFLogger logger = SFLoggerFactory.getLogger(ArrowValueConverter.class);

  private final VectorSchemaRoot root;
  private final List<ArrowVectorConverter> converters;

  /**
   * @param root record batch
   * @param fields metadata per column, or null to read it from the arrow field metadata
   * @param context session formats and flags
   * @throws SFException if a column cannot be read with its metadata
   */
  public ArrowValueConverter(
      VectorSchemaRoot root, List<FieldMetadata> fields, DataConversionContext context)
      throws SFException {
    this.root = root;
    List<FieldVector> vectors = root.getFieldVectors();
    if (fields != null && fields.size() != vectors.size()) {
      throw new SFException(
          ErrorCode.INTERNAL_ERROR,
          "batch has " + vectors.size() + " columns but " + fields.size() + " fields");
    }
    List<ArrowVectorConverter> list = new ArrayList<>(vectors.size());
    for (int i = 0; i < vectors.size(); i++) {
      FieldVector vector = vectors.get(i);
      FieldMetadata field =
          fields == null
              ? ArrowVectorConverterUtil.toFieldMetadata(vector.getField())
              : fields.get(i);
      list.add(ArrowVectorConverterUtil.initConverter(vector, field, context));
    }
    this.converters = Collections.unmodifiableList(list);
    logger.debug(
        "Reading arrow batch with {} columns and {} rows", vectors.size(), root.getRowCount());
  }

  public int getRowCount() {
    return root.getRowCount();
  }

  public int getColumnCount() {
    return converters.size();
  }

  /**
   * @param column zero based column index
   * @param row row index
   * @return the Java value of the cell
   * @throws SFException if the value cannot be converted
   */
  public Object getValue(int column, int row) throws SFException {
    return converters.get(column).toObject(row);
  }

  /**
   * @param row row index
   * @param dest destination, one element per column
   * @throws SFException if a value cannot be converted
   */
  public void convertRow(int row, Object[] dest) throws SFException {
    if (dest.length < converters.size()) {
      throw new SFException(
          ErrorCode.INTERNAL_ERROR,
          "destination holds " + dest.length + " values for " + converters.size() + " columns");
    }
    for (int i = 0; i < converters.size(); i++) {
      dest[i] = converters.get(i).toObject(row);
    }
  }

  /**
   * Convert a single cell.
   *
   * @param vector column vector
   * @param field column metadata
   * @param row row index
   * @param context session formats and flags
   * @return the Java value, null for SQL NULL
   * @throws SFException if the value cannot be converted
   */
  public static Object cellToValue(
      FieldVector vector, FieldMetadata field, int row, DataConversionContext context)
      throws SFException {
    if (vector.isNull(row)) {
      return null;
    }
    return ArrowVectorConverterUtil.initConverter(vector, field, context).toObject(row);
  }

  /**
   * Convert one row of a batch.
   *
   * @param root record batch
   * @param fields metadata per column, or null to read it from the arrow field metadata
   * @param row row index
   * @param dest destination, one element per column
   * @param context session formats and flags
   * @throws SFException if a value cannot be converted
   */
  public static void convertRow(
      VectorSchemaRoot root,
      List<FieldMetadata> fields,
      int row,
      Object[] dest,
      DataConversionContext context)
      throws SFException {
    new ArrowValueConverter(root, fields, context).convertRow(row, dest);
  }
}
