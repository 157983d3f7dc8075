package net.snowflake.codec.core.arrow;

import java.math.BigDecimal;
import net.snowflake.codec.core.SFException;

/**
 * Reads the cells of one Arrow vector as Java values. A converter is built on top of the vector
 * for a given field metadata, so the same vector can be read as a top level column or as a field
 * nested in a structured value.
 */
public interface ArrowVectorConverter {
  /**
   * Determine whether source value in arrow vector is null value or not
   *
   * @param index index of value to be checked
   * @return true if null value otherwise false
   */
  boolean isNull(int index);

  /**
   * @param index index of the value
   * @return the Java value of the cell, null for SQL NULL
   * @throws SFException if the value cannot be converted
   */
  Object toObject(int index) throws SFException;

  /**
   * @param index index of the value
   * @return long value of the cell, 0 for SQL NULL
   * @throws SFException if the cell is not an integer
   */
  long toLong(int index) throws SFException;

  /**
   * @param index index of the value
   * @return double value of the cell, 0 for SQL NULL
   * @throws SFException if the cell is not a number
   */
  double toDouble(int index) throws SFException;

  /**
   * @param index index of the value
   * @return decimal value of the cell, null for SQL NULL
   * @throws SFException if the cell is not a number
   */
  BigDecimal toBigDecimal(int index) throws SFException;
}
