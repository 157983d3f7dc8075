package net.snowflake.codec.core.arrow.fullvectorconverters;

import net.snowflake.codec.core.SFException;
import org.apache.arrow.vector.FieldVector;

/** Rewrites a whole vector into another arrow type. The source vector is consumed. */
public interface ArrowFullVectorConverter {
  /**
   * @return the rewritten vector, owned by the caller
   * @throws SFException if a value cannot be represented in the target type
   * @throws SFArrowException if the converter was already used or the vector layout is unexpected
   */
  FieldVector convert() throws SFException, SFArrowException;
}
