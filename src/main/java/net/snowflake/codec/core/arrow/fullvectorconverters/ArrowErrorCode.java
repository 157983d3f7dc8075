package net.snowflake.codec.core.arrow.fullvectorconverters;

public enum ArrowErrorCode {
  VECTOR_ALREADY_CONVERTED,
  CONVERT_FAILED
}
