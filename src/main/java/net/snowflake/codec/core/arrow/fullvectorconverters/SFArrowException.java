package net.snowflake.codec.core.arrow.fullvectorconverters;

/**
 * Failure to rewrite a vector that is not caused by one of its values. Value errors are reported
 * as {@link net.snowflake.codec.core.SFException}.
 */
public final class SFArrowException extends Exception {
  private static final long serialVersionUID = 1L;

  private final ArrowErrorCode errorCode;

  public SFArrowException(ArrowErrorCode errorCode, String message) {
    super(message);
    this.errorCode = errorCode;
  }

  public ArrowErrorCode getErrorCode() {
    return errorCode;
  }

  @Override
  public String toString() {
    return super.toString() + ", errorCode = " + errorCode;
  }
}
