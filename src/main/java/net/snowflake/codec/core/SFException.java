package net.snowflake.codec.core;

import net.snowflake.codec.jdbc.ErrorCode;
import net.snowflake.common.core.ResourceBundleManager;

/**
 * Failure of a single conversion. The message is resolved from the error message bundle using the
 * vendor code of the {@link ErrorCode}.
 */
public class SFException extends Throwable {
  private static final long serialVersionUID = 1L;

  static final ResourceBundleManager errorResourceBundleManager =
      ResourceBundleManager.getSingleton(ErrorCode.errorMessageResource);

  private final transient ErrorCode errorCode;
  private final String sqlState;
  private final int vendorCode;
  private final transient Object[] params;

  /**
   * @param errorCode the error code
   * @param params additional params
   */
  public SFException(ErrorCode errorCode, Object... params) {
    this((Throwable) null, errorCode, params);
  }

  /**
   * @param cause throwable
   * @param errorCode error code
   * @param params additional params
   */
  public SFException(Throwable cause, ErrorCode errorCode, Object... params) {
    super(
        errorResourceBundleManager.getLocalizedMessage(
            String.valueOf(errorCode.getMessageCode()), params),
        cause);

    this.errorCode = errorCode;
    this.sqlState = errorCode.getSqlState();
    this.vendorCode = errorCode.getMessageCode();
    this.params = params;
  }

  public ErrorCode getErrorCode() {
    return errorCode;
  }

  /**
   * Get the SQL state
   *
   * @return SQL state string
   */
  public String getSqlState() {
    return sqlState;
  }

  /**
   * Get the vendor code
   *
   * @return vendor code
   */
  public int getVendorCode() {
    return vendorCode;
  }

  /**
   * Get additional parameters
   *
   * @return parameter array
   */
  public Object[] getParams() {
    return params;
  }

  @Override
  public String toString() {
    return super.toString() + (getSqlState() != null ? ", sql state = " + getSqlState() : "");
  }
}
