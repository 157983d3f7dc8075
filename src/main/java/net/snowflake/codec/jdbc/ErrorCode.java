package net.snowflake.codec.jdbc;

import java.util.HashMap;
import java.util.Map;
import net.snowflake.common.core.SqlState;

/** Internal error codes of the value codec */
public enum ErrorCode {

  // 2NNNNN: client side codes
  INTERNAL_ERROR(200001, SqlState.INTERNAL_ERROR),
  DATA_TYPE_NOT_SUPPORTED(200018, SqlState.FEATURE_NOT_SUPPORTED),
  ARRAY_BIND_MIXED_TYPES_NOT_SUPPORTED(200023, SqlState.FEATURE_NOT_SUPPORTED),
  COLUMN_DOES_NOT_EXIST(200032, SqlState.DATA_EXCEPTION),
  INVALID_PARAMETER_VALUE(200033, SqlState.INVALID_PARAMETER_VALUE),
  INVALID_VALUE_CONVERT(200038, SqlState.DATA_EXCEPTION),
  INVALID_STRUCT_DATA(200060, SqlState.DATA_EXCEPTION),
  INVALID_TIMESTAMP_TZ(200070, SqlState.DATA_EXCEPTION),
  INVALID_BINARY_HEX_FORM(200071, SqlState.DATA_EXCEPTION),
  TOO_HIGH_TIMESTAMP_PRECISION(200072, SqlState.NUMERIC_VALUE_OUT_OF_RANGE),
  UNSUPPORTED_MAP_KEY_TYPE(200073, SqlState.FEATURE_NOT_SUPPORTED);

  public static final String errorMessageResource =
      "net.snowflake.codec.jdbc.codec_error_messages";

  private final Integer messageCode;

  private final String sqlState;

  /**
   * @param messageCode key of the message in the codec resource bundle
   * @param sqlState SQL state reported with the error
   */
  ErrorCode(Integer messageCode, String sqlState) {
    this.messageCode = messageCode;
    this.sqlState = sqlState;
  }

  public Integer getMessageCode() {
    return messageCode;
  }

  public String getSqlState() {
    return sqlState;
  }

  @Override
  public String toString() {
    return "ErrorCode{" + "messageCode=" + messageCode + ", sqlState=" + sqlState + '}';
  }

  private static final Map<Integer, ErrorCode> errorCodeMap = new HashMap<>();

  static {
    for (ErrorCode errorCode : ErrorCode.values()) {
      errorCodeMap.put(errorCode.getMessageCode(), errorCode);
    }
  }

  public static ErrorCode getByErrorCode(int errorCode) {
    return errorCodeMap.get(errorCode);
  }
}
