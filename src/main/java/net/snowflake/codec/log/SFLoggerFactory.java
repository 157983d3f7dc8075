package net.snowflake.codec.log;

import static net.snowflake.codec.jdbc.SnowflakeUtil.systemGetProperty;

/** Used to create SFLogger instance */
public class SFLoggerFactory {
  static final String LOGGER_IMPL_PROPERTY = "net.snowflake.codec.loggerImpl";

  private static volatile LoggerImpl loggerImplementation;

  enum LoggerImpl {
    SLF4JLOGGER("net.snowflake.codec.log.SLF4JLogger"),
    JDK14LOGGER("net.snowflake.codec.log.JDK14Logger");

    private final String loggerImplClassName;

    LoggerImpl(String loggerClass) {
      this.loggerImplClassName = loggerClass;
    }

    public String getLoggerImplClassName() {
      return this.loggerImplClassName;
    }

    public static LoggerImpl fromString(String loggerImplClassName) {
      if (loggerImplClassName != null) {
        for (LoggerImpl imp : LoggerImpl.values()) {
          if (loggerImplClassName.equalsIgnoreCase(imp.getLoggerImplClassName())) {
            return imp;
          }
        }
      }
      return null;
    }
  }

  private SFLoggerFactory() {}

  /**
   * @param clazz Class type that the logger is instantiated
   * @return An SFLogger instance given the name of the class
   */
  public static SFLogger getLogger(Class<?> clazz) {
    return getLogger(clazz.getName());
  }

  /**
   * @param name name to indicate the class that the logger is instantiated
   * @return An SFLogger instance given the name
   */
  public static SFLogger getLogger(String name) {
    if (loggerImplementation == null) {
      LoggerImpl impl = LoggerImpl.fromString(systemGetProperty(LOGGER_IMPL_PROPERTY));
      // default to use java util logging
      loggerImplementation = impl == null ? LoggerImpl.JDK14LOGGER : impl;
    }

    switch (loggerImplementation) {
      case SLF4JLOGGER:
        return new SLF4JLogger(name);
      case JDK14LOGGER:
      default:
        return new JDK14Logger(name);
    }
  }

  static LoggerImpl getLoggerImplementation() {
    return loggerImplementation;
  }
}
