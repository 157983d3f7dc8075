package net.snowflake.codec.log;

import java.text.MessageFormat;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link SFLogger} backed by java.util.logging.
 *
 * <table>
 *   <caption>Level mapping</caption>
 *   <tr><th>SFLogger</th><th>java.util.logging</th></tr>
 *   <tr><td>ERROR</td><td>SEVERE</td></tr>
 *   <tr><td>WARN</td><td>WARNING</td></tr>
 *   <tr><td>INFO</td><td>INFO</td></tr>
 *   <tr><td>DEBUG</td><td>FINE</td></tr>
 *   <tr><td>TRACE</td><td>FINEST</td></tr>
 * </table>
 */
public class JDK14Logger implements SFLogger {
  /** Parent of every codec logger. Handlers and levels set through this class apply to it. */
  public static final String CLASS_NAME_PREFIX = "net.snowflake.codec";

  private static final String SELF = JDK14Logger.class.getName();

  private final Logger delegate;

  public JDK14Logger(String name) {
    this.delegate = Logger.getLogger(name);
  }

  public boolean isErrorEnabled() {
    return delegate.isLoggable(Level.SEVERE);
  }

  public boolean isWarnEnabled() {
    return delegate.isLoggable(Level.WARNING);
  }

  public boolean isInfoEnabled() {
    return delegate.isLoggable(Level.INFO);
  }

  public boolean isDebugEnabled() {
    return delegate.isLoggable(Level.FINE);
  }

  public boolean isTraceEnabled() {
    return delegate.isLoggable(Level.FINEST);
  }

  public void error(String msg, Object... arguments) {
    format(Level.SEVERE, msg, arguments);
  }

  public void error(String msg, Throwable t) {
    publish(Level.SEVERE, msg, t);
  }

  public void warn(String msg, Object... arguments) {
    format(Level.WARNING, msg, arguments);
  }

  public void warn(String msg, Throwable t) {
    publish(Level.WARNING, msg, t);
  }

  public void info(String msg, Object... arguments) {
    format(Level.INFO, msg, arguments);
  }

  public void info(String msg, Throwable t) {
    publish(Level.INFO, msg, t);
  }

  public void debug(String msg, Object... arguments) {
    format(Level.FINE, msg, arguments);
  }

  public void debug(String msg, Throwable t) {
    publish(Level.FINE, msg, t);
  }

  public void trace(String msg, Object... arguments) {
    format(Level.FINEST, msg, arguments);
  }

  public void trace(String msg, Throwable t) {
    publish(Level.FINEST, msg, t);
  }

  private void format(Level level, String msg, Object[] arguments) {
    if (!delegate.isLoggable(level)) {
      return;
    }
    String text;
    try {
      text = MessageFormat.format(refactorString(msg), evaluateLambdaArgs(arguments));
    } catch (IllegalArgumentException e) {
      text = "Unable to format msg: " + msg;
    }
    publish(level, text, null);
  }

  private void publish(Level level, String text, Throwable t) {
    if (!delegate.isLoggable(level)) {
      return;
    }
    StackTraceElement caller = callerFrame();
    String sourceClass = caller == null ? null : caller.getClassName();
    String sourceMethod = caller == null ? null : caller.getMethodName();
    if (t == null) {
      delegate.logp(level, sourceClass, sourceMethod, text);
    } else {
      delegate.logp(level, sourceClass, sourceMethod, text, t);
    }
  }

  /** First stack frame below the frames of this class, or null when there is none. */
  private static StackTraceElement callerFrame() {
    boolean inLogger = false;
    for (StackTraceElement frame : Thread.currentThread().getStackTrace()) {
      boolean self = SELF.equals(frame.getClassName());
      if (self) {
        inLogger = true;
      } else if (inLogger) {
        return frame;
      }
    }
    return null;
  }

  public static void addHandler(Handler handler) {
    Logger.getLogger(CLASS_NAME_PREFIX).addHandler(handler);
  }

  public static void removeHandler(Handler handler) {
    Logger.getLogger(CLASS_NAME_PREFIX).removeHandler(handler);
  }

  public static void setLevel(Level level) {
    Logger.getLogger(CLASS_NAME_PREFIX).setLevel(level);
  }

  public static Level getLevel() {
    return Logger.getLogger(CLASS_NAME_PREFIX).getLevel();
  }

  /**
   * Rewrites "{}" placeholders as indexed MessageFormat ones, so "Error in {} on {}" becomes "Error
   * in {0} on {1}". Single quotes are doubled so MessageFormat prints them.
   */
  static String refactorString(String original) {
    StringBuilder out = new StringBuilder(original.length() + 8);
    int index = 0;
    int i = 0;
    while (i < original.length()) {
      char c = original.charAt(i);
      if (c == '{' && i + 1 < original.length() && original.charAt(i + 1) == '}') {
        out.append('{').append(index++).append('}');
        i += 2;
        continue;
      }
      out.append(c == '\'' ? "''" : String.valueOf(c));
      i++;
    }
    return out.toString();
  }

  /** Resolves {@link ArgSupplier} arguments and renders numbers without locale grouping. */
  static Object[] evaluateLambdaArgs(Object... args) {
    Object[] resolved = new Object[args.length];
    for (int i = 0; i < args.length; i++) {
      Object arg = args[i] instanceof ArgSupplier ? ((ArgSupplier) args[i]).get() : args[i];
      resolved[i] = arg instanceof Number ? arg.toString() : arg;
    }
    return resolved;
  }
}
