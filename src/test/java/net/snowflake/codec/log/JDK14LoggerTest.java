package net.snowflake.codec.log;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class JDK14LoggerTest {
  // holds the parent logger so it keeps the handler
  private final Logger codecLogger = Logger.getLogger(JDK14Logger.CLASS_NAME_PREFIX);
  private final ListHandler handler = new ListHandler();
  private Level previousLevel;

  @BeforeEach
  public void setUp() {
    previousLevel = JDK14Logger.getLevel();
    JDK14Logger.addHandler(handler);
  }

  @AfterEach
  public void tearDown() {
    JDK14Logger.removeHandler(handler);
    JDK14Logger.setLevel(previousLevel);
  }

  @Test
  public void testRefactorString() {
    assertEquals("Error in {0} on {1}", JDK14Logger.refactorString("Error in {} on {}"));
    assertEquals("it''s {0}", JDK14Logger.refactorString("it's {}"));
    assertEquals("no placeholder", JDK14Logger.refactorString("no placeholder"));
  }

  @Test
  public void testNumbersAreNotGrouped() {
    assertArrayEquals(
        new Object[] {"1234567", "text"}, JDK14Logger.evaluateLambdaArgs(1234567, "text"));
  }

  @Test
  public void testMessageIsFormatted() {
    JDK14Logger.setLevel(Level.ALL);
    JDK14Logger logger = new JDK14Logger(JDK14LoggerTest.class.getName());
    logger.warn("Column {} has {} rows", "C1", 12345);

    assertEquals(1, handler.records.size());
    assertEquals(Level.WARNING, handler.records.get(0).getLevel());
    assertEquals("Column C1 has 12345 rows", handler.records.get(0).getMessage());
    assertEquals(JDK14LoggerTest.class.getName(), handler.records.get(0).getSourceClassName());
    assertEquals("testMessageIsFormatted", handler.records.get(0).getSourceMethodName());
  }

  @Test
  public void testArgSupplierIsLazy() {
    JDK14Logger.setLevel(Level.INFO);
    JDK14Logger logger = new JDK14Logger(JDK14LoggerTest.class.getName());
    AtomicBoolean called = new AtomicBoolean();
    assertFalse(logger.isDebugEnabled());
    logger.debug(
        "Value: {}",
        (ArgSupplier)
            () -> {
              called.set(true);
              return "expensive";
            });
    assertFalse(called.get());
    assertTrue(handler.records.isEmpty());

    JDK14Logger.setLevel(Level.FINE);
    logger.debug("Value: {}", (ArgSupplier) () -> "computed");
    assertEquals("Value: computed", handler.records.get(0).getMessage());
  }

  @Test
  public void testThrowableIsAttached() {
    JDK14Logger.setLevel(Level.ALL);
    JDK14Logger logger = new JDK14Logger(JDK14LoggerTest.class.getName());
    IllegalStateException ex = new IllegalStateException("boom");
    logger.error("Failed", ex);
    assertEquals(ex, handler.records.get(0).getThrown());
    assertEquals(Level.SEVERE, handler.records.get(0).getLevel());
  }
}
