package exm.yil.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.util.Enumeration;

import org.apache.log4j.Appender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.junit.After;
import org.junit.Test;

import exm.yil.common.exceptions.InvalidOptionException;

public class LoggingTest {

  private static final String LOG_FILE = "target/LoggingTest.yil.log";

  @After
  public void restoreLogging() {
    Logger logger = Logging.getYILLogger();
    Appender appender = logger.getAppender(LOG_FILE);
    if (appender != null) {
      logger.removeAppender(appender);
      appender.close();
    }
    System.clearProperty(Settings.LOG_FILE);
    System.clearProperty(Settings.LOG_TRACE);
    Settings.reset();
    Logging.setupLogging("", false);
  }

  @Test
  public void testWarnWithoutLogFile() throws InvalidOptionException {
    Logger logger = Logging.setupLoggingFromSettings();
    assertEquals(Level.WARN, logger.getLevel());
  }

  @Test
  public void testLogFileFromSettings() throws InvalidOptionException {
    Settings.set(Settings.LOG_FILE, LOG_FILE);
    Settings.set(Settings.LOG_TRACE, "true");
    Logger logger = Logging.setupLoggingFromSettings();
    assertEquals(Level.TRACE, logger.getLevel());
    assertNotNull(logger.getAppender(LOG_FILE));
    logger.trace("trace message");
    assertTrue(new File(LOG_FILE).exists());

    Settings.set(Settings.LOG_TRACE, "false");
    assertEquals(Level.DEBUG, Logging.setupLoggingFromSettings().getLevel());
  }

  @Test
  public void testSystemPropertiesConfigureLogging()
        throws InvalidOptionException {
    System.setProperty(Settings.LOG_FILE, LOG_FILE);
    System.setProperty(Settings.LOG_TRACE, "true");
    Settings.initYILProperties();
    Logger logger = Logging.getYILLogger();
    assertEquals(Level.TRACE, logger.getLevel());
    assertNotNull(logger.getAppender(LOG_FILE));
  }

  @Test
  public void testReconfigureReplacesAppender() throws InvalidOptionException {
    Settings.set(Settings.LOG_FILE, LOG_FILE);
    Logging.setupLoggingFromSettings();
    Logger logger = Logging.setupLoggingFromSettings();
    int count = 0;
    Enumeration<?> appenders = logger.getAllAppenders();
    while (appenders.hasMoreElements()) {
      Appender a = (Appender)appenders.nextElement();
      if (LOG_FILE.equals(a.getName())) {
        count++;
      }
    }
    assertEquals(1, count);
  }
}
