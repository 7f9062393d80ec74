package exm.yil.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.yil.common.exceptions.InvalidOptionException;

public class SettingsTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @After
  public void resetSettings() {
    System.clearProperty(Settings.PRINTER_INDENT_WIDTH);
    Settings.reset();
  }

  @Test
  public void testDefaults() throws InvalidOptionException {
    assertTrue(Settings.getBoolean(Settings.PRINTER_STRICT));
    assertFalse(Settings.getBoolean(Settings.PRINTER_COMMENTS));
    assertEquals(2, Settings.getLong(Settings.PRINTER_INDENT_WIDTH));
    assertEquals("", Settings.get(Settings.LOG_FILE));
  }

  @Test
  public void testKeys() {
    assertEquals(Arrays.asList(Settings.LOG_FILE, Settings.LOG_TRACE,
        Settings.PRINTER_COMMENTS, Settings.PRINTER_INDENT_WIDTH,
        Settings.PRINTER_STRICT), Settings.getKeys());
  }

  @Test
  public void testSetAndReset() throws InvalidOptionException {
    Settings.set(Settings.PRINTER_STRICT, " FALSE ");
    assertFalse(Settings.getBoolean(Settings.PRINTER_STRICT));
    Settings.reset();
    assertTrue(Settings.getBoolean(Settings.PRINTER_STRICT));
  }

  @Test
  public void testBadBoolean() throws InvalidOptionException {
    Settings.set(Settings.PRINTER_COMMENTS, "yes");
    exception.expect(InvalidOptionException.class);
    Settings.getBoolean(Settings.PRINTER_COMMENTS);
  }

  @Test
  public void testBadLong() throws InvalidOptionException {
    Settings.set(Settings.PRINTER_INDENT_WIDTH, "two");
    exception.expect(InvalidOptionException.class);
    Settings.getLong(Settings.PRINTER_INDENT_WIDTH);
  }

  @Test
  public void testSystemOverride() throws InvalidOptionException {
    System.setProperty(Settings.PRINTER_INDENT_WIDTH, "4");
    Settings.initYILProperties();
    assertEquals(4, Settings.getLong(Settings.PRINTER_INDENT_WIDTH));
  }

  @Test
  public void testIndentWidth() throws InvalidOptionException {
    assertEquals(2, Settings.getIndentWidth());
    Settings.set(Settings.PRINTER_INDENT_WIDTH, "4");
    assertEquals(4, Settings.getIndentWidth());
  }

  @Test
  public void testOversizedWidthRejected() throws InvalidOptionException {
    // would wrap around to 2 if narrowed to an int
    Settings.set(Settings.PRINTER_INDENT_WIDTH, "4294967298");
    exception.expect(InvalidOptionException.class);
    exception.expectMessage("out of range");
    Settings.getIndentWidth();
  }

  @Test
  public void testSetNegativeWidthRejected() throws InvalidOptionException {
    Settings.set(Settings.PRINTER_INDENT_WIDTH, "-3");
    exception.expect(InvalidOptionException.class);
    exception.expectMessage("must not be negative");
    Settings.getIndentWidth();
  }

  @Test
  public void testNegativeWidthRejected() throws InvalidOptionException {
    System.setProperty(Settings.PRINTER_INDENT_WIDTH, "-1");
    exception.expect(InvalidOptionException.class);
    Settings.initYILProperties();
  }
}
