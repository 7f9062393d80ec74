/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.yil.common;

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

import org.apache.log4j.Appender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.yil.common.exceptions.InvalidOptionException;
import exm.yil.common.exceptions.YILRuntimeError;
import exm.yil.common.util.Pair;

public class Logging {
  private static final String YIL_LOGGER_NAME = "exm.yil";

  private static final String LOG_PATTERN = "%-5p %c{1}: %m%n";

  /**
   * Messages already emitted.
   */
  private static final Set<Pair<Level, String>> emitted =
          new HashSet<Pair<Level, String>>();

  public static Logger getYILLogger() {
    return Logger.getLogger(YIL_LOGGER_NAME);
  }

  /**
   * Configure the YIL logger.
   * @param logfile file to log to, or empty to only report warnings
   *                through whatever appenders are already configured
   * @param trace whether to log at trace level
   * @return the configured logger
   */
  public static Logger setupLogging(String logfile, boolean trace) {
    Logger yilLogger = getYILLogger();
    if (logfile == null || logfile.length() == 0) {
      yilLogger.setLevel(Level.WARN);
      return yilLogger;
    }

    Layout layout = new PatternLayout(LOG_PATTERN);
    try {
      FileAppender appender = new FileAppender(layout, logfile, false);
      // appenders are named by their file, so reconfiguring replaces them
      appender.setName(logfile);
      Appender old = yilLogger.getAppender(logfile);
      if (old != null) {
        yilLogger.removeAppender(old);
        old.close();
      }
      yilLogger.addAppender(appender);
    } catch (IOException e) {
      throw new YILRuntimeError("Could not open log file " + logfile +
                                ": " + e.getMessage());
    }
    yilLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    return yilLogger;
  }

  /**
   * Configure the YIL logger from {@link Settings#LOG_FILE} and
   * {@link Settings#LOG_TRACE}
   */
  public static Logger setupLoggingFromSettings()
        throws InvalidOptionException {
    return setupLogging(Settings.get(Settings.LOG_FILE),
                        Settings.getBoolean(Settings.LOG_TRACE));
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static boolean addEmitted(Level level, String msg) {
    synchronized (emitted) {
      return emitted.add(Pair.create(level, msg));
    }
  }

  public static void uniqueWarn(String msg) {
    if (Logging.addEmitted(Level.WARN, msg)) {
      Logging.getYILLogger().warn(msg);
    } else {
      Logging.getYILLogger().debug("Duplicate Warning: " + msg);
    }
  }
}
