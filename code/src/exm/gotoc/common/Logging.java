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
package exm.gotoc.common;

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.gotoc.common.util.Pair;

public class Logging
{
  private static final String GOTOC_LOGGER_NAME = "exm.gotoc";

  private static final String LOG_PATTERN = "%-5p %c{1} - %m%n";

  /**
   * Messages already emitted.
   */
  private static final Set<Pair<Level, String>> emitted =
       new HashSet<Pair<Level, String>>();

  public static Logger getGotocLogger()
  {
    return Logger.getLogger(GOTOC_LOGGER_NAME);
  }

  /**
   * Direct project logging to a file.  With no file, leave the
   * console configuration from log4j.properties in place.
   * @param logfile file to append to, or null/empty for none
   * @param trace log at TRACE rather than DEBUG level
   * @return the project logger
   */
  public static Logger setupLogging(String logfile, boolean trace)
  {
    Logger logger = getGotocLogger();
    if (logfile == null || logfile.length() == 0) {
      return logger;
    }

    try {
      FileAppender appender = new FileAppender(new PatternLayout(LOG_PATTERN),
                                               logfile, false);
      logger.addAppender(appender);
      logger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    } catch (IOException e) {
      System.err.println("Could not open log file: " + logfile + ": " +
                         e.getMessage());
    }
    return logger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static synchronized boolean addEmitted(Level level, String msg)
  {
    return emitted.add(Pair.create(level, msg));
  }

  public static void uniqueWarn(String msg)
  {
    if (addEmitted(Level.WARN, msg))
      getGotocLogger().warn(msg);
    else
      getGotocLogger().debug("Duplicate Warning: " + msg);
  }
}
