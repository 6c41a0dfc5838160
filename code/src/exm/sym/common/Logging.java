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

package exm.sym.common;

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.sym.common.exceptions.SymRuntimeError;

public class Logging
{
  private static final String SYM_LOGGER_NAME = "exm.sym";

  private static final String LOG_PATTERN = "%-5p %c{1} - %m%n";

  /**
   * Messages already emitted.
   */
  static final Set<String> emitted = new HashSet<String>();

  public static Logger getSymLogger()
  {
    return Logger.getLogger(SYM_LOGGER_NAME);
  }

  /**
   * Route the engine logger to a file, or to stderr if no file given.
   * @param logfile empty or null for console logging
   * @param trace if true, log everything down to TRACE, else only warnings
   *          on the console and DEBUG in a log file
   */
  public static Logger setupLogging(String logfile, boolean trace)
  {
    Logger symLogger = getSymLogger();
    symLogger.removeAllAppenders();
    symLogger.setAdditivity(false);
    Layout layout = new PatternLayout(LOG_PATTERN);

    if (logfile != null && logfile.length() > 0) {
      try {
        symLogger.addAppender(new FileAppender(layout, logfile, false));
      } catch (IOException e) {
        throw new SymRuntimeError("Could not open log file " + logfile, e);
      }
      symLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    } else {
      ConsoleAppender console = new ConsoleAppender(layout,
                                            ConsoleAppender.SYSTEM_ERR);
      symLogger.addAppender(console);
      symLogger.setLevel(trace ? Level.TRACE : Level.WARN);
    }
    // Even if logging is disabled, this must be valid:
    return symLogger;
  }

  /**
   * @param msg
   * @return true if not already emitted
   */
  public static synchronized boolean addEmitted(String msg)
  {
    return emitted.add(msg);
  }

  public static void uniqueWarn(String msg)
  {
    if (addEmitted(msg))
      getSymLogger().warn(msg);
    else
      getSymLogger().debug("Duplicate Warning: " + msg);
  }
}
