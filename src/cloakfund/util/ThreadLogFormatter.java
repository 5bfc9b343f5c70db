/*
 * Cloakfund - Confidential Crowdfunding Settlement via Verifiable Reveals
 *
 * Copyright 2016-2017 Ethan Cecchetti, Fan Zhang and Yan Ji
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package cloakfund.util;

import java.text.DateFormat;
import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

public class ThreadLogFormatter extends Formatter {
    // SimpleDateFormat is not thread safe.
    private static final ThreadLocal<DateFormat> DATE_FORMAT = ThreadLocal
            .withInitial(() -> new SimpleDateFormat("hh:mm:ss.SSS"));

    /**
     * Routes the named logger to a console handler using this formatter at the
     * given level, replacing any handlers it already had.
     *
     * @param loggerName the logger to configure, e.g. {@code "cloakfund"}.
     * @param level the minimum level to print.
     * @return the configured logger.
     */
    public static Logger installOn(String loggerName, Level level) {
        Logger logger = Logger.getLogger(loggerName);
        for (Handler existing : logger.getHandlers())
            logger.removeHandler(existing);

        Handler handler = new ConsoleHandler();
        handler.setFormatter(new ThreadLogFormatter());
        handler.setLevel(level);
        logger.addHandler(handler);
        logger.setLevel(level);
        logger.setUseParentHandlers(false);
        return logger;
    }

    @Override
    public String format(LogRecord record) {
        String sourceClass = record.getSourceClassName() == null ? "?" : record.getSourceClassName();
        String lastClassName = sourceClass.substring(sourceClass.lastIndexOf('.') + 1);
        return String.format("[%-7s] [%s] [%s %-2d] %s <%s.%s>%n", record.getLevel(),
                DATE_FORMAT.get().format(new Date(record.getMillis())), record.getLoggerName(), record.getThreadID(),
                formatMessage(record), lastClassName, record.getSourceMethodName());
    }
}
