/**
 * MIT License
 * <p>
 * Copyright (c) 2021 Justin Kunimune
 * <p>
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 * <p>
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 * <p>
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package quantity;

import java.io.IOException;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * sets up java.util.logging the way this library likes to read it: one line per record.
 */
public class Logging {
	private static final String CONSOLE_FORMAT = "%1$ta %1$tH:%1$tM:%1$tS | %2$s | %3$s%4$s%n";
	private static final String FILE_FORMAT = "%1$tY-%1$tm-%1$td %1$tH:%1$tM:%1$tS | %2$s | %3$s%4$s%n";

	/**
	 * install the single-line formatter on the console handlers above this logger and
	 * let records down to the given level through.
	 */
	public static void configureLogger(Logger logger, Level level) {
		logger.setLevel(level);
		for (Logger parent = logger; parent != null; parent = parent.getParent()) {
			for (Handler handler: parent.getHandlers()) {
				handler.setFormatter(newFormatter(CONSOLE_FORMAT));
				handler.setLevel(level);
			}
			if (!parent.getUseParentHandlers())
				break;
		}
	}

	/**
	 * also send this logger's records to a file, appending to it if it already exists
	 * @throws IOException if the file can't be opened
	 */
	public static FileHandler logToFile(Logger logger, String filename) throws IOException {
		FileHandler handler = new FileHandler(filename, true);
		handler.setEncoding("UTF-8");
		handler.setFormatter(newFormatter(FILE_FORMAT));
		handler.setLevel(logger.getLevel() != null ? logger.getLevel() : Level.INFO);
		logger.addHandler(handler);
		return handler;
	}

	static Formatter newFormatter(String format) {
		return new SimpleFormatter() {
			@Override
			public String format(LogRecord record) {
				return String.format(format,
				                     record.getMillis(),
				                     record.getLevel(),
				                     record.getMessage(),
				                     (record.getThrown() != null) ? " " + record.getThrown() : "");
			}
		};
	}
}
