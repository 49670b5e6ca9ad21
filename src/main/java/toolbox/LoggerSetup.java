package toolbox;

import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

import runtimevars.Parameters;

/**
 * Routes every logger to a single console handler with a one line format.
 */
public class LoggerSetup {

	private static final String FORMAT = "%1$tY-%1$tm-%1$td %1$tH:%1$tM:%1$tS.%1$tL %4$-7s [%3$s %2$s] %5$s %6$s%n";

	public static Logger setupLogger() {
		return setupLogger(parseLevel(Parameters.<String>get("logLevel")));
	}

	public static Logger setupLogger(Level level) {

		System.setProperty("java.util.logging.SimpleFormatter.format", FORMAT);

		Logger root = Logger.getLogger("");
		root.setUseParentHandlers(false);
		// remove any default handlers
		for (Handler handler : root.getHandlers()) {
			root.removeHandler(handler);
		}

		ConsoleHandler consoleHandler = new ConsoleHandler();
		consoleHandler.setFormatter(new SimpleFormatter());
		consoleHandler.setLevel(level);
		root.addHandler(consoleHandler);
		root.setLevel(level);

		return root;
	}

	public static Level parseLevel(String name) {
		if (name == null) {
			return Level.INFO;
		}
		try {
			return Level.parse(name.toUpperCase());
		} catch (IllegalArgumentException e) {
			Logger.getLogger(LoggerSetup.class.getName()).warning("Unknown log level '" + name + "', using INFO.");
			return Level.INFO;
		}
	}

}
