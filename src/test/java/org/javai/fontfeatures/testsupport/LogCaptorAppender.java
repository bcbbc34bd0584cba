package org.javai.fontfeatures.testsupport;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;
import org.apache.logging.log4j.core.config.Property;
import org.apache.logging.log4j.core.layout.PatternLayout;

/**
 * Records what a compiler class logs while a test runs, so diagnostics can be
 * asserted on as they reach the log rather than only through the session's sink.
 * <p>
 * The logger is lowered to the requested level for the lifetime of the appender and
 * restored on {@link #close()}:
 * <pre>
 * try (LogCaptorAppender log = LogCaptorAppender.create(DiagnosticSink.class, Level.INFO)) {
 *     session.compile("DumpClassNames;");
 *     assertThat(log.messages(Level.INFO)).containsExactly("CLASS_REPORT: No classes defined (at 1:1)");
 * }
 * </pre>
 */
public final class LogCaptorAppender extends AbstractAppender implements AutoCloseable {

	private final LoggerContext context;
	private final LoggerConfig target;
	private final Level restoreLevel;
	private final boolean temporaryLogger;
	private final List<LogEvent> captured = new CopyOnWriteArrayList<>();

	private LogCaptorAppender(LoggerContext context, LoggerConfig target, Level restoreLevel, boolean temporaryLogger) {
		super("captor:" + target.getName(), null,
				PatternLayout.newBuilder().withPattern(PatternLayout.SIMPLE_CONVERSION_PATTERN).build(),
				false, Property.EMPTY_ARRAY);
		this.context = context;
		this.target = target;
		this.restoreLevel = restoreLevel;
		this.temporaryLogger = temporaryLogger;
	}

	/**
	 * Attaches a capturing appender to the logger of {@code loggerClass}.
	 */
	public static LogCaptorAppender create(Class<?> loggerClass, Level level) {
		LoggerContext context = (LoggerContext) LogManager.getContext(false);
		Configuration configuration = context.getConfiguration();
		String name = loggerClass.getName();

		// an inherited config belongs to a parent logger, so give the class its own
		LoggerConfig target = configuration.getLoggerConfig(name);
		boolean temporary = !target.getName().equals(name);
		if (temporary) {
			target = new LoggerConfig(name, level, true);
			configuration.addLogger(name, target);
		}
		Level restoreLevel = target.getLevel();
		target.setLevel(level);

		LogCaptorAppender appender = new LogCaptorAppender(context, target, restoreLevel, temporary);
		appender.start();
		target.addAppender(appender, level, null);
		context.updateLoggers();
		return appender;
	}

	@Override
	public void append(LogEvent event) {
		captured.add(event.toImmutable());
	}

	/**
	 * Formatted messages logged at exactly {@code level}, in emission order.
	 */
	public List<String> messages(Level level) {
		return captured.stream()
				.filter(event -> event.getLevel() == level)
				.map(event -> event.getMessage().getFormattedMessage())
				.toList();
	}

	@Override
	public void close() {
		stop();
		target.removeAppender(getName());
		if (temporaryLogger) {
			context.getConfiguration().removeLogger(target.getName());
		} else {
			target.setLevel(restoreLevel);
		}
		context.updateLoggers();
	}
}
