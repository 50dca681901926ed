// Part of Sharefetch
package com.machinezoo.sharefetch.util;

import static java.util.stream.Collectors.*;
import java.util.*;
import java.util.function.*;
import java.util.stream.*;
import org.slf4j.*;
import com.machinezoo.stagean.*;

/**
 * Prefix-tagged, level-gated diagnostic log.
 * Messages pass through SLF4J, so the logging backend may filter them further.
 * <p>
 * Typical use is to give each cache or stream registry its own prefix:
 *
 * <pre>{@code
 * DiagnosticLog log = new DiagnosticLog("[users]").level(DiagnosticLog.Level.DEBUG);
 * cache.log(log);
 * registry.getStream("feed").ifPresent(s -> s.subscribe(log.debugTap(v -> "feed " + v)));
 * }</pre>
 *
 * Diagnostic log is a side channel. It never alters values passing through taps and swallows nothing.
 */
@StubDocs
public class DiagnosticLog {
	/**
	 * Verbosity threshold. Messages below the configured level are skipped without being formatted.
	 */
	public enum Level {
		DEBUG,
		INFO,
		NONE
	}
	private static final Logger defaultLogger = LoggerFactory.getLogger(DiagnosticLog.class);
	private final String prefix;
	public String prefix() {
		return prefix;
	}
	private volatile Logger logger = defaultLogger;
	public DiagnosticLog logger(Logger logger) {
		Objects.requireNonNull(logger);
		this.logger = logger;
		return this;
	}
	private volatile Level level = Level.INFO;
	public Level level() {
		return level;
	}
	public DiagnosticLog level(Level level) {
		Objects.requireNonNull(level);
		this.level = level;
		return this;
	}
	public DiagnosticLog(String prefix) {
		Objects.requireNonNull(prefix);
		this.prefix = prefix;
	}
	public boolean enabled(Level level) {
		return level != Level.NONE && this.level.compareTo(level) <= 0;
	}
	String format(Object... message) {
		return Stream.concat(Stream.of(prefix), Arrays.stream(message))
			.map(Objects::toString)
			.collect(joining(" "));
	}
	public void debug(Object... message) {
		if (enabled(Level.DEBUG))
			logger.debug(format(message));
	}
	public void info(Object... message) {
		if (enabled(Level.INFO))
			logger.info(format(message));
	}
	/*
	 * Taps take a message function rather than a message, so that formatting is skipped when the level is off.
	 */
	public <T> Consumer<T> debugTap(Function<T, ?> message) {
		Objects.requireNonNull(message);
		return v -> {
			if (enabled(Level.DEBUG))
				logger.debug(format(message.apply(v)));
		};
	}
	public <T> Consumer<T> infoTap(Function<T, ?> message) {
		Objects.requireNonNull(message);
		return v -> {
			if (enabled(Level.INFO))
				logger.info(format(message.apply(v)));
		};
	}
	@Override
	public String toString() {
		return "DiagnosticLog" + prefix + "(" + level + ")";
	}
}
