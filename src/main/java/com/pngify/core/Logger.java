package com.pngify.core;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Small level-filtered logger so the codec ships without logging dependencies.
 * Levels are chosen by name (none, debug, info, error); anything unrecognised means none.
 */
public class Logger {

	public static final String NONE = "NONE";
	public static final String DEBUG = "DEBUG";
	public static final String INFO = "INFO";
	public static final String ERROR = "ERROR";
	private static final List<String> LOG_LEVELS = Arrays.asList(NONE, DEBUG, INFO, ERROR);

	private final String logLevel;

	private final PrintStream out;

	/** */
	public Logger(String logLevel) {
		this(logLevel, System.out);
	}

	/** */
	Logger(String logLevel, PrintStream out) {
		final String level = (logLevel == null) ? NONE : logLevel.toUpperCase(Locale.ROOT);
		this.logLevel = LOG_LEVELS.contains(level) ? level : NONE;
		this.out = out;
	}

	public boolean isDebugEnabled() {
		return DEBUG.equals(this.logLevel);
	}

	/**
	 * Write debug messages.
	 * Args are only formatted when the level applies.
	 */
	public void debug(String message, Object... args) {
		if (isDebugEnabled()) {
			write(message, args);
		}
	}

	/**
	 * Write info messages.
	 * Args are only formatted when the level applies.
	 */
	public void info(String message, Object... args) {
		if (DEBUG.equals(this.logLevel) || INFO.equals(this.logLevel)) {
			write(message, args);
		}
	}

	/**
	 * Write error messages; shown at every level except none.
	 */
	public void error(String message, Object... args) {
		if (!NONE.equals(this.logLevel)) {
			write(message, args);
		}
	}

	/* */
	private void write(String message, Object... args) {
		this.out.println((args.length == 0) ? message : String.format(message, args));
	}
}
