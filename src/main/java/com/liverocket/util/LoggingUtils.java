/*
 * Copyright 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package com.liverocket.util;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import ch.qos.logback.core.util.StatusPrinter;
import com.liverocket.LifecycleObserver;
import com.liverocket.LogEvent;
import com.liverocket.Request;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.slf4j.bridge.SLF4JBridgeHandler;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Logging plumbing for LiveRocket.
 * <p>
 * {@link LifecycleObserver#didReceiveLogEvent(LogEvent)} hands every {@link LogEvent} to {@link #logLogEvent(LogEvent)},
 * which writes it through SLF4J with the request method and path in the {@link MDC}. Logback is the bound SLF4J
 * implementation; {@link #initializeLogback(Path, LogbackOption...)} loads an explicit configuration file and brings
 * third-party {@code java.util.logging} output along with it.
 */
@ThreadSafe
public final class LoggingUtils {
	/**
	 * SLF4J logger name that {@link LogEvent}s are written to.
	 */
	@NonNull
	public static final String LOG_EVENT_LOGGER_NAME;
	/**
	 * {@link MDC} key holding the HTTP method of the request a {@link LogEvent} refers to.
	 */
	@NonNull
	public static final String REQUEST_METHOD_MDC_KEY;
	/**
	 * {@link MDC} key holding the path of the request a {@link LogEvent} refers to.
	 */
	@NonNull
	public static final String REQUEST_PATH_MDC_KEY;

	@NonNull
	private static final Logger LOG_EVENT_LOGGER;
	@NonNull
	private static final Object LOGBACK_LOCK;

	static {
		LOG_EVENT_LOGGER_NAME = "com.liverocket.LogEvent";
		REQUEST_METHOD_MDC_KEY = "liverocket.requestMethod";
		REQUEST_PATH_MDC_KEY = "liverocket.requestPath";
		LOG_EVENT_LOGGER = LoggerFactory.getLogger(LOG_EVENT_LOGGER_NAME);
		LOGBACK_LOCK = new Object();
	}

	public enum LogbackOption {
		/**
		 * Print Logback's internal status messages if configuration produced errors or warnings.
		 */
		DEBUGGING_ENABLED
	}

	private LoggingUtils() {}

	/**
	 * Renders a {@link LogEvent} as a single line, for example {@code [REQUEST_PROCESSING_FAILED] An error occurred...}.
	 *
	 * @param logEvent the event to render
	 * @return the rendered line
	 */
	@NonNull
	public static String formatLogEvent(@NonNull LogEvent logEvent) {
		requireNonNull(logEvent);
		return format("[%s] %s", logEvent.getLogEventType().name(), logEvent.getMessage());
	}

	/**
	 * Writes a {@link LogEvent} to SLF4J.
	 * <p>
	 * Events carrying a throwable are logged at {@code ERROR} with the throwable attached; all others at {@code WARN}.
	 * If the event refers to a request, its method and path are in the {@link MDC} for the duration of the call.
	 *
	 * @param logEvent the event to write
	 */
	public static void logLogEvent(@NonNull LogEvent logEvent) {
		requireNonNull(logEvent);

		Request request = logEvent.getRequest().orElse(null);
		Throwable throwable = logEvent.getThrowable().orElse(null);
		String message = formatLogEvent(logEvent);

		if (request != null) {
			MDC.put(REQUEST_METHOD_MDC_KEY, request.getMethod());
			MDC.put(REQUEST_PATH_MDC_KEY, request.getPath());
		}

		try {
			if (throwable == null)
				LOG_EVENT_LOGGER.warn(message);
			else
				LOG_EVENT_LOGGER.error(message, throwable);
		} finally {
			if (request != null) {
				MDC.remove(REQUEST_METHOD_MDC_KEY);
				MDC.remove(REQUEST_PATH_MDC_KEY);
			}
		}
	}

	/**
	 * Replaces Logback's configuration with the given file and routes {@code java.util.logging} records to SLF4J.
	 * <p>
	 * May be called again later; each call resets the logger context before loading the file.
	 *
	 * @param logbackConfigurationFile the Logback XML configuration file
	 * @param logbackOptions           optional behavior toggles
	 * @throws IllegalArgumentException if the path is not a regular file
	 * @throws IllegalStateException    if Logback rejects the configuration
	 */
	public static void initializeLogback(@NonNull Path logbackConfigurationFile,
																			 @Nullable LogbackOption... logbackOptions) {
		requireNonNull(logbackConfigurationFile);

		Path absoluteLogbackConfigurationFile = logbackConfigurationFile.toAbsolutePath();

		if (!Files.isRegularFile(absoluteLogbackConfigurationFile))
			throw new IllegalArgumentException(format("Logback configuration file %s does not exist or is not a regular file",
					absoluteLogbackConfigurationFile));

		List<LogbackOption> enabledLogbackOptions = logbackOptions == null ? List.of() : Arrays.asList(logbackOptions);

		synchronized (LOGBACK_LOCK) {
			LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
			JoranConfigurator joranConfigurator = new JoranConfigurator();
			joranConfigurator.setContext(loggerContext);
			loggerContext.reset();

			try {
				joranConfigurator.doConfigure(absoluteLogbackConfigurationFile.toFile());
			} catch (JoranException e) {
				throw new IllegalStateException(format("Logback rejected configuration file %s", absoluteLogbackConfigurationFile), e);
			}

			if (enabledLogbackOptions.contains(LogbackOption.DEBUGGING_ENABLED))
				StatusPrinter.printInCaseOfErrorsOrWarnings(loggerContext);

			if (!SLF4JBridgeHandler.isInstalled()) {
				SLF4JBridgeHandler.removeHandlersForRootLogger();
				SLF4JBridgeHandler.install();
			}
		}
	}

	/**
	 * Removes the {@code java.util.logging} to SLF4J bridge, if installed.
	 */
	public static void uninstallLogback() {
		synchronized (LOGBACK_LOCK) {
			if (SLF4JBridgeHandler.isInstalled())
				SLF4JBridgeHandler.uninstall();
		}
	}

	/**
	 * Is the {@code java.util.logging} to SLF4J bridge currently installed?
	 *
	 * @return {@code true} if installed, {@code false} otherwise
	 */
	@NonNull
	public static Boolean isLogbackBridgeInstalled() {
		synchronized (LOGBACK_LOCK) {
			return SLF4JBridgeHandler.isInstalled();
		}
	}
}
