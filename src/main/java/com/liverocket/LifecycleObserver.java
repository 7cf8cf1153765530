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

package com.liverocket;

import com.liverocket.util.LoggingUtils;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.List;

/**
 * Read-only hook methods for observing system and request lifecycle events.
 * <p>
 * Note: the start and stop hooks are "fail-fast" - exceptions thrown will bubble out and stop execution - and for the
 * request handling hooks, LiveRocket will catch exceptions and surface them separately via {@link #didReceiveLogEvent(LogEvent)}.
 * <p>
 * A standard threadsafe implementation can be acquired via the {@link #defaultInstance()} factory method.
 */
public interface LifecycleObserver {
	/**
	 * Called before a {@link LiveRocket} instance starts.
	 */
	default void willStartLiveRocket(@NonNull LiveRocket liveRocket) {
		// No-op by default
	}

	/**
	 * Called after a {@link LiveRocket} instance starts.
	 */
	default void didStartLiveRocket(@NonNull LiveRocket liveRocket) {
		// No-op by default
	}

	/**
	 * Called before a {@link LiveRocket} instance stops.
	 */
	default void willStopLiveRocket(@NonNull LiveRocket liveRocket) {
		// No-op by default
	}

	/**
	 * Called after a {@link LiveRocket} instance stops.
	 */
	default void didStopLiveRocket(@NonNull LiveRocket liveRocket) {
		// No-op by default
	}

	/**
	 * Called once per request, after global middleware has run and the route, if any, has been resolved.
	 * <p>
	 * {@code route} is {@code null} when no route matched or when a global middleware threw before resolution.
	 */
	default void didStartRequestHandling(@NonNull Request request,
																			 @Nullable Route route) {
		// No-op by default
	}

	/**
	 * Called after a request finishes processing, before its response is written.
	 * <p>
	 * {@code response} is {@code null} when processing ended in a framework-generated error response
	 * rather than a handler's response; {@code throwables} holds whatever was thrown along the way.
	 */
	default void didFinishRequestHandling(@NonNull Request request,
																				@Nullable Route route,
																				@Nullable Response response,
																				@NonNull Duration duration,
																				@NonNull List<@NonNull Throwable> throwables) {
		// No-op by default
	}

	/**
	 * Called when LiveRocket emits a log event.
	 * <p>
	 * The default implementation writes the event through SLF4J via {@link LoggingUtils#logLogEvent(LogEvent)}.
	 */
	default void didReceiveLogEvent(@NonNull LogEvent logEvent) {
		LoggingUtils.logLogEvent(logEvent);
	}

	/**
	 * Acquires a threadsafe {@link LifecycleObserver} instance with sensible defaults.
	 *
	 * @return a {@code LifecycleObserver} with default settings
	 */
	@NonNull
	static LifecycleObserver defaultInstance() {
		return DefaultLifecycleObserver.defaultInstance();
	}
}
