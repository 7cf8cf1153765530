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

import com.liverocket.exception.MalformedRequestException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * LiveRocket's main class - manages a {@link Server} using the provided system configuration and dispatches each
 * request through global middleware, the {@link RouteTable}, route middleware and finally the matched {@link RouteHandler}.
 * <p>
 * <pre>{@code // Register routes
 * RouteTable routeTable = new RouteTable();
 *
 * routeTable.get("/greet/<name>", (request, response, pathParameters) ->
 *   response.send("hi " + pathParameters.getString("name").get()));
 *
 * routeTable.get("/items/<int:id>", (request, response, pathParameters) ->
 *   response.send("item " + pathParameters.getLong("id").get()));
 *
 * // Configure the server
 * LiveRocketConfig config = LiveRocketConfig.withServer(Server.withPort(8080).build())
 *   .routeTable(routeTable)
 *   .build();
 *
 * try (LiveRocket liveRocket = LiveRocket.withConfig(config)) {
 *   liveRocket.start();
 *   System.out.println("LiveRocket started, press [enter] to exit");
 *   System.in.read();
 * }}</pre>
 */
@ThreadSafe
public final class LiveRocket implements AutoCloseable {
	@NonNull
	private static final String ROUTE_NOT_FOUND_MESSAGE;

	static {
		ROUTE_NOT_FOUND_MESSAGE = "Route not found";
	}

	@NonNull
	private final LiveRocketConfig liveRocketConfig;
	@NonNull
	private final ReentrantLock lock;
	@NonNull
	private final AtomicReference<CountDownLatch> awaitShutdownLatchReference;

	/**
	 * Acquires a LiveRocket instance with the given configuration.
	 *
	 * @param liveRocketConfig configuration that drives the LiveRocket system
	 * @return a LiveRocket instance
	 */
	@NonNull
	public static LiveRocket withConfig(@NonNull LiveRocketConfig liveRocketConfig) {
		requireNonNull(liveRocketConfig);
		return new LiveRocket(liveRocketConfig);
	}

	private LiveRocket(@NonNull LiveRocketConfig liveRocketConfig) {
		requireNonNull(liveRocketConfig);

		this.liveRocketConfig = liveRocketConfig;
		this.lock = new ReentrantLock();
		this.awaitShutdownLatchReference = new AtomicReference<>(new CountDownLatch(1));

		liveRocketConfig.getServer().initialize(liveRocketConfig, this::handleRequest);
	}

	/**
	 * Starts the managed server.
	 * <p>
	 * If the server is already started, this is a no-op.
	 *
	 * @throws java.io.UncheckedIOException if the server cannot bind its port
	 */
	public void start() {
		getLock().lock();

		try {
			if (isStarted())
				return;

			getAwaitShutdownLatchReference().set(new CountDownLatch(1));

			LifecycleObserver lifecycleObserver = getLiveRocketConfig().getLifecycleObserver();

			lifecycleObserver.willStartLiveRocket(this);
			getLiveRocketConfig().getServer().start();
			lifecycleObserver.didStartLiveRocket(this);
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Stops the managed server, waiting for in-flight connections up to the server's shutdown timeout.
	 * <p>
	 * If the server is already stopped, this is a no-op.
	 */
	public void stop() {
		getLock().lock();

		try {
			if (isStarted()) {
				LifecycleObserver lifecycleObserver = getLiveRocketConfig().getLifecycleObserver();

				lifecycleObserver.willStopLiveRocket(this);
				getLiveRocketConfig().getServer().stop();
				lifecycleObserver.didStopLiveRocket(this);
			}
		} finally {
			try {
				getAwaitShutdownLatchReference().get().countDown();
			} finally {
				getLock().unlock();
			}
		}
	}

	/**
	 * Blocks the current thread until JVM shutdown ({@code SIGTERM/SIGINT/System.exit(...)} and so forth) or until
	 * {@link #stop()} is invoked from another thread.
	 * <p>
	 * This method will automatically invoke this instance's {@link #stop()} method once it becomes unblocked.
	 *
	 * @throws InterruptedException if the current thread has its interrupted status set on entry to this method, or is interrupted while waiting
	 */
	public void awaitShutdown() throws InterruptedException {
		Thread shutdownHook = new Thread(() -> {
			try {
				stop();
			} catch (Throwable throwable) {
				throwable.printStackTrace(System.err);
			}
		}, "liverocket-shutdown-hook");

		Runtime.getRuntime().addShutdownHook(shutdownHook);

		try {
			getAwaitShutdownLatchReference().get().await();
		} finally {
			try {
				Runtime.getRuntime().removeShutdownHook(shutdownHook);
			} catch (IllegalStateException ignored) {
				// JVM shutting down
			}

			stop();
		}
	}

	/**
	 * Synonym for {@link #stop()}.
	 */
	@Override
	public void close() {
		stop();
	}

	/**
	 * Is the managed {@link Server} started?
	 *
	 * @return {@code true} if started, {@code false} otherwise
	 */
	@NonNull
	public Boolean isStarted() {
		getLock().lock();

		try {
			return getLiveRocketConfig().getServer().isStarted();
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Builds the URL registered for a handler, substituting path parameters.
	 *
	 * @see RouteTable#urlFor(RouteHandler, Map)
	 */
	@NonNull
	public String urlFor(@NonNull RouteHandler routeHandler,
											 @NonNull Map<@NonNull String, ?> pathParameters) {
		return getLiveRocketConfig().getRouteTable().urlFor(routeHandler, pathParameters);
	}

	/**
	 * Builds the URL registered for a {@link RouteGroup} class, substituting path parameters.
	 *
	 * @see RouteTable#urlFor(Class, Map)
	 */
	@NonNull
	public String urlFor(@NonNull Class<? extends RouteGroup> routeGroupClass,
											 @NonNull Map<@NonNull String, ?> pathParameters) {
		return getLiveRocketConfig().getRouteTable().urlFor(routeGroupClass, pathParameters);
	}

	/**
	 * Dispatches a parsed request and marshals whatever it produces.
	 * <p>
	 * Never throws: failures become {@code 404} or {@code 500} responses.
	 */
	@NonNull
	RequestResult handleRequest(@NonNull Request request) {
		requireNonNull(request);

		Instant processingStarted = Instant.now();
		LiveRocketConfig liveRocketConfig = getLiveRocketConfig();
		List<Throwable> throwables = new ArrayList<>(4);
		Route route = null;
		Response response = null;
		RequestResult requestResult;
		boolean didStartRequestHandling = false;

		try {
			for (Middleware middleware : liveRocketConfig.getMiddlewares())
				middleware.process(request);

			HttpMethod httpMethod = request.getHttpMethod().orElse(null);
			RouteMatch routeMatch = httpMethod == null ? null : liveRocketConfig.getRouteTable().resolve(request.getPath(), httpMethod).orElse(null);

			if (routeMatch != null)
				route = routeMatch.getRoute();

			didStartRequestHandling = true;
			safelyInvokeDidStartRequestHandling(request, route, throwables);

			if (routeMatch == null) {
				requestResult = errorRequestResult(StatusCode.HTTP_404, ROUTE_NOT_FOUND_MESSAGE, null);
			} else {
				for (Middleware middleware : route.getMiddlewares())
					middleware.process(request);

				response = new Response(liveRocketConfig.getTemplateRenderer());
				route.getRouteHandler().handleRequest(request, response, routeMatch.getPathParameters());
				requestResult = marshal(request, response, route, throwables);
			}
		} catch (Throwable throwable) {
			throwables.add(throwable);
			response = null;

			safelyLog(LogEvent.with(LogEventType.REQUEST_PROCESSING_FAILED, format("An error occurred while processing %s %s", request.getMethod(), request.getPath()))
					.throwable(throwable)
					.request(request)
					.build());

			requestResult = errorRequestResult(StatusCode.HTTP_500, format("%s: %s", StatusCode.HTTP_500.getReasonPhrase(), messageFor(throwable)), route);
		}

		// A global middleware failure skips the normal call site
		if (!didStartRequestHandling)
			safelyInvokeDidStartRequestHandling(request, route, throwables);

		try {
			liveRocketConfig.getLifecycleObserver().didFinishRequestHandling(request, route, response, Duration.between(processingStarted, Instant.now()), List.copyOf(throwables));
		} catch (Throwable throwable) {
			safelyLog(LogEvent.with(LogEventType.LIFECYCLE_OBSERVER_DID_FINISH_REQUEST_HANDLING_FAILED,
							format("An exception occurred while invoking %s::didFinishRequestHandling", LifecycleObserver.class.getSimpleName()))
					.throwable(throwable)
					.request(request)
					.build());
		}

		return requestResult;
	}

	private void safelyInvokeDidStartRequestHandling(@NonNull Request request,
																									 @Nullable Route route,
																									 @NonNull List<Throwable> throwables) {
		requireNonNull(request);
		requireNonNull(throwables);

		try {
			getLiveRocketConfig().getLifecycleObserver().didStartRequestHandling(request, route);
		} catch (Throwable throwable) {
			throwables.add(throwable);
			safelyLog(LogEvent.with(LogEventType.LIFECYCLE_OBSERVER_DID_START_REQUEST_HANDLING_FAILED,
							format("An exception occurred while invoking %s::didStartRequestHandling", LifecycleObserver.class.getSimpleName()))
					.throwable(throwable)
					.request(request)
					.build());
		}
	}

	@NonNull
	private RequestResult marshal(@NonNull Request request,
																@NonNull Response response,
																@NonNull Route route,
																@NonNull List<Throwable> throwables) {
		requireNonNull(request);
		requireNonNull(response);
		requireNonNull(route);
		requireNonNull(throwables);

		try {
			byte[] marshaledResponse = getLiveRocketConfig().getResponseMarshaler().marshal(response);

			return RequestResult.with(response.getStatus(), response.getBody(), marshaledResponse)
					.response(response)
					.route(route)
					.build();
		} catch (IllegalArgumentException e) {
			throwables.add(e);

			safelyLog(LogEvent.with(LogEventType.RESPONSE_MARSHALING_FAILED, format("Unable to marshal response for %s %s", request.getMethod(), request.getPath()))
					.throwable(e)
					.request(request)
					.build());

			return errorRequestResult(StatusCode.HTTP_500, messageFor(e), route);
		}
	}

	@NonNull
	private RequestResult errorRequestResult(@NonNull StatusCode statusCode,
																					 @NonNull String message,
																					 @Nullable Route route) {
		return errorRequestResult(getLiveRocketConfig().getResponseMarshaler(), statusCode, message, route);
	}

	@NonNull
	static RequestResult errorRequestResult(@NonNull ResponseMarshaler responseMarshaler,
																					@NonNull StatusCode statusCode,
																					@NonNull String message,
																					@Nullable Route route) {
		requireNonNull(responseMarshaler);
		requireNonNull(statusCode);
		requireNonNull(message);

		byte[] marshaledResponse = responseMarshaler.marshalError(statusCode, message);
		int headerTerminatorIndex = DefaultRequestParser.indexOfHeaderTerminator(marshaledResponse, marshaledResponse.length);
		byte[] body = headerTerminatorIndex == -1
				? Utilities.emptyByteArray()
				: Arrays.copyOfRange(marshaledResponse, headerTerminatorIndex + 4, marshaledResponse.length);

		return RequestResult.with(statusCode.getStatusLine(), body, marshaledResponse)
				.route(route)
				.build();
	}

	@NonNull
	static String messageFor(@NonNull Throwable throwable) {
		requireNonNull(throwable);

		String message = throwable.getMessage();
		return message == null ? throwable.getClass().getSimpleName() : message;
	}

	/**
	 * Runs LiveRocket with a special non-network "simulator" implementation of {@link Server} - useful for integration testing.
	 * <p>
	 * The configured server is never started.
	 *
	 * @param liveRocketConfig  configuration that drives the LiveRocket system
	 * @param simulatorConsumer code to execute within the context of the simulator
	 */
	public static void runSimulator(@NonNull LiveRocketConfig liveRocketConfig,
																	@NonNull Consumer<Simulator> simulatorConsumer) {
		requireNonNull(liveRocketConfig);
		requireNonNull(simulatorConsumer);

		LiveRocket liveRocket = LiveRocket.withConfig(liveRocketConfig);
		MockServer mockServer = new MockServer();

		mockServer.initialize(liveRocketConfig, liveRocket::handleRequest);

		Simulator simulator = new DefaultSimulator(mockServer);
		simulatorConsumer.accept(simulator);
	}

	private void safelyLog(@NonNull LogEvent logEvent) {
		requireNonNull(logEvent);

		try {
			getLiveRocketConfig().getLifecycleObserver().didReceiveLogEvent(logEvent);
		} catch (Throwable throwable) {
			// The LifecycleObserver implementation errored out, but we can't let that affect us - swallow its exception.
			// Not much else we can do here but dump to stderr
			throwable.printStackTrace(System.err);
		}
	}

	@NonNull
	public LiveRocketConfig getLiveRocketConfig() {
		return this.liveRocketConfig;
	}

	@NonNull
	protected ReentrantLock getLock() {
		return this.lock;
	}

	@NonNull
	protected AtomicReference<CountDownLatch> getAwaitShutdownLatchReference() {
		return this.awaitShutdownLatchReference;
	}

	@ThreadSafe
	static class DefaultSimulator implements Simulator {
		@NonNull
		private final MockServer server;

		public DefaultSimulator(@NonNull MockServer server) {
			requireNonNull(server);
			this.server = server;
		}

		@NonNull
		@Override
		public RequestResult performRequest(@NonNull Request request) {
			requireNonNull(request);
			return getRequestHandler().handleRequest(request);
		}

		@NonNull
		@Override
		public RequestResult performRawRequest(@NonNull byte[] requestBytes) {
			requireNonNull(requestBytes);
			return performRawRequest(requestBytes, null);
		}

		@NonNull
		@Override
		public RequestResult performRawRequest(@NonNull byte[] requestBytes,
																					 @Nullable InetSocketAddress remoteAddress) {
			requireNonNull(requestBytes);

			LiveRocketConfig liveRocketConfig = getServer().getLiveRocketConfig().orElseThrow(() ->
					new IllegalStateException("You must initialize the server prior to simulating requests"));

			Request request;

			try {
				request = liveRocketConfig.getRequestParser().parse(requestBytes, remoteAddress);
			} catch (MalformedRequestException e) {
				return errorRequestResult(liveRocketConfig.getResponseMarshaler(), StatusCode.HTTP_500, messageFor(e), null);
			}

			return getRequestHandler().handleRequest(request);
		}

		private Server.@NonNull RequestHandler getRequestHandler() {
			return getServer().getRequestHandler().orElseThrow(() ->
					new IllegalStateException("You must register a request handler prior to simulating requests"));
		}

		@NonNull
		protected MockServer getServer() {
			return this.server;
		}
	}

	/**
	 * Mock server that doesn't touch the network at all, useful for testing.
	 */
	@ThreadSafe
	static class MockServer implements Server {
		@Nullable
		private volatile LiveRocketConfig liveRocketConfig;
		private volatile Server.@Nullable RequestHandler requestHandler;

		@Override
		public void start() {
			// No-op
		}

		@Override
		public void stop() {
			// No-op
		}

		@NonNull
		@Override
		public Boolean isStarted() {
			return true;
		}

		@Override
		public void initialize(@NonNull LiveRocketConfig liveRocketConfig,
													 @NonNull RequestHandler requestHandler) {
			requireNonNull(liveRocketConfig);
			requireNonNull(requestHandler);

			this.liveRocketConfig = liveRocketConfig;
			this.requestHandler = requestHandler;
		}

		@NonNull
		protected Optional<LiveRocketConfig> getLiveRocketConfig() {
			return Optional.ofNullable(this.liveRocketConfig);
		}

		@NonNull
		protected Optional<RequestHandler> getRequestHandler() {
			return Optional.ofNullable(this.requestHandler);
		}
	}
}
