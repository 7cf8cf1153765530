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

import com.liverocket.exception.MiddlewareConfigurationException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Defines how a LiveRocket instance is configured.
 * <p>
 * Instances can be acquired via the {@link #withServer(Server)} builder factory method. Everything other than the server
 * has a sensible default.
 * <pre>{@code RouteTable routeTable = new RouteTable();
 * routeTable.get("/hello/<name>", (request, response, pathParameters) ->
 *   response.send("Hello " + pathParameters.getString("name").get()));
 *
 * LiveRocketConfig config = LiveRocketConfig.withServer(Server.withPort(8080).build())
 *   .routeTable(routeTable)
 *   .build();}</pre>
 */
@ThreadSafe
public final class LiveRocketConfig {
	@NonNull
	private final Server server;
	@NonNull
	private final RouteTable routeTable;
	@NonNull
	private final List<@NonNull Middleware> middlewares;
	@NonNull
	private final RequestParser requestParser;
	@NonNull
	private final ResponseMarshaler responseMarshaler;
	@NonNull
	private final LifecycleObserver lifecycleObserver;
	@NonNull
	private final TemplateRenderer templateRenderer;

	/**
	 * Vends a configuration builder for the given server.
	 *
	 * @param server the server that accepts connections
	 * @return a configuration builder
	 */
	@NonNull
	public static Builder withServer(@NonNull Server server) {
		requireNonNull(server);
		return new Builder(server);
	}

	/**
	 * Vends a configuration builder for use with {@link LiveRocket#runSimulator(LiveRocketConfig, java.util.function.Consumer)},
	 * where no network server is started.
	 *
	 * @return a configuration builder
	 */
	@NonNull
	public static Builder forSimulatorTesting() {
		return withServer(Server.withPort(0).build());
	}

	protected LiveRocketConfig(@NonNull Builder builder) {
		requireNonNull(builder);

		List<Middleware> middlewares = builder.middlewares == null ? List.of() : new ArrayList<>(builder.middlewares);

		for (int i = 0; i < middlewares.size(); i++)
			if (middlewares.get(i) == null)
				throw new MiddlewareConfigurationException(format("Global middleware at index %d is null", i));

		this.server = builder.server;
		this.routeTable = builder.routeTable != null ? builder.routeTable : new RouteTable();
		this.middlewares = Collections.unmodifiableList(middlewares);
		this.requestParser = builder.requestParser != null ? builder.requestParser : RequestParser.defaultInstance();
		this.responseMarshaler = builder.responseMarshaler != null ? builder.responseMarshaler : ResponseMarshaler.defaultInstance();
		this.lifecycleObserver = builder.lifecycleObserver != null ? builder.lifecycleObserver : LifecycleObserver.defaultInstance();
		this.templateRenderer = builder.templateRenderer != null ? builder.templateRenderer : TemplateRenderer.defaultInstance();
	}

	@NonNull
	public Server getServer() {
		return this.server;
	}

	@NonNull
	public RouteTable getRouteTable() {
		return this.routeTable;
	}

	/**
	 * Middleware run for every request, in order, before route resolution.
	 *
	 * @return the global middleware
	 */
	@NonNull
	public List<@NonNull Middleware> getMiddlewares() {
		return this.middlewares;
	}

	@NonNull
	public RequestParser getRequestParser() {
		return this.requestParser;
	}

	@NonNull
	public ResponseMarshaler getResponseMarshaler() {
		return this.responseMarshaler;
	}

	@NonNull
	public LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}

	@NonNull
	public TemplateRenderer getTemplateRenderer() {
		return this.templateRenderer;
	}

	/**
	 * Builder used to construct instances of {@link LiveRocketConfig}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private Server server;
		@Nullable
		private RouteTable routeTable;
		@Nullable
		private List<Middleware> middlewares;
		@Nullable
		private RequestParser requestParser;
		@Nullable
		private ResponseMarshaler responseMarshaler;
		@Nullable
		private LifecycleObserver lifecycleObserver;
		@Nullable
		private TemplateRenderer templateRenderer;

		Builder(@NonNull Server server) {
			requireNonNull(server);
			this.server = server;
		}

		@NonNull
		public Builder server(@NonNull Server server) {
			requireNonNull(server);
			this.server = server;
			return this;
		}

		@NonNull
		public Builder routeTable(@Nullable RouteTable routeTable) {
			this.routeTable = routeTable;
			return this;
		}

		@NonNull
		public Builder middlewares(@Nullable List<Middleware> middlewares) {
			this.middlewares = middlewares;
			return this;
		}

		@NonNull
		public Builder requestParser(@Nullable RequestParser requestParser) {
			this.requestParser = requestParser;
			return this;
		}

		@NonNull
		public Builder responseMarshaler(@Nullable ResponseMarshaler responseMarshaler) {
			this.responseMarshaler = responseMarshaler;
			return this;
		}

		@NonNull
		public Builder lifecycleObserver(@Nullable LifecycleObserver lifecycleObserver) {
			this.lifecycleObserver = lifecycleObserver;
			return this;
		}

		@NonNull
		public Builder templateRenderer(@Nullable TemplateRenderer templateRenderer) {
			this.templateRenderer = templateRenderer;
			return this;
		}

		/**
		 * Builds the configuration.
		 *
		 * @return the configuration
		 * @throws MiddlewareConfigurationException if any global middleware is {@code null}
		 */
		@NonNull
		public LiveRocketConfig build() {
			return new LiveRocketConfig(this);
		}
	}
}
