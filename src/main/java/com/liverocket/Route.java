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
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A registered association of path template and HTTP method with a {@link RouteHandler} and its route-specific middleware.
 * <p>
 * Instances are normally created by {@link RouteTable}; they can also be built directly via {@link #with(HttpMethod, String, RouteHandler)}.
 */
@ThreadSafe
public final class Route {
	@NonNull
	private final HttpMethod httpMethod;
	@NonNull
	private final String path;
	@NonNull
	private final RouteHandler routeHandler;
	@NonNull
	private final List<@NonNull Middleware> middlewares;
	@Nullable
	private final RoutePattern routePattern;

	/**
	 * Acquires a builder for {@link Route} instances.
	 *
	 * @param httpMethod   the HTTP method this route serves
	 * @param path         the path template, which may contain placeholders
	 * @param routeHandler the handler for this route
	 * @return the builder
	 */
	@NonNull
	public static Builder with(@NonNull HttpMethod httpMethod,
														 @NonNull String path,
														 @NonNull RouteHandler routeHandler) {
		requireNonNull(httpMethod);
		requireNonNull(path);
		requireNonNull(routeHandler);

		return new Builder(httpMethod, path, routeHandler);
	}

	protected Route(@NonNull Builder builder) {
		requireNonNull(builder);

		List<Middleware> middlewares = builder.middlewares == null ? List.of() : new ArrayList<>(builder.middlewares);

		for (int i = 0; i < middlewares.size(); i++)
			if (middlewares.get(i) == null)
				throw new MiddlewareConfigurationException(format("Middleware at index %d for %s %s is null", i, builder.httpMethod.name(), builder.path));

		this.httpMethod = builder.httpMethod;
		this.path = builder.path;
		this.routeHandler = builder.routeHandler;
		this.middlewares = Collections.unmodifiableList(middlewares);
		this.routePattern = RoutePattern.hasPlaceholders(builder.path) ? RoutePattern.compile(builder.path) : null;
	}

	@Override
	public String toString() {
		return format("%s{httpMethod=%s, path=%s, middlewares=%d}", getClass().getSimpleName(), getHttpMethod().name(), getPath(), getMiddlewares().size());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Route route))
			return false;

		return Objects.equals(getHttpMethod(), route.getHttpMethod())
				&& Objects.equals(getPath(), route.getPath())
				&& Objects.equals(getRouteHandler(), route.getRouteHandler())
				&& Objects.equals(getMiddlewares(), route.getMiddlewares());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getHttpMethod(), getPath(), getRouteHandler(), getMiddlewares());
	}

	@NonNull
	public HttpMethod getHttpMethod() {
		return this.httpMethod;
	}

	/**
	 * The path template as registered, for example {@code /users/<int:userId>}.
	 *
	 * @return the path template
	 */
	@NonNull
	public String getPath() {
		return this.path;
	}

	@NonNull
	public RouteHandler getRouteHandler() {
		return this.routeHandler;
	}

	/**
	 * Middleware that runs for this route only, in order, after any global middleware.
	 *
	 * @return the route's middleware
	 */
	@NonNull
	public List<@NonNull Middleware> getMiddlewares() {
		return this.middlewares;
	}

	/**
	 * The compiled template, present only when the path contains placeholders.
	 *
	 * @return the compiled template, or {@link Optional#empty()} for exact-match routes
	 */
	@NonNull
	public Optional<RoutePattern> getRoutePattern() {
		return Optional.ofNullable(this.routePattern);
	}

	/**
	 * Builder used to construct instances of {@link Route} via {@link Route#with(HttpMethod, String, RouteHandler)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final HttpMethod httpMethod;
		@NonNull
		private final String path;
		@NonNull
		private final RouteHandler routeHandler;
		@Nullable
		private List<Middleware> middlewares;

		protected Builder(@NonNull HttpMethod httpMethod,
											@NonNull String path,
											@NonNull RouteHandler routeHandler) {
			requireNonNull(httpMethod);
			requireNonNull(path);
			requireNonNull(routeHandler);

			this.httpMethod = httpMethod;
			this.path = path;
			this.routeHandler = routeHandler;
		}

		@NonNull
		public Builder middlewares(@Nullable List<Middleware> middlewares) {
			this.middlewares = middlewares;
			return this;
		}

		/**
		 * Builds the route.
		 *
		 * @return the route
		 * @throws MiddlewareConfigurationException if any middleware is {@code null}
		 * @throws IllegalArgumentException         if the path template repeats a placeholder name
		 */
		@NonNull
		public Route build() {
			return new Route(this);
		}
	}
}
