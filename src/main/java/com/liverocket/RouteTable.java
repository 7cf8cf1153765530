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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Resolves a request path and HTTP method to a {@link Route}.
 * <p>
 * Paths without placeholders are indexed for exact lookup, and registering the same path and method again replaces
 * the earlier route. Paths with placeholders are kept in registration order and consulted only when no exact route
 * matches; the first pattern route whose method and template both match wins.
 * <p>
 * Routes are normally registered during startup. Resolution reads concurrent collections without locking, so it is
 * safe to call from any number of request-handling threads.
 */
@ThreadSafe
public final class RouteTable {
	@NonNull
	private final Map<@NonNull String, @NonNull Map<@NonNull HttpMethod, @NonNull Route>> exactRoutesByPath;
	@NonNull
	private final List<@NonNull Route> patternRoutes;
	// Keyed by RouteHandler or RouteGroup class
	@NonNull
	private final Map<@NonNull Object, @NonNull String> pathsByRouteTarget;

	public RouteTable() {
		this.exactRoutesByPath = new ConcurrentHashMap<>();
		this.patternRoutes = new CopyOnWriteArrayList<>();
		this.pathsByRouteTarget = new ConcurrentHashMap<>();
	}

	/**
	 * Registers a route.
	 *
	 * @param path         the path template, for example {@code /users/<int:userId>}
	 * @param httpMethod   the HTTP method the route serves
	 * @param routeHandler the handler to invoke
	 * @param middlewares  middleware to run for this route only, in order; may be {@code null} for none
	 * @return the registered route
	 * @throws com.liverocket.exception.MiddlewareConfigurationException if any middleware is {@code null}
	 * @throws IllegalArgumentException                                  if the template repeats a placeholder name
	 */
	@NonNull
	public Route register(@NonNull String path,
												@NonNull HttpMethod httpMethod,
												@NonNull RouteHandler routeHandler,
												@Nullable List<Middleware> middlewares) {
		requireNonNull(path);
		requireNonNull(httpMethod);
		requireNonNull(routeHandler);

		Route route = Route.with(httpMethod, path, routeHandler)
				.middlewares(middlewares)
				.build();

		if (route.getRoutePattern().isPresent())
			getPatternRoutes().add(route);
		else
			getExactRoutesByPath().computeIfAbsent(path, (ignored) -> new ConcurrentHashMap<>()).put(httpMethod, route);

		getPathsByRouteTarget().put(routeHandler, path);

		return route;
	}

	@NonNull
	public Route get(@NonNull String path,
									 @NonNull RouteHandler routeHandler,
									 @Nullable Middleware... middlewares) {
		return register(path, HttpMethod.GET, routeHandler, middlewaresAsList(middlewares));
	}

	@NonNull
	public Route post(@NonNull String path,
										@NonNull RouteHandler routeHandler,
										@Nullable Middleware... middlewares) {
		return register(path, HttpMethod.POST, routeHandler, middlewaresAsList(middlewares));
	}

	@NonNull
	public Route put(@NonNull String path,
									 @NonNull RouteHandler routeHandler,
									 @Nullable Middleware... middlewares) {
		return register(path, HttpMethod.PUT, routeHandler, middlewaresAsList(middlewares));
	}

	@NonNull
	public Route delete(@NonNull String path,
											@NonNull RouteHandler routeHandler,
											@Nullable Middleware... middlewares) {
		return register(path, HttpMethod.DELETE, routeHandler, middlewaresAsList(middlewares));
	}

	@NonNull
	public Route patch(@NonNull String path,
										 @NonNull RouteHandler routeHandler,
										 @Nullable Middleware... middlewares) {
		return register(path, HttpMethod.PATCH, routeHandler, middlewaresAsList(middlewares));
	}

	/**
	 * Registers each handler of a {@link RouteGroup} under {@code /} followed by the group's simple class name.
	 *
	 * @param routeGroup  the group to register
	 * @param middlewares middleware shared by every route in the group
	 * @return the registered routes
	 */
	@NonNull
	public List<@NonNull Route> group(@NonNull RouteGroup routeGroup,
																		@Nullable Middleware... middlewares) {
		requireNonNull(routeGroup);
		return group(defaultPathForRouteGroup(routeGroup), routeGroup, middlewares);
	}

	/**
	 * Registers each handler of a {@link RouteGroup} under a single path.
	 *
	 * @param path        the path template shared by the group's routes
	 * @param routeGroup  the group to register
	 * @param middlewares middleware shared by every route in the group
	 * @return the registered routes
	 */
	@NonNull
	public List<@NonNull Route> group(@NonNull String path,
																		@NonNull RouteGroup routeGroup,
																		@Nullable Middleware... middlewares) {
		requireNonNull(path);
		requireNonNull(routeGroup);

		Map<HttpMethod, RouteHandler> routeHandlersByHttpMethod = routeGroup.getRouteHandlersByHttpMethod();

		if (routeHandlersByHttpMethod == null)
			throw new IllegalArgumentException(format("%s returned no route handlers", routeGroup.getClass().getName()));

		List<Middleware> middlewaresAsList = middlewaresAsList(middlewares);
		List<Route> routes = new ArrayList<>(routeHandlersByHttpMethod.size());

		// Register in enum order so the outcome doesn't depend on the group's map implementation
		for (HttpMethod httpMethod : HttpMethod.values()) {
			RouteHandler routeHandler = routeHandlersByHttpMethod.get(httpMethod);

			if (routeHandler != null)
				routes.add(register(path, httpMethod, routeHandler, middlewaresAsList));
		}

		getPathsByRouteTarget().put(routeGroup.getClass(), path);

		return Collections.unmodifiableList(routes);
	}

	/**
	 * Resolves a decoded request path and method to a route.
	 *
	 * @param path       the decoded request path, without query string
	 * @param httpMethod the request's HTTP method
	 * @return the matching route and its extracted path parameters, or {@link Optional#empty()} if nothing matches
	 */
	@NonNull
	public Optional<RouteMatch> resolve(@NonNull String path,
																			@NonNull HttpMethod httpMethod) {
		requireNonNull(path);
		requireNonNull(httpMethod);

		Map<HttpMethod, Route> exactRoutesByHttpMethod = getExactRoutesByPath().get(path);

		if (exactRoutesByHttpMethod != null) {
			Route route = exactRoutesByHttpMethod.get(httpMethod);

			if (route != null)
				return Optional.of(RouteMatch.of(route, PathParameters.empty()));
		}

		for (Route route : getPatternRoutes()) {
			if (route.getHttpMethod() != httpMethod)
				continue;

			RoutePattern routePattern = route.getRoutePattern().get();
			Optional<PathParameters> pathParameters = routePattern.match(path);

			if (pathParameters.isPresent())
				return Optional.of(RouteMatch.of(route, pathParameters.get()));
		}

		return Optional.empty();
	}

	/**
	 * Builds a path for a registered handler by substituting values into its template.
	 * <p>
	 * If the same handler was registered more than once, the most recent registration's template is used.
	 *
	 * @param routeHandler         a handler previously registered with this table
	 * @param pathParameterValues values keyed by placeholder name
	 * @return the expanded path
	 * @throws IllegalArgumentException if the handler was never registered
	 */
	@NonNull
	public String urlFor(@NonNull RouteHandler routeHandler,
											 @NonNull Map<@NonNull String, ?> pathParameterValues) {
		requireNonNull(routeHandler);
		requireNonNull(pathParameterValues);

		return urlForRouteTarget(routeHandler, pathParameterValues);
	}

	/**
	 * Builds a path for a registered {@link RouteGroup} type by substituting values into its template.
	 *
	 * @param routeGroupClass     the class of a group previously registered with this table
	 * @param pathParameterValues values keyed by placeholder name
	 * @return the expanded path
	 * @throws IllegalArgumentException if no group of that class was registered
	 */
	@NonNull
	public String urlFor(@NonNull Class<? extends RouteGroup> routeGroupClass,
											 @NonNull Map<@NonNull String, ?> pathParameterValues) {
		requireNonNull(routeGroupClass);
		requireNonNull(pathParameterValues);

		return urlForRouteTarget(routeGroupClass, pathParameterValues);
	}

	/**
	 * Every registered route: exact routes first, then pattern routes in registration order.
	 *
	 * @return a snapshot of the registered routes
	 */
	@NonNull
	public List<@NonNull Route> getRoutes() {
		List<Route> routes = new ArrayList<>();

		for (Map<HttpMethod, Route> exactRoutesByHttpMethod : getExactRoutesByPath().values())
			routes.addAll(exactRoutesByHttpMethod.values());

		routes.addAll(getPatternRoutes());

		return Collections.unmodifiableList(routes);
	}

	@Override
	public String toString() {
		return format("%s{exactPaths=%s, patternRoutes=%s}", getClass().getSimpleName(), getExactRoutesByPath().keySet(), getPatternRoutes());
	}

	@NonNull
	private String urlForRouteTarget(@NonNull Object routeTarget,
																	 @NonNull Map<@NonNull String, ?> pathParameterValues) {
		requireNonNull(routeTarget);
		requireNonNull(pathParameterValues);

		String path = getPathsByRouteTarget().get(routeTarget);

		if (path == null)
			throw new IllegalArgumentException(format("No route found for %s", routeTarget));

		return RoutePattern.compile(path).expand(pathParameterValues);
	}

	@NonNull
	static String defaultPathForRouteGroup(@NonNull RouteGroup routeGroup) {
		requireNonNull(routeGroup);
		return "/" + routeGroup.getClass().getSimpleName();
	}

	@NonNull
	private static List<Middleware> middlewaresAsList(@Nullable Middleware[] middlewares) {
		if (middlewares == null)
			return List.of();

		// Arrays.asList tolerates null elements so Route can report them
		return Arrays.asList(middlewares);
	}

	@NonNull
	private Map<@NonNull String, @NonNull Map<@NonNull HttpMethod, @NonNull Route>> getExactRoutesByPath() {
		return this.exactRoutesByPath;
	}

	@NonNull
	private List<@NonNull Route> getPatternRoutes() {
		return this.patternRoutes;
	}

	@NonNull
	private Map<@NonNull Object, @NonNull String> getPathsByRouteTarget() {
		return this.pathsByRouteTarget;
	}
}
