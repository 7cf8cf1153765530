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
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The outcome of resolving a request path and method against a {@link RouteTable}.
 */
@ThreadSafe
public final class RouteMatch {
	@NonNull
	private final Route route;
	@NonNull
	private final PathParameters pathParameters;

	@NonNull
	public static RouteMatch of(@NonNull Route route,
															@NonNull PathParameters pathParameters) {
		requireNonNull(route);
		requireNonNull(pathParameters);

		return new RouteMatch(route, pathParameters);
	}

	private RouteMatch(@NonNull Route route,
										 @NonNull PathParameters pathParameters) {
		this.route = route;
		this.pathParameters = pathParameters;
	}

	@Override
	public String toString() {
		return format("%s{route=%s, pathParameters=%s}", getClass().getSimpleName(), getRoute(), getPathParameters());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof RouteMatch routeMatch))
			return false;

		return Objects.equals(getRoute(), routeMatch.getRoute())
				&& Objects.equals(getPathParameters(), routeMatch.getPathParameters());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getRoute(), getPathParameters());
	}

	@NonNull
	public Route getRoute() {
		return this.route;
	}

	@NonNull
	public PathParameters getPathParameters() {
		return this.pathParameters;
	}
}
