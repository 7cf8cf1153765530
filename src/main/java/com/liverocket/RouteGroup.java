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

import java.util.Map;

/**
 * An application object that handles several HTTP methods for a single path.
 * <p>
 * Register via {@link RouteTable#group(RouteGroup, Middleware...)} or {@link RouteTable#group(String, RouteGroup, Middleware...)}.
 * When no path is supplied, the group is registered under {@code /} followed by its class's simple name, for example
 * {@code /UserResource}.
 * <pre>{@code public class UserResource implements RouteGroup {
 *   @Override
 *   public Map<HttpMethod, RouteHandler> getRouteHandlersByHttpMethod() {
 *     return Map.of(
 *       HttpMethod.GET, this::get,
 *       HttpMethod.POST, this::post
 *     );
 *   }
 * }}</pre>
 */
public interface RouteGroup {
	/**
	 * The handlers this group provides, keyed by the HTTP method each one serves.
	 *
	 * @return handlers by HTTP method
	 */
	@NonNull
	Map<@NonNull HttpMethod, @NonNull RouteHandler> getRouteHandlersByHttpMethod();
}
