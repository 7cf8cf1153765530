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

/**
 * A step run before a request reaches its {@link RouteHandler}.
 * <p>
 * Global middleware (registered via {@link LiveRocketConfig.Builder#middlewares(java.util.List)}) runs for every request,
 * before route resolution. Route middleware runs only for its route, after resolution. Both run in registration order.
 * <p>
 * Middleware may annotate the request via {@link Request#setAttribute(String, Object)}. Throwing aborts the request with a
 * {@code 500 Internal Server Error} response.
 */
@FunctionalInterface
public interface Middleware {
	void process(@NonNull Request request) throws Exception;
}
