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
 * Application code that services requests for a registered route.
 * <p>
 * Handlers write their result into the supplied {@link Response}. Any exception thrown is converted by
 * {@link LiveRocket} into a {@code 500 Internal Server Error} response that includes the exception's message.
 */
@FunctionalInterface
public interface RouteHandler {
	/**
	 * Services a request.
	 *
	 * @param request        the parsed request
	 * @param response       a fresh response, initially {@code 200 OK} with {@code Content-Type: text/plain}
	 * @param pathParameters typed values extracted from the request path, empty for routes without placeholders
	 * @throws Exception if the request could not be serviced
	 */
	void handleRequest(@NonNull Request request,
										 @NonNull Response response,
										 @NonNull PathParameters pathParameters) throws Exception;
}
