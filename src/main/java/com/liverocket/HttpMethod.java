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

import java.util.Optional;

/**
 * Typesafe representation of the <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Methods">HTTP request methods</a> that routes may be registered for.
 * <p>
 * Requests that arrive with any other method token are still parsed, but never resolve to a route.
 */
public enum HttpMethod {
	/**
	 * The HTTP <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Methods/GET">{@code GET}</a> request method.
	 */
	GET,
	/**
	 * The HTTP <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Methods/POST">{@code POST}</a> request method.
	 */
	POST,
	/**
	 * The HTTP <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Methods/PUT">{@code PUT}</a> request method.
	 */
	PUT,
	/**
	 * The HTTP <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Methods/DELETE">{@code DELETE}</a> request method.
	 */
	DELETE,
	/**
	 * The HTTP <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Methods/PATCH">{@code PATCH}</a> request method.
	 */
	PATCH;

	/**
	 * Maps a method token from an HTTP request line to its {@link HttpMethod}, if supported.
	 * <p>
	 * Method tokens are case-sensitive per RFC 9110, so {@code get} does not map to {@link #GET}.
	 *
	 * @param methodToken the method token, e.g. {@code "GET"}
	 * @return the corresponding method, or {@link Optional#empty()} if the token is not a supported method
	 */
	@NonNull
	public static Optional<HttpMethod> fromMethodToken(@Nullable String methodToken) {
		if (methodToken == null)
			return Optional.empty();

		for (HttpMethod httpMethod : values())
			if (httpMethod.name().equals(methodToken))
				return Optional.of(httpMethod);

		return Optional.empty();
	}
}
