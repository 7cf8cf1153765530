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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Enumeration of the HTTP status codes that applications commonly write.
 * <p>
 * A {@link Response} status is a full status line fragment such as {@code "404 Not Found"}; use {@link #getStatusLine()}
 * to produce one from an enum value.
 * <p>
 * See <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status">https://developer.mozilla.org/en-US/docs/Web/HTTP/Status</a> for details.
 */
public enum StatusCode {
	/**
	 * The request succeeded.
	 */
	HTTP_200(200, "OK"),
	/**
	 * The request succeeded, and a new resource was created as a result.
	 */
	HTTP_201(201, "Created"),
	/**
	 * The request has been received but not yet acted upon.
	 */
	HTTP_202(202, "Accepted"),
	/**
	 * There is no content to send for this request, but the headers are useful.
	 */
	HTTP_204(204, "No Content"),
	/**
	 * The URL of the requested resource has been changed permanently.
	 */
	HTTP_301(301, "Moved Permanently"),
	/**
	 * The URI of the requested resource has been changed <em>temporarily</em>.
	 */
	HTTP_302(302, "Found"),
	/**
	 * Directs the client to get the requested resource at another URI with a {@code GET} request.
	 */
	HTTP_303(303, "See Other"),
	/**
	 * The response has not been modified, so the client can continue to use its cached version.
	 */
	HTTP_304(304, "Not Modified"),
	/**
	 * Like {@link #HTTP_302}, but the client must not change the HTTP method used.
	 */
	HTTP_307(307, "Temporary Redirect"),
	/**
	 * Like {@link #HTTP_301}, but the client must not change the HTTP method used.
	 */
	HTTP_308(308, "Permanent Redirect"),
	/**
	 * The server cannot or will not process the request due to something that is perceived to be a client error.
	 */
	HTTP_400(400, "Bad Request"),
	/**
	 * The client must authenticate itself to get the requested response.
	 */
	HTTP_401(401, "Unauthorized"),
	/**
	 * The client does not have access rights to the content.
	 */
	HTTP_403(403, "Forbidden"),
	/**
	 * The server cannot find the requested resource.
	 */
	HTTP_404(404, "Not Found"),
	/**
	 * The request method is known by the server but is not supported by the target resource.
	 */
	HTTP_405(405, "Method Not Allowed"),
	/**
	 * The request conflicts with the current state of the server.
	 */
	HTTP_409(409, "Conflict"),
	/**
	 * The request entity is larger than limits defined by the server.
	 */
	HTTP_413(413, "Content Too Large"),
	/**
	 * The media format of the requested data is not supported by the server.
	 */
	HTTP_415(415, "Unsupported Media Type"),
	/**
	 * The request was well-formed but was unable to be followed due to semantic errors.
	 */
	HTTP_422(422, "Unprocessable Content"),
	/**
	 * The server has encountered a situation it does not know how to handle.
	 */
	HTTP_500(500, "Internal Server Error"),
	/**
	 * The request method is not supported by the server and cannot be handled.
	 */
	HTTP_501(501, "Not Implemented"),
	/**
	 * The server is not ready to handle the request.
	 */
	HTTP_503(503, "Service Unavailable");

	@NonNull
	private static final Map<Integer, StatusCode> STATUS_CODES_BY_NUMBER;

	static {
		Map<Integer, StatusCode> statusCodesByNumber = new HashMap<>();

		for (StatusCode statusCode : StatusCode.values())
			statusCodesByNumber.put(statusCode.getStatusCode(), statusCode);

		STATUS_CODES_BY_NUMBER = Collections.unmodifiableMap(statusCodesByNumber);
	}

	@NonNull
	private final Integer statusCode;
	@NonNull
	private final String reasonPhrase;

	StatusCode(@NonNull Integer statusCode,
						 @NonNull String reasonPhrase) {
		requireNonNull(statusCode);
		requireNonNull(reasonPhrase);

		this.statusCode = statusCode;
		this.reasonPhrase = reasonPhrase;
	}

	/**
	 * Given an HTTP status code, return the corresponding enum value.
	 *
	 * @param statusCode the HTTP status code
	 * @return the enum value that corresponds to the provided HTTP status code, or {@link Optional#empty()} if none exists
	 */
	@NonNull
	public static Optional<StatusCode> fromStatusCode(@NonNull Integer statusCode) {
		requireNonNull(statusCode);
		return Optional.ofNullable(STATUS_CODES_BY_NUMBER.get(statusCode));
	}

	@Override
	public String toString() {
		return format("%s.%s{statusCode=%s, reasonPhrase=%s}", getClass().getSimpleName(), name(), getStatusCode(), getReasonPhrase());
	}

	/**
	 * The HTTP status code that corresponds to this enum value.
	 *
	 * @return the HTTP status code
	 */
	@NonNull
	public Integer getStatusCode() {
		return this.statusCode;
	}

	/**
	 * An English-language description for this HTTP status code.
	 * <p>
	 * For example, {@link StatusCode#HTTP_404} has reason phrase {@code Not Found}.
	 *
	 * @return English description for this HTTP status code
	 */
	@NonNull
	public String getReasonPhrase() {
		return this.reasonPhrase;
	}

	/**
	 * The status as it appears after the protocol version on an HTTP response's status line.
	 * <p>
	 * For example, {@link StatusCode#HTTP_404} has status line {@code 404 Not Found}.
	 *
	 * @return the code and reason phrase separated by a single space
	 */
	@NonNull
	public String getStatusLine() {
		return format("%d %s", getStatusCode(), getReasonPhrase());
	}
}
