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

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.net.InetSocketAddress;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Encapsulates information specified in an HTTP request.
 * <p>
 * Requests read from the network are built by {@link RequestParser}. Instances can also be built directly via
 * {@link #with(String, String)} or {@link #with(HttpMethod, String)}, which is useful with {@link LiveRocket.Simulator}.
 * <p>
 * Header names are normalized to upper case with {@code -} replaced by {@code _}, so {@code Content-Type} is stored as
 * {@code CONTENT_TYPE}. {@link #getHeader(String)} applies the same normalization to its argument, so either form may be used
 * for lookups.
 * <p>
 * A request is read-only, except for its attributes, which middleware may use to pass data along to handlers.
 */
@ThreadSafe
public final class Request {
	@NonNull
	private final String method;
	@Nullable
	private final HttpMethod httpMethod;
	@NonNull
	private final String path;
	@Nullable
	private final String rawQuery;
	@NonNull
	private final Map<@NonNull String, @NonNull String> queryParameters;
	@NonNull
	private final Map<@NonNull String, @NonNull String> headers;
	@NonNull
	private final String protocol;
	@Nullable
	private final InetSocketAddress remoteAddress;
	@NonNull
	private final RequestBody body;
	@NonNull
	private final Map<@NonNull String, @NonNull Object> attributes;

	/**
	 * Acquires a builder for {@link Request} instances.
	 *
	 * @param method the method token from the request line, which need not be a supported {@link HttpMethod}
	 * @param path   the decoded request path, without query string
	 * @return the builder
	 */
	@NonNull
	public static Builder with(@NonNull String method,
														 @NonNull String path) {
		requireNonNull(method);
		requireNonNull(path);

		return new Builder(method, path);
	}

	/**
	 * Acquires a builder for {@link Request} instances.
	 *
	 * @param httpMethod the HTTP method
	 * @param path       the decoded request path, without query string
	 * @return the builder
	 */
	@NonNull
	public static Builder with(@NonNull HttpMethod httpMethod,
														 @NonNull String path) {
		requireNonNull(httpMethod);
		requireNonNull(path);

		return new Builder(httpMethod.name(), path);
	}

	protected Request(@NonNull Builder builder) {
		requireNonNull(builder);

		this.method = builder.method;
		this.httpMethod = HttpMethod.fromMethodToken(builder.method).orElse(null);
		this.path = builder.path;
		this.rawQuery = builder.rawQuery;
		this.queryParameters = builder.queryParameters == null ? Map.of()
				: Collections.unmodifiableMap(new LinkedHashMap<>(builder.queryParameters));

		Map<String, String> headers = new LinkedHashMap<>();

		if (builder.headers != null)
			for (Entry<String, String> entry : builder.headers.entrySet())
				headers.put(Utilities.normalizeHeaderName(entry.getKey()), entry.getValue());

		this.headers = Collections.unmodifiableMap(headers);
		this.protocol = builder.protocol == null ? "HTTP/1.1" : builder.protocol;
		this.remoteAddress = builder.remoteAddress;
		this.body = builder.body == null ? RequestBody.empty() : builder.body;
		this.attributes = new ConcurrentHashMap<>();
	}

	@Override
	public String toString() {
		return format("%s{method=%s, path=%s, rawQuery=%s}", getClass().getSimpleName(), getMethod(), getPath(), getRawQuery().orElse(null));
	}

	/**
	 * The method token exactly as it appeared on the request line, for example {@code GET}.
	 *
	 * @return the method token
	 */
	@NonNull
	public String getMethod() {
		return this.method;
	}

	/**
	 * The request's method, if it is one routes may be registered for.
	 *
	 * @return the HTTP method, or {@link Optional#empty()} for unsupported method tokens
	 */
	@NonNull
	public Optional<HttpMethod> getHttpMethod() {
		return Optional.ofNullable(this.httpMethod);
	}

	/**
	 * The percent-decoded request path, for example {@code /hello world}.
	 *
	 * @return the request path
	 */
	@NonNull
	public String getPath() {
		return this.path;
	}

	/**
	 * The query string as received, without the leading {@code ?}.
	 *
	 * @return the raw query string, or {@link Optional#empty()} if the request target had none
	 */
	@NonNull
	public Optional<String> getRawQuery() {
		return Optional.ofNullable(this.rawQuery);
	}

	@NonNull
	public Map<@NonNull String, @NonNull String> getQueryParameters() {
		return this.queryParameters;
	}

	@NonNull
	public Optional<String> getQueryParameter(@Nullable String name) {
		if (name == null)
			return Optional.empty();

		return Optional.ofNullable(getQueryParameters().get(name));
	}

	/**
	 * All request headers keyed by normalized name, for example {@code CONTENT_TYPE}.
	 *
	 * @return the request headers
	 */
	@NonNull
	public Map<@NonNull String, @NonNull String> getHeaders() {
		return this.headers;
	}

	/**
	 * Looks up a request header. The name is normalized before lookup, so {@code "Content-Type"},
	 * {@code "content-type"} and {@code "CONTENT_TYPE"} are equivalent.
	 *
	 * @param name the header name
	 * @return the header value, or {@link Optional#empty()} if not present
	 */
	@NonNull
	public Optional<String> getHeader(@Nullable String name) {
		if (name == null)
			return Optional.empty();

		return Optional.ofNullable(getHeaders().get(Utilities.normalizeHeaderName(name)));
	}

	/**
	 * The media type from the {@code Content-Type} header, lower-cased and without parameters.
	 *
	 * @return the media type, or {@link Optional#empty()} if none was specified
	 */
	@NonNull
	public Optional<String> getContentType() {
		return getHeader("CONTENT_TYPE").flatMap(Utilities::extractContentTypeFromHeaderValue);
	}

	/**
	 * The protocol from the request line, for example {@code HTTP/1.1}.
	 *
	 * @return the protocol
	 */
	@NonNull
	public String getProtocol() {
		return this.protocol;
	}

	@NonNull
	public Optional<InetSocketAddress> getRemoteAddress() {
		return Optional.ofNullable(this.remoteAddress);
	}

	@NonNull
	public RequestBody getBody() {
		return this.body;
	}

	/**
	 * Looks up a form parameter from an {@code application/x-www-form-urlencoded} body.
	 *
	 * @param name the parameter name
	 * @return a {@link String}, or a {@link java.util.List} of strings for repeated names; {@link Optional#empty()} if absent or the body is not a form
	 */
	@NonNull
	public Optional<Object> getFormParameter(@Nullable String name) {
		if (name == null)
			return Optional.empty();

		return getBody().getFormParameters().map(formParameters -> formParameters.get(name));
	}

	@NonNull
	public Optional<Object> getAttribute(@Nullable String name) {
		if (name == null)
			return Optional.empty();

		return Optional.ofNullable(this.attributes.get(name));
	}

	/**
	 * Associates a value with this request, typically from a {@link Middleware} for a later handler to read.
	 * A {@code null} value removes the attribute.
	 *
	 * @param name  the attribute name
	 * @param value the attribute value, or {@code null} to remove
	 */
	public void setAttribute(@NonNull String name,
													 @Nullable Object value) {
		requireNonNull(name);

		if (value == null)
			this.attributes.remove(name);
		else
			this.attributes.put(name, value);
	}

	@NonNull
	public Map<@NonNull String, @NonNull Object> getAttributes() {
		return Collections.unmodifiableMap(this.attributes);
	}

	/**
	 * Builder used to construct instances of {@link Request} via {@link Request#with(String, String)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final String method;
		@NonNull
		private final String path;
		@Nullable
		private String rawQuery;
		@Nullable
		private Map<String, String> queryParameters;
		@Nullable
		private Map<String, String> headers;
		@Nullable
		private String protocol;
		@Nullable
		private InetSocketAddress remoteAddress;
		@Nullable
		private RequestBody body;

		protected Builder(@NonNull String method,
											@NonNull String path) {
			requireNonNull(method);
			requireNonNull(path);

			this.method = method;
			this.path = path;
		}

		@NonNull
		public Builder rawQuery(@Nullable String rawQuery) {
			this.rawQuery = rawQuery;
			return this;
		}

		@NonNull
		public Builder queryParameters(@Nullable Map<String, String> queryParameters) {
			this.queryParameters = queryParameters;
			return this;
		}

		@NonNull
		public Builder headers(@Nullable Map<String, String> headers) {
			this.headers = headers;
			return this;
		}

		@NonNull
		public Builder protocol(@Nullable String protocol) {
			this.protocol = protocol;
			return this;
		}

		@NonNull
		public Builder remoteAddress(@Nullable InetSocketAddress remoteAddress) {
			this.remoteAddress = remoteAddress;
			return this;
		}

		@NonNull
		public Builder body(@Nullable RequestBody body) {
			this.body = body;
			return this;
		}

		@NonNull
		public Request build() {
			return new Request(this);
		}
	}
}
