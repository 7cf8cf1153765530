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
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The outcome of handling one request: the exact bytes to write to the client, plus the pieces that produced them.
 * <p>
 * Instances are produced by {@link LiveRocket} for each request and are returned directly by {@link LiveRocket.Simulator},
 * which makes them the natural thing to assert against in tests.
 */
@ThreadSafe
public final class RequestResult {
	@NonNull
	private final String status;
	@NonNull
	private final byte[] body;
	@NonNull
	private final byte[] marshaledResponse;
	@Nullable
	private final Response response;
	@Nullable
	private final Route route;

	/**
	 * Acquires a builder for {@link RequestResult} instances.
	 *
	 * @param status            the status as written on the status line, for example {@code 404 Not Found}
	 * @param body              the body as written
	 * @param marshaledResponse the complete response bytes
	 * @return the builder
	 */
	@NonNull
	public static Builder with(@NonNull String status,
														 @NonNull byte[] body,
														 @NonNull byte[] marshaledResponse) {
		requireNonNull(status);
		requireNonNull(body);
		requireNonNull(marshaledResponse);

		return new Builder(status, body, marshaledResponse);
	}

	protected RequestResult(@NonNull Builder builder) {
		requireNonNull(builder);

		this.status = builder.status;
		this.body = builder.body.clone();
		this.marshaledResponse = builder.marshaledResponse.clone();
		this.response = builder.response;
		this.route = builder.route;
	}

	@Override
	public String toString() {
		return format("%s{status=%s, route=%s, marshaledResponseLength=%d}", getClass().getSimpleName(), getStatus(),
				getRoute().orElse(null), this.marshaledResponse.length);
	}

	@NonNull
	public String getStatus() {
		return this.status;
	}

	/**
	 * The numeric part of {@link #getStatus()}.
	 *
	 * @return the status code, or {@link Optional#empty()} if the status does not start with a number
	 */
	@NonNull
	public Optional<Integer> getStatusCode() {
		String status = getStatus().trim();
		int indexOfSpace = status.indexOf(' ');
		String code = indexOfSpace == -1 ? status : status.substring(0, indexOfSpace);

		try {
			return Optional.of(Integer.valueOf(code));
		} catch (NumberFormatException e) {
			return Optional.empty();
		}
	}

	@NonNull
	public byte[] getBody() {
		return this.body.clone();
	}

	@NonNull
	public String getBodyAsString() {
		return new String(this.body, StandardCharsets.UTF_8);
	}

	/**
	 * The complete response bytes - status line, headers, blank line and body - exactly as written to the client.
	 *
	 * @return the marshaled response
	 */
	@NonNull
	public byte[] getMarshaledResponse() {
		return this.marshaledResponse.clone();
	}

	/**
	 * The handler's response, absent when a framework-generated error response was written instead.
	 *
	 * @return the response, or {@link Optional#empty()}
	 */
	@NonNull
	public Optional<Response> getResponse() {
		return Optional.ofNullable(this.response);
	}

	/**
	 * The route that handled the request, absent when no route matched or the request never reached routing.
	 *
	 * @return the route, or {@link Optional#empty()}
	 */
	@NonNull
	public Optional<Route> getRoute() {
		return Optional.ofNullable(this.route);
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof RequestResult requestResult))
			return false;

		return Arrays.equals(this.marshaledResponse, requestResult.marshaledResponse);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(this.marshaledResponse);
	}

	/**
	 * Builder used to construct instances of {@link RequestResult} via {@link RequestResult#with(String, byte[], byte[])}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final String status;
		@NonNull
		private final byte[] body;
		@NonNull
		private final byte[] marshaledResponse;
		@Nullable
		private Response response;
		@Nullable
		private Route route;

		protected Builder(@NonNull String status,
											@NonNull byte[] body,
											@NonNull byte[] marshaledResponse) {
			this.status = status;
			this.body = body;
			this.marshaledResponse = marshaledResponse;
		}

		@NonNull
		public Builder response(@Nullable Response response) {
			this.response = response;
			return this;
		}

		@NonNull
		public Builder route(@Nullable Route route) {
			this.route = route;
			return this;
		}

		@NonNull
		public RequestResult build() {
			return new RequestResult(this);
		}
	}
}
