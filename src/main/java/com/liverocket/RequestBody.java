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
import org.json.JSONArray;
import org.json.JSONObject;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The interpreted body of a {@link Request}.
 * <p>
 * Interpretation depends on the request's {@code Content-Type}:
 * <ul>
 *   <li>{@code application/x-www-form-urlencoded} produces {@link Type#FORM} parameters</li>
 *   <li>{@code application/json} produces a {@link Type#JSON} value ({@link JSONObject}, {@link JSONArray} or a scalar)</li>
 *   <li>anything else produces {@link Type#RAW} bytes</li>
 * </ul>
 * Requests without a body have {@link Type#NONE}. The bytes as received are always available via {@link #getBytes()}.
 */
@ThreadSafe
public final class RequestBody {
	@NonNull
	private static final RequestBody EMPTY_INSTANCE;

	static {
		EMPTY_INSTANCE = new RequestBody(Type.NONE, Utilities.emptyByteArray(), null, null);
	}

	/**
	 * How a request body was interpreted.
	 */
	public enum Type {
		NONE,
		FORM,
		JSON,
		RAW
	}

	@NonNull
	private final Type type;
	@NonNull
	private final byte[] bytes;
	@Nullable
	private final Map<@NonNull String, @NonNull Object> formParameters;
	@Nullable
	private final Object json;

	@NonNull
	public static RequestBody empty() {
		return EMPTY_INSTANCE;
	}

	/**
	 * A form body. Each value is a {@link String}, or a {@link java.util.List} of strings for repeated names.
	 *
	 * @param formParameters decoded form parameters
	 * @param bytes          the body as received
	 * @return the body
	 */
	@NonNull
	public static RequestBody ofFormParameters(@NonNull Map<@NonNull String, @NonNull Object> formParameters,
																						 @NonNull byte[] bytes) {
		requireNonNull(formParameters);
		requireNonNull(bytes);

		return new RequestBody(Type.FORM, bytes, Collections.unmodifiableMap(new LinkedHashMap<>(formParameters)), null);
	}

	/**
	 * A JSON body.
	 *
	 * @param json  the parsed value, for example a {@link JSONObject}
	 * @param bytes the body as received
	 * @return the body
	 */
	@NonNull
	public static RequestBody ofJson(@NonNull Object json,
																	 @NonNull byte[] bytes) {
		requireNonNull(json);
		requireNonNull(bytes);

		return new RequestBody(Type.JSON, bytes, null, json);
	}

	@NonNull
	public static RequestBody ofBytes(@NonNull byte[] bytes) {
		requireNonNull(bytes);

		if (bytes.length == 0)
			return empty();

		return new RequestBody(Type.RAW, bytes, null, null);
	}

	private RequestBody(@NonNull Type type,
											@NonNull byte[] bytes,
											@Nullable Map<@NonNull String, @NonNull Object> formParameters,
											@Nullable Object json) {
		this.type = type;
		this.bytes = bytes;
		this.formParameters = formParameters;
		this.json = json;
	}

	@Override
	public String toString() {
		return format("%s{type=%s, length=%d}", getClass().getSimpleName(), getType().name(), this.bytes.length);
	}

	@NonNull
	public Type getType() {
		return this.type;
	}

	/**
	 * The body bytes as received. Returns a copy.
	 *
	 * @return the body bytes, zero-length if there was no body
	 */
	@NonNull
	public byte[] getBytes() {
		return this.bytes.clone();
	}

	/**
	 * The body decoded as UTF-8 text.
	 *
	 * @return the body text, empty if there was no body
	 */
	@NonNull
	public String getBytesAsString() {
		return new String(this.bytes, StandardCharsets.UTF_8);
	}

	@NonNull
	public Optional<Map<@NonNull String, @NonNull Object>> getFormParameters() {
		return Optional.ofNullable(this.formParameters);
	}

	/**
	 * The parsed JSON value for {@link Type#JSON} bodies.
	 *
	 * @return the JSON value, or {@link Optional#empty()} for other body types
	 */
	@NonNull
	public Optional<Object> getJson() {
		return Optional.ofNullable(this.json);
	}

	/**
	 * Convenience accessor for JSON bodies whose top-level value is an object.
	 *
	 * @return the JSON object, or {@link Optional#empty()} if the body is not a JSON object
	 */
	@NonNull
	public Optional<JSONObject> getJsonObject() {
		return getJson().filter(json -> json instanceof JSONObject).map(json -> (JSONObject) json);
	}
}
