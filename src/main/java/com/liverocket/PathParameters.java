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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Typed values extracted from a request path by a {@link RoutePattern}, keyed by placeholder name in template order.
 * <p>
 * Values are {@link String}, {@link Long} or {@link Double} depending on each placeholder's {@link PathParameterType}.
 */
@ThreadSafe
public final class PathParameters {
	@NonNull
	private static final PathParameters EMPTY_INSTANCE;

	static {
		EMPTY_INSTANCE = new PathParameters(Map.of());
	}

	@NonNull
	private final Map<@NonNull String, @NonNull Object> valuesByName;

	/**
	 * Vends an instance with no parameters, used for routes whose templates have no placeholders.
	 *
	 * @return an empty instance
	 */
	@NonNull
	public static PathParameters empty() {
		return EMPTY_INSTANCE;
	}

	/**
	 * Vends an instance backed by a copy of the given values.
	 *
	 * @param valuesByName parameter values keyed by name; iteration order is preserved
	 * @return an instance holding the values
	 */
	@NonNull
	public static PathParameters withValues(@NonNull Map<@NonNull String, @NonNull Object> valuesByName) {
		requireNonNull(valuesByName);

		if (valuesByName.isEmpty())
			return empty();

		return new PathParameters(valuesByName);
	}

	private PathParameters(@NonNull Map<@NonNull String, @NonNull Object> valuesByName) {
		requireNonNull(valuesByName);
		this.valuesByName = Collections.unmodifiableMap(new LinkedHashMap<>(valuesByName));
	}

	@NonNull
	public Optional<Object> get(@Nullable String name) {
		if (name == null)
			return Optional.empty();

		return Optional.ofNullable(this.valuesByName.get(name));
	}

	/**
	 * The value of the named parameter in its textual form, regardless of its declared type.
	 *
	 * @param name the placeholder name
	 * @return the value as a string, or {@link Optional#empty()} if there is no such parameter
	 */
	@NonNull
	public Optional<String> getString(@Nullable String name) {
		return get(name).map(String::valueOf);
	}

	/**
	 * The value of an {@code int} parameter.
	 *
	 * @param name the placeholder name
	 * @return the value, or {@link Optional#empty()} if there is no such parameter or it is not a {@link Long}
	 */
	@NonNull
	public Optional<Long> getLong(@Nullable String name) {
		return get(name).filter(value -> value instanceof Long).map(value -> (Long) value);
	}

	/**
	 * The value of a {@code float} parameter.
	 *
	 * @param name the placeholder name
	 * @return the value, or {@link Optional#empty()} if there is no such parameter or it is not a {@link Double}
	 */
	@NonNull
	public Optional<Double> getDouble(@Nullable String name) {
		return get(name).filter(value -> value instanceof Double).map(value -> (Double) value);
	}

	@NonNull
	public Map<@NonNull String, @NonNull Object> asMap() {
		return this.valuesByName;
	}

	@NonNull
	public Boolean isEmpty() {
		return this.valuesByName.isEmpty();
	}

	@Override
	public String toString() {
		return format("%s{valuesByName=%s}", getClass().getSimpleName(), asMap());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof PathParameters pathParameters))
			return false;

		return Objects.equals(asMap(), pathParameters.asMap());
	}

	@Override
	public int hashCode() {
		return Objects.hash(asMap());
	}
}
