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

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The types a {@link RoutePattern} placeholder may declare, for example {@code int} in {@code /users/<int:userId>}.
 * <p>
 * Each type contributes the regular expression its placeholder compiles to and the conversion applied to the
 * matched text. Placeholders that name no type, or an unknown type, are treated as {@link #STRING}.
 */
public enum PathParameterType {
	/**
	 * Any run of characters other than {@code /}. Converts to {@link String}.
	 */
	STRING("string", "[^/]+", (value) -> Optional.of(value)),
	/**
	 * One or more decimal digits. Converts to {@link Long}.
	 */
	INT("int", "\\d+", (value) -> {
		try {
			return Optional.of(Long.valueOf(value));
		} catch (NumberFormatException e) {
			// Too many digits to fit in a long
			return Optional.empty();
		}
	}),
	/**
	 * Digits with an optional decimal point and fraction, for example {@code 3.14} or {@code 3.}. Converts to {@link Double}.
	 */
	FLOAT("float", "\\d+\\.?\\d*", (value) -> {
		try {
			return Optional.of(Double.valueOf(value));
		} catch (NumberFormatException e) {
			return Optional.empty();
		}
	}),
	/**
	 * One or more characters of any kind, including {@code /}. Converts to {@link String}.
	 */
	PATH("path", ".+", (value) -> Optional.of(value)),
	/**
	 * A lowercase hyphenated UUID such as {@code 123e4567-e89b-12d3-a456-426614174000}. Converts to {@link String}.
	 */
	UUID("uuid", "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}", (value) -> Optional.of(value));

	@NonNull
	private static final Map<String, PathParameterType> PATH_PARAMETER_TYPES_BY_NAME;

	static {
		Map<String, PathParameterType> pathParameterTypesByName = new HashMap<>();

		for (PathParameterType pathParameterType : PathParameterType.values())
			pathParameterTypesByName.put(pathParameterType.getName(), pathParameterType);

		PATH_PARAMETER_TYPES_BY_NAME = Collections.unmodifiableMap(pathParameterTypesByName);
	}

	@NonNull
	private final String name;
	@NonNull
	private final String regex;
	@NonNull
	private final Function<String, Optional<Object>> converter;

	PathParameterType(@NonNull String name,
										@NonNull String regex,
										@NonNull Function<String, Optional<Object>> converter) {
		requireNonNull(name);
		requireNonNull(regex);
		requireNonNull(converter);

		this.name = name;
		this.regex = regex;
		this.converter = converter;
	}

	/**
	 * Resolves a placeholder type name, for example {@code "int"}.
	 * <p>
	 * Lookup is case-insensitive. A {@code null} or unrecognized name resolves to {@link #STRING}.
	 *
	 * @param name the type name as written in a route template, may be {@code null}
	 * @return the matching type, never {@code null}
	 */
	@NonNull
	public static PathParameterType fromName(@Nullable String name) {
		if (name == null)
			return STRING;

		PathParameterType pathParameterType = PATH_PARAMETER_TYPES_BY_NAME.get(name.trim().toLowerCase(Locale.ENGLISH));
		return pathParameterType == null ? STRING : pathParameterType;
	}

	/**
	 * Converts text captured by this type's regular expression into its typed value.
	 *
	 * @param value the captured text
	 * @return the converted value, or {@link Optional#empty()} if the text cannot be represented
	 */
	@NonNull
	public Optional<Object> convert(@NonNull String value) {
		requireNonNull(value);
		return getConverter().apply(value);
	}

	@Override
	public String toString() {
		return format("%s.%s{name=%s, regex=%s}", getClass().getSimpleName(), name(), getName(), getRegex());
	}

	/**
	 * The name used for this type inside a placeholder, for example {@code uuid}.
	 *
	 * @return the type name
	 */
	@NonNull
	public String getName() {
		return this.name;
	}

	/**
	 * The regular expression (without a capturing group) that text for this type must match.
	 *
	 * @return the regular expression
	 */
	@NonNull
	public String getRegex() {
		return this.regex;
	}

	@NonNull
	private Function<String, Optional<Object>> getConverter() {
		return this.converter;
	}
}
