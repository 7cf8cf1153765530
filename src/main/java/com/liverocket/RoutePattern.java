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
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A compiled route template such as {@code /users/<int:userId>/files/<path:filePath>}.
 * <p>
 * Placeholders are written {@code <name>} or {@code <type:name>}, where {@code type} is one of the names
 * defined by {@link PathParameterType}. Text outside placeholders is matched literally, and matching always spans the
 * entire request path.
 * <p>
 * It is not legal to use the same placeholder name more than once in a template.
 * <ul>
 *   <li>{@code /users/<int:id>/roles/<roleId>} is a valid template</li>
 *   <li>{@code /users/<id>/other/<int:id>} is an <em>invalid</em> template</li>
 * </ul>
 * Instances are acquired via {@link #compile(String)}.
 */
@ThreadSafe
public final class RoutePattern {
	@NonNull
	private static final Pattern PLACEHOLDER_PATTERN;

	static {
		PLACEHOLDER_PATTERN = Pattern.compile("<(?:([^:>]+):)?([^>]+)>");
	}

	@NonNull
	private final String template;
	@NonNull
	private final List<@NonNull Parameter> parameters;
	@Nullable
	private final Pattern pattern;

	/**
	 * Compiles a route template.
	 *
	 * @param template the template, for example {@code /items/<int:itemId>}
	 * @return the compiled pattern
	 * @throws IllegalArgumentException if a placeholder name appears more than once
	 */
	@NonNull
	public static RoutePattern compile(@NonNull String template) {
		requireNonNull(template);
		return new RoutePattern(template);
	}

	/**
	 * Does the template contain at least one {@code <...>} placeholder?
	 * <p>
	 * Templates without placeholders are routed by exact string comparison.
	 *
	 * @param template the template to inspect
	 * @return {@code true} if the template has placeholder syntax, {@code false} otherwise
	 */
	@NonNull
	public static Boolean hasPlaceholders(@NonNull String template) {
		requireNonNull(template);
		return PLACEHOLDER_PATTERN.matcher(template).find();
	}

	private RoutePattern(@NonNull String template) {
		requireNonNull(template);

		this.template = template;

		List<Parameter> parameters = new ArrayList<>();
		Set<String> parameterNames = new LinkedHashSet<>();
		StringBuilder regex = new StringBuilder();
		Matcher matcher = PLACEHOLDER_PATTERN.matcher(template);
		int literalStart = 0;

		while (matcher.find()) {
			String name = matcher.group(2);

			if (!parameterNames.add(name))
				throw new IllegalArgumentException(format("Duplicate placeholder name '%s' in route template: %s", name, template));

			PathParameterType type = PathParameterType.fromName(matcher.group(1));

			if (matcher.start() > literalStart)
				regex.append(Pattern.quote(template.substring(literalStart, matcher.start())));

			regex.append('(').append(type.getRegex()).append(')');
			parameters.add(new Parameter(name, type));
			literalStart = matcher.end();
		}

		if (literalStart < template.length())
			regex.append(Pattern.quote(template.substring(literalStart)));

		this.parameters = Collections.unmodifiableList(parameters);
		this.pattern = parameters.isEmpty() ? null : Pattern.compile(regex.toString());
	}

	/**
	 * Matches a decoded request path against this template.
	 * <p>
	 * Each captured value is converted according to its placeholder type. If any conversion fails, for example an
	 * {@code int} too large to represent, the path is treated as not matching.
	 *
	 * @param path the decoded request path, for example {@code /items/42}
	 * @return the extracted parameters, or {@link Optional#empty()} if the path does not match
	 */
	@NonNull
	public Optional<PathParameters> match(@NonNull String path) {
		requireNonNull(path);

		if (this.pattern == null)
			return getTemplate().equals(path) ? Optional.of(PathParameters.empty()) : Optional.empty();

		Matcher matcher = this.pattern.matcher(path);

		if (!matcher.matches())
			return Optional.empty();

		Map<String, Object> valuesByName = new LinkedHashMap<>(getParameters().size());

		for (int i = 0; i < getParameters().size(); i++) {
			Parameter parameter = getParameters().get(i);
			Optional<Object> value = parameter.getType().convert(matcher.group(i + 1));

			if (value.isEmpty())
				return Optional.empty();

			valuesByName.put(parameter.getName(), value.get());
		}

		return Optional.of(PathParameters.withValues(valuesByName));
	}

	/**
	 * Substitutes values into this template's placeholders, the reverse of {@link #match(String)}.
	 * <p>
	 * Placeholders with no corresponding entry in {@code valuesByName} are left as written.
	 *
	 * @param valuesByName values keyed by placeholder name
	 * @return the expanded path
	 */
	@NonNull
	public String expand(@NonNull Map<@NonNull String, ?> valuesByName) {
		requireNonNull(valuesByName);

		Matcher matcher = PLACEHOLDER_PATTERN.matcher(getTemplate());
		StringBuilder expanded = new StringBuilder();

		while (matcher.find()) {
			Object value = valuesByName.get(matcher.group(2));
			String replacement = value == null ? matcher.group() : String.valueOf(value);
			matcher.appendReplacement(expanded, Matcher.quoteReplacement(replacement));
		}

		matcher.appendTail(expanded);
		return expanded.toString();
	}

	@NonNull
	public Boolean hasPlaceholders() {
		return !getParameters().isEmpty();
	}

	@Override
	public String toString() {
		return format("%s{template=%s, parameters=%s}", getClass().getSimpleName(), getTemplate(), getParameters());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof RoutePattern routePattern))
			return false;

		return Objects.equals(getTemplate(), routePattern.getTemplate());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getTemplate());
	}

	@NonNull
	public String getTemplate() {
		return this.template;
	}

	/**
	 * The template's placeholders in the order they appear.
	 *
	 * @return the placeholders
	 */
	@NonNull
	public List<@NonNull Parameter> getParameters() {
		return this.parameters;
	}

	/**
	 * A single {@code <type:name>} placeholder within a {@link RoutePattern}.
	 */
	@ThreadSafe
	public static final class Parameter {
		@NonNull
		private final String name;
		@NonNull
		private final PathParameterType type;

		Parameter(@NonNull String name,
							@NonNull PathParameterType type) {
			requireNonNull(name);
			requireNonNull(type);

			this.name = name;
			this.type = type;
		}

		@Override
		public String toString() {
			return format("%s{name=%s, type=%s}", getClass().getSimpleName(), getName(), getType().getName());
		}

		@Override
		public boolean equals(@Nullable Object object) {
			if (this == object)
				return true;

			if (!(object instanceof Parameter parameter))
				return false;

			return Objects.equals(getName(), parameter.getName())
					&& Objects.equals(getType(), parameter.getType());
		}

		@Override
		public int hashCode() {
			return Objects.hash(getName(), getType());
		}

		@NonNull
		public String getName() {
			return this.name;
		}

		@NonNull
		public PathParameterType getType() {
			return this.type;
		}
	}
}
