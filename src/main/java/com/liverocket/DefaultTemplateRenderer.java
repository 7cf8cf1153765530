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

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Reads UTF-8 templates from a directory and replaces {@code {{ key }}} tokens with context values.
 * <p>
 * Whitespace inside the braces is optional. Tokens whose key is not in the context are left as written.
 * Template names that would resolve outside the template directory are treated as missing.
 */
@ThreadSafe
final class DefaultTemplateRenderer implements TemplateRenderer {
	@Nonnull
	private static final DefaultTemplateRenderer DEFAULT_INSTANCE;

	static {
		DEFAULT_INSTANCE = new DefaultTemplateRenderer(Paths.get("templates"));
	}

	@Nonnull
	private final Path templateDirectory;

	@Nonnull
	public static DefaultTemplateRenderer defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	DefaultTemplateRenderer(@Nonnull Path templateDirectory) {
		requireNonNull(templateDirectory);
		this.templateDirectory = templateDirectory.toAbsolutePath().normalize();
	}

	@Nonnull
	@Override
	public Optional<String> render(@Nonnull String templateName,
																 @Nonnull Map<String, ?> context) {
		requireNonNull(templateName);
		requireNonNull(context);

		Path templateFile = getTemplateDirectory().resolve(templateName).normalize();

		if (!templateFile.startsWith(getTemplateDirectory()) || !Files.isRegularFile(templateFile))
			return Optional.empty();

		String template;

		try {
			template = Files.readString(templateFile, StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new UncheckedIOException(format("Unable to read template %s", templateFile), e);
		}

		for (Entry<String, ?> entry : context.entrySet()) {
			Pattern tokenPattern = Pattern.compile("\\{\\{\\s*" + Pattern.quote(entry.getKey()) + "\\s*\\}\\}");
			template = tokenPattern.matcher(template).replaceAll(Matcher.quoteReplacement(String.valueOf(entry.getValue())));
		}

		return Optional.of(template);
	}

	@Nonnull
	@Override
	public String getLocationDescription() {
		return getTemplateDirectory().toString();
	}

	@Override
	public String toString() {
		return format("%s{templateDirectory=%s}", getClass().getSimpleName(), getTemplateDirectory());
	}

	@Nonnull
	private Path getTemplateDirectory() {
		return this.templateDirectory;
	}
}
