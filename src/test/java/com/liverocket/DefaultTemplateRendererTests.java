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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ThreadSafe
public class DefaultTemplateRendererTests {
	private static final Path TEMPLATE_DIRECTORY = Paths.get("src", "test", "resources", "templates");

	@Test
	public void substitutesTokensWithOptionalWhitespace() {
		TemplateRenderer templateRenderer = TemplateRenderer.withTemplateDirectory(TEMPLATE_DIRECTORY);
		String rendered = templateRenderer.render("greeting.html", Map.of("name", "Ada", "count", 3, "things", "messages")).orElseThrow();

		assertEquals("<h1>Hello, Ada!</h1>\n<p>You have 3 new messages.</p>\n", rendered);
	}

	@Test
	public void unknownTokensAreLeftAsWritten() {
		TemplateRenderer templateRenderer = TemplateRenderer.withTemplateDirectory(TEMPLATE_DIRECTORY);
		assertEquals(Optional.of("<p>{{ unknown }}</p>\n"), templateRenderer.render("untouched.html", Map.of("other", "x")));
	}

	@Test
	public void replacementTextIsLiteral() {
		TemplateRenderer templateRenderer = TemplateRenderer.withTemplateDirectory(TEMPLATE_DIRECTORY);
		String rendered = templateRenderer.render("greeting.html", Map.of("name", "$1\\x", "count", 0, "things", "a")).orElseThrow();

		assertTrue(rendered.startsWith("<h1>Hello, $1\\x!</h1>"));
	}

	@Test
	public void missingTemplateIsEmpty() {
		TemplateRenderer templateRenderer = TemplateRenderer.withTemplateDirectory(TEMPLATE_DIRECTORY);
		assertTrue(templateRenderer.render("does-not-exist.html", Map.of()).isEmpty());
	}

	@Test
	public void templatesOutsideDirectoryAreNotRead(@TempDir Path tempDirectory) throws IOException {
		Path templateDirectory = Files.createDirectory(tempDirectory.resolve("templates"));
		Files.writeString(tempDirectory.resolve("secret.txt"), "secret", StandardCharsets.UTF_8);

		TemplateRenderer templateRenderer = TemplateRenderer.withTemplateDirectory(templateDirectory);

		assertTrue(templateRenderer.render("../secret.txt", Map.of()).isEmpty());
		assertTrue(templateRenderer.getLocationDescription().endsWith("templates"));
	}
}
