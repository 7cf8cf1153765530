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

import javax.annotation.concurrent.ThreadSafe;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.lang.String.format;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ThreadSafe
public class ResponseTests {
	@Test
	public void defaults() {
		Response response = new Response();

		assertEquals("200 OK", response.getStatus());
		assertEquals(List.of(new Header("Content-Type", "text/plain")), response.getHeaders());
		assertEquals(0, response.getBody().length);
	}

	@Test
	public void contentTypeIsNeverDuplicated() {
		Response response = new Response();
		response.addHeader("content-type", "application/json");

		assertEquals(List.of(new Header("Content-Type", "application/json")), response.getHeaders());

		response.setHeaders(List.of(
				new Header("Content-Type", "text/plain"),
				new Header("X-Tag", "a"),
				new Header("content-type", "text/csv")));
		response.setContentType("text/html");

		assertEquals(List.of(new Header("Content-Type", "text/html"), new Header("X-Tag", "a")), response.getHeaders());
		assertEquals(Optional.of("text/html"), response.getHeader("Content-Type"));
	}

	@Test
	public void sendWithNumericStatusAppendsOk() {
		Response response = new Response();
		response.send("created", 201);

		assertEquals("201 OK", response.getStatus());
		assertEquals("created", response.getText());
	}

	@Test
	public void sendWithStatusCodeUsesReasonPhrase() {
		Response response = new Response();
		response.send("gone", StatusCode.HTTP_404);

		assertEquals("404 Not Found", response.getStatus());
	}

	@Test
	public void sendWithStatusLineIsVerbatim() {
		Response response = new Response();
		response.send("short and stout", "418 I'm a teapot");

		assertEquals("418 I'm a teapot", response.getStatus());
	}

	@Test
	public void redirectReplacesHeadersAndBody() {
		Response response = new Response();
		response.addHeader("X-Before", "1");
		response.redirect("/elsewhere");

		assertEquals("302 Found", response.getStatus());
		assertEquals(List.of(new Header("Location", "/elsewhere")), response.getHeaders());
		assertEquals("Redirecting to /elsewhere", response.getText());

		response.redirect("/forever", true);
		assertEquals("301 Moved Permanently", response.getStatus());
	}

	@Test
	public void setContentTypeReplacesInPlace() {
		Response response = new Response();
		response.addHeader("X-After", "1");
		response.setContentType("application/json");

		assertEquals(List.of(new Header("Content-Type", "application/json"), new Header("X-After", "1")), response.getHeaders());
		assertEquals(Optional.of("application/json"), response.getHeader("content-type"));

		response.setHeaders(List.of());
		response.setContentType("text/csv");
		assertEquals(List.of(new Header("Content-Type", "text/csv")), response.getHeaders());
	}

	@Test
	public void headersSnapshotIsDetached() {
		Response response = new Response();
		List<Header> headers = response.getHeaders();
		response.addHeader("X-Later", "1");

		assertEquals(1, headers.size());
	}

	@Test
	public void renderExistingTemplate() {
		Response response = new Response(TemplateRenderer.withTemplateDirectory(Paths.get("src", "test", "resources", "templates")));
		response.setStatus(StatusCode.HTTP_400);
		response.render("greeting.html", Map.of("name", "Ada", "count", 1, "things", "task"));

		assertEquals("200 OK", response.getStatus());
		assertEquals(Optional.of("text/html"), response.getHeader("Content-Type"));
		assertTrue(response.getText().contains("Hello, Ada!"));
	}

	@Test
	public void renderMissingTemplate() {
		TemplateRenderer templateRenderer = TemplateRenderer.withTemplateDirectory(Paths.get("src", "test", "resources", "templates"));
		Response response = new Response(templateRenderer);
		response.render("missing.html", Map.of());

		assertEquals("500 Internal Server Error", response.getStatus());
		assertEquals(format("Template 'missing.html' not found in %s", templateRenderer.getLocationDescription()), response.getText());
		assertEquals(Optional.of("text/plain"), response.getHeader("Content-Type"));
	}
}
