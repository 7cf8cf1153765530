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
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The response a {@link RouteHandler} builds for a request.
 * <p>
 * A new instance starts as {@code 200 OK} with a single {@code Content-Type: text/plain} header and an empty body.
 * Handlers mutate it in place; it is serialized by a {@link ResponseMarshaler} once the handler returns.
 * <p>
 * The status is kept as it appears after the protocol version on the status line, for example {@code 404 Not Found}.
 * <p>
 * This class is intended for use by a single thread.
 */
@NotThreadSafe
public final class Response {
	@NonNull
	private static final String DEFAULT_STATUS;
	@NonNull
	private static final String DEFAULT_CONTENT_TYPE;

	static {
		DEFAULT_STATUS = StatusCode.HTTP_200.getStatusLine();
		DEFAULT_CONTENT_TYPE = "text/plain";
	}

	@NonNull
	private final TemplateRenderer templateRenderer;
	@NonNull
	private String status;
	@NonNull
	private List<@NonNull Header> headers;
	@NonNull
	private byte[] body;

	/**
	 * Creates a response that renders templates with {@link TemplateRenderer#defaultInstance()}.
	 */
	public Response() {
		this(TemplateRenderer.defaultInstance());
	}

	public Response(@NonNull TemplateRenderer templateRenderer) {
		requireNonNull(templateRenderer);

		this.templateRenderer = templateRenderer;
		this.status = DEFAULT_STATUS;
		this.headers = new ArrayList<>(List.of(new Header("Content-Type", DEFAULT_CONTENT_TYPE)));
		this.body = Utilities.emptyByteArray();
	}

	/**
	 * Sets a text body and a {@code 200 OK} status.
	 *
	 * @param text the body text, written as UTF-8
	 */
	public void send(@NonNull String text) {
		send(text, DEFAULT_STATUS);
	}

	/**
	 * Sets a text body and a status given as a bare number.
	 * <p>
	 * The number is always paired with the reason phrase {@code OK}, so {@code send("x", 201)} yields {@code 201 OK}.
	 * Use {@link #send(String, StatusCode)} for the standard reason phrase.
	 *
	 * @param text       the body text, written as UTF-8
	 * @param statusCode the numeric status code
	 */
	public void send(@NonNull String text,
									 int statusCode) {
		send(text, format("%d OK", statusCode));
	}

	public void send(@NonNull String text,
									 @NonNull StatusCode statusCode) {
		requireNonNull(statusCode);
		send(text, statusCode.getStatusLine());
	}

	/**
	 * Sets a text body and a status given exactly as it should appear on the status line, for example {@code 418 I'm a teapot}.
	 *
	 * @param text   the body text, written as UTF-8
	 * @param status the status
	 */
	public void send(@NonNull String text,
									 @NonNull String status) {
		requireNonNull(text);
		requireNonNull(status);

		setText(text);
		setStatus(status);
	}

	public void redirect(@NonNull String location) {
		redirect(location, false);
	}

	/**
	 * Turns this response into a redirect.
	 * <p>
	 * All existing headers are replaced by a single {@code Location} header, and the body becomes {@code Redirecting to <location>}.
	 *
	 * @param location  the redirect target
	 * @param permanent {@code true} for {@code 301 Moved Permanently}, {@code false} for {@code 302 Found}
	 */
	public void redirect(@NonNull String location,
											 boolean permanent) {
		requireNonNull(location);

		this.status = permanent ? StatusCode.HTTP_301.getStatusLine() : StatusCode.HTTP_302.getStatusLine();
		this.headers = new ArrayList<>(List.of(new Header("Location", location)));
		setText(format("Redirecting to %s", location));
	}

	/**
	 * Renders a template into this response as {@code text/html} with status {@code 200 OK}.
	 * <p>
	 * If the template does not exist, the status becomes {@code 500 Internal Server Error} and the body names the
	 * template and where it was looked for.
	 *
	 * @param templateName the template name, for example {@code index.html}
	 * @param context      values to substitute into the template
	 */
	public void render(@NonNull String templateName,
										 @NonNull Map<@NonNull String, ?> context) {
		requireNonNull(templateName);
		requireNonNull(context);

		Optional<String> rendered = getTemplateRenderer().render(templateName, context);

		if (rendered.isEmpty()) {
			setText(format("Template '%s' not found in %s", templateName, getTemplateRenderer().getLocationDescription()));
			setStatus(StatusCode.HTTP_500);
			return;
		}

		setContentType("text/html");
		setText(rendered.get());
		setStatus(StatusCode.HTTP_200);
	}

	@NonNull
	public String getStatus() {
		return this.status;
	}

	public void setStatus(@NonNull String status) {
		requireNonNull(status);
		this.status = status;
	}

	public void setStatus(@NonNull StatusCode statusCode) {
		requireNonNull(statusCode);
		this.status = statusCode.getStatusLine();
	}

	/**
	 * A snapshot of this response's headers, in order.
	 *
	 * @return the headers
	 */
	@NonNull
	public List<@NonNull Header> getHeaders() {
		return Collections.unmodifiableList(new ArrayList<>(this.headers));
	}

	/**
	 * Replaces all headers.
	 *
	 * @param headers the new headers, in order
	 */
	public void setHeaders(@NonNull List<@NonNull Header> headers) {
		requireNonNull(headers);
		this.headers = new ArrayList<>(headers);
	}

	/**
	 * Appends a header. Existing headers with the same name are kept.
	 * <p>
	 * {@code Content-Type} is the exception: it is routed through {@link #setContentType(String)}, so there is only ever one.
	 *
	 * @param name  the header name
	 * @param value the header value
	 */
	public void addHeader(@NonNull String name,
												@NonNull String value) {
		requireNonNull(name);
		requireNonNull(value);

		if ("Content-Type".equalsIgnoreCase(name))
			setContentType(value);
		else
			this.headers.add(new Header(name, value));
	}

	/**
	 * The value of the first header with the given name, compared case-insensitively.
	 *
	 * @param name the header name
	 * @return the header value, or {@link Optional#empty()} if there is no such header
	 */
	@NonNull
	public Optional<String> getHeader(@Nullable String name) {
		if (name == null)
			return Optional.empty();

		for (Header header : this.headers)
			if (header.hasName(name))
				return Optional.of(header.value());

		return Optional.empty();
	}

	/**
	 * Sets the {@code Content-Type} header, replacing the first existing one in place or appending if there is none.
	 * <p>
	 * Any later {@code Content-Type} headers are removed.
	 *
	 * @param contentType the content type, for example {@code application/json}
	 */
	public void setContentType(@NonNull String contentType) {
		requireNonNull(contentType);

		boolean replaced = false;

		for (int i = 0; i < this.headers.size(); i++) {
			if (!this.headers.get(i).hasName("Content-Type"))
				continue;

			if (replaced) {
				this.headers.remove(i--);
			} else {
				this.headers.set(i, new Header("Content-Type", contentType));
				replaced = true;
			}
		}

		if (!replaced)
			this.headers.add(new Header("Content-Type", contentType));
	}

	@NonNull
	public String getText() {
		return new String(this.body, StandardCharsets.UTF_8);
	}

	public void setText(@NonNull String text) {
		requireNonNull(text);
		this.body = text.getBytes(StandardCharsets.UTF_8);
	}

	/**
	 * The body as it will be written. Returns a copy.
	 *
	 * @return the body bytes
	 */
	@NonNull
	public byte[] getBody() {
		return this.body.clone();
	}

	public void setBody(@NonNull byte[] body) {
		requireNonNull(body);
		this.body = body.clone();
	}

	@Override
	public String toString() {
		return format("%s{status=%s, headers=%s, bodyLength=%d}", getClass().getSimpleName(), getStatus(), this.headers, this.body.length);
	}

	@NonNull
	private TemplateRenderer getTemplateRenderer() {
		return this.templateRenderer;
	}
}
