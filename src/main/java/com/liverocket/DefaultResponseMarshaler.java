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
import java.io.ByteArrayOutputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Writes {@code HTTP/1.1} responses with these framing rules:
 * <ul>
 *   <li>headers appear in the order supplied</li>
 *   <li>{@code Content-Length} is appended unless the response already has one</li>
 *   <li>{@code Connection: close} is always appended</li>
 * </ul>
 */
@ThreadSafe
final class DefaultResponseMarshaler implements ResponseMarshaler {
	@Nonnull
	private static final DefaultResponseMarshaler DEFAULT_INSTANCE;
	@Nonnull
	private static final String PROTOCOL;
	@Nonnull
	private static final byte[] CRLF;

	static {
		DEFAULT_INSTANCE = new DefaultResponseMarshaler(StandardCharsets.UTF_8);
		PROTOCOL = "HTTP/1.1";
		CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);
	}

	@Nonnull
	private final Charset charset;

	@Nonnull
	public static DefaultResponseMarshaler defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	DefaultResponseMarshaler(@Nonnull Charset charset) {
		requireNonNull(charset);
		this.charset = charset;
	}

	@Nonnull
	@Override
	public byte[] marshal(@Nonnull Response response) {
		requireNonNull(response);
		return marshal(response.getStatus(), response.getHeaders(), response.getBody());
	}

	@Nonnull
	@Override
	public byte[] marshalError(@Nonnull StatusCode statusCode,
														 @Nonnull String message) {
		requireNonNull(statusCode);
		requireNonNull(message);

		String body = format("<h1>%s</h1>\n<p>%s</p>", statusCode.getStatusLine(), Utilities.escapeHtml(message));

		return marshal(statusCode.getStatusLine(), List.of(new Header("Content-Type", "text/html")), body.getBytes(getCharset()));
	}

	@Nonnull
	private byte[] marshal(@Nonnull String status,
												 @Nonnull List<Header> headers,
												 @Nonnull byte[] body) {
		requireNonNull(status);
		requireNonNull(headers);
		requireNonNull(body);

		if (status.indexOf('\r') != -1 || status.indexOf('\n') != -1)
			throw new IllegalArgumentException(format("Illegal status '%s'", Utilities.printableString(status)));

		ByteArrayOutputStream output = new ByteArrayOutputStream(256 + body.length);
		boolean hasContentLength = false;

		writeLine(output, format("%s %s", PROTOCOL, status));

		for (Header header : headers) {
			Utilities.validateHeaderNameAndValue(header.name(), header.value());

			if (header.hasName("Content-Length"))
				hasContentLength = true;

			writeLine(output, format("%s: %s", header.name(), header.value()));
		}

		if (!hasContentLength)
			writeLine(output, format("Content-Length: %d", body.length));

		writeLine(output, "Connection: close");
		output.writeBytes(CRLF);
		output.writeBytes(body);

		return output.toByteArray();
	}

	private void writeLine(@Nonnull ByteArrayOutputStream output,
												 @Nonnull String line) {
		output.writeBytes(line.getBytes(getCharset()));
		output.writeBytes(CRLF);
	}

	@Override
	public String toString() {
		return format("%s{charset=%s}", getClass().getSimpleName(), getCharset());
	}

	@Nonnull
	private Charset getCharset() {
		return this.charset;
	}
}
