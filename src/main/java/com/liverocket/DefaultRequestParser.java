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

import com.liverocket.exception.MalformedRequestException;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONParserConfiguration;
import org.json.JSONTokener;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.net.InetSocketAddress;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Parses requests per the rules documented on {@link RequestBody} and {@link Request}.
 * <p>
 * The head of the request (everything before the first blank line) is decoded as UTF-8. Header lines without a
 * {@code :} are ignored, and a repeated header keeps its last value.
 */
@ThreadSafe
final class DefaultRequestParser implements RequestParser {
	@Nonnull
	private static final DefaultRequestParser DEFAULT_INSTANCE;
	@Nonnull
	private static final Charset CHARSET;
	@Nonnull
	private static final byte[] HEADER_TERMINATOR;
	@Nonnull
	private static final JSONParserConfiguration JSON_PARSER_CONFIGURATION;

	static {
		DEFAULT_INSTANCE = new DefaultRequestParser();
		CHARSET = StandardCharsets.UTF_8;
		HEADER_TERMINATOR = new byte[]{'\r', '\n', '\r', '\n'};
		JSON_PARSER_CONFIGURATION = new JSONParserConfiguration().withStrictMode(true);
	}

	@Nonnull
	public static DefaultRequestParser defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	private DefaultRequestParser() {
		// Use defaultInstance()
	}

	@Nonnull
	@Override
	public Request parse(@Nonnull byte[] requestBytes,
											 @Nullable InetSocketAddress remoteAddress) {
		requireNonNull(requestBytes);

		if (requestBytes.length == 0)
			throw new MalformedRequestException("Request is empty");

		int headerTerminatorIndex = indexOfHeaderTerminator(requestBytes, requestBytes.length);
		int headEnd = headerTerminatorIndex == -1 ? requestBytes.length : headerTerminatorIndex;
		byte[] body = headerTerminatorIndex == -1 ? Utilities.emptyByteArray()
				: Arrays.copyOfRange(requestBytes, headerTerminatorIndex + HEADER_TERMINATOR.length, requestBytes.length);

		String head = new String(requestBytes, 0, headEnd, CHARSET);
		String[] lines = head.split("\r\n", -1);

		// Request line: METHOD SP REQUEST-TARGET SP PROTOCOL
		String[] requestLineComponents = lines[0].split(" ", -1);

		if (requestLineComponents.length != 3)
			throw new MalformedRequestException(format("Malformed request line '%s'. Expected 3 space-separated components but found %d",
					Utilities.printableString(lines[0]), requestLineComponents.length));

		String method = requestLineComponents[0];
		String requestTarget = requestLineComponents[1];
		String protocol = requestLineComponents[2];

		String rawPath = requestTarget;
		String rawQuery = null;
		int indexOfQuestionMark = requestTarget.indexOf('?');

		if (indexOfQuestionMark != -1) {
			rawPath = requestTarget.substring(0, indexOfQuestionMark);
			rawQuery = requestTarget.substring(indexOfQuestionMark + 1);
		}

		String path = Utilities.decodePath(rawPath, CHARSET);
		Map<String, String> queryParameters = rawQuery == null ? Map.of() : Utilities.extractQueryParametersFromQuery(rawQuery, CHARSET);

		Map<String, String> headers = new LinkedHashMap<>();

		for (int i = 1; i < lines.length; i++) {
			String line = lines[i];

			if (line.isEmpty())
				break;

			int indexOfColon = line.indexOf(':');

			if (indexOfColon == -1)
				continue;

			headers.put(Utilities.normalizeHeaderName(line.substring(0, indexOfColon)), line.substring(indexOfColon + 1).trim());
		}

		Optional<Integer> contentLength = extractContentLength(headers.get("CONTENT_LENGTH"));

		if (contentLength.isPresent() && contentLength.get() < body.length)
			body = Arrays.copyOf(body, contentLength.get());

		String contentType = Utilities.extractContentTypeFromHeaderValue(headers.get("CONTENT_TYPE")).orElse(null);

		return Request.with(method, path)
				.rawQuery(rawQuery)
				.queryParameters(queryParameters)
				.headers(headers)
				.protocol(protocol)
				.remoteAddress(remoteAddress)
				.body(interpretBody(body, contentType))
				.build();
	}

	@Nonnull
	protected RequestBody interpretBody(@Nonnull byte[] body,
																			@Nullable String contentType) {
		requireNonNull(body);

		if (body.length == 0)
			return RequestBody.empty();

		if ("application/x-www-form-urlencoded".equals(contentType))
			return RequestBody.ofFormParameters(Utilities.extractFormParametersFromBody(new String(body, CHARSET), CHARSET), body);

		if ("application/json".equals(contentType))
			return RequestBody.ofJson(parseJson(new String(body, CHARSET)), body);

		return RequestBody.ofBytes(body);
	}

	@Nonnull
	protected Object parseJson(@Nonnull String json) {
		requireNonNull(json);

		try {
			// Strict mode rejects lenient syntax such as unquoted keys
			JSONTokener jsonTokener = new JSONTokener(json, JSON_PARSER_CONFIGURATION);
			Object value = jsonTokener.nextValue();

			// Trailing garbage means the document as a whole is not valid JSON
			if (jsonTokener.nextClean() != 0)
				return new JSONObject();

			// Unquoted text is accepted by the tokener as a bare string; strict JSON does not allow it
			if (value instanceof String && !json.trim().startsWith("\""))
				return new JSONObject();

			return value;
		} catch (JSONException e) {
			return new JSONObject();
		}
	}

	@Nonnull
	static Optional<Integer> extractContentLength(@Nullable String contentLengthHeaderValue) {
		if (contentLengthHeaderValue == null)
			return Optional.empty();

		try {
			int contentLength = Integer.parseInt(contentLengthHeaderValue.trim());
			return contentLength < 0 ? Optional.empty() : Optional.of(contentLength);
		} catch (NumberFormatException e) {
			return Optional.empty();
		}
	}

	/**
	 * Finds the CRLFCRLF sequence that ends a request's head.
	 *
	 * @return the index of the sequence's first byte, or {@code -1} if not yet present
	 */
	static int indexOfHeaderTerminator(@Nonnull byte[] bytes,
																		 int length) {
		requireNonNull(bytes);

		for (int i = 0; i + HEADER_TERMINATOR.length <= length; i++) {
			if (bytes[i] == '\r' && bytes[i + 1] == '\n' && bytes[i + 2] == '\r' && bytes[i + 3] == '\n')
				return i;
		}

		return -1;
	}
}
