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
import java.io.ByteArrayOutputStream;
import java.lang.Thread.UncaughtExceptionHandler;
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodHandles.Lookup;
import java.lang.invoke.MethodType;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.regex.Pattern;

import static java.lang.String.format;
import static java.util.Locale.ENGLISH;
import static java.util.Objects.requireNonNull;

/**
 * A non-instantiable collection of utility methods.
 */
@ThreadSafe
public final class Utilities {
	@NonNull
	private static final boolean VIRTUAL_THREADS_AVAILABLE;
	@NonNull
	private static final byte[] EMPTY_BYTE_ARRAY;
	@NonNull
	private static final Pattern HEAD_WHITESPACE_PATTERN;
	@NonNull
	private static final Pattern TAIL_WHITESPACE_PATTERN;

	static {
		EMPTY_BYTE_ARRAY = new byte[0];

		boolean virtualThreadsAvailable = false;

		try {
			// Detect if Virtual Threads are usable by feature testing via reflection.
			// Hat tip to https://github.com/javalin/javalin for this technique
			Class.forName("java.lang.Thread$Builder$OfVirtual");
			virtualThreadsAvailable = true;
		} catch (Exception ignored) {
			// We don't care why this failed, but if we're here we know JVM does not support virtual threads
		}

		VIRTUAL_THREADS_AVAILABLE = virtualThreadsAvailable;

		// \p{Z} or \p{Separator}: any kind of whitespace or invisible separator.
		// Combined with the ASCII whitespace trim(), this gives the "stronger" trim we want for user-supplied input.
		HEAD_WHITESPACE_PATTERN = Pattern.compile("^(\\p{Z})+");
		TAIL_WHITESPACE_PATTERN = Pattern.compile("(\\p{Z})+$");
	}

	private Utilities() {
		// Non-instantiable
	}

	/**
	 * Does the platform runtime support virtual threads (either Java 19 and 20 w/preview enabled or Java 21+)?
	 *
	 * @return {@code true} if the runtime supports virtual threads, {@code false} otherwise
	 */
	@NonNull
	static Boolean virtualThreadsAvailable() {
		return VIRTUAL_THREADS_AVAILABLE;
	}

	/**
	 * Provides a virtual-thread-per-task executor service if supported by the runtime.
	 * <p>
	 * LiveRocket is compiled with a source level &lt; 19, so there are no hard references to virtual threads; the
	 * executor service is created dynamically via {@link MethodHandle} references.
	 * <p>
	 * <strong>You should not call this method if {@link Utilities#virtualThreadsAvailable()} is {@code false}.</strong>
	 * <pre>{@code // This method is effectively equivalent to this code
	 * return Executors.newThreadPerTaskExecutor(
	 *   Thread.ofVirtual()
	 *    .name(threadNamePrefix, 1)
	 *    .uncaughtExceptionHandler(uncaughtExceptionHandler)
	 *    .factory()
	 * );}</pre>
	 *
	 * @param threadNamePrefix         thread name prefix for the virtual thread factory builder
	 * @param uncaughtExceptionHandler uncaught exception handler for the virtual thread factory builder
	 * @return a virtual-thread-per-task executor service
	 * @throws IllegalStateException if the runtime environment does not support virtual threads
	 */
	@NonNull
	static ExecutorService createVirtualThreadsNewThreadPerTaskExecutor(@NonNull String threadNamePrefix,
																																			@NonNull UncaughtExceptionHandler uncaughtExceptionHandler) {
		requireNonNull(threadNamePrefix);
		requireNonNull(uncaughtExceptionHandler);

		if (!virtualThreadsAvailable())
			throw new IllegalStateException("Virtual threads are not available. Please confirm you are using Java 19-20 with the '--enable-preview' javac parameter specified or Java 21+");

		Class<?> threadBuilderOfVirtualClass;

		try {
			threadBuilderOfVirtualClass = Class.forName("java.lang.Thread$Builder$OfVirtual");
		} catch (ClassNotFoundException e) {
			throw new IllegalStateException("Unable to load virtual thread builder class", e);
		}

		Lookup lookup = MethodHandles.publicLookup();

		MethodHandle methodHandleThreadOfVirtual;
		MethodHandle methodHandleThreadBuilderOfVirtualName;
		MethodHandle methodHandleThreadBuilderOfVirtualUncaughtExceptionHandler;
		MethodHandle methodHandleThreadBuilderOfVirtualFactory;
		MethodHandle methodHandleExecutorsNewThreadPerTaskExecutor;

		try {
			methodHandleThreadOfVirtual = lookup.findStatic(Thread.class, "ofVirtual", MethodType.methodType(threadBuilderOfVirtualClass));
			methodHandleThreadBuilderOfVirtualName = lookup.findVirtual(threadBuilderOfVirtualClass, "name", MethodType.methodType(threadBuilderOfVirtualClass, String.class, long.class));
			methodHandleThreadBuilderOfVirtualUncaughtExceptionHandler = lookup.findVirtual(threadBuilderOfVirtualClass, "uncaughtExceptionHandler", MethodType.methodType(threadBuilderOfVirtualClass, UncaughtExceptionHandler.class));
			methodHandleThreadBuilderOfVirtualFactory = lookup.findVirtual(threadBuilderOfVirtualClass, "factory", MethodType.methodType(ThreadFactory.class));
			methodHandleExecutorsNewThreadPerTaskExecutor = lookup.findStatic(Executors.class, "newThreadPerTaskExecutor", MethodType.methodType(ExecutorService.class, ThreadFactory.class));
		} catch (NoSuchMethodException | IllegalAccessException e) {
			throw new IllegalStateException("Unable to load method handle for virtual thread factory", e);
		}

		try {
			Object virtualThreadBuilder = methodHandleThreadOfVirtual.invoke();
			methodHandleThreadBuilderOfVirtualName.invoke(virtualThreadBuilder, threadNamePrefix, 1L);
			methodHandleThreadBuilderOfVirtualUncaughtExceptionHandler.invoke(virtualThreadBuilder, uncaughtExceptionHandler);
			ThreadFactory threadFactory = (ThreadFactory) methodHandleThreadBuilderOfVirtualFactory.invoke(virtualThreadBuilder);

			return (ExecutorService) methodHandleExecutorsNewThreadPerTaskExecutor.invoke(threadFactory);
		} catch (Throwable t) {
			throw new IllegalStateException("Unable to create virtual thread executor service", t);
		}
	}

	/**
	 * Returns a shared zero-length {@code byte[]} instance.
	 *
	 * @return a zero-length byte array (never {@code null})
	 */
	@NonNull
	static byte[] emptyByteArray() {
		return EMPTY_BYTE_ARRAY;
	}

	/**
	 * Normalizes an HTTP header name the way {@link Request} stores it: trimmed, upper-cased, with {@code -} replaced by {@code _}.
	 * <p>
	 * For example, {@code "Content-Type"} becomes {@code "CONTENT_TYPE"}.
	 *
	 * @param headerName the header name as it appeared on the wire
	 * @return the normalized header name
	 */
	@NonNull
	public static String normalizeHeaderName(@NonNull String headerName) {
		requireNonNull(headerName);
		return trimAggressivelyToEmpty(headerName).toUpperCase(ENGLISH).replace('-', '_');
	}

	/**
	 * Percent-decodes a request path. {@code +} is <strong>not</strong> treated as a space.
	 * <p>
	 * An invalid {@code %xy} sequence, such as a trailing {@code %}, is kept as written.
	 *
	 * @param path    the raw path from the request line
	 * @param charset the charset used to interpret decoded bytes
	 * @return the decoded path
	 */
	@NonNull
	public static String decodePath(@NonNull String path,
																	@NonNull Charset charset) {
		requireNonNull(path);
		requireNonNull(charset);

		return percentDecode(path, charset);
	}

	/**
	 * Parses an {@code application/x-www-form-urlencoded} query string into single values.
	 * <p>
	 * {@code +} decodes to a space. Pairs without a value are dropped and, when a name repeats, its last value wins.
	 * Invalid percent-escapes are kept as written.
	 *
	 * @param query   the raw query string, without the leading {@code ?}
	 * @param charset the charset used to interpret decoded bytes
	 * @return decoded values keyed by name, in first-seen order
	 */
	@NonNull
	public static Map<@NonNull String, @NonNull String> extractQueryParametersFromQuery(@NonNull String query,
																																										 @NonNull Charset charset) {
		requireNonNull(query);
		requireNonNull(charset);

		Map<String, String> queryParameters = new LinkedHashMap<>();

		for (Entry<String, String> pair : extractNameValuePairs(query, charset))
			queryParameters.put(pair.getKey(), pair.getValue());

		return queryParameters;
	}

	/**
	 * Parses an {@code application/x-www-form-urlencoded} body.
	 * <p>
	 * Decoding matches {@link #extractQueryParametersFromQuery(String, Charset)}, except that repeated names are all kept:
	 * a name with one value maps to a {@link String} and a name with several maps to a {@link List} of them.
	 *
	 * @param form    the form body
	 * @param charset the charset used to interpret decoded bytes
	 * @return decoded values keyed by name, in first-seen order
	 */
	@NonNull
	public static Map<@NonNull String, @NonNull Object> extractFormParametersFromBody(@NonNull String form,
																																									 @NonNull Charset charset) {
		requireNonNull(form);
		requireNonNull(charset);

		Map<String, List<String>> valuesByName = new LinkedHashMap<>();

		for (Entry<String, String> pair : extractNameValuePairs(form, charset))
			valuesByName.computeIfAbsent(pair.getKey(), (ignored) -> new ArrayList<>()).add(pair.getValue());

		Map<String, Object> formParameters = new LinkedHashMap<>(valuesByName.size());

		for (Entry<String, List<String>> entry : valuesByName.entrySet()) {
			List<String> values = entry.getValue();
			formParameters.put(entry.getKey(), values.size() == 1 ? values.get(0) : Collections.unmodifiableList(values));
		}

		return formParameters;
	}

	@NonNull
	private static List<Entry<String, String>> extractNameValuePairs(@NonNull String encoded,
																																	 @NonNull Charset charset) {
		requireNonNull(encoded);
		requireNonNull(charset);

		List<Entry<String, String>> pairs = new ArrayList<>();

		for (String component : encoded.split("&")) {
			if (component.isEmpty())
				continue;

			int indexOfEquals = component.indexOf('=');

			// Bare names carry no value, so they are dropped like blank values
			if (indexOfEquals == -1)
				continue;

			String rawValue = component.substring(indexOfEquals + 1);

			if (rawValue.isEmpty())
				continue;

			String name = percentDecode(component.substring(0, indexOfEquals).replace('+', ' '), charset);
			String value = percentDecode(rawValue.replace('+', ' '), charset);

			pairs.add(Map.entry(name, value));
		}

		return pairs;
	}

	/**
	 * Percent-decodes a string into bytes, then constructs a String using the provided charset.
	 * <p>
	 * An invalid {@code %xy} sequence is kept as written.
	 */
	@NonNull
	private static String percentDecode(@NonNull String s,
																			@NonNull Charset charset) {
		requireNonNull(s);
		requireNonNull(charset);

		if (s.indexOf('%') == -1)
			return s;

		StringBuilder sb = new StringBuilder(s.length());
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();

		for (int i = 0; i < s.length(); ) {
			char c = s.charAt(i);

			if (c == '%') {
				// Consume one or more consecutive %xx triplets into bytes
				bytes.reset();
				int j = i;

				while (j < s.length() && s.charAt(j) == '%') {
					int hi = j + 2 < s.length() ? hex(s.charAt(j + 1)) : -1;
					int lo = j + 2 < s.length() ? hex(s.charAt(j + 2)) : -1;

					if (hi < 0 || lo < 0)
						break;

					bytes.write((hi << 4) | lo);
					j += 3;
				}

				sb.append(new String(bytes.toByteArray(), charset));

				// Keep the offending '%' literally and carry on after it
				if (j < s.length() && s.charAt(j) == '%') {
					sb.append('%');
					j++;
				}

				i = j;
				continue;
			}

			sb.append(c);
			i++;
		}

		return sb.toString();
	}

	private static int hex(char c) {
		if (c >= '0' && c <= '9') return c - '0';
		if (c >= 'A' && c <= 'F') return c - 'A' + 10;
		if (c >= 'a' && c <= 'f') return c - 'a' + 10;
		return -1;
	}

	/**
	 * Extracts the media type (without parameters) from a {@code Content-Type} header value, lower-cased.
	 * <p>
	 * For example, {@code "Application/JSON; charset=UTF-8"} → {@code "application/json"}.
	 *
	 * @param contentTypeHeaderValue the raw header value; may be {@code null} or blank
	 * @return the media type if present; otherwise {@link Optional#empty()}
	 */
	@NonNull
	public static Optional<@NonNull String> extractContentTypeFromHeaderValue(@Nullable String contentTypeHeaderValue) {
		contentTypeHeaderValue = trimAggressivelyToNull(contentTypeHeaderValue);

		if (contentTypeHeaderValue == null)
			return Optional.empty();

		int indexOfSemicolon = contentTypeHeaderValue.indexOf(";");

		String contentType = indexOfSemicolon == -1 ? contentTypeHeaderValue : contentTypeHeaderValue.substring(0, indexOfSemicolon);
		contentType = trimAggressivelyToNull(contentType);

		return Optional.ofNullable(contentType == null ? null : contentType.toLowerCase(ENGLISH));
	}

	/**
	 * Escapes the five HTML-significant characters so that text can be embedded in markup.
	 *
	 * @param text the text to escape
	 * @return the escaped text
	 */
	@NonNull
	public static String escapeHtml(@NonNull String text) {
		requireNonNull(text);

		StringBuilder escaped = new StringBuilder(text.length() + 16);

		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);

			switch (c) {
				case '&' -> escaped.append("&amp;");
				case '<' -> escaped.append("&lt;");
				case '>' -> escaped.append("&gt;");
				case '"' -> escaped.append("&quot;");
				case '\'' -> escaped.append("&#x27;");
				default -> escaped.append(c);
			}
		}

		return escaped.toString();
	}

	/**
	 * A "stronger" version of {@link String#trim()} which discards any kind of whitespace or invisible separator.
	 *
	 * @param string the string to trim
	 * @return the trimmed string, or {@code null} if the input string is {@code null}
	 */
	@Nullable
	public static String trimAggressively(@Nullable String string) {
		if (string == null)
			return null;

		string = HEAD_WHITESPACE_PATTERN.matcher(string.trim()).replaceAll("");

		if (string.length() == 0)
			return string;

		return TAIL_WHITESPACE_PATTERN.matcher(string).replaceAll("").trim();
	}

	@Nullable
	public static String trimAggressivelyToNull(@Nullable String string) {
		if (string == null)
			return null;

		string = trimAggressively(string);
		return string.length() == 0 ? null : string;
	}

	@NonNull
	public static String trimAggressivelyToEmpty(@Nullable String string) {
		if (string == null)
			return "";

		return trimAggressively(string);
	}

	/**
	 * Rejects header names and values that could split or corrupt a response's header block.
	 *
	 * @param name  the header name
	 * @param value the header value
	 * @throws IllegalArgumentException if the name is blank or not an RFC 9110 token, or if the value contains CR, LF or other control characters
	 */
	static void validateHeaderNameAndValue(@Nullable String name,
																				 @Nullable String value) {
		if (name == null || name.isEmpty())
			throw new IllegalArgumentException("Header name is blank");

		for (int i = 0; i < name.length(); i++) {
			char c = name.charAt(i);
			// RFC 9110 tchar: "!" / "#" / "$" / "%" / "&" / "'" / "*" / "+" / "-" / "." / "^" / "_" / "`" / "|" / "~" / DIGIT / ALPHA
			if (c > 0x7F || !(c == '!' || c == '#' || c == '$' || c == '%' || c == '&' || c == '\'' || c == '*' || c == '+' ||
					c == '-' || c == '.' || c == '^' || c == '_' || c == '`' || c == '|' || c == '~' ||
					Character.isLetterOrDigit(c))) {
				throw new IllegalArgumentException(format("Illegal header name '%s'. Offending character: '%s'", printableString(name), printableChar(c)));
			}
		}

		if (value == null)
			throw new IllegalArgumentException(format("Header '%s' has a null value", name));

		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);

			if (c == '\r' || c == '\n' || c == 0x00 || (c < 0x20 && c != '\t') || c == 0x7F)
				throw new IllegalArgumentException(format("Illegal header value '%s' for header name '%s'. Offending character: '%s'", printableString(value), name, printableChar(c)));
		}
	}

	@NonNull
	static String printableString(@NonNull String input) {
		requireNonNull(input);

		StringBuilder out = new StringBuilder(input.length() + 16);

		for (int i = 0; i < input.length(); i++)
			out.append(printableChar(input.charAt(i)));

		return out.toString();
	}

	@NonNull
	static String printableChar(char c) {
		if (c == '\r') return "\\r";
		if (c == '\n') return "\\n";
		if (c == '\t') return "\\t";
		if (c == 0) return "\\0";

		if (c < 0x20 || c == 0x7F)  // control chars
			return String.format("\\u%04X", (int) c);

		return String.valueOf(c);
	}
}
