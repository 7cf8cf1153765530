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
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.net.InetSocketAddress;

/**
 * Converts the raw bytes of a single HTTP/1.1 request into a {@link Request}.
 * <p>
 * A standard threadsafe implementation can be acquired via the {@link #defaultInstance()} factory method.
 */
@FunctionalInterface
public interface RequestParser {
	/**
	 * Parses a complete request.
	 *
	 * @param requestBytes  the request line, headers, blank line and body as read from the connection
	 * @param remoteAddress the client's address, if known
	 * @return the parsed request
	 * @throws MalformedRequestException if the bytes are not a well-formed request
	 */
	@NonNull
	Request parse(@NonNull byte[] requestBytes,
								@Nullable InetSocketAddress remoteAddress);

	/**
	 * Acquires a threadsafe {@link RequestParser} instance with sensible defaults.
	 *
	 * @return a {@code RequestParser} with default settings
	 */
	@NonNull
	static RequestParser defaultInstance() {
		return DefaultRequestParser.defaultInstance();
	}
}
