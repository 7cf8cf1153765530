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

/**
 * Serializes responses into the exact bytes written to a connection.
 * <p>
 * Implementations must not mutate the {@link Response}, so marshaling the same response twice yields identical bytes.
 * <p>
 * A standard threadsafe implementation can be acquired via the {@link #defaultInstance()} factory method.
 */
public interface ResponseMarshaler {
	/**
	 * Serializes a handler's response.
	 *
	 * @param response the response to serialize
	 * @return the complete HTTP/1.1 response bytes
	 * @throws IllegalArgumentException if a header name or value would corrupt the header block, for example by containing CR or LF
	 */
	@NonNull
	byte[] marshal(@NonNull Response response);

	/**
	 * Serializes a framework-generated error response with an HTML body naming the status and a message.
	 *
	 * @param statusCode the error status
	 * @param message    the message to include, which is HTML-escaped
	 * @return the complete HTTP/1.1 response bytes
	 */
	@NonNull
	byte[] marshalError(@NonNull StatusCode statusCode,
											@NonNull String message);

	/**
	 * Acquires a threadsafe {@link ResponseMarshaler} instance with sensible defaults.
	 *
	 * @return a {@code ResponseMarshaler} with default settings
	 */
	@NonNull
	static ResponseMarshaler defaultInstance() {
		return DefaultResponseMarshaler.defaultInstance();
	}
}
