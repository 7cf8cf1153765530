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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Services a single accepted connection: reads one request, parses it, hands it to the {@link Server.RequestHandler},
 * writes the response and closes the socket.
 * <p>
 * Any failure after the request has been read is answered with a {@code 500 Internal Server Error} response carrying the
 * failure's message. If the client closes the connection without sending anything, it is closed without a response.
 */
@NotThreadSafe
final class ConnectionHandler implements Runnable {
	/**
	 * Where a connection is in its lifecycle.
	 */
	enum ConnectionState {
		ACCEPTED,
		READ,
		PARSED,
		DISPATCHED,
		RESPONDED,
		ERROR,
		CLOSED
	}

	@Nonnull
	private final Socket socket;
	@Nonnull
	private final Server.RequestHandler requestHandler;
	@Nonnull
	private final RequestParser requestParser;
	@Nonnull
	private final ResponseMarshaler responseMarshaler;
	@Nonnull
	private final LifecycleObserver lifecycleObserver;
	@Nonnull
	private final Integer requestReadBufferSizeInBytes;
	@Nonnull
	private final Integer maximumRequestSizeInBytes;
	@Nonnull
	private ConnectionState connectionState;

	ConnectionHandler(@Nonnull Socket socket,
										@Nonnull Server.RequestHandler requestHandler,
										@Nonnull RequestParser requestParser,
										@Nonnull ResponseMarshaler responseMarshaler,
										@Nonnull LifecycleObserver lifecycleObserver,
										@Nonnull Integer requestReadBufferSizeInBytes,
										@Nonnull Integer maximumRequestSizeInBytes) {
		requireNonNull(socket);
		requireNonNull(requestHandler);
		requireNonNull(requestParser);
		requireNonNull(responseMarshaler);
		requireNonNull(lifecycleObserver);
		requireNonNull(requestReadBufferSizeInBytes);
		requireNonNull(maximumRequestSizeInBytes);

		this.socket = socket;
		this.requestHandler = requestHandler;
		this.requestParser = requestParser;
		this.responseMarshaler = responseMarshaler;
		this.lifecycleObserver = lifecycleObserver;
		this.requestReadBufferSizeInBytes = requestReadBufferSizeInBytes;
		this.maximumRequestSizeInBytes = maximumRequestSizeInBytes;
		this.connectionState = ConnectionState.ACCEPTED;
	}

	@Override
	public void run() {
		Request request = null;

		try {
			byte[] requestBytes = readRequest(this.socket.getInputStream());
			this.connectionState = ConnectionState.READ;

			// Client went away without sending anything
			if (requestBytes.length == 0)
				return;

			request = this.requestParser.parse(requestBytes, remoteAddress().orElse(null));
			this.connectionState = ConnectionState.PARSED;

			RequestResult requestResult = this.requestHandler.handleRequest(request);
			this.connectionState = ConnectionState.DISPATCHED;

			write(requestResult.getMarshaledResponse());
		} catch (MalformedRequestException e) {
			this.connectionState = ConnectionState.ERROR;
			safelyLog(LogEvent.with(LogEventType.SERVER_UNPARSEABLE_REQUEST, format("Unable to parse request: %s", e.getMessage()))
					.throwable(e)
					.build());
			writeFailsafeResponse(e, request);
		} catch (IOException e) {
			this.connectionState = ConnectionState.ERROR;
			safelyLog(LogEvent.with(LogEventType.CONNECTION_IO_FAILED, "Unable to read request or write response")
					.throwable(e)
					.request(request)
					.build());
		} catch (Throwable t) {
			this.connectionState = ConnectionState.ERROR;
			safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "An unexpected error occurred during connection handling")
					.throwable(t)
					.request(request)
					.build());
			writeFailsafeResponse(t, request);
		} finally {
			close();
		}
	}

	/**
	 * Reads until the request head is complete and, if the head declares a {@code Content-Length}, until that many body
	 * bytes have arrived. Stops early at end of stream.
	 */
	@Nonnull
	byte[] readRequest(@Nonnull InputStream inputStream) throws IOException {
		requireNonNull(inputStream);

		ByteArrayOutputStream requestBytes = new ByteArrayOutputStream(this.requestReadBufferSizeInBytes);
		byte[] buffer = new byte[this.requestReadBufferSizeInBytes];
		Integer expectedLength = null;

		while (true) {
			int bytesRead = inputStream.read(buffer);

			if (bytesRead == -1)
				break;

			requestBytes.write(buffer, 0, bytesRead);

			if (requestBytes.size() > this.maximumRequestSizeInBytes)
				throw new MalformedRequestException(format("Request exceeds maximum size of %d bytes", this.maximumRequestSizeInBytes));

			if (expectedLength == null) {
				byte[] bytesSoFar = requestBytes.toByteArray();
				int headerTerminatorIndex = DefaultRequestParser.indexOfHeaderTerminator(bytesSoFar, bytesSoFar.length);

				if (headerTerminatorIndex != -1) {
					int headLength = headerTerminatorIndex + 4;
					int contentLength = extractContentLength(new String(bytesSoFar, 0, headerTerminatorIndex, StandardCharsets.UTF_8)).orElse(0);
					expectedLength = headLength + contentLength;

					if (expectedLength > this.maximumRequestSizeInBytes || expectedLength < 0)
						throw new MalformedRequestException(format("Request exceeds maximum size of %d bytes", this.maximumRequestSizeInBytes));
				}
			}

			if (expectedLength != null && requestBytes.size() >= expectedLength)
				break;
		}

		return requestBytes.toByteArray();
	}

	@Nonnull
	private static Optional<Integer> extractContentLength(@Nonnull String head) {
		requireNonNull(head);

		String contentLength = null;

		for (String line : head.split("\r\n")) {
			int indexOfColon = line.indexOf(':');

			if (indexOfColon != -1 && "CONTENT_LENGTH".equals(Utilities.normalizeHeaderName(line.substring(0, indexOfColon))))
				contentLength = line.substring(indexOfColon + 1);
		}

		return DefaultRequestParser.extractContentLength(contentLength);
	}

	private void writeFailsafeResponse(@Nonnull Throwable throwable,
																		 @Nullable Request request) {
		requireNonNull(throwable);

		if (this.socket.isClosed() || this.socket.isOutputShutdown())
			return;

		try {
			write(this.responseMarshaler.marshalError(StatusCode.HTTP_500, LiveRocket.messageFor(throwable)));
		} catch (Throwable t) {
			safelyLog(LogEvent.with(LogEventType.CONNECTION_IO_FAILED, "An error occurred while writing a failsafe response")
					.throwable(t)
					.request(request)
					.build());
		}
	}

	private void write(@Nonnull byte[] responseBytes) throws IOException {
		requireNonNull(responseBytes);

		OutputStream outputStream = this.socket.getOutputStream();
		outputStream.write(responseBytes);
		outputStream.flush();
		this.connectionState = ConnectionState.RESPONDED;
	}

	private void close() {
		try {
			this.socket.close();
		} catch (IOException e) {
			safelyLog(LogEvent.with(LogEventType.CONNECTION_IO_FAILED, "Unable to close client connection")
					.throwable(e)
					.build());
		} finally {
			this.connectionState = ConnectionState.CLOSED;
		}
	}

	@Nonnull
	private Optional<InetSocketAddress> remoteAddress() {
		SocketAddress remoteSocketAddress = this.socket.getRemoteSocketAddress();
		return remoteSocketAddress instanceof InetSocketAddress ? Optional.of((InetSocketAddress) remoteSocketAddress) : Optional.empty();
	}

	private void safelyLog(@Nonnull LogEvent logEvent) {
		requireNonNull(logEvent);

		try {
			this.lifecycleObserver.didReceiveLogEvent(logEvent);
		} catch (Throwable throwable) {
			// The LifecycleObserver implementation errored out, but we can't let that affect us - swallow its exception.
			// Not much else we can do here but dump to stderr
			throwable.printStackTrace(System.err);
		}
	}

	@Nonnull
	ConnectionState getConnectionState() {
		return this.connectionState;
	}
}
