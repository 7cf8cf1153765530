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
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * A TCP listener that accepts connections and hands each one to a worker, which reads a single request, writes a single
 * response and closes the connection.
 * <p>
 * A standard implementation can be acquired via the {@link #withPort(Integer)} builder factory method.
 */
public interface Server extends AutoCloseable {
	/**
	 * Binds the listening socket and starts accepting connections.
	 * <p>
	 * If the server is already started, no action is taken.
	 * <p>
	 * <strong>This method is designed for internal use by {@link LiveRocket} only and should not be invoked elsewhere.</strong>
	 *
	 * @throws java.io.UncheckedIOException if the socket cannot be bound, for example because the port is in use
	 */
	void start();

	/**
	 * Closes the listening socket, then waits up to the configured shutdown timeout for in-flight connections to finish
	 * before interrupting them.
	 * <p>
	 * If the server is already stopped, no action is taken.
	 * <p>
	 * <strong>This method is designed for internal use by {@link LiveRocket} only and should not be invoked elsewhere.</strong>
	 */
	void stop();

	@NonNull
	Boolean isStarted();

	/**
	 * Supplies the collaborators the server needs to process connections.
	 * <p>
	 * <strong>This method is designed for internal use by {@link LiveRocket} only and should not be invoked elsewhere.</strong>
	 *
	 * @param liveRocketConfig configuration providing the request parser, response marshaler and lifecycle observer
	 * @param requestHandler   dispatches parsed requests
	 */
	void initialize(@NonNull LiveRocketConfig liveRocketConfig,
									@NonNull RequestHandler requestHandler);

	@Override
	default void close() throws Exception {
		stop();
	}

	/**
	 * Dispatches a parsed request and produces the bytes to write back. Implementations must not throw.
	 */
	@FunctionalInterface
	interface RequestHandler {
		@NonNull
		RequestResult handleRequest(@NonNull Request request);
	}

	/**
	 * Acquires a builder for a standard {@link Server} implementation.
	 *
	 * @param port the port to listen on
	 * @return the builder
	 */
	@NonNull
	static Builder withPort(@NonNull Integer port) {
		requireNonNull(port);
		return new Builder(port);
	}

	/**
	 * Builder used to construct a standard implementation of {@link Server}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	final class Builder {
		@NonNull
		Integer port;
		@Nullable
		String host;
		@Nullable
		Integer maximumConnections;
		@Nullable
		Integer requestReadBufferSizeInBytes;
		@Nullable
		Integer maximumRequestSizeInBytes;
		@Nullable
		Integer socketPendingConnectionLimit;
		@Nullable
		Duration shutdownTimeout;
		@Nullable
		Supplier<ExecutorService> connectionExecutorServiceSupplier;

		@NonNull
		private Builder(@NonNull Integer port) {
			requireNonNull(port);
			this.port = port;
		}

		@NonNull
		public Builder port(@NonNull Integer port) {
			requireNonNull(port);
			this.port = port;
			return this;
		}

		/**
		 * The interface to bind, {@code 0.0.0.0} by default.
		 */
		@NonNull
		public Builder host(@Nullable String host) {
			this.host = host;
			return this;
		}

		/**
		 * The most connections processed at once. When the limit is reached, accepting waits for a connection to finish.
		 * {@code 0}, the default, means unbounded.
		 */
		@NonNull
		public Builder maximumConnections(@Nullable Integer maximumConnections) {
			this.maximumConnections = maximumConnections;
			return this;
		}

		@NonNull
		public Builder requestReadBufferSizeInBytes(@Nullable Integer requestReadBufferSizeInBytes) {
			this.requestReadBufferSizeInBytes = requestReadBufferSizeInBytes;
			return this;
		}

		/**
		 * The largest request, head and body together, the server will read. Larger requests are rejected as malformed.
		 * 10 MiB by default.
		 */
		@NonNull
		public Builder maximumRequestSizeInBytes(@Nullable Integer maximumRequestSizeInBytes) {
			this.maximumRequestSizeInBytes = maximumRequestSizeInBytes;
			return this;
		}

		@NonNull
		public Builder socketPendingConnectionLimit(@Nullable Integer socketPendingConnectionLimit) {
			this.socketPendingConnectionLimit = socketPendingConnectionLimit;
			return this;
		}

		@NonNull
		public Builder shutdownTimeout(@Nullable Duration shutdownTimeout) {
			this.shutdownTimeout = shutdownTimeout;
			return this;
		}

		/**
		 * Supplies the executor that runs one task per connection. By default, a virtual-thread-per-task executor when the
		 * runtime has virtual threads, otherwise a cached pool of platform threads.
		 */
		@NonNull
		public Builder connectionExecutorServiceSupplier(@Nullable Supplier<ExecutorService> connectionExecutorServiceSupplier) {
			this.connectionExecutorServiceSupplier = connectionExecutorServiceSupplier;
			return this;
		}

		@NonNull
		public Server build() {
			return new DefaultServer(this);
		}
	}
}
