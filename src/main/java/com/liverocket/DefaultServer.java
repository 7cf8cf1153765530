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
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.BindException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

@ThreadSafe
final class DefaultServer implements Server {
	@Nonnull
	private static final String DEFAULT_HOST;
	@Nonnull
	private static final Integer DEFAULT_MAXIMUM_REQUEST_SIZE_IN_BYTES;
	@Nonnull
	private static final Integer DEFAULT_REQUEST_READ_BUFFER_SIZE_IN_BYTES;
	@Nonnull
	private static final Integer DEFAULT_SOCKET_PENDING_CONNECTION_LIMIT;
	@Nonnull
	private static final Integer DEFAULT_MAXIMUM_CONNECTIONS;
	@Nonnull
	private static final Duration DEFAULT_SHUTDOWN_TIMEOUT;

	static {
		DEFAULT_HOST = "0.0.0.0";
		DEFAULT_MAXIMUM_REQUEST_SIZE_IN_BYTES = 1_024 * 1_024 * 10;
		DEFAULT_REQUEST_READ_BUFFER_SIZE_IN_BYTES = 1_024 * 4;
		DEFAULT_SOCKET_PENDING_CONNECTION_LIMIT = 0;
		DEFAULT_MAXIMUM_CONNECTIONS = 0;
		DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);
	}

	@Nonnull
	private final Integer port;
	@Nonnull
	private final String host;
	@Nonnull
	private final Integer maximumConnections;
	@Nonnull
	private final Integer maximumRequestSizeInBytes;
	@Nonnull
	private final Integer requestReadBufferSizeInBytes;
	@Nonnull
	private final Integer socketPendingConnectionLimit;
	@Nonnull
	private final Duration shutdownTimeout;
	@Nonnull
	private final Supplier<ExecutorService> connectionExecutorServiceSupplier;
	@Nonnull
	private final ReentrantLock lock;
	@Nullable
	private volatile ServerSocket serverSocket;
	@Nullable
	private volatile Thread acceptThread;
	@Nullable
	private volatile ExecutorService connectionExecutorService;
	@Nullable
	private volatile Semaphore connectionPermits;
	@Nullable
	private volatile RequestHandler requestHandler;
	@Nullable
	private volatile RequestParser requestParser;
	@Nullable
	private volatile ResponseMarshaler responseMarshaler;
	@Nullable
	private volatile LifecycleObserver lifecycleObserver;

	protected DefaultServer(@Nonnull Builder builder) {
		requireNonNull(builder);

		this.lock = new ReentrantLock();

		this.port = builder.port;
		this.host = builder.host != null ? builder.host : DEFAULT_HOST;
		this.maximumConnections = builder.maximumConnections != null ? builder.maximumConnections : DEFAULT_MAXIMUM_CONNECTIONS;
		this.maximumRequestSizeInBytes = builder.maximumRequestSizeInBytes != null ? builder.maximumRequestSizeInBytes : DEFAULT_MAXIMUM_REQUEST_SIZE_IN_BYTES;
		this.requestReadBufferSizeInBytes = builder.requestReadBufferSizeInBytes != null ? builder.requestReadBufferSizeInBytes : DEFAULT_REQUEST_READ_BUFFER_SIZE_IN_BYTES;
		this.socketPendingConnectionLimit = builder.socketPendingConnectionLimit != null ? builder.socketPendingConnectionLimit : DEFAULT_SOCKET_PENDING_CONNECTION_LIMIT;
		this.shutdownTimeout = builder.shutdownTimeout != null ? builder.shutdownTimeout : DEFAULT_SHUTDOWN_TIMEOUT;
		this.connectionExecutorServiceSupplier = builder.connectionExecutorServiceSupplier != null ? builder.connectionExecutorServiceSupplier : () -> {
			String threadNamePrefix = "connection-handler-";

			if (Utilities.virtualThreadsAvailable())
				return Utilities.createVirtualThreadsNewThreadPerTaskExecutor(threadNamePrefix, (Thread thread, Throwable throwable) -> {
					safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "Unexpected exception occurred during connection handling")
							.throwable(throwable)
							.build());
				});

			return Executors.newCachedThreadPool(new NonvirtualThreadFactory(threadNamePrefix));
		};

		if (this.port < 0 || this.port > 65_535)
			throw new IllegalArgumentException(format("Port must be between 0 and 65535, but was %d", this.port));

		if (this.maximumConnections < 0)
			throw new IllegalArgumentException("Maximum connections must be >= 0");

		if (this.requestReadBufferSizeInBytes <= 0)
			throw new IllegalArgumentException("Request read buffer size must be > 0");

		if (this.maximumRequestSizeInBytes <= 0)
			throw new IllegalArgumentException("Maximum request size must be > 0");

		if (this.shutdownTimeout.isNegative())
			throw new IllegalArgumentException("Shutdown timeout must be >= 0");
	}

	@Override
	public void start() {
		getLock().lock();

		try {
			if (isStarted())
				return;

			if (this.requestHandler == null)
				throw new IllegalStateException(format("No %s was registered for %s", RequestHandler.class, getClass()));

			ServerSocket serverSocket = new ServerSocket();

			try {
				serverSocket.setReuseAddress(true);
				serverSocket.bind(new InetSocketAddress(getHost(), getPort()), getSocketPendingConnectionLimit());
			} catch (BindException e) {
				closeQuietly(serverSocket);
				throw new UncheckedIOException(format("LiveRocket was unable to start the HTTP server - port %d is already in use.", getPort()), e);
			} catch (IOException e) {
				closeQuietly(serverSocket);
				throw e;
			}

			this.serverSocket = serverSocket;
			this.connectionExecutorService = getConnectionExecutorServiceSupplier().get();
			this.connectionPermits = getMaximumConnections() > 0 ? new Semaphore(getMaximumConnections()) : null;

			Thread acceptThread = new Thread(() -> acceptConnections(serverSocket), "liverocket-accept");
			this.acceptThread = acceptThread;
			acceptThread.start();
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		} finally {
			getLock().unlock();
		}
	}

	protected void acceptConnections(@Nonnull ServerSocket serverSocket) {
		requireNonNull(serverSocket);

		while (!serverSocket.isClosed()) {
			Semaphore connectionPermits = this.connectionPermits;
			boolean permitAcquired = false;

			try {
				if (connectionPermits != null) {
					connectionPermits.acquire();
					permitAcquired = true;
				}

				Socket socket = serverSocket.accept();
				ExecutorService connectionExecutorService = this.connectionExecutorService;

				if (connectionExecutorService == null) {
					closeQuietly(socket);
					break;
				}

				ConnectionHandler connectionHandler = new ConnectionHandler(socket, this.requestHandler, getRequestParser(),
						getResponseMarshaler(), getLifecycleObserver(), getRequestReadBufferSizeInBytes(), getMaximumRequestSizeInBytes());

				try {
					connectionExecutorService.execute(() -> {
						try {
							connectionHandler.run();
						} finally {
							if (connectionPermits != null)
								connectionPermits.release();
						}
					});

					// Ownership of the permit passed to the worker
					permitAcquired = false;
				} catch (RejectedExecutionException e) {
					safelyLog(LogEvent.with(LogEventType.SERVER_INTERNAL_ERROR, "Connection executor rejected task")
							.throwable(e)
							.build());
					closeQuietly(socket);
				}
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				break;
			} catch (IOException e) {
				// Closing the server socket during stop() unblocks accept() with an exception; that is the normal exit path
				if (!serverSocket.isClosed())
					safelyLog(LogEvent.with(LogEventType.CONNECTION_IO_FAILED, "Unable to accept connection")
							.throwable(e)
							.build());
			} finally {
				if (permitAcquired)
					connectionPermits.release();
			}
		}
	}

	@Override
	public void stop() {
		getLock().lock();

		try {
			if (!isStarted())
				return;

			closeQuietly(this.serverSocket);

			boolean interrupted = false;

			try {
				Thread acceptThread = this.acceptThread;

				if (acceptThread != null) {
					// Unblocks an accept loop waiting for a connection permit
					acceptThread.interrupt();
					acceptThread.join(Math.max(1L, getShutdownTimeout().toMillis()));
				}

				ExecutorService connectionExecutorService = this.connectionExecutorService;

				if (connectionExecutorService != null) {
					// Start graceful shutdown (no new tasks)
					connectionExecutorService.shutdown();

					long deadlineNanos = System.nanoTime() + getShutdownTimeout().toNanos();
					long remMillis = Math.max(0L, TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime()));
					boolean done = remMillis > 0L && connectionExecutorService.awaitTermination(remMillis, TimeUnit.MILLISECONDS);

					if (!done) {
						// Escalate: interrupt running tasks
						connectionExecutorService.shutdownNow();
						connectionExecutorService.awaitTermination(100L, TimeUnit.MILLISECONDS);
					}
				}
			} catch (InterruptedException e) {
				interrupted = true;
			} finally {
				if (interrupted)
					Thread.currentThread().interrupt();
			}
		} finally {
			this.serverSocket = null;
			this.acceptThread = null;
			this.connectionExecutorService = null;
			this.connectionPermits = null;

			getLock().unlock();
		}
	}

	@Nonnull
	@Override
	public Boolean isStarted() {
		getLock().lock();

		try {
			ServerSocket serverSocket = this.serverSocket;
			return serverSocket != null && !serverSocket.isClosed();
		} finally {
			getLock().unlock();
		}
	}

	@Override
	public void initialize(@Nonnull LiveRocketConfig liveRocketConfig,
												 @Nonnull RequestHandler requestHandler) {
		requireNonNull(liveRocketConfig);
		requireNonNull(requestHandler);

		this.requestHandler = requestHandler;
		this.requestParser = liveRocketConfig.getRequestParser();
		this.responseMarshaler = liveRocketConfig.getResponseMarshaler();
		this.lifecycleObserver = liveRocketConfig.getLifecycleObserver();
	}

	protected void safelyLog(@Nonnull LogEvent logEvent) {
		requireNonNull(logEvent);

		try {
			getLifecycleObserver().didReceiveLogEvent(logEvent);
		} catch (Throwable throwable) {
			// The LifecycleObserver implementation errored out, but we can't let that affect us - swallow its exception.
			// Not much else we can do here but dump to stderr
			throwable.printStackTrace(System.err);
		}
	}

	private void closeQuietly(@Nullable AutoCloseable closeable) {
		if (closeable == null)
			return;

		try {
			closeable.close();
		} catch (Exception e) {
			safelyLog(LogEvent.with(LogEventType.CONNECTION_IO_FAILED, format("Unable to close %s", closeable))
					.throwable(e)
					.build());
		}
	}

	@Override
	public String toString() {
		return format("%s{host=%s, port=%s, maximumConnections=%s}", getClass().getSimpleName(), getHost(), getPort(), getMaximumConnections());
	}

	@Nonnull
	protected Integer getPort() {
		return this.port;
	}

	@Nonnull
	protected String getHost() {
		return this.host;
	}

	@Nonnull
	protected Integer getMaximumConnections() {
		return this.maximumConnections;
	}

	@Nonnull
	protected Integer getMaximumRequestSizeInBytes() {
		return this.maximumRequestSizeInBytes;
	}

	@Nonnull
	protected Integer getRequestReadBufferSizeInBytes() {
		return this.requestReadBufferSizeInBytes;
	}

	@Nonnull
	protected Integer getSocketPendingConnectionLimit() {
		return this.socketPendingConnectionLimit;
	}

	@Nonnull
	protected Duration getShutdownTimeout() {
		return this.shutdownTimeout;
	}

	@Nonnull
	protected Supplier<ExecutorService> getConnectionExecutorServiceSupplier() {
		return this.connectionExecutorServiceSupplier;
	}

	@Nonnull
	protected RequestParser getRequestParser() {
		RequestParser requestParser = this.requestParser;
		return requestParser == null ? RequestParser.defaultInstance() : requestParser;
	}

	@Nonnull
	protected ResponseMarshaler getResponseMarshaler() {
		ResponseMarshaler responseMarshaler = this.responseMarshaler;
		return responseMarshaler == null ? ResponseMarshaler.defaultInstance() : responseMarshaler;
	}

	@Nonnull
	protected LifecycleObserver getLifecycleObserver() {
		LifecycleObserver lifecycleObserver = this.lifecycleObserver;
		return lifecycleObserver == null ? LifecycleObserver.defaultInstance() : lifecycleObserver;
	}

	@Nonnull
	protected ReentrantLock getLock() {
		return this.lock;
	}

	protected static class NonvirtualThreadFactory implements ThreadFactory {
		@Nonnull
		private final String namePrefix;
		@Nonnull
		private final AtomicInteger idGenerator;

		public NonvirtualThreadFactory(@Nonnull String namePrefix) {
			requireNonNull(namePrefix);

			this.namePrefix = namePrefix;
			this.idGenerator = new AtomicInteger(0);
		}

		@Override
		@Nonnull
		public Thread newThread(@Nonnull Runnable runnable) {
			String name = format("%s%s", getNamePrefix(), getIdGenerator().incrementAndGet());
			return new Thread(runnable, name);
		}

		@Nonnull
		protected String getNamePrefix() {
			return this.namePrefix;
		}

		@Nonnull
		protected AtomicInteger getIdGenerator() {
			return this.idGenerator;
		}
	}
}
