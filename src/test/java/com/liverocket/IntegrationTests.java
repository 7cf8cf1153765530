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
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ThreadSafe
public class IntegrationTests {
	private static class QuietLifecycleObserver implements LifecycleObserver {
		@Override
		public void didReceiveLogEvent(LogEvent logEvent) { /* no-op */ }
	}

	private static LiveRocket startApp(int port, RouteTable routeTable) {
		return startApp(Server.withPort(port).host("127.0.0.1").build(), routeTable);
	}

	private static LiveRocket startApp(Server server, RouteTable routeTable) {
		LiveRocketConfig liveRocketConfig = LiveRocketConfig.withServer(server)
				.routeTable(routeTable)
				.lifecycleObserver(new QuietLifecycleObserver())
				.build();

		LiveRocket liveRocket = LiveRocket.withConfig(liveRocketConfig);
		liveRocket.start();
		return liveRocket;
	}

	private static RouteTable demoRoutes() {
		RouteTable routeTable = new RouteTable();

		routeTable.get("/greet/<name>", (request, response, pathParameters) ->
				response.send("hi " + pathParameters.getString("name").get()));

		routeTable.get("/boom", (request, response, pathParameters) -> {
			throw new IllegalStateException("kaboom");
		});

		routeTable.post("/echo", (request, response, pathParameters) ->
				response.send(request.getBody().getBytesAsString()));

		return routeTable;
	}

	@Test
	public void greetOverNetwork() throws Exception {
		int port = TestSupport.findFreePort();

		try (LiveRocket app = startApp(port, demoRoutes())) {
			String response = TestSupport.exchange(port, "GET /greet/bob HTTP/1.1\r\nHost: localhost\r\n\r\n");

			assertEquals("HTTP/1.1 200 OK\r\n"
					+ "Content-Type: text/plain\r\n"
					+ "Content-Length: 6\r\n"
					+ "Connection: close\r\n"
					+ "\r\n"
					+ "hi bob", response);
		}
	}

	@Test
	public void notFoundOverNetwork() throws Exception {
		int port = TestSupport.findFreePort();

		try (LiveRocket app = startApp(port, demoRoutes())) {
			String response = TestSupport.exchange(port, "GET /nope HTTP/1.1\r\n\r\n");

			assertTrue(response.startsWith("HTTP/1.1 404 Not Found\r\n"));
			assertTrue(response.contains("Route not found"));
		}
	}

	@Test
	public void handlerErrorOverNetworkClosesCleanly() throws Exception {
		int port = TestSupport.findFreePort();

		try (LiveRocket app = startApp(port, demoRoutes())) {
			String response = TestSupport.exchange(port, "GET /boom HTTP/1.1\r\n\r\n");

			assertTrue(response.startsWith("HTTP/1.1 500 Internal Server Error\r\n"));
			assertTrue(response.contains("Connection: close\r\n"));
			assertTrue(response.endsWith("<p>Internal Server Error: kaboom</p>"));

			// Server keeps serving after a failure
			assertTrue(TestSupport.exchange(port, "GET /greet/again HTTP/1.1\r\n\r\n").endsWith("hi again"));
		}
	}

	@Test
	public void malformedRequestOverNetwork() throws Exception {
		int port = TestSupport.findFreePort();

		try (LiveRocket app = startApp(port, demoRoutes())) {
			String response = TestSupport.exchange(port, "NONSENSE\r\n\r\n");

			assertTrue(response.startsWith("HTTP/1.1 500 Internal Server Error\r\n"));
			assertTrue(response.contains("Malformed request line"));
		}
	}

	@Test
	public void bodySplitAcrossWritesIsReadCompletely() throws Exception {
		int port = TestSupport.findFreePort();

		try (LiveRocket app = startApp(port, demoRoutes());
				 Socket socket = TestSupport.connectWithRetry("127.0.0.1", port, 5_000)) {
			OutputStream out = socket.getOutputStream();
			out.write("POST /echo HTTP/1.1\r\nContent-Type: text/plain\r\nContent-Length: 11\r\n\r\nhello".getBytes(StandardCharsets.UTF_8));
			out.flush();

			Thread.sleep(200);

			out.write(" world".getBytes(StandardCharsets.UTF_8));
			out.flush();

			String response = new String(TestSupport.readAll(socket.getInputStream()), StandardCharsets.UTF_8);
			assertTrue(response.endsWith("\r\n\r\nhello world"), response);
		}
	}

	@Test
	public void oversizedRequestIsRejected() throws Exception {
		int port = TestSupport.findFreePort();
		Server server = Server.withPort(port)
				.host("127.0.0.1")
				.maximumRequestSizeInBytes(64)
				.build();

		try (LiveRocket app = startApp(server, demoRoutes())) {
			String response = TestSupport.exchange(port, "POST /echo HTTP/1.1\r\nContent-Length: 1000\r\n\r\n");

			assertTrue(response.startsWith("HTTP/1.1 500 Internal Server Error\r\n"));
			assertTrue(response.contains("Request exceeds maximum size of 64 bytes"));
		}
	}

	@Test
	public void emptyConnectionIsClosedWithoutResponse() throws Exception {
		int port = TestSupport.findFreePort();

		try (LiveRocket app = startApp(port, demoRoutes())) {
			try (Socket socket = TestSupport.connectWithRetry("127.0.0.1", port, 5_000)) {
				socket.shutdownOutput();
				assertEquals(0, TestSupport.readAll(socket.getInputStream()).length);
			}

			assertTrue(TestSupport.exchange(port, "GET /greet/next HTTP/1.1\r\n\r\n").endsWith("hi next"));
		}
	}

	@Test
	public void slowHandlerDoesNotBlockOthers() throws Exception {
		int port = TestSupport.findFreePort();
		CountDownLatch slowHandlerEntered = new CountDownLatch(1);
		CountDownLatch releaseSlowHandler = new CountDownLatch(1);
		RouteTable routeTable = demoRoutes();

		routeTable.get("/slow", (request, response, pathParameters) -> {
			slowHandlerEntered.countDown();
			releaseSlowHandler.await(10, TimeUnit.SECONDS);
			response.send("slow");
		});

		ExecutorService executorService = Executors.newFixedThreadPool(8);

		try (LiveRocket app = startApp(port, routeTable)) {
			Future<String> slowResponse = executorService.submit(() -> TestSupport.exchange(port, "GET /slow HTTP/1.1\r\n\r\n"));
			assertTrue(slowHandlerEntered.await(5, TimeUnit.SECONDS));

			List<Future<String>> fastResponses = new ArrayList<>();

			for (int i = 0; i < 16; i++) {
				String name = "user" + i;
				fastResponses.add(executorService.submit(() -> TestSupport.exchange(port, "GET /greet/" + name + " HTTP/1.1\r\n\r\n")));
			}

			for (int i = 0; i < fastResponses.size(); i++)
				assertTrue(fastResponses.get(i).get(5, TimeUnit.SECONDS).endsWith("hi user" + i));

			assertFalse(slowResponse.isDone());

			releaseSlowHandler.countDown();
			assertTrue(slowResponse.get(5, TimeUnit.SECONDS).endsWith("\r\n\r\nslow"));
		} finally {
			releaseSlowHandler.countDown();
			executorService.shutdownNow();
		}
	}

	@Test
	public void startAndStopAreIdempotent() throws Exception {
		int port = TestSupport.findFreePort();
		List<String> events = new ArrayList<>();

		LifecycleObserver lifecycleObserver = new QuietLifecycleObserver() {
			@Override
			public void willStartLiveRocket(LiveRocket liveRocket) {
				events.add("willStart");
			}

			@Override
			public void didStartLiveRocket(LiveRocket liveRocket) {
				events.add("didStart");
			}

			@Override
			public void willStopLiveRocket(LiveRocket liveRocket) {
				events.add("willStop");
			}

			@Override
			public void didStopLiveRocket(LiveRocket liveRocket) {
				events.add("didStop");
			}
		};

		LiveRocket liveRocket = LiveRocket.withConfig(LiveRocketConfig.withServer(Server.withPort(port).host("127.0.0.1").build())
				.routeTable(demoRoutes())
				.lifecycleObserver(lifecycleObserver)
				.build());

		liveRocket.start();
		liveRocket.start();
		assertTrue(liveRocket.isStarted());

		liveRocket.stop();
		liveRocket.stop();
		assertFalse(liveRocket.isStarted());

		assertEquals(List.of("willStart", "didStart", "willStop", "didStop"), events);
	}

	@Test
	public void awaitShutdownReturnsWhenStopped() throws Exception {
		int port = TestSupport.findFreePort();
		LiveRocket liveRocket = startApp(port, demoRoutes());
		CountDownLatch shutdownReturned = new CountDownLatch(1);

		Thread waiter = new Thread(() -> {
			try {
				liveRocket.awaitShutdown();
				shutdownReturned.countDown();
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
		});

		waiter.start();
		liveRocket.stop();

		assertTrue(shutdownReturned.await(5, TimeUnit.SECONDS));
		assertFalse(liveRocket.isStarted());
	}

	@Test
	public void portInUseFailsToStart() throws Exception {
		try (ServerSocket occupied = new ServerSocket(0)) {
			int port = occupied.getLocalPort();

			LiveRocket liveRocket = LiveRocket.withConfig(LiveRocketConfig.withServer(Server.withPort(port).build())
					.lifecycleObserver(new QuietLifecycleObserver())
					.build());

			UncheckedIOException e = assertThrows(UncheckedIOException.class, liveRocket::start);
			assertTrue(e.getMessage().contains(String.valueOf(port)));
			assertFalse(liveRocket.isStarted());
		}
	}

	@Test
	public void maximumConnectionsStillServesSequentialRequests() throws Exception {
		int port = TestSupport.findFreePort();
		Server server = Server.withPort(port)
				.host("127.0.0.1")
				.maximumConnections(1)
				.shutdownTimeout(Duration.ofSeconds(1))
				.build();

		try (LiveRocket app = startApp(server, demoRoutes())) {
			for (int i = 0; i < 5; i++)
				assertTrue(TestSupport.exchange(port, "GET /greet/n" + i + " HTTP/1.1\r\n\r\n").endsWith("hi n" + i));
		}
	}

	@Test
	public void invalidServerConfigurationIsRejected() {
		assertThrows(IllegalArgumentException.class, () -> Server.withPort(70_000).build());
		assertThrows(IllegalArgumentException.class, () -> Server.withPort(8080).maximumConnections(-1).build());
		assertThrows(IllegalArgumentException.class, () -> Server.withPort(8080).maximumRequestSizeInBytes(0).build());
	}

	@Test
	public void readRequestStopsAtDeclaredBodyLength() throws IOException {
		try (Socket unconnectedSocket = new Socket()) {
			ConnectionHandler connectionHandler = new ConnectionHandler(unconnectedSocket, (request) -> {
				throw new UnsupportedOperationException();
			}, RequestParser.defaultInstance(), ResponseMarshaler.defaultInstance(), new QuietLifecycleObserver(), 1, 1_024);

			byte[] rawRequest = "POST / HTTP/1.1\r\nContent-Length: 3\r\n\r\nabcEXTRA".getBytes(StandardCharsets.UTF_8);
			byte[] read = connectionHandler.readRequest(new ByteArrayInputStream(rawRequest));

			assertEquals("POST / HTTP/1.1\r\nContent-Length: 3\r\n\r\nabc", new String(read, StandardCharsets.UTF_8));
		}
	}

	@Test
	public void connectionHandlerClosesAfterServingOneRequest() throws Exception {
		try (ServerSocket serverSocket = new ServerSocket(0);
				 Socket client = TestSupport.connectWithRetry("127.0.0.1", serverSocket.getLocalPort(), 5_000);
				 Socket accepted = serverSocket.accept()) {
			Response response = new Response();
			response.send("handled");

			ConnectionHandler connectionHandler = new ConnectionHandler(accepted, (request) ->
					RequestResult.with(response.getStatus(), response.getBody(), ResponseMarshaler.defaultInstance().marshal(response)).build(),
					RequestParser.defaultInstance(), ResponseMarshaler.defaultInstance(), new QuietLifecycleObserver(), 4_096, 1_024);

			assertEquals(ConnectionHandler.ConnectionState.ACCEPTED, connectionHandler.getConnectionState());

			client.getOutputStream().write("GET /anything HTTP/1.1\r\n\r\n".getBytes(StandardCharsets.UTF_8));
			client.getOutputStream().flush();

			connectionHandler.run();

			assertEquals(ConnectionHandler.ConnectionState.CLOSED, connectionHandler.getConnectionState());
			assertTrue(accepted.isClosed());
			assertTrue(new String(TestSupport.readAll(client.getInputStream()), StandardCharsets.UTF_8).endsWith("\r\n\r\nhandled"));
		}
	}
}
