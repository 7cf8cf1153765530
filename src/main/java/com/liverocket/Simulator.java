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

import java.net.InetSocketAddress;
import java.util.function.Consumer;

/**
 * Simulates server behavior of accepting a request and returning a response, useful for writing integration tests.
 * <p>
 * Instances of {@link Simulator} are made available via {@link LiveRocket#runSimulator(LiveRocketConfig, Consumer)}.
 * <p>
 * Usage example:
 * <pre>{@code @Test
 * public void greetTest() {
 *   RouteTable routeTable = new RouteTable();
 *   routeTable.get("/greet/<name>", (request, response, pathParameters) ->
 *     response.send("hi " + pathParameters.getString("name").get()));
 *
 *   LiveRocketConfig config = LiveRocketConfig.forSimulatorTesting()
 *     .routeTable(routeTable)
 *     .build();
 *
 *   LiveRocket.runSimulator(config, (simulator -> {
 *     RequestResult result = simulator.performRequest(Request.with(HttpMethod.GET, "/greet/bob").build());
 *     Assertions.assertEquals("hi bob", result.getBodyAsString());
 *   }));
 * }}</pre>
 */
public interface Simulator {
	/**
	 * Given a request, dispatch it and return the result, including the bytes that would be sent over the wire.
	 *
	 * @param request the request to process
	 * @return the result that corresponds to the request
	 */
	@NonNull
	RequestResult performRequest(@NonNull Request request);

	/**
	 * Given the raw bytes of a request, parse them with the configured {@link RequestParser} and dispatch the result.
	 * <p>
	 * Bytes that cannot be parsed produce the same {@code 500 Internal Server Error} response a real connection would receive.
	 *
	 * @param requestBytes the raw request bytes
	 * @return the result that corresponds to the request
	 */
	@NonNull
	RequestResult performRawRequest(@NonNull byte[] requestBytes);

	/**
	 * Like {@link #performRawRequest(byte[])}, but with the given client address attached to the parsed request.
	 *
	 * @param requestBytes  the raw request bytes
	 * @param remoteAddress the simulated client address, or {@code null} for none
	 * @return the result that corresponds to the request
	 */
	@NonNull
	RequestResult performRawRequest(@NonNull byte[] requestBytes,
																	@Nullable InetSocketAddress remoteAddress);
}
