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

import com.liverocket.exception.MiddlewareConfigurationException;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ThreadSafe
public class RouteTableTests {
	@Test
	public void exactRouteTakesPrecedenceOverPatternRoute() {
		RouteTable routeTable = new RouteTable();
		RouteHandler patternHandler = (request, response, pathParameters) -> response.send("pattern");
		RouteHandler exactHandler = (request, response, pathParameters) -> response.send("exact");

		// Pattern registered first on purpose
		routeTable.get("/users/<name>", patternHandler);
		routeTable.get("/users/me", exactHandler);

		RouteMatch routeMatch = routeTable.resolve("/users/me", HttpMethod.GET).orElseThrow();

		assertSame(exactHandler, routeMatch.getRoute().getRouteHandler());
		assertTrue(routeMatch.getPathParameters().isEmpty());
		assertSame(patternHandler, routeTable.resolve("/users/bob", HttpMethod.GET).orElseThrow().getRoute().getRouteHandler());
	}

	@Test
	public void firstRegisteredPatternWins() {
		RouteTable routeTable = new RouteTable();
		RouteHandler first = (request, response, pathParameters) -> response.send("first");
		RouteHandler second = (request, response, pathParameters) -> response.send("second");

		routeTable.get("/items/<int:id>", first);
		routeTable.get("/items/<name>", second);

		assertSame(first, routeTable.resolve("/items/5", HttpMethod.GET).orElseThrow().getRoute().getRouteHandler());
		assertSame(second, routeTable.resolve("/items/abc", HttpMethod.GET).orElseThrow().getRoute().getRouteHandler());
	}

	@Test
	public void methodsCoexistOnSamePath() {
		RouteTable routeTable = new RouteTable();
		RouteHandler getHandler = (request, response, pathParameters) -> response.send("get");
		RouteHandler postHandler = (request, response, pathParameters) -> response.send("post");

		routeTable.get("/things", getHandler);
		routeTable.post("/things", postHandler);

		assertSame(getHandler, routeTable.resolve("/things", HttpMethod.GET).orElseThrow().getRoute().getRouteHandler());
		assertSame(postHandler, routeTable.resolve("/things", HttpMethod.POST).orElseThrow().getRoute().getRouteHandler());
		assertTrue(routeTable.resolve("/things", HttpMethod.DELETE).isEmpty());
	}

	@Test
	public void patternRoutesSkipOtherMethods() {
		RouteTable routeTable = new RouteTable();
		RouteHandler deleteHandler = (request, response, pathParameters) -> response.send("delete");
		RouteHandler putHandler = (request, response, pathParameters) -> response.send("put");

		routeTable.delete("/items/<int:id>", deleteHandler);
		routeTable.put("/items/<int:id>", putHandler);

		assertSame(putHandler, routeTable.resolve("/items/1", HttpMethod.PUT).orElseThrow().getRoute().getRouteHandler());
		assertTrue(routeTable.resolve("/items/1", HttpMethod.PATCH).isEmpty());
	}

	@Test
	public void lastExactRegistrationWins() {
		RouteTable routeTable = new RouteTable();
		RouteHandler original = (request, response, pathParameters) -> response.send("original");
		RouteHandler replacement = (request, response, pathParameters) -> response.send("replacement");

		routeTable.get("/x", original);
		routeTable.get("/x", replacement);

		assertSame(replacement, routeTable.resolve("/x", HttpMethod.GET).orElseThrow().getRoute().getRouteHandler());
	}

	@Test
	public void unmatchedPathResolvesToEmpty() {
		RouteTable routeTable = new RouteTable();
		routeTable.get("/items/<int:id>", (request, response, pathParameters) -> response.send("x"));

		assertTrue(routeTable.resolve("/items/abc", HttpMethod.GET).isEmpty());
		assertTrue(routeTable.resolve("/nothing", HttpMethod.GET).isEmpty());
	}

	@Test
	public void nullMiddlewareIsRejectedAtRegistration() {
		RouteTable routeTable = new RouteTable();
		Middleware middleware = (request) -> {};

		MiddlewareConfigurationException e = assertThrows(MiddlewareConfigurationException.class, () ->
				routeTable.get("/x", (request, response, pathParameters) -> response.send("x"), middleware, null));

		assertTrue(e.getMessage().contains("index 1"));
		assertTrue(routeTable.getRoutes().isEmpty());
	}

	@Test
	public void routeMiddlewaresAreKeptInOrder() {
		RouteTable routeTable = new RouteTable();
		Middleware first = (request) -> request.setAttribute("first", true);
		Middleware second = (request) -> request.setAttribute("second", true);

		Route route = routeTable.post("/x", (request, response, pathParameters) -> response.send("x"), first, second);

		assertEquals(List.of(first, second), route.getMiddlewares());
	}

	@Test
	public void routeGroupRegistersEachVerb() {
		RouteTable routeTable = new RouteTable();
		ItemsGroup itemsGroup = new ItemsGroup();

		List<Route> routes = routeTable.group(itemsGroup);

		assertEquals(2, routes.size());
		assertEquals(HttpMethod.GET, routes.get(0).getHttpMethod());
		assertEquals(HttpMethod.POST, routes.get(1).getHttpMethod());
		assertEquals("/ItemsGroup", routes.get(0).getPath());
		assertSame(itemsGroup.getHandler, routeTable.resolve("/ItemsGroup", HttpMethod.GET).orElseThrow().getRoute().getRouteHandler());
		assertSame(itemsGroup.postHandler, routeTable.resolve("/ItemsGroup", HttpMethod.POST).orElseThrow().getRoute().getRouteHandler());
		assertTrue(routeTable.resolve("/ItemsGroup", HttpMethod.DELETE).isEmpty());
	}

	@Test
	public void routeGroupWithExplicitPath() {
		RouteTable routeTable = new RouteTable();
		routeTable.group("/items/<int:id>", new ItemsGroup());

		RouteMatch routeMatch = routeTable.resolve("/items/3", HttpMethod.POST).orElseThrow();
		assertEquals(3L, routeMatch.getPathParameters().getLong("id").orElseThrow());
		assertEquals("/items/9", routeTable.urlFor(ItemsGroup.class, Map.of("id", 9)));
	}

	@Test
	public void urlForHandler() {
		RouteTable routeTable = new RouteTable();
		RouteHandler userHandler = (request, response, pathParameters) -> response.send("user");
		RouteHandler aboutHandler = (request, response, pathParameters) -> response.send("about");

		routeTable.get("/users/<int:userId>", userHandler);
		routeTable.get("/about", aboutHandler);

		assertEquals("/users/42", routeTable.urlFor(userHandler, Map.of("userId", 42)));
		assertEquals("/about", routeTable.urlFor(aboutHandler, Map.of()));
	}

	@Test
	public void urlForUsesMostRecentRegistration() {
		RouteTable routeTable = new RouteTable();
		RouteHandler routeHandler = (request, response, pathParameters) -> response.send("x");

		routeTable.get("/old/<id>", routeHandler);
		routeTable.get("/new/<id>", routeHandler);

		assertEquals("/new/1", routeTable.urlFor(routeHandler, Map.of("id", 1)));
	}

	@Test
	public void urlForUnknownHandlerFails() {
		RouteTable routeTable = new RouteTable();
		RouteHandler routeHandler = (request, response, pathParameters) -> response.send("x");

		assertThrows(IllegalArgumentException.class, () -> routeTable.urlFor(routeHandler, Map.of()));
		assertThrows(IllegalArgumentException.class, () -> routeTable.urlFor(ItemsGroup.class, Map.of()));
	}

	@ThreadSafe
	static class ItemsGroup implements RouteGroup {
		final RouteHandler getHandler = (request, response, pathParameters) -> response.send("list");
		final RouteHandler postHandler = (request, response, pathParameters) -> response.send("created", StatusCode.HTTP_201);

		@Override
		public Map<HttpMethod, RouteHandler> getRouteHandlersByHttpMethod() {
			return Map.of(HttpMethod.GET, getHandler, HttpMethod.POST, postHandler);
		}
	}
}
