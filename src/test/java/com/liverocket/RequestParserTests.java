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
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ThreadSafe
public class RequestParserTests {
	@Test
	public void parsesRequestLineQueryAndHeaders() {
		InetSocketAddress remoteAddress = new InetSocketAddress("127.0.0.1", 50000);
		Request request = parse("GET /search?q=hello+world&page=2 HTTP/1.1\r\nHost: localhost\r\nX-Request-Id:  abc  \r\n\r\n", remoteAddress);

		assertEquals("GET", request.getMethod());
		assertEquals(Optional.of(HttpMethod.GET), request.getHttpMethod());
		assertEquals("/search", request.getPath());
		assertEquals(Optional.of("q=hello+world&page=2"), request.getRawQuery());
		assertEquals(Map.of("q", "hello world", "page", "2"), request.getQueryParameters());
		assertEquals("HTTP/1.1", request.getProtocol());
		assertEquals(Optional.of("abc"), request.getHeader("X_REQUEST_ID"));
		assertEquals(Optional.of("abc"), request.getHeader("x-request-id"));
		assertEquals(Optional.of("localhost"), request.getHeaders().entrySet().stream()
				.filter(entry -> entry.getKey().equals("HOST"))
				.map(Map.Entry::getValue)
				.findFirst());
		assertEquals(Optional.of(remoteAddress), request.getRemoteAddress());
		assertEquals(RequestBody.Type.NONE, request.getBody().getType());
	}

	@Test
	public void pathIsPercentDecodedButPlusStaysLiteral() {
		Request request = parse("GET /files/a%20b+c HTTP/1.1\r\n\r\n");
		assertEquals("/files/a b+c", request.getPath());
	}

	@Test
	public void invalidPercentEscapeInPathIsKeptAsWritten() {
		assertEquals("/files/100%", parse("GET /files/100% HTTP/1.1\r\n\r\n").getPath());
		assertEquals("/q/%zz", parse("GET /q/%zz HTTP/1.1\r\n\r\n").getPath());
	}

	@Test
	public void requestLineMustHaveThreeParts() {
		assertThrows(MalformedRequestException.class, () -> parse("GET /\r\n\r\n"));
		assertThrows(MalformedRequestException.class, () -> parse("GET / HTTP/1.1 extra\r\n\r\n"));
		assertThrows(MalformedRequestException.class, () -> parse("garbage"));
	}

	@Test
	public void emptyRequestIsMalformed() {
		assertThrows(MalformedRequestException.class, () -> RequestParser.defaultInstance().parse(new byte[0], null));
	}

	@Test
	public void unsupportedMethodIsKeptAsToken() {
		Request request = parse("BREW /pot HTTP/1.1\r\n\r\n");

		assertEquals("BREW", request.getMethod());
		assertTrue(request.getHttpMethod().isEmpty());
	}

	@Test
	public void queryLastValueWinsAndBlankValuesAreDropped() {
		Request request = parse("GET /q?a=1&a=2&empty=&bare&b=%41 HTTP/1.1\r\n\r\n");
		assertEquals(Map.of("a", "2", "b", "A"), request.getQueryParameters());
	}

	@Test
	public void headerLinesWithoutColonAreIgnoredAndLastValueWins() {
		Request request = parse("GET / HTTP/1.1\r\nnot a header\r\nAccept: text/plain\r\naccept: text/html\r\n\r\n");

		assertEquals(1, request.getHeaders().size());
		assertEquals(Optional.of("text/html"), request.getHeader("Accept"));
	}

	@Test
	public void formBodyIsDecoded() {
		String body = "name=Jane+Doe&tag=a&tag=b&blank=";
		Request request = parse("POST /form HTTP/1.1\r\nContent-Type: application/x-www-form-urlencoded; charset=UTF-8\r\n"
				+ "Content-Length: " + body.length() + "\r\n\r\n" + body);

		assertEquals(Optional.of("application/x-www-form-urlencoded"), request.getContentType());
		assertEquals(RequestBody.Type.FORM, request.getBody().getType());
		assertEquals(Optional.of("Jane Doe"), request.getFormParameter("name"));
		assertEquals(Optional.of(List.of("a", "b")), request.getFormParameter("tag"));
		assertTrue(request.getFormParameter("blank").isEmpty());
	}

	@Test
	public void jsonBodyIsParsed() {
		String body = "{\"name\":\"rocket\",\"count\":3}";
		Request request = parse("POST /json HTTP/1.1\r\nContent-Type: APPLICATION/JSON\r\nContent-Length: " + body.length() + "\r\n\r\n" + body);

		assertEquals(RequestBody.Type.JSON, request.getBody().getType());

		JSONObject jsonObject = request.getBody().getJsonObject().orElseThrow();
		assertEquals("rocket", jsonObject.getString("name"));
		assertEquals(3, jsonObject.getInt("count"));
	}

	@Test
	public void jsonArrayBodyIsParsed() {
		Request request = parse("POST /json HTTP/1.1\r\nContent-Type: application/json\r\n\r\n[1,2,3]");

		Object json = request.getBody().getJson().orElseThrow();
		assertTrue(json instanceof JSONArray);
		assertEquals(3, ((JSONArray) json).length());
		assertTrue(request.getBody().getJsonObject().isEmpty());
	}

	@Test
	public void malformedJsonBecomesEmptyObject() {
		for (String body : List.of("{not json", "{\"a\":1} trailing", "plain words",
				"{a:1}", "{'a':1}", "[1,2,]", "{\"a\":1,}")) {
			Request request = parse("POST /json HTTP/1.1\r\nContent-Type: application/json\r\n\r\n" + body);
			JSONObject jsonObject = request.getBody().getJsonObject().orElseThrow();

			assertTrue(jsonObject.isEmpty(), "Expected empty object for body: " + body);
		}
	}

	@Test
	public void otherContentTypesKeepRawBytes() {
		Request request = parse("PUT /upload HTTP/1.1\r\nContent-Type: text/plain\r\n\r\nhello");

		assertEquals(RequestBody.Type.RAW, request.getBody().getType());
		assertArrayEquals("hello".getBytes(StandardCharsets.UTF_8), request.getBody().getBytes());
		assertEquals("hello", request.getBody().getBytesAsString());
	}

	@Test
	public void bodyIsTruncatedToContentLength() {
		Request request = parse("POST /x HTTP/1.1\r\nContent-Length: 3\r\n\r\nabcdef");
		assertEquals("abc", request.getBody().getBytesAsString());
	}

	@Test
	public void invalidContentLengthKeepsWholeBody() {
		Request request = parse("POST /x HTTP/1.1\r\nContent-Length: nope\r\n\r\nabcdef");
		assertEquals("abcdef", request.getBody().getBytesAsString());
	}

	@Test
	public void requestWithoutHeaderTerminatorStillParses() {
		Request request = parse("GET /partial HTTP/1.1\r\nHost: x");

		assertEquals("/partial", request.getPath());
		assertEquals(Optional.of("x"), request.getHeader("Host"));
	}

	@Test
	public void extractContentLength() {
		assertEquals(Optional.of(10), DefaultRequestParser.extractContentLength(" 10 "));
		assertEquals(Optional.empty(), DefaultRequestParser.extractContentLength("-1"));
		assertEquals(Optional.empty(), DefaultRequestParser.extractContentLength(null));
	}

	private static Request parse(String rawRequest) {
		return parse(rawRequest, null);
	}

	private static Request parse(String rawRequest,
															 InetSocketAddress remoteAddress) {
		return RequestParser.defaultInstance().parse(rawRequest.getBytes(StandardCharsets.UTF_8), remoteAddress);
	}
}
