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
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ThreadSafe
public class DefaultResponseMarshalerTests {
	@Test
	public void framesTextResponse() {
		Response response = new Response();
		response.send("hi");

		String marshaled = marshal(response);

		assertEquals("HTTP/1.1 200 OK\r\n"
				+ "Content-Type: text/plain\r\n"
				+ "Content-Length: 2\r\n"
				+ "Connection: close\r\n"
				+ "\r\n"
				+ "hi", marshaled);
	}

	@Test
	public void contentLengthCountsUtf8Bytes() {
		Response response = new Response();
		response.send("héllo");

		assertTrue(marshal(response).contains("Content-Length: 6\r\n"));
	}

	@Test
	public void headersAreWrittenInOrderWithDuplicates() {
		Response response = new Response();
		response.addHeader("X-Tag", "one");
		response.addHeader("X-Tag", "two");
		response.send("");

		String marshaled = marshal(response);

		assertTrue(marshaled.contains("Content-Type: text/plain\r\nX-Tag: one\r\nX-Tag: two\r\nContent-Length: 0\r\n"));
	}

	@Test
	public void explicitContentLengthIsNotDuplicated() {
		Response response = new Response();
		response.addHeader("content-length", "2");
		response.send("hi");

		String marshaled = marshal(response);

		assertTrue(marshaled.contains("content-length: 2\r\n"));
		assertFalse(marshaled.contains("Content-Length:"));
		assertTrue(marshaled.endsWith("Connection: close\r\n\r\nhi"));
	}

	@Test
	public void marshalingIsIdempotent() {
		Response response = new Response();
		response.send("same", StatusCode.HTTP_201);
		response.addHeader("X-One", "1");

		byte[] first = ResponseMarshaler.defaultInstance().marshal(response);
		byte[] second = ResponseMarshaler.defaultInstance().marshal(response);

		assertArrayEquals(first, second);
		assertEquals(List.of(new Header("Content-Type", "text/plain"), new Header("X-One", "1")), response.getHeaders());
	}

	@Test
	public void binaryBodyIsWrittenVerbatim() {
		byte[] body = new byte[]{0, (byte) 0xFF, 10, 13};
		Response response = new Response();
		response.setContentType("application/octet-stream");
		response.setBody(body);

		byte[] marshaled = ResponseMarshaler.defaultInstance().marshal(response);
		byte[] tail = new byte[body.length];
		System.arraycopy(marshaled, marshaled.length - body.length, tail, 0, body.length);

		assertArrayEquals(body, tail);
		assertTrue(new String(marshaled, StandardCharsets.ISO_8859_1).contains("Content-Length: 4\r\n"));
	}

	@Test
	public void headerInjectionIsRejected() {
		Response newlineInValue = new Response();
		newlineInValue.addHeader("X-Evil", "a\r\nSet-Cookie: b");
		assertThrows(IllegalArgumentException.class, () -> ResponseMarshaler.defaultInstance().marshal(newlineInValue));

		Response newlineInName = new Response();
		newlineInName.addHeader("X-Evil\n", "a");
		assertThrows(IllegalArgumentException.class, () -> ResponseMarshaler.defaultInstance().marshal(newlineInName));

		Response newlineInStatus = new Response();
		newlineInStatus.setStatus("200 OK\r\nX-Evil: 1");
		assertThrows(IllegalArgumentException.class, () -> ResponseMarshaler.defaultInstance().marshal(newlineInStatus));
	}

	@Test
	public void errorResponseIsHtml() {
		String marshaled = new String(ResponseMarshaler.defaultInstance().marshalError(StatusCode.HTTP_404, "Route not found"), StandardCharsets.UTF_8);
		String body = "<h1>404 Not Found</h1>\n<p>Route not found</p>";

		assertEquals("HTTP/1.1 404 Not Found\r\n"
				+ "Content-Type: text/html\r\n"
				+ "Content-Length: " + body.length() + "\r\n"
				+ "Connection: close\r\n"
				+ "\r\n"
				+ body, marshaled);
	}

	@Test
	public void errorMessageIsEscaped() {
		String marshaled = new String(ResponseMarshaler.defaultInstance().marshalError(StatusCode.HTTP_500, "<script>\"x\" & 'y'"), StandardCharsets.UTF_8);
		assertTrue(marshaled.endsWith("<p>&lt;script&gt;&quot;x&quot; &amp; &#x27;y&#x27;</p>"));
	}

	private static String marshal(Response response) {
		return new String(ResponseMarshaler.defaultInstance().marshal(response), StandardCharsets.UTF_8);
	}
}
