/*
 * Copyright (c) 2026 VMware, Inc. or its affiliates, All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.hashroute.examples.http.router;

import java.util.List;

import io.hashroute.PathPattern;
import io.hashroute.http.HttpRouter;
import io.netty.handler.codec.http.HttpMethod;
import reactor.core.publisher.Mono;
import reactor.netty.http.server.HttpServer;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpHeaderValues.TEXT_PLAIN;

/**
 * An HTTP server routing requests with an {@link HttpRouter}.
 * <ul>
 *     <li>{@code GET /} answers "Hello World!"</li>
 *     <li>{@code POST /foo/{a}/bar/{b}/baz} echoes the two captured segments</li>
 *     <li>{@code GET /{name}} greets {@code name}</li>
 * </ul>
 * Anything else is answered with {@code 404}.
 */
public final class RouterServer {

	static final int PORT = Integer.parseInt(System.getProperty("port", "8080"));
	static final boolean WIRETAP = System.getProperty("wiretap") != null;

	public static void main(String[] args) {
		HttpRouter router =
				HttpRouter.builder()
				          .get("/", (params, req, res) -> text(res, "Hello World!"))
				          .register(HttpMethod.POST, PathPattern.of(HttpMethod.POST, "foo", "_", "bar", "_", "baz"),
				                  RouterServer::echo)
				          .get("/_", (params, req, res) -> text(res, "Hello " + params.get(0) + "!"))
				          .build();

		HttpServer.create()
		          .port(PORT)
		          .wiretap(WIRETAP)
		          .handle(router)
		          .bindNow()
		          .onDispose()
		          .block();
	}

	static Mono<Void> echo(List<String> params, HttpServerRequest request, HttpServerResponse response) {
		return text(response, params.get(0) + " " + params.get(1));
	}

	static Mono<Void> text(HttpServerResponse response, String body) {
		return response.header(CONTENT_TYPE, TEXT_PLAIN)
		               .sendString(Mono.just(body))
		               .then();
	}
}
