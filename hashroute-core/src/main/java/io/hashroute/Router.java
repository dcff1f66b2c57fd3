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
package io.hashroute;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

import io.netty.handler.codec.http.HttpMethod;
import org.reactivestreams.Publisher;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.annotation.Nullable;

/**
 * Dispatches requests to the handler of the first route matching their method and path.
 * <p>
 * A {@code Router} is created by a {@link RouterBuilder} and wraps an immutable
 * {@link RouteTable}; it holds no other state and can be shared by any number of
 * concurrent requests. Dispatching neither logs, retries nor transforms the request: a
 * handler's failure reaches the caller exactly as the handler signalled it.
 * <pre>
 * Router&lt;Request, Response&gt; router =
 *         Router.&lt;Request, Response&gt;builder(req -&gt; Mono.just(Response.NOT_FOUND))
 *               .get("/", (params, req) -&gt; index(req))
 *               .post("/foo/_/bar/_/baz", (params, req) -&gt; save(params.get(0), params.get(1), req))
 *               .build();
 * </pre>
 *
 * @param <REQ> the inbound request type
 * @param <RES> the response type
 */
public final class Router<REQ, RES> {

	/**
	 * Creates a new {@link RouterBuilder}.
	 *
	 * @param notFound produces the response for requests no route matches
	 * @param <REQ> the inbound request type
	 * @param <RES> the response type
	 * @return a new {@link RouterBuilder}
	 */
	public static <REQ, RES> RouterBuilder<REQ, RES> builder(Function<? super REQ, ? extends Publisher<RES>> notFound) {
		return new RouterBuilder<>(notFound);
	}

	final RouteTable<REQ, RES>                           table;
	final Function<? super REQ, ? extends Publisher<RES>> notFound;

	Router(RouteTable<REQ, RES> table, Function<? super REQ, ? extends Publisher<RES>> notFound) {
		this.table = Objects.requireNonNull(table, "table");
		this.notFound = Objects.requireNonNull(notFound, "notFound");
	}

	/**
	 * Matches the request against the route table and invokes the selected handler with
	 * the captured values. When nothing matches the not-found function is applied instead.
	 * A handler throwing rather than returning an error {@link Publisher} is reported as
	 * {@link Mono#error(Throwable)} with the very same exception.
	 *
	 * @param method the request method
	 * @param path the request path, without query string
	 * @param request the request
	 * @return the {@link Publisher} produced by the handler or by the not-found function
	 */
	public Publisher<RES> dispatch(HttpMethod method, String path, REQ request) {
		return dispatch(method, PathComponents.split(path), request);
	}

	/**
	 * Same as {@link #dispatch(HttpMethod, String, Object)} for a path already split into
	 * its components. A component is matched as is, so it may contain a {@code /} that was
	 * percent-encoded on the wire.
	 *
	 * @param method the request method
	 * @param components the non-empty path components, in order
	 * @param request the request
	 * @return the {@link Publisher} produced by the handler or by the not-found function
	 */
	public Publisher<RES> dispatch(HttpMethod method, List<String> components, REQ request) {
		RouteMatch<REQ, RES> match = table.find(method, components);
		try {
			if (match != null) {
				return match.handler().handle(match.params(), request);
			}
			return notFound.apply(request);
		}
		catch (Throwable t) {
			Exceptions.throwIfJvmFatal(t);
			return Mono.error(t);
		}
	}

	/**
	 * Runs only the matching step of {@link #dispatch(HttpMethod, String, Object)}.
	 *
	 * @param method the request method
	 * @param path the request path
	 * @return the match, or {@code null} when no route matches
	 */
	@Nullable
	public RouteMatch<REQ, RES> find(HttpMethod method, String path) {
		return table.find(method, path);
	}

	/**
	 * Returns the route table this router dispatches with.
	 *
	 * @return the route table
	 */
	public RouteTable<REQ, RES> routes() {
		return table;
	}

	@Override
	public String toString() {
		return "Router{" + table + '}';
	}
}
