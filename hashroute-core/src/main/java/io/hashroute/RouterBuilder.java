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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

import io.netty.handler.codec.http.HttpMethod;
import org.reactivestreams.Publisher;
import reactor.util.Logger;
import reactor.util.Loggers;

/**
 * Collects routes, in order, and compiles them into a {@link Router}.
 * <p>
 * Registration order decides precedence: for a given method and segment count, the
 * earliest registered pattern matching a path wins. A pattern identical to an earlier one
 * is accepted but can never be reached.
 * <p>
 * Each {@link #build()} takes a snapshot of the routes registered so far; registering more
 * routes afterwards does not affect routers already built. A builder is meant to be used
 * from a single thread.
 *
 * @param <REQ> the inbound request type
 * @param <RES> the response type
 */
public final class RouterBuilder<REQ, RES> {

	final List<RouteEntry<REQ, RES>>                      entries = new ArrayList<>();
	Function<? super REQ, ? extends Publisher<RES>>       notFound;

	RouterBuilder(Function<? super REQ, ? extends Publisher<RES>> notFound) {
		this.notFound = Objects.requireNonNull(notFound, "notFound");
	}

	/**
	 * Replaces the function producing the response for requests no route matches. Routers
	 * already built keep the function they were built with.
	 *
	 * @param notFound produces the response for requests no route matches
	 * @return this builder
	 */
	public RouterBuilder<REQ, RES> notFound(Function<? super REQ, ? extends Publisher<RES>> notFound) {
		this.notFound = Objects.requireNonNull(notFound, "notFound");
		return this;
	}

	/**
	 * Registers a route.
	 *
	 * @param method the HTTP method
	 * @param pattern the pattern, whose method must equal {@code method}
	 * @param handler the handler
	 * @return this builder
	 * @throws IllegalArgumentException if the pattern was created for another method
	 */
	public RouterBuilder<REQ, RES> register(HttpMethod method, PathPattern pattern, RouteHandler<REQ, RES> handler) {
		Objects.requireNonNull(method, "method");
		Objects.requireNonNull(pattern, "pattern");
		Objects.requireNonNull(handler, "handler");
		if (!method.equals(pattern.method())) {
			throw new IllegalArgumentException("Pattern [" + pattern + "] cannot be registered for method " + method);
		}
		entries.add(new RouteEntry<>(pattern, handler));
		return this;
	}

	/**
	 * Registers a route for the given tokens, see {@link PathPattern#of(HttpMethod, List)}.
	 *
	 * @param method the HTTP method
	 * @param tokens the pattern tokens
	 * @param handler the handler
	 * @return this builder
	 */
	public RouterBuilder<REQ, RES> register(HttpMethod method, List<String> tokens, RouteHandler<REQ, RES> handler) {
		return register(method, PathPattern.of(method, tokens), handler);
	}

	/**
	 * Registers a route for the given path pattern, see
	 * {@link PathPattern#parse(HttpMethod, String)}.
	 *
	 * @param method the HTTP method
	 * @param path the path pattern, e.g. {@code /foo/_}
	 * @param handler the handler
	 * @return this builder
	 */
	public RouterBuilder<REQ, RES> register(HttpMethod method, String path, RouteHandler<REQ, RES> handler) {
		return register(method, PathPattern.parse(method, path), handler);
	}

	/**
	 * Registers a {@code DELETE} route.
	 *
	 * @param path the path pattern
	 * @param handler the handler
	 * @return this builder
	 */
	public RouterBuilder<REQ, RES> delete(String path, RouteHandler<REQ, RES> handler) {
		return register(HttpMethod.DELETE, path, handler);
	}

	/**
	 * Registers a {@code GET} route.
	 *
	 * @param path the path pattern
	 * @param handler the handler
	 * @return this builder
	 */
	public RouterBuilder<REQ, RES> get(String path, RouteHandler<REQ, RES> handler) {
		return register(HttpMethod.GET, path, handler);
	}

	/**
	 * Registers a {@code HEAD} route.
	 *
	 * @param path the path pattern
	 * @param handler the handler
	 * @return this builder
	 */
	public RouterBuilder<REQ, RES> head(String path, RouteHandler<REQ, RES> handler) {
		return register(HttpMethod.HEAD, path, handler);
	}

	/**
	 * Registers an {@code OPTIONS} route.
	 *
	 * @param path the path pattern
	 * @param handler the handler
	 * @return this builder
	 */
	public RouterBuilder<REQ, RES> options(String path, RouteHandler<REQ, RES> handler) {
		return register(HttpMethod.OPTIONS, path, handler);
	}

	/**
	 * Registers a {@code PATCH} route.
	 *
	 * @param path the path pattern
	 * @param handler the handler
	 * @return this builder
	 */
	public RouterBuilder<REQ, RES> patch(String path, RouteHandler<REQ, RES> handler) {
		return register(HttpMethod.PATCH, path, handler);
	}

	/**
	 * Registers a {@code POST} route.
	 *
	 * @param path the path pattern
	 * @param handler the handler
	 * @return this builder
	 */
	public RouterBuilder<REQ, RES> post(String path, RouteHandler<REQ, RES> handler) {
		return register(HttpMethod.POST, path, handler);
	}

	/**
	 * Registers a {@code PUT} route.
	 *
	 * @param path the path pattern
	 * @param handler the handler
	 * @return this builder
	 */
	public RouterBuilder<REQ, RES> put(String path, RouteHandler<REQ, RES> handler) {
		return register(HttpMethod.PUT, path, handler);
	}

	/**
	 * Compiles the routes registered so far into a new {@link Router}.
	 *
	 * @return a new {@link Router}
	 */
	public Router<REQ, RES> build() {
		RouteTable<REQ, RES> table = new RouteTable<>(entries);
		if (log.isDebugEnabled()) {
			logShadowedRoutes();
			log.debug("Built route table with {} route(s) in {} bucket(s)", table.size(), table.bucketCount());
		}
		return new Router<>(table, notFound);
	}

	void logShadowedRoutes() {
		Map<PathPattern, Integer> firstSeen = new HashMap<>();
		for (int i = 0; i < entries.size(); i++) {
			PathPattern pattern = entries.get(i).pattern;
			Integer first = firstSeen.putIfAbsent(pattern, i);
			if (first != null) {
				log.debug("Route #{} [{}] is shadowed by route #{} and will never be matched", i, pattern, first);
			}
		}
	}

	static final Logger log = Loggers.getLogger(RouterBuilder.class);
}
