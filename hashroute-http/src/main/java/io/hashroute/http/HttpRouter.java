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
package io.hashroute.http;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;

import io.hashroute.HashRoute;
import io.hashroute.PathComponents;
import io.hashroute.PathPattern;
import io.hashroute.RouteHandler;
import io.hashroute.RouteTable;
import io.hashroute.Router;
import io.hashroute.RouterBuilder;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Mono;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;
import reactor.util.Logger;
import reactor.util.Loggers;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpHeaderValues.TEXT_PLAIN;

/**
 * Routes the requests of a reactor-netty {@code HttpServer} with a {@link Router}.
 * <pre>
 * HttpRouter router =
 *         HttpRouter.builder()
 *                   .get("/", (params, req, res) -&gt; res.sendString(Mono.just("index")))
 *                   .post("/foo/_/bar/_/baz", (params, req, res) -&gt; res.sendString(Mono.just(params.toString())))
 *                   .build();
 *
 * HttpServer.create()
 *           .port(8080)
 *           .handle(router)
 *           .bindNow();
 * </pre>
 * Requests are matched on {@link HttpServerRequest#method()} and the path of
 * {@link HttpServerRequest#uri()}, so the query string does not take part in routing.
 * The raw path is split on {@code /} before each component is percent-decoded: an
 * encoded {@code %2F} stays inside its component and is captured as {@code /}. A path
 * with a malformed escape sequence is answered with {@code 400}.
 * <p>
 * Unmatched requests go to the not-found handler, {@code 404} by default. A failing route
 * handler is logged and its error passed to the internal error handler, {@code 500} by
 * default; when the response headers are already on the wire the error is left to
 * reactor-netty, which terminates the connection.
 */
public final class HttpRouter implements BiFunction<HttpServerRequest, HttpServerResponse, Publisher<Void>> {

	/**
	 * Creates a new {@link Builder}.
	 *
	 * @return a new {@link Builder}
	 */
	public static Builder builder() {
		return new Builder();
	}

	final Router<HttpExchange, Void> router;
	final HttpErrorHandler           internalError;

	HttpRouter(Router<HttpExchange, Void> router, HttpErrorHandler internalError) {
		this.router = router;
		this.internalError = internalError;
	}

	@Override
	public Publisher<Void> apply(HttpServerRequest request, HttpServerResponse response) {
		List<String> components;
		try {
			components = pathComponents(request.uri());
		}
		catch (IllegalArgumentException e) {
			if (log.isDebugEnabled()) {
				log.debug("Malformed path in {} {}", request.method(), request.uri(), e);
			}
			return response.status(HttpResponseStatus.BAD_REQUEST)
			               .send();
		}
		Publisher<Void> result =
				router.dispatch(request.method(), components, new HttpExchange(request, response));
		return Mono.from(result)
		           .onErrorResume(t -> handleError(t, request, response));
	}

	/**
	 * Returns the route table requests are matched against.
	 *
	 * @return the route table
	 */
	public RouteTable<?, ?> routes() {
		return router.routes();
	}

	Mono<Void> handleError(Throwable error, HttpServerRequest request, HttpServerResponse response) {
		log.error("Route handler failed for {} {}", request.method(), request.uri(), error);
		if (response.hasSentHeaders()) {
			return Mono.error(error);
		}
		return Mono.from(internalError.handle(error, request, response));
	}

	@Override
	public String toString() {
		return "HttpRouter{" + router.routes() + '}';
	}

	/**
	 * Splits the path of a request target into its non-empty components, then decodes each
	 * of them.
	 *
	 * @param uri the request target, in origin or absolute form
	 * @return the decoded path components
	 * @throws IllegalArgumentException if a component holds a malformed escape sequence
	 */
	static List<String> pathComponents(String uri) {
		List<String> raw = PathComponents.split(rawPath(uri));
		List<String> components = new ArrayList<>(raw.size());
		for (String component : raw) {
			components.add(component.indexOf('%') < 0 ? component : new QueryStringDecoder(component).path());
		}
		return components;
	}

	static String rawPath(String uri) {
		int end = uri.length();
		int query = uri.indexOf('?');
		if (query >= 0) {
			end = query;
		}
		int fragment = uri.indexOf('#');
		if (fragment >= 0 && fragment < end) {
			end = fragment;
		}
		int start = 0;
		if (!uri.startsWith("/")) {
			int scheme = uri.indexOf("://");
			if (scheme >= 0 && scheme < end) {
				int slash = uri.indexOf('/', scheme + 3);
				start = slash >= 0 && slash < end ? slash : end;
			}
		}
		return uri.substring(start, end);
	}

	static RouteHandler<HttpExchange, Void> adapt(HttpRouteHandler handler) {
		Objects.requireNonNull(handler, "handler");
		return (params, exchange) -> handler.handle(params, exchange.request, exchange.response);
	}

	static Publisher<Void> defaultNotFound(HttpServerRequest request, HttpServerResponse response) {
		if (log.isDebugEnabled()) {
			log.debug("No route for {} {}", request.method(), request.uri());
		}
		return response.sendNotFound();
	}

	static Publisher<Void> defaultInternalError(Throwable error, HttpServerRequest request, HttpServerResponse response) {
		response.status(HttpResponseStatus.INTERNAL_SERVER_ERROR);
		String message = error.getMessage();
		if (!HashRoute.errorDetails() || message == null) {
			return response.send();
		}
		return response.header(CONTENT_TYPE, TEXT_PLAIN)
		               .sendString(Mono.just(message));
	}

	static final Logger log = Loggers.getLogger(HttpRouter.class);

	/**
	 * Accumulates the routes of an {@link HttpRouter} in a {@link RouterBuilder}, which
	 * validates them as they are registered. {@link #build()} takes a snapshot of them.
	 */
	public static final class Builder {

		final RouterBuilder<HttpExchange, Void> routes =
				Router.builder(exchange -> defaultNotFound(exchange.request, exchange.response));

		HttpErrorHandler internalError = HttpRouter::defaultInternalError;

		Builder() {
		}

		/**
		 * Registers a route, see {@link RouterBuilder#register(HttpMethod, PathPattern, RouteHandler)}.
		 *
		 * @param method the HTTP method
		 * @param pattern the pattern, whose method must equal {@code method}
		 * @param handler the handler
		 * @return this builder
		 */
		public Builder register(HttpMethod method, PathPattern pattern, HttpRouteHandler handler) {
			routes.register(method, pattern, adapt(handler));
			return this;
		}

		/**
		 * Registers a route for the given pattern tokens, {@code _} denoting a wildcard.
		 *
		 * @param method the HTTP method
		 * @param tokens the pattern tokens
		 * @param handler the handler
		 * @return this builder
		 */
		public Builder register(HttpMethod method, List<String> tokens, HttpRouteHandler handler) {
			routes.register(method, tokens, adapt(handler));
			return this;
		}

		/**
		 * Registers a route for a {@code /} separated pattern such as {@code /users/_}.
		 *
		 * @param method the HTTP method
		 * @param path the path pattern
		 * @param handler the handler
		 * @return this builder
		 */
		public Builder register(HttpMethod method, String path, HttpRouteHandler handler) {
			routes.register(method, path, adapt(handler));
			return this;
		}

		public Builder delete(String path, HttpRouteHandler handler) {
			return register(HttpMethod.DELETE, path, handler);
		}

		public Builder get(String path, HttpRouteHandler handler) {
			return register(HttpMethod.GET, path, handler);
		}

		public Builder head(String path, HttpRouteHandler handler) {
			return register(HttpMethod.HEAD, path, handler);
		}

		public Builder options(String path, HttpRouteHandler handler) {
			return register(HttpMethod.OPTIONS, path, handler);
		}

		public Builder patch(String path, HttpRouteHandler handler) {
			return register(HttpMethod.PATCH, path, handler);
		}

		public Builder post(String path, HttpRouteHandler handler) {
			return register(HttpMethod.POST, path, handler);
		}

		public Builder put(String path, HttpRouteHandler handler) {
			return register(HttpMethod.PUT, path, handler);
		}

		/**
		 * Sets the handler for requests no route matches.
		 * Default to {@link HttpServerResponse#sendNotFound()}.
		 *
		 * @param notFound the not-found handler
		 * @return this builder
		 */
		public Builder notFoundHandler(
				BiFunction<? super HttpServerRequest, ? super HttpServerResponse, ? extends Publisher<Void>> notFound) {
			Objects.requireNonNull(notFound, "notFound");
			routes.notFound(exchange -> notFound.apply(exchange.request, exchange.response));
			return this;
		}

		/**
		 * Sets the handler converting route handler failures into responses.
		 * Default to a {@code 500} response carrying the error message, see
		 * {@link HashRoute#ERROR_DETAILS}.
		 *
		 * @param internalError the internal error handler
		 * @return this builder
		 */
		public Builder internalErrorHandler(HttpErrorHandler internalError) {
			this.internalError = Objects.requireNonNull(internalError, "internalError");
			return this;
		}

		/**
		 * Builds a new {@link HttpRouter} from the routes registered so far.
		 *
		 * @return a new {@link HttpRouter}
		 */
		public HttpRouter build() {
			return new HttpRouter(routes.build(), internalError);
		}
	}
}
