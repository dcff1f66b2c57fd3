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

import java.util.List;

import org.reactivestreams.Publisher;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;

/**
 * Handles an HTTP request routed by an {@link HttpRouter}.
 */
@FunctionalInterface
public interface HttpRouteHandler {

	/**
	 * Handles the request, writing the outcome through {@code response}.
	 *
	 * @param params the values captured by the wildcard segments of the route, left to right
	 * @param request the request
	 * @param response the response
	 * @return a {@link Publisher} completing once the response has been sent
	 */
	Publisher<Void> handle(List<String> params, HttpServerRequest request, HttpServerResponse response);
}
