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

import org.reactivestreams.Publisher;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;

/**
 * Converts the failure of an {@link HttpRouteHandler} into a response.
 */
@FunctionalInterface
public interface HttpErrorHandler {

	/**
	 * Sends the response for a failed request. Only invoked while the response headers
	 * have not been sent yet.
	 *
	 * @param error the failure signalled by the route handler
	 * @param request the request
	 * @param response the response
	 * @return a {@link Publisher} completing once the response has been sent
	 */
	Publisher<Void> handle(Throwable error, HttpServerRequest request, HttpServerResponse response);
}
