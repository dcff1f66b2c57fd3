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

import org.reactivestreams.Publisher;

/**
 * Handles a request routed by a {@link Router}.
 * <p>
 * A single handler instance is shared by every request matching its route and may be
 * invoked concurrently.
 *
 * @param <REQ> the inbound request type
 * @param <RES> the response type
 */
@FunctionalInterface
public interface RouteHandler<REQ, RES> {

	/**
	 * Produces the response for a matched request.
	 *
	 * @param params the values captured by the wildcard segments, left to right
	 * @param request the inbound request
	 * @return a {@link Publisher} of the response
	 */
	Publisher<RES> handle(List<String> params, REQ request);
}
