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

import java.util.Objects;

/**
 * A {@link PathPattern} bound to its {@link RouteHandler}.
 *
 * @param <REQ> the inbound request type
 * @param <RES> the response type
 */
public final class RouteEntry<REQ, RES> {

	final PathPattern              pattern;
	final RouteHandler<REQ, RES>   handler;

	RouteEntry(PathPattern pattern, RouteHandler<REQ, RES> handler) {
		this.pattern = Objects.requireNonNull(pattern, "pattern");
		this.handler = Objects.requireNonNull(handler, "handler");
	}

	public PathPattern pattern() {
		return pattern;
	}

	public RouteHandler<REQ, RES> handler() {
		return handler;
	}

	@Override
	public String toString() {
		return "RouteEntry{pattern=" + pattern + ", handler=" + handler + '}';
	}
}
