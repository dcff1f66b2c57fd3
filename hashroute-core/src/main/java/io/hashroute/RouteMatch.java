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

/**
 * The result of a successful lookup in a {@link RouteTable}: the matched entry and the
 * values its wildcards captured, left to right.
 *
 * @param <REQ> the inbound request type
 * @param <RES> the response type
 */
public final class RouteMatch<REQ, RES> {

	final RouteEntry<REQ, RES> entry;
	final List<String>         params;

	RouteMatch(RouteEntry<REQ, RES> entry, List<String> params) {
		this.entry = entry;
		this.params = params;
	}

	public RouteEntry<REQ, RES> entry() {
		return entry;
	}

	public RouteHandler<REQ, RES> handler() {
		return entry.handler;
	}

	/**
	 * Returns the unmodifiable list of captured values.
	 *
	 * @return the unmodifiable list of captured values
	 */
	public List<String> params() {
		return params;
	}

	@Override
	public String toString() {
		return "RouteMatch{pattern=" + entry.pattern + ", params=" + params + '}';
	}
}
