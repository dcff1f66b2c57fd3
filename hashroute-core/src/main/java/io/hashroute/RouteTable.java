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
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import io.netty.handler.codec.http.HttpMethod;
import reactor.util.annotation.Nullable;

/**
 * Immutable set of {@link RouteEntry}s partitioned into buckets keyed by
 * {@code (method, segment count)}. Within a bucket the registration order is kept and
 * the first fully matching entry wins, regardless of how specific a later entry is.
 * <p>
 * A table is never mutated once created and can be read concurrently without
 * synchronization.
 *
 * @param <REQ> the inbound request type
 * @param <RES> the response type
 */
public final class RouteTable<REQ, RES> {

	final Map<RouteKey, List<RouteEntry<REQ, RES>>> buckets;
	final List<RouteEntry<REQ, RES>>                entries;

	RouteTable(List<RouteEntry<REQ, RES>> entries) {
		Map<RouteKey, List<RouteEntry<REQ, RES>>> partitions = new HashMap<>();
		for (RouteEntry<REQ, RES> entry : entries) {
			PathPattern pattern = entry.pattern;
			partitions.computeIfAbsent(new RouteKey(pattern.method, pattern.size()), k -> new ArrayList<>())
			          .add(entry);
		}
		Map<RouteKey, List<RouteEntry<REQ, RES>>> buckets = new HashMap<>(partitions.size());
		for (Map.Entry<RouteKey, List<RouteEntry<REQ, RES>>> partition : partitions.entrySet()) {
			buckets.put(partition.getKey(), Collections.unmodifiableList(partition.getValue()));
		}
		this.buckets = Collections.unmodifiableMap(buckets);
		this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
	}

	/**
	 * Finds the route for the given method and path.
	 *
	 * @param method the request method
	 * @param path the request path, e.g. {@code /foo/1/bar}
	 * @return the match, or {@code null} when no route matches
	 */
	@Nullable
	public RouteMatch<REQ, RES> find(HttpMethod method, String path) {
		Objects.requireNonNull(method, "method");
		return find(method, PathComponents.split(path));
	}

	/**
	 * Finds the route for the given method and path components.
	 *
	 * @param method the request method
	 * @param components the non-empty path components
	 * @return the match, or {@code null} when no route matches
	 */
	@Nullable
	public RouteMatch<REQ, RES> find(HttpMethod method, List<String> components) {
		List<RouteEntry<REQ, RES>> bucket = buckets.get(new RouteKey(method, components.size()));
		if (bucket == null) {
			return null;
		}
		for (RouteEntry<REQ, RES> entry : bucket) {
			List<String> captures = entry.pattern.match(components);
			if (captures != null) {
				return new RouteMatch<>(entry, captures);
			}
		}
		return null;
	}

	/**
	 * Returns the entries in the bucket of the given key, in registration order.
	 *
	 * @param method the method
	 * @param size the segment count
	 * @return the entries, empty when there is no such bucket
	 */
	public List<RouteEntry<REQ, RES>> bucket(HttpMethod method, int size) {
		List<RouteEntry<REQ, RES>> bucket = buckets.get(new RouteKey(method, size));
		return bucket == null ? Collections.emptyList() : bucket;
	}

	/**
	 * Returns the number of buckets.
	 *
	 * @return the number of buckets
	 */
	public int bucketCount() {
		return buckets.size();
	}

	/**
	 * Returns all entries in registration order.
	 *
	 * @return all entries in registration order
	 */
	public List<RouteEntry<REQ, RES>> entries() {
		return entries;
	}

	/**
	 * Returns the number of entries.
	 *
	 * @return the number of entries
	 */
	public int size() {
		return entries.size();
	}

	@Override
	public String toString() {
		return "RouteTable{entries=" + entries.size() + ", buckets=" + buckets.size() + '}';
	}

	static final class RouteKey {

		final HttpMethod method;
		final int        size;

		RouteKey(HttpMethod method, int size) {
			this.method = method;
			this.size = size;
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) {
				return true;
			}
			if (!(o instanceof RouteKey)) {
				return false;
			}
			RouteKey that = (RouteKey) o;
			return size == that.size && method.equals(that.method);
		}

		@Override
		public int hashCode() {
			return 31 * method.hashCode() + size;
		}
	}
}
