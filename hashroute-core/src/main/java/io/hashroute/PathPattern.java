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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import io.netty.handler.codec.http.HttpMethod;
import reactor.util.annotation.Nullable;

/**
 * An HTTP method paired with a fixed-length, ordered sequence of {@link PathSegment}s.
 * A pattern without segments denotes the root path.
 * <p>
 * Two patterns are equal when they have the same method and the same segments, in the
 * same order. Instances are immutable.
 */
public final class PathPattern {

	/**
	 * Creates a pattern from ordered tokens. {@link HashRoute#WILDCARD} denotes a wildcard,
	 * any other token is literal text.
	 * <pre>
	 * PathPattern.of(HttpMethod.POST, "foo", "_", "bar", "_", "baz");
	 * </pre>
	 *
	 * @param method the HTTP method
	 * @param tokens the tokens, none of which may be empty or contain {@code /}
	 * @return the pattern
	 */
	public static PathPattern of(HttpMethod method, String... tokens) {
		Objects.requireNonNull(tokens, "tokens");
		return of(method, Arrays.asList(tokens));
	}

	/**
	 * Creates a pattern from ordered tokens. {@link HashRoute#WILDCARD} denotes a wildcard,
	 * any other token is literal text.
	 *
	 * @param method the HTTP method
	 * @param tokens the tokens, none of which may be empty or contain {@code /}
	 * @return the pattern
	 */
	public static PathPattern of(HttpMethod method, List<String> tokens) {
		Objects.requireNonNull(method, "method");
		Objects.requireNonNull(tokens, "tokens");
		List<PathSegment> segments = new ArrayList<>(tokens.size());
		for (String token : tokens) {
			segments.add(PathSegment.of(token));
		}
		return new PathPattern(method, segments);
	}

	/**
	 * Creates a pattern from a {@code /} separated path such as {@code /users/_/posts}.
	 * The path is split with {@link PathComponents#split(String)}, so empty components,
	 * leading and trailing separators are ignored.
	 *
	 * @param method the HTTP method
	 * @param path the path pattern
	 * @return the pattern
	 */
	public static PathPattern parse(HttpMethod method, String path) {
		return of(method, PathComponents.split(path));
	}

	/**
	 * Creates a pattern from already built segments.
	 *
	 * @param method the HTTP method
	 * @param segments the segments
	 * @return the pattern
	 */
	public static PathPattern ofSegments(HttpMethod method, List<PathSegment> segments) {
		Objects.requireNonNull(method, "method");
		Objects.requireNonNull(segments, "segments");
		List<PathSegment> copy = new ArrayList<>(segments.size());
		for (PathSegment segment : segments) {
			copy.add(Objects.requireNonNull(segment, "segment"));
		}
		return new PathPattern(method, copy);
	}

	final HttpMethod        method;
	final List<PathSegment> segments;
	final int               wildcardCount;

	PathPattern(HttpMethod method, List<PathSegment> segments) {
		this.method = method;
		this.segments = Collections.unmodifiableList(segments);
		int wildcards = 0;
		for (PathSegment segment : segments) {
			if (segment.isWildcard()) {
				wildcards++;
			}
		}
		this.wildcardCount = wildcards;
	}

	/**
	 * Returns the HTTP method of this pattern.
	 *
	 * @return the HTTP method of this pattern
	 */
	public HttpMethod method() {
		return method;
	}

	/**
	 * Returns the number of segments, {@code 0} for the root path.
	 *
	 * @return the number of segments
	 */
	public int size() {
		return segments.size();
	}

	/**
	 * Returns the segment at the given position.
	 *
	 * @param index the position, starting from {@code 0}
	 * @return the segment
	 * @throws IndexOutOfBoundsException if there is no such position
	 */
	public PathSegment segment(int index) {
		return segments.get(index);
	}

	/**
	 * Returns the unmodifiable list of segments.
	 *
	 * @return the unmodifiable list of segments
	 */
	public List<PathSegment> segments() {
		return segments;
	}

	/**
	 * Returns the number of wildcard segments, which is the number of captured values a
	 * successful match yields.
	 *
	 * @return the number of wildcard segments
	 */
	public int wildcardCount() {
		return wildcardCount;
	}

	/**
	 * Compares the given components position by position with the segments of this
	 * pattern. The method is not checked.
	 *
	 * @param components the path components
	 * @return the values captured by the wildcards, left to right, or {@code null} when the
	 * components do not match
	 */
	@Nullable
	List<String> match(List<String> components) {
		if (components.size() != segments.size()) {
			return null;
		}
		if (wildcardCount == 0) {
			for (int i = 0; i < segments.size(); i++) {
				if (!segments.get(i).matches(components.get(i))) {
					return null;
				}
			}
			return Collections.emptyList();
		}
		List<String> captures = new ArrayList<>(wildcardCount);
		for (int i = 0; i < segments.size(); i++) {
			PathSegment segment = segments.get(i);
			String component = components.get(i);
			if (!segment.matches(component)) {
				return null;
			}
			if (segment.isWildcard()) {
				captures.add(component);
			}
		}
		return Collections.unmodifiableList(captures);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof PathPattern)) {
			return false;
		}
		PathPattern that = (PathPattern) o;
		return method.equals(that.method) && segments.equals(that.segments);
	}

	@Override
	public int hashCode() {
		return Objects.hash(method, segments);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder(method.name()).append(' ');
		if (segments.isEmpty()) {
			return sb.append('/').toString();
		}
		for (PathSegment segment : segments) {
			sb.append('/').append(segment);
		}
		return sb.toString();
	}
}
