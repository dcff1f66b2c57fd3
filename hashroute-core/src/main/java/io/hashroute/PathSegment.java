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

import reactor.util.annotation.Nullable;

/**
 * A single segment specifier of a {@link PathPattern}: either literal text that a path
 * component must equal exactly, or a wildcard which matches any single component and
 * captures its value.
 */
public final class PathSegment {

	/**
	 * The kind of a {@link PathSegment}.
	 */
	public enum Kind {
		LITERAL,
		WILDCARD
	}

	/**
	 * The wildcard segment. All wildcards are equal to each other.
	 */
	public static final PathSegment WILDCARD = new PathSegment(Kind.WILDCARD, null);

	/**
	 * Classifies a pattern token: {@link HashRoute#WILDCARD} becomes the wildcard segment,
	 * anything else a literal.
	 *
	 * @param token the token
	 * @return the segment
	 * @throws IllegalArgumentException if the token is empty or contains {@code /}
	 */
	public static PathSegment of(String token) {
		Objects.requireNonNull(token, "token");
		if (HashRoute.WILDCARD.equals(token)) {
			return WILDCARD;
		}
		return literal(token);
	}

	/**
	 * Creates a literal segment, even for text equal to {@link HashRoute#WILDCARD}.
	 *
	 * @param text the literal text
	 * @return the segment
	 * @throws IllegalArgumentException if the text is empty or contains {@code /}
	 */
	public static PathSegment literal(String text) {
		Objects.requireNonNull(text, "text");
		if (text.isEmpty()) {
			throw new IllegalArgumentException("Path segment must not be empty");
		}
		if (text.indexOf('/') >= 0) {
			throw new IllegalArgumentException("Path segment [" + text + "] must not contain '/'");
		}
		return new PathSegment(Kind.LITERAL, text);
	}

	final Kind kind;
	final String value;

	PathSegment(Kind kind, @Nullable String value) {
		this.kind = kind;
		this.value = value;
	}

	/**
	 * Returns the kind of this segment.
	 *
	 * @return the kind of this segment
	 */
	public Kind kind() {
		return kind;
	}

	/**
	 * Returns whether this segment is the wildcard.
	 *
	 * @return {@code true} for the wildcard
	 */
	public boolean isWildcard() {
		return kind == Kind.WILDCARD;
	}

	/**
	 * Returns the literal text, {@code null} for the wildcard.
	 *
	 * @return the literal text, {@code null} for the wildcard
	 */
	@Nullable
	public String value() {
		return value;
	}

	/**
	 * Tests a single, non-empty, path component against this segment. Literals compare
	 * case-sensitively.
	 *
	 * @param component the path component
	 * @return {@code true} on match
	 */
	public boolean matches(String component) {
		if (kind == Kind.WILDCARD) {
			return !component.isEmpty();
		}
		return value.equals(component);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof PathSegment)) {
			return false;
		}
		PathSegment that = (PathSegment) o;
		return kind == that.kind && Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, value);
	}

	@Override
	public String toString() {
		return kind == Kind.WILDCARD ? HashRoute.WILDCARD : value;
	}
}
