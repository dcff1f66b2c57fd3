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

/**
 * Internal helpers and the system properties recognized by HashRoute.
 */
public final class HashRoute {

	/**
	 * The token which, inside a route pattern, denotes a wildcard segment.
	 */
	public static final String WILDCARD = "_";

	/**
	 * Specifies whether the default internal error handler of the HTTP router writes the
	 * failure message into the response body.
	 * Default to {@code true}.
	 */
	public static final String ERROR_DETAILS = "hashroute.http.errorDetails";

	/**
	 * Returns the resolved value of {@link #ERROR_DETAILS}.
	 *
	 * @return {@code true} when error messages should be sent to the remote peer
	 */
	public static boolean errorDetails() {
		return Boolean.parseBoolean(System.getProperty(ERROR_DETAILS, "true"));
	}

	HashRoute() {
	}
}
