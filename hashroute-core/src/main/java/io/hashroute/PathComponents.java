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
import java.util.List;
import java.util.Objects;

/**
 * Splits paths into their non-empty {@code /} delimited components. Route patterns and
 * inbound request paths go through the same rule, so {@code ""}, {@code "/"} and
 * {@code "//"} all have zero components and {@code "/a//b/"} has two.
 */
public final class PathComponents {

	/**
	 * Splits the given path into its non-empty components.
	 *
	 * @param path the path, with or without a leading {@code /}
	 * @return the ordered components, never {@code null}
	 */
	public static List<String> split(String path) {
		Objects.requireNonNull(path, "path");
		List<String> components = new ArrayList<>();
		int length = path.length();
		int start = 0;
		for (int i = 0; i <= length; i++) {
			if (i == length || path.charAt(i) == '/') {
				if (i > start) {
					components.add(path.substring(start, i));
				}
				start = i + 1;
			}
		}
		return components;
	}

	PathComponents() {
	}
}
