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

import java.util.Arrays;

import io.netty.handler.codec.http.HttpMethod;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import static org.assertj.core.api.Assertions.assertThat;

class RouteTableTest {

	static final RouteHandler<String, String> FIRST = (params, req) -> Mono.just("first");
	static final RouteHandler<String, String> SECOND = (params, req) -> Mono.just("second");

	@Test
	void entriesArePartitionedByMethodAndSize() {
		RouteTable<String, String> table = new RouteTable<>(Arrays.asList(
				entry(HttpMethod.GET, "/", FIRST),
				entry(HttpMethod.GET, "/foo", FIRST),
				entry(HttpMethod.GET, "/_", SECOND),
				entry(HttpMethod.POST, "/foo", SECOND),
				entry(HttpMethod.GET, "/foo/_", FIRST)));

		assertThat(table.size()).isEqualTo(5);
		assertThat(table.bucketCount()).isEqualTo(4);
		assertThat(table.bucket(HttpMethod.GET, 1))
				.extracting(RouteEntry::pattern)
				.containsExactly(PathPattern.parse(HttpMethod.GET, "/foo"), PathPattern.parse(HttpMethod.GET, "/_"));
		assertThat(table.bucket(HttpMethod.DELETE, 1)).isEmpty();
		assertThat(table.entries()).extracting(e -> e.pattern().toString())
		                           .containsExactly("GET /", "GET /foo", "GET /_", "POST /foo", "GET /foo/_");
	}

	@Test
	void earlierRegistrationWinsOverMoreSpecificPattern() {
		RouteTable<String, String> table = new RouteTable<>(Arrays.asList(
				entry(HttpMethod.GET, "/_/_", FIRST),
				entry(HttpMethod.GET, "/foo/_", SECOND)));

		RouteMatch<String, String> match = table.find(HttpMethod.GET, "/foo/1");

		assertThat(match).isNotNull();
		assertThat(match.handler()).isSameAs(FIRST);
		assertThat(match.params()).containsExactly("foo", "1");
	}

	@Test
	void literalPatternRegisteredFirstWins() {
		RouteTable<String, String> table = new RouteTable<>(Arrays.asList(
				entry(HttpMethod.GET, "/foo/_", FIRST),
				entry(HttpMethod.GET, "/_/_", SECOND)));

		RouteMatch<String, String> foo = table.find(HttpMethod.GET, "/foo/1");
		RouteMatch<String, String> other = table.find(HttpMethod.GET, "/bar/1");

		assertThat(foo).isNotNull();
		assertThat(foo.handler()).isSameAs(FIRST);
		assertThat(foo.params()).containsExactly("1");
		assertThat(other).isNotNull();
		assertThat(other.handler()).isSameAs(SECOND);
		assertThat(other.params()).containsExactly("bar", "1");
	}

	@Test
	void failedCandidateDoesNotLeakCaptures() {
		RouteTable<String, String> table = new RouteTable<>(Arrays.asList(
				entry(HttpMethod.GET, "/_/a", FIRST),
				entry(HttpMethod.GET, "/x/_", SECOND)));

		RouteMatch<String, String> match = table.find(HttpMethod.GET, "/x/b");

		assertThat(match).isNotNull();
		assertThat(match.handler()).isSameAs(SECOND);
		assertThat(match.params()).containsExactly("b");
	}

	@Test
	void duplicatesAreShadowed() {
		RouteTable<String, String> table = new RouteTable<>(Arrays.asList(
				entry(HttpMethod.PUT, "/a/_", FIRST),
				entry(HttpMethod.PUT, "/a/_", SECOND)));

		assertThat(table.size()).isEqualTo(2);
		assertThat(table.find(HttpMethod.PUT, "/a/b").handler()).isSameAs(FIRST);
	}

	@Test
	void noMatch() {
		RouteTable<String, String> table = new RouteTable<>(Arrays.asList(
				entry(HttpMethod.GET, "/foo", FIRST),
				entry(HttpMethod.GET, "/foo/bar", FIRST)));

		assertThat(table.find(HttpMethod.GET, "/bar")).isNull();
		assertThat(table.find(HttpMethod.GET, "/foo/baz")).isNull();
		assertThat(table.find(HttpMethod.GET, "/foo/bar/baz")).isNull();
		assertThat(table.find(HttpMethod.POST, "/foo")).isNull();
		assertThat(table.find(HttpMethod.GET, "/FOO")).isNull();
	}

	@Test
	void rootMatchesOnlyEmptyPath() {
		RouteTable<String, String> table = new RouteTable<>(Arrays.asList(entry(HttpMethod.GET, "/", FIRST)));

		assertThat(table.find(HttpMethod.GET, "/")).isNotNull();
		assertThat(table.find(HttpMethod.GET, "")).isNotNull();
		assertThat(table.find(HttpMethod.GET, "/").params()).isEmpty();
		assertThat(table.find(HttpMethod.GET, "/x")).isNull();
		assertThat(table.find(HttpMethod.HEAD, "/")).isNull();
	}

	@Test
	void customMethodsHaveTheirOwnBuckets() {
		HttpMethod purge = HttpMethod.valueOf("PURGE");
		RouteTable<String, String> table = new RouteTable<>(Arrays.asList(entry(purge, "/cache/_", FIRST)));

		assertThat(table.find(HttpMethod.valueOf("PURGE"), "/cache/img").params()).containsExactly("img");
		assertThat(table.find(HttpMethod.DELETE, "/cache/img")).isNull();
	}

	static RouteEntry<String, String> entry(HttpMethod method, String path, RouteHandler<String, String> handler) {
		return new RouteEntry<>(PathPattern.parse(method, path), handler);
	}
}
