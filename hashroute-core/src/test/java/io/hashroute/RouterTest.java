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

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import io.netty.handler.codec.http.HttpMethod;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class RouterTest {

	static final String NOT_FOUND = "404";

	@Test
	void capturesArePassedToTheHandlerInOrder() {
		AtomicReference<List<String>> captured = new AtomicReference<>();
		Router<String, String> router =
				Router.<String, String>builder(req -> Mono.just(NOT_FOUND))
				      .register(HttpMethod.POST, PathPattern.of(HttpMethod.POST, "foo", "_", "bar", "_", "baz"),
				              (params, req) -> {
				                  captured.set(params);
				                  return Mono.just(req + ":" + String.join(",", params));
				              })
				      .build();

		StepVerifier.create(router.dispatch(HttpMethod.POST, "/foo/1/bar/2/baz", "body"))
		            .expectNext("body:1,2")
		            .expectComplete()
		            .verify(Duration.ofSeconds(5));

		assertThat(captured.get()).containsExactly("1", "2");
	}

	@Test
	void splitComponentsAreMatchedAsGiven() {
		Router<String, String> router =
				Router.<String, String>builder(req -> Mono.just(NOT_FOUND))
				      .get("/files/_", (params, req) -> Mono.just("one " + params))
				      .get("/files/_/_", (params, req) -> Mono.just("two " + params))
				      .build();

		StepVerifier.create(router.dispatch(HttpMethod.GET, Arrays.asList("files", "a/b"), "req"))
		            .expectNext("one [a/b]")
		            .verifyComplete();

		StepVerifier.create(router.dispatch(HttpMethod.GET, "/files/a/b", "req"))
		            .expectNext("two [a, b]")
		            .verifyComplete();
	}

	@Test
	void rootRoute() {
		Router<String, String> router =
				Router.<String, String>builder(req -> Mono.just(NOT_FOUND))
				      .register(HttpMethod.GET, Collections.emptyList(), (params, req) -> Mono.just("root"))
				      .build();

		StepVerifier.create(router.dispatch(HttpMethod.GET, "/", "req"))
		            .expectNext("root")
		            .verifyComplete();

		StepVerifier.create(router.dispatch(HttpMethod.GET, "/x", "req"))
		            .expectNext(NOT_FOUND)
		            .verifyComplete();
	}

	@Test
	void samePathDifferentMethods() {
		Router<String, String> router =
				Router.<String, String>builder(req -> Mono.just(NOT_FOUND))
				      .get("/foo", (params, req) -> Mono.just("get"))
				      .post("/foo", (params, req) -> Mono.just("post"))
				      .build();

		StepVerifier.create(router.dispatch(HttpMethod.GET, "/foo", "req"))
		            .expectNext("get")
		            .verifyComplete();

		StepVerifier.create(router.dispatch(HttpMethod.POST, "/foo", "req"))
		            .expectNext("post")
		            .verifyComplete();

		StepVerifier.create(router.dispatch(HttpMethod.DELETE, "/foo", "req"))
		            .expectNext(NOT_FOUND)
		            .verifyComplete();
	}

	@Test
	void notFoundReceivesTheRequestAndNoHandlerIsInvoked() {
		AtomicInteger invocations = new AtomicInteger();
		Router<String, String> router =
				Router.<String, String>builder(req -> Mono.just("missing " + req))
				      .get("/a/b", (params, req) -> {
				          invocations.incrementAndGet();
				          return Mono.just("a");
				      })
				      .build();

		StepVerifier.create(router.dispatch(HttpMethod.GET, "/a", "req-1"))
		            .expectNext("missing req-1")
		            .verifyComplete();

		StepVerifier.create(router.dispatch(HttpMethod.GET, "/a/b/c", "req-2"))
		            .expectNext("missing req-2")
		            .verifyComplete();

		assertThat(invocations).hasValue(0);
	}

	@Test
	void overlappingPatternsFollowRegistrationOrder() {
		Router<String, String> router =
				Router.<String, String>builder(req -> Mono.just(NOT_FOUND))
				      .get("/_/_", (params, req) -> Mono.just("wildcards " + params))
				      .get("/foo/_", (params, req) -> Mono.just("foo " + params))
				      .build();

		StepVerifier.create(router.dispatch(HttpMethod.GET, "/foo/1", "req"))
		            .expectNext("wildcards [foo, 1]")
		            .verifyComplete();
	}

	@Test
	void handlerResultIsReturnedUnchanged() {
		Flux<String> response = Flux.just("a", "b", "c");
		Router<String, String> router =
				Router.<String, String>builder(req -> Mono.just(NOT_FOUND))
				      .get("/stream", (params, req) -> response)
				      .build();

		assertThat(router.dispatch(HttpMethod.GET, "/stream", "req")).isSameAs(response);
	}

	@Test
	void handlerErrorIsPropagated() {
		IllegalStateException failure = new IllegalStateException("boom");
		Router<String, String> router =
				Router.<String, String>builder(req -> Mono.just(NOT_FOUND))
				      .get("/async", (params, req) -> Mono.error(failure))
				      .get("/sync", (params, req) -> {
				          throw failure;
				      })
				      .build();

		StepVerifier.create(router.dispatch(HttpMethod.GET, "/async", "req"))
		            .expectErrorSatisfies(t -> assertThat(t).isSameAs(failure))
		            .verify(Duration.ofSeconds(5));

		StepVerifier.create(router.dispatch(HttpMethod.GET, "/sync", "req"))
		            .expectErrorSatisfies(t -> assertThat(t).isSameAs(failure))
		            .verify(Duration.ofSeconds(5));
	}

	@Test
	void handlerIsNotInvokedBeforeDispatch() {
		AtomicInteger subscriptions = new AtomicInteger();
		Router<String, String> router =
				Router.<String, String>builder(req -> Mono.just(NOT_FOUND))
				      .get("/lazy", (params, req) -> Mono.fromCallable(() -> "v" + subscriptions.incrementAndGet()))
				      .build();

		Mono<String> response = Mono.from(router.dispatch(HttpMethod.GET, "/lazy", "req"));
		assertThat(subscriptions).hasValue(0);

		StepVerifier.create(response)
		            .expectNext("v1")
		            .verifyComplete();
	}

	@Test
	void repeatedDispatchYieldsSameResult() {
		Router<String, String> router =
				Router.<String, String>builder(req -> Mono.just(NOT_FOUND))
				      .get("/users/_/posts/_", (params, req) -> Mono.just(String.join("-", params)))
				      .get("/users/_", (params, req) -> Mono.just(params.get(0)))
				      .build();

		for (int i = 0; i < 3; i++) {
			assertThat(Mono.from(router.dispatch(HttpMethod.GET, "/users/7/posts/9", "req")).block())
					.isEqualTo("7-9");
			assertThat(Mono.from(router.dispatch(HttpMethod.GET, "/users/7", "req")).block())
					.isEqualTo("7");
			assertThat(router.find(HttpMethod.GET, "/users/7/posts/9").params())
					.containsExactly("7", "9");
		}
	}

	@Test
	void concurrentDispatch() {
		Router<String, String> router =
				Router.<String, String>builder(req -> Mono.just(NOT_FOUND))
				      .get("/items/_", (params, req) -> Mono.just(params.get(0)))
				      .build();

		List<String> expected = new ArrayList<>();
		for (int i = 0; i < 1000; i++) {
			expected.add(String.valueOf(i));
		}

		List<String> results =
				Flux.range(0, 1000)
				    .parallel(4)
				    .runOn(Schedulers.parallel())
				    .flatMap(i -> router.dispatch(HttpMethod.GET, "/items/" + i, "req"))
				    .sequential()
				    .collectList()
				    .block(Duration.ofSeconds(10));

		assertThat(results).containsExactlyInAnyOrderElementsOf(expected);
	}
}
