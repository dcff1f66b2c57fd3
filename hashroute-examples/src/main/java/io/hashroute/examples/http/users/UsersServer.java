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
package io.hashroute.examples.http.users;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import io.hashroute.http.HttpRouter;
import io.netty.handler.codec.http.HttpResponseStatus;
import reactor.core.publisher.Mono;
import reactor.netty.http.server.HttpServer;

/**
 * An HTTP server keeping users in memory. The store belongs to the handlers; the router
 * only selects them.
 * <pre>
 * curl -X PUT -d 'Jane' localhost:8080/users/1
 * curl localhost:8080/users/1
 * curl -X DELETE localhost:8080/users/1
 * </pre>
 */
public final class UsersServer {

	static final int PORT = Integer.parseInt(System.getProperty("port", "8080"));
	static final boolean WIRETAP = System.getProperty("wiretap") != null;

	public static void main(String[] args) {
		Map<String, String> users = new ConcurrentHashMap<>();

		HttpRouter router =
				HttpRouter.builder()
				          .get("/users", (params, req, res) -> res.sendString(Mono.just(String.join("\n", users.keySet()))))
				          .get("/users/_", (params, req, res) -> {
				              String name = users.get(params.get(0));
				              if (name == null) {
				                  return res.sendNotFound();
				              }
				              return res.sendString(Mono.just(name));
				          })
				          .put("/users/_", (params, req, res) ->
				                  req.receive()
				                     .aggregate()
				                     .asString()
				                     .switchIfEmpty(Mono.error(new IllegalArgumentException("User name is required")))
				                     .flatMap(name -> {
				                         users.put(params.get(0), name);
				                         return res.status(HttpResponseStatus.NO_CONTENT).send();
				                     }))
				          .delete("/users/_", (params, req, res) ->
				                  users.remove(params.get(0)) == null ? res.sendNotFound() :
				                          res.status(HttpResponseStatus.NO_CONTENT).send())
				          .notFoundHandler((req, res) ->
				                  res.status(HttpResponseStatus.NOT_FOUND)
				                     .sendString(Mono.just("No route for " + req.method() + " " + req.uri())))
				          .internalErrorHandler((error, req, res) ->
				                  res.status(error instanceof IllegalArgumentException ?
				                                     HttpResponseStatus.BAD_REQUEST : HttpResponseStatus.INTERNAL_SERVER_ERROR)
				                     .sendString(Mono.just(String.valueOf(error.getMessage()))))
				          .build();

		HttpServer.create()
		          .port(PORT)
		          .wiretap(WIRETAP)
		          .handle(router)
		          .bindNow()
		          .onDispose()
		          .block();
	}
}
