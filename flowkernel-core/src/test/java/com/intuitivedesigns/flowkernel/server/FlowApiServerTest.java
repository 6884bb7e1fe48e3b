/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.flowkernel.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.flowkernel.config.FlowConfigLoader;
import com.intuitivedesigns.flowkernel.config.FlowFactory;
import com.intuitivedesigns.flowkernel.dispatch.RequestDispatcher;
import com.intuitivedesigns.flowkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.flowkernel.route.RouteTable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FlowApiServerTest {

    private static final String CONFIG = """
            extensions: [ counting ]
            api:
              - route: greet
                version: "1.0"
                methods: [GET, POST]
                max_size: 64
                pipeline:
                  name: greet
                  node:
                    - name: T
                      type: transformer
                      version: "1.0"
                      config:
                        data:
                          body: "{'greeting': 'hello ' + (data.param.name ?: 'nobody')}"
                          headers: "{'X-Flow': 'greet'}"
                          status: 201
              - route: opaque
                version: "1.0"
                methods: [GET]
                pipeline:
                  name: opaque
                  node:
                    - { name: O, type: opaque, version: "1.0" }
              - route: café menu
                version: "1.0"
                methods: [GET]
                pipeline:
                  name: menu
                  node:
                    - name: T
                      type: transformer
                      version: "1.0"
                      config:
                        data:
                          body: "{'route': data.route}"
            """;

    private final ObjectMapper json = new ObjectMapper();
    private final HttpClient client = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    private FlowApiServer server;

    @BeforeEach
    void start() throws Exception {
        RouteTable routes = FlowFactory.createRouteTable(FlowConfigLoader.parse(CONFIG), MetricsRuntime.noop());
        ServerSettings settings = ServerSettings.forTesting(4, 5_000);
        RequestDispatcher dispatcher = FlowFactory.createDispatcher(routes, settings, MetricsRuntime.noop());
        server = new FlowApiServer(settings, dispatcher, routes.largestMaxSize());
        server.start();
    }

    @AfterEach
    void stop() {
        server.close();
    }

    private URI uri(String pathAndQuery) {
        return URI.create("http://127.0.0.1:" + server.port() + pathAndQuery);
    }

    @Test
    void getRunsPipelineWithQueryParams() throws Exception {
        HttpResponse<String> r = client.send(HttpRequest.newBuilder(uri("/v1/0/greet?name=ada")).GET().build(),
                HttpResponse.BodyHandlers.ofString());

        assertThat(r.statusCode()).isEqualTo(201);
        assertThat(r.headers().firstValue("X-Flow")).hasValue("greet");
        assertThat(r.headers().firstValue("Content-Type")).hasValue("application/json");
        assertThat(json.readTree(r.body()).path("greeting").asText()).isEqualTo("hello ada");
    }

    @Test
    void postBodyMergesIntoParams() throws Exception {
        HttpResponse<String> r = client.send(HttpRequest.newBuilder(uri("/v1/0/greet"))
                        .POST(HttpRequest.BodyPublishers.ofString("{\"name\":\"bob\"}"))
                        .header("Content-Type", "application/json")
                        .build(),
                HttpResponse.BodyHandlers.ofString());

        assertThat(r.statusCode()).isEqualTo(201);
        assertThat(json.readTree(r.body()).path("greeting").asText()).isEqualTo("hello bob");
    }

    @Test
    void unknownRouteIs404() throws Exception {
        HttpResponse<String> r = client.send(HttpRequest.newBuilder(uri("/v9/9/greet")).GET().build(),
                HttpResponse.BodyHandlers.ofString());

        assertThat(r.statusCode()).isEqualTo(404);
        JsonNode body = json.readTree(r.body());
        assertThat(body.path("error").asText()).isEqualTo("NO_SUCH_ENDPOINT");
    }

    @Test
    void wrongMethodIs405WithAllow() throws Exception {
        HttpResponse<String> r = client.send(HttpRequest.newBuilder(uri("/v1/0/greet"))
                        .DELETE()
                        .build(),
                HttpResponse.BodyHandlers.ofString());

        assertThat(r.statusCode()).isEqualTo(405);
        assertThat(r.headers().firstValue("Allow")).hasValue("GET, POST");
    }

    @Test
    void oversizedBodyIs413() throws Exception {
        HttpResponse<String> r = client.send(HttpRequest.newBuilder(uri("/v1/0/greet"))
                        .POST(HttpRequest.BodyPublishers.ofString("{\"name\":\"" + "x".repeat(200) + "\"}"))
                        .build(),
                HttpResponse.BodyHandlers.ofString());

        assertThat(r.statusCode()).isEqualTo(413);
    }

    @Test
    void unserializableBodyStillGetsA500() throws Exception {
        HttpResponse<String> r = client.send(HttpRequest.newBuilder(uri("/v1/0/opaque")).GET().build(),
                HttpResponse.BodyHandlers.ofString());

        assertThat(r.statusCode()).isEqualTo(500);
        JsonNode body = json.readTree(r.body());
        assertThat(body.path("message").asText()).isEqualTo("Requested process failed");
        assertThat(body.path("id").asText()).isNotBlank();
    }

    @Test
    void percentEncodedPathMatchesDecodedRoute() throws Exception {
        HttpResponse<String> r = client.send(HttpRequest.newBuilder(uri("/v1/0/caf%C3%A9%20menu")).GET().build(),
                HttpResponse.BodyHandlers.ofString());

        assertThat(r.statusCode()).isEqualTo(200);
        assertThat(json.readTree(r.body()).path("route").asText()).isEqualTo("caf\u00e9 menu");
    }

    @Test
    void decodePathKeepsPlusAndMalformedEscapes() {
        assertThat(FlowApiServer.decodePath("/v1/0/a%20b")).isEqualTo("/v1/0/a b");
        assertThat(FlowApiServer.decodePath("/v1/0/a+b")).isEqualTo("/v1/0/a+b");
        assertThat(FlowApiServer.decodePath("/v1/0/a+b%21")).isEqualTo("/v1/0/a+b!");
        assertThat(FlowApiServer.decodePath("/v1/0/%zz")).isEqualTo("/v1/0/%zz");
        assertThat(FlowApiServer.decodePath(null)).isNull();
    }

    @Test
    void parseQueryDecodesAndCollectsRepeats() {
        Map<String, Object> q = FlowApiServer.parseQuery("a=1&b=x%20y&a=2&flag&a=3");

        assertThat(q).containsEntry("a", List.of("1", "2", "3"))
                .containsEntry("b", "x y")
                .containsEntry("flag", "");
        assertThat(FlowApiServer.parseQuery(null)).isEmpty();
    }

    @Test
    void readBodyStopsAtLimit() throws Exception {
        byte[] read = FlowApiServer.readBody(new ByteArrayInputStream(new byte[20_000]), 10_001);

        assertThat(read).hasSize(10_001);
    }
}
