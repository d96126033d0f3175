package com.spreadsheet.calc.controllers;

import com.spreadsheet.calc.CalcApplication;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.*;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests using a running server instance (RANDOM_PORT).
 * These tests verify end-to-end HTTP behavior and JSON handling.
 */
@SpringBootTest(
        classes = CalcApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT
)
@ActiveProfiles("test")
class SpreadsheetControllerIntegrationTest {

    private static final ParameterizedTypeReference<Map<String, Double>> UPDATES =
            new ParameterizedTypeReference<Map<String, Double>>() {};

    @LocalServerPort
    int port;

    // The JDK client supports PATCH, the default one does not
    private final RestTemplate restTemplate = new RestTemplate(new JdkClientHttpRequestFactory());

    private String ssName;

    @BeforeEach
    void setUp() {
        // Spreadsheets outlive a test, so every test gets its own
        ssName = "ss" + System.nanoTime();
    }

    private URI cellUrl(String cellId, String param, String value) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl("http://localhost:" + port)
                .path("/api/{ssName}/{cellId}");
        if (param == null) {
            return builder.encode().buildAndExpand(ssName, cellId).toUri();
        }
        return builder.queryParam(param, "{value}").encode().buildAndExpand(ssName, cellId, value).toUri();
    }

    private URI sheetUrl(String suffix) {
        return URI.create("http://localhost:" + port + "/api/" + ssName + suffix);
    }

    private Map<String, Double> patch(String cellId, String param, String value) {
        ResponseEntity<Map<String, Double>> response = restTemplate.exchange(
                cellUrl(cellId, param, value), HttpMethod.PATCH, null, UPDATES);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        return response.getBody();
    }

    private HttpClientErrorException patchExpectingError(String cellId, String param, String value) {
        return assertThrows(HttpClientErrorException.class, () -> restTemplate.exchange(
                cellUrl(cellId, param, value), HttpMethod.PATCH, null, UPDATES));
    }

    @Test
    void testEvaluatePropagatesToDependents() {
        assertEquals(Map.of("b1", 1.0), patch("b1", "expr", "a1+1"));
        assertEquals(Map.of("a1", 5.0, "b1", 6.0), patch("a1", "expr", "5"));

        ResponseEntity<Map> cell = restTemplate.getForEntity(cellUrl("b1", null, null), Map.class);
        assertEquals(HttpStatus.OK, cell.getStatusCode());
        assertEquals("a1+1", cell.getBody().get("expr"));
        assertEquals(6.0, ((Number) cell.getBody().get("value")).doubleValue());
    }

    @Test
    void testSyntaxErrorIs400() {
        HttpClientErrorException ex = patchExpectingError("a1", "expr", "1+");
        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
        assertTrue(ex.getResponseBodyAsString().contains("\"SYNTAX\""));
    }

    @Test
    void testCircularReferenceIs400AndRolledBack() {
        patch("a1", "expr", "b1+1");
        HttpClientErrorException ex = patchExpectingError("b1", "expr", "a1+1");
        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
        assertTrue(ex.getResponseBodyAsString().contains("\"CIRCULAR_REF\""));

        ResponseEntity<Map> cell = restTemplate.getForEntity(cellUrl("b1", null, null), Map.class);
        assertEquals("", cell.getBody().get("expr"));
    }

    @Test
    void testPatchNeedsExactlyOneOfExprAndSrcCellId() {
        HttpClientErrorException neither = assertThrows(HttpClientErrorException.class,
                () -> restTemplate.exchange(cellUrl("a1", null, null), HttpMethod.PATCH, null, UPDATES));
        assertTrue(neither.getResponseBodyAsString().contains("\"BAD_REQ\""));

        URI both = UriComponentsBuilder.fromHttpUrl("http://localhost:" + port)
                .path("/api/{ssName}/a1")
                .queryParam("expr", "1")
                .queryParam("srcCellId", "b1")
                .buildAndExpand(ssName).toUri();
        HttpClientErrorException ex = assertThrows(HttpClientErrorException.class,
                () -> restTemplate.exchange(both, HttpMethod.PATCH, null, UPDATES));
        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
    }

    @Test
    void testCopyAndRemove() {
        patch("a1", "expr", "2");
        patch("b1", "expr", "a1*3");
        assertEquals(Map.of("b2", 0.0), patch("b2", "srcCellId", "b1"));

        patch("a2", "expr", "4");
        ResponseEntity<Map<String, Double>> removed = restTemplate.exchange(
                cellUrl("a1", null, null), HttpMethod.DELETE, null, UPDATES);
        assertEquals(Map.of("b1", 0.0), removed.getBody());
    }

    @Test
    void testLoadDumpAndClear() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        String body = "[[\"b1\", \"a1 * 2\"], [\"a1\", \"21\"]]";
        restTemplate.exchange(sheetUrl(""), HttpMethod.PUT, new HttpEntity<>(body, headers), Void.class);

        ResponseEntity<List> dump = restTemplate.getForEntity(sheetUrl(""), List.class);
        assertEquals(Arrays.asList(Arrays.asList("a1", "21"), Arrays.asList("b1", "a1*2")), dump.getBody());

        ResponseEntity<List> withValues = restTemplate.getForEntity(sheetUrl("?withValues=true"), List.class);
        List<?> b1 = (List<?>) withValues.getBody().get(1);
        assertEquals(42.0, ((Number) b1.get(2)).doubleValue());

        restTemplate.exchange(sheetUrl(""), HttpMethod.DELETE, null, Void.class);
        assertTrue(restTemplate.getForEntity(sheetUrl(""), List.class).getBody().isEmpty());
    }

    @Test
    void testDependencyGraphs() {
        patch("b1", "expr", "a1");
        patch("c1", "expr", "b1+a1");

        Map forward = restTemplate.getForEntity(sheetUrl("/forwardDependencies"), Map.class).getBody();
        assertEquals(Arrays.asList("a1", "b1"), forward.get("c1"));
        assertTrue(((List<?>) forward.get("a1")).isEmpty());

        Map reverse = restTemplate.getForEntity(sheetUrl("/reverseDependencies"), Map.class).getBody();
        assertEquals(Arrays.asList("b1", "c1"), reverse.get("a1"));
    }

    @Test
    void testCellOutsideGridIs400() {
        // The test profile uses a 10x10 grid
        HttpClientErrorException ex = patchExpectingError("a11", "expr", "1");
        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
        assertTrue(ex.getResponseBodyAsString().contains("\"BAD_REQ\""));
    }
}
