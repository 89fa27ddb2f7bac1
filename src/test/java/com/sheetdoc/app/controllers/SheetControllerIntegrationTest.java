package com.sheetdoc.app.controllers;

import com.sheetdoc.app.SheetDocApplication;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.*;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests using a running server instance (RANDOM_PORT).
 * These tests verify end-to-end HTTP behavior, JSON handling and SheetDoc text.
 */
@SpringBootTest(
        classes = SheetDocApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT
)
@ActiveProfiles("test")
class SheetControllerIntegrationTest {

    @LocalServerPort
    int port;

    private String url(String path) {
        return "http://localhost:" + port + path;
    }

    private static HttpEntity<String> text(String body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.TEXT_PLAIN);
        return new HttpEntity<>(body, headers);
    }

    private static HttpEntity<String> json(String body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return new HttpEntity<>(body, headers);
    }

    private long createSheet(RestTemplate restTemplate, String body) {
        ResponseEntity<Long> response = restTemplate.postForEntity(url("/sheet"), body == null ? null : json(body),
                Long.class);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertNotNull(response.getBody());
        return response.getBody();
    }

    /**
     * Creates a sheet, sets literals and a formula, reads back evaluated values.
     */
    @Test
    void testCreateSheetAndEvaluate() {
        RestTemplate restTemplate = new RestTemplate();
        long sheetId = createSheet(restTemplate, null);

        restTemplate.put(url("/sheet/" + sheetId + "/cell/A1"), text("1"));
        restTemplate.put(url("/sheet/" + sheetId + "/cell/A2"), text("2"));
        restTemplate.put(url("/sheet/" + sheetId + "/cell/b1"), text("=SUM(A1:A3)"));
        restTemplate.put(url("/sheet/" + sheetId + "/cell/C1"), text("=\"hello\"+\"world\""));
        restTemplate.put(url("/sheet/" + sheetId + "/cell/C2"), text("=5/0"));

        ResponseEntity<Map> response = restTemplate.getForEntity(url("/sheet/" + sheetId), Map.class);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        Map<String, Object> data = response.getBody();
        assertEquals(3, data.get("B1"));
        assertEquals("helloworld", data.get("C1"));
        assertEquals("#ERROR", data.get("C2"));
        assertFalse(data.containsKey("A3"));
    }

    @Test
    void testInvalidAddressIsBadRequest() {
        RestTemplate restTemplate = new RestTemplate();
        long sheetId = createSheet(restTemplate, null);

        HttpClientErrorException e = assertThrows(HttpClientErrorException.class, () ->
                restTemplate.exchange(url("/sheet/" + sheetId + "/cell/1A"), HttpMethod.PUT, text("x"), Void.class));
        assertEquals(HttpStatus.BAD_REQUEST, e.getStatusCode());
        assertTrue(e.getResponseBodyAsString().contains("INVALID_CELL_ADDRESS"));
    }

    @Test
    void testOversizedSheetIsBadRequest() {
        RestTemplate restTemplate = new RestTemplate();
        long sheetId = createSheet(restTemplate, null);

        HttpClientErrorException e = assertThrows(HttpClientErrorException.class, () ->
                restTemplate.exchange(url("/sheet/" + sheetId + "/cell/A2147483647"), HttpMethod.PUT, text("x"),
                        Void.class));
        assertEquals(HttpStatus.BAD_REQUEST, e.getStatusCode());
        assertTrue(e.getResponseBodyAsString().contains("SHEET_TOO_LARGE"));

        HttpClientErrorException create = assertThrows(HttpClientErrorException.class, () ->
                restTemplate.postForEntity(url("/sheet"), json("{\"rowCount\": 100000}"), Long.class));
        assertEquals(HttpStatus.BAD_REQUEST, create.getStatusCode());
    }

    @Test
    void testUnknownSheetIsNotFound() {
        RestTemplate restTemplate = new RestTemplate();

        HttpClientErrorException e = assertThrows(HttpClientErrorException.class, () ->
                restTemplate.getForEntity(url("/sheet/987654"), Map.class));
        assertEquals(HttpStatus.NOT_FOUND, e.getStatusCode());
    }

    /**
     * The test profile creates 5x5 sheets; the evaluation carries a full display matrix.
     */
    @Test
    void testEvaluationEndpoint() {
        RestTemplate restTemplate = new RestTemplate();
        long sheetId = createSheet(restTemplate, null);

        restTemplate.put(url("/sheet/" + sheetId + "/cells"), json(
                "[{\"address\": \"A1\", \"value\": \"=B1\"}, {\"address\": \"B1\", \"value\": \"=A1\"}]"));

        ResponseEntity<Map> response = restTemplate.getForEntity(url("/sheet/" + sheetId + "/evaluation"), Map.class);
        List<List<String>> display = (List<List<String>>) response.getBody().get("display");
        assertEquals(5, display.size());
        assertEquals(5, display.get(0).size());
        assertEquals(Arrays.asList("#CYCLE", "#CYCLE", "", "", ""), display.get(0));

        List<List<String>> errors = (List<List<String>>) response.getBody().get("errors");
        assertEquals("Circular reference detected", errors.get(0).get(0));
        assertNull(errors.get(1).get(1));
    }

    @Test
    void testGetForwardDependencyGraph() {
        RestTemplate restTemplate = new RestTemplate();
        long sheetId = createSheet(restTemplate, null);

        // B1 -> C2, A1 -> B1
        restTemplate.put(url("/sheet/" + sheetId + "/cell/B1"), text("=C2"));
        restTemplate.put(url("/sheet/" + sheetId + "/cell/A1"), text("=B1"));

        ResponseEntity<Map> response = restTemplate.getForEntity(
                url("/sheet/" + sheetId + "/forwardDependencies"), Map.class);
        Map<String, List<String>> forwardGraph = response.getBody();
        assertNotNull(forwardGraph);

        assertEquals(Collections.singletonList("C2"), forwardGraph.get("B1"));
        assertEquals(Collections.singletonList("B1"), forwardGraph.get("A1"));
        assertNull(forwardGraph.get("C2"));
    }

    @Test
    void testGetReverseDependencyGraph() {
        RestTemplate restTemplate = new RestTemplate();
        long sheetId = createSheet(restTemplate, null);

        // B5 -> A5, C5 -> B5
        restTemplate.put(url("/sheet/" + sheetId + "/cell/B5"), text("=A5"));
        restTemplate.put(url("/sheet/" + sheetId + "/cell/C5"), text("=B5"));

        ResponseEntity<Map> response = restTemplate.getForEntity(
                url("/sheet/" + sheetId + "/reverseDependencies"), Map.class);
        Map<String, List<String>> reverseGraph = response.getBody();
        assertNotNull(reverseGraph);

        assertEquals(Collections.singletonList("B5"), reverseGraph.get("A5"));
        assertEquals(Collections.singletonList("C5"), reverseGraph.get("B5"));
        assertNull(reverseGraph.get("C5"));
    }

    /**
     * Export as SheetDoc, import into a second sheet, compare values.
     */
    @Test
    void testDocumentRoundTrip() {
        RestTemplate restTemplate = new RestTemplate();
        long sourceId = createSheet(restTemplate, "{\"title\": \"Source\", \"rowCount\": 3, \"columnCount\": 2}");
        restTemplate.put(url("/sheet/" + sourceId + "/cell/A1"), text("6"));
        restTemplate.put(url("/sheet/" + sourceId + "/cell/B1"), text("=A1*7"));

        ResponseEntity<String> exported = restTemplate.getForEntity(
                url("/sheet/" + sourceId + "/document"), String.class);
        assertEquals(HttpStatus.OK, exported.getStatusCode());
        String document = exported.getBody();
        assertTrue(document.startsWith("#%PAGESPACE_SHEETDOC v1\n"));
        assertTrue(document.contains("row_count = 3\ncolumn_count = 2\n"));

        long targetId = createSheet(restTemplate, null);
        restTemplate.put(url("/sheet/" + targetId + "/document?strict=true"), text(document));

        Map<String, Object> data = restTemplate.getForEntity(url("/sheet/" + targetId), Map.class).getBody();
        assertEquals(6, data.get("A1"));
        assertEquals(42, data.get("B1"));
    }

    @Test
    void testStrictImportOfMalformedDocument() {
        RestTemplate restTemplate = new RestTemplate();
        long sheetId = createSheet(restTemplate, null);

        HttpClientErrorException e = assertThrows(HttpClientErrorException.class, () ->
                restTemplate.exchange(url("/sheet/" + sheetId + "/document?strict=true"), HttpMethod.PUT,
                        text("#%PAGESPACE_SHEETDOC v2\n"), Void.class));
        assertEquals(HttpStatus.BAD_REQUEST, e.getStatusCode());
        assertTrue(e.getResponseBodyAsString().contains("Unsupported SheetDoc version: v2"));
    }

    @Test
    void testCrossSheetReference() {
        RestTemplate restTemplate = new RestTemplate();
        long budgetId = createSheet(restTemplate, "{\"title\": \"Budget\"}");
        restTemplate.put(url("/sheet/" + budgetId + "/cell/B2"), text("100"));

        long sheetId = createSheet(restTemplate, null);
        restTemplate.put(url("/sheet/" + sheetId + "/cell/A1"), text("=@[Budget](" + budgetId + "):B2/4"));

        Map<String, Object> data = restTemplate.getForEntity(url("/sheet/" + sheetId), Map.class).getBody();
        assertEquals(25, data.get("A1"));

        ResponseEntity<List> references = restTemplate.getForEntity(
                url("/sheet/" + sheetId + "/externalReferences"), List.class);
        Map<String, Object> reference = (Map<String, Object>) references.getBody().get(0);
        assertEquals("Budget", reference.get("label"));
        assertEquals(String.valueOf(budgetId), reference.get("identifier"));
    }
}
