package com.zzf.codesync.api;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.actuate.metrics.AutoConfigureMetrics;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.web.server.LocalServerPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@AutoConfigureMetrics
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
public class SyncControllerTest {

    private static final String COLUMN = "Column(\n  children: [\n    Text('A'),\n  ],\n)\n";

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate restTemplate;

    private String url(String path) {
        return "http://localhost:" + port + "/api/sync" + path;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> post(String path, Map<String, Object> body) {
        ResponseEntity<Map> resp = restTemplate.postForEntity(url(path), body, Map.class);
        assertEquals(HttpStatus.OK, resp.getStatusCode(), String.valueOf(resp.getBody()));
        return resp.getBody();
    }

    private static Map<String, Object> body(Object... pairs) {
        Map<String, Object> out = new HashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            out.put((String) pairs[i], pairs[i + 1]);
        }
        return out;
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testLoadEditAndUndo() {
        Map<String, Object> loaded = post("/buffer", body("text", COLUMN));
        assertEquals("loaded", loaded.get("status"));
        Map<String, Object> tree = (Map<String, Object>) loaded.get("tree");
        assertEquals("Root", tree.get("name"));

        Map<String, Object> edited = post("/edit", body("targetLine", 1, "code", "Text('New')", "position", "asChild"));
        assertEquals("applied", edited.get("status"));
        assertEquals(1, edited.get("linesDelta"));
        assertTrue(((String) edited.get("text")).contains("    Text('New'),\n    Text('A'),"));

        Map<String, Object> current = restTemplate.getForObject(url("/text"), Map.class);
        assertEquals(edited.get("text"), current.get("text"));

        Map<String, Object> undone = post("/undo", body());
        assertEquals("applied", undone.get("status"));
        assertEquals(COLUMN, restTemplate.getForObject(url("/text"), Map.class).get("text"));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testRejectedEditKeepsText() {
        post("/buffer", body("text", COLUMN));
        Map<String, Object> rejected = post("/edit", body("targetLine", 4, "code", "Text('x')", "position", "AFTER"));
        assertEquals("rejected", rejected.get("status"));
        assertEquals("TARGET_NOT_FOUND", rejected.get("reason"));
        assertEquals(COLUMN, rejected.get("text"));

        Map<String, Object> noSlot = post("/edit", body("targetLine", 3, "code", "Text('x')", "position", "AS_CHILD"));
        assertEquals("NO_CHILD_SLOT", noSlot.get("reason"));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testTreeJsonShape() {
        post("/buffer", body("text", "Center(child: Text('Hi'))"));
        Map<String, Object> tree = restTemplate.getForObject(url("/tree"), Map.class);
        List<Map<String, Object>> children = (List<Map<String, Object>>) tree.get("children");
        Map<String, Object> center = children.get(0);
        assertEquals("Center", center.get("name"));
        assertEquals("LAYOUT", center.get("kind"));
        assertEquals(1, center.get("startLine"));
        assertEquals("<Text>", ((Map<String, Object>) center.get("properties")).get("child"));
        assertNull(center.get("startOffset"));
    }

    @Test
    public void testTrackSelectAndResolve() {
        post("/buffer", body("text", COLUMN));
        Map<String, Object> selected = post("/select", body("line", 3));
        assertEquals("selected", selected.get("status"));
        Number trackingId = (Number) selected.get("trackingId");

        post("/edit", body("targetLine", 3, "code", "Text('Z')", "position", "before"));
        Map<?, ?> resolved = restTemplate.getForObject(url("/track/" + trackingId.longValue()), Map.class);
        assertEquals(4, resolved.get("line"));

        Map<String, Object> tracked = post("/track", body("line", 2));
        assertEquals(2, tracked.get("line"));

        ResponseEntity<Map> missing = restTemplate.getForEntity(url("/track/987654"), Map.class);
        assertEquals(HttpStatus.NOT_FOUND, missing.getStatusCode());
        assertEquals("TRACK_NOT_FOUND", missing.getBody().get("errorCode"));
    }

    @Test
    public void testInvalidRequestsAreBadRequests() {
        ResponseEntity<Map> badLine = restTemplate.postForEntity(url("/delete"), body("targetLine", 0), Map.class);
        assertEquals(HttpStatus.BAD_REQUEST, badLine.getStatusCode());
        assertEquals("INVALID_LINE", badLine.getBody().get("errorCode"));

        ResponseEntity<Map> badPosition = restTemplate.postForEntity(url("/edit"),
                body("targetLine", 1, "code", "Text('x')", "position", "sideways"), Map.class);
        assertEquals(HttpStatus.BAD_REQUEST, badPosition.getStatusCode());
        assertEquals("INVALID_POSITION", badPosition.getBody().get("errorCode"));

        ResponseEntity<Map> noText = restTemplate.postForEntity(url("/buffer"), body(), Map.class);
        assertEquals(HttpStatus.BAD_REQUEST, noText.getStatusCode());
        assertEquals("MISSING_TEXT", noText.getBody().get("errorCode"));
    }

    @Test
    public void testStateAndHealth() {
        post("/buffer", body("text", COLUMN));
        Map<?, ?> state = restTemplate.getForObject(url("/state"), Map.class);
        assertEquals("PARSED", state.get("state"));

        ResponseEntity<String> health = restTemplate.getForEntity("http://localhost:" + port + "/actuator/health", String.class);
        assertEquals(HttpStatus.OK, health.getStatusCode());
        assertTrue(health.getBody().contains("\"sync\""), health.getBody());
        assertTrue(health.getBody().contains("\"state\":\"PARSED\""), health.getBody());
    }

    @Test
    public void testPrometheusEndpoint() {
        post("/buffer", body("text", COLUMN));
        post("/delete", body("targetLine", 3));
        ResponseEntity<String> resp = restTemplate.getForEntity("http://localhost:" + port + "/actuator/prometheus", String.class);
        assertEquals(HttpStatus.OK, resp.getStatusCode());
        assertTrue(resp.getBody().contains("codesync_edits_total"));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testReorder() {
        post("/buffer", body("text", "Column(\n  children: [\n    Text('A'),\n    Text('B'),\n  ],\n)\n"));
        Map<String, Object> swapped = post("/reorder", body("firstLine", 3, "secondLine", 4));
        assertEquals("applied", swapped.get("status"));
        assertTrue(((String) swapped.get("text")).contains("    Text('B'),\n    Text('A'),"));

        Map<String, Object> rejected = post("/reorder", body("firstLine", 1, "secondLine", 3));
        assertEquals("NOT_SIBLINGS", rejected.get("reason"));

        ResponseEntity<Map> badLine = restTemplate.postForEntity(url("/reorder"), body("firstLine", 3), Map.class);
        assertEquals(HttpStatus.BAD_REQUEST, badLine.getStatusCode());
        assertEquals("INVALID_LINE", badLine.getBody().get("errorCode"));
    }

    @Test
    public void testWrapPropertyWithoutValueIsBadRequest() {
        post("/buffer", body("text", "Text('a')"));
        Map<String, Object> properties = new HashMap<>();
        properties.put("padding", null);
        ResponseEntity<Map> resp = restTemplate.postForEntity(url("/wrap"),
                body("targetLine", 1, "wrapper", "Padding", "properties", properties), Map.class);
        assertEquals(HttpStatus.BAD_REQUEST, resp.getStatusCode());
        assertEquals("MISSING_VALUE", resp.getBody().get("errorCode"));
        assertEquals("Text('a')", restTemplate.getForObject(url("/text"), Map.class).get("text"));
    }
}
