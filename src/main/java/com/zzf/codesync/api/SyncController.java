package com.zzf.codesync.api;

import com.zzf.codesync.core.edit.InsertPosition;
import com.zzf.codesync.core.tree.UiTreeNode;
import com.zzf.codesync.model.CustomException;
import com.zzf.codesync.model.ErrorResponse;
import com.zzf.codesync.sync.EditOutcome;
import com.zzf.codesync.sync.NodeSelection;
import com.zzf.codesync.sync.SyncOrchestrator;
import com.zzf.codesync.sync.SyncSnapshot;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * JSON surface of the {@link SyncOrchestrator} for the canvas, tree and code panels.
 */
@RestController
@RequestMapping("/api/sync")
@RequiredArgsConstructor
public class SyncController {

    private final SyncOrchestrator orchestrator;

    @Data
    public static class BufferRequest {
        private String text;
    }

    @Data
    public static class EditRequest {
        private Integer targetLine;
        private String code;
        private String position;
    }

    @Data
    public static class LineRequest {
        private Integer targetLine;
        private Integer line;

        int lineOrTarget() {
            return line != null ? line : targetLine == null ? 0 : targetLine;
        }
    }

    @Data
    public static class WrapRequest {
        private Integer targetLine;
        private String wrapper;
        private Map<String, String> properties;
    }

    @Data
    public static class ReorderRequest {
        private Integer firstLine;
        private Integer secondLine;
    }

    @Data
    public static class PropertyRequest {
        private Integer targetLine;
        private String name;
        private String value;
    }

    @PostMapping("/buffer")
    public Map<String, Object> loadBuffer(@RequestBody BufferRequest request) {
        String text = requireText(request.getText());
        UiTreeNode tree = orchestrator.loadBuffer(text);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "loaded");
        response.put("version", orchestrator.snapshot().getBuffer().getVersion());
        response.put("tree", tree);
        return response;
    }

    @PostMapping("/edit")
    public EditOutcome edit(@RequestBody EditRequest request) {
        int line = requireLine(request.getTargetLine());
        InsertPosition position;
        try {
            position = InsertPosition.from(request.getPosition());
        } catch (IllegalArgumentException e) {
            throw new CustomException("INVALID_POSITION", e.getMessage());
        }
        if (position != InsertPosition.REPLACE && (request.getCode() == null || request.getCode().trim().isEmpty())) {
            throw new CustomException("MISSING_CODE", "code is required for position " + position);
        }
        return orchestrator.requestEdit(line, request.getCode(), position);
    }

    @PostMapping("/delete")
    public EditOutcome delete(@RequestBody LineRequest request) {
        return orchestrator.requestDelete(requireLine(request.lineOrTarget()));
    }

    @PostMapping("/wrap")
    public EditOutcome wrap(@RequestBody WrapRequest request) {
        int line = requireLine(request.getTargetLine());
        String wrapper = request.getWrapper();
        if (wrapper == null || wrapper.trim().isEmpty() || !Character.isUpperCase(wrapper.trim().charAt(0))) {
            throw new CustomException("INVALID_WRAPPER", "wrapper must be a node name, got: " + wrapper);
        }
        if (request.getProperties() != null) {
            for (Map.Entry<String, String> entry : request.getProperties().entrySet()) {
                if (entry.getValue() == null || entry.getValue().trim().isEmpty()) {
                    throw new CustomException("MISSING_VALUE", "wrapper property '" + entry.getKey() + "' has no value");
                }
            }
        }
        return orchestrator.requestWrap(line, wrapper, request.getProperties());
    }

    @PostMapping("/reorder")
    public EditOutcome reorder(@RequestBody ReorderRequest request) {
        return orchestrator.requestReorder(requireLine(request.getFirstLine()), requireLine(request.getSecondLine()));
    }

    @PostMapping("/property")
    public EditOutcome property(@RequestBody PropertyRequest request) {
        int line = requireLine(request.getTargetLine());
        if (request.getName() == null || request.getName().trim().isEmpty()) {
            throw new CustomException("MISSING_NAME", "property name is required");
        }
        if (request.getValue() == null || request.getValue().trim().isEmpty()) {
            throw new CustomException("MISSING_VALUE", "property value is required");
        }
        return orchestrator.requestPropertyUpdate(line, request.getName(), request.getValue());
    }

    @PostMapping("/text")
    public EditOutcome text(@RequestBody BufferRequest request) {
        return orchestrator.applyTextChange(requireText(request.getText()));
    }

    @PostMapping("/undo")
    public Map<String, Object> undo() {
        return historyResponse(orchestrator.undo());
    }

    @PostMapping("/redo")
    public Map<String, Object> redo() {
        return historyResponse(orchestrator.redo());
    }

    @PostMapping("/track")
    public Map<String, Object> track(@RequestBody LineRequest request) {
        int line = requireLine(request.lineOrTarget());
        long id = orchestrator.trackLine(line);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("id", id);
        response.put("line", line);
        return response;
    }

    @GetMapping("/track/{id}")
    public ResponseEntity<?> resolve(@PathVariable("id") long id) {
        Optional<Integer> line = orchestrator.resolveLine(id);
        if (!line.isPresent()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(new ErrorResponse("TRACK_NOT_FOUND", "no tracked line for id " + id));
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("id", id);
        response.put("line", line.get());
        return ResponseEntity.ok(response);
    }

    @PostMapping("/select")
    public Map<String, Object> select(@RequestBody LineRequest request) {
        Optional<NodeSelection> selection = orchestrator.selectLine(requireLine(request.lineOrTarget()));
        Map<String, Object> response = new LinkedHashMap<>();
        if (!selection.isPresent()) {
            response.put("status", "none");
            return response;
        }
        response.put("status", "selected");
        response.put("trackingId", selection.get().getTrackingId());
        response.put("line", selection.get().getLine());
        response.put("version", selection.get().getVersion());
        response.put("node", selection.get().getNode());
        return response;
    }

    @GetMapping("/tree")
    public UiTreeNode tree() {
        return orchestrator.currentTree();
    }

    @GetMapping("/text")
    public Map<String, Object> currentText() {
        SyncSnapshot snapshot = orchestrator.snapshot();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("version", snapshot.getBuffer().getVersion());
        response.put("text", snapshot.getBuffer().getText());
        return response;
    }

    @GetMapping("/state")
    public Map<String, Object> state() {
        SyncSnapshot snapshot = orchestrator.snapshot();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("state", snapshot.getState());
        response.put("version", snapshot.getBuffer().getVersion());
        response.put("history", orchestrator.historyState());
        response.put("trackedLines", orchestrator.getTracker().size());
        return response;
    }

    private Map<String, Object> historyResponse(Optional<UiTreeNode> tree) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", tree.isPresent() ? "applied" : "empty");
        response.put("version", orchestrator.snapshot().getBuffer().getVersion());
        response.put("tree", tree.orElse(null));
        return response;
    }

    private static String requireText(String text) {
        if (text == null) {
            throw new CustomException("MISSING_TEXT", "text is required");
        }
        return text;
    }

    private static int requireLine(Integer line) {
        if (line == null || line < 1) {
            throw new CustomException("INVALID_LINE", "line must be >= 1, got " + line);
        }
        return line;
    }
}
