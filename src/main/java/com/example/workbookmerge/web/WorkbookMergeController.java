package com.example.workbookmerge.web;

import com.example.workbookmerge.service.MergeReport;
import com.example.workbookmerge.service.WorkbookMergeException;
import com.example.workbookmerge.service.WorkbookMergeService;
import com.example.workbookmerge.service.yield.YieldReport;
import com.example.workbookmerge.service.yield.YieldService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.util.List;

@RestController
@RequestMapping("/api/workbook")
@RequiredArgsConstructor
public class WorkbookMergeController {

    private final WorkbookMergeService workbookMergeService;
    private final YieldService yieldService;

    @GetMapping("/sheets")
    public List<String> listSheets(@RequestParam("path") String path) {
        return workbookMergeService.listSheets(requirePath(path, "path"));
    }

    @PostMapping("/merge")
    public MergeReport merge(@RequestBody MergeRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Merge request body is required.");
        }
        return workbookMergeService.mergeFiles(
                requirePath(request.basePath(), "basePath"),
                requirePath(request.incomingPath(), "incomingPath"),
                optionalPath(request.targetPath()),
                request.save());
    }

    @PostMapping("/yield")
    public YieldReport addYieldColumns(@RequestBody YieldRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Yield request body is required.");
        }
        return yieldService.addYieldColumns(
                requirePath(request.inputPath(), "inputPath"),
                optionalPath(request.outputPath()));
    }

    @ExceptionHandler(WorkbookMergeException.class)
    public ResponseEntity<ErrorResponse> handleMergeFailure(WorkbookMergeException e) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ErrorResponse(e.stage().name(), e.kind().name(), e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse(null, null, e.getMessage()));
    }

    private static Path requirePath(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be empty.");
        }
        return Path.of(value.trim());
    }

    private static Path optionalPath(String value) {
        return value == null || value.isBlank() ? null : Path.of(value.trim());
    }
}
