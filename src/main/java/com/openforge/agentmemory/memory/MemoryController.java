package com.openforge.agentmemory.memory;

import com.openforge.agentmemory.capture.CaptureService;
import com.openforge.agentmemory.capture.CaptureService.CaptureResult;
import com.openforge.agentmemory.memory.MemoryIndexingService.FileIndexResult;
import com.openforge.agentmemory.memory.MemoryIndexingService.IndexResult;
import com.openforge.agentmemory.memory.MemoryRetrievalService.RecallQuery;
import com.openforge.agentmemory.memory.MemoryRetrievalService.RecallResult;
import com.openforge.agentmemory.memory.MemoryStatsService.MemoryStats;
import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

/**
 * REST API of the memory service.
 *
 * ┌──────────────────────────────────────────────────────────────────────┐
 * │  Endpoint                         Description                        │
 * ├──────────────────────────────────────────────────────────────────────┤
 * │  POST /api/memory/query           semantic search with filters       │
 * │  POST /api/memory/index           chunk + embed + upsert free text   │
 * │  POST /api/memory/capture         classify and store one utterance   │
 * │  POST /api/memory/index-file      ingest a file from owner's bucket  │
 * │  GET  /api/memory/stats           index introspection                │
 * │  GET  /api/memory/health          liveness                           │
 * └──────────────────────────────────────────────────────────────────────┘
 */
@RestController
@RequestMapping("/api/memory")
@RequiredArgsConstructor
public class MemoryController {

    static final String SERVICE_NAME = "agent-memory";

    private final MemoryRetrievalService retrievalService;
    private final MemoryIndexingService  indexingService;
    private final CaptureService         captureService;
    private final MemoryStatsService     statsService;

    // ── Query ────────────────────────────────────────────────────────────────

    /**
     * Out-of-range topK / minScore are clamped by the pipeline, not rejected.
     */
    @PostMapping("/query")
    public ResponseEntity<RecallResult> query(@Valid @RequestBody QueryRequest req) {
        RecallResult result = retrievalService.query(new RecallQuery(
                req.query(),
                req.owner(),
                MemoryCategory.fromWireName(req.category()),
                req.topK(),
                req.minScore()));
        return ResponseEntity.ok(result);
    }

    // ── Index ────────────────────────────────────────────────────────────────

    @PostMapping("/index")
    public ResponseEntity<IndexResponse> index(@Valid @RequestBody IndexRequest req) {
        IndexResult result = indexingService.index(
                req.owner(), req.text(), MemoryCategory.fromWireName(req.category()), req.source(), req.chunkIndex());
        return ResponseEntity.ok(new IndexResponse(result.count(), result.ids()));
    }

    @PostMapping("/index-file")
    public ResponseEntity<FileIndexResult> indexFile(@Valid @RequestBody IndexFileRequest req) {
        return ResponseEntity.ok(indexingService.indexFile(req.owner(), req.file()));
    }

    // ── Capture ──────────────────────────────────────────────────────────────

    /** Always 200 for a well-formed request; a rejected capture carries its reason. */
    @PostMapping("/capture")
    public ResponseEntity<CaptureResult> capture(@Valid @RequestBody CaptureRequest req) {
        return ResponseEntity.ok(captureService.capture(req.owner(), req.content(), req.classification()));
    }

    // ── Introspection ────────────────────────────────────────────────────────

    @GetMapping("/stats")
    public ResponseEntity<MemoryStats> stats() {
        return ResponseEntity.ok(statsService.stats());
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(new HealthResponse("ok", SERVICE_NAME, Instant.now()));
    }

    // ── Inner DTOs ────────────────────────────────────────────────────────────

    public record QueryRequest(
            @NotBlank String query,
            String  owner,
            String  category,
            Integer topK,
            Double  minScore
    ) {}

    public record IndexRequest(
            @NotBlank String owner,
            @NotBlank String text,
            String category,
            String source,
            @JsonAlias("chunk_index") Integer chunkIndex
    ) {}

    public record IndexResponse(int indexed, List<String> ids) {}

    public record CaptureRequest(
            @NotBlank String owner,
            @NotBlank String content,
            String classification
    ) {}

    public record IndexFileRequest(
            @NotBlank String owner,
            @NotBlank String file
    ) {}

    public record HealthResponse(String status, String service, Instant timestamp) {}
}
