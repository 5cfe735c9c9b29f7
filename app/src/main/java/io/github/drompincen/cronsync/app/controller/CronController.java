package io.github.drompincen.cronsync.app.controller;

import io.github.drompincen.cronsync.protocol.api.CronRunLogEntry;
import io.github.drompincen.cronsync.runtime.editor.JobEditorFields;
import io.github.drompincen.cronsync.runtime.sync.CronSyncEngine;
import io.github.drompincen.cronsync.runtime.sync.CronSyncSnapshot;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api/cron")
public class CronController {

    private final CronSyncEngine engine;

    public CronController(CronSyncEngine engine) {
        this.engine = engine;
    }

    @GetMapping
    public CronSyncSnapshot snapshot() {
        return engine.snapshot();
    }

    @PostMapping("/refresh")
    public CompletableFuture<CronSyncSnapshot> refresh() {
        return engine.refreshJobs().thenApply(v -> engine.snapshot());
    }

    @PutMapping("/selection")
    public CompletableFuture<CronSyncSnapshot> select(@RequestBody SelectionRequest req) {
        return engine.selectJob(req.jobId()).thenApply(v -> engine.snapshot());
    }

    // --- Jobs ---

    @PostMapping("/jobs")
    public CompletableFuture<ResponseEntity<CronSyncSnapshot>> createJob(@RequestBody JobEditorFields fields) {
        return engine.saveJob(null, fields)
                .thenApply(v -> ResponseEntity.status(HttpStatus.CREATED).body(engine.snapshot()));
    }

    @PutMapping("/jobs/{id}")
    public CompletableFuture<CronSyncSnapshot> updateJob(@PathVariable String id,
                                                         @RequestBody JobEditorFields fields) {
        return engine.saveJob(id, fields).thenApply(v -> engine.snapshot());
    }

    @GetMapping("/jobs/{id}/editor")
    public ResponseEntity<JobEditorFields> editor(@PathVariable String id) {
        return engine.snapshot().findJob(id)
                .map(JobEditorFields::fromJob)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/jobs/{id}")
    public CompletableFuture<ResponseEntity<Void>> removeJob(@PathVariable String id) {
        return engine.removeJob(id).thenApply(v -> ResponseEntity.noContent().<Void>build());
    }

    @PutMapping("/jobs/{id}/enabled")
    public CompletableFuture<CronSyncSnapshot> setEnabled(@PathVariable String id,
                                                          @RequestBody EnabledRequest req) {
        return engine.setEnabled(id, req.enabled()).thenApply(v -> engine.snapshot());
    }

    @PostMapping("/jobs/{id}/run")
    public CompletableFuture<ResponseEntity<Void>> runJob(@PathVariable String id,
                                                          @RequestParam(defaultValue = "false") boolean force) {
        return engine.runJob(id, force).thenApply(v -> ResponseEntity.accepted().<Void>build());
    }

    // --- Runs ---

    @GetMapping("/jobs/{id}/runs")
    public ResponseEntity<List<CronRunLogEntry>> runs(@PathVariable String id) {
        CronSyncSnapshot snapshot = engine.snapshot();
        if (!id.equals(snapshot.selectedJobId())) {
            // runs are only cached for the selected job
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(snapshot.runEntries());
    }
}
