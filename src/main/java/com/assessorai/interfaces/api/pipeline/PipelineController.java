package com.assessorai.interfaces.api.pipeline;

import com.assessorai.application.pipeline.PipelineAppService;
import com.assessorai.domain.pipeline.model.RunReport;
import com.assessorai.interfaces.api.dto.DeadLetterResponse;
import com.assessorai.interfaces.api.dto.RunRequest;
import com.assessorai.interfaces.api.dto.RunResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/pipeline/runs")
@RequiredArgsConstructor
public class PipelineController {

    private final PipelineAppService pipelineAppService;

    @PostMapping
    public ResponseEntity<RunResponse> run(@Valid @RequestBody RunRequest request) {
        RunReport report = pipelineAppService.run(request.runId(), request.inputs(), request.profile());
        return ResponseEntity.ok(RunResponse.from(report));
    }

    @PostMapping("/{runId}/resume")
    public ResponseEntity<RunResponse> resume(@PathVariable String runId) {
        return ResponseEntity.ok(RunResponse.from(pipelineAppService.resume(runId)));
    }

    @PostMapping("/{runId}/abort")
    public ResponseEntity<Void> abort(@PathVariable String runId) {
        return pipelineAppService.abort(runId)
                ? ResponseEntity.status(HttpStatus.ACCEPTED).build()
                : ResponseEntity.notFound().build();
    }

    @DeleteMapping("/{runId}")
    public ResponseEntity<Void> discard(@PathVariable String runId) {
        pipelineAppService.discard(runId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{runId}/dead-letters")
    public ResponseEntity<List<DeadLetterResponse>> deadLetters(@PathVariable String runId) {
        return ResponseEntity.ok(pipelineAppService.inspectDeadLetters(runId).stream()
                .map(DeadLetterResponse::from)
                .toList());
    }
}
