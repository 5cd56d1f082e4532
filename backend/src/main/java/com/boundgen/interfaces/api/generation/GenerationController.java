package com.boundgen.interfaces.api.generation;

import com.boundgen.application.generation.DocumentGenerationAppService;
import com.boundgen.domain.clarification.model.MergedClarifications;
import com.boundgen.domain.generation.model.GenerationResult;
import com.boundgen.interfaces.api.dto.GenerateDocumentRequest;
import com.boundgen.interfaces.api.dto.GenerationResponse;
import com.boundgen.interfaces.api.dto.MergeClarificationsRequest;
import com.boundgen.interfaces.api.dto.MergeClarificationsResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class GenerationController {

    private final DocumentGenerationAppService generationAppService;

    @PostMapping("/generations")
    public ResponseEntity<GenerationResponse> generate(@Valid @RequestBody GenerateDocumentRequest request) {
        GenerationResult result = generationAppService.generate(
                request.toInputs(), request.answers(), request.toTask());
        return ResponseEntity.ok(GenerationResponse.from(generationAppService.getExecution(result.executionId())));
    }

    @GetMapping("/generations/{executionId}")
    public ResponseEntity<GenerationResponse> getExecution(@PathVariable String executionId) {
        return ResponseEntity.ok(GenerationResponse.from(generationAppService.getExecution(executionId)));
    }

    @PostMapping("/clarifications/merge")
    public ResponseEntity<MergeClarificationsResponse> merge(@Valid @RequestBody MergeClarificationsRequest request) {
        MergedClarifications merged = generationAppService.merge(request.toInputs(), request.answers());
        return ResponseEntity.ok(MergeClarificationsResponse.from(merged));
    }
}
