package com.example.UniScout.controller;

import com.example.UniScout.model.OrchestrationRequest;
import com.example.UniScout.model.SearchPreview;
import com.example.UniScout.service.RetrievalOrchestrator;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

/**
 * Retrieval preview: the merged evidence a question would be answered from,
 * without classification or answer generation.
 */
@RestController
@RequestMapping("/api/qa")
@RequiredArgsConstructor
@Validated
public class SearchController {

    private final RetrievalOrchestrator orchestrator;

    /**
     * Simple mode: configured backends, domains and limits.
     *   GET /api/qa/search?q=xxx
     */
    @GetMapping("/search")
    public SearchPreview searchByQueryParam(@RequestParam("q") @NotBlank String query) {
        return orchestrator.preview(OrchestrationRequest.of(query));
    }

    /**
     * Advanced mode: caller picks backends, limits, depth and allowed domains.
     *   POST /api/qa/search
     *   {
     *     "query": "xxx",
     *     "enabledBackends": ["TAVILY"],
     *     "limits": {"TAVILY": 8},
     *     "depth": "basic"
     *   }
     */
    @PostMapping("/search")
    public SearchPreview searchByBody(@Valid @RequestBody OrchestrationRequest request) {
        return orchestrator.preview(request);
    }
}
