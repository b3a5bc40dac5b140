package com.example.UniScout.controller;

import com.example.UniScout.model.OrchestrationOutcome;
import com.example.UniScout.model.OrchestrationRequest;
import com.example.UniScout.model.ProgressEvent;
import com.example.UniScout.service.RetrievalOrchestrator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.io.IOException;

@RestController
@RequestMapping("/api/qa")
@RequiredArgsConstructor
public class QaController {

    private final RetrievalOrchestrator orchestrator;

    @PostMapping("/answer")
    public OrchestrationOutcome answer(@Valid @RequestBody OrchestrationRequest request) {
        return orchestrator.orchestrate(request);
    }

    @PostMapping(value = "/answer/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamAnswer(@Valid @RequestBody OrchestrationRequest request) {
        // 0L means no timeout; every external call inside the orchestrator is already bounded
        SseEmitter emitter = new SseEmitter(0L);

        // Steps: validate-start / validate-complete / search-* / filter-complete / synthesize-start / done
        Flux<ProgressEvent> stream = orchestrator.stream(request);

        Disposable subscription = stream.subscribe(
                event -> {
                    try {
                        // Step name as SSE event name so the frontend can handle each step separately
                        emitter.send(
                                SseEmitter.event()
                                        .name(event.step().wireName())
                                        .data(event)
                        );
                    } catch (IOException e) {
                        emitter.completeWithError(e);
                    }
                },
                emitter::completeWithError,
                emitter::complete
        );

        // Client went away: dispose, which abandons in-flight backend calls
        emitter.onCompletion(subscription::dispose);
        emitter.onTimeout(subscription::dispose);
        emitter.onError(t -> subscription.dispose());

        return emitter;
    }
}
