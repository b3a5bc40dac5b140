package com.example.UniScout.controller;

import com.example.UniScout.model.CitationRecord;
import com.example.UniScout.model.Diagnostics;
import com.example.UniScout.model.OrchestrationOutcome;
import com.example.UniScout.model.OrchestrationRequest;
import com.example.UniScout.model.OrchestrationState;
import com.example.UniScout.model.ProgressEvent;
import com.example.UniScout.model.ProgressStep;
import com.example.UniScout.model.SearchDepth;
import com.example.UniScout.model.SearchPreview;
import com.example.UniScout.model.Sentinel;
import com.example.UniScout.service.RetrievalOrchestrator;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import reactor.core.publisher.Flux;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = {QaController.class, SearchController.class})
class QaControllerTest {

    private static final OrchestrationOutcome OUTCOME = new OrchestrationOutcome(
            "Need-based grants are available.",
            Sentinel.NONE,
            List.of(new CitationRecord("Aid", "https://policy.vinuni.edu.vn/aid", "Grants", 0.9)),
            Diagnostics.none(OrchestrationState.DONE));

    @Autowired
    private MockMvc mvc;

    @MockitoBean
    private RetrievalOrchestrator orchestrator;

    @Test
    void answerReturnsOutcome() throws Exception {
        when(orchestrator.orchestrate(any(OrchestrationRequest.class))).thenReturn(OUTCOME);

        mvc.perform(post("/api/qa/answer")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"What financial aid options exist?\",\"depth\":\"basic\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.answer").value("Need-based grants are available."))
                .andExpect(jsonPath("$.sentinel").value("NONE"))
                .andExpect(jsonPath("$.citations[0].url").value("https://policy.vinuni.edu.vn/aid"));

        ArgumentCaptor<OrchestrationRequest> captor = ArgumentCaptor.forClass(OrchestrationRequest.class);
        verify(orchestrator).orchestrate(captor.capture());
        assertThat(captor.getValue().depth()).isEqualTo(SearchDepth.BASIC);
    }

    @Test
    void blankQueryIsRejected() throws Exception {
        mvc.perform(post("/api/qa/answer")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value(org.hamcrest.Matchers.containsString("query")));

        verifyNoInteractions(orchestrator);
    }

    @Test
    void streamSendsEachStepAsNamedEvent() throws Exception {
        when(orchestrator.stream(any(OrchestrationRequest.class))).thenReturn(Flux.just(
                ProgressEvent.of(ProgressStep.VALIDATE_START, "Validating query relevance..."),
                new ProgressEvent(ProgressStep.DONE, "Finished.", OUTCOME)));

        MvcResult result = mvc.perform(post("/api/qa/answer/stream")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"What financial aid options exist?\"}"))
                .andExpect(request().asyncStarted())
                .andReturn();

        String body = result.getResponse().getContentAsString();
        assertThat(body)
                .contains("event:validate-start")
                .contains("event:done")
                .contains("\"step\":\"done\"")
                .contains("Need-based grants are available.");
    }

    @Test
    void searchPreviewByQueryParam() throws Exception {
        when(orchestrator.preview(any(OrchestrationRequest.class))).thenReturn(
                new SearchPreview("library hours", OUTCOME.citations(), Diagnostics.none(OrchestrationState.DONE)));

        mvc.perform(get("/api/qa/search").param("q", "library hours"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.query").value("library hours"))
                .andExpect(jsonPath("$.citations.length()").value(1));
    }

    @Test
    void blankSearchParamIsRejected() throws Exception {
        mvc.perform(get("/api/qa/search").param("q", " "))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(orchestrator);
    }
}
