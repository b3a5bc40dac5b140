package com.example.UniScout.service;

import com.example.UniScout.llm.LanguageModelException;
import com.example.UniScout.llm.LanguageModelGateway;
import com.example.UniScout.model.Answer;
import com.example.UniScout.model.BackendId;
import com.example.UniScout.model.EvidenceBundle;
import com.example.UniScout.model.QueryHints;
import com.example.UniScout.model.Sentinel;
import com.example.UniScout.util.AnswerMessages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static com.example.UniScout.TestFixtures.result;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EvidenceSynthesizerTest {

    private LanguageModelGateway languageModel;
    private EvidenceSynthesizer synthesizer;
    private final CitationFormatter citationFormatter = new CitationFormatter();

    private final EvidenceBundle evidence = new EvidenceBundle(List.of(
            result("https://policy.vinuni.edu.vn/aid", 0.9, BackendId.TAVILY),
            result("https://vinuni.edu.vn/scholarships", 0.7, BackendId.TAVILY)));

    @BeforeEach
    void setUp() {
        languageModel = mock(LanguageModelGateway.class);
        synthesizer = new EvidenceSynthesizer(languageModel, citationFormatter);
    }

    @Test
    void normalOutputBecomesGroundedAnswerWithCitations() {
        when(languageModel.generate(anyString())).thenReturn("  Need-based grants are available.  ");

        Answer answer = synthesizer.synthesize("What financial aid options exist?", evidence);

        assertThat(answer.sentinel()).isEqualTo(Sentinel.NONE);
        assertThat(answer.text()).isEqualTo("Need-based grants are available.");
        assertThat(answer.citations()).isEqualTo(citationFormatter.project(evidence));
        assertThat(answer.isUsable()).isTrue();
    }

    @Test
    void notFoundTokenStillSurfacesEvidence() {
        when(languageModel.generate(anyString())).thenReturn("NOT_FOUND");

        Answer answer = synthesizer.synthesize("What is the parking fee?", evidence);

        assertThat(answer.sentinel()).isEqualTo(Sentinel.NOT_FOUND);
        assertThat(answer.text()).isEqualTo(AnswerMessages.NOT_FOUND);
        assertThat(answer.citations()).isEqualTo(citationFormatter.project(evidence));
    }

    @Test
    void deniedTokenDropsCitations() {
        when(languageModel.generate(anyString())).thenReturn("DENIED\n");

        Answer answer = synthesizer.synthesize("Best pizza in Hanoi?", evidence);

        assertThat(answer.sentinel()).isEqualTo(Sentinel.DENIED);
        assertThat(answer.citations()).isEmpty();
    }

    @Test
    void sentinelTokenInsideLongerAnswerIsOrdinaryText() {
        // exact-match parsing: a truthful answer that mentions the token is not a sentinel
        when(languageModel.generate(anyString())).thenReturn("Appeals marked DENIED can be resubmitted once.");

        Answer answer = synthesizer.synthesize("Can I resubmit a denied appeal?", evidence);

        assertThat(answer.sentinel()).isEqualTo(Sentinel.NONE);
        assertThat(answer.text()).contains("DENIED");
    }

    @Test
    void generationFailureYieldsApologyWithoutCitations() {
        when(languageModel.generate(anyString())).thenThrow(new LanguageModelException("503"));

        Answer answer = synthesizer.synthesize("What financial aid options exist?", evidence);

        assertThat(answer.sentinel()).isEqualTo(Sentinel.NONE);
        assertThat(answer.text()).isEqualTo(AnswerMessages.GENERATION_FAILED);
        assertThat(answer.citations()).isEmpty();
        assertThat(answer.fallback()).isTrue();
    }

    @Test
    void blankOutputIsTreatedAsFailure() {
        when(languageModel.generate(anyString())).thenReturn("   ");

        assertThat(synthesizer.synthesize("q", evidence).fallback()).isTrue();
    }

    @Test
    void promptNumbersDocumentsAndIncludesHints() {
        when(languageModel.generate(anyString())).thenReturn("ok");

        synthesizer.synthesize("What financial aid options exist?", evidence,
                new QueryHints("21.0", "105.8", "Hanoi", "VN"));

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(languageModel).generate(prompt.capture());
        assertThat(prompt.getValue())
                .contains("Document 1:\nTitle: Title of https://policy.vinuni.edu.vn/aid")
                .contains("Document 2:")
                .contains("URL: https://vinuni.edu.vn/scholarships")
                .contains("respond with exactly: DENIED")
                .contains("respond with exactly: NOT_FOUND")
                .contains("- city: Hanoi")
                .contains("USER QUESTION: What financial aid options exist?");
    }
}
