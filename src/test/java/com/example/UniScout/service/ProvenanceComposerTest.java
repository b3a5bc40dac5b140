package com.example.UniScout.service;

import com.example.UniScout.model.Answer;
import com.example.UniScout.model.BackendId;
import com.example.UniScout.model.BackendReport;
import com.example.UniScout.model.BackendStatus;
import com.example.UniScout.model.CitationRecord;
import com.example.UniScout.model.Sentinel;
import com.example.UniScout.util.AnswerMessages;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProvenanceComposerTest {

    private final ProvenanceComposer composer = new ProvenanceComposer();

    private static final CitationRecord KB_CITE = new CitationRecord("Handbook", "kb://handbook/1", "...", 0.8);
    private static final CitationRecord WEB_CITE = new CitationRecord("Aid", "https://policy.vinuni.edu.vn/aid", "...", 0.9);

    private static BackendReport ok(BackendId id) {
        return new BackendReport(id, BackendStatus.OK, 1, 1, 0, 0, null);
    }

    @Test
    void twoUsableAnswersAreJoinedUnderSeparateHeaders() {
        List<ProvenanceComposer.Section> sections = List.of(
                new ProvenanceComposer.Section(BackendId.KNOWLEDGE_BASE, Answer.answered("From the handbook.", List.of(KB_CITE))),
                new ProvenanceComposer.Section(BackendId.TAVILY, Answer.answered("From the policy site.", List.of(WEB_CITE))));

        Answer answer = composer.compose(sections, List.of(ok(BackendId.KNOWLEDGE_BASE), ok(BackendId.TAVILY)));

        assertThat(answer.sentinel()).isEqualTo(Sentinel.NONE);
        assertThat(answer.text())
                .startsWith("## Knowledge Base Results\n\nFrom the handbook.")
                .contains("\n\n## Policy Documents\n\nFrom the policy site.")
                .endsWith("*Results compiled from 1 knowledge base sources and 1 policy documents sources.*");
        assertThat(answer.citations()).containsExactly(KB_CITE, WEB_CITE);
    }

    @Test
    void singleUsableAnswerGetsFooterNamingTheOtherSources() {
        List<ProvenanceComposer.Section> sections = List.of(
                new ProvenanceComposer.Section(BackendId.TAVILY, Answer.answered("From the policy site.", List.of(WEB_CITE))));
        List<BackendReport> reports = List.of(
                BackendReport.error(BackendId.KNOWLEDGE_BASE, "down"),
                ok(BackendId.TAVILY),
                new BackendReport(BackendId.SERPER, BackendStatus.EMPTY, 0, 0, 0, 0, null));

        Answer answer = composer.compose(sections, reports);

        assertThat(answer.text())
                .startsWith("From the policy site.")
                .doesNotContain("## ")
                .contains("*Results from policy documents (1 sources).")
                .contains("Knowledge base search was unavailable.")
                .contains("Web search search found no relevant information.");
        assertThat(answer.citations()).containsExactly(WEB_CITE);
    }

    @Test
    void unusableAnswersAreDroppedFromComposition() {
        List<ProvenanceComposer.Section> sections = List.of(
                new ProvenanceComposer.Section(BackendId.KNOWLEDGE_BASE, Answer.generationFailed()),
                new ProvenanceComposer.Section(BackendId.TAVILY, Answer.answered("Policy answer.", List.of(WEB_CITE))));

        Answer answer = composer.compose(sections, List.of(ok(BackendId.KNOWLEDGE_BASE), ok(BackendId.TAVILY)));

        assertThat(answer.text()).startsWith("Policy answer.").doesNotContain(AnswerMessages.GENERATION_FAILED);
    }

    @Test
    void notFoundWinsWhenNothingIsUsable() {
        List<ProvenanceComposer.Section> sections = List.of(
                new ProvenanceComposer.Section(BackendId.KNOWLEDGE_BASE, Answer.denied()),
                new ProvenanceComposer.Section(BackendId.TAVILY, Answer.notFound(List.of(WEB_CITE))));

        Answer answer = composer.compose(sections, List.of());

        assertThat(answer.sentinel()).isEqualTo(Sentinel.NOT_FOUND);
        assertThat(answer.citations()).containsExactly(WEB_CITE);
    }

    @Test
    void allDeniedIsDenied() {
        List<ProvenanceComposer.Section> sections = List.of(
                new ProvenanceComposer.Section(BackendId.KNOWLEDGE_BASE, Answer.denied()),
                new ProvenanceComposer.Section(BackendId.TAVILY, Answer.denied()));

        assertThat(composer.compose(sections, List.of()).sentinel()).isEqualTo(Sentinel.DENIED);
    }

    @Test
    void allFailedIsApology() {
        List<ProvenanceComposer.Section> sections = List.of(
                new ProvenanceComposer.Section(BackendId.TAVILY, Answer.generationFailed()));

        assertThat(composer.compose(sections, List.of()).text()).isEqualTo(AnswerMessages.GENERATION_FAILED);
    }

    @Test
    void noSectionsIsNothingFound() {
        assertThat(composer.compose(List.of(), List.of()).text()).isEqualTo(AnswerMessages.NOTHING_FOUND);
    }
}
