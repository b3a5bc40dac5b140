package com.example.UniScout.service;

import com.example.UniScout.model.Answer;
import com.example.UniScout.model.BackendId;
import com.example.UniScout.model.BackendReport;
import com.example.UniScout.model.CitationRecord;
import com.example.UniScout.model.Sentinel;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Joins per-backend answers without re-synthesizing them. Each usable answer keeps
 * its own section header so citations stay attributable to the backend that produced them.
 */
@Component
public class ProvenanceComposer {

    /**
     * One backend's synthesized answer.
     */
    public record Section(BackendId backend, Answer answer) {
    }

    public Answer compose(List<Section> sections, List<BackendReport> reports) {
        List<Section> usable = sections.stream()
                .filter(s -> s.answer().isUsable())
                .toList();

        if (usable.isEmpty()) {
            return composeWithoutAnswer(sections);
        }

        List<CitationRecord> citations = new ArrayList<>();
        usable.forEach(s -> citations.addAll(s.answer().citations()));

        if (usable.size() == 1) {
            Section only = usable.get(0);
            return Answer.answered(only.answer().text() + "\n\n" + singleSourceFooter(only, reports), citations);
        }

        StringBuilder text = new StringBuilder();
        for (Section section : usable) {
            if (text.length() > 0) {
                text.append("\n\n");
            }
            text.append("## ").append(section.backend().sectionHeader()).append("\n\n")
                    .append(section.answer().text());
        }
        text.append("\n\n---\n\n*Results compiled from ").append(sourceCounts(usable)).append(".*");
        return Answer.answered(text.toString(), citations);
    }

    private Answer composeWithoutAnswer(List<Section> sections) {
        List<CitationRecord> notFoundCitations = new ArrayList<>();
        boolean anyNotFound = false;
        for (Section section : sections) {
            if (section.answer().sentinel() == Sentinel.NOT_FOUND) {
                anyNotFound = true;
                notFoundCitations.addAll(section.answer().citations());
            }
        }
        if (anyNotFound) {
            return Answer.notFound(notFoundCitations);
        }
        if (!sections.isEmpty() && sections.stream().allMatch(s -> s.answer().sentinel() == Sentinel.DENIED)) {
            return Answer.denied();
        }
        if (!sections.isEmpty() && sections.stream().allMatch(s -> s.answer().fallback())) {
            return Answer.generationFailed();
        }
        return Answer.nothingFound();
    }

    private String singleSourceFooter(Section only, List<BackendReport> reports) {
        StringBuilder footer = new StringBuilder("*Results from ")
                .append(only.backend().label())
                .append(" (").append(only.answer().citations().size()).append(" sources).");
        for (BackendReport report : reports) {
            if (report.backend() == only.backend()) {
                continue;
            }
            footer.append(' ').append(capitalize(report.backend().label())).append(" search ")
                    .append(report.isFailure() ? "was unavailable." : "found no relevant information.");
        }
        return footer.append('*').toString();
    }

    private static String sourceCounts(List<Section> usable) {
        List<String> parts = usable.stream()
                .map(s -> s.answer().citations().size() + " " + s.backend().label() + " sources")
                .toList();
        if (parts.size() == 1) {
            return parts.get(0);
        }
        return String.join(", ", parts.subList(0, parts.size() - 1)) + " and " + parts.get(parts.size() - 1);
    }

    private static String capitalize(String label) {
        return label.substring(0, 1).toUpperCase(Locale.ROOT) + label.substring(1);
    }
}
