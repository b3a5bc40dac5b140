package com.example.UniScout.util;

import com.example.UniScout.model.EvidenceBundle;
import com.example.UniScout.model.QueryHints;
import com.example.UniScout.model.SearchResult;

import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Prompt text for the classifier, keyword extractor and synthesizer.
 * The topic list is shared by the classifier and the synthesizer.
 */
public final class PromptTemplates {

    private PromptTemplates() {
    }

    public static final String DENIED_TOKEN = "DENIED";
    public static final String NOT_FOUND_TOKEN = "NOT_FOUND";
    public static final String VALID_TOKEN = "VALID";

    public static final String TOPICS = "admissions, scholarships, awards, application procedures, "
            + "required documents, courses, curriculum design, faculty, staff, research, research funding, "
            + "majors, minors, double majors, interdisciplinary programs, students, enrollment statistics, "
            + "campus life, student engagement, tuition fees, payment plans, financial aid, grants, fellowships, "
            + "assistantships, exchange programs, study abroad opportunities, internships, job placement, "
            + "career services, alumni relations, student organizations, clubs, housing, dormitories, "
            + "mental health counseling, wellness programs, disability and accessibility services, "
            + "academic accommodations, international student support, immigration advising, "
            + "orientation programs, mentorship programs, tutoring services, academic advising, "
            + "course registration, transfer credits, online learning, IT support, library resources, "
            + "laboratories, research centers, innovation hubs, startup support, intellectual property services, "
            + "university rankings, accreditations, institutional partnerships, university governance, "
            + "administration, student government, code of conduct, campus safety, emergency procedures, "
            + "sustainability initiatives, campus events, sports and athletics, graduate and postgraduate programs, "
            + "thesis and dissertation support, honors programs, continuing education, certificate programs, "
            + "community outreach, diversity and inclusion programs, university history, traditions, "
            + "bookstores, lost and found, and campus maps";

    private static final String TOPIC_SCOPE = """
            These are the topics that are related to VinUni that you are allowed to answer.
            - University-related topics include: %s, etc.
            - Questions asking about specific individuals (e.g., faculty, staff, researchers, or students) \
            in relation to their roles or involvement at VinUni ARE allowed.
            """.formatted(TOPICS);

    private static final String GROUNDING_INSTRUCTION = """
            You are an AI assistant restricted to answering questions under all these conditions.

            **RESPONSE CONDITIONS**
            1. You MUST ONLY answer if the question is related to VinUni or university-related topics.
               - University-related topics include: %s, etc.
               - Questions asking about specific individuals in relation to their roles at VinUni ARE allowed.
            2. If the question is NOT related to VinUni or university topics, respond with exactly: %s
            3. If the documents do not contain the answer, respond with exactly: %s

            **ANSWER SOURCE CONDITIONS**
            - You must ONLY use the content provided in the documents below.
            - You may NEVER answer using your own general knowledge.
            - You may NEVER infer or guess the answer if it is not explicitly in the documents.
            """.formatted(TOPICS, DENIED_TOKEN, NOT_FOUND_TOKEN);

    private static final String KEYWORD_INSTRUCTION = """
            You are a keyword extraction assistant. Extract the most important keywords from the user's query \
            that would be useful for searching academic/university policy documents. Return ONLY a JSON array \
            of keywords, maximum 5 keywords. Do not include common words like "what", "how", "where", "the", \
            "a", "an". Focus on nouns, proper nouns, and important terms.

            Example:
            User: "What are the requirements for the robotics minor?"
            Response: ["robotics", "minor", "requirements"]

            User: %s
            Response:""";

    public static String classification(String query) {
        return TOPIC_SCOPE
                + "\nUSER QUESTION: " + query + "\n\n"
                + "Respond with only \"" + VALID_TOKEN + "\" if the question is related to VinUni or university "
                + "topics as defined in the instructions, or \"" + DENIED_TOKEN + "\" if it's not related.";
    }

    public static String keywordExtraction(String query) {
        return KEYWORD_INSTRUCTION.formatted("\"" + query + "\"");
    }

    public static String synthesis(String query, EvidenceBundle evidence, QueryHints hints) {
        StringBuilder sb = new StringBuilder();
        sb.append("Based on the following documents from VinUni sources, answer the user's question.\n");
        sb.append(GROUNDING_INSTRUCTION).append('\n');
        sb.append("DOCUMENTS:\n").append(renderDocuments(evidence)).append("\n\n");
        if (hints != null && !hints.isEmpty()) {
            sb.append(renderHints(hints)).append('\n');
        }
        sb.append("USER QUESTION: ").append(query).append("\n\n");
        sb.append("Please provide a comprehensive answer based solely on the information in the documents above.");
        return sb.toString();
    }

    static String renderDocuments(EvidenceBundle evidence) {
        return IntStream.range(0, evidence.size())
                .mapToObj(i -> renderDocument(i + 1, evidence.items().get(i)))
                .collect(Collectors.joining("\n\n"));
    }

    private static String renderDocument(int index, SearchResult result) {
        return "Document " + index + ":\n"
                + "Title: " + result.title() + "\n"
                + "URL: " + result.url() + "\n"
                + "Content: " + result.content() + "\n"
                + "---";
    }

    private static String renderHints(QueryHints hints) {
        return "About the origin of user's request:\n"
                + "- lat: " + hints.latitude() + "\n"
                + "- lon: " + hints.longitude() + "\n"
                + "- city: " + hints.city() + "\n"
                + "- country: " + hints.country() + "\n";
    }
}
