package com.example.UniScout.util;

/**
 * Fixed user-facing texts for every non-generated answer.
 */
public final class AnswerMessages {

    private AnswerMessages() {
    }

    public static final String DENIED =
            "I'm sorry, but I can only assist with questions related to VinUni-related topics. "
                    + "Please ask questions about admissions, scholarships, courses, faculty, research, "
                    + "campus life, or other university-related topics.";

    public static final String NOT_FOUND =
            "I couldn't find specific information to answer your question in the available VinUni documents. "
                    + "Please try rephrasing your question or ask about other VinUni-related topics.";

    public static final String NOTHING_FOUND =
            "I couldn't find relevant information in any of the available sources. "
                    + "Please try rephrasing your question or asking about other VinUni-related topics.";

    public static final String GENERATION_FAILED =
            "An unexpected error has occurred. Please refresh the page, delete this chat or try again later!";

    public static final String UNEXPECTED_ERROR =
            "An unexpected error occurred during the search. Please try again later.";

    public static final String CANCELLED =
            "The request was cancelled before an answer could be generated.";
}
