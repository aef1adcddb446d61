package com.askbetter.core.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Candidate documents as the generation step would return them.
 */
public final class CandidateFixtures {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private CandidateFixtures() {
    }

    /**
     * A candidate that passes validation as-is, shaped like a review of "Fix this SQL?".
     */
    public static ObjectNode validSqlReview() {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("original_question", "Fix this SQL?");
        root.putObject("classification")
                .put("domain", "software")
                .put("type", "debugging");
        root.putObject("scores")
                .put("clarity", 3)
                .put("specificity", 1)
                .put("answerability", 2)
                .put("safety", 10);
        root.putArray("missing_info")
                .add("The SQL query text")
                .add("Which database engine and version (e.g. PostgreSQL 15, MySQL 8)")
                .add("The error message or the unexpected result");
        root.putArray("assumptions")
                .add("The query is syntactically close to working");
        root.putArray("followups")
                .add("Can you paste the full query?")
                .add("Which database are you using?");
        root.putObject("rewrites")
                .put("minimal", "Fix this SQL query: <paste query>?")
                .put("ideal", "My PostgreSQL 15 query <paste query> fails with <error>. "
                        + "What is wrong and how do I fix it?");
        root.putArray("flags");
        return root;
    }

    public static String json(ObjectNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }

    public static String validSqlReviewJson() {
        return json(validSqlReview());
    }

    public static String withoutClassificationJson() {
        ObjectNode node = validSqlReview();
        node.remove("classification");
        return json(node);
    }
}
