package com.askbetter.core.validation;

import com.askbetter.core.error.ValidationException;
import com.askbetter.core.llm.CandidateFixtures;
import com.askbetter.core.model.CandidateRecord;
import com.askbetter.core.model.Flag;
import com.askbetter.core.model.QuestionReview;
import com.askbetter.core.model.Rewrites;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SchemaValidatorTest {

    private static final String QUESTION = "Fix this SQL?";
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final SchemaValidator validator = new SchemaValidator();

    private QuestionReview validate(ObjectNode node) {
        return validator.validate(new CandidateRecord(node, node.toString()), QUESTION);
    }

    private ValidationException reject(ObjectNode node) {
        return assertThrows(ValidationException.class, () -> validate(node));
    }

    @Test
    @DisplayName("accepts a well-formed candidate unchanged")
    void acceptsValidCandidate() {
        QuestionReview review = validate(CandidateFixtures.validSqlReview());

        assertEquals("software", review.classification().domain());
        assertEquals(3, review.missingInfo().size());
        assertTrue(review.flags().isEmpty());
    }

    @Test
    @DisplayName("original_question is always the caller's input")
    void replacesOriginalQuestion() {
        ObjectNode node = CandidateFixtures.validSqlReview();
        node.put("original_question", "Something else entirely");

        assertEquals(QUESTION, validate(node).originalQuestion());
    }

    @Nested
    @DisplayName("classification")
    class ClassificationField {

        @Test
        @DisplayName("missing object is a defect named classification")
        void missingClassification() {
            ObjectNode node = CandidateFixtures.validSqlReview();
            node.remove("classification");

            ValidationException e = reject(node);
            assertEquals(List.of("classification"), e.fields());
        }

        @Test
        @DisplayName("empty parts are reported separately")
        void emptyParts() {
            ObjectNode node = CandidateFixtures.validSqlReview();
            node.putObject("classification").put("domain", "").put("type", "  ");

            assertEquals(List.of("classification.domain", "classification.type"), reject(node).fields());
        }

        @Test
        @DisplayName("tags are trimmed and lower-cased")
        void normalizesTags() {
            ObjectNode node = CandidateFixtures.validSqlReview();
            node.putObject("classification").put("domain", " Software ").put("type", "DEBUGGING");

            assertEquals("debugging", validate(node).classification().type());
        }
    }

    @Nested
    @DisplayName("scores")
    class ScoreFields {

        @Test
        @DisplayName("out-of-range scores are clamped")
        void clampsScores() {
            ObjectNode node = CandidateFixtures.validSqlReview();
            node.putObject("scores").put("clarity", 14).put("specificity", -3)
                    .put("answerability", 7).put("safety", 10);

            QuestionReview review = validate(node);
            assertEquals(10, review.scores().clarity());
            assertEquals(0, review.scores().specificity());
        }

        @Test
        @DisplayName("fractional and numeric-text scores are rounded")
        void roundsScores() {
            assertEquals(8, SchemaValidator.score(NODES.numberNode(7.6)));
            assertEquals(4, SchemaValidator.score(NODES.textNode(" 4 ")));
            assertNull(SchemaValidator.score(NODES.textNode("high")));
            assertNull(SchemaValidator.score(NODES.booleanNode(true)));
        }

        @Test
        @DisplayName("every missing score is named")
        void missingScores() {
            ObjectNode node = CandidateFixtures.validSqlReview();
            node.putObject("scores").put("clarity", 5).put("safety", "n/a");

            assertEquals(List.of("scores.specificity", "scores.answerability", "scores.safety"),
                    reject(node).fields());
        }
    }

    @Nested
    @DisplayName("rewrites")
    class RewriteFields {

        @Test
        @DisplayName("over-long rewrites are cut at a word boundary")
        void truncatesAtWordBoundary() {
            String longText = "word ".repeat(100).trim();
            ObjectNode node = CandidateFixtures.validSqlReview();
            node.putObject("rewrites").put("minimal", "Fix it?").put("ideal", longText);

            String ideal = validate(node).rewrites().ideal();
            assertTrue(ideal.length() <= Rewrites.MAX_LENGTH);
            assertTrue(longText.startsWith(ideal));
            assertTrue(ideal.endsWith("word"));
        }

        @Test
        @DisplayName("a single word longer than the cap cannot be repaired")
        void unsplittableRewrite() {
            ObjectNode node = CandidateFixtures.validSqlReview();
            node.putObject("rewrites").put("minimal", "x".repeat(300)).put("ideal", "Fine.");

            assertEquals(List.of("rewrites.minimal"), reject(node).fields());
        }

        @Test
        @DisplayName("truncation keeps text that already fits")
        void truncateKeepsShortText() {
            assertEquals("short text", SchemaValidator.truncateAtWordBoundary("short text", 20));
            assertEquals("one two", SchemaValidator.truncateAtWordBoundary("one two three", 9));
            assertNull(SchemaValidator.truncateAtWordBoundary("abcdefghij klm", 5));
        }
    }

    @Nested
    @DisplayName("lists")
    class ListFields {

        @Test
        @DisplayName("duplicates are dropped case-insensitively and the cap is applied")
        void dedupesAndCaps() {
            ObjectNode node = CandidateFixtures.validSqlReview();
            node.putArray("followups").add("Which DB?").add("which db?").add("A").add("B")
                    .add("C").add("D").add("E");

            assertEquals(List.of("Which DB?", "A", "B", "C", "D"), validate(node).followups());
        }

        @Test
        @DisplayName("a single string becomes a one-element list and null becomes empty")
        void coercesShapes() {
            ObjectNode node = CandidateFixtures.validSqlReview();
            node.put("assumptions", "PostgreSQL");
            node.putNull("missing_info");

            QuestionReview review = validate(node);
            assertEquals(List.of("PostgreSQL"), review.assumptions());
            assertTrue(review.missingInfo().isEmpty());
        }

        @Test
        @DisplayName("entries blank under Unicode whitespace are dropped")
        void dropsUnicodeBlankEntries() {
            ObjectNode node = CandidateFixtures.validSqlReview();
            node.putArray("assumptions").add("\u3000").add("PostgreSQL").add("\u2003 postgresql \u3000");
            node.putArray("followups").add("\u2003");

            QuestionReview review = validate(node);
            assertEquals(List.of("PostgreSQL"), review.assumptions());
            assertTrue(review.followups().isEmpty());
        }

        @Test
        @DisplayName("nested objects inside a list are a defect")
        void rejectsObjectEntries() {
            ObjectNode node = CandidateFixtures.validSqlReview();
            node.putArray("followups").addObject().put("q", "?");

            assertEquals(List.of("followups"), reject(node).fields());
        }
    }

    @Test
    @DisplayName("flags are normalized to the known vocabulary")
    void normalizesFlags() {
        ObjectNode node = CandidateFixtures.validSqlReview();
        node.putArray("flags").add("EMAIL").add(" vague ").add("ssn").add("email");

        assertEquals(List.of("email", "vague"), validate(node).flags());
        assertEquals(Set.of(), validator.flags(NODES.textNode("email")));
        assertEquals(Set.of(Flag.PHONE), validator.flags(NODES.arrayNode().add("phone")));
    }

    @Test
    @DisplayName("a rejection by the review record becomes a validation defect")
    void recordRejectionIsDefect() {
        ObjectNode node = CandidateFixtures.validSqlReview();

        ValidationException e = assertThrows(ValidationException.class,
                () -> validator.validate(new CandidateRecord(node, node.toString()), ""));
        assertEquals(List.of("review"), e.fields());
        assertTrue(e.retryable());
    }

    @Test
    @DisplayName("collects every defect into one exception")
    void collectsAllDefects() {
        ObjectNode node = CandidateFixtures.validSqlReview();
        node.remove("classification");
        node.remove("scores");
        node.remove("rewrites");

        ValidationException e = reject(node);
        assertEquals(List.of("classification", "scores", "rewrites"), e.fields());
        assertTrue(e.getMessage().contains("classification: missing"));
    }
}
