package com.askbetter.dispatch.cli;

import com.askbetter.core.engine.ReviewOrchestrator;
import com.askbetter.core.error.ErrorKind;
import com.askbetter.core.error.ReviewError;
import com.askbetter.core.error.ReviewException;
import com.askbetter.core.llm.LlmProperties;
import com.askbetter.core.model.GenerationSettings;
import com.askbetter.core.model.QuestionReview;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: askbetter [options] [question...]
 * <p>
 * Reviews one question and prints the {@link QuestionReview} as JSON on standard
 * output. With no words on the command line the question is read from the console.
 * Failures are printed to the error stream as {@code {"error":{"kind":..,"description":..}}}.
 */
@Command(
        name = "askbetter",
        mixinStandardHelpOptions = true,
        version = "AskBetter 0.1.0",
        description = "Reviews a question and suggests how to ask it better",
        exitCodeListHeading = "%nExit codes:%n",
        exitCodeList = {
                "0:Review printed",
                "1:Review failed",
                "2:Usage error or no question",
                "3:Configuration error"
        }
)
@Component
public class AskBetterCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AskBetterCommand.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final int EXIT_OK = 0;
    public static final int EXIT_REVIEW_FAILED = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_CONFIGURATION = 3;

    static final String PROMPT = "Enter your question: ";
    static final String NO_QUESTION = "No question provided.";

    @Spec
    private CommandSpec spec;

    @Parameters(arity = "0..*", paramLabel = "QUESTION", description = "The question to review")
    private List<String> words = new ArrayList<>();

    @Option(names = "--model", description = "Model to use instead of the configured one")
    private String model;

    @Option(names = "--temperature", description = "Sampling temperature, 0 to 2")
    private Double temperature;

    @Option(names = "--seed", description = "Seed for repeatable generation")
    private Integer seed;

    @Option(names = "--compact", description = "Print the review on a single line")
    private boolean compact;

    private final ReviewOrchestrator orchestrator;
    private final LlmProperties llmProperties;
    private final InputStream in;

    @Autowired
    public AskBetterCommand(ReviewOrchestrator orchestrator, LlmProperties llmProperties) {
        this(orchestrator, llmProperties, System.in);
    }

    AskBetterCommand(ReviewOrchestrator orchestrator, LlmProperties llmProperties, InputStream in) {
        this.orchestrator = orchestrator;
        this.llmProperties = llmProperties;
        this.in = in;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        String question = String.join(" ", words).trim();
        if (question.isEmpty()) {
            ConsoleOutput.prompt(err, PROMPT);
            question = readLine().trim();
        }
        if (question.isEmpty()) {
            err.println(NO_QUESTION);
            err.flush();
            return EXIT_USAGE;
        }

        GenerationSettings settings;
        try {
            settings = llmProperties.defaultSettings()
                    .withModel(model)
                    .withTemperature(temperature)
                    .withSeed(seed);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.warn(err, e.getMessage());
            return EXIT_USAGE;
        }

        try {
            QuestionReview review = orchestrator.review(question, settings);
            out.println(compact
                    ? MAPPER.writeValueAsString(review)
                    : MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(review));
            out.flush();
            return EXIT_OK;
        } catch (ReviewException e) {
            log.debug("Review failed", e);
            err.println(errorJson(e));
            err.flush();
            return exitCodeFor(e.kind());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize review", e);
        }
    }

    /**
     * Maps a failure kind onto the process exit code.
     */
    public static int exitCodeFor(ErrorKind kind) {
        switch (kind) {
            case CONFIGURATION:
                return EXIT_CONFIGURATION;
            case INPUT:
                return EXIT_USAGE;
            default:
                return EXIT_REVIEW_FAILED;
        }
    }

    /**
     * Renders a failure as the single-line structured error document.
     */
    public static String errorJson(ReviewException e) {
        try {
            return MAPPER.writeValueAsString(Map.of("error", ReviewError.of(e)));
        } catch (JsonProcessingException jsonError) {
            throw new IllegalStateException("Failed to serialize error", jsonError);
        }
    }

    private String readLine() {
        try {
            var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
            String line = reader.readLine();
            return line != null ? line : "";
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read the question from the console", e);
        }
    }
}
