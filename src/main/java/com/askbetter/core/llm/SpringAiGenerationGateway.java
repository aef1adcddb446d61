package com.askbetter.core.llm;

import com.askbetter.core.error.GenerationException;
import com.askbetter.core.llm.GenerationTurn.FinalCandidate;
import com.askbetter.core.llm.GenerationTurn.ToolInvocation;
import com.askbetter.core.model.CandidateRecord;
import com.askbetter.core.model.GenerationSettings;
import com.askbetter.core.model.QuestionReview;
import com.askbetter.core.tools.ToolDispatcher;
import com.askbetter.core.tools.ToolResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.ResponseFormat;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * {@link GenerationGateway} backed by Spring AI's {@link ChatClient}.
 * <p>
 * The rubric goes out as the system message and the question, followed by the
 * {@link BeanOutputConverter} JSON-schema instructions for {@link QuestionReview},
 * as the user message. The {@code pii_scan} tool is advertised with Spring AI's
 * internal tool execution switched off, so tool calls come back to the caller as
 * {@link ToolInvocation} turns instead of being run inside the model call.
 */
@Service
public class SpringAiGenerationGateway implements GenerationGateway {

    private static final Logger log = LoggerFactory.getLogger(SpringAiGenerationGateway.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ChatClient chatClient;
    private final List<ToolCallback> tools;
    private final String formatInstructions;

    public SpringAiGenerationGateway(ChatClient.Builder builder, ToolDispatcher toolDispatcher) {
        this.chatClient = builder.build();
        this.tools = toolDispatcher.toolCallbacks();
        this.formatInstructions = new BeanOutputConverter<>(QuestionReview.class).getFormat();
    }

    @Override
    public GenerationExchange open(String question, String instructions, GenerationSettings settings) {
        var options = OpenAiChatOptions.builder()
                .model(settings.model())
                .temperature(settings.temperature())
                .seed(settings.seed())
                .responseFormat(ResponseFormat.builder().type(ResponseFormat.Type.JSON_OBJECT).build())
                .toolCallbacks(tools)
                .internalToolExecutionEnabled(false)
                .build();
        return new ChatExchange(question, instructions, options);
    }

    /**
     * Extracts the JSON object from a model reply, tolerating markdown code fences and
     * stray prose around the object.
     *
     * @throws GenerationException if no JSON object can be parsed
     */
    static CandidateRecord parseCandidate(String content) {
        if (content == null || content.isBlank()) {
            throw new GenerationException("Model returned empty content. "
                    + "Check that the model is reachable and supports structured JSON output.");
        }
        String cleaned = content.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        cleaned = cleaned.trim();

        int open = cleaned.indexOf('{');
        int close = cleaned.lastIndexOf('}');
        if (open < 0 || close < open) {
            throw new GenerationException("Model response contains no JSON object ("
                    + content.length() + " chars)");
        }
        try {
            JsonNode root = MAPPER.readTree(cleaned.substring(open, close + 1));
            if (root == null || !root.isObject()) {
                throw new GenerationException("Model response is not a JSON object");
            }
            return new CandidateRecord(root, content);
        } catch (JsonProcessingException e) {
            log.debug("Unparseable model response: {}", content);
            throw new GenerationException("Model response is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private final class ChatExchange implements GenerationExchange {

        private final OpenAiChatOptions options;
        private final List<Message> messages = new ArrayList<>();
        private final Deque<ToolInvocation> pending = new ArrayDeque<>();
        private final List<ToolResponseMessage.ToolResponse> answered = new ArrayList<>();
        private boolean started;

        private ChatExchange(String question, String instructions, OpenAiChatOptions options) {
            this.options = options;
            messages.add(new SystemMessage(instructions));
            messages.add(new UserMessage(question + "\n\n" + formatInstructions));
        }

        @Override
        public GenerationTurn next() {
            if (!pending.isEmpty()) {
                return pending.peek();
            }
            if (started) {
                throw new IllegalStateException("Exchange already produced its final candidate");
            }
            started = true;
            return call();
        }

        @Override
        public GenerationTurn submitToolResult(ToolResult result) {
            ToolInvocation expected = pending.peek();
            if (expected == null || !Objects.equals(expected.id(), result.id())) {
                throw new IllegalStateException("No pending tool invocation with id " + result.id());
            }
            pending.poll();
            answered.add(new ToolResponseMessage.ToolResponse(result.id(), result.toolName(), result.content()));
            if (!pending.isEmpty()) {
                return pending.peek();
            }
            messages.add(new ToolResponseMessage(List.copyOf(answered)));
            answered.clear();
            return call();
        }

        private GenerationTurn call() {
            log.info("Generation call started ({} message(s), model {})", messages.size(), options.getModel());
            long start = System.currentTimeMillis();
            ChatResponse response;
            try {
                response = chatClient.prompt(new Prompt(List.copyOf(messages), options))
                        .call()
                        .chatResponse();
            } catch (RuntimeException e) {
                throw new GenerationException("Generation call failed: " + describe(e), e);
            }
            long elapsed = System.currentTimeMillis() - start;
            log.info("Generation call complete ({}s)", String.format("%.1f", elapsed / 1000.0));

            if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
                throw new GenerationException("Model returned no result");
            }
            AssistantMessage output = response.getResult().getOutput();
            if (output.hasToolCalls()) {
                messages.add(output);
                for (AssistantMessage.ToolCall toolCall : output.getToolCalls()) {
                    pending.add(new ToolInvocation(toolCall.id(), toolCall.name(), toolCall.arguments()));
                }
                log.info("Model requested {} tool call(s)", pending.size());
                return pending.peek();
            }
            return new FinalCandidate(parseCandidate(output.getText()));
        }
    }

    private static String describe(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return cause == t ? message : t.getClass().getSimpleName() + " (" + message + ")";
    }
}
