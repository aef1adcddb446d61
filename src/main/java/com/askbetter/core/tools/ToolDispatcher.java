package com.askbetter.core.tools;

import com.askbetter.core.error.GenerationException;
import com.askbetter.core.error.ToolException;
import com.askbetter.core.llm.GenerationTurn.ToolInvocation;
import com.askbetter.core.model.Flag;
import com.askbetter.core.scanner.PiiScanner;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.function.FunctionToolCallback;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Runs the local tools the generation step may ask for mid-exchange.
 * <p>
 * Only {@value #PII_SCAN} exists. The tool is advertised to the model through
 * {@link #toolCallbacks()}, but it is executed here, by the orchestrator, and the
 * result is handed back to the exchange explicitly.
 */
@Component
public class ToolDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ToolDispatcher.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String PII_SCAN = "pii_scan";

    /** Arguments of {@value #PII_SCAN}. */
    public record PiiScanRequest(String text) {}

    private final PiiScanner scanner;
    private final List<ToolCallback> toolCallbacks;

    public ToolDispatcher(PiiScanner scanner) {
        this.scanner = scanner;
        this.toolCallbacks = List.of(
                FunctionToolCallback.builder(PII_SCAN, (PiiScanRequest request) -> tags(scan(request.text())))
                        .description("Return PII flags found in the text (email, phone, card-ish). "
                                + "Call it with text=original_question and copy the result into flags.")
                        .inputType(PiiScanRequest.class)
                        .build());
    }

    /**
     * Tool definitions to advertise to the generation service.
     */
    public List<ToolCallback> toolCallbacks() {
        return toolCallbacks;
    }

    /**
     * Executes a tool invocation requested by the generation step.
     *
     * @throws GenerationException if the tool is unknown or its arguments are malformed
     * @throws ToolException       if the scanner itself fails
     */
    public ToolResult dispatch(ToolInvocation invocation) {
        if (!PII_SCAN.equals(invocation.toolName())) {
            throw new GenerationException("Generation requested unknown tool: " + invocation.toolName());
        }
        String text = textArgument(invocation.arguments());
        List<String> tags = tags(scan(text));
        log.debug("Tool {} ({}) returned {}", invocation.toolName(), invocation.id(), tags);
        try {
            return new ToolResult(invocation.id(), invocation.toolName(), MAPPER.writeValueAsString(tags));
        } catch (JsonProcessingException e) {
            throw new ToolException("Failed to encode " + PII_SCAN + " result", e);
        }
    }

    private Set<Flag> scan(String text) {
        try {
            return scanner.scan(text);
        } catch (RuntimeException e) {
            throw new ToolException("PII scanner failed: " + e.getMessage(), e);
        }
    }

    private static String textArgument(String arguments) {
        try {
            JsonNode node = MAPPER.readTree(arguments == null || arguments.isBlank() ? "{}" : arguments);
            JsonNode text = node.get("text");
            if (text == null || !text.isTextual()) {
                throw new GenerationException(PII_SCAN + " called without a text argument");
            }
            return text.asText();
        } catch (JsonProcessingException e) {
            throw new GenerationException(PII_SCAN + " called with malformed arguments: " + e.getOriginalMessage(), e);
        }
    }

    private static List<String> tags(Set<Flag> flags) {
        return flags.stream().map(Flag::tag).toList();
    }
}
