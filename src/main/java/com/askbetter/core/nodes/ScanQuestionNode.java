package com.askbetter.core.nodes;

import com.askbetter.core.error.ToolException;
import com.askbetter.core.model.Flag;
import com.askbetter.core.model.ReviewStatus;
import com.askbetter.core.scanner.PiiScanner;
import com.askbetter.core.state.ReviewState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs the deterministic PII scan over the question before anything is generated.
 * The flags found here end up in the final review whatever the generation step says.
 */
@Component
public class ScanQuestionNode {

    private static final Logger log = LoggerFactory.getLogger(ScanQuestionNode.class);

    private final PiiScanner scanner;

    public ScanQuestionNode(PiiScanner scanner) {
        this.scanner = scanner;
    }

    public Map<String, Object> apply(ReviewState state) {
        Set<Flag> flags;
        try {
            flags = scanner.scan(state.question());
        } catch (RuntimeException e) {
            throw new ToolException("PII scanner failed: " + e.getMessage(), e);
        }
        log.info("Local scan found {} flag(s): {}", flags.size(), flags);
        return Map.of(
                "localFlags", List.copyOf(flags),
                "status", ReviewStatus.GENERATE.name()
        );
    }
}
