package com.askbetter.core.llm;

import com.askbetter.core.model.CandidateRecord;

/**
 * One reply from the generation step: either the final candidate, or a request to
 * run a named local tool before the exchange can continue.
 */
public sealed interface GenerationTurn permits GenerationTurn.FinalCandidate, GenerationTurn.ToolInvocation {

    record FinalCandidate(CandidateRecord candidate) implements GenerationTurn {}

    /**
     * @param id        correlation id the tool result must echo
     * @param toolName  name of the requested tool, e.g. {@code pii_scan}
     * @param arguments tool arguments as a JSON object string
     */
    record ToolInvocation(String id, String toolName, String arguments) implements GenerationTurn {}
}
