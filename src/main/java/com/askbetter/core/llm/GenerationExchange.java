package com.askbetter.core.llm;

import com.askbetter.core.tools.ToolResult;

/**
 * A single in-flight conversation with the generation service. Holds the message
 * history of one request and is discarded when the request's attempt ends.
 */
public interface GenerationExchange {

    /**
     * Sends the opening request, or returns the next pending tool invocation.
     *
     * @throws com.askbetter.core.error.GenerationException on transport failure,
     *         timeout, rate limiting or an unparseable response
     */
    GenerationTurn next();

    /**
     * Resumes the exchange with the result of a previously requested tool.
     *
     * @throws com.askbetter.core.error.GenerationException as for {@link #next()}
     */
    GenerationTurn submitToolResult(ToolResult result);
}
