package com.askbetter.core.tools;

/**
 * Output of a local tool, correlated to the invocation that requested it.
 */
public record ToolResult(String id, String toolName, String content) {}
