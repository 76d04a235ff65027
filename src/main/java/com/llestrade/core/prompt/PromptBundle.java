package com.llestrade.core.prompt;

/**
 * The system and user templates a group runs with.
 *
 * @param systemTemplate system prompt template
 * @param userTemplate   user prompt template, always containing {@code {document_content}}
 * @param systemSource   where the system template came from ("default" or a path)
 * @param userSource     where the user template came from ("default" or a path)
 */
public record PromptBundle(String systemTemplate, String userTemplate, String systemSource, String userSource) {}
