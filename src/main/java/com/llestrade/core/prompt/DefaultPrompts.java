package com.llestrade.core.prompt;

/**
 * Templates used when a group does not name its own prompt files.
 */
public final class DefaultPrompts {

    private DefaultPrompts() {}

    public static final String SYSTEM = """
            You are a meticulous analyst working through a large case file for {project_name}.
            Extract facts exactly as the documents state them. Quote dates, names and figures
            verbatim, cite the document they come from, and never invent details that are not
            in the text.
            """;

    public static final String USER = """
            Analyse the document "{document_name}" below. Summarise the key facts, the timeline
            of events and any details a reviewer would need, using markdown headings.

            {document_content}
            """;

    public static final String COMBINED_USER = """
            The following material comes from {reduce_source_count} analyses. Produce one
            coherent deliverable that preserves every key fact, resolves duplicates and notes
            any contradictions between sources.

            {document_content}
            """;

    /** Merges the per-chunk outputs of one document. */
    public static final String CHUNK_MERGE = """
            Create a unified bulk analysis by combining these partial results of document: {document_name}

            ## Partial Results:
            {chunk_summaries}

            Please create a single, coherent deliverable that captures all key information from the document.""";

    public static final String CHUNK_SEPARATOR = "\n\n---\n\n";
}
