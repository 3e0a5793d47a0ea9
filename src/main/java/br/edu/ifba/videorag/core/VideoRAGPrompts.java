package br.edu.ifba.videorag.core;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Prompt templates used by indexing and query processing.
 * Templates are Java text blocks filled with {@link String#formatted(Object...)}.
 */
public final class VideoRAGPrompts {

    private VideoRAGPrompts() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static final String EXTRACTION_SYSTEM_PROMPT = """
        You are an expert in knowledge graph extraction from multimodal video content. \
        Respond only with a single valid JSON object.""";

    private static final String EXTRACTION_TEMPLATE = """
        From the following text, which combines visual descriptions and spoken transcripts from video clips, \
        extract key entities and their relationships.

        Format the output as a single JSON object with two keys: "entities" and "relationships".
        - "entities": a list of objects, each with "entity_id" (a unique, lowercase, snake_case identifier), \
        "label" (a short human-readable name) and "description" (a one-sentence description).
        - "relationships": a list of objects, each with "source_id", "target_id", "type" \
        (an UPPERCASE_SNAKE_CASE verb phrase) and "description".

        Text to analyze:
        ---
        %s
        ---
        """;

    private static final String SYNTHESIS_TEMPLATE = """
        You are an expert knowledge synthesizer. Two descriptions exist for the same entity '%s'. \
        Combine them into a single comprehensive description. Do not lose any information from either \
        description; remove only exact repetition.

        Existing description:
        %s

        New description:
        %s

        Synthesized description:""";

    private static final String REFORMULATION_TEMPLATE = """
        Reformulate the question into a declarative sentence that states what a relevant passage would say. \
        Return only the sentence.

        Question: %s""";

    private static final String SCENE_TEMPLATE = """
        Describe the core visual scene for this query in one or two sentences, as it would appear on screen. \
        Return only the description.

        Query: %s""";

    private static final String RELEVANCE_TEMPLATE = """
        Is the following video clip context essential to answer the user's query?

        Query: %s

        Clip context:
        %s

        Respond with a JSON object of the form {"is_relevant": true} or {"is_relevant": false}.""";

    private static final String KEYWORDS_TEMPLATE = """
        Extract a concise list of 2-5 essential keywords from the query below. \
        Return them as a single comma-separated line.

        Query: %s""";

    private static final String QUERY_CAPTION_TEMPLATE = """
        You are watching frames sampled from a short video clip.
        Spoken transcript of the clip: "%s"
        Focus on details related to these keywords: %s.
        Describe what is visually happening, emphasising anything connected to the keywords.""";

    private static final String INITIAL_CAPTION_TEMPLATE = """
        You are watching frames sampled from a short video clip.
        Spoken transcript of the clip: "%s"
        Describe the setting, the people and objects on screen, any visible text, and the actions taking place.""";

    public static final String GENERATION_SYSTEM_PROMPT = """
        You are a helpful assistant that answers questions about a library of videos. \
        Use only the provided context. If the context does not contain the answer, say so.""";

    private static final String GENERATION_TEMPLATE = """
        Answer the user's query using the retrieved video context below.

        PART 1: Query-focused clip descriptions
        %s

        PART 2: Retrieved clip captions and transcripts
        %s

        User query: %s

        Answer:""";

    @NotNull
    public static String extraction(@NotNull String chunkContent) {
        return EXTRACTION_TEMPLATE.formatted(chunkContent);
    }

    @NotNull
    public static String synthesis(@NotNull String label, @NotNull String existing, @NotNull String incoming) {
        return SYNTHESIS_TEMPLATE.formatted(label, existing, incoming);
    }

    @NotNull
    public static String reformulation(@NotNull String query) {
        return REFORMULATION_TEMPLATE.formatted(query);
    }

    @NotNull
    public static String sceneDescription(@NotNull String query) {
        return SCENE_TEMPLATE.formatted(query);
    }

    @NotNull
    public static String relevance(@NotNull String query, @NotNull String clipContext) {
        return RELEVANCE_TEMPLATE.formatted(query, clipContext);
    }

    @NotNull
    public static String keywords(@NotNull String query) {
        return KEYWORDS_TEMPLATE.formatted(query);
    }

    @NotNull
    public static String initialCaption(@NotNull String transcript) {
        return INITIAL_CAPTION_TEMPLATE.formatted(transcript);
    }

    @NotNull
    public static String queryFocusedCaption(@NotNull String transcript, @NotNull List<String> keywords) {
        return QUERY_CAPTION_TEMPLATE.formatted(transcript, String.join(", ", keywords));
    }

    @NotNull
    public static String generation(@NotNull String enrichedContext, @NotNull String retrievedContext, @NotNull String query) {
        return GENERATION_TEMPLATE.formatted(enrichedContext, retrievedContext, query);
    }
}
