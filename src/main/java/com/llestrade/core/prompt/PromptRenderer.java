package com.llestrade.core.prompt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.llestrade.core.errors.FatalConfigurationException;
import com.llestrade.core.model.AnalysisGroup;
import com.llestrade.core.model.Project;
import com.llestrade.core.placeholders.PlaceholderMap;
import com.llestrade.core.placeholders.SystemPlaceholders;
import com.llestrade.core.storage.ContentHasher;
import com.llestrade.core.storage.JsonFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Loads prompt templates, substitutes {@code {placeholder}} tokens and computes the prompt hash
 * that decides whether earlier outputs can be reused.
 * <p>
 * Tokens with no value are left in place so a missing optional placeholder stays visible in
 * the rendered prompt.
 */
@Component
public class PromptRenderer {

    private static final Logger log = LoggerFactory.getLogger(PromptRenderer.class);

    public static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-z][a-z0-9_]*)}");

    public PromptBundle load(Project project, AnalysisGroup group) {
        String systemTemplate = readTemplate(project, group.getSystemPromptPath());
        String userTemplate = readTemplate(project, group.getUserPromptPath());
        String defaultUser = group.isCombined() ? DefaultPrompts.COMBINED_USER : DefaultPrompts.USER;
        PromptBundle bundle = new PromptBundle(
                systemTemplate != null ? systemTemplate : DefaultPrompts.SYSTEM,
                userTemplate != null ? userTemplate : defaultUser,
                systemTemplate != null ? group.getSystemPromptPath() : "default",
                userTemplate != null ? group.getUserPromptPath() : "default");
        if (!placeholdersIn(bundle.userTemplate()).contains("document_content")) {
            throw new FatalConfigurationException(
                    "User prompt " + bundle.userSource() + " must contain the {document_content} placeholder");
        }
        return bundle;
    }

    /** Placeholder keys the templates reference, excluding the ones the renderer fills itself. */
    public Set<String> usedPlaceholders(PromptBundle bundle) {
        Set<String> keys = new LinkedHashSet<>();
        keys.addAll(placeholdersIn(bundle.systemTemplate()));
        keys.addAll(placeholdersIn(bundle.userTemplate()));
        keys.removeAll(SystemPlaceholders.RUNTIME_KEYS);
        return keys;
    }

    public static Set<String> placeholdersIn(String template) {
        Set<String> keys = new LinkedHashSet<>();
        Matcher matcher = PLACEHOLDER.matcher(template);
        while (matcher.find()) {
            keys.add(matcher.group(1));
        }
        return keys;
    }

    public String render(String template, Map<String, String> values) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder(template.length());
        while (matcher.find()) {
            String value = values.get(matcher.group(1));
            matcher.appendReplacement(out, Matcher.quoteReplacement(value != null ? value : matcher.group()));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    public String renderSystem(PromptBundle bundle, PlaceholderMap placeholders) {
        return render(bundle.systemTemplate(), placeholders.values());
    }

    public String renderUser(PromptBundle bundle, PlaceholderMap placeholders, String documentName, String content) {
        Map<String, String> values = new LinkedHashMap<>(placeholders.values());
        values.put("document_name", documentName);
        values.put("document_content", content);
        return render(bundle.userTemplate(), values);
    }

    public String renderChunk(PromptBundle bundle, PlaceholderMap placeholders, String documentName,
                              String content, int chunkIndex, int chunkTotal) {
        Map<String, String> values = new LinkedHashMap<>(placeholders.values());
        values.put("document_name", documentName);
        values.put("document_content", content);
        values.put("chunk_index", String.valueOf(chunkIndex));
        values.put("chunk_total", String.valueOf(chunkTotal));
        return "You are analysing chunk " + chunkIndex + " of " + chunkTotal + " from " + documentName + ".\n\n"
                + render(bundle.userTemplate(), values);
    }

    /** Prompt that merges the per-chunk outputs of one document. */
    public String renderChunkMerge(List<String> partials, String documentName, PlaceholderMap placeholders) {
        Map<String, String> values = new LinkedHashMap<>(placeholders.values());
        values.put("document_name", documentName);
        values.put("chunk_summaries", partials.stream()
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.joining(DefaultPrompts.CHUNK_SEPARATOR)));
        return render(DefaultPrompts.CHUNK_MERGE, values);
    }

    /**
     * Hash of everything that shapes the model output apart from the document itself: templates,
     * provider and model settings, placeholder requirements and the project and run placeholder
     * values. Per-run system values such as the timestamp are excluded so a rerun can still match.
     */
    public String promptHash(PromptBundle bundle, AnalysisGroup group, String providerId, String model,
                             double temperature, Map<String, String> projectValues,
                             Map<String, String> runValues) {
        Map<String, Object> payload = new TreeMap<>();
        payload.put("system_template", bundle.systemTemplate());
        payload.put("user_template", bundle.userTemplate());
        payload.put("system_source", bundle.systemSource());
        payload.put("user_source", bundle.userSource());
        payload.put("provider", providerId);
        payload.put("model", model);
        payload.put("temperature", temperature);
        payload.put("operation", group.getOperation().name());
        payload.put("use_reasoning", group.isUseReasoning());
        payload.put("context_window", group.getModelContextWindow());
        payload.put("placeholder_requirements", new TreeMap<>(group.getPlaceholderRequirements()));
        payload.put("project_values", new TreeMap<>(projectValues));
        payload.put("run_values", runValues == null ? Map.of() : new TreeMap<>(runValues));
        if (group.isCombined()) {
            payload.put("combine_order", group.getCombineOrder().name());
        }
        try {
            return ContentHasher.sha256(JsonFiles.mapper().writeValueAsString(payload));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Prompt hash payload could not be serialised", e);
        }
    }

    private String readTemplate(Project project, String promptPath) {
        if (promptPath == null || promptPath.isBlank()) {
            return null;
        }
        Path path = Path.of(promptPath);
        if (!path.isAbsolute()) {
            path = project.root().resolve(promptPath);
        }
        if (!Files.isRegularFile(path)) {
            throw new FatalConfigurationException("Prompt file not found: " + path);
        }
        try {
            String text = Files.readString(path, StandardCharsets.UTF_8);
            if (text.isBlank()) {
                log.warn("Prompt file {} is empty; using the default template", path);
                return null;
            }
            return text;
        } catch (IOException e) {
            throw new FatalConfigurationException("Prompt file could not be read: " + path, e);
        }
    }
}
