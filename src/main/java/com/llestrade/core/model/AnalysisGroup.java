package com.llestrade.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A named analysis configuration: which documents to analyse, with which prompts and model,
 * and whether outputs are produced per document or combined into one artifact.
 * <p>
 * Persisted as {@code bulk_analysis/<slug>/config.json}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class AnalysisGroup {

    public static final String CURRENT_VERSION = "2";
    public static final String DEFAULT_OUTPUT_TEMPLATE = "combined_{timestamp}.md";

    private String id;
    private String name;
    private String slug;
    private String description = "";
    private AnalysisOperation operation = AnalysisOperation.PER_DOCUMENT;

    // Per-document selection, relative to converted_documents/
    private List<String> files = new ArrayList<>();
    private List<String> directories = new ArrayList<>();

    // Combined selection
    private List<String> combineConvertedFiles = new ArrayList<>();
    private List<String> combineConvertedDirectories = new ArrayList<>();
    private List<String> combineMapGroups = new ArrayList<>();
    private List<String> combineMapFiles = new ArrayList<>();
    private List<String> combineMapDirectories = new ArrayList<>();
    private CombineOrder combineOrder = CombineOrder.PATH;
    private String combineOutputTemplate = DEFAULT_OUTPUT_TEMPLATE;

    private String systemPromptPath;
    private String userPromptPath;
    private String providerId = "anthropic";
    private String model = "";
    private Integer modelContextWindow;
    private boolean useReasoning;
    private Map<String, Boolean> placeholderRequirements = new LinkedHashMap<>();

    private String version = CURRENT_VERSION;
    private Instant createdAt;
    private Instant updatedAt;

    public static AnalysisGroup create(String name, AnalysisOperation operation) {
        AnalysisGroup group = new AnalysisGroup();
        Instant now = Instant.now();
        group.setId(UUID.randomUUID().toString());
        group.setName(name);
        group.setOperation(operation);
        group.setCreatedAt(now);
        group.setUpdatedAt(now);
        return group;
    }

    @JsonIgnore
    public boolean isCombined() {
        return operation == AnalysisOperation.COMBINED;
    }

    /** Directory name under {@code bulk_analysis/}; the slug, or the id for groups saved before slugs existed. */
    @JsonIgnore
    public String folderName() {
        return slug != null && !slug.isBlank() ? slug : id;
    }

    public void touch() {
        this.updatedAt = Instant.now();
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getSlug() { return slug; }
    public void setSlug(String slug) { this.slug = slug; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public AnalysisOperation getOperation() { return operation; }
    public void setOperation(AnalysisOperation operation) { this.operation = operation; }

    public List<String> getFiles() { return files; }
    public void setFiles(List<String> files) { this.files = nonNull(files); }

    public List<String> getDirectories() { return directories; }
    public void setDirectories(List<String> directories) { this.directories = nonNull(directories); }

    public List<String> getCombineConvertedFiles() { return combineConvertedFiles; }
    public void setCombineConvertedFiles(List<String> combineConvertedFiles) { this.combineConvertedFiles = nonNull(combineConvertedFiles); }

    public List<String> getCombineConvertedDirectories() { return combineConvertedDirectories; }
    public void setCombineConvertedDirectories(List<String> combineConvertedDirectories) { this.combineConvertedDirectories = nonNull(combineConvertedDirectories); }

    public List<String> getCombineMapGroups() { return combineMapGroups; }
    public void setCombineMapGroups(List<String> combineMapGroups) { this.combineMapGroups = nonNull(combineMapGroups); }

    public List<String> getCombineMapFiles() { return combineMapFiles; }
    public void setCombineMapFiles(List<String> combineMapFiles) { this.combineMapFiles = nonNull(combineMapFiles); }

    public List<String> getCombineMapDirectories() { return combineMapDirectories; }
    public void setCombineMapDirectories(List<String> combineMapDirectories) { this.combineMapDirectories = nonNull(combineMapDirectories); }

    public CombineOrder getCombineOrder() { return combineOrder; }
    public void setCombineOrder(CombineOrder combineOrder) { this.combineOrder = combineOrder == null ? CombineOrder.PATH : combineOrder; }

    public String getCombineOutputTemplate() { return combineOutputTemplate; }
    public void setCombineOutputTemplate(String combineOutputTemplate) { this.combineOutputTemplate = combineOutputTemplate; }

    public String getSystemPromptPath() { return systemPromptPath; }
    public void setSystemPromptPath(String systemPromptPath) { this.systemPromptPath = systemPromptPath; }

    public String getUserPromptPath() { return userPromptPath; }
    public void setUserPromptPath(String userPromptPath) { this.userPromptPath = userPromptPath; }

    public String getProviderId() { return providerId; }
    public void setProviderId(String providerId) { this.providerId = providerId; }

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public Integer getModelContextWindow() { return modelContextWindow; }
    public void setModelContextWindow(Integer modelContextWindow) { this.modelContextWindow = modelContextWindow; }

    public boolean isUseReasoning() { return useReasoning; }
    public void setUseReasoning(boolean useReasoning) { this.useReasoning = useReasoning; }

    public Map<String, Boolean> getPlaceholderRequirements() { return placeholderRequirements; }
    public void setPlaceholderRequirements(Map<String, Boolean> placeholderRequirements) {
        this.placeholderRequirements = placeholderRequirements == null
                ? new LinkedHashMap<>()
                : new LinkedHashMap<>(placeholderRequirements);
    }

    public String getVersion() { return version; }
    public void setVersion(String version) { this.version = version; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    private static List<String> nonNull(List<String> values) {
        return values == null ? new ArrayList<>() : new ArrayList<>(values);
    }
}
