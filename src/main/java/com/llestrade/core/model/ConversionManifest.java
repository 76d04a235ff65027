package com.llestrade.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Maps source paths (relative to {@code sources/}) to their converted outputs.
 * Stored as {@code converted_documents/.conversion_manifest.json}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConversionManifest {

    private int version = 1;
    private Map<String, ConversionRecord> files = new TreeMap<>();

    public int getVersion() { return version; }
    public void setVersion(int version) { this.version = version; }

    public Map<String, ConversionRecord> getFiles() { return files; }
    public void setFiles(Map<String, ConversionRecord> files) {
        this.files = files == null ? new TreeMap<>() : new TreeMap<>(files);
    }

    public Optional<ConversionRecord> get(String relativePath) {
        return Optional.ofNullable(files.get(relativePath));
    }

    public void put(String relativePath, ConversionRecord record) {
        files.put(relativePath, record);
    }
}
