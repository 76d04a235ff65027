package com.llestrade.core.model;

import java.time.Instant;

/**
 * @param outputPath  converted output, relative to the project root
 * @param sourceHash  SHA-256 of the source bytes when converted
 * @param convertedAt conversion time
 */
public record ConversionRecord(String outputPath, String sourceHash, Instant convertedAt) {}
