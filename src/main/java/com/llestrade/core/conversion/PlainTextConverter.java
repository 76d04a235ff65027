package com.llestrade.core.conversion;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Copies sources that are already text.
 */
@Component
public class PlainTextConverter implements DocumentConverter {

    @Override
    public boolean supports(Path source) {
        String name = source.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".md") || name.endsWith(".txt") || name.endsWith(".markdown");
    }

    @Override
    public String name() {
        return "plain-text";
    }

    @Override
    public String convert(Path source) throws IOException {
        return Files.readString(source, StandardCharsets.UTF_8);
    }
}
