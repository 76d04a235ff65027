package com.llestrade.core.placeholders;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlaceholderParserTest {

    @Test
    @DisplayName("parses bullet and numbered lists, skipping headings")
    void parsesLists() {
        String markdown = """
                # Case placeholders

                - client_name
                * opposing_counsel
                1. court
                2) hearing_date
                """;

        assertEquals(List.of("client_name", "opposing_counsel", "court", "hearing_date"),
                PlaceholderParser.parse(markdown));
    }

    @Test
    @DisplayName("rejects default values")
    void rejectsDefaults() {
        var error = assertThrows(PlaceholderParseException.class, () -> PlaceholderParser.parse("- client: ACME"));
        assertTrue(error.getMessage().contains("default values"));
    }

    @Test
    @DisplayName("rejects keys that are not snake_case")
    void rejectsBadKeys() {
        assertThrows(PlaceholderParseException.class, () -> PlaceholderParser.parse("- ClientName"));
    }

    @Test
    @DisplayName("rejects duplicates")
    void rejectsDuplicates() {
        assertThrows(PlaceholderParseException.class, () -> PlaceholderParser.parse("- a\n- a"));
    }

    @Test
    @DisplayName("reads from a file")
    void readsFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("placeholders.md");
        Files.writeString(file, "- client\n- court\n");

        assertEquals(List.of("client", "court"), PlaceholderParser.parse(file));
    }

    @Test
    @DisplayName("a missing file is a parse error")
    void missingFile(@TempDir Path dir) {
        assertThrows(PlaceholderParseException.class, () -> PlaceholderParser.parse(dir.resolve("nope.md")));
    }
}
