package com.raditha.canon.config;

import com.raditha.canon.format.OrphanCommentPolicy;
import com.raditha.canon.patch.TransactionMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for loading canon.yml and applying command-line overrides.
 */
class CanonSettingsTest {

    @TempDir
    Path tempDir;

    private Path write(String yaml) throws IOException {
        Path file = tempDir.resolve("canon.yml");
        Files.writeString(file, yaml);
        return file;
    }

    @Test
    void testNoFileUsesCliSettings() throws IOException {
        CanonConfig config = CanonSettings.loadConfig(null, "lenient", "all-or-nothing");

        assertTrue(config.allowUnhintedInsert());
        assertEquals(TransactionMode.ALL_OR_NOTHING, config.transactionMode());
    }

    @Test
    void testMissingExplicitFile() {
        Path missing = tempDir.resolve("missing.yml");
        assertThrows(IOException.class, () -> CanonSettings.loadConfig(missing, null, null));
    }

    @Test
    void testLoadSection() throws IOException {
        Path file = write("""
                canon:
                  preset: tekton
                  duration_keys: [deadline]
                  aliases:
                    - {key: kind, spelling: ClusterTask, canonical: Task}
                  defaults:
                    - {parent: "spec", key: retries, value: 0}
                  ignored_paths: [metadata.annotations]
                  orphan_comments: next
                  transaction_mode: best-effort
                  verify_round_trip: false
                """);

        CanonConfig config = CanonSettings.loadConfig(file, null, null);

        assertEquals(List.of("timeout", "deadline"), config.durationKeys());
        assertEquals(2, config.aliases().size());
        assertEquals("ClusterTask", config.aliases().get(1).spelling());
        assertEquals(CanonConfig.tekton().defaultValues().size() + 1, config.defaultValues().size());
        assertTrue(config.ignoredPaths().contains("metadata.uid"));
        assertTrue(config.ignoredPaths().contains("metadata.annotations"));
        assertEquals(OrphanCommentPolicy.ATTACH_TO_NEXT, config.orphanCommentPolicy());
        assertEquals(TransactionMode.BEST_EFFORT, config.transactionMode());
        assertFalse(config.verifyRoundTrip());
    }

    @Test
    void testTopLevelSettings() throws IOException {
        Path file = write("timestamp_patterns: [\"dd/MM/yyyy\"]\nallow_unhinted_insert: true\n");

        CanonConfig config = CanonSettings.loadConfig(file, null, null);

        assertEquals(List.of("dd/MM/yyyy"), config.timestampPatterns());
        assertTrue(config.allowUnhintedInsert());
        assertEquals(TransactionMode.ALL_OR_NOTHING, config.transactionMode());
    }

    @Test
    void testCliOverridesFile() throws IOException {
        Path file = write("canon:\n  preset: lenient\n  transaction_mode: best-effort\n");

        CanonConfig config = CanonSettings.loadConfig(file, "strict", "all-or-nothing");

        assertEquals(OrphanCommentPolicy.ATTACH_TO_PREVIOUS, config.orphanCommentPolicy());
        assertEquals(TransactionMode.ALL_OR_NOTHING, config.transactionMode());
    }

    @Test
    void testEmptyFile() throws IOException {
        Path file = write("");

        CanonConfig config = CanonSettings.loadConfig(file, null, null);

        assertEquals(CanonConfig.defaults(), config);
    }

    @Test
    void testInvalidSettings() throws IOException {
        Path notMapping = write("- a\n- b\n");
        assertThrows(IllegalArgumentException.class, () -> CanonSettings.loadConfig(notMapping, null, null));

        Path badMode = write("transaction_mode: sometimes\n");
        assertThrows(IllegalArgumentException.class, () -> CanonSettings.loadConfig(badMode, null, null));

        Path badAlias = write("aliases: [oops]\n");
        assertThrows(IllegalArgumentException.class, () -> CanonSettings.loadConfig(badAlias, null, null));
    }
}
