package com.raditha.canon.format;

import com.raditha.canon.format.json.JsonGrammar;
import com.raditha.canon.format.yaml.YamlGrammar;

import java.nio.file.Path;

/**
 * Lookup of the bundled grammars.
 */
public final class FormatGrammars {

    private FormatGrammars() {
    }

    public static FormatGrammar forName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Grammar name cannot be null");
        }
        return switch (name.toLowerCase()) {
            case "yaml", "yml" -> new YamlGrammar();
            case "json" -> new JsonGrammar();
            default -> throw new IllegalArgumentException("Unknown format: " + name + ". Must be: yaml or json");
        };
    }

    /**
     * Grammar for a file, chosen by extension. Unknown extensions are read as YAML, which accepts
     * JSON-like flow documents as well.
     */
    public static FormatGrammar forPath(Path path) {
        String fileName = path.getFileName().toString().toLowerCase();
        if (fileName.endsWith(".json")) {
            return new JsonGrammar();
        }
        return new YamlGrammar();
    }
}
