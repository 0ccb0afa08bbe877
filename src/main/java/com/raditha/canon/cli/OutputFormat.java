package com.raditha.canon.cli;

/**
 * Format of the canonical view printed by the CLI.
 */
public enum OutputFormat {
    /**
     * Block YAML with sorted keys.
     */
    YAML,

    /**
     * Indented JSON with sorted keys.
     */
    JSON;

    /**
     * Convert a string value to OutputFormat enum.
     *
     * @param value the string value to convert (case-insensitive)
     * @return the corresponding OutputFormat
     * @throws IllegalArgumentException if the value is not a valid format
     */
    public static OutputFormat fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("OutputFormat value cannot be null");
        }

        return switch (value.toLowerCase()) {
            case "yaml", "yml" -> YAML;
            case "json" -> JSON;
            default -> throw new IllegalArgumentException(
                    "Invalid output format: " + value + ". Must be: yaml or json");
        };
    }

    /**
     * Get the string representation of this format for CLI usage.
     *
     * @return lowercase string representation
     */
    public String toCliString() {
        return switch (this) {
            case YAML -> "yaml";
            case JSON -> "json";
        };
    }
}
