package ai.contract.segmenter.config;

/**
 * Serialization used for segmented clauses.
 */
public enum OutputFormat {
    TEXT,
    JSON;

    public static OutputFormat from(String raw) {
        if (raw == null || raw.isBlank()) {
            return TEXT;
        }
        for (OutputFormat format : values()) {
            if (format.name().equalsIgnoreCase(raw.trim())) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unsupported output format: " + raw);
    }
}
