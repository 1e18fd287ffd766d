package com.ficshelf.collab;

public final class RetrievalResult {

    private final String metadataJson;

    public RetrievalResult(String metadataJson) {
        this.metadataJson = metadataJson != null ? metadataJson : "";
    }

    /**
     * The tool's structured output, stored verbatim as the story's metadata file.
     */
    public String getMetadataJson() {
        return metadataJson;
    }
}
