package com.sheetdoc.app.models;

/**
 * A mention of another page inside a formula: {@code @[Label](identifier:mentionType)}.
 * The identifier part is optional, and so is the mention type within it.
 */
public class PageReference {
    private final String raw;
    private final String label;
    private final String normalizedLabel;
    private final String identifier;
    private final String mentionType;

    public PageReference(String label, String identifier, String mentionType) {
        this.label = label.trim();
        this.normalizedLabel = this.label.toLowerCase();
        this.identifier = blankToNull(identifier);
        this.mentionType = blankToNull(mentionType);
        this.raw = "@[" + this.label + "]" + identifierSuffix();
    }

    private static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private String identifierSuffix() {
        if (identifier == null && mentionType == null) {
            return "";
        }
        return "(" + (identifier == null ? "" : identifier) + (mentionType == null ? "" : ":" + mentionType) + ")";
    }

    /**
     * Canonical dependency key for a cell on this page, e.g. "@[Budget](p1:sheet):B2".
     */
    public String formatCell(String address) {
        return raw + ":" + address.toUpperCase();
    }

    public String getRaw() {
        return raw;
    }
    public String getLabel() {
        return label;
    }
    public String getNormalizedLabel() {
        return normalizedLabel;
    }
    public String getIdentifier() {
        return identifier;
    }
    public String getMentionType() {
        return mentionType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PageReference)) {
            return false;
        }
        return raw.equals(((PageReference) o).raw);
    }

    @Override
    public int hashCode() {
        return raw.hashCode();
    }

    @Override
    public String toString() {
        return raw;
    }
}
