package io.phosflow.util;

public final class Texts {
    private Texts() {
    }

    public static String tail(String raw, int maxChars) {
        if (raw == null) {
            return "";
        }
        return raw.length() <= maxChars ? raw : raw.substring(raw.length() - maxChars);
    }

    public static String singleLine(String raw, int maxChars) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= maxChars) {
            return normalized;
        }
        return normalized.substring(0, maxChars) + "...";
    }
}
