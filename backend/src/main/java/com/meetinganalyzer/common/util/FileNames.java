package com.meetinganalyzer.common.util;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

public final class FileNames {

    private static final int MAX_LOCAL_NAME_BYTES = 200;
    private static final Pattern UNSAFE_CHARACTERS = Pattern.compile("[/\\\\:*?\"<>|\\n\\r\\t]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SOCIETY_SEPARATORS = Pattern.compile("[_\\-|.]+");
    private static final String UNKNOWN_SOCIETY = "Unknown Society";

    private FileNames() {
    }

    /**
     * Makes a remote display name safe for the local filesystem. The result is at most
     * 200 bytes in UTF-8, leaving room for an id prefix under the 255-byte name limit.
     */
    public static String sanitize(String name) {
        if (name == null || name.isBlank()) {
            return "unnamed";
        }
        String safe = UNSAFE_CHARACTERS.matcher(name).replaceAll("_");
        safe = WHITESPACE.matcher(safe.trim()).replaceAll("_");
        safe = truncateToBytes(safe, MAX_LOCAL_NAME_BYTES);
        return safe.isEmpty() ? "unnamed" : safe;
    }

    private static String truncateToBytes(String value, int maxBytes) {
        if (value.getBytes(StandardCharsets.UTF_8).length <= maxBytes) {
            return value;
        }
        StringBuilder kept = new StringBuilder();
        int bytes = 0;
        int index = 0;
        while (index < value.length()) {
            int codePoint = value.codePointAt(index);
            int size = new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8).length;
            if (bytes + size > maxBytes) {
                break;
            }
            kept.appendCodePoint(codePoint);
            bytes += size;
            index += Character.charCount(codePoint);
        }
        return kept.toString();
    }

    public static String stripExtension(String name) {
        if (name == null) {
            return "";
        }
        int index = name.lastIndexOf('.');
        return index > 0 ? name.substring(0, index) : name;
    }

    public static String societyName(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            return UNKNOWN_SOCIETY;
        }
        String base = SOCIETY_SEPARATORS.matcher(stripExtension(fileName)).replaceAll(" ");
        base = WHITESPACE.matcher(base.trim()).replaceAll(" ");
        return base.isEmpty() ? UNKNOWN_SOCIETY : base;
    }
}
