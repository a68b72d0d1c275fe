package com.aviax.media.backend;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * What the extraction backend returned for a query: a single item, or a
 * result set (search or playlist) whose items are in {@link #entries()}.
 * A result set may be empty.
 */
public record ExtractedInfo(
        String id,
        String title,
        long durationSeconds,
        String thumbnail,
        String url,
        String ext,
        String filepath,
        boolean resultSet,
        List<ExtractedInfo> entries,
        List<FormatOption> formats) {

    public ExtractedInfo {
        entries = entries == null ? List.of() : List.copyOf(entries);
        formats = formats == null ? List.of() : List.copyOf(formats);
    }

    /**
     * Map the backend's JSON document.
     */
    public static ExtractedInfo fromJson(JsonNode node) {
        List<ExtractedInfo> entries = new ArrayList<>();
        JsonNode entriesNode = node.path("entries");
        if (entriesNode.isArray()) {
            for (JsonNode entry : entriesNode) {
                if (entry != null && entry.isObject()) {
                    entries.add(fromJson(entry));
                }
            }
        }

        List<FormatOption> formats = new ArrayList<>();
        JsonNode formatsNode = node.path("formats");
        if (formatsNode.isArray()) {
            for (JsonNode f : formatsNode) {
                formats.add(new FormatOption(
                        textOrNull(f, "format_id"),
                        f.path("ext").asText(""),
                        f.path("format_note").asText(f.path("format").asText("")),
                        f.path("height").asInt(0),
                        f.path("filesize").asLong(f.path("filesize_approx").asLong(0)),
                        f.path("acodec").asText("none"),
                        f.path("vcodec").asText("none")));
            }
        }

        return new ExtractedInfo(
                textOrNull(node, "id"),
                textOrNull(node, "title"),
                Math.round(node.path("duration").asDouble(0)),
                textOrNull(node, "thumbnail"),
                textOrNull(node, "url"),
                textOrNull(node, "ext"),
                resolveFilepath(node),
                entriesNode.isArray() || "playlist".equals(node.path("_type").asText()),
                entries,
                formats);
    }

    private static String resolveFilepath(JsonNode node) {
        String direct = textOrNull(node, "filepath");
        if (direct != null) {
            return direct;
        }
        JsonNode downloads = node.path("requested_downloads");
        if (downloads.isArray() && downloads.size() > 0) {
            String requested = textOrNull(downloads.get(0), "filepath");
            if (requested != null) {
                return requested;
            }
        }
        String underscored = textOrNull(node, "_filename");
        return underscored != null ? underscored : textOrNull(node, "filename");
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isEmpty() ? null : text;
    }
}
