package com.whereq.newscaster.rehost;

import org.apache.commons.io.FilenameUtils;

import java.util.Locale;
import java.util.Map;

/**
 * Content type lookup by file extension, used when the remote server sends none
 */
public final class ContentTypes {

    public static final String OCTET_STREAM = "application/octet-stream";

    private static final Map<String, String> BY_EXTENSION = Map.ofEntries(
        Map.entry("mp4", "video/mp4"),
        Map.entry("m4v", "video/mp4"),
        Map.entry("mov", "video/quicktime"),
        Map.entry("webm", "video/webm"),
        Map.entry("mkv", "video/x-matroska"),
        Map.entry("mp3", "audio/mpeg"),
        Map.entry("wav", "audio/wav"),
        Map.entry("m4a", "audio/mp4"),
        Map.entry("aac", "audio/aac"),
        Map.entry("ogg", "audio/ogg"),
        Map.entry("flac", "audio/flac"),
        Map.entry("png", "image/png"),
        Map.entry("jpg", "image/jpeg"),
        Map.entry("jpeg", "image/jpeg"),
        Map.entry("gif", "image/gif"),
        Map.entry("json", "application/json"),
        Map.entry("txt", "text/plain"),
        Map.entry("srt", "application/x-subrip"),
        Map.entry("vtt", "text/vtt")
    );

    private ContentTypes() {
    }

    /**
     * @return content type for the file name's extension, or null when unknown
     */
    public static String forFileName(String fileName) {
        if (fileName == null) {
            return null;
        }
        String extension = FilenameUtils.getExtension(fileName);
        if (extension == null || extension.isEmpty()) {
            return null;
        }
        return BY_EXTENSION.get(extension.toLowerCase(Locale.ROOT));
    }

    /**
     * First usable value of header, extension table, hint; octet-stream otherwise
     */
    public static String resolve(String header, String fileName, String hint) {
        if (isUsable(header)) {
            return header;
        }
        String byExtension = forFileName(fileName);
        if (byExtension != null) {
            return byExtension;
        }
        return isUsable(hint) ? hint : OCTET_STREAM;
    }

    private static boolean isUsable(String contentType) {
        return contentType != null && !contentType.isBlank() && !OCTET_STREAM.equalsIgnoreCase(contentType.trim());
    }
}
