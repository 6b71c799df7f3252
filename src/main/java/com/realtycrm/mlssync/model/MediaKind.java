package com.realtycrm.mlssync.model;

import org.apache.commons.io.FilenameUtils;

import java.net.URI;
import java.util.Locale;
import java.util.Set;

public enum MediaKind {
    PHOTO,
    VIDEO,
    VIRTUAL_TOUR,
    DOCUMENT;

    private static final Set<String> VIDEO_EXTENSIONS = Set.of("mp4", "mov", "m4v", "webm", "avi");
    private static final Set<String> DOCUMENT_EXTENSIONS = Set.of("pdf", "doc", "docx");

    /**
     * Maps a provider media category onto the canonical type; unknown categories are treated as photos.
     */
    public static MediaKind fromProviderValue(String value) {
        if (value == null) {
            return PHOTO;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if (normalized.contains("VIDEO")) {
            return VIDEO;
        }
        if (normalized.contains("TOUR")) {
            return VIRTUAL_TOUR;
        }
        if (normalized.contains("DOC") || normalized.contains("PDF")) {
            return DOCUMENT;
        }
        return PHOTO;
    }

    /**
     * Uses the provider category when one is given, otherwise guesses from the extension of the URL path.
     */
    public static MediaKind classify(String category, String url) {
        if (category != null && !category.isBlank()) {
            return fromProviderValue(category);
        }
        return fromUrl(url);
    }

    static MediaKind fromUrl(String url) {
        if (url == null) {
            return PHOTO;
        }
        String path;
        try {
            path = URI.create(url.trim()).getPath();
        } catch (IllegalArgumentException e) {
            return PHOTO;
        }
        if (path == null) {
            return PHOTO;
        }
        String extension = FilenameUtils.getExtension(path).toLowerCase(Locale.ROOT);
        if (VIDEO_EXTENSIONS.contains(extension)) {
            return VIDEO;
        }
        if (DOCUMENT_EXTENSIONS.contains(extension)) {
            return DOCUMENT;
        }
        return PHOTO;
    }
}
