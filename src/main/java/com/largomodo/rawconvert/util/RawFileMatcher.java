package com.largomodo.rawconvert.util;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Raw camera file detection by extension.
 * <p>
 * Recognizes Nikon NEF/NRW and the other common raw formats dcraw decodes
 * (Canon, Sony, Adobe DNG, Olympus, Fujifilm, Panasonic, Pentax, Samsung, Hasselblad,
 * Kodak, Minolta, Sigma). Matching is case-insensitive: cameras write upper-case names.
 * <p>
 * Stateless utility performing filesystem checks. Safe for concurrent use.
 */
public class RawFileMatcher {

    private static final Set<String> EXTENSIONS = Set.of(
            "nef", "nrw",
            "cr2", "crw",
            "arw", "srf", "sr2",
            "dng",
            "orf",
            "raf",
            "rw2",
            "pef",
            "srw",
            "3fr",
            "kdc",
            "mrw",
            "x3f"
    );

    private RawFileMatcher() {
        // Static utility class - prevent instantiation
    }

    /**
     * Check if path is a regular file with a recognized raw extension.
     *
     * @param path File path to check (can be null)
     * @return true if path is a regular file matching a raw extension, false otherwise
     */
    public static boolean isRaw(Path path) {
        if (path == null) {
            return false;  // Safe filter predicate semantics (prevents NPE in stream filters)
        }
        if (!Files.isRegularFile(path)) {
            // Directories named like "2024.NEF" are not images
            return false;
        }
        return hasRawExtension(path.getFileName().toString());
    }

    /**
     * Extension-only check, without touching the filesystem.
     */
    public static boolean hasRawExtension(String fileName) {
        if (fileName == null) {
            return false;
        }
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) {
            return false;
        }
        return EXTENSIONS.contains(fileName.substring(dot + 1).toLowerCase(Locale.ROOT));
    }
}
