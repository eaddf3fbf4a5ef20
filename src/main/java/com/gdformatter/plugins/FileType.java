package com.gdformatter.plugins;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import com.gdformatter.util.LoggerUtil;

/**
 * Supported file types, detected by extension with a shebang fallback for
 * extensionless scripts.
 */
public enum FileType {
    GDSCRIPT("gd"),
    UNKNOWN("");

    private static final Logger logger = LoggerUtil.getLogger(FileType.class);
    private final String extension;

    private static final Map<Path, FileType> typeCache = new ConcurrentHashMap<>();
    private static final int MAX_CACHE_SIZE = 10000;

    FileType(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * Detects the file type of a path, caching the answer.
     */
    public static FileType detect(Path filePath) {
        FileType cachedType = typeCache.get(filePath);
        if (cachedType != null) {
            return cachedType;
        }

        if (typeCache.size() > MAX_CACHE_SIZE) {
            typeCache.clear();
            logger.fine("Cleared file type detection cache");
        }

        FileType detectedType = detectByExtension(filePath);
        if (detectedType == UNKNOWN) {
            detectedType = detectByShebang(filePath);
        }
        typeCache.put(filePath, detectedType);
        return detectedType;
    }

    private static FileType detectByExtension(Path filePath) {
        Path name = filePath.getFileName();
        if (name == null) {
            return UNKNOWN;
        }
        String fileName = name.toString().toLowerCase();
        if (!fileName.contains(".")) {
            return UNKNOWN;
        }

        String extension = fileName.substring(fileName.lastIndexOf('.') + 1);
        return switch (extension) {
            case "gd" -> GDSCRIPT;
            default -> UNKNOWN;
        };
    }

    /**
     * Scripts run with {@code godot --script} may carry a shebang instead of an extension.
     */
    private static FileType detectByShebang(Path filePath) {
        if (!Files.isRegularFile(filePath)) {
            return UNKNOWN;
        }
        try (BufferedReader reader = Files.newBufferedReader(filePath, StandardCharsets.UTF_8)) {
            String firstLine = reader.readLine();
            if (firstLine != null && firstLine.startsWith("#!") && firstLine.contains("godot")) {
                return GDSCRIPT;
            }
            return UNKNOWN;
        } catch (IOException e) {
            logger.log(Level.FINE, "Error reading file for type detection: " + filePath, e);
            return UNKNOWN;
        }
    }

    public static void clearCache() {
        typeCache.clear();
        logger.fine("File type detection cache cleared");
    }

    public static int getCacheSize() {
        return typeCache.size();
    }

    public String getDescription() {
        return switch (this) {
            case GDSCRIPT -> "GDScript source file";
            case UNKNOWN -> "Unknown file type";
        };
    }
}
