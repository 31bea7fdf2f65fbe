package com.starscape.videoteca.features.uploadvideo.app;

import com.starscape.videoteca.common.config.StorageProperties;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.UUID;

/**
 * Builds storage keys of the form {@code prefix/<random id><.ext>}. Every call yields a fresh key,
 * even for identical filenames.
 */
@Component
public class StorageKeyGenerator {
    
    private static final int MAX_EXTENSION_LENGTH = 10;
    
    private final String keyPrefix;
    
    public StorageKeyGenerator(StorageProperties storageProperties) {
        String prefix = storageProperties.getKeyPrefix();
        this.keyPrefix = prefix == null ? "" : prefix.replaceAll("^/+|/+$", "");
    }
    
    public String generate(String originalFilename) {
        String id = UUID.randomUUID().toString().replace("-", "");
        String name = id + extractExtension(originalFilename);
        return keyPrefix.isEmpty() ? name : keyPrefix + "/" + name;
    }
    
    static String extractExtension(String filename) {
        if (filename == null) {
            return "";
        }
        int lastDot = filename.lastIndexOf('.');
        if (lastDot < 0 || lastDot == filename.length() - 1) {
            return "";
        }
        String ext = filename.substring(lastDot + 1).toLowerCase(Locale.ROOT);
        if (ext.length() > MAX_EXTENSION_LENGTH || !ext.chars().allMatch(c -> (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9'))) {
            return "";
        }
        return "." + ext;
    }
}
