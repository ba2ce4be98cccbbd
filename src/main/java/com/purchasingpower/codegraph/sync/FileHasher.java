package com.purchasingpower.codegraph.sync;

import com.google.common.hash.Hashing;
import org.springframework.stereotype.Component;

/**
 * SHA-256 content digest used for change detection.
 */
@Component
public class FileHasher {

    public String hash(byte[] content) {
        return Hashing.sha256().hashBytes(content).toString();
    }
}
