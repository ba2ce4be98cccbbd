package com.purchasingpower.codegraph.sync;

/**
 * A recoverable per-file error collected during a run.
 *
 * @param path  project-relative path
 * @param error error description
 */
public record FileFailure(String path, String error) {
}
