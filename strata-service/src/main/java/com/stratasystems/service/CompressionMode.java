package com.stratasystems.service;

/**
 * Per-save override of the compression decision.
 */
public enum CompressionMode {
    /** Compress when enabled in config and the codec judges it worthwhile. */
    AUTO,
    ALWAYS,
    NEVER
}
