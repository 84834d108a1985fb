package com.edugen.ai.usage;

/**
 * Append-only destination for usage records.
 */
public interface UsageLogSink {
    
    void record(UsageLogEntry entry);
}
