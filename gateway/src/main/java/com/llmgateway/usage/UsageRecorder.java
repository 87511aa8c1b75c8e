package com.llmgateway.usage;

import com.llmgateway.model.UsageRecord;

/**
 * Fire-and-forget sink for usage records. Implementations must never throw into the caller.
 */
public interface UsageRecorder {

    void record(UsageRecord record);
}
