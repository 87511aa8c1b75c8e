package com.llmgateway.routing;

import com.llmgateway.provider.LlmProvider;

/**
 * Adapter chosen for one call.
 *
 * @param providerKey normalized configuration key the adapter was chosen under
 * @param fallback    whether the primary provider was bypassed
 */
public record ResolvedProvider(String providerKey, LlmProvider adapter, boolean fallback) {
}
