package com.llmgateway.provider;

import com.llmgateway.model.ChatModels;
import com.llmgateway.model.TaskModels.AnalyzeCodeOptions;
import com.llmgateway.model.TaskModels.AnalyzeCodeResult;
import com.llmgateway.model.TaskModels.ConnectionTestResult;
import com.llmgateway.model.TaskModels.GenerateCodeOptions;
import com.llmgateway.model.TaskModels.GenerateCodeResult;
import com.llmgateway.model.TaskModels.OptimizeCodeOptions;
import com.llmgateway.model.TaskModels.OptimizeCodeResult;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Interface for all LLM providers (OpenAI-compatible, Claude, DeepSeek, local)
 */
public interface LlmProvider {

    /**
     * Get the canonical provider key
     */
    String getName();

    /**
     * Model used when neither the call nor the configuration names one
     */
    String getDefaultModel();

    /**
     * Local providers run without credentials and get the patient retry policy
     */
    boolean isLocal();

    Mono<GenerateCodeResult> generateCode(String prompt, String language, GenerateCodeOptions options,
                                          CallSettings call);

    Mono<AnalyzeCodeResult> analyzeCode(String code, String language, AnalyzeCodeOptions options,
                                        CallSettings call);

    Mono<OptimizeCodeResult> optimizeCode(String code, String language, OptimizeCodeOptions options,
                                          CallSettings call);

    /**
     * Sends a prepared conversation and returns the answer verbatim
     */
    Mono<ChatReply> chat(List<ChatModels.Message> messages, CallSettings call);

    /**
     * Verifies the credential and endpoint; latency is measured by the caller
     */
    Mono<ConnectionTestResult> testConnection(CallSettings call);

    int countTokens(String text);
}
