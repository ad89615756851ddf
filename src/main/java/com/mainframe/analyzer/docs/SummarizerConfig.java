package com.mainframe.analyzer.docs;

import java.time.Duration;

import lombok.Builder;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * Connection settings for the Azure OpenAI chat-completions endpoint.
 */
@Value
@Builder(toBuilder = true)
public class SummarizerConfig {

    /**
     * Resource endpoint, e.g. https://my-resource.openai.azure.com
     */
    @NonNull
    String endpoint;

    /**
     * Name of the model deployment inside the resource.
     */
    @NonNull
    String deployment;

    @NonNull
    @ToString.Exclude
    String apiKey;

    @NonNull
    @Builder.Default
    String apiVersion = "2024-02-01";

    @Builder.Default
    double temperature = 0.0;

    @NonNull
    @Builder.Default
    Duration timeout = Duration.ofSeconds(60);

    /**
     * Full chat-completions URL for the configured deployment.
     */
    public String chatCompletionsUrl() {
        String base = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        return base + "/openai/deployments/" + deployment + "/chat/completions?api-version=" + apiVersion;
    }
}
