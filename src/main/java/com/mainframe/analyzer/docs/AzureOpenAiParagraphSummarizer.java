package com.mainframe.analyzer.docs;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Summarizes paragraphs through an Azure OpenAI chat-completions deployment.
 */
public class AzureOpenAiParagraphSummarizer implements ParagraphSummarizer {

    private static final Logger log = LoggerFactory.getLogger(AzureOpenAiParagraphSummarizer.class);

    static final String SYSTEM_PROMPT = "You are a COBOL documentation expert.";

    private final SummarizerConfig config;
    private final DocumentationRenderer renderer;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public AzureOpenAiParagraphSummarizer(SummarizerConfig config, DocumentationRenderer renderer) {
        this(config, renderer, HttpClient.newBuilder()
                .connectTimeout(config.getTimeout())
                .build());
    }

    public AzureOpenAiParagraphSummarizer(SummarizerConfig config, DocumentationRenderer renderer, HttpClient httpClient) {
        this.config = Objects.requireNonNull(config, "config");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public String summarize(String name, String code) {
        log.debug("Summarizing paragraph {} with deployment {}", name, config.getDeployment());

        try {
            String prompt = renderer.renderPrompt(name, code);

            Map<String, Object> requestBody = Map.of(
                    "messages", List.of(
                            Map.of("role", "system", "content", SYSTEM_PROMPT),
                            Map.of("role", "user", "content", prompt)),
                    "temperature", config.getTemperature());

            String jsonBody = objectMapper.writeValueAsString(requestBody);

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(config.chatCompletionsUrl()))
                    .header("Content-Type", "application/json")
                    .header("api-key", config.getApiKey())
                    .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                    .timeout(config.getTimeout())
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() / 100 != 2) {
                log.error("Azure OpenAI error for {}: {} - {}", name, response.statusCode(), response.body());
                throw new SummarizationException(name, "Azure OpenAI returned HTTP " + response.statusCode());
            }

            JsonNode content = objectMapper.readTree(response.body())
                    .path("choices").path(0).path("message").path("content");
            if (!content.isTextual()) {
                throw new SummarizationException(name, "Azure OpenAI response has no message content");
            }

            log.debug("Summary for {} received: {} chars", name, content.asText().length());
            return content.asText();
        } catch (IOException e) {
            throw new SummarizationException(name, "Azure OpenAI request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SummarizationException(name, "Interrupted while waiting for Azure OpenAI", e);
        }
    }
}
