package com.homepurse.analysis.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.homepurse.analysis.config.HomepurseProperties;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Blocking text-completion client for the configured provider (OpenAI Responses API or Gemini
 * generateContent). The provider is fixed at construction from {@link HomepurseProperties.Ai}.
 */
@Component
public class OpenAiResponsesClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiResponsesClient.class);
    private static final String GEMINI_DEFAULT_ENDPOINT = "https://generativelanguage.googleapis.com/v1beta";
    private static final int DEFAULT_MAX_TOKENS = 600;
    private static final int GEMINI_MAX_TOKENS = 2048;

    public enum Provider { OPENAI, GEMINI }

    private final HomepurseProperties.Ai ai;
    private final Provider provider;
    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public record Message(String role, String content) {}

    public record OpenAiResponsesRequest(String model, List<Message> input, Integer max_output_tokens) {}

    public OpenAiResponsesClient(HomepurseProperties properties, ObjectMapper objectMapper) {
        this.ai = properties.ai();
        this.provider = "gemini".equals(ai.providerOrDefault()) ? Provider.GEMINI : Provider.OPENAI;
        this.objectMapper = objectMapper;

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        Duration readTimeout = properties.analysis().modelTimeout();
        requestFactory.setConnectTimeout(Duration.ofSeconds(10));
        requestFactory.setReadTimeout(readTimeout);

        this.restClient = RestClient.builder().requestFactory(requestFactory).build();
        log.info("AI HTTP client configured: provider={} model={} readTimeoutMs={}", provider, ai.model(), readTimeout.toMillis());
    }

    public String providerName() {
        return provider.name().toLowerCase();
    }

    public String model() {
        return ai.snapshotOrDefault();
    }

    /**
     * @return the completion text, never blank
     * @throws LanguageModelException when the provider yields no usable text
     */
    public String generateText(List<Message> inputMessages, Integer maxOutputTokens) {
        String apiKey = resolveApiKey()
                .orElseThrow(() -> new LanguageModelException("No API key configured for provider " + providerName()));
        int maxTokens = sanitizePositive(maxOutputTokens, DEFAULT_MAX_TOKENS,
                provider == Provider.GEMINI ? GEMINI_MAX_TOKENS : Integer.MAX_VALUE);
        return switch (provider) {
            case GEMINI -> generateGemini(inputMessages, maxTokens, apiKey);
            case OPENAI -> generateOpenAi(inputMessages, maxTokens, apiKey);
        };
    }

    private String generateOpenAi(List<Message> inputMessages, int maxTokens, String apiKey) {
        OpenAiResponsesRequest requestBody = new OpenAiResponsesRequest(model(), inputMessages, maxTokens);
        try {
            JsonNode response = restClient.post()
                    .uri(ai.endpoint())
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(headers -> headers.setBearerAuth(apiKey))
                    .body(requestBody)
                    .retrieve()
                    .body(JsonNode.class);
            if (response == null) {
                throw new LanguageModelException("OpenAI returned an empty body");
            }
            String text = extractText(response.get("output"));
            if (text == null || text.isBlank()) {
                text = extractText(response.get("output_text"));
            }
            return requireText(text, response);
        } catch (RestClientResponseException ex) {
            log.warn("OpenAI Responses call failed (status {}): {}", ex.getStatusCode(), ex.getMessage());
            throw new LanguageModelException("Model provider returned HTTP " + ex.getStatusCode().value(), ex);
        } catch (RestClientException ex) {
            log.warn("OpenAI Responses call failed: {}", ex.getMessage());
            throw new LanguageModelException("Model provider call failed: " + ex.getMessage(), ex);
        }
    }

    private String generateGemini(List<Message> inputMessages, int maxTokens, String apiKey) {
        ObjectNode payload = buildGeminiPayload(inputMessages, maxTokens);
        try {
            JsonNode response = restClient.post()
                    .uri(geminiEndpoint(model()))
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(headers -> headers.set("x-goog-api-key", apiKey))
                    .body(payload)
                    .retrieve()
                    .body(JsonNode.class);
            if (response == null) {
                throw new LanguageModelException("Gemini returned an empty body");
            }
            String text = extractGeminiText(response);
            if (text == null || text.isBlank()) {
                log.warn("Gemini returned no text. finishReason={}, blockReason={}",
                        readPath(response, "candidates", "finishReason"), readPath(response, "promptFeedback", "blockReason"));
            }
            return requireText(text, response);
        } catch (RestClientResponseException ex) {
            String body = ex.getResponseBodyAsString();
            log.warn("Gemini call failed (status {}): {}{}", ex.getStatusCode(), ex.getMessage(),
                    body != null && !body.isBlank() ? "; body=" + truncate(body, 400) : "");
            throw new LanguageModelException("Model provider returned HTTP " + ex.getStatusCode().value(), ex);
        } catch (RestClientException ex) {
            log.warn("Gemini call failed: {}", ex.getMessage());
            throw new LanguageModelException("Model provider call failed: " + ex.getMessage(), ex);
        }
    }

    private String requireText(String text, JsonNode response) {
        if (text == null || text.isBlank()) {
            throw new LanguageModelException("Model returned no text content (keys: " + describeKeys(response, 8) + ")");
        }
        return text;
    }

    private ObjectNode buildGeminiPayload(List<Message> messages, int maxTokens) {
        ObjectNode root = objectMapper.createObjectNode();

        String systemInstruction = collectSystemInstruction(messages);
        if (systemInstruction != null) {
            ObjectNode si = root.putObject("systemInstruction");
            si.put("role", "system");
            si.putArray("parts").addObject().put("text", systemInstruction);
        }

        ArrayNode contents = root.putArray("contents");
        for (Message message : messages) {
            if (message == null || message.role() == null || message.content() == null
                    || "system".equalsIgnoreCase(message.role())) {
                continue;
            }
            String mappedRole = "assistant".equalsIgnoreCase(message.role()) ? "model" : "user";
            ObjectNode content = contents.addObject();
            content.put("role", mappedRole);
            content.putArray("parts").addObject().put("text", message.content());
        }

        ObjectNode generationConfig = root.putObject("generationConfig");
        generationConfig.put("maxOutputTokens", maxTokens);
        generationConfig.put("temperature", 0);
        generationConfig.put("responseMimeType", "application/json");
        return root;
    }

    private String collectSystemInstruction(List<Message> messages) {
        StringBuilder builder = new StringBuilder();
        for (Message message : messages) {
            if (message != null && "system".equalsIgnoreCase(message.role())
                    && message.content() != null && !message.content().isBlank()) {
                if (builder.length() > 0) {
                    builder.append("\n\n");
                }
                builder.append(message.content());
            }
        }
        return builder.length() == 0 ? null : builder.toString();
    }

    private String geminiEndpoint(String model) {
        String base = ai.endpoint();
        if (base == null || base.isBlank() || base.contains("api.openai.com")) {
            base = GEMINI_DEFAULT_ENDPOINT;
        }
        if (!base.endsWith("/")) {
            base = base + "/";
        }
        return base + "models/" + model + ":generateContent";
    }

    private Optional<String> resolveApiKey() {
        String configured = ai.apiKey();
        if (configured != null && !configured.isBlank()) {
            return Optional.of(configured);
        }
        String envKey = System.getenv(provider == Provider.GEMINI ? "GEMINI_API_KEY" : "OPENAI_API_KEY");
        if (envKey != null && !envKey.isBlank()) {
            return Optional.of(envKey);
        }
        return Optional.empty();
    }

    private int sanitizePositive(Integer requested, int defaultValue, int maxValue) {
        int value = Optional.ofNullable(requested).filter(v -> v > 0).orElse(defaultValue);
        return Math.min(value, maxValue);
    }

    private String readPath(JsonNode response, String container, String field) {
        JsonNode node = response != null ? response.get(container) : null;
        if (node != null && node.isArray() && node.size() > 0) {
            node = node.get(0);
        }
        JsonNode value = node != null ? node.get(field) : null;
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, Math.max(0, max)) + "...";
    }

    private String describeKeys(JsonNode node, int maxKeys) {
        if (node == null || !node.isObject()) {
            return "";
        }
        java.util.Iterator<String> names = node.fieldNames();
        java.util.List<String> keys = new java.util.ArrayList<>();
        while (names.hasNext() && keys.size() < Math.max(1, maxKeys)) {
            keys.add(names.next());
        }
        String suffix = names.hasNext() ? ", ..." : "";
        return String.join(", ", keys) + suffix;
    }

    private String extractGeminiText(JsonNode node) {
        JsonNode candidates = node.get("candidates");
        if (candidates != null && candidates.isArray()) {
            for (JsonNode candidate : candidates) {
                JsonNode parts = candidate.path("content").path("parts");
                if (parts.isArray()) {
                    for (JsonNode part : parts) {
                        String partText = extractText(part.get("text"));
                        if (partText != null && !partText.isBlank()) {
                            return partText;
                        }
                    }
                }
            }
        }
        return null;
    }

    private String extractText(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                String nested = extractText(item);
                if (nested != null && !nested.isBlank()) {
                    return nested;
                }
            }
            return null;
        }
        JsonNode content = node.get("content");
        if (content != null) {
            String nested = extractText(content);
            if (nested != null && !nested.isBlank()) {
                return nested;
            }
        }
        JsonNode text = node.get("text");
        if (text != null) {
            return extractText(text);
        }
        return null;
    }
}
