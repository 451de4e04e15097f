package com.homepurse.analysis.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.homepurse.analysis.ai.LanguageModelException;
import com.homepurse.analysis.ai.OpenAiResponsesClient;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Asks the configured model for a candidate query and extracts it from the JSON reply.
 */
@Component
public class SqlGenerator {

    private static final int MAX_OUTPUT_TOKENS = 800;

    private final OpenAiResponsesClient client;
    private final ObjectMapper objectMapper;
    private final ExecutorService executor;

    public SqlGenerator(OpenAiResponsesClient client,
                        ObjectMapper objectMapper,
                        @Qualifier("analysisIoExecutor") ExecutorService executor) {
        this.client = client;
        this.objectMapper = objectMapper;
        this.executor = executor;
    }

    public String providerName() {
        return client.providerName();
    }

    public String model() {
        return client.model();
    }

    /**
     * Completes exceptionally with {@link LanguageModelException} when the call fails and with
     * {@link SqlGenerationException} when the reply holds no query.
     */
    public CompletableFuture<GeneratedSql> generate(PromptPayload prompt) {
        return CompletableFuture.supplyAsync(
                () -> parseReply(client.generateText(prompt.messages(), MAX_OUTPUT_TOKENS)),
                executor);
    }

    GeneratedSql parseReply(String reply) {
        if (reply == null || reply.isBlank()) {
            throw new SqlGenerationException("empty reply");
        }
        String text = stripFences(reply.strip());
        JsonNode node = readObject(text);
        if (node == null) {
            int start = text.indexOf('{');
            int end = text.lastIndexOf('}');
            if (start >= 0 && end > start) {
                node = readObject(text.substring(start, end + 1));
            }
        }
        if (node != null) {
            JsonNode sql = node.get("sql");
            if (sql == null || !sql.isTextual() || sql.asText().isBlank()) {
                throw new SqlGenerationException("reply JSON has no \"sql\" field");
            }
            JsonNode reason = node.get("reason");
            return new GeneratedSql(sql.asText().strip(),
                    reason != null && reason.isTextual() && !reason.asText().isBlank() ? reason.asText().strip() : null);
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.startsWith("select") || lower.startsWith("with")) {
            return new GeneratedSql(text, null);
        }
        throw new SqlGenerationException("reply is neither JSON nor a SQL query");
    }

    private JsonNode readObject(String text) {
        try {
            JsonNode node = objectMapper.readTree(text);
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException ex) {
            return null;
        }
    }

    private static String stripFences(String text) {
        if (!text.startsWith("```")) {
            return text;
        }
        String body = text.substring(3);
        int newline = body.indexOf('\n');
        if (newline >= 0) {
            // drop the language tag on the opening fence
            body = body.substring(newline + 1);
        }
        int closing = body.lastIndexOf("```");
        if (closing >= 0) {
            body = body.substring(0, closing);
        }
        return body.strip();
    }
}
