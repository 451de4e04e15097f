package com.homepurse.analysis.agent;

import com.homepurse.analysis.ai.OpenAiResponsesClient;
import java.util.List;

public record PromptPayload(Kind kind, List<OpenAiResponsesClient.Message> messages) {

    public enum Kind { GENERATION, REPAIR }

    public PromptPayload {
        if (kind == null) {
            throw new IllegalArgumentException("kind is required");
        }
        messages = List.copyOf(messages);
    }

    public String systemText() {
        return messages.stream()
                .filter(m -> "system".equals(m.role()))
                .map(OpenAiResponsesClient.Message::content)
                .findFirst()
                .orElse("");
    }

    public String userText() {
        return messages.stream()
                .filter(m -> "user".equals(m.role()))
                .map(OpenAiResponsesClient.Message::content)
                .reduce((first, second) -> second)
                .orElse("");
    }
}
