package org.carball.lbs.ai;

import com.theokanning.openai.completion.chat.ChatCompletionRequest;
import com.theokanning.openai.completion.chat.ChatCompletionResult;
import com.theokanning.openai.completion.chat.ChatMessage;
import com.theokanning.openai.completion.chat.ChatMessageRole;
import com.theokanning.openai.service.OpenAiService;
import lombok.extern.slf4j.Slf4j;
import org.carball.lbs.config.LlmConfig;
import org.carball.lbs.exception.TextGenerationException;

import java.util.Arrays;

@Slf4j
public class OpenAiTextGenerator implements TextGenerator {

    private final OpenAiService openAiService;
    private final LlmConfig config;

    public OpenAiTextGenerator(LlmConfig config) {
        // Only initialize the client if we're actually going to use it
        this(OpenAiClients.aiDisabled() ? null : OpenAiClients.create(config), config);
    }

    public OpenAiTextGenerator(OpenAiService openAiService, LlmConfig config) {
        this.openAiService = openAiService;
        this.config = config;
    }

    @Override
    public String generate(String systemPrompt, String userPrompt) {
        if (openAiService == null) {
            throw new TextGenerationException("Text generation is disabled (skip.ai=true)", null);
        }

        ChatCompletionRequest request = ChatCompletionRequest.builder()
                .model(config.getModel())
                .messages(Arrays.asList(
                        new ChatMessage(ChatMessageRole.SYSTEM.value(), systemPrompt),
                        new ChatMessage(ChatMessageRole.USER.value(), userPrompt)
                ))
                .temperature(config.getTemperature())
                .topP(config.getTopP())
                .maxTokens(config.getMaxTokens())
                .build();

        log.trace("System prompt:\n{}", systemPrompt);
        log.trace("User prompt:\n{}", userPrompt);

        ChatCompletionResult result;
        try {
            result = openAiService.createChatCompletion(request);
        } catch (RuntimeException e) {
            log.error("Chat completion with model {} failed: {}", config.getModel(), e.getMessage());
            throw new TextGenerationException("Error calling language model: " + e.getMessage(), e);
        }

        if (result.getChoices() == null || result.getChoices().isEmpty()) {
            throw new TextGenerationException("Language model returned no choices", null);
        }
        String response = result.getChoices().get(0).getMessage().getContent();
        response = response == null ? "" : response.strip();

        log.trace("Received response: {} characters", response.length());
        log.trace("Model response:\n{}", response);
        return response;
    }

    @Override
    public String modelName() {
        return config.getModel();
    }
}
