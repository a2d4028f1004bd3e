package world.willfrog.contract.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import world.willfrog.contract.config.ContractProperties;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds OpenAI-compatible chat models from {@code contract.llm.*}, one per distinct temperature.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ContractChatModelFactory {

    private static final double DEFAULT_TEMPERATURE = 0.7D;

    private final ContractProperties properties;
    private final ObjectMapper objectMapper;
    private final Map<Double, ChatLanguageModel> models = new ConcurrentHashMap<>();

    public ChatLanguageModel buildChatModelWithTemperature(double temperature) {
        double finalTemperature = Double.isNaN(temperature) ? DEFAULT_TEMPERATURE : roundTemperature(temperature);
        return models.computeIfAbsent(finalTemperature, this::build);
    }

    public AgentCall agentCall() {
        return agentCall(properties.getLlm().getSystemPrompt());
    }

    public AgentCall agentCall(String systemPrompt) {
        return new ChatModelAgentCall(this::buildChatModelWithTemperature, systemPrompt, objectMapper);
    }

    private ChatLanguageModel build(double temperature) {
        ContractProperties.Llm llm = properties.getLlm();
        if (isBlank(llm.getApiKey())) {
            throw new IllegalArgumentException("LLM api key is not configured: contract.llm.api-key");
        }
        if (isBlank(llm.getModelName())) {
            throw new IllegalArgumentException("LLM model is not configured: contract.llm.model-name");
        }
        boolean debugEnabled = log.isDebugEnabled();
        OpenAiChatModel.OpenAiChatModelBuilder builder = OpenAiChatModel.builder()
                .apiKey(llm.getApiKey())
                .modelName(llm.getModelName())
                .maxTokens(llm.getMaxTokens())
                .temperature(temperature)
                .logRequests(debugEnabled)
                .logResponses(debugEnabled);
        if (!isBlank(llm.getBaseUrl())) {
            builder.baseUrl(llm.getBaseUrl());
        }
        log.info("Built chat model: model={}, temperature={}", llm.getModelName(), temperature);
        return builder.build();
    }

    /**
     * Adaptive steps accumulate floating point drift, e.g. 0.30000000000000004; two decimals keep
     * the cache to one model per visible temperature.
     */
    static double roundTemperature(double temperature) {
        return Math.round(temperature * 100.0D) / 100.0D;
    }

    private boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
