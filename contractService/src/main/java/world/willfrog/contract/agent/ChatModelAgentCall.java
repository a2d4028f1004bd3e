package world.willfrog.contract.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;
import world.willfrog.contract.model.AgentCallRequest;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleFunction;

/**
 * Agent backed by a chat model. The request is sent as a JSON user message; the model's raw text
 * is returned for the enforcer to normalize.
 */
@Slf4j
public class ChatModelAgentCall implements AgentCall {

    private final DoubleFunction<ChatLanguageModel> modelProvider;
    private final String systemPrompt;
    private final ObjectMapper objectMapper;

    public ChatModelAgentCall(DoubleFunction<ChatLanguageModel> modelProvider, String systemPrompt, ObjectMapper objectMapper) {
        this.modelProvider = modelProvider;
        this.systemPrompt = systemPrompt == null ? "" : systemPrompt.trim();
        this.objectMapper = objectMapper;
    }

    @Override
    public Object call(AgentCallRequest request, Double temperature) throws Exception {
        ChatLanguageModel model = modelProvider.apply(temperature == null ? Double.NaN : temperature);
        List<ChatMessage> messages = new ArrayList<>();
        // langchain4j rejects blank message text
        if (!systemPrompt.isEmpty()) {
            messages.add(new SystemMessage(systemPrompt));
        }
        messages.add(new UserMessage(objectMapper.writeValueAsString(buildPayload(request))));
        long startedAt = System.currentTimeMillis();
        Response<AiMessage> response = model.generate(messages);
        String text = response == null || response.content() == null ? "" : response.content().text();
        log.debug("Chat model answered in {}ms: temperature={}, chars={}",
                System.currentTimeMillis() - startedAt, temperature, text == null ? 0 : text.length());
        return text == null ? "" : text;
    }

    private Map<String, Object> buildPayload(AgentCallRequest request) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("args", request.args());
        Map<String, Object> kwargs = new LinkedHashMap<>(request.kwargs());
        kwargs.remove(AgentCallRequest.KEY_CONTEXT);
        kwargs.remove(AgentCallRequest.KEY_MEMORY);
        payload.put("kwargs", kwargs);
        Map<String, Object> context = request.resolveContext();
        if (!context.isEmpty()) {
            payload.put("context", context);
        }
        return payload;
    }
}
