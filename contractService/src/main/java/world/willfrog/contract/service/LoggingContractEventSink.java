package world.willfrog.contract.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import world.willfrog.contract.model.ContractEvent;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes each event as one JSON line on the {@code contract.events} logger.
 */
@Component
@RequiredArgsConstructor
public class LoggingContractEventSink implements ContractEventSink {

    private static final Logger EVENTS = LoggerFactory.getLogger("contract.events");

    private final ObjectMapper objectMapper;

    @Override
    public void publish(ContractEvent event) {
        EVENTS.info(toJson(event));
    }

    String toJson(ContractEvent event) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("timestamp", event.timestamp() == null ? null : event.timestamp().toString());
        payload.put("event_type", event.eventType());
        payload.put("contract_version", event.contractVersion());
        payload.put("role", event.role());
        payload.put("data", event.data());
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (Exception e) {
            return String.valueOf(payload);
        }
    }
}
