package world.willfrog.contract.service;

import lombok.extern.slf4j.Slf4j;
import world.willfrog.contract.model.ContractEvent;
import world.willfrog.contract.model.ContractSpec;
import world.willfrog.contract.model.EscalationReason;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolves escalation actions for one contract and emits contract events. Emission is
 * fire-and-forget: a failing sink is logged and otherwise ignored.
 */
@Slf4j
public class EscalationHandler {

    private final ContractSpec spec;
    private final ContractEventSink sink;
    private final Clock clock;

    public EscalationHandler(ContractSpec spec, ContractEventSink sink, Clock clock) {
        this.spec = spec;
        this.sink = sink;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public String escalate(EscalationReason reason, String detail) {
        String action = spec.escalation().actionFor(reason);
        log.warn("Handling escalation: role={}, reason={}, action={}, detail={}",
                spec.role(), reason.key(), action, detail);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("reason", reason.key());
        data.put("action", action);
        if (detail != null && !detail.isBlank()) {
            data.put("detail", detail);
        }
        if (spec.escalation().fallbackRole() != null) {
            data.put("fallback_role", spec.escalation().fallbackRole());
        }
        emit(ContractEvent.TYPE_ESCALATION, data);
        return action;
    }

    public void emit(String eventType, Map<String, Object> data) {
        if (sink == null) {
            return;
        }
        try {
            sink.publish(new ContractEvent(
                    OffsetDateTime.now(clock),
                    eventType,
                    spec.version(),
                    spec.role(),
                    data
            ));
        } catch (Exception e) {
            log.warn("Failed to publish contract event: type={}, role={}, err={}", eventType, spec.role(), e.getMessage());
        }
    }
}
