package world.willfrog.contract.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import world.willfrog.contract.model.ContractEvent;
import world.willfrog.contract.model.ContractSpec;
import world.willfrog.contract.model.EscalationReason;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class EscalationHandlerTest {

    @Mock
    private ContractEventSink sink;

    private final MutableClock clock = new MutableClock();
    private final ContractSpec spec = ContractFixtures.tradingSpec();

    @Test
    void escalate_shouldUseConfiguredActionAndPublishEvent() {
        EscalationHandler handler = new EscalationHandler(spec, sink, clock);

        String action = handler.escalate(EscalationReason.UNEXPECTED_OUTPUT, "High confidence decision changed");

        assertEquals("flag_for_review", action);
        ArgumentCaptor<ContractEvent> captor = ArgumentCaptor.forClass(ContractEvent.class);
        verify(sink).publish(captor.capture());
        ContractEvent event = captor.getValue();
        assertEquals("escalation", event.eventType());
        assertEquals("1.1", event.contractVersion());
        assertEquals("trader", event.role());
        assertEquals(clock.instant(), event.timestamp().toInstant());
        assertEquals("unexpected_output", event.data().get("reason"));
        assertEquals("flag_for_review", event.data().get("action"));
        assertEquals("human_reviewer", event.data().get("fallback_role"));
    }

    @Test
    void escalate_shouldDefaultToFallbackForUnmappedReason() {
        EscalationHandler handler = new EscalationHandler(spec, sink, clock);

        assertEquals("fallback", handler.escalate(EscalationReason.INVALID_RESPONSE, null));

        ArgumentCaptor<ContractEvent> captor = ArgumentCaptor.forClass(ContractEvent.class);
        verify(sink).publish(captor.capture());
        assertFalse(captor.getValue().data().containsKey("detail"));
    }

    @Test
    void emit_shouldSwallowSinkFailure() {
        doThrow(new IllegalStateException("disk full")).when(sink).publish(any());
        EscalationHandler handler = new EscalationHandler(spec, sink, clock);

        handler.emit(ContractEvent.TYPE_HEALTH_CHECK, Map.of("status", "unhealthy"));
        assertEquals("fallback", handler.escalate(EscalationReason.CONTEXT_MISMATCH, "mismatch"));
    }
}
