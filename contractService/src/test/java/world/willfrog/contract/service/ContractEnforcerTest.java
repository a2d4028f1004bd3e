package world.willfrog.contract.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import world.willfrog.contract.agent.AgentCall;
import world.willfrog.contract.config.ContractProperties;
import world.willfrog.contract.model.AgentCallRequest;
import world.willfrog.contract.model.ContractEvent;
import world.willfrog.contract.model.ContractSpec;
import world.willfrog.contract.model.MemoryEntry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class ContractEnforcerTest {

    private static final double EPS = 1e-9;

    @Mock
    private ContractEventSink sink;

    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private ContractProperties properties;
    private ContractEnforcerFactory factory;
    private ContractEnforcer enforcer;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        meterRegistry = new SimpleMeterRegistry();
        properties = new ContractProperties();
        ObjectMapper objectMapper = new ObjectMapper();
        factory = new ContractEnforcerFactory(
                new ResponseNormalizer(objectMapper),
                new ResponseValidator(clock),
                new SuspiciousBehaviorDetector(),
                sink,
                properties,
                meterRegistry,
                clock
        );
        enforcer = factory.create(ContractFixtures.tradingSpec());
    }

    @Test
    void enforce_shouldReturnValidatedResponseAndCoolTemperature() {
        List<Double> temperatures = new ArrayList<>();
        AgentCall agent = (request, temperature) -> {
            temperatures.add(temperature);
            return ContractFixtures.validResponse("BUY", "high");
        };

        Map<String, Object> result = enforcer.enforce(agent, AgentCallRequest.builder().arg("AAPL").build());

        assertEquals("BUY", result.get("decision"));
        assertEquals("Momentum is strong", result.get("summary"));
        assertFalse(result.containsKey("flagged_for_review"));
        assertEquals(1, temperatures.size());
        assertEquals(0.4D, temperatures.get(0), EPS);
        assertEquals(0.3D, enforcer.temperatureController().getTemperature(), EPS);
        assertEquals(0, enforcer.healthMonitor().strikeCount());
        verifyNoInteractions(sink);
    }

    @Test
    void enforce_shouldFallBackWithPiiReasonAfterRetriesExhausted() {
        AtomicInteger calls = new AtomicInteger();
        AgentCall agent = (request, temperature) -> {
            calls.incrementAndGet();
            Map<String, Object> response = ContractFixtures.validResponse("BUY", "high");
            response.put("reasoning", "Ask jane.doe@example.com");
            return response;
        };

        Map<String, Object> result = enforcer.enforce(agent, AgentCallRequest.builder().build());

        assertEquals(2, calls.get());
        assertEquals("unknown", result.get("decision"));
        assertEquals("low", result.get("confidence"));
        assertEquals("Unable to analyze", result.get("summary"));
        assertTrue(String.valueOf(result.get("reasoning")).contains("pii"));
        assertEquals(Boolean.FALSE, result.get("flagged_for_review"));
        assertTrue(result.containsKey("strike_reason"));
        assertEquals(2, enforcer.healthMonitor().strikeCount());
        assertEquals(1.0D, meterRegistry.get("contract.enforce.fallback").tag("role", "trader").counter().count(), EPS);
        ContractEvent escalation = publishedEvents().stream()
                .filter(event -> "escalation".equals(event.eventType()))
                .findFirst()
                .orElseThrow();
        assertEquals("unexpected_output", escalation.data().get("reason"));
        assertEquals("flag_for_review", escalation.data().get("action"));
    }

    @Test
    void enforce_shouldFallBackWhenAgentThrowsError() {
        AtomicInteger calls = new AtomicInteger();
        AgentCall agent = (request, temperature) -> {
            calls.incrementAndGet();
            throw new AssertionError("agent bug");
        };

        Map<String, Object> result = enforcer.enforce(agent, AgentCallRequest.builder().build());

        assertEquals(2, calls.get());
        assertEquals("unknown", result.get("decision"));
        assertTrue(String.valueOf(result.get("reasoning")).contains("agent bug"));
        assertEquals(2, enforcer.healthMonitor().strikeCount());
    }

    @Test
    void enforce_shouldFallBackWhenCollaboratorThrowsError() {
        ContractEnforcer broken = new ContractEnforcer(
                ContractFixtures.tradingSpec(),
                new HealthMonitor(ContractFixtures.tradingSpec().health(), clock),
                new TemperatureController(ContractFixtures.tradingSpec().temperatureControl()),
                new ResponseNormalizer(new ObjectMapper()) {
                    @Override
                    public Optional<Map<String, Object>> normalize(Object raw) {
                        throw new NoClassDefFoundError("com/fasterxml/jackson/Missing");
                    }
                },
                new ResponseValidator(clock),
                new SuspiciousBehaviorDetector(),
                new EscalationHandler(ContractFixtures.tradingSpec(), sink, clock),
                clock,
                meterRegistry,
                true,
                true
        );

        Map<String, Object> result = broken.enforce(
                (request, temperature) -> ContractFixtures.validResponse("BUY", "high"),
                AgentCallRequest.builder().build());

        assertEquals("unknown", result.get("decision"));
        assertTrue(String.valueOf(result.get("reasoning")).contains("unexpected error"));
    }

    @Test
    void enforce_shouldFallBackWhenRequiredFieldMissing() {
        AgentCall agent = (request, temperature) -> Map.of("decision", "BUY", "summary", "s", "reasoning", "r");

        Map<String, Object> result = enforcer.enforce(agent, AgentCallRequest.builder().build());

        assertEquals("unknown", result.get("decision"));
        assertEquals("low", result.get("confidence"));
        assertTrue(String.valueOf(result.get("reasoning")).contains("confidence"));
    }

    @Test
    void enforce_shouldFallBackWithTimeoutReasonWhenAgentIsSlow() {
        AgentCall agent = (request, temperature) -> {
            clock.advanceMillis(6000L);
            return ContractFixtures.validResponse("BUY", "high");
        };

        Map<String, Object> result = enforcer.enforce(agent, AgentCallRequest.builder().build());

        String reasoning = String.valueOf(result.get("reasoning"));
        assertTrue(reasoning.contains("exceeded"));
        assertTrue(reasoning.contains("timeout"));
    }

    @Test
    void enforce_shouldFallBackWithErrorReasonWhenAgentThrows() {
        AtomicInteger calls = new AtomicInteger();
        AgentCall agent = (request, temperature) -> {
            calls.incrementAndGet();
            throw new IllegalStateException("upstream unavailable");
        };

        Map<String, Object> result = enforcer.enforce(agent, AgentCallRequest.builder().build());

        assertEquals(2, calls.get());
        assertEquals("unknown", result.get("decision"));
        assertTrue(String.valueOf(result.get("reasoning")).contains("error"));
        assertTrue(String.valueOf(result.get("reasoning")).contains("upstream unavailable"));
        assertEquals(0.6D, enforcer.temperatureController().getTemperature(), EPS);
        List<ContractEvent> events = publishedEvents();
        assertEquals(2, events.stream().filter(event -> "error".equals(event.eventType())).count());
        assertTrue(events.stream().anyMatch(event -> "escalation".equals(event.eventType())
                && "flag_for_review".equals(event.data().get("action"))));
    }

    @Test
    void enforce_shouldRecoverOnRetry() {
        List<Double> temperatures = new ArrayList<>();
        AtomicInteger calls = new AtomicInteger();
        AgentCall agent = (request, temperature) -> {
            temperatures.add(temperature);
            return calls.incrementAndGet() == 1
                    ? "not json at all"
                    : ContractFixtures.validResponse("HOLD", "medium");
        };

        Map<String, Object> result = enforcer.enforce(agent, AgentCallRequest.builder().build());

        assertEquals("HOLD", result.get("decision"));
        assertEquals(1, enforcer.healthMonitor().strikeCount());
        assertEquals(0.4D, temperatures.get(0), EPS);
        assertEquals(0.5D, temperatures.get(1), EPS);
        assertEquals(0.4D, enforcer.temperatureController().getTemperature(), EPS);
    }

    @Test
    void enforce_shouldCallAgentOnceWhenNoRetriesAllowed() {
        ContractEnforcer noRetry = factory.create(ContractFixtures.withRetries(ContractFixtures.tradingSpec(), 0));
        AtomicInteger calls = new AtomicInteger();
        AgentCall agent = (request, temperature) -> {
            calls.incrementAndGet();
            return "[]";
        };

        Map<String, Object> result = noRetry.enforce(agent, AgentCallRequest.builder().build());

        assertEquals(1, calls.get());
        assertEquals("Fallback due to: " + ContractEnforcer.REASON_UNPARSEABLE, result.get("reasoning"));
    }

    @Test
    void enforce_shouldSkipAgentWhenUnhealthy() {
        enforcer.healthMonitor().addStrike("a");
        enforcer.healthMonitor().addStrike("b");
        enforcer.healthMonitor().addStrike("c");
        AtomicInteger calls = new AtomicInteger();
        AgentCall agent = (request, temperature) -> {
            calls.incrementAndGet();
            return ContractFixtures.validResponse("BUY", "high");
        };

        Map<String, Object> result = enforcer.enforce(agent, AgentCallRequest.builder().build());

        assertEquals(0, calls.get());
        assertEquals("unknown", result.get("decision"));
        assertTrue(String.valueOf(result.get("reasoning")).contains(ContractEnforcer.REASON_UNHEALTHY));
        ContractEvent event = publishedEvents().get(0);
        assertEquals("health_check", event.eventType());
        assertEquals("unhealthy", event.data().get("status"));
    }

    @Test
    void enforce_shouldFlagSuspiciousDecisionFlipAndRecordStrike() {
        AgentCallRequest request = AgentCallRequest.builder()
                .kwarg("memory", List.of(MemoryEntry.of("decision", "BUY", "high")))
                .build();
        AgentCall agent = (req, temperature) -> ContractFixtures.validResponse("SELL", "high");

        Map<String, Object> result = enforcer.enforce(agent, request);

        assertEquals("SELL", result.get("decision"));
        assertEquals(Boolean.TRUE, result.get("flagged_for_review"));
        assertEquals("High confidence decision changed from BUY to SELL", result.get("strike_reason"));
        assertEquals(1, enforcer.healthMonitor().strikeCount());
        assertEquals(ContractEnforcer.STRIKE_SUSPICIOUS, enforcer.healthMonitor().strikes().get(0).reason());
        assertEquals(1.0D, meterRegistry.get("contract.enforce.flagged").tag("role", "trader").counter().count(), EPS);
        ContractEvent event = publishedEvents().get(0);
        assertEquals("escalation", event.eventType());
        assertEquals("unexpected_output", event.data().get("reason"));
        assertEquals("flag_for_review", event.data().get("action"));
    }

    @Test
    void enforce_shouldNotStrikeSuspiciousResponseWhenDisabled() {
        properties.getEnforcer().setSuspiciousCountsAsStrike(false);
        ContractEnforcer lenientEnforcer = factory.create(ContractFixtures.tradingSpec());
        AgentCallRequest request = AgentCallRequest.builder()
                .context(Map.of("memory", List.of(MemoryEntry.of("decision", "BUY", "high"))))
                .build();

        Map<String, Object> result = lenientEnforcer.enforce(
                (req, temperature) -> ContractFixtures.validResponse("SELL", "high"), request);

        assertEquals(Boolean.TRUE, result.get("flagged_for_review"));
        assertEquals(0, lenientEnforcer.healthMonitor().strikeCount());
    }

    @Test
    void enforce_shouldIgnoreEventSinkFailures() {
        doThrow(new IllegalStateException("sink down")).when(sink).publish(any());
        AgentCall agent = (request, temperature) -> {
            throw new IllegalArgumentException("bad input");
        };

        Map<String, Object> result = enforcer.enforce(agent, AgentCallRequest.builder().build());

        assertEquals("unknown", result.get("decision"));
        assertTrue(String.valueOf(result.get("reasoning")).contains("bad input"));
    }

    @Test
    void enforce_shouldPassNoTemperatureToAgentThatIgnoresIt() {
        List<Double> temperatures = new ArrayList<>();
        AgentCall agent = new AgentCall() {
            @Override
            public Object call(AgentCallRequest request, Double temperature) {
                temperatures.add(temperature);
                return ContractFixtures.validResponse("BUY", "low");
            }

            @Override
            public boolean acceptsTemperature() {
                return false;
            }
        };

        enforcer.enforce(agent, AgentCallRequest.builder().build());
        Map<String, Object> result = enforcer.enforce(
                AgentCall.ignoringTemperature(request -> ContractFixtures.validResponse("HOLD", "low")),
                AgentCallRequest.builder().build());

        assertEquals(1, temperatures.size());
        assertNull(temperatures.get(0));
        assertEquals("HOLD", result.get("decision"));
    }

    @Test
    void enforce_shouldFillEveryRequiredFieldInFallback() {
        ContractSpec spec = ContractFixtures.tradingSpec();
        List<String> required = new ArrayList<>(spec.responseContract().requiredFields());
        required.add("risk_score");
        ContractEnforcer strict = factory.create(spec.toBuilder()
                .responseContract(spec.responseContract().toBuilder().requiredFields(required).build())
                .build());

        Map<String, Object> result = strict.enforce(
                (request, temperature) -> ContractFixtures.validResponse("BUY", "high"),
                AgentCallRequest.builder().build());

        for (String field : required) {
            assertTrue(result.containsKey(field), field);
        }
        assertNull(result.get("risk_score"));
    }

    @Test
    void enforce_shouldParseFencedTextOutput() {
        AgentCall agent = (request, temperature) -> """
                ```json
                {"decision": "SELL", "confidence": "medium", "summary": "s", "reasoning": "r"}
                ```""";

        Map<String, Object> result = enforcer.enforce(agent, AgentCallRequest.builder().build());

        assertEquals("SELL", result.get("decision"));
    }

    @Test
    void enforce_shouldWarnWhenRetriesExceedBudgetInTotal() {
        AtomicInteger calls = new AtomicInteger();
        AgentCall agent = (request, temperature) -> {
            clock.advanceMillis(3000L);
            return calls.incrementAndGet() == 1
                    ? Map.of("decision", "BUY")
                    : ContractFixtures.validResponse("BUY", "medium");
        };

        Map<String, Object> result = enforcer.enforce(agent, AgentCallRequest.builder().build());

        assertEquals("BUY", result.get("decision"));
        assertTrue(publishedEvents().stream().anyMatch(event -> "performance_warning".equals(event.eventType())));
    }

    @Test
    void wrap_shouldBindAgentAndRecordDuration() {
        Function<AgentCallRequest, Map<String, Object>> wrapped =
                enforcer.wrap((request, temperature) -> ContractFixtures.validResponse("BUY", "medium"));

        wrapped.apply(AgentCallRequest.builder().build());
        wrapped.apply(null);

        assertEquals(2L, meterRegistry.get("contract.enforce.duration").tag("role", "trader").timer().count());
    }

    private List<ContractEvent> publishedEvents() {
        ArgumentCaptor<ContractEvent> captor = ArgumentCaptor.forClass(ContractEvent.class);
        verify(sink, atLeastOnce()).publish(captor.capture());
        return captor.getAllValues();
    }
}
