package world.willfrog.contract.agent;

import world.willfrog.contract.model.AgentCallRequest;

/**
 * The wrapped agent. Implementations may block, throw, or return a map or text; the enforcer
 * treats the call as opaque.
 */
@FunctionalInterface
public interface AgentCall {

    /**
     * @param request     arguments of this invocation
     * @param temperature sampling temperature chosen by the enforcer, {@code null} when
     *                    {@link #acceptsTemperature()} is false
     */
    Object call(AgentCallRequest request, Double temperature) throws Exception;

    default boolean acceptsTemperature() {
        return true;
    }

    /**
     * Adapts an agent body that has no notion of temperature.
     */
    static AgentCall ignoringTemperature(Body body) {
        return new AgentCall() {
            @Override
            public Object call(AgentCallRequest request, Double temperature) throws Exception {
                return body.call(request);
            }

            @Override
            public boolean acceptsTemperature() {
                return false;
            }
        };
    }

    @FunctionalInterface
    interface Body {
        Object call(AgentCallRequest request) throws Exception;
    }
}
