package world.willfrog.contract.service;

import world.willfrog.contract.model.ContractEvent;

/**
 * Append-only destination for contract events such as escalations and health checks.
 */
public interface ContractEventSink {

    void publish(ContractEvent event);
}
