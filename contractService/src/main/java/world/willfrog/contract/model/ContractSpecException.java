package world.willfrog.contract.model;

/**
 * Raised when a contract specification is malformed. Only thrown while a contract is
 * being built or loaded, never while a call is enforced.
 */
public class ContractSpecException extends RuntimeException {

    public ContractSpecException(String message) {
        super(message);
    }

    public ContractSpecException(String message, Throwable cause) {
        super(message, cause);
    }
}
