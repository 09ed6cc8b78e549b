package lab.reconciler.adapter;

/**
 * Transient chain-side failure (timeout, connection refused, node error page). Never a
 * verdict about a transaction.
 */
public class RpcUnavailableException extends RuntimeException {

    private final String chain;

    public RpcUnavailableException(String chain, String message, Throwable cause) {
        super(chain + ": " + message, cause);
        this.chain = chain;
    }

    public RpcUnavailableException(String chain, String message) {
        this(chain, message, null);
    }

    public String getChain() {
        return chain;
    }
}
