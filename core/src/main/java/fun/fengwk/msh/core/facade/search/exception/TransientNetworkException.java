package fun.fengwk.msh.core.facade.search.exception;

/**
 * Connection or timeout failure which outlived the transport retries.
 *
 * @author fengwk
 */
public class TransientNetworkException extends SearchProviderException {

    public TransientNetworkException(String message, Throwable cause) {
        super(message, cause);
    }

}
