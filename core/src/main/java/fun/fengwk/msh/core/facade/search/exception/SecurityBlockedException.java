package fun.fengwk.msh.core.facade.search.exception;

/**
 * Request or result content was blocked by the security policy.
 *
 * <p>Fatal for the query: neither retried nor failed over.
 *
 * @author fengwk
 */
public class SecurityBlockedException extends SearchProviderException {

    public SecurityBlockedException(String message) {
        super(message);
    }

}
