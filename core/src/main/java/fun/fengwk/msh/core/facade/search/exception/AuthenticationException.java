package fun.fengwk.msh.core.facade.search.exception;

/**
 * Invalid or missing credentials (HTTP 401/403).
 *
 * @author fengwk
 */
public class AuthenticationException extends SearchProviderException {

    public AuthenticationException(String message) {
        super(message);
    }

}
