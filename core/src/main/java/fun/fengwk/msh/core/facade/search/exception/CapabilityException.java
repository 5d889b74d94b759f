package fun.fengwk.msh.core.facade.search.exception;

/**
 * Requested search type is not supported by the provider(s).
 *
 * @author fengwk
 */
public class CapabilityException extends SearchProviderException {

    public CapabilityException(String message) {
        super(message);
    }

}
