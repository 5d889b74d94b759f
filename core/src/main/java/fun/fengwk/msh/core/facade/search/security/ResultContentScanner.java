package fun.fengwk.msh.core.facade.search.security;

/**
 * Inspects result text before it is returned to the caller.
 *
 * @author fengwk
 */
public interface ResultContentScanner {

    /**
     * @param content title and description of one result
     * @param providerName provider which produced the content
     */
    ScanResult scan(String content, String providerName);

}
