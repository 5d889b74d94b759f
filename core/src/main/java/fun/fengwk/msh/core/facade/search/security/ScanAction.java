package fun.fengwk.msh.core.facade.search.security;

/**
 * @author fengwk
 */
public enum ScanAction {

    ALLOW,
    WARN,
    BLOCK

}
