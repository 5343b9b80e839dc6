package replay;

/**
 * Side of the migration a failure belongs to, so upper layers can tell target
 * database faults apart from source side faults.
 */
public enum ErrorScope {
    NOT_SET,
    UPSTREAM,
    DOWNSTREAM,
    INTERNAL
}
