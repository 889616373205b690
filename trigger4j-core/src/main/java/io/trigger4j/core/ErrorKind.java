package io.trigger4j.core;

/**
 * Coarse error classification handed to callers so an outer layer can map it to a status code.
 * <ul>
 *   <li>VALIDATION: the caller's input is wrong and can be fixed by resubmitting</li>
 *   <li>NOT_FOUND: the addressed resource does not exist for this owner</li>
 *   <li>INTERNAL: transient failure of a collaborator; retrying may succeed</li>
 * </ul>
 */
public enum ErrorKind {
    VALIDATION,
    NOT_FOUND,
    INTERNAL
}
