package warden.core.model.session;

/**
 * One action of a multi-step agent operation.
 *
 * @param action requested action tag
 * @param amount amount in the smallest currency unit
 */
public record ExecutionStep(String action, long amount) {}
