package warden.adapter.in.dto;

/**
 * DTO for releasing a reserved amount after a downstream failure.
 *
 * @param amount amount to release in the smallest currency unit
 */
public record ReversalRequest(Long amount) {}
