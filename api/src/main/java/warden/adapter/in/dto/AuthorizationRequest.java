package warden.adapter.in.dto;

/**
 * DTO for agent authorization requests.
 *
 * @param action action tag, e.g. {@code transfer}
 * @param amount amount in the smallest currency unit
 */
public record AuthorizationRequest(String action, Long amount) {}
