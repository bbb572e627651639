package warden.adapter.in.dto;

/**
 * DTO for session key revocation requests.
 *
 * @param reason optional reason recorded on the session key
 */
public record RevokeSessionKeyRequest(String reason) {}
