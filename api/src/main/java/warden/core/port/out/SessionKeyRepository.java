package warden.core.port.out;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import warden.core.model.session.SessionKey;
import warden.core.model.session.SessionKeyStatus;
import warden.core.model.session.UpdateOutcome;

/**
 * Outbound port for session key storage.
 *
 * <p>Session keys are never deleted; termination is a status transition.
 * Every write after the initial insert is conditional on the stored version.
 *
 * <p>Implementations maintain a per-wallet index of the single session key in
 * an enforceable status ({@code ACTIVE} or {@code RENEWING}) and refuse writes
 * that would give a wallet a second one.
 */
public interface SessionKeyRepository {

    /**
     * Store a new session key only if the ID does not already exist.
     *
     * @param sessionKey session key to store
     * @return true if stored, false if the ID is taken
     */
    Uni<Boolean> insertIfAbsent(SessionKey sessionKey);

    /**
     * Retrieve a session key by ID.
     *
     * @param sessionKeyId session key identifier
     * @return the session key, or empty if not found
     */
    Uni<Optional<SessionKey>> findById(String sessionKeyId);

    /**
     * Replace a session key if its stored version equals {@code expectedVersion}.
     *
     * <p>Implementation notes:
     * <ul>
     *   <li>Redis: Lua script comparing the version field before writing</li>
     *   <li>In-Memory: ConcurrentHashMap.compute()</li>
     * </ul>
     *
     * @param updated         the new record, carrying {@code expectedVersion + 1}
     * @param expectedVersion version the caller read
     * @return whether the update was applied
     */
    Uni<UpdateOutcome> compareAndSet(SessionKey updated, long expectedVersion);

    /**
     * List every session key of a wallet, newest first.
     */
    Uni<List<SessionKey>> findByWallet(String walletId);

    /**
     * Find the wallet's session key in an enforceable status, if any.
     */
    Uni<Optional<SessionKey>> findEnforceableByWallet(String walletId);

    /**
     * List session keys in any of the given statuses.
     *
     * <p>Used by the renewal scheduler to find candidates for renewal and expiry.
     */
    Uni<List<SessionKey>> findByStatus(Collection<SessionKeyStatus> statuses);
}
