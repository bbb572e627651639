package warden.core.service.session;

import io.smallrye.mutiny.Uni;

import warden.adapter.out.storage.memory.InMemorySessionKeyRepository;
import warden.core.model.session.SessionKey;
import warden.core.model.session.UpdateOutcome;

/**
 * In-memory repository whose next {@code staleWrites} conditional updates lose to a concurrent writer.
 */
class ContendedSessionKeyRepository extends InMemorySessionKeyRepository {

    int staleWrites;

    @Override
    public Uni<UpdateOutcome> compareAndSet(SessionKey updated, long expectedVersion) {
        if (staleWrites > 0) {
            staleWrites--;
            return Uni.createFrom().item(UpdateOutcome.STALE);
        }
        return super.compareAndSet(updated, expectedVersion);
    }
}
