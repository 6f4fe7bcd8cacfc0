package org.overlaynet.network;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Services advertised by each peer identity.
 * <p>
 * Entries are kept whether or not the identity is currently verified,
 * so announcements that arrive before a handshake completes are not lost.
 * <p>
 * Not thread-safe: {@link PeerRegistry} serializes all access.
 */
public class ServiceIndex {

    private final Map<IdentityKey, Set<ServiceId>> servicesByIdentity = new HashMap<>();

    /**
     * Merges services into the set recorded for an identity.
     *
     * @param identityKey the advertising identity
     * @param services services to add to its set
     * @return the number of services that were not already recorded
     */
    public int merge(IdentityKey identityKey, Collection<ServiceId> services) {
        Set<ServiceId> known = this.servicesByIdentity.computeIfAbsent(identityKey, key -> new LinkedHashSet<>());

        int added = 0;
        for (ServiceId service : services)
            if (known.add(service))
                ++added;

        // Don't keep empty entries around for identities that advertised nothing
        if (known.isEmpty())
            this.servicesByIdentity.remove(identityKey);

        return added;
    }

    /**
     * Returns services recorded for an identity.
     *
     * @param identityKey the identity to look up
     * @return read-only copy of the recorded services, empty if none
     */
    public Set<ServiceId> get(IdentityKey identityKey) {
        Set<ServiceId> known = this.servicesByIdentity.get(identityKey);
        if (known == null)
            return Collections.emptySet();

        return Collections.unmodifiableSet(new LinkedHashSet<>(known));
    }

    /**
     * Checks whether an identity advertises a service.
     *
     * @param identityKey the identity to check
     * @param service the service to look for
     * @return {@code true} if the service is recorded for the identity
     */
    public boolean provides(IdentityKey identityKey, ServiceId service) {
        Set<ServiceId> known = this.servicesByIdentity.get(identityKey);
        return known != null && known.contains(service);
    }

    /**
     * Forgets all services of an identity.
     *
     * @param identityKey the identity to forget
     * @return {@code true} if anything was recorded
     */
    public boolean remove(IdentityKey identityKey) {
        return this.servicesByIdentity.remove(identityKey) != null;
    }

    /**
     * Returns the number of identities with at least one recorded service.
     *
     * @return identity count
     */
    public int size() {
        return this.servicesByIdentity.size();
    }
}
