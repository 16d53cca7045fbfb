package de.bsommerfeld.tscache.db.equivalence;

import com.google.inject.Singleton;
import de.bsommerfeld.tscache.core.domain.SubjectRef;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** Non-persistent {@link LinkStore} for TEST mode and unit tests. */
@Singleton
public class InMemoryLinkStore implements LinkStore {

    private final List<EquivalenceLink> links = new ArrayList<>();
    private long nextId = 1;

    @Override
    public synchronized long activate(SubjectRef seed, SubjectRef target, String createdBy, String reason,
            Instant at) {
        for (int i = 0; i < links.size(); i++) {
            EquivalenceLink l = links.get(i);
            if (l.seed().equals(seed) && l.target().equals(target)) {
                if (!l.active())
                    links.set(i, l.reactivated(createdBy, reason, at));
                return l.linkId();
            }
        }
        long id = nextId++;
        links.add(EquivalenceLink.created(id, seed, target, createdBy, reason, at));
        return id;
    }

    @Override
    public synchronized boolean deactivate(SubjectRef seed, SubjectRef target, String deactivatedBy, String reason,
            Instant at) {
        for (int i = 0; i < links.size(); i++) {
            EquivalenceLink l = links.get(i);
            if (l.active() && l.seed().equals(seed) && l.target().equals(target)) {
                links.set(i, l.deactivated(deactivatedBy, reason, at));
                return true;
            }
        }
        return false;
    }

    @Override
    public synchronized List<EquivalenceLink> linksTouching(SubjectRef ref, boolean includeInactive) {
        List<EquivalenceLink> result = new ArrayList<>();
        for (EquivalenceLink l : links) {
            if (l.touches(ref) && (includeInactive || l.active()))
                result.add(l);
        }
        return result;
    }

    @Override
    public synchronized List<EquivalenceLink> allLinks(boolean includeInactive) {
        List<EquivalenceLink> result = new ArrayList<>();
        for (EquivalenceLink l : links) {
            if (includeInactive || l.active())
                result.add(l);
        }
        return result;
    }
}
