package com.tazifor.popup.service;

import com.tazifor.popup.model.Campaign;
import com.tazifor.popup.model.Surface;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * PriorityResolver
 *
 * TOTAL ORDER: priority desc, then createdAt asc, then id asc. Two distinct
 * campaigns never compare equal, so the winner is the same on every node.
 *
 * Surfaces are independent: a BANNER candidate never competes with a
 * CENTER_MODAL candidate.
 */
@Component
public class PriorityResolver {

    public static final Comparator<Campaign> PRIORITY_ORDER = Comparator.<Campaign>comparingInt(Campaign::getEffectivePriority)
        .reversed()
        .thenComparing(Campaign::getCreatedAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
        .thenComparing(Campaign::getId, Comparator.nullsLast(Comparator.<String>naturalOrder()));

    private static final Comparator<Candidate> CANDIDATE_ORDER =
        Comparator.comparing(Candidate::getCampaign, PRIORITY_ORDER);

    /**
     * Candidates grouped by surface, best first. Surfaces without candidates are absent.
     * The head of each list is that surface's winner unless the cap store denies it.
     */
    public Map<Surface, List<Candidate>> rankBySurface(Collection<Candidate> candidates) {
        Map<Surface, List<Candidate>> ranked = new EnumMap<>(Surface.class);
        for (Candidate candidate : candidates) {
            ranked.computeIfAbsent(candidate.getSurface(), surface -> new ArrayList<>()).add(candidate);
        }
        ranked.values().forEach(list -> list.sort(CANDIDATE_ORDER));
        return ranked;
    }
}
