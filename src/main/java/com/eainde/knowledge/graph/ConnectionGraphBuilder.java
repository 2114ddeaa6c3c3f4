package com.eainde.knowledge.graph;

import com.eainde.knowledge.model.Fact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;

/**
 * Computes, for every fact of a population, how many other facts are its
 * neighbours under {@link NeighborRule}.
 *
 * <h3>Indexed counting:</h3>
 * <pre>
 * facts    → profiles (every field the rule reads except origins) with multiplicities
 * profiles → candidate profiles from term, category, format and dependency buckets
 * pair     → linked regardless of origin: every member counts
 *            linked only with disjoint origins: members minus those sharing an origin
 * </pre>
 *
 * <p>Repeated matches of the same lexeme collapse into one profile, so the rule is
 * evaluated per pair of profiles instead of per pair of facts. The result equals
 * {@link #countNeighborsPairwise(List)}, which compares every pair.</p>
 *
 * <p>This class is pure logic with no Spring dependencies.</p>
 */
public class ConnectionGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(ConnectionGraphBuilder.class);

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * Indexed neighbour counts, position-aligned with {@code facts}.
     */
    public int[] countNeighbors(List<Fact> facts) {
        int n = facts.size();
        int[] counts = new int[n];
        if (n < 2) return counts;

        List<Profile> profiles = Profile.group(facts);
        ProfileIndex index = ProfileIndex.build(profiles);
        int[] stamp = new int[profiles.size()];
        long comparisons = 0;

        for (int p = 0; p < profiles.size(); p++) {
            Profile profile = profiles.get(p);
            int mark = p + 1;
            int unconditional = 0;
            List<Profile> conditional = new ArrayList<>();

            for (List<Integer> bucket : index.bucketsFor(profile.representative)) {
                for (int q : bucket) {
                    if (stamp[q] == mark) continue;
                    stamp[q] = mark;
                    comparisons++;
                    Profile other = profiles.get(q);
                    if (NeighborRule.linkedRegardlessOfOrigin(profile.representative, other.representative)) {
                        unconditional += other.size;
                    } else if (NeighborRule.linkedWhenOriginsDisjoint(profile.representative, other.representative)) {
                        conditional.add(other);
                    }
                }
            }

            // a profile always shares its subject with itself, so unconditional includes the fact's own profile
            for (OriginClass originClass : profile.originClasses.values()) {
                int count = unconditional - 1;
                for (Profile other : conditional) {
                    count += other.size - other.sharingAnyOf(originClass.origins);
                }
                for (int i : originClass.members) {
                    counts[i] = count;
                }
            }
        }

        log.debug("Neighbour counts for {} facts ({} profiles) computed with {} rule evaluations",
                n, profiles.size(), comparisons);
        return counts;
    }

    /**
     * Reference implementation comparing every pair.
     */
    public int[] countNeighborsPairwise(List<Fact> facts) {
        int n = facts.size();
        int[] counts = new int[n];
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                if (NeighborRule.areNeighbors(facts.get(i), facts.get(j))) {
                    counts[i]++;
                    counts[j]++;
                }
            }
        }
        return counts;
    }

    // =========================================================================
    //  Profiles
    // =========================================================================

    private record ProfileKey(String subject, String object, String categoryId, String format,
                              boolean validated, List<String> dependencies) {

        static ProfileKey of(Fact fact) {
            return new ProfileKey(fact.subject(), fact.object(), fact.categoryId(), fact.format(),
                    fact.validated(), fact.dependencies());
        }
    }

    /** Facts of one profile that also carry the same origin set. */
    private static final class OriginClass {
        private final SortedSet<String> origins;
        private final List<Integer> members = new ArrayList<>();

        private OriginClass(SortedSet<String> origins) {
            this.origins = origins;
        }
    }

    /** Facts the neighbour rule cannot tell apart except through their origins. */
    private static final class Profile {
        private final Fact representative;
        private final Map<SortedSet<String>, OriginClass> originClasses = new LinkedHashMap<>();
        private final Map<String, List<OriginClass>> byOrigin = new HashMap<>();
        private int size;

        private Profile(Fact representative) {
            this.representative = representative;
        }

        static List<Profile> group(List<Fact> facts) {
            Map<ProfileKey, Profile> byKey = new LinkedHashMap<>();
            for (int i = 0; i < facts.size(); i++) {
                Fact fact = facts.get(i);
                byKey.computeIfAbsent(ProfileKey.of(fact), k -> new Profile(fact)).add(fact, i);
            }
            return new ArrayList<>(byKey.values());
        }

        private void add(Fact fact, int position) {
            size++;
            OriginClass originClass = originClasses.get(fact.origins());
            if (originClass == null) {
                originClass = new OriginClass(fact.origins());
                originClasses.put(fact.origins(), originClass);
                for (String origin : fact.origins()) {
                    byOrigin.computeIfAbsent(origin, k -> new ArrayList<>()).add(originClass);
                }
            }
            originClass.members.add(position);
        }

        /** Members whose origin set intersects {@code origins}. */
        int sharingAnyOf(Set<String> origins) {
            if (origins.isEmpty()) return 0;
            Set<OriginClass> seen = new HashSet<>();
            int total = 0;
            for (String origin : origins) {
                for (OriginClass originClass : byOrigin.getOrDefault(origin, List.of())) {
                    if (seen.add(originClass)) {
                        total += originClass.members.size();
                    }
                }
            }
            return total;
        }
    }

    // =========================================================================
    //  Index
    // =========================================================================

    private static final class ProfileIndex {

        private final Map<String, List<Integer>> byTerm = new HashMap<>();
        private final Map<String, List<Integer>> byCategory = new HashMap<>();
        private final Map<String, List<Integer>> byFormat = new HashMap<>();
        /** category id -> profiles whose dependency list names it */
        private final Map<String, List<Integer>> byDependency = new HashMap<>();

        static ProfileIndex build(List<Profile> profiles) {
            ProfileIndex index = new ProfileIndex();
            for (int i = 0; i < profiles.size(); i++) {
                Fact fact = profiles.get(i).representative;
                add(index.byTerm, fact.subject(), i);
                if (!Objects.equals(fact.subject(), fact.object())) {
                    add(index.byTerm, fact.object(), i);
                }
                add(index.byCategory, fact.categoryId(), i);
                add(index.byFormat, fact.format(), i);
                for (String dependency : new HashSet<>(fact.dependencies())) {
                    add(index.byDependency, dependency, i);
                }
            }
            return index;
        }

        List<List<Integer>> bucketsFor(Fact fact) {
            List<List<Integer>> buckets = new ArrayList<>();
            addIfPresent(buckets, byTerm, fact.subject());
            addIfPresent(buckets, byTerm, fact.object());
            addIfPresent(buckets, byCategory, fact.categoryId());
            addIfPresent(buckets, byFormat, fact.format());
            addIfPresent(buckets, byDependency, fact.categoryId());
            for (String dependency : fact.dependencies()) {
                addIfPresent(buckets, byCategory, dependency);
            }
            return buckets;
        }

        private static void add(Map<String, List<Integer>> index, String key, int position) {
            index.computeIfAbsent(key, k -> new ArrayList<>()).add(position);
        }

        private static void addIfPresent(List<List<Integer>> buckets, Map<String, List<Integer>> index, String key) {
            List<Integer> bucket = index.get(key);
            if (bucket != null) buckets.add(bucket);
        }
    }
}
