package io.keydigger.core.resolve;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.keydigger.api.keys.KeyPaths;
import io.keydigger.api.keys.KeyStore;
import io.keydigger.core.pattern.Cardinality;
import io.keydigger.core.pattern.Completeness;
import io.keydigger.core.pattern.KeyMatch;
import io.keydigger.core.pattern.KeyPattern;
import io.keydigger.core.pattern.KeyTemplate;
import io.keydigger.core.pattern.PatternSpec;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/// Turns the keys of a {@link KeyStore} into {@link WorkUnit}s for one {@link PatternSpec}.
///
/// Resolution only looks at key names. It never reads values, never mutates the store, and
/// returns the same units in the same order for an unchanged store.
///
/// Every key is matched against the primary pattern. A match is placed in a group by its grouping
/// captures and in a variant by its remaining captures. With {@link Cardinality#SINGLE} every
/// primary match becomes one unit. With {@link Cardinality#MULTI} every distinct group and variant
/// combination is completed with all companion matches of its group, and kept only if its
/// {@link Completeness} rule holds. Incomplete combinations are dropped without error.
///
/// A companion belongs to a group when the grouping captures it shares with the primary pattern
/// carry the group's values. A companion which shares none of them belongs to its key's own group.
///
/// Groups are emitted in order of their first primary match, and variants within a group in
/// order of their first match. Companion keys follow the primary keys in pattern order, sorted
/// within each pattern.
public class Resolver {
    private static final Logger logger = LogManager.getLogger(Resolver.class);

    private final PatternSpec spec;

    /// @param spec a validated spec, see {@link PatternSpec#builder()}
    public Resolver(PatternSpec spec) {
        this.spec = Objects.requireNonNull(spec, "spec");
    }

    /// Resolve a spec once.
    /// @param store the keys to resolve against
    /// @param spec the spec to resolve
    /// @return the work units, possibly empty
    public static List<WorkUnit> resolve(KeyStore store, PatternSpec spec) {
        return new Resolver(spec).resolve(store);
    }

    public PatternSpec spec() {
        return spec;
    }

    /// @param store the keys to resolve against
    /// @return the work units, possibly empty
    public List<WorkUnit> resolve(KeyStore store) {
        List<String> keys = store.keys();
        Map<String, Map<List<String>, List<KeyMatch>>> primaries = matchPrimaries(keys);
        if (primaries.isEmpty()) {
            logger.debug("No key of {} matches primary pattern {} of {}", store.location(), spec.primary(), spec.name());
            return List.of();
        }

        Map<String, List<Set<String>>> companions = spec.cardinality() == Cardinality.MULTI
            ? matchCompanions(keys, primaries)
            : Map.of();

        List<WorkUnit> units = new ArrayList<>();
        for (Map.Entry<String, Map<List<String>, List<KeyMatch>>> byGroup : primaries.entrySet()) {
            String group = byGroup.getKey();
            for (Map.Entry<List<String>, List<KeyMatch>> byVariant : byGroup.getValue().entrySet()) {
                List<KeyMatch> matches = byVariant.getValue();
                if (spec.cardinality() == Cardinality.SINGLE) {
                    for (KeyMatch match : matches) {
                        candidate(group, List.of(match), List.of(), store).ifPresent(units::add);
                    }
                } else {
                    List<Set<String>> perPattern = companions.get(group);
                    if (spec.completeness().isAll() && hasUnmatchedCompanion(perPattern)) {
                        logger.debug("Dropping {} {} of group '{}': a companion pattern has no match",
                            spec.name(), byVariant.getKey(), group);
                        continue;
                    }
                    candidate(group, matches, perPattern, store).ifPresent(units::add);
                }
            }
        }
        logger.debug("Resolved {} work units for {} from {} keys of {}",
            units.size(), spec.name(), keys.size(), store.location());
        return units;
    }

    private Map<String, Map<List<String>, List<KeyMatch>>> matchPrimaries(List<String> keys) {
        KeyPattern primary = spec.primary();
        Map<String, Map<List<String>, List<KeyMatch>>> primaries = new LinkedHashMap<>();
        for (String key : keys) {
            Optional<KeyMatch> matched = primary.match(key);
            if (matched.isEmpty()) {
                continue;
            }
            KeyMatch match = matched.get();
            primaries.computeIfAbsent(groupOf(primary, match), g -> new LinkedHashMap<>())
                .computeIfAbsent(variantOf(match), v -> new ArrayList<>())
                .add(match);
        }
        return primaries;
    }

    /// @return for each group, the sorted keys matched by each companion pattern
    private Map<String, List<Set<String>>> matchCompanions(List<String> keys,
                                                           Map<String, Map<List<String>, List<KeyMatch>>> primaries) {
        List<KeyPattern> patterns = spec.companions();
        Map<String, Map<String, String>> groupCaptures = new LinkedHashMap<>();
        Map<String, List<Set<String>>> companions = new LinkedHashMap<>();
        for (Map.Entry<String, Map<List<String>, List<KeyMatch>>> byGroup : primaries.entrySet()) {
            KeyMatch first = byGroup.getValue().values().iterator().next().get(0);
            groupCaptures.put(byGroup.getKey(), groupCapturesOf(spec.primary(), first));
            List<Set<String>> perPattern = new ArrayList<>(patterns.size());
            for (int i = 0; i < patterns.size(); i++) {
                perPattern.add(new TreeSet<>());
            }
            companions.put(byGroup.getKey(), perPattern);
        }
        for (int i = 0; i < patterns.size(); i++) {
            KeyPattern pattern = patterns.get(i);
            for (String key : keys) {
                Optional<KeyMatch> matched = pattern.match(key);
                if (matched.isEmpty()) {
                    continue;
                }
                for (Map.Entry<String, List<Set<String>>> byGroup : companions.entrySet()) {
                    String group = byGroup.getKey();
                    if (inGroup(pattern, matched.get(), group, groupCaptures.get(group))) {
                        byGroup.getValue().get(i).add(key);
                    }
                }
            }
        }
        return companions;
    }

    private static boolean hasUnmatchedCompanion(List<Set<String>> perPattern) {
        for (Set<String> matched : perPattern) {
            if (matched.isEmpty()) {
                return true;
            }
        }
        return false;
    }

    private Optional<WorkUnit> candidate(String group, List<KeyMatch> matches, List<Set<String>> perPattern,
                                         KeyStore store) {
        LinkedHashSet<String> primaryKeys = new LinkedHashSet<>();
        for (KeyMatch match : matches) {
            primaryKeys.add(match.key());
        }
        for (Set<String> matched : perPattern) {
            primaryKeys.addAll(matched);
        }

        KeyMatch first = matches.get(0);
        List<String> auxiliaryKeys = auxiliaryKeys(group, first);
        if (!spec.completeness().isAll()
            && !satisfiesRequirements(group, groupCapturesOf(spec.primary(), first), primaryKeys, auxiliaryKeys, store)) {
            logger.debug("Dropping {} {} of group '{}': completeness {} not met",
                spec.name(), first.key(), group, spec.completeness());
            return Optional.empty();
        }
        String label = spec.labeler().label(first);
        return Optional.of(new WorkUnit(group, new ArrayList<>(primaryKeys), auxiliaryKeys, label));
    }

    private boolean satisfiesRequirements(String group, Map<String, String> groupCaptures, Set<String> primaryKeys,
                                          List<String> auxiliaryKeys, KeyStore store) {
        List<String> candidates = new ArrayList<>(primaryKeys);
        for (String key : auxiliaryKeys) {
            if (store.contains(key)) {
                candidates.add(key);
            }
        }
        for (KeyPattern requirement : spec.completeness().requirements()) {
            boolean grouped = spec.groupingNames().stream().anyMatch(requirement::hasName);
            boolean satisfied = false;
            for (String key : candidates) {
                Optional<KeyMatch> matched = requirement.match(key);
                if (matched.isPresent() && (!grouped || inGroup(requirement, matched.get(), group, groupCaptures))) {
                    satisfied = true;
                    break;
                }
            }
            if (!satisfied) {
                return false;
            }
        }
        return true;
    }

    private List<String> auxiliaryKeys(String group, KeyMatch primary) {
        LinkedHashSet<String> rendered = new LinkedHashSet<>();
        for (KeyTemplate template : spec.auxiliary()) {
            boolean renderable = true;
            for (String token : template.requiredTokens()) {
                if (!token.equals(PatternSpec.GROUP_TOKEN) && !primary.captures().containsKey(token)) {
                    renderable = false;
                }
            }
            if (!renderable) {
                logger.debug("Skipping auxiliary key {} for {}: a required capture has no value", template, primary.key());
                continue;
            }
            rendered.add(template.render(
                token -> token.equals(PatternSpec.GROUP_TOKEN) ? group : primary.captures().get(token)));
        }
        return new ArrayList<>(rendered);
    }

    /// The group value of a match: its grouping captures joined with `/`, or the key's own
    /// group when the pattern has no grouping capture.
    private String groupOf(KeyPattern pattern, KeyMatch match) {
        Map<String, String> captures = groupCapturesOf(pattern, match);
        if (captures.isEmpty()) {
            return KeyPaths.groupOf(match.key());
        }
        return String.join(String.valueOf(KeyPaths.SEPARATOR), captures.values());
    }

    /// @return the grouping captures declared by the pattern which took part in the match
    private Map<String, String> groupCapturesOf(KeyPattern pattern, KeyMatch match) {
        Map<String, String> captures = new LinkedHashMap<>();
        for (String name : spec.groupingNames()) {
            if (pattern.hasName(name) && match.captures().containsKey(name)) {
                captures.put(name, match.capture(name));
            }
        }
        return captures;
    }

    /// A match is in a group when every grouping capture it shares with the group has the
    /// group's value. Without shared captures, its group value must equal the group.
    private boolean inGroup(KeyPattern pattern, KeyMatch match, String group, Map<String, String> groupCaptures) {
        boolean shared = false;
        for (Map.Entry<String, String> capture : groupCapturesOf(pattern, match).entrySet()) {
            String expected = groupCaptures.get(capture.getKey());
            if (expected != null) {
                if (!expected.equals(capture.getValue())) {
                    return false;
                }
                shared = true;
            }
        }
        return shared || groupOf(pattern, match).equals(group);
    }

    private List<String> variantOf(KeyMatch match) {
        List<String> variant = new ArrayList<>(spec.variantNames().size());
        for (String name : spec.variantNames()) {
            variant.add(match.capture(name));
        }
        return variant;
    }

    @Override
    public String toString() {
        return "Resolver{" + spec.name() + "}";
    }
}
