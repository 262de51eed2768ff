package io.keydigger.core.pattern;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/// An immutable description of one work-unit shape.
///
/// - `patterns`: the primary pattern first, then any companion patterns
/// - `cardinality`: {@link Cardinality#SINGLE} for one pattern, {@link Cardinality#MULTI} for more
/// - `completeness`: {@link Completeness#ALL} or an explicit list of required expressions
/// - `auxiliary`: key templates attached to every work unit, such as `gtc/tstep` or
///   `[group]/mpsi+1`
/// - `labeler`: how the label is derived from the primary key
///
/// Named captures of the primary pattern which also appear in a companion pattern are the
/// grouping dimensions; the remaining captures of the primary pattern are variant dimensions.
/// When no capture is shared (always the case for a single pattern), the first capture of the
/// primary pattern is the grouping dimension. An explicit `groupBy` overrides both rules.
///
/// Instances are built with {@link #builder()}, which validates everything up front and
/// throws {@link PatternSpecException} for a malformed spec.
public final class PatternSpec {

    /// The token which auxiliary templates use for the group value
    public static final String GROUP_TOKEN = "group";

    private final String name;
    private final List<KeyPattern> patterns;
    private final Cardinality cardinality;
    private final Completeness completeness;
    private final List<KeyTemplate> auxiliary;
    private final Labeler labeler;
    private final List<String> groupingNames;
    private final List<String> variantNames;

    private PatternSpec(Builder builder, List<KeyPattern> patterns, Cardinality cardinality,
                        List<KeyTemplate> auxiliary, List<String> groupingNames, List<String> variantNames) {
        this.name = builder.name != null ? builder.name : patterns.get(0).source();
        this.patterns = patterns;
        this.cardinality = cardinality;
        this.completeness = builder.completeness;
        this.auxiliary = auxiliary;
        this.labeler = builder.labeler;
        this.groupingNames = groupingNames;
        this.variantNames = variantNames;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// @return the name of this spec, or the primary pattern when unnamed
    public String name() {
        return name;
    }

    public List<KeyPattern> patterns() {
        return patterns;
    }

    public KeyPattern primary() {
        return patterns.get(0);
    }

    public List<KeyPattern> companions() {
        return patterns.subList(1, patterns.size());
    }

    public Cardinality cardinality() {
        return cardinality;
    }

    public Completeness completeness() {
        return completeness;
    }

    public List<KeyTemplate> auxiliary() {
        return auxiliary;
    }

    public Labeler labeler() {
        return labeler;
    }

    /// @return the capture names whose values identify a group
    public List<String> groupingNames() {
        return groupingNames;
    }

    /// @return the capture names of the primary pattern which distinguish work units in a group
    public List<String> variantNames() {
        return variantNames;
    }

    @Override
    public String toString() {
        return "PatternSpec{" + name
            + ", patterns=" + patterns
            + ", cardinality=" + cardinality
            + ", completeness=" + completeness
            + ", auxiliary=" + auxiliary
            + ", labeler=" + labeler
            + "}";
    }

    /// Fluent builder for {@link PatternSpec}.
    public static final class Builder {
        private String name;
        private final List<String> patterns = new ArrayList<>();
        private Cardinality declaredCardinality;
        private Completeness completeness = Completeness.ALL;
        private final List<String> auxiliary = new ArrayList<>();
        private final List<String> groupBy = new ArrayList<>();
        private Labeler labeler = Labeler.firstCapture();

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /// Append patterns; the first one ever added is the primary pattern.
        public Builder patterns(String... regexes) {
            return patterns(List.of(regexes));
        }

        public Builder patterns(List<String> regexes) {
            this.patterns.addAll(regexes);
            return this;
        }

        /// Declare the cardinality; it must agree with the number of patterns.
        public Builder cardinality(Cardinality cardinality) {
            this.declaredCardinality = cardinality;
            return this;
        }

        public Builder completeness(Completeness completeness) {
            this.completeness = completeness == null ? Completeness.ALL : completeness;
            return this;
        }

        /// Shorthand for an explicit {@link Completeness} rule.
        public Builder requiring(String... regexes) {
            return completeness(Completeness.of(regexes));
        }

        public Builder auxiliary(String... templates) {
            return auxiliary(List.of(templates));
        }

        public Builder auxiliary(List<String> templates) {
            this.auxiliary.addAll(templates);
            return this;
        }

        /// Override the grouping dimensions with explicit capture names of the primary pattern.
        public Builder groupBy(String... names) {
            return groupBy(List.of(names));
        }

        public Builder groupBy(List<String> names) {
            this.groupBy.addAll(names);
            return this;
        }

        public Builder labeler(Labeler labeler) {
            this.labeler = labeler == null ? Labeler.firstCapture() : labeler;
            return this;
        }

        /// @return the validated spec
        /// @throws PatternSpecException if the spec is malformed
        public PatternSpec build() {
            if (patterns.isEmpty()) {
                throw new PatternSpecException(describe() + " has no patterns");
            }
            List<KeyPattern> compiled = new ArrayList<>(patterns.size());
            for (String regex : patterns) {
                compiled.add(KeyPattern.compile(regex));
            }
            Cardinality cardinality = Cardinality.forPatternCount(compiled.size());
            if (declaredCardinality != null && declaredCardinality != cardinality) {
                throw new PatternSpecException(describe() + " declares " + declaredCardinality
                    + " cardinality but has " + compiled.size() + " pattern(s)");
            }

            KeyPattern primary = compiled.get(0);
            List<String> grouping = groupingNames(primary, compiled);
            List<String> variants = new ArrayList<>(primary.names());
            variants.removeAll(grouping);

            List<KeyTemplate> templates = new ArrayList<>(auxiliary.size());
            for (String text : auxiliary) {
                KeyTemplate template = KeyTemplate.parse(text);
                for (String token : template.tokens()) {
                    if (!token.equals(GROUP_TOKEN) && !primary.hasName(token)) {
                        throw new PatternSpecException(describe() + ": auxiliary template '" + text
                            + "' refers to '" + token + "', which is neither '" + GROUP_TOKEN
                            + "' nor a capture of the primary pattern");
                    }
                }
                templates.add(template);
            }

            return new PatternSpec(this,
                Collections.unmodifiableList(compiled),
                cardinality,
                Collections.unmodifiableList(templates),
                Collections.unmodifiableList(grouping),
                Collections.unmodifiableList(variants));
        }

        private List<String> groupingNames(KeyPattern primary, List<KeyPattern> compiled) {
            if (!groupBy.isEmpty()) {
                for (String groupName : groupBy) {
                    if (!primary.hasName(groupName)) {
                        throw new PatternSpecException(describe() + ": group_by name '" + groupName
                            + "' is not a capture of the primary pattern '" + primary + "'");
                    }
                }
                return new ArrayList<>(new LinkedHashSet<>(groupBy));
            }
            Set<String> shared = new LinkedHashSet<>();
            for (String captureName : primary.names()) {
                for (KeyPattern companion : compiled.subList(1, compiled.size())) {
                    if (companion.hasName(captureName)) {
                        shared.add(captureName);
                    }
                }
            }
            if (!shared.isEmpty()) {
                return new ArrayList<>(shared);
            }
            if (!primary.names().isEmpty()) {
                return new ArrayList<>(List.of(primary.names().get(0)));
            }
            return new ArrayList<>();
        }

        private String describe() {
            return "pattern spec" + (name == null ? "" : " '" + name + "'");
        }
    }
}
