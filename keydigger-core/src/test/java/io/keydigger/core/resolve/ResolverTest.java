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

import io.keydigger.api.keys.KeyStore;
import io.keydigger.core.pattern.Labeler;
import io.keydigger.core.pattern.PatternSpec;
import io.keydigger.core.store.CachingKeyStore;
import io.keydigger.core.store.MapKeyLoader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Resolver")
class ResolverTest {

    private static CachingKeyStore storeOf(String... keys) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (String key : keys) {
            values.put(key, new double[]{key.length()});
        }
        return new CachingKeyStore(new MapKeyLoader(values));
    }

    private static List<List<String>> primaryKeysOf(List<WorkUnit> units) {
        return units.stream().map(WorkUnit::primaryKeys).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("scenarios")
    class Scenarios {

        @Test
        @DisplayName("single pattern with literal auxiliaries and a formatted label")
        void shouldResolveSinglePatternProfiles() {
            KeyStore store = storeOf("da/i-p-f", "da/i-m-f", "da/e-p-f", "da/e-m-f", "g/c", "his/n");
            PatternSpec spec = PatternSpec.builder()
                .patterns("^(?<sect>da)/(?<spc>i|e)-(?<fld>p|m)-f$")
                .auxiliary("g/c", "his/n")
                .labeler(Labeler.formatted("da/(?<spc>i|e)-(?<fld>p|m)-f", "[spc]_[fld]_f"))
                .build();

            List<WorkUnit> units = Resolver.resolve(store, spec);

            assertThat(units).hasSize(4);
            WorkUnit ipf = units.stream().filter(u -> u.primaryKey().equals("da/i-p-f")).findFirst().orElseThrow();
            assertThat(ipf.group()).isEqualTo("da");
            assertThat(ipf.primaryKeys()).containsExactly("da/i-p-f");
            assertThat(ipf.auxiliaryKeys()).containsExactly("g/c", "his/n");
            assertThat(ipf.label()).isEqualTo("i_p_f");
            assertThat(units).extracting(WorkUnit::label).containsExactly("e_m_f", "e_p_f", "i_m_f", "i_p_f");
        }

        @Test
        @DisplayName("joining labeler over three captures")
        void shouldJoinLabelCaptures() {
            KeyStore store = storeOf("da/i-p-f", "da/e-m-f");
            PatternSpec spec = PatternSpec.builder()
                .patterns("^(?<sect>da)/(?<spc>i|e)-(?<fld>p|m)-f$")
                .labeler(Labeler.joining("da/(?<spc>i|e)-(?<fld>p|m)-(?<kind>f)"))
                .build();
            assertThat(Resolver.resolve(store, spec)).extracting(WorkUnit::label).containsExactly("e_m_f", "i_p_f");
        }

        @Test
        @DisplayName("species paired with a shared companion")
        void shouldPairEachVariantWithCompanion() {
            KeyStore store = storeOf("his/i", "his/e", "his/n", "g/c");
            PatternSpec spec = PatternSpec.builder()
                .patterns("^(?<sect>his)/(?<spc>i|e)$", "^(?<sect>his)/n$")
                .build();

            List<WorkUnit> units = Resolver.resolve(store, spec);

            assertThat(primaryKeysOf(units)).containsExactlyInAnyOrder(
                List.of("his/i", "his/n"),
                List.of("his/e", "his/n"));
            assertThat(units).allMatch(u -> u.group().equals("his"));
        }

        @Test
        @DisplayName("fields completed by both companion matches")
        void shouldIncludeEveryCompanionMatchOfTheGroup() {
            KeyStore store = storeOf("s0/p", "s0/a", "s0/x", "s0/y", "s2/p", "s2/a", "s2/x", "s2/y", "g/c");
            PatternSpec spec = PatternSpec.builder()
                .patterns("^(?<sect>s\\d+)/(?<fld>p|a)$", "^(?<sect>s\\d+)/(?<cmp>x|y)$")
                .build();

            List<WorkUnit> units = Resolver.resolve(store, spec);

            assertThat(units).hasSize(4);
            assertThat(units).allMatch(u -> u.primaryKeys().size() == 3);
            assertThat(units).extracting(WorkUnit::group).containsExactly("s0", "s0", "s2", "s2");
            assertThat(primaryKeysOf(units)).containsExactly(
                List.of("s0/a", "s0/x", "s0/y"),
                List.of("s0/p", "s0/x", "s0/y"),
                List.of("s2/a", "s2/x", "s2/y"),
                List.of("s2/p", "s2/x", "s2/y"));
        }
    }

    @Nested
    @DisplayName("properties")
    class Properties {

        private final PatternSpec fields = PatternSpec.builder()
            .patterns("^(?<sect>s\\d+)/(?<fld>p|a)$", "^(?<sect>s\\d+)/(?<cmp>x|y)$")
            .build();

        @Test
        void shouldBeIdempotentAndReadNoValues() {
            CachingKeyStore store = storeOf("s0/p", "s0/a", "s0/x", "s2/p", "s2/y");
            List<WorkUnit> first = Resolver.resolve(store, fields);
            List<WorkUnit> second = Resolver.resolve(store, fields);
            assertThat(second).isEqualTo(first);
            assertThat(store.cachedCount()).isZero();
        }

        @Test
        void shouldReturnNothingWithoutPrimaryMatches() {
            assertThat(Resolver.resolve(storeOf("g/c", "his/n"), fields)).isEmpty();
        }

        @Test
        void shouldEmitOneUnitPerMatchForSinglePattern() {
            PatternSpec spec = PatternSpec.builder().patterns("^(?<sect>s\\d+)/(?<fld>p|a)$").build();
            List<WorkUnit> units = Resolver.resolve(storeOf("s0/p", "s0/a", "s1/p", "s1/x"), spec);
            assertThat(units).hasSize(3);
            assertThat(units).allMatch(u -> u.primaryKeys().size() == 1);
        }

        @Test
        void shouldDropCombinationsMissingACompanion() {
            assertThat(Resolver.resolve(storeOf("s0/p", "s0/a"), fields)).isEmpty();
        }

        @Test
        void shouldEvaluateCompletenessPerGroup() {
            List<WorkUnit> units = Resolver.resolve(storeOf("s0/p", "s0/x", "s2/p"), fields);
            assertThat(primaryKeysOf(units)).containsExactly(List.of("s0/p", "s0/x"));
        }

        @Test
        void shouldRequireEveryExplicitExpression() {
            PatternSpec strict = PatternSpec.builder()
                .patterns("^(?<sect>s\\d+)/(?<fld>p|a)$", "^(?<sect>s\\d+)/(?<cmp>x|y)$")
                .requiring("^s\\d+/x$", "^s\\d+/y$")
                .build();
            KeyStore store = storeOf("s0/p", "s0/x", "s0/y", "s2/p", "s2/x");

            assertThat(primaryKeysOf(Resolver.resolve(store, strict))).containsExactly(
                List.of("s0/p", "s0/x", "s0/y"));
            assertThat(Resolver.resolve(store, fields)).hasSize(2);
        }

        @Test
        void shouldCompareGroupedRequirementsAgainstTheGroup() {
            PatternSpec grouped = PatternSpec.builder()
                .patterns("^(?<sect>s\\d+)/p$")
                .auxiliary("s0/y")
                .requiring("^(?<sect>s\\d+)/y$")
                .build();
            PatternSpec ungrouped = PatternSpec.builder()
                .patterns("^(?<sect>s\\d+)/p$")
                .auxiliary("s0/y")
                .requiring("^s\\d+/y$")
                .build();
            KeyStore store = storeOf("s0/p", "s0/y", "s2/p");
            assertThat(Resolver.resolve(store, grouped)).extracting(WorkUnit::group).containsExactly("s0");
            assertThat(Resolver.resolve(store, ungrouped)).extracting(WorkUnit::group).containsExactly("s0", "s2");
        }

        @Test
        void shouldCountExistingAuxiliaryKeysTowardsExplicitCompleteness() {
            PatternSpec spec = PatternSpec.builder()
                .patterns("^(?<sect>s\\d+)/p$")
                .auxiliary("[group]/x")
                .requiring("^s\\d+/x$")
                .build();
            List<WorkUnit> units = Resolver.resolve(storeOf("s0/p", "s0/x", "s2/p"), spec);
            assertThat(units).hasSize(1);
            assertThat(units.get(0).allKeys()).containsExactly("s0/p", "s0/x");
        }

        @Test
        void shouldRenderAuxiliaryTemplatesFromGroupAndCaptures() {
            PatternSpec spec = PatternSpec.builder()
                .patterns("^(?<sect>snap\\d+)/(?<spc>i|e)-profile(?:\\.(?<ver>\\d))?$")
                .auxiliary("gtc/tstep", "[group]/mpsi+1", "norm/[spc]", "extra[.{ver*}]")
                .build();
            List<WorkUnit> units = Resolver.resolve(storeOf("snap00100/i-profile", "snap00200/e-profile.2"), spec);
            assertThat(units).extracting(WorkUnit::auxiliaryKeys).containsExactly(
                List.of("gtc/tstep", "snap00100/mpsi+1", "norm/i", "extra"),
                List.of("gtc/tstep", "snap00200/mpsi+1", "norm/e", "extra.2"));
        }

        @Test
        void shouldShareLiteralAuxiliariesAcrossUnits() {
            PatternSpec spec = PatternSpec.builder()
                .patterns("^(?<sect>s\\d+)/(?<fld>p|a)$")
                .auxiliary("g/c", "his/n")
                .build();
            List<WorkUnit> units = Resolver.resolve(storeOf("s0/p", "s1/a", "s2/p"), spec);
            assertThat(units).extracting(WorkUnit::auxiliaryKeys).containsOnly(List.of("g/c", "his/n"));
        }

        @Test
        void shouldOrderGroupsByFirstAppearance() {
            PatternSpec spec = PatternSpec.builder().patterns("^(?<sect>s\\d+)/(?<fld>p|a)$").build();
            List<WorkUnit> units = Resolver.resolve(storeOf("s2/p", "s10/p", "s10/a"), spec);
            assertThat(units).extracting(WorkUnit::primaryKey).containsExactly("s10/a", "s10/p", "s2/p");
        }

        @Test
        void shouldDeduplicateKeysMatchedByPrimaryAndCompanion() {
            PatternSpec spec = PatternSpec.builder()
                .patterns("^(?<sect>his)/(?<spc>i|e)$", "^(?<sect>his)/")
                .build();
            List<WorkUnit> units = Resolver.resolve(storeOf("his/e", "his/n"), spec);
            assertThat(units).hasSize(1);
            assertThat(units.get(0).primaryKeys()).containsExactly("his/e", "his/n");
        }

        @Test
        void shouldOrderCompanionsByPatternThenKey() {
            PatternSpec spec = PatternSpec.builder()
                .patterns("^(?<sect>his)/(?<spc>i)$", "^(?<sect>his)/z\\d?$", "^(?<sect>his)/a$")
                .build();
            List<WorkUnit> units = Resolver.resolve(storeOf("his/i", "his/z2", "his/a", "his/z1"), spec);
            assertThat(primaryKeysOf(units)).containsExactly(List.of("his/i", "his/z1", "his/z2", "his/a"));
        }

        @Test
        void shouldMatchCompanionsOnSharedGroupingCaptures() {
            PatternSpec spec = PatternSpec.builder()
                .patterns("^(?<sect>s\\d)/(?<run>r\\d)/p$", "^(?<sect>s\\d)/grid$", "^(?<run>r\\d)/time$")
                .build();
            assertThat(spec.groupingNames()).containsExactly("sect", "run");

            List<WorkUnit> units = Resolver.resolve(
                storeOf("s0/r1/p", "s0/r2/p", "s0/grid", "s1/grid", "r1/time", "r2/time"), spec);

            assertThat(units).extracting(WorkUnit::group).containsExactly("s0/r1", "s0/r2");
            assertThat(primaryKeysOf(units)).containsExactly(
                List.of("s0/r1/p", "s0/grid", "r1/time"),
                List.of("s0/r2/p", "s0/grid", "r2/time"));
        }

        @Test
        void shouldDropGroupsWhoseSharedCaptureHasNoCompanion() {
            PatternSpec spec = PatternSpec.builder()
                .patterns("^(?<sect>s\\d)/(?<run>r\\d)/p$", "^(?<sect>s\\d)/grid$", "^(?<run>r\\d)/time$")
                .build();
            List<WorkUnit> units = Resolver.resolve(storeOf("s0/r1/p", "s1/r1/p", "s0/grid", "r1/time"), spec);
            assertThat(primaryKeysOf(units)).containsExactly(List.of("s0/r1/p", "s0/grid", "r1/time"));
        }

        @Test
        void shouldMergePrimariesSharingACombination() {
            PatternSpec spec = PatternSpec.builder()
                .patterns("^(?<sect>s\\d+)/(?:p|q)$", "^(?<sect>s\\d+)/x$")
                .build();
            List<WorkUnit> units = Resolver.resolve(storeOf("s0/p", "s0/q", "s0/x"), spec);
            assertThat(primaryKeysOf(units)).containsExactly(List.of("s0/p", "s0/q", "s0/x"));
        }

        @Test
        void shouldLabelUnmatchedUnitsWithNullSentinel() {
            PatternSpec spec = PatternSpec.builder()
                .patterns("^(?<sect>s\\d+)/(?<fld>p|a)$")
                .labeler(Labeler.joining("s\\d+/(?<fld>p)"))
                .build();
            assertThat(Resolver.resolve(storeOf("s0/a", "s0/p"), spec))
                .extracting(WorkUnit::label)
                .containsExactly(Labeler.NULL_LABEL, "p");
        }

        @Test
        void shouldUseKeyGroupWithoutCaptures() {
            PatternSpec spec = PatternSpec.builder().patterns("^grid/c").build();
            List<WorkUnit> units = Resolver.resolve(storeOf("grid/coords", "grid/cells", "his/n"), spec);
            assertThat(units).extracting(WorkUnit::group).containsExactly("grid", "grid");
            assertThat(units).extracting(WorkUnit::label).containsExactly("grid/cells", "grid/coords");
        }
    }

    @Test
    void shouldRejectWorkUnitsWithoutPrimaryKeys() {
        assertThatThrownBy(() -> new WorkUnit("g", List.of(), List.of(), "l"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
