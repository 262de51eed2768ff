package io.keydigger.core.catalog;

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
import io.keydigger.core.pattern.Cardinality;
import io.keydigger.core.pattern.Completeness;
import io.keydigger.core.pattern.Labeler;
import io.keydigger.core.pattern.PatternSpec;
import io.keydigger.core.pattern.PatternSpecException;
import io.keydigger.core.resolve.Resolver;
import io.keydigger.core.resolve.WorkUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// A named set of {@link PatternSpec}s, usually read from YAML.
///
/// ```yaml
/// specs:
///   profiles:
///     patterns:
///       - '^(?<sect>snap\d+)/(?<spc>i|e)-(?<fld>p|m)-f$'
///     auxiliary: [grid/coords, history/time]
///     labeler:
///       pattern: '^snap\d+/(?<spc>i|e)-(?<fld>p|m)'
///       format: '[spc]_[fld]_f'
///   history:
///     patterns:
///       - '^(?<sect>his)/(?<spc>i|e)$'
///       - '^(?<sect>his)/n$'
///     cardinality: multi
///     completeness: all
/// ```
///
/// Per spec, `patterns` is required and may be a single string. `cardinality` is `single` or
/// `multi`, `completeness` is `all` or a list of expressions, `auxiliary` a list of key templates,
/// `group_by` a capture name or a list of them, and `labeler` either an expression whose captures
/// are joined with `_` or a map with `pattern` and an optional `format` or `separator`.
public class SpecCatalog {
    private static final Logger logger = LogManager.getLogger(SpecCatalog.class);

    public static final String SPECS = "specs";
    private static final Set<String> KNOWN_FIELDS =
        Set.of("patterns", "cardinality", "completeness", "auxiliary", "group_by", "labeler");

    private final Map<String, PatternSpec> specs;

    /// @param specs the specs, each under its own name
    /// @throws PatternSpecException if two specs share a name
    public SpecCatalog(Collection<PatternSpec> specs) {
        Map<String, PatternSpec> byName = new LinkedHashMap<>();
        for (PatternSpec spec : specs) {
            if (byName.put(spec.name(), spec) != null) {
                throw new PatternSpecException("duplicate pattern spec name '" + spec.name() + "'");
            }
        }
        this.specs = Collections.unmodifiableMap(byName);
    }

    /// Read a catalog file.
    /// @param path a YAML file
    /// @return the catalog
    /// @throws PatternSpecException if the file does not describe valid specs
    public static SpecCatalog load(Path path) {
        LoadSettings loadSettings = LoadSettings.builder().setLabel(path.toString()).build();
        Load yaml = new Load(loadSettings);
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            SpecCatalog catalog = fromObject(yaml.loadFromReader(reader), path.toString());
            logger.info("Loaded {} pattern specs from {}", catalog.specs.size(), path);
            return catalog;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read spec catalog '" + path + "'", e);
        } catch (YamlEngineException e) {
            throw new PatternSpecException("invalid YAML in '" + path + "': " + e.getMessage(), e);
        }
    }

    /// @param yamlText catalog YAML
    /// @return the catalog
    /// @throws PatternSpecException if the text does not describe valid specs
    public static SpecCatalog fromYaml(String yamlText) {
        Load yaml = new Load(LoadSettings.builder().build());
        try {
            return fromObject(yaml.loadFromString(yamlText), "yaml text");
        } catch (YamlEngineException e) {
            throw new PatternSpecException("invalid YAML: " + e.getMessage(), e);
        }
    }

    private static SpecCatalog fromObject(Object document, String source) {
        if (!(document instanceof Map)) {
            throw new PatternSpecException("'" + source + "' has no '" + SPECS + "' map");
        }
        Object specsNode = ((Map<?, ?>) document).get(SPECS);
        if (!(specsNode instanceof Map)) {
            throw new PatternSpecException("'" + source + "' has no '" + SPECS + "' map");
        }
        List<PatternSpec> specs = new ArrayList<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) specsNode).entrySet()) {
            String name = String.valueOf(entry.getKey());
            if (!(entry.getValue() instanceof Map)) {
                throw new PatternSpecException("pattern spec '" + name + "' in '" + source + "' is not a map");
            }
            specs.add(parseSpec(name, (Map<?, ?>) entry.getValue()));
        }
        return new SpecCatalog(specs);
    }

    private static PatternSpec parseSpec(String name, Map<?, ?> fields) {
        PatternSpec.Builder builder = PatternSpec.builder().name(name);
        List<String> patterns = stringList(name, "patterns", fields.get("patterns"));
        if (patterns.isEmpty()) {
            throw new PatternSpecException("pattern spec '" + name + "' has no patterns");
        }
        builder.patterns(patterns);

        Object cardinality = fields.get("cardinality");
        if (cardinality != null) {
            builder.cardinality(Cardinality.fromString(String.valueOf(cardinality)));
        }

        Object completeness = fields.get("completeness");
        if (completeness instanceof String && "all".equalsIgnoreCase((String) completeness)) {
            builder.completeness(Completeness.ALL);
        } else if (completeness != null) {
            builder.completeness(Completeness.of(stringList(name, "completeness", completeness)));
        }

        builder.auxiliary(stringList(name, "auxiliary", fields.get("auxiliary")));
        builder.groupBy(stringList(name, "group_by", fields.get("group_by")));

        Object labeler = fields.get("labeler");
        if (labeler instanceof String) {
            builder.labeler(Labeler.joining((String) labeler));
        } else if (labeler instanceof Map) {
            builder.labeler(parseLabeler(name, (Map<?, ?>) labeler));
        } else if (labeler != null) {
            throw new PatternSpecException("labeler of pattern spec '" + name + "' must be a string or a map");
        }

        for (Object field : fields.keySet()) {
            if (!KNOWN_FIELDS.contains(String.valueOf(field))) {
                throw new PatternSpecException("unknown field '" + field + "' in pattern spec '" + name + "'");
            }
        }
        return builder.build();
    }

    private static Labeler parseLabeler(String name, Map<?, ?> fields) {
        Object pattern = fields.get("pattern");
        if (!(pattern instanceof String)) {
            throw new PatternSpecException("labeler of pattern spec '" + name + "' has no pattern");
        }
        Object format = fields.get("format");
        if (format != null) {
            return Labeler.formatted((String) pattern, String.valueOf(format));
        }
        Object separator = fields.get("separator");
        return Labeler.joining((String) pattern, separator == null ? null : String.valueOf(separator));
    }

    private static List<String> stringList(String name, String field, Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof String) {
            return List.of((String) value);
        }
        if (value instanceof List) {
            List<String> values = new ArrayList<>();
            for (Object element : (List<?>) value) {
                values.add(String.valueOf(element));
            }
            return values;
        }
        throw new PatternSpecException(
            "field '" + field + "' of pattern spec '" + name + "' must be a string or a list of strings");
    }

    /// @return the spec names, in catalog order
    public Set<String> names() {
        return specs.keySet();
    }

    /// @param name a spec name
    /// @return the spec, if the catalog has one by that name
    public Optional<PatternSpec> get(String name) {
        return Optional.ofNullable(specs.get(name));
    }

    /// @return all specs, in catalog order
    public List<PatternSpec> specs() {
        return List.copyOf(specs.values());
    }

    /// Resolve every spec of the catalog.
    /// @param store the keys to resolve against
    /// @return the work units of each spec, keyed by spec name in catalog order
    public Map<String, List<WorkUnit>> resolveAll(KeyStore store) {
        Map<String, List<WorkUnit>> resolved = new LinkedHashMap<>();
        for (PatternSpec spec : specs.values()) {
            resolved.put(spec.name(), Resolver.resolve(store, spec));
        }
        return resolved;
    }

    @Override
    public String toString() {
        return "SpecCatalog" + specs.keySet();
    }
}
