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
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;

/// Derives a human-readable label for a work unit from its primary key.
///
/// There are three forms:
/// - the default labeler uses the value of the first named capture of the primary match
/// - a regex labeler matches the key and joins its named captures with a separator
/// - a regex labeler with a format renders a {@link KeyTemplate} such as `[spc]_[fld]_f` from
///   the captures
///
/// When a regex labeler does not match the key, the label is {@link #NULL_LABEL}.
public final class Labeler {

    /// The label used when the labeler does not match
    public static final String NULL_LABEL = "null";
    /// The default separator between joined captures
    public static final String DEFAULT_SEPARATOR = "_";

    private static final Labeler FIRST_CAPTURE = new Labeler(null, null, DEFAULT_SEPARATOR);

    private final KeyPattern pattern;
    private final KeyTemplate format;
    private final String separator;

    private Labeler(KeyPattern pattern, KeyTemplate format, String separator) {
        this.pattern = pattern;
        this.format = format;
        this.separator = separator;
    }

    /// @return the labeler which uses the first named capture of the primary match
    public static Labeler firstCapture() {
        return FIRST_CAPTURE;
    }

    /// @param regex the expression to match against the primary key
    /// @return a labeler joining the named captures with `_`
    public static Labeler joining(String regex) {
        return joining(regex, DEFAULT_SEPARATOR);
    }

    /// @param regex the expression to match against the primary key
    /// @param separator the text between captures
    /// @return a labeler joining the named captures with the separator
    public static Labeler joining(String regex, String separator) {
        return new Labeler(KeyPattern.compile(regex), null, separator == null ? DEFAULT_SEPARATOR : separator);
    }

    /// @param regex the expression to match against the primary key
    /// @param format a template over the named captures of the expression
    /// @return a labeler rendering the format
    /// @throws PatternSpecException if the format refers to captures the expression lacks
    public static Labeler formatted(String regex, String format) {
        KeyPattern compiled = KeyPattern.compile(regex);
        KeyTemplate template = KeyTemplate.parse(format);
        for (String token : template.tokens()) {
            if (!compiled.hasName(token)) {
                throw new PatternSpecException(
                    "label format '" + format + "' refers to '" + token + "', which is not a capture of '" + regex + "'");
            }
        }
        return new Labeler(compiled, template, DEFAULT_SEPARATOR);
    }

    /// @return the labeler's own expression, or empty for the default labeler
    public Optional<KeyPattern> pattern() {
        return Optional.ofNullable(pattern);
    }

    /// @return the label format, if any
    public Optional<KeyTemplate> format() {
        return Optional.ofNullable(format);
    }

    /// @return the separator between joined captures
    public String separator() {
        return separator;
    }

    /// @param primary the match of the primary key against the primary pattern
    /// @return the label
    public String label(KeyMatch primary) {
        if (pattern == null) {
            return primary.captures().values().stream().findFirst().orElse(primary.key());
        }
        Optional<Matcher> matched = pattern.matcher(primary.key());
        if (matched.isEmpty()) {
            return NULL_LABEL;
        }
        Matcher m = matched.get();
        if (format != null) {
            return format.render(name -> {
                String value = m.group(name);
                return value == null ? "" : value;
            });
        }
        List<String> values = new ArrayList<>();
        if (pattern.names().isEmpty()) {
            for (int i = 1; i <= m.groupCount(); i++) {
                if (m.group(i) != null) {
                    values.add(m.group(i));
                }
            }
            if (values.isEmpty()) {
                return m.group();
            }
        } else {
            for (String name : pattern.names()) {
                String value = m.group(name);
                if (value != null) {
                    values.add(value);
                }
            }
        }
        return String.join(separator, values);
    }

    @Override
    public String toString() {
        if (pattern == null) {
            return "Labeler{first capture}";
        }
        return "Labeler{" + pattern + (format == null ? ", separator='" + separator + "'" : ", format=" + format) + "}";
    }
}
