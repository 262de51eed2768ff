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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/// A compiled key pattern: a regular expression with named captures such as
/// `^(?<sect>snap\d{5,7})/(?<particle>ion|electron)-profile$`.
///
/// Matching is anchored at the start of the key, but not at its end unless the expression says
/// so. The names of the captures are read from the expression once, in the order they appear.
public final class KeyPattern {

    private final String source;
    private final Pattern pattern;
    private final List<String> names;

    private KeyPattern(String source, Pattern pattern, List<String> names) {
        this.source = source;
        this.pattern = pattern;
        this.names = names;
    }

    /// @param regex a regular expression
    /// @return the compiled pattern
    /// @throws PatternSpecException if the expression is empty or invalid
    public static KeyPattern compile(String regex) {
        if (regex == null || regex.isEmpty()) {
            throw new PatternSpecException("a key pattern cannot be empty");
        }
        try {
            Pattern compiled = Pattern.compile(regex);
            return new KeyPattern(regex, compiled, Collections.unmodifiableList(namedGroups(regex)));
        } catch (PatternSyntaxException e) {
            throw new PatternSpecException("invalid key pattern '" + regex + "': " + e.getDescription(), e);
        }
    }

    /// @return the expression this pattern was compiled from
    public String source() {
        return source;
    }

    /// @return the capture names, in order of appearance
    public List<String> names() {
        return names;
    }

    /// @param name a capture name
    /// @return true if the expression declares the capture
    public boolean hasName(String name) {
        return names.contains(name);
    }

    /// @param key a key
    /// @return a matcher positioned after a successful start-anchored match, or empty
    public Optional<Matcher> matcher(String key) {
        Matcher matcher = pattern.matcher(key);
        return matcher.lookingAt() ? Optional.of(matcher) : Optional.empty();
    }

    /// @param key a key
    /// @return the match with its named captures, or empty if the key does not match
    public Optional<KeyMatch> match(String key) {
        return matcher(key).map(m -> {
            Map<String, String> captures = new LinkedHashMap<>();
            for (String name : names) {
                String value = m.group(name);
                if (value != null) {
                    captures.put(name, value);
                }
            }
            return new KeyMatch(key, captures);
        });
    }

    /// Scan an expression for `(?<name>` openings, skipping escapes, quoted sections and
    /// character classes.
    static List<String> namedGroups(String regex) {
        List<String> found = new ArrayList<>();
        int classDepth = 0;
        int length = regex.length();
        for (int i = 0; i < length; i++) {
            char c = regex.charAt(i);
            if (c == '\\') {
                if (i + 1 < length && regex.charAt(i + 1) == 'Q') {
                    int end = regex.indexOf("\\E", i + 2);
                    if (end < 0) {
                        break;
                    }
                    i = end + 1;
                } else {
                    i++;
                }
                continue;
            }
            if (c == '[') {
                classDepth++;
                if (classDepth == 1 && i + 1 < length && regex.charAt(i + 1) == '^') {
                    i++;
                }
                if (classDepth == 1 && i + 1 < length && regex.charAt(i + 1) == ']') {
                    i++;
                }
                continue;
            }
            if (classDepth > 0) {
                if (c == ']') {
                    classDepth--;
                }
                continue;
            }
            if (c == '(' && regex.startsWith("?<", i + 1) && i + 3 < length
                && Character.isLetter(regex.charAt(i + 3))) {
                int end = regex.indexOf('>', i + 3);
                if (end > 0) {
                    found.add(regex.substring(i + 3, end));
                    i = end;
                }
            }
        }
        return found;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof KeyPattern && ((KeyPattern) o).source.equals(source);
    }

    @Override
    public int hashCode() {
        return source.hashCode();
    }

    @Override
    public String toString() {
        return source;
    }
}
