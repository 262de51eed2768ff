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
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// A key or label template which contains place holders for capture values.
///
/// Sections within the template string are replaced with token values and accompanying
/// literal characters. Sections are indicated with square brackets like `[...]`. Each section
/// must contain a token name to be substituted with its value. By default, the token value is
/// _required_. You can make a token optional by suffixing the token name with `*`. When an
/// optional token has no value, the enclosing section is elided from the result.
///
/// Token names may be qualified with curly braces, to disambiguate them from surrounding literal
/// characters which are part of that token's section. For example, `[group]/mpsi+1` renders to
/// `snap00100/mpsi+1` for the group `snap00100`, and `[spc]_[fld]_f` renders to `i_p_f`.
/// `x[-{suffix*}]` renders to `x` when `suffix` has no value and to `x-a` when it is `a`.
///
/// A template without any section is a literal.
public final class KeyTemplate {

    private final static Pattern scanner = Pattern.compile("\\[[^\\[\\]]+\\]");
    private final static Pattern tokenPattern = Pattern.compile(
        """
            (?<pre>[^{]*)
            \\{ (?<token>[^}]+) \\}
            (?<post>.*)
            """, Pattern.COMMENTS
    );
    private final static Pattern barePattern = Pattern.compile(
        """
            (?<pre>[^a-zA-Z0-9_]*)
            (?<token>[a-zA-Z0-9_]+\\*?)
            (?<post>[^a-zA-Z0-9_]*)
            """, Pattern.COMMENTS
    );

    private final String source;
    private final List<Part> parts;

    private KeyTemplate(String source, List<Part> parts) {
        this.source = source;
        this.parts = parts;
    }

    /// @param template the template text
    /// @return the parsed template
    /// @throws PatternSpecException if a section is unbalanced or has no token
    public static KeyTemplate parse(String template) {
        if (template == null || template.isEmpty()) {
            throw new PatternSpecException("a template cannot be empty");
        }
        List<Part> parts = new ArrayList<>();
        Matcher matcher = scanner.matcher(template);
        int last = 0;
        while (matcher.find()) {
            addLiteral(template, template.substring(last, matcher.start()), parts);
            parts.add(section(template, matcher.group()));
            last = matcher.end();
        }
        addLiteral(template, template.substring(last), parts);
        return new KeyTemplate(template, Collections.unmodifiableList(parts));
    }

    private static void addLiteral(String template, String text, List<Part> parts) {
        if (text.indexOf('[') >= 0 || text.indexOf(']') >= 0) {
            throw new PatternSpecException("unbalanced section in template '" + template + "'");
        }
        if (!text.isEmpty()) {
            parts.add(new Part(text, null, "", false));
        }
    }

    private static Part section(String template, String bracketed) {
        String section = bracketed.substring(1, bracketed.length() - 1);
        Matcher qualified = tokenPattern.matcher(section);
        Matcher bare = barePattern.matcher(section);
        Matcher inner = qualified.matches() ? qualified : bare.matches() ? bare : null;
        if (inner == null) {
            throw new PatternSpecException(
                "unresolvable section '" + bracketed + "' in template '" + template + "'");
        }
        String token = inner.group("token").trim();
        boolean optional = token.endsWith("*");
        token = optional ? token.substring(0, token.length() - 1) : token;
        return new Part(inner.group("pre"), token, inner.group("post"), optional);
    }

    /// @return the template text
    public String source() {
        return source;
    }

    /// @return true if the template has no sections
    public boolean isLiteral() {
        return parts.stream().noneMatch(p -> p.token != null);
    }

    /// @return every token name used, in order
    public Set<String> tokens() {
        Set<String> tokens = new LinkedHashSet<>();
        for (Part part : parts) {
            if (part.token != null) {
                tokens.add(part.token);
            }
        }
        return tokens;
    }

    /// @return the token names which must have a value
    public Set<String> requiredTokens() {
        Set<String> tokens = new LinkedHashSet<>();
        for (Part part : parts) {
            if (part.token != null && !part.optional) {
                tokens.add(part.token);
            }
        }
        return tokens;
    }

    /// Resolve the template.
    /// @param lookup resolves a token name to its value, or null if it has none
    /// @return the rendered text
    /// @throws IllegalStateException if a required token has no value
    public String render(Function<String, String> lookup) {
        StringBuilder sb = new StringBuilder();
        for (Part part : parts) {
            if (part.token == null) {
                sb.append(part.pre);
                continue;
            }
            String value = lookup.apply(part.token);
            if (value == null || (part.optional && value.isEmpty())) {
                if (part.optional) {
                    continue;
                }
                throw new IllegalStateException(
                    "no value for token '" + part.token + "' in template '" + source + "'");
            }
            sb.append(part.pre).append(value).append(part.post);
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof KeyTemplate && ((KeyTemplate) o).source.equals(source);
    }

    @Override
    public int hashCode() {
        return source.hashCode();
    }

    @Override
    public String toString() {
        return source;
    }

    private static final class Part {
        private final String pre;
        private final String token;
        private final String post;
        private final boolean optional;

        private Part(String pre, String token, String post, boolean optional) {
            this.pre = pre;
            this.token = token;
            this.post = post;
            this.optional = optional;
        }
    }
}
