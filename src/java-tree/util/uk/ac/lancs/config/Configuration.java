/*
 * Copyright 2026, Regents of the University of Lancaster
 * All rights reserved.
 * 
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are
 * met:
 * 
 *  * Redistributions of source code must retain the above copyright
 *    notice, this list of conditions and the following disclaimer.
 * 
 *  * Redistributions in binary form must reproduce the above copyright
 *    notice, this list of conditions and the following disclaimer in the
 *    documentation and/or other materials provided with the
 *    distribution.
 * 
 *  * Neither the name of the University of Lancaster nor the names of
 *    its contributors may be used to endorse or promote products derived
 *    from this software without specific prior written permission.
 * 
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS
 * "AS IS" AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT
 * LIMITED TO, THE IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR
 * A PARTICULAR PURPOSE ARE DISCLAIMED. IN NO EVENT SHALL THE COPYRIGHT
 * OWNER OR CONTRIBUTORS BE LIABLE FOR ANY DIRECT, INDIRECT, INCIDENTAL,
 * SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES (INCLUDING, BUT NOT
 * LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES; LOSS OF USE,
 * DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND ON ANY
 * THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
 * (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE
 * OF THIS SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 */

package uk.ac.lancs.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Provides access to a read-only set of string properties, with
 * support for hierarchical views and variable expansion.
 * 
 * <p>
 * Keys are dotted names such as <samp>ssh.bastion.host</samp>. A
 * subview with prefix <samp>ssh.bastion</samp> presents the same
 * property as <samp>host</samp>.
 */
public interface Configuration {
    /**
     * Get the raw value of a property.
     * 
     * @param key the property key
     * 
     * @return the property's value, or {@code null} if not set
     */
    String get(String key);

    /**
     * Get the raw value of a property, or a default.
     * 
     * @param key the property key
     * 
     * @param defaultValue the value to return if the property is not
     * set
     * 
     * @return the property's value, or the default if not set
     */
    default String get(String key, String defaultValue) {
        String value = get(key);
        if (value == null) return defaultValue;
        return value;
    }

    /**
     * Get a property with <samp>${name}</samp> references expanded.
     * 
     * @param key the property key
     * 
     * @return the expanded value, or {@code null} if not set
     * 
     * @see #expand(String)
     */
    default String getExpanded(String key) {
        String value = get(key);
        if (value == null) return null;
        return expand(value);
    }

    /**
     * Get a property with references expanded, or a default.
     * 
     * @param key the property key
     * 
     * @param defaultValue the value to expand if the property is not
     * set
     * 
     * @return the expanded value
     */
    default String getExpanded(String key, String defaultValue) {
        return expand(get(key, defaultValue));
    }

    /**
     * Get a property as an expanded filesystem path.
     * 
     * @param key the property key
     * 
     * @param defaultValue the value to use if the property is not set,
     * or {@code null}
     * 
     * @return the path, or {@code null} if neither the property nor
     * the default is set
     */
    default Path getPath(String key, String defaultValue) {
        String value = get(key, defaultValue);
        if (value == null) return null;
        return Paths.get(expand(value));
    }

    /**
     * Get a property as a number of milliseconds. The value is a
     * decimal number of seconds, optionally fractional.
     * 
     * @param key the property key
     * 
     * @param defaultMillis the value to return if the property is not
     * set
     * 
     * @return the property's value in milliseconds
     * 
     * @throws IllegalArgumentException if the value is not a number
     */
    default long getSeconds(String key, long defaultMillis) {
        String value = get(key);
        if (value == null) return defaultMillis;
        try {
            return Math.round(Double.parseDouble(value.trim()) * 1000.0);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("bad duration for " + key
                + ": " + value, ex);
        }
    }

    /**
     * Get a property as an integer.
     * 
     * @param key the property key
     * 
     * @param defaultValue the value to return if the property is not
     * set
     * 
     * @return the property's value
     * 
     * @throws IllegalArgumentException if the value is not an integer
     */
    default int getInt(String key, int defaultValue) {
        String value = get(key);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("bad integer for " + key
                + ": " + value, ex);
        }
    }

    /**
     * Get a property as a list of whitespace- or comma-separated
     * items.
     * 
     * @param key the property key
     * 
     * @return the items, empty if the property is not set
     */
    default List<String> getList(String key) {
        String value = get(key);
        if (value == null || value.trim().isEmpty())
            return Collections.emptyList();
        List<String> result = new ArrayList<>();
        for (String item : value.trim().split("[\\s,]+"))
            result.add(item);
        return result;
    }

    /**
     * Get a view of the configuration with keys starting with a given
     * prefix. A dot is appended to the prefix if not already present.
     * 
     * @param prefix the prefix to strip from keys
     * 
     * @return the requested view
     */
    Configuration subview(String prefix);

    /**
     * Get all keys in this view.
     * 
     * @return the keys
     */
    Iterable<String> keys();

    /**
     * Look up a variable referenced from a property value. The
     * default looks in system properties, and then in the environment.
     * 
     * @param name the variable name
     * 
     * @return the variable's value, or {@code null} if undefined
     */
    default String variable(String name) {
        String value = System.getProperty(name);
        if (value != null) return value;
        return System.getenv(name);
    }

    /**
     * Expand <samp>${name}</samp> references in a string. Undefined
     * references are left as they are.
     * 
     * @param value the string to expand
     * 
     * @return the expanded string
     */
    default String expand(String value) {
        Matcher m = REFERENCE.matcher(value);
        StringBuffer result = new StringBuffer();
        while (m.find()) {
            String repl = variable(m.group(1));
            if (repl == null) repl = m.group();
            m.appendReplacement(result, Matcher.quoteReplacement(repl));
        }
        m.appendTail(result);
        return result.toString();
    }

    /**
     * Copy all properties of this view into a new properties object.
     * 
     * @return the properties
     */
    default Properties toProperties() {
        Properties result = new Properties();
        for (String key : keys())
            result.setProperty(key, get(key));
        return result;
    }

    /**
     * Normalize a prefix, ensuring that it ends with a dot, unless
     * empty.
     * 
     * @param prefix the prefix to normalize
     * 
     * @return the normalized prefix
     */
    static String normalizePrefix(String prefix) {
        if (prefix.isEmpty() || prefix.endsWith(".")) return prefix;
        return prefix + '.';
    }

    /**
     * Matches a variable reference in a property value.
     */
    static final Pattern REFERENCE =
        Pattern.compile("\\$\\{([^}]+)\\}");
}
