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

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Loads configurations from properties files, and caches them by
 * location.
 */
public final class ConfigurationContext {
    private final Map<Path, Configuration> cache = new HashMap<>();

    /**
     * Get the configuration stored in a file. Subsequent requests for
     * the same file yield the same object.
     * 
     * @param file the file to load
     * 
     * @return the configuration in the file
     * 
     * @throws IOException if the file could not be read
     */
    public synchronized Configuration get(Path file) throws IOException {
        Path key = file.toAbsolutePath().normalize();
        Configuration result = cache.get(key);
        if (result != null) return result;
        Properties props = new Properties();
        try (Reader in = Files.newBufferedReader(key, StandardCharsets.UTF_8)) {
            props.load(in);
        }
        result = new PropertiesConfiguration(props);
        cache.put(key, result);
        return result;
    }

    /**
     * Get a configuration from a classpath resource.
     * 
     * @param loader the class loader to search
     * 
     * @param name the resource name
     * 
     * @return the configuration in the resource
     * 
     * @throws IOException if the resource could not be read, or does
     * not exist
     */
    public Configuration getResource(ClassLoader loader, String name)
        throws IOException {
        Properties props = new Properties();
        try (InputStream in = loader.getResourceAsStream(name)) {
            if (in == null) throw new IOException("no resource " + name);
            props.load(in);
        }
        return new PropertiesConfiguration(props);
    }

    /**
     * Create a configuration from properties.
     * 
     * @param props the source properties, which are copied
     * 
     * @return a configuration presenting the properties
     */
    public static Configuration of(Properties props) {
        return new PropertiesConfiguration(props);
    }

    /**
     * Create a configuration from the text of a properties file.
     * 
     * @param text the text to parse
     * 
     * @return a configuration presenting the parsed properties
     */
    public static Configuration of(String text) {
        Properties props = new Properties();
        try {
            props.load(new StringReader(text));
        } catch (IOException ex) {
            throw new AssertionError("unreachable", ex);
        }
        return new PropertiesConfiguration(props);
    }

    /**
     * An empty configuration
     */
    public static final Configuration EMPTY = of(new Properties());
}
