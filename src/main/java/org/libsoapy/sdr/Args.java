/*
 * Copyright @ 2017-Present 8x8, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.libsoapy.sdr;

import java.util.*;

import org.libsoapy.soapysdr.*;

/**
 * An ordered list of key/value string pairs which is used to filter and make
 * devices and to pass additional parameters to streams and to tuning. Keys
 * are not required to be unique; {@link #get(String)} and
 * {@link #set(String, String)} act on the first pair with a given key.
 * <p>
 * Instances are not thread-safe.
 * </p>
 */
public class Args
    implements Iterable<Map.Entry<String, String>>
{
    /**
     * Parses a string of the form <tt>key1=value1, key2=value2</tt>. Segments
     * without a <tt>=</tt> are ignored. Keys and values are trimmed.
     *
     * @param s the string to parse
     * @return a new <tt>Args</tt> with the pairs in <tt>s</tt> in the order in
     * which they appear
     * @throws IllegalArgumentException if <tt>s</tt> contains a NUL character
     */
    public static Args parse(String s)
    {
        Args args = new Args();

        if (s == null)
            return args;

        for (String segment : s.split(","))
        {
            int eq = segment.indexOf('=');

            if (eq < 0)
                continue;
            args.set(
                    segment.substring(0, eq).trim(),
                    segment.substring(eq + 1).trim());
        }
        return args;
    }

    /**
     * Initializes a new <tt>Args</tt> with the entries of a <tt>Map</tt> in
     * its iteration order.
     *
     * @param map the <tt>Map</tt> to copy
     * @return a new <tt>Args</tt> with the entries of <tt>map</tt>
     */
    public static Args fromMap(Map<String, String> map)
    {
        return fromPairs(map.entrySet());
    }

    /**
     * Initializes a new <tt>Args</tt> with a sequence of pairs. A key which
     * occurs more than once keeps its first position and its last value.
     *
     * @param pairs the pairs to copy
     * @return a new <tt>Args</tt> with the <tt>pairs</tt>
     */
    public static Args fromPairs(
            Iterable<? extends Map.Entry<String, String>> pairs)
    {
        Args args = new Args();

        for (Map.Entry<String, String> pair : pairs)
            args.set(pair.getKey(), pair.getValue());
        return args;
    }

    /**
     * Copies a native <tt>SoapySDRKwargs</tt> into a new <tt>Args</tt>. The
     * native structure is not released.
     */
    static Args fromNative(SoapySDRKwargs kwargs)
    {
        Args args = new Args();
        String[] keys = kwargs.readKeys();
        String[] vals = kwargs.readValues();

        for (int i = 0; i < keys.length; i++)
        {
            args.keys.add((keys[i] == null) ? "" : keys[i]);
            args.values.add((vals[i] == null) ? "" : vals[i]);
        }
        return args;
    }

    private static void checkString(String s, String what)
    {
        if (s == null)
            throw new IllegalArgumentException(what + " is null");
        if (s.indexOf('\0') >= 0)
            throw new IllegalArgumentException(what + " contains NUL: " + s);
    }

    private final List<String> keys = new ArrayList<>();

    private final List<String> values = new ArrayList<>();

    /**
     * Initializes a new empty <tt>Args</tt>.
     */
    public Args()
    {
    }

    /**
     * Gets the value of the first pair with a specific key.
     *
     * @param key the key to look up
     * @return the value of the first pair with <tt>key</tt> or <tt>null</tt>
     */
    public String get(String key)
    {
        int i = keys.indexOf(key);

        return (i < 0) ? null : values.get(i);
    }

    /**
     * Sets the value of the first pair with a specific key or appends a new
     * pair if there is no pair with the key.
     *
     * @param key the key
     * @param value the value
     * @return this <tt>Args</tt>
     * @throws IllegalArgumentException if <tt>key</tt> or <tt>value</tt> is
     * <tt>null</tt> or contains a NUL character
     */
    public Args set(String key, String value)
    {
        checkString(key, "key");
        checkString(value, "value");

        int i = keys.indexOf(key);

        if (i < 0)
        {
            keys.add(key);
            values.add(value);
        }
        else
        {
            values.set(i, value);
        }
        return this;
    }

    public int size()
    {
        return keys.size();
    }

    public boolean isEmpty()
    {
        return keys.isEmpty();
    }

    /**
     * Iterates over the pairs of this <tt>Args</tt> in order.
     */
    @Override
    public Iterator<Map.Entry<String, String>> iterator()
    {
        return new Iterator<Map.Entry<String, String>>()
        {
            private int next = 0;

            @Override
            public boolean hasNext()
            {
                return next < keys.size();
            }

            @Override
            public Map.Entry<String, String> next()
            {
                if (!hasNext())
                    throw new NoSuchElementException();

                int i = next++;

                return
                    new AbstractMap.SimpleImmutableEntry<>(
                            keys.get(i),
                            values.get(i));
            }
        };
    }

    /**
     * Copies this <tt>Args</tt> into a <tt>Map</tt> which preserves the order
     * of first occurrence. A duplicate key ends up with its last value.
     *
     * @return a new <tt>Map</tt> with the pairs of this <tt>Args</tt>
     */
    public Map<String, String> toMap()
    {
        Map<String, String> map = new LinkedHashMap<>();

        for (int i = 0; i < keys.size(); i++)
            map.put(keys.get(i), values.get(i));
        return map;
    }

    /**
     * Marshals this <tt>Args</tt> into a native <tt>SoapySDRKwargs</tt>. The
     * caller keeps the returned structure reachable until the native call
     * which reads it returns.
     */
    SoapySDRKwargs toNative()
    {
        return
            new SoapySDRKwargs(
                    keys.toArray(new String[0]),
                    values.toArray(new String[0]));
    }

    @Override
    public boolean equals(Object obj)
    {
        if (this == obj)
            return true;
        if (!(obj instanceof Args))
            return false;

        Args other = (Args) obj;

        return keys.equals(other.keys) && values.equals(other.values);
    }

    @Override
    public int hashCode()
    {
        return 31 * keys.hashCode() + values.hashCode();
    }

    /**
     * Returns the pairs of this <tt>Args</tt> in the form
     * <tt>key1=value1, key2=value2</tt> which {@link #parse(String)} accepts.
     */
    @Override
    public String toString()
    {
        StringBuilder s = new StringBuilder();

        for (int i = 0; i < keys.size(); i++)
        {
            if (i != 0)
                s.append(", ");
            s.append(keys.get(i)).append('=').append(values.get(i));
        }
        return s.toString();
    }
}
