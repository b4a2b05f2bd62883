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
package org.libsoapy.soapysdr;

import com.sun.jna.*;

/**
 * Maps the native <tt>SoapySDRKwargs</tt> structure, a list of key/value
 * string pairs held in two parallel arrays of <tt>size</tt> elements.
 */
@Structure.FieldOrder({ "size", "keys", "vals" })
public class SoapySDRKwargs
    extends Structure
{
    /**
     * The by-value flavor of <tt>SoapySDRKwargs</tt> returned by functions such
     * as <tt>SoapySDRDevice_getHardwareInfo</tt>.
     */
    public static class ByValue
        extends SoapySDRKwargs
        implements Structure.ByValue
    {
    }

    public SizeT size;

    /**
     * The <tt>char **</tt> array of keys.
     */
    public Pointer keys;

    /**
     * The <tt>char **</tt> array of values.
     */
    public Pointer vals;

    /**
     * The Java-allocated key strings, if any, referenced here so that they stay
     * reachable for as long as this structure is.
     */
    private StringArray ownedKeys;

    private StringArray ownedVals;

    public SoapySDRKwargs()
    {
        size = new SizeT();
    }

    public SoapySDRKwargs(Pointer p)
    {
        super(p);
        read();
    }

    /**
     * Initializes a new <tt>SoapySDRKwargs</tt> which points to Java-allocated
     * copies of specific keys and values. The caller keeps the new instance
     * reachable for the duration of the native call which reads it.
     *
     * @param keys the keys
     * @param vals the values, as many as there are keys
     */
    public SoapySDRKwargs(String[] keys, String[] vals)
    {
        if (keys.length != vals.length)
            throw new IllegalArgumentException("keys.length != vals.length");

        size = new SizeT(keys.length);
        if (keys.length != 0)
        {
            ownedKeys = new StringArray(keys, "UTF-8");
            ownedVals = new StringArray(vals, "UTF-8");
            this.keys = ownedKeys;
            this.vals = ownedVals;
        }
        write();
    }

    /**
     * Copies the keys of this structure into Java strings.
     *
     * @return the keys of this structure
     */
    public String[] readKeys()
    {
        return readStrings(keys);
    }

    /**
     * Copies the values of this structure into Java strings.
     *
     * @return the values of this structure
     */
    public String[] readValues()
    {
        return readStrings(vals);
    }

    private String[] readStrings(Pointer array)
    {
        int n = size.intValue();
        String[] strings = new String[n];

        for (int i = 0; i < n; i++)
        {
            Pointer s = array.getPointer((long) i * Native.POINTER_SIZE);

            strings[i] = (s == null) ? null : s.getString(0, "UTF-8");
        }
        return strings;
    }
}
