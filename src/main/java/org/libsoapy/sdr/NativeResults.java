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

import com.sun.jna.*;
import com.sun.jna.ptr.*;
import org.libsoapy.soapysdr.*;

/**
 * Copies the values which the native SoapySDR library allocates and returns
 * into Java objects and hands the native memory back to the matching free
 * function exactly once.
 */
final class NativeResults
{
    /**
     * Copies and frees a <tt>char *</tt> allocated by SoapySDR.
     */
    static String string(SoapySDRLibrary lib, Pointer p)
    {
        if (p == null)
            return "";
        try
        {
            return p.getString(0, "UTF-8");
        }
        finally
        {
            lib.SoapySDR_free(p);
        }
    }

    /**
     * Copies and frees a <tt>char **</tt> of <tt>length</tt> elements
     * allocated by SoapySDR.
     */
    static List<String> strings(SoapySDRLibrary lib, Pointer p, long length)
    {
        if (p == null)
            return new ArrayList<>();
        try
        {
            List<String> strings = new ArrayList<>((int) length);

            for (long i = 0; i < length; i++)
            {
                Pointer s = p.getPointer(i * Native.POINTER_SIZE);

                strings.add((s == null) ? "" : s.getString(0, "UTF-8"));
            }
            return strings;
        }
        finally
        {
            lib.SoapySDRStrings_clear(
                    new PointerByReference(p),
                    new SizeT(length));
        }
    }

    /**
     * Copies and frees a <tt>double *</tt> of <tt>length</tt> elements
     * allocated by SoapySDR.
     */
    static List<Double> doubles(SoapySDRLibrary lib, Pointer p, long length)
    {
        List<Double> doubles = new ArrayList<>((int) length);

        if (p == null)
            return doubles;
        try
        {
            for (double d : p.getDoubleArray(0, (int) length))
                doubles.add(d);
            return doubles;
        }
        finally
        {
            lib.SoapySDR_free(p);
        }
    }

    /**
     * Copies and frees a <tt>SoapySDRRange *</tt> of <tt>length</tt> elements
     * allocated by SoapySDR.
     */
    static List<Range> ranges(SoapySDRLibrary lib, Pointer p, long length)
    {
        List<Range> ranges = new ArrayList<>((int) length);

        if (p == null)
            return ranges;
        try
        {
            if (length > 0)
            {
                Structure[] structs
                    = new SoapySDRRange(p).toArray((int) length);

                for (Structure s : structs)
                    ranges.add(new Range((SoapySDRRange) s));
            }
            return ranges;
        }
        finally
        {
            lib.SoapySDR_free(p);
        }
    }

    /**
     * Copies and clears a <tt>SoapySDRKwargs</tt> returned by value.
     */
    static Args args(SoapySDRLibrary lib, SoapySDRKwargs kwargs)
    {
        if (kwargs == null)
            return new Args();
        try
        {
            return Args.fromNative(kwargs);
        }
        finally
        {
            lib.SoapySDRKwargs_clear(kwargs.getPointer());
        }
    }

    /**
     * Copies and frees a <tt>SoapySDRKwargs *</tt> of <tt>length</tt> elements
     * allocated by SoapySDR.
     */
    static List<Args> argsList(SoapySDRLibrary lib, Pointer p, long length)
    {
        List<Args> list = new ArrayList<>((int) length);

        if (p == null)
            return list;
        try
        {
            if (length > 0)
            {
                Structure[] structs
                    = new SoapySDRKwargs(p).toArray((int) length);

                for (Structure s : structs)
                    list.add(Args.fromNative((SoapySDRKwargs) s));
            }
            return list;
        }
        finally
        {
            lib.SoapySDRKwargsList_clear(p, new SizeT(length));
        }
    }

    /**
     * Copies and clears a <tt>SoapySDRArgInfo</tt> returned by value.
     */
    static ArgInfo argInfo(SoapySDRLibrary lib, SoapySDRArgInfo info)
    {
        try
        {
            return ArgInfo.fromNative(info);
        }
        finally
        {
            lib.SoapySDRArgInfo_clear(info.getPointer());
        }
    }

    /**
     * Copies and frees a <tt>SoapySDRArgInfo *</tt> of <tt>length</tt>
     * elements allocated by SoapySDR. The list is freed exactly once, also
     * when it is empty or when one of its elements is malformed.
     */
    static List<ArgInfo> argInfoList(
            SoapySDRLibrary lib,
            Pointer p,
            long length)
    {
        try
        {
            List<ArgInfo> list = new ArrayList<>((int) length);

            if (p != null && length > 0)
            {
                Structure[] structs
                    = new SoapySDRArgInfo(p).toArray((int) length);

                for (Structure s : structs)
                    list.add(ArgInfo.fromNative((SoapySDRArgInfo) s));
            }
            return list;
        }
        finally
        {
            lib.SoapySDRArgInfoList_clear(p, new SizeT(length));
        }
    }

    private NativeResults()
    {
    }
}
