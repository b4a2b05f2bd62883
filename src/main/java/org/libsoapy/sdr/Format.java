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

/**
 * Enumerates the stream sample formats of SoapySDR. The name of a format
 * starts with <tt>C</tt> if it is complex, followed by <tt>F</tt> (floating
 * point), <tt>S</tt> (signed integer) or <tt>U</tt> (unsigned integer) and
 * the number of bits per number.
 * <p>
 * The sizes in bytes per element are fixed here and match what
 * <tt>SoapySDR_formatToSize</tt> reports. Setting up a stream checks the
 * size of its format against the native library and fails with
 * {@link ErrorCode#NOT_SUPPORTED} on a mismatch.
 * </p>
 */
public enum Format
{
    CF64(16),
    CF32(8),
    CS32(8),
    CU32(8),
    CS16(4),
    CU16(4),
    CS12(3, false),
    CU12(3, false),
    CS8(2),
    CU8(2),
    CS4(1, false),
    CU4(1, false),
    F64(8),
    F32(4),
    S32(4),
    U32(4),
    S16(2),
    U16(2),
    S8(1),
    U8(1);

    /**
     * Gets the <tt>Format</tt> with a specific name.
     *
     * @param name the name of the format, for example <tt>CF32</tt>
     * @return the <tt>Format</tt> named <tt>name</tt> or <tt>null</tt> if
     * there is no such format
     */
    public static Format fromName(String name)
    {
        if (name != null)
        {
            for (Format format : values())
            {
                if (format.name().equals(name))
                    return format;
            }
        }
        return null;
    }

    private final int size;

    private final boolean independentlyAddressable;

    private Format(int size)
    {
        this(size, true);
    }

    private Format(int size, boolean independentlyAddressable)
    {
        this.size = size;
        this.independentlyAddressable = independentlyAddressable;
    }

    /**
     * Gets the name of this format as SoapySDR spells it.
     *
     * @return the name of this format
     */
    public String getName()
    {
        return name();
    }

    /**
     * Gets the number of bytes of one element of this format. The value is
     * not read from the native library; stream setup compares it with
     * <tt>SoapySDR_formatToSize</tt>.
     *
     * @return the number of bytes of one element of this format
     */
    public int size()
    {
        return size;
    }

    /**
     * Determines whether every element of this format starts on a byte
     * boundary. Packed 12-bit and 4-bit formats do not, so a buffer of such
     * elements cannot be split at an arbitrary element.
     *
     * @return <tt>true</tt> if elements of this format are byte-aligned
     */
    public boolean isIndependentlyAddressable()
    {
        return independentlyAddressable;
    }
}
