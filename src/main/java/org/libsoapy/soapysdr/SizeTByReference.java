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
import com.sun.jna.ptr.*;

/**
 * Represents a <tt>size_t *</tt> out parameter, which SoapySDR uses to return
 * the length of the arrays it allocates.
 */
public class SizeTByReference
    extends ByReference
{
    public SizeTByReference()
    {
        this(0);
    }

    public SizeTByReference(long value)
    {
        super(Native.SIZE_T_SIZE);
        setValue(value);
    }

    public long getValue()
    {
        Pointer p = getPointer();

        return (Native.SIZE_T_SIZE == 8) ? p.getLong(0) : (p.getInt(0) & 0xFFFFFFFFL);
    }

    public void setValue(long value)
    {
        Pointer p = getPointer();

        if (Native.SIZE_T_SIZE == 8)
            p.setLong(0, value);
        else
            p.setInt(0, (int) value);
    }
}
