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
 * Maps the native <tt>size_t</tt> type which SoapySDR uses for channel
 * indices, lengths and element counts.
 */
public class SizeT
    extends IntegerType
{
    private static final long serialVersionUID = 0L;

    public SizeT()
    {
        this(0);
    }

    public SizeT(long value)
    {
        super(Native.SIZE_T_SIZE, value, true);
    }
}
