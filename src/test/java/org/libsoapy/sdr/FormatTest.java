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

import org.junit.*;

import static org.junit.Assert.*;

public class FormatTest
{
    @Test
    public void sizes()
    {
        assertEquals(16, Format.CF64.size());
        assertEquals(8, Format.CF32.size());
        assertEquals(8, Format.CS32.size());
        assertEquals(4, Format.CS16.size());
        assertEquals(3, Format.CS12.size());
        assertEquals(2, Format.CS8.size());
        assertEquals(1, Format.CS4.size());
        assertEquals(4, Format.F32.size());
        assertEquals(2, Format.U16.size());
        assertEquals(1, Format.S8.size());
    }

    @Test
    public void packedFormatsAreNotIndependentlyAddressable()
    {
        assertFalse(Format.CS12.isIndependentlyAddressable());
        assertFalse(Format.CU12.isIndependentlyAddressable());
        assertFalse(Format.CS4.isIndependentlyAddressable());
        assertFalse(Format.CU4.isIndependentlyAddressable());
        assertTrue(Format.CS16.isIndependentlyAddressable());
    }

    @Test
    public void fromName()
    {
        for (Format format : Format.values())
            assertSame(format, Format.fromName(format.getName()));
        assertNull(Format.fromName("cf32"));
        assertNull(Format.fromName("CF31"));
        assertNull(Format.fromName(null));
    }
}
