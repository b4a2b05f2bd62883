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

import com.sun.jna.*;
import org.junit.*;
import org.libsoapy.soapysdr.*;

import static org.easymock.EasyMock.*;
import static org.junit.Assert.*;

public class DeviceHandleTest
{
    private static final Pointer DEVICE = new Pointer(0x1000);

    @Test
    public void unmakesOnceAfterLastRelease()
    {
        SoapySDRLibrary lib = createMock(SoapySDRLibrary.class);

        expect(lib.SoapySDRDevice_unmake(DEVICE)).andReturn(0).once();
        replay(lib);

        DeviceHandle handle = new DeviceHandle(lib, DEVICE);

        handle.retain();
        assertEquals(2, handle.getRefCount());
        handle.release();
        assertSame(DEVICE, handle.getPointer());
        handle.release();
        assertEquals(0, handle.getRefCount());
        verify(lib);
    }

    @Test
    public void closedHandleCannotBeUsed()
    {
        SoapySDRLibrary lib = createNiceMock(SoapySDRLibrary.class);

        replay(lib);

        DeviceHandle handle = new DeviceHandle(lib, DEVICE);

        handle.release();
        try
        {
            handle.getPointer();
            fail("expected IllegalStateException");
        }
        catch (IllegalStateException ise)
        {
            // Expected.
        }
        try
        {
            handle.retain();
            fail("expected IllegalStateException");
        }
        catch (IllegalStateException ise)
        {
            // Expected.
        }
    }
}
