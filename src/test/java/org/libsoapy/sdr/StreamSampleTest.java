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

import java.nio.*;

import org.junit.*;

import static org.junit.Assert.*;

public class StreamSampleTest
{
    private static ByteOrder foreignOrder()
    {
        return
            (ByteOrder.nativeOrder() == ByteOrder.LITTLE_ENDIAN)
                ? ByteOrder.BIG_ENDIAN
                : ByteOrder.LITTLE_ENDIAN;
    }

    @Test
    public void everyByteAlignedFormatIsRegistered()
    {
        for (Format format : Format.values())
        {
            if (!format.isIndependentlyAddressable())
                continue;

            StreamSample<?> sample = StreamSample.forFormat(format);

            assertSame(format, sample.getFormat());
            assertEquals(
                    format.size(),
                    sample.getComponentBytes() * sample.getComponents());
        }
        assertSame(StreamSample.CF32, StreamSample.forFormat(Format.CF32));
        assertSame(FloatBuffer.class, StreamSample.CF32.getBufferClass());
        assertSame(ShortBuffer.class, StreamSample.CS16.getBufferClass());
    }

    @Test(expected = IllegalArgumentException.class)
    public void packedFormatHasNoBufferType()
    {
        StreamSample.forFormat(Format.CS12);
    }

    @Test
    public void allocateGivesDirectNativeOrderBuffer()
    {
        FloatBuffer buffer = StreamSample.CF32.allocate(16);

        assertTrue(buffer.isDirect());
        assertEquals(ByteOrder.nativeOrder(), buffer.order());
        assertEquals(32, buffer.capacity());
        assertEquals(16, StreamSample.CF32.elements(buffer));
        StreamSample.CF32.validate(buffer);
    }

    @Test
    public void elementsCountsWholeElements()
    {
        FloatBuffer buffer = StreamSample.CF32.allocate(4);

        buffer.limit(7);
        assertEquals(3, StreamSample.CF32.elements(buffer));
        assertEquals(7, StreamSample.F32.elements(buffer));
    }

    @Test(expected = IllegalArgumentException.class)
    public void heapBufferIsRejected()
    {
        StreamSample.CF32.validate(FloatBuffer.allocate(8));
    }

    @Test(expected = IllegalArgumentException.class)
    public void foreignOrderIsRejected()
    {
        ShortBuffer buffer
            = ByteBuffer.allocateDirect(16).order(foreignOrder())
                .asShortBuffer();

        StreamSample.CS16.validate(buffer);
    }

    @Test(expected = IllegalArgumentException.class)
    public void wrongBufferTypeIsRejected()
    {
        StreamSample.CF32.validate(StreamSample.CS16.allocate(4));
    }

    @Test
    public void pointerFollowsPosition()
    {
        FloatBuffer buffer = StreamSample.CF32.allocate(4);

        buffer.position(2);
        StreamSample.CF32.pointer(buffer).setFloat(0, 2.5f);
        assertEquals(2.5f, buffer.get(2), 0f);

        StreamSample.CF32.advance(buffer, 1);
        assertEquals(4, buffer.position());
    }
}
