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
import java.util.*;
import java.util.concurrent.atomic.*;

import com.sun.jna.*;
import com.sun.jna.ptr.*;
import org.junit.*;
import org.libsoapy.soapysdr.*;

import static org.easymock.EasyMock.*;
import static org.junit.Assert.*;

public class StreamTest
{
    private static final Pointer DEVICE = new Pointer(0x1000);

    private static final Pointer STREAM = new Pointer(0x2000);

    private SoapySDRLibrary lib;

    private final AtomicInteger activations = new AtomicInteger();

    private final AtomicInteger deactivations = new AtomicInteger();

    private final AtomicInteger closes = new AtomicInteger();

    private final AtomicInteger unmakes = new AtomicInteger();

    /**
     * The flags and the time of each activation, each deactivation and each
     * write, in order.
     */
    private final List<long[]> calls = new ArrayList<>();

    private int activateResult = 0;

    private int deactivateResult = 0;

    @Before
    public void setUp()
    {
        lib = createNiceMock(SoapySDRLibrary.class);
        expect(lib.SoapySDRDevice_make(anyObject(SoapySDRKwargs.class)))
            .andReturn(DEVICE).anyTimes();
        expect(lib.SoapySDRDevice_unmake(DEVICE))
            .andAnswer(() -> {
                unmakes.incrementAndGet();
                return 0;
            })
            .anyTimes();
        expect(lib.SoapySDR_formatToSize(anyObject(String.class)))
            .andAnswer(
                    () -> new SizeT(
                            Format.fromName((String) getCurrentArguments()[0])
                                .size()))
            .anyTimes();
        expect(
                lib.SoapySDRDevice_setupStream(
                        eq(DEVICE),
                        anyInt(),
                        anyObject(String.class),
                        anyObject(Pointer.class),
                        anyObject(SizeT.class),
                        anyObject(SoapySDRKwargs.class)))
            .andReturn(STREAM).anyTimes();
        expect(
                lib.SoapySDRDevice_activateStream(
                        eq(DEVICE),
                        eq(STREAM),
                        anyInt(),
                        anyLong(),
                        anyObject(SizeT.class)))
            .andAnswer(() -> {
                Object[] args = getCurrentArguments();

                activations.incrementAndGet();
                calls.add(
                        new long[] {
                            (Integer) args[2],
                            (Long) args[3],
                            ((SizeT) args[4]).longValue()
                        });
                return activateResult;
            })
            .anyTimes();
        expect(
                lib.SoapySDRDevice_deactivateStream(
                        eq(DEVICE),
                        eq(STREAM),
                        anyInt(),
                        anyLong()))
            .andAnswer(() -> {
                Object[] args = getCurrentArguments();

                deactivations.incrementAndGet();
                calls.add(new long[] { (Integer) args[2], (Long) args[3] });
                return deactivateResult;
            })
            .anyTimes();
        expect(lib.SoapySDRDevice_closeStream(DEVICE, STREAM))
            .andAnswer(() -> {
                closes.incrementAndGet();
                return 0;
            })
            .anyTimes();
        expect(lib.SoapySDRDevice_getStreamMTU(DEVICE, STREAM))
            .andReturn(new SizeT(1024)).anyTimes();
    }

    private Device openDevice()
        throws SoapySDRException
    {
        replay(lib);
        return new Device(lib, new Args());
    }

    private void expectReads(int result, int flags, long timeNs)
    {
        expect(
                lib.SoapySDRDevice_readStream(
                        eq(DEVICE),
                        eq(STREAM),
                        anyObject(Pointer[].class),
                        anyObject(SizeT.class),
                        anyObject(IntByReference.class),
                        anyObject(LongByReference.class),
                        anyObject(NativeLong.class)))
            .andAnswer(() -> {
                Object[] args = getCurrentArguments();
                Pointer[] buffs = (Pointer[]) args[2];
                long numElems = ((SizeT) args[3]).longValue();

                calls.add(new long[] { buffs.length, numElems });
                if (result > 0)
                {
                    for (Pointer buff : buffs)
                    {
                        buff.setFloat(0, 0.25f);
                        buff.setFloat(4, -0.5f);
                    }
                }
                ((IntByReference) args[4]).setValue(flags);
                ((LongByReference) args[5]).setValue(timeNs);
                return result;
            })
            .anyTimes();
    }

    private void expectWrites(int maxPerCall)
    {
        expect(
                lib.SoapySDRDevice_writeStream(
                        eq(DEVICE),
                        eq(STREAM),
                        anyObject(Pointer[].class),
                        anyObject(SizeT.class),
                        anyObject(IntByReference.class),
                        anyLong(),
                        anyObject(NativeLong.class)))
            .andAnswer(() -> {
                Object[] args = getCurrentArguments();
                long numElems = ((SizeT) args[3]).longValue();
                int flags = ((IntByReference) args[4]).getValue();
                long timeNs = (Long) args[5];

                calls.add(new long[] { numElems, flags, timeNs });
                return (int) Math.min(numElems, maxPerCall);
            })
            .anyTimes();
    }

    @Test
    public void activateTwiceFailsAndStaysActive()
        throws Exception
    {
        RxStream<FloatBuffer> stream
            = openDevice().rxStream(StreamSample.CF32, 0);

        stream.activate();
        assertTrue(stream.isActive());
        try
        {
            stream.activate();
            fail("expected SoapySDRException");
        }
        catch (SoapySDRException sdre)
        {
            assertEquals(ErrorCode.OTHER, sdre.getErrorCode());
            assertEquals("Stream is already active", sdre.getMessage());
        }
        assertTrue(stream.isActive());
        assertEquals(1, activations.get());
    }

    @Test
    public void deactivateBeforeActivateFails()
        throws Exception
    {
        TxStream<ShortBuffer> stream
            = openDevice().txStream(StreamSample.CS16, 0);

        try
        {
            stream.deactivate();
            fail("expected SoapySDRException");
        }
        catch (SoapySDRException sdre)
        {
            assertEquals(ErrorCode.OTHER, sdre.getErrorCode());
            assertEquals("Stream is not active", sdre.getMessage());
        }
        assertFalse(stream.isActive());
        assertEquals(0, deactivations.get());
    }

    @Test
    public void timedActivationSetsHasTime()
        throws Exception
    {
        RxStream<FloatBuffer> stream
            = openDevice().rxStream(StreamSample.CF32, 0);

        stream.activate(5000000000L);
        stream.deactivate();
        stream.activateBurst(4096);

        assertArrayEquals(
                new long[] { SoapySDR.SOAPY_SDR_HAS_TIME, 5000000000L, 0 },
                calls.get(0));
        assertArrayEquals(new long[] { 0, 0 }, calls.get(1));
        assertArrayEquals(
                new long[] { SoapySDR.SOAPY_SDR_END_BURST, 0, 4096 },
                calls.get(2));
    }

    @Test
    public void timedDeactivationSetsHasTime()
        throws Exception
    {
        TxStream<FloatBuffer> stream
            = openDevice().txStream(StreamSample.CF32, 0);

        stream.activate();
        stream.deactivate(9000000000L);

        assertArrayEquals(
                new long[] { SoapySDR.SOAPY_SDR_HAS_TIME, 9000000000L },
                calls.get(1));
        assertFalse(stream.isActive());
    }

    @Test
    public void failedActivationLeavesStreamInactive()
        throws Exception
    {
        activateResult = SoapySDR.SOAPY_SDR_NOT_SUPPORTED;

        RxStream<FloatBuffer> stream
            = openDevice().rxStream(StreamSample.CF32, 0);

        try
        {
            stream.activate(1000L);
            fail("expected SoapySDRException");
        }
        catch (SoapySDRException sdre)
        {
            assertEquals(ErrorCode.NOT_SUPPORTED, sdre.getErrorCode());
        }
        assertFalse(stream.isActive());

        try
        {
            stream.deactivate();
            fail("expected SoapySDRException");
        }
        catch (SoapySDRException sdre)
        {
            assertEquals("Stream is not active", sdre.getMessage());
        }
        assertEquals(0, deactivations.get());

        activateResult = 0;
        stream.activate();
        assertTrue(stream.isActive());
    }

    @Test
    public void readTransfersAndRecordsFlags()
        throws Exception
    {
        expectReads(
                10,
                SoapySDR.SOAPY_SDR_HAS_TIME | SoapySDR.SOAPY_SDR_END_BURST,
                123456789L);

        RxStream<FloatBuffer> stream
            = openDevice().rxStream(StreamSample.CF32, 0);
        FloatBuffer buffer = StreamSample.CF32.allocate(16);

        buffer.position(2);
        stream.activate();

        int read = stream.read(buffer, 100000);

        assertEquals(10, read);
        assertEquals(22, buffer.position());
        assertEquals(0.25f, buffer.get(2), 0f);
        assertEquals(-0.5f, buffer.get(3), 0f);
        assertArrayEquals(new long[] { 1, 15 }, calls.get(1));
        assertTrue(stream.hasLastTime());
        assertEquals(123456789L, stream.getLastTimeNs());
        assertTrue(stream.isEndOfBurst());
        assertFalse(stream.hasMoreFragments());
    }

    @Test
    public void readRequestsTheSmallestBuffer()
        throws Exception
    {
        expectReads(3, 0, 0);

        RxStream<ShortBuffer> stream
            = openDevice().rxStream(StreamSample.CS16, 0, 1);
        ShortBuffer a = StreamSample.CS16.allocate(8);
        ShortBuffer b = StreamSample.CS16.allocate(5);

        assertEquals(3, stream.read(new ShortBuffer[] { a, b }, 1000));
        assertArrayEquals(new long[] { 2, 5 }, calls.get(0));
        assertEquals(6, a.position());
        assertEquals(6, b.position());
        assertFalse(stream.hasLastTime());
    }

    @Test
    public void readErrorIsTranslated()
        throws Exception
    {
        expectReads(SoapySDR.SOAPY_SDR_OVERFLOW, 0, 0);

        RxStream<FloatBuffer> stream
            = openDevice().rxStream(StreamSample.CF32, 0);
        FloatBuffer buffer = StreamSample.CF32.allocate(8);

        try
        {
            stream.read(buffer, 1000);
            fail("expected SoapySDRException");
        }
        catch (SoapySDRException sdre)
        {
            assertEquals(ErrorCode.OVERFLOW, sdre.getErrorCode());
        }
        assertEquals(0, buffer.position());
    }

    @Test(expected = IllegalArgumentException.class)
    public void readRequiresOneBufferPerChannel()
        throws Exception
    {
        RxStream<FloatBuffer> stream
            = openDevice().rxStream(StreamSample.CF32, 0, 1);

        stream.read(StreamSample.CF32.allocate(8), 1000);
    }

    @Test(expected = IllegalArgumentException.class)
    public void readRejectsHeapBuffer()
        throws Exception
    {
        RxStream<FloatBuffer> stream
            = openDevice().rxStream(StreamSample.CF32, 0);

        stream.read(FloatBuffer.allocate(8), 1000);
    }

    @Test
    public void writeAllChunksAndTimestampsOnlyTheFirstCall()
        throws Exception
    {
        expectWrites(4);

        TxStream<FloatBuffer> stream
            = openDevice().txStream(StreamSample.CF32, 0);
        FloatBuffer buffer = StreamSample.CF32.allocate(10);

        stream.activate();
        calls.clear();
        stream.writeAll(buffer, 777L, true, 1000);

        int endBurst = SoapySDR.SOAPY_SDR_END_BURST;
        int hasTime = SoapySDR.SOAPY_SDR_HAS_TIME;

        assertEquals(3, calls.size());
        assertArrayEquals(
                new long[] { 10, endBurst | hasTime, 777 },
                calls.get(0));
        assertArrayEquals(new long[] { 6, endBurst, 0 }, calls.get(1));
        assertArrayEquals(new long[] { 2, endBurst, 0 }, calls.get(2));
        assertEquals(0, buffer.remaining());
    }

    @Test
    public void writeAllWithoutProgressTimesOut()
        throws Exception
    {
        expectWrites(0);

        TxStream<FloatBuffer> stream
            = openDevice().txStream(StreamSample.CF32, 0);
        FloatBuffer buffer = StreamSample.CF32.allocate(4);

        stream.activate();
        calls.clear();
        try
        {
            stream.writeAll(buffer, null, false, 1000);
            fail("expected SoapySDRException");
        }
        catch (SoapySDRException sdre)
        {
            assertEquals(ErrorCode.TIMEOUT, sdre.getErrorCode());
        }
        assertEquals(1, calls.size());
        assertEquals(0, buffer.position());
    }

    @Test
    public void writeAllStopsAfterPartialProgress()
        throws Exception
    {
        AtomicInteger answers = new AtomicInteger();

        expect(
                lib.SoapySDRDevice_writeStream(
                        eq(DEVICE),
                        eq(STREAM),
                        anyObject(Pointer[].class),
                        anyObject(SizeT.class),
                        anyObject(IntByReference.class),
                        anyLong(),
                        anyObject(NativeLong.class)))
            .andAnswer(() -> (answers.getAndIncrement() == 0) ? 3 : 0)
            .anyTimes();

        TxStream<ShortBuffer> stream
            = openDevice().txStream(StreamSample.CS16, 0);
        ShortBuffer buffer = StreamSample.CS16.allocate(8);

        try
        {
            stream.writeAll(buffer, 100L, true, 1000);
            fail("expected SoapySDRException");
        }
        catch (SoapySDRException sdre)
        {
            assertEquals(ErrorCode.TIMEOUT, sdre.getErrorCode());
        }
        assertEquals(2, answers.get());
        assertEquals(6, buffer.position());
    }

    @Test
    public void writeReturnsShortCount()
        throws Exception
    {
        expectWrites(3);

        TxStream<ByteBuffer> stream
            = openDevice().txStream(StreamSample.CS8, 0);
        ByteBuffer buffer = StreamSample.CS8.allocate(8);

        assertEquals(3, stream.write(buffer, null, false, 1000));
        assertEquals(6, buffer.position());
        assertArrayEquals(new long[] { 8, 0, 0 }, calls.get(0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void writeRequiresEqualBuffers()
        throws Exception
    {
        TxStream<FloatBuffer> stream
            = openDevice().txStream(StreamSample.CF32, 0, 1);

        stream.write(
                new FloatBuffer[] {
                    StreamSample.CF32.allocate(8),
                    StreamSample.CF32.allocate(7)
                },
                null,
                false,
                1000);
    }

    @Test
    public void readStatus()
        throws Exception
    {
        expect(
                lib.SoapySDRDevice_readStreamStatus(
                        eq(DEVICE),
                        eq(STREAM),
                        anyObject(SizeTByReference.class),
                        anyObject(IntByReference.class),
                        anyObject(LongByReference.class),
                        anyObject(NativeLong.class)))
            .andAnswer(() -> {
                Object[] args = getCurrentArguments();

                ((SizeTByReference) args[2]).setValue(1);
                ((IntByReference) args[3]).setValue(
                        SoapySDR.SOAPY_SDR_END_BURST
                            | SoapySDR.SOAPY_SDR_HAS_TIME);
                ((LongByReference) args[4]).setValue(42L);
                return 0;
            });

        TxStream<FloatBuffer> stream
            = openDevice().txStream(StreamSample.CF32, 0);
        StreamStatus status = stream.readStatus(1000);

        assertEquals(1, status.getChannelMask());
        assertTrue(status.isEndOfBurst());
        assertTrue(status.hasTime());
        assertEquals(42L, status.getTimeNs());
    }

    @Test
    public void closeDeactivatesOnceThenClosesAndReleases()
        throws Exception
    {
        deactivateResult = SoapySDR.SOAPY_SDR_STREAM_ERROR;

        Device device = openDevice();
        TxStream<FloatBuffer> stream = device.txStream(StreamSample.CF32, 0);

        stream.activate();
        device.close();
        stream.close();

        assertEquals(1, deactivations.get());
        assertEquals(1, closes.get());
        assertEquals(1, unmakes.get());
        assertTrue(stream.isClosed());
        assertFalse(stream.isActive());

        stream.close();
        assertEquals(1, closes.get());
        try
        {
            stream.getMtu();
            fail("expected IllegalStateException");
        }
        catch (IllegalStateException ise)
        {
            // Expected.
        }
    }

    @Test
    public void metadata()
        throws Exception
    {
        RxStream<DoubleBuffer> stream
            = openDevice().rxStream(StreamSample.CF64, 0, 1, 2);

        assertEquals(3, stream.getChannelCount());
        assertEquals(Format.CF64, stream.getFormat());
        assertSame(StreamSample.CF64, stream.getSample());
        assertEquals(1024, stream.getMtu());
    }
}
