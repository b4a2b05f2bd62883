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

import com.sun.jna.*;
import com.sun.jna.ptr.*;
import org.libsoapy.soapysdr.*;

/**
 * A stream which transmits samples through a device. It is obtained through
 * {@link Device#txStream}.
 *
 * @param <B> the NIO buffer type of the samples of the stream
 */
public class TxStream<B extends Buffer>
    extends AbstractStream<B>
{
    TxStream(
            DeviceHandle device,
            Pointer stream,
            StreamSample<B> sample,
            int channelCount)
    {
        super(device, stream, sample, channelCount);
    }

    /**
     * Writes samples from one buffer per channel. The driver may accept fewer
     * elements than the buffers hold. The position of each buffer is
     * advanced by the number of elements written.
     *
     * @param buffers one direct buffer in native byte order per channel, all
     * with the same number of remaining elements
     * @param atNs the hardware time in nanoseconds at which to transmit the
     * first element or <tt>null</tt> to transmit as soon as possible
     * @param endBurst <tt>true</tt> if the last element of the buffers ends a
     * burst
     * @param timeoutUs the maximum time to block in microseconds
     * @return the number of elements written from each buffer
     * @throws SoapySDRException if the driver reports an error
     * @throws IllegalArgumentException if there is not exactly one valid
     * buffer per channel or if the buffers hold different numbers of elements
     */
    public int write(B[] buffers, Long atNs, boolean endBurst, long timeoutUs)
        throws SoapySDRException
    {
        checkOpen();

        Pointer[] pointers = pointers(buffers);
        int numElems = sample.elements(buffers[0]);

        for (B buffer : buffers)
        {
            if (sample.elements(buffer) != numElems)
            {
                throw new IllegalArgumentException(
                        "All buffers must hold the same number of elements");
            }
        }

        int flags = 0;

        if (atNs != null)
            flags |= SoapySDR.SOAPY_SDR_HAS_TIME;
        if (endBurst)
            flags |= SoapySDR.SOAPY_SDR_END_BURST;

        int written
            = translator.checkLength(
                    lib.SoapySDRDevice_writeStream(
                            getDevicePointer(),
                            getStreamPointer(),
                            pointers,
                            new SizeT(numElems),
                            new IntByReference(flags),
                            (atNs == null) ? 0 : atNs,
                            new NativeLong(timeoutUs)));

        advance(buffers, written);
        return written;
    }

    public int write(B buffer, Long atNs, boolean endBurst, long timeoutUs)
        throws SoapySDRException
    {
        return write(single(buffer), atNs, endBurst, timeoutUs);
    }

    /**
     * Writes every remaining element of one buffer per channel, calling
     * {@link #write(Buffer[], Long, boolean, long)} as many times as it takes.
     * Only the first call is given <tt>atNs</tt>; the elements after it follow
     * without a gap. <tt>endBurst</tt> is passed to every call.
     *
     * @param buffers one direct buffer in native byte order per channel, all
     * with the same number of remaining elements
     * @param atNs the hardware time in nanoseconds at which to transmit the
     * first element or <tt>null</tt> to transmit as soon as possible
     * @param endBurst <tt>true</tt> if the last element of the buffers ends a
     * burst
     * @param timeoutUs the maximum time for each call to block in
     * microseconds
     * @throws SoapySDRException if the driver reports an error or if a call
     * writes nothing within <tt>timeoutUs</tt> ({@link ErrorCode#TIMEOUT}).
     * The positions of the buffers tell how much was written before.
     */
    public void writeAll(
            B[] buffers,
            Long atNs,
            boolean endBurst,
            long timeoutUs)
        throws SoapySDRException
    {
        Long timeNs = atNs;

        pointers(buffers);
        while (sample.elements(buffers[0]) > 0)
        {
            int written = write(buffers, timeNs, endBurst, timeoutUs);

            if (written == 0)
            {
                throw new SoapySDRException(
                        ErrorCode.TIMEOUT,
                        "No elements written within " + timeoutUs + " us, "
                            + sample.elements(buffers[0]) + " remaining");
            }
            timeNs = null;
        }
    }

    public void writeAll(B buffer, Long atNs, boolean endBurst, long timeoutUs)
        throws SoapySDRException
    {
        writeAll(single(buffer), atNs, endBurst, timeoutUs);
    }

    /**
     * Waits for an asynchronous status event of this stream, such as an
     * underflow or the acknowledgement of the end of a burst.
     *
     * @param timeoutUs the maximum time to block in microseconds
     * @return the status event
     * @throws SoapySDRException if the driver reports an error, for example
     * {@link ErrorCode#TIMEOUT} if there was no event
     */
    public StreamStatus readStatus(long timeoutUs)
        throws SoapySDRException
    {
        checkOpen();

        SizeTByReference chanMask = new SizeTByReference();
        IntByReference flags = new IntByReference(0);
        LongByReference timeNs = new LongByReference(0);

        translator.checkLength(
                lib.SoapySDRDevice_readStreamStatus(
                        getDevicePointer(),
                        getStreamPointer(),
                        chanMask,
                        flags,
                        timeNs,
                        new NativeLong(timeoutUs)));
        return
            new StreamStatus(
                    chanMask.getValue(),
                    flags.getValue(),
                    timeNs.getValue());
    }
}
