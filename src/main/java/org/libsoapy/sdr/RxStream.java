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
 * A stream which receives samples from a device. It is obtained through
 * {@link Device#rxStream}.
 *
 * @param <B> the NIO buffer type of the samples of the stream
 */
public class RxStream<B extends Buffer>
    extends AbstractStream<B>
{
    private int lastFlags;

    private long lastTimeNs;

    RxStream(
            DeviceHandle device,
            Pointer stream,
            StreamSample<B> sample,
            int channelCount)
    {
        super(device, stream, sample, channelCount);
    }

    /**
     * Reads samples into one buffer per channel. As many elements are
     * requested as the fullest buffer has room for; the driver may deliver
     * fewer. The position of each buffer is advanced by the number of
     * elements read.
     *
     * @param buffers one direct buffer in native byte order per channel
     * @param timeoutUs the maximum time to block in microseconds
     * @return the number of elements read into each buffer
     * @throws SoapySDRException if the driver reports an error such as
     * {@link ErrorCode#TIMEOUT} or {@link ErrorCode#OVERFLOW}
     * @throws IllegalArgumentException if there is not exactly one valid
     * buffer per channel
     */
    public int read(B[] buffers, long timeoutUs)
        throws SoapySDRException
    {
        checkOpen();

        Pointer[] pointers = pointers(buffers);
        int numElems = Integer.MAX_VALUE;

        for (B buffer : buffers)
            numElems = Math.min(numElems, sample.elements(buffer));

        IntByReference flags = new IntByReference(0);
        LongByReference timeNs = new LongByReference(0);
        int ret
            = lib.SoapySDRDevice_readStream(
                    getDevicePointer(),
                    getStreamPointer(),
                    pointers,
                    new SizeT(numElems),
                    flags,
                    timeNs,
                    new NativeLong(timeoutUs));

        lastFlags = flags.getValue();
        lastTimeNs = timeNs.getValue();

        int read = translator.checkLength(ret);

        advance(buffers, read);
        return read;
    }

    /**
     * Reads samples from a single-channel stream.
     *
     * @param buffer a direct buffer in native byte order
     * @param timeoutUs the maximum time to block in microseconds
     * @return the number of elements read
     * @throws SoapySDRException if the driver reports an error
     * @see #read(Buffer[], long)
     */
    public int read(B buffer, long timeoutUs)
        throws SoapySDRException
    {
        return read(single(buffer), timeoutUs);
    }

    /**
     * Gets the flags which the driver returned with the last read.
     *
     * @return the <tt>SOAPY_SDR_*</tt> flags of the last read
     */
    public int getLastFlags()
    {
        return lastFlags;
    }

    /**
     * Determines whether the last read returned a timestamp.
     *
     * @return <tt>true</tt> if {@link #getLastTimeNs()} is valid
     */
    public boolean hasLastTime()
    {
        return (lastFlags & SoapySDR.SOAPY_SDR_HAS_TIME) != 0;
    }

    /**
     * Gets the hardware time of the first element of the last read.
     *
     * @return the time in nanoseconds, valid if {@link #hasLastTime()}
     */
    public long getLastTimeNs()
    {
        return lastTimeNs;
    }

    public boolean isEndOfBurst()
    {
        return (lastFlags & SoapySDR.SOAPY_SDR_END_BURST) != 0;
    }

    /**
     * Determines whether the last read returned only part of a packet, the
     * rest of which the next read returns.
     *
     * @return <tt>true</tt> if more fragments of the packet follow
     */
    public boolean hasMoreFragments()
    {
        return (lastFlags & SoapySDR.SOAPY_SDR_MORE_FRAGMENTS) != 0;
    }
}
