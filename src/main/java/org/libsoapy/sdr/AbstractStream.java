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
import org.jitsi.utils.logging.*;
import org.libsoapy.soapysdr.*;

/**
 * Implements the session state which receive and transmit streams share: the
 * native stream handle, the reference to the device it was set up on and the
 * activation state.
 * <p>
 * A stream starts out inactive. {@link #activate()} makes it active,
 * {@link #deactivate()} makes it inactive again and {@link #close()} releases
 * it for good. Streams are not thread-safe; a stream may be handed from one
 * thread to another between calls.
 * </p>
 *
 * @param <B> the NIO buffer type of the samples of the stream
 */
public abstract class AbstractStream<B extends Buffer>
    implements AutoCloseable
{
    /**
     * The <tt>Logger</tt> used by the <tt>AbstractStream</tt> class and its
     * instances for logging output.
     */
    private static final Logger logger
        = Logger.getLogger(AbstractStream.class);

    private final DeviceHandle device;

    protected final SoapySDRLibrary lib;

    protected final ErrorTranslator translator;

    private final Pointer stream;

    protected final StreamSample<B> sample;

    private final int channelCount;

    private boolean active = false;

    private boolean closed = false;

    AbstractStream(
            DeviceHandle device,
            Pointer stream,
            StreamSample<B> sample,
            int channelCount)
    {
        device.retain();

        this.device = device;
        this.lib = device.getLibrary();
        this.translator = new ErrorTranslator(lib);
        this.stream = stream;
        this.sample = sample;
        this.channelCount = channelCount;
    }

    /**
     * Activates this stream, starting it as soon as possible.
     *
     * @throws SoapySDRException if this stream is already active or if the
     * driver fails to activate it
     */
    public void activate()
        throws SoapySDRException
    {
        doActivate(0, null, 0);
    }

    /**
     * Activates this stream at a specific hardware time.
     *
     * @param startTimeNs the hardware time in nanoseconds at which to start
     * @throws SoapySDRException if this stream is already active or if the
     * driver fails to activate it
     */
    public void activate(long startTimeNs)
        throws SoapySDRException
    {
        doActivate(0, startTimeNs, 0);
    }

    /**
     * Activates this stream for a burst of a specific number of elements,
     * starting as soon as possible.
     *
     * @param numElems the number of elements of the burst
     * @throws SoapySDRException if this stream is already active or if the
     * driver fails to activate it
     */
    public void activateBurst(int numElems)
        throws SoapySDRException
    {
        doActivate(SoapySDR.SOAPY_SDR_END_BURST, null, numElems);
    }

    public void activateBurst(long startTimeNs, int numElems)
        throws SoapySDRException
    {
        doActivate(SoapySDR.SOAPY_SDR_END_BURST, startTimeNs, numElems);
    }

    private void doActivate(int flags, Long timeNs, int numElems)
        throws SoapySDRException
    {
        checkOpen();
        if (numElems < 0)
            throw new IllegalArgumentException("numElems " + numElems);
        if (active)
        {
            throw new SoapySDRException(
                    ErrorCode.OTHER,
                    "Stream is already active");
        }

        if (timeNs != null)
            flags |= SoapySDR.SOAPY_SDR_HAS_TIME;
        translator.checkReturnCode(
                lib.SoapySDRDevice_activateStream(
                        device.getPointer(),
                        stream,
                        flags,
                        (timeNs == null) ? 0 : timeNs,
                        new SizeT(numElems)));
        active = true;
    }

    /**
     * Deactivates this stream as soon as possible.
     *
     * @throws SoapySDRException if this stream is not active or if the driver
     * fails to deactivate it
     */
    public void deactivate()
        throws SoapySDRException
    {
        checkOpen();
        doDeactivate(null);
    }

    /**
     * Deactivates this stream at a specific hardware time.
     *
     * @param stopTimeNs the hardware time in nanoseconds at which to stop
     * @throws SoapySDRException if this stream is not active or if the driver
     * fails to deactivate it
     */
    public void deactivate(long stopTimeNs)
        throws SoapySDRException
    {
        checkOpen();
        doDeactivate(stopTimeNs);
    }

    private void doDeactivate(Long timeNs)
        throws SoapySDRException
    {
        if (!active)
        {
            throw new SoapySDRException(
                    ErrorCode.OTHER,
                    "Stream is not active");
        }

        int flags = (timeNs == null) ? 0 : SoapySDR.SOAPY_SDR_HAS_TIME;

        translator.checkReturnCode(
                lib.SoapySDRDevice_deactivateStream(
                        device.getPointer(),
                        stream,
                        flags,
                        (timeNs == null) ? 0 : timeNs));
        active = false;
    }

    /**
     * Closes this stream. An active stream is deactivated first; a failure to
     * deactivate it is logged and does not keep the stream from being closed.
     * The reference of this stream to its device is then released. Closing a
     * closed stream does nothing.
     */
    @Override
    public void close()
    {
        if (closed)
            return;

        try
        {
            if (active)
            {
                try
                {
                    doDeactivate(null);
                }
                catch (SoapySDRException sdre)
                {
                    /*
                     * The stream is closed below regardless, so the failure
                     * is only worth a record in the log.
                     */
                    logger.error("Failed to deactivate " + this, sdre);
                }
                active = false;
            }

            int ret
                = lib.SoapySDRDevice_closeStream(device.getPointer(), stream);

            if (ret != 0)
            {
                logger.warn(
                        "SoapySDRDevice_closeStream failed with " + ret + ": "
                            + lib.SoapySDRDevice_lastError());
            }
        }
        finally
        {
            closed = true;
            device.release();
        }
        if (logger.isDebugEnabled())
            logger.debug("Closed " + this);
    }

    /**
     * Gets the maximum number of elements per channel which the driver
     * recommends to transfer in a single call. Larger transfers are allowed
     * and may come out short.
     *
     * @return the stream MTU in elements
     * @throws SoapySDRException if the call fails
     */
    public int getMtu()
        throws SoapySDRException
    {
        checkOpen();

        Pointer dev = device.getPointer();
        SizeT mtu
            = translator.invoke(
                    () -> lib.SoapySDRDevice_getStreamMTU(dev, stream));

        return (mtu == null) ? 0 : mtu.intValue();
    }

    public boolean isActive()
    {
        return active;
    }

    public boolean isClosed()
    {
        return closed;
    }

    public int getChannelCount()
    {
        return channelCount;
    }

    public StreamSample<B> getSample()
    {
        return sample;
    }

    public Format getFormat()
    {
        return sample.getFormat();
    }

    /**
     * Checks that this stream has not been closed.
     *
     * @throws IllegalStateException if this stream has been closed
     */
    protected void checkOpen()
    {
        if (closed)
            throw new IllegalStateException(this + " is closed");
    }

    protected Pointer getDevicePointer()
    {
        return device.getPointer();
    }

    protected Pointer getStreamPointer()
    {
        return stream;
    }

    /**
     * Validates one buffer per channel and gets the native addresses of their
     * positions.
     *
     * @param buffers the buffers, one per channel
     * @return the native addresses of the positions of <tt>buffers</tt>
     * @throws IllegalArgumentException if there is not exactly one valid
     * buffer per channel
     */
    protected Pointer[] pointers(B[] buffers)
    {
        if (buffers == null || buffers.length != channelCount)
        {
            throw new IllegalArgumentException(
                    "Expected " + channelCount + " buffer(s), got "
                        + ((buffers == null) ? 0 : buffers.length));
        }

        Pointer[] pointers = new Pointer[buffers.length];

        for (int i = 0; i < buffers.length; i++)
        {
            sample.validate(buffers[i]);
            pointers[i] = sample.pointer(buffers[i]);
        }
        return pointers;
    }

    /**
     * Advances the positions of buffers by the number of elements which a
     * transfer moved.
     */
    protected void advance(B[] buffers, int elements)
    {
        for (B buffer : buffers)
            sample.advance(buffer, elements);
    }

    @SuppressWarnings("unchecked")
    protected B[] single(B buffer)
    {
        return (B[]) new Buffer[] { buffer };
    }

    @Override
    public String toString()
    {
        return
            getClass().getSimpleName() + "[" + sample.getFormat() + " x "
                + channelCount + "]";
    }
}
