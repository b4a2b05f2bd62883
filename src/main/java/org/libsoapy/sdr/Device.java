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
import org.jitsi.utils.logging.*;
import org.libsoapy.soapysdr.*;

/**
 * An opened SoapySDR device.
 * <p>
 * The native device handle is shared by this <tt>Device</tt>, its
 * {@link #duplicate() duplicates} and the streams set up on any of them. It is
 * unmade when the last of them is closed. A <tt>Device</tt> may be used by
 * multiple threads concurrently; whether the driver tolerates concurrent
 * calls is up to the driver.
 * </p>
 */
public class Device
    implements AutoCloseable
{
    /**
     * The <tt>Logger</tt> used by the <tt>Device</tt> class for logging
     * output.
     */
    private static final Logger logger = Logger.getLogger(Device.class);

    /**
     * Lists the devices which match a specific filter.
     *
     * @param filter the <tt>Args</tt> which the devices have to match. An
     * empty <tt>Args</tt> lists every device of every driver.
     * @return one <tt>Args</tt> per device which identifies it to
     * {@link #Device(Args)}. Empty if no device matches.
     * @throws SoapySDRException if the enumeration fails
     */
    public static List<Args> enumerate(Args filter)
        throws SoapySDRException
    {
        return enumerate(SoapySDR.getLibrary(), filter);
    }

    /**
     * Lists the devices which match a specific filter given in the
     * <tt>key=value, key=value</tt> form.
     *
     * @param filter the filter to {@link Args#parse(String) parse}
     * @return one <tt>Args</tt> per device which matches <tt>filter</tt>
     * @throws SoapySDRException if the enumeration fails
     */
    public static List<Args> enumerate(String filter)
        throws SoapySDRException
    {
        return enumerate(Args.parse(filter));
    }

    static List<Args> enumerate(SoapySDRLibrary lib, Args filter)
        throws SoapySDRException
    {
        ErrorTranslator translator = new ErrorTranslator(lib);
        SoapySDRKwargs kwargs
            = ((filter == null) ? new Args() : filter).toNative();
        SizeTByReference length = new SizeTByReference();
        Pointer devices
            = translator.invoke(
                    () -> lib.SoapySDRDevice_enumerate(kwargs, length));
        List<Args> result
            = NativeResults.argsList(lib, devices, length.getValue());

        if (logger.isDebugEnabled())
        {
            logger.debug(
                    "Found " + result.size() + " device(s) matching \""
                        + filter + "\"");
        }
        return result;
    }

    private static void checkString(String s, String what)
    {
        if (s != null && s.indexOf('\0') >= 0)
            throw new IllegalArgumentException(what + " contains NUL: " + s);
    }

    private static SizeT channel(int channel)
    {
        if (channel < 0)
            throw new IllegalArgumentException("channel " + channel);
        return new SizeT(channel);
    }

    private static byte bool(boolean b)
    {
        return (byte) (b ? 1 : 0);
    }

    private final DeviceHandle handle;

    private final SoapySDRLibrary lib;

    private final ErrorTranslator translator;

    /**
     * Whether this <tt>Device</tt> has dropped its reference to
     * {@link #handle}.
     */
    private final AtomicBoolean closed = new AtomicBoolean();

    /**
     * Opens the device identified by specific <tt>Args</tt>, typically one of
     * those returned by {@link #enumerate(Args)}.
     *
     * @param args the <tt>Args</tt> which identify the device
     * @throws SoapySDRException if the device cannot be opened
     */
    public Device(Args args)
        throws SoapySDRException
    {
        this(SoapySDR.getLibrary(), args);
    }

    public Device(String args)
        throws SoapySDRException
    {
        this(Args.parse(args));
    }

    Device(SoapySDRLibrary lib, Args args)
        throws SoapySDRException
    {
        this.lib = lib;
        this.translator = new ErrorTranslator(lib);

        SoapySDRKwargs kwargs = ((args == null) ? new Args() : args).toNative();
        Pointer device
            = translator.invoke(() -> lib.SoapySDRDevice_make(kwargs));

        if (device == null)
        {
            throw new SoapySDRException(
                    ErrorCode.OTHER,
                    "Failed to make device " + args + ": "
                        + lib.SoapySDRDevice_lastError());
        }
        this.handle = new DeviceHandle(lib, device);

        if (logger.isInfoEnabled())
            logger.info("Opened SoapySDR device " + args);
    }

    private Device(DeviceHandle handle)
    {
        handle.retain();

        this.handle = handle;
        this.lib = handle.getLibrary();
        this.translator = new ErrorTranslator(lib);
    }

    /**
     * Gets a new <tt>Device</tt> which shares the native device with this one.
     * The native device is unmade when both have been closed.
     *
     * @return a new <tt>Device</tt> which shares the native device with this
     * one
     */
    public Device duplicate()
    {
        ptr();
        return new Device(handle);
    }

    /**
     * Drops the reference of this <tt>Device</tt> to the native device.
     * Streams set up on this <tt>Device</tt> stay usable until they are closed
     * themselves. Closing a closed <tt>Device</tt> does nothing.
     */
    @Override
    public void close()
    {
        if (closed.compareAndSet(false, true))
            handle.release();
    }

    public boolean isClosed()
    {
        return closed.get();
    }

    private Pointer ptr()
    {
        if (closed.get())
            throw new IllegalStateException("Device is closed");
        return handle.getPointer();
    }

    /* Identification API */

    /**
     * Gets the key which identifies the driver of this device, for example
     * <tt>lime</tt> or <tt>rtlsdr</tt>.
     *
     * @return the driver key
     * @throws SoapySDRException if the call fails
     */
    public String getDriverKey()
        throws SoapySDRException
    {
        Pointer p = ptr();

        return
            NativeResults.string(
                    lib,
                    translator.invoke(
                            () -> lib.SoapySDRDevice_getDriverKey(p)));
    }

    /**
     * Gets the key which identifies the hardware, for example the product
     * name.
     *
     * @return the hardware key
     * @throws SoapySDRException if the call fails
     */
    public String getHardwareKey()
        throws SoapySDRException
    {
        Pointer p = ptr();

        return
            NativeResults.string(
                    lib,
                    translator.invoke(
                            () -> lib.SoapySDRDevice_getHardwareKey(p)));
    }

    /**
     * Gets the information the driver reports about the hardware, such as
     * serial numbers and firmware versions.
     *
     * @return the hardware information
     * @throws SoapySDRException if the call fails
     */
    public Args getHardwareInfo()
        throws SoapySDRException
    {
        Pointer p = ptr();

        return
            NativeResults.args(
                    lib,
                    translator.invoke(
                            () -> lib.SoapySDRDevice_getHardwareInfo(p)));
    }

    /* Channels API */

    /**
     * Sets the mapping of the frontends of a direction to channels.
     *
     * @param direction the direction
     * @param mapping the driver-specific mapping
     * @throws SoapySDRException if the call fails
     */
    public void setFrontendMapping(Direction direction, String mapping)
        throws SoapySDRException
    {
        checkString(mapping, "mapping");

        Pointer p = ptr();

        translator.invokeStatus(
                () -> lib.SoapySDRDevice_setFrontendMapping(
                        p, direction.getValue(), mapping));
    }

    public String getFrontendMapping(Direction direction)
        throws SoapySDRException
    {
        Pointer p = ptr();

        return
            NativeResults.string(
                    lib,
                    translator.invoke(
                            () -> lib.SoapySDRDevice_getFrontendMapping(
                                    p, direction.getValue())));
    }

    /**
     * Gets the number of channels of a direction.
     *
     * @param direction the direction
     * @return the number of channels of <tt>direction</tt>
     * @throws SoapySDRException if the call fails
     */
    public int getNumChannels(Direction direction)
        throws SoapySDRException
    {
        Pointer p = ptr();
        SizeT n
            = translator.invoke(
                    () -> lib.SoapySDRDevice_getNumChannels(
                            p, direction.getValue()));

        return (n == null) ? 0 : n.intValue();
    }

    public Args getChannelInfo(Direction direction, int channel)
        throws SoapySDRException
    {
        Pointer p = ptr();
        SizeT ch = channel(channel);

        return
            NativeResults.args(
                    lib,
                    translator.invoke(
                            () -> lib.SoapySDRDevice_getChannelInfo(
                                    p, direction.getValue(), ch)));
    }

    /**
     * Determines whether a channel can receive and transmit at the same time.
     *
     * @param direction the direction
     * @param channel the channel
     * @return <tt>true</tt> if the channel supports full duplex operation
     * @throws SoapySDRException if the call fails
     */
    public boolean isFullDuplex(Direction direction, int channel)
        throws SoapySDRException
    {
        Pointer p = ptr();
        SizeT ch = channel(channel);

        return
            translator.invoke(
                    () -> lib.SoapySDRDevice_getFullDuplex(
                            p, direction.getValue(), ch))
                != 0;
    }

    /* Stream API */

    /**
     * Gets the sample formats a channel can stream. Formats which this
     * version of libsoapy does not know are left out.
     *
     * @param direction the direction
     * @param channel the channel
     * @return the formats the channel can stream
     * @throws SoapySDRException if the call fails
     */
    public List<Format> getStreamFormats(Direction direction, int channel)
        throws SoapySDRException
    {
        Pointer p = ptr();
        SizeT ch = channel(channel);
        SizeTByReference length = new SizeTByReference();
        List<String> names
            = NativeResults.strings(
                    lib,
                    translator.invoke(
                            () -> lib.SoapySDRDevice_getStreamFormats(
                                    p, direction.getValue(), ch, length)),
                    length.getValue());
        List<Format> formats = new ArrayList<>(names.size());

        for (String name : names)
        {
            Format format = Format.fromName(name);

            if (format == null)
            {
                if (logger.isDebugEnabled())
                    logger.debug("Ignoring unknown stream format " + name);
            }
            else
            {
                formats.add(format);
            }
        }
        return formats;
    }

    /**
     * Gets the format in which the hardware of a channel natively streams.
     *
     * @param direction the direction
     * @param channel the channel
     * @return the native format of the channel or <tt>null</tt> if this
     * version of libsoapy does not know it
     * @throws SoapySDRException if the call fails
     */
    public Format getNativeStreamFormat(Direction direction, int channel)
        throws SoapySDRException
    {
        return Format.fromName(nativeStreamFormat(direction, channel, null));
    }

    /**
     * Gets the maximum magnitude of a sample in the native stream format of a
     * channel, for example <tt>2048</tt> for 12-bit samples.
     *
     * @param direction the direction
     * @param channel the channel
     * @return the full scale of the native stream format of the channel
     * @throws SoapySDRException if the call fails
     */
    public double getNativeStreamFullScale(Direction direction, int channel)
        throws SoapySDRException
    {
        DoubleByReference fullScale = new DoubleByReference();

        nativeStreamFormat(direction, channel, fullScale);
        return fullScale.getValue();
    }

    private String nativeStreamFormat(
            Direction direction,
            int channel,
            DoubleByReference fullScale)
        throws SoapySDRException
    {
        Pointer p = ptr();
        SizeT ch = channel(channel);
        DoubleByReference fs
            = (fullScale == null) ? new DoubleByReference() : fullScale;

        return
            NativeResults.string(
                    lib,
                    translator.invoke(
                            () -> lib.SoapySDRDevice_getNativeStreamFormat(
                                    p, direction.getValue(), ch, fs)));
    }

    public List<ArgInfo> getStreamArgsInfo(Direction direction, int channel)
        throws SoapySDRException
    {
        Pointer p = ptr();
        SizeT ch = channel(channel);
        SizeTByReference length = new SizeTByReference();
        Pointer info
            = translator.invoke(
                    () -> lib.SoapySDRDevice_getStreamArgsInfo(
                            p, direction.getValue(), ch, length));

        return NativeResults.argInfoList(lib, info, length.getValue());
    }

    /**
     * Sets up a receive stream of specific channels with no stream arguments.
     *
     * @param sample the sample type of the stream
     * @param channels the channels of the stream
     * @return the new stream, not yet active
     * @throws SoapySDRException if the driver cannot set up the stream
     */
    public <B extends Buffer> RxStream<B> rxStream(
            StreamSample<B> sample,
            int... channels)
        throws SoapySDRException
    {
        return rxStream(sample, channels, null);
    }

    /**
     * Sets up a receive stream of specific channels.
     *
     * @param sample the sample type of the stream
     * @param channels the channels of the stream, at least one
     * @param args the driver-specific stream arguments or <tt>null</tt>
     * @return the new stream, not yet active
     * @throws SoapySDRException if the driver cannot set up the stream
     */
    public <B extends Buffer> RxStream<B> rxStream(
            StreamSample<B> sample,
            int[] channels,
            Args args)
        throws SoapySDRException
    {
        Pointer stream = setupStream(Direction.RX, sample, channels, args);

        return new RxStream<>(handle, stream, sample, channels.length);
    }

    public <B extends Buffer> TxStream<B> txStream(
            StreamSample<B> sample,
            int... channels)
        throws SoapySDRException
    {
        return txStream(sample, channels, null);
    }

    /**
     * Sets up a transmit stream of specific channels.
     *
     * @param sample the sample type of the stream
     * @param channels the channels of the stream, at least one
     * @param args the driver-specific stream arguments or <tt>null</tt>
     * @return the new stream, not yet active
     * @throws SoapySDRException if the driver cannot set up the stream
     */
    public <B extends Buffer> TxStream<B> txStream(
            StreamSample<B> sample,
            int[] channels,
            Args args)
        throws SoapySDRException
    {
        Pointer stream = setupStream(Direction.TX, sample, channels, args);

        return new TxStream<>(handle, stream, sample, channels.length);
    }

    private Pointer setupStream(
            Direction direction,
            StreamSample<?> sample,
            int[] channels,
            Args args)
        throws SoapySDRException
    {
        if (sample == null)
            throw new IllegalArgumentException("sample is null");
        if (channels == null || channels.length == 0)
            throw new IllegalArgumentException("No channels");

        Pointer p = ptr();
        Format format = sample.getFormat();
        SizeT nativeSize = lib.SoapySDR_formatToSize(format.getName());

        if (nativeSize == null || nativeSize.longValue() != format.size())
        {
            throw new SoapySDRException(
                    ErrorCode.NOT_SUPPORTED,
                    "SoapySDR reports a size of " + nativeSize + " for "
                        + format + " instead of " + format.size());
        }

        Memory chans = new Memory((long) Native.SIZE_T_SIZE * channels.length);

        for (int i = 0; i < channels.length; i++)
        {
            long offset = (long) i * Native.SIZE_T_SIZE;
            long channel = channel(channels[i]).longValue();

            if (Native.SIZE_T_SIZE == 8)
                chans.setLong(offset, channel);
            else
                chans.setInt(offset, (int) channel);
        }

        SoapySDRKwargs kwargs = ((args == null) ? new Args() : args).toNative();
        Pointer stream
            = translator.invoke(
                    () -> lib.SoapySDRDevice_setupStream(
                            p,
                            direction.getValue(),
                            format.getName(),
                            chans,
                            new SizeT(channels.length),
                            kwargs));

        if (stream == null)
        {
            throw new SoapySDRException(
                    ErrorCode.OTHER,
                    "Failed to set up " + direction + " stream of " + format
                        + ": " + lib.SoapySDRDevice_lastError());
        }
        if (logger.isDebugEnabled())
        {
            logger.debug(
                    "Set up " + direction + " stream of " + format + " on "
                        + channels.length + " channel(s)");
        }
        return stream;
    }

    /* Antenna API */

    public List<String> listAntennas(Direction direction, int channel)
        throws SoapySDRException
    {
        Pointer p = ptr();
        SizeT ch = channel(channel);
        SizeTByReference length = new SizeTByReference();
        Pointer names
            = translator.invoke(
                    () -> lib.SoapySDRDevice_listAntennas(
                            p, direction.getValue(), ch, length));

        return NativeResults.strings(lib, names, length.getValue());
    }

    /**
     * Selects the antenna of a channel.
     *
     * @param direction the direction
     * @param channel the channel
     * @param name the name of the antenna, one of {@link #listAntennas}
     * @throws SoapySDRException if the call fails
     */
    public void setAntenna(Direction direction, int channel, String name)
        throws SoapySDRException
    {
        checkString(name, "name");

        Pointer p = ptr();
        SizeT ch = channel(channel);

        translator.invokeStatus(
                () -> lib.SoapySDRDevice_setAntenna(
                        p, direction.getValue(), ch, name));
    }

    public String getAntenna(Direction direction, int channel)
        throws SoapySDRException
    {
        Pointer p = ptr();
        SizeT ch = channel(channel);

        return
            NativeResults.string(
                    lib,
                    translator.invoke(
                            () -> lib.SoapySDRDevice_getAntenna(
                                    p, direction.getValue(), ch)));
    }

    /* Frontend corrections API */

    public boolean hasDCOffsetMode(Direction direction, int channel)
        throws SoapySDRException
    {
        Pointer p = ptr();
        SizeT ch = channel(channel);

        return
            translator.invoke(
                    () -> lib.SoapySDRDevice_hasDCOffsetMode(
                            p, direction.getValue(), ch))
                != 0;
    }

    /**
     * Enables or disables the automatic DC offset correction of a channel.
     *
     * @param direction the direction
     * @param channel the channel
     * @param automatic <tt>true</tt> to enable the automatic correction
     * @throws SoapySDRException if the call fails
     */
    public void setDCOffsetMode(
            Direction direction,
            int channel,
            boolean automatic)
        throws SoapySDRException
    {
        Pointer p = ptr();
        SizeT ch = channel(channel);

        translator.invokeStatus(
                () -> lib.SoapySDRDevice_setDCOffsetMode(
                        p, direction.getValue(), ch, bool(automatic)));
    }

    public boolean getDCOffsetMode(Direction direction, int channel)
        throws SoapySDRException
    {
        Pointer p = ptr();
        SizeT ch = channel(channel);

        return
            translator.invoke(
                    () -> lib.SoapySDRDevice_getDCOffsetMode(
                            p, direction.getValue(), ch))
                != 0;
    }

    public boolean hasDCOffset(Direction direction, int channel)
        throws SoapySDRException
    {
        Pointer p = ptr();
        SizeT ch = channel(channel);

        return
            translator.invoke(
                    () -> lib.SoapySDRDevice_hasDCOffset(
                            p, direction.getValue(), ch))
                != 0;
    }

    /**
     * Sets the DC offset correction of a channel.
     *
     * @param direction the direction
     * @param channel the channel
     * @param offsetI the in-phase correction
     * @param offsetQ the quadrature correction
     * @throws SoapySDRException if the call fails
     */
    public void setDCOffset(
            Direction direction,
            int channel,
            double offsetI,
            double offsetQ)
        throws SoapySDRException
    {
        Pointer p = ptr();
        SizeT ch = channel(channel);

        translator.invokeStatus(
                () -> lib.SoapySDRDevice_setDCOffset(
                        p, direction.getValue(), ch, offsetI, offsetQ));
    }

    /**
     * Gets the DC offset correction of a channel.
     *
     * @param direction the direction
     * @param channel the channel
     * @return the in-phase and the quadrature correction, in this order
     * @throws SoapySDRException if the call fails
     */
    public double[] getDCOffset(Direction direction, int channel)
        throws SoapySDRException
    {
        Pointer p = ptr();
        SizeT ch = channel(channel);
        DoubleByReference i = new DoubleByReference();
        DoubleByReference q = new DoubleByReference();

        translator.invokeStatus(
                () -> lib.SoapySDRDevice_getDCOffset(
                        p, direction.getValue(), ch, i, q));
        return new double[] { i.getValue(), q.getValue() };
    }

    public boolean hasIQBalance(Direction direction, int channel)
        throws SoapySDRException
    {
        Pointer p = ptr();
        SizeT ch = channel(channel);

        return
            translator.invoke(
                    () -> lib.SoapySDRDevice_hasIQBalance(
                            p, direction.getValue(), ch))
                != 0;
    }

    public void setIQBalance(
            Direction direction,
            int channel,
            double balanceI,
            double balanceQ)
        throws SoapySDRException
    {
        Pointer p = ptr();
        SizeT ch = channel(channel);

        translator.invokeStatus(
                () -> lib.SoapySDRDevice_setIQBalance(
                        p, direction.getValue(), ch, balanceI, balanceQ));
    }

    /**
     * Gets the IQ balance correction of a channel.
     *
     * @param direction the direction
     * @param channel the channel
     * @return the in-phase and the quadrature correction, in this order
     * @throws SoapySDRException if the call fails
     */
    public double[] getIQBalance(Direction direction, int channel)
        throws SoapySDRException
    {
        Pointer p = ptr();
        SizeT ch = channel(channel);
        DoubleByReference i = new DoubleByReference();
        DoubleByReference q = new DoubleByReference();

        translator.invokeStatus(
                () -> lib.SoapySDRDevice_getIQBalance(
                        p, direction.getValue(), ch, i, q));
        return new double[] { i.getValue(), q.getValue() };
    }

    /* Gain API */

    /**
     * Lists the amplification elements of a channel in the order in which
     * {@link #setGain} distributes an overall gain over them.
     *
     * @param direction the direction
     * @param channel the channel
     * @return the names of the gain elements of the channel
     * @throws SoapySDRException if the call fails
     */
    public List<String> listGains(Direction direction, int channel)
        throws SoapySDRException
    {
        Pointer p = ptr();
        SizeT ch = channel(channel);
        SizeTByReference length = new SizeTByReference();
        Pointer names
            = translator.invoke(
                    () -> lib.SoapySDRDevice_listGains(
                            p, direction.getValue(), ch, length));

        return NativeResults.strings(lib, names, length.getValue());
    }

    public boolean hasGainMode(Direction direction, int channel)
        throws SoapySDRException
    {
        Pointer p = ptr();
        SizeT ch = channel(channel);

        return
            translator.invoke(
                    () -> lib.SoapySDRDevice_hasGainMode(
                            p, direction.getValue(), ch))
                != 0;
    }

    /**
     * Enables or disables the automatic gain control of a channel.
     *
     * @param direction the direction
     * @param channel the channel
     * @param automatic <tt>true</tt> to enable the automatic gain control
     * @throws SoapySDRException if the call fails
     */
    public void setGainMode(Direction direction, int channel, boolean automatic)
        throws SoapySDRException
    {
        Pointer p = ptr();
        SizeT ch = channel(channel);

        translator.invokeStatus(
                () -> lib.SoapySDRDevice_setGainMode(
                        p, direction.getValue(), ch, bool(automatic)));
    }

    public boolean getGainMode(Direction direction, int channel)
        throws SoapySDRException
    {
        Pointer p = ptr();
        SizeT ch = channel(channel);

        return
            translator.invoke(
                    () -> lib.SoapySDRDevice_getGainMode(
                            p, direction.getValue(), ch))
                != 0;
    }

    /**
     * Sets the overall gain of a channel. The driver distributes it over the
     * gain elements of the channel.
     *
     * @param direction the direction
     * @param channel the channel
     * @param gain the overall gain in dB
     * @throws SoapySDRException if the call fails
     */
    public void setGain(Direction direction, int channel, double gain)
        throws SoapySDRException
    {
        Pointer p = ptr();
        SizeT ch = channel(channel);

        translator.invokeStatus(
                () -> lib.SoapySDRDevice_setGain(
                        p, direction.getValue(), ch, gain));
    }

    public double getGain(Direction direction, int channel)
        throws SoapySDRException
    {
        Pointer p = ptr();
        SizeT ch = channel(channel);

        return
            translator.invoke(
                    () -> lib.SoapySDRDevice_getGain(
                            p, direction.getValue(), ch));
    }

    public Range getGainRange(Direction direction, int channel)
        throws SoapySDRException
    {
        Pointer p = ptr();
        SizeT ch = channel(channel);

        return
            new Range(
                    translator.invoke(
                            () -> lib.SoapySDRDevice_getGainRange(
                                    p, direction.getValue(), ch)));
    }

    public void setGainElement(
            Direction direction,
            int channel,
            String name,
            double gain)
        throws SoapySDRException
    {
        checkString(name, "name");

        Pointer p = ptr();
        SizeT ch = channel(channel);

        translator.invokeStatus(
                () -> lib.SoapySDRDevice_setGainElement(
                        p, direction.getValue(), ch, name, gain));
    }

    public double getGainElement(Direction direction, int channel, String name)
        throws SoapySDRException
    {
        checkString(name, "name");

        Pointer p = ptr();
        SizeT ch = channel(channel);

        return
            translator.invoke(
                    () -> lib.SoapySDRDevice_getGainElement(
                            p, direction.getValue(), ch, name));
    }

    public Range getGainElementRange(
            Direction direction,
            int channel,
            String name)
        throws SoapySDRException
    {
        checkString(name, "name");

        Pointer p = ptr();
        SizeT ch = channel(channel);

        return
            new Range(
                    translator.invoke(
                            () -> lib.SoapySDRDevice_getGainElementRange(
                                    p, direction.getValue(), ch, name)));
    }

    /* Frequency API */

    /**
     * Tunes a channel to a specific center frequency. The driver distributes
     * the frequency over the tunable components of the channel.
     *
     * @param direction the direction
     * @param channel the channel
     * @param frequency the center frequency in Hz
     * @param args the driver-specific tuning arguments or <tt>null</tt>
     * @throws SoapySDRException if the call fails
     */
    public void setFrequency(
            Direction direction,
            int channel,
            double frequency,
            Args args)
        throws SoapySDRException
    {
        Pointer p = ptr();
        SizeT ch = channel(channel);
        SoapySDRKwargs kwargs = ((args == null) ? new Args() : args).toNative();

        translator.invokeStatus(
                () -> lib.SoapySDRDevice_setFrequency(
                        p, direction.getValue(), ch, frequency, kwargs));
    }

    public void setFrequency(Direction direction, int channel, double frequency)
        throws SoapySDRException
    {
        setFrequency(direction, channel, frequency, null);
    }

    /**
     * Gets the overall center frequency of a channel.
     *
     * @param direction the direction
     * @param channel the channel
     * @return the center frequency in Hz
     * @throws SoapySDRException if the call fails
     */
    public double getFrequency(Direction direction, int channel)
        throws SoapySDRException
    {
        Pointer p = ptr();
        SizeT ch = channel(channel);

        return
            translator.invoke(
                    () -> lib.SoapySDRDevice_getFrequency(
                            p, direction.getValue(), ch));
    }

    public List<Range> getFrequencyRange(Direction direction, int channel)
        throws SoapySDRException
    {
        Pointer p = ptr();
        SizeT ch = channel(channel);
        SizeTByReference length = new SizeTByReference();
        Pointer ranges
            = translator.invoke(
                    () -> lib.SoapySDRDevice_getFrequencyRange(
                            p, direction.getValue(), ch, length));

        return NativeResults.ranges(lib, ranges, length.getValue());
    }

    /**
     * Lists the tunable components of a channel, for example <tt>RF</tt> and
     * <tt>BB</tt>.
     *
     * @param direction the direction
     * @param channel the channel
     * @return the names of the tunable components of the channel
     * @throws SoapySDRException if the call fails
     */
    public List<String> listFrequencies(Direction direction, int channel)
        throws SoapySDRException
    {
        Pointer p = ptr();
        SizeT ch = channel(channel);
        SizeTByReference length = new SizeTByReference();
        Pointer names
            = translator.invoke(
                    () -> lib.SoapySDRDevice_listFrequencies(
                            p, direction.getValue(), ch, length));

        return NativeResults.strings(lib, names, length.getValue());
    }

    public void setFrequencyComponent(
            Direction direction,
            int channel,
            String name,
            double frequency,
            Args args)
        throws SoapySDRException
    {
        checkString(name, "name");

        Pointer p = ptr();
        SizeT ch = channel(channel);
        SoapySDRKwargs kwargs = ((args == null) ? new Args() : args).toNative();

        translator.invokeStatus(
                () -> lib.SoapySDRDevice_setFrequencyComponent(
                        p, direction.getValue(), ch, name, frequency, kwargs));
    }

    public double getFrequencyComponent(
            Direction direction,
            int channel,
            String name)
        throws SoapySDRException
    {
        checkString(name, "name");

        Pointer p = ptr();
        SizeT ch = channel(channel);

        return
            translator.invoke(
                    () -> lib.SoapySDRDevice_getFrequencyComponent(
                            p, direction.getValue(), ch, name));
    }

    public List<Range> getFrequencyComponentRange(
            Direction direction,
            int channel,
            String name)
        throws SoapySDRException
    {
        checkString(name, "name");

        Pointer p = ptr();
        SizeT ch = channel(channel);
        SizeTByReference length = new SizeTByReference();
        Pointer ranges
            = translator.invoke(
                    () -> lib.SoapySDRDevice_getFrequencyRangeComponent(
                            p, direction.getValue(), ch, name, length));

        return NativeResults.ranges(lib, ranges, length.getValue());
    }

    /**
     * Describes the tuning arguments {@link #setFrequency} accepts.
     *
     * @param direction the direction
     * @param channel the channel
     * @return the descriptions of the tuning arguments of the channel
     * @throws SoapySDRException if the call fails
     */
    public List<ArgInfo> getFrequencyArgsInfo(Direction direction, int channel)
        throws SoapySDRException
    {
        Pointer p = ptr();
        SizeT ch = channel(channel);
        SizeTByReference length = new SizeTByReference();
        Pointer info
            = translator.invoke(
                    () -> lib.SoapySDRDevice_getFrequencyArgsInfo(
                            p, direction.getValue(), ch, length));

        return NativeResults.argInfoList(lib, info, length.getValue());
    }

    /* Sample rate API */

    /**
     * Sets the sample rate of a channel.
     *
     * @param direction the direction
     * @param channel the channel
     * @param rate the sample rate in samples per second
     * @throws SoapySDRException if the call fails
     */
    public void setSampleRate(Direction direction, int channel, double rate)
        throws SoapySDRException
    {
        Pointer p = ptr();
        SizeT ch = channel(channel);

        translator.invokeStatus(
                () -> lib.SoapySDRDevice_setSampleRate(
                        p, direction.getValue(), ch, rate));
    }

    public double getSampleRate(Direction direction, int channel)
        throws SoapySDRException
    {
        Pointer p = ptr();
        SizeT ch = channel(channel);

        return
            translator.invoke(
                    () -> lib.SoapySDRDevice_getSampleRate(
                            p, direction.getValue(), ch));
    }

    public List<Double> listSampleRates(Direction direction, int channel)
        throws SoapySDRException
    {
        Pointer p = ptr();
        SizeT ch = channel(channel);
        SizeTByReference length = new SizeTByReference();
        Pointer rates
            = translator.invoke(
                    () -> lib.SoapySDRDevice_listSampleRates(
                            p, direction.getValue(), ch, length));

        return NativeResults.doubles(lib, rates, length.getValue());
    }

    public List<Range> getSampleRateRange(Direction direction, int channel)
        throws SoapySDRException
    {
        Pointer p = ptr();
        SizeT ch = channel(channel);
        SizeTByReference length = new SizeTByReference();
        Pointer ranges
            = translator.invoke(
                    () -> lib.SoapySDRDevice_getSampleRateRange(
                            p, direction.getValue(), ch, length));

        return NativeResults.ranges(lib, ranges, length.getValue());
    }

    /* Bandwidth API */

    /**
     * Sets the baseband filter width of a channel.
     *
     * @param direction the direction
     * @param channel the channel
     * @param bandwidth the filter width in Hz
     * @throws SoapySDRException if the call fails
     */
    public void setBandwidth(Direction direction, int channel, double bandwidth)
        throws SoapySDRException
    {
        Pointer p = ptr();
        SizeT ch = channel(channel);

        translator.invokeStatus(
                () -> lib.SoapySDRDevice_setBandwidth(
                        p, direction.getValue(), ch, bandwidth));
    }

    public double getBandwidth(Direction direction, int channel)
        throws SoapySDRException
    {
        Pointer p = ptr();
        SizeT ch = channel(channel);

        return
            translator.invoke(
                    () -> lib.SoapySDRDevice_getBandwidth(
                            p, direction.getValue(), ch));
    }

    public List<Double> listBandwidths(Direction direction, int channel)
        throws SoapySDRException
    {
        Pointer p = ptr();
        SizeT ch = channel(channel);
        SizeTByReference length = new SizeTByReference();
        Pointer bandwidths
            = translator.invoke(
                    () -> lib.SoapySDRDevice_listBandwidths(
                            p, direction.getValue(), ch, length));

        return NativeResults.doubles(lib, bandwidths, length.getValue());
    }

    public List<Range> getBandwidthRange(Direction direction, int channel)
        throws SoapySDRException
    {
        Pointer p = ptr();
        SizeT ch = channel(channel);
        SizeTByReference length = new SizeTByReference();
        Pointer ranges
            = translator.invoke(
                    () -> lib.SoapySDRDevice_getBandwidthRange(
                            p, direction.getValue(), ch, length));

        return NativeResults.ranges(lib, ranges, length.getValue());
    }

    /* Clocking API */

    public void setMasterClockRate(double rate)
        throws SoapySDRException
    {
        Pointer p = ptr();

        translator.invokeStatus(
                () -> lib.SoapySDRDevice_setMasterClockRate(p, rate));
    }

    /**
     * Gets the rate of the clock from which the sample rates of the device
     * are derived.
     *
     * @return the master clock rate in Hz
     * @throws SoapySDRException if the call fails
     */
    public double getMasterClockRate()
        throws SoapySDRException
    {
        Pointer p = ptr();

        return
            translator.invoke(() -> lib.SoapySDRDevice_getMasterClockRate(p));
    }

    public List<Range> getMasterClockRates()
        throws SoapySDRException
    {
        Pointer p = ptr();
        SizeTByReference length = new SizeTByReference();
        Pointer ranges
            = translator.invoke(
                    () -> lib.SoapySDRDevice_getMasterClockRates(p, length));

        return NativeResults.ranges(lib, ranges, length.getValue());
    }

    public List<String> listClockSources()
        throws SoapySDRException
    {
        Pointer p = ptr();
        SizeTByReference length = new SizeTByReference();
        Pointer names
            = translator.invoke(
                    () -> lib.SoapySDRDevice_listClockSources(p, length));

        return NativeResults.strings(lib, names, length.getValue());
    }

    public void setClockSource(String source)
        throws SoapySDRException
    {
        checkString(source, "source");

        Pointer p = ptr();

        translator.invokeStatus(
                () -> lib.SoapySDRDevice_setClockSource(p, source));
    }

    public String getClockSource()
        throws SoapySDRException
    {
        Pointer p = ptr();

        return
            NativeResults.string(
                    lib,
                    translator.invoke(
                            () -> lib.SoapySDRDevice_getClockSource(p)));
    }

    /* Time API */

    public List<String> listTimeSources()
        throws SoapySDRException
    {
        Pointer p = ptr();
        SizeTByReference length = new SizeTByReference();
        Pointer names
            = translator.invoke(
                    () -> lib.SoapySDRDevice_listTimeSources(p, length));

        return NativeResults.strings(lib, names, length.getValue());
    }

    public void setTimeSource(String source)
        throws SoapySDRException
    {
        checkString(source, "source");

        Pointer p = ptr();

        translator.invokeStatus(
                () -> lib.SoapySDRDevice_setTimeSource(p, source));
    }

    public String getTimeSource()
        throws SoapySDRException
    {
        Pointer p = ptr();

        return
            NativeResults.string(
                    lib,
                    translator.invoke(
                            () -> lib.SoapySDRDevice_getTimeSource(p)));
    }

    /**
     * Determines whether the device has a specific hardware time source.
     *
     * @param what the name of the time source or <tt>null</tt> for the
     * default one
     * @return <tt>true</tt> if the device has the time source
     * @throws SoapySDRException if the call fails
     */
    public boolean hasHardwareTime(String what)
        throws SoapySDRException
    {
        checkString(what, "what");

        Pointer p = ptr();

        return
            translator.invoke(() -> lib.SoapySDRDevice_hasHardwareTime(p, what))
                != 0;
    }

    /**
     * Reads a hardware time source.
     *
     * @param what the name of the time source or <tt>null</tt> for the
     * default one
     * @return the time in nanoseconds
     * @throws SoapySDRException if the call fails
     */
    public long getHardwareTime(String what)
        throws SoapySDRException
    {
        checkString(what, "what");

        Pointer p = ptr();

        return
            translator.invoke(() -> lib.SoapySDRDevice_getHardwareTime(p, what));
    }

    /**
     * Writes a hardware time source.
     *
     * @param timeNs the time in nanoseconds
     * @param what the name of the time source or <tt>null</tt> for the
     * default one
     * @throws SoapySDRException if the call fails
     */
    public void setHardwareTime(long timeNs, String what)
        throws SoapySDRException
    {
        checkString(what, "what");

        Pointer p = ptr();

        translator.invokeStatus(
                () -> lib.SoapySDRDevice_setHardwareTime(p, timeNs, what));
    }

    /* Sensor API */

    public List<String> listSensors()
        throws SoapySDRException
    {
        Pointer p = ptr();
        SizeTByReference length = new SizeTByReference();
        Pointer names
            = translator.invoke(() -> lib.SoapySDRDevice_listSensors(p, length));

        return NativeResults.strings(lib, names, length.getValue());
    }

    public ArgInfo getSensorInfo(String key)
        throws SoapySDRException
    {
        checkString(key, "key");

        Pointer p = ptr();

        return
            NativeResults.argInfo(
                    lib,
                    translator.invoke(
                            () -> lib.SoapySDRDevice_getSensorInfo(p, key)));
    }

    /**
     * Reads a device sensor.
     *
     * @param key the key of the sensor, one of {@link #listSensors()}
     * @return the reading in the form its {@link ArgInfo} describes
     * @throws SoapySDRException if the call fails
     */
    public String readSensor(String key)
        throws SoapySDRException
    {
        checkString(key, "key");

        Pointer p = ptr();

        return
            NativeResults.string(
                    lib,
                    translator.invoke(
                            () -> lib.SoapySDRDevice_readSensor(p, key)));
    }

    public List<String> listChannelSensors(Direction direction, int channel)
        throws SoapySDRException
    {
        Pointer p = ptr();
        SizeT ch = channel(channel);
        SizeTByReference length = new SizeTByReference();
        Pointer names
            = translator.invoke(
                    () -> lib.SoapySDRDevice_listChannelSensors(
                            p, direction.getValue(), ch, length));

        return NativeResults.strings(lib, names, length.getValue());
    }

    public ArgInfo getChannelSensorInfo(
            Direction direction,
            int channel,
            String key)
        throws SoapySDRException
    {
        checkString(key, "key");

        Pointer p = ptr();
        SizeT ch = channel(channel);

        return
            NativeResults.argInfo(
                    lib,
                    translator.invoke(
                            () -> lib.SoapySDRDevice_getChannelSensorInfo(
                                    p, direction.getValue(), ch, key)));
    }

    public String readChannelSensor(Direction direction, int channel, String key)
        throws SoapySDRException
    {
        checkString(key, "key");

        Pointer p = ptr();
        SizeT ch = channel(channel);

        return
            NativeResults.string(
                    lib,
                    translator.invoke(
                            () -> lib.SoapySDRDevice_readChannelSensor(
                                    p, direction.getValue(), ch, key)));
    }

    /* Settings API */

    /**
     * Describes the device-wide settings of the driver.
     *
     * @return the descriptions of the settings
     * @throws SoapySDRException if the call fails
     */
    public List<ArgInfo> getSettingInfo()
        throws SoapySDRException
    {
        Pointer p = ptr();
        SizeTByReference length = new SizeTByReference();
        Pointer info
            = translator.invoke(
                    () -> lib.SoapySDRDevice_getSettingInfo(p, length));

        return NativeResults.argInfoList(lib, info, length.getValue());
    }

    public void writeSetting(String key, String value)
        throws SoapySDRException
    {
        checkString(key, "key");
        checkString(value, "value");

        Pointer p = ptr();

        translator.invokeStatus(
                () -> lib.SoapySDRDevice_writeSetting(p, key, value));
    }

    public String readSetting(String key)
        throws SoapySDRException
    {
        checkString(key, "key");

        Pointer p = ptr();

        return
            NativeResults.string(
                    lib,
                    translator.invoke(
                            () -> lib.SoapySDRDevice_readSetting(p, key)));
    }

    public List<ArgInfo> getChannelSettingInfo(
            Direction direction,
            int channel)
        throws SoapySDRException
    {
        Pointer p = ptr();
        SizeT ch = channel(channel);
        SizeTByReference length = new SizeTByReference();
        Pointer info
            = translator.invoke(
                    () -> lib.SoapySDRDevice_getChannelSettingInfo(
                            p, direction.getValue(), ch, length));

        return NativeResults.argInfoList(lib, info, length.getValue());
    }

    public void writeChannelSetting(
            Direction direction,
            int channel,
            String key,
            String value)
        throws SoapySDRException
    {
        checkString(key, "key");
        checkString(value, "value");

        Pointer p = ptr();
        SizeT ch = channel(channel);

        translator.invokeStatus(
                () -> lib.SoapySDRDevice_writeChannelSetting(
                        p, direction.getValue(), ch, key, value));
    }

    public String readChannelSetting(Direction direction, int channel, String key)
        throws SoapySDRException
    {
        checkString(key, "key");

        Pointer p = ptr();
        SizeT ch = channel(channel);

        return
            NativeResults.string(
                    lib,
                    translator.invoke(
                            () -> lib.SoapySDRDevice_readChannelSetting(
                                    p, direction.getValue(), ch, key)));
    }
}
