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
package org.libsoapy.tools;

import java.io.*;
import java.nio.*;
import java.util.*;

import com.beust.jcommander.*;
import org.jitsi.utils.logging.*;
import org.libsoapy.sdr.*;
import org.libsoapy.util.*;

/**
 * Records samples from a SoapySDR device into a file or plays a file back
 * through it. Files hold raw little-endian complex float samples, see
 * {@link IqFile}.
 * <p>
 * Usage: <tt>SoapySdrStream (-r FILE | -t FILE) [options]</tt>
 * </p>
 */
public class SoapySdrStream
{
    /**
     * The name of the configuration property which specifies the timeout in
     * microseconds of each read and write.
     */
    public static final String PNAME_TIMEOUT_US
        = "org.libsoapy.tools.TIMEOUT_US";

    public static final long DEFAULT_TIMEOUT_US = 1000000;

    /**
     * The smallest transfer buffer, in elements, for drivers which report no
     * MTU.
     */
    private static final int MIN_BUFFER_ELEMENTS = 1024;

    private static final Logger logger
        = Logger.getLogger(SoapySdrStream.class);

    /**
     * The command-line options of <tt>SoapySdrStream</tt>.
     */
    public static class Options
    {
        @Parameter(names = { "-d", "--device" }, description = "Device filter")
        public String device = "";

        @Parameter(
                names = { "-r", "--receive" },
                description = "Receive data to file")
        public String receive;

        @Parameter(
                names = { "-t", "--transmit" },
                description = "Transmit data from file")
        public String transmit;

        @Parameter(
                names = { "-c", "--channel" },
                description = "Channel of the device")
        public int channel = 0;

        @Parameter(
                names = { "-f", "--frequency" },
                description = "Center frequency in Hz",
                converter = SiNumberConverter.class)
        public Double frequency;

        @Parameter(
                names = { "-s", "--rate" },
                description = "Sample rate in Hz",
                converter = SiNumberConverter.class)
        public Double rate;

        @Parameter(names = { "-a", "--antenna" }, description = "Antenna name")
        public String antenna;

        @Parameter(
                names = { "-b", "--bandwidth" },
                description = "Baseband filter bandwidth in Hz",
                converter = SiNumberConverter.class)
        public Double bandwidth;

        @Parameter(names = { "-g", "--gain" }, description = "Gain in dB")
        public Double gain;

        @Parameter(
                names = { "-n", "--samples" },
                description
                    = "With -r: number of samples (default unlimited). "
                        + "With -t: number of times to repeat the file "
                        + "(default 1)",
                converter = SiNumberConverter.class)
        public Double samples;

        @Parameter(
                names = { "-h", "--help" },
                description = "Print this help",
                help = true)
        public boolean help;
    }

    public static void main(String[] argv)
    {
        Options options = new Options();
        JCommander jCommander
            = JCommander.newBuilder()
                .programName(SoapySdrStream.class.getSimpleName())
                .addObject(options)
                .build();

        try
        {
            jCommander.parse(argv);
        }
        catch (ParameterException pe)
        {
            System.err.println(pe.getMessage());
            jCommander.usage();
            System.exit(2);
        }
        if (options.help)
        {
            jCommander.usage();
            return;
        }
        if ((options.receive == null) == (options.transmit == null))
        {
            System.err.println(
                    "Specify exactly one of --transmit FILE or --receive FILE");
            System.exit(2);
        }

        int status;

        try
        {
            status = new SoapySdrStream(options, System.err).run();
        }
        catch (IOException | SoapySDRException ex)
        {
            logger.error("Streaming failed", ex);
            System.err.println("Error: " + ex.getMessage());
            status = 1;
        }
        if (status != 0)
            System.exit(status);
    }

    private final Options options;

    private final PrintStream err;

    private final long timeoutUs;

    /**
     * Whether streaming is to stop early because the user interrupted it.
     */
    private volatile boolean stopped = false;

    /**
     * Whether the thread which called {@link #run()} is streaming.
     */
    private volatile boolean streaming = false;

    public SoapySdrStream(Options options, PrintStream err)
    {
        this.options = options;
        this.err = err;
        this.timeoutUs
            = ConfigUtils.getLong(PNAME_TIMEOUT_US, DEFAULT_TIMEOUT_US);
    }

    /**
     * Finds the single device which matches the filter, configures it and
     * streams.
     *
     * @return the exit status, <tt>0</tt> on success
     * @throws IOException if the file cannot be read or written
     * @throws SoapySDRException if the device fails
     */
    public int run()
        throws IOException, SoapySDRException
    {
        List<Args> devices = Device.enumerate(options.device);

        if (devices.isEmpty())
        {
            err.println("No matching devices found");
            return 1;
        }
        if (devices.size() > 1)
        {
            err.println(devices.size() + " devices found. Try one of:");
            for (Args device : devices)
                err.println("\t -d '" + device + "'");
            return 1;
        }

        try (Device device = new Device(devices.get(0)))
        {
            Direction direction
                = (options.receive != null) ? Direction.RX : Direction.TX;

            configure(device, direction);
            installStopHook();
            streaming = true;
            try
            {
                if (direction == Direction.RX)
                    receive(device);
                else
                    transmit(device);
            }
            finally
            {
                streaming = false;
            }
        }
        return 0;
    }

    /**
     * Applies the frequency, sample rate, antenna, bandwidth and gain options
     * to the selected channel.
     */
    void configure(Device device, Direction direction)
        throws SoapySDRException
    {
        int channel = options.channel;

        if (options.frequency != null)
            device.setFrequency(direction, channel, options.frequency);
        if (options.rate != null)
            device.setSampleRate(direction, channel, options.rate);
        if (options.antenna != null)
            device.setAntenna(direction, channel, options.antenna);
        if (options.bandwidth != null)
            device.setBandwidth(direction, channel, options.bandwidth);
        if (options.gain != null)
            device.setGain(direction, channel, options.gain);
    }

    private void installStopHook()
    {
        Thread thread = Thread.currentThread();

        Runtime.getRuntime().addShutdownHook(
                new Thread(() -> {
                    stopped = true;
                    try
                    {
                        // Let the stream be deactivated and closed.
                        if (streaming)
                            thread.join(2000);
                    }
                    catch (InterruptedException ie)
                    {
                        Thread.currentThread().interrupt();
                    }
                }));
    }

    /**
     * Records samples until <tt>-n</tt> samples have been received or the
     * user interrupts.
     */
    void receive(Device device)
        throws IOException, SoapySDRException
    {
        long remaining
            = (options.samples == null)
                ? Long.MAX_VALUE
                : options.samples.longValue();

        try (RxStream<FloatBuffer> stream
                    = device.rxStream(StreamSample.CF32, options.channel);
                OutputStream out
                    = new BufferedOutputStream(
                            new FileOutputStream(options.receive)))
        {
            FloatBuffer buffer
                = StreamSample.CF32.allocate(
                        Math.max(stream.getMtu(), MIN_BUFFER_ELEMENTS));
            int capacity = buffer.capacity() / 2;

            stream.activate();
            while (remaining > 0 && !stopped)
            {
                buffer.clear();
                buffer.limit((int) Math.min(remaining, capacity) * 2);

                int read = stream.read(buffer, timeoutUs);

                buffer.flip();
                IqFile.write(out, buffer);
                remaining -= read;
            }
            stream.deactivate();
        }
        err.println("exiting");
    }

    /**
     * Plays the file back <tt>-n</tt> times and ends the burst after the last
     * time.
     */
    void transmit(Device device)
        throws IOException, SoapySDRException
    {
        long repeat
            = (options.samples == null) ? 1 : options.samples.longValue();

        try (TxStream<FloatBuffer> stream
                = device.txStream(StreamSample.CF32, options.channel))
        {
            FloatBuffer buffer
                = StreamSample.CF32.allocate(
                        Math.max(stream.getMtu(), MIN_BUFFER_ELEMENTS));

            stream.activate();
            for (long i = 0; i < repeat && !stopped; i++)
            {
                try (InputStream in
                        = new BufferedInputStream(
                                new FileInputStream(options.transmit)))
                {
                    while (!stopped)
                    {
                        buffer.clear();
                        if (IqFile.read(in, buffer) < 0)
                            break;
                        buffer.flip();
                        stream.writeAll(buffer, null, false, timeoutUs);
                    }
                }
            }

            // An empty write which carries only the end of the burst.
            buffer.clear();
            buffer.limit(0);
            stream.write(buffer, null, true, timeoutUs);
            stream.deactivate();
        }
        err.println("exiting");
    }
}
