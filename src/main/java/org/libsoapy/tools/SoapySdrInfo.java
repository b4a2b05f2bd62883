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
import java.util.*;

import org.jitsi.utils.logging.*;
import org.libsoapy.sdr.*;

/**
 * Lists the SoapySDR devices which match an optional filter together with the
 * frequency range, sample rates and antennas of each of their channels.
 * <p>
 * Usage: <tt>SoapySdrInfo [filter]</tt>, for example
 * <tt>SoapySdrInfo driver=rtlsdr</tt>.
 * </p>
 */
public class SoapySdrInfo
{
    private static final Logger logger = Logger.getLogger(SoapySdrInfo.class);

    public static void main(String[] args)
    {
        String filter = (args.length > 0) ? args[0] : "";

        try
        {
            new SoapySdrInfo(System.out).run(Device.enumerate(filter));
        }
        catch (SoapySDRException sdre)
        {
            logger.error("Failed to list devices", sdre);
            System.err.println("Error listing devices: " + sdre.getMessage());
            System.exit(1);
        }
    }

    private final PrintStream out;

    public SoapySdrInfo(PrintStream out)
    {
        this.out = out;
    }

    /**
     * Opens and describes each of a list of devices.
     *
     * @param devices the <tt>Args</tt> of the devices to describe
     * @throws SoapySDRException if a device cannot be opened or described
     */
    public void run(List<Args> devices)
        throws SoapySDRException
    {
        for (Args deviceArgs : devices)
        {
            out.println(deviceArgs);
            try (Device device = new Device(deviceArgs))
            {
                describe(device);
            }
        }
    }

    /**
     * Prints the channels of both directions of a device.
     *
     * @param device the device to describe
     * @throws SoapySDRException if the device cannot be queried
     */
    public void describe(Device device)
        throws SoapySDRException
    {
        for (Direction direction
                : new Direction[] { Direction.RX, Direction.TX })
        {
            int channels;

            try
            {
                channels = device.getNumChannels(direction);
            }
            catch (SoapySDRException sdre)
            {
                logger.warn(
                        "Failed to get the number of " + direction
                            + " channels: " + sdre.getMessage());
                channels = 0;
            }
            for (int channel = 0; channel < channels; channel++)
                describeChannel(device, direction, channel);
        }
    }

    private void describeChannel(Device device, Direction direction, int channel)
        throws SoapySDRException
    {
        out.println("\t" + direction + " Channel " + channel);

        List<Range> ranges = device.getFrequencyRange(direction, channel);

        if (!ranges.isEmpty())
        {
            Range range = ranges.get(0);

            out.println(
                    "\t\tFreq range: " + (range.getMinimum() / 1e6) + " to "
                        + (range.getMaximum() / 1e6) + " MHz");
        }
        out.println(
                "\t\tSample rates: "
                    + device.listSampleRates(direction, channel));
        out.println("\t\tAntennas: ");
        for (String antenna : device.listAntennas(direction, channel))
            out.println("\t\t\t" + antenna);
    }
}
