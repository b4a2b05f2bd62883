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

import org.libsoapy.soapysdr.*;

/**
 * An asynchronous status event of a transmit stream.
 */
public final class StreamStatus
{
    private final long channelMask;

    private final int flags;

    private final long timeNs;

    public StreamStatus(long channelMask, int flags, long timeNs)
    {
        this.channelMask = channelMask;
        this.flags = flags;
        this.timeNs = timeNs;
    }

    /**
     * Gets the channels the event concerns, one bit per channel index.
     *
     * @return the channel mask of the event
     */
    public long getChannelMask()
    {
        return channelMask;
    }

    public int getFlags()
    {
        return flags;
    }

    public long getTimeNs()
    {
        return timeNs;
    }

    public boolean hasTime()
    {
        return (flags & SoapySDR.SOAPY_SDR_HAS_TIME) != 0;
    }

    public boolean isEndOfBurst()
    {
        return (flags & SoapySDR.SOAPY_SDR_END_BURST) != 0;
    }

    @Override
    public String toString()
    {
        return
            "StreamStatus[channelMask=0x" + Long.toHexString(channelMask)
                + ", flags=0x" + Integer.toHexString(flags) + ", timeNs="
                + timeNs + "]";
    }
}
