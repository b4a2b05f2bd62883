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
 * The direction of a channel or a stream.
 */
public enum Direction
{
    TX(SoapySDR.SOAPY_SDR_TX),
    RX(SoapySDR.SOAPY_SDR_RX);

    private final int value;

    private Direction(int value)
    {
        this.value = value;
    }

    /**
     * Gets the native <tt>SOAPY_SDR_TX</tt> or <tt>SOAPY_SDR_RX</tt> value of
     * this direction.
     *
     * @return the native value of this direction
     */
    public int getValue()
    {
        return value;
    }
}
