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
 * Enumerates the error codes reported by the native SoapySDR library.
 */
public enum ErrorCode
{
    /**
     * A read or a write timed out.
     */
    TIMEOUT(SoapySDR.SOAPY_SDR_TIMEOUT),

    /**
     * A non-specific stream error.
     */
    STREAM_ERROR(SoapySDR.SOAPY_SDR_STREAM_ERROR),

    /**
     * A read saw corrupted data, for example a malformed packet.
     */
    CORRUPTION(SoapySDR.SOAPY_SDR_CORRUPTION),

    /**
     * A read lost samples because an internal buffer filled.
     */
    OVERFLOW(SoapySDR.SOAPY_SDR_OVERFLOW),

    /**
     * The requested operation or flag is not supported by the driver.
     */
    NOT_SUPPORTED(SoapySDR.SOAPY_SDR_NOT_SUPPORTED),

    /**
     * A stream time was late or too early to process.
     */
    TIME_ERROR(SoapySDR.SOAPY_SDR_TIME_ERROR),

    /**
     * A write was interrupted by an underflow, for example of a continuous
     * stream.
     */
    UNDERFLOW(SoapySDR.SOAPY_SDR_UNDERFLOW),

    /**
     * An error without a specific code. The message describes it.
     */
    OTHER(0);

    /**
     * Returns the <tt>ErrorCode</tt> which has a specific native value.
     *
     * @param value the native error code
     * @return the <tt>ErrorCode</tt> which has the specified <tt>value</tt>
     * or {@link #OTHER} if there is no such <tt>ErrorCode</tt>
     */
    public static ErrorCode valueOf(int value)
    {
        for (ErrorCode code : values())
        {
            if (code.value == value)
                return code;
        }
        return OTHER;
    }

    private final int value;

    private ErrorCode(int value)
    {
        this.value = value;
    }

    public int getValue()
    {
        return value;
    }
}
