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
 * The data type of an argument described by an {@link ArgInfo}.
 */
public enum ArgType
{
    BOOL,
    INT,
    FLOAT,
    STRING,

    /**
     * A type tag which this version of libsoapy does not know.
     */
    UNRECOGNIZED;

    /**
     * Maps a native <tt>SoapySDRArgInfoType</tt> value.
     *
     * @param type the native type tag
     * @return the <tt>ArgType</tt> for <tt>type</tt> or
     * {@link #UNRECOGNIZED}
     */
    public static ArgType valueOf(int type)
    {
        switch (type)
        {
        case SoapySDR.SOAPY_SDR_ARG_INFO_BOOL:
            return BOOL;
        case SoapySDR.SOAPY_SDR_ARG_INFO_INT:
            return INT;
        case SoapySDR.SOAPY_SDR_ARG_INFO_FLOAT:
            return FLOAT;
        case SoapySDR.SOAPY_SDR_ARG_INFO_STRING:
            return STRING;
        default:
            return UNRECOGNIZED;
        }
    }
}
