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
package org.libsoapy.soapysdr;

import com.sun.jna.*;

/**
 * Maps the native <tt>SoapySDRArgInfo</tt> structure which describes a
 * configurable parameter of a device, a stream or a sensor. The string fields
 * are kept as raw pointers because any of them may be <tt>NULL</tt>.
 */
@Structure.FieldOrder({
        "key", "value", "name", "description", "units",
        "type", "range", "numOptions", "options", "optionNames" })
public class SoapySDRArgInfo
    extends Structure
{
    public static class ByValue
        extends SoapySDRArgInfo
        implements Structure.ByValue
    {
    }

    public Pointer key;

    public Pointer value;

    public Pointer name;

    public Pointer description;

    public Pointer units;

    /**
     * One of the <tt>SOAPY_SDR_ARG_INFO_*</tt> constants of {@link SoapySDR}.
     */
    public int type;

    public SoapySDRRange range;

    public SizeT numOptions;

    public Pointer options;

    public Pointer optionNames;

    public SoapySDRArgInfo()
    {
        range = new SoapySDRRange();
        numOptions = new SizeT();
    }

    public SoapySDRArgInfo(Pointer p)
    {
        super(p);
        read();
    }
}
