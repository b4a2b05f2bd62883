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

import java.util.*;

import com.sun.jna.*;
import org.libsoapy.soapysdr.*;

/**
 * Describes an argument which a device, a stream, a tuning request, a sensor
 * or a setting accepts. Instances are immutable.
 */
public final class ArgInfo
{
    /**
     * One of the discrete values an argument may be restricted to.
     */
    public static final class Option
    {
        private final String value;

        private final String name;

        public Option(String value, String name)
        {
            this.value = Objects.requireNonNull(value, "value");
            this.name = name;
        }

        public String getValue()
        {
            return value;
        }

        /**
         * Gets the displayable name of this option.
         *
         * @return the displayable name of this option or <tt>null</tt>
         */
        public String getName()
        {
            return name;
        }

        @Override
        public boolean equals(Object obj)
        {
            if (!(obj instanceof Option))
                return false;

            Option other = (Option) obj;

            return value.equals(other.value) && Objects.equals(name, other.name);
        }

        @Override
        public int hashCode()
        {
            return Objects.hash(value, name);
        }

        @Override
        public String toString()
        {
            return (name == null) ? value : (value + " (" + name + ")");
        }
    }

    /**
     * Copies a native <tt>SoapySDRArgInfo</tt>. The native structure is not
     * released.
     *
     * @throws IllegalStateException if the native key or value is
     * <tt>NULL</tt>
     */
    static ArgInfo fromNative(SoapySDRArgInfo info)
    {
        int numOptions = (info.numOptions == null) ? 0 : info.numOptions.intValue();
        List<Option> options = new ArrayList<>(numOptions);

        for (int i = 0; i < numOptions; i++)
        {
            long offset = (long) i * Native.POINTER_SIZE;
            String value
                = requiredString(
                        (info.options == null)
                            ? null
                            : info.options.getPointer(offset),
                        "option");
            String name
                = optionalString(
                        (info.optionNames == null)
                            ? null
                            : info.optionNames.getPointer(offset));

            options.add(new Option(value, name));
        }

        SoapySDRRange r = info.range;

        return
            new ArgInfo(
                    requiredString(info.key, "key"),
                    requiredString(info.value, "value"),
                    optionalString(info.name),
                    optionalString(info.description),
                    optionalString(info.units),
                    ArgType.valueOf(info.type),
                    (r == null) ? new Range(0, 0) : new Range(r),
                    options);
    }

    private static String optionalString(Pointer p)
    {
        return (p == null) ? null : p.getString(0, "UTF-8");
    }

    private static String requiredString(Pointer p, String field)
    {
        if (p == null)
        {
            throw new IllegalStateException(
                    "SoapySDR returned an argument with a NULL " + field);
        }
        return p.getString(0, "UTF-8");
    }

    private final String key;

    private final String value;

    private final String name;

    private final String description;

    private final String units;

    private final ArgType dataType;

    private final Range range;

    private final List<Option> options;

    public ArgInfo(
            String key,
            String value,
            String name,
            String description,
            String units,
            ArgType dataType,
            Range range,
            List<Option> options)
    {
        this.key = Objects.requireNonNull(key, "key");
        this.value = Objects.requireNonNull(value, "value");
        this.name = name;
        this.description = description;
        this.units = units;
        this.dataType = (dataType == null) ? ArgType.UNRECOGNIZED : dataType;
        this.range = (range == null) ? new Range(0, 0) : range;
        this.options
            = (options == null)
                ? Collections.<Option>emptyList()
                : Collections.unmodifiableList(new ArrayList<>(options));
    }

    /**
     * Gets the key which identifies the argument.
     *
     * @return the key which identifies the argument
     */
    public String getKey()
    {
        return key;
    }

    /**
     * Gets the default value of the argument.
     *
     * @return the default value of the argument
     */
    public String getValue()
    {
        return value;
    }

    public String getName()
    {
        return name;
    }

    public String getDescription()
    {
        return description;
    }

    /**
     * Gets the units of the argument, for example <tt>dB</tt> or <tt>Hz</tt>.
     *
     * @return the units of the argument or <tt>null</tt>
     */
    public String getUnits()
    {
        return units;
    }

    public ArgType getDataType()
    {
        return dataType;
    }

    /**
     * Gets the range of a numeric argument.
     *
     * @return the range of a numeric argument. All zero if the driver did not
     * specify one.
     */
    public Range getRange()
    {
        return range;
    }

    /**
     * Gets the discrete values the argument is restricted to.
     *
     * @return the options of the argument, empty if it is not restricted
     */
    public List<Option> getOptions()
    {
        return options;
    }

    @Override
    public String toString()
    {
        return
            getClass().getSimpleName() + "[key=" + key + ", value=" + value
                + ", type=" + dataType + "]";
    }
}
