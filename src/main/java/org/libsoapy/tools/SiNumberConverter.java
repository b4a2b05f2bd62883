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

import com.beust.jcommander.*;

/**
 * Converts command-line numbers which may carry a <tt>k</tt>, <tt>M</tt> or
 * <tt>G</tt> suffix, for example <tt>433.92M</tt> or <tt>2.4G</tt>.
 */
public class SiNumberConverter
    implements IStringConverter<Double>
{
    /**
     * Parses a number with an optional SI suffix.
     *
     * @param s the number to parse
     * @return the value of <tt>s</tt>
     * @throws NumberFormatException if <tt>s</tt> is not a number
     */
    public static double parse(String s)
    {
        String t = s.trim();
        double multiplier = 1;

        if (t.endsWith("k"))
            multiplier = 1e3;
        else if (t.endsWith("M"))
            multiplier = 1e6;
        else if (t.endsWith("G"))
            multiplier = 1e9;
        if (multiplier != 1)
            t = t.substring(0, t.length() - 1);
        return Double.parseDouble(t) * multiplier;
    }

    @Override
    public Double convert(String value)
    {
        try
        {
            return parse(value);
        }
        catch (NumberFormatException nfe)
        {
            throw new ParameterException("Not a number: " + value);
        }
    }
}
