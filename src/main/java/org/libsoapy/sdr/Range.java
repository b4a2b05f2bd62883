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
 * A numeric range with an optional step. A step of zero means that the range
 * is continuous.
 */
public final class Range
{
    private final double minimum;

    private final double maximum;

    private final double step;

    public Range(double minimum, double maximum)
    {
        this(minimum, maximum, 0);
    }

    public Range(double minimum, double maximum, double step)
    {
        this.minimum = minimum;
        this.maximum = maximum;
        this.step = step;
    }

    Range(SoapySDRRange range)
    {
        this(range.minimum, range.maximum, range.step);
    }

    public double getMinimum()
    {
        return minimum;
    }

    public double getMaximum()
    {
        return maximum;
    }

    public double getStep()
    {
        return step;
    }

    /**
     * Determines whether a specific value lies within this range, bounds
     * included. The step is not taken into account.
     *
     * @param value the value to check
     * @return <tt>true</tt> if <tt>value</tt> lies within this range
     */
    public boolean contains(double value)
    {
        return value >= minimum && value <= maximum;
    }

    @Override
    public boolean equals(Object obj)
    {
        if (this == obj)
            return true;
        if (!(obj instanceof Range))
            return false;

        Range other = (Range) obj;

        return
            Double.compare(minimum, other.minimum) == 0
                && Double.compare(maximum, other.maximum) == 0
                && Double.compare(step, other.step) == 0;
    }

    @Override
    public int hashCode()
    {
        int h = Double.hashCode(minimum);

        h = 31 * h + Double.hashCode(maximum);
        h = 31 * h + Double.hashCode(step);
        return h;
    }

    @Override
    public String toString()
    {
        StringBuilder s = new StringBuilder();

        s.append('[').append(minimum).append(", ").append(maximum);
        if (step != 0)
            s.append("; step ").append(step);
        s.append(']');
        return s.toString();
    }
}
