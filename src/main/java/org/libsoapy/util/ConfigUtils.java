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
package org.libsoapy.util;

import org.jitsi.service.configuration.*;
import org.libsoapy.*;

/**
 * Reads the configuration properties of libsoapy from either a specific
 * <tt>ConfigurationService</tt> or, if there is none, from <tt>System</tt>.
 * The overloads without a <tt>ConfigurationService</tt> argument use the one
 * installed with {@link LibSoapy#setConfigurationService}.
 */
public class ConfigUtils
{
    /**
     * Gets the value as a {@code boolean} of a property from either a specific
     * {@code ConfigurationService} or {@code System}.
     *
     * @param cfg the {@code ConfigurationService} to get the value from or
     * {@code null} if the property is to be retrieved from {@code System}
     * @param property the name of the property to get
     * @param defaultValue the value to be returned if {@code property} is not
     * associated with a value
     * @return the value as a {@code boolean} of {@code property}
     */
    public static boolean getBoolean(
            ConfigurationService cfg,
            String property,
            boolean defaultValue)
    {
        if (cfg != null)
            return cfg.getBoolean(property, defaultValue);

        String s = getSystemProperty(property);

        return (s == null) ? defaultValue : Boolean.parseBoolean(s);
    }

    public static boolean getBoolean(String property, boolean defaultValue)
    {
        return
            getBoolean(
                    LibSoapy.getConfigurationService(),
                    property,
                    defaultValue);
    }

    /**
     * Gets the value as a {@code long} of a property from either a specific
     * {@code ConfigurationService} or {@code System}. A value which is not a
     * number yields {@code defaultValue}.
     *
     * @param cfg the {@code ConfigurationService} to get the value from or
     * {@code null} if the property is to be retrieved from {@code System}
     * @param property the name of the property to get
     * @param defaultValue the value to be returned if {@code property} is not
     * associated with a numeric value
     * @return the value as a {@code long} of {@code property}
     */
    public static long getLong(
            ConfigurationService cfg,
            String property,
            long defaultValue)
    {
        if (cfg != null)
            return cfg.getLong(property, defaultValue);

        String s = getSystemProperty(property);

        if (s == null)
            return defaultValue;
        try
        {
            return Long.parseLong(s.trim());
        }
        catch (NumberFormatException nfe)
        {
            return defaultValue;
        }
    }

    public static long getLong(String property, long defaultValue)
    {
        return
            getLong(LibSoapy.getConfigurationService(), property, defaultValue);
    }

    /**
     * Gets the value as a {@code String} of a property from either a specific
     * {@code ConfigurationService} or {@code System}.
     *
     * @param cfg the {@code ConfigurationService} to get the value from or
     * {@code null} if the property is to be retrieved from {@code System}
     * @param property the name of the property to get
     * @param defaultValue the value to be returned if {@code property} is not
     * associated with a value
     * @return the value as a {@code String} of {@code property}
     */
    public static String getString(
            ConfigurationService cfg,
            String property,
            String defaultValue)
    {
        if (cfg != null)
            return cfg.getString(property, defaultValue);

        String s = getSystemProperty(property);

        return (s == null) ? defaultValue : s;
    }

    public static String getString(String property, String defaultValue)
    {
        return
            getString(
                    LibSoapy.getConfigurationService(),
                    property,
                    defaultValue);
    }

    /**
     * Gets a <tt>System</tt> property, treating an empty value as absent.
     */
    private static String getSystemProperty(String property)
    {
        String s = System.getProperty(property);

        return (s == null || s.length() == 0) ? null : s;
    }
}
