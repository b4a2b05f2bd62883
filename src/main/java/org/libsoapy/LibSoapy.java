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
package org.libsoapy;

import org.jitsi.service.configuration.*;

/**
 * Represents the entry point of the <tt>libsoapy</tt> library for the
 * services it optionally consumes from its host application.
 * <p>
 * A host which manages its settings through a <tt>ConfigurationService</tt>
 * installs it with {@link #setConfigurationService} before the native library
 * is first used. Without one, libsoapy reads its properties from
 * <tt>System</tt>.
 * </p>
 */
public final class LibSoapy
{
    private static volatile ConfigurationService configurationService;

    /**
     * Gets the <tt>ConfigurationService</tt> installed by the host.
     *
     * @return the <tt>ConfigurationService</tt> installed by the host or
     * <tt>null</tt> if properties are to be read from <tt>System</tt>
     */
    public static ConfigurationService getConfigurationService()
    {
        return configurationService;
    }

    public static void setConfigurationService(ConfigurationService cfg)
    {
        configurationService = cfg;
    }

    private LibSoapy()
    {
    }
}
