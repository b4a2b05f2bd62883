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
import org.junit.*;

import static org.easymock.EasyMock.*;
import static org.junit.Assert.*;

public class ConfigUtilsTest
{
    private static final String PNAME = "org.libsoapy.util.ConfigUtilsTest.P";

    @After
    public void tearDown()
    {
        System.clearProperty(PNAME);
    }

    @Test
    public void systemPropertiesAreUsedWithoutConfigurationService()
    {
        assertEquals("dflt", ConfigUtils.getString(null, PNAME, "dflt"));
        assertTrue(ConfigUtils.getBoolean(null, PNAME, true));
        assertEquals(7L, ConfigUtils.getLong(null, PNAME, 7L));

        System.setProperty(PNAME, "false");
        assertEquals("false", ConfigUtils.getString(null, PNAME, "dflt"));
        assertFalse(ConfigUtils.getBoolean(null, PNAME, true));
        assertEquals(7L, ConfigUtils.getLong(null, PNAME, 7L));

        System.setProperty(PNAME, " 250000 ");
        assertEquals(250000L, ConfigUtils.getLong(null, PNAME, 7L));
    }

    @Test
    public void emptySystemPropertyMeansUnset()
    {
        System.setProperty(PNAME, "");
        assertEquals("dflt", ConfigUtils.getString(null, PNAME, "dflt"));
        assertTrue(ConfigUtils.getBoolean(null, PNAME, true));
    }

    @Test
    public void configurationServiceTakesPrecedence()
    {
        ConfigurationService cfg = createMock(ConfigurationService.class);

        expect(cfg.getString(PNAME, "dflt")).andReturn("rtlsdr");
        expect(cfg.getBoolean(PNAME, true)).andReturn(false);
        expect(cfg.getLong(PNAME, 7L)).andReturn(3L);
        replay(cfg);

        System.setProperty(PNAME, "ignored");
        assertEquals("rtlsdr", ConfigUtils.getString(cfg, PNAME, "dflt"));
        assertFalse(ConfigUtils.getBoolean(cfg, PNAME, true));
        assertEquals(3L, ConfigUtils.getLong(cfg, PNAME, 7L));
        verify(cfg);
    }
}
