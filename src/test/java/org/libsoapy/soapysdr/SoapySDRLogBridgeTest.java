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

import java.util.*;
import java.util.logging.*;

import org.junit.*;

import static org.junit.Assert.*;

public class SoapySDRLogBridgeTest
{
    @Test
    public void trimMessageStripsLeadingLineBreaks()
    {
        assertEquals("tuned", SoapySDRLogBridge.trimMessage("\r\n\ntuned"));
        assertEquals("a\nb\n", SoapySDRLogBridge.trimMessage("a\nb\n"));
        assertEquals("", SoapySDRLogBridge.trimMessage("\n"));
        assertEquals("", SoapySDRLogBridge.trimMessage(null));
    }

    /**
     * Gets the level a native message is logged at.
     */
    private static Level levelOf(int nativeLevel)
    {
        java.util.logging.Logger julLogger
            = java.util.logging.Logger.getLogger(
                    SoapySDRLogBridge.class.getName());
        List<LogRecord> records = new ArrayList<>();
        Handler handler
            = new Handler()
            {
                @Override
                public void publish(LogRecord record)
                {
                    records.add(record);
                }

                @Override
                public void flush()
                {
                }

                @Override
                public void close()
                {
                }
            };
        Level oldLevel = julLogger.getLevel();

        handler.setLevel(Level.ALL);
        julLogger.setLevel(Level.ALL);
        julLogger.addHandler(handler);
        try
        {
            new SoapySDRLogBridge().callback(nativeLevel, "\r\nlevel test");
        }
        finally
        {
            julLogger.removeHandler(handler);
            julLogger.setLevel(oldLevel);
        }

        assertEquals(1, records.size());

        String message = records.get(0).getMessage();

        assertTrue(message.endsWith("level test"));
        assertFalse(message.contains("\n"));
        return records.get(0).getLevel();
    }

    @Test
    public void nativeLevelsMapOntoLoggerLevels()
    {
        assertEquals(Level.SEVERE, levelOf(SoapySDR.SOAPY_SDR_FATAL));
        assertEquals(Level.SEVERE, levelOf(SoapySDR.SOAPY_SDR_CRITICAL));
        assertEquals(Level.SEVERE, levelOf(SoapySDR.SOAPY_SDR_ERROR));
        assertEquals(Level.WARNING, levelOf(SoapySDR.SOAPY_SDR_WARNING));
        assertEquals(Level.INFO, levelOf(SoapySDR.SOAPY_SDR_NOTICE));
        assertEquals(Level.INFO, levelOf(SoapySDR.SOAPY_SDR_INFO));
        assertEquals(Level.INFO, levelOf(SoapySDR.SOAPY_SDR_SSI));
        assertEquals(Level.INFO, levelOf(42));

        Level debug = levelOf(SoapySDR.SOAPY_SDR_DEBUG);
        Level trace = levelOf(SoapySDR.SOAPY_SDR_TRACE);

        assertTrue(debug.intValue() < Level.INFO.intValue());
        assertTrue(trace.intValue() <= debug.intValue());
    }

    @Test
    public void parseLogLevel()
    {
        assertEquals(
                SoapySDR.SOAPY_SDR_WARNING,
                SoapySDR.parseLogLevel("warning"));
        assertEquals(
                SoapySDR.SOAPY_SDR_TRACE,
                SoapySDR.parseLogLevel(" TRACE "));
        assertEquals(SoapySDR.SOAPY_SDR_FATAL, SoapySDR.parseLogLevel("1"));
        assertEquals(SoapySDR.SOAPY_SDR_SSI, SoapySDR.parseLogLevel("9"));
        assertEquals(-1, SoapySDR.parseLogLevel("0"));
        assertEquals(-1, SoapySDR.parseLogLevel("10"));
        assertEquals(-1, SoapySDR.parseLogLevel("loud"));
    }
}
