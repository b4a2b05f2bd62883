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

import com.sun.jna.*;
import org.libsoapy.util.*;
import org.jitsi.utils.logging.*;

/**
 * Provides the constants of the native SoapySDR C API and loads the native
 * library on first use.
 */
public final class SoapySDR
{
    /**
     * The name of the configuration property which specifies the name (or
     * path) of the native SoapySDR library to load.
     */
    public static final String PNAME_LIBRARY_NAME
        = "org.libsoapy.soapysdr.LIBRARY_NAME";

    /**
     * The name of the <tt>boolean</tt> configuration property which specifies
     * whether the log messages of the native library are to be routed into
     * the <tt>Logger</tt> of libsoapy.
     */
    public static final String PNAME_REDIRECT_LOGGING
        = "org.libsoapy.soapysdr.REDIRECT_LOGGING";

    /**
     * The name of the configuration property which specifies the log level of
     * the native library, either by name (e.g. <tt>DEBUG</tt>) or by number.
     */
    public static final String PNAME_LOG_LEVEL
        = "org.libsoapy.soapysdr.LOG_LEVEL";

    public static final String DEFAULT_LIBRARY_NAME = "SoapySDR";

    /* Directions. */

    public static final int SOAPY_SDR_TX = 0;

    public static final int SOAPY_SDR_RX = 1;

    /* Stream flags. */

    /**
     * Indicates the end of a burst on transmit or receive.
     */
    public static final int SOAPY_SDR_END_BURST = 1 << 1;

    /**
     * Indicates that the time argument of a stream call is valid.
     */
    public static final int SOAPY_SDR_HAS_TIME = 1 << 2;

    public static final int SOAPY_SDR_END_ABRUPT = 1 << 3;

    public static final int SOAPY_SDR_ONE_PACKET = 1 << 4;

    /**
     * Indicates that a read returned only part of a packet and that the next
     * read will return the remainder.
     */
    public static final int SOAPY_SDR_MORE_FRAGMENTS = 1 << 5;

    public static final int SOAPY_SDR_WAIT_TRIGGER = 1 << 6;

    /* Error codes. */

    public static final int SOAPY_SDR_TIMEOUT = -1;

    public static final int SOAPY_SDR_STREAM_ERROR = -2;

    public static final int SOAPY_SDR_CORRUPTION = -3;

    public static final int SOAPY_SDR_OVERFLOW = -4;

    public static final int SOAPY_SDR_NOT_SUPPORTED = -5;

    public static final int SOAPY_SDR_TIME_ERROR = -6;

    public static final int SOAPY_SDR_UNDERFLOW = -7;

    /* SoapySDRArgInfoType */

    public static final int SOAPY_SDR_ARG_INFO_BOOL = 0;

    public static final int SOAPY_SDR_ARG_INFO_INT = 1;

    public static final int SOAPY_SDR_ARG_INFO_FLOAT = 2;

    public static final int SOAPY_SDR_ARG_INFO_STRING = 3;

    /* SoapySDRLogLevel */

    public static final int SOAPY_SDR_FATAL = 1;

    public static final int SOAPY_SDR_CRITICAL = 2;

    public static final int SOAPY_SDR_ERROR = 3;

    public static final int SOAPY_SDR_WARNING = 4;

    public static final int SOAPY_SDR_NOTICE = 5;

    public static final int SOAPY_SDR_INFO = 6;

    public static final int SOAPY_SDR_DEBUG = 7;

    public static final int SOAPY_SDR_TRACE = 8;

    public static final int SOAPY_SDR_SSI = 9;

    private static final String[] LOG_LEVEL_NAMES
        = {
            "FATAL", "CRITICAL", "ERROR", "WARNING", "NOTICE", "INFO", "DEBUG",
            "TRACE", "SSI"
        };

    /**
     * The <tt>Logger</tt> used by the <tt>SoapySDR</tt> class for logging
     * output.
     */
    private static final Logger logger = Logger.getLogger(SoapySDR.class);

    /**
     * The loaded native library or <tt>null</tt> if it has not been loaded
     * yet.
     */
    private static SoapySDRLibrary library;

    /**
     * The log handler registered with the native library. The native library
     * keeps only a function pointer to it so it must stay strongly reachable.
     */
    private static SoapySDRLogHandler logHandler;

    /**
     * Gets the native SoapySDR library, loading it first if necessary. The
     * name of the library is read from {@link #PNAME_LIBRARY_NAME}.
     *
     * @return the native SoapySDR library
     * @throws UnsatisfiedLinkError if the native library cannot be loaded
     */
    public static synchronized SoapySDRLibrary getLibrary()
    {
        if (library == null)
        {
            String name
                = ConfigUtils.getString(
                        PNAME_LIBRARY_NAME,
                        DEFAULT_LIBRARY_NAME);
            SoapySDRLibrary lib
                = Native.load(
                        name,
                        SoapySDRLibrary.class,
                        Collections.singletonMap(
                                Library.OPTION_STRING_ENCODING,
                                "UTF-8"));

            if (logger.isInfoEnabled())
            {
                logger.info(
                        "Loaded " + name + " (API "
                            + lib.SoapySDR_getAPIVersion() + ", ABI "
                            + lib.SoapySDR_getABIVersion() + ", library "
                            + lib.SoapySDR_getLibVersion() + ")");
            }

            if (ConfigUtils.getBoolean(PNAME_REDIRECT_LOGGING, true))
            {
                logHandler = new SoapySDRLogBridge();
                lib.SoapySDR_registerLogHandler(logHandler);
            }

            String logLevel = ConfigUtils.getString(PNAME_LOG_LEVEL, null);

            if (logLevel != null)
            {
                int level = parseLogLevel(logLevel);

                if (level > 0)
                    lib.SoapySDR_setLogLevel(level);
                else
                    logger.warn("Ignoring unknown log level " + logLevel);
            }

            library = lib;
        }
        return library;
    }

    /**
     * Gets the version of the SoapySDR API implemented by the native library.
     *
     * @return the API version string, for example <tt>0.8.0</tt>
     */
    public static String getAPIVersion()
    {
        return getLibrary().SoapySDR_getAPIVersion();
    }

    public static String getABIVersion()
    {
        return getLibrary().SoapySDR_getABIVersion();
    }

    public static String getLibVersion()
    {
        return getLibrary().SoapySDR_getLibVersion();
    }

    /**
     * Parses a native log level given either by name (case insensitive) or
     * by number.
     *
     * @param s the log level to parse
     * @return the <tt>SOAPY_SDR_*</tt> log level constant or <tt>-1</tt> if
     * <tt>s</tt> does not name one
     */
    public static int parseLogLevel(String s)
    {
        String name = s.trim();

        for (int i = 0; i < LOG_LEVEL_NAMES.length; i++)
        {
            if (LOG_LEVEL_NAMES[i].equalsIgnoreCase(name))
                return i + 1;
        }
        try
        {
            int level = Integer.parseInt(name);

            if (level >= SOAPY_SDR_FATAL && level <= SOAPY_SDR_SSI)
                return level;
        }
        catch (NumberFormatException nfe)
        {
            // Neither a name nor a number.
        }
        return -1;
    }

    private SoapySDR()
    {
    }
}
