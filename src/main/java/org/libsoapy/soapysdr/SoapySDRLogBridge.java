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

import org.jitsi.utils.logging.*;

/**
 * Routes the log messages of the native SoapySDR library and its driver
 * modules into the <tt>Logger</tt> of libsoapy.
 */
public class SoapySDRLogBridge
    implements SoapySDRLogHandler
{
    private static final Logger logger
        = Logger.getLogger(SoapySDRLogBridge.class);

    /**
     * Strips the carriage returns and line feeds which some drivers put in
     * front of their messages.
     *
     * @param message the message received from the native library
     * @return <tt>message</tt> without leading CR and LF characters
     */
    static String trimMessage(String message)
    {
        if (message == null)
            return "";

        int start = 0;
        int length = message.length();

        while (start < length)
        {
            char c = message.charAt(start);

            if (c != '\r' && c != '\n')
                break;
            start++;
        }
        return message.substring(start);
    }

    @Override
    public void callback(int logLevel, String message)
    {
        String msg = trimMessage(message);

        switch (logLevel)
        {
        case SoapySDR.SOAPY_SDR_FATAL:
        case SoapySDR.SOAPY_SDR_CRITICAL:
        case SoapySDR.SOAPY_SDR_ERROR:
            logger.error(msg);
            break;
        case SoapySDR.SOAPY_SDR_WARNING:
            logger.warn(msg);
            break;
        case SoapySDR.SOAPY_SDR_DEBUG:
            if (logger.isDebugEnabled())
                logger.debug(msg);
            break;
        case SoapySDR.SOAPY_SDR_TRACE:
            if (logger.isTraceEnabled())
                logger.trace(msg);
            break;
        default:
            // NOTICE, INFO, SSI and anything newer
            if (logger.isInfoEnabled())
                logger.info(msg);
            break;
        }
    }
}
