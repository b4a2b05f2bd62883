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

/**
 * Implements <tt>Exception</tt> for a failure reported by the native SoapySDR
 * library, either through the return value of a function or through
 * <tt>SoapySDRDevice_lastStatus</tt>.
 */
public class SoapySDRException
    extends Exception
{
    /**
     * Serial version UID.
     */
    private static final long serialVersionUID = 0L;

    /**
     * The code of the error represented by this instance.
     */
    private final ErrorCode errorCode;

    /**
     * Initializes a new <tt>SoapySDRException</tt> instance with a specific
     * detail message and {@link ErrorCode#OTHER}.
     *
     * @param message the detail message to initialize the new instance with
     */
    public SoapySDRException(String message)
    {
        this(ErrorCode.OTHER, message);
    }

    /**
     * Initializes a new <tt>SoapySDRException</tt> instance with a specific
     * error code and detail message.
     *
     * @param errorCode the code of the error
     * @param message the detail message to initialize the new instance with
     */
    public SoapySDRException(ErrorCode errorCode, String message)
    {
        super(message);

        this.errorCode = (errorCode == null) ? ErrorCode.OTHER : errorCode;
    }

    /**
     * Gets the code of the error represented by this instance.
     *
     * @return the code of the error represented by this instance, never
     * <tt>null</tt>
     */
    public ErrorCode getErrorCode()
    {
        return errorCode;
    }

    /**
     * Returns a human-readable representation/description of this
     * <tt>Throwable</tt>.
     *
     * @return a human-readable representation/description of this
     * <tt>Throwable</tt>
     */
    @Override
    public String toString()
    {
        String s = super.toString();

        if (errorCode != ErrorCode.OTHER)
        {
            StringBuilder sb = new StringBuilder(s);

            sb.append(": errorCode= ");
            sb.append(errorCode);
            sb.append(" (").append(errorCode.getValue()).append(");");
            s = sb.toString();
        }
        return s;
    }
}
