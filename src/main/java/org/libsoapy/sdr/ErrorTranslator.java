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
 * Translates the two ways in which the native SoapySDR library reports errors
 * into {@link SoapySDRException}s.
 * <p>
 * Stream functions and setters return a status code which is negative (or,
 * for setters, non-zero) on failure. Every other function reports failure
 * through the thread-local <tt>SoapySDRDevice_lastStatus</tt> and
 * <tt>SoapySDRDevice_lastError</tt> which have to be read on the calling
 * thread right after the call returns.
 * </p>
 */
public class ErrorTranslator
{
    /**
     * A native call whose result is checked through
     * <tt>SoapySDRDevice_lastStatus</tt>.
     *
     * @param <T> the type of the result of the call
     */
    public interface Call<T>
    {
        T call();
    }

    private final SoapySDRLibrary lib;

    public ErrorTranslator(SoapySDRLibrary lib)
    {
        if (lib == null)
            throw new NullPointerException("lib");

        this.lib = lib;
    }

    /**
     * Performs a native call and checks <tt>SoapySDRDevice_lastStatus</tt>
     * immediately after it.
     *
     * @param call the native call to perform
     * @return the result of <tt>call</tt>
     * @throws SoapySDRException with {@link ErrorCode#OTHER} and the text of
     * <tt>SoapySDRDevice_lastError</tt> if the call failed
     */
    public <T> T invoke(Call<T> call)
        throws SoapySDRException
    {
        T result = call.call();

        checkLastStatus();
        return result;
    }

    /**
     * Performs a native call which returns a status code, typically a setter.
     * The call fails if <tt>SoapySDRDevice_lastStatus</tt> reports a failure
     * or if the returned status code is not zero.
     *
     * @param call the native call to perform
     * @throws SoapySDRException if the call failed
     */
    public void invokeStatus(Call<Integer> call)
        throws SoapySDRException
    {
        Integer status = invoke(call);

        if (status != null && status != 0)
            throw newException(status);
    }

    /**
     * Checks <tt>SoapySDRDevice_lastStatus</tt> of the calling thread.
     *
     * @throws SoapySDRException with {@link ErrorCode#OTHER} and the text of
     * <tt>SoapySDRDevice_lastError</tt> if the last call failed
     */
    public void checkLastStatus()
        throws SoapySDRException
    {
        if (lib.SoapySDRDevice_lastStatus() != 0)
            throw new SoapySDRException(ErrorCode.OTHER, lastError());
    }

    /**
     * Checks the status code returned by a native function which returns
     * zero on success.
     *
     * @param code the status code returned by the native function
     * @throws SoapySDRException with the translated code if <tt>code</tt> is
     * not zero
     */
    public void checkReturnCode(int code)
        throws SoapySDRException
    {
        if (code != 0)
            throw newException(code);
    }

    /**
     * Checks the value returned by a native function which returns a
     * non-negative length on success and a negative error code on failure.
     *
     * @param ret the value returned by the native function
     * @return <tt>ret</tt> if it is not negative
     * @throws SoapySDRException with the translated code if <tt>ret</tt> is
     * negative
     */
    public int checkLength(int ret)
        throws SoapySDRException
    {
        if (ret < 0)
            throw newException(ret);
        return ret;
    }

    private SoapySDRException newException(int code)
    {
        return new SoapySDRException(ErrorCode.valueOf(code), lastError());
    }

    private String lastError()
    {
        String error = lib.SoapySDRDevice_lastError();

        return (error == null) ? "" : error;
    }

    /**
     * Gets the native library whose errors this instance translates.
     *
     * @return the native library whose errors this instance translates
     */
    public SoapySDRLibrary getLibrary()
    {
        return lib;
    }
}
