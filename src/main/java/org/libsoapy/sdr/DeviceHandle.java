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

import java.util.concurrent.atomic.*;

import com.sun.jna.*;
import org.jitsi.utils.logging.*;
import org.libsoapy.soapysdr.*;

/**
 * Tracks the references to a native <tt>SoapySDRDevice</tt> handle and unmakes
 * it when the last of them is released. A {@link Device}, each of its
 * duplicates and each of its streams hold one reference. This class is
 * thread-safe.
 */
class DeviceHandle
{
    private static final Logger logger = Logger.getLogger(DeviceHandle.class);

    private final SoapySDRLibrary lib;

    private final Pointer pointer;

    private final AtomicInteger refCount = new AtomicInteger(1);

    /**
     * Initializes a new <tt>DeviceHandle</tt> which holds one reference to a
     * specific native device.
     *
     * @param lib the native library which made the device
     * @param pointer the native device
     */
    DeviceHandle(SoapySDRLibrary lib, Pointer pointer)
    {
        this.lib = lib;
        this.pointer = pointer;
    }

    /**
     * Adds a reference.
     *
     * @throws IllegalStateException if the native device has already been
     * unmade
     */
    void retain()
    {
        int count;

        do
        {
            count = refCount.get();
            if (count <= 0)
                throw new IllegalStateException("Device has been closed");
        }
        while (!refCount.compareAndSet(count, count + 1));
    }

    /**
     * Drops a reference and unmakes the native device if it was the last one.
     */
    void release()
    {
        int count = refCount.decrementAndGet();

        if (count == 0)
        {
            if (logger.isDebugEnabled())
                logger.debug("Unmaking SoapySDR device " + pointer);

            int ret = lib.SoapySDRDevice_unmake(pointer);

            if (ret != 0)
            {
                logger.warn(
                        "SoapySDRDevice_unmake failed with " + ret + ": "
                            + lib.SoapySDRDevice_lastError());
            }
        }
        else if (count < 0)
        {
            throw new IllegalStateException("Device released too many times");
        }
    }

    int getRefCount()
    {
        return refCount.get();
    }

    SoapySDRLibrary getLibrary()
    {
        return lib;
    }

    /**
     * Gets the native device.
     *
     * @return the native device
     * @throws IllegalStateException if the native device has been unmade
     */
    Pointer getPointer()
    {
        if (refCount.get() <= 0)
            throw new IllegalStateException("Device has been closed");
        return pointer;
    }
}
