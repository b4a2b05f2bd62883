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

import com.sun.jna.*;
import com.sun.jna.ptr.*;

/**
 * Declares the functions of the native SoapySDR C API (<tt>libSoapySDR</tt>)
 * which are used by libsoapy. An instance is obtained through
 * {@link SoapySDR#getLibrary()}.
 * <p>
 * Functions which return a C <tt>bool</tt> are declared to return a
 * <tt>byte</tt> so that only the low-order byte of the return register is
 * read. Functions which return memory allocated by SoapySDR return a
 * <tt>Pointer</tt> which the caller hands back to the matching free function.
 * </p>
 */
public interface SoapySDRLibrary
    extends Library
{
    /* Version.h */

    String SoapySDR_getAPIVersion();

    String SoapySDR_getABIVersion();

    String SoapySDR_getLibVersion();

    /* Types.h */

    void SoapySDR_free(Pointer ptr);

    void SoapySDRStrings_clear(PointerByReference elems, SizeT length);

    void SoapySDRKwargs_clear(Pointer args);

    void SoapySDRKwargsList_clear(Pointer args, SizeT length);

    void SoapySDRArgInfo_clear(Pointer info);

    void SoapySDRArgInfoList_clear(Pointer info, SizeT length);

    /* Formats.h */

    SizeT SoapySDR_formatToSize(String format);

    /* Logger.h */

    void SoapySDR_registerLogHandler(SoapySDRLogHandler handler);

    void SoapySDR_setLogLevel(int logLevel);

    /* Device.h: errors */

    int SoapySDRDevice_lastStatus();

    String SoapySDRDevice_lastError();

    /* Device.h: identification and construction */

    Pointer SoapySDRDevice_enumerate(
            SoapySDRKwargs args,
            SizeTByReference length);

    Pointer SoapySDRDevice_make(SoapySDRKwargs args);

    int SoapySDRDevice_unmake(Pointer device);

    Pointer SoapySDRDevice_getDriverKey(Pointer device);

    Pointer SoapySDRDevice_getHardwareKey(Pointer device);

    SoapySDRKwargs.ByValue SoapySDRDevice_getHardwareInfo(Pointer device);

    /* Device.h: channels API */

    int SoapySDRDevice_setFrontendMapping(
            Pointer device,
            int direction,
            String mapping);

    Pointer SoapySDRDevice_getFrontendMapping(Pointer device, int direction);

    SizeT SoapySDRDevice_getNumChannels(Pointer device, int direction);

    SoapySDRKwargs.ByValue SoapySDRDevice_getChannelInfo(
            Pointer device,
            int direction,
            SizeT channel);

    byte SoapySDRDevice_getFullDuplex(
            Pointer device,
            int direction,
            SizeT channel);

    /* Device.h: stream API */

    Pointer SoapySDRDevice_getStreamFormats(
            Pointer device,
            int direction,
            SizeT channel,
            SizeTByReference length);

    Pointer SoapySDRDevice_getNativeStreamFormat(
            Pointer device,
            int direction,
            SizeT channel,
            DoubleByReference fullScale);

    Pointer SoapySDRDevice_getStreamArgsInfo(
            Pointer device,
            int direction,
            SizeT channel,
            SizeTByReference length);

    Pointer SoapySDRDevice_setupStream(
            Pointer device,
            int direction,
            String format,
            Pointer channels,
            SizeT numChans,
            SoapySDRKwargs args);

    int SoapySDRDevice_closeStream(Pointer device, Pointer stream);

    SizeT SoapySDRDevice_getStreamMTU(Pointer device, Pointer stream);

    int SoapySDRDevice_activateStream(
            Pointer device,
            Pointer stream,
            int flags,
            long timeNs,
            SizeT numElems);

    int SoapySDRDevice_deactivateStream(
            Pointer device,
            Pointer stream,
            int flags,
            long timeNs);

    int SoapySDRDevice_readStream(
            Pointer device,
            Pointer stream,
            Pointer[] buffs,
            SizeT numElems,
            IntByReference flags,
            LongByReference timeNs,
            NativeLong timeoutUs);

    int SoapySDRDevice_writeStream(
            Pointer device,
            Pointer stream,
            Pointer[] buffs,
            SizeT numElems,
            IntByReference flags,
            long timeNs,
            NativeLong timeoutUs);

    int SoapySDRDevice_readStreamStatus(
            Pointer device,
            Pointer stream,
            SizeTByReference chanMask,
            IntByReference flags,
            LongByReference timeNs,
            NativeLong timeoutUs);

    /* Device.h: antenna API */

    Pointer SoapySDRDevice_listAntennas(
            Pointer device,
            int direction,
            SizeT channel,
            SizeTByReference length);

    int SoapySDRDevice_setAntenna(
            Pointer device,
            int direction,
            SizeT channel,
            String name);

    Pointer SoapySDRDevice_getAntenna(
            Pointer device,
            int direction,
            SizeT channel);

    /* Device.h: frontend corrections API */

    byte SoapySDRDevice_hasDCOffsetMode(
            Pointer device,
            int direction,
            SizeT channel);

    int SoapySDRDevice_setDCOffsetMode(
            Pointer device,
            int direction,
            SizeT channel,
            byte automatic);

    byte SoapySDRDevice_getDCOffsetMode(
            Pointer device,
            int direction,
            SizeT channel);

    byte SoapySDRDevice_hasDCOffset(
            Pointer device,
            int direction,
            SizeT channel);

    int SoapySDRDevice_setDCOffset(
            Pointer device,
            int direction,
            SizeT channel,
            double offsetI,
            double offsetQ);

    int SoapySDRDevice_getDCOffset(
            Pointer device,
            int direction,
            SizeT channel,
            DoubleByReference offsetI,
            DoubleByReference offsetQ);

    byte SoapySDRDevice_hasIQBalance(
            Pointer device,
            int direction,
            SizeT channel);

    int SoapySDRDevice_setIQBalance(
            Pointer device,
            int direction,
            SizeT channel,
            double balanceI,
            double balanceQ);

    int SoapySDRDevice_getIQBalance(
            Pointer device,
            int direction,
            SizeT channel,
            DoubleByReference balanceI,
            DoubleByReference balanceQ);

    /* Device.h: gain API */

    Pointer SoapySDRDevice_listGains(
            Pointer device,
            int direction,
            SizeT channel,
            SizeTByReference length);

    byte SoapySDRDevice_hasGainMode(
            Pointer device,
            int direction,
            SizeT channel);

    int SoapySDRDevice_setGainMode(
            Pointer device,
            int direction,
            SizeT channel,
            byte automatic);

    byte SoapySDRDevice_getGainMode(
            Pointer device,
            int direction,
            SizeT channel);

    int SoapySDRDevice_setGain(
            Pointer device,
            int direction,
            SizeT channel,
            double value);

    int SoapySDRDevice_setGainElement(
            Pointer device,
            int direction,
            SizeT channel,
            String name,
            double value);

    double SoapySDRDevice_getGain(
            Pointer device,
            int direction,
            SizeT channel);

    double SoapySDRDevice_getGainElement(
            Pointer device,
            int direction,
            SizeT channel,
            String name);

    SoapySDRRange.ByValue SoapySDRDevice_getGainRange(
            Pointer device,
            int direction,
            SizeT channel);

    SoapySDRRange.ByValue SoapySDRDevice_getGainElementRange(
            Pointer device,
            int direction,
            SizeT channel,
            String name);

    /* Device.h: frequency API */

    int SoapySDRDevice_setFrequency(
            Pointer device,
            int direction,
            SizeT channel,
            double frequency,
            SoapySDRKwargs args);

    int SoapySDRDevice_setFrequencyComponent(
            Pointer device,
            int direction,
            SizeT channel,
            String name,
            double frequency,
            SoapySDRKwargs args);

    double SoapySDRDevice_getFrequency(
            Pointer device,
            int direction,
            SizeT channel);

    double SoapySDRDevice_getFrequencyComponent(
            Pointer device,
            int direction,
            SizeT channel,
            String name);

    Pointer SoapySDRDevice_listFrequencies(
            Pointer device,
            int direction,
            SizeT channel,
            SizeTByReference length);

    Pointer SoapySDRDevice_getFrequencyRange(
            Pointer device,
            int direction,
            SizeT channel,
            SizeTByReference length);

    Pointer SoapySDRDevice_getFrequencyRangeComponent(
            Pointer device,
            int direction,
            SizeT channel,
            String name,
            SizeTByReference length);

    Pointer SoapySDRDevice_getFrequencyArgsInfo(
            Pointer device,
            int direction,
            SizeT channel,
            SizeTByReference length);

    /* Device.h: sample rate API */

    int SoapySDRDevice_setSampleRate(
            Pointer device,
            int direction,
            SizeT channel,
            double rate);

    double SoapySDRDevice_getSampleRate(
            Pointer device,
            int direction,
            SizeT channel);

    Pointer SoapySDRDevice_listSampleRates(
            Pointer device,
            int direction,
            SizeT channel,
            SizeTByReference length);

    Pointer SoapySDRDevice_getSampleRateRange(
            Pointer device,
            int direction,
            SizeT channel,
            SizeTByReference length);

    /* Device.h: bandwidth API */

    int SoapySDRDevice_setBandwidth(
            Pointer device,
            int direction,
            SizeT channel,
            double bw);

    double SoapySDRDevice_getBandwidth(
            Pointer device,
            int direction,
            SizeT channel);

    Pointer SoapySDRDevice_listBandwidths(
            Pointer device,
            int direction,
            SizeT channel,
            SizeTByReference length);

    Pointer SoapySDRDevice_getBandwidthRange(
            Pointer device,
            int direction,
            SizeT channel,
            SizeTByReference length);

    /* Device.h: clocking API */

    int SoapySDRDevice_setMasterClockRate(Pointer device, double rate);

    double SoapySDRDevice_getMasterClockRate(Pointer device);

    Pointer SoapySDRDevice_getMasterClockRates(
            Pointer device,
            SizeTByReference length);

    Pointer SoapySDRDevice_listClockSources(
            Pointer device,
            SizeTByReference length);

    int SoapySDRDevice_setClockSource(Pointer device, String source);

    Pointer SoapySDRDevice_getClockSource(Pointer device);

    /* Device.h: time API */

    Pointer SoapySDRDevice_listTimeSources(
            Pointer device,
            SizeTByReference length);

    int SoapySDRDevice_setTimeSource(Pointer device, String source);

    Pointer SoapySDRDevice_getTimeSource(Pointer device);

    byte SoapySDRDevice_hasHardwareTime(Pointer device, String what);

    long SoapySDRDevice_getHardwareTime(Pointer device, String what);

    int SoapySDRDevice_setHardwareTime(
            Pointer device,
            long timeNs,
            String what);

    /* Device.h: sensor API */

    Pointer SoapySDRDevice_listSensors(
            Pointer device,
            SizeTByReference length);

    SoapySDRArgInfo.ByValue SoapySDRDevice_getSensorInfo(
            Pointer device,
            String key);

    Pointer SoapySDRDevice_readSensor(Pointer device, String key);

    Pointer SoapySDRDevice_listChannelSensors(
            Pointer device,
            int direction,
            SizeT channel,
            SizeTByReference length);

    SoapySDRArgInfo.ByValue SoapySDRDevice_getChannelSensorInfo(
            Pointer device,
            int direction,
            SizeT channel,
            String key);

    Pointer SoapySDRDevice_readChannelSensor(
            Pointer device,
            int direction,
            SizeT channel,
            String key);

    /* Device.h: settings API */

    Pointer SoapySDRDevice_getSettingInfo(
            Pointer device,
            SizeTByReference length);

    int SoapySDRDevice_writeSetting(
            Pointer device,
            String key,
            String value);

    Pointer SoapySDRDevice_readSetting(Pointer device, String key);

    Pointer SoapySDRDevice_getChannelSettingInfo(
            Pointer device,
            int direction,
            SizeT channel,
            SizeTByReference length);

    int SoapySDRDevice_writeChannelSetting(
            Pointer device,
            int direction,
            SizeT channel,
            String key,
            String value);

    Pointer SoapySDRDevice_readChannelSetting(
            Pointer device,
            int direction,
            SizeT channel,
            String key);
}
