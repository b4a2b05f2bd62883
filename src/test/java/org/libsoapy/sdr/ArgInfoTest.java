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

import java.util.*;

import com.sun.jna.*;
import org.junit.*;
import org.libsoapy.soapysdr.*;

import static org.easymock.EasyMock.*;
import static org.junit.Assert.*;

public class ArgInfoTest
{
    private static Memory string(String s)
    {
        Memory m = new Memory(s.length() * 4L + 1);

        m.setString(0, s, "UTF-8");
        return m;
    }

    private final List<Object> keepAlive = new ArrayList<>();

    private void fill(
            SoapySDRArgInfo info,
            String key,
            String value,
            int type,
            String[] options,
            String[] optionNames)
    {
        info.key = (key == null) ? null : string(key);
        info.value = (value == null) ? null : string(value);
        info.name = string("Gain");
        info.description = null;
        info.units = string("dB");
        info.type = type;
        info.range.minimum = 0;
        info.range.maximum = 70;
        info.range.step = 1;
        info.numOptions = new SizeT(options.length);
        if (options.length != 0)
        {
            info.options = new StringArray(options, "UTF-8");
            info.optionNames = new StringArray(optionNames, "UTF-8");
        }
        keepAlive.add(info.key);
        keepAlive.add(info.value);
        keepAlive.add(info.name);
        keepAlive.add(info.units);
        keepAlive.add(info.options);
        keepAlive.add(info.optionNames);
    }

    @Test
    public void fromNative()
    {
        SoapySDRArgInfo info = new SoapySDRArgInfo();

        fill(
                info,
                "gain",
                "10",
                SoapySDR.SOAPY_SDR_ARG_INFO_FLOAT,
                new String[] { "0", "10" },
                new String[] { "Off", null });

        ArgInfo argInfo = ArgInfo.fromNative(info);

        assertEquals("gain", argInfo.getKey());
        assertEquals("10", argInfo.getValue());
        assertEquals("Gain", argInfo.getName());
        assertNull(argInfo.getDescription());
        assertEquals("dB", argInfo.getUnits());
        assertEquals(ArgType.FLOAT, argInfo.getDataType());
        assertEquals(new Range(0, 70, 1), argInfo.getRange());
        assertEquals(
                Arrays.asList(
                        new ArgInfo.Option("0", "Off"),
                        new ArgInfo.Option("10", null)),
                argInfo.getOptions());
    }

    @Test
    public void unknownTypeIsUnrecognized()
    {
        SoapySDRArgInfo info = new SoapySDRArgInfo();

        fill(info, "mode", "auto", 42, new String[0], new String[0]);
        assertEquals(
                ArgType.UNRECOGNIZED,
                ArgInfo.fromNative(info).getDataType());
        assertTrue(ArgInfo.fromNative(info).getOptions().isEmpty());
    }

    @Test(expected = IllegalStateException.class)
    public void missingKeyFailsFast()
    {
        SoapySDRArgInfo info = new SoapySDRArgInfo();

        fill(info, null, "1", 0, new String[0], new String[0]);
        ArgInfo.fromNative(info);
    }

    @Test
    public void emptyListIsFreedOnce()
    {
        SoapySDRLibrary lib = createMock(SoapySDRLibrary.class);

        lib.SoapySDRArgInfoList_clear(null, new SizeT(0));
        expectLastCall().once();
        replay(lib);

        assertTrue(NativeResults.argInfoList(lib, null, 0).isEmpty());
        verify(lib);
    }

    @Test
    public void listIsCopiedThenFreedOnce()
    {
        SoapySDRArgInfo[] infos
            = (SoapySDRArgInfo[]) new SoapySDRArgInfo().toArray(2);

        fill(
                infos[0],
                "bias",
                "false",
                SoapySDR.SOAPY_SDR_ARG_INFO_BOOL,
                new String[0],
                new String[0]);
        fill(
                infos[1],
                "mode",
                "a",
                SoapySDR.SOAPY_SDR_ARG_INFO_STRING,
                new String[] { "a", "b" },
                new String[] { "A", "B" });
        for (SoapySDRArgInfo info : infos)
            info.write();

        Pointer p = infos[0].getPointer();
        SoapySDRLibrary lib = createMock(SoapySDRLibrary.class);

        lib.SoapySDRArgInfoList_clear(p, new SizeT(2));
        expectLastCall().once();
        replay(lib);

        List<ArgInfo> list = NativeResults.argInfoList(lib, p, 2);

        assertEquals(2, list.size());
        assertEquals("bias", list.get(0).getKey());
        assertEquals(ArgType.BOOL, list.get(0).getDataType());
        assertEquals("mode", list.get(1).getKey());
        assertEquals("B", list.get(1).getOptions().get(1).getName());
        verify(lib);
    }

    @Test
    public void malformedListIsStillFreedOnce()
    {
        SoapySDRArgInfo[] infos
            = (SoapySDRArgInfo[]) new SoapySDRArgInfo().toArray(1);

        fill(infos[0], "key", null, 0, new String[0], new String[0]);
        infos[0].write();

        Pointer p = infos[0].getPointer();
        SoapySDRLibrary lib = createMock(SoapySDRLibrary.class);

        lib.SoapySDRArgInfoList_clear(p, new SizeT(1));
        expectLastCall().once();
        replay(lib);

        try
        {
            NativeResults.argInfoList(lib, p, 1);
            fail("expected IllegalStateException");
        }
        catch (IllegalStateException ise)
        {
            // Expected.
        }
        verify(lib);
    }
}
