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
package org.libsoapy.tools;

import java.io.*;
import java.nio.*;

/**
 * Reads and writes raw complex float samples in the interchange format of the
 * command-line tools: interleaved in-phase and quadrature components as
 * little-endian 32-bit floats, 8 bytes per sample, without a header.
 */
public final class IqFile
{
    /**
     * The number of bytes of one sample in a file.
     */
    public static final int BYTES_PER_SAMPLE = 8;

    /**
     * Reads as many whole samples as fit into a buffer of interleaved
     * components. A trailing partial sample at the end of the input is
     * dropped.
     *
     * @param in the input to read from
     * @param dst the buffer to put the components of the samples into
     * @return the number of samples read or <tt>-1</tt> if the input was at
     * its end
     * @throws IOException if reading from <tt>in</tt> fails
     */
    public static int read(InputStream in, FloatBuffer dst)
        throws IOException
    {
        int maxSamples = dst.remaining() / 2;
        byte[] bytes = new byte[maxSamples * BYTES_PER_SAMPLE];
        int length = 0;

        while (length < bytes.length)
        {
            int read = in.read(bytes, length, bytes.length - length);

            if (read < 0)
                break;
            length += read;
        }

        int samples = length / BYTES_PER_SAMPLE;

        if (samples == 0 && length < bytes.length)
            return -1;

        ByteBuffer le
            = ByteBuffer.wrap(bytes, 0, samples * BYTES_PER_SAMPLE)
                .order(ByteOrder.LITTLE_ENDIAN);

        for (int i = 0; i < samples * 2; i++)
            dst.put(le.getFloat());
        return samples;
    }

    /**
     * Writes the remaining samples of a buffer of interleaved components and
     * advances its position past them.
     *
     * @param out the output to write to
     * @param src the buffer which holds the components of the samples
     * @return the number of samples written
     * @throws IOException if writing to <tt>out</tt> fails
     */
    public static int write(OutputStream out, FloatBuffer src)
        throws IOException
    {
        int samples = src.remaining() / 2;
        ByteBuffer le
            = ByteBuffer.allocate(samples * BYTES_PER_SAMPLE)
                .order(ByteOrder.LITTLE_ENDIAN);

        for (int i = 0; i < samples * 2; i++)
            le.putFloat(src.get());
        out.write(le.array(), 0, le.position());
        return samples;
    }

    private IqFile()
    {
    }
}
