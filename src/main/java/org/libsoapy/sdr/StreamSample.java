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

import java.nio.*;
import java.util.*;

import com.sun.jna.*;

/**
 * Binds a host NIO buffer type to the SoapySDR {@link Format} of the samples
 * it holds. A stream is set up with a <tt>StreamSample</tt> and then only
 * accepts buffers of its type, so the layout the driver writes is always the
 * layout the host reads.
 * <p>
 * Complex formats store the in-phase and the quadrature component of a
 * sample next to each other; one element of such a format spans two
 * components of the buffer. Buffers passed to a stream must be direct and in
 * native byte order.
 * </p>
 *
 * @param <B> the NIO buffer type of the samples
 */
public final class StreamSample<B extends Buffer>
{
    public static final StreamSample<ByteBuffer> U8
        = new StreamSample<>(ByteBuffer.class, Format.U8, 1, 1);

    public static final StreamSample<ByteBuffer> S8
        = new StreamSample<>(ByteBuffer.class, Format.S8, 1, 1);

    public static final StreamSample<ByteBuffer> CU8
        = new StreamSample<>(ByteBuffer.class, Format.CU8, 1, 2);

    public static final StreamSample<ByteBuffer> CS8
        = new StreamSample<>(ByteBuffer.class, Format.CS8, 1, 2);

    public static final StreamSample<ShortBuffer> U16
        = new StreamSample<>(ShortBuffer.class, Format.U16, 2, 1);

    public static final StreamSample<ShortBuffer> S16
        = new StreamSample<>(ShortBuffer.class, Format.S16, 2, 1);

    public static final StreamSample<ShortBuffer> CU16
        = new StreamSample<>(ShortBuffer.class, Format.CU16, 2, 2);

    public static final StreamSample<ShortBuffer> CS16
        = new StreamSample<>(ShortBuffer.class, Format.CS16, 2, 2);

    public static final StreamSample<IntBuffer> U32
        = new StreamSample<>(IntBuffer.class, Format.U32, 4, 1);

    public static final StreamSample<IntBuffer> S32
        = new StreamSample<>(IntBuffer.class, Format.S32, 4, 1);

    public static final StreamSample<IntBuffer> CU32
        = new StreamSample<>(IntBuffer.class, Format.CU32, 4, 2);

    public static final StreamSample<IntBuffer> CS32
        = new StreamSample<>(IntBuffer.class, Format.CS32, 4, 2);

    public static final StreamSample<FloatBuffer> F32
        = new StreamSample<>(FloatBuffer.class, Format.F32, 4, 1);

    public static final StreamSample<FloatBuffer> CF32
        = new StreamSample<>(FloatBuffer.class, Format.CF32, 4, 2);

    public static final StreamSample<DoubleBuffer> F64
        = new StreamSample<>(DoubleBuffer.class, Format.F64, 8, 1);

    public static final StreamSample<DoubleBuffer> CF64
        = new StreamSample<>(DoubleBuffer.class, Format.CF64, 8, 2);

    private static final Map<Format, StreamSample<?>> REGISTRY;

    static
    {
        Map<Format, StreamSample<?>> registry = new EnumMap<>(Format.class);

        for (StreamSample<?> s
                : Arrays.asList(
                        U8, S8, CU8, CS8,
                        U16, S16, CU16, CS16,
                        U32, S32, CU32, CS32,
                        F32, CF32, F64, CF64))
        {
            registry.put(s.format, s);
        }
        REGISTRY = Collections.unmodifiableMap(registry);
    }

    /**
     * Gets the <tt>StreamSample</tt> registered for a specific format.
     *
     * @param format the format
     * @return the <tt>StreamSample</tt> registered for <tt>format</tt>
     * @throws IllegalArgumentException if no host buffer type is registered
     * for <tt>format</tt>, which is the case for the packed formats
     */
    public static StreamSample<?> forFormat(Format format)
    {
        StreamSample<?> sample = REGISTRY.get(format);

        if (sample == null)
        {
            throw new IllegalArgumentException(
                    "No buffer type is registered for format " + format);
        }
        return sample;
    }

    private final Class<B> bufferClass;

    private final Format format;

    private final int componentBytes;

    private final int components;

    private StreamSample(
            Class<B> bufferClass,
            Format format,
            int componentBytes,
            int components)
    {
        if (componentBytes * components != format.size())
        {
            throw new IllegalArgumentException(
                    bufferClass.getSimpleName() + " with " + components
                        + " component(s) of " + componentBytes
                        + " byte(s) does not hold " + format);
        }

        this.bufferClass = bufferClass;
        this.format = format;
        this.componentBytes = componentBytes;
        this.components = components;
    }

    public Class<B> getBufferClass()
    {
        return bufferClass;
    }

    public Format getFormat()
    {
        return format;
    }

    /**
     * Gets the number of bytes of one buffer component.
     *
     * @return the number of bytes of one buffer component
     */
    public int getComponentBytes()
    {
        return componentBytes;
    }

    /**
     * Gets the number of buffer components which make up one element.
     *
     * @return <tt>2</tt> for complex formats, <tt>1</tt> otherwise
     */
    public int getComponents()
    {
        return components;
    }

    /**
     * Allocates a direct buffer in native byte order with room for a specific
     * number of elements.
     *
     * @param elements the number of elements
     * @return a new direct buffer in native byte order
     */
    @SuppressWarnings("unchecked")
    public B allocate(int elements)
    {
        ByteBuffer bytes
            = ByteBuffer.allocateDirect(elements * format.size())
                .order(ByteOrder.nativeOrder());
        Buffer buffer;

        if (bufferClass == ByteBuffer.class)
            buffer = bytes;
        else if (bufferClass == ShortBuffer.class)
            buffer = bytes.asShortBuffer();
        else if (bufferClass == IntBuffer.class)
            buffer = bytes.asIntBuffer();
        else if (bufferClass == FloatBuffer.class)
            buffer = bytes.asFloatBuffer();
        else
            buffer = bytes.asDoubleBuffer();
        return (B) buffer;
    }

    /**
     * Gets the number of whole elements between the position and the limit of
     * a buffer.
     *
     * @param buffer the buffer
     * @return the number of whole elements remaining in <tt>buffer</tt>
     */
    public int elements(B buffer)
    {
        return buffer.remaining() / components;
    }

    /**
     * Checks that a buffer can be handed to the native library.
     *
     * @param buffer the buffer to check
     * @throws IllegalArgumentException if <tt>buffer</tt> is <tt>null</tt>,
     * not of the registered type, not direct or not in native byte order
     */
    public void validate(Buffer buffer)
    {
        if (buffer == null)
            throw new IllegalArgumentException("buffer is null");
        if (!bufferClass.isInstance(buffer))
        {
            throw new IllegalArgumentException(
                    format + " requires a " + bufferClass.getSimpleName()
                        + ", not a " + buffer.getClass().getSimpleName());
        }
        if (!buffer.isDirect())
            throw new IllegalArgumentException("buffer is not direct");
        if (order(buffer) != ByteOrder.nativeOrder())
        {
            throw new IllegalArgumentException(
                    "buffer is not in native byte order");
        }
    }

    /**
     * Gets the native address of the position of a direct buffer.
     *
     * @param buffer the direct buffer
     * @return the native address of the position of <tt>buffer</tt>
     */
    Pointer pointer(Buffer buffer)
    {
        return
            Native.getDirectBufferPointer(buffer)
                .share((long) buffer.position() * componentBytes);
    }

    /**
     * Advances the position of a buffer by a number of elements.
     *
     * @param buffer the buffer
     * @param elements the number of elements to skip
     */
    void advance(Buffer buffer, int elements)
    {
        buffer.position(buffer.position() + elements * components);
    }

    private static ByteOrder order(Buffer buffer)
    {
        if (buffer instanceof ByteBuffer)
            return ((ByteBuffer) buffer).order();
        if (buffer instanceof ShortBuffer)
            return ((ShortBuffer) buffer).order();
        if (buffer instanceof IntBuffer)
            return ((IntBuffer) buffer).order();
        if (buffer instanceof FloatBuffer)
            return ((FloatBuffer) buffer).order();
        if (buffer instanceof DoubleBuffer)
            return ((DoubleBuffer) buffer).order();
        return null;
    }

    @Override
    public String toString()
    {
        return format + "/" + bufferClass.getSimpleName();
    }
}
