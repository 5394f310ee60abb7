/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.dafsa.io.util;

import java.nio.ByteBuffer;

import com.google.common.base.Preconditions;

import org.agrona.DirectBuffer;
import org.agrona.concurrent.UnsafeBuffer;

/**
 * Immutable, bounds-checked read view over a sequence of bytes.
 *
 * The span never owns or modifies the memory it is built on; callers that hand over a byte array or buffer must not
 * mutate it afterwards. Positions are always relative to the start of the span and every read is checked against its
 * length, so a view over a malformed graph can never read outside of the bytes it was given.
 */
public final class ByteSpan
{
    public static final ByteSpan EMPTY = new ByteSpan(new UnsafeBuffer(new byte[0]));

    private final DirectBuffer buffer;

    private ByteSpan(DirectBuffer buffer)
    {
        this.buffer = buffer;
    }

    public static ByteSpan wrap(byte[] bytes)
    {
        Preconditions.checkNotNull(bytes);
        return bytes.length == 0 ? EMPTY : new ByteSpan(new UnsafeBuffer(bytes));
    }

    /**
     * Wraps the remaining bytes of the given buffer, i.e. the ones between its position and limit. The buffer's own
     * position and limit are not modified.
     */
    public static ByteSpan wrap(ByteBuffer buffer)
    {
        Preconditions.checkNotNull(buffer);
        if (!buffer.hasRemaining())
            return EMPTY;

        // Read-only heap buffers do not expose their array, copy them
        if (!buffer.isDirect() && !buffer.hasArray())
        {
            byte[] copy = new byte[buffer.remaining()];
            buffer.duplicate().get(copy);
            return new ByteSpan(new UnsafeBuffer(copy));
        }
        return new ByteSpan(new UnsafeBuffer(buffer, buffer.position(), buffer.remaining()));
    }

    public int length()
    {
        return buffer.capacity();
    }

    public boolean isEmpty()
    {
        return buffer.capacity() == 0;
    }

    public boolean contains(int position)
    {
        return position >= 0 && position < buffer.capacity();
    }

    /**
     * Returns the unsigned value of the byte at the given position.
     *
     * @throws IndexOutOfBoundsException if the position is outside of the span
     */
    public int get(int position)
    {
        Preconditions.checkElementIndex(position, buffer.capacity());
        return buffer.getByte(position) & 0xFF;
    }

    public byte[] toByteArray()
    {
        byte[] copy = new byte[buffer.capacity()];
        buffer.getBytes(0, copy);
        return copy;
    }

    @Override
    public String toString()
    {
        return "ByteSpan(" + length() + " bytes)";
    }
}
