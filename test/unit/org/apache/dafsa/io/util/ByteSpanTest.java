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

import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ByteSpanTest
{
    @Test
    public void testWrapArray()
    {
        ByteSpan span = ByteSpan.wrap(new byte[]{ 1, (byte) 0xFF, 0x7F });
        assertEquals(3, span.length());
        assertFalse(span.isEmpty());
        assertEquals(1, span.get(0));
        assertEquals(0xFF, span.get(1));
        assertEquals(0x7F, span.get(2));
    }

    @Test
    public void testWrapEmpty()
    {
        assertSame(ByteSpan.EMPTY, ByteSpan.wrap(new byte[0]));
        assertSame(ByteSpan.EMPTY, ByteSpan.wrap(ByteBuffer.allocate(0)));
        assertTrue(ByteSpan.EMPTY.isEmpty());
        assertFalse(ByteSpan.EMPTY.contains(0));
    }

    @Test
    public void testWrapBufferUsesRemainingBytes()
    {
        ByteBuffer buffer = ByteBuffer.wrap(new byte[]{ 9, 8, 7, 6, 5 });
        buffer.position(1).limit(4);
        ByteSpan span = ByteSpan.wrap(buffer);
        assertArrayEquals(new byte[]{ 8, 7, 6 }, span.toByteArray());
        assertEquals(1, buffer.position());
        assertEquals(4, buffer.limit());
    }

    @Test
    public void testWrapReadOnlyAndDirectBuffers()
    {
        byte[] bytes = new byte[]{ 3, 4, 5 };
        assertArrayEquals(bytes, ByteSpan.wrap(ByteBuffer.wrap(bytes).asReadOnlyBuffer()).toByteArray());

        ByteBuffer direct = ByteBuffer.allocateDirect(3);
        direct.put(bytes).flip();
        assertArrayEquals(bytes, ByteSpan.wrap(direct).toByteArray());
    }

    @Test
    public void testBoundsChecked()
    {
        ByteSpan span = ByteSpan.wrap(new byte[]{ 1, 2 });
        assertTrue(span.contains(1));
        assertFalse(span.contains(2));
        assertFalse(span.contains(-1));
        for (int position : new int[]{ -1, 2, Integer.MAX_VALUE })
        {
            try
            {
                span.get(position);
                fail("Read at " + position + " should have failed");
            }
            catch (IndexOutOfBoundsException e)
            {
                // expected
            }
        }
    }
}
