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
package org.apache.dafsa.io.tries;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import org.apache.dafsa.io.util.ByteSpan;

import static java.util.Arrays.asList;
import static org.apache.dafsa.io.tries.DafsaNode.BRANCH;
import static org.apache.dafsa.io.tries.DafsaNode.LABEL;
import static org.apache.dafsa.io.tries.DafsaNode.NOT_FOUND;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class DafsaNodeTest
{
    /**
     * {"a" -> 2, "aa" -> 1, "aaa" -> 3, "aaaa" -> 4, "aab" -> 5}
     */
    static final byte[] GRAPH = bytes(0x81, 0xe1, 0x02, 0x81, 0x82, 0xe1, 0x03, 0x02, 0x86,
                                      0x62, 0x85, 0xe1, 0x02, 0x82, 0x61, 0x84, 0x83, 0x81);

    static byte[] bytes(int... values)
    {
        byte[] bytes = new byte[values.length];
        for (int i = 0; i < values.length; ++i)
            bytes[i] = (byte) values[i];
        return bytes;
    }

    private final ByteSpan graph = ByteSpan.wrap(GRAPH);

    @Test
    public void testRoot()
    {
        assertFalse(BRANCH.isLabel());
        assertEquals(1, BRANCH.findEdge(graph, DafsaNode.ROOT_POSITION, 'a'));
        assertEquals(-1, BRANCH.findEdge(graph, DafsaNode.ROOT_POSITION, 'b'));
        assertEquals(NOT_FOUND, BRANCH.resultCode(graph, DafsaNode.ROOT_POSITION));
        assertFalse(BRANCH.isAccepting(graph, DafsaNode.ROOT_POSITION));
    }

    @Test
    public void testLabelCharacters()
    {
        assertTrue(LABEL.isLabel());
        assertEquals('a', LABEL.labelCharacter(graph, 1));
        assertTrue(LABEL.isLastInLabel(graph, 1));
        assertFalse(LABEL.hasResultCode(graph, 1));
        assertEquals(NOT_FOUND, LABEL.resultCode(graph, 1));
        assertEquals(2, LABEL.continuation(graph, 1));
        assertEquals(-1, LABEL.advanceWithinLabel(graph, 1));

        // "aab": 'b' is followed by a result byte within the same label
        assertEquals('b', LABEL.labelCharacter(graph, 9));
        assertFalse(LABEL.isLastInLabel(graph, 9));
        assertEquals(-1, LABEL.continuation(graph, 9));
        assertEquals(10, LABEL.advanceWithinLabel(graph, 9));
    }

    @Test
    public void testResultBytes()
    {
        assertTrue(LABEL.hasResultCode(graph, 10));
        assertEquals(5, LABEL.resultCode(graph, 10));
        assertTrue(LABEL.isAccepting(graph, 10));
        assertEquals(-1, LABEL.labelCharacter(graph, 10));
        assertFalse(LABEL.isLastInLabel(graph, 10));
        assertEquals(-1, LABEL.continuation(graph, 10));
        assertEquals(-1, LABEL.advanceWithinLabel(graph, 10));
    }

    @Test
    public void testAcceptingBranch()
    {
        // after "a": a result child (code 2) and an 'a' child
        assertEquals(2, BRANCH.resultCode(graph, 2));
        assertEquals(5, BRANCH.findEdge(graph, 2, 'a'));
        assertEquals(-1, BRANCH.findEdge(graph, 2, 'b'));

        // after "aa": 'b', 'a' and a result child (code 1), the last one being reached through three offsets
        assertEquals(1, BRANCH.resultCode(graph, 6));
        assertEquals(9, BRANCH.findEdge(graph, 6, 'b'));
        assertEquals(11, BRANCH.findEdge(graph, 6, 'a'));

        List<Integer> children = new ArrayList<>();
        BRANCH.forEachChild(graph, 6, children::add);
        assertEquals(asList(9, 11, 17), children);
    }

    @Test
    public void testMultiByteOffsets()
    {
        // two-byte offset: distance 0x042 to a result byte
        byte[] twoBytes = new byte[0x43];
        twoBytes[0] = (byte) 0xC0;
        twoBytes[1] = 0x42;
        twoBytes[0x42] = (byte) 0x83;
        assertEquals(3, BRANCH.resultCode(ByteSpan.wrap(twoBytes), 0));

        // three-byte offset: distance 0x002001, then a one-byte offset to a label
        byte[] threeBytes = new byte[0x2004];
        threeBytes[0] = 0x60;
        threeBytes[1] = 0x20;
        threeBytes[2] = 0x01;
        threeBytes[3] = (byte) 0x82;
        threeBytes[0x2001] = (byte) 0x81;
        threeBytes[0x2003] = (byte) 0xFA;
        ByteSpan span = ByteSpan.wrap(threeBytes);
        assertEquals(1, BRANCH.resultCode(span, 0));
        assertEquals(0x2003, BRANCH.findEdge(span, 0, 'z'));
    }

    @Test
    public void testOffsetOutsideGraph()
    {
        assertCorrupt(() -> BRANCH.findEdge(ByteSpan.wrap(bytes(0x85, 0xe1)), 0, 'a'));
        assertCorrupt(() -> BRANCH.resultCode(ByteSpan.wrap(bytes(0x02, 0x85, 0xe1)), 0));
    }

    @Test
    public void testZeroOffset()
    {
        assertCorrupt(() -> BRANCH.findEdge(ByteSpan.wrap(bytes(0x80, 0xe1)), 0, 'a'));
    }

    @Test
    public void testTruncatedGraph()
    {
        // offset list running off the graph
        assertCorrupt(() -> BRANCH.findEdge(ByteSpan.wrap(bytes(0x02, 0x02, 0xe1)), 0, 'b'));
        // two-byte offset cut short
        assertCorrupt(() -> BRANCH.resultCode(ByteSpan.wrap(bytes(0xC0)), 0));
        // label that neither ends nor continues
        assertCorrupt(() -> LABEL.advanceWithinLabel(ByteSpan.wrap(bytes(0x81, 0x61)), 1));
        // end of label without an offset list
        assertCorrupt(() -> LABEL.continuation(ByteSpan.wrap(bytes(0x81, 0xe1)), 1));
    }

    @Test
    public void testInvalidBytes()
    {
        assertCorrupt(() -> LABEL.labelCharacter(ByteSpan.wrap(bytes(0x81, 0x05)), 1));
        assertCorrupt(() -> LABEL.resultCode(ByteSpan.wrap(bytes(0x81, 0x93)), 1));
    }

    @Test
    public void testIsCharacter()
    {
        assertFalse(DafsaNode.isCharacter(0x1F));
        assertTrue(DafsaNode.isCharacter(' '));
        assertTrue(DafsaNode.isCharacter('~'));
        assertTrue(DafsaNode.isCharacter(0x7F));
        assertFalse(DafsaNode.isCharacter(0x80));
        assertFalse(DafsaNode.isCharacter('é'));
    }

    static void assertCorrupt(Runnable decode)
    {
        try
        {
            decode.run();
            fail("Expected the graph to be detected as corrupt");
        }
        catch (CorruptDafsaException e)
        {
            // expected
        }
    }
}
