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

import java.util.function.IntConsumer;

import org.apache.dafsa.io.util.ByteSpan;

/**
 * DAFSA node types and the decoding of their byte representation. Nodes are never materialized: they are read
 * directly from the graph's bytes at a given position, which is all the state a lookup needs to keep.
 *
 * This class is effectively an enumeration of the two shapes a position in the graph can have, {@link #LABEL} and
 * {@link #BRANCH}; which of the two applies is decided by the byte that led to the position (see
 * {@link Label#isLastInLabel}), the root being a branch.
 */
public abstract class DafsaNode
{
    /*
    GRAPH FORMAT

    The graph is a sequence of nodes, each of which is a label optionally followed by a list of offsets to child nodes.
    The root is the offset list at position 0; an empty graph represents the empty set.

    Labels are runs of ASCII characters (0x20 to 0x7F) shared by all strings going through the node:
     - a character that is followed by another character or by a result byte is stored as is;
     - the last character of a label that is followed by an offset list is stored with the high bit set (c | 0x80);
     - a result byte, 0x80 | code with code between 0 and 15, ends a label without an offset list. It marks the
       sequence of characters leading to it as a member of the set with the given result code.
    Result bytes and end-of-label characters are told apart by their top three bits: 100xxxxx is a result, while
    characters start at 0x20 and thus have 101xxxxx or 11xxxxxx when marked as last. Result bytes with bit 0x10 set are
    reserved.

    An offset list holds one entry per child. Each entry is one, two or three bytes long:
     - s0xxxxxx                     six-bit distance
     - s10xxxxx xxxxxxxx            13-bit distance
     - s11xxxxx xxxxxxxx xxxxxxxx   21-bit distance
    where the s bit is set on the first byte of the last entry of the list. The first child is located at the start of
    the list plus the first distance, every following child at the previous child's position plus its distance. The
    entries are ordered by position, not by character, so a child lookup scans the list.

    A state that is both a member of the set and a prefix of longer members is a branch with a child whose label is a
    single result byte. Two children of the same branch can never start with the same byte.

    All distances are strictly positive, thus every transition moves forward in the buffer. This makes the graph acyclic
    by construction and bounds the number of transitions any lookup can take by the size of the graph.
    */

    /** Returned by {@link #resultCode} for states that are not accepting. */
    public static final int NOT_FOUND = -1;

    public static final int ROOT_POSITION = 0;

    public static final int MIN_CHARACTER = 0x20;
    public static final int MAX_CHARACTER = 0x7F;
    public static final int MAX_RESULT_CODE = 0x0F;

    static final int END_OF_LABEL = 0x80;
    static final int CHARACTER_MASK = 0x7F;
    static final int RESULT_TAG_MASK = 0xE0;
    static final int RESULT_TAG = 0x80;
    static final int RESULT_RESERVED_BIT = 0x10;

    static final int LAST_OFFSET = 0x80;
    static final int OFFSET_SIZE_MASK = 0x60;
    static final int OFFSET_16 = 0x40;
    static final int OFFSET_24 = 0x60;

    public static final Label LABEL = new Label();
    public static final Branch BRANCH = new Branch();

    DafsaNode()
    {
    }

    public abstract boolean isLabel();

    /**
     * Returns the result code of the state at the given position, or {@link #NOT_FOUND} if the state is not accepting.
     */
    public abstract int resultCode(ByteSpan graph, int position);

    public boolean isAccepting(ByteSpan graph, int position)
    {
        return resultCode(graph, position) != NOT_FOUND;
    }

    public static boolean isCharacter(int c)
    {
        return c >= MIN_CHARACTER && c <= MAX_CHARACTER;
    }

    static int read(ByteSpan graph, int position)
    {
        if (!graph.contains(position))
            throw new CorruptDafsaException(position, "read outside of the " + graph.length() + " bytes of the graph");
        return graph.get(position);
    }

    static boolean isResult(int b)
    {
        return (b & RESULT_TAG_MASK) == RESULT_TAG;
    }

    static int resultValue(int b, int position)
    {
        if ((b & RESULT_RESERVED_BIT) != 0)
            throw new CorruptDafsaException(position, String.format("reserved result byte %02x", b));
        return b & MAX_RESULT_CODE;
    }

    /**
     * A position inside a label: either a character, possibly the last one of the label, or a result byte.
     */
    public static final class Label extends DafsaNode
    {
        private Label()
        {
        }

        @Override
        public boolean isLabel()
        {
            return true;
        }

        /**
         * Returns the character at this position, or -1 if the label ends with a result byte here.
         */
        public int labelCharacter(ByteSpan graph, int position)
        {
            int b = read(graph, position);
            if (isResult(b))
                return -1;
            int c = b & CHARACTER_MASK;
            if (c < MIN_CHARACTER)
                throw new CorruptDafsaException(position, String.format("invalid label byte %02x", b));
            return c;
        }

        public boolean isLastInLabel(ByteSpan graph, int position)
        {
            int b = read(graph, position);
            return !isResult(b) && (b & END_OF_LABEL) != 0;
        }

        public boolean hasResultCode(ByteSpan graph, int position)
        {
            return isResult(read(graph, position));
        }

        @Override
        public int resultCode(ByteSpan graph, int position)
        {
            int b = read(graph, position);
            return isResult(b) ? resultValue(b, position) : NOT_FOUND;
        }

        /**
         * Returns the position of the offset list that follows the last character of a label, or -1 if the byte at
         * this position does not end the label with a continuation.
         */
        public int continuation(ByteSpan graph, int position)
        {
            if (!isLastInLabel(graph, position))
                return -1;
            return next(graph, position);
        }

        /**
         * Returns the position of the next byte of the label, or -1 if the label does not continue after this
         * position.
         */
        public int advanceWithinLabel(ByteSpan graph, int position)
        {
            int b = read(graph, position);
            if (isResult(b) || (b & END_OF_LABEL) != 0)
                return -1;
            return next(graph, position);
        }

        private static int next(ByteSpan graph, int position)
        {
            int next = position + 1;
            if (!graph.contains(next))
                throw new CorruptDafsaException(position, "label runs past the end of the graph");
            return next;
        }
    }

    /**
     * A position at the start of an offset list, i.e. a state with outgoing edges to one or more child labels.
     */
    public static final class Branch extends DafsaNode
    {
        private Branch()
        {
        }

        @Override
        public boolean isLabel()
        {
            return false;
        }

        /**
         * Returns the position of the child whose label starts with the given character, or -1 if no such child
         * exists.
         */
        public int findEdge(ByteSpan graph, int position, int character)
        {
            int entry = position;
            int child = position;
            while (true)
            {
                int b = read(graph, entry);
                child = child(graph, entry, b, child);
                int first = read(graph, child);
                if (!isResult(first) && (first & CHARACTER_MASK) == character)
                    return child;
                if ((b & LAST_OFFSET) != 0)
                    return -1;
                entry += entrySize(b);
            }
        }

        /**
         * Returns the result code of the branch state itself, carried by a child that consists of a single result
         * byte, or {@link #NOT_FOUND} if there is none.
         */
        @Override
        public int resultCode(ByteSpan graph, int position)
        {
            int entry = position;
            int child = position;
            while (true)
            {
                int b = read(graph, entry);
                child = child(graph, entry, b, child);
                int first = read(graph, child);
                if (isResult(first))
                    return resultValue(first, child);
                if ((b & LAST_OFFSET) != 0)
                    return NOT_FOUND;
                entry += entrySize(b);
            }
        }

        /**
         * Feeds the positions of all children of the branch, in the order of the offset list, to the consumer.
         */
        public void forEachChild(ByteSpan graph, int position, IntConsumer consumer)
        {
            int entry = position;
            int child = position;
            while (true)
            {
                int b = read(graph, entry);
                child = child(graph, entry, b, child);
                consumer.accept(child);
                if ((b & LAST_OFFSET) != 0)
                    return;
                entry += entrySize(b);
            }
        }

        private static int entrySize(int b)
        {
            switch (b & OFFSET_SIZE_MASK)
            {
                case OFFSET_24:
                    return 3;
                case OFFSET_16:
                    return 2;
                default:
                    return 1;
            }
        }

        private static int child(ByteSpan graph, int entry, int b, int previous)
        {
            int distance;
            switch (b & OFFSET_SIZE_MASK)
            {
                case OFFSET_24:
                    distance = ((b & 0x1F) << 16) | (read(graph, entry + 1) << 8) | read(graph, entry + 2);
                    break;
                case OFFSET_16:
                    distance = ((b & 0x1F) << 8) | read(graph, entry + 1);
                    break;
                default:
                    distance = b & 0x3F;
            }
            if (distance == 0)
                throw new CorruptDafsaException(entry, "zero child offset");

            long target = (long) previous + distance;
            if (target >= graph.length())
                throw new CorruptDafsaException(entry, "child offset " + target + " points past the end of the graph");
            return (int) target;
        }
    }
}
