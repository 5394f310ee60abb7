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
package org.apache.dafsa.lookup;

import com.google.common.base.Preconditions;

import org.apache.dafsa.io.tries.DafsaNode;
import org.apache.dafsa.io.util.ByteSpan;

import static org.apache.dafsa.io.tries.DafsaNode.BRANCH;
import static org.apache.dafsa.io.tries.DafsaNode.LABEL;

/**
 * Incremental membership and prefix queries against a fixed set of strings encoded as a DAFSA graph.
 *
 * The lookup starts at the state of the empty sequence, and input characters are added one at a time with
 * {@link #advance}. After each addition {@link #resultForCurrentSequence} tells whether the sequence consumed so far
 * is in the set, which allows queries like "which prefixes of this input are in the set" in a single pass. Suffix
 * queries work the same way on graphs built over reversed strings, feeding the input from its end.
 *
 * The state of a lookup is a position in the graph and the shape of the node at that position, so lookups are cheap
 * to {@link #copy}; this is meant for callers that need to save a position and return to it, e.g. to probe for a
 * wildcard character. Instances are not thread-safe, but any number of them can share the same graph.
 *
 * Simple membership query:
 * <pre>
 *    FixedSetIncrementalLookup lookup = new FixedSetIncrementalLookup(graph);
 *    for (int i = 0; i &lt; input.length(); ++i)
 *        if (!lookup.advance(input.charAt(i)))
 *            return false;
 *    return lookup.resultForCurrentSequence() != DafsaNode.NOT_FOUND;
 * </pre>
 */
public final class FixedSetIncrementalLookup
{
    private final ByteSpan graph;

    /** Position of the current state in the graph, -1 once the graph is exhausted. */
    private int position;

    /** Whether the position is inside a label, or at the start of an offset list. */
    private DafsaNode node;

    public FixedSetIncrementalLookup(ByteSpan graph)
    {
        this.graph = Preconditions.checkNotNull(graph);
        this.position = graph.isEmpty() ? -1 : DafsaNode.ROOT_POSITION;
        this.node = BRANCH;
    }

    private FixedSetIncrementalLookup(FixedSetIncrementalLookup other)
    {
        this.graph = other.graph;
        this.position = other.position;
        this.node = other.node;
    }

    /**
     * Returns an independent lookup at the same state as this one.
     */
    public FixedSetIncrementalLookup copy()
    {
        return new FixedSetIncrementalLookup(this);
    }

    /**
     * Resets this lookup to the state of the given one, which must be over the same graph.
     */
    public void restore(FixedSetIncrementalLookup saved)
    {
        Preconditions.checkArgument(saved.graph == graph, "Cannot restore a lookup over a different graph");
        this.position = saved.position;
        this.node = saved.node;
    }

    /**
     * Adds a character to the input sequence. Any character can be given, but only ASCII characters in the range
     * 0x20-0x7F can ever match.
     *
     * @return true if the resulting sequence is in the set or is a prefix of a string in the set; false if the graph
     * is exhausted, in which case all further calls return false and the result stays {@link DafsaNode#NOT_FOUND}
     * @throws org.apache.dafsa.io.tries.CorruptDafsaException if the graph is malformed
     */
    public boolean advance(char c)
    {
        if (position < 0)
            return false;

        if (DafsaNode.isCharacter(c))
        {
            int at = node.isLabel() ? position : BRANCH.findEdge(graph, position, c);
            if (at >= 0 && LABEL.labelCharacter(graph, at) == c)
            {
                if (LABEL.isLastInLabel(graph, at))
                {
                    position = LABEL.continuation(graph, at);
                    node = BRANCH;
                }
                else
                {
                    position = LABEL.advanceWithinLabel(graph, at);
                    node = LABEL;
                }
                return true;
            }
        }

        position = -1;
        node = BRANCH;
        return false;
    }

    /**
     * Returns the result code for the sequence added so far, or {@link DafsaNode#NOT_FOUND} if it is not in the set.
     * This does not change the state of the lookup; the sequence can still be extended afterwards.
     *
     * For public-suffix graphs the codes are bitmasks of {@link DafsaRule} bits, see {@link DafsaResult}.
     */
    public int resultForCurrentSequence()
    {
        if (position < 0)
            return DafsaNode.NOT_FOUND;
        return node.resultCode(graph, position);
    }

    public boolean isExhausted()
    {
        return position < 0;
    }

    @Override
    public String toString()
    {
        if (position < 0)
            return "FixedSetIncrementalLookup(exhausted)";
        return "FixedSetIncrementalLookup(" + (node.isLabel() ? "label" : "branch") + " at " + position + ')';
    }
}
