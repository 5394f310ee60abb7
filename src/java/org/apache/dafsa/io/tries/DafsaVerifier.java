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

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;

import org.apache.dafsa.io.util.ByteSpan;

import static org.apache.dafsa.io.tries.DafsaNode.BRANCH;
import static org.apache.dafsa.io.tries.DafsaNode.LABEL;

/**
 * Eagerly checks every state reachable from the root of a graph against the format described in {@link DafsaNode}.
 *
 * Lookups detect corruption lazily, only on the bytes they touch. Verifying a graph once before it is put to use
 * guarantees that no lookup over it will throw {@link CorruptDafsaException}, as long as its bytes do not change.
 */
public final class DafsaVerifier
{
    private DafsaVerifier()
    {
    }

    /**
     * Verifies the graph, visiting each reachable state once.
     *
     * @return the number of distinct states visited
     * @throws CorruptDafsaException on the first violation found
     */
    public static int verify(ByteSpan graph)
    {
        if (graph.isEmpty())
            return 0;

        // a position can be reached both as a label character and as the start of an offset list
        BitSet labelsSeen = new BitSet(graph.length());
        BitSet branchesSeen = new BitSet(graph.length());
        Deque<Integer> labels = new ArrayDeque<>();
        Deque<Integer> branches = new ArrayDeque<>();
        branches.push(DafsaNode.ROOT_POSITION);
        branchesSeen.set(DafsaNode.ROOT_POSITION);
        int states = 0;

        while (!labels.isEmpty() || !branches.isEmpty())
        {
            ++states;
            if (!branches.isEmpty())
            {
                int position = branches.pop();
                verifyBranch(graph, position, labels, labelsSeen);
                continue;
            }

            int position = labels.pop();
            if (LABEL.hasResultCode(graph, position))
            {
                LABEL.resultCode(graph, position);
                continue;
            }

            LABEL.labelCharacter(graph, position);
            if (LABEL.isLastInLabel(graph, position))
            {
                int next = LABEL.continuation(graph, position);
                if (!branchesSeen.get(next))
                {
                    branchesSeen.set(next);
                    branches.push(next);
                }
            }
            else
            {
                int next = LABEL.advanceWithinLabel(graph, position);
                if (!labelsSeen.get(next))
                {
                    labelsSeen.set(next);
                    labels.push(next);
                }
            }
        }
        return states;
    }

    private static void verifyBranch(ByteSpan graph, int position, Deque<Integer> labels, BitSet labelsSeen)
    {
        // first label bytes of the children, with 0x80 standing for any result byte
        BitSet firstBytes = new BitSet(DafsaNode.MAX_CHARACTER + 2);
        BRANCH.forEachChild(graph, position, child ->
        {
            int c = LABEL.labelCharacter(graph, child);
            int key = c == -1 ? DafsaNode.MAX_CHARACTER + 1 : c;
            if (firstBytes.get(key))
                throw new CorruptDafsaException(position, c == -1
                                                          ? "more than one result code for the same state"
                                                          : String.format("more than one edge for character '%c'", (char) c));
            firstBytes.set(key);

            if (!labelsSeen.get(child))
            {
                labelsSeen.set(child);
                labels.push(child);
            }
        });
    }
}
