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
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import com.google.common.collect.AbstractIterator;

import org.apache.dafsa.io.util.ByteSpan;

import static org.apache.dafsa.io.tries.DafsaNode.BRANCH;
import static org.apache.dafsa.io.tries.DafsaNode.LABEL;

/**
 * Convertor of the strings in a graph to an iterator where each string and its result code are passed through
 * {@link #mapContent} (to be implemented by descendants).
 *
 * Strings are produced in lexicographic order. Graphs share suffixes between strings, so the number of entries can be
 * much larger than the size of the graph.
 */
public abstract class DafsaEntriesIterator<V> extends AbstractIterator<V>
{
    private final ByteSpan graph;
    private final Deque<Frame> stack = new ArrayDeque<>();
    private final StringBuilder key = new StringBuilder();

    protected DafsaEntriesIterator(ByteSpan graph)
    {
        this.graph = graph;
        if (!graph.isEmpty())
            stack.push(new Frame(DafsaNode.ROOT_POSITION, false, 0));
    }

    @Override
    protected V computeNext()
    {
        while (!stack.isEmpty())
        {
            Frame frame = stack.pop();
            key.setLength(frame.depth);
            if (frame.inLabel)
            {
                int c = LABEL.labelCharacter(graph, frame.position);
                if (c == -1)
                    return mapContent(LABEL.resultCode(graph, frame.position), key);

                key.append((char) c);
                if (LABEL.isLastInLabel(graph, frame.position))
                    stack.push(new Frame(LABEL.continuation(graph, frame.position), false, frame.depth + 1));
                else
                    stack.push(new Frame(LABEL.advanceWithinLabel(graph, frame.position), true, frame.depth + 1));
            }
            else
            {
                List<Integer> children = new ArrayList<>();
                BRANCH.forEachChild(graph, frame.position, children::add);
                // result bytes sort before characters, which puts a string before its extensions
                children.sort((a, b) -> Integer.compare(graph.get(a) & DafsaNode.CHARACTER_MASK,
                                                        graph.get(b) & DafsaNode.CHARACTER_MASK));
                for (int i = children.size() - 1; i >= 0; --i)
                    stack.push(new Frame(children.get(i), true, frame.depth));
            }
        }
        return endOfData();
    }

    protected abstract V mapContent(int resultCode, CharSequence key);

    private static class Frame
    {
        final int position;
        final boolean inLabel;
        final int depth;

        Frame(int position, boolean inLabel, int depth)
        {
            this.position = position;
            this.inLabel = inLabel;
            this.depth = depth;
        }
    }
}
