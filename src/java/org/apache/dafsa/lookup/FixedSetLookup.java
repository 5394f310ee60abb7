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

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

import com.google.common.base.Preconditions;

import org.apache.dafsa.io.tries.DafsaNode;
import org.apache.dafsa.io.util.ByteSpan;

/**
 * Whole-string, prefix and reversed-suffix lookups, all driven by a {@link FixedSetIncrementalLookup}.
 */
public final class FixedSetLookup
{
    /** Separates the components of a key, e.g. the labels of a host name. */
    public static final char COMPONENT_SEPARATOR = '.';

    private FixedSetLookup()
    {
    }

    /**
     * Looks up the whole key in the set.
     *
     * @return {@link DafsaResult#NOT_FOUND}, or the result attached to the key in the graph
     */
    public static DafsaResult lookup(ByteSpan graph, CharSequence key)
    {
        Preconditions.checkNotNull(key);
        FixedSetIncrementalLookup lookup = new FixedSetIncrementalLookup(graph);
        for (int i = 0; i < key.length(); ++i)
        {
            if (!lookup.advance(key.charAt(i)))
                return DafsaResult.NOT_FOUND;
        }
        return DafsaResult.of(lookup.resultForCurrentSequence());
    }

    /**
     * Looks up the longest suffix of the host in a graph built over reversed strings.
     *
     * A suffix only matches if it starts at a new component, i.e. it is the whole host or it is preceded by
     * {@link #COMPONENT_SEPARATOR}. When {@code includePrivate} is false, strings whose result carries
     * {@link DafsaRule#PRIVATE} are skipped and the longest remaining match is returned.
     *
     * @return the result and length of the longest matching suffix, {@link DafsaMatch#NONE} if there is none
     */
    public static DafsaMatch lookupSuffix(ByteSpan graph, boolean includePrivate, CharSequence host)
    {
        Preconditions.checkNotNull(host);
        FixedSetIncrementalLookup lookup = new FixedSetIncrementalLookup(graph);
        DafsaMatch best = DafsaMatch.NONE;
        for (int i = host.length() - 1; i >= 0 && lookup.advance(host.charAt(i)); --i)
        {
            int code = lookup.resultForCurrentSequence();
            if (code == DafsaNode.NOT_FOUND || (!includePrivate && (code & DafsaRule.PRIVATE.bit) != 0))
                continue;

            if (i == 0 || host.charAt(i - 1) == COMPONENT_SEPARATOR)
                best = new DafsaMatch(DafsaResult.of(code), host.length() - i);
        }
        return best;
    }

    /**
     * Lists all prefixes of the input that are in the set, shortest first.
     */
    public static List<DafsaMatch> prefixMatches(ByteSpan graph, CharSequence input)
    {
        Preconditions.checkNotNull(input);
        List<DafsaMatch> matches = new ArrayList<>();
        FixedSetIncrementalLookup lookup = new FixedSetIncrementalLookup(graph);
        addIfFound(matches, lookup, 0);
        for (int i = 0; i < input.length() && lookup.advance(input.charAt(i)); ++i)
            addIfFound(matches, lookup, i + 1);
        return matches;
    }

    /**
     * Returns the longest prefix of the input that is in the set with a result accepted by the filter.
     *
     * @return the match, {@link DafsaMatch#NONE} if no prefix qualifies
     */
    public static DafsaMatch longestPrefix(ByteSpan graph, CharSequence input, Predicate<DafsaResult> filter)
    {
        Preconditions.checkNotNull(input);
        DafsaMatch best = DafsaMatch.NONE;
        FixedSetIncrementalLookup lookup = new FixedSetIncrementalLookup(graph);
        for (int i = 0; i <= input.length(); ++i)
        {
            if (i > 0 && !lookup.advance(input.charAt(i - 1)))
                break;
            DafsaResult result = DafsaResult.of(lookup.resultForCurrentSequence());
            if (result.isFound() && filter.test(result))
                best = new DafsaMatch(result, i);
        }
        return best;
    }

    private static void addIfFound(List<DafsaMatch> matches, FixedSetIncrementalLookup lookup, int length)
    {
        int code = lookup.resultForCurrentSequence();
        if (code != DafsaNode.NOT_FOUND)
            matches.add(new DafsaMatch(DafsaResult.of(code), length));
    }
}
