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

import java.util.EnumSet;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.Sets;

import org.apache.dafsa.io.tries.DafsaNode;

/**
 * The outcome of a lookup: either {@link #NOT_FOUND}, or the result code the graph attaches to the matched string
 * together with the {@link DafsaRule} flags it encodes.
 *
 * Instances are interned, there is exactly one per possible code.
 */
public final class DafsaResult
{
    public static final DafsaResult NOT_FOUND = new DafsaResult(DafsaNode.NOT_FOUND);

    private static final DafsaResult[] FOUND = new DafsaResult[DafsaNode.MAX_RESULT_CODE + 1];
    static
    {
        for (int i = 0; i < FOUND.length; ++i)
            FOUND[i] = new DafsaResult(i);
    }

    /** Plain membership, no flags. */
    public static final DafsaResult FOUND_PLAIN = FOUND[0];

    private final int code;
    private final Set<DafsaRule> rules;

    private DafsaResult(int code)
    {
        this.code = code;
        EnumSet<DafsaRule> rules = EnumSet.noneOf(DafsaRule.class);
        if (code > 0)
        {
            for (DafsaRule rule : DafsaRule.values())
                if ((code & rule.bit) != 0)
                    rules.add(rule);
        }
        this.rules = Sets.immutableEnumSet(rules);
    }

    /**
     * Returns the result for a code as produced by {@link FixedSetIncrementalLookup#resultForCurrentSequence()}.
     */
    public static DafsaResult of(int code)
    {
        if (code == DafsaNode.NOT_FOUND)
            return NOT_FOUND;
        Preconditions.checkArgument(code >= 0 && code <= DafsaNode.MAX_RESULT_CODE, "Invalid result code %s", code);
        return FOUND[code];
    }

    /**
     * Returns the result carrying exactly the given flags.
     */
    public static DafsaResult of(Set<DafsaRule> rules)
    {
        int code = 0;
        for (DafsaRule rule : rules)
            code |= rule.bit;
        return FOUND[code];
    }

    public boolean isFound()
    {
        return code != DafsaNode.NOT_FOUND;
    }

    /**
     * The raw result code, -1 for {@link #NOT_FOUND}.
     */
    public int code()
    {
        return code;
    }

    public Set<DafsaRule> rules()
    {
        return rules;
    }

    public boolean is(DafsaRule rule)
    {
        return rules.contains(rule);
    }

    @Override
    public String toString()
    {
        if (!isFound())
            return "NOT_FOUND";
        return rules.isEmpty() ? "FOUND(" + code + ")" : "FOUND(" + code + ", " + rules + ")";
    }
}
