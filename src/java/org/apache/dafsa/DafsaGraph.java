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
package org.apache.dafsa;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URL;
import java.nio.ByteBuffer;
import java.util.AbstractMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.io.ByteStreams;
import com.google.common.io.Resources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.apache.dafsa.io.tries.CorruptDafsaException;
import org.apache.dafsa.io.tries.DafsaEntriesIterator;
import org.apache.dafsa.io.tries.DafsaVerifier;
import org.apache.dafsa.io.util.ByteSpan;
import org.apache.dafsa.lookup.DafsaMatch;
import org.apache.dafsa.lookup.DafsaResult;
import org.apache.dafsa.lookup.FixedSetIncrementalLookup;
import org.apache.dafsa.lookup.FixedSetLookup;

/**
 * An immutable fixed set of strings, encoded as a DAFSA graph generated ahead of time.
 *
 * Graphs are safe for unsynchronized use by any number of threads: lookups never modify them, and each lookup keeps
 * its own state in a {@link FixedSetIncrementalLookup}.
 *
 * Unless the {@value #VERIFY_ON_LOAD_PROPERTY} system property is set to false, the factory methods verify the whole
 * graph before returning it, so that a malformed graph is rejected up front instead of failing in the middle of a
 * lookup.
 */
public final class DafsaGraph
{
    private static final Logger logger = LoggerFactory.getLogger(DafsaGraph.class);

    public static final String VERIFY_ON_LOAD_PROPERTY = "dafsa.verify_on_load";

    @VisibleForTesting
    static final boolean VERIFY_ON_LOAD = Boolean.parseBoolean(System.getProperty(VERIFY_ON_LOAD_PROPERTY, "true"));

    private final String name;
    private final ByteSpan bytes;

    private DafsaGraph(String name, ByteSpan bytes)
    {
        this.name = name;
        this.bytes = bytes;
    }

    /**
     * Creates a graph over a copy of the given bytes.
     */
    public static DafsaGraph wrap(String name, byte[] bytes)
    {
        Preconditions.checkNotNull(bytes);
        return create(name, ByteSpan.wrap(bytes.clone()), VERIFY_ON_LOAD);
    }

    /**
     * Creates a graph over the remaining bytes of the buffer, without copying them unless the buffer is a read-only
     * heap buffer. The content of the buffer must not change while the graph is in use.
     */
    public static DafsaGraph wrap(String name, ByteBuffer buffer)
    {
        return create(name, ByteSpan.wrap(buffer), VERIFY_ON_LOAD);
    }

    /**
     * Reads a graph from the stream, up to its end. The stream is not closed.
     */
    public static DafsaGraph read(String name, InputStream in) throws IOException
    {
        Preconditions.checkNotNull(in);
        return create(name, ByteSpan.wrap(ByteStreams.toByteArray(in)), VERIFY_ON_LOAD);
    }

    /**
     * Loads a graph from a class path resource.
     *
     * @throws IllegalArgumentException if the resource does not exist
     */
    public static DafsaGraph fromResource(String resourceName)
    {
        URL url = Resources.getResource(resourceName);
        try
        {
            return create(resourceName, ByteSpan.wrap(Resources.toByteArray(url)), VERIFY_ON_LOAD);
        }
        catch (IOException e)
        {
            throw new UncheckedIOException("Failed to read DAFSA resource " + resourceName, e);
        }
    }

    @VisibleForTesting
    static DafsaGraph create(String name, ByteSpan bytes, boolean verify)
    {
        Preconditions.checkNotNull(name);
        DafsaGraph graph = new DafsaGraph(name, bytes);
        if (verify)
        {
            int states = graph.verify();
            logger.debug("Loaded DAFSA {} ({} bytes, {} states)", name, bytes.length(), states);
        }
        else
        {
            logger.debug("Loaded DAFSA {} ({} bytes) without verification", name, bytes.length());
        }
        return graph;
    }

    /**
     * Checks the whole graph for format violations.
     *
     * @return the number of states of the graph
     * @throws CorruptDafsaException if the graph is malformed
     */
    public int verify()
    {
        try
        {
            return DafsaVerifier.verify(bytes);
        }
        catch (CorruptDafsaException e)
        {
            logger.warn("DAFSA {} failed verification: {}", name, e.getMessage());
            throw new CorruptDafsaException(name, e);
        }
    }

    public String name()
    {
        return name;
    }

    /**
     * The size of the graph in bytes.
     */
    public int size()
    {
        return bytes.length();
    }

    /**
     * Starts an incremental lookup at the root of the graph. Unlike the lookup methods of this class, the cursor
     * reports corruption without the name of the graph.
     */
    public FixedSetIncrementalLookup cursor()
    {
        return new FixedSetIncrementalLookup(bytes);
    }

    /**
     * @see FixedSetLookup#lookup
     */
    public DafsaResult lookup(CharSequence key)
    {
        try
        {
            return FixedSetLookup.lookup(bytes, key);
        }
        catch (CorruptDafsaException e)
        {
            throw new CorruptDafsaException(name, e);
        }
    }

    public boolean contains(CharSequence key)
    {
        return lookup(key).isFound();
    }

    /**
     * @see FixedSetLookup#lookupSuffix
     */
    public DafsaMatch lookupSuffix(boolean includePrivate, CharSequence host)
    {
        try
        {
            return FixedSetLookup.lookupSuffix(bytes, includePrivate, host);
        }
        catch (CorruptDafsaException e)
        {
            throw new CorruptDafsaException(name, e);
        }
    }

    /**
     * @see FixedSetLookup#prefixMatches
     */
    public List<DafsaMatch> prefixMatches(CharSequence input)
    {
        try
        {
            return FixedSetLookup.prefixMatches(bytes, input);
        }
        catch (CorruptDafsaException e)
        {
            throw new CorruptDafsaException(name, e);
        }
    }

    /**
     * @see FixedSetLookup#longestPrefix
     */
    public DafsaMatch longestPrefix(CharSequence input, Predicate<DafsaResult> filter)
    {
        try
        {
            return FixedSetLookup.longestPrefix(bytes, input, filter);
        }
        catch (CorruptDafsaException e)
        {
            throw new CorruptDafsaException(name, e);
        }
    }

    /**
     * Returns all strings of the set with their results, in lexicographic order. For graphs built over reversed
     * strings the entries are reversed as well.
     */
    public Iterator<Map.Entry<String, DafsaResult>> entries()
    {
        return new DafsaEntriesIterator<Map.Entry<String, DafsaResult>>(bytes)
        {
            @Override
            protected Map.Entry<String, DafsaResult> computeNext()
            {
                try
                {
                    return super.computeNext();
                }
                catch (CorruptDafsaException e)
                {
                    throw new CorruptDafsaException(name, e);
                }
            }

            @Override
            protected Map.Entry<String, DafsaResult> mapContent(int resultCode, CharSequence key)
            {
                return new AbstractMap.SimpleImmutableEntry<>(key.toString(), DafsaResult.of(resultCode));
            }
        };
    }

    /**
     * Lists the content of the graph, one "string -> result code" line per entry.
     */
    public String dump()
    {
        StringBuilder sb = new StringBuilder();
        Iterator<Map.Entry<String, DafsaResult>> it = entries();
        while (it.hasNext())
        {
            Map.Entry<String, DafsaResult> entry = it.next();
            sb.append(entry.getKey()).append(" -> ").append(entry.getValue().code()).append('\n');
        }
        return sb.toString();
    }

    @Override
    public String toString()
    {
        return "DafsaGraph(" + name + ", " + bytes.length() + " bytes)";
    }
}
