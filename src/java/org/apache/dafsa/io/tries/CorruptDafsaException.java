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

/**
 * Signals that a DAFSA graph does not follow the encoding described in {@link DafsaNode}, e.g. an offset points
 * outside of the buffer or a label runs past its end.
 *
 * This is never a result of the query input: it means the graph and the decoder disagree on the format, and the graph
 * must be treated as invalid as a whole.
 */
public class CorruptDafsaException extends RuntimeException
{
    /** Name of the graph, null when the error was raised below the level of a named graph. */
    public final String graphName;
    public final int position;
    private final String detail;

    public CorruptDafsaException(int position, String message)
    {
        super(String.format("Corrupt DAFSA at position %d: %s", position, message));
        this.graphName = null;
        this.position = position;
        this.detail = message;
    }

    /**
     * Attaches the name of the graph to an error raised by the decoder.
     */
    public CorruptDafsaException(String graphName, CorruptDafsaException cause)
    {
        super(String.format("Corrupt DAFSA %s at position %d: %s", graphName, cause.position, cause.detail), cause);
        this.graphName = graphName;
        this.position = cause.position;
        this.detail = cause.detail;
    }
}
