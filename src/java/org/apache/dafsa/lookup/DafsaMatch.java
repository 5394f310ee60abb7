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

import java.util.Objects;

/**
 * A matched prefix or suffix of a lookup input: its result and its length in characters.
 */
public final class DafsaMatch
{
    public static final DafsaMatch NONE = new DafsaMatch(DafsaResult.NOT_FOUND, 0);

    public final DafsaResult result;
    public final int length;

    public DafsaMatch(DafsaResult result, int length)
    {
        this.result = result;
        this.length = length;
    }

    public boolean isFound()
    {
        return result.isFound();
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
            return true;
        if (!(o instanceof DafsaMatch))
            return false;
        DafsaMatch that = (DafsaMatch) o;
        return length == that.length && result == that.result;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(result.code(), length);
    }

    @Override
    public String toString()
    {
        return result + "/" + length;
    }
}
