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

/**
 * Flags carried by the result code of a matched string in public-suffix style graphs.
 */
public enum DafsaRule
{
    /** The string is excluded from the set by an exception rule. */
    EXCEPTION(1),
    /** The string matched a wildcard rule. */
    WILDCARD(2),
    /** The string matched a private rule. */
    PRIVATE(4);

    public final int bit;

    DafsaRule(int bit)
    {
        this.bit = bit;
    }
}
