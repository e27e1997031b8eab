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
package org.ucdtrie.tools.ucd;

import java.util.Arrays;

import com.google.common.base.Preconditions;

/**
 * One mapping of CaseFolding.txt.
 */
public final class CaseFoldingEntry
{
    public static final int MAX_MAPPING = 3;

    public enum Status
    {
        /** Common to simple and full folding. */
        C,
        /** Full folding, expanding to several codepoints. */
        F,
        /** Simple folding, where it differs from the full one. */
        S,
        /** Turkic languages only. */
        T;

        public boolean isFull()
        {
            return this == C || this == F;
        }
    }

    private final int codepoint;
    private final Status status;
    private final int[] mapping;

    public CaseFoldingEntry(int codepoint, Status status, int... mapping)
    {
        Preconditions.checkArgument(mapping.length >= 1 && mapping.length <= MAX_MAPPING, "Mapping length out of range: %s", mapping.length);
        this.codepoint = codepoint;
        this.status = Preconditions.checkNotNull(status);
        this.mapping = mapping.clone();
    }

    public int codepoint()
    {
        return codepoint;
    }

    public Status status()
    {
        return status;
    }

    public int[] mapping()
    {
        return mapping.clone();
    }

    public int mappingLength()
    {
        return mapping.length;
    }

    public int mapping(int i)
    {
        return mapping[i];
    }

    @Override
    public boolean equals(Object o)
    {
        if (!(o instanceof CaseFoldingEntry))
            return false;

        CaseFoldingEntry that = (CaseFoldingEntry) o;
        return codepoint == that.codepoint && status == that.status && Arrays.equals(mapping, that.mapping);
    }

    @Override
    public int hashCode()
    {
        return 31 * (31 * codepoint + status.hashCode()) + Arrays.hashCode(mapping);
    }

    @Override
    public String toString()
    {
        StringBuilder sb = new StringBuilder(String.format("%04X; %s;", codepoint, status));
        for (int cv : mapping)
            sb.append(String.format(" %04X", cv));
        return sb.toString();
    }
}
