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
package org.ucdtrie.db;

import java.util.Arrays;

import com.google.common.base.Preconditions;

/**
 * Result of full case folding a single codepoint: one to four codepoints.
 *
 * A folding is trivial when it maps the codepoint to itself, which is the case for most codepoints.
 */
public final class CaseFolding
{
    public static final int MAX_LENGTH = 4;

    private final int[] codepoints;
    private final boolean trivial;

    private CaseFolding(int[] codepoints, boolean trivial)
    {
        this.codepoints = codepoints;
        this.trivial = trivial;
    }

    /**
     * The identity mapping of {@code codepoint}.
     */
    public static CaseFolding identity(int codepoint)
    {
        return new CaseFolding(new int[]{ codepoint }, true);
    }

    /**
     * The folding of {@code source} into {@code folded}; trivial iff it is the single codepoint {@code source}.
     */
    public static CaseFolding of(int source, int... folded)
    {
        Preconditions.checkArgument(folded.length >= 1 && folded.length <= MAX_LENGTH, "Case folding length out of range: %s", folded.length);
        return new CaseFolding(folded.clone(), folded.length == 1 && folded[0] == source);
    }

    public int length()
    {
        return codepoints.length;
    }

    public int codepoint(int i)
    {
        return codepoints[i];
    }

    public int[] codepoints()
    {
        return codepoints.clone();
    }

    public boolean isTrivial()
    {
        return trivial;
    }

    /**
     * Appends the folded codepoints to {@code sb}.
     */
    public StringBuilder appendTo(StringBuilder sb)
    {
        for (int codepoint : codepoints)
            sb.appendCodePoint(codepoint);
        return sb;
    }

    @Override
    public boolean equals(Object o)
    {
        if (!(o instanceof CaseFolding))
            return false;
        CaseFolding that = (CaseFolding) o;
        return trivial == that.trivial && Arrays.equals(codepoints, that.codepoints);
    }

    @Override
    public int hashCode()
    {
        return Arrays.hashCode(codepoints);
    }

    @Override
    public String toString()
    {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < codepoints.length; i++)
        {
            if (i > 0)
                sb.append(' ');
            sb.append(String.format("U+%04X", codepoints[i]));
        }
        return sb.toString();
    }
}
