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
import java.util.Objects;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import org.ucdtrie.db.GeneralCategory;

/**
 * One record of UnicodeData.txt, restricted to the fields used to build the tables. A record covers either a single
 * codepoint or, for {@code <..., First>}/{@code <..., Last>} pairs, a range.
 */
public final class UnicodeDataRecord
{
    private final int lbound;
    private final int ubound;
    private final GeneralCategory category;
    private final int combiningClass;
    @Nullable
    private final int[] decomposition;
    private final boolean compatibility;

    public UnicodeDataRecord(int lbound, int ubound, GeneralCategory category, int combiningClass,
                             @Nullable int[] decomposition, boolean compatibility)
    {
        Preconditions.checkArgument(lbound >= 0 && lbound <= ubound && ubound <= 0x10FFFF, "Invalid range U+%s..U+%s",
                                    Integer.toHexString(lbound), Integer.toHexString(ubound));
        Preconditions.checkArgument(decomposition == null || lbound == ubound, "Decomposition on a range");
        this.lbound = lbound;
        this.ubound = ubound;
        this.category = Preconditions.checkNotNull(category);
        this.combiningClass = combiningClass;
        this.decomposition = decomposition;
        this.compatibility = decomposition != null && compatibility;
    }

    public static UnicodeDataRecord single(int codepoint, GeneralCategory category)
    {
        return new UnicodeDataRecord(codepoint, codepoint, category, 0, null, false);
    }

    public static UnicodeDataRecord range(int lbound, int ubound, GeneralCategory category)
    {
        return new UnicodeDataRecord(lbound, ubound, category, 0, null, false);
    }

    public int lbound()
    {
        return lbound;
    }

    public int ubound()
    {
        return ubound;
    }

    public boolean isRange()
    {
        return ubound > lbound;
    }

    public GeneralCategory category()
    {
        return category;
    }

    public int combiningClass()
    {
        return combiningClass;
    }

    @Nullable
    public int[] decomposition()
    {
        return decomposition == null ? null : decomposition.clone();
    }

    /**
     * True for a tagged ({@code <compat>}, {@code <font>}...) decomposition.
     */
    public boolean isCompatibility()
    {
        return compatibility;
    }

    @Override
    public boolean equals(Object o)
    {
        if (!(o instanceof UnicodeDataRecord))
            return false;

        UnicodeDataRecord that = (UnicodeDataRecord) o;
        return lbound == that.lbound
               && ubound == that.ubound
               && category == that.category
               && combiningClass == that.combiningClass
               && compatibility == that.compatibility
               && Arrays.equals(decomposition, that.decomposition);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(lbound, ubound, category, combiningClass);
    }

    @Override
    public String toString()
    {
        return isRange()
               ? String.format("[%s] U+%04X - U+%04X", category.abbreviation(), lbound, ubound)
               : String.format("[%s] U+%04X", category.abbreviation(), lbound);
    }
}
