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
package org.ucdtrie.db.tables;

import org.ucdtrie.db.GeneralCategory;
import org.ucdtrie.exceptions.TableBoundsException;
import org.ucdtrie.exceptions.TableIntegrityException;
import org.ucdtrie.io.tries.CompiledTrie;

/**
 * Maps any 32-bit integer to a general category code.
 *
 * The tables are consulted in a fixed order, the first one with an answer winning:
 * <ol>
 *   <li>U+0000..U+00FF: the 256 entry core table, fully populated;</li>
 *   <li>U+0100..U+1FFFF: the bitmap, whose 2-bit fields select Lo, Ll or So, then for fields left at zero the
 *       general trie of the plane, then the hardcoded surrogate and private use ranges;</li>
 *   <li>U+20000..U+10FFFF: the astral range table;</li>
 * </ol>
 * with Cn for everything else, negative values included.
 */
public final class CategoryClassifier
{
    public static final int CORE_SIZE = 0x100;
    /** Words needed for 2 bits per codepoint over U+0100..U+1FFFF. */
    public static final int BITMAP_SIZE = (0x20000 - CORE_SIZE) / 8;
    public static final int TRIE_DEPTH = 4;

    private static final int BITMAP_LO = 1;
    private static final int BITMAP_LL = 2;
    private static final int BITMAP_SO = 3;

    private static final int SURROGATE_FIRST = 0xD800;
    private static final int SURROGATE_LAST = 0xDFFF;
    private static final int PRIVATE_USE_FIRST = 0xE000;
    private static final int PRIVATE_USE_LAST = 0xF8FF;

    private static final int CN = GeneralCategory.Cn.code();

    private final char[] core;
    private final char[] bitmap;
    private final CompiledTrie generalLow;
    private final CompiledTrie generalHigh;
    private final AstralRangeTable astral;

    public CategoryClassifier(char[] core, char[] bitmap, CompiledTrie generalLow, CompiledTrie generalHigh, AstralRangeTable astral)
    {
        if (core.length != CORE_SIZE)
            throw new TableIntegrityException("Invalid core table length " + core.length);
        this.core = core;
        this.bitmap = bitmap;
        this.generalLow = generalLow;
        this.generalHigh = generalHigh;
        this.astral = astral;
    }

    /**
     * Returns the 16-bit category code of {@code cv}. Defined for every int.
     */
    public int classify(int cv)
    {
        if (cv >= 0 && cv < CORE_SIZE)
            return core[cv];

        if (cv >= CORE_SIZE && cv <= 0x1FFFF)
            return classifyGeneral(cv);

        if (cv >= AstralRangeTable.MIN_CODEPOINT && cv <= AstralRangeTable.MAX_CODEPOINT)
            return astral.lookup(cv, CN);

        return CN;
    }

    private int classifyGeneral(int cv)
    {
        int offset = cv - CORE_SIZE;
        int index = offset / 8;
        int shift = (offset % 8) * 2;
        if (index >= bitmap.length)
            throw TableBoundsException.outOfRange("bitmap", index, bitmap.length);

        switch ((bitmap[index] >> shift) & 0x3)
        {
            case BITMAP_LO:
                return GeneralCategory.Lo.code();
            case BITMAP_LL:
                return GeneralCategory.Ll.code();
            case BITMAP_SO:
                return GeneralCategory.So.code();
            default:
                break;
        }

        int code = cv <= 0xFFFF ? generalLow.get(cv) : generalHigh.get(cv - 0x10000);
        if (code != CompiledTrie.ABSENT)
            return code;

        if (cv >= SURROGATE_FIRST && cv <= SURROGATE_LAST)
            return GeneralCategory.Cs.code();
        if (cv >= PRIVATE_USE_FIRST && cv <= PRIVATE_USE_LAST)
            return GeneralCategory.Co.code();
        return CN;
    }
}
