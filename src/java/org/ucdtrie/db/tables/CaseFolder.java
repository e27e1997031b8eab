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

import org.ucdtrie.db.CaseFolding;
import org.ucdtrie.exceptions.TableIntegrityException;
import org.ucdtrie.io.tries.CompiledTrie;

/**
 * Full case folding (statuses C and F of CaseFolding.txt) for planes 0 and 1.
 *
 * Each plane has a depth 4 trie keyed by the low 16 bits of the codepoint. A mapped value is a data key: the two low
 * bits hold the sequence length minus one, the rest the offset of the sequence in the shared data array. The array
 * stores only the low 16 bits of each codepoint; plane 1 sequences get {@code 0x10000} added back, since a mapping
 * never leaves its plane. Codepoints without a mapping fold to themselves.
 */
public final class CaseFolder
{
    public static final int TRIE_DEPTH = 4;

    private final CompiledTrie lower;
    private final CompiledTrie upper;
    private final char[] data;

    public CaseFolder(CompiledTrie lower, CompiledTrie upper, char[] data)
    {
        this.lower = lower;
        this.upper = upper;
        this.data = data;
    }

    /**
     * Folds a valid codepoint; validity is the caller's responsibility.
     */
    public CaseFolding fold(int cv)
    {
        int key;
        int planeBase;
        if (cv >= 0 && cv <= 0xFFFF)
        {
            key = lower.get(cv);
            planeBase = 0;
        }
        else if (cv >= 0x10000 && cv <= 0x1FFFF)
        {
            key = upper.get(cv & 0xFFFF);
            planeBase = 0x10000;
        }
        else
        {
            return CaseFolding.identity(cv);
        }

        if (key == CompiledTrie.ABSENT)
            return CaseFolding.identity(cv);

        int length = (key & 0x3) + 1;
        int offset = key >> 2;
        if (offset > data.length - length)
            throw new TableIntegrityException(String.format("Case data slice [%d, %d) out of range for length %d", offset, offset + length, data.length));

        int[] folded = new int[length];
        for (int i = 0; i < length; i++)
            folded[i] = data[offset + i] + planeBase;
        return CaseFolding.of(cv, folded);
    }

    /**
     * Encodes a data key for a sequence of {@code length} codepoints starting at {@code offset}.
     */
    public static int dataKey(int offset, int length)
    {
        return (offset << 2) | (length - 1);
    }
}
