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
package org.ucdtrie.io.tries;

import com.google.common.base.Preconditions;

import org.ucdtrie.exceptions.TableBoundsException;
import org.ucdtrie.exceptions.TableIntegrityException;

/**
 * A trie compiled by {@link TrieWriter}: a flat sequence of 16-word tables, table 0 being the root.
 *
 * A query consumes one nybble of the key per level, most significant first. On every level but the last the selected
 * slot holds the index of the next table, or {@link #ABSENT}. On the last level it holds the mapped value in
 * {@code [0, 0xFFFE]}, or {@link #ABSENT}. The depth is not recorded in the array; it is a property of each trie and
 * is supplied by whoever reads it.
 *
 * Instances are immutable and can be shared between threads.
 */
public final class CompiledTrie
{
    public static final int ABSENT = 0xFFFF;
    public static final int TABLE_SIZE = 16;

    private final String name;
    private final char[] tables;
    private final int depth;

    public CompiledTrie(String name, char[] tables, int depth)
    {
        Preconditions.checkArgument(depth >= 1 && depth <= TrieWriter.MAX_DEPTH, "Trie depth must be in [1, %s], got %s", TrieWriter.MAX_DEPTH, depth);
        if (tables.length < 1)
            throw new TableIntegrityException("Empty compiled trie " + name);
        this.name = name;
        this.tables = tables;
        this.depth = depth;
    }

    /**
     * Looks up the low {@code depth * 4} bits of {@code key}.
     *
     * @return the mapped value, or {@link #ABSENT}
     * @throws TableBoundsException if the walk leaves the array, meaning the table is corrupted
     */
    public int get(int key)
    {
        return query(tables, tables.length, key, depth, name);
    }

    /**
     * Queries a compiled trie of {@code length} words.
     *
     * Only the {@code depth} least significant nybbles of the key are used. Every access is checked against
     * {@code length}; escaping it is a {@link TableBoundsException}.
     */
    public static int query(char[] trie, int length, int key, int depth)
    {
        return query(trie, length, key, depth, "trie");
    }

    private static int query(char[] trie, int length, int key, int depth, String name)
    {
        Preconditions.checkArgument(depth >= 1 && depth <= TrieWriter.MAX_DEPTH, "Trie depth must be in [1, %s], got %s", TrieWriter.MAX_DEPTH, depth);
        Preconditions.checkArgument(length <= trie.length, "Length %s exceeds array length %s", length, trie.length);
        if (length < 1)
            throw new TableIntegrityException("Empty compiled trie " + name);

        int offset = 0;
        for (int level = 0; level < depth - 1; level++)
        {
            int index = offset + ((key >>> ((depth - level - 1) * 4)) & 0xF);
            if (index >= length)
                throw TableBoundsException.outOfRange(name, index, length);
            int slot = trie[index];
            if (slot == ABSENT)
                return ABSENT;
            offset = slot * TABLE_SIZE;
        }

        int index = offset + (key & 0xF);
        if (index >= length)
            throw TableBoundsException.outOfRange(name, index, length);
        return trie[index];
    }

    public String name()
    {
        return name;
    }

    public int depth()
    {
        return depth;
    }

    public int length()
    {
        return tables.length;
    }

    /**
     * Word at {@code index} of the flat array.
     */
    public int word(int index)
    {
        if (index < 0 || index >= tables.length)
            throw TableBoundsException.outOfRange(name, index, tables.length);
        return tables[index];
    }

    /**
     * Iterates the mapped entries in ascending key order.
     */
    public TrieEntryIterator entries()
    {
        return new TrieEntryIterator(this);
    }

    @Override
    public String toString()
    {
        return String.format("%s(depth=%d, tables=%d)", name, depth, tables.length / TABLE_SIZE);
    }
}
