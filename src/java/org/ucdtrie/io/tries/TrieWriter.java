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

import java.util.Arrays;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;

import org.ucdtrie.exceptions.DuplicateKeyException;
import org.ucdtrie.exceptions.TableIntegrityException;
import org.ucdtrie.exceptions.TableStateException;

/**
 * Offline builder of nybble-keyed tries. Mappings are accumulated sparsely and {@link #compile} flattens them into
 * the table format read by {@link CompiledTrie}.
 *
 * Every key is exactly {@code depth} nybbles long, most significant first. The tree is held as an arena of 16-slot
 * tables addressed by index: slot {@code s} of table {@code t} lives at {@code slots[t * 16 + s]} and holds either
 * {@code NONE}, the arena index of a child table (all levels but the last), or the mapped value (last level). The
 * arena index is only the insertion order; the table ids in the output are assigned by {@link #compile}.
 *
 * Compilation numbers tables depth first. The root is table 0, and the children of a table get consecutive ids in
 * ascending slot order right after their parent's id is taken, before any grandchild is numbered. The output for a
 * given set of mappings is therefore fully determined, whatever the insertion order.
 *
 * A writer is single use: once compiled, it rejects any further call.
 */
public class TrieWriter
{
    public static final int MAX_DEPTH = 8;
    public static final int MAX_VALUE = 0xFFFE;
    /** Highest table id, all 16-bit values but {@link CompiledTrie#ABSENT}. */
    static final int MAX_TABLE_ID = 0xFFFE;

    private static final int NONE = -1;
    private static final int INITIAL_TABLES = 16;

    private final int depth;
    private int[] slots;
    private int tableCount;
    private long count = 0;

    private TrieWriter(int depth)
    {
        this.depth = depth;
        this.slots = newTables(INITIAL_TABLES);
        this.tableCount = 1;
    }

    /**
     * Creates a writer for keys of {@code depth} nybbles, {@code depth} being between 1 and 8.
     */
    public static TrieWriter create(int depth)
    {
        Preconditions.checkArgument(depth >= 1 && depth <= MAX_DEPTH, "Trie depth must be in [1, %s], got %s", MAX_DEPTH, depth);
        return new TrieWriter(depth);
    }

    public int depth()
    {
        return depth;
    }

    /**
     * Number of mappings added so far.
     */
    public long count()
    {
        return count;
    }

    /**
     * Maps the key, given as {@code depth} nybbles most significant first, to {@code value}.
     *
     * @throws DuplicateKeyException if the key is already mapped.
     */
    public void add(int[] key, int value)
    {
        checkOpen();
        Preconditions.checkArgument(key.length == depth, "Expected a key of %s nybbles, got %s", depth, key.length);
        for (int nybble : key)
            Preconditions.checkArgument(nybble >= 0 && nybble <= 0xF, "Key nybble out of range: %s", nybble);
        Preconditions.checkArgument(value >= 0 && value <= MAX_VALUE, "Trie value out of range: %s", value);

        int table = 0;
        for (int level = 0; level < depth - 1; level++)
        {
            int slot = table * CompiledTrie.TABLE_SIZE + key[level];
            int child = slots[slot];
            if (child == NONE)
            {
                child = allocateTable();
                slots[slot] = child;
            }
            table = child;
        }

        int leaf = table * CompiledTrie.TABLE_SIZE + key[depth - 1];
        if (slots[leaf] != NONE)
            throw new DuplicateKeyException(String.format("Key %s already mapped to 0x%04x", formatKey(key), slots[leaf]));
        slots[leaf] = value;
        ++count;
    }

    /**
     * Maps the {@code depth * 4} low bits of {@code key} to {@code value}.
     */
    public void add(long key, int value)
    {
        Preconditions.checkArgument(key >= 0 && (depth == MAX_DEPTH ? key <= 0xFFFFFFFFL : key < 1L << (depth * 4)),
                                    "Key 0x%s does not fit in %s nybbles", Long.toHexString(key), depth);
        add(split(key, depth), value);
    }

    /**
     * Splits a key into {@code depth} nybbles, most significant first.
     */
    public static int[] split(long key, int depth)
    {
        int[] nybbles = new int[depth];
        for (int i = 0; i < depth; i++)
            nybbles[i] = (int) (key >>> ((depth - i - 1) * 4)) & 0xF;
        return nybbles;
    }

    /**
     * Flattens the trie into {@code tableCount * 16} words pre-filled with {@link CompiledTrie#ABSENT}. Consumes the
     * writer.
     */
    public char[] compile()
    {
        checkOpen();
        if (tableCount - 1 > MAX_TABLE_ID)
            throw new TableIntegrityException(String.format("Too many tables in 16-bit trie: %d", tableCount));

        int[] ids = new int[tableCount];
        Arrays.fill(ids, NONE);
        ids[0] = 0;
        int assigned = assignIds(ids, 0, 0, 1);
        assert assigned == tableCount : assigned + " != " + tableCount;

        char[] result = new char[tableCount * CompiledTrie.TABLE_SIZE];
        Arrays.fill(result, (char) CompiledTrie.ABSENT);
        writeTables(result, ids, 0, 0);

        slots = null;
        return result;
    }

    @VisibleForTesting
    int tableCount()
    {
        return tableCount;
    }

    private int assignIds(int[] ids, int table, int level, int nextId)
    {
        if (level == depth - 1)
            return nextId;

        int base = table * CompiledTrie.TABLE_SIZE;
        for (int i = 0; i < CompiledTrie.TABLE_SIZE; i++)
        {
            int child = slots[base + i];
            if (child != NONE)
                ids[child] = nextId++;
        }
        for (int i = 0; i < CompiledTrie.TABLE_SIZE; i++)
        {
            int child = slots[base + i];
            if (child != NONE)
                nextId = assignIds(ids, child, level + 1, nextId);
        }
        return nextId;
    }

    private void writeTables(char[] result, int[] ids, int table, int level)
    {
        int base = table * CompiledTrie.TABLE_SIZE;
        int offset = ids[table] * CompiledTrie.TABLE_SIZE;
        boolean leaf = level == depth - 1;
        for (int i = 0; i < CompiledTrie.TABLE_SIZE; i++)
        {
            int entry = slots[base + i];
            if (entry == NONE)
                continue;
            result[offset + i] = (char) (leaf ? entry : ids[entry]);
            if (!leaf)
                writeTables(result, ids, entry, level + 1);
        }
    }

    private int allocateTable()
    {
        if (tableCount * CompiledTrie.TABLE_SIZE == slots.length)
        {
            int[] grown = newTables(tableCount * 2);
            System.arraycopy(slots, 0, grown, 0, slots.length);
            slots = grown;
        }
        return tableCount++;
    }

    private static int[] newTables(int tables)
    {
        int[] s = new int[tables * CompiledTrie.TABLE_SIZE];
        Arrays.fill(s, NONE);
        return s;
    }

    private void checkOpen()
    {
        if (slots == null)
            throw new TableStateException("Trie writer already compiled");
    }

    private static String formatKey(int[] key)
    {
        StringBuilder sb = new StringBuilder(key.length);
        for (int nybble : key)
            sb.append(Character.forDigit(nybble, 16));
        return sb.toString();
    }
}
