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

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Thread-unsafe iterator over the mapped entries of a {@link CompiledTrie}, in ascending key order.
 *
 * Walks the tables depth first, keeping the path from the root as a stack of iteration positions. Every slot read is
 * checked against the array length the same way {@link CompiledTrie#get} does.
 */
public class TrieEntryIterator implements Iterator<TrieEntryIterator.Entry>
{
    public static final class Entry
    {
        private final int key;
        private final int value;

        Entry(int key, int value)
        {
            this.key = key;
            this.value = value;
        }

        public int key()
        {
            return key;
        }

        public int value()
        {
            return value;
        }

        @Override
        public boolean equals(Object o)
        {
            if (!(o instanceof Entry))
                return false;
            Entry that = (Entry) o;
            return key == that.key && value == that.value;
        }

        @Override
        public int hashCode()
        {
            return 31 * key + value;
        }

        @Override
        public String toString()
        {
            return String.format("%x=0x%04x", key, value);
        }
    }

    static class IterationPosition
    {
        final int table;
        final int keyPrefix;
        final int level;
        int childIndex;
        final IterationPosition prev;

        IterationPosition(int table, int keyPrefix, int level, IterationPosition prev)
        {
            this.table = table;
            this.keyPrefix = keyPrefix;
            this.level = level;
            this.childIndex = -1;
            this.prev = prev;
        }
    }

    private final CompiledTrie trie;
    private IterationPosition stack;
    private Entry next;

    TrieEntryIterator(CompiledTrie trie)
    {
        this.trie = trie;
        this.stack = new IterationPosition(0, 0, 0, null);
        this.next = advance();
    }

    @Override
    public boolean hasNext()
    {
        return next != null;
    }

    @Override
    public Entry next()
    {
        if (next == null)
            throw new NoSuchElementException();
        Entry toReturn = next;
        next = advance();
        return toReturn;
    }

    private Entry advance()
    {
        int leafLevel = trie.depth() - 1;
        while (stack != null)
        {
            if (++stack.childIndex == CompiledTrie.TABLE_SIZE)
            {
                // ascend
                stack = stack.prev;
                continue;
            }

            int slot = trie.word(stack.table * CompiledTrie.TABLE_SIZE + stack.childIndex);
            if (slot == CompiledTrie.ABSENT)
                continue;

            int key = (stack.keyPrefix << 4) | stack.childIndex;
            if (stack.level == leafLevel)
                return new Entry(key, slot);

            // descend
            stack = new IterationPosition(slot, key, stack.level + 1, stack);
        }
        return null;
    }
}
