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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Random;
import java.util.TreeMap;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

public class TrieEntryIteratorTest
{
    @Test
    public void testAscendingOrder()
    {
        TreeMap<Integer, Integer> content = new TreeMap<>();
        Random rand = new Random(7);
        for (int i = 0; i < 300; i++)
            content.put(rand.nextInt(0x10000), rand.nextInt(0xFFFF));

        TrieWriter writer = TrieWriter.create(4);
        content.forEach((k, v) -> writer.add(k, v));
        CompiledTrie trie = new CompiledTrie("random", writer.compile(), 4);

        List<TrieEntryIterator.Entry> expected = new ArrayList<>();
        for (Map.Entry<Integer, Integer> e : content.entrySet())
            expected.add(new TrieEntryIterator.Entry(e.getKey(), e.getValue()));

        List<TrieEntryIterator.Entry> actual = new ArrayList<>();
        trie.entries().forEachRemaining(actual::add);
        assertEquals(expected, actual);
    }

    @Test
    public void testDepthOne()
    {
        TrieWriter writer = TrieWriter.create(1);
        writer.add(9, 1);
        writer.add(2, 0);
        TrieEntryIterator it = new CompiledTrie("one", writer.compile(), 1).entries();

        assertEquals(new TrieEntryIterator.Entry(2, 0), it.next());
        assertEquals(new TrieEntryIterator.Entry(9, 1), it.next());
        assertFalse(it.hasNext());
    }

    @Test(expected = NoSuchElementException.class)
    public void testEmpty()
    {
        TrieEntryIterator it = new CompiledTrie("empty", TrieWriter.create(4).compile(), 4).entries();
        assertFalse(it.hasNext());
        it.next();
    }

    @Test
    public void testEntryToString()
    {
        assertEquals("df=0x0003", new TrieEntryIterator.Entry(0xDF, 3).toString());
    }
}
