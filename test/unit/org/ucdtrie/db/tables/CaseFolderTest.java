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

import org.junit.Before;
import org.junit.Test;

import org.ucdtrie.db.CaseFolding;
import org.ucdtrie.exceptions.TableIntegrityException;
import org.ucdtrie.io.tries.CompiledTrie;
import org.ucdtrie.io.tries.TrieWriter;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class CaseFolderTest
{
    private CaseFolder folder;

    @Before
    public void setUp()
    {
        TrieWriter lower = TrieWriter.create(CaseFolder.TRIE_DEPTH);
        TrieWriter upper = TrieWriter.create(CaseFolder.TRIE_DEPTH);
        char[] data = { 0x006D, 0x0073, 0x0073, 0x0428, 0x0066, 0x0066, 0x0069 };

        lower.add(0x004D, CaseFolder.dataKey(0, 1));
        lower.add(0x00DF, CaseFolder.dataKey(1, 2));
        lower.add(0xFB03, CaseFolder.dataKey(4, 3));
        upper.add(0x0400, CaseFolder.dataKey(3, 1));

        folder = new CaseFolder(new CompiledTrie("lower", lower.compile(), CaseFolder.TRIE_DEPTH),
                                new CompiledTrie("upper", upper.compile(), CaseFolder.TRIE_DEPTH),
                                data);
    }

    @Test
    public void testDataKey()
    {
        assertEquals(0, CaseFolder.dataKey(0, 1));
        assertEquals(0x7, CaseFolder.dataKey(1, 4));
        assertEquals((0x3FFE << 2) | 2, CaseFolder.dataKey(0x3FFE, 3));
    }

    @Test
    public void testSingleCodepoint()
    {
        CaseFolding folding = folder.fold(0x004D);
        assertArrayEquals(new int[]{ 0x006D }, folding.codepoints());
        assertFalse(folding.isTrivial());
    }

    @Test
    public void testExpansion()
    {
        assertArrayEquals(new int[]{ 0x73, 0x73 }, folder.fold(0xDF).codepoints());
        assertArrayEquals(new int[]{ 0x66, 0x66, 0x69 }, folder.fold(0xFB03).codepoints());
    }

    @Test
    public void testPlaneOneRestoresHighBit()
    {
        assertArrayEquals(new int[]{ 0x10428 }, folder.fold(0x10400).codepoints());
        // same low bits in plane 0 are not mapped
        assertTrue(folder.fold(0x0400).isTrivial());
    }

    @Test
    public void testUnmappedIsIdentity()
    {
        assertEquals(CaseFolding.identity(0x61), folder.fold(0x61));
        assertEquals(CaseFolding.identity(0x1F600), folder.fold(0x1F600));
        assertEquals(CaseFolding.identity(0x20400), folder.fold(0x20400));
        assertEquals(CaseFolding.identity(0x10FFFF), folder.fold(0x10FFFF));
    }

    @Test(expected = TableIntegrityException.class)
    public void testSliceOutOfRange()
    {
        TrieWriter lower = TrieWriter.create(CaseFolder.TRIE_DEPTH);
        lower.add(0x0041, CaseFolder.dataKey(1, 2));
        CaseFolder broken = new CaseFolder(new CompiledTrie("lower", lower.compile(), CaseFolder.TRIE_DEPTH),
                                           new CompiledTrie("upper", TrieWriter.create(CaseFolder.TRIE_DEPTH).compile(), CaseFolder.TRIE_DEPTH),
                                           new char[]{ 0x61, 0x62 });
        broken.fold(0x0041);
    }
}
