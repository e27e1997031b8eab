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

import java.util.Arrays;

import org.junit.Before;
import org.junit.Test;

import org.ucdtrie.db.GeneralCategory;
import org.ucdtrie.exceptions.TableBoundsException;
import org.ucdtrie.exceptions.TableIntegrityException;
import org.ucdtrie.io.tries.CompiledTrie;
import org.ucdtrie.io.tries.TrieWriter;

import static org.junit.Assert.assertEquals;

public class CategoryClassifierTest
{
    private static final int CN = GeneralCategory.Cn.code();

    private char[] core;
    private char[] bitmap;
    private TrieWriter low;
    private TrieWriter high;
    private char[] astral;

    @Before
    public void setUp()
    {
        core = new char[CategoryClassifier.CORE_SIZE];
        Arrays.fill(core, (char) GeneralCategory.Cc.code());
        core['A'] = (char) GeneralCategory.Lu.code();
        core['a'] = (char) GeneralCategory.Ll.code();
        core[' '] = (char) GeneralCategory.Zs.code();

        bitmap = new char[CategoryClassifier.BITMAP_SIZE];
        low = TrieWriter.create(CategoryClassifier.TRIE_DEPTH);
        high = TrieWriter.create(CategoryClassifier.TRIE_DEPTH);
        astral = new char[]{ 2, 0x10, 0x20, (char) GeneralCategory.Lo.code() };
    }

    private void setBitmap(int cv, int value)
    {
        int offset = cv - CategoryClassifier.CORE_SIZE;
        bitmap[offset / 8] |= value << ((offset % 8) * 2);
    }

    private CategoryClassifier classifier()
    {
        return new CategoryClassifier(core,
                                      bitmap,
                                      new CompiledTrie("low", low.compile(), CategoryClassifier.TRIE_DEPTH),
                                      new CompiledTrie("high", high.compile(), CategoryClassifier.TRIE_DEPTH),
                                      new AstralRangeTable(astral));
    }

    @Test
    public void testCoreTable()
    {
        CategoryClassifier classifier = classifier();
        assertEquals(GeneralCategory.Lu.code(), classifier.classify(0x41));
        assertEquals(GeneralCategory.Ll.code(), classifier.classify(0x61));
        assertEquals(GeneralCategory.Zs.code(), classifier.classify(0x20));
        assertEquals(GeneralCategory.Cc.code(), classifier.classify(0x00));
        assertEquals(GeneralCategory.Cc.code(), classifier.classify(0xFF));
    }

    @Test
    public void testBitmapValues()
    {
        setBitmap(0x100, 1);
        setBitmap(0x107, 2);
        setBitmap(0x108, 3);
        setBitmap(0x1FFFF, 3);
        CategoryClassifier classifier = classifier();

        assertEquals(GeneralCategory.Lo.code(), classifier.classify(0x100));
        assertEquals(GeneralCategory.Ll.code(), classifier.classify(0x107));
        assertEquals(GeneralCategory.So.code(), classifier.classify(0x108));
        assertEquals(GeneralCategory.So.code(), classifier.classify(0x1FFFF));
        assertEquals(CN, classifier.classify(0x101));
    }

    @Test
    public void testBitmapTakesPrecedenceOverTrieAndRanges()
    {
        setBitmap(0x300, 2);
        low.add(0x300, GeneralCategory.Mn.code());
        setBitmap(0xD800, 1);
        setBitmap(0xE000, 3);
        CategoryClassifier classifier = classifier();

        assertEquals(GeneralCategory.Ll.code(), classifier.classify(0x300));
        assertEquals(GeneralCategory.Lo.code(), classifier.classify(0xD800));
        assertEquals(GeneralCategory.So.code(), classifier.classify(0xE000));
    }

    @Test
    public void testGeneralTries()
    {
        low.add(0x300, GeneralCategory.Mn.code());
        low.add(0xFFFD, GeneralCategory.So.code());
        high.add(0xD400, GeneralCategory.Lu.code());
        CategoryClassifier classifier = classifier();

        assertEquals(GeneralCategory.Mn.code(), classifier.classify(0x300));
        assertEquals(GeneralCategory.So.code(), classifier.classify(0xFFFD));
        assertEquals(GeneralCategory.Lu.code(), classifier.classify(0x1D400));
        // the plane 0 trie is never consulted for plane 1 and vice versa
        assertEquals(CN, classifier.classify(0xD400));
        assertEquals(CN, classifier.classify(0x10300));
    }

    @Test
    public void testTrieTakesPrecedenceOverHardcodedRanges()
    {
        low.add(0xDB80, GeneralCategory.Cf.code());
        CategoryClassifier classifier = classifier();
        assertEquals(GeneralCategory.Cf.code(), classifier.classify(0xDB80));
        assertEquals(GeneralCategory.Cs.code(), classifier.classify(0xDB7F));
    }

    @Test
    public void testHardcodedRanges()
    {
        CategoryClassifier classifier = classifier();
        assertEquals(CN, classifier.classify(0xD7FF));
        assertEquals(GeneralCategory.Cs.code(), classifier.classify(0xD800));
        assertEquals(GeneralCategory.Cs.code(), classifier.classify(0xDFFF));
        assertEquals(GeneralCategory.Co.code(), classifier.classify(0xE000));
        assertEquals(GeneralCategory.Co.code(), classifier.classify(0xF8FF));
        assertEquals(CN, classifier.classify(0xF900));
        // plane 1 has no hardcoded range
        assertEquals(CN, classifier.classify(0x1D800));
    }

    @Test
    public void testCnStoredInTrieIsReturned()
    {
        low.add(0xE100, CN);
        assertEquals(CN, classifier().classify(0xE100));
    }

    @Test
    public void testAstral()
    {
        CategoryClassifier classifier = classifier();
        assertEquals(GeneralCategory.Lo.code(), classifier.classify(0x20010));
        assertEquals(GeneralCategory.Lo.code(), classifier.classify(0x20020));
        assertEquals(CN, classifier.classify(0x2000F));
        assertEquals(CN, classifier.classify(0x20021));
    }

    @Test
    public void testOutOfRange()
    {
        CategoryClassifier classifier = classifier();
        assertEquals(CN, classifier.classify(-1));
        assertEquals(CN, classifier.classify(Integer.MIN_VALUE));
        assertEquals(CN, classifier.classify(0x110000));
        assertEquals(CN, classifier.classify(Integer.MAX_VALUE));
    }

    @Test(expected = TableBoundsException.class)
    public void testShortBitmap()
    {
        bitmap = new char[16];
        classifier().classify(0x1000);
    }

    @Test(expected = TableIntegrityException.class)
    public void testWrongCoreLength()
    {
        core = new char[255];
        classifier();
    }
}
