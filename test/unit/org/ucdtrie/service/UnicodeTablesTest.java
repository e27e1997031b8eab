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
package org.ucdtrie.service;

import java.util.EnumMap;
import java.util.Map;

import org.junit.BeforeClass;
import org.junit.Test;

import org.ucdtrie.config.DataTableStore;
import org.ucdtrie.config.ResourceDataTableStore;
import org.ucdtrie.config.UcdConfig;
import org.ucdtrie.db.CaseFolding;
import org.ucdtrie.db.GeneralCategory;
import org.ucdtrie.db.TableId;
import org.ucdtrie.exceptions.ConfigurationException;
import org.ucdtrie.exceptions.InvalidCodepointException;
import org.ucdtrie.exceptions.TableFormatException;
import org.ucdtrie.exceptions.TableIntegrityException;
import org.ucdtrie.io.util.Base64Words;
import org.mockito.Mockito;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * Runs against the bundled UCD 14.0.0 tables.
 */
public class UnicodeTablesTest
{
    private static UnicodeTables tables;

    @BeforeClass
    public static void load()
    {
        tables = UnicodeTables.load(new ResourceDataTableStore(UcdConfig.DEFAULT_TABLE_RESOURCE));
    }

    @Test
    public void testClassify()
    {
        assertEquals(GeneralCategory.Lu.code(), tables.classify(0x0041));
        assertEquals(GeneralCategory.Ll.code(), tables.classify(0x0061));
        assertEquals(GeneralCategory.Cn.code(), tables.classify(-1));
        assertEquals(GeneralCategory.Cn.code(), tables.classify(0x110000));
        assertEquals(GeneralCategory.Cs.code(), tables.classify(0xD800));
        assertEquals(GeneralCategory.Co.code(), tables.classify(0xE000));
    }

    @Test
    public void testCategoryOfEachTier()
    {
        // core
        assertEquals(GeneralCategory.Zs, tables.category(0x0020));
        assertEquals(GeneralCategory.Cc, tables.category(0x0000));
        assertEquals(GeneralCategory.Nd, tables.category(0x0035));
        assertEquals(GeneralCategory.Sc, tables.category(0x00A3));
        // bitmap
        assertEquals(GeneralCategory.Lo, tables.category(0x4E00));
        assertEquals(GeneralCategory.Ll, tables.category(0x0101));
        assertEquals(GeneralCategory.So, tables.category(0x1F600));
        // general tries
        assertEquals(GeneralCategory.Mn, tables.category(0x0300));
        assertEquals(GeneralCategory.Lu, tables.category(0x0100));
        assertEquals(GeneralCategory.Lu, tables.category(0x10400));
        assertEquals(GeneralCategory.Nd, tables.category(0x1D7CE));
        assertEquals(GeneralCategory.Zl, tables.category(0x2028));
        // hardcoded ranges
        assertEquals(GeneralCategory.Cs, tables.category(0xDFFF));
        assertEquals(GeneralCategory.Co, tables.category(0xF8FF));
        assertEquals(GeneralCategory.Lo, tables.category(0xF900));
        // astral
        assertEquals(GeneralCategory.Lo, tables.category(0x20000));
        assertEquals(GeneralCategory.Cf, tables.category(0xE0001));
        assertEquals(GeneralCategory.Mn, tables.category(0xE0100));
        assertEquals(GeneralCategory.Co, tables.category(0xF0000));
        assertEquals(GeneralCategory.Co, tables.category(0x10FFFD));
        // unassigned
        assertEquals(GeneralCategory.Cn, tables.category(0x0378));
        assertEquals(GeneralCategory.Cn, tables.category(0x1FFFF));
        assertEquals(GeneralCategory.Cn, tables.category(0x10FFFF));
    }

    @Test
    public void testEveryCodepointHasAKnownCategory()
    {
        int unassigned = 0;
        for (int cv = 0; cv <= UnicodeTables.MAX_CODEPOINT; cv++)
        {
            if (tables.category(cv) == GeneralCategory.Cn)
                ++unassigned;
        }
        // UCD 14.0.0 leaves 829834 codepoints unassigned
        assertEquals(829834, unassigned);
    }

    @Test
    public void testFoldCase()
    {
        CaseFolding m = tables.foldCase(0x004D);
        assertArrayEquals(new int[]{ 0x006D }, m.codepoints());
        assertFalse(m.isTrivial());

        CaseFolding a = tables.foldCase(0x0061);
        assertArrayEquals(new int[]{ 0x0061 }, a.codepoints());
        assertTrue(a.isTrivial());

        assertArrayEquals(new int[]{ 0x0073, 0x0073 }, tables.foldCase(0x00DF).codepoints());
        assertArrayEquals(new int[]{ 0x0073, 0x0073 }, tables.foldCase(0x1E9E).codepoints());
        assertArrayEquals(new int[]{ 0x0069, 0x0307 }, tables.foldCase(0x0130).codepoints());
        assertArrayEquals(new int[]{ 0x03C5, 0x0308, 0x0301 }, tables.foldCase(0x03B0).codepoints());
        assertArrayEquals(new int[]{ 0x03C3 }, tables.foldCase(0x03A3).codepoints());
        assertArrayEquals(new int[]{ 0x10428 }, tables.foldCase(0x10400).codepoints());
        assertArrayEquals(new int[]{ 0x1E922 }, tables.foldCase(0x1E900).codepoints());
    }

    @Test
    public void testFoldOutsideTries()
    {
        assertTrue(tables.foldCase(0x20000).isTrivial());
        assertTrue(tables.foldCase(0x10FFFF).isTrivial());
        assertTrue(tables.foldCase(0xFFFF).isTrivial());
    }

    @Test
    public void testFoldRejectsInvalidCodepoints()
    {
        for (int cv : new int[]{ -1, 0xD800, 0xDBFF, 0xDFFF, 0x110000, Integer.MAX_VALUE })
        {
            try
            {
                tables.foldCase(cv);
                fail("Expected U+" + Integer.toHexString(cv) + " to be rejected");
            }
            catch (InvalidCodepointException e)
            {
                assertEquals(cv, e.codepoint());
            }
        }
    }

    @Test
    public void testValidCodepoints()
    {
        assertTrue(UnicodeTables.isValidCodepoint(0));
        assertTrue(UnicodeTables.isValidCodepoint(0xD7FF));
        assertFalse(UnicodeTables.isValidCodepoint(0xD800));
        assertFalse(UnicodeTables.isValidCodepoint(0xDFFF));
        assertTrue(UnicodeTables.isValidCodepoint(0xE000));
        assertTrue(UnicodeTables.isValidCodepoint(0x10FFFF));
        assertFalse(UnicodeTables.isValidCodepoint(0x110000));
        assertFalse(UnicodeTables.isValidCodepoint(-1));
    }

    @Test
    public void testMissingTable()
    {
        DataTableStore store = Mockito.mock(DataTableStore.class);
        when(store.fetch(any(TableId.class))).thenReturn("AAA=");
        when(store.fetch(TableId.GCAT_ASTRAL)).thenReturn(null);

        try
        {
            UnicodeTables.load(store);
            fail("Expected a missing table to fail loading");
        }
        catch (ConfigurationException e)
        {
            assertTrue(e.getMessage(), e.getMessage().contains("gcat.astral"));
        }
    }

    @Test(expected = TableFormatException.class)
    public void testMalformedTable()
    {
        Map<TableId, String> encoded = bundled();
        encoded.put(TableId.CASE_DATA, "not base64!");
        UnicodeTables.load(encoded::get);
    }

    @Test(expected = TableIntegrityException.class)
    public void testWrongBitmapSize()
    {
        Map<TableId, String> encoded = bundled();
        encoded.put(TableId.GCAT_BITMAP, Base64Words.encode(new char[100]));
        UnicodeTables.load(encoded::get);
    }

    @Test(expected = TableIntegrityException.class)
    public void testWrongCoreSize()
    {
        Map<TableId, String> encoded = bundled();
        encoded.put(TableId.GCAT_CORE, Base64Words.encode(new char[255]));
        UnicodeTables.load(encoded::get);
    }

    private static Map<TableId, String> bundled()
    {
        DataTableStore store = new ResourceDataTableStore(UcdConfig.DEFAULT_TABLE_RESOURCE);
        Map<TableId, String> encoded = new EnumMap<>(TableId.class);
        for (TableId id : TableId.VALUES)
            encoded.put(id, store.fetch(id));
        assertNotNull(encoded.get(TableId.GCAT_CORE));
        return encoded;
    }
}
