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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.util.List;

import org.junit.Test;

import org.ucdtrie.db.GeneralCategory;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class UnicodeDataReaderTest
{
    private static UnicodeDataReader reader(String... lines)
    {
        return new UnicodeDataReader("UnicodeData.txt", new BufferedReader(new StringReader(String.join("\n", lines))));
    }

    @Test
    public void testSingleRecords() throws Exception
    {
        List<UnicodeDataRecord> records = reader("# comment",
                                                 "",
                                                 "0041;LATIN CAPITAL LETTER A;Lu;0;L;;;;;N;;;;0061;",
                                                 "   # indented comment",
                                                 "00A0;NO-BREAK SPACE;Zs;0;CS;<noBreak> 0020;;;;N;NON-BREAKING SPACE;;;;",
                                                 "00C0;LATIN CAPITAL LETTER A WITH GRAVE;Lu;0;L;0041 0300;;;;N;LATIN CAPITAL LETTER A GRAVE;;;00E0;",
                                                 "0300;COMBINING GRAVE ACCENT;Mn;230;NSM;;;;;N;NON-SPACING GRAVE;;;;").readAll();
        assertEquals(4, records.size());

        UnicodeDataRecord a = records.get(0);
        assertEquals(0x41, a.lbound());
        assertEquals(0x41, a.ubound());
        assertFalse(a.isRange());
        assertEquals(GeneralCategory.Lu, a.category());
        assertNull(a.decomposition());

        UnicodeDataRecord nbsp = records.get(1);
        assertArrayEquals(new int[]{ 0x20 }, nbsp.decomposition());
        assertTrue(nbsp.isCompatibility());

        UnicodeDataRecord grave = records.get(2);
        assertArrayEquals(new int[]{ 0x41, 0x300 }, grave.decomposition());
        assertFalse(grave.isCompatibility());

        assertEquals(230, records.get(3).combiningClass());
    }

    @Test
    public void testRangesAreMerged() throws Exception
    {
        UnicodeDataReader reader = reader("3400;<CJK Ideograph Extension A, First>;Lo;0;L;;;;;N;;;;;",
                                          "4DBF;<CJK Ideograph Extension A, Last>;Lo;0;L;;;;;N;;;;;",
                                          "4DC0;HEXAGRAM FOR THE CREATIVE HEAVEN;So;0;ON;;;;;N;;;;;");
        UnicodeDataRecord range = reader.next();
        assertEquals(0x3400, range.lbound());
        assertEquals(0x4DBF, range.ubound());
        assertTrue(range.isRange());
        assertEquals("[Lo] U+3400 - U+4DBF", range.toString());

        assertEquals(0x4DC0, reader.next().lbound());
        assertNull(reader.next());
        assertNull(reader.next());
    }

    @Test
    public void testMalformedInput() throws IOException
    {
        assertRejected(3, "# header", "", "0041;LATIN CAPITAL LETTER A;Lu");
        assertRejected(1, "00G1;BAD;Lu;0;L;;;;;N;;;;;");
        assertRejected(1, "110000;BAD;Lu;0;L;;;;;N;;;;;");
        assertRejected(1, "0041;LATIN CAPITAL LETTER A;LU;0;L;;;;;N;;;;;");
        assertRejected(1, "0041;LATIN CAPITAL LETTER A;Lx;0;L;;;;;N;;;;;");
        assertRejected(1, "0041;LATIN CAPITAL LETTER A;Lu;256;L;;;;;N;;;;;");
        assertRejected(1, "00A0;NO-BREAK SPACE;Zs;0;CS;<noBreak>;;;;N;;;;;");
        assertRejected(2, "0042;B;Lu;0;L;;;;;N;;;;;", "0041;A;Lu;0;L;;;;;N;;;;;");
        // ranges
        assertRejected(1, "3400;<CJK, First>;Lo;0;L;;;;;N;;;;;");
        assertRejected(2, "3400;<CJK, First>;Lo;0;L;;;;;N;;;;;", "4DBF;<CJK, Last>;Lu;0;L;;;;;N;;;;;");
        assertRejected(2, "3400;<CJK, First>;Lo;0;L;;;;;N;;;;;", "4DBF;CJK;Lo;0;L;;;;;N;;;;;");
        assertRejected(1, "4DBF;<CJK, Last>;Lo;0;L;;;;;N;;;;;");
        assertRejected(2, "3400;<CJK, First>;Lo;0;L;;;;;N;;;;;", "3400;<CJK, Last>;Lo;0;L;;;;;N;;;;;");
        assertRejected(3, "0300;A;Mn;230;L;;;;;N;;;;;", "3400;<CJK, First>;Lo;0;L;;;;;N;;;;;", "4DBF;<CJK, Last>;Lo;0;L;0041;;;;N;;;;;");
    }

    private static void assertRejected(int line, String... lines) throws IOException
    {
        try
        {
            reader(lines).readAll();
            fail("Expected " + String.join(" / ", lines) + " to be rejected");
        }
        catch (UcdParseException e)
        {
            assertEquals(e.getMessage(), line, e.line());
            assertTrue(e.getMessage(), e.getMessage().startsWith("UnicodeData.txt:" + line + ": "));
        }
    }
}
