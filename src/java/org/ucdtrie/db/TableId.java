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
package org.ucdtrie.db;

/**
 * Identifiers of the embedded data tables.
 */
public enum TableId
{
    /** Case folding index trie for U+0000..U+FFFF. */
    CASE_LOWER    (100, "case.lower"),
    /** Case folding index trie for U+10000..U+1FFFF. */
    CASE_UPPER    (101, "case.upper"),
    /** Codepoint sequences referenced from both case folding tries. */
    CASE_DATA     (102, "case.data"),

    /** Categories of U+0000..U+00FF. */
    GCAT_CORE     (200, "gcat.core"),
    /** General category trie for U+0100..U+FFFF. */
    GCAT_GEN_LOW  (201, "gcat.gen.low"),
    /** General category trie for U+10000..U+1FFFF. */
    GCAT_GEN_HIGH (202, "gcat.gen.high"),
    /** Two bits per codepoint selecting Lo, Ll or So in U+0100..U+1FFFF. */
    GCAT_BITMAP   (203, "gcat.bitmap"),
    /** Sorted range records for U+20000 and above. */
    GCAT_ASTRAL   (204, "gcat.astral");

    public static final TableId[] VALUES = values();

    /** The numeric key, stable across releases. */
    private final int key;
    /** The property name in a bundled table resource. */
    private final String property;

    TableId(int key, String property)
    {
        this.key = key;
        this.property = property;
    }

    public int key()
    {
        return key;
    }

    public String property()
    {
        return property;
    }

    /**
     * @return the table with the given numeric key, or {@code null} if the key is not recognized
     */
    public static TableId fromKey(int key)
    {
        for (TableId id : VALUES)
        {
            if (id.key == key)
                return id;
        }
        return null;
    }

    /**
     * @return the table with the given property name, or {@code null} if the name is not recognized
     */
    public static TableId fromProperty(String property)
    {
        for (TableId id : VALUES)
        {
            if (id.property.equals(property))
                return id;
        }
        return null;
    }
}
