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
 * The 7 groups the general categories fall into. A category code belongs to the group whose code equals its most
 * significant byte, see {@link #of(int)}.
 *
 * The "LC" cased letter pseudo-group is not one of these; use {@link GeneralCategory#isCasedLetter()}.
 */
public enum CategoryGroup
{
    LETTER     ('L', "Letters"),
    MARK       ('M', "Combining marks"),
    NUMBER     ('N', "Numbers"),
    PUNCTUATION('P', "Punctuation"),
    SYMBOL     ('S', "Symbols"),
    SEPARATOR  ('Z', "Separators"),
    OTHER      ('C', "Other");

    public static final int MASK = 0xFF00;

    private static final CategoryGroup[] VALUES = values();

    private final int code;
    private final String description;

    CategoryGroup(char letter, String description)
    {
        this.code = letter << 8;
        this.description = description;
    }

    /**
     * The group code, the uppercase letter in the most significant byte and zero in the least significant one.
     */
    public int code()
    {
        return code;
    }

    public char letter()
    {
        return (char) (code >> 8);
    }

    public String description()
    {
        return description;
    }

    /**
     * Returns the group of a 16-bit category code, or {@code null} if its upper byte is not a group letter.
     */
    public static CategoryGroup of(int categoryCode)
    {
        int masked = categoryCode & MASK;
        for (CategoryGroup group : VALUES)
        {
            if (group.code == masked)
                return group;
        }
        return null;
    }
}
