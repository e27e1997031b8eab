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

import java.util.HashMap;
import java.util.Map;

import com.google.common.collect.ImmutableMap;

/**
 * The 30 Unicode general categories.
 *
 * Each category is encoded on 16 bits, the ASCII code of its uppercase letter in the most significant byte and the
 * ASCII code of its lowercase letter in the least significant byte; {@code Lu} is {@code 0x4C75}. This is the form
 * stored in the data tables and returned by the classifier.
 */
public enum GeneralCategory
{
    Lu("Uppercase letter"),
    Ll("Lowercase letter"),
    Lt("Titlecase digraph"),
    Lm("Modifier letter"),
    Lo("Other letter"),

    Mn("Nonspacing mark"),
    Mc("Spacing mark"),
    Me("Enclosing mark"),

    Nd("Decimal digit"),
    Nl("Letter-like numeric"),
    No("Other numeric"),

    Pc("Connector punctuation"),
    Pd("Dash punctuation"),
    Ps("Opening punctuation"),
    Pe("Closing punctuation"),
    Pi("Initial quotation mark"),
    Pf("Final quotation mark"),
    Po("Other punctuation"),

    Sm("Math symbol"),
    Sc("Currency symbol"),
    Sk("Modifier symbol"),
    So("Other symbol"),

    Zs("Space character"),
    Zl("Line separator"),
    Zp("Paragraph separator"),

    Cc("Control code"),
    Cf("Format control code"),
    Cs("Surrogate"),
    Co("Private use"),
    Cn("Reserved or unassigned");

    private static final Map<Integer, GeneralCategory> BY_CODE;

    static
    {
        Map<Integer, GeneralCategory> byCode = new HashMap<>();
        for (GeneralCategory category : values())
            byCode.put(category.code, category);
        BY_CODE = ImmutableMap.copyOf(byCode);
    }

    private final int code;
    private final String description;
    private final CategoryGroup group;

    GeneralCategory(String description)
    {
        this.code = encode(name());
        this.description = description;
        this.group = CategoryGroup.of(code);
    }

    /**
     * The 16-bit encoded form.
     */
    public int code()
    {
        return code;
    }

    public String abbreviation()
    {
        return name();
    }

    public String description()
    {
        return description;
    }

    public CategoryGroup group()
    {
        return group;
    }

    /**
     * Whether the category is one of Lu, Ll and Lt, the "LC" pseudo-group.
     */
    public boolean isCasedLetter()
    {
        return this == Lu || this == Ll || this == Lt;
    }

    /**
     * Returns the category with the given 16-bit code, or {@code null} if there is none.
     */
    public static GeneralCategory fromCode(int code)
    {
        return BY_CODE.get(code);
    }

    /**
     * Returns the category with the given two letter abbreviation.
     *
     * @throws IllegalArgumentException if the abbreviation is not a known category
     */
    public static GeneralCategory fromAbbreviation(String abbreviation)
    {
        GeneralCategory category = fromCode(encode(abbreviation));
        if (category == null)
            throw new IllegalArgumentException("Unknown general category: " + abbreviation);
        return category;
    }

    /**
     * Encodes an uppercase ASCII letter followed by a lowercase ASCII letter into its 16-bit form.
     *
     * @throws IllegalArgumentException if the abbreviation does not have that shape
     */
    public static int encode(String abbreviation)
    {
        if (abbreviation.length() != 2
            || abbreviation.charAt(0) < 'A' || abbreviation.charAt(0) > 'Z'
            || abbreviation.charAt(1) < 'a' || abbreviation.charAt(1) > 'z')
            throw new IllegalArgumentException("Invalid category abbreviation: " + abbreviation);
        return (abbreviation.charAt(0) << 8) | abbreviation.charAt(1);
    }

    /**
     * Renders a 16-bit code back into its two letters, whether or not it is a known category.
     */
    public static String decode(int code)
    {
        return new String(new char[]{ (char) ((code >> 8) & 0xFF), (char) (code & 0xFF) });
    }
}
