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
package org.ucdtrie.tools;

/**
 * Kinds of table the generator can produce, and the UCD file each is built from.
 */
public enum TableKind
{
    /** Case folding tries and data, from CaseFolding.txt. */
    CASE("case", true),
    /** General category tries, from UnicodeData.txt. */
    GENCHAR("genchar", false),
    ASTRAL("astral", false),
    CORE("core", false),
    BITMAP("bitmap", false),
    /** Surrogate and private use ranges; only printable in pretty form. */
    REMAINDER("remainder", false);

    private final String name;
    private final boolean caseFolding;

    TableKind(String name, boolean caseFolding)
    {
        this.name = name;
        this.caseFolding = caseFolding;
    }

    public String kindName()
    {
        return name;
    }

    /**
     * @return true if built from CaseFolding.txt rather than UnicodeData.txt
     */
    public boolean fromCaseFolding()
    {
        return caseFolding;
    }

    public static TableKind fromName(String name)
    {
        for (TableKind kind : values())
        {
            if (kind.name.equals(name))
                return kind;
        }
        throw new IllegalArgumentException("Unknown table kind '" + name + "'");
    }
}
