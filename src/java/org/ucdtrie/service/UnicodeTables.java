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

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.ucdtrie.config.DataTableStore;
import org.ucdtrie.db.CaseFolding;
import org.ucdtrie.db.GeneralCategory;
import org.ucdtrie.db.TableId;
import org.ucdtrie.db.tables.AstralRangeTable;
import org.ucdtrie.db.tables.CaseFolder;
import org.ucdtrie.db.tables.CategoryClassifier;
import org.ucdtrie.exceptions.ConfigurationException;
import org.ucdtrie.exceptions.InvalidCodepointException;
import org.ucdtrie.exceptions.TableException;
import org.ucdtrie.exceptions.TableIntegrityException;
import org.ucdtrie.io.tries.CompiledTrie;
import org.ucdtrie.io.util.Base64Words;

/**
 * Immutable handle over the decoded tables. Safe for use by any number of threads once published.
 */
public final class UnicodeTables
{
    private static final Logger logger = LoggerFactory.getLogger(UnicodeTables.class);

    public static final int MAX_CODEPOINT = 0x10FFFF;

    private final CategoryClassifier classifier;
    private final CaseFolder folder;

    public UnicodeTables(CategoryClassifier classifier, CaseFolder folder)
    {
        this.classifier = Preconditions.checkNotNull(classifier);
        this.folder = Preconditions.checkNotNull(folder);
    }

    /**
     * Fetches and decodes all tables from {@code store}.
     *
     * @throws ConfigurationException if the store does not supply one of the tables.
     * @throws TableException if a table is malformed.
     */
    public static UnicodeTables load(DataTableStore store)
    {
        long start = System.nanoTime();
        Map<TableId, char[]> words = new EnumMap<>(TableId.class);
        for (TableId id : TableId.VALUES)
        {
            String encoded = store.fetch(id);
            if (encoded == null)
                throw new ConfigurationException(String.format("Table %s (%d) is not available from %s", id.property(), id.key(), store.getClass().getName()));
            char[] decoded = Base64Words.decode(encoded);
            logger.debug("Decoded table {} into {} words", id.property(), decoded.length);
            words.put(id, decoded);
        }

        char[] bitmap = words.get(TableId.GCAT_BITMAP);
        if (bitmap.length != CategoryClassifier.BITMAP_SIZE)
            throw new TableIntegrityException(String.format("Bitmap table has %d words, expected %d", bitmap.length, CategoryClassifier.BITMAP_SIZE));

        CategoryClassifier classifier = new CategoryClassifier(words.get(TableId.GCAT_CORE),
                                                               bitmap,
                                                               trie(words, TableId.GCAT_GEN_LOW, CategoryClassifier.TRIE_DEPTH),
                                                               trie(words, TableId.GCAT_GEN_HIGH, CategoryClassifier.TRIE_DEPTH),
                                                               new AstralRangeTable(words.get(TableId.GCAT_ASTRAL)));
        CaseFolder folder = new CaseFolder(trie(words, TableId.CASE_LOWER, CaseFolder.TRIE_DEPTH),
                                           trie(words, TableId.CASE_UPPER, CaseFolder.TRIE_DEPTH),
                                           words.get(TableId.CASE_DATA));

        int total = 0;
        for (char[] table : words.values())
            total += table.length;
        logger.info("Loaded {} Unicode tables ({} words) in {} ms", words.size(), total, (System.nanoTime() - start) / 1_000_000);
        return new UnicodeTables(classifier, folder);
    }

    private static CompiledTrie trie(Map<TableId, char[]> words, TableId id, int depth)
    {
        return new CompiledTrie(id.property(), words.get(id), depth);
    }

    public static boolean isValidCodepoint(int cv)
    {
        return cv >= 0 && cv <= MAX_CODEPOINT && (cv < 0xD800 || cv > 0xDFFF);
    }

    /**
     * @return the category code of {@code cv}, Cn for anything unassigned or out of range
     */
    public int classify(int cv)
    {
        return classifier.classify(cv);
    }

    public GeneralCategory category(int cv)
    {
        int code = classify(cv);
        GeneralCategory category = GeneralCategory.fromCode(code);
        if (category == null)
            throw new TableIntegrityException(String.format("Unknown category code 0x%04x for U+%04X", code, cv));
        return category;
    }

    /**
     * @throws InvalidCodepointException if {@code cv} is not a valid codepoint
     */
    public CaseFolding foldCase(int cv)
    {
        if (!isValidCodepoint(cv))
            throw new InvalidCodepointException(cv);
        return folder.fold(cv);
    }

    public CategoryClassifier classifier()
    {
        return classifier;
    }

    public CaseFolder caseFolder()
    {
        return folder;
    }
}
