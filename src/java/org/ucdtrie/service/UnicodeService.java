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

import com.google.common.annotations.VisibleForTesting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.ucdtrie.config.DataTableStore;
import org.ucdtrie.db.CaseFolding;
import org.ucdtrie.db.GeneralCategory;
import org.ucdtrie.exceptions.InvalidCodepointException;
import org.ucdtrie.exceptions.TableException;
import org.ucdtrie.exceptions.TableStateException;
import org.ucdtrie.utils.FatalErrorHandler;
import org.ucdtrie.utils.UnicodeStabilityInspector;

/**
 * Process wide entry point. {@link #initialize} must be called exactly once before any query; the tables are then
 * read-only and every query may run concurrently without locking.
 *
 * Every {@link TableException} raised here goes through the {@link UnicodeStabilityInspector} before being rethrown.
 */
public final class UnicodeService
{
    private static final Logger logger = LoggerFactory.getLogger(UnicodeService.class);

    private static final Object lock = new Object();

    private static volatile UnicodeTables tables;
    /** Set by the first initialization attempt, successful or not. Guarded by {@code lock}. */
    private static boolean initializing = false;
    private static volatile UnicodeStabilityInspector inspector;

    private UnicodeService() {}

    public static void initialize()
    {
        initialize(null);
    }

    public static void initialize(FatalErrorHandler handler)
    {
        initialize(null, handler);
    }

    /**
     * Only one attempt is allowed: any later call fails, even when the first one failed.
     *
     * @param store the table source, or {@code null} for the one named by the configuration
     * @param handler the fatal error handler, or {@code null} for the one selected by the configuration
     */
    public static void initialize(DataTableStore store, FatalErrorHandler handler)
    {
        synchronized (lock)
        {
            UnicodeStabilityInspector current = UnicodeStabilityInspector.create(handler);
            if (initializing)
                throw current.propagate(new TableStateException(tables != null
                                                                ? "Unicode tables already initialized"
                                                                : "Unicode tables initialization already attempted and failed"));
            initializing = true;
            inspector = current;

            try
            {
                tables = UnicodeTables.load(store != null ? store : DataTableStore.create());
            }
            catch (TableException e)
            {
                throw current.propagate(e);
            }
            logger.debug("Unicode service initialized with {}", current.handler().getClass().getSimpleName());
        }
    }

    /**
     * Initializes with the configured store and handler unless an attempt was already made.
     */
    public static void ensureInitialized()
    {
        synchronized (lock)
        {
            if (!initializing)
                initialize();
        }
    }

    public static boolean isInitialized()
    {
        return tables != null;
    }

    public static boolean isValidCodepoint(int cv)
    {
        return UnicodeTables.isValidCodepoint(cv);
    }

    public static int classify(int cv)
    {
        UnicodeTables t = tables();
        try
        {
            return t.classify(cv);
        }
        catch (TableException e)
        {
            throw inspector.propagate(e);
        }
    }

    public static GeneralCategory category(int cv)
    {
        UnicodeTables t = tables();
        try
        {
            return t.category(cv);
        }
        catch (TableException e)
        {
            throw inspector.propagate(e);
        }
    }

    /**
     * @throws InvalidCodepointException if {@code cv} fails {@link #isValidCodepoint}
     */
    public static CaseFolding foldCase(int cv)
    {
        UnicodeTables t = tables();
        try
        {
            return t.foldCase(cv);
        }
        catch (TableException e)
        {
            throw inspector.propagate(e);
        }
    }

    /**
     * @return the published tables
     * @throws TableStateException if the service is not initialized
     */
    public static UnicodeTables tables()
    {
        UnicodeTables t = tables;
        if (t == null)
        {
            UnicodeStabilityInspector current = inspector;
            if (current == null)
                current = UnicodeStabilityInspector.create(null);
            throw current.propagate(new TableStateException("Unicode tables queried before initialization"));
        }
        return t;
    }

    @VisibleForTesting
    static void reset()
    {
        synchronized (lock)
        {
            tables = null;
            inspector = null;
            initializing = false;
        }
    }
}
