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
package org.ucdtrie.utils;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.ucdtrie.config.UcdConfig;
import org.ucdtrie.exceptions.TableException;

/**
 * Single boundary through which every fatal table error passes.
 *
 * The inspector walks an error and its causes and hands each {@link TableException} to its handler. Callers then
 * rethrow; see {@link #propagate}.
 */
public final class UnicodeStabilityInspector
{
    private static final Logger logger = LoggerFactory.getLogger(UnicodeStabilityInspector.class);

    private final FatalErrorHandler handler;

    public UnicodeStabilityInspector(FatalErrorHandler handler)
    {
        this.handler = Preconditions.checkNotNull(handler);
    }

    /**
     * An inspector using {@code handler}, or the handler selected by the {@code fatal_error_policy} setting when it
     * is {@code null}.
     */
    public static UnicodeStabilityInspector create(@Nullable FatalErrorHandler handler)
    {
        return new UnicodeStabilityInspector(handler != null ? handler : defaultHandler());
    }

    public static FatalErrorHandler defaultHandler()
    {
        switch (UcdConfig.getFatalErrorPolicy())
        {
            case die:
                return new ExitingErrorHandler();
            case propagate:
            default:
                return new LoggingErrorHandler();
        }
    }

    public FatalErrorHandler handler()
    {
        return handler;
    }

    /**
     * Inspects the error recursively, handing every table error found to the handler.
     */
    public void inspectThrowable(Throwable error)
    {
        while (error != null)
        {
            if (logger.isTraceEnabled())
                logger.trace("Inspecting {}/{}", error.getClass(), error.getMessage(), error);

            if (error instanceof TableException)
                handler.handleFatalError((TableException) error);

            error = error.getCause();
        }
    }

    /**
     * Inspects a fatal error and returns it for the caller to throw: {@code throw inspector.propagate(e);}
     */
    public <T extends TableException> T propagate(T error)
    {
        inspectThrowable(error);
        return error;
    }
}
