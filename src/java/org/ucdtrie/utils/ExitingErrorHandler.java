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

import java.util.concurrent.atomic.AtomicBoolean;

import com.google.common.annotations.VisibleForTesting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.ucdtrie.exceptions.TableException;

/**
 * Terminates the JVM on the first fatal table error, after logging it.
 */
public class ExitingErrorHandler implements FatalErrorHandler
{
    private static final Logger logger = LoggerFactory.getLogger(ExitingErrorHandler.class);

    public static final int EXIT_STATUS = 100;

    private final AtomicBoolean exiting = new AtomicBoolean();

    @Override
    public void handleFatalError(TableException error)
    {
        logger.error("Unicode tables determined to be unusable. Exiting forcefully due to:", error);
        if (exiting.compareAndSet(false, true))
            exit(EXIT_STATUS);
    }

    @VisibleForTesting
    protected void exit(int status)
    {
        System.exit(status);
    }
}
