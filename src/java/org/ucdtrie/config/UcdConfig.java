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
package org.ucdtrie.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Settings read from {@code ucdtrie.*} system properties.
 */
public final class UcdConfig
{
    private static final Logger logger = LoggerFactory.getLogger(UcdConfig.class);

    public static final String PROPERTY_PREFIX = "ucdtrie.";

    public static final String TABLE_STORE_PROPERTY = PROPERTY_PREFIX + "table_store";
    public static final String TABLE_RESOURCE_PROPERTY = PROPERTY_PREFIX + "table_resource";
    public static final String FATAL_ERROR_POLICY_PROPERTY = PROPERTY_PREFIX + "fatal_error_policy";

    public static final String DEFAULT_TABLE_RESOURCE = "org/ucdtrie/db/ucd-tables.properties";

    public enum FatalErrorPolicy
    {
        /** Log the error and rethrow it. */
        propagate,
        /** Log the error and terminate the JVM. */
        die
    }

    private UcdConfig() {}

    /**
     * @return the class name of the {@link DataTableStore} to use, or {@code null} for the bundled tables
     */
    public static String getTableStoreClass()
    {
        return System.getProperty(TABLE_STORE_PROPERTY);
    }

    public static String getTableResource()
    {
        return System.getProperty(TABLE_RESOURCE_PROPERTY, DEFAULT_TABLE_RESOURCE);
    }

    public static FatalErrorPolicy getFatalErrorPolicy()
    {
        String policy = System.getProperty(FATAL_ERROR_POLICY_PROPERTY);
        if (policy == null)
            return FatalErrorPolicy.propagate;

        try
        {
            return FatalErrorPolicy.valueOf(policy.trim().toLowerCase());
        }
        catch (IllegalArgumentException e)
        {
            logger.warn("Unknown {} '{}', using {}", FATAL_ERROR_POLICY_PROPERTY, policy, FatalErrorPolicy.propagate);
            return FatalErrorPolicy.propagate;
        }
    }
}
