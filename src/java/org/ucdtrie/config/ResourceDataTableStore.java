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

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.Map;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.ucdtrie.db.TableId;
import org.ucdtrie.exceptions.ConfigurationException;

/**
 * Reads the tables from a properties resource on the classpath, keyed by {@link TableId#property()}.
 *
 * Values are usually split over several lines with trailing backslashes; whitespace is removed before the value is
 * handed out. Keys that do not name a table are ignored.
 */
public class ResourceDataTableStore implements DataTableStore
{
    private static final Logger logger = LoggerFactory.getLogger(ResourceDataTableStore.class);

    private final String resource;
    private final Map<TableId, String> tables;

    public ResourceDataTableStore()
    {
        this(UcdConfig.getTableResource());
    }

    public ResourceDataTableStore(String resource)
    {
        this.resource = resource;
        this.tables = load(resource);
    }

    public String resource()
    {
        return resource;
    }

    @Override
    public String fetch(TableId id)
    {
        return tables.get(id);
    }

    private static Map<TableId, String> load(String resource)
    {
        ClassLoader loader = ResourceDataTableStore.class.getClassLoader();
        Properties properties = new Properties();
        try (InputStream in = loader.getResourceAsStream(resource))
        {
            if (in == null)
                throw new ConfigurationException("Table resource not found on the classpath: " + resource);

            try (Reader reader = new InputStreamReader(in, StandardCharsets.US_ASCII))
            {
                properties.load(reader);
            }
        }
        catch (IOException e)
        {
            throw new ConfigurationException("Unable to read table resource " + resource, e);
        }

        Map<TableId, String> tables = new EnumMap<>(TableId.class);
        for (String name : properties.stringPropertyNames())
        {
            TableId id = TableId.fromProperty(name);
            if (id == null)
            {
                logger.debug("Ignoring unknown property {} in {}", name, resource);
                continue;
            }
            tables.put(id, properties.getProperty(name).replaceAll("\\s+", ""));
        }
        logger.debug("Loaded {} tables from {}", tables.size(), resource);
        return tables;
    }
}
