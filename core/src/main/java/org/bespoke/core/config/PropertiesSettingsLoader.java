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
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package org.bespoke.core.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Enumeration;
import java.util.Map;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Maps;

/** Loads {@link BespokeSettings} from a {@code .properties} file. */
public class PropertiesSettingsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(PropertiesSettingsLoader.class);

    private final Path propertiesPath;

    public PropertiesSettingsLoader(Path propertiesPath) {
        this.propertiesPath = propertiesPath;
    }

    /**
     * @throws ValidationException if the file cannot be read
     */
    public Map<String, String> load() {
        Properties props = new Properties();
        try (InputStream resource = Files.newInputStream(propertiesPath)) {
            props.load(resource);
        } catch (IOException e) {
            LOG.warn("Failed to load properties file from " + propertiesPath, e);
            throw new ValidationException("Unable to read settings file: " + e.getMessage(), propertiesPath.toString(), e);
        }

        Map<String, String> result = Maps.newLinkedHashMap();
        for (Enumeration<?> iter = props.propertyNames(); iter.hasMoreElements(); ) {
            String key = (String) iter.nextElement();
            result.put(key, props.getProperty(key));
        }
        LOG.debug("Loaded {} settings from {}", result.size(), propertiesPath);
        return result;
    }

    public BespokeSettings loadSettings() {
        Map<String, String> properties = load();
        try {
            return BespokeSettings.fromProperties(properties);
        } catch (ValidationException e) {
            throw new ValidationException(e.getMessage(), propertiesPath.toString(), e);
        }
    }

}
