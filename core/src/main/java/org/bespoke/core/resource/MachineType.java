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
package org.bespoke.core.resource;

import java.util.Locale;

import org.bespoke.core.config.ValidationException;

public enum MachineType {
    /** A long-lived machine shared by reference between test cases. */
    STATIC("static"),
    /** A machine provisioned per checkout; every test case gets its own copy. */
    TEMPLATE("template");

    private final String value;

    MachineType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * @throws ValidationException for anything other than {@code static} or {@code template}
     */
    public static MachineType fromValue(String value) {
        for (MachineType type : values()) {
            if (type.value.equals(value == null ? null : value.toLowerCase(Locale.ROOT))) {
                return type;
            }
        }
        throw new ValidationException("The machine type '" + value + "' is not supported!");
    }

    @Override
    public String toString() {
        return value;
    }
}
