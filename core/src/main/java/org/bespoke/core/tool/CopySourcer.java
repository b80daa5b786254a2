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
package org.bespoke.core.tool;

import static com.google.common.base.Preconditions.checkNotNull;

/** Copies a tool from its source location into the local tools directory. */
public abstract class CopySourcer {

    protected final String source;
    protected final String destination;
    private boolean copied;

    protected CopySourcer(String source, String destination) {
        this.source = checkNotNull(source, "source");
        this.destination = checkNotNull(destination, "destination");
    }

    public final void copy() throws CopyException {
        doCopy();
        copied = true;
    }

    protected abstract void doCopy() throws CopyException;

    public boolean wasCopied() {
        return copied;
    }

    public String getSource() {
        return source;
    }

    public String getDestination() {
        return destination;
    }
}
