/*
 * Copyright (c) 2026, CDLScope Authors.
 * All rights reserved.
 *
 * This file is part of CDLScope.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */

package com.cdlscope.cdl;

/**
 * Receives periodic progress notifications from {@link CdlParser}. It is called
 * synchronously on the parsing thread; an exception thrown here aborts the parse.
 */
@FunctionalInterface
public interface ParseProgressListener {

    /**
     * @param processed Number of tokens handled so far in the current pass
     * @param total Total number of tokens in the file
     */
    void onProgress(int processed, int total);
}
