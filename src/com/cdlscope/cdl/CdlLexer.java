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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import com.cdlscope.util.function.InputStreamSupplier;

/**
 * Splits CDL text into logical lines. A physical line whose first non-blank
 * character is '+' continues the previous line; continuations are joined with
 * single spaces. Inline comments (from the first '*') are removed from the
 * content of every line that is not itself a comment.
 *
 * The source is opened anew by every call to {@link #tokenize()}, so a lexer
 * can be traversed any number of times.
 */
public class CdlLexer {

    private final InputStreamSupplier source;

    private final String sourceName;

    public CdlLexer(Path fileName) {
        this(InputStreamSupplier.fromPath(fileName), fileName.toString());
    }

    public CdlLexer(InputStreamSupplier source, String sourceName) {
        this.source = source;
        this.sourceName = sourceName;
    }

    public static CdlLexer fromString(String text) {
        return new CdlLexer(InputStreamSupplier.fromString(text), "<string>");
    }

    public String getSourceName() {
        return sourceName;
    }

    /**
     * Opens the source and returns a lazy iterator over its logical lines. The
     * underlying reader is closed when the iterator is exhausted or closed.
     * @return A new token iterator
     */
    public TokenIterator tokenize() {
        try {
            return new TokenIterator(new BufferedReader(new InputStreamReader(source.get(), StandardCharsets.UTF_8)));
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Could not open CDL source: " + sourceName, e);
        }
    }

    /**
     * Reads every logical line of the source into memory.
     * @return All tokens in file order
     */
    public List<CdlToken> readAllTokens() {
        List<CdlToken> tokens = new ArrayList<>();
        try (TokenIterator it = tokenize()) {
            while (it.hasNext()) {
                tokens.add(it.next());
            }
        }
        return tokens;
    }

    /**
     * Builds the token for one group of physical lines, the first of which is
     * not a continuation.
     * @param lineNumber Line number of the first physical line
     * @param lines The physical lines, without line terminators
     * @return The logical line token
     */
    static CdlToken makeToken(int lineNumber, List<String> lines) {
        String joined;
        String raw;
        if (lines.size() == 1) {
            joined = lines.get(0);
            raw = joined;
        } else {
            joined = joinContinuation(lines);
            raw = String.join("\n", lines);
        }
        CdlLineType type = CdlLineType.classify(joined);
        String content = type == CdlLineType.COMMENT ? joined.strip() : stripComment(joined);
        return new CdlToken(lineNumber, type, content, raw);
    }

    private static String joinContinuation(List<String> lines) {
        StringBuilder sb = new StringBuilder(lines.get(0).stripTrailing());
        for (int i = 1; i < lines.size(); i++) {
            String cont = lines.get(i).stripLeading().substring(1).stripLeading();
            sb.append(' ').append(cont);
        }
        return sb.toString();
    }

    /**
     * Cuts a line at its first '*' and removes trailing whitespace.
     * @param line The line text
     * @return The content before the comment
     */
    static String stripComment(String line) {
        int idx = line.indexOf('*');
        if (idx >= 0) {
            line = line.substring(0, idx);
        }
        return line.stripTrailing();
    }

    private static boolean isContinuation(String line) {
        return line.stripLeading().startsWith("+");
    }

    /**
     * Lazy token sequence over one opening of the source.
     */
    public static final class TokenIterator implements Iterator<CdlToken>, AutoCloseable {

        private final BufferedReader reader;

        /** Physical line read ahead while collecting continuations */
        private String pending;

        private int lineCount;

        private CdlToken next;

        private boolean closed;

        private TokenIterator(BufferedReader reader) {
            this.reader = reader;
        }

        private String readLine() throws IOException {
            String line = reader.readLine();
            if (line != null) lineCount++;
            return line;
        }

        private CdlToken advance() throws IOException {
            String first = pending;
            pending = null;
            if (first == null) {
                first = readLine();
                if (first == null) return null;
            }
            // the look-ahead line, when used, is the last one counted
            int lineNumber = lineCount;
            List<String> group = new ArrayList<>(1);
            group.add(first);
            String line;
            while ((line = readLine()) != null) {
                if (!isContinuation(line)) {
                    pending = line;
                    break;
                }
                group.add(line);
            }
            return makeToken(lineNumber, group);
        }

        @Override
        public boolean hasNext() {
            if (next != null) return true;
            if (closed) return false;
            try {
                next = advance();
            } catch (IOException e) {
                close();
                throw new UncheckedIOException("ERROR: Problem reading CDL source", e);
            }
            if (next == null) close();
            return next != null;
        }

        @Override
        public CdlToken next() {
            if (!hasNext()) throw new NoSuchElementException();
            CdlToken t = next;
            next = null;
            return t;
        }

        @Override
        public void close() {
            if (closed) return;
            closed = true;
            try {
                reader.close();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }
}
