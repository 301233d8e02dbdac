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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.jetbrains.annotations.Nullable;

import com.cdlscope.util.FileTools;
import com.cdlscope.util.MessageGenerator;
import com.cdlscope.util.NamePool;
import com.cdlscope.util.Params;
import com.cdlscope.util.RuntimeTracker;

/**
 * Reads a CDL netlist in two passes over the buffered token list: the first
 * collects every .SUBCKT definition, the second resolves instance lines against
 * them, so instances may precede the definition of their cell type. Line level
 * problems are collected rather than thrown; the parse fails at the end if any of
 * them is an error.
 */
public class CdlParser {

    private final NetNormalizer normalizer;

    private int progressInterval = Params.CDL_PROGRESS_INTERVAL;

    public CdlParser() {
        this(new NetNormalizer());
    }

    public CdlParser(NetClassificationConfig config) {
        this(new NetNormalizer(config));
    }

    public CdlParser(NetNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    public NetNormalizer getNormalizer() {
        return normalizer;
    }

    /**
     * @param progressInterval Number of tokens between two progress callbacks
     */
    public void setProgressInterval(int progressInterval) {
        if (progressInterval < 1) {
            throw new IllegalArgumentException("Progress interval must be positive, got " + progressInterval);
        }
        this.progressInterval = progressInterval;
    }

    public ParsedDesign parse(Path fileName) {
        return parse(fileName, null);
    }

    /**
     * Parses a CDL file (optionally gzipped). The design is named after the file.
     * @param fileName The CDL file
     * @param listener Optional progress listener
     * @return The parsed design, possibly with warnings
     * @throws CdlParseException if any line level error was found
     */
    public ParsedDesign parse(Path fileName, @Nullable ParseProgressListener listener) {
        FileTools.errorIfFileDoesNotExist(fileName);
        return parse(new CdlLexer(fileName), FileTools.getBaseName(fileName), listener);
    }

    /**
     * Parses CDL text held in memory.
     * @param text The netlist text
     * @param designName Name given to the resulting design
     * @return The parsed design
     */
    public ParsedDesign parseString(String text, String designName) {
        return parse(CdlLexer.fromString(text), designName, null);
    }

    public ParsedDesign parse(CdlLexer lexer, String designName, @Nullable ParseProgressListener listener) {
        RuntimeTracker total = new RuntimeTracker("Parse " + designName);
        total.start();

        RuntimeTracker t = total.startChild("Read tokens");
        List<CdlToken> tokens = lexer.readAllTokens();
        t.stop();

        List<ParseIssue> issues = new ArrayList<>();

        t = total.startChild("Subcircuits");
        SubcircuitParser subcktParser = new SubcircuitParser();
        collectSubcircuits(tokens, subcktParser, issues, listener);
        Map<String, SubcircuitDefinition> definitions = subcktParser.getAllDefinitions();
        t.stop();

        t = total.startChild("Instances");
        InstanceParser instParser = new InstanceParser(new NamePool());
        Map<String, CellInstance> instances = collectInstances(tokens, definitions, instParser, issues, listener);
        t.stop();

        t = total.startChild("Nets");
        Map<String, NetInfo> nets = new LinkedHashMap<>();
        for (CellInstance inst : instances.values()) {
            for (String netName : inst.getNetNames()) {
                if (!nets.containsKey(netName)) {
                    nets.put(netName, normalizer.normalize(netName));
                }
            }
        }
        t.stop();
        total.stop();

        List<ParseIssue> errors = new ArrayList<>();
        for (ParseIssue issue : issues) {
            if (issue.isError()) errors.add(issue);
        }
        if (!errors.isEmpty()) {
            StringBuilder sb = new StringBuilder("Failed to parse " + lexer.getSourceName() + ":");
            for (ParseIssue e : errors) {
                sb.append('\n').append(e);
            }
            throw new CdlParseException(sb.toString());
        }

        ParsedDesign design = new ParsedDesign(designName, definitions, instances, nets, issues);
        if (Params.CDL_VERBOSE) {
            printSummary(design, total);
        }
        return design;
    }

    private void collectSubcircuits(List<CdlToken> tokens, SubcircuitParser subcktParser,
            List<ParseIssue> issues, @Nullable ParseProgressListener listener) {
        int size = tokens.size();
        for (int i = 0; i < size; i++) {
            reportProgress(listener, i, size);
            CdlToken token = tokens.get(i);
            try {
                if (token.getType() == CdlLineType.SUBCKT) {
                    subcktParser.parseSubcktLine(token);
                } else if (token.getType() == CdlLineType.ENDS) {
                    subcktParser.parseEndsLine(token);
                }
            } catch (CdlParseException e) {
                issues.add(ParseIssue.error(token.getLineNumber(), e.getDetail()));
            }
        }
        try {
            subcktParser.validateComplete();
        } catch (CdlParseException e) {
            issues.add(ParseIssue.error(CdlParseException.NO_LINE, e.getDetail()));
        }
    }

    private Map<String, CellInstance> collectInstances(List<CdlToken> tokens,
            Map<String, SubcircuitDefinition> definitions, InstanceParser instParser,
            List<ParseIssue> issues, @Nullable ParseProgressListener listener) {
        Map<String, CellInstance> instances = new LinkedHashMap<>();
        List<String> duplicates = new ArrayList<>();
        int size = tokens.size();
        for (int i = 0; i < size; i++) {
            reportProgress(listener, i, size);
            CdlToken token = tokens.get(i);
            if (token.getType() != CdlLineType.INSTANCE) continue;
            try {
                CellInstance inst = instParser.parseInstanceLine(token, definitions);
                if (instances.put(inst.getName(), inst) != null) {
                    duplicates.add("Line " + token.getLineNumber() + ": Duplicate instance name '"
                            + inst.getName() + "', the later definition replaces the earlier one");
                }
            } catch (CdlParseException e) {
                issues.add(ParseIssue.error(token.getLineNumber(), e.getDetail()));
            }
        }
        for (String w : instParser.getWarnings()) {
            issues.add(ParseIssue.warning(w));
        }
        for (String w : duplicates) {
            issues.add(ParseIssue.warning(w));
        }
        return instances;
    }

    private void reportProgress(@Nullable ParseProgressListener listener, int processed, int total) {
        if (listener != null && processed % progressInterval == 0) {
            listener.onProgress(processed, total);
        }
    }

    private static void printSummary(ParsedDesign design, RuntimeTracker tracker) {
        MessageGenerator.printHeader("CDL: " + design.getName());
        MessageGenerator.briefMessage(design.toString());
        MessageGenerator.briefMessage(tracker.toTreeString());
        for (ParseIssue w : design.getWarnings()) {
            MessageGenerator.warning(w.toString());
        }
    }
}
