// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.kotoba.language.dictionary.builder;

import ai.kotoba.language.dictionary.CharacterClass;
import ai.kotoba.language.dictionary.CharacterDefinition;
import ai.kotoba.language.dictionary.InvokeDefinitionMap;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds a character definition from the lines of a char.def file. The file has category definition lines
 * <pre>NAME INVOKE GROUP LENGTH</pre>
 * and mapping lines for a code unit or an inclusive range of them
 * <pre>0xXXXX CLASS [COMPATIBLE_CLASS ...]
 * 0xXXXX..0xYYYY CLASS [COMPATIBLE_CLASS ...]</pre>
 * Text from # to the end of the line is a comment.
 * Invalid lines are logged and skipped. Code units with no mapping get the DEFAULT class.
 */
public class CharacterDefinitionBuilder {

    private static final Logger log = Logger.getLogger(CharacterDefinitionBuilder.class.getName());

    private static final Pattern categoryDefinition = Pattern.compile("^(\\w+)\\s+(\\d+)\\s+(\\d+)\\s+(\\d+)");
    private static final Pattern categoryMapping = Pattern.compile("^0x([0-9A-Fa-f]{4})\\s+(.+)$");
    private static final Pattern rangeCategoryMapping = Pattern.compile("^0x([0-9A-Fa-f]{4})\\.\\.0x([0-9A-Fa-f]{4})\\s+(.+)$");

    private final List<CharacterClass> classes = new ArrayList<>();
    private final Set<String> classNames = new HashSet<>();
    private final List<Mapping> mappings = new ArrayList<>();

    /** Adds a line of char.def */
    public CharacterDefinitionBuilder putLine(String line) {
        int commentStart = line.indexOf('#');
        String content = (commentStart >= 0 ? line.substring(0, commentStart) : line).trim();
        if (content.isEmpty()) return this;

        Matcher matcher = categoryDefinition.matcher(content);
        if (matcher.find()) {
            putCategory(matcher, line);
            return this;
        }
        matcher = rangeCategoryMapping.matcher(content);
        if (matcher.matches()) {
            putMapping(Integer.parseInt(matcher.group(1), 16), Integer.parseInt(matcher.group(2), 16), matcher.group(3), line);
            return this;
        }
        matcher = categoryMapping.matcher(content);
        if (matcher.matches()) {
            int codeUnit = Integer.parseInt(matcher.group(1), 16);
            putMapping(codeUnit, codeUnit, matcher.group(2), line);
            return this;
        }
        log.warning("char.def parse error: Skipping unrecognized line '" + line + "'");
        return this;
    }

    private void putCategory(Matcher matcher, String line) {
        String name = matcher.group(1);
        int invoke, group, length;
        try {
            invoke = Integer.parseInt(matcher.group(2));
            group = Integer.parseInt(matcher.group(3));
            length = Integer.parseInt(matcher.group(4));
        }
        catch (NumberFormatException e) {
            log.warning("char.def parse error: Number out of range in '" + line + "'");
            return;
        }
        if (invoke != 0 && invoke != 1) {
            log.warning("char.def parse error: INVOKE must be 0 or 1 in '" + line + "'");
            return;
        }
        if (group != 0 && group != 1) {
            log.warning("char.def parse error: GROUP must be 0 or 1 in '" + line + "'");
            return;
        }
        if ( ! classNames.add(name)) {
            log.warning("char.def parse error: Class " + name + " is defined twice, skipping '" + line + "'");
            return;
        }
        if (classes.size() > 255) {
            log.warning("char.def parse error: Too many classes, skipping '" + line + "'");
            return;
        }
        classes.add(new CharacterClass(classes.size(), name, invoke == 1, group == 1, length));
    }

    private void putMapping(int start, int end, String classNames, String line) {
        if (end < start) {
            log.warning("char.def parse error: Empty range in '" + line + "'");
            return;
        }
        List<String> names = Arrays.asList(classNames.trim().split("\\s+"));
        mappings.add(new Mapping(start, end, names.get(0), names.subList(1, names.size()), line));
    }

    /**
     * Returns the character definition of the lines added.
     *
     * @throws IllegalArgumentException if there is no DEFAULT class
     */
    public CharacterDefinition build() {
        InvokeDefinitionMap invokeDefinitionMap = new InvokeDefinitionMap(classes);
        int defaultId = invokeDefinitionMap.lookup(CharacterDefinition.DEFAULT_CATEGORY);
        if (defaultId == InvokeDefinitionMap.NOT_FOUND)
            throw new IllegalArgumentException("char.def has no " + CharacterDefinition.DEFAULT_CATEGORY + " class");

        byte[] categories = new byte[CharacterDefinition.CODE_UNITS];
        boolean[] assigned = new boolean[CharacterDefinition.CODE_UNITS];
        int[] compatibleCategories = new int[CharacterDefinition.CODE_UNITS];
        for (Mapping mapping : mappings) {
            int classId = invokeDefinitionMap.lookup(mapping.className);
            if (classId == InvokeDefinitionMap.NOT_FOUND) {
                log.warning("char.def parse error: Undefined class " + mapping.className + " in '" + mapping.line + "'");
                continue;
            }
            int compatibleBits = compatibleBits(mapping, invokeDefinitionMap);
            for (int codeUnit = mapping.start; codeUnit <= mapping.end; codeUnit++) {
                categories[codeUnit] = (byte)classId;
                assigned[codeUnit] = true;
                compatibleCategories[codeUnit] |= compatibleBits;
            }
        }
        for (int codeUnit = 0; codeUnit < CharacterDefinition.CODE_UNITS; codeUnit++) {
            if ( ! assigned[codeUnit])
                categories[codeUnit] = (byte)defaultId;
        }
        return new CharacterDefinition(categories, compatibleCategories, invokeDefinitionMap);
    }

    private static int compatibleBits(Mapping mapping, InvokeDefinitionMap invokeDefinitionMap) {
        int bits = 0;
        for (String name : mapping.compatibleClassNames) {
            int classId = invokeDefinitionMap.lookup(name);
            if (classId == InvokeDefinitionMap.NOT_FOUND)
                log.warning("char.def parse error: Undefined compatible class " + name + " in '" + mapping.line + "'");
            else if (classId >= 32)
                log.warning("char.def parse error: Class " + name + " has id " + classId +
                            ", only the first 32 classes can be compatible classes");
            else
                bits |= 1 << classId;
        }
        return bits;
    }

    private static class Mapping {

        final int start;
        final int end;
        final String className;
        final List<String> compatibleClassNames;
        final String line;

        Mapping(int start, int end, String className, List<String> compatibleClassNames, String line) {
            this.start = start;
            this.end = end;
            this.className = className;
            this.compatibleClassNames = compatibleClassNames;
            this.line = line;
        }

    }

}
