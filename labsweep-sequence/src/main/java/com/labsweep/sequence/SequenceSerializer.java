package com.labsweep.sequence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and writes the line-oriented sequence format:
 * <pre>
 * - "Voltage", "[1, 2]"
 * -- "Frequency", "linspace(10, 100, 10)"
 * </pre>
 * The number of dashes is the node level plus one. Lines that do not contain the pattern are skipped;
 * a line that does contain it is authoritative. Loading is all-or-nothing: the store is only touched
 * after the whole text has been validated.
 */
public final class SequenceSerializer {

    private static final Logger log = LoggerFactory.getLogger(SequenceSerializer.class);

    private static final Pattern LINE = Pattern.compile("(-+) \"(.*?)\", \"(.*?)\"", Pattern.DOTALL);
    /** Only CR, LF and CRLF end a line; other Unicode separators are field content. */
    private static final Pattern LINE_BREAK = Pattern.compile("\r\n|\r|\n");

    private final Set<String> allowedParameters;

    /** Serializer that accepts any parameter name. */
    public SequenceSerializer() {
        this(List.of());
    }

    /** @param allowedParameters accepted parameter names on load; empty accepts any */
    public SequenceSerializer(Collection<String> allowedParameters) {
        this.allowedParameters = Collections.unmodifiableSet(new LinkedHashSet<>(allowedParameters));
    }

    public Set<String> getAllowedParameters() {
        return allowedParameters;
    }

    /**
     * Parses and validates {@code text} without touching any store.
     *
     * @param maxDepth deepest level allowed is {@code maxDepth - 1}
     * @throws SequenceFormatException      on a level jump, a first node not at level 0, an unrepresentable field or excessive depth
     * @throws ParameterValidationException on a parameter outside the allowed set
     */
    public List<SequenceEntry> parse(String text, int maxDepth) {
        List<SequenceEntry> entries = new ArrayList<>();
        String[] lines = LINE_BREAK.split(text, -1);
        int previousLevel = -1;
        for (int i = 0; i < lines.length; i++) {
            int lineNumber = i + 1;
            String line = lines[i].strip();
            Matcher m = LINE.matcher(line);
            if (!m.find()) {
                if (!line.isEmpty()) {
                    log.debug("Skipping line {} with no sequence entry: {}", lineNumber, line);
                }
                continue;
            }
            int level = m.group(1).length() - 1;
            String parameter = m.group(2);
            String expression = m.group(3);
            if (level > previousLevel + 1) {
                throw new SequenceFormatException(previousLevel < 0
                        ? "first entry must be at level 0 (one dash), found level " + level
                        : "level " + level + " follows level " + previousLevel + ", an intermediate level is missing",
                        lineNumber, line);
            }
            if (level >= maxDepth) {
                throw new SequenceFormatException("level " + level + " exceeds the maximum depth of " + maxDepth,
                        lineNumber, line);
            }
            if (parameter.indexOf('"') >= 0) {
                throw new SequenceFormatException("parameter name must not contain a double quote", lineNumber, line);
            }
            if (!allowedParameters.isEmpty() && !allowedParameters.contains(parameter)) {
                throw new ParameterValidationException(parameter, lineNumber);
            }
            entries.add(new SequenceEntry(level, parameter, expression));
            previousLevel = level;
        }
        return entries;
    }

    /**
     * Loads {@code text} into {@code store}. Without {@code append} the store's nodes are replaced;
     * with it the new nodes follow the existing forest as further roots. On failure the store is unchanged.
     */
    public void load(SequenceStore store, String text, boolean append) {
        List<SequenceEntry> entries;
        try {
            entries = parse(text, store.getMaxDepth());
        } catch (SequenceFormatException e) {
            log.warn("Sequence load rejected | line={} | {}", e.getLineNumber(), e.getMessage());
            throw e;
        } catch (ParameterValidationException e) {
            log.warn("Sequence load rejected | line={} | unknown parameter={}", e.getLineNumber(), e.getParameter());
            throw e;
        }
        if (!append) {
            store.clear();
        }
        SequenceNode[] parents = new SequenceNode[store.getMaxDepth()];
        for (SequenceEntry entry : entries) {
            SequenceNode parent = entry.level() == 0 ? null : parents[entry.level() - 1];
            parents[entry.level()] = store.add(entry.parameter(), entry.expression(), parent).node();
        }
        log.info("Sequence loaded | nodes={} | append={} | total={}", entries.size(), append, store.size());
    }

    /** One line per node in store order, each terminated by a line feed. */
    public String save(SequenceStore store) {
        StringBuilder sb = new StringBuilder();
        for (SequenceEntry entry : store.entries()) {
            sb.append(format(entry)).append('\n');
        }
        return sb.toString();
    }

    /** The file line for {@code entry}, without a line terminator. */
    public static String format(SequenceEntry entry) {
        return "-".repeat(entry.level() + 1) + " \"" + entry.parameter() + "\", \"" + entry.expression() + "\"";
    }
}
