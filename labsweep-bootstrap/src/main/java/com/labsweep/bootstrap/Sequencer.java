package com.labsweep.bootstrap;

import com.labsweep.config.SweepConfig;
import com.labsweep.expansion.DepthFoldExpander;
import com.labsweep.expansion.RunQueue;
import com.labsweep.expansion.RunSpec;
import com.labsweep.expansion.RunSpecJson;
import com.labsweep.expansion.SweepDispatcher;
import com.labsweep.expansion.SweepExpander;
import com.labsweep.expansion.TreeSweepExpander;
import com.labsweep.expression.ExpressionEvaluator;
import com.labsweep.expression.FunctionRegistry;
import com.labsweep.sequence.SequenceFileLoader;
import com.labsweep.sequence.SequenceSerializer;
import com.labsweep.sequence.SequenceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * One sweep editing session: a store plus the serializer, file loader, evaluator and expander
 * configured from a {@link SweepConfig}. Not thread-safe.
 */
public final class Sequencer {

    private static final Logger log = LoggerFactory.getLogger(Sequencer.class);

    private final SweepConfig config;
    private final SequenceStore store;
    private final SequenceSerializer serializer;
    private final SequenceFileLoader fileLoader;
    private final ExpressionEvaluator evaluator;
    private final SweepExpander expander;

    private Sequencer(SweepConfig config, FunctionRegistry registry) {
        this.config = config;
        this.store = new SequenceStore(config.getMaxDepth());
        this.serializer = new SequenceSerializer(config.getAllowedParameters());
        this.fileLoader = new SequenceFileLoader(serializer, Path.of(config.getSequenceDir()));
        this.evaluator = new ExpressionEvaluator(registry, config.getMaxValuesPerExpression());
        this.expander = switch (config.getExpander()) {
            case FOLD -> new DepthFoldExpander(evaluator, config.getParameterNames());
            case TREE -> new TreeSweepExpander(evaluator, config.getParameterNames());
        };
    }

    /** Sequencer configured from environment variables. */
    public static Sequencer fromEnvironment() {
        log.info("Sequencer: loading configuration from environment");
        return create(SweepConfig.fromEnvironment());
    }

    /** Sequencer with the standard function set. */
    public static Sequencer create(SweepConfig config) {
        return create(config, FunctionRegistry.standard());
    }

    /** @param registry the only functions and constants expressions may use */
    public static Sequencer create(SweepConfig config, FunctionRegistry registry) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(registry, "registry");
        Sequencer sequencer = new Sequencer(config, registry);
        log.info("Sequencer ready | maxDepth={} | maxValuesPerExpression={} | expander={} | sequenceDir={} | allowedParameters={}",
                config.getMaxDepth(), config.getMaxValuesPerExpression(), config.getExpander(),
                config.getSequenceDir(), config.getAllowedParameters().size());
        return sequencer;
    }

    public SweepConfig getConfig() {
        return config;
    }

    public SequenceStore getStore() {
        return store;
    }

    public ExpressionEvaluator getEvaluator() {
        return evaluator;
    }

    public SweepExpander getExpander() {
        return expander;
    }

    /** Loads sequence text; see {@link SequenceSerializer#load}. */
    public void load(String text, boolean append) {
        serializer.load(store, text, append);
    }

    /** Loads a sequence file, resolving relative names against the sequence directory. */
    public void loadFile(String fileName, boolean append) {
        fileLoader.load(store, fileName, append);
    }

    public String save() {
        return serializer.save(store);
    }

    /** @return the file written */
    public Path saveFile(String fileName) {
        return fileLoader.save(store, fileName);
    }

    public List<RunSpec> expand() {
        return expander.expand(store);
    }

    /** Expanded sweep as JSON; see {@link RunSpecJson}. */
    public String expandToJson() {
        return RunSpecJson.toJson(expand());
    }

    /** Expands and submits every run to {@code queue}; nothing is submitted if any expression fails. */
    public List<RunSpec> dispatch(RunQueue queue) {
        return new SweepDispatcher(expander, queue).dispatch(store);
    }
}
