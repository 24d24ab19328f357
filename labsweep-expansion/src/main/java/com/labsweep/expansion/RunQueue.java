package com.labsweep.expansion;

import java.util.Map;

/** Receives one flat parameter set per planned run, in run order. */
@FunctionalInterface
public interface RunQueue {

    void submit(Map<String, Object> parameters);
}
