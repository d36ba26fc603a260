package com.contextflow.core.context;

import java.util.List;
import java.util.Set;

/**
 * Immutable per-context configuration: the phase template synthesized for the
 * context, its base timeout, its predecessor contexts and whether it may run
 * concurrently with other parallel-safe contexts.
 *
 * @param context             the context this profile describes
 * @param primaryFunction     capability name (e.g. "quality_assurance")
 * @param phaseName           name given to synthesized phases
 * @param phaseDescription    description given to synthesized phases
 * @param inputs              input keys of synthesized phases
 * @param outputs             output keys of synthesized phases
 * @param qualityGates        quality gates of synthesized phases
 * @param baseTimeoutSeconds  timeout before complexity scaling
 * @param predecessors        contexts whose phases must finish first
 * @param parallelSafe        true when phases may share a parallel group
 * @param order               position in the logical phase order
 */
public record ContextProfile(
    ContextType context,
    String primaryFunction,
    String phaseName,
    String phaseDescription,
    List<String> inputs,
    List<String> outputs,
    List<String> qualityGates,
    int baseTimeoutSeconds,
    Set<ContextType> predecessors,
    boolean parallelSafe,
    int order
) {

    public ContextProfile {
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
        qualityGates = List.copyOf(qualityGates);
        predecessors = Set.copyOf(predecessors);
    }

    public ContextProfile withBaseTimeout(int seconds) {
        return new ContextProfile(context, primaryFunction, phaseName, phaseDescription, inputs, outputs,
                qualityGates, seconds, predecessors, parallelSafe, order);
    }
}
