/*
 * Copyright (C) 2015-2017 Jakub Galgonek   galgonek@uochb.cas.cz
 * Copyright (C) 2008-2009 Mark Rijnbeek    markr@ebi.ac.uk
 *
 * This program is free software; you can redistribute it and/or modify it under the terms of the GNU Lesser General
 * Public License as published by the Free Software Foundation; either version 2.1 of the License, or (at your option)
 * any later version. All we ask is that proper credit is given for our work, which includes - but is not limited to -
 * adding the above copyright notice to the beginning of your source code files, and to any copyright notice that you
 * may distribute with programs based on this work.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Lesser General Public License for more
 * details.
 */
package cz.iocb.chemname.engine;



/**
 * Data-dependency contract of a phase.
 */
@FunctionalInterface
public interface PhaseContract
{
    /**
     * Returns a description of the first unmet dependency, or null if the phase may run.
     */
    String checkDependencies(ContextState state);


    public static final PhaseContract NONE = state -> null;


    public static PhaseContract requiresPhase(ExecutionPhase phase)
    {
        return state -> state.isPhaseCompleted(phase) ? null : "phase " + phase.getLabel() + " is not complete";
    }


    public static PhaseContract requiresAtomicAnalysis()
    {
        return state -> state.getAtomicAnalysis() != null ? null : "atomic analysis is missing";
    }


    public static PhaseContract requiresFunctionalGroups()
    {
        return state -> !state.getFunctionalGroups().isEmpty() ? null : "functional groups must be non-empty";
    }


    public static PhaseContract requiresParentStructure()
    {
        return state -> state.getParentStructure() != null ? null : "no parent structure was selected";
    }


    public static PhaseContract requiresNumbering()
    {
        return state -> state.getNumbering() != null ? null : "parent structure is not numbered";
    }


    default PhaseContract and(PhaseContract other)
    {
        return state -> {
            String message = checkDependencies(state);
            return message != null ? message : other.checkDependencies(state);
        };
    }


    /**
     * Returns the contract of a phase as run by the engine.
     */
    public static PhaseContract forPhase(ExecutionPhase phase)
    {
        switch(phase)
        {
            case ATOMIC_ANALYSIS:
                return NONE;
            case FUNCTIONAL_GROUPS:
            case NOMENCLATURE_METHOD:
            case PARENT_SELECTION:
                return requiresPhase(phase.getPredecessor()).and(requiresAtomicAnalysis());
            case NUMBERING:
                return requiresPhase(phase.getPredecessor()).and(requiresParentStructure());
            case ASSEMBLY:
                return requiresPhase(phase.getPredecessor()).and(requiresParentStructure()).and(requiresNumbering());
            default:
                return NONE;
        }
    }
}
