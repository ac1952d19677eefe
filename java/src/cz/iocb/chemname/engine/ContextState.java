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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import cz.iocb.chemname.analysis.AtomicAnalysis;
import cz.iocb.chemname.assembly.AssemblyState;
import cz.iocb.chemname.groups.FunctionalGroup;
import cz.iocb.chemname.molecule.Molecule;
import cz.iocb.chemname.numbering.Numbering;
import cz.iocb.chemname.parent.CascadeState;
import cz.iocb.chemname.parent.Chain;
import cz.iocb.chemname.parent.ParentStructure;
import cz.iocb.chemname.parent.RingSystem;



/**
 * Immutable snapshot of everything derived about a molecule during one naming session.
 */
public final class ContextState
{
    public static final class Builder
    {
        private Molecule molecule;
        private AtomicAnalysis atomicAnalysis;
        private List<FunctionalGroup> functionalGroups;
        private List<Chain> candidateChains;
        private List<RingSystem> candidateRings;
        private ParentStructure parentStructure;
        private Numbering numbering;
        private NomenclatureMethod nomenclatureMethod;
        private CascadeState cascade;
        private AssemblyState assembly;
        private String finalName;
        private Set<ExecutionPhase> completedPhases;
        private List<RuleConflict> conflicts;
        private List<TraceEntry> trace;


        private Builder(ContextState state)
        {
            molecule = state.molecule;
            atomicAnalysis = state.atomicAnalysis;
            functionalGroups = state.functionalGroups;
            candidateChains = state.candidateChains;
            candidateRings = state.candidateRings;
            parentStructure = state.parentStructure;
            numbering = state.numbering;
            nomenclatureMethod = state.nomenclatureMethod;
            cascade = state.cascade;
            assembly = state.assembly;
            finalName = state.finalName;
            completedPhases = state.completedPhases;
            conflicts = state.conflicts;
            trace = state.trace;
        }


        public Builder setAtomicAnalysis(AtomicAnalysis atomicAnalysis)
        {
            this.atomicAnalysis = atomicAnalysis;
            return this;
        }


        public Builder setFunctionalGroups(List<FunctionalGroup> functionalGroups)
        {
            this.functionalGroups = functionalGroups;
            return this;
        }


        public Builder setCandidateChains(List<Chain> candidateChains)
        {
            this.candidateChains = candidateChains;
            return this;
        }


        public Builder setCandidateRings(List<RingSystem> candidateRings)
        {
            this.candidateRings = candidateRings;
            return this;
        }


        Builder setParentStructure(ParentStructure parentStructure)
        {
            this.parentStructure = parentStructure;
            return this;
        }


        public Builder setNumbering(Numbering numbering)
        {
            this.numbering = numbering;
            return this;
        }


        public Builder setNomenclatureMethod(NomenclatureMethod nomenclatureMethod)
        {
            this.nomenclatureMethod = nomenclatureMethod;
            return this;
        }


        public Builder setCascade(CascadeState cascade)
        {
            this.cascade = cascade;
            return this;
        }


        public Builder setAssembly(AssemblyState assembly)
        {
            this.assembly = assembly;
            return this;
        }


        public Builder setFinalName(String finalName)
        {
            this.finalName = finalName;
            return this;
        }


        Builder addCompletedPhase(ExecutionPhase phase)
        {
            Set<ExecutionPhase> phases = EnumSet.noneOf(ExecutionPhase.class);
            phases.addAll(completedPhases);
            phases.add(phase);
            completedPhases = Collections.unmodifiableSet(phases);
            return this;
        }


        Builder addConflict(RuleConflict conflict)
        {
            List<RuleConflict> list = new ArrayList<RuleConflict>(conflicts);
            list.add(conflict);
            conflicts = Collections.unmodifiableList(list);
            return this;
        }


        Builder addTraceEntry(TraceEntry entry)
        {
            List<TraceEntry> list = new ArrayList<TraceEntry>(trace);
            list.add(entry);
            trace = Collections.unmodifiableList(list);
            return this;
        }


        public ContextState build()
        {
            return new ContextState(this);
        }
    }


    private final Molecule molecule;
    private final AtomicAnalysis atomicAnalysis;
    private final List<FunctionalGroup> functionalGroups;
    private final List<Chain> candidateChains;
    private final List<RingSystem> candidateRings;
    private final ParentStructure parentStructure;
    private final Numbering numbering;
    private final NomenclatureMethod nomenclatureMethod;
    private final CascadeState cascade;
    private final AssemblyState assembly;
    private final String finalName;
    private final Set<ExecutionPhase> completedPhases;
    private final List<RuleConflict> conflicts;
    private final List<TraceEntry> trace;


    ContextState(Molecule molecule)
    {
        if(molecule == null)
            throw new NullPointerException("molecule");

        this.molecule = molecule;
        this.atomicAnalysis = null;
        this.functionalGroups = Collections.emptyList();
        this.candidateChains = null;
        this.candidateRings = null;
        this.parentStructure = null;
        this.numbering = null;
        this.nomenclatureMethod = null;
        this.cascade = CascadeState.INITIAL;
        this.assembly = null;
        this.finalName = null;
        this.completedPhases = Collections.unmodifiableSet(EnumSet.noneOf(ExecutionPhase.class));
        this.conflicts = Collections.emptyList();
        this.trace = Collections.emptyList();
    }


    private ContextState(Builder builder)
    {
        molecule = builder.molecule;
        atomicAnalysis = builder.atomicAnalysis;
        functionalGroups = builder.functionalGroups == null ? Collections.emptyList() :
                Collections.unmodifiableList(new ArrayList<FunctionalGroup>(builder.functionalGroups));
        candidateChains = builder.candidateChains == null ? null :
                Collections.unmodifiableList(new ArrayList<Chain>(builder.candidateChains));
        candidateRings = builder.candidateRings == null ? null :
                Collections.unmodifiableList(new ArrayList<RingSystem>(builder.candidateRings));
        parentStructure = builder.parentStructure;
        numbering = builder.numbering;
        nomenclatureMethod = builder.nomenclatureMethod;
        cascade = builder.cascade;
        assembly = builder.assembly;
        finalName = builder.finalName;
        completedPhases = builder.completedPhases;
        conflicts = builder.conflicts;
        trace = builder.trace;
    }


    public Builder toBuilder()
    {
        return new Builder(this);
    }


    public Molecule getMolecule()
    {
        return molecule;
    }


    public AtomicAnalysis getAtomicAnalysis()
    {
        return atomicAnalysis;
    }


    public List<FunctionalGroup> getFunctionalGroups()
    {
        return functionalGroups;
    }


    public List<FunctionalGroup> getPrincipalGroups()
    {
        List<FunctionalGroup> principal = new ArrayList<FunctionalGroup>();

        for(FunctionalGroup group : functionalGroups)
            if(group.isPrincipal())
                principal.add(group);

        return principal;
    }


    /**
     * Returns the candidate chains, or null if the candidates were not enumerated yet.
     */
    public List<Chain> getCandidateChains()
    {
        return candidateChains;
    }


    /**
     * Returns the candidate ring systems, or null if ring systems were not detected yet.
     */
    public List<RingSystem> getCandidateRings()
    {
        return candidateRings;
    }


    public ParentStructure getParentStructure()
    {
        return parentStructure;
    }


    public Numbering getNumbering()
    {
        return numbering;
    }


    public NomenclatureMethod getNomenclatureMethod()
    {
        return nomenclatureMethod;
    }


    public CascadeState getCascade()
    {
        return cascade;
    }


    public AssemblyState getAssembly()
    {
        return assembly;
    }


    public String getFinalName()
    {
        return finalName;
    }


    public Set<ExecutionPhase> getCompletedPhases()
    {
        return completedPhases;
    }


    public boolean isPhaseCompleted(ExecutionPhase phase)
    {
        return completedPhases.contains(phase);
    }


    public List<RuleConflict> getConflicts()
    {
        return conflicts;
    }


    public List<TraceEntry> getTrace()
    {
        return trace;
    }


    /**
     * Returns a compact description of the derived data, used for the before/after fields of trace entries.
     */
    public String summary()
    {
        StringBuilder builder = new StringBuilder();
        builder.append("groups=").append(functionalGroups.size());
        builder.append(" principal=").append(getPrincipalGroups().size());
        builder.append(" chains=").append(candidateChains == null ? "-" : candidateChains.size());
        builder.append(" rings=").append(candidateRings == null ? "-" : candidateRings.size());
        builder.append(" parent=").append(parentStructure == null ? "-" : parentStructure.getType().getLabel());
        builder.append(" method=").append(nomenclatureMethod == null ? "-" : nomenclatureMethod.getLabel());
        builder.append(" numbered=").append(numbering != null);
        builder.append(" conflicts=").append(conflicts.size());

        if(finalName != null)
            builder.append(" name=").append(finalName);

        return builder.toString();
    }
}
