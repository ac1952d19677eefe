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

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import cz.iocb.chemname.groups.FunctionalGroup;
import cz.iocb.chemname.molecule.Molecule;
import cz.iocb.chemname.parent.Chain;
import cz.iocb.chemname.parent.ParentStructure;
import cz.iocb.chemname.parent.RingSystem;



/**
 * Persistent naming context. Every transition copies the state, applies a delta and appends exactly one trace
 * entry; previously returned contexts are never modified.
 */
public final class NamingContext
{
    private final ContextState state;
    private final NamingServices services;
    private final NamingConfiguration configuration;


    private NamingContext(ContextState state, NamingServices services, NamingConfiguration configuration)
    {
        this.state = state;
        this.services = services;
        this.configuration = configuration;
    }


    public static NamingContext create(Molecule molecule, NamingServices services, NamingConfiguration configuration)
    {
        return new NamingContext(new ContextState(molecule), services, configuration);
    }


    public ContextState getState()
    {
        return state;
    }


    public NamingServices getServices()
    {
        return services;
    }


    public NamingConfiguration getConfiguration()
    {
        return configuration;
    }


    public Molecule getMolecule()
    {
        return state.getMolecule();
    }


    public NamingContext withStateUpdate(Consumer<ContextState.Builder> update, String ruleId, String ruleName,
            String reference, ExecutionPhase phase, String description)
    {
        ContextState.Builder builder = state.toBuilder();
        update.accept(builder);
        return transition(builder, ruleId, ruleName, reference, phase, description);
    }


    public NamingContext withStateUpdate(Consumer<ContextState.Builder> update, Rule rule, String description)
    {
        return withStateUpdate(update, rule.getId(), rule.getName(), rule.getBlueBookReference(), rule.getPhase(),
                description);
    }


    /**
     * Sets the parent structure.
     *
     * @throws IllegalStateException if a parent structure has already been chosen
     */
    public NamingContext withParentStructure(ParentStructure parent, String ruleId, String ruleName, String reference,
            ExecutionPhase phase, String description)
    {
        if(parent == null)
            throw new IllegalArgumentException("parent structure must not be null");

        if(state.getParentStructure() != null)
            throw new IllegalStateException("parent structure is already set to " + state.getParentStructure());

        return transition(state.toBuilder().setParentStructure(parent), ruleId, ruleName, reference, phase,
                description);
    }


    public NamingContext withParentStructure(ParentStructure parent, Rule rule, String description)
    {
        return withParentStructure(parent, rule.getId(), rule.getName(), rule.getBlueBookReference(), rule.getPhase(),
                description);
    }


    public NamingContext withFunctionalGroups(List<FunctionalGroup> groups, String ruleId, String ruleName,
            String reference, ExecutionPhase phase, String description)
    {
        return transition(state.toBuilder().setFunctionalGroups(groups), ruleId, ruleName, reference, phase,
                description);
    }


    public NamingContext withFunctionalGroups(List<FunctionalGroup> groups, Rule rule, String description)
    {
        return withFunctionalGroups(groups, rule.getId(), rule.getName(), rule.getBlueBookReference(),
                rule.getPhase(), description);
    }


    public NamingContext withNomenclatureMethod(NomenclatureMethod method, String ruleId, String ruleName,
            String reference, ExecutionPhase phase, String description)
    {
        return transition(state.toBuilder().setNomenclatureMethod(method), ruleId, ruleName, reference, phase,
                description);
    }


    public NamingContext withNomenclatureMethod(NomenclatureMethod method, Rule rule, String description)
    {
        return withNomenclatureMethod(method, rule.getId(), rule.getName(), rule.getBlueBookReference(),
                rule.getPhase(), description);
    }


    /**
     * Replaces the candidate chains. Once enumerated, candidates may only be filtered.
     *
     * @throws IllegalStateException if the new list contains a chain that is not a current candidate
     */
    public NamingContext withUpdatedCandidates(List<Chain> chains, String ruleId, String ruleName, String reference,
            ExecutionPhase phase, String description)
    {
        checkSubset(state.getCandidateChains(), chains, "chain");
        return transition(state.toBuilder().setCandidateChains(chains), ruleId, ruleName, reference, phase,
                description);
    }


    public NamingContext withUpdatedCandidates(List<Chain> chains, Rule rule, String description)
    {
        return withUpdatedCandidates(chains, rule.getId(), rule.getName(), rule.getBlueBookReference(),
                rule.getPhase(), description);
    }


    /**
     * Replaces the candidate ring systems. Once detected, candidates may only be filtered.
     *
     * @throws IllegalStateException if the new list contains a ring system that is not a current candidate
     */
    public NamingContext withUpdatedRings(List<RingSystem> rings, String ruleId, String ruleName, String reference,
            ExecutionPhase phase, String description)
    {
        checkSubset(state.getCandidateRings(), rings, "ring system");
        return transition(state.toBuilder().setCandidateRings(rings), ruleId, ruleName, reference, phase,
                description);
    }


    public NamingContext withUpdatedRings(List<RingSystem> rings, Rule rule, String description)
    {
        return withUpdatedRings(rings, rule.getId(), rule.getName(), rule.getBlueBookReference(), rule.getPhase(),
                description);
    }


    public NamingContext withConflict(RuleConflict conflict, String ruleId, String ruleName, String reference,
            ExecutionPhase phase, String description)
    {
        return transition(state.toBuilder().addConflict(conflict), ruleId, ruleName, reference, phase, description);
    }


    public NamingContext withConflict(RuleConflict conflict, Rule rule, String description)
    {
        return withConflict(conflict, rule.getId(), rule.getName(), rule.getBlueBookReference(), rule.getPhase(),
                description);
    }


    public NamingContext withPhaseCompletion(ExecutionPhase phase, String ruleId, String ruleName, String reference,
            String description)
    {
        return transition(state.toBuilder().addCompletedPhase(phase), ruleId, ruleName, reference, phase,
                description);
    }


    private static <T> void checkSubset(List<T> current, List<T> updated, String kind)
    {
        if(current == null || updated == null)
            return;

        Set<T> allowed = new HashSet<T>(current);

        for(T item : updated)
            if(!allowed.contains(item))
                throw new IllegalStateException(kind + " candidates may only shrink once enumerated");
    }


    private NamingContext transition(ContextState.Builder builder, String ruleId, String ruleName, String reference,
            ExecutionPhase phase, String description)
    {
        ContextState next = builder.build();

        boolean summaries = configuration.isTraceSummaries();
        TraceEntry entry = new TraceEntry(state.getTrace().size(), ruleId, ruleName, phase, reference, description,
                System.currentTimeMillis(), summaries ? state.summary() : null, summaries ? next.summary() : null);

        return new NamingContext(next.toBuilder().addTraceEntry(entry).build(), services, configuration);
    }
}
