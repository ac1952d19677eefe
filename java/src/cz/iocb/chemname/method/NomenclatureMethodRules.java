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
package cz.iocb.chemname.method;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import cz.iocb.chemname.analysis.AtomicAnalysis;
import cz.iocb.chemname.engine.ContextState;
import cz.iocb.chemname.engine.ExecutionPhase;
import cz.iocb.chemname.engine.NamingContext;
import cz.iocb.chemname.engine.NomenclatureMethod;
import cz.iocb.chemname.engine.Rule;
import cz.iocb.chemname.engine.RulePriority;
import cz.iocb.chemname.groups.FunctionalGroup;
import cz.iocb.chemname.groups.FunctionalGroupType;
import cz.iocb.chemname.parent.RingSystem;



/**
 * Selection of the nomenclature method. The first applicable rule in priority order decides.
 */
public class NomenclatureMethodRules
{
    /* share of heteroatoms among all atoms above which skeletal replacement is considered */
    public static final double SKELETAL_REPLACEMENT_RATIO = 0.2;


    public static final Rule ESTER_METHOD = new Rule("ester-method", "Ester nomenclature method", "P-65.6.3.2",
            ExecutionPhase.NOMENCLATURE_METHOD, RulePriority.HUNDRED + 10,
            context -> undecided(context) && !getGroups(context, FunctionalGroupType.ESTER).isEmpty(),
            NomenclatureMethodRules::selectEsterMethod);

    public static final Rule FUNCTIONAL_CLASS = new Rule("functional-class-method", "Functional class nomenclature",
            "P-51.2", ExecutionPhase.NOMENCLATURE_METHOD, RulePriority.HUNDRED,
            context -> undecided(context) && hasFunctionalClassTrigger(context.getState()),
            (context, rule) -> context.withNomenclatureMethod(NomenclatureMethod.FUNCTIONAL_CLASS, rule,
                    "principal group is named with a class word"));

    public static final Rule SKELETAL_REPLACEMENT = new Rule("skeletal-replacement-method",
            "Skeletal replacement nomenclature", "P-51.3", ExecutionPhase.NOMENCLATURE_METHOD, RulePriority.EIGHTY,
            context -> undecided(context) && !context.getState().getFunctionalGroups().isEmpty()
                    && getHeteroatomRatio(context.getState()) > SKELETAL_REPLACEMENT_RATIO,
            (context, rule) -> context.withNomenclatureMethod(NomenclatureMethod.SKELETAL_REPLACEMENT, rule,
                    String.format("heteroatom ratio %.2f", getHeteroatomRatio(context.getState()))));

    public static final Rule MULTIPLICATIVE = new Rule("multiplicative-method", "Multiplicative nomenclature",
            "P-51.4", ExecutionPhase.NOMENCLATURE_METHOD, RulePriority.SEVENTY,
            context -> undecided(context) && hasRepeatedType(context.getState().getFunctionalGroups()),
            (context, rule) -> context.withNomenclatureMethod(NomenclatureMethod.MULTIPLICATIVE, rule,
                    "two or more groups of one class"));

    public static final Rule CONJUNCTIVE = new Rule("conjunctive-method", "Conjunctive nomenclature", "P-51.5",
            ExecutionPhase.NOMENCLATURE_METHOD, RulePriority.SIXTY,
            context -> undecided(context) && hasFusedRingSystem(context.getState().getAtomicAnalysis()),
            (context, rule) -> context.withNomenclatureMethod(NomenclatureMethod.CONJUNCTIVE, rule,
                    "fused ring system present"));

    public static final Rule SUBSTITUTIVE = new Rule("substitutive-method", "Substitutive nomenclature", "P-51.1",
            ExecutionPhase.NOMENCLATURE_METHOD, RulePriority.TEN,
            NomenclatureMethodRules::undecided,
            (context, rule) -> context.withNomenclatureMethod(NomenclatureMethod.SUBSTITUTIVE, rule,
                    "default method"));


    public static List<Rule> rules()
    {
        return Arrays.asList(ESTER_METHOD, FUNCTIONAL_CLASS, SKELETAL_REPLACEMENT, MULTIPLICATIVE, CONJUNCTIVE,
                SUBSTITUTIVE);
    }


    private static boolean undecided(NamingContext context)
    {
        return context.getState().getNomenclatureMethod() == null;
    }


    private static List<FunctionalGroup> getGroups(NamingContext context, FunctionalGroupType type)
    {
        List<FunctionalGroup> result = new ArrayList<FunctionalGroup>();

        for(FunctionalGroup group : context.getState().getFunctionalGroups())
            if(group.getType() == type)
                result.add(group);

        return result;
    }


    private static NamingContext selectEsterMethod(NamingContext context, Rule rule)
    {
        ContextState state = context.getState();
        List<FunctionalGroup> esters = getGroups(context, FunctionalGroupType.ESTER);
        int esterPriority = FunctionalGroupType.ESTER.getPriority();

        for(FunctionalGroup ester : esters)
            if(EsterClassifier.isLactone(ester, state.getMolecule(), state.getAtomicAnalysis()))
                return context.withNomenclatureMethod(NomenclatureMethod.SUBSTITUTIVE, rule,
                        "lactone is named as a heterocyclic ketone");

        for(FunctionalGroup group : state.getFunctionalGroups())
            if(group.getType().isPrincipalCapable() && group.getPriority() > esterPriority)
                return context.withNomenclatureMethod(NomenclatureMethod.SUBSTITUTIVE, rule,
                        "ester is cited as a prefix of " + group.getType().getLabel());

        if(esters.size() > 1 && EsterClassifier.isHierarchical(esters, state.getMolecule()))
        {
            List<FunctionalGroup> groups = EsterClassifier.keepPrimaryEster(state.getFunctionalGroups(),
                    state.getMolecule());

            return context.withStateUpdate(
                    builder -> builder.setNomenclatureMethod(NomenclatureMethod.SUBSTITUTIVE)
                            .setFunctionalGroups(groups),
                    rule, "hierarchical esters cite the nested esters as prefixes");
        }

        return context.withNomenclatureMethod(NomenclatureMethod.FUNCTIONAL_CLASS, rule,
                esters.size() + " esters named as alkyl carboxylates");
    }


    private static boolean hasFunctionalClassTrigger(ContextState state)
    {
        for(FunctionalGroup group : state.getPrincipalGroups())
            if(group.getType().isFunctionalClassTrigger())
                return true;

        return false;
    }


    static double getHeteroatomRatio(ContextState state)
    {
        AtomicAnalysis analysis = state.getAtomicAnalysis();
        return (double) analysis.getHeteroatoms().length / analysis.getTotalAtomCount();
    }


    private static boolean hasRepeatedType(List<FunctionalGroup> groups)
    {
        Set<FunctionalGroupType> seen = EnumSet.noneOf(FunctionalGroupType.class);

        for(FunctionalGroup group : groups)
            if(!seen.add(group.getType()))
                return true;

        return false;
    }


    private static boolean hasFusedRingSystem(AtomicAnalysis analysis)
    {
        for(RingSystem system : analysis.getRingSystems())
            if(system.getKind() == RingSystem.Kind.FUSED)
                return true;

        return false;
    }
}
