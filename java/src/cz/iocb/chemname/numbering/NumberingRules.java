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
package cz.iocb.chemname.numbering;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import cz.iocb.chemname.engine.ContextState;
import cz.iocb.chemname.engine.ExecutionPhase;
import cz.iocb.chemname.engine.NamingContext;
import cz.iocb.chemname.engine.Rule;
import cz.iocb.chemname.engine.RulePriority;
import cz.iocb.chemname.groups.FunctionalGroup;
import cz.iocb.chemname.molecule.Molecule;
import cz.iocb.chemname.parent.ChainParent;
import cz.iocb.chemname.parent.GroupAnchors;
import cz.iocb.chemname.parent.HeteroatomParent;
import cz.iocb.chemname.parent.ParentStructure;
import cz.iocb.chemname.parent.ParentStructure.ParentType;
import cz.iocb.chemname.parent.RingParent;
import cz.iocb.chemname.parent.RingSystem;
import cz.iocb.chemname.parent.Substituent;



public class NumberingRules
{
    public static final Rule HYDRIDE = new Rule("hydride-numbering", "Mononuclear parent hydride locant",
            "P-31.1.4.1", ExecutionPhase.NUMBERING, RulePriority.HUNDRED,
            context -> isUnnumbered(context, ParentType.HETEROATOM),
            NumberingRules::numberHydride);

    public static final Rule RING = new Rule("ring-numbering", "Ring numbering", "P-31.1.4.2.4",
            ExecutionPhase.NUMBERING, RulePriority.NINETY + 5,
            context -> isUnnumbered(context, ParentType.RING),
            NumberingRules::numberRing);

    public static final Rule CHAIN = new Rule("chain-numbering", "Chain numbering", "P-31.1.4.2.4",
            ExecutionPhase.NUMBERING, RulePriority.NINETY,
            context -> isUnnumbered(context, ParentType.CHAIN),
            NumberingRules::numberChain);

    public static final Rule GROUP_LOCANTS = new Rule("group-locants", "Locants of principal characteristic groups",
            "P-31.1.4.2.4", ExecutionPhase.NUMBERING, RulePriority.EIGHTY,
            NumberingRules::hasUnnumberedGroups,
            NumberingRules::assignGroupLocants);

    public static final Rule SUBSTITUENT_LOCANTS = new Rule("substituent-locants", "Locants of detachable prefixes",
            "P-31.1.4.3.4", ExecutionPhase.NUMBERING, RulePriority.SEVENTY,
            context -> context.getState().getNumbering() != null
                    && context.getState().getNumbering().getSubstituents() == null,
            NumberingRules::assignSubstituentLocants);


    public static List<Rule> rules()
    {
        return Arrays.asList(HYDRIDE, RING, CHAIN, GROUP_LOCANTS, SUBSTITUENT_LOCANTS);
    }


    private static boolean isUnnumbered(NamingContext context, ParentType type)
    {
        ContextState state = context.getState();
        return state.getNumbering() == null && state.getParentStructure() != null
                && state.getParentStructure().getType() == type;
    }


    private static NamingContext numberHydride(NamingContext context, Rule rule)
    {
        HeteroatomParent parent = (HeteroatomParent) context.getState().getParentStructure();
        Numbering numbering = new Numbering(new int[] { parent.getAtom() }, new String[] { "1" },
                context.getMolecule().getAtomCount());

        return context.withStateUpdate(builder -> builder.setNumbering(numbering), rule,
                parent.getElement() + " carries the locant 1");
    }


    private static NamingContext numberRing(NamingContext context, Rule rule)
    {
        RingParent parent = (RingParent) context.getState().getParentStructure();
        RingSystem ring = parent.getRing();
        List<int[]> orderings = RingNumbering.getOrderings(ring);
        int best = getCriteria(context, parent, true).choose(orderings);
        Numbering numbering = new Numbering(orderings.get(best), RingNumbering.getLabels(ring),
                context.getMolecule().getAtomCount());

        return context.withStateUpdate(builder -> builder.setNumbering(numbering), rule,
                "numbering " + (best + 1) + " of " + orderings.size() + ": " + numbering);
    }


    private static NamingContext numberChain(NamingContext context, Rule rule)
    {
        ChainParent parent = (ChainParent) context.getState().getParentStructure();
        List<int[]> orderings = ChainNumbering.getOrderings(parent.getChain());
        int best = getCriteria(context, parent, false).choose(orderings);
        Numbering numbering = new Numbering(orderings.get(best), ChainNumbering.getLabels(parent.getChain()),
                context.getMolecule().getAtomCount());

        return context.withStateUpdate(builder -> builder.setNumbering(numbering), rule,
                (best == 0 ? "forward" : "reverse") + " numbering: " + numbering);
    }


    private static NumberingCriteria getCriteria(NamingContext context, ParentStructure parent, boolean attached)
    {
        ContextState state = context.getState();
        Molecule molecule = state.getMolecule();
        boolean[] mask = GroupAnchors.toMask(parent.getAtoms(), molecule.getAtomCount());
        List<Integer> anchors = new ArrayList<Integer>();

        for(FunctionalGroup group : state.getPrincipalGroups())
        {
            int anchor = GroupAnchors.anchor(group, mask, molecule, attached);

            if(anchor >= 0)
                anchors.add(anchor);
        }

        return new NumberingCriteria(molecule, context.getServices().getDictionary(), parent.getAtoms(),
                anchors.stream().mapToInt(Integer::intValue).toArray(), parent.getSubstituents());
    }


    private static boolean hasUnnumberedGroups(NamingContext context)
    {
        if(context.getState().getNumbering() == null)
            return false;

        for(FunctionalGroup group : context.getState().getPrincipalGroups())
            if(group.getLocants().isEmpty())
                return true;

        return false;
    }


    private static NamingContext assignGroupLocants(NamingContext context, Rule rule)
    {
        ContextState state = context.getState();
        Molecule molecule = state.getMolecule();
        ParentStructure parent = state.getParentStructure();
        Numbering numbering = state.getNumbering();
        boolean[] mask = GroupAnchors.toMask(parent.getAtoms(), molecule.getAtomCount());
        boolean attached = parent.getType() != ParentType.CHAIN;
        List<FunctionalGroup> groups = new ArrayList<FunctionalGroup>();
        List<String> assigned = new ArrayList<String>();

        for(FunctionalGroup group : state.getFunctionalGroups())
        {
            int anchor = group.isPrincipal() ? GroupAnchors.anchor(group, mask, molecule, attached) : -1;

            if(anchor < 0)
            {
                groups.add(group);
                continue;
            }

            String label = numbering.getLabel(anchor);
            groups.add(group.withLocants(Collections.singletonList(label)));
            assigned.add(label);
        }

        return context.withFunctionalGroups(groups, rule, "principal groups at " + String.join(",", assigned));
    }


    private static NamingContext assignSubstituentLocants(NamingContext context, Rule rule)
    {
        ContextState state = context.getState();
        Numbering numbering = state.getNumbering();
        List<Substituent> substituents = new ArrayList<Substituent>();

        for(Substituent substituent : state.getParentStructure().getSubstituents())
            substituents.add(substituent.isNitrogen() ? substituent :
                    substituent.withLocant(numbering.getLabel(substituent.getAttachment())));

        Numbering numbered = numbering.withSubstituents(substituents);

        return context.withStateUpdate(builder -> builder.setNumbering(numbered), rule,
                substituents.size() + " substituents numbered");
    }
}
