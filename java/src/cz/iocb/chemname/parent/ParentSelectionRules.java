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
package cz.iocb.chemname.parent;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import cz.iocb.chemname.analysis.AtomicAnalysis;
import cz.iocb.chemname.engine.ContextState;
import cz.iocb.chemname.engine.ExecutionPhase;
import cz.iocb.chemname.engine.NamingConfiguration;
import cz.iocb.chemname.engine.NamingContext;
import cz.iocb.chemname.engine.Rule;
import cz.iocb.chemname.engine.RulePriority;
import cz.iocb.chemname.groups.FunctionalGroup;
import cz.iocb.chemname.groups.FunctionalGroupType;
import cz.iocb.chemname.molecule.Atom;
import cz.iocb.chemname.molecule.Molecule;
import cz.iocb.chemname.shared.NomenclatureDictionary;



/**
 * Selection of the parent structure: mononuclear parent hydrides, ring system seniority, the ring-versus-chain
 * decision and the chain seniority cascade.
 */
public class ParentSelectionRules
{
    /* chains with a larger share of ring atoms are not considered in the ring-versus-chain decision */
    public static final double RING_OVERLAP_LIMIT = 0.7;

    /* size of a carbon branch that excludes a mononuclear parent hydride */
    public static final int HYDRIDE_BRANCH_LIMIT = 5;


    public static final Rule HYDRIDE = new Rule("parent-hydride", "Mononuclear parent hydride", "P-2.1",
            ExecutionPhase.PARENT_SELECTION, RulePriority.PRE_EMPTIVE,
            context -> context.getState().getParentStructure() == null && findHydrideAtom(context) >= 0,
            ParentSelectionRules::selectHydride);

    public static final Rule RING_SYSTEMS = new Rule("ring-systems", "Ring system candidates", "P-44.2",
            ExecutionPhase.PARENT_SELECTION, RulePriority.HUNDRED,
            context -> context.getState().getCandidateRings() == null,
            (context, rule) -> context.withUpdatedRings(context.getState().getAtomicAnalysis().getRingSystems(), rule,
                    context.getState().getAtomicAnalysis().getRingSystems().size() + " ring systems"));

    public static final Rule CHAINS = new Rule("chain-candidates", "Chains with the maximum number of principal groups",
            "P-44.1.1", ExecutionPhase.PARENT_SELECTION, RulePriority.HUNDRED - 2,
            context -> context.getState().getCandidateChains() == null
                    && context.getState().getParentStructure() == null,
            ParentSelectionRules::enumerateChains);

    public static final Rule RING_PRINCIPAL_GROUPS = new Rule("ring-principal-groups",
            "Ring systems with the maximum number of principal groups", "P-44.1.1", ExecutionPhase.PARENT_SELECTION,
            RulePriority.HUNDRED - 6, ParentSelectionRules::hasRingChoice,
            ParentSelectionRules::filterRingsByPrincipalGroups);

    public static final Rule RING_HETEROATOMS = new Rule("ring-heteroatoms", "Heteroatom seniority of ring systems",
            "P-44.2.1.2", ExecutionPhase.PARENT_SELECTION, RulePriority.NINETY,
            ParentSelectionRules::hasRingChoice, ParentSelectionRules::filterRingsByHeteroatoms);

    public static final Rule RING_COUNT = new Rule("ring-count", "Greater number of rings", "P-44.2.1.4",
            ExecutionPhase.PARENT_SELECTION, RulePriority.EIGHTY, ParentSelectionRules::hasRingChoice,
            ParentSelectionRules::filterRingsByCount);

    public static final Rule RING_VERSUS_CHAIN = new Rule("ring-versus-chain", "Ring or chain as parent", "P-44.1.2.2",
            ExecutionPhase.PARENT_SELECTION, RulePriority.SEVENTY,
            context -> context.getState().getParentStructure() == null
                    && context.getState().getCandidateRings() != null
                    && !context.getState().getCandidateRings().isEmpty(),
            ParentSelectionRules::arbitrate);

    public static final Rule CHAIN_PARENT = new Rule("chain-parent", "Principal chain", "P-44.3",
            ExecutionPhase.PARENT_SELECTION, RulePriority.TEN,
            context -> context.getState().getParentStructure() == null
                    && context.getState().getCandidateChains() != null
                    && !context.getState().getCandidateChains().isEmpty(),
            ParentSelectionRules::selectChain);


    public static List<Rule> rules()
    {
        List<Rule> rules = new ArrayList<Rule>();
        rules.addAll(Arrays.asList(HYDRIDE, RING_SYSTEMS, CHAINS, RING_PRINCIPAL_GROUPS, RING_HETEROATOMS, RING_COUNT,
                RING_VERSUS_CHAIN));
        rules.addAll(ChainSeniorityRules.rules());
        rules.add(CHAIN_PARENT);
        return rules;
    }


    private static boolean hasRingChoice(NamingContext context)
    {
        ContextState state = context.getState();
        return state.getParentStructure() == null && state.getCandidateRings() != null
                && state.getCandidateRings().size() > 1;
    }


    /**
     * Returns the atom of a mononuclear parent hydride, or -1.
     */
    static int findHydrideAtom(NamingContext context)
    {
        ContextState state = context.getState();
        Molecule molecule = state.getMolecule();
        AtomicAnalysis analysis = state.getAtomicAnalysis();
        NomenclatureDictionary dictionary = context.getServices().getDictionary();
        NamingConfiguration configuration = context.getConfiguration();

        if(analysis == null || molecule.getHeavyAtomCount() > configuration.getMaxHydrideHeavyAtoms())
            return -1;

        int found = -1;

        for(int i = 0; i < molecule.getAtomCount(); i++)
        {
            if(dictionary.isHydrideElement(molecule.getAtom(i).symbol))
            {
                if(found >= 0)
                    return -1;

                found = i;
            }
        }

        if(found < 0 || analysis.isInRing(found))
            return -1;

        Atom atom = molecule.getAtom(found);

        if(analysis.getValence(found) != dictionary.getHydrideValence(atom.symbol))
            return -1;

        if(isPnictogen(atom.symbol) ? containsNitrogen(molecule) : hasNitrogenGroup(state.getFunctionalGroups()))
            return -1;

        for(int neighbour : molecule.getNeighbours(found))
            if(molecule.getAtom(neighbour).isCarbon()
                    && getCarbonComponentSize(molecule, neighbour, found) >= HYDRIDE_BRANCH_LIMIT)
                return -1;

        return found;
    }


    private static boolean isPnictogen(String symbol)
    {
        return symbol.equals("P") || symbol.equals("As") || symbol.equals("Sb") || symbol.equals("Bi");
    }


    private static boolean containsNitrogen(Molecule molecule)
    {
        for(Atom atom : molecule.getAtoms())
            if(atom.is("N"))
                return true;

        return false;
    }


    private static boolean hasNitrogenGroup(List<FunctionalGroup> groups)
    {
        for(FunctionalGroup group : groups)
        {
            switch(group.getType())
            {
                case AMIDE:
                case AMINE:
                case IMINE:
                case NITRILE:
                case NITRO:
                case NITROSO:
                case THIOCYANATE:
                    return true;
                default:
                    break;
            }
        }

        return false;
    }


    private static int getCarbonComponentSize(Molecule molecule, int start, int excluded)
    {
        boolean[] visited = new boolean[molecule.getAtomCount()];
        visited[excluded] = true;
        visited[start] = true;
        List<Integer> queue = new ArrayList<Integer>();
        queue.add(start);

        for(int q = 0; q < queue.size(); q++)
        {
            for(int n : molecule.getNeighbours(queue.get(q)))
            {
                if(!visited[n] && molecule.getAtom(n).isCarbon())
                {
                    visited[n] = true;
                    queue.add(n);
                }
            }
        }

        return queue.size();
    }


    private static NamingContext selectHydride(NamingContext context, Rule rule)
    {
        ContextState state = context.getState();
        Molecule molecule = state.getMolecule();
        int atom = findHydrideAtom(context);
        String element = molecule.getAtom(atom).symbol;
        String name = context.getServices().getDictionary().getHydrideName(element);

        List<FunctionalGroup> demoted = new ArrayList<FunctionalGroup>();

        for(FunctionalGroup group : state.getFunctionalGroups())
            demoted.add(group.withPrincipal(false));

        List<Substituent> substituents = SubstituentFinder.find(molecule, state.getAtomicAnalysis(),
                context.getServices().getSubstituentNamer(), new int[] { atom }, Collections.emptyList());

        return context.withFunctionalGroups(demoted, rule, "groups are cited as prefixes of " + name)
                .withParentStructure(new HeteroatomParent(atom, element, name, substituents), rule,
                        name + " with " + substituents.size() + " substituents");
    }


    private static NamingContext enumerateChains(NamingContext context, Rule rule)
    {
        ContextState state = context.getState();
        List<Chain> chains = ChainFinder.find(state.getMolecule(), state.getAtomicAnalysis(),
                state.getFunctionalGroups(), context.getServices().getSubstituentNamer(),
                context.getServices().getDictionary(), context.getConfiguration().getMaxCandidateChains());

        int principal = chains.isEmpty() ? 0 : chains.get(0).getPrincipalGroupCount();

        return context.withUpdatedCandidates(chains, rule,
                chains.size() + " candidate chains with " + principal + " principal groups");
    }


    private static NamingContext filterRingsByPrincipalGroups(NamingContext context, Rule rule)
    {
        ContextState state = context.getState();
        List<RingSystem> rings = state.getCandidateRings();
        int[] counts = new int[rings.size()];
        int max = 0;

        for(int i = 0; i < rings.size(); i++)
        {
            counts[i] = countRingGroups(state, rings.get(i), false);
            max = Math.max(max, counts[i]);
        }

        List<RingSystem> kept = new ArrayList<RingSystem>();

        for(int i = 0; i < rings.size(); i++)
            if(counts[i] == max)
                kept.add(rings.get(i));

        return context.withUpdatedRings(kept, rule, kept.size() + " ring systems with " + max + " principal groups");
    }


    private static NamingContext filterRingsByHeteroatoms(NamingContext context, Rule rule)
    {
        List<RingSystem> rings = context.getState().getCandidateRings();
        int max = Integer.MIN_VALUE;

        for(RingSystem ring : rings)
            max = Math.max(max, ring.getHeteroatomScore());

        List<RingSystem> kept = new ArrayList<RingSystem>();

        for(RingSystem ring : rings)
            if(ring.getHeteroatomScore() == max)
                kept.add(ring);

        return context.withUpdatedRings(kept, rule, kept.size() + " ring systems with heteroatom score " + max);
    }


    private static NamingContext filterRingsByCount(NamingContext context, Rule rule)
    {
        List<RingSystem> rings = context.getState().getCandidateRings();
        RingSystem best = rings.get(0);

        for(RingSystem ring : rings)
            if(ring.getRingCount() > best.getRingCount()
                    || ring.getRingCount() == best.getRingCount() && ring.getSize() < best.getSize())
                best = ring;

        List<RingSystem> kept = new ArrayList<RingSystem>();

        for(RingSystem ring : rings)
            if(ring.getRingCount() == best.getRingCount() && ring.getSize() == best.getSize())
                kept.add(ring);

        return context.withUpdatedRings(kept, rule,
                kept.size() + " ring systems with " + best.getRingCount() + " rings of size " + best.getSize());
    }


    /**
     * Counts the principal groups in the ring system or bonded to it. Ketones and imines count only when their carbon
     * is a ring member. With {@code aromaticExclusion}, principal nitrogen, oxygen and sulfur atoms bonded to an
     * aromatic ring atom are not counted.
     */
    static int countRingGroups(ContextState state, RingSystem ring, boolean aromaticExclusion)
    {
        Molecule molecule = state.getMolecule();
        AtomicAnalysis analysis = state.getAtomicAnalysis();
        boolean[] mask = GroupAnchors.toMask(ring.getAtoms(), molecule.getAtomCount());
        int count = 0;

        for(FunctionalGroup group : state.getPrincipalGroups())
        {
            int anchor = GroupAnchors.anchor(group, mask, molecule, true);

            if(anchor < 0)
                continue;

            /* an exocyclic ketone or imine carbon belongs to a chain */
            if(isCarbonylLike(group) && !mask[group.getKeyAtom()])
                continue;

            if(aromaticExclusion && anchor != group.getKeyAtom() && isChalcogenOrNitrogen(molecule, group)
                    && analysis.isAromatic(anchor))
                continue;

            count++;
        }

        return count;
    }


    private static boolean isCarbonylLike(FunctionalGroup group)
    {
        return group.getType() == FunctionalGroupType.KETONE || group.getType() == FunctionalGroupType.IMINE;
    }


    private static boolean isChalcogenOrNitrogen(Molecule molecule, FunctionalGroup group)
    {
        Atom atom = molecule.getAtom(group.getKeyAtom());
        return atom.is("N") || atom.is("O") || atom.is("S");
    }


    /*
     * An exocyclic nitrogen bonded both to the ring system and to a benzene ring of another ring system.
     */
    private static boolean hasArylAmine(ContextState state, RingSystem ring)
    {
        Molecule molecule = state.getMolecule();
        AtomicAnalysis analysis = state.getAtomicAnalysis();
        boolean[] mask = GroupAnchors.toMask(ring.getAtoms(), molecule.getAtomCount());

        for(int atom : ring.getAtoms())
        {
            for(int nitrogen : molecule.getNeighbours(atom))
            {
                if(mask[nitrogen] || !molecule.getAtom(nitrogen).is("N") || analysis.isInRing(nitrogen))
                    continue;

                for(int aryl : molecule.getNeighbours(nitrogen))
                    if(!mask[aryl] && isBenzeneAtom(analysis, aryl))
                        return true;
            }
        }

        return false;
    }


    private static boolean isBenzeneAtom(AtomicAnalysis analysis, int atom)
    {
        RingSystem system = analysis.getRingSystemOf(atom);
        return system != null && system.getRingCount() == 1 && system.getSize() == 6 && system.getName().isFixed()
                && system.getName().getFixedName().equals("benzene");
    }


    private static NamingContext arbitrate(NamingContext context, Rule rule)
    {
        ContextState state = context.getState();
        AtomicAnalysis analysis = state.getAtomicAnalysis();
        RingSystem ring = state.getCandidateRings().get(0);
        int ringCount = countRingGroups(state, ring, true);

        Chain senior = null;
        int longest = 0;

        if(state.getCandidateChains() != null)
        {
            for(Chain chain : state.getCandidateChains())
            {
                int inRing = 0;

                for(int atom : chain.getAtoms())
                    if(analysis.isInRing(atom))
                        inRing++;

                if(inRing > RING_OVERLAP_LIMIT * chain.getLength())
                    continue;

                longest = Math.max(longest, chain.getLength());

                if(senior == null || chain.getPrincipalGroupCount() > senior.getPrincipalGroupCount())
                    senior = chain;
            }
        }

        if(senior == null)
            return selectRing(context, rule, ring, "no competing chain");

        int chainCount = senior.getPrincipalGroupCount();

        if(chainCount > ringCount)
            return context.withUpdatedRings(Collections.emptyList(), rule,
                    "chain carries " + chainCount + " principal groups, ring " + ringCount);

        if(chainCount == ringCount)
        {
            if(hasArylAmine(state, ring))
                return selectRing(context, rule, ring, "N-aryl amine on the ring system");

            if(ring.getSize() < longest)
                return context.withUpdatedRings(Collections.emptyList(), rule,
                        "chain of " + longest + " atoms is longer than the ring system of " + ring.getSize());
        }

        return selectRing(context, rule, ring, "ring carries " + ringCount + " principal groups, chain " + chainCount);
    }


    private static NamingContext selectRing(NamingContext context, Rule rule, RingSystem ring, String reason)
    {
        ContextState state = context.getState();
        Molecule molecule = state.getMolecule();
        List<FunctionalGroup> groups = RingGroupFilter.filter(state.getFunctionalGroups(), ring, molecule,
                state.getAtomicAnalysis());

        List<FunctionalGroup> principal = new ArrayList<FunctionalGroup>();

        for(FunctionalGroup group : groups)
            if(group.isPrincipal())
                principal.add(group);

        List<Substituent> substituents = SubstituentFinder.find(molecule, state.getAtomicAnalysis(),
                context.getServices().getSubstituentNamer(), ring.getAtoms(), principal);
        String name = getRingName(ring, context.getServices().getDictionary());

        return context.withFunctionalGroups(groups, rule, principal.size() + " principal groups on the ring system")
                .withParentStructure(new RingParent(ring, name, substituents), rule, name + ": " + reason);
    }


    static String getRingName(RingSystem ring, NomenclatureDictionary dictionary)
    {
        RingName name = ring.getName();

        if(name.isFixed())
            return name.getFixedName();

        return name.getPrefix() + dictionary.getStem(name.getSize()) + "ane";
    }


    private static NamingContext selectChain(NamingContext context, Rule rule)
    {
        ContextState state = context.getState();
        Molecule molecule = state.getMolecule();
        Chain chain = state.getCandidateChains().get(0);
        boolean[] mask = GroupAnchors.toMask(chain.getAtoms(), molecule.getAtomCount());

        List<FunctionalGroup> groups = new ArrayList<FunctionalGroup>();
        int demoted = 0;

        for(FunctionalGroup group : state.getFunctionalGroups())
        {
            if(group.isPrincipal() && GroupAnchors.anchor(group, mask, molecule, false) < 0)
            {
                groups.add(group.withPrincipal(false));
                demoted++;
            }
            else
            {
                groups.add(group);
            }
        }

        NomenclatureDictionary dictionary = context.getServices().getDictionary();
        String name = HydrideNames.compose(dictionary.getStem(chain.getLength()),
                toStrings(chain.getDoubleBondLocants()), toStrings(chain.getTripleBondLocants()), true, dictionary);
        ChainParent parent = new ChainParent(chain, name, chain.getSubstituents());

        NamingContext next = context;

        if(demoted > 0)
            next = next.withFunctionalGroups(groups, rule, demoted + " principal groups are not on the chain");

        return next.withParentStructure(parent, rule, name + " " + chain);
    }


    static List<String> toStrings(int[] locants)
    {
        List<String> strings = new ArrayList<String>();

        for(int locant : locants)
            strings.add(Integer.toString(locant));

        return strings;
    }
}
