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
import java.util.List;
import java.util.function.Function;
import java.util.function.ToIntFunction;
import cz.iocb.chemname.engine.ContextState;
import cz.iocb.chemname.engine.ExecutionPhase;
import cz.iocb.chemname.engine.NamingContext;
import cz.iocb.chemname.engine.Rule;
import cz.iocb.chemname.engine.RulePriority;
import cz.iocb.chemname.shared.Locants;



/**
 * Selection of the principal chain among the remaining candidates. Each step keeps the candidates that are best by
 * its criterion; step n runs only after step n - 1 and first checks that the candidates still agree on the threshold
 * stored by step n - 1.
 */
public class ChainSeniorityRules
{
    public static final Rule LENGTH = cascadeRule(1, "chain-length", "Greater number of skeletal atoms", "P-44.3.2",
            ChainSeniorityRules::applyLength);

    public static final Rule MULTIPLE_BONDS = cascadeRule(2, "chain-multiple-bonds",
            "Greater number of multiple bonds", "P-44.4.1.1", ChainSeniorityRules::applyMultipleBonds);

    public static final Rule DOUBLE_BONDS = cascadeRule(3, "chain-double-bonds", "Greater number of double bonds",
            "P-44.4.1.2", ChainSeniorityRules::applyDoubleBonds);

    public static final Rule MULTIPLE_BOND_LOCANTS = cascadeRule(4, "chain-multiple-bond-locants",
            "Lower locants for multiple bonds", "P-44.4.1.3", ChainSeniorityRules::applyMultipleBondLocants);

    public static final Rule DOUBLE_BOND_LOCANTS = cascadeRule(5, "chain-double-bond-locants",
            "Lower locants for double bonds", "P-44.4.1.4", ChainSeniorityRules::applyDoubleBondLocants);

    public static final Rule SUBSTITUENTS = cascadeRule(6, "chain-substituents", "Greater number of substituents",
            "P-44.4.1.5", ChainSeniorityRules::applySubstituents);

    public static final Rule SUBSTITUENT_LOCANTS = cascadeRule(7, "chain-substituent-locants",
            "Lower locants for substituents", "P-44.4.1.6", ChainSeniorityRules::applySubstituentLocants);

    public static final Rule CITATION = cascadeRule(8, "chain-citation",
            "Lower locant for the substituent cited first", "P-44.4.1.7", ChainSeniorityRules::applyCitation);


    @FunctionalInterface
    private static interface Step
    {
        NamingContext apply(NamingContext context, Rule rule, List<Chain> chains, CascadeState cascade);
    }


    public static List<Rule> rules()
    {
        return Arrays.asList(LENGTH, MULTIPLE_BONDS, DOUBLE_BONDS, MULTIPLE_BOND_LOCANTS, DOUBLE_BOND_LOCANTS,
                SUBSTITUENTS, SUBSTITUENT_LOCANTS, CITATION);
    }


    private static Rule cascadeRule(int step, String id, String name, String reference, Step action)
    {
        return new Rule(id, name, reference, ExecutionPhase.PARENT_SELECTION, RulePriority.SIXTY + 1 - step,
                context -> isApplicable(context.getState(), step),
                (context, rule) -> action.apply(context, rule, context.getState().getCandidateChains(),
                        context.getState().getCascade()));
    }


    static boolean isApplicable(ContextState state, int step)
    {
        return state.getParentStructure() == null && state.getCandidateChains() != null
                && state.getCandidateChains().size() > 1 && state.getCascade().isReady(step);
    }


    private static NamingContext applyLength(NamingContext context, Rule rule, List<Chain> chains,
            CascadeState cascade)
    {
        int max = max(chains, Chain::getLength);
        List<Chain> kept = keepEqual(chains, Chain::getLength, max);
        return update(context, rule, kept, cascade.withLength(max), "length " + max);
    }


    private static NamingContext applyMultipleBonds(NamingContext context, Rule rule, List<Chain> chains,
            CascadeState cascade)
    {
        check(chains, Chain::getLength, cascade.getLength(), "length");

        int max = max(chains, Chain::getMultipleBondCount);
        List<Chain> kept = keepEqual(chains, Chain::getMultipleBondCount, max);
        return update(context, rule, kept, cascade.withMultipleBonds(max), max + " multiple bonds");
    }


    private static NamingContext applyDoubleBonds(NamingContext context, Rule rule, List<Chain> chains,
            CascadeState cascade)
    {
        check(chains, Chain::getMultipleBondCount, cascade.getMultipleBonds(), "multiple bond count");

        int max = max(chains, Chain::getDoubleBondCount);
        List<Chain> kept = keepEqual(chains, Chain::getDoubleBondCount, max);
        return update(context, rule, kept, cascade.withDoubleBonds(max), max + " double bonds");
    }


    private static NamingContext applyMultipleBondLocants(NamingContext context, Rule rule, List<Chain> chains,
            CascadeState cascade)
    {
        check(chains, Chain::getDoubleBondCount, cascade.getDoubleBonds(), "double bond count");

        int[] min = min(chains, Chain::getMultipleBondLocants);
        List<Chain> kept = keepEqualLocants(chains, Chain::getMultipleBondLocants, min);
        return update(context, rule, kept, cascade.withMultipleBondLocants(min),
                "multiple bond locants {" + Locants.join(min) + "}");
    }


    private static NamingContext applyDoubleBondLocants(NamingContext context, Rule rule, List<Chain> chains,
            CascadeState cascade)
    {
        checkLocants(chains, Chain::getMultipleBondLocants, cascade.getMultipleBondLocants(),
                "multiple bond locants");

        int[] min = min(chains, Chain::getDoubleBondLocants);
        List<Chain> kept = keepEqualLocants(chains, Chain::getDoubleBondLocants, min);
        return update(context, rule, kept, cascade.withDoubleBondLocants(min),
                "double bond locants {" + Locants.join(min) + "}");
    }


    private static NamingContext applySubstituents(NamingContext context, Rule rule, List<Chain> chains,
            CascadeState cascade)
    {
        checkLocants(chains, Chain::getDoubleBondLocants, cascade.getDoubleBondLocants(), "double bond locants");

        int max = max(chains, Chain::getSubstituentCount);
        List<Chain> kept = keepEqual(chains, Chain::getSubstituentCount, max);
        return update(context, rule, kept, cascade.withSubstituents(max), max + " substituents");
    }


    private static NamingContext applySubstituentLocants(NamingContext context, Rule rule, List<Chain> chains,
            CascadeState cascade)
    {
        check(chains, Chain::getSubstituentCount, cascade.getSubstituents(), "substituent count");

        int[] min = min(chains, Chain::getSubstituentLocants);
        List<Chain> kept = keepEqualLocants(chains, Chain::getSubstituentLocants, min);
        return update(context, rule, kept, cascade.withSubstituentLocants(min),
                "substituent locants {" + Locants.join(min) + "}");
    }


    private static NamingContext applyCitation(NamingContext context, Rule rule, List<Chain> chains,
            CascadeState cascade)
    {
        checkLocants(chains, Chain::getSubstituentLocants, cascade.getSubstituentLocants(), "substituent locants");

        Chain best = chains.get(0);

        for(Chain chain : chains)
            if(Locants.compare(chain.getCitation(), best.getCitation()) < 0)
                best = chain;

        List<Chain> kept = new ArrayList<Chain>();
        kept.add(best);

        return update(context, rule, kept, cascade.withCitation(best.getCitation()),
                best.getCitation().isEmpty() ? "first remaining chain" : "citation " + best.getCitation());
    }


    private static NamingContext update(NamingContext context, Rule rule, List<Chain> kept, CascadeState cascade,
            String threshold)
    {
        int before = context.getState().getCandidateChains().size();

        return context.withStateUpdate(builder -> builder.setCandidateChains(kept).setCascade(cascade), rule,
                threshold + ": " + before + " -> " + kept.size() + " candidate chains");
    }


    private static int max(List<Chain> chains, ToIntFunction<Chain> criterion)
    {
        int max = Integer.MIN_VALUE;

        for(Chain chain : chains)
            max = Math.max(max, criterion.applyAsInt(chain));

        return max;
    }


    private static int[] min(List<Chain> chains, Function<Chain, int[]> criterion)
    {
        int[] min = null;

        for(Chain chain : chains)
        {
            int[] value = criterion.apply(chain);

            if(min == null || Locants.compare(value, min) < 0)
                min = value;
        }

        return min;
    }


    private static List<Chain> keepEqual(List<Chain> chains, ToIntFunction<Chain> criterion, int value)
    {
        List<Chain> kept = new ArrayList<Chain>();

        for(Chain chain : chains)
            if(criterion.applyAsInt(chain) == value)
                kept.add(chain);

        return kept;
    }


    private static List<Chain> keepEqualLocants(List<Chain> chains, Function<Chain, int[]> criterion,
            int[] value)
    {
        List<Chain> kept = new ArrayList<Chain>();

        for(Chain chain : chains)
            if(Arrays.equals(criterion.apply(chain), value))
                kept.add(chain);

        return kept;
    }


    private static void check(List<Chain> chains, ToIntFunction<Chain> criterion, int threshold, String what)
    {
        for(Chain chain : chains)
            if(criterion.applyAsInt(chain) != threshold)
                throw new IllegalStateException("candidate " + chain + " does not match the " + what + " "
                        + threshold);
    }


    private static void checkLocants(List<Chain> chains, Function<Chain, int[]> criterion, int[] threshold,
            String what)
    {
        for(Chain chain : chains)
            if(!Arrays.equals(criterion.apply(chain), threshold))
                throw new IllegalStateException("candidate " + chain + " does not match the " + what + " {"
                        + Locants.join(threshold) + "}");
    }
}
