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
package cz.iocb.chemname.groups;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import cz.iocb.chemname.analysis.AtomicAnalysis;
import cz.iocb.chemname.engine.ExecutionPhase;
import cz.iocb.chemname.engine.NamingContext;
import cz.iocb.chemname.engine.Rule;
import cz.iocb.chemname.engine.RulePriority;



public class FunctionalGroupRules
{
    public static final Rule DETECTION = new Rule("functional-group-detection", "Characteristic group detection",
            "P-41", ExecutionPhase.FUNCTIONAL_GROUPS, RulePriority.HUNDRED,
            context -> context.getState().getFunctionalGroups().isEmpty(),
            FunctionalGroupRules::detectGroups);

    public static final Rule PRINCIPAL_SELECTION = new Rule("principal-group-selection",
            "Principal characteristic group selection", "P-41", ExecutionPhase.FUNCTIONAL_GROUPS,
            RulePriority.NINETY,
            context -> !context.getState().getFunctionalGroups().isEmpty()
                    && context.getState().getPrincipalGroups().isEmpty(),
            FunctionalGroupRules::selectPrincipal);


    public static List<Rule> rules()
    {
        return Arrays.asList(DETECTION, PRINCIPAL_SELECTION);
    }


    private static NamingContext detectGroups(NamingContext context, Rule rule)
    {
        AtomicAnalysis analysis = context.getState().getAtomicAnalysis();
        List<FunctionalGroup> groups = context.getServices().getDetector().detect(context.getMolecule(), analysis);

        return context.withFunctionalGroups(groups, rule, "detected " + groups.size() + " characteristic groups");
    }


    private static NamingContext selectPrincipal(NamingContext context, Rule rule)
    {
        List<FunctionalGroup> groups = markPrincipal(context.getState().getFunctionalGroups());
        int count = 0;
        String type = "-";

        for(FunctionalGroup group : groups)
        {
            if(group.isPrincipal())
            {
                count++;
                type = group.getType().getLabel();
            }
        }

        return context.withFunctionalGroups(groups, rule, count + " principal groups of type " + type);
    }


    /**
     * Returns the groups with the principal flag set on exactly those principal-capable groups whose priority equals
     * the maximum among them.
     */
    public static List<FunctionalGroup> markPrincipal(List<FunctionalGroup> groups)
    {
        int max = Integer.MIN_VALUE;

        for(FunctionalGroup group : groups)
            if(group.getType().isPrincipalCapable())
                max = Math.max(max, group.getPriority());

        List<FunctionalGroup> marked = new ArrayList<FunctionalGroup>(groups.size());

        for(FunctionalGroup group : groups)
            marked.add(group.withPrincipal(group.getType().isPrincipalCapable() && group.getPriority() == max));

        return marked;
    }
}
