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
package cz.iocb.chemname.assembly;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import cz.iocb.chemname.engine.ContextState;
import cz.iocb.chemname.engine.ExecutionPhase;
import cz.iocb.chemname.engine.NamingContext;
import cz.iocb.chemname.engine.NomenclatureMethod;
import cz.iocb.chemname.engine.Rule;
import cz.iocb.chemname.engine.RuleConflict;
import cz.iocb.chemname.engine.RuleConflict.ConflictType;
import cz.iocb.chemname.engine.RulePriority;
import cz.iocb.chemname.groups.FunctionalGroup;
import cz.iocb.chemname.groups.FunctionalGroupType;
import cz.iocb.chemname.parent.Substituent;
import cz.iocb.chemname.shared.NomenclatureDictionary;



/**
 * Name assembly: alphabetized prefixes, the parent name with its suffix, the method-specific full name, and the
 * final normalization and validation.
 */
public class NameAssemblyRules
{
    public static final Rule PREFIX_GROUPS = new Rule("prefix-groups", "Alphanumerical order of prefixes", "P-14.5",
            ExecutionPhase.ASSEMBLY, RulePriority.HUNDRED,
            context -> getAssembly(context).getPrefixGroups() == null,
            NameAssemblyRules::groupPrefixes);

    public static final Rule PREFIX_TEXT = new Rule("prefix-text", "Locants and multiplying prefixes", "P-16.9",
            ExecutionPhase.ASSEMBLY, RulePriority.NINETY,
            context -> getAssembly(context).getPrefixGroups() != null && getAssembly(context).getPrefixText() == null,
            NameAssemblyRules::citePrefixes);

    public static final Rule PARENT_NAME = new Rule("parent-name", "Parent hydride and suffixes", "P-31.1.4",
            ExecutionPhase.ASSEMBLY, RulePriority.EIGHTY,
            context -> getAssembly(context).getPrefixText() != null && getAssembly(context).getParentName() == null,
            NameAssemblyRules::nameParent);

    public static final Rule FULL_NAME = new Rule("full-name", "Method-specific name construction", "P-51",
            ExecutionPhase.ASSEMBLY, RulePriority.SEVENTY,
            context -> getAssembly(context).getParentName() != null && getAssembly(context).getFullName() == null,
            NameAssemblyRules::assembleName);

    public static final Rule FINAL_NAME = new Rule("final-name", "Name validation and formatting", "P-16",
            ExecutionPhase.ASSEMBLY, RulePriority.SIXTY,
            context -> getAssembly(context).getFullName() != null && context.getState().getFinalName() == null,
            NameAssemblyRules::finishName);


    public static List<Rule> rules()
    {
        return Arrays.asList(PREFIX_GROUPS, PREFIX_TEXT, PARENT_NAME, FULL_NAME, FINAL_NAME);
    }


    private static AssemblyState getAssembly(NamingContext context)
    {
        AssemblyState assembly = context.getState().getAssembly();
        return assembly == null ? AssemblyState.EMPTY : assembly;
    }


    private static NamingContext groupPrefixes(NamingContext context, Rule rule)
    {
        List<Substituent> substituents = context.getState().getNumbering().getSubstituents();

        if(substituents == null)
            throw new IllegalStateException("substituents are not numbered");

        List<PrefixGroup> groups = PrefixGroup.group(substituents);
        AssemblyState assembly = getAssembly(context).withPrefixGroups(groups);

        return context.withStateUpdate(builder -> builder.setAssembly(assembly), rule,
                groups.size() + " prefix groups " + groups);
    }


    /*
     * Nitrogen locants are always cited; numeric locants follow the omission rules of the parent.
     */
    private static NamingContext citePrefixes(NamingContext context, Rule rule)
    {
        ContextState state = context.getState();
        NomenclatureDictionary dictionary = context.getServices().getDictionary();
        boolean numeric = ParentNameBuilder.showSubstituentLocants(state);
        List<String> fragments = new ArrayList<String>();

        for(PrefixGroup group : getAssembly(context).getPrefixGroups())
            fragments.add(group.render(dictionary, numeric || isNitrogenGroup(group)));

        String text = PrefixGroup.join(fragments);
        AssemblyState assembly = getAssembly(context).withPrefixText(text);

        return context.withStateUpdate(builder -> builder.setAssembly(assembly), rule,
                text.isEmpty() ? "no prefixes" : "prefixes " + text);
    }


    private static boolean isNitrogenGroup(PrefixGroup group)
    {
        for(String locant : group.getLocants())
            if(!locant.equals("N"))
                return false;

        return true;
    }


    private static NamingContext nameParent(NamingContext context, Rule rule)
    {
        String name = ParentNameBuilder.build(context.getState(), context.getServices().getDictionary());
        AssemblyState assembly = getAssembly(context).withParentName(name);

        return context.withStateUpdate(builder -> builder.setAssembly(assembly), rule, "parent name " + name);
    }


    private static NamingContext assembleName(NamingContext context, Rule rule)
    {
        ContextState state = context.getState();
        AssemblyState assembly = getAssembly(context);
        String name = null;
        String method = NomenclatureMethod.SUBSTITUTIVE.getLabel();

        if(state.getNomenclatureMethod() == NomenclatureMethod.FUNCTIONAL_CLASS || citesEster(state))
        {
            FunctionalClassNamer namer = new FunctionalClassNamer(context.getServices().getDictionary(),
                    context.getServices().getSubstituentNamer());
            name = namer.name(state, assembly.getPrefixText(), assembly.getParentName());

            if(name != null)
                method = NomenclatureMethod.FUNCTIONAL_CLASS.getLabel();
        }

        if(name == null)
            name = PrefixGroup.join(Arrays.asList(assembly.getPrefixText(), assembly.getParentName()));

        AssemblyState next = assembly.withFullName(name);
        List<FunctionalGroup> groups = new ArrayList<FunctionalGroup>();

        /* the principal groups keep the name they were expressed in */
        for(FunctionalGroup group : state.getFunctionalGroups())
            groups.add(group.isPrincipal() ? group.withAssembledName(name) : group);

        return context.withStateUpdate(builder -> builder.setAssembly(next).setFunctionalGroups(groups), rule,
                method + " name " + name);
    }


    /*
     * An ester cited as the suffix of a substitutively named parent still needs its alkyl word.
     */
    private static boolean citesEster(ContextState state)
    {
        List<FunctionalGroup> cited = ParentNameBuilder.getCitedGroups(state);

        for(FunctionalGroup group : cited)
            if(group.getType() != FunctionalGroupType.ESTER)
                return false;

        return !cited.isEmpty();
    }


    private static NamingContext finishName(NamingContext context, Rule rule)
    {
        String name = NameFormatter.format(getAssembly(context).getFullName());
        String problem = NameFormatter.validate(name, context.getConfiguration().getMaxNameLength());
        NamingContext next = context.withStateUpdate(builder -> builder.setFinalName(name), rule, "final name " + name);

        if(problem == null)
            return next;

        RuleConflict conflict = new RuleConflict(rule.getId(), ConflictType.STATE_INCONSISTENCY,
                ExecutionPhase.ASSEMBLY, problem + ": " + name);

        return next.withConflict(conflict, rule, "invalid name: " + problem);
    }
}
