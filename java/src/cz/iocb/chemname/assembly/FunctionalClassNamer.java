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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import cz.iocb.chemname.analysis.AtomicAnalysis;
import cz.iocb.chemname.engine.ContextState;
import cz.iocb.chemname.groups.FunctionalGroup;
import cz.iocb.chemname.method.EsterClassifier;
import cz.iocb.chemname.molecule.Molecule;
import cz.iocb.chemname.parent.Substituent;
import cz.iocb.chemname.shared.Alphanumerics;
import cz.iocb.chemname.shared.NomenclatureDictionary;



/**
 * Builds functional class names, in which the principal characteristic group is expressed by a separate class word:
 * esters ("methyl acetate"), thioesters ("S-methyl ethanethioate"), anhydrides ("acetic anhydride"), acyl halides
 * ("acetyl chloride") and thiocyanates ("methyl thiocyanate").
 */
public class FunctionalClassNamer
{
    private final NomenclatureDictionary dictionary;
    private final SubstituentNamer namer;


    public FunctionalClassNamer(NomenclatureDictionary dictionary, SubstituentNamer namer)
    {
        this.dictionary = dictionary;
        this.namer = namer;
    }


    /**
     * Returns the functional class name, or null if the principal groups have no functional class rendering and the
     * substitutive name is to be used.
     *
     * @param parentName the name of the parent with its suffix, e.g. "butanedioate" or "acetyl"
     */
    public String name(ContextState state, String prefixText, String parentName)
    {
        List<FunctionalGroup> principal = ParentNameBuilder.getCitedGroups(state);

        if(principal.isEmpty())
            return null;

        for(FunctionalGroup group : principal)
            if(group.getType() != principal.get(0).getType())
                return null;

        String acid = PrefixGroup.join(Arrays.asList(prefixText, parentName));

        switch(principal.get(0).getType())
        {
            case ESTER:
                return nameEster(state, principal, acid, null);
            case THIOESTER:
                return nameEster(state, principal, acid, "S");
            case ACYL_HALIDE:
                return nameAcylHalide(state.getMolecule(), principal, acid);
            case ANHYDRIDE:
                return principal.size() == 1 ? nameAnhydride(state, principal.get(0)) : null;
            case THIOCYANATE:
                return principal.size() == 1 ? nameThiocyanate(state, principal.get(0)) : null;
            default:
                return null;
        }
    }


    /*
     * The alkyl groups on the single-bonded heteroatoms are cited as separate words before the anion name.
     */
    private String nameEster(ContextState state, List<FunctionalGroup> esters, String anion, String locant)
    {
        Molecule molecule = state.getMolecule();
        AtomicAnalysis analysis = state.getAtomicAnalysis();
        Map<String, Integer> counts = new LinkedHashMap<String, Integer>();
        Map<String, Boolean> compound = new LinkedHashMap<String, Boolean>();

        for(FunctionalGroup ester : esters)
        {
            int heteroatom = ester.getAtom(2);
            int root = getOuterNeighbour(molecule, heteroatom, ester.getAtom(0));

            if(root < 0)
                return null;

            Substituent alkyl = namer.name(molecule, analysis, root, heteroatom, getAcylSide(ester, molecule));
            counts.merge(alkyl.getName(), 1, Integer::sum);
            compound.merge(alkyl.getName(), alkyl.isCompound(), Boolean::logicalOr);
        }

        List<String> names = new ArrayList<String>(counts.keySet());
        names.sort(Alphanumerics.COMPARATOR);

        StringBuilder builder = new StringBuilder();

        for(String name : names)
        {
            int count = counts.get(name);

            if(locant != null)
                builder.append(String.join(",", Collections.nCopies(count, locant))).append('-');

            if(count == 1)
                builder.append(name);
            else if(compound.get(name))
                builder.append(dictionary.getComplexMultiplier(count)).append('(').append(name).append(')');
            else
                builder.append(dictionary.getMultiplier(count)).append(name);

            builder.append(' ');
        }

        return builder.append(anion).toString();
    }


    private String nameAcylHalide(Molecule molecule, List<FunctionalGroup> halides, String acyl)
    {
        String element = molecule.getAtom(halides.get(0).getAtom(2)).symbol;

        for(FunctionalGroup halide : halides)
            if(!molecule.getAtom(halide.getAtom(2)).symbol.equals(element))
                return null;

        String halide = dictionary.getHalideName(element);

        if(halide == null)
            return null;

        return acyl + " " + dictionary.getMultiplier(halides.size()) + halide;
    }


    /*
     * Both acyl groups are named as acids; symmetric anhydrides cite the acid once.
     */
    private String nameAnhydride(ContextState state, FunctionalGroup anhydride)
    {
        Molecule molecule = state.getMolecule();
        AtomicAnalysis analysis = state.getAtomicAnalysis();
        int bridge = anhydride.getAtom(2);

        boolean[] outer = EsterClassifier.getAlkoxySubtree(anhydride, molecule);
        boolean[] inner = new boolean[outer.length];

        for(int i = 0; i < outer.length; i++)
            inner[i] = !outer[i];

        boolean[] blocked = outer.clone();
        blocked[bridge] = true;

        String first = toAcid(namer.name(molecule, analysis, anhydride.getAtom(0), bridge, blocked).getName());
        String second = toAcid(namer.name(molecule, analysis, anhydride.getAtom(3), bridge, inner).getName());

        if(first == null || second == null)
            return null;

        if(first.equals(second))
            return first + " anhydride";

        List<String> acids = new ArrayList<String>(Arrays.asList(first, second));
        acids.sort(Alphanumerics.COMPARATOR);

        return acids.get(0) + " " + acids.get(1) + " anhydride";
    }


    private String nameThiocyanate(ContextState state, FunctionalGroup thiocyanate)
    {
        Molecule molecule = state.getMolecule();
        int sulfur = thiocyanate.getAtom(0);
        int root = getOuterNeighbour(molecule, sulfur, thiocyanate.getAtom(1));

        if(root < 0)
            return null;

        boolean[] blocked = new boolean[molecule.getAtomCount()];

        for(int atom : thiocyanate.getAtoms())
            blocked[atom] = true;

        Substituent alkyl = namer.name(molecule, state.getAtomicAnalysis(), root, sulfur, blocked);

        return alkyl.getName() + " thiocyanate";
    }


    /**
     * Converts an acyl prefix to the first word of the corresponding acid name, e.g. "propanoyl" to "propanoic",
     * "cyclohexanecarbonyl" to "cyclohexanecarboxylic", or returns null.
     */
    static String toAcid(String acyl)
    {
        switch(acyl)
        {
            case "formyl":
                return "formic";
            case "acetyl":
                return "acetic";
            case "benzoyl":
                return "benzoic";
            default:
                break;
        }

        if(acyl.endsWith("oyl"))
            return acyl.substring(0, acyl.length() - "oyl".length()) + "oic";

        if(acyl.endsWith("carbonyl"))
            return acyl.substring(0, acyl.length() - "carbonyl".length()) + "carboxylic";

        return null;
    }


    private static boolean[] getAcylSide(FunctionalGroup ester, Molecule molecule)
    {
        boolean[] outer = EsterClassifier.getAlkoxySubtree(ester, molecule);
        boolean[] blocked = new boolean[outer.length];

        for(int i = 0; i < outer.length; i++)
            blocked[i] = !outer[i];

        return blocked;
    }


    private static int getOuterNeighbour(Molecule molecule, int heteroatom, int inner)
    {
        for(int n : molecule.getNeighbours(heteroatom))
            if(n != inner)
                return n;

        return -1;
    }
}
