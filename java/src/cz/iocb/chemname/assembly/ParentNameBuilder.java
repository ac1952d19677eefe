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
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import cz.iocb.chemname.engine.ContextState;
import cz.iocb.chemname.groups.FunctionalGroup;
import cz.iocb.chemname.groups.FunctionalGroupType;
import cz.iocb.chemname.groups.GroupNames;
import cz.iocb.chemname.molecule.BondType;
import cz.iocb.chemname.molecule.Molecule;
import cz.iocb.chemname.numbering.Numbering;
import cz.iocb.chemname.parent.ChainParent;
import cz.iocb.chemname.parent.HydrideNames;
import cz.iocb.chemname.parent.ParentStructure;
import cz.iocb.chemname.parent.ParentStructure.ParentType;
import cz.iocb.chemname.parent.RingParent;
import cz.iocb.chemname.parent.RingSystem;
import cz.iocb.chemname.parent.Substituent;
import cz.iocb.chemname.shared.NomenclatureDictionary;



/**
 * Builds the parent part of a name: the parent hydride with its unsaturation endings and the suffix of the
 * principal characteristic groups, or a retained name.
 */
public class ParentNameBuilder
{
    /* suffixes that always end a chain and are cited without locants */
    private static final Set<FunctionalGroupType> terminalSuffixes = EnumSet.of(FunctionalGroupType.CARBOXYLIC_ACID,
            FunctionalGroupType.ANHYDRIDE, FunctionalGroupType.ESTER, FunctionalGroupType.ACYL_HALIDE,
            FunctionalGroupType.AMIDE, FunctionalGroupType.NITRILE, FunctionalGroupType.ALDEHYDE,
            FunctionalGroupType.THIOESTER);

    private static final Map<FunctionalGroupType, String> acetylNames = new EnumMap<>(FunctionalGroupType.class);
    private static final Map<FunctionalGroupType, String> formylNames = new EnumMap<>(FunctionalGroupType.class);
    private static final Map<FunctionalGroupType, String> benzeneNames = new EnumMap<>(FunctionalGroupType.class);


    static
    {
        acetylNames.put(FunctionalGroupType.CARBOXYLIC_ACID, "acetic acid");
        acetylNames.put(FunctionalGroupType.ESTER, toAnion("acetic acid"));
        acetylNames.put(FunctionalGroupType.AMIDE, "acetamide");
        acetylNames.put(FunctionalGroupType.ALDEHYDE, "acetaldehyde");
        acetylNames.put(FunctionalGroupType.NITRILE, "acetonitrile");
        acetylNames.put(FunctionalGroupType.ACYL_HALIDE, "acetyl");

        formylNames.put(FunctionalGroupType.CARBOXYLIC_ACID, "formic acid");
        formylNames.put(FunctionalGroupType.ESTER, toAnion("formic acid"));
        formylNames.put(FunctionalGroupType.AMIDE, "formamide");
        formylNames.put(FunctionalGroupType.ALDEHYDE, "formaldehyde");
        formylNames.put(FunctionalGroupType.ACYL_HALIDE, "formyl");

        benzeneNames.put(FunctionalGroupType.ALCOHOL, "phenol");
        benzeneNames.put(FunctionalGroupType.AMINE, "aniline");
        benzeneNames.put(FunctionalGroupType.CARBOXYLIC_ACID, "benzoic acid");
        benzeneNames.put(FunctionalGroupType.ESTER, toAnion("benzoic acid"));
        benzeneNames.put(FunctionalGroupType.ALDEHYDE, "benzaldehyde");
        benzeneNames.put(FunctionalGroupType.NITRILE, "benzonitrile");
        benzeneNames.put(FunctionalGroupType.AMIDE, "benzamide");
        benzeneNames.put(FunctionalGroupType.ACYL_HALIDE, "benzoyl");
    }


    public static String build(ContextState state, NomenclatureDictionary dictionary)
    {
        ParentStructure parent = state.getParentStructure();

        switch(parent.getType())
        {
            case CHAIN:
                return buildChain(state, (ChainParent) parent, dictionary);
            case RING:
                return buildRing(state, (RingParent) parent, dictionary);
            default:
                return parent.getName();
        }
    }


    /**
     * Converts an acid name to the name of its anion: "-oic acid" to "-oate", "-ic acid" to "-ate" and
     * "carboxylic acid" to "carboxylate".
     */
    public static String toAnion(String acid)
    {
        if(acid.endsWith("oic acid"))
            return acid.substring(0, acid.length() - "oic acid".length()) + "oate";

        if(acid.endsWith("ic acid"))
            return acid.substring(0, acid.length() - "ic acid".length()) + "ate";

        return acid;
    }


    private static String buildChain(ContextState state, ChainParent parent, NomenclatureDictionary dictionary)
    {
        Molecule molecule = state.getMolecule();
        Numbering numbering = state.getNumbering();
        int[] atoms = numbering.getOrderedAtoms();
        int length = atoms.length;

        List<String> doubles = new ArrayList<String>();
        List<String> triples = new ArrayList<String>();

        for(int i = 0; i + 1 < length; i++)
        {
            BondType type = molecule.getBondType(atoms[i], atoms[i + 1]);

            if(type == BondType.DOUBLE)
                doubles.add(numbering.getLabel(atoms[i]));
            else if(type == BondType.TRIPLE)
                triples.add(numbering.getLabel(atoms[i]));
        }

        List<FunctionalGroup> principal = getCitedGroups(state);
        int bonds = doubles.size() + triples.size();
        boolean hasSuffix = !principal.isEmpty();

        if(bonds == 0 && principal.size() == 1 && !hasCarbonSubstituents(parent))
        {
            Map<FunctionalGroupType, String> retained = length == 2 ? acetylNames : length == 1 ? formylNames : null;
            String name = retained == null ? null : retained.get(principal.get(0).getType());

            if(name != null)
                return name;
        }

        boolean unsaturationLocants = !(length == 2
                || length == 3 && bonds == 1 && !hasSuffix && parent.getSubstituents().isEmpty());
        String hydride = HydrideNames.compose(dictionary.getStem(length), doubles, triples, unsaturationLocants,
                dictionary);

        if(!hasSuffix)
            return hydride;

        FunctionalGroupType type = principal.get(0).getType();
        boolean locants = !terminalSuffixes.contains(type) && length > 1
                && !(length <= 2 && countFeatures(state) == 1);

        return attachSuffix(hydride, principal, locants, parent, dictionary);
    }


    private static String buildRing(ContextState state, RingParent parent, NomenclatureDictionary dictionary)
    {
        Molecule molecule = state.getMolecule();
        Numbering numbering = state.getNumbering();
        RingSystem ring = parent.getRing();
        List<FunctionalGroup> principal = getCitedGroups(state);

        if(parent.getName().equals("benzene") && principal.size() == 1)
        {
            FunctionalGroup group = principal.get(0);
            String name = benzeneNames.get(group.getType());

            if(name != null && !ring.contains(group.getKeyAtom()))
                return name;
        }

        boolean features = !principal.isEmpty() || !parent.getSubstituents().isEmpty();
        boolean unsaturationLocants = features || countRingMultipleBonds(molecule, ring) > 1;
        String hydride = HydrideNames.getRingHydrideName(molecule, dictionary, ring, numbering.getOrderedAtoms(),
                numbering.getLabels(), unsaturationLocants);

        if(principal.isEmpty())
            return hydride;

        boolean locants = !(isSymmetric(molecule, parent) && countFeatures(state) == 1);

        return attachSuffix(hydride, principal, locants, parent, dictionary);
    }


    private static String attachSuffix(String hydride, List<FunctionalGroup> principal, boolean showLocants,
            ParentStructure parent, NomenclatureDictionary dictionary)
    {
        FunctionalGroup first = principal.get(0);
        String suffix = parent.contains(first.getKeyAtom()) ? GroupNames.getSuffix(first.getType()) :
                GroupNames.getAttachedSuffix(first.getType());

        if(suffix == null)
            return hydride;

        List<String> locants = new ArrayList<String>();

        for(FunctionalGroup group : principal)
            locants.addAll(group.getLocants());

        locants.sort(PrefixGroup.LOCANT_ORDER);

        String multiplied = dictionary.getMultiplier(principal.size()) + suffix;

        return HydrideNames.attachSuffix(hydride, showLocants ? locants : Collections.emptyList(), multiplied);
    }


    /**
     * Returns the principal groups expressed by the suffix, i.e. the principal groups located on the parent.
     */
    static List<FunctionalGroup> getCitedGroups(ContextState state)
    {
        List<FunctionalGroup> cited = new ArrayList<FunctionalGroup>();

        for(FunctionalGroup group : state.getPrincipalGroups())
            if(!group.getLocants().isEmpty())
                cited.add(group);

        return cited;
    }


    private static boolean hasCarbonSubstituents(ParentStructure parent)
    {
        for(Substituent substituent : parent.getSubstituents())
            if(!substituent.isNitrogen())
                return true;

        return false;
    }


    /**
     * Counts the features that need numeric locants: principal groups, detachable prefixes on parent atoms and
     * multiple bonds.
     */
    static int countFeatures(ContextState state)
    {
        ParentStructure parent = state.getParentStructure();
        int count = getCitedGroups(state).size();

        for(Substituent substituent : parent.getSubstituents())
            if(!substituent.isNitrogen())
                count++;

        if(parent.getType() == ParentType.CHAIN)
            count += ((ChainParent) parent).getChain().getMultipleBondCount();

        return count;
    }


    private static int countRingMultipleBonds(Molecule molecule, RingSystem ring)
    {
        int count = 0;

        for(int atom : ring.getAtoms())
        {
            for(int n : molecule.getNeighbours(atom))
            {
                BondType type = molecule.getBondType(atom, n);

                if(atom < n && ring.contains(n) && (type == BondType.DOUBLE || type == BondType.TRIPLE))
                    count++;
            }
        }

        return count;
    }


    private static boolean isSymmetric(Molecule molecule, ParentStructure parent)
    {
        return parent.getType() == ParentType.RING
                && HydrideNames.isSymmetricMonocycle(molecule, ((RingParent) parent).getRing());
    }


    /**
     * Returns true if the numeric locants of the detachable prefixes are cited. Locants are omitted for a
     * mononuclear parent hydride, a one-carbon chain, and a two-carbon chain or a symmetric monocycle bearing a single
     * feature.
     */
    public static boolean showSubstituentLocants(ContextState state)
    {
        ParentStructure parent = state.getParentStructure();

        switch(parent.getType())
        {
            case HETEROATOM:
                return false;
            case CHAIN:
                int length = ((ChainParent) parent).getChain().getLength();
                return length > 2 || length == 2 && countFeatures(state) > 1;
            default:
                return !(isSymmetric(state.getMolecule(), parent) && countFeatures(state) == 1);
        }
    }
}
