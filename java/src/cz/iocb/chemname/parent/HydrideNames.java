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
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import cz.iocb.chemname.molecule.BondType;
import cz.iocb.chemname.molecule.Molecule;
import cz.iocb.chemname.numbering.NumberingCriteria;
import cz.iocb.chemname.shared.NomenclatureDictionary;



/**
 * Composition of parent hydride names: unsaturation endings, suffix attachment with elision and skeletal
 * replacement prefixes.
 */
public class HydrideNames
{
    /**
     * Composes a hydride name from a stem and the locants of its double and triple bonds, e.g. "butane",
     * "but-1-ene", "buta-1,3-diene", "but-1-en-3-yne".
     */
    public static String compose(String stem, List<String> doubles, List<String> triples, boolean showLocants,
            NomenclatureDictionary dictionary)
    {
        if(doubles.isEmpty() && triples.isEmpty())
            return stem + "ane";

        StringBuilder builder = new StringBuilder(stem);

        /* euphonic "a" before a multiplying prefix */
        if(doubles.size() > 1 || doubles.isEmpty() && triples.size() > 1)
            builder.append('a');

        if(!doubles.isEmpty())
        {
            builder.append(locants(doubles, showLocants));
            builder.append(dictionary.getMultiplier(doubles.size()));
            builder.append(triples.isEmpty() || triples.size() > 1 ? "ene" : "en");
        }

        if(!triples.isEmpty())
        {
            builder.append(locants(triples, showLocants));
            builder.append(dictionary.getMultiplier(triples.size()));
            builder.append("yne");
        }

        return builder.toString();
    }


    private static String locants(List<String> locants, boolean show)
    {
        return show ? "-" + String.join(",", locants) + "-" : "";
    }


    /**
     * Attaches a suffix to a hydride name. The final "e" of the hydride name is elided before a suffix starting
     * with a vowel; locants, if any, are enclosed in hyphens.
     */
    public static String attachSuffix(String hydride, List<String> locants, String suffix)
    {
        String base = hydride;

        if(base.endsWith("e") && !suffix.isEmpty() && "aeiouy".indexOf(suffix.charAt(0)) >= 0)
            base = base.substring(0, base.length() - 1);

        if(locants.isEmpty())
            return base + suffix;

        return base + "-" + String.join(",", locants) + "-" + suffix;
    }


    /**
     * Returns the skeletal replacement prefixes of the heteroatoms of a numbered ring, e.g. "7-oxa" or
     * "1,4-dioxa", or an empty string.
     */
    public static String getReplacementPrefix(Molecule molecule, NomenclatureDictionary dictionary, int[] ordering,
            String[] labels)
    {
        /* keyed by seniority rank and element symbol */
        Map<String, List<String>> locantsByKey = new TreeMap<String, List<String>>();
        Map<String, String> prefixByKey = new TreeMap<String, String>();

        for(int i = 0; i < ordering.length; i++)
        {
            String symbol = molecule.getAtom(ordering[i]).symbol;

            if(symbol.equals("C"))
                continue;

            String prefix = dictionary.getReplacementPrefix(symbol);

            if(prefix == null)
                prefix = symbol.toLowerCase() + "a";

            String key = String.format("%04d%s", dictionary.getHeteroatomRank(symbol), symbol);
            prefixByKey.put(key, prefix);
            locantsByKey.computeIfAbsent(key, k -> new ArrayList<String>()).add(labels[i]);
        }

        List<String> parts = new ArrayList<String>();

        for(Map.Entry<String, List<String>> entry : locantsByKey.entrySet())
        {
            List<String> locants = entry.getValue();
            parts.add(String.join(",", locants) + "-" + dictionary.getMultiplier(locants.size())
                    + prefixByKey.get(entry.getKey()));
        }

        return String.join("-", parts);
    }


    /**
     * Names a numbered ring system as a parent hydride, including skeletal replacement prefixes and the endings of
     * its endocyclic multiple bonds.
     */
    public static String getRingHydrideName(Molecule molecule, NomenclatureDictionary dictionary, RingSystem system,
            int[] ordering, String[] labels)
    {
        return getRingHydrideName(molecule, dictionary, system, ordering, labels, true);
    }


    public static String getRingHydrideName(Molecule molecule, NomenclatureDictionary dictionary, RingSystem system,
            int[] ordering, String[] labels, boolean showLocants)
    {
        RingName name = system.getName();
        String replacement = name.isReplacement() ?
                getReplacementPrefix(molecule, dictionary, ordering, labels) : "";

        if(name.isFixed())
            return replacement + name.getFixedName();

        List<String> doubles = new ArrayList<String>();
        List<String> triples = new ArrayList<String>();
        int[] rank = new int[molecule.getAtomCount()];

        for(int i = 0; i < ordering.length; i++)
            rank[ordering[i]] = i + 1;

        List<int[]> bonds = new ArrayList<int[]>();

        for(int atom : ordering)
        {
            for(int n : molecule.getNeighbours(atom))
            {
                BondType type = molecule.getBondType(atom, n);

                if(atom < n && system.contains(n) && (type == BondType.DOUBLE || type == BondType.TRIPLE))
                    bonds.add(new int[] { NumberingCriteria.getBondLocant(rank[atom], rank[n]),
                            type == BondType.DOUBLE ? 0 : 1 });
            }
        }

        bonds.sort((a, b) -> Integer.compare(a[0], b[0]));

        for(int[] bond : bonds)
            (bond[1] == 0 ? doubles : triples).add(labels[bond[0] - 1]);

        String stem = name.getPrefix() + dictionary.getStem(name.getSize());
        return replacement + compose(stem, doubles, triples, showLocants, dictionary);
    }


    /**
     * Returns true for a saturated carbocyclic monocycle, whose atoms are all equivalent before substitution.
     */
    public static boolean isSymmetricMonocycle(Molecule molecule, RingSystem system)
    {
        if(system.getScheme() != RingSystem.Scheme.MONOCYCLE)
            return false;

        for(int atom : system.getAtoms())
        {
            if(!molecule.getAtom(atom).isCarbon())
                return false;

            for(int n : molecule.getNeighbours(atom))
            {
                BondType type = molecule.getBondType(atom, n);

                if(system.contains(n) && (type == BondType.DOUBLE || type == BondType.TRIPLE))
                    return false;
            }
        }

        return true;
    }
}
