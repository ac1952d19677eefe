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
package cz.iocb.chemname.shared;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;



/**
 * Read-only nomenclature tables: alkane stems, multiplying prefixes, replacement prefixes, hydride names, ring
 * aliases and substituent aliases.
 */
public class NomenclatureDictionary
{
    private static final String[] simpleStems = { null, "meth", "eth", "prop", "but", "pent", "hex", "hept", "oct",
            "non", "dec", "undec", "dodec", "tridec", "tetradec", "pentadec", "hexadec", "heptadec", "octadec",
            "nonadec", "icos" };

    private static final String[] unitPrefixes = { null, "hen", "do", "tri", "tetra", "penta", "hexa", "hepta", "octa",
            "nona" };

    private static final String[] tenPrefixes = { null, "dec", "cos", "triacont", "tetracont", "pentacont", "hexacont",
            "heptacont", "octacont", "nonacont" };

    private static final String[] basicMultipliers = { null, "", "di", "tri", "tetra", "penta", "hexa", "hepta", "octa",
            "nona", "deca", "undeca", "dodeca" };

    private static final String[] complexMultipliers = { null, "", "bis", "tris", "tetrakis", "pentakis", "hexakis",
            "heptakis", "octakis", "nonakis", "decakis" };

    private final Map<String, String> replacementPrefixes;
    private final Map<String, Integer> heteroatomRanks;
    private final Map<String, String> hydrideNames;
    private final Map<String, Integer> hydrideValences;
    private final Map<String, String> halogenPrefixes;
    private final Map<String, String> halideNames;
    private final Map<String, String> substituentAliases;


    public NomenclatureDictionary()
    {
        Map<String, String> replacement = new HashMap<String, String>();
        replacement.put("O", "oxa");
        replacement.put("S", "thia");
        replacement.put("Se", "selena");
        replacement.put("Te", "tellura");
        replacement.put("N", "aza");
        replacement.put("P", "phospha");
        replacement.put("As", "arsa");
        replacement.put("Sb", "stiba");
        replacement.put("B", "bora");
        replacement.put("Si", "sila");
        replacement.put("Ge", "germa");
        replacement.put("Sn", "stanna");
        replacement.put("Pb", "plumba");
        replacementPrefixes = Collections.unmodifiableMap(replacement);

        /* fixed seniority table, lower is more senior */
        Map<String, Integer> ranks = new HashMap<String, Integer>();
        ranks.put("O", 1);
        ranks.put("S", 2);
        ranks.put("Se", 3);
        ranks.put("Te", 4);
        ranks.put("N", 5);
        ranks.put("P", 6);
        ranks.put("As", 7);
        ranks.put("Sb", 8);
        ranks.put("B", 9);
        ranks.put("Si", 10);
        ranks.put("Ge", 11);
        heteroatomRanks = Collections.unmodifiableMap(ranks);

        Map<String, String> hydrides = new HashMap<String, String>();
        Map<String, Integer> valences = new HashMap<String, Integer>();
        addHydride(hydrides, valences, "B", "borane", 3);
        addHydride(hydrides, valences, "Si", "silane", 4);
        addHydride(hydrides, valences, "Ge", "germane", 4);
        addHydride(hydrides, valences, "Sn", "stannane", 4);
        addHydride(hydrides, valences, "Pb", "plumbane", 4);
        addHydride(hydrides, valences, "P", "phosphane", 3);
        addHydride(hydrides, valences, "As", "arsane", 3);
        addHydride(hydrides, valences, "Sb", "stibane", 3);
        addHydride(hydrides, valences, "Bi", "bismuthane", 3);
        hydrideNames = Collections.unmodifiableMap(hydrides);
        hydrideValences = Collections.unmodifiableMap(valences);

        Map<String, String> halogens = new HashMap<String, String>();
        halogens.put("F", "fluoro");
        halogens.put("Cl", "chloro");
        halogens.put("Br", "bromo");
        halogens.put("I", "iodo");
        halogenPrefixes = Collections.unmodifiableMap(halogens);

        Map<String, String> halides = new HashMap<String, String>();
        halides.put("F", "fluoride");
        halides.put("Cl", "chloride");
        halides.put("Br", "bromide");
        halides.put("I", "iodide");
        halideNames = Collections.unmodifiableMap(halides);

        Map<String, String> aliases = new HashMap<String, String>();
        aliases.put("methyloxy", "methoxy");
        aliases.put("ethyloxy", "ethoxy");
        aliases.put("propyloxy", "propoxy");
        aliases.put("butyloxy", "butoxy");
        aliases.put("phenyloxy", "phenoxy");
        aliases.put("ethanoyl", "acetyl");
        aliases.put("methanoyl", "formyl");
        aliases.put("benzenecarbonyl", "benzoyl");
        aliases.put("aminocarbonyl", "carbamoyl");
        aliases.put("hydroxycarbonyl", "carboxy");
        substituentAliases = Collections.unmodifiableMap(aliases);
    }


    private static void addHydride(Map<String, String> names, Map<String, Integer> valences, String element,
            String name, int valence)
    {
        names.put(element, name);
        valences.put(element, valence);
    }


    /**
     * Returns the alkane stem for a chain of the given length ("meth", "eth", ..., "henicos", "docos", ...).
     */
    public String getStem(int length)
    {
        if(length < 1)
            throw new IllegalArgumentException("chain length must be positive: " + length);

        if(length < simpleStems.length)
            return simpleStems[length];

        if(length >= 100)
            throw new IllegalArgumentException("chain length is not supported: " + length);

        int units = length % 10;
        int tens = length / 10;

        if(units == 0)
            return tens == 2 ? "icos" : tenPrefixes[tens];

        String tenPart = tens == 1 ? "dec" : tens == 2 ? (units == 1 ? "icos" : "cos") : tenPrefixes[tens];
        String unitPart = units == 1 && tens == 1 ? "un" : unitPrefixes[units];

        return unitPart + tenPart;
    }


    public String getMultiplier(int count)
    {
        if(count < 1 || count >= basicMultipliers.length)
            throw new IllegalArgumentException("unsupported multiplicity: " + count);

        return basicMultipliers[count];
    }


    public String getComplexMultiplier(int count)
    {
        if(count < 1 || count >= complexMultipliers.length)
            throw new IllegalArgumentException("unsupported multiplicity: " + count);

        return complexMultipliers[count];
    }


    public String getReplacementPrefix(String element)
    {
        return replacementPrefixes.get(element);
    }


    /**
     * Returns the seniority rank of a ring heteroatom, 999 for elements outside the table.
     */
    public int getHeteroatomRank(String element)
    {
        return heteroatomRanks.getOrDefault(element, 999);
    }


    public boolean isHydrideElement(String element)
    {
        return hydrideNames.containsKey(element);
    }


    public String getHydrideName(String element)
    {
        return hydrideNames.get(element);
    }


    public int getHydrideValence(String element)
    {
        return hydrideValences.getOrDefault(element, -1);
    }


    public String getHalogenPrefix(String element)
    {
        return halogenPrefixes.get(element);
    }


    public String getHalideName(String element)
    {
        return halideNames.get(element);
    }


    /**
     * Returns the preferred spelling of a composed substituent prefix, or the prefix itself.
     */
    public String getSubstituentAlias(String prefix)
    {
        return substituentAliases.getOrDefault(prefix, prefix);
    }
}
