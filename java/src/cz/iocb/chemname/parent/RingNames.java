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
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import cz.iocb.chemname.molecule.BondType;
import cz.iocb.chemname.molecule.Molecule;



/**
 * Names of ring parent hydrides: retained names of common monocycles and the composed names of the remaining
 * monocyclic, von Baeyer and spiro systems.
 */
public class RingNames
{
    private static final Map<String, String> aromaticNames;
    private static final Map<String, String> saturatedNames;


    static
    {
        Map<String, String> aromatic = new HashMap<String, String>();
        put(aromatic, "benzene", "C", "C", "C", "C", "C", "C");
        put(aromatic, "pyridine", "N", "C", "C", "C", "C", "C");
        put(aromatic, "pyridazine", "N", "N", "C", "C", "C", "C");
        put(aromatic, "pyrimidine", "N", "C", "N", "C", "C", "C");
        put(aromatic, "pyrazine", "N", "C", "C", "N", "C", "C");
        put(aromatic, "1,3,5-triazine", "N", "C", "N", "C", "N", "C");
        put(aromatic, "furan", "O", "C", "C", "C", "C");
        put(aromatic, "thiophene", "S", "C", "C", "C", "C");
        put(aromatic, "pyrrole", "N", "C", "C", "C", "C");
        put(aromatic, "imidazole", "N", "C", "N", "C", "C");
        put(aromatic, "pyrazole", "N", "N", "C", "C", "C");
        put(aromatic, "1,3-oxazole", "O", "C", "N", "C", "C");
        put(aromatic, "1,2-oxazole", "O", "N", "C", "C", "C");
        put(aromatic, "1,3-thiazole", "S", "C", "N", "C", "C");
        put(aromatic, "1,2-thiazole", "S", "N", "C", "C", "C");
        aromaticNames = Collections.unmodifiableMap(aromatic);

        Map<String, String> saturated = new HashMap<String, String>();
        put(saturated, "oxirane", "O", "C", "C");
        put(saturated, "thiirane", "S", "C", "C");
        put(saturated, "aziridine", "N", "C", "C");
        put(saturated, "oxetane", "O", "C", "C", "C");
        put(saturated, "thietane", "S", "C", "C", "C");
        put(saturated, "azetidine", "N", "C", "C", "C");
        put(saturated, "oxolane", "O", "C", "C", "C", "C");
        put(saturated, "thiolane", "S", "C", "C", "C", "C");
        put(saturated, "pyrrolidine", "N", "C", "C", "C", "C");
        put(saturated, "1,3-dioxolane", "O", "C", "O", "C", "C");
        put(saturated, "oxane", "O", "C", "C", "C", "C", "C");
        put(saturated, "thiane", "S", "C", "C", "C", "C", "C");
        put(saturated, "piperidine", "N", "C", "C", "C", "C", "C");
        put(saturated, "piperazine", "N", "C", "C", "N", "C", "C");
        put(saturated, "morpholine", "O", "C", "C", "N", "C", "C");
        put(saturated, "1,4-dioxane", "O", "C", "C", "O", "C", "C");
        put(saturated, "1,3-dioxane", "O", "C", "O", "C", "C", "C");
        put(saturated, "oxepane", "O", "C", "C", "C", "C", "C", "C");
        put(saturated, "thiepane", "S", "C", "C", "C", "C", "C", "C");
        put(saturated, "azepane", "N", "C", "C", "C", "C", "C", "C");
        saturatedNames = Collections.unmodifiableMap(saturated);
    }


    private static void put(Map<String, String> map, String name, String... symbols)
    {
        List<String> list = new ArrayList<String>();
        Collections.addAll(list, symbols);
        map.put(signature(list), name);
    }


    /**
     * Returns the smallest rotation or reflection of the element sequence around a ring.
     */
    static String signature(List<String> symbols)
    {
        int size = symbols.size();
        String best = null;

        for(int start = 0; start < size; start++)
        {
            for(int direction = -1; direction <= 1; direction += 2)
            {
                StringBuilder builder = new StringBuilder();

                for(int i = 0; i < size; i++)
                    builder.append(symbols.get(Math.floorMod(start + direction * i, size))).append(',');

                String candidate = builder.toString();

                if(best == null || candidate.compareTo(best) < 0)
                    best = candidate;
            }
        }

        return best;
    }


    public static RingName nameMonocycle(Molecule molecule, int[] ring, boolean aromatic)
    {
        List<String> symbols = new ArrayList<String>();
        boolean hetero = false;
        boolean unsaturated = false;

        for(int i = 0; i < ring.length; i++)
        {
            String symbol = molecule.getAtom(ring[i]).symbol;
            symbols.add(symbol);
            hetero |= !symbol.equals("C");

            BondType type = molecule.getBondType(ring[i], ring[(i + 1) % ring.length]);
            unsaturated |= type == BondType.DOUBLE || type == BondType.TRIPLE;
        }

        String signature = signature(symbols);

        if(aromatic && aromaticNames.containsKey(signature))
            return RingName.fixed(aromaticNames.get(signature), false);

        if(!aromatic && !unsaturated && saturatedNames.containsKey(signature))
            return RingName.fixed(saturatedNames.get(signature), false);

        return RingName.stem("cyclo", ring.length, hetero);
    }


    public static RingName nameVonBaeyer(int[] bridgeSizes, int size, boolean hetero)
    {
        StringBuilder prefix = new StringBuilder("bicyclo[");

        for(int i = 0; i < bridgeSizes.length; i++)
            prefix.append(i == 0 ? "" : ".").append(bridgeSizes[i]);

        return RingName.stem(prefix.append(']').toString(), size, hetero);
    }


    public static RingName nameSpiro(int smaller, int larger, boolean hetero)
    {
        return RingName.stem("spiro[" + smaller + "." + larger + "]", smaller + larger + 1, hetero);
    }


    public static RingName namePolycycle(String multiplier, int size, boolean hetero)
    {
        return RingName.stem(multiplier + "cyclo", size, hetero);
    }
}
