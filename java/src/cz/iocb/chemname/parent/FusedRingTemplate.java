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
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import cz.iocb.chemname.molecule.Molecule;



/**
 * Retained names of aromatic ortho-fused ring systems with their fixed peripheral numbering. A template lists the
 * locants in the order of the periphery; locants with a letter belong to fusion atoms.
 */
public final class FusedRingTemplate
{
    /**
     * Result of a template match: the name, the labels in locant order and every numbering that fits the template,
     * each as the list of atoms in locant order.
     */
    public static final class Match
    {
        private final RingName name;
        private final String[] labels;
        private final List<int[]> orderings;


        private Match(RingName name, String[] labels, List<int[]> orderings)
        {
            this.name = name;
            this.labels = labels;
            this.orderings = orderings;
        }


        public RingName getName()
        {
            return name;
        }


        public String[] getLabels()
        {
            return labels.clone();
        }


        public List<int[]> getOrderings()
        {
            return orderings;
        }
    }


    private static final String[] NAPHTHALENE = { "1", "2", "3", "4", "4a", "5", "6", "7", "8", "8a" };
    private static final String[] INDENE = { "1", "2", "3", "3a", "4", "5", "6", "7", "7a" };
    private static final String[] ANTHRACENE = {
            "1", "2", "3", "4", "4a", "10", "10a", "5", "6", "7", "8", "8a", "9", "9a" };
    private static final String[] PHENANTHRENE = {
            "1", "2", "3", "4", "4a", "4b", "5", "6", "7", "8", "8a", "9", "10", "10a" };
    private static final String[] FLUORENE = { "1", "2", "3", "4", "4a", "4b", "5", "6", "7", "8", "8a", "9", "9a" };

    private static final List<FusedRingTemplate> templates = new ArrayList<FusedRingTemplate>();


    static
    {
        add("naphthalene", NAPHTHALENE);
        add("quinoline", NAPHTHALENE, "1", "N");
        add("isoquinoline", NAPHTHALENE, "2", "N");
        add("cinnoline", NAPHTHALENE, "1", "N", "2", "N");
        add("quinazoline", NAPHTHALENE, "1", "N", "3", "N");
        add("quinoxaline", NAPHTHALENE, "1", "N", "4", "N");
        add("phthalazine", NAPHTHALENE, "2", "N", "3", "N");

        add("indene", INDENE);
        add("indole", INDENE, "1", "N");
        add("isoindole", INDENE, "2", "N");
        add("benzofuran", INDENE, "1", "O");
        add("benzothiophene", INDENE, "1", "S");
        add("indazole", INDENE, "1", "N", "2", "N");
        add("benzimidazole", INDENE, "1", "N", "3", "N");
        add("benzoxazole", INDENE, "1", "O", "3", "N");
        add("benzothiazole", INDENE, "1", "S", "3", "N");

        add("anthracene", ANTHRACENE);
        add("acridine", ANTHRACENE, "10", "N");
        add("phenanthrene", PHENANTHRENE);

        add("fluorene", FLUORENE);
        add("carbazole", FLUORENE, "9", "N");
    }


    private final String name;
    private final String[] labels;
    private final String[] elements;
    private final boolean[] fusion;
    private final int[] locantOrder;


    private FusedRingTemplate(String name, String[] labels, Map<String, String> heteroatoms)
    {
        this.name = name;
        this.labels = labels;
        this.elements = new String[labels.length];
        this.fusion = new boolean[labels.length];

        for(int i = 0; i < labels.length; i++)
        {
            elements[i] = heteroatoms.getOrDefault(labels[i], "C");
            fusion[i] = Character.isLetter(labels[i].charAt(labels[i].length() - 1));
        }

        Integer[] order = new Integer[labels.length];

        for(int i = 0; i < order.length; i++)
            order[i] = i;

        Arrays.sort(order, Comparator.comparingInt((Integer i) -> numericPart(labels[i]))
                .thenComparing(i -> labels[i]));

        this.locantOrder = Arrays.stream(order).mapToInt(Integer::intValue).toArray();
    }


    private static void add(String name, String[] labels, String... heteroatoms)
    {
        Map<String, String> map = new HashMap<String, String>();

        for(int i = 0; i < heteroatoms.length; i += 2)
            map.put(heteroatoms[i], heteroatoms[i + 1]);

        templates.add(new FusedRingTemplate(name, labels, map));
    }


    private static int numericPart(String label)
    {
        int end = 0;

        while(end < label.length() && Character.isDigit(label.charAt(end)))
            end++;

        return Integer.parseInt(label.substring(0, end));
    }


    /**
     * Finds the retained name of an aromatic ortho-fused ring system. Heteroatoms not covered by any retained name
     * are expressed by replacement prefixes on the carbocyclic name with the same skeleton. Returns null if no
     * template has the skeleton of the ring system.
     */
    public static Match find(Molecule molecule, List<int[]> rings)
    {
        int[] periphery = getPeriphery(molecule.getAtomCount(), rings);

        if(periphery == null)
            return null;

        boolean[] fused = new boolean[periphery.length];
        boolean hetero = false;

        for(int i = 0; i < periphery.length; i++)
        {
            fused[i] = countRings(rings, periphery[i]) > 1;
            hetero |= !molecule.getAtom(periphery[i]).isCarbon();
        }

        for(FusedRingTemplate template : templates)
        {
            List<int[]> orderings = template.match(molecule, periphery, fused, true);

            if(!orderings.isEmpty())
                return new Match(RingName.fixed(template.name, false), template.getLabels(), orderings);
        }

        if(!hetero)
            return null;

        for(FusedRingTemplate template : templates)
        {
            if(!template.isCarbocyclic())
                continue;

            List<int[]> orderings = template.match(molecule, periphery, fused, false);

            if(!orderings.isEmpty())
                return new Match(RingName.fixed(template.name, true), template.getLabels(), orderings);
        }

        return null;
    }


    private boolean isCarbocyclic()
    {
        for(String element : elements)
            if(!element.equals("C"))
                return false;

        return true;
    }


    private String[] getLabels()
    {
        String[] result = new String[labels.length];

        for(int i = 0; i < result.length; i++)
            result[i] = labels[locantOrder[i]];

        return result;
    }


    /*
     * Every start on the periphery and both directions are tried; the fusion atoms and, if requested, the elements
     * have to agree with the template.
     */
    private List<int[]> match(Molecule molecule, int[] periphery, boolean[] fused, boolean checkElements)
    {
        int size = periphery.length;
        List<int[]> result = new ArrayList<int[]>();

        if(size != labels.length)
            return result;

        for(int start = 0; start < size; start++)
        {
            for(int direction = 1; direction >= -1; direction -= 2)
            {
                int[] sequence = new int[size];
                boolean matches = true;

                for(int i = 0; i < size && matches; i++)
                {
                    int index = Math.floorMod(start + direction * i, size);
                    sequence[i] = periphery[index];
                    matches = fused[index] == fusion[i]
                            && (!checkElements || molecule.getAtom(periphery[index]).symbol.equals(elements[i]));
                }

                if(!matches)
                    continue;

                int[] ordering = new int[size];

                for(int i = 0; i < size; i++)
                    ordering[i] = sequence[locantOrder[i]];

                result.add(ordering);
            }
        }

        return result;
    }


    /**
     * Returns the atoms of the periphery in cyclic order, or null if some atom lies inside the ring system or the
     * peripheral bonds do not form a single cycle. A peripheral bond belongs to exactly one ring.
     */
    static int[] getPeriphery(int atomCount, List<int[]> rings)
    {
        Map<Long, Integer> bondRings = new HashMap<Long, Integer>();

        for(int[] ring : rings)
            for(int i = 0; i < ring.length; i++)
                bondRings.merge(bondKey(ring[i], ring[(i + 1) % ring.length], atomCount), 1, Integer::sum);

        List<List<Integer>> neighbours = new ArrayList<List<Integer>>(Collections.nCopies(atomCount, null));
        int members = 0;

        for(Map.Entry<Long, Integer> entry : bondRings.entrySet())
        {
            if(entry.getValue() != 1)
                continue;

            int a = (int) (entry.getKey() / atomCount);
            int b = (int) (entry.getKey() % atomCount);

            for(int[] pair : new int[][] { { a, b }, { b, a } })
            {
                if(neighbours.get(pair[0]) == null)
                {
                    neighbours.set(pair[0], new ArrayList<Integer>());
                    members++;
                }

                neighbours.get(pair[0]).add(pair[1]);
            }
        }

        int first = -1;

        for(int[] ring : rings)
        {
            for(int atom : ring)
            {
                if(neighbours.get(atom) == null || neighbours.get(atom).size() != 2)
                    return null;

                first = atom;
            }
        }

        int[] periphery = new int[members];
        int previous = -1;
        int current = first;

        for(int i = 0; i < members; i++)
        {
            if(i > 0 && current == first)
                return null;

            periphery[i] = current;
            List<Integer> next = neighbours.get(current);
            int following = next.get(0) == previous ? next.get(1) : next.get(0);
            previous = current;
            current = following;
        }

        return current == first ? periphery : null;
    }


    private static long bondKey(int a, int b, int atomCount)
    {
        return (long) Math.min(a, b) * atomCount + Math.max(a, b);
    }


    private static int countRings(List<int[]> rings, int atom)
    {
        int count = 0;

        for(int[] ring : rings)
            for(int member : ring)
                if(member == atom)
                    count++;

        return count;
    }
}
