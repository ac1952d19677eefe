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
package cz.iocb.chemname.numbering;

import java.util.ArrayList;
import java.util.List;
import cz.iocb.chemname.parent.RingSystem;



/**
 * Candidate numberings of ring systems.
 */
public class RingNumbering
{
    /**
     * Returns all numberings allowed by the numbering scheme of the ring system, each as the list of atoms in
     * locant order.
     */
    public static List<int[]> getOrderings(RingSystem system)
    {
        switch(system.getScheme())
        {
            case MONOCYCLE:
                return getMonocycleOrderings(system.getRings().get(0));
            case FUSED:
                return system.getOrderings();
            case VON_BAEYER:
                return getVonBaeyerOrderings(system);
            case SPIRO:
                return getSpiroOrderings(system);
            default:
                List<int[]> orderings = new ArrayList<int[]>();
                orderings.add(system.getAtoms());
                return orderings;
        }
    }


    public static String[] getLabels(RingSystem system)
    {
        if(system.getScheme() == RingSystem.Scheme.FUSED)
            return system.getLabels();

        String[] labels = new String[system.getSize()];

        for(int i = 0; i < labels.length; i++)
            labels[i] = Integer.toString(i + 1);

        return labels;
    }


    static List<int[]> getMonocycleOrderings(int[] ring)
    {
        int size = ring.length;
        List<int[]> orderings = new ArrayList<int[]>();

        for(int start = 0; start < size; start++)
        {
            for(int direction = 1; direction >= -1; direction -= 2)
            {
                int[] ordering = new int[size];

                for(int i = 0; i < size; i++)
                    ordering[i] = ring[Math.floorMod(start + direction * i, size)];

                orderings.add(ordering);
            }
        }

        return orderings;
    }


    /*
     * Numbering starts at a main bridgehead, proceeds around the largest bridge to the other bridgehead, continues
     * around the next largest bridge back to the main bridgehead and ends with the smallest bridge, numbered from
     * the atom nearer to the main bridgehead.
     */
    private static List<int[]> getVonBaeyerOrderings(RingSystem system)
    {
        int[] heads = system.getBridgeheads();
        List<int[]> bridges = system.getBridges();
        List<int[]> orderings = new ArrayList<int[]>();

        for(int[] order : getBridgeOrders(bridges))
        {
            int[] largest = bridges.get(order[0]);
            int[] next = bridges.get(order[1]);
            int[] smallest = bridges.get(order[2]);

            orderings.add(concat(new int[] { heads[0] }, largest, new int[] { heads[1] }, reverse(next), smallest));
            orderings.add(concat(new int[] { heads[1] }, reverse(largest), new int[] { heads[0] }, next,
                    reverse(smallest)));
        }

        return orderings;
    }


    /**
     * Returns the permutations of the bridges that keep them sorted by decreasing size.
     */
    private static List<int[]> getBridgeOrders(List<int[]> bridges)
    {
        int[][] permutations = { { 0, 1, 2 }, { 0, 2, 1 }, { 1, 0, 2 }, { 1, 2, 0 }, { 2, 0, 1 }, { 2, 1, 0 } };
        List<int[]> result = new ArrayList<int[]>();

        for(int[] permutation : permutations)
        {
            int a = bridges.get(permutation[0]).length;
            int b = bridges.get(permutation[1]).length;
            int c = bridges.get(permutation[2]).length;

            if(a >= b && b >= c)
                result.add(permutation);
        }

        return result;
    }


    /*
     * Numbering starts in the smaller ring at an atom next to the spiro atom, continues through the spiro atom and
     * around the larger ring.
     */
    private static List<int[]> getSpiroOrderings(RingSystem system)
    {
        int spiro = system.getBridgeheads()[0];
        int[] small = system.getBridges().get(0);
        int[] large = system.getBridges().get(1);

        List<int[]> orderings = new ArrayList<int[]>();
        addSpiroOrderings(orderings, small, spiro, large);

        if(small.length == large.length)
            addSpiroOrderings(orderings, large, spiro, small);

        return orderings;
    }


    private static void addSpiroOrderings(List<int[]> orderings, int[] first, int spiro, int[] second)
    {
        for(int[] a : new int[][] { first, reverse(first) })
            for(int[] b : new int[][] { second, reverse(second) })
                orderings.add(concat(a, new int[] { spiro }, b));
    }


    private static int[] reverse(int[] array)
    {
        int[] result = new int[array.length];

        for(int i = 0; i < array.length; i++)
            result[i] = array[array.length - 1 - i];

        return result;
    }


    private static int[] concat(int[]... parts)
    {
        int length = 0;

        for(int[] part : parts)
            length += part.length;

        int[] result = new int[length];
        int offset = 0;

        for(int[] part : parts)
        {
            System.arraycopy(part, 0, result, offset, part.length);
            offset += part.length;
        }

        return result;
    }
}
