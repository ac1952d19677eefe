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
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import cz.iocb.chemname.molecule.BondType;
import cz.iocb.chemname.molecule.Molecule;
import cz.iocb.chemname.parent.Substituent;
import cz.iocb.chemname.shared.Alphanumerics;
import cz.iocb.chemname.shared.Locants;
import cz.iocb.chemname.shared.NomenclatureDictionary;



/**
 * Lowest-locant comparison of alternative numberings of one parent. The criteria are applied in this order:
 * <ol>
 * <li>skeletal heteroatoms considered together,</li>
 * <li>skeletal heteroatoms in the order O, S, Se, Te, N, P, ...,</li>
 * <li>principal characteristic groups (or free valences),</li>
 * <li>multiple bonds considered together,</li>
 * <li>double bonds,</li>
 * <li>detachable prefixes considered together,</li>
 * <li>prefixes in the order of their citation.</li>
 * </ol>
 */
public class NumberingCriteria
{
    public static final class Key implements Comparable<Key>
    {
        private final int[][] values;


        private Key(int[][] values)
        {
            this.values = values;
        }


        public int[] getValue(int criterion)
        {
            return values[criterion].clone();
        }


        @Override
        public int compareTo(Key other)
        {
            for(int i = 0; i < values.length; i++)
            {
                int result = Locants.compare(values[i], other.values[i]);

                if(result != 0)
                    return result;
            }

            return 0;
        }


        @Override
        public String toString()
        {
            return Arrays.deepToString(values);
        }
    }


    private final int atomCount;
    private final int[] heteroatoms;
    private final int[] heteroatomSeniority;
    private final int[] principalAnchors;
    private final int[][] multipleBonds;
    private final int[] substituentAttachments;
    private final int[] citationOrder;


    public NumberingCriteria(Molecule molecule, NomenclatureDictionary dictionary, int[] parentAtoms,
            int[] principalAnchors, List<Substituent> substituents)
    {
        boolean[] parent = new boolean[molecule.getAtomCount()];

        for(int atom : parentAtoms)
            parent[atom] = true;

        List<Integer> hetero = new ArrayList<Integer>();

        for(int atom : parentAtoms)
            if(!molecule.getAtom(atom).isCarbon())
                hetero.add(atom);

        List<int[]> bonds = new ArrayList<int[]>();

        for(int atom : parentAtoms)
        {
            for(int neighbour : molecule.getNeighbours(atom))
            {
                BondType type = molecule.getBondType(atom, neighbour);

                if(atom < neighbour && parent[neighbour] && (type == BondType.DOUBLE || type == BondType.TRIPLE))
                    bonds.add(new int[] { atom, neighbour, type == BondType.DOUBLE ? 1 : 0 });
            }
        }

        List<Substituent> cited = new ArrayList<Substituent>();

        for(Substituent substituent : substituents)
            if(!substituent.isNitrogen())
                cited.add(substituent);

        List<Substituent> alphabetical = new ArrayList<Substituent>(cited);
        alphabetical.sort(Comparator.comparing(Substituent::getName, Alphanumerics.COMPARATOR));

        this.atomCount = molecule.getAtomCount();
        this.heteroatoms = hetero.stream().mapToInt(Integer::intValue).toArray();
        this.heteroatomSeniority = hetero.stream()
                .mapToInt(atom -> dictionary.getHeteroatomRank(molecule.getAtom(atom).symbol)).toArray();
        this.principalAnchors = principalAnchors.clone();
        this.multipleBonds = bonds.toArray(new int[0][]);
        this.substituentAttachments = cited.stream().mapToInt(Substituent::getAttachment).toArray();
        this.citationOrder = alphabetical.stream().mapToInt(Substituent::getAttachment).toArray();
    }


    /**
     * Returns the locant of a bond between atoms with the given ranks: the lower rank, unless the bond closes a
     * ring between the first and the last position.
     */
    public static int getBondLocant(int rank1, int rank2)
    {
        if(Math.abs(rank1 - rank2) == 1)
            return Math.min(rank1, rank2);

        return Math.max(rank1, rank2);
    }


    public Key evaluate(int[] ordering)
    {
        int[] rank = new int[atomCount];

        for(int i = 0; i < ordering.length; i++)
            rank[ordering[i]] = i + 1;

        int[] heteroLocants = ranks(rank, heteroatoms);

        Integer[] bySeniority = new Integer[heteroatoms.length];

        for(int i = 0; i < bySeniority.length; i++)
            bySeniority[i] = i;

        Arrays.sort(bySeniority, Comparator.comparingInt((Integer i) -> heteroatomSeniority[i])
                .thenComparingInt(i -> rank[heteroatoms[i]]));

        int[] senior = new int[heteroatoms.length];

        for(int i = 0; i < senior.length; i++)
            senior[i] = rank[heteroatoms[bySeniority[i]]];

        List<Integer> multiple = new ArrayList<Integer>();
        List<Integer> doubles = new ArrayList<Integer>();

        for(int[] bond : multipleBonds)
        {
            int locant = getBondLocant(rank[bond[0]], rank[bond[1]]);
            multiple.add(locant);

            if(bond[2] == 1)
                doubles.add(locant);
        }

        int[] alphabetical = new int[citationOrder.length];

        for(int i = 0; i < alphabetical.length; i++)
            alphabetical[i] = rank[citationOrder[i]];

        return new Key(new int[][] { Locants.sorted(heteroLocants), senior,
                Locants.sorted(ranks(rank, principalAnchors)), Locants.sorted(multiple), Locants.sorted(doubles),
                Locants.sorted(ranks(rank, substituentAttachments)), alphabetical });
    }


    private static int[] ranks(int[] rank, int[] atoms)
    {
        int[] result = new int[atoms.length];

        for(int i = 0; i < atoms.length; i++)
            result[i] = rank[atoms[i]];

        return result;
    }


    /**
     * Returns the index of the ordering with the lowest key; on ties the first one wins.
     */
    public int choose(List<int[]> orderings)
    {
        if(orderings.isEmpty())
            throw new IllegalArgumentException("no numbering to choose from");

        int best = 0;
        Key bestKey = evaluate(orderings.get(0));

        for(int i = 1; i < orderings.size(); i++)
        {
            Key key = evaluate(orderings.get(i));

            if(key.compareTo(bestKey) < 0)
            {
                best = i;
                bestKey = key;
            }
        }

        return best;
    }
}
