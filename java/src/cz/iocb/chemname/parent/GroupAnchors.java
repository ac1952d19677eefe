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

import cz.iocb.chemname.groups.FunctionalGroup;
import cz.iocb.chemname.method.EsterClassifier;
import cz.iocb.chemname.molecule.Molecule;



/**
 * Relations between characteristic groups and parent atoms.
 */
public class GroupAnchors
{
    /**
     * Returns the parent atom carrying the group, or -1. A group is carried by its key atom when the key atom
     * belongs to the parent, otherwise by a parent atom bonded to the key atom. Carbon-anchored groups may only be
     * attached this way when {@code attached} is true, as the characteristic carbon of a chain group is always a
     * chain member.
     */
    public static int anchor(FunctionalGroup group, boolean[] parent, Molecule molecule, boolean attached)
    {
        int key = group.getKeyAtom();

        if(parent[key])
            return key;

        if(group.getType().isCarbonAnchored() && !attached)
            return -1;

        for(int neighbour : molecule.getNeighbours(key))
            if(parent[neighbour])
                return neighbour;

        return -1;
    }


    public static boolean[] toMask(int[] atoms, int size)
    {
        boolean[] mask = new boolean[size];

        for(int atom : atoms)
            mask[atom] = true;

        return mask;
    }


    /**
     * Marks the atoms expressed by the suffix or class word of a principal group: the group atoms and, for esters,
     * thioesters and anhydrides, the whole part beyond the bridging heteroatom.
     */
    public static void markSuffixAtoms(FunctionalGroup group, Molecule molecule, boolean[] mask)
    {
        for(int atom : group.getAtoms())
            mask[atom] = true;

        switch(group.getType())
        {
            case ESTER:
            case THIOESTER:
            case ANHYDRIDE:
                boolean[] outer = EsterClassifier.getAlkoxySubtree(group, molecule);

                for(int i = 0; i < outer.length; i++)
                    mask[i] |= outer[i];

                break;
            default:
                break;
        }
    }


    /**
     * Returns the nitrogen atom whose further substituents are cited with the locant "N", or -1.
     */
    public static int getNitrogen(FunctionalGroup group)
    {
        switch(group.getType())
        {
            case AMIDE:
                return group.getAtom(2);
            case AMINE:
                return group.getAtom(0);
            case IMINE:
                return group.getAtom(1);
            default:
                return -1;
        }
    }
}
