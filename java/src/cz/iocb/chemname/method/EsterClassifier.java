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
package cz.iocb.chemname.method;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import cz.iocb.chemname.analysis.AtomicAnalysis;
import cz.iocb.chemname.groups.FunctionalGroup;
import cz.iocb.chemname.groups.FunctionalGroupType;
import cz.iocb.chemname.molecule.Molecule;



/**
 * Structural tests on ester groups. Ester atoms are stored as [carbonyl carbon, carbonyl oxygen, ester oxygen].
 */
public class EsterClassifier
{
    /**
     * Returns true if the carbonyl carbon and the ester oxygen lie in one ring, directly or through one alpha carbon.
     */
    public static boolean isLactone(FunctionalGroup ester, Molecule molecule, AtomicAnalysis analysis)
    {
        if(ester.getType() != FunctionalGroupType.ESTER)
            return false;

        int carbon = ester.getAtom(0);
        int oxygen = ester.getAtom(2);

        if(!analysis.isInRing(oxygen))
            return false;

        if(analysis.getCommonRing(carbon, oxygen) != null)
            return true;

        for(int alpha : molecule.getNeighbours(carbon))
            if(molecule.getAtom(alpha).isCarbon() && analysis.getCommonRing(alpha, oxygen) != null)
                return true;

        return false;
    }


    /**
     * Returns true if the alkoxy part of one ester, explored without recrossing its ester oxygen, reaches the
     * carbonyl carbon of another ester.
     */
    public static boolean isHierarchical(List<FunctionalGroup> esters, Molecule molecule)
    {
        return findPrimaryEster(esters, molecule) != null;
    }


    /**
     * Returns the first ester whose alkoxy part contains the carbonyl carbon of another ester, or null if the esters
     * are independent of each other.
     */
    public static FunctionalGroup findPrimaryEster(List<FunctionalGroup> esters, Molecule molecule)
    {
        for(FunctionalGroup ester : esters)
        {
            boolean[] visited = getAlkoxySubtree(ester, molecule);

            for(FunctionalGroup other : esters)
                if(other != ester && visited[other.getAtom(0)])
                    return ester;
        }

        return null;
    }


    /**
     * Leaves the principal flag only on the primary ester of a hierarchy of principal esters. The other esters are
     * cited as acyloxy or alkoxycarbonyl prefixes of its alkyl group.
     */
    public static List<FunctionalGroup> keepPrimaryEster(List<FunctionalGroup> groups, Molecule molecule)
    {
        List<FunctionalGroup> esters = new ArrayList<FunctionalGroup>();

        for(FunctionalGroup group : groups)
            if(group.isPrincipal() && group.getType() == FunctionalGroupType.ESTER)
                esters.add(group);

        if(esters.size() < 2)
            return groups;

        FunctionalGroup primary = findPrimaryEster(esters, molecule);

        if(primary == null)
            return groups;

        List<FunctionalGroup> result = new ArrayList<FunctionalGroup>(groups.size());

        for(FunctionalGroup group : groups)
            result.add(esters.contains(group) && group != primary ? group.withPrincipal(false) : group);

        return result;
    }


    /**
     * Marks the atoms reachable from the ester oxygen on the side opposite to the carbonyl carbon.
     */
    public static boolean[] getAlkoxySubtree(FunctionalGroup ester, Molecule molecule)
    {
        int carbon = ester.getAtom(0);
        int oxygen = ester.getAtom(2);

        boolean[] visited = new boolean[molecule.getAtomCount()];
        visited[oxygen] = true;
        visited[carbon] = true;

        Deque<Integer> queue = new ArrayDeque<Integer>();

        for(int n : molecule.getNeighbours(oxygen))
        {
            if(n != carbon)
            {
                visited[n] = true;
                queue.add(n);
            }
        }

        while(!queue.isEmpty())
        {
            int atom = queue.poll();

            for(int n : molecule.getNeighbours(atom))
            {
                if(!visited[n])
                {
                    visited[n] = true;
                    queue.add(n);
                }
            }
        }

        /* the starting atoms belong to the acyl side */
        visited[oxygen] = false;
        visited[carbon] = false;

        return visited;
    }
}
