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
import cz.iocb.chemname.analysis.AtomicAnalysis;
import cz.iocb.chemname.assembly.SubstituentNamer;
import cz.iocb.chemname.groups.FunctionalGroup;
import cz.iocb.chemname.molecule.Molecule;



/**
 * Enumerates the substituents of a parent: the branches leaving parent atoms and the branches on the nitrogen atoms
 * of principal amides, amines and imines.
 */
public class SubstituentFinder
{
    public static List<Substituent> find(Molecule molecule, AtomicAnalysis analysis, SubstituentNamer namer,
            int[] parentAtoms, List<FunctionalGroup> principalGroups)
    {
        boolean[] blocked = GroupAnchors.toMask(parentAtoms, molecule.getAtomCount());

        for(FunctionalGroup group : principalGroups)
            GroupAnchors.markSuffixAtoms(group, molecule, blocked);

        List<Substituent> substituents = new ArrayList<Substituent>();

        for(int atom : parentAtoms)
            for(int neighbour : molecule.getNeighbours(atom))
                if(!blocked[neighbour])
                    substituents.add(namer.name(molecule, analysis, neighbour, atom, blocked));

        for(FunctionalGroup group : principalGroups)
        {
            int nitrogen = GroupAnchors.getNitrogen(group);

            if(nitrogen < 0)
                continue;

            for(int neighbour : molecule.getNeighbours(nitrogen))
                if(!blocked[neighbour])
                    substituents.add(namer.name(molecule, analysis, neighbour, nitrogen, blocked)
                            .withNitrogenLocant());
        }

        return substituents;
    }
}
