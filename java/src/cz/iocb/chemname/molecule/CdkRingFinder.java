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
package cz.iocb.chemname.molecule;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.openscience.cdk.graph.MinimumCycleBasis;



/**
 * Ring finder backed by the minimum cycle basis of the chemistry development kit.
 */
public class CdkRingFinder implements RingFinder
{
    @Override
    public List<int[]> findRings(Molecule molecule)
    {
        List<int[]> rings = new ArrayList<int[]>();

        if(molecule.getBondCount() < 3)
            return rings;

        int[][] paths = new MinimumCycleBasis(molecule.toAdjacencyGraph()).paths();

        for(int[] path : paths)
        {
            if(path.length > 1 && path[0] == path[path.length - 1])
                rings.add(Arrays.copyOf(path, path.length - 1));
            else
                rings.add(path.clone());
        }

        return rings;
    }
}
