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
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;
import cz.iocb.chemname.molecule.Bond;
import cz.iocb.chemname.molecule.Molecule;
import cz.iocb.chemname.shared.NomenclatureDictionary;



/**
 * Groups perceived rings into ring systems and classifies and names them.
 */
public class RingSystemDetector
{
    public static List<RingSystem> detect(Molecule molecule, List<int[]> rings, NomenclatureDictionary dictionary)
    {
        int[] parent = new int[rings.size()];

        for(int i = 0; i < parent.length; i++)
            parent[i] = i;

        for(int i = 0; i < rings.size(); i++)
            for(int j = i + 1; j < rings.size(); j++)
                if(sharedAtoms(rings.get(i), rings.get(j)) > 0)
                    union(parent, i, j);

        List<RingSystem> systems = new ArrayList<RingSystem>();

        for(int i = 0; i < rings.size(); i++)
        {
            if(find(parent, i) != i)
                continue;

            List<int[]> members = new ArrayList<int[]>();

            for(int j = 0; j < rings.size(); j++)
                if(find(parent, j) == i)
                    members.add(rings.get(j));

            systems.add(build(molecule, members, dictionary));
        }

        systems.sort(Comparator.comparingInt(system -> system.getAtoms()[0]));
        return systems;
    }


    private static RingSystem build(Molecule molecule, List<int[]> rings, NomenclatureDictionary dictionary)
    {
        TreeSet<Integer> atomSet = new TreeSet<Integer>();
        TreeSet<Integer> bondSet = new TreeSet<Integer>();

        for(int[] ring : rings)
        {
            for(int i = 0; i < ring.length; i++)
            {
                atomSet.add(ring[i]);
                Bond bond = molecule.getBond(ring[i], ring[(i + 1) % ring.length]);

                if(bond != null)
                    bondSet.add(bond.id);
            }
        }

        int[] atoms = atomSet.stream().mapToInt(Integer::intValue).toArray();
        int[] bonds = bondSet.stream().mapToInt(Integer::intValue).toArray();

        boolean aromatic = true;
        boolean hetero = false;
        int score = 0;

        for(int atom : atoms)
        {
            aromatic &= molecule.getAtom(atom).aromatic;

            if(!molecule.getAtom(atom).isCarbon())
            {
                hetero = true;
                score += 1000 - dictionary.getHeteroatomRank(molecule.getAtom(atom).symbol);
            }
        }

        RingSystem.Kind kind = classify(rings);

        if(rings.size() == 1)
            return new RingSystem(rings, atoms, bonds, kind, score, aromatic,
                    RingNames.nameMonocycle(molecule, rings.get(0), aromatic), RingSystem.Scheme.MONOCYCLE,
                    new int[0], new ArrayList<int[]>());

        if(rings.size() == 2 && kind == RingSystem.Kind.SPIRO)
        {
            int spiro = commonAtom(rings.get(0), rings.get(1));
            List<int[]> paths = new ArrayList<int[]>();
            paths.add(pathAround(rings.get(0), spiro));
            paths.add(pathAround(rings.get(1), spiro));
            paths.sort(Comparator.comparingInt(path -> path.length));

            return new RingSystem(rings, atoms, bonds, kind, score, aromatic,
                    RingNames.nameSpiro(paths.get(0).length, paths.get(1).length, hetero), RingSystem.Scheme.SPIRO,
                    new int[] { spiro }, paths);
        }

        if(kind == RingSystem.Kind.FUSED && aromatic)
        {
            FusedRingTemplate.Match match = FusedRingTemplate.find(molecule, rings);

            if(match != null)
                return new RingSystem(rings, atoms, bonds, kind, score, aromatic, match.getName(),
                        RingSystem.Scheme.FUSED, new int[0], new ArrayList<int[]>(), match.getLabels(),
                        match.getOrderings());
        }

        if(rings.size() == 2)
        {
            int[] bridgeheads = new int[2];
            List<int[]> bridges = findBridges(molecule, atomSet, bondSet, bridgeheads);

            if(bridges != null)
            {
                int[] sizes = new int[] { bridges.get(0).length, bridges.get(1).length, bridges.get(2).length };

                return new RingSystem(rings, atoms, bonds, kind, score, aromatic,
                        RingNames.nameVonBaeyer(sizes, atoms.length, hetero), RingSystem.Scheme.VON_BAEYER,
                        bridgeheads, bridges);
            }
        }

        return new RingSystem(rings, atoms, bonds, kind, score, aromatic,
                RingNames.namePolycycle(dictionary.getMultiplier(Math.min(rings.size(), 12)), atoms.length, hetero),
                RingSystem.Scheme.GENERIC, new int[0], new ArrayList<int[]>());
    }


    static RingSystem.Kind classify(List<int[]> rings)
    {
        if(rings.size() == 1)
            return RingSystem.Kind.ISOLATED;

        boolean fused = false;
        boolean spiro = false;

        for(int i = 0; i < rings.size(); i++)
        {
            for(int j = i + 1; j < rings.size(); j++)
            {
                int shared = sharedAtoms(rings.get(i), rings.get(j));

                if(shared > 2)
                    return RingSystem.Kind.BRIDGED;
                else if(shared == 2)
                    fused = true;
                else if(shared == 1)
                    spiro = true;
            }
        }

        return fused || !spiro ? RingSystem.Kind.FUSED : RingSystem.Kind.SPIRO;
    }


    /**
     * Finds the three bridges between the two bridgeheads of a bicyclic system, sorted by decreasing size. Returns
     * null if the system is not a simple bicycle.
     */
    private static List<int[]> findBridges(Molecule molecule, TreeSet<Integer> atoms, TreeSet<Integer> bonds,
            int[] bridgeheads)
    {
        List<Integer> heads = new ArrayList<Integer>();

        for(int atom : atoms)
            if(systemNeighbours(molecule, atom, bonds).size() >= 3)
                heads.add(atom);

        if(heads.size() != 2)
            return null;

        bridgeheads[0] = heads.get(0);
        bridgeheads[1] = heads.get(1);

        List<int[]> bridges = new ArrayList<int[]>();

        for(int start : systemNeighbours(molecule, bridgeheads[0], bonds))
        {
            List<Integer> path = new ArrayList<Integer>();
            int previous = bridgeheads[0];
            int current = start;

            while(current != bridgeheads[1])
            {
                List<Integer> next = systemNeighbours(molecule, current, bonds);

                if(next.size() != 2 || path.size() > atoms.size())
                    return null;

                path.add(current);
                int following = next.get(0) == previous ? next.get(1) : next.get(0);
                previous = current;
                current = following;
            }

            bridges.add(path.stream().mapToInt(Integer::intValue).toArray());
        }

        if(bridges.size() != 3)
            return null;

        /* stable, bridges of equal size keep the order of discovery */
        bridges.sort(Comparator.comparingInt((int[] bridge) -> bridge.length).reversed());
        return bridges;
    }


    private static List<Integer> systemNeighbours(Molecule molecule, int atom, TreeSet<Integer> bonds)
    {
        List<Integer> result = new ArrayList<Integer>();

        for(int neighbour : molecule.getNeighbours(atom))
            if(bonds.contains(molecule.getBond(atom, neighbour).id))
                result.add(neighbour);

        return result;
    }


    private static int[] pathAround(int[] ring, int start)
    {
        int index = 0;

        while(ring[index] != start)
            index++;

        int[] path = new int[ring.length - 1];

        for(int i = 1; i < ring.length; i++)
            path[i - 1] = ring[(index + i) % ring.length];

        return path;
    }


    private static int commonAtom(int[] ring1, int[] ring2)
    {
        for(int a : ring1)
            for(int b : ring2)
                if(a == b)
                    return a;

        return -1;
    }


    static int sharedAtoms(int[] ring1, int[] ring2)
    {
        int[] sorted = ring2.clone();
        Arrays.sort(sorted);
        int count = 0;

        for(int atom : ring1)
            if(Arrays.binarySearch(sorted, atom) >= 0)
                count++;

        return count;
    }


    private static int find(int[] parent, int i)
    {
        while(parent[i] != i)
            i = parent[i] = parent[parent[i]];

        return i;
    }


    private static void union(int[] parent, int i, int j)
    {
        int a = find(parent, i);
        int b = find(parent, j);

        if(a != b)
            parent[Math.max(a, b)] = Math.min(a, b);
    }
}
