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
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import cz.iocb.chemname.analysis.AtomicAnalysis;
import cz.iocb.chemname.assembly.SubstituentNamer;
import cz.iocb.chemname.groups.FunctionalGroup;
import cz.iocb.chemname.method.EsterClassifier;
import cz.iocb.chemname.molecule.BondType;
import cz.iocb.chemname.molecule.Molecule;
import cz.iocb.chemname.numbering.NumberingCriteria;
import cz.iocb.chemname.shared.NomenclatureDictionary;



/**
 * Enumerates candidate parent chains: the leaf-to-leaf paths of the forest formed by acyclic carbon atoms, and its
 * isolated atoms. Only the candidates carrying the maximum number of principal characteristic groups are returned.
 */
public class ChainFinder
{
    private static final Logger LOGGER = LogManager.getFormatterLogger(ChainFinder.class);


    public static List<Chain> find(Molecule molecule, AtomicAnalysis analysis, List<FunctionalGroup> groups,
            SubstituentNamer namer, NomenclatureDictionary dictionary, int maxCandidates)
    {
        boolean[] allowed = getChainAtoms(molecule, analysis, groups);
        List<int[]> paths = enumeratePaths(molecule, allowed);

        List<FunctionalGroup> principal = new ArrayList<FunctionalGroup>();

        for(FunctionalGroup group : groups)
            if(group.isPrincipal())
                principal.add(group);

        int max = 0;
        int[] counts = new int[paths.size()];

        for(int i = 0; i < paths.size(); i++)
        {
            counts[i] = getAnchoredGroups(principal, paths.get(i), molecule).size();
            max = Math.max(max, counts[i]);
        }

        List<Chain> chains = new ArrayList<Chain>();

        for(int i = 0; i < paths.size(); i++)
        {
            if(counts[i] != max)
                continue;

            if(chains.size() == maxCandidates)
            {
                LOGGER.warn("candidate chains truncated to %d", maxCandidates);
                break;
            }

            chains.add(createChain(molecule, analysis, principal, paths.get(i), namer, dictionary));
        }

        return chains;
    }


    /**
     * Returns the principal groups carried by the given parent atoms.
     */
    public static List<FunctionalGroup> getAnchoredGroups(List<FunctionalGroup> principal, int[] atoms,
            Molecule molecule)
    {
        boolean[] mask = GroupAnchors.toMask(atoms, molecule.getAtomCount());
        List<FunctionalGroup> anchored = new ArrayList<FunctionalGroup>();

        for(FunctionalGroup group : principal)
            if(GroupAnchors.anchor(group, mask, molecule, false) >= 0)
                anchored.add(group);

        return anchored;
    }


    static boolean[] getChainAtoms(Molecule molecule, AtomicAnalysis analysis, List<FunctionalGroup> groups)
    {
        boolean[] allowed = new boolean[molecule.getAtomCount()];

        for(int i = 0; i < allowed.length; i++)
            allowed[i] = molecule.getAtom(i).isCarbon() && !analysis.isInRing(i);

        for(FunctionalGroup group : groups)
        {
            switch(group.getType())
            {
                case THIOCYANATE:
                    allowed[group.getAtom(1)] = false;
                    break;
                case ANHYDRIDE:
                    if(!group.isPrincipal())
                        allowed[group.getAtom(0)] = allowed[group.getAtom(3)] = false;
                    break;
                case NITRILE:
                case ESTER:
                case AMIDE:
                case ACYL_HALIDE:
                case CARBOXYLIC_ACID:
                case THIOESTER:
                    if(!group.isPrincipal())
                        allowed[group.getKeyAtom()] = false;
                    break;
                default:
                    break;
            }

            switch(group.getType())
            {
                case ESTER:
                case THIOESTER:
                case ANHYDRIDE:
                    if(group.isPrincipal())
                    {
                        boolean[] outer = EsterClassifier.getAlkoxySubtree(group, molecule);

                        for(int i = 0; i < outer.length; i++)
                            if(outer[i])
                                allowed[i] = false;
                    }
                    break;
                default:
                    break;
            }
        }

        return allowed;
    }


    static List<int[]> enumeratePaths(Molecule molecule, boolean[] allowed)
    {
        int count = molecule.getAtomCount();
        List<Integer> leaves = new ArrayList<Integer>();

        for(int i = 0; i < count; i++)
        {
            if(!allowed[i])
                continue;

            int degree = 0;

            for(int n : molecule.getNeighbours(i))
                if(allowed[n])
                    degree++;

            if(degree <= 1)
                leaves.add(i);
        }

        List<int[]> paths = new ArrayList<int[]>();

        for(int a = 0; a < leaves.size(); a++)
        {
            int start = leaves.get(a);
            int[] parents = new int[count];
            Arrays.fill(parents, -2);
            parents[start] = -1;
            List<Integer> queue = new ArrayList<Integer>();
            queue.add(start);

            for(int q = 0; q < queue.size(); q++)
            {
                int atom = queue.get(q);

                for(int n : molecule.getNeighbours(atom))
                {
                    if(allowed[n] && parents[n] == -2)
                    {
                        parents[n] = atom;
                        queue.add(n);
                    }
                }
            }

            if(queue.size() == 1)
            {
                paths.add(new int[] { start });
                continue;
            }

            for(int b = a + 1; b < leaves.size(); b++)
            {
                int end = leaves.get(b);

                if(parents[end] == -2)
                    continue;

                List<Integer> path = new ArrayList<Integer>();

                for(int atom = end; atom != -1; atom = parents[atom])
                    path.add(atom);

                Collections.reverse(path);
                paths.add(path.stream().mapToInt(Integer::intValue).toArray());
            }
        }

        return paths;
    }


    /*
     * The chain is stored in the orientation preferred by the lowest-locant rules.
     */
    private static Chain createChain(Molecule molecule, AtomicAnalysis analysis, List<FunctionalGroup> principal,
            int[] path, SubstituentNamer namer, NomenclatureDictionary dictionary)
    {
        List<FunctionalGroup> anchored = getAnchoredGroups(principal, path, molecule);
        List<Substituent> substituents = SubstituentFinder.find(molecule, analysis, namer, path, anchored);
        boolean[] mask = GroupAnchors.toMask(path, molecule.getAtomCount());
        int[] anchors = new int[anchored.size()];

        for(int i = 0; i < anchors.length; i++)
            anchors[i] = GroupAnchors.anchor(anchored.get(i), mask, molecule, false);

        int[] reverse = new int[path.length];

        for(int i = 0; i < path.length; i++)
            reverse[i] = path[path.length - 1 - i];

        NumberingCriteria criteria = new NumberingCriteria(molecule, dictionary, path, anchors, substituents);
        int[] oriented = criteria.choose(Arrays.asList(path, reverse)) == 0 ? path : reverse;

        return new Chain(oriented, anchored.size(), getBondLocants(molecule, oriented, BondType.DOUBLE),
                getBondLocants(molecule, oriented, BondType.TRIPLE), substituents);
    }


    static int[] getBondLocants(Molecule molecule, int[] chain, BondType type)
    {
        List<Integer> locants = new ArrayList<Integer>();

        for(int i = 0; i + 1 < chain.length; i++)
            if(molecule.getBondType(chain[i], chain[i + 1]) == type)
                locants.add(i + 1);

        return locants.stream().mapToInt(Integer::intValue).toArray();
    }
}
