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
package cz.iocb.chemname.groups;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import cz.iocb.chemname.analysis.AtomicAnalysis;
import cz.iocb.chemname.molecule.Atom;
import cz.iocb.chemname.molecule.BondType;
import cz.iocb.chemname.molecule.Molecule;



/**
 * Detects characteristic groups on the heavy-atom graph. Every atom belongs to at most one detected group.
 */
public class FunctionalGroupDetector
{
    public List<FunctionalGroup> detect(Molecule molecule, AtomicAnalysis analysis)
    {
        int count = molecule.getAtomCount();
        boolean[] claimed = new boolean[count];
        List<FunctionalGroup> groups = new ArrayList<FunctionalGroup>();

        for(int c = 0; c < count; c++)
            if(molecule.getAtom(c).isCarbon() && !claimed[c])
                detectCarbonyl(molecule, c, claimed, groups);

        for(int c = 0; c < count; c++)
            if(molecule.getAtom(c).isCarbon() && !claimed[c])
                detectNitrile(molecule, c, claimed, groups);

        for(int n = 0; n < count; n++)
            if(molecule.getAtom(n).is("N") && !claimed[n])
                detectNitrogenOxide(molecule, n, claimed, groups);

        for(int s = 0; s < count; s++)
            if(molecule.getAtom(s).is("S") && !claimed[s] && !analysis.isInRing(s))
                detectSulfurOxide(molecule, s, claimed, groups);

        for(int c = 0; c < count; c++)
        {
            if(!molecule.getAtom(c).isCarbon() || claimed[c])
                continue;

            for(int n : molecule.getNeighbours(c))
            {
                if(molecule.getAtom(n).is("N") && !claimed[n] && molecule.getBondType(c, n) == BondType.DOUBLE)
                {
                    groups.add(new FunctionalGroup(FunctionalGroupType.IMINE, c, n));
                    claimed[c] = claimed[n] = true;
                    break;
                }
            }
        }

        for(int i = 0; i < count; i++)
        {
            if(claimed[i])
                continue;

            Atom atom = molecule.getAtom(i);
            int[] neighbours = molecule.getNeighbours(i);
            boolean singleOnly = hasOnlySingleBonds(molecule, i);
            int carbons = countCarbons(molecule, neighbours);

            if(atom.is("O") && atom.hydrogens > 0 && neighbours.length == 1 && carbons == 1 && singleOnly)
                add(groups, claimed, FunctionalGroupType.ALCOHOL, i);
            else if(atom.is("S") && atom.hydrogens > 0 && neighbours.length == 1 && carbons == 1 && singleOnly)
                add(groups, claimed, FunctionalGroupType.THIOL, i);
            else if(atom.is("N") && atom.charge == 0 && !analysis.isAromatic(i) && !analysis.isInRing(i)
                    && singleOnly && carbons > 0)
                add(groups, claimed, FunctionalGroupType.AMINE, i);
            else if(atom.is("O") && neighbours.length == 2 && carbons == 2 && singleOnly && !analysis.isInRing(i))
                add(groups, claimed, FunctionalGroupType.ETHER, i);
            else if(atom.is("S") && neighbours.length == 2 && carbons == 2 && singleOnly && !analysis.isInRing(i))
                add(groups, claimed, FunctionalGroupType.THIOETHER, i);
            else if(atom.isHalogen() && neighbours.length == 1 && carbons == 1)
                add(groups, claimed, FunctionalGroupType.HALIDE, i);
            else if(atom.is("P") && !analysis.isInRing(i))
                add(groups, claimed, FunctionalGroupType.PHOSPHANYL, i);
            else if(atom.is("B") && !analysis.isInRing(i))
                add(groups, claimed, FunctionalGroupType.BORANE, i);
        }

        groups.sort(Comparator.comparingInt(FunctionalGroup::getPriority).reversed()
                .thenComparingInt(FunctionalGroup::getKeyAtom));

        return groups;
    }


    private static void detectCarbonyl(Molecule molecule, int c, boolean[] claimed, List<FunctionalGroup> groups)
    {
        int oxygen = findDoubleBonded(molecule, c, "O");

        if(oxygen < 0 || claimed[oxygen])
            return;

        int carbons = 0;
        int hydrogens = molecule.getAtom(c).hydrogens;

        for(int n : molecule.getNeighbours(c))
        {
            if(n == oxygen)
                continue;

            Atom atom = molecule.getAtom(n);

            if(molecule.getBondType(c, n) != BondType.SINGLE && !atom.isCarbon())
                return;

            if(atom.isCarbon())
            {
                carbons++;
                continue;
            }

            if(claimed[n])
                continue;

            int[] next = molecule.getNeighbours(n);

            if(atom.is("O") && next.length == 1 && atom.hydrogens > 0)
            {
                add(groups, claimed, FunctionalGroupType.CARBOXYLIC_ACID, c, oxygen, n);
                return;
            }

            if(atom.is("O") && next.length == 2)
            {
                int other = next[0] == c ? next[1] : next[0];

                if(!molecule.getAtom(other).isCarbon())
                    continue;

                int otherOxygen = findDoubleBonded(molecule, other, "O");

                if(otherOxygen >= 0 && !claimed[other] && !claimed[otherOxygen])
                    add(groups, claimed, FunctionalGroupType.ANHYDRIDE, c, oxygen, n, other, otherOxygen);
                else
                    add(groups, claimed, FunctionalGroupType.ESTER, c, oxygen, n);

                return;
            }

            if(atom.isHalogen())
            {
                add(groups, claimed, FunctionalGroupType.ACYL_HALIDE, c, oxygen, n);
                return;
            }

            if(atom.is("N") && atom.charge == 0 && findDoubleBonded(molecule, n, "O") < 0)
            {
                add(groups, claimed, FunctionalGroupType.AMIDE, c, oxygen, n);
                return;
            }

            if(atom.is("S") && next.length == 2)
            {
                int other = next[0] == c ? next[1] : next[0];

                if(molecule.getAtom(other).isCarbon())
                {
                    add(groups, claimed, FunctionalGroupType.THIOESTER, c, oxygen, n);
                    return;
                }
            }

            /* carbonates, carbamates and similar classes are not recognized */
            return;
        }

        if(hydrogens > 0 && carbons <= 1)
            add(groups, claimed, FunctionalGroupType.ALDEHYDE, c, oxygen);
        else if(carbons == 2)
            add(groups, claimed, FunctionalGroupType.KETONE, c, oxygen);
    }


    private static void detectNitrile(Molecule molecule, int c, boolean[] claimed, List<FunctionalGroup> groups)
    {
        int nitrogen = findTripleBonded(molecule, c, "N");

        if(nitrogen < 0 || claimed[nitrogen] || molecule.getDegree(nitrogen) != 1)
            return;

        for(int n : molecule.getNeighbours(c))
        {
            if(molecule.getAtom(n).is("S") && !claimed[n] && molecule.getDegree(n) == 2)
            {
                add(groups, claimed, FunctionalGroupType.THIOCYANATE, n, c, nitrogen);
                return;
            }
        }

        add(groups, claimed, FunctionalGroupType.NITRILE, c, nitrogen);
    }


    private static void detectNitrogenOxide(Molecule molecule, int n, boolean[] claimed, List<FunctionalGroup> groups)
    {
        List<Integer> oxygens = new ArrayList<Integer>();
        boolean doubleOxygen = false;

        for(int o : molecule.getNeighbours(n))
        {
            if(molecule.getAtom(o).is("O") && molecule.getDegree(o) == 1 && !claimed[o])
            {
                oxygens.add(o);
                doubleOxygen |= molecule.getBondType(n, o) == BondType.DOUBLE;
            }
        }

        if(!doubleOxygen)
            return;

        if(oxygens.size() >= 2)
            add(groups, claimed, FunctionalGroupType.NITRO, n, oxygens.get(0), oxygens.get(1));
        else if(molecule.getDegree(n) == 2)
            add(groups, claimed, FunctionalGroupType.NITROSO, n, oxygens.get(0));
    }


    /*
     * Sulfoxides and sulfones: one or two terminal oxygens and exactly two carbon neighbours.
     */
    private static void detectSulfurOxide(Molecule molecule, int s, boolean[] claimed, List<FunctionalGroup> groups)
    {
        List<Integer> oxygens = new ArrayList<Integer>();
        int carbons = 0;

        for(int n : molecule.getNeighbours(s))
        {
            Atom atom = molecule.getAtom(n);
            BondType type = molecule.getBondType(s, n);

            if(atom.is("O") && type == BondType.DOUBLE && molecule.getDegree(n) == 1 && !claimed[n])
                oxygens.add(n);
            else if(atom.isCarbon() && type == BondType.SINGLE)
                carbons++;
            else
                return;
        }

        if(carbons != 2)
            return;

        if(oxygens.size() == 2)
            add(groups, claimed, FunctionalGroupType.SULFONYL, s, oxygens.get(0), oxygens.get(1));
        else if(oxygens.size() == 1)
            add(groups, claimed, FunctionalGroupType.SULFINYL, s, oxygens.get(0));
    }


    private static void add(List<FunctionalGroup> groups, boolean[] claimed, FunctionalGroupType type, int... atoms)
    {
        for(int atom : atoms)
            claimed[atom] = true;

        groups.add(new FunctionalGroup(type, atoms));
    }


    static int findDoubleBonded(Molecule molecule, int atom, String element)
    {
        for(int n : molecule.getNeighbours(atom))
            if(molecule.getAtom(n).is(element) && molecule.getBondType(atom, n) == BondType.DOUBLE)
                return n;

        return -1;
    }


    static int findTripleBonded(Molecule molecule, int atom, String element)
    {
        for(int n : molecule.getNeighbours(atom))
            if(molecule.getAtom(n).is(element) && molecule.getBondType(atom, n) == BondType.TRIPLE)
                return n;

        return -1;
    }


    private static boolean hasOnlySingleBonds(Molecule molecule, int atom)
    {
        for(int n : molecule.getNeighbours(atom))
            if(molecule.getBondType(atom, n) != BondType.SINGLE)
                return false;

        return true;
    }


    private static int countCarbons(Molecule molecule, int[] atoms)
    {
        int count = 0;

        for(int atom : atoms)
            if(molecule.getAtom(atom).isCarbon())
                count++;

        return count;
    }
}
