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
package cz.iocb.chemname.analysis;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import cz.iocb.chemname.molecule.Atom;
import cz.iocb.chemname.molecule.Bond;
import cz.iocb.chemname.molecule.BondType;
import cz.iocb.chemname.molecule.Molecule;
import cz.iocb.chemname.parent.RingSystem;



/**
 * Per-atom structural analysis held in arrays indexed by atom index.
 */
public final class AtomicAnalysis
{
    public static enum Hybridization
    {
        SP, SP2, SP3, UNKNOWN
    }


    private final Hybridization[] hybridization;
    private final int[] valence;
    private final boolean[] aromatic;
    private final Map<BondType, Integer> bondHistogram;
    private final int[] heteroatoms;
    private final int totalAtomCount;

    private final List<int[]> rings;
    private final int[] ringMembership;
    private final boolean[] ringBonds;
    private final List<RingSystem> ringSystems;
    private final int[] ringSystemIndex;


    private AtomicAnalysis(Hybridization[] hybridization, int[] valence, boolean[] aromatic,
            Map<BondType, Integer> bondHistogram, int[] heteroatoms, int totalAtomCount, List<int[]> rings,
            int[] ringMembership, boolean[] ringBonds, List<RingSystem> ringSystems, int[] ringSystemIndex)
    {
        this.hybridization = hybridization;
        this.valence = valence;
        this.aromatic = aromatic;
        this.bondHistogram = bondHistogram;
        this.heteroatoms = heteroatoms;
        this.totalAtomCount = totalAtomCount;
        this.rings = rings;
        this.ringMembership = ringMembership;
        this.ringBonds = ringBonds;
        this.ringSystems = ringSystems;
        this.ringSystemIndex = ringSystemIndex;
    }


    public static AtomicAnalysis analyze(Molecule molecule)
    {
        int count = molecule.getAtomCount();

        Hybridization[] hybridization = new Hybridization[count];
        int[] valence = new int[count];
        boolean[] aromatic = new boolean[count];
        List<Integer> heteroatoms = new ArrayList<Integer>();

        Map<BondType, Integer> histogram = new EnumMap<BondType, Integer>(BondType.class);

        for(BondType type : BondType.values())
            histogram.put(type, 0);

        for(Bond bond : molecule.getBonds())
            histogram.put(bond.type, histogram.get(bond.type) + 1);

        for(int i = 0; i < count; i++)
        {
            Atom atom = molecule.getAtom(i);
            int doubled = 0;
            int doubleBonds = 0;
            boolean triple = false;
            boolean aromaticBond = false;

            for(int neighbour : molecule.getNeighbours(i))
            {
                BondType type = molecule.getBondType(i, neighbour);
                doubled += type.getDoubledOrder();

                if(type == BondType.DOUBLE)
                    doubleBonds++;
                else if(type == BondType.TRIPLE)
                    triple = true;
                else if(type == BondType.AROMATIC)
                    aromaticBond = true;
            }

            valence[i] = doubled / 2 + atom.hydrogens;
            aromatic[i] = atom.aromatic || aromaticBond;

            if(triple || doubleBonds >= 2)
                hybridization[i] = Hybridization.SP;
            else if(doubleBonds == 1 || aromatic[i])
                hybridization[i] = Hybridization.SP2;
            else if(atom.is("H"))
                hybridization[i] = Hybridization.UNKNOWN;
            else
                hybridization[i] = Hybridization.SP3;

            if(!atom.isCarbon() && !atom.is("H"))
                heteroatoms.add(i);
        }

        int total = molecule.getAtomCount() + molecule.getTotalHydrogenCount();

        for(Atom atom : molecule.getAtoms())
            if(atom.is("H"))
                total--;

        int[] noRings = new int[count];
        int[] noSystems = new int[count];
        Arrays.fill(noSystems, -1);

        return new AtomicAnalysis(hybridization, valence, aromatic, Collections.unmodifiableMap(histogram),
                heteroatoms.stream().mapToInt(Integer::intValue).toArray(), total, Collections.emptyList(), noRings,
                new boolean[molecule.getBondCount()], Collections.emptyList(), noSystems);
    }


    /**
     * Returns a copy of this analysis extended with the perceived rings and the ring systems built from them.
     */
    public AtomicAnalysis withRings(Molecule molecule, List<int[]> perceived, List<RingSystem> systems)
    {
        int[] membership = new int[ringMembership.length];
        boolean[] bonds = new boolean[ringBonds.length];

        for(int[] ring : perceived)
        {
            for(int i = 0; i < ring.length; i++)
            {
                membership[ring[i]]++;

                Bond bond = molecule.getBond(ring[i], ring[(i + 1) % ring.length]);

                if(bond != null)
                    bonds[bond.id] = true;
            }
        }

        int[] systemIndex = new int[ringMembership.length];
        Arrays.fill(systemIndex, -1);

        for(int s = 0; s < systems.size(); s++)
            for(int atom : systems.get(s).getAtoms())
                systemIndex[atom] = s;

        List<int[]> ringCopy = new ArrayList<int[]>();

        for(int[] ring : perceived)
            ringCopy.add(ring.clone());

        return new AtomicAnalysis(hybridization, valence, aromatic, bondHistogram, heteroatoms, totalAtomCount,
                Collections.unmodifiableList(ringCopy), membership, bonds,
                Collections.unmodifiableList(new ArrayList<RingSystem>(systems)), systemIndex);
    }


    public Hybridization getHybridization(int atom)
    {
        return hybridization[atom];
    }


    /**
     * Returns the sum of bond orders and implicit hydrogens, aromatic bonds counted as 1.5 and the sum rounded down.
     */
    public int getValence(int atom)
    {
        return valence[atom];
    }


    public boolean isAromatic(int atom)
    {
        return aromatic[atom];
    }


    public int getBondCount(BondType type)
    {
        return bondHistogram.get(type);
    }


    public int[] getHeteroatoms()
    {
        return heteroatoms.clone();
    }


    /**
     * Returns the number of atoms including implicit hydrogens.
     */
    public int getTotalAtomCount()
    {
        return totalAtomCount;
    }


    public List<int[]> getRings()
    {
        return rings;
    }


    public boolean isInRing(int atom)
    {
        return ringMembership[atom] > 0;
    }


    public int getRingMembership(int atom)
    {
        return ringMembership[atom];
    }


    public boolean isRingBond(int bond)
    {
        return ringBonds[bond];
    }


    public List<RingSystem> getRingSystems()
    {
        return ringSystems;
    }


    /**
     * Returns the ring system containing the atom, or null.
     */
    public RingSystem getRingSystemOf(int atom)
    {
        return ringSystemIndex[atom] < 0 ? null : ringSystems.get(ringSystemIndex[atom]);
    }


    /**
     * Returns the ring containing both atoms, or null.
     */
    public int[] getCommonRing(int atom1, int atom2)
    {
        for(int[] ring : rings)
        {
            boolean first = false;
            boolean second = false;

            for(int atom : ring)
            {
                first |= atom == atom1;
                second |= atom == atom2;
            }

            if(first && second)
                return ring;
        }

        return null;
    }
}
