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
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import cz.iocb.chemname.shared.Locants;



/**
 * Candidate parent chain. The atoms are stored in the orientation that gives the chain its lowest locants, so the
 * first atom carries the locant 1.
 */
public final class Chain
{
    private final int[] atoms;
    private final int principalGroupCount;
    private final int[] doubleBondLocants;
    private final int[] tripleBondLocants;
    private final List<Substituent> substituents;


    public Chain(int[] atoms, int principalGroupCount, int[] doubleBondLocants, int[] tripleBondLocants,
            List<Substituent> substituents)
    {
        if(atoms.length == 0)
            throw new IllegalArgumentException("empty chain");

        this.atoms = atoms.clone();
        this.principalGroupCount = principalGroupCount;
        this.doubleBondLocants = Locants.sorted(doubleBondLocants);
        this.tripleBondLocants = Locants.sorted(tripleBondLocants);
        this.substituents = Collections.unmodifiableList(new ArrayList<Substituent>(substituents));
    }


    public int[] getAtoms()
    {
        return atoms.clone();
    }


    public int getAtom(int index)
    {
        return atoms[index];
    }


    public int getLength()
    {
        return atoms.length;
    }


    /**
     * Returns the locant (1-based position) of an atom, or 0 if the atom does not belong to the chain.
     */
    public int getLocant(int atom)
    {
        for(int i = 0; i < atoms.length; i++)
            if(atoms[i] == atom)
                return i + 1;

        return 0;
    }


    public boolean contains(int atom)
    {
        return getLocant(atom) > 0;
    }


    public int getPrincipalGroupCount()
    {
        return principalGroupCount;
    }


    public int getMultipleBondCount()
    {
        return doubleBondLocants.length + tripleBondLocants.length;
    }


    public int getDoubleBondCount()
    {
        return doubleBondLocants.length;
    }


    public int[] getMultipleBondLocants()
    {
        int[] locants = new int[doubleBondLocants.length + tripleBondLocants.length];
        System.arraycopy(doubleBondLocants, 0, locants, 0, doubleBondLocants.length);
        System.arraycopy(tripleBondLocants, 0, locants, doubleBondLocants.length, tripleBondLocants.length);
        return Locants.sorted(locants);
    }


    public int[] getDoubleBondLocants()
    {
        return doubleBondLocants.clone();
    }


    public int[] getTripleBondLocants()
    {
        return tripleBondLocants.clone();
    }


    public List<Substituent> getSubstituents()
    {
        return substituents;
    }


    public int getSubstituentCount()
    {
        int count = 0;

        for(Substituent substituent : substituents)
            if(!substituent.isNitrogen())
                count++;

        return count;
    }


    public int[] getSubstituentLocants()
    {
        List<Integer> locants = new ArrayList<Integer>();

        for(Substituent substituent : substituents)
            if(!substituent.isNitrogen())
                locants.add(getLocant(substituent.getAttachment()));

        return Locants.sorted(locants);
    }


    /**
     * Returns the substituent names ordered by locant and then alphabetically.
     */
    public List<String> getCitation()
    {
        List<Substituent> sorted = new ArrayList<Substituent>();

        for(Substituent substituent : substituents)
            if(!substituent.isNitrogen())
                sorted.add(substituent);

        sorted.sort(Comparator.comparingInt((Substituent s) -> getLocant(s.getAttachment()))
                .thenComparing(Substituent::getName));

        List<String> citation = new ArrayList<String>();

        for(Substituent substituent : sorted)
            citation.add(substituent.getName());

        return citation;
    }


    @Override
    public String toString()
    {
        StringBuilder builder = new StringBuilder("C");
        builder.append(atoms.length).append('[');

        for(int i = 0; i < atoms.length; i++)
            builder.append(i == 0 ? "" : "-").append(atoms[i]);

        return builder.append(']').toString();
    }
}
