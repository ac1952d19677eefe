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
import java.util.Collections;
import java.util.List;
import cz.iocb.chemname.parent.Substituent;



/**
 * Final numbering of a parent structure: the parent atoms in locant order with their locant labels, and the
 * substituents with their assigned locants once they are known.
 */
public final class Numbering
{
    private final int[] orderedAtoms;
    private final String[] labels;
    private final int[] rank;
    private final List<Substituent> substituents;


    public Numbering(int[] orderedAtoms, String[] labels, int atomCount)
    {
        this(orderedAtoms, labels, atomCount, null);
    }


    private Numbering(int[] orderedAtoms, String[] labels, int atomCount, List<Substituent> substituents)
    {
        if(orderedAtoms.length != labels.length)
            throw new IllegalArgumentException("every numbered atom needs exactly one label");

        this.orderedAtoms = orderedAtoms.clone();
        this.labels = labels.clone();
        this.rank = new int[atomCount];

        for(int i = 0; i < orderedAtoms.length; i++)
            rank[orderedAtoms[i]] = i + 1;

        this.substituents = substituents == null ? null :
                Collections.unmodifiableList(new ArrayList<Substituent>(substituents));
    }


    public Numbering withSubstituents(List<Substituent> substituents)
    {
        return new Numbering(orderedAtoms, labels, rank.length, substituents);
    }


    public int[] getOrderedAtoms()
    {
        return orderedAtoms.clone();
    }


    public String[] getLabels()
    {
        return labels.clone();
    }


    /**
     * Returns the locant label of a parent atom, or null for atoms outside the parent.
     */
    public String getLabel(int atom)
    {
        return rank[atom] == 0 ? null : labels[rank[atom] - 1];
    }


    /**
     * Returns the position of a parent atom in the numbering, starting at 1, or 0 for atoms outside the parent.
     */
    public int getRank(int atom)
    {
        return rank[atom];
    }


    public int size()
    {
        return orderedAtoms.length;
    }


    /**
     * Returns the substituents with locants, or null if they were not numbered yet.
     */
    public List<Substituent> getSubstituents()
    {
        return substituents;
    }


    @Override
    public String toString()
    {
        StringBuilder builder = new StringBuilder();

        for(int i = 0; i < orderedAtoms.length; i++)
            builder.append(i == 0 ? "" : " ").append(labels[i]).append(':').append(orderedAtoms[i]);

        return builder.toString();
    }
}
