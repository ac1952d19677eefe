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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;



/**
 * Progress of the chain seniority cascade. Step n may only run after step n - 1 has been applied; each step stores
 * the threshold it filtered on so that the next step can validate the remaining candidates against it.
 */
public final class CascadeState
{
    public static final int STEPS = 8;

    public static final CascadeState INITIAL = new CascadeState(new boolean[STEPS + 1], 0, 0, 0, new int[0],
            new int[0], 0, new int[0], Collections.emptyList());


    private final boolean[] applied;
    private final int length;
    private final int multipleBonds;
    private final int doubleBonds;
    private final int[] multipleBondLocants;
    private final int[] doubleBondLocants;
    private final int substituents;
    private final int[] substituentLocants;
    private final List<String> citation;


    private CascadeState(boolean[] applied, int length, int multipleBonds, int doubleBonds,
            int[] multipleBondLocants, int[] doubleBondLocants, int substituents, int[] substituentLocants,
            List<String> citation)
    {
        this.applied = applied;
        this.length = length;
        this.multipleBonds = multipleBonds;
        this.doubleBonds = doubleBonds;
        this.multipleBondLocants = multipleBondLocants;
        this.doubleBondLocants = doubleBondLocants;
        this.substituents = substituents;
        this.substituentLocants = substituentLocants;
        this.citation = citation;
    }


    private boolean[] mark(int step)
    {
        if(step > 1 && !applied[step - 1])
            throw new IllegalStateException("cascade step " + step + " requires step " + (step - 1));

        boolean[] copy = applied.clone();
        copy[step] = true;
        return copy;
    }


    public boolean isApplied(int step)
    {
        return applied[step];
    }


    /**
     * Returns true if the step may run: it has not run yet and its predecessor has been applied.
     */
    public boolean isReady(int step)
    {
        return !applied[step] && (step == 1 || applied[step - 1]);
    }


    public CascadeState withLength(int value)
    {
        return new CascadeState(mark(1), value, multipleBonds, doubleBonds, multipleBondLocants, doubleBondLocants,
                substituents, substituentLocants, citation);
    }


    public CascadeState withMultipleBonds(int value)
    {
        return new CascadeState(mark(2), length, value, doubleBonds, multipleBondLocants, doubleBondLocants,
                substituents, substituentLocants, citation);
    }


    public CascadeState withDoubleBonds(int value)
    {
        return new CascadeState(mark(3), length, multipleBonds, value, multipleBondLocants, doubleBondLocants,
                substituents, substituentLocants, citation);
    }


    public CascadeState withMultipleBondLocants(int[] value)
    {
        return new CascadeState(mark(4), length, multipleBonds, doubleBonds, value.clone(), doubleBondLocants,
                substituents, substituentLocants, citation);
    }


    public CascadeState withDoubleBondLocants(int[] value)
    {
        return new CascadeState(mark(5), length, multipleBonds, doubleBonds, multipleBondLocants, value.clone(),
                substituents, substituentLocants, citation);
    }


    public CascadeState withSubstituents(int value)
    {
        return new CascadeState(mark(6), length, multipleBonds, doubleBonds, multipleBondLocants, doubleBondLocants,
                value, substituentLocants, citation);
    }


    public CascadeState withSubstituentLocants(int[] value)
    {
        return new CascadeState(mark(7), length, multipleBonds, doubleBonds, multipleBondLocants, doubleBondLocants,
                substituents, value.clone(), citation);
    }


    public CascadeState withCitation(List<String> value)
    {
        return new CascadeState(mark(8), length, multipleBonds, doubleBonds, multipleBondLocants, doubleBondLocants,
                substituents, substituentLocants, Collections.unmodifiableList(value));
    }


    public int getLength()
    {
        return length;
    }


    public int getMultipleBonds()
    {
        return multipleBonds;
    }


    public int getDoubleBonds()
    {
        return doubleBonds;
    }


    public int[] getMultipleBondLocants()
    {
        return multipleBondLocants.clone();
    }


    public int[] getDoubleBondLocants()
    {
        return doubleBondLocants.clone();
    }


    public int getSubstituents()
    {
        return substituents;
    }


    public int[] getSubstituentLocants()
    {
        return substituentLocants.clone();
    }


    public List<String> getCitation()
    {
        return citation;
    }


    @Override
    public String toString()
    {
        StringBuilder builder = new StringBuilder("cascade");

        for(int step = 1; step <= STEPS; step++)
            if(applied[step])
                builder.append(' ').append(step);

        return builder.append(" length=").append(length).append(" multiple=").append(multipleBonds)
                .append(" double=").append(doubleBonds).append(" locants=")
                .append(Arrays.toString(multipleBondLocants)).toString();
    }
}
