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
import java.util.List;



/**
 * Chosen parent structure. Once set in a naming context it is never replaced.
 */
public abstract class ParentStructure
{
    public static enum ParentType
    {
        CHAIN("chain"), RING("ring"), HETEROATOM("heteroatom");

        private String label;

        private ParentType(String label)
        {
            this.label = label;
        };

        public String getLabel()
        {
            return label;
        }
    }


    private final String name;
    private final List<Substituent> substituents;


    protected ParentStructure(String name, List<Substituent> substituents)
    {
        this.name = name;
        this.substituents = Collections.unmodifiableList(new ArrayList<Substituent>(substituents));
    }


    public abstract ParentType getType();


    /**
     * Returns the parent atoms. The order is only meaningful for chains.
     */
    public abstract int[] getAtoms();


    public boolean contains(int atom)
    {
        for(int a : getAtoms())
            if(a == atom)
                return true;

        return false;
    }


    /**
     * Returns the name of the unsubstituted parent hydride.
     */
    public String getName()
    {
        return name;
    }


    /**
     * Returns the substituents without locants; locants are assigned by the numbering.
     */
    public List<Substituent> getSubstituents()
    {
        return substituents;
    }


    @Override
    public String toString()
    {
        return getType().getLabel() + ":" + name;
    }
}
