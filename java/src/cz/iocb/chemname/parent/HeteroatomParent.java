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

import java.util.List;



/**
 * Mononuclear parent hydride such as phosphane or silane.
 */
public final class HeteroatomParent extends ParentStructure
{
    private final int atom;
    private final String element;


    public HeteroatomParent(int atom, String element, String name, List<Substituent> substituents)
    {
        super(name, substituents);
        this.atom = atom;
        this.element = element;
    }


    public int getAtom()
    {
        return atom;
    }


    public String getElement()
    {
        return element;
    }


    @Override
    public ParentType getType()
    {
        return ParentType.HETEROATOM;
    }


    @Override
    public int[] getAtoms()
    {
        return new int[] { atom };
    }
}
