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



public final class RingParent extends ParentStructure
{
    private final RingSystem ring;


    public RingParent(RingSystem ring, String name, List<Substituent> substituents)
    {
        super(name, substituents);
        this.ring = ring;
    }


    public RingSystem getRing()
    {
        return ring;
    }


    @Override
    public ParentType getType()
    {
        return ParentType.RING;
    }


    @Override
    public int[] getAtoms()
    {
        return ring.getAtoms();
    }
}
