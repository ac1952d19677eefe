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
package cz.iocb.chemname.molecule;



public class Bond
{
    public static enum Stereo
    {
        NONE, OPPOSITE, TOGETHER, UNDEFINED
    }


    public final int id;
    public final int atom1;
    public final int atom2;
    public final BondType type;
    public final Stereo stereo;


    public Bond(int id, int atom1, int atom2, BondType type, Stereo stereo)
    {
        if(atom1 == atom2)
            throw new IllegalArgumentException("bond " + id + " connects atom " + atom1 + " to itself");

        this.id = id;
        this.atom1 = atom1;
        this.atom2 = atom2;
        this.type = type;
        this.stereo = stereo == null ? Stereo.NONE : stereo;
    }


    public Bond(int id, int atom1, int atom2, BondType type)
    {
        this(id, atom1, atom2, type, Stereo.NONE);
    }


    public int getOther(int atom)
    {
        if(atom == atom1)
            return atom2;
        else if(atom == atom2)
            return atom1;

        throw new IllegalArgumentException("atom " + atom + " is not a member of bond " + id);
    }


    public boolean contains(int atom)
    {
        return atom == atom1 || atom == atom2;
    }
}
