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



public class Atom
{
    public static enum Chirality
    {
        NONE, CLOCKWISE, ANTI_CLOCKWISE, UNDEFINED
    }


    public final int id;
    public final String symbol;
    public final int charge;
    public final int isotope;
    public final boolean aromatic;
    public final int hydrogens;
    public final Chirality chirality;


    public Atom(int id, String symbol, int charge, int isotope, boolean aromatic, int hydrogens, Chirality chirality)
    {
        if(symbol == null || symbol.isEmpty())
            throw new IllegalArgumentException("atom " + id + " has no element symbol");

        if(hydrogens < 0)
            throw new IllegalArgumentException("atom " + id + " has a negative hydrogen count");

        this.id = id;
        this.symbol = symbol;
        this.charge = charge;
        this.isotope = isotope;
        this.aromatic = aromatic;
        this.hydrogens = hydrogens;
        this.chirality = chirality == null ? Chirality.NONE : chirality;
    }


    public Atom(int id, String symbol, boolean aromatic, int hydrogens)
    {
        this(id, symbol, 0, 0, aromatic, hydrogens, Chirality.NONE);
    }


    public boolean isCarbon()
    {
        return symbol.equals("C");
    }


    public boolean isHalogen()
    {
        return symbol.equals("F") || symbol.equals("Cl") || symbol.equals("Br") || symbol.equals("I");
    }


    public boolean is(String element)
    {
        return symbol.equals(element);
    }


    @Override
    public String toString()
    {
        return symbol + id;
    }
}
