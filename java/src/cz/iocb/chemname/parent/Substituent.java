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



/**
 * Prefix cited for a branch hanging off a parent atom, or off the nitrogen atom of a principal amide, amine or
 * imine (cited with the locant "N").
 */
public final class Substituent
{
    private final int attachment;
    private final int root;
    private final String name;
    private final boolean compound;
    private final boolean nitrogen;
    private final String locant;


    public Substituent(int attachment, int root, String name, boolean compound)
    {
        this(attachment, root, name, compound, false, null);
    }


    private Substituent(int attachment, int root, String name, boolean compound, boolean nitrogen, String locant)
    {
        if(name == null || name.isEmpty())
            throw new IllegalArgumentException("substituent at atom " + root + " has no name");

        this.attachment = attachment;
        this.root = root;
        this.name = name;
        this.compound = compound;
        this.nitrogen = nitrogen;
        this.locant = locant;
    }


    public Substituent withNitrogenLocant()
    {
        return new Substituent(attachment, root, name, compound, true, "N");
    }


    public Substituent withLocant(String locant)
    {
        return new Substituent(attachment, root, name, compound, nitrogen, nitrogen ? "N" : locant);
    }


    /**
     * Returns the parent atom (or the nitrogen atom of the principal group) bearing the substituent.
     */
    public int getAttachment()
    {
        return attachment;
    }


    public int getRoot()
    {
        return root;
    }


    public String getName()
    {
        return name;
    }


    /**
     * Returns true if the prefix must be enclosed in parentheses and multiplied with bis, tris, ...
     */
    public boolean isCompound()
    {
        return compound;
    }


    public boolean isNitrogen()
    {
        return nitrogen;
    }


    public String getLocant()
    {
        return locant;
    }


    @Override
    public String toString()
    {
        return (locant == null ? "?" : locant) + "-" + name;
    }
}
