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
 * Name of a ring parent hydride. Fixed names are complete ("benzene", "oxolane"); stem names are composed from a
 * prefix, the alkane stem and the unsaturation endings ("cyclohex" + "ane", "bicyclo[2.2.1]hept" + "ane").
 */
public final class RingName
{
    public static enum Style
    {
        FIXED, STEM
    }


    private final Style style;
    private final String fixedName;
    private final String prefix;
    private final int size;
    private final boolean replacement;


    private RingName(Style style, String fixedName, String prefix, int size, boolean replacement)
    {
        this.style = style;
        this.fixedName = fixedName;
        this.prefix = prefix;
        this.size = size;
        this.replacement = replacement;
    }


    public static RingName fixed(String name, boolean replacement)
    {
        return new RingName(Style.FIXED, name, null, 0, replacement);
    }


    public static RingName stem(String prefix, int size, boolean replacement)
    {
        return new RingName(Style.STEM, null, prefix, size, replacement);
    }


    public Style getStyle()
    {
        return style;
    }


    public boolean isFixed()
    {
        return style == Style.FIXED;
    }


    public String getFixedName()
    {
        return fixedName;
    }


    public String getPrefix()
    {
        return prefix;
    }


    public int getSize()
    {
        return size;
    }


    /**
     * Returns true if ring heteroatoms are expressed by replacement prefixes ("oxa", "aza", ...).
     */
    public boolean isReplacement()
    {
        return replacement;
    }


    @Override
    public String toString()
    {
        return style == Style.FIXED ? fixedName : prefix + "[" + size + "]";
    }
}
