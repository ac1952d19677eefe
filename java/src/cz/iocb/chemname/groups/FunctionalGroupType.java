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
package cz.iocb.chemname.groups;



/**
 * Characteristic group classes in order of seniority. The raw priority uses the inverted scale of the seniority
 * table (1 is the most senior class); {@link #getPriority()} maps it to the normalized 0-100 scale.
 */
public enum FunctionalGroupType
{
    CARBOXYLIC_ACID("carboxylic_acid", 1, true, true),
    ANHYDRIDE("anhydride", 2, true, true),
    ESTER("ester", 4, true, true),
    ACYL_HALIDE("acyl_halide", 5, true, true),
    AMIDE("amide", 6, true, true),
    THIOCYANATE("thiocyanate", 6.5, true, false),
    NITRILE("nitrile", 7, true, true),
    ALDEHYDE("aldehyde", 8, true, true),
    KETONE("ketone", 9, true, true),
    THIOESTER("thioester", 9.5, true, true),
    ALCOHOL("alcohol", 10, true, false),
    THIOL("thiol", 10.5, true, false),
    IMINE("imine", 11, true, true),
    NITRO("nitro", 12, false, false),
    NITROSO("nitroso", 12.5, false, false),
    AMINE("amine", 13, true, false),
    ETHER("ether", 14, false, false),
    SULFONYL("sulfonyl", 15, false, false),
    SULFINYL("sulfinyl", 16, false, false),
    THIOETHER("thioether", 17, false, false),
    PHOSPHANYL("phosphanyl", 18, false, false),
    BORANE("borane", 19, true, false),
    HALIDE("halide", 20, false, false);

    private String label;
    private double rawPriority;
    private boolean principalCapable;
    private boolean carbonAnchored;

    private FunctionalGroupType(String label, double rawPriority, boolean principalCapable, boolean carbonAnchored)
    {
        this.label = label;
        this.rawPriority = rawPriority;
        this.principalCapable = principalCapable;
        this.carbonAnchored = carbonAnchored;
    };

    public String getLabel()
    {
        return label;
    }


    public double getRawPriority()
    {
        return rawPriority;
    }


    public int getPriority()
    {
        return normalizePriority(rawPriority);
    }


    /**
     * Returns false for classes that are always cited as prefixes (halides, ethers, nitro compounds, ...).
     */
    public boolean isPrincipalCapable()
    {
        return principalCapable;
    }


    public boolean isSubstituentOnly()
    {
        return !principalCapable;
    }


    /**
     * Returns true if the first atom of the group is a carbon atom that becomes a member of a parent chain.
     */
    public boolean isCarbonAnchored()
    {
        return carbonAnchored;
    }


    /**
     * Returns true for the terminal classes that stay principal when attached one atom away from a ring.
     */
    public boolean isAlwaysPrincipalTerminal()
    {
        switch(this)
        {
            case ESTER:
            case CARBOXYLIC_ACID:
            case ALDEHYDE:
            case KETONE:
            case AMIDE:
            case ACYL_HALIDE:
            case ANHYDRIDE:
            case THIOESTER:
                return true;
            default:
                return false;
        }
    }


    /**
     * Returns true for classes whose names are built from a class word (functional class nomenclature).
     */
    public boolean isFunctionalClassTrigger()
    {
        switch(this)
        {
            case ANHYDRIDE:
            case ACYL_HALIDE:
            case NITRILE:
            case THIOESTER:
            case THIOCYANATE:
            case BORANE:
                return true;
            default:
                return false;
        }
    }


    public static int normalizePriority(double raw)
    {
        if(raw > 20)
            return (int) Math.round(raw);

        return (int) Math.round((19 + 1 - raw) / 19 * 100);
    }
}
