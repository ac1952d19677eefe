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

import java.util.EnumMap;
import java.util.Map;



/**
 * Prefix and suffix spellings of the characteristic group classes.
 */
public class GroupNames
{
    private static final Map<FunctionalGroupType, String> prefixes = new EnumMap<>(FunctionalGroupType.class);
    private static final Map<FunctionalGroupType, String> suffixes = new EnumMap<>(FunctionalGroupType.class);
    private static final Map<FunctionalGroupType, String> attachedSuffixes = new EnumMap<>(FunctionalGroupType.class);


    static
    {
        add(FunctionalGroupType.CARBOXYLIC_ACID, "carboxy", "oic acid", "carboxylic acid");
        add(FunctionalGroupType.ANHYDRIDE, "acyloxycarbonyl", "oic anhydride", "carboxylic anhydride");
        add(FunctionalGroupType.ESTER, "alkoxycarbonyl", "oate", "carboxylate");
        add(FunctionalGroupType.ACYL_HALIDE, "halocarbonyl", "oyl", "carbonyl");
        add(FunctionalGroupType.AMIDE, "carbamoyl", "amide", "carboxamide");
        add(FunctionalGroupType.THIOCYANATE, "thiocyanato", "thiocyanate", "thiocyanate");
        add(FunctionalGroupType.NITRILE, "cyano", "nitrile", "carbonitrile");
        add(FunctionalGroupType.ALDEHYDE, "oxo", "al", "carbaldehyde");
        add(FunctionalGroupType.KETONE, "oxo", "one", "one");
        add(FunctionalGroupType.THIOESTER, "alkylsulfanylcarbonyl", "thioate", "carbothioate");
        add(FunctionalGroupType.ALCOHOL, "hydroxy", "ol", "ol");
        add(FunctionalGroupType.THIOL, "sulfanyl", "thiol", "thiol");
        add(FunctionalGroupType.IMINE, "imino", "imine", "imine");
        add(FunctionalGroupType.NITRO, "nitro", null, null);
        add(FunctionalGroupType.NITROSO, "nitroso", null, null);
        add(FunctionalGroupType.AMINE, "amino", "amine", "amine");
        add(FunctionalGroupType.ETHER, "alkoxy", null, null);
        add(FunctionalGroupType.SULFONYL, "alkylsulfonyl", null, null);
        add(FunctionalGroupType.SULFINYL, "alkylsulfinyl", null, null);
        add(FunctionalGroupType.THIOETHER, "alkylsulfanyl", null, null);
        add(FunctionalGroupType.PHOSPHANYL, "phosphanyl", null, null);
        add(FunctionalGroupType.BORANE, "boranyl", null, null);
        add(FunctionalGroupType.HALIDE, "halo", null, null);
    }


    private static void add(FunctionalGroupType type, String prefix, String suffix, String attachedSuffix)
    {
        prefixes.put(type, prefix);
        suffixes.put(type, suffix);
        attachedSuffixes.put(type, attachedSuffix);
    }


    public static String getPrefix(FunctionalGroupType type)
    {
        return prefixes.get(type);
    }


    /**
     * Returns the suffix used when the key atom belongs to the parent, or null for prefix-only classes.
     */
    public static String getSuffix(FunctionalGroupType type)
    {
        return suffixes.get(type);
    }


    /**
     * Returns the suffix used when the carbon of the group is attached to the parent (ring parents).
     */
    public static String getAttachedSuffix(FunctionalGroupType type)
    {
        return attachedSuffixes.get(type);
    }
}
