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
package cz.iocb.chemname.assembly;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import cz.iocb.chemname.parent.Substituent;
import cz.iocb.chemname.shared.Alphanumerics;
import cz.iocb.chemname.shared.NomenclatureDictionary;



/**
 * Identical substituent prefixes cited together with one multiplying prefix.
 */
public final class PrefixGroup
{
    /**
     * Orders locants: letter locants ("N") first, then numerals in ascending order, "4a" after "4".
     */
    public static final Comparator<String> LOCANT_ORDER = new Comparator<String>()
    {
        @Override
        public int compare(String a, String b)
        {
            boolean numericA = !a.isEmpty() && Character.isDigit(a.charAt(0));
            boolean numericB = !b.isEmpty() && Character.isDigit(b.charAt(0));

            if(numericA != numericB)
                return numericA ? 1 : -1;

            if(!numericA)
                return a.compareTo(b);

            int result = Integer.compare(leadingNumber(a), leadingNumber(b));
            return result != 0 ? result : a.compareTo(b);
        }
    };


    private final String name;
    private final boolean compound;
    private final List<String> locants;


    public PrefixGroup(String name, boolean compound, List<String> locants)
    {
        List<String> sorted = new ArrayList<String>(locants);
        sorted.sort(LOCANT_ORDER);

        this.name = name;
        this.compound = compound;
        this.locants = Collections.unmodifiableList(sorted);
    }


    private static int leadingNumber(String locant)
    {
        int end = 0;

        while(end < locant.length() && Character.isDigit(locant.charAt(end)))
            end++;

        return Integer.parseInt(locant.substring(0, end));
    }


    /**
     * Groups identical prefixes and orders the groups alphanumerically.
     */
    public static List<PrefixGroup> group(List<Substituent> substituents)
    {
        Map<String, List<String>> locants = new LinkedHashMap<String, List<String>>();
        Map<String, Boolean> compound = new LinkedHashMap<String, Boolean>();

        for(Substituent substituent : substituents)
        {
            locants.computeIfAbsent(substituent.getName(), k -> new ArrayList<String>())
                    .add(substituent.getLocant() == null ? "" : substituent.getLocant());
            compound.merge(substituent.getName(), substituent.isCompound(), Boolean::logicalOr);
        }

        List<PrefixGroup> groups = new ArrayList<PrefixGroup>();

        for(Map.Entry<String, List<String>> entry : locants.entrySet())
            groups.add(new PrefixGroup(entry.getKey(), compound.get(entry.getKey()), entry.getValue()));

        groups.sort(Comparator.comparing(PrefixGroup::getName, Alphanumerics.COMPARATOR));
        return groups;
    }


    public String getName()
    {
        return name;
    }


    public boolean isCompound()
    {
        return compound;
    }


    public List<String> getLocants()
    {
        return locants;
    }


    public int getCount()
    {
        return locants.size();
    }


    /**
     * Renders the group, e.g. "2,3-dimethyl", "N,N-dimethyl", "1,1-bis(2-chloroethyl)" or, without locants,
     * "trichloro".
     */
    public String render(NomenclatureDictionary dictionary, boolean showLocants)
    {
        StringBuilder builder = new StringBuilder();

        if(showLocants && !locants.contains(""))
            builder.append(String.join(",", locants)).append('-');

        if(compound)
        {
            builder.append(dictionary.getComplexMultiplier(getCount()));
            builder.append('(').append(name).append(')');
        }
        else
        {
            builder.append(dictionary.getMultiplier(getCount()));
            builder.append(name);
        }

        return builder.toString();
    }


    /**
     * Joins rendered prefix groups; a hyphen separates a group from a following group that starts with a locant.
     */
    public static String cite(List<PrefixGroup> groups, NomenclatureDictionary dictionary, boolean showLocants)
    {
        List<String> fragments = new ArrayList<String>();

        for(PrefixGroup group : groups)
            fragments.add(group.render(dictionary, showLocants));

        return join(fragments);
    }


    public static String join(List<String> fragments)
    {
        StringBuilder builder = new StringBuilder();

        for(String fragment : fragments)
        {
            if(fragment.isEmpty())
                continue;

            if(builder.length() > 0 && startsWithLocant(fragment))
                builder.append('-');

            builder.append(fragment);
        }

        return builder.toString();
    }


    static boolean startsWithLocant(String text)
    {
        if(text.isEmpty())
            return false;

        if(Character.isDigit(text.charAt(0)))
            return true;

        return text.length() > 1 && Character.isUpperCase(text.charAt(0))
                && (text.charAt(1) == ',' || text.charAt(1) == '-');
    }


    @Override
    public String toString()
    {
        return locants + name;
    }
}
