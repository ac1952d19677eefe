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
package cz.iocb.chemname.shared;

import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;



/**
 * Utilities for comparing and formatting locant sets.
 */
public class Locants
{
    /**
     * Compares two locant arrays by first point of difference. A strict prefix is smaller than its extension.
     */
    public static int compare(int[] a, int[] b)
    {
        int length = Math.min(a.length, b.length);

        for(int i = 0; i < length; i++)
            if(a[i] != b[i])
                return a[i] < b[i] ? -1 : 1;

        return Integer.compare(a.length, b.length);
    }


    public static <T extends Comparable<T>> int compare(List<T> a, List<T> b)
    {
        int length = Math.min(a.size(), b.size());

        for(int i = 0; i < length; i++)
        {
            int value = a.get(i).compareTo(b.get(i));

            if(value != 0)
                return value;
        }

        return Integer.compare(a.size(), b.size());
    }


    public static final Comparator<int[]> COMPARATOR = Locants::compare;


    public static int[] sorted(int[] locants)
    {
        int[] copy = locants.clone();
        Arrays.sort(copy);
        return copy;
    }


    public static int[] sorted(Collection<Integer> locants)
    {
        return locants.stream().mapToInt(Integer::intValue).sorted().toArray();
    }


    public static String join(Collection<String> labels)
    {
        return labels.stream().collect(Collectors.joining(","));
    }


    public static String join(int[] locants)
    {
        return Arrays.stream(locants).mapToObj(Integer::toString).collect(Collectors.joining(","));
    }
}
