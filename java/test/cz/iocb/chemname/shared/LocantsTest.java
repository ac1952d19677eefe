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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;



public class LocantsTest
{
    @Test
    public void testFirstPointOfDifference()
    {
        assertTrue(Locants.compare(new int[] { 1, 2, 4 }, new int[] { 1, 3, 3 }) < 0);
        assertTrue(Locants.compare(new int[] { 2, 2 }, new int[] { 1, 5, 6 }) > 0);
        assertEquals(0, Locants.compare(new int[] { 1, 4 }, new int[] { 1, 4 }));
    }


    @Test
    public void testPrefixIsLower()
    {
        assertTrue(Locants.compare(new int[] { 1, 2 }, new int[] { 1, 2, 3 }) < 0);
        assertTrue(Locants.compare(new int[] { 1, 2, 3 }, new int[] { 1, 2 }) > 0);
        assertTrue(Locants.compare(new int[0], new int[] { 1 }) < 0);
    }


    @Test
    public void testListComparison()
    {
        assertTrue(Locants.compare(Arrays.asList("ethyl", "methyl"), Arrays.asList("methyl", "ethyl")) < 0);
        assertTrue(Locants.compare(Arrays.asList("methyl"), Arrays.asList("methyl", "methyl")) < 0);
    }


    @Test
    public void testComparatorIsConsistentWithSorting()
    {
        List<int[]> sets = new ArrayList<int[]>(Arrays.asList(new int[] { 2, 3 }, new int[] { 1, 4, 5 },
                new int[] { 1, 4 }, new int[] { 1, 3, 9 }));

        sets.sort(Locants.COMPARATOR);

        assertEquals("1,3,9", Locants.join(sets.get(0)));
        assertEquals("1,4", Locants.join(sets.get(1)));
        assertEquals("1,4,5", Locants.join(sets.get(2)));
        assertEquals("2,3", Locants.join(sets.get(3)));
    }


    @Test
    public void testSorted()
    {
        int[] original = { 5, 1, 3 };

        assertEquals("1,3,5", Locants.join(Locants.sorted(original)));
        assertEquals(5, original[0]);
        assertEquals("2,7", Locants.join(Locants.sorted(Arrays.asList(7, 2))));
    }


    @Test
    public void testAlphanumericalOrder()
    {
        List<String> prefixes = new ArrayList<String>(Arrays.asList("methyl", "(dimethylamino)", "chloro", "ethyl",
                "2-chloroethyl"));

        prefixes.sort(Alphanumerics.COMPARATOR);

        assertEquals(Arrays.asList("chloro", "2-chloroethyl", "(dimethylamino)", "ethyl", "methyl"), prefixes);
        assertEquals("dimethylamino", Alphanumerics.key("(Dimethylamino)"));
    }
}
