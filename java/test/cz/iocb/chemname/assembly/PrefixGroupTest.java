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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import cz.iocb.chemname.parent.Substituent;
import cz.iocb.chemname.shared.NomenclatureDictionary;



public class PrefixGroupTest
{
    private final NomenclatureDictionary dictionary = new NomenclatureDictionary();


    private static Substituent substituent(String name, String locant, boolean compound)
    {
        return new Substituent(0, 1, name, compound).withLocant(locant);
    }


    @Test
    public void testGrouping()
    {
        List<PrefixGroup> groups = PrefixGroup.group(Arrays.asList(substituent("methyl", "3", false),
                substituent("chloro", "2", false), substituent("methyl", "2", false)));

        assertEquals(2, groups.size());
        assertEquals("chloro", groups.get(0).getName());
        assertEquals("methyl", groups.get(1).getName());
        assertEquals(Arrays.asList("2", "3"), groups.get(1).getLocants());
        assertEquals(2, groups.get(1).getCount());
    }


    @Test
    public void testRendering()
    {
        PrefixGroup methyl = new PrefixGroup("methyl", false, Arrays.asList("3", "2", "2"));
        PrefixGroup chloroethyl = new PrefixGroup("2-chloroethyl", true, Arrays.asList("1", "1"));

        assertEquals("2,2,3-trimethyl", methyl.render(dictionary, true));
        assertEquals("trimethyl", methyl.render(dictionary, false));
        assertEquals("1,1-bis(2-chloroethyl)", chloroethyl.render(dictionary, true));
    }


    @Test
    public void testCitation()
    {
        List<PrefixGroup> groups = Arrays.asList(new PrefixGroup("bromo", false, Arrays.asList("1")),
                new PrefixGroup("methyl", false, Arrays.asList("2", "3")));

        assertEquals("1-bromo-2,3-dimethyl", PrefixGroup.cite(groups, dictionary, true));
        assertEquals("bromodimethyl", PrefixGroup.cite(groups, dictionary, false));
        assertEquals("2-methylbutane", PrefixGroup.join(Arrays.asList("", "2-methyl", "butane")));
        assertEquals("2-methylbutan-2-ol", PrefixGroup.join(Arrays.asList("2-methyl", "butan-2-ol")));
    }


    @Test
    public void testLocantOrder()
    {
        List<String> locants = new ArrayList<String>(Arrays.asList("4a", "10", "N", "2", "4"));

        locants.sort(PrefixGroup.LOCANT_ORDER);

        assertEquals(Arrays.asList("N", "2", "4", "4a", "10"), locants);
    }


    @Test
    public void testNitrogenSubstituentKeepsLetterLocant()
    {
        Substituent nitrogen = new Substituent(0, 1, "methyl", false).withNitrogenLocant().withLocant("2");

        assertTrue(nitrogen.isNitrogen());
        assertEquals("N", nitrogen.getLocant());
        assertTrue(PrefixGroup.startsWithLocant("N,N-dimethyl"));
        assertFalse(PrefixGroup.startsWithLocant("Nmethyl"));
    }


    @Test
    public void testAcidAndAnionNames()
    {
        assertEquals("propanoic", FunctionalClassNamer.toAcid("propanoyl"));
        assertEquals("acetic", FunctionalClassNamer.toAcid("acetyl"));
        assertEquals("cyclohexanecarboxylic", FunctionalClassNamer.toAcid("cyclohexanecarbonyl"));
        assertNull(FunctionalClassNamer.toAcid("methyl"));

        assertEquals("butanedioate", ParentNameBuilder.toAnion("butanedioic acid"));
        assertEquals("acetate", ParentNameBuilder.toAnion("acetic acid"));
        assertEquals("benzenecarboxylate", ParentNameBuilder.toAnion("benzenecarboxylic acid"));
    }
}
