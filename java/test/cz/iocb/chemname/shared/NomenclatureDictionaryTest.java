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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import org.junit.Test;



public class NomenclatureDictionaryTest
{
    private final NomenclatureDictionary dictionary = new NomenclatureDictionary();


    @Test
    public void testStems()
    {
        assertEquals("meth", dictionary.getStem(1));
        assertEquals("but", dictionary.getStem(4));
        assertEquals("undec", dictionary.getStem(11));
        assertEquals("icos", dictionary.getStem(20));
        assertEquals("henicos", dictionary.getStem(21));
        assertEquals("docos", dictionary.getStem(22));
        assertEquals("triacont", dictionary.getStem(30));
        assertEquals("hentriacont", dictionary.getStem(31));
        assertEquals("pentatetracont", dictionary.getStem(45));
    }


    @Test(expected = IllegalArgumentException.class)
    public void testInvalidStem()
    {
        dictionary.getStem(0);
    }


    @Test
    public void testMultipliers()
    {
        assertEquals("", dictionary.getMultiplier(1));
        assertEquals("di", dictionary.getMultiplier(2));
        assertEquals("tetra", dictionary.getMultiplier(4));
        assertEquals("bis", dictionary.getComplexMultiplier(2));
        assertEquals("tetrakis", dictionary.getComplexMultiplier(4));
    }


    @Test(expected = IllegalArgumentException.class)
    public void testUnsupportedMultiplicity()
    {
        dictionary.getMultiplier(0);
    }


    @Test
    public void testHeteroatoms()
    {
        assertEquals("oxa", dictionary.getReplacementPrefix("O"));
        assertEquals("aza", dictionary.getReplacementPrefix("N"));
        assertTrue(dictionary.getHeteroatomRank("O") < dictionary.getHeteroatomRank("S"));
        assertTrue(dictionary.getHeteroatomRank("S") < dictionary.getHeteroatomRank("N"));
        assertEquals(999, dictionary.getHeteroatomRank("Xe"));
    }


    @Test
    public void testHydridesAndHalogens()
    {
        assertTrue(dictionary.isHydrideElement("Si"));
        assertFalse(dictionary.isHydrideElement("C"));
        assertEquals("phosphane", dictionary.getHydrideName("P"));
        assertEquals(3, dictionary.getHydrideValence("B"));
        assertEquals(-1, dictionary.getHydrideValence("O"));
        assertEquals("bromo", dictionary.getHalogenPrefix("Br"));
        assertEquals("chloride", dictionary.getHalideName("Cl"));
        assertNull(dictionary.getHalideName("O"));
    }


    @Test
    public void testSubstituentAliases()
    {
        assertEquals("methoxy", dictionary.getSubstituentAlias("methyloxy"));
        assertEquals("acetyl", dictionary.getSubstituentAlias("ethanoyl"));
        assertEquals("propyl", dictionary.getSubstituentAlias("propyl"));
    }
}
