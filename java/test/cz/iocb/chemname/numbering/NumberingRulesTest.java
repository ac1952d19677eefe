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
package cz.iocb.chemname.numbering;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import java.util.Map;
import org.junit.BeforeClass;
import org.junit.Test;
import org.openscience.cdk.exception.CDKException;
import cz.iocb.chemname.engine.NamingConfiguration;
import cz.iocb.chemname.engine.NamingEngine;
import cz.iocb.chemname.engine.NamingResult;
import cz.iocb.chemname.engine.NamingServices;



public class NumberingRulesTest
{
    private static NamingEngine engine;


    @BeforeClass
    public static void setUp()
    {
        engine = new NamingEngine(NamingServices.createDefault(), NamingConfiguration.defaults());
    }


    private static String name(String smiles) throws CDKException
    {
        return engine.nameSmiles(smiles).getName();
    }


    @Test
    public void testPrincipalGroupGetsLowestLocant() throws CDKException
    {
        NamingResult result = engine.nameSmiles("CCC(O)C");
        Map<Integer, String> locants = result.getLocants();

        assertEquals("butan-2-ol", result.getName());
        assertEquals("4", locants.get(0));
        assertEquals("2", locants.get(2));
        assertEquals("1", locants.get(4));
    }


    @Test
    public void testPrincipalGroupBeforeMultipleBonds() throws CDKException
    {
        assertEquals("but-3-en-1-ol", name("C=CCCO"));
    }


    @Test
    public void testMultipleBondsBeforePrefixes() throws CDKException
    {
        assertEquals("4-methylpent-1-ene", name("C=CCC(C)C"));
    }


    @Test
    public void testPrefixesTogether() throws CDKException
    {
        assertEquals("2-methylpentane", name("CCCC(C)C"));
        assertEquals("2,4-dimethylhexane", name("CCC(C)CC(C)C"));
    }


    @Test
    public void testCitationOrderDecidesTies() throws CDKException
    {
        assertEquals("1-bromo-2-chloroethane", name("ClCCBr"));
        assertEquals("1-chloro-4-methylbenzene", name("Cc1ccc(Cl)cc1"));
    }


    @Test
    public void testRingHeteroatomGetsLocantOne() throws CDKException
    {
        assertEquals("2-methyloxolane", name("CC1CCCO1"));
    }


    @Test
    public void testLocantsCoverParent() throws CDKException
    {
        NamingResult result = engine.nameSmiles("CCCCCC");

        assertEquals("hexane", result.getName());
        assertEquals(6, result.getLocants().size());
        assertTrue(result.getLocants().containsValue("1"));
        assertTrue(result.getLocants().containsValue("6"));
    }
}
