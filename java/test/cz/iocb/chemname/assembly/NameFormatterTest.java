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
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import org.junit.BeforeClass;
import org.junit.Test;
import org.openscience.cdk.exception.CDKException;
import cz.iocb.chemname.engine.ContextState;
import cz.iocb.chemname.engine.NamingConfiguration;
import cz.iocb.chemname.engine.NamingEngine;
import cz.iocb.chemname.engine.NamingServices;
import cz.iocb.chemname.molecule.MoleculeCreator;



public class NameFormatterTest
{
    private static NamingEngine engine;


    @BeforeClass
    public static void setUp()
    {
        engine = new NamingEngine(NamingServices.createDefault(), NamingConfiguration.defaults());
    }


    @Test
    public void testHyphenation()
    {
        assertEquals("2-methylpropane", NameFormatter.format("2methylpropane"));
        assertEquals("2-methylpropane", NameFormatter.format("2--methylpropane"));
        assertEquals("2-methylpropane", NameFormatter.format("-2-methylpropane"));
        assertEquals("1,2-dichloroethane", NameFormatter.format("1-,2-dichloroethane"));
        assertEquals("ethanol", NameFormatter.format("  Ethanol "));
    }


    @Test
    public void testLetterLocantsAndIndicatedHydrogen()
    {
        assertEquals("N,N-dimethylacetamide", NameFormatter.format("N,N-dimethylacetamide"));
        assertEquals("N-methylethanamine", NameFormatter.format("N-methylethanamine"));
        assertEquals("2H-pyran", NameFormatter.format("2H-pyran"));
    }


    @Test
    public void testRedundantHydroxy()
    {
        assertEquals("propan-2-ol", NameFormatter.format("2-hydroxypropan-2-ol"));
        assertEquals("1-hydroxypropan-2-one", NameFormatter.format("1-hydroxypropan-2-one"));
    }


    @Test
    public void testIdempotence()
    {
        String[] names = { "2methylpropane", "1-,2-dichloroethane", "N,N-dimethylacetamide", "2-hydroxypropan-2-ol",
                "dimethyl butanedioate", "1,1-bis(2-chloroethyl)cyclohexane" };

        for(String name : names)
        {
            String once = NameFormatter.format(name);
            assertEquals(once, NameFormatter.format(once));
        }
    }


    @Test
    public void testValidation()
    {
        assertNull(NameFormatter.validate("ethanol", 200));
        assertNull(NameFormatter.validate("1,1-bis(2-chloroethyl)cyclohexane", 200));
        assertNotNull(NameFormatter.validate("", 200));
        assertNotNull(NameFormatter.validate(null, 200));
        assertNotNull(NameFormatter.validate("2,3", 200));
        assertNotNull(NameFormatter.validate("bis(2-chloroethyl", 200));
        assertNotNull(NameFormatter.validate("ethyl)(", 200));
        assertNotNull(NameFormatter.validate("ethanol", 5));
    }


    @Test
    public void testConfidence() throws CDKException
    {
        ContextState ethanol = engine.run(MoleculeCreator.getMoleculeFromSmiles("CCO")).getState();
        ContextState methane = engine.run(MoleculeCreator.getMoleculeFromSmiles("C")).getState();

        assertEquals(1.0, NameFormatter.confidence(ethanol, 200), 1e-9);
        assertEquals(0.8, NameFormatter.confidence(ethanol, 3), 1e-9);
        assertEquals(0.9, NameFormatter.confidence(methane, 200), 1e-9);

        double confidence = NameFormatter.confidence(methane, 1);
        assertTrue(confidence >= 0.1 && confidence <= 1.0);
    }


    @Test
    public void testConfidenceHasOneDecimal() throws CDKException
    {
        ContextState methane = engine.run(MoleculeCreator.getMoleculeFromSmiles("C")).getState();

        /* no groups and an invalid name: 1.0 - 0.1 - 0.2 */
        double confidence = NameFormatter.confidence(methane, 1);

        assertEquals(0.7, confidence, 0.0);
        assertEquals("0.7", Double.toString(confidence));
    }
}
