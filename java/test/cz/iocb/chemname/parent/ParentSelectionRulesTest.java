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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import org.junit.BeforeClass;
import org.junit.Test;
import org.openscience.cdk.exception.CDKException;
import cz.iocb.chemname.engine.NamingConfiguration;
import cz.iocb.chemname.engine.NamingEngine;
import cz.iocb.chemname.engine.NamingServices;
import cz.iocb.chemname.groups.FunctionalGroup;
import cz.iocb.chemname.groups.FunctionalGroupType;
import cz.iocb.chemname.molecule.Molecule;
import cz.iocb.chemname.molecule.MoleculeCreator;
import cz.iocb.chemname.parent.ParentStructure.ParentType;



public class ParentSelectionRulesTest
{
    private static NamingEngine engine;


    @BeforeClass
    public static void setUp()
    {
        engine = new NamingEngine(NamingServices.createDefault(), NamingConfiguration.defaults());
    }


    private static ParentStructure parent(String smiles) throws CDKException
    {
        ParentStructure parent = engine.run(MoleculeCreator.getMoleculeFromSmiles(smiles)).getState()
                .getParentStructure();

        assertNotNull(smiles, parent);
        return parent;
    }


    @Test
    public void testRingVersusChain() throws CDKException
    {
        assertEquals(ParentType.RING, parent("Cc1ccccc1").getType());
        assertEquals(ParentType.CHAIN, parent("CCCCCCCCc1ccccc1").getType());
        assertEquals(ParentType.RING, parent("OC(=O)c1ccccc1").getType());
    }


    @Test
    public void testPrincipalGroupsDecideBeforeSize() throws CDKException
    {
        /* the hydroxy groups make the chain senior to the larger ring */
        ParentStructure parent = parent("OCC(O)CC1CCCCCCCC1");

        assertEquals(ParentType.CHAIN, parent.getType());
        assertEquals(3, parent.getAtoms().length);
    }


    @Test
    public void testLongestChain() throws CDKException
    {
        ParentStructure parent = parent("CCC(CC)CCCC");

        assertEquals(ParentType.CHAIN, parent.getType());
        assertEquals(7, parent.getAtoms().length);
        assertEquals(1, parent.getSubstituents().size());
        assertEquals("ethyl", parent.getSubstituents().get(0).getName());
    }


    @Test
    public void testMononuclearHydride() throws CDKException
    {
        ParentStructure parent = parent("[SiH4]");

        assertEquals(ParentType.HETEROATOM, parent.getType());
        assertEquals("silane", parent.getName());
        assertTrue(parent.getSubstituents().isEmpty());
    }


    @Test
    public void testRingNames() throws CDKException
    {
        assertEquals("cyclohexane", parent("C1CCCCC1").getName());
        assertEquals("oxolane", parent("C1CCOC1").getName());
        assertEquals("benzene", parent("Clc1ccccc1").getName());
    }


    @Test
    public void testRingSizeAgainstChainLength() throws CDKException
    {
        /* an equally long chain does not outrank the ring */
        assertEquals(ParentType.RING, parent("CCCCCCc1ccccc1").getType());
        assertEquals(ParentType.CHAIN, parent("CCCCCCCc1ccccc1").getType());
    }


    @Test
    public void testChainWithMorePrincipalGroupsWins() throws CDKException
    {
        ParentStructure parent = parent("CCCCCCNc1ccccc1");

        assertEquals(ParentType.CHAIN, parent.getType());
        assertEquals(6, parent.getAtoms().length);
    }


    @Test
    public void testArylAmineKeepsRingAtEqualCounts() throws CDKException
    {
        /* the octyl chain is longer, but the anilino nitrogen keeps the pyridine */
        ParentStructure parent = parent("CCCCCCCCc1ccnc(Nc2ccccc2)c1");

        assertEquals(ParentType.RING, parent.getType());
        assertEquals("pyridine", parent.getName());
    }


    @Test
    public void testRingHeteroatomSeniority() throws CDKException
    {
        assertEquals("pyridine", parent("c1ccccc1Cc1ccncc1").getName());
        assertEquals("furan", parent("c1ccoc1Cc1ccncc1").getName());
    }


    @Test
    public void testFusedRingParent() throws CDKException
    {
        ParentStructure parent = parent("Cc1ccc2ncccc2c1");

        assertEquals(ParentType.RING, parent.getType());
        assertEquals("quinoline", parent.getName());
        assertEquals(10, parent.getAtoms().length);
    }


    @Test
    public void testHydrideExclusions() throws CDKException
    {
        assertEquals(ParentType.HETEROATOM, parent("CP").getType());
        assertEquals(ParentType.HETEROATOM, parent("CCCC[SiH3]").getType());
        assertEquals(ParentType.HETEROATOM, parent("C[Si](C)(CC)CCC").getType());

        /* a pnictogen is not a parent hydride in a molecule containing nitrogen */
        assertEquals(ParentType.CHAIN, parent("NCCP").getType());

        /* a carbon branch of five atoms */
        assertEquals(ParentType.CHAIN, parent("CCCCC[SiH3]").getType());

        /* more heavy atoms than allowed for a mononuclear parent */
        assertEquals(ParentType.CHAIN, parent("C[Si](CCC)(CCC)CCCC").getType());
    }


    @Test
    public void testLactamDetection() throws CDKException
    {
        Molecule molecule = MoleculeCreator.getMoleculeFromSmiles("O=C1CCCN1");
        boolean[] ring = new boolean[molecule.getAtomCount()];

        for(int i = 1; i < molecule.getAtomCount(); i++)
            ring[i] = true;

        FunctionalGroup amide = new FunctionalGroup(FunctionalGroupType.AMIDE, 1, 0, 5);

        assertTrue(RingGroupFilter.isLactam(amide, ring));
        assertFalse(RingGroupFilter.isLactam(new FunctionalGroup(FunctionalGroupType.KETONE, 1, 0), ring));

        /* nitrogen outside the ring system */
        ring[5] = false;
        assertFalse(RingGroupFilter.isLactam(amide, ring));
    }
}
