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
package cz.iocb.chemname.engine;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import org.junit.BeforeClass;
import org.junit.Test;
import org.openscience.cdk.exception.CDKException;
import cz.iocb.chemname.groups.FunctionalGroup;
import cz.iocb.chemname.groups.FunctionalGroupType;
import cz.iocb.chemname.molecule.MoleculeCreator;
import cz.iocb.chemname.parent.ParentStructure.ParentType;



public class NamingEngineTest
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
    public void testEsterScenario() throws CDKException
    {
        NamingResult result = engine.nameSmiles("CC(=O)OC");

        assertEquals("methyl acetate", result.getName());
        assertEquals(NomenclatureMethod.FUNCTIONAL_CLASS, result.getMethod());
        assertEquals(ParentType.CHAIN, result.getParentStructure().getType());
    }


    @Test
    public void testAmideScenario() throws CDKException
    {
        assertEquals("N,N-dimethylacetamide", name("CC(=O)N(C)C"));
    }


    @Test
    public void testLactoneScenario() throws CDKException
    {
        NamingResult result = engine.nameSmiles("O=C1CCCO1");

        assertEquals("oxolan-2-one", result.getName());
        assertEquals(ParentType.RING, result.getParentStructure().getType());
        assertFalse(result.getMethod() == NomenclatureMethod.FUNCTIONAL_CLASS);
    }


    @Test
    public void testDiesterScenario() throws CDKException
    {
        NamingResult result = engine.nameSmiles("COC(=O)CCC(=O)OC");

        assertEquals("dimethyl butanedioate", result.getName());
        assertEquals(NomenclatureMethod.FUNCTIONAL_CLASS, result.getMethod());
    }


    @Test
    public void testHierarchicalEsters() throws CDKException
    {
        NamingResult result = engine.nameSmiles("CC(=O)OCCOC(=O)C");

        /* only the outer ester is principal, the nested one becomes a prefix of its alkyl group */
        assertEquals("2-(acetyloxy)ethyl acetate", result.getName());
        assertEquals(NomenclatureMethod.SUBSTITUTIVE, result.getMethod());
        assertEquals(ParentType.CHAIN, result.getParentStructure().getType());

        assertEquals("2-(ethoxycarbonyl)ethyl acetate", name("CCOC(=O)CCOC(=O)C"));
    }


    @Test
    public void testArylAmineOnChain() throws CDKException
    {
        NamingResult result = engine.nameSmiles("CCCCCCNc1ccccc1");

        assertEquals("N-phenylhexan-1-amine", result.getName());
        assertEquals(ParentType.CHAIN, result.getParentStructure().getType());
    }


    @Test
    public void testAcylBenzene() throws CDKException
    {
        assertEquals("1-phenylethan-1-one", name("CC(=O)c1ccccc1"));
        assertEquals("benzaldehyde", name("O=Cc1ccccc1"));
    }


    @Test
    public void testCycloalkylSubstituents() throws CDKException
    {
        assertEquals("cyclohexyl acetate", name("CC(=O)OC1CCCCC1"));
        assertEquals("1-cyclopropylheptane", name("CCCCCCCC1CC1"));
        assertEquals("cyclohexylmethanol", name("OCC1CCCCC1"));
    }


    @Test
    public void testFusedRingNames() throws CDKException
    {
        assertEquals("quinoline", name("c1ccc2ncccc2c1"));
        assertEquals("isoquinoline", name("c1ccc2cnccc2c1"));
        assertEquals("indole", name("c1ccc2[nH]ccc2c1"));
        assertEquals("benzofuran", name("c1ccc2occc2c1"));
        assertEquals("anthracene", name("c1ccc2cc3ccccc3cc2c1"));
        assertEquals("phenanthrene", name("c1ccc2c(c1)ccc1ccccc12"));
        assertEquals("carbazole", name("c1ccc2c(c1)[nH]c1ccccc12"));
    }


    @Test
    public void testFusedRingLocants() throws CDKException
    {
        assertEquals("6-methylquinoline", name("Cc1ccc2ncccc2c1"));
        assertEquals("quinolin-8-ol", name("Oc1cccc2cccnc12"));

        /* no retained name, the heteroatoms are cited as replacement prefixes */
        assertEquals("1,5-diazanaphthalene", name("c1cnc2cccnc2c1"));
    }


    @Test
    public void testLactamScenario() throws CDKException
    {
        NamingContext context = engine.run(MoleculeCreator.getMoleculeFromSmiles("O=C1CCCN1"));
        boolean ketone = false;

        for(FunctionalGroup group : context.getState().getFunctionalGroups())
        {
            assertFalse(group.isPrincipal() && group.getType() == FunctionalGroupType.AMIDE);
            ketone |= group.isPrincipal() && group.getType() == FunctionalGroupType.KETONE;
        }

        assertTrue(ketone);
        assertEquals("pyrrolidin-2-one", context.getState().getFinalName());
    }


    @Test
    public void testSulfoxideIsCountedAsGroup() throws CDKException
    {
        NamingResult result = engine.nameSmiles("CS(=O)C");

        assertTrue(result.getName(), result.getName().contains("sulfinyl"));
        assertEquals(1.0, result.getConfidence(), 0.0);
    }


    @Test
    public void testChains() throws CDKException
    {
        assertEquals("ethanol", name("CCO"));
        assertEquals("propan-2-ol", name("CC(C)O"));
        assertEquals("2-methylpropane", name("CC(C)C"));
        assertEquals("but-1-ene", name("C=CCC"));
        assertEquals("ethane-1,2-diol", name("OCCO"));
        assertEquals("acetic acid", name("CC(=O)O"));
    }


    @Test
    public void testRings() throws CDKException
    {
        assertEquals("benzoic acid", name("OC(=O)c1ccccc1"));
        assertEquals("phenol", name("Oc1ccccc1"));
        assertEquals("cyclohexanol", name("OC1CCCCC1"));
        assertEquals("chlorobenzene", name("Clc1ccccc1"));
    }


    @Test
    public void testDeterminism() throws CDKException
    {
        String[] inputs = { "CC(=O)OC", "CCC(C)CC(C)C", "OC(=O)c1ccc(Cl)cc1", "CC(C)(C)O" };

        for(String smiles : inputs)
        {
            NamingResult first = engine.nameSmiles(smiles);
            NamingResult second = engine.nameSmiles(smiles);

            assertEquals(first.getName(), second.getName());
            assertEquals(first.getFiredRules(), second.getFiredRules());
            assertEquals(first.getLocants(), second.getLocants());
        }
    }


    @Test
    public void testResultContents() throws CDKException
    {
        NamingResult result = engine.nameSmiles("CCO");

        assertTrue(result.getConfidence() > 0.5 && result.getConfidence() <= 1.0);
        assertTrue(result.getConflicts().isEmpty());
        assertTrue(result.getFiredRules().contains("chain-parent"));
        assertTrue(result.getFiredRules().contains("final-name"));
        assertEquals(2, result.getLocants().size());
        assertFalse(result.getTrace().isEmpty());

        for(int i = 0; i < result.getTrace().size(); i++)
            assertEquals(i, result.getTrace().get(i).sequence);
    }


    @Test
    public void testPhasesCompleted() throws CDKException
    {
        NamingContext context = engine.run(MoleculeCreator.getMoleculeFromSmiles("CCCC"));

        for(ExecutionPhase phase : ExecutionPhase.values())
            assertTrue(phase.getLabel(), context.getState().isPhaseCompleted(phase));

        assertNotNull(context.getState().getFinalName());
        assertEquals("butane", context.getState().getFinalName());
    }


    @Test
    public void testEveryRequestIsIndependent() throws CDKException
    {
        NamingResult first = engine.nameSmiles("CCCl");
        engine.nameSmiles("CC(=O)N(C)C");
        NamingResult second = engine.nameSmiles("CCCl");

        assertEquals(first.getName(), second.getName());
        assertEquals(first.getTrace().size(), second.getTrace().size());
    }


    @Test(expected = CDKException.class)
    public void testInvalidSmiles() throws CDKException
    {
        engine.nameSmiles("C1CC(");
    }
}
