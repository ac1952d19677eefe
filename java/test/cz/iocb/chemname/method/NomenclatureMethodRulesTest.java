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
package cz.iocb.chemname.method;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import java.util.ArrayList;
import java.util.List;
import org.junit.BeforeClass;
import org.junit.Test;
import org.openscience.cdk.exception.CDKException;
import cz.iocb.chemname.engine.ContextState;
import cz.iocb.chemname.engine.NamingConfiguration;
import cz.iocb.chemname.engine.NamingEngine;
import cz.iocb.chemname.engine.NamingServices;
import cz.iocb.chemname.engine.NomenclatureMethod;
import cz.iocb.chemname.groups.FunctionalGroup;
import cz.iocb.chemname.groups.FunctionalGroupType;
import cz.iocb.chemname.molecule.Molecule;
import cz.iocb.chemname.molecule.MoleculeCreator;



public class NomenclatureMethodRulesTest
{
    private static NamingEngine engine;


    @BeforeClass
    public static void setUp()
    {
        engine = new NamingEngine(NamingServices.createDefault(), NamingConfiguration.defaults());
    }


    private static ContextState run(String smiles) throws CDKException
    {
        return engine.run(MoleculeCreator.getMoleculeFromSmiles(smiles)).getState();
    }


    private static NomenclatureMethod method(String smiles) throws CDKException
    {
        return run(smiles).getNomenclatureMethod();
    }


    private static List<FunctionalGroup> esters(ContextState state)
    {
        List<FunctionalGroup> esters = new ArrayList<FunctionalGroup>();

        for(FunctionalGroup group : state.getFunctionalGroups())
            if(group.getType() == FunctionalGroupType.ESTER)
                esters.add(group);

        return esters;
    }


    @Test
    public void testEsterMethods() throws CDKException
    {
        assertEquals(NomenclatureMethod.FUNCTIONAL_CLASS, method("CC(=O)OC"));
        assertEquals(NomenclatureMethod.FUNCTIONAL_CLASS, method("COC(=O)CCC(=O)OC"));
        assertEquals(NomenclatureMethod.SUBSTITUTIVE, method("CC(=O)OCCOC(=O)C"));

        /* lactone */
        assertEquals(NomenclatureMethod.SUBSTITUTIVE, method("O=C1CCCO1"));

        /* the acid outranks the ester */
        assertEquals(NomenclatureMethod.SUBSTITUTIVE, method("OC(=O)CCC(=O)OC"));
    }


    @Test
    public void testHierarchicalEstersKeepOnePrincipal() throws CDKException
    {
        int principal = 0;

        for(FunctionalGroup group : run("CC(=O)OCCOC(=O)C").getFunctionalGroups())
            if(group.getType() == FunctionalGroupType.ESTER && group.isPrincipal())
                principal++;

        assertEquals(1, principal);
    }


    @Test
    public void testPrimaryEster() throws CDKException
    {
        ContextState state = run("CC(=O)OCCOC(=O)C");
        Molecule nested = state.getMolecule();
        List<FunctionalGroup> esters = esters(state);

        assertEquals(2, esters.size());
        assertTrue(EsterClassifier.isHierarchical(esters, nested));
        assertTrue(esters.contains(EsterClassifier.findPrimaryEster(esters, nested)));

        ContextState other = run("COC(=O)CCC(=O)OC");
        Molecule independent = other.getMolecule();
        List<FunctionalGroup> pair = esters(other);

        assertEquals(2, pair.size());
        assertFalse(EsterClassifier.isHierarchical(pair, independent));
        assertNull(EsterClassifier.findPrimaryEster(pair, independent));
    }


    @Test
    public void testFunctionalClassTriggers() throws CDKException
    {
        assertEquals(NomenclatureMethod.FUNCTIONAL_CLASS, method("CC(=O)Cl"));
        assertEquals(NomenclatureMethod.FUNCTIONAL_CLASS, method("CC#N"));
    }


    @Test
    public void testSkeletalReplacement() throws CDKException
    {
        /* two heteroatoms among seven atoms */
        assertEquals(NomenclatureMethod.SKELETAL_REPLACEMENT, method("OCO"));
    }


    @Test
    public void testMultiplicative() throws CDKException
    {
        assertEquals(NomenclatureMethod.MULTIPLICATIVE, method("OCCCO"));
    }


    @Test
    public void testConjunctive() throws CDKException
    {
        assertEquals(NomenclatureMethod.CONJUNCTIVE, method("c1ccc2ccccc2c1"));
    }


    @Test
    public void testSubstitutiveDefault() throws CDKException
    {
        assertEquals(NomenclatureMethod.SUBSTITUTIVE, method("CCO"));
        assertEquals(NomenclatureMethod.SUBSTITUTIVE, method("CCCC"));
    }
}
