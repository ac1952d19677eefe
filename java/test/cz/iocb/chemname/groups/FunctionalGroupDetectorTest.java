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
package cz.iocb.chemname.groups;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.openscience.cdk.exception.CDKException;
import cz.iocb.chemname.analysis.AtomicAnalysis;
import cz.iocb.chemname.molecule.Molecule;
import cz.iocb.chemname.molecule.MoleculeCreator;



public class FunctionalGroupDetectorTest
{
    private final FunctionalGroupDetector detector = new FunctionalGroupDetector();


    private List<FunctionalGroup> detect(String smiles) throws CDKException
    {
        Molecule molecule = MoleculeCreator.getMoleculeFromSmiles(smiles);
        return detector.detect(molecule, AtomicAnalysis.analyze(molecule));
    }


    private List<FunctionalGroupType> types(String smiles) throws CDKException
    {
        List<FunctionalGroupType> types = new ArrayList<FunctionalGroupType>();

        for(FunctionalGroup group : detect(smiles))
            types.add(group.getType());

        return types;
    }


    @Test
    public void testCarbonylClasses() throws CDKException
    {
        assertEquals(Arrays.asList(FunctionalGroupType.CARBOXYLIC_ACID), types("CC(=O)O"));
        assertEquals(Arrays.asList(FunctionalGroupType.ESTER), types("CC(=O)OC"));
        assertEquals(Arrays.asList(FunctionalGroupType.ANHYDRIDE), types("CC(=O)OC(C)=O"));
        assertEquals(Arrays.asList(FunctionalGroupType.ALDEHYDE), types("CC=O"));
        assertEquals(Arrays.asList(FunctionalGroupType.KETONE), types("CC(C)=O"));
        assertEquals(Arrays.asList(FunctionalGroupType.AMIDE), types("CC(N)=O"));
        assertEquals(Arrays.asList(FunctionalGroupType.ACYL_HALIDE), types("CC(Cl)=O"));
    }


    @Test
    public void testHeteroatomClasses() throws CDKException
    {
        assertEquals(Arrays.asList(FunctionalGroupType.ALCOHOL), types("CCO"));
        assertEquals(Arrays.asList(FunctionalGroupType.THIOL), types("CCS"));
        assertEquals(Arrays.asList(FunctionalGroupType.AMINE), types("CCN"));
        assertEquals(Arrays.asList(FunctionalGroupType.NITRILE), types("CC#N"));
        assertEquals(Arrays.asList(FunctionalGroupType.ETHER), types("COC"));
        assertEquals(Arrays.asList(FunctionalGroupType.HALIDE), types("CCBr"));
    }


    @Test
    public void testSulfurOxides() throws CDKException
    {
        List<FunctionalGroup> sulfoxide = detect("CS(=O)C");

        assertEquals(1, sulfoxide.size());
        assertEquals(FunctionalGroupType.SULFINYL, sulfoxide.get(0).getType());
        assertEquals(1, sulfoxide.get(0).getKeyAtom());
        assertTrue(!sulfoxide.get(0).getType().isPrincipalCapable());

        List<FunctionalGroup> sulfone = detect("CCS(=O)(=O)C");

        assertEquals(1, sulfone.size());
        assertEquals(FunctionalGroupType.SULFONYL, sulfone.get(0).getType());
        assertEquals(3, sulfone.get(0).getAtoms().length);

        /* a sulfonic acid is not a sulfone */
        assertTrue(!types("CS(=O)(=O)O").contains(FunctionalGroupType.SULFONYL));
        assertEquals(Arrays.asList(FunctionalGroupType.THIOETHER), types("CSC"));
    }


    @Test
    public void testSeniorityOrder() throws CDKException
    {
        List<FunctionalGroup> groups = detect("OCCC(=O)O");

        assertEquals(2, groups.size());
        assertEquals(FunctionalGroupType.CARBOXYLIC_ACID, groups.get(0).getType());
        assertEquals(FunctionalGroupType.ALCOHOL, groups.get(1).getType());
        assertTrue(groups.get(0).getPriority() > groups.get(1).getPriority());
    }


    @Test
    public void testAtomsAreClaimedOnce() throws CDKException
    {
        List<FunctionalGroup> groups = detect("OC(=O)CC(=O)OCC(O)CN");
        boolean[] seen = new boolean[32];

        for(FunctionalGroup group : groups)
        {
            for(int atom : group.getAtoms())
            {
                assertTrue("atom " + atom + " claimed twice", !seen[atom]);
                seen[atom] = true;
            }
        }
    }


    @Test
    public void testPriorityScale()
    {
        assertEquals(100, FunctionalGroupType.CARBOXYLIC_ACID.getPriority());
        assertTrue(FunctionalGroupType.ESTER.getPriority() > FunctionalGroupType.ALCOHOL.getPriority());
        assertTrue(FunctionalGroupType.ALCOHOL.getPriority() > FunctionalGroupType.AMINE.getPriority());
        assertTrue(FunctionalGroupType.ANHYDRIDE.isFunctionalClassTrigger());
        assertTrue(!FunctionalGroupType.HALIDE.isPrincipalCapable());
    }
}
