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
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import java.util.Arrays;
import java.util.Collections;
import org.junit.Before;
import org.junit.Test;
import org.openscience.cdk.exception.CDKException;
import cz.iocb.chemname.engine.RuleConflict.ConflictType;
import cz.iocb.chemname.molecule.MoleculeCreator;
import cz.iocb.chemname.parent.Chain;
import cz.iocb.chemname.parent.HeteroatomParent;
import cz.iocb.chemname.parent.ParentStructure;



public class NamingContextTest
{
    private NamingContext context;


    @Before
    public void setUp() throws CDKException
    {
        context = NamingContext.create(MoleculeCreator.getMoleculeFromSmiles("CCCC"), NamingServices.createDefault(),
                NamingConfiguration.defaults());
    }


    private static Chain chain(int... atoms)
    {
        return new Chain(atoms, 0, new int[0], new int[0], Collections.emptyList());
    }


    @Test
    public void testInitialState()
    {
        ContextState state = context.getState();

        assertNull(state.getParentStructure());
        assertNull(state.getFinalName());
        assertTrue(state.getFunctionalGroups().isEmpty());
        assertTrue(state.getConflicts().isEmpty());
        assertTrue(state.getTrace().isEmpty());
        assertTrue(state.getCompletedPhases().isEmpty());
        assertEquals(4, context.getMolecule().getAtomCount());
    }


    @Test
    public void testTransitionsDoNotModifyPreviousContext()
    {
        NamingContext next = context.withStateUpdate(builder -> builder.setFinalName("butane"), "test", "Test rule",
                "P-0", ExecutionPhase.ASSEMBLY, "set name");

        assertNull(context.getState().getFinalName());
        assertTrue(context.getState().getTrace().isEmpty());
        assertEquals("butane", next.getState().getFinalName());
        assertSame(context.getServices(), next.getServices());
        assertSame(context.getConfiguration(), next.getConfiguration());
    }


    @Test
    public void testEveryTransitionAppendsOneTraceEntry()
    {
        NamingContext first = context.withNomenclatureMethod(NomenclatureMethod.SUBSTITUTIVE, "method", "Method",
                "P-51", ExecutionPhase.NOMENCLATURE_METHOD, "substitutive");
        NamingContext second = first.withPhaseCompletion(ExecutionPhase.NOMENCLATURE_METHOD, "nomenclature-method",
                "phase completion", "-", "done");

        assertEquals(1, first.getState().getTrace().size());
        assertEquals(2, second.getState().getTrace().size());

        TraceEntry entry = second.getState().getTrace().get(1);

        assertEquals(1, entry.sequence);
        assertEquals("nomenclature-method", entry.ruleId);
        assertEquals("-", entry.blueBookReference);
        assertEquals(ExecutionPhase.NOMENCLATURE_METHOD, entry.phase);
        assertNotNull(entry.before);
        assertNotNull(entry.after);
        assertTrue(second.getState().isPhaseCompleted(ExecutionPhase.NOMENCLATURE_METHOD));
    }


    @Test
    public void testTraceSummariesCanBeDisabled() throws CDKException
    {
        NamingContext quiet = NamingContext.create(MoleculeCreator.getMoleculeFromSmiles("C"),
                NamingServices.createDefault(), new NamingConfiguration(200, 100, 10, false));
        NamingContext next = quiet.withStateUpdate(builder -> builder.setFinalName("methane"), "test", "Test rule",
                "P-0", ExecutionPhase.ASSEMBLY, "set name");

        assertNull(next.getState().getTrace().get(0).before);
        assertNull(next.getState().getTrace().get(0).after);
    }


    @Test
    public void testConflictsAccumulate()
    {
        RuleConflict conflict = new RuleConflict("test", ConflictType.MUTUAL_EXCLUSION,
                ExecutionPhase.PARENT_SELECTION, "two equal chains");

        NamingContext next = context.withConflict(conflict, "test", "Test rule", "P-0",
                ExecutionPhase.PARENT_SELECTION, "conflict");

        assertTrue(context.getState().getConflicts().isEmpty());
        assertEquals(Arrays.asList(conflict), next.getState().getConflicts());
    }


    @Test
    public void testParentStructureIsSetOnce()
    {
        ParentStructure parent = new HeteroatomParent(0, "C", "methane", Collections.emptyList());
        NamingContext next = context.withParentStructure(parent, "test", "Test rule", "P-0",
                ExecutionPhase.PARENT_SELECTION, "parent");

        assertSame(parent, next.getState().getParentStructure());

        try
        {
            next.withParentStructure(parent, "test", "Test rule", "P-0", ExecutionPhase.PARENT_SELECTION, "again");
            throw new AssertionError("second parent structure accepted");
        }
        catch(IllegalStateException e)
        {
            assertEquals(1, next.getState().getTrace().size());
        }
    }


    @Test(expected = IllegalArgumentException.class)
    public void testNullParentStructure()
    {
        context.withParentStructure(null, "test", "Test rule", "P-0", ExecutionPhase.PARENT_SELECTION, "parent");
    }


    @Test
    public void testCandidatesMayOnlyShrink()
    {
        Chain longest = chain(0, 1, 2, 3);
        Chain shorter = chain(0, 1, 2);

        NamingContext enumerated = context.withUpdatedCandidates(Arrays.asList(longest, shorter), "test", "Test rule",
                "P-0", ExecutionPhase.PARENT_SELECTION, "enumerated");
        NamingContext filtered = enumerated.withUpdatedCandidates(Arrays.asList(longest), "test", "Test rule", "P-0",
                ExecutionPhase.PARENT_SELECTION, "filtered");

        assertEquals(2, enumerated.getState().getCandidateChains().size());
        assertEquals(Arrays.asList(longest), filtered.getState().getCandidateChains());
    }


    @Test(expected = IllegalStateException.class)
    public void testCandidatesCannotGrow()
    {
        NamingContext enumerated = context.withUpdatedCandidates(Arrays.asList(chain(0, 1, 2, 3)), "test",
                "Test rule", "P-0", ExecutionPhase.PARENT_SELECTION, "enumerated");

        enumerated.withUpdatedCandidates(Arrays.asList(chain(1, 2, 3)), "test", "Test rule", "P-0",
                ExecutionPhase.PARENT_SELECTION, "grown");
    }
}
