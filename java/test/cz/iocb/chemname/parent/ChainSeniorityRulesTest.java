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
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.Before;
import org.junit.Test;
import org.openscience.cdk.exception.CDKException;
import cz.iocb.chemname.engine.ExecutionPhase;
import cz.iocb.chemname.engine.NamingConfiguration;
import cz.iocb.chemname.engine.NamingContext;
import cz.iocb.chemname.engine.NamingServices;
import cz.iocb.chemname.engine.PhaseContract;
import cz.iocb.chemname.engine.PhaseController;
import cz.iocb.chemname.engine.RuleConflict;
import cz.iocb.chemname.engine.RuleConflict.ConflictType;
import cz.iocb.chemname.engine.TraceEntry;
import cz.iocb.chemname.molecule.MoleculeCreator;



public class ChainSeniorityRulesTest
{
    private static final int[] NONE = new int[0];

    private NamingContext context;
    private PhaseController controller;


    @Before
    public void setUp() throws CDKException
    {
        context = NamingContext.create(MoleculeCreator.getMoleculeFromSmiles("CCCCCCCC"),
                NamingServices.createDefault(), NamingConfiguration.defaults());
        controller = new PhaseController(ExecutionPhase.PARENT_SELECTION, ChainSeniorityRules.rules(),
                PhaseContract.NONE);
    }


    private NamingContext withCandidates(Chain... chains)
    {
        return context.withUpdatedCandidates(Arrays.asList(chains), "test", "Test candidates", "P-0",
                ExecutionPhase.PARENT_SELECTION, chains.length + " candidates");
    }


    private static List<String> firedRules(NamingContext context)
    {
        return context.getState().getTrace().stream().filter(e -> e.ruleId.startsWith("chain-"))
                .map(e -> e.ruleId).collect(Collectors.toList());
    }


    @Test
    public void testLengthDecides()
    {
        Chain longest = new Chain(new int[] { 0, 1, 2, 3, 4 }, 0, NONE, NONE, Collections.emptyList());
        Chain shorter = new Chain(new int[] { 0, 1, 2, 3 }, 0, new int[] { 1 }, NONE, Collections.emptyList());

        NamingContext result = controller.execute(withCandidates(shorter, longest));

        assertEquals(Arrays.asList(longest), result.getState().getCandidateChains());
        assertEquals(Arrays.asList("chain-length"), firedRules(result));
        assertTrue(result.getState().getCascade().isApplied(1));
        assertFalse(result.getState().getCascade().isApplied(2));
    }


    @Test
    public void testMultipleBondsFollowLength()
    {
        Chain saturated = new Chain(new int[] { 0, 1, 2, 3 }, 0, NONE, NONE, Collections.emptyList());
        Chain unsaturated = new Chain(new int[] { 4, 5, 6, 7 }, 0, NONE, new int[] { 2 }, Collections.emptyList());

        NamingContext result = controller.execute(withCandidates(saturated, unsaturated));

        assertEquals(Arrays.asList(unsaturated), result.getState().getCandidateChains());
        assertEquals(Arrays.asList("chain-length", "chain-multiple-bonds"), firedRules(result));
        assertEquals(4, result.getState().getCascade().getLength());
        assertEquals(1, result.getState().getCascade().getMultipleBonds());
    }


    @Test
    public void testSubstituentLocantsDecide()
    {
        Chain high = new Chain(new int[] { 0, 1, 2, 3 }, 0, NONE, NONE,
                Arrays.asList(new Substituent(2, 6, "methyl", false)));
        Chain low = new Chain(new int[] { 4, 5, 6, 7 }, 0, NONE, NONE,
                Arrays.asList(new Substituent(5, 1, "methyl", false)));

        NamingContext result = controller.execute(withCandidates(high, low));

        assertEquals(Arrays.asList(low), result.getState().getCandidateChains());
        assertEquals(7, firedRules(result).size());
        assertTrue(Arrays.equals(new int[] { 2 }, result.getState().getCascade().getSubstituentLocants()));
    }


    @Test
    public void testCascadeAlwaysEndsWithOneCandidate()
    {
        Chain first = new Chain(new int[] { 0, 1, 2, 3 }, 0, NONE, NONE, Collections.emptyList());
        Chain second = new Chain(new int[] { 4, 5, 6, 7 }, 0, NONE, NONE, Collections.emptyList());

        NamingContext result = controller.execute(withCandidates(first, second));

        assertEquals(1, result.getState().getCandidateChains().size());
        assertSame(first, result.getState().getCandidateChains().get(0));
        assertEquals(ChainSeniorityRules.rules().size(), firedRules(result).size());

        for(int step = 1; step <= CascadeState.STEPS; step++)
            assertTrue(result.getState().getCascade().isApplied(step));

        for(TraceEntry entry : result.getState().getTrace())
            assertEquals(ExecutionPhase.PARENT_SELECTION, entry.phase);
    }


    @Test
    public void testStepsRequireTheirPredecessor()
    {
        Chain first = new Chain(new int[] { 0, 1, 2 }, 0, NONE, NONE, Collections.emptyList());
        Chain second = new Chain(new int[] { 4, 5, 6 }, 0, NONE, NONE, Collections.emptyList());
        NamingContext candidates = withCandidates(first, second);

        assertTrue(ChainSeniorityRules.isApplicable(candidates.getState(), 1));

        for(int step = 2; step <= CascadeState.STEPS; step++)
            assertFalse(ChainSeniorityRules.isApplicable(candidates.getState(), step));

        NamingContext single = context.withUpdatedCandidates(Arrays.asList(first), "test", "Test candidates", "P-0",
                ExecutionPhase.PARENT_SELECTION, "one candidate");

        assertFalse(ChainSeniorityRules.isApplicable(single.getState(), 1));
    }


    @Test
    public void testThresholdMismatchIsReported()
    {
        Chain first = new Chain(new int[] { 0, 1, 2 }, 0, NONE, NONE, Collections.emptyList());
        Chain second = new Chain(new int[] { 4, 5, 6 }, 0, NONE, NONE, Collections.emptyList());

        NamingContext inconsistent = withCandidates(first, second).withStateUpdate(
                builder -> builder.setCascade(CascadeState.INITIAL.withLength(5)), "test", "Test cascade", "P-0",
                ExecutionPhase.PARENT_SELECTION, "length 5");

        NamingContext result = controller.execute(inconsistent);
        List<RuleConflict> conflicts = result.getState().getConflicts();

        assertEquals(1, conflicts.size());
        assertEquals("chain-multiple-bonds", conflicts.get(0).ruleId);
        assertEquals(ConflictType.STATE_INCONSISTENCY, conflicts.get(0).type);
        assertEquals(2, result.getState().getCandidateChains().size());
    }


    @Test(expected = IllegalStateException.class)
    public void testCascadeStateRejectsSkippedStep()
    {
        CascadeState.INITIAL.withDoubleBonds(1);
    }
}
