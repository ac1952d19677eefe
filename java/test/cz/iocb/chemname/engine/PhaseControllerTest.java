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
import static org.junit.Assert.assertTrue;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.openscience.cdk.exception.CDKException;
import cz.iocb.chemname.engine.RuleConflict.ConflictType;
import cz.iocb.chemname.molecule.MoleculeCreator;



public class PhaseControllerTest
{
    private NamingContext context;
    private List<String> executed;


    @Before
    public void setUp() throws CDKException
    {
        context = NamingContext.create(MoleculeCreator.getMoleculeFromSmiles("CCO"), NamingServices.createDefault(),
                NamingConfiguration.defaults());
        executed = new ArrayList<String>();
    }


    private Rule recordingRule(String id, int priority)
    {
        return new Rule(id, id, "P-0", ExecutionPhase.ATOMIC_ANALYSIS, priority, c -> true, (c, rule) -> {
            executed.add(rule.getId());
            return c.withStateUpdate(builder -> {}, rule, "executed");
        });
    }


    @Test
    public void testRulesRunInDescendingPriority()
    {
        PhaseController controller = new PhaseController(ExecutionPhase.ATOMIC_ANALYSIS,
                Arrays.asList(recordingRule("low", RulePriority.TEN), recordingRule("high", RulePriority.HUNDRED),
                        recordingRule("first-mid", RulePriority.FIFTY),
                        recordingRule("second-mid", RulePriority.FIFTY)));

        NamingContext result = controller.execute(context);

        assertEquals(Arrays.asList("high", "first-mid", "second-mid", "low"), executed);
        assertTrue(result.getState().isPhaseCompleted(ExecutionPhase.ATOMIC_ANALYSIS));

        /* four rules and the phase completion */
        assertEquals(5, result.getState().getTrace().size());
    }


    @Test
    public void testInapplicableRuleIsSkipped()
    {
        Rule never = new Rule("never", "never", "P-0", ExecutionPhase.ATOMIC_ANALYSIS, RulePriority.HUNDRED,
                c -> false, (c, rule) -> {
                    executed.add(rule.getId());
                    return c;
                });

        PhaseController controller = new PhaseController(ExecutionPhase.ATOMIC_ANALYSIS,
                Arrays.asList(never, recordingRule("always", RulePriority.TEN)));

        controller.execute(context);

        assertEquals(Arrays.asList("always"), executed);
    }


    @Test
    public void testConditionSeesEarlierUpdates()
    {
        Rule setter = new Rule("setter", "setter", "P-0", ExecutionPhase.ATOMIC_ANALYSIS, RulePriority.HUNDRED,
                c -> true, (c, rule) -> c.withStateUpdate(builder -> builder.setFinalName("ethanol"), rule, "set"));

        Rule reader = new Rule("reader", "reader", "P-0", ExecutionPhase.ATOMIC_ANALYSIS, RulePriority.TEN,
                c -> "ethanol".equals(c.getState().getFinalName()), (c, rule) -> {
                    executed.add(rule.getId());
                    return c;
                });

        new PhaseController(ExecutionPhase.ATOMIC_ANALYSIS, Arrays.asList(reader, setter)).execute(context);

        assertEquals(Arrays.asList("reader"), executed);
    }


    @Test
    public void testFailingRuleBecomesConflict()
    {
        Rule failing = new Rule("failing", "failing", "P-0", ExecutionPhase.ATOMIC_ANALYSIS, RulePriority.HUNDRED,
                c -> true, (c, rule) -> {
                    throw new IllegalStateException("broken invariant");
                });

        PhaseController controller = new PhaseController(ExecutionPhase.ATOMIC_ANALYSIS,
                Arrays.asList(failing, recordingRule("next", RulePriority.TEN)));

        NamingContext result = controller.execute(context);
        List<RuleConflict> conflicts = result.getState().getConflicts();

        assertEquals(1, conflicts.size());
        assertEquals("failing", conflicts.get(0).ruleId);
        assertEquals(ConflictType.STATE_INCONSISTENCY, conflicts.get(0).type);
        assertEquals("broken invariant", conflicts.get(0).description);
        assertEquals(Arrays.asList("next"), executed);
        assertTrue(result.getState().isPhaseCompleted(ExecutionPhase.ATOMIC_ANALYSIS));
    }


    @Test
    public void testUnmetDependencySkipsPhase()
    {
        Rule rule = new Rule("numbering", "numbering", "P-0", ExecutionPhase.NUMBERING, RulePriority.HUNDRED,
                c -> true, (c, r) -> {
                    executed.add(r.getId());
                    return c;
                });

        NamingContext result = new PhaseController(ExecutionPhase.NUMBERING, Arrays.asList(rule)).execute(context);
        List<RuleConflict> conflicts = result.getState().getConflicts();

        assertTrue(executed.isEmpty());
        assertFalse(result.getState().isPhaseCompleted(ExecutionPhase.NUMBERING));
        assertEquals(1, conflicts.size());
        assertEquals(ConflictType.DEPENDENCY, conflicts.get(0).type);
        assertEquals(ExecutionPhase.NUMBERING, conflicts.get(0).phase);
    }


    @Test
    public void testCompletedPhaseIsNotRepeated()
    {
        PhaseController controller = new PhaseController(ExecutionPhase.ATOMIC_ANALYSIS,
                Arrays.asList(recordingRule("once", RulePriority.TEN)));

        NamingContext first = controller.execute(context);
        NamingContext second = controller.execute(first);

        assertEquals(Arrays.asList("once"), executed);
        assertEquals(first.getState().getTrace().size(), second.getState().getTrace().size());
    }


    @Test(expected = IllegalArgumentException.class)
    public void testRuleOfOtherPhaseIsRejected()
    {
        new PhaseController(ExecutionPhase.NUMBERING, Arrays.asList(recordingRule("atomic", RulePriority.TEN)));
    }
}
