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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import cz.iocb.chemname.engine.RuleConflict.ConflictType;



/**
 * Runs the rules of one phase in descending priority order.
 */
public class PhaseController
{
    private static final Logger LOGGER = LogManager.getFormatterLogger(PhaseController.class);

    private final ExecutionPhase phase;
    private final List<Rule> rules;
    private final PhaseContract contract;


    public PhaseController(ExecutionPhase phase, List<Rule> rules, PhaseContract contract)
    {
        for(Rule rule : rules)
            if(rule.getPhase() != phase)
                throw new IllegalArgumentException("rule " + rule.getId() + " does not belong to phase " + phase);

        List<Rule> sorted = new ArrayList<Rule>(rules);

        /* List.sort is stable, rules of equal priority keep their registration order */
        sorted.sort(Comparator.comparingInt(Rule::getPriority).reversed());

        this.phase = phase;
        this.rules = Collections.unmodifiableList(sorted);
        this.contract = contract;
    }


    public PhaseController(ExecutionPhase phase, List<Rule> rules)
    {
        this(phase, rules, PhaseContract.forPhase(phase));
    }


    public ExecutionPhase getPhase()
    {
        return phase;
    }


    public List<Rule> getRules()
    {
        return rules;
    }


    public NamingContext execute(NamingContext context)
    {
        if(context.getState().isPhaseCompleted(phase))
            return context;

        String unmet = contract.checkDependencies(context.getState());

        if(unmet != null)
        {
            LOGGER.debug("phase %s skipped: %s", phase.getLabel(), unmet);
            RuleConflict conflict = new RuleConflict(phase.getLabel(), ConflictType.DEPENDENCY, phase, unmet);
            return context.withConflict(conflict, phase.getLabel(), "phase dependency check", "-", phase,
                    "phase not executed: " + unmet);
        }

        LOGGER.debug("phase %s started with %d rules", phase.getLabel(), rules.size());

        NamingContext current = context;

        for(Rule rule : rules)
        {
            try
            {
                if(!rule.isApplicable(current))
                    continue;

                current = rule.apply(current);
            }
            catch(RuntimeException e)
            {
                String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                LOGGER.warn("rule %s failed: %s", rule.getId(), message);

                RuleConflict conflict = new RuleConflict(rule.getId(), ConflictType.STATE_INCONSISTENCY, phase,
                        message);
                current = current.withConflict(conflict, rule, "rule failed: " + message);
            }
        }

        LOGGER.debug("phase %s completed", phase.getLabel());

        return current.withPhaseCompletion(phase, phase.getLabel(), "phase completion", "-",
                "phase " + phase.getLabel() + " completed");
    }
}
