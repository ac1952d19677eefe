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
package cz.iocb.chemname.analysis;

import java.util.Arrays;
import java.util.List;
import cz.iocb.chemname.engine.ExecutionPhase;
import cz.iocb.chemname.engine.NamingContext;
import cz.iocb.chemname.engine.Rule;
import cz.iocb.chemname.engine.RulePriority;
import cz.iocb.chemname.molecule.Molecule;
import cz.iocb.chemname.parent.RingSystem;
import cz.iocb.chemname.parent.RingSystemDetector;



public class AtomicAnalysisRules
{
    public static final Rule ATOM_ANALYSIS = new Rule("atomic-analysis", "Atom and bond analysis", "P-14.1",
            ExecutionPhase.ATOMIC_ANALYSIS, RulePriority.HUNDRED,
            context -> context.getState().getAtomicAnalysis() == null,
            AtomicAnalysisRules::analyzeAtoms);

    public static final Rule RING_PERCEPTION = new Rule("ring-perception", "Ring perception", "P-22.1",
            ExecutionPhase.ATOMIC_ANALYSIS, RulePriority.NINETY,
            context -> context.getState().getAtomicAnalysis() != null,
            AtomicAnalysisRules::perceiveRings);


    public static List<Rule> rules()
    {
        return Arrays.asList(ATOM_ANALYSIS, RING_PERCEPTION);
    }


    private static NamingContext analyzeAtoms(NamingContext context, Rule rule)
    {
        AtomicAnalysis analysis = AtomicAnalysis.analyze(context.getMolecule());

        return context.withStateUpdate(builder -> builder.setAtomicAnalysis(analysis), rule,
                "analyzed " + context.getMolecule().getAtomCount() + " atoms, " + analysis.getHeteroatoms().length
                        + " heteroatoms");
    }


    private static NamingContext perceiveRings(NamingContext context, Rule rule)
    {
        Molecule molecule = context.getMolecule();
        List<int[]> rings = context.getServices().getRingFinder().findRings(molecule);
        List<RingSystem> systems = RingSystemDetector.detect(molecule, rings, context.getServices().getDictionary());

        AtomicAnalysis analysis = context.getState().getAtomicAnalysis().withRings(molecule, rings, systems);

        return context.withStateUpdate(builder -> builder.setAtomicAnalysis(analysis), rule,
                "perceived " + rings.size() + " rings in " + systems.size() + " ring systems");
    }
}
