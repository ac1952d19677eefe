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
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.openscience.cdk.exception.CDKException;
import cz.iocb.chemname.analysis.AtomicAnalysisRules;
import cz.iocb.chemname.assembly.NameAssemblyRules;
import cz.iocb.chemname.assembly.NameFormatter;
import cz.iocb.chemname.engine.RuleConflict.ConflictType;
import cz.iocb.chemname.groups.FunctionalGroupRules;
import cz.iocb.chemname.method.NomenclatureMethodRules;
import cz.iocb.chemname.molecule.Molecule;
import cz.iocb.chemname.molecule.MoleculeCreator;
import cz.iocb.chemname.numbering.NumberingRules;
import cz.iocb.chemname.parent.ParentSelectionRules;



/**
 * Entry point of the nomenclature pipeline. An engine instance is immutable and can be shared by threads; every
 * request gets its own context.
 */
public class NamingEngine
{
    private static final Logger LOGGER = LogManager.getFormatterLogger(NamingEngine.class);

    private final NamingServices services;
    private final NamingConfiguration configuration;
    private final List<PhaseController> controllers;


    public NamingEngine(NamingServices services, NamingConfiguration configuration)
    {
        this.services = services;
        this.configuration = configuration;

        List<PhaseController> list = new ArrayList<PhaseController>();
        list.add(new PhaseController(ExecutionPhase.ATOMIC_ANALYSIS, AtomicAnalysisRules.rules()));
        list.add(new PhaseController(ExecutionPhase.FUNCTIONAL_GROUPS, FunctionalGroupRules.rules()));
        list.add(new PhaseController(ExecutionPhase.NOMENCLATURE_METHOD, NomenclatureMethodRules.rules()));
        list.add(new PhaseController(ExecutionPhase.PARENT_SELECTION, ParentSelectionRules.rules()));
        list.add(new PhaseController(ExecutionPhase.NUMBERING, NumberingRules.rules()));
        list.add(new PhaseController(ExecutionPhase.ASSEMBLY, NameAssemblyRules.rules()));
        this.controllers = Collections.unmodifiableList(list);
    }


    public NamingEngine()
    {
        this(NamingServices.createDefault(), NamingConfiguration.load());
    }


    public List<PhaseController> getControllers()
    {
        return controllers;
    }


    public NamingConfiguration getConfiguration()
    {
        return configuration;
    }


    /**
     * Runs all phases and returns the final context.
     */
    public NamingContext run(Molecule molecule)
    {
        NamingContext context = NamingContext.create(molecule, services, configuration);

        for(PhaseController controller : controllers)
        {
            try
            {
                context = controller.execute(context);
            }
            catch(RuntimeException e)
            {
                LOGGER.error("phase %s aborted: %s", controller.getPhase().getLabel(), e.getMessage());

                RuleConflict conflict = new RuleConflict(controller.getPhase().getLabel(),
                        ConflictType.STATE_INCONSISTENCY, controller.getPhase(), String.valueOf(e.getMessage()));
                context = context.withConflict(conflict, controller.getPhase().getLabel(), "phase failure", "-",
                        controller.getPhase(), "phase aborted");
            }
        }

        return context;
    }


    public NamingResult name(Molecule molecule)
    {
        NamingContext context = run(molecule);
        ContextState state = context.getState();

        double confidence = NameFormatter.confidence(state, configuration.getMaxNameLength());
        NamingResult result = new NamingResult(state, confidence);

        if(!state.getConflicts().isEmpty())
            LOGGER.info("%s named with %d conflicts", result.getName(), state.getConflicts().size());

        return result;
    }


    public NamingResult nameSmiles(String smiles) throws CDKException
    {
        return name(MoleculeCreator.getMoleculeFromSmiles(smiles));
    }
}
