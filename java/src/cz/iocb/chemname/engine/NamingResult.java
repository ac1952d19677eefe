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
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import cz.iocb.chemname.groups.FunctionalGroup;
import cz.iocb.chemname.parent.ParentStructure;



/**
 * Outcome of one naming request.
 */
public class NamingResult
{
    private final String name;
    private final NomenclatureMethod method;
    private final ParentStructure parentStructure;
    private final List<FunctionalGroup> functionalGroups;
    private final Map<Integer, String> locants;
    private final double confidence;
    private final List<String> firedRules;
    private final List<RuleConflict> conflicts;
    private final List<TraceEntry> trace;


    public NamingResult(ContextState state, double confidence)
    {
        this.name = state.getFinalName() == null ? "" : state.getFinalName();
        this.method = state.getNomenclatureMethod();
        this.parentStructure = state.getParentStructure();
        this.functionalGroups = state.getFunctionalGroups();
        this.confidence = confidence;
        this.conflicts = state.getConflicts();
        this.trace = state.getTrace();

        Map<Integer, String> map = new LinkedHashMap<Integer, String>();

        if(state.getNumbering() != null)
            for(int atom : state.getNumbering().getOrderedAtoms())
                map.put(atom, state.getNumbering().getLabel(atom));

        this.locants = Collections.unmodifiableMap(map);

        Set<String> fired = new LinkedHashSet<String>();

        for(TraceEntry entry : trace)
            if(!entry.blueBookReference.equals("-"))
                fired.add(entry.ruleId);

        this.firedRules = Collections.unmodifiableList(new ArrayList<String>(fired));
    }


    public String getName()
    {
        return name;
    }


    public NomenclatureMethod getMethod()
    {
        return method;
    }


    public ParentStructure getParentStructure()
    {
        return parentStructure;
    }


    public List<FunctionalGroup> getFunctionalGroups()
    {
        return functionalGroups;
    }


    /**
     * Returns the locant of every parent atom, keyed by atom index, in numbering order.
     */
    public Map<Integer, String> getLocants()
    {
        return locants;
    }


    public double getConfidence()
    {
        return confidence;
    }


    public List<String> getFiredRules()
    {
        return firedRules;
    }


    public List<RuleConflict> getConflicts()
    {
        return conflicts;
    }


    public List<TraceEntry> getTrace()
    {
        return trace;
    }


    @Override
    public String toString()
    {
        return name + " (" + (method == null ? "-" : method.getLabel()) + ", confidence " + confidence + ")";
    }
}
