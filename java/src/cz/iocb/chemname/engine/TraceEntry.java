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



/**
 * One record of the rule-execution trace. Entries are appended by context transitions and never modified.
 */
public class TraceEntry
{
    public final int sequence;
    public final String ruleId;
    public final String ruleName;
    public final ExecutionPhase phase;
    public final String blueBookReference;
    public final String description;
    public final long timestamp;
    public final String before;
    public final String after;


    public TraceEntry(int sequence, String ruleId, String ruleName, ExecutionPhase phase, String blueBookReference,
            String description, long timestamp, String before, String after)
    {
        this.sequence = sequence;
        this.ruleId = ruleId;
        this.ruleName = ruleName;
        this.phase = phase;
        this.blueBookReference = blueBookReference;
        this.description = description;
        this.timestamp = timestamp;
        this.before = before;
        this.after = after;
    }


    @Override
    public String toString()
    {
        return sequence + " " + phase.getLabel() + " " + ruleId + " (" + blueBookReference + "): " + description;
    }
}
