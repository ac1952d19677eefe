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

import java.util.function.Predicate;



/**
 * A production rule of the naming pipeline.
 */
public class Rule
{
    @FunctionalInterface
    public static interface Action
    {
        NamingContext apply(NamingContext context, Rule rule);
    }


    private final String id;
    private final String name;
    private final String blueBookReference;
    private final ExecutionPhase phase;
    private final int priority;
    private final Predicate<NamingContext> condition;
    private final Action action;


    public Rule(String id, String name, String blueBookReference, ExecutionPhase phase, int priority,
            Predicate<NamingContext> condition, Action action)
    {
        this.id = id;
        this.name = name;
        this.blueBookReference = blueBookReference;
        this.phase = phase;
        this.priority = priority;
        this.condition = condition;
        this.action = action;
    }


    public boolean isApplicable(NamingContext context)
    {
        return condition.test(context);
    }


    public NamingContext apply(NamingContext context)
    {
        return action.apply(context, this);
    }


    public String getId()
    {
        return id;
    }


    public String getName()
    {
        return name;
    }


    public String getBlueBookReference()
    {
        return blueBookReference;
    }


    public ExecutionPhase getPhase()
    {
        return phase;
    }


    public int getPriority()
    {
        return priority;
    }


    @Override
    public String toString()
    {
        return id + " " + name + " [" + priority + "]";
    }
}
