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
package cz.iocb.chemname.assembly;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;



/**
 * Intermediate results of the name assembly phase.
 */
public final class AssemblyState
{
    public static final AssemblyState EMPTY = new AssemblyState(null, null, null, null);

    private final List<PrefixGroup> prefixGroups;
    private final String prefixText;
    private final String parentName;
    private final String fullName;


    private AssemblyState(List<PrefixGroup> prefixGroups, String prefixText, String parentName, String fullName)
    {
        this.prefixGroups = prefixGroups == null ? null :
                Collections.unmodifiableList(new ArrayList<PrefixGroup>(prefixGroups));
        this.prefixText = prefixText;
        this.parentName = parentName;
        this.fullName = fullName;
    }


    public AssemblyState withPrefixGroups(List<PrefixGroup> prefixGroups)
    {
        return new AssemblyState(prefixGroups, prefixText, parentName, fullName);
    }


    public AssemblyState withPrefixText(String prefixText)
    {
        return new AssemblyState(prefixGroups, prefixText, parentName, fullName);
    }


    public AssemblyState withParentName(String parentName)
    {
        return new AssemblyState(prefixGroups, prefixText, parentName, fullName);
    }


    public AssemblyState withFullName(String fullName)
    {
        return new AssemblyState(prefixGroups, prefixText, parentName, fullName);
    }


    /**
     * Returns the alphabetized prefix groups, or null if they were not collected yet.
     */
    public List<PrefixGroup> getPrefixGroups()
    {
        return prefixGroups;
    }


    public String getPrefixText()
    {
        return prefixText;
    }


    public String getParentName()
    {
        return parentName;
    }


    public String getFullName()
    {
        return fullName;
    }


    @Override
    public String toString()
    {
        return "prefixes=" + prefixText + " parent=" + parentName + " name=" + fullName;
    }
}
