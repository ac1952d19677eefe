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
package cz.iocb.chemname.groups;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;



/**
 * Detected characteristic group. The first atom is the key atom: the carbon of carbon-anchored classes and the
 * characteristic heteroatom otherwise.
 */
public final class FunctionalGroup
{
    private final FunctionalGroupType type;
    private final int[] atoms;
    private final int priority;
    private final boolean principal;
    private final List<String> locants;
    private final String assembledName;


    public FunctionalGroup(FunctionalGroupType type, int... atoms)
    {
        this(type, atoms, type.getPriority(), false, Collections.emptyList(), null);
    }


    private FunctionalGroup(FunctionalGroupType type, int[] atoms, int priority, boolean principal,
            List<String> locants, String assembledName)
    {
        if(atoms.length == 0)
            throw new IllegalArgumentException("functional group without atoms");

        this.type = type;
        this.atoms = atoms.clone();
        this.priority = priority;
        this.principal = principal;
        this.locants = Collections.unmodifiableList(locants);
        this.assembledName = assembledName;
    }


    public FunctionalGroup withPrincipal(boolean principal)
    {
        return new FunctionalGroup(type, atoms, priority, principal, locants, assembledName);
    }


    public FunctionalGroup withLocants(List<String> locants)
    {
        return new FunctionalGroup(type, atoms, priority, principal, locants, assembledName);
    }


    public FunctionalGroup withAssembledName(String assembledName)
    {
        return new FunctionalGroup(type, atoms, priority, principal, locants, assembledName);
    }


    /**
     * Returns a group of another class over a subset of the atoms, used when a ring-embedded ester or amide is
     * re-expressed as a ring ketone.
     */
    public FunctionalGroup convert(FunctionalGroupType newType, int... newAtoms)
    {
        return new FunctionalGroup(newType, newAtoms, newType.getPriority(), principal, locants, null);
    }


    public FunctionalGroupType getType()
    {
        return type;
    }


    public int getKeyAtom()
    {
        return atoms[0];
    }


    public int[] getAtoms()
    {
        return atoms.clone();
    }


    public int getAtom(int index)
    {
        return atoms[index];
    }


    public boolean contains(int atom)
    {
        for(int a : atoms)
            if(a == atom)
                return true;

        return false;
    }


    public int getPriority()
    {
        return priority;
    }


    public boolean isPrincipal()
    {
        return principal;
    }


    public List<String> getLocants()
    {
        return locants;
    }


    public String getPrefix()
    {
        return GroupNames.getPrefix(type);
    }


    public String getSuffix()
    {
        return GroupNames.getSuffix(type);
    }


    public String getAssembledName()
    {
        return assembledName;
    }


    @Override
    public String toString()
    {
        return type.getLabel() + Arrays.toString(atoms) + (principal ? "*" : "") + (locants.isEmpty() ? "" : locants);
    }
}
