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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;



/**
 * Connected union of perceived rings sharing atoms.
 */
public final class RingSystem
{
    public static enum Kind
    {
        ISOLATED, FUSED, SPIRO, BRIDGED
    }


    public static enum Scheme
    {
        MONOCYCLE, FUSED, VON_BAEYER, SPIRO, GENERIC
    }


    private final List<int[]> rings;
    private final int[] atoms;
    private final int[] bonds;
    private final Kind kind;
    private final int heteroatomScore;
    private final boolean aromatic;
    private final RingName name;
    private final Scheme scheme;
    private final int[] bridgeheads;
    private final List<int[]> bridges;
    private final String[] labels;
    private final List<int[]> orderings;


    public RingSystem(List<int[]> rings, int[] atoms, int[] bonds, Kind kind, int heteroatomScore, boolean aromatic,
            RingName name, Scheme scheme, int[] bridgeheads, List<int[]> bridges)
    {
        this(rings, atoms, bonds, kind, heteroatomScore, aromatic, name, scheme, bridgeheads, bridges, null,
                Collections.emptyList());
    }


    /**
     * Creates a ring system with a fixed numbering, given by its labels in locant order and the atom orderings that
     * fit it.
     */
    public RingSystem(List<int[]> rings, int[] atoms, int[] bonds, Kind kind, int heteroatomScore, boolean aromatic,
            RingName name, Scheme scheme, int[] bridgeheads, List<int[]> bridges, String[] labels,
            List<int[]> orderings)
    {
        List<int[]> ringCopy = new ArrayList<int[]>();

        for(int[] ring : rings)
            ringCopy.add(ring.clone());

        List<int[]> bridgeCopy = new ArrayList<int[]>();

        for(int[] bridge : bridges)
            bridgeCopy.add(bridge.clone());

        this.rings = Collections.unmodifiableList(ringCopy);
        this.atoms = atoms.clone();
        Arrays.sort(this.atoms);
        this.bonds = bonds.clone();
        this.kind = kind;
        this.heteroatomScore = heteroatomScore;
        this.aromatic = aromatic;
        this.name = name;
        this.scheme = scheme;
        this.bridgeheads = bridgeheads.clone();
        this.bridges = Collections.unmodifiableList(bridgeCopy);
        this.labels = labels == null ? null : labels.clone();

        List<int[]> orderingCopy = new ArrayList<int[]>();

        for(int[] ordering : orderings)
            orderingCopy.add(ordering.clone());

        this.orderings = Collections.unmodifiableList(orderingCopy);
    }


    public List<int[]> getRings()
    {
        return rings;
    }


    public int getRingCount()
    {
        return rings.size();
    }


    /**
     * Returns the member atoms in ascending index order.
     */
    public int[] getAtoms()
    {
        return atoms.clone();
    }


    public int[] getBonds()
    {
        return bonds.clone();
    }


    public int getSize()
    {
        return atoms.length;
    }


    public boolean contains(int atom)
    {
        return Arrays.binarySearch(atoms, atom) >= 0;
    }


    public Kind getKind()
    {
        return kind;
    }


    public int getHeteroatomScore()
    {
        return heteroatomScore;
    }


    public boolean isAromatic()
    {
        return aromatic;
    }


    public RingName getName()
    {
        return name;
    }


    public Scheme getScheme()
    {
        return scheme;
    }


    /**
     * Returns the bridgehead atoms of a bicyclic system, or the spiro atom of a spiro system.
     */
    public int[] getBridgeheads()
    {
        return bridgeheads.clone();
    }


    /**
     * Returns the bridges of a bicyclic system, each running from the first to the second bridgehead, or the two
     * rings of a spiro system without the spiro atom in cyclic order.
     */
    public List<int[]> getBridges()
    {
        return bridges;
    }


    /**
     * Returns the locants of a ring system with a fixed numbering in locant order, or null.
     */
    public String[] getLabels()
    {
        return labels == null ? null : labels.clone();
    }


    /**
     * Returns the atom orderings allowed by a fixed numbering.
     */
    public List<int[]> getOrderings()
    {
        return orderings;
    }


    @Override
    public String toString()
    {
        return name + Arrays.toString(atoms);
    }
}
