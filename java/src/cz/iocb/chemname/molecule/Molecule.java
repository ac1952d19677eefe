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
package cz.iocb.chemname.molecule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;



/**
 * Immutable molecular graph. Atoms and bonds are addressed by their indices, which are equal to their ids.
 */
public class Molecule
{
    public static class Builder
    {
        private final List<Atom> atoms = new ArrayList<Atom>();
        private final List<Bond> bonds = new ArrayList<Bond>();


        public int addAtom(String symbol, int charge, int isotope, boolean aromatic, int hydrogens,
                Atom.Chirality chirality)
        {
            int id = atoms.size();
            atoms.add(new Atom(id, symbol, charge, isotope, aromatic, hydrogens, chirality));
            return id;
        }


        public int addAtom(String symbol, boolean aromatic, int hydrogens)
        {
            return addAtom(symbol, 0, 0, aromatic, hydrogens, Atom.Chirality.NONE);
        }


        public int addAtom(String symbol, int hydrogens)
        {
            return addAtom(symbol, 0, 0, false, hydrogens, Atom.Chirality.NONE);
        }


        public int addBond(int atom1, int atom2, BondType type, Bond.Stereo stereo)
        {
            int id = bonds.size();
            bonds.add(new Bond(id, atom1, atom2, type, stereo));
            return id;
        }


        public int addBond(int atom1, int atom2, BondType type)
        {
            return addBond(atom1, atom2, type, Bond.Stereo.NONE);
        }


        public Molecule build()
        {
            return new Molecule(atoms, bonds);
        }
    }


    private final List<Atom> atoms;
    private final List<Bond> bonds;
    private final int[][] neighbours;
    private final int[][] neighbourBonds;


    public Molecule(List<Atom> atoms, List<Bond> bonds)
    {
        this.atoms = Collections.unmodifiableList(new ArrayList<Atom>(atoms));
        this.bonds = Collections.unmodifiableList(new ArrayList<Bond>(bonds));

        for(int i = 0; i < this.atoms.size(); i++)
            if(this.atoms.get(i).id != i)
                throw new IllegalArgumentException("atom at index " + i + " has id " + this.atoms.get(i).id);

        int[] degree = new int[this.atoms.size()];

        for(int i = 0; i < this.bonds.size(); i++)
        {
            Bond bond = this.bonds.get(i);

            if(bond.id != i)
                throw new IllegalArgumentException("bond at index " + i + " has id " + bond.id);

            if(bond.atom1 < 0 || bond.atom1 >= degree.length || bond.atom2 < 0 || bond.atom2 >= degree.length)
                throw new IllegalArgumentException("bond " + i + " refers to an unknown atom");

            degree[bond.atom1]++;
            degree[bond.atom2]++;
        }

        neighbours = new int[degree.length][];
        neighbourBonds = new int[degree.length][];

        for(int i = 0; i < degree.length; i++)
        {
            neighbours[i] = new int[degree[i]];
            neighbourBonds[i] = new int[degree[i]];
            degree[i] = 0;
        }

        for(Bond bond : this.bonds)
        {
            neighbours[bond.atom1][degree[bond.atom1]] = bond.atom2;
            neighbourBonds[bond.atom1][degree[bond.atom1]++] = bond.id;
            neighbours[bond.atom2][degree[bond.atom2]] = bond.atom1;
            neighbourBonds[bond.atom2][degree[bond.atom2]++] = bond.id;
        }
    }


    public int getAtomCount()
    {
        return atoms.size();
    }


    public int getBondCount()
    {
        return bonds.size();
    }


    public Atom getAtom(int index)
    {
        return atoms.get(index);
    }


    public Bond getBond(int index)
    {
        return bonds.get(index);
    }


    public List<Atom> getAtoms()
    {
        return atoms;
    }


    public List<Bond> getBonds()
    {
        return bonds;
    }


    public int[] getNeighbours(int atom)
    {
        return neighbours[atom].clone();
    }


    public int getDegree(int atom)
    {
        return neighbours[atom].length;
    }


    /**
     * Returns the bond connecting the given atoms, or null.
     */
    public Bond getBond(int atom1, int atom2)
    {
        int[] list = neighbours[atom1];

        for(int i = 0; i < list.length; i++)
            if(list[i] == atom2)
                return bonds.get(neighbourBonds[atom1][i]);

        return null;
    }


    public boolean isBonded(int atom1, int atom2)
    {
        return getBond(atom1, atom2) != null;
    }


    public BondType getBondType(int atom1, int atom2)
    {
        Bond bond = getBond(atom1, atom2);
        return bond == null ? null : bond.type;
    }


    public int getHeavyAtomCount()
    {
        int count = 0;

        for(Atom atom : atoms)
            if(!atom.is("H"))
                count++;

        return count;
    }


    public int getTotalHydrogenCount()
    {
        int count = 0;

        for(Atom atom : atoms)
            count += atom.is("H") ? 1 : atom.hydrogens;

        return count;
    }


    /**
     * Returns the atom graph as adjacency lists, as expected by the cycle perception algorithms.
     */
    public int[][] toAdjacencyGraph()
    {
        int[][] graph = new int[neighbours.length][];

        for(int i = 0; i < neighbours.length; i++)
            graph[i] = neighbours[i].clone();

        return graph;
    }


    @Override
    public String toString()
    {
        StringBuilder builder = new StringBuilder();

        for(Atom atom : atoms)
            builder.append(atom.symbol);

        return builder.toString() + "/" + bonds.size();
    }
}
