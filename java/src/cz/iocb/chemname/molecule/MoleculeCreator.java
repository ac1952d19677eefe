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

import java.util.HashMap;
import java.util.Map;
import org.openscience.cdk.aromaticity.Aromaticity;
import org.openscience.cdk.aromaticity.ElectronDonation;
import org.openscience.cdk.exception.CDKException;
import org.openscience.cdk.graph.Cycles;
import org.openscience.cdk.interfaces.IAtom;
import org.openscience.cdk.interfaces.IAtomContainer;
import org.openscience.cdk.interfaces.IBond;
import org.openscience.cdk.interfaces.IDoubleBondStereochemistry.Conformation;
import org.openscience.cdk.interfaces.IPseudoAtom;
import org.openscience.cdk.interfaces.IStereoElement;
import org.openscience.cdk.interfaces.ITetrahedralChirality.Stereo;
import org.openscience.cdk.silent.SilentChemObjectBuilder;
import org.openscience.cdk.smiles.SmilesParser;
import org.openscience.cdk.stereo.DoubleBondStereochemistry;
import org.openscience.cdk.stereo.TetrahedralChirality;
import org.openscience.cdk.tools.manipulator.AtomContainerManipulator;



/**
 * Class for creating molecules
 */
public class MoleculeCreator
{
    private static final ThreadLocal<Aromaticity> aromaticity = new ThreadLocal<Aromaticity>()
    {
        @Override
        protected Aromaticity initialValue()
        {
            return new Aromaticity(ElectronDonation.daylight(), Cycles.or(Cycles.all(), Cycles.relevant()));
        }
    };


    public static Molecule getMoleculeFromSmiles(String smiles) throws CDKException
    {
        if(smiles == null || smiles.trim().isEmpty())
            throw new CDKException("empty SMILES string");

        SmilesParser sp = new SmilesParser(SilentChemObjectBuilder.getInstance());
        IAtomContainer container = sp.parseSmiles(smiles.trim());

        return convert(configureMolecule(container));
    }


    public static IAtomContainer configureMolecule(IAtomContainer container) throws CDKException
    {
        IAtomContainer molecule = AtomContainerManipulator.suppressHydrogens(container);
        aromaticity.get().apply(molecule);
        return molecule;
    }


    public static Molecule convert(IAtomContainer container) throws CDKException
    {
        Map<IAtom, Atom.Chirality> chirality = new HashMap<IAtom, Atom.Chirality>();
        Map<IBond, Bond.Stereo> bondStereo = new HashMap<IBond, Bond.Stereo>();

        for(@SuppressWarnings("rawtypes")
        IStereoElement element : container.stereoElements())
        {
            if(element instanceof TetrahedralChirality)
            {
                TetrahedralChirality tetrahedral = (TetrahedralChirality) element;
                chirality.put(tetrahedral.getChiralAtom(), tetrahedral.getStereo() == Stereo.CLOCKWISE ?
                        Atom.Chirality.CLOCKWISE : Atom.Chirality.ANTI_CLOCKWISE);
            }
            else if(element instanceof DoubleBondStereochemistry)
            {
                DoubleBondStereochemistry stereo = (DoubleBondStereochemistry) element;
                bondStereo.put(stereo.getStereoBond(), stereo.getStereo() == Conformation.OPPOSITE ?
                        Bond.Stereo.OPPOSITE : Bond.Stereo.TOGETHER);
            }
        }


        Molecule.Builder builder = new Molecule.Builder();

        for(IAtom atom : container.atoms())
        {
            if(atom instanceof IPseudoAtom)
                throw new CDKException("pseudo atom " + atom.getSymbol() + " cannot be named");

            int charge = atom.getFormalCharge() == null ? 0 : atom.getFormalCharge();
            int isotope = atom.getMassNumber() == null ? 0 : atom.getMassNumber();
            int hydrogens = atom.getImplicitHydrogenCount() == null ? 0 : atom.getImplicitHydrogenCount();
            Atom.Chirality tag = chirality.getOrDefault(atom, Atom.Chirality.NONE);

            builder.addAtom(atom.getSymbol(), charge, isotope, atom.isAromatic(), hydrogens, tag);
        }

        for(IBond bond : container.bonds())
        {
            int a1 = container.indexOf(bond.getBegin());
            int a2 = container.indexOf(bond.getEnd());

            builder.addBond(a1, a2, getBondType(bond), bondStereo.getOrDefault(bond, Bond.Stereo.NONE));
        }

        return builder.build();
    }


    private static BondType getBondType(IBond bond) throws CDKException
    {
        if(bond.isAromatic())
            return BondType.AROMATIC;

        switch(bond.getOrder())
        {
            case SINGLE:
                return BondType.SINGLE;
            case DOUBLE:
                return BondType.DOUBLE;
            case TRIPLE:
                return BondType.TRIPLE;
            default:
                throw new CDKException("unsupported bond order " + bond.getOrder());
        }
    }
}
