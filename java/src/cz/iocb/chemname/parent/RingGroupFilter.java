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
import java.util.List;
import cz.iocb.chemname.analysis.AtomicAnalysis;
import cz.iocb.chemname.groups.FunctionalGroup;
import cz.iocb.chemname.groups.FunctionalGroupType;
import cz.iocb.chemname.method.EsterClassifier;
import cz.iocb.chemname.molecule.Molecule;



/**
 * Adjusts the characteristic groups once a ring system has been chosen as the parent. Lactams are removed from the
 * principal candidates as amides, so no amide suffix is ever derived from them; their carbonyl stays as a ring ketone
 * ("pyrrolidin-2-one"). Lactones, cyclic anhydrides and cyclic thioesters are expressed as ring ketones as well.
 * Groups out of reach of the ring lose their principal status and the principal groups are derived again.
 */
public class RingGroupFilter
{
    public static List<FunctionalGroup> filter(List<FunctionalGroup> groups, RingSystem ring, Molecule molecule,
            AtomicAnalysis analysis)
    {
        boolean[] mask = GroupAnchors.toMask(ring.getAtoms(), molecule.getAtomCount());
        List<FunctionalGroup> converted = new ArrayList<FunctionalGroup>();

        for(FunctionalGroup group : groups)
        {
            switch(group.getType())
            {
                case ESTER:
                    if(EsterClassifier.isLactone(group, molecule, analysis))
                    {
                        converted.add(group.convert(FunctionalGroupType.KETONE, group.getAtom(0), group.getAtom(1)));
                        continue;
                    }
                    break;
                case AMIDE:
                    /* a lactam never competes as an amide; only its ring carbonyl is kept, as a ring ketone */
                    if(isLactam(group, mask))
                    {
                        converted.add(group.convert(FunctionalGroupType.KETONE, group.getAtom(0), group.getAtom(1)));
                        continue;
                    }
                    break;
                case THIOESTER:
                    if(mask[group.getAtom(0)] && mask[group.getAtom(2)])
                    {
                        converted.add(group.convert(FunctionalGroupType.KETONE, group.getAtom(0), group.getAtom(1)));
                        continue;
                    }
                    break;
                case ANHYDRIDE:
                    if(mask[group.getAtom(0)] && mask[group.getAtom(2)] && mask[group.getAtom(3)])
                    {
                        converted.add(group.convert(FunctionalGroupType.KETONE, group.getAtom(0), group.getAtom(1)));
                        converted.add(group.convert(FunctionalGroupType.KETONE, group.getAtom(3), group.getAtom(4)));
                        continue;
                    }
                    break;
                default:
                    break;
            }

            converted.add(group);
        }

        boolean[] eligible = new boolean[converted.size()];
        int max = Integer.MIN_VALUE;

        for(int i = 0; i < converted.size(); i++)
        {
            FunctionalGroup group = converted.get(i);
            FunctionalGroupType type = group.getType();

            if(!type.isPrincipalCapable() || GroupAnchors.anchor(group, mask, molecule, true) < 0)
                continue;

            /* exocyclic ketones and imines are expressed as acyl and imidoyl prefixes */
            if((type == FunctionalGroupType.KETONE || type == FunctionalGroupType.IMINE) && !mask[group.getKeyAtom()])
                continue;

            /* a ring nitrogen is expressed by the ring name */
            if(type == FunctionalGroupType.AMINE && mask[group.getKeyAtom()])
                continue;

            eligible[i] = true;
            max = Math.max(max, group.getPriority());
        }

        List<FunctionalGroup> result = new ArrayList<FunctionalGroup>(converted.size());

        for(int i = 0; i < converted.size(); i++)
            result.add(converted.get(i).withPrincipal(eligible[i] && converted.get(i).getPriority() == max));

        return EsterClassifier.keepPrimaryEster(result, molecule);
    }


    /**
     * Returns true for an amide whose carbonyl carbon and nitrogen are both members of the ring system.
     */
    static boolean isLactam(FunctionalGroup group, boolean[] mask)
    {
        return group.getType() == FunctionalGroupType.AMIDE && mask[group.getAtom(0)] && mask[group.getAtom(2)];
    }
}
