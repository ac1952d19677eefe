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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import cz.iocb.chemname.analysis.AtomicAnalysis;
import cz.iocb.chemname.molecule.Atom;
import cz.iocb.chemname.molecule.BondType;
import cz.iocb.chemname.molecule.Molecule;
import cz.iocb.chemname.numbering.NumberingCriteria;
import cz.iocb.chemname.numbering.RingNumbering;
import cz.iocb.chemname.parent.HydrideNames;
import cz.iocb.chemname.parent.RingSystem;
import cz.iocb.chemname.parent.Substituent;
import cz.iocb.chemname.shared.Alphanumerics;
import cz.iocb.chemname.shared.Locants;
import cz.iocb.chemname.shared.NomenclatureDictionary;



/**
 * Names the branch hanging off a parent atom as a substituent prefix. The branch is explored from its root atom
 * without entering blocked atoms or the atom it is attached to.
 */
public class SubstituentNamer
{
    private static final class Prefix
    {
        final String name;
        final boolean compound;


        Prefix(String name, boolean compound)
        {
            this.name = name;
            this.compound = compound;
        }
    }


    private static final class Branch
    {
        final int locant;
        final Prefix prefix;


        Branch(int locant, Prefix prefix)
        {
            this.locant = locant;
            this.prefix = prefix;
        }
    }


    private final NomenclatureDictionary dictionary;


    public SubstituentNamer(NomenclatureDictionary dictionary)
    {
        this.dictionary = dictionary;
    }


    /**
     * Names the branch rooted at {@code root} and bonded to the parent atom {@code from}.
     *
     * @param blocked atoms that belong to the parent or are expressed otherwise; the array is not modified
     */
    public Substituent name(Molecule molecule, AtomicAnalysis analysis, int root, int from, boolean[] blocked)
    {
        Session session = new Session(molecule, analysis, blocked.clone());
        Prefix prefix = session.describe(root, from);
        return new Substituent(from, root, prefix.name, prefix.compound);
    }


    private final class Session
    {
        private final Molecule molecule;
        private final AtomicAnalysis analysis;
        private final boolean[] taken;


        Session(Molecule molecule, AtomicAnalysis analysis, boolean[] taken)
        {
            this.molecule = molecule;
            this.analysis = analysis;
            this.taken = taken;
        }


        Prefix describe(int root, int from)
        {
            Atom atom = molecule.getAtom(root);
            taken[root] = true;

            if(analysis.isInRing(root) && analysis.getRingSystemOf(root) != null)
                return describeRing(root, from, false);

            if(atom.isHalogen())
                return new Prefix(dictionary.getHalogenPrefix(atom.symbol), false);

            switch(atom.symbol)
            {
                case "C":
                    return describeCarbon(root, from);
                case "O":
                    return describeOxygen(root, from);
                case "S":
                    return describeSulfur(root, from);
                case "N":
                    return describeNitrogen(root, from);
                case "Se":
                    return describeCore(root, from, "selanyl");
                case "Te":
                    return describeCore(root, from, "tellanyl");
                case "P":
                    return describeCore(root, from, "phosphanyl");
                case "Si":
                case "Ge":
                case "Sn":
                case "Pb":
                    return describeCore(root, from, stripEnding(dictionary.getHydrideName(atom.symbol), "ane") + "yl");
                case "B":
                case "As":
                case "Sb":
                case "Bi":
                    return describeCore(root, from, stripEnding(dictionary.getHydrideName(atom.symbol), "e") + "yl");
                default:
                    return describeCore(root, from, atom.symbol.toLowerCase() + "anyl");
            }
        }


        private Prefix describeOxygen(int root, int from)
        {
            if(molecule.getBondType(root, from) == BondType.DOUBLE)
                return new Prefix("oxo", false);

            if(molecule.getAtom(root).charge < 0)
                return new Prefix("oxido", false);

            List<Integer> next = getFree(root, from);

            if(next.isEmpty())
                return new Prefix("hydroxy", false);

            int carbon = next.get(0);
            Prefix inner = describe(carbon, root);

            if(inner.name.endsWith("oyl") || inner.name.endsWith("carbonyl"))
                return new Prefix(wrap(inner) + "oxy", true);

            String composed = inner.name + "oxy";
            String alias = dictionary.getSubstituentAlias(composed);

            if(!alias.equals(composed))
                return new Prefix(alias, false);

            return new Prefix(wrap(inner) + "oxy", true);
        }


        private Prefix describeSulfur(int root, int from)
        {
            if(molecule.getBondType(root, from) == BondType.DOUBLE)
                return new Prefix("sulfanylidene", false);

            int oxo = 0;
            int hydroxy = -1;

            for(int n : getFree(root, from))
            {
                Atom neighbour = molecule.getAtom(n);

                if(neighbour.is("O") && molecule.getBondType(root, n) == BondType.DOUBLE)
                {
                    taken[n] = true;
                    oxo++;
                }
                else if(neighbour.is("O") && molecule.getDegree(n) == 1)
                {
                    hydroxy = n;
                }
            }

            if(oxo == 2 && hydroxy >= 0)
            {
                taken[hydroxy] = true;
                return new Prefix("sulfo", false);
            }

            String core = oxo == 2 ? "sulfonyl" : oxo == 1 ? "sulfinyl" : "sulfanyl";
            List<Integer> next = getFree(root, from);

            if(next.isEmpty())
                return new Prefix(core, false);

            int other = next.get(0);

            if(oxo == 0 && molecule.getAtom(other).isCarbon() && findBonded(other, "N", BondType.TRIPLE) >= 0)
            {
                taken[other] = true;
                taken[findBonded(other, "N", BondType.TRIPLE)] = true;
                return new Prefix("thiocyanato", false);
            }

            List<Prefix> inner = new ArrayList<Prefix>();

            for(int n : next)
                if(!taken[n])
                    inner.add(describe(n, root));

            return new Prefix(cite(inner) + core, true);
        }


        private Prefix describeNitrogen(int root, int from)
        {
            if(molecule.getBondType(root, from) == BondType.DOUBLE)
            {
                List<Prefix> inner = describeAll(root, from);
                return inner.isEmpty() ? new Prefix("imino", false) : new Prefix(cite(inner) + "imino", true);
            }

            List<Integer> oxygens = new ArrayList<Integer>();
            boolean doubleOxygen = false;

            for(int n : getFree(root, from))
            {
                if(molecule.getAtom(n).is("O") && molecule.getDegree(n) == 1)
                {
                    oxygens.add(n);
                    doubleOxygen |= molecule.getBondType(root, n) == BondType.DOUBLE;
                }
            }

            if(doubleOxygen && oxygens.size() == 2)
            {
                for(int o : oxygens)
                    taken[o] = true;

                return new Prefix("nitro", false);
            }

            if(doubleOxygen && oxygens.size() == 1 && molecule.getDegree(root) == 2)
            {
                taken[oxygens.get(0)] = true;
                return new Prefix("nitroso", false);
            }

            List<Prefix> inner = describeAll(root, from);

            if(inner.isEmpty())
                return new Prefix("amino", false);

            return new Prefix(cite(inner) + "amino", true);
        }


        private Prefix describeCore(int root, int from, String core)
        {
            List<Prefix> inner = describeAll(root, from);

            if(inner.isEmpty())
                return new Prefix(core, false);

            return new Prefix(cite(inner) + core, true);
        }


        private Prefix describeCarbon(int root, int from)
        {
            int nitrogen = findBonded(root, "N", BondType.TRIPLE);

            if(nitrogen >= 0 && !taken[nitrogen])
            {
                taken[nitrogen] = true;
                return new Prefix("cyano", false);
            }

            int oxygen = findBonded(root, "O", BondType.DOUBLE);

            if(oxygen >= 0 && !taken[oxygen])
            {
                Prefix carbonyl = describeCarbonyl(root, from, oxygen);

                if(carbonyl != null)
                    return carbonyl;
            }

            return describeAlkyl(root, from, false);
        }


        /*
         * Returns null for a carbonyl carbon that continues an alkyl chain in the middle (oxo branch).
         */
        private Prefix describeCarbonyl(int root, int from, int oxygen)
        {
            List<Integer> next = new ArrayList<Integer>();

            for(int n : getFree(root, from))
                if(n != oxygen)
                    next.add(n);

            if(next.size() > 1)
                return null;

            taken[oxygen] = true;

            if(next.isEmpty())
                return new Prefix("formyl", false);

            int other = next.get(0);
            Atom atom = molecule.getAtom(other);

            if(atom.is("O") && molecule.getDegree(other) == 1)
            {
                taken[other] = true;
                return new Prefix("carboxy", false);
            }

            if(atom.is("O"))
            {
                taken[other] = true;
                List<Integer> beyond = getFree(other, root);
                Prefix inner = describe(beyond.get(0), other);
                String oxy = inner.name + "oxy";
                String alias = dictionary.getSubstituentAlias(oxy);
                String alkoxy = alias.equals(oxy) ? wrap(inner) + "oxy" : alias;
                return new Prefix(alkoxy + "carbonyl", true);
            }

            if(atom.is("N"))
            {
                taken[other] = true;
                List<Prefix> inner = describeAll(other, root);
                return inner.isEmpty() ? new Prefix("carbamoyl", false) : new Prefix(cite(inner) + "carbamoyl",
                        true);
            }

            if(atom.isHalogen())
            {
                taken[other] = true;
                return new Prefix(dictionary.getHalogenPrefix(atom.symbol) + "carbonyl", true);
            }

            if(atom.is("S"))
            {
                taken[other] = true;
                List<Integer> beyond = getFree(other, root);

                if(beyond.isEmpty())
                    return new Prefix("sulfanylcarbonyl", true);

                Prefix inner = describe(beyond.get(0), other);
                return new Prefix("(" + wrap(inner) + "sulfanyl)carbonyl", true);
            }

            if(!atom.isCarbon())
                return new Prefix(describe(other, root).name + "carbonyl", true);

            if(analysis.isInRing(other) && analysis.getRingSystemOf(other) != null)
            {
                taken[other] = true;
                return describeRing(other, root, true);
            }

            return describeAlkyl(root, from, true);
        }


        private List<Prefix> describeAll(int root, int from)
        {
            List<Prefix> inner = new ArrayList<Prefix>();

            for(int n : getFree(root, from))
                if(!taken[n])
                    inner.add(describe(n, root));

            return inner;
        }


        /*
         * Picks the substituent chain among the acyclic carbons reachable from the root: longest chain, lowest locant
         * of the free valence, most multiple bonds with the lowest locants, most branches with the lowest locants.
         */
        private Prefix describeAlkyl(int root, int from, boolean acyl)
        {
            boolean[] tree = new boolean[molecule.getAtomCount()];
            collectTree(root, from, tree, acyl);

            int[] best = null;
            int[] bestKey = null;
            List<Integer> members = new ArrayList<Integer>();

            for(int i = 0; i < tree.length; i++)
                if(tree[i])
                    members.add(i);

            for(int start : members)
            {
                int[] parents = new int[tree.length];
                Arrays.fill(parents, -2);
                parents[start] = -1;
                List<Integer> queue = new ArrayList<Integer>();
                queue.add(start);

                for(int q = 0; q < queue.size(); q++)
                {
                    int atom = queue.get(q);

                    for(int n : molecule.getNeighbours(atom))
                    {
                        if(tree[n] && parents[n] == -2)
                        {
                            parents[n] = atom;
                            queue.add(n);
                        }
                    }
                }

                for(int end : members)
                {
                    List<Integer> path = new ArrayList<Integer>();

                    for(int atom = end; atom != -1; atom = parents[atom])
                        path.add(atom);

                    /* path runs from start to end */
                    Collections.reverse(path);
                    int[] chain = path.stream().mapToInt(Integer::intValue).toArray();
                    int position = indexOf(chain, root);

                    if(position < 0 || acyl && position != 0)
                        continue;

                    int[] key = evaluateChain(chain, position, from);

                    if(bestKey == null || Locants.compare(key, bestKey) < 0)
                    {
                        best = chain;
                        bestKey = key;
                    }
                }
            }

            return nameChain(best, indexOf(best, root), from, acyl);
        }


        private void collectTree(int root, int from, boolean[] tree, boolean acyl)
        {
            List<Integer> queue = new ArrayList<Integer>();
            tree[root] = true;
            queue.add(root);

            for(int q = 0; q < queue.size(); q++)
            {
                int atom = queue.get(q);

                for(int n : molecule.getNeighbours(atom))
                {
                    if(n == from || tree[n] || taken[n] && n != root)
                        continue;

                    if(molecule.getAtom(n).isCarbon() && !analysis.isInRing(n) && isChainCarbon(n, atom))
                    {
                        tree[n] = true;
                        queue.add(n);
                    }
                }
            }
        }


        /*
         * Carbons expressed by their own prefixes (cyano, carboxy, alkoxycarbonyl, carbamoyl) do not extend chains.
         */
        private boolean isChainCarbon(int carbon, int from)
        {
            if(findBonded(carbon, "N", BondType.TRIPLE) >= 0)
                return false;

            int oxygen = findBonded(carbon, "O", BondType.DOUBLE);

            if(oxygen < 0 || taken[oxygen])
                return true;

            for(int n : molecule.getNeighbours(carbon))
                if(n != oxygen && n != from && !molecule.getAtom(n).isCarbon())
                    return false;

            return true;
        }


        private int[] evaluateChain(int[] chain, int position, int from)
        {
            List<Integer> key = new ArrayList<Integer>();
            key.add(-chain.length);
            key.add(position);

            List<Integer> multiple = getMultipleBondLocants(chain, null);
            key.add(-multiple.size());
            key.addAll(multiple);

            List<Integer> branches = new ArrayList<Integer>();

            for(int i = 0; i < chain.length; i++)
                for(int n : molecule.getNeighbours(chain[i]))
                    if(n != from && !taken[n] && indexOf(chain, n) < 0)
                        branches.add(i + 1);

            key.add(-branches.size());
            key.addAll(branches);

            return key.stream().mapToInt(Integer::intValue).toArray();
        }


        private List<Integer> getMultipleBondLocants(int[] chain, BondType type)
        {
            List<Integer> locants = new ArrayList<Integer>();

            for(int i = 0; i + 1 < chain.length; i++)
            {
                BondType bond = molecule.getBondType(chain[i], chain[i + 1]);

                if(type == null && (bond == BondType.DOUBLE || bond == BondType.TRIPLE) || type != null && bond == type)
                    locants.add(i + 1);
            }

            return locants;
        }


        private Prefix nameChain(int[] chain, int position, int from, boolean acyl)
        {
            for(int atom : chain)
                taken[atom] = true;

            List<Branch> branches = new ArrayList<Branch>();

            for(int i = 0; i < chain.length; i++)
                for(int n : molecule.getNeighbours(chain[i]))
                    if(n != from && !taken[n])
                        branches.add(new Branch(i + 1, describe(n, chain[i])));

            List<String> doubles = toStrings(getMultipleBondLocants(chain, BondType.DOUBLE));
            List<String> triples = toStrings(getMultipleBondLocants(chain, BondType.TRIPLE));
            String stem = dictionary.getStem(chain.length);
            BondType attachment = molecule.getBondType(chain[position], from);
            String ending = attachment == BondType.DOUBLE ? "ylidene" : attachment == BondType.TRIPLE ? "ylidyne" :
                    "yl";
            String core;

            if(acyl)
            {
                if(doubles.isEmpty() && triples.isEmpty())
                    core = dictionary.getSubstituentAlias(stem + "anoyl");
                else
                    core = HydrideNames.attachSuffix(HydrideNames.compose(stem, doubles, triples, true, dictionary),
                            Collections.emptyList(), "oyl");
            }
            else if(doubles.isEmpty() && triples.isEmpty() && position == 0)
            {
                core = stem + ending;
            }
            else if(chain.length == 2 && position == 0)
            {
                core = HydrideNames.attachSuffix(HydrideNames.compose(stem, doubles, triples, false, dictionary),
                        Collections.emptyList(), ending);
            }
            else
            {
                String hydride = HydrideNames.compose(stem, doubles, triples, true, dictionary);
                core = HydrideNames.attachSuffix(hydride, Collections.singletonList(Integer.toString(position + 1)),
                        ending);
            }

            String name = citeBranches(branches, chain.length > 1) + core;
            boolean compound = !branches.isEmpty() || containsDigit(name);

            return new Prefix(name, compound);
        }


        private Prefix describeRing(int root, int from, boolean acyl)
        {
            RingSystem system = analysis.getRingSystemOf(root);

            for(int atom : system.getAtoms())
                taken[atom] = true;

            List<Substituent> substituents = new ArrayList<Substituent>();

            for(int atom : system.getAtoms())
            {
                for(int n : molecule.getNeighbours(atom))
                {
                    if(taken[n] || n == from)
                        continue;

                    Prefix prefix = describe(n, atom);
                    substituents.add(new Substituent(atom, n, prefix.name, prefix.compound));
                }
            }

            List<int[]> orderings = RingNumbering.getOrderings(system);
            NumberingCriteria criteria = new NumberingCriteria(molecule, dictionary, system.getAtoms(),
                    new int[] { root }, substituents);
            int[] ordering = orderings.get(criteria.choose(orderings));
            String[] labels = RingNumbering.getLabels(system);

            List<Substituent> labelled = new ArrayList<Substituent>();

            for(Substituent substituent : substituents)
                labelled.add(substituent.withLocant(labels[indexOf(ordering, substituent.getAttachment())]));

            String hydride = HydrideNames.getRingHydrideName(molecule, dictionary, system, ordering, labels);
            String locant = labels[indexOf(ordering, root)];
            boolean symmetric = HydrideNames.isSymmetricMonocycle(molecule, system);
            BondType attachment = molecule.getBondType(root, from);
            String core;

            if(acyl)
            {
                String composed = dictionary.getSubstituentAlias(hydride + "carbonyl");

                if(!composed.equals(hydride + "carbonyl") || symmetric)
                    core = composed;
                else
                    core = hydride + "-" + locant + "-carbonyl";
            }
            else if(hydride.equals("benzene") && attachment == BondType.SINGLE)
            {
                core = "phenyl";
            }
            else if(symmetric && hydride.endsWith("ane"))
            {
                /* cycloalkyl groups replace the "ane" ending */
                core = hydride.substring(0, hydride.length() - 3)
                        + (attachment == BondType.DOUBLE ? "ylidene" : "yl");
            }
            else
            {
                String ending = attachment == BondType.DOUBLE ? "ylidene" : "yl";
                List<String> locants = symmetric ? Collections.emptyList() : Collections.singletonList(locant);
                core = HydrideNames.attachSuffix(hydride, locants, ending);
            }

            String name = PrefixGroup.cite(PrefixGroup.group(labelled), dictionary, true) + core;
            boolean compound = !substituents.isEmpty() || containsDigit(name) || name.contains("[");

            return new Prefix(name, compound);
        }


        private String citeBranches(List<Branch> branches, boolean showLocants)
        {
            List<Substituent> substituents = new ArrayList<Substituent>();

            for(Branch branch : branches)
                substituents.add(new Substituent(-1, -1, branch.prefix.name, branch.prefix.compound)
                        .withLocant(Integer.toString(branch.locant)));

            return PrefixGroup.cite(PrefixGroup.group(substituents), dictionary, showLocants);
        }


        private List<Integer> getFree(int atom, int from)
        {
            List<Integer> free = new ArrayList<Integer>();

            for(int n : molecule.getNeighbours(atom))
                if(n != from && !taken[n])
                    free.add(n);

            return free;
        }


        private int findBonded(int atom, String element, BondType type)
        {
            for(int n : molecule.getNeighbours(atom))
                if(molecule.getAtom(n).is(element) && molecule.getBondType(atom, n) == type)
                    return n;

            return -1;
        }
    }


    /**
     * Cites the prefixes on a heteroatomic core: identical prefixes are multiplied, the remaining ones follow in
     * alphanumerical order enclosed in parentheses, as in "dimethyl" or "ethyl(methyl)".
     */
    private String cite(List<Prefix> prefixes)
    {
        List<Prefix> sorted = new ArrayList<Prefix>(prefixes);
        sorted.sort((a, b) -> Alphanumerics.COMPARATOR.compare(a.name, b.name));

        StringBuilder builder = new StringBuilder();
        int i = 0;

        while(i < sorted.size())
        {
            Prefix prefix = sorted.get(i);
            int count = 1;

            while(i + count < sorted.size() && sorted.get(i + count).name.equals(prefix.name))
                count++;

            String text;

            if(count > 1)
                text = prefix.compound ? dictionary.getComplexMultiplier(count) + "(" + prefix.name + ")" :
                        dictionary.getMultiplier(count) + prefix.name;
            else
                text = prefix.compound ? "(" + prefix.name + ")" : prefix.name;

            if(builder.length() > 0 && !text.startsWith("("))
                text = "(" + text + ")";

            builder.append(text);
            i += count;
        }

        return builder.toString();
    }


    private static String wrap(Prefix prefix)
    {
        return prefix.compound ? "(" + prefix.name + ")" : prefix.name;
    }


    private static String stripEnding(String name, String ending)
    {
        return name.endsWith(ending) ? name.substring(0, name.length() - ending.length()) : name;
    }


    private static boolean containsDigit(String name)
    {
        for(char c : name.toCharArray())
            if(Character.isDigit(c))
                return true;

        return false;
    }


    private static List<String> toStrings(List<Integer> locants)
    {
        List<String> strings = new ArrayList<String>();

        for(int locant : locants)
            strings.add(Integer.toString(locant));

        return strings;
    }


    private static int indexOf(int[] array, int value)
    {
        for(int i = 0; i < array.length; i++)
            if(array[i] == value)
                return i;

        return -1;
    }
}
