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
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import cz.iocb.chemname.engine.ContextState;



/**
 * Textual normalization, validation and confidence scoring of assembled names.
 */
public class NameFormatter
{
    private static final Pattern digitLetter = Pattern.compile("(\\d)(?=[A-GI-Za-gi-z])");
    private static final Pattern letterDigit = Pattern.compile("([A-Za-z])(?=\\d(?!-))");
    private static final Pattern hyphens = Pattern.compile("--+");
    private static final Pattern locantComma = Pattern.compile("(\\d)-,(\\d)");
    private static final Pattern strayComma = Pattern.compile("-,(?=\\d)");
    private static final Pattern commaHyphen = Pattern.compile(",-+");
    private static final Pattern hydroxy = Pattern.compile("(\\d+)-?hydroxy");


    /**
     * Normalizes hyphens and commas around locants, lowercases the first letter unless it is a letter locant, and
     * drops hydroxy prefixes repeating an "-ol" suffix at the same locant. The operation is idempotent.
     */
    public static String format(String name)
    {
        String formatted = name.trim();

        /* the H of indicated hydrogen ("2H-pyran") stays attached to its locant */
        formatted = digitLetter.matcher(formatted).replaceAll("$1-");
        formatted = letterDigit.matcher(formatted).replaceAll("$1-");
        formatted = hyphens.matcher(formatted).replaceAll("-");
        formatted = locantComma.matcher(formatted).replaceAll("$1,$2");
        formatted = strayComma.matcher(formatted).replaceAll(",");
        formatted = commaHyphen.matcher(formatted).replaceAll(",");

        if(formatted.startsWith("-"))
            formatted = formatted.substring(1);

        if(!formatted.isEmpty() && !isLetterLocant(formatted))
            formatted = Character.toLowerCase(formatted.charAt(0)) + formatted.substring(1);

        return removeRedundantHydroxy(formatted);
    }


    private static boolean isLetterLocant(String name)
    {
        return name.length() > 1 && Character.isUpperCase(name.charAt(0))
                && (name.charAt(1) == ',' || name.charAt(1) == '-');
    }


    private static String removeRedundantHydroxy(String name)
    {
        List<String> locants = new ArrayList<String>();
        Matcher matcher = hydroxy.matcher(name);

        while(matcher.find())
            locants.add(matcher.group(1));

        String result = name;

        for(String locant : locants)
        {
            if(!result.contains(locant + "-ol"))
                continue;

            result = result.replaceAll("[,-]?" + locant + "-?hydroxy", "");
            result = hyphens.matcher(result).replaceAll("-");

            if(result.startsWith("-"))
                result = result.substring(1);
        }

        return result;
    }


    /**
     * Returns a description of the first problem of the name, or null if the name is acceptable.
     */
    public static String validate(String name, int maxLength)
    {
        if(name == null || name.isEmpty())
            return "name is empty";

        if(name.length() > maxLength)
            return "name is longer than " + maxLength + " characters";

        boolean letter = false;

        for(int i = 0; i < name.length(); i++)
            letter |= Character.isLetter(name.charAt(i));

        if(!letter)
            return "name contains no letter";

        int round = 0;
        int square = 0;

        for(int i = 0; i < name.length() && round >= 0 && square >= 0; i++)
        {
            switch(name.charAt(i))
            {
                case '(':
                    round++;
                    break;
                case ')':
                    round--;
                    break;
                case '[':
                    square++;
                    break;
                case ']':
                    square--;
                    break;
                default:
                    break;
            }
        }

        if(round != 0 || square != 0)
            return "unbalanced brackets";

        return null;
    }


    /**
     * Scores the completeness of a finished naming session between 0.1 and 1.0, rounded to one decimal place.
     */
    public static double confidence(ContextState state, int maxLength)
    {
        double confidence = 1.0;

        if(state.getParentStructure() == null)
            confidence -= 0.3;

        if(state.getFunctionalGroups().isEmpty())
            confidence -= 0.1;

        confidence -= 0.1 * state.getConflicts().size();

        if(validate(state.getFinalName(), maxLength) != null)
            confidence -= 0.2;

        return Math.round(Math.max(0.1, Math.min(1.0, confidence)) * 10) / 10.0;
    }
}
