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
package cz.iocb.chemname.shared;

import java.util.Comparator;



/**
 * Alphanumerical ordering of substituent prefixes. Locants, enclosing marks and punctuation are ignored, so that a
 * compound prefix such as "(dimethylamino)" is alphabetized under its first letter.
 */
public class Alphanumerics
{
    public static final Comparator<String> COMPARATOR = Comparator.comparing(Alphanumerics::key)
            .thenComparing(Comparator.naturalOrder());


    public static String key(String prefix)
    {
        StringBuilder builder = new StringBuilder(prefix.length());

        for(char c : prefix.toLowerCase().toCharArray())
            if(c >= 'a' && c <= 'z')
                builder.append(c);

        return builder.toString();
    }
}
