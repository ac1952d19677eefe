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

import java.io.IOException;
import cz.iocb.chemname.shared.ConfigurationException;
import cz.iocb.chemname.shared.ConfigurationProperties;



public class NamingConfiguration
{
    public static final String DEFAULT_RESOURCE = "chemname.properties";

    private final int maxNameLength;
    private final int maxCandidateChains;
    private final int maxHydrideHeavyAtoms;
    private final boolean traceSummaries;


    public NamingConfiguration(int maxNameLength, int maxCandidateChains, int maxHydrideHeavyAtoms,
            boolean traceSummaries)
    {
        if(maxNameLength < 1 || maxCandidateChains < 1 || maxHydrideHeavyAtoms < 1)
            throw new ConfigurationException("configuration limits must be positive");

        this.maxNameLength = maxNameLength;
        this.maxCandidateChains = maxCandidateChains;
        this.maxHydrideHeavyAtoms = maxHydrideHeavyAtoms;
        this.traceSummaries = traceSummaries;
    }


    public static NamingConfiguration defaults()
    {
        return new NamingConfiguration(200, 5000, 10, true);
    }


    public static NamingConfiguration fromProperties(ConfigurationProperties properties)
    {
        NamingConfiguration defaults = defaults();

        return new NamingConfiguration(properties.getIntProperty("chemname.name.maxLength", defaults.maxNameLength),
                properties.getIntProperty("chemname.chain.maxCandidates", defaults.maxCandidateChains),
                properties.getIntProperty("chemname.hydride.maxHeavyAtoms", defaults.maxHydrideHeavyAtoms),
                properties.getBooleanProperty("chemname.trace.summaries", defaults.traceSummaries));
    }


    /**
     * Loads the configuration from a classpath resource.
     */
    public static NamingConfiguration load(String resource)
    {
        try
        {
            return fromProperties(ConfigurationProperties.fromResource(resource));
        }
        catch(IOException e)
        {
            throw new ConfigurationException("cannot load configuration " + resource, e);
        }
    }


    public static NamingConfiguration load()
    {
        return load(DEFAULT_RESOURCE);
    }


    public int getMaxNameLength()
    {
        return maxNameLength;
    }


    public int getMaxCandidateChains()
    {
        return maxCandidateChains;
    }


    public int getMaxHydrideHeavyAtoms()
    {
        return maxHydrideHeavyAtoms;
    }


    public boolean isTraceSummaries()
    {
        return traceSummaries;
    }
}
