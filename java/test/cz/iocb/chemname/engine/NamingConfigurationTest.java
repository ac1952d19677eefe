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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import java.util.Properties;
import org.junit.Test;
import cz.iocb.chemname.shared.ConfigurationException;
import cz.iocb.chemname.shared.ConfigurationProperties;



public class NamingConfigurationTest
{
    @Test
    public void testDefaults()
    {
        NamingConfiguration configuration = NamingConfiguration.defaults();

        assertEquals(200, configuration.getMaxNameLength());
        assertEquals(5000, configuration.getMaxCandidateChains());
        assertEquals(10, configuration.getMaxHydrideHeavyAtoms());
        assertTrue(configuration.isTraceSummaries());
    }


    @Test
    public void testLoadResource()
    {
        NamingConfiguration configuration = NamingConfiguration.load("chemname-test.properties");

        assertEquals(64, configuration.getMaxNameLength());
        assertEquals(100, configuration.getMaxCandidateChains());
        assertEquals(4, configuration.getMaxHydrideHeavyAtoms());
        assertFalse(configuration.isTraceSummaries());
    }


    @Test
    public void testMissingPropertiesKeepDefaults()
    {
        Properties properties = new Properties();
        properties.setProperty("chemname.name.maxLength", "80");

        NamingConfiguration configuration = NamingConfiguration.fromProperties(new ConfigurationProperties(properties));

        assertEquals(80, configuration.getMaxNameLength());
        assertEquals(5000, configuration.getMaxCandidateChains());
    }


    @Test(expected = ConfigurationException.class)
    public void testMissingResource()
    {
        NamingConfiguration.load("missing.properties");
    }


    @Test(expected = ConfigurationException.class)
    public void testWrongIntegerValue()
    {
        Properties properties = new Properties();
        properties.setProperty("chemname.chain.maxCandidates", "many");

        NamingConfiguration.fromProperties(new ConfigurationProperties(properties));
    }


    @Test(expected = ConfigurationException.class)
    public void testNonPositiveLimit()
    {
        new NamingConfiguration(0, 100, 10, true);
    }
}
