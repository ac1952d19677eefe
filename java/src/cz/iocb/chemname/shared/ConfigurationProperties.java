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

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;



public class ConfigurationProperties
{
    private final Properties properties = new Properties();


    public ConfigurationProperties(String path) throws IOException
    {
        try(Reader reader = new InputStreamReader(new FileInputStream(path), StandardCharsets.UTF_8))
        {
            properties.load(reader);
        }
    }


    public ConfigurationProperties(Properties properties)
    {
        this.properties.putAll(properties);
    }


    public static ConfigurationProperties fromResource(String resource) throws IOException
    {
        try(InputStream stream = ConfigurationProperties.class.getClassLoader().getResourceAsStream(resource))
        {
            if(stream == null)
                throw new IOException("resource " + resource + " not found");

            Properties properties = new Properties();
            properties.load(new InputStreamReader(stream, StandardCharsets.UTF_8));
            return new ConfigurationProperties(properties);
        }
    }


    public boolean hasProperty(String name)
    {
        return properties.getProperty(name) != null;
    }


    public String getProperty(String name)
    {
        String value = properties.getProperty(name);

        if(value == null)
            throw new ConfigurationException("property '" + name + "' is not set");

        return value.trim();
    }


    public String getProperty(String name, String defaultValue)
    {
        String value = properties.getProperty(name);
        return value == null ? defaultValue : value.trim();
    }


    public int getIntProperty(String name)
    {
        String value = getProperty(name);

        try
        {
            return Integer.parseInt(value);
        }
        catch(NumberFormatException e)
        {
            throw new ConfigurationException("property '" + name + "' has wrong integer value '" + value + "'", e);
        }
    }


    public int getIntProperty(String name, int defaultValue)
    {
        return hasProperty(name) ? getIntProperty(name) : defaultValue;
    }


    public double getDoubleProperty(String name)
    {
        String value = getProperty(name);

        try
        {
            return Double.parseDouble(value);
        }
        catch(NumberFormatException e)
        {
            throw new ConfigurationException("property '" + name + "' has wrong numeric value '" + value + "'", e);
        }
    }


    public boolean getBooleanProperty(String name)
    {
        String value = getProperty(name);

        if(value.equalsIgnoreCase("true"))
            return true;
        else if(value.equalsIgnoreCase("false"))
            return false;

        throw new ConfigurationException("property '" + name + "' has wrong boolean value '" + value + "'");
    }


    public boolean getBooleanProperty(String name, boolean defaultValue)
    {
        return hasProperty(name) ? getBooleanProperty(name) : defaultValue;
    }
}
