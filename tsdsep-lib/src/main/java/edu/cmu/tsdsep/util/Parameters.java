///////////////////////////////////////////////////////////////////////////////
// For information as to what this class does, see the Javadoc, below.       //
// Copyright (C) 1998, 1999, 2000, 2001, 2002, 2003, 2004, 2005, 2006,       //
// 2007, 2008, 2009, 2010, 2014, 2015 by Peter Spirtes, Richard Scheines, Joseph   //
// Ramsey, and Clark Glymour.                                                //
//                                                                           //
// This program is free software; you can redistribute it and/or modify      //
// it under the terms of the GNU General Public License as published by      //
// the Free Software Foundation; either version 2 of the License, or         //
// (at your option) any later version.                                       //
//                                                                           //
// This program is distributed in the hope that it will be useful,           //
// but WITHOUT ANY WARRANTY; without even the implied warranty of            //
// MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the             //
// GNU General Public License for more details.                              //
//                                                                           //
// You should have received a copy of the GNU General Public License         //
// along with this program; if not, write to the Free Software               //
// Foundation, Inc., 59 Temple Place, Suite 330, Boston, MA  02111-1307  USA //
///////////////////////////////////////////////////////////////////////////////

package edu.cmu.tsdsep.util;

import java.io.IOException;
import java.io.InputStream;
import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Stores parameter values by name. Values that have not been set fall back to the defaults in
 * tsdsep-defaults.properties.
 */
public class Parameters implements Serializable {

    static final long serialVersionUID = 23L;

    private static final String DEFAULTS_RESOURCE = "/tsdsep-defaults.properties";

    private static final Properties DEFAULTS = loadDefaults();

    private final Map<String, Object> parameters = new LinkedHashMap<>();

    //==========================CONSTRUCTORS=============================//

    public Parameters() {
    }

    public Parameters(Parameters parameters) {
        this.parameters.putAll(parameters.parameters);
    }

    //==========================PUBLIC METHODS=============================//

    public void set(String name, Object value) {
        if (name == null) {
            throw new IllegalArgumentException("Parameter name must not be null.");
        }

        parameters.put(name, value);
    }

    /**
     * @return the value set for the parameter, or its default as a string.
     * @throws IllegalArgumentException if the parameter was never set and has no default.
     */
    public Object get(String name) {
        if (parameters.containsKey(name)) {
            return parameters.get(name);
        }

        String value = DEFAULTS.getProperty(name);

        if (value == null) {
            throw new IllegalArgumentException("Unrecognized parameter: " + name);
        }

        return value.trim();
    }

    public int getInt(String name) {
        Object value = get(name);

        if (value instanceof Number) {
            return ((Number) value).intValue();
        }

        try {
            return Integer.parseInt(String.valueOf(value));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Parameter " + name + " is not an integer: " + value, e);
        }
    }

    public boolean getBoolean(String name) {
        Object value = get(name);

        if (value instanceof Boolean) {
            return (Boolean) value;
        }

        String s = String.valueOf(value);

        if ("true".equalsIgnoreCase(s)) return true;
        if ("false".equalsIgnoreCase(s)) return false;

        throw new IllegalArgumentException("Parameter " + name + " is not a boolean: " + value);
    }

    public String toString() {
        return "Parameters" + parameters + " defaults" + DEFAULTS;
    }

    //==========================PRIVATE METHODS============================//

    private static Properties loadDefaults() {
        Properties defaults = new Properties();

        try (InputStream in = Parameters.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing resource " + DEFAULTS_RESOURCE);
            }

            defaults.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Could not read " + DEFAULTS_RESOURCE, e);
        }

        return defaults;
    }
}
