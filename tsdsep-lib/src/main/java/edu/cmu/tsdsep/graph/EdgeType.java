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

package edu.cmu.tsdsep.graph;

/**
 * The edge symbols that may appear in a cell of a time series graph array. A cell (i, j, tau) describes the edge
 * between variable i at lag -tau and variable j at lag 0, read from i to j.
 */
public enum EdgeType {
    DIRECTED("-->"),
    REVERSE_DIRECTED("<--"),
    BIDIRECTED("<->"),
    UNDIRECTED("---");

    private final String symbol;

    EdgeType(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * @return the same edge read from the other endpoint.
     */
    public EdgeType reverse() {
        switch (this) {
            case DIRECTED:
                return REVERSE_DIRECTED;
            case REVERSE_DIRECTED:
                return DIRECTED;
            default:
                return this;
        }
    }

    /**
     * @return true if the edge type may be used for tau > 0.
     */
    public boolean isAllowedLagged() {
        return this != REVERSE_DIRECTED;
    }

    /**
     * @return the edge type with the given symbol, or null if the symbol is not one of the four edge symbols.
     */
    public static EdgeType fromSymbol(String symbol) {
        for (EdgeType type : values()) {
            if (type.symbol.equals(symbol)) {
                return type;
            }
        }

        return null;
    }

    public String toString() {
        return symbol;
    }
}
