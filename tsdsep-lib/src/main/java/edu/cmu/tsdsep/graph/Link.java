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

import java.util.function.DoubleUnaryOperator;

/**
 * An incoming link of a variable: the source variable, the relative lag at which the source acts (never positive)
 * and a coefficient. Only links with a nonzero coefficient are edges of the graph. The generating function is carried
 * along for simulation code and plays no role in d-separation.
 */
public final class Link {

    private final int source;
    private final int lag;
    private final double coefficient;
    private final DoubleUnaryOperator function;

    //==========================CONSTRUCTORS=============================//

    public Link(int source, int lag) {
        this(source, lag, 1.0, null);
    }

    public Link(int source, int lag, double coefficient) {
        this(source, lag, coefficient, null);
    }

    public Link(int source, int lag, double coefficient, DoubleUnaryOperator function) {
        this.source = source;
        this.lag = lag;
        this.coefficient = coefficient;
        this.function = function;
    }

    //==========================PUBLIC METHODS=============================//

    public int getSource() {
        return source;
    }

    /**
     * @return the lag of the source relative to the target, <= 0.
     */
    public int getLag() {
        return lag;
    }

    public double getCoefficient() {
        return coefficient;
    }

    /**
     * @return the generating function, or null if none was given.
     */
    public DoubleUnaryOperator getFunction() {
        return function;
    }

    public boolean isEdge() {
        return coefficient != 0.0;
    }

    public boolean isContemporaneous() {
        return lag == 0;
    }

    public String toString() {
        return "((" + source + ", " + lag + "), " + coefficient + ")";
    }
}
