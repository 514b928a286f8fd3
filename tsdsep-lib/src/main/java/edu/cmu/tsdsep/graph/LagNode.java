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
 * A vertex of the time-unrolled graph: a variable index together with a non-positive lag, where lag 0 stands for the
 * present. Lags are not checked here; queries are validated by the oracle before nodes reach the searches.
 */
public final class LagNode {

    private final int variable;
    private final int lag;

    public LagNode(int variable, int lag) {
        this.variable = variable;
        this.lag = lag;
    }

    public int getVariable() {
        return variable;
    }

    public int getLag() {
        return lag;
    }

    /**
     * @return this node moved to a different variable index at the same lag.
     */
    public LagNode withVariable(int variable) {
        return new LagNode(variable, lag);
    }

    public boolean equals(Object o) {
        if (o == this) return true;
        if (!(o instanceof LagNode)) return false;
        LagNode node = (LagNode) o;
        return variable == node.variable && lag == node.lag;
    }

    public int hashCode() {
        return 31 * variable + lag;
    }

    public String toString() {
        return "(" + variable + ", " + lag + ")";
    }
}
