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

package edu.cmu.tsdsep.search;

import edu.cmu.tsdsep.graph.LagNode;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A path between X and Y given Z as found by {@link DSeparationOracle#getShortestPath}, or the fact that there is
 * none. The observed path uses observed variable indices, like the query; the full path and the ancestor maps use the
 * indices of the compiled model, latent and selection variables included.
 */
public final class ShortestPathResult {

    private final List<LagNode> path;
    private final List<LagNode> fullPath;
    private final int maxLag;
    private final Map<LagNode, List<LagNode>> ancestorsOfX;
    private final Map<LagNode, List<LagNode>> ancestorsOfY;
    private final Map<LagNode, List<LagNode>> ancestorsOfZ;

    ShortestPathResult(List<LagNode> path, List<LagNode> fullPath, int maxLag,
                       Map<LagNode, List<LagNode>> ancestorsOfX,
                       Map<LagNode, List<LagNode>> ancestorsOfY,
                       Map<LagNode, List<LagNode>> ancestorsOfZ) {
        this.path = path == null ? null : Collections.unmodifiableList(path);
        this.fullPath = fullPath == null ? null : Collections.unmodifiableList(fullPath);
        this.maxLag = maxLag;
        this.ancestorsOfX = ancestorsOfX;
        this.ancestorsOfY = ancestorsOfY;
        this.ancestorsOfZ = ancestorsOfZ;
    }

    public boolean isConnected() {
        return path != null;
    }

    /**
     * @return the path restricted to observed variables, or null if X and Y are d-separated given Z.
     */
    public List<LagNode> getPath() {
        return path;
    }

    /**
     * @return the path including latent and selection nodes, or null if there is none.
     */
    public List<LagNode> getFullPath() {
        return fullPath;
    }

    /**
     * @return the lag at which the graph was truncated for the search.
     */
    public int getMaxLag() {
        return maxLag;
    }

    /**
     * @return the ancestors of each x up to the max lag, or null if ancestors were not computed.
     */
    public Map<LagNode, List<LagNode>> getAncestorsOfX() {
        return ancestorsOfX;
    }

    public Map<LagNode, List<LagNode>> getAncestorsOfY() {
        return ancestorsOfY;
    }

    public Map<LagNode, List<LagNode>> getAncestorsOfZ() {
        return ancestorsOfZ;
    }

    public boolean hasAncestors() {
        return ancestorsOfX != null;
    }

    public String toString() {
        return isConnected() ? "path = " + path + " (max lag " + maxLag + ")" : "no path (max lag " + maxLag + ")";
    }
}
