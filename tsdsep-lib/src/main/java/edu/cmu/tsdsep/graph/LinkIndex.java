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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parent and child lookups on the time-unrolled graph of a link model. Children are precomputed once by inverting
 * the parent links.
 */
public final class LinkIndex {

    private final LinkModel model;

    /**
     * For every variable i the pairs (j, tau) with a link X^i_{t-tau} --> X^j_t, tau >= 0.
     */
    private final List<List<int[]>> children;

    public LinkIndex(LinkModel model) {
        this.model = model;

        int numVars = model.getNumVariables();
        List<List<int[]>> children = new ArrayList<>();

        for (int i = 0; i < numVars; i++) {
            children.add(new ArrayList<int[]>());
        }

        for (int j = 0; j < numVars; j++) {
            for (Link link : model.getLinks(j)) {
                if (link.isEdge()) {
                    children.get(link.getSource()).add(new int[]{j, Math.abs(link.getLag())});
                }
            }
        }

        for (int i = 0; i < numVars; i++) {
            children.set(i, Collections.unmodifiableList(children.get(i)));
        }

        this.children = Collections.unmodifiableList(children);
    }

    public LinkModel getModel() {
        return model;
    }

    public List<LagNode> parentsOf(LagNode node) {
        return parentsOf(node, false);
    }

    /**
     * @param node                   A node (j, lag) with lag <= 0.
     * @param excludeContemporaneous Whether lag-zero links are skipped.
     * @return the parents (i, lag + tau_link) of the node, in the order of the links of j.
     */
    public List<LagNode> parentsOf(LagNode node, boolean excludeContemporaneous) {
        List<LagNode> parents = new ArrayList<>();

        for (Link link : model.getLinks(node.getVariable())) {
            if (!link.isEdge()) continue;
            if (excludeContemporaneous && link.isContemporaneous()) continue;
            parents.add(new LagNode(link.getSource(), node.getLag() + link.getLag()));
        }

        return parents;
    }

    public List<LagNode> childrenOf(LagNode node) {
        return childrenOf(node, false);
    }

    /**
     * @param node                   A node (i, lag) with lag <= 0.
     * @param excludeContemporaneous Whether lag-zero links are skipped.
     * @return the children (j, lag + tau) of the node. Children may lie in the future (lag > 0); callers bound them.
     */
    public List<LagNode> childrenOf(LagNode node, boolean excludeContemporaneous) {
        List<LagNode> result = new ArrayList<>();

        for (int[] child : children.get(node.getVariable())) {
            if (excludeContemporaneous && child[1] == 0) continue;
            result.add(new LagNode(child[0], node.getLag() + child[1]));
        }

        return result;
    }
}
