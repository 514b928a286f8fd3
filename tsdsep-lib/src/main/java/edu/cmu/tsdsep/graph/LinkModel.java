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

import java.util.*;

/**
 * The causal model of a stationary time series graph: for every variable j the list of its incoming links
 * ((i, -tau), coefficient). The model is shift-invariant, so a link holds between X^i_{t-tau} and X^j_t for all t.
 * <p>
 * Variables are indexed 0..N-1. Some of them may be unobserved (latent) and some may be selection variables, which
 * are conditioned on at every lag. Contemporaneous links must not form a cycle; lagged links may.
 * <p>
 * Instances are immutable.
 */
public final class LinkModel {

    /**
     * Incoming links per variable, in the order given.
     */
    private final List<List<Link>> links;

    /**
     * Indices of the observed variables, sorted. Query indices refer to positions in this list.
     */
    private final List<Integer> observedVars;

    /**
     * Indices of the selection variables, sorted.
     */
    private final List<Integer> selectionVars;

    //==========================CONSTRUCTORS=============================//

    /**
     * Constructs a model in which every variable is observed and none is selected.
     */
    public LinkModel(Map<Integer, List<Link>> links) {
        this(links, null, null);
    }

    /**
     * @param links         Incoming links for each variable; the keys must be exactly 0..N-1.
     * @param observedVars  The observed variables, or null if all variables are observed.
     * @param selectionVars The selection variables, or null if there are none.
     */
    public LinkModel(Map<Integer, List<Link>> links, List<Integer> observedVars, List<Integer> selectionVars) {
        if (links == null) {
            throw new OracleConfigurationException("Links must be specified.");
        }

        int numVars = links.size();
        List<List<Link>> _links = new ArrayList<>();

        for (int j = 0; j < numVars; j++) {
            if (!links.containsKey(j)) {
                throw new OracleConfigurationException("Links must have keys 0.." + (numVars - 1)
                        + " but key " + j + " is missing.");
            }

            List<Link> parents = links.get(j) == null ? Collections.<Link>emptyList() : links.get(j);

            for (Link link : parents) {
                if (link.getSource() < 0 || link.getSource() >= numVars) {
                    throw new OracleConfigurationException("Link " + link + " of variable " + j
                            + " has a source outside [0, " + (numVars - 1) + "].");
                }

                if (link.getLag() > 0) {
                    throw new OracleConfigurationException("Link " + link + " of variable " + j
                            + " has a positive lag; lags must be non-positive.");
                }
            }

            _links.add(Collections.unmodifiableList(new ArrayList<>(parents)));
        }

        this.links = Collections.unmodifiableList(_links);

        if (observedVars == null) {
            List<Integer> all = new ArrayList<>();
            for (int j = 0; j < numVars; j++) all.add(j);
            this.observedVars = Collections.unmodifiableList(all);
        } else {
            checkVarList("observed_vars", observedVars, numVars);
            this.observedVars = Collections.unmodifiableList(new ArrayList<>(observedVars));
        }

        if (selectionVars == null) {
            this.selectionVars = Collections.emptyList();
        } else {
            checkVarList("selection_vars", selectionVars, numVars);
            this.selectionVars = Collections.unmodifiableList(new ArrayList<>(selectionVars));
        }

        checkContemporaneousAcyclic();
    }

    //==========================PUBLIC METHODS=============================//

    /**
     * @return the number of variables, including latent and selection variables.
     */
    public int getNumVariables() {
        return links.size();
    }

    /**
     * @return the incoming links of variable j.
     */
    public List<Link> getLinks(int j) {
        return links.get(j);
    }

    public List<Integer> getObservedVars() {
        return observedVars;
    }

    public List<Integer> getSelectionVars() {
        return selectionVars;
    }

    public boolean isObserved(int variable) {
        return Collections.binarySearch(observedVars, variable) >= 0;
    }

    public boolean isSelection(int variable) {
        return Collections.binarySearch(selectionVars, variable) >= 0;
    }

    /**
     * @return the internal index of the observed variable at the given position.
     */
    public int toInternal(int observedIndex) {
        return observedVars.get(observedIndex);
    }

    public String toString() {
        StringBuilder buf = new StringBuilder();

        for (int j = 0; j < links.size(); j++) {
            buf.append(j).append(": ").append(links.get(j)).append("\n");
        }

        buf.append("observed = ").append(observedVars).append("\n");
        buf.append("selected = ").append(selectionVars);
        return buf.toString();
    }

    //==========================PRIVATE METHODS============================//

    private static void checkVarList(String name, List<Integer> vars, int numVars) {
        Set<Integer> seen = new HashSet<>();
        int previous = Integer.MIN_VALUE;

        for (Integer var : vars) {
            if (var == null || var < 0 || var >= numVars) {
                throw new OracleConfigurationException(name + " must be subset of range(" + numVars + ").");
            }

            if (!seen.add(var)) {
                throw new OracleConfigurationException(name + " must not contain duplicates.");
            }

            if (var < previous) {
                throw new OracleConfigurationException(name + " must be ordered.");
            }

            previous = var;
        }
    }

    // Kahn's algorithm over the nonzero lag-zero links.
    private void checkContemporaneousAcyclic() {
        int numVars = links.size();
        int[] inDegree = new int[numVars];
        List<List<Integer>> children = new ArrayList<>();
        for (int j = 0; j < numVars; j++) children.add(new ArrayList<Integer>());

        for (int j = 0; j < numVars; j++) {
            for (Link link : links.get(j)) {
                if (link.isEdge() && link.isContemporaneous()) {
                    children.get(link.getSource()).add(j);
                    inDegree[j]++;
                }
            }
        }

        LinkedList<Integer> queue = new LinkedList<>();
        for (int j = 0; j < numVars; j++) {
            if (inDegree[j] == 0) queue.add(j);
        }

        int visited = 0;

        while (!queue.isEmpty()) {
            int i = queue.removeFirst();
            visited++;

            for (int j : children.get(i)) {
                if (--inDegree[j] == 0) queue.add(j);
            }
        }

        if (visited < numVars) {
            throw new OracleConfigurationException("Contemporaneous links form a cycle.");
        }
    }
}
