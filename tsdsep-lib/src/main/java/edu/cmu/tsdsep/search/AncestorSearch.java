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
import edu.cmu.tsdsep.graph.LinkIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Finds the ancestors of nodes in the time-unrolled graph along directed paths that are not blocked by a set of
 * conditions. Selection variables count as conditions at every lag from 0 up to the bound of the search.
 * <p>
 * In mode NON_REPEATING an ancestor X^i_{t-tau_i} reached over the link X^i_{t-tau_i} --> X^j_{t-tau_j} is only
 * included if no time-shifted copy X^i_{t'-tau_i} --> X^j_{t'-tau_j} of that link has been followed before for the
 * same seed. The most lagged ancestor then gives the maximum ancestral time lag, which is what the d-separation
 * search needs as its horizon. In mode MAX_LAG all ancestors up to a given lag are included.
 */
public final class AncestorSearch {

    private static final Logger LOGGER = LoggerFactory.getLogger(AncestorSearch.class);

    public enum Mode {NON_REPEATING, MAX_LAG}

    private final LinkIndex index;
    private final List<Integer> selectionVars;
    private boolean verbose = false;

    //==========================CONSTRUCTORS=============================//

    public AncestorSearch(LinkIndex index) {
        this.index = index;
        this.selectionVars = index.getModel().getSelectionVars();
    }

    //==========================PUBLIC METHODS=============================//

    /**
     * Ancestors without repeated links; the returned max lag is the maximum ancestral time lag.
     */
    public Result nonRepeating(List<LagNode> seeds, List<LagNode> conds) {
        return search(seeds, conds, Mode.NON_REPEATING, null);
    }

    /**
     * All ancestors with lag >= -maxLag.
     */
    public Result upToLag(List<LagNode> seeds, List<LagNode> conds, int maxLag) {
        return search(seeds, conds, Mode.MAX_LAG, maxLag);
    }

    /**
     * @param seeds  The nodes whose ancestors are wanted.
     * @param conds  Nodes that block directed paths; seeds among them are ignored. May be null.
     * @param mode   How far back ancestors are followed.
     * @param maxLag The bound in mode MAX_LAG; ignored in mode NON_REPEATING.
     * @return the ancestors of every seed, in discovery order, and the max lag.
     * @throws MissingBoundException if mode is MAX_LAG and maxLag is null.
     */
    public Result search(List<LagNode> seeds, List<LagNode> conds, Mode mode, Integer maxLag) {
        return search(seeds, conds, mode, maxLag, false);
    }

    /**
     * The maximum ancestral time lag of the seeds given conds, in mode NON_REPEATING, where for every selection node
     * S below a found node v the other parents w of S are followed too. Selection nodes are always conditioned on,
     * so v --&gt; ... --&gt; [S] &lt;-- w is open.
     */
    public int horizon(List<LagNode> seeds, List<LagNode> conds) {
        return search(seeds, conds, Mode.NON_REPEATING, null, true).getMaxLag();
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    //==========================PRIVATE METHODS============================//

    private Result search(List<LagNode> seeds, List<LagNode> conds, Mode mode, Integer maxLag,
                          boolean throughSelection) {
        int bound;

        if (mode == Mode.NON_REPEATING) {
            bound = 0;
        } else {
            if (maxLag == null) {
                throw new MissingBoundException("max_lag must be set in mode = 'max_lag'");
            }

            if (maxLag < 0) {
                throw new IllegalArgumentException("max_lag must be non-negative: " + maxLag);
            }

            bound = maxLag;
        }

        Set<LagNode> blocked = new HashSet<>();

        if (conds != null) {
            for (LagNode z : conds) {
                if (!seeds.contains(z)) blocked.add(z);
            }
        }

        for (int s : selectionVars) {
            for (int tau = 0; tau <= bound; tau++) {
                blocked.add(new LagNode(s, -tau));
            }
        }

        Map<LagNode, List<LagNode>> ancestors = new LinkedHashMap<>();

        for (LagNode y : seeds) {
            if (ancestors.containsKey(y)) continue;

            if (mode == Mode.NON_REPEATING) {
                bound = Math.max(bound, Math.abs(y.getLag()));
            }

            List<LagNode> found = new ArrayList<>();
            Set<LagNode> foundSet = new HashSet<>();
            Set<LinkShape> seenLinks = new HashSet<>();

            List<LagNode> thisLevel = Collections.singletonList(y);

            while (!thisLevel.isEmpty()) {
                List<LagNode> nextLevel = new ArrayList<>();

                for (LagNode v : thisLevel) {
                    List<LagNode[]> steps = new ArrayList<>();

                    for (LagNode parent : index.parentsOf(v)) {
                        steps.add(new LagNode[]{parent, v});
                    }

                    if (throughSelection) {
                        for (LagNode s : selectionDescendants(v)) {
                            for (LagNode spouse : index.parentsOf(s)) {
                                if (!spouse.equals(v) && !spouse.equals(y)) steps.add(new LagNode[]{spouse, s});
                            }
                        }
                    }

                    for (LagNode[] step : steps) {
                        LagNode parent = step[0];
                        if (blocked.contains(parent) || foundSet.contains(parent)) continue;

                        LinkShape shape = new LinkShape(parent, step[1]);

                        if (mode == Mode.NON_REPEATING) {
                            if (seenLinks.contains(shape)) continue;
                            bound = Math.max(bound, Math.abs(parent.getLag()));
                        } else if (Math.abs(parent.getLag()) > bound) {
                            continue;
                        }

                        found.add(parent);
                        foundSet.add(parent);
                        nextLevel.add(parent);
                        seenLinks.add(shape);
                    }
                }

                thisLevel = nextLevel;
            }

            ancestors.put(y, Collections.unmodifiableList(found));

            if (verbose) {
                LOGGER.info("Ancestors of {}: {}", y, found);
            }
        }

        return new Result(ancestors, bound);
    }

    // Selection nodes reachable from v along directed paths that stay at lags <= 0.
    private List<LagNode> selectionDescendants(LagNode v) {
        List<LagNode> found = new ArrayList<>();
        Set<LagNode> seen = new HashSet<>();
        LinkedList<LagNode> queue = new LinkedList<>();
        queue.add(v);
        seen.add(v);

        while (!queue.isEmpty()) {
            LagNode node = queue.removeFirst();

            for (LagNode child : index.childrenOf(node)) {
                if (child.getLag() > 0 || !seen.add(child)) continue;

                if (isSelection(child)) {
                    found.add(child);
                } else {
                    queue.add(child);
                }
            }
        }

        return found;
    }

    private boolean isSelection(LagNode node) {
        return index.getModel().isSelection(node.getVariable());
    }

    //==========================CLASSES====================================//

    /**
     * The ancestors found for each seed, and the max lag of the search.
     */
    public static final class Result {
        private final Map<LagNode, List<LagNode>> ancestors;
        private final int maxLag;

        Result(Map<LagNode, List<LagNode>> ancestors, int maxLag) {
            this.ancestors = Collections.unmodifiableMap(ancestors);
            this.maxLag = maxLag;
        }

        public Map<LagNode, List<LagNode>> getAncestors() {
            return ancestors;
        }

        public List<LagNode> getAncestors(LagNode seed) {
            List<LagNode> list = ancestors.get(seed);
            return list == null ? Collections.<LagNode>emptyList() : list;
        }

        /**
         * @return in mode NON_REPEATING the largest |lag| among the seeds and their ancestors; in mode MAX_LAG the
         * bound that was given.
         */
        public int getMaxLag() {
            return maxLag;
        }
    }

    /**
     * A link up to time shift: the two variables and the distance in time between them.
     */
    private static final class LinkShape {
        private final int from;
        private final int to;
        private final int distance;

        LinkShape(LagNode parent, LagNode child) {
            this.from = parent.getVariable();
            this.to = child.getVariable();
            this.distance = Math.abs(child.getLag() - parent.getLag());
        }

        public boolean equals(Object o) {
            if (!(o instanceof LinkShape)) return false;
            LinkShape shape = (LinkShape) o;
            return from == shape.from && to == shape.to && distance == shape.distance;
        }

        public int hashCode() {
            return Objects.hash(from, to, distance);
        }
    }
}
