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
 * Searches the time series graph, truncated at a maximum lag, for a path that d-connects a node of X with a node of Y
 * given a set of conditions. Selection variables are conditioned on at every lag of the truncated graph.
 * <p>
 * The search is breadth-first from both ends and meets in the middle; at every round the smaller fringe is walked.
 * Paths may only pass through the motifs &lt;-- v &lt;--, &lt;-- v --&gt;, --&gt; v --&gt; with v unconditioned, and
 * --&gt; [v] &lt;-- with v conditioned on. Every node (v, t) on a path satisfies -maxLag &lt;= t &lt;= 0.
 */
public final class DSeparationSearch {

    private static final Logger LOGGER = LoggerFactory.getLogger(DSeparationSearch.class);

    /**
     * How a path ends at a node. START marks the endpoints x and y themselves.
     */
    public enum Mark {START, TAIL, ARROWHEAD}

    private final LinkIndex index;
    private final List<Integer> selectionVars;
    private boolean verbose = false;

    //==========================CONSTRUCTORS=============================//

    public DSeparationSearch(LinkIndex index) {
        this.index = index;
        this.selectionVars = index.getModel().getSelectionVars();
    }

    //==========================PUBLIC METHODS=============================//

    /**
     * @return true if some x in X and some y in Y are d-connected given conds.
     */
    public boolean hasAnyPath(List<LagNode> X, List<LagNode> Y, List<LagNode> conds, int maxLag) {
        return findPath(X, Y, conds, maxLag, false) != null;
    }

    /**
     * @param X        Start nodes.
     * @param Y        End nodes.
     * @param conds    Conditioning nodes; members of X or Y are ignored. May be null.
     * @param maxLag   The lag at which the graph is truncated.
     * @param backdoor Whether only paths that leave x into one of its parents count.
     * @return the first d-connecting path found, from some x to some y inclusive, or null if X and Y are d-separated
     * given conds in the truncated graph. The path includes latent and selection nodes.
     */
    public List<LagNode> findPath(List<LagNode> X, List<LagNode> Y, List<LagNode> conds, int maxLag,
                                  boolean backdoor) {
        if (maxLag < 0) {
            throw new IllegalArgumentException("max_lag must be non-negative: " + maxLag);
        }

        Set<LagNode> _conds = new HashSet<>();

        if (conds != null) {
            for (LagNode z : conds) {
                if (!X.contains(z) && !Y.contains(z)) _conds.add(z);
            }
        }

        for (int s : selectionVars) {
            for (int tau = 0; tau <= maxLag; tau++) {
                _conds.add(new LagNode(s, -tau));
            }
        }

        for (LagNode x : X) {
            for (LagNode y : Y) {
                List<LagNode> path = new PairSearch(x, y, _conds, maxLag, backdoor).search();

                if (path != null) {
                    return path;
                }
            }
        }

        return null;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    //==========================PRIVATE METHODS============================//

    /**
     * A node together with the mark with which a walk arrived at it.
     */
    private static final class MarkedNode {
        private final LagNode node;
        private final Mark mark;

        MarkedNode(LagNode node, Mark mark) {
            this.node = node;
            this.mark = mark;
        }

        public boolean equals(Object o) {
            if (!(o instanceof MarkedNode)) return false;
            MarkedNode other = (MarkedNode) o;
            return node.equals(other.node) && mark == other.mark;
        }

        public int hashCode() {
            return 31 * node.hashCode() + mark.hashCode();
        }

        public String toString() {
            return "(" + node + ", " + mark + ")";
        }
    }

    /**
     * The bidirectional search for a single pair (x, y).
     */
    private final class PairSearch {
        private final LagNode x;
        private final LagNode y;
        private final Set<LagNode> conds;
        private final int maxLag;
        private final boolean backdoor;

        // For every visited node and arrival mark, the state it was reached from, walking from x (pred) or from
        // y (succ). The start state maps to null.
        private final Map<LagNode, EnumMap<Mark, MarkedNode>> pred = new HashMap<>();
        private final Map<LagNode, EnumMap<Mark, MarkedNode>> succ = new HashMap<>();

        private LagNode connection = null;
        private Mark predMark = null;
        private Mark succMark = null;

        PairSearch(LagNode x, LagNode y, Set<LagNode> conds, int maxLag, boolean backdoor) {
            this.x = x;
            this.y = y;
            this.conds = conds;
            this.maxLag = maxLag;
            this.backdoor = backdoor;
        }

        List<LagNode> search() {
            pred.put(x, marks(Mark.START, null));
            succ.put(y, marks(Mark.START, null));

            List<MarkedNode> forwardFringe = new ArrayList<>();
            forwardFringe.add(new MarkedNode(x, Mark.START));
            List<MarkedNode> reverseFringe = new ArrayList<>();
            reverseFringe.add(new MarkedNode(y, Mark.START));

            while (!forwardFringe.isEmpty() && !reverseFringe.isEmpty()) {
                if (forwardFringe.size() <= reverseFringe.size()) {
                    if (LOGGER.isTraceEnabled()) {
                        LOGGER.trace("Walk from X since len(X_fringe)={} <= len(Y_fringe)={}",
                                forwardFringe.size(), reverseFringe.size());
                    }

                    List<MarkedNode> thisLevel = forwardFringe;
                    forwardFringe = new ArrayList<>();
                    walkFringe(thisLevel, forwardFringe, pred, succ);
                } else {
                    if (LOGGER.isTraceEnabled()) {
                        LOGGER.trace("Walk from Y since len(X_fringe)={} > len(Y_fringe)={}",
                                forwardFringe.size(), reverseFringe.size());
                    }

                    List<MarkedNode> thisLevel = reverseFringe;
                    reverseFringe = new ArrayList<>();
                    walkFringe(thisLevel, reverseFringe, succ, pred);
                }

                if (connection != null) {
                    List<LagNode> path = backtracePath();

                    if (verbose) {
                        LOGGER.info("Found connection {} on path {}", connection, path);
                    }

                    return path;
                }
            }

            return null;
        }

        private void walkFringe(List<MarkedNode> thisLevel, List<MarkedNode> fringe,
                                Map<LagNode, EnumMap<Mark, MarkedNode>> thisPath,
                                Map<LagNode, EnumMap<Mark, MarkedNode>> otherPath) {
            if (backdoor && thisLevel.size() == 1 && thisLevel.get(0).equals(new MarkedNode(x, Mark.START))) {
                walkToParents(thisLevel.get(0), fringe, thisPath, otherPath);
                return;
            }

            for (MarkedNode current : thisLevel) {
                LagNode v = current.node;
                Mark mark = current.mark;

                if (conds.contains(v)) {
                    // --> [v] <-- : only parents.
                    if (mark == Mark.ARROWHEAD || mark == Mark.START) {
                        if (walkToParents(current, fringe, thisPath, otherPath)) return;
                    }
                } else if (mark == Mark.TAIL || mark == Mark.START) {
                    // <-- v <-- or <-- v --> : parents and children.
                    if (walkToParents(current, fringe, thisPath, otherPath)) return;
                    if (walkToChildren(current, fringe, thisPath, otherPath)) return;
                } else {
                    // --> v --> : only children.
                    if (walkToChildren(current, fringe, thisPath, otherPath)) return;
                }
            }
        }

        private boolean walkToParents(MarkedNode current, List<MarkedNode> fringe,
                                      Map<LagNode, EnumMap<Mark, MarkedNode>> thisPath,
                                      Map<LagNode, EnumMap<Mark, MarkedNode>> otherPath) {
            LagNode v = current.node;

            for (LagNode w : index.parentsOf(v)) {
                if (backdoor && w.equals(x)) continue;

                // Conditioned parents block the path.
                if (conds.contains(w) || !inHorizon(w)) continue;

                EnumMap<Mark, MarkedNode> marks = thisPath.get(w);

                if (marks == null || (!marks.containsKey(Mark.TAIL) && !marks.containsKey(Mark.START))) {
                    if (LOGGER.isTraceEnabled()) {
                        LOGGER.trace("Walk parent: {} --> {}", v, w);
                    }

                    fringe.add(new MarkedNode(w, Mark.TAIL));

                    if (marks == null) {
                        thisPath.put(w, marks(Mark.TAIL, current));
                    } else {
                        marks.put(Mark.TAIL, current);
                    }
                }

                // w is unconditioned and left with a tail, so it composes with any mark from the other side.
                EnumMap<Mark, MarkedNode> other = otherPath.get(w);

                if (other != null) {
                    connect(w, Mark.TAIL, other.keySet().iterator().next(), thisPath);
                    return true;
                }
            }

            return false;
        }

        private boolean walkToChildren(MarkedNode current, List<MarkedNode> fringe,
                                       Map<LagNode, EnumMap<Mark, MarkedNode>> thisPath,
                                       Map<LagNode, EnumMap<Mark, MarkedNode>> otherPath) {
            LagNode v = current.node;

            for (LagNode w : index.childrenOf(v)) {
                if (!inHorizon(w)) continue;

                EnumMap<Mark, MarkedNode> marks = thisPath.get(w);

                if (marks == null || (!marks.containsKey(Mark.ARROWHEAD) && !marks.containsKey(Mark.START))) {
                    if (LOGGER.isTraceEnabled()) {
                        LOGGER.trace("Walk child:  {} --> {}", v, w);
                    }

                    fringe.add(new MarkedNode(w, Mark.ARROWHEAD));

                    if (marks == null) {
                        thisPath.put(w, marks(Mark.ARROWHEAD, current));
                    } else {
                        marks.put(Mark.ARROWHEAD, current);
                    }
                }

                // w is entered with an arrowhead: a tail on the other side needs w unconditioned, an arrowhead on
                // the other side needs w conditioned.
                EnumMap<Mark, MarkedNode> other = otherPath.get(w);

                if (other != null) {
                    boolean conditioned = conds.contains(w);
                    Mark otherMark = null;

                    if (other.containsKey(Mark.START)) {
                        otherMark = Mark.START;
                    } else if (other.containsKey(Mark.TAIL) && !conditioned) {
                        otherMark = Mark.TAIL;
                    } else if (other.containsKey(Mark.ARROWHEAD) && conditioned) {
                        otherMark = Mark.ARROWHEAD;
                    }

                    if (otherMark != null) {
                        connect(w, Mark.ARROWHEAD, otherMark, thisPath);
                        return true;
                    }
                }
            }

            return false;
        }

        private boolean inHorizon(LagNode w) {
            return w.getLag() <= 0 && -w.getLag() <= maxLag;
        }

        // The walk on this side ends in w with the given mark, or w is where this side started.
        private void connect(LagNode w, Mark thisMark, Mark otherMark,
                             Map<LagNode, EnumMap<Mark, MarkedNode>> thisPath) {
            if (thisPath.get(w).containsKey(Mark.START)) {
                thisMark = Mark.START;
            }

            connection = w;

            if (thisPath == pred) {
                predMark = thisMark;
                succMark = otherMark;
            } else {
                predMark = otherMark;
                succMark = thisMark;
            }
        }

        /**
         * Walks the predecessors from the connection back to x, then the successors forward to y.
         */
        private List<LagNode> backtracePath() {
            int limit = 2 * (maxLag + 1) * index.getModel().getNumVariables() + 2;

            List<LagNode> path = new ArrayList<>();
            path.add(connection);
            walk(path, pred, new MarkedNode(connection, predMark), limit);
            Collections.reverse(path);
            walk(path, succ, new MarkedNode(connection, succMark), limit);

            return path;
        }

        private void walk(List<LagNode> path, Map<LagNode, EnumMap<Mark, MarkedNode>> links, MarkedNode state,
                          int limit) {
            int steps = 0;
            MarkedNode previous = links.get(state.node).get(state.mark);

            while (previous != null) {
                if (++steps > limit) {
                    throw new IllegalStateException("Could not trace path from " + connection + " within "
                            + limit + " steps.");
                }

                path.add(previous.node);
                previous = links.get(previous.node).get(previous.mark);
            }
        }

        private EnumMap<Mark, MarkedNode> marks(Mark mark, MarkedNode predecessor) {
            EnumMap<Mark, MarkedNode> marks = new EnumMap<>(Mark.class);
            marks.put(mark, predecessor);
            return marks;
        }
    }
}
