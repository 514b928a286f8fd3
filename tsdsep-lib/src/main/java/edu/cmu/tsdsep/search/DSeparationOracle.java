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

import edu.cmu.tsdsep.graph.*;
import edu.cmu.tsdsep.util.Parameters;
import edu.cmu.tsdsep.util.Params;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Oracle of conditional independence X _||_ Y | Z given the true time series graph. X _||_ Y | Z holds iff X and Y are
 * d-separated given Z in the graph. The oracle can be used wherever a statistical independence test is expected; its
 * main use is unit testing of causal discovery methods against ground truth.
 * <p>
 * D-separation is decided in two steps:
 * <ol>
 * <li>The maximum time lag max_lag of any ancestor of X, Y or Z along a directed path that is not blocked by Z and
 * does not repeat a time-shifted link is found. An ancestor X^i_{t-tau_i} with link X^i_{t-tau_i} --&gt;
 * X^j_{t-tau_j} is only counted if X^i_{t'-tau_i} --&gt; X^j_{t'-tau_j} for t' != t has not been counted already.
 * The other parents of a selection node below an ancestor count as ancestors.</li>
 * <li>In the time series graph truncated at 2 * max_lag, a breadth-first search from both X and Y looks for a path that
 * is open given Z.</li>
 * </ol>
 * Results are cached per (X, Y, Z). The cache is safe for concurrent callers, and each distinct query is computed
 * once.
 */
public final class DSeparationOracle implements IndependenceTest {

    private static final Logger LOGGER = LoggerFactory.getLogger(DSeparationOracle.class);

    private final LinkModel model;
    private final AncestorSearch ancestorSearch;
    private final DSeparationSearch dSeparationSearch;
    private final Parameters parameters;

    /**
     * Computed d-separation facts by query.
     */
    private final Map<Query, Boolean> dsepsets = new ConcurrentHashMap<>();

    private final AtomicInteger numSearches = new AtomicInteger();

    private boolean verbose;

    //==========================CONSTRUCTORS=============================//

    public DSeparationOracle(LinkModel model) {
        this(model, new Parameters());
    }

    public DSeparationOracle(LinkModel model, Parameters parameters) {
        if (model == null) {
            throw new OracleConfigurationException("Either links or graph must be specified!");
        }

        this.model = model;
        this.parameters = parameters == null ? new Parameters() : new Parameters(parameters);

        LinkIndex index = new LinkIndex(model);
        this.ancestorSearch = new AncestorSearch(index);
        this.dSeparationSearch = new DSeparationSearch(index);

        setVerbose(this.parameters.getBoolean(Params.VERBOSE));
    }

    /**
     * Builds an oracle from a graph array (DAG or MAG); see {@link GraphCompiler}.
     */
    public static DSeparationOracle fromGraph(String[][][] graph) {
        return fromGraph(graph, new Parameters());
    }

    public static DSeparationOracle fromGraph(String[][][] graph, Parameters parameters) {
        return create(null, null, null, graph, parameters);
    }

    /**
     * Builds an oracle from links if they are given, otherwise from the graph array. The variable lists are only used
     * with links; a graph array brings its own.
     *
     * @throws OracleConfigurationException if neither links nor graph is given, or the variable lists are malformed.
     */
    public static DSeparationOracle create(Map<Integer, List<Link>> links, List<Integer> observedVars,
                                           List<Integer> selectionVars, String[][][] graph,
                                           Parameters parameters) {
        if (parameters == null) {
            parameters = new Parameters();
        }

        LinkModel model;

        if (links != null) {
            model = new LinkModel(links, observedVars, selectionVars);
        } else if (graph != null) {
            GraphCompiler compiler = new GraphCompiler();
            compiler.setVerbose(parameters.getBoolean(Params.VERBOSE));
            model = compiler.compile(graph);
        } else {
            throw new OracleConfigurationException("Either links or graph must be specified!");
        }

        return new DSeparationOracle(model, parameters);
    }

    //==========================PUBLIC METHODS=============================//

    /**
     * Performs the oracle conditional independence test.
     *
     * @param X      Nodes (var, -tau) with var an index into the observed variables.
     * @param Y      Nodes of the same form; one of them must have lag 0.
     * @param Z      Conditioning nodes; may be null.
     * @param tauMax Not used.
     * @return (0, 1) if X and Y are d-separated given Z, otherwise (1, 0).
     * @throws MalformedQueryException if X, Y, Z are not well formed.
     */
    public TestResult runTest(List<LagNode> X, List<LagNode> Y, List<LagNode> Z, int tauMax) {
        Query query = checkXYZ(X, Y, Z);
        boolean cached = dsepsets.containsKey(query);

        TestResult result = isDSeparated(query) ? new TestResult(0.0, 1.0) : new TestResult(1.0, 0.0);

        if (verbose) {
            LOGGER.info("        {}{}", result, cached ? " [cached]" : "");
        }

        return result;
    }

    /**
     * @return 0 if X and Y are d-separated given Z, otherwise 1.
     */
    public double getMeasure(List<LagNode> X, List<LagNode> Y, List<LagNode> Z, int tauMax) {
        return isDSeparated(checkXYZ(X, Y, Z)) ? 0.0 : 1.0;
    }

    /**
     * @return true if X and Y are d-separated given Z. Uses the cache.
     */
    public boolean isDSeparated(List<LagNode> X, List<LagNode> Y, List<LagNode> Z) {
        return isDSeparated(checkXYZ(X, Y, Z));
    }

    /**
     * @return true if X and Y are d-separated given Z in the graph truncated at maxLag. Not cached.
     */
    public boolean isDSeparated(List<LagNode> X, List<LagNode> Y, List<LagNode> Z, int maxLag) {
        return isDSep(checkXYZ(X, Y, Z), checkMaxLag(maxLag));
    }

    public ShortestPathResult getShortestPath(List<LagNode> X, List<LagNode> Y, List<LagNode> Z) {
        return getShortestPath(X, Y, Z, null, false, parameters.getBoolean(Params.BACKDOOR));
    }

    /**
     * Finds a path between X and Y that is open given Z. Paths may run through latent and selection variables, which
     * are left out of the returned observed path.
     *
     * @param maxLag           The lag at which to truncate the graph, or null to find it by ancestor search.
     * @param computeAncestors Whether to also return the ancestors of X, Y and Z up to the max lag. This may take a
     *                         long time.
     * @param backdoor         Whether only paths that start with an arrowhead at x count.
     */
    public ShortestPathResult getShortestPath(List<LagNode> X, List<LagNode> Y, List<LagNode> Z, Integer maxLag,
                                              boolean computeAncestors, boolean backdoor) {
        Query query = checkXYZ(X, Y, Z);

        if (verbose) {
            LOGGER.info("Testing X={} d-sep Y={} given Z={} in TSG", query.x, query.y, query.z);
        }

        int lag = resolveMaxLag(query, maxLag);

        List<LagNode> fullPath = dSeparationSearch.findPath(query.x, query.y, query.z, lag, backdoor);
        List<LagNode> observedPath = null;

        if (fullPath != null) {
            observedPath = new ArrayList<>();

            for (LagNode node : fullPath) {
                if (model.isObserved(node.getVariable())) {
                    observedPath.add(node.withVariable(model.getObservedVars().indexOf(node.getVariable())));
                }
            }
        }

        if (verbose) {
            LOGGER.info("_has_any_path     = {}", fullPath);
            LOGGER.info("_has_any_path_obs = {}", observedPath);
        }

        if (!computeAncestors) {
            return new ShortestPathResult(observedPath, fullPath, lag, null, null, null);
        }

        if (verbose) {
            LOGGER.info("Compute ancestors.");
        }

        // Ancestors up to the maximum ancestral time lag, repeated links included.
        Map<LagNode, List<LagNode>> ancX = ancestorSearch.upToLag(query.x, query.z, lag).getAncestors();
        Map<LagNode, List<LagNode>> ancY = ancestorSearch.upToLag(query.y, query.z, lag).getAncestors();
        Map<LagNode, List<LagNode>> ancZ = ancestorSearch.upToLag(query.z, query.z, lag).getAncestors();

        return new ShortestPathResult(observedPath, fullPath, lag, ancX, ancY, ancZ);
    }

    /**
     * @return twice the maximum non-repeated ancestral time lag of X, Y and Z given Z, where the other parents of
     * selection nodes below an ancestor count as ancestors; the horizon used for the d-separation search when no
     * fixed max lag is set.
     */
    public int getMaxLag(List<LagNode> X, List<LagNode> Y, List<LagNode> Z) {
        return getMaxLagFromXYZ(checkXYZ(X, Y, Z));
    }

    /**
     * Model selection is not available for the oracle.
     *
     * @throws UnsupportedOperationException always.
     */
    public double getModelSelectionCriterion(int j, List<LagNode> parents, int tauMax) {
        throw new UnsupportedOperationException("Model selection not implemented for " + getMeasureName());
    }

    public String getMeasureName() {
        return "oracle_ci";
    }

    public LinkModel getLinkModel() {
        return model;
    }

    /**
     * @return the number of d-separation searches run for cached queries so far.
     */
    public int getNumSearches() {
        return numSearches.get();
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
        ancestorSearch.setVerbose(verbose);
        dSeparationSearch.setVerbose(verbose);
    }

    public String toString() {
        return "Oracle CI test, " + model.getObservedVars().size() + " observed of "
                + model.getNumVariables() + " variables";
    }

    //==========================PRIVATE METHODS============================//

    private boolean isDSeparated(Query query) {
        return dsepsets.computeIfAbsent(query, q -> {
            numSearches.incrementAndGet();
            int fixed = parameters.getInt(Params.MAX_LAG);
            return isDSep(q, fixed >= 0 ? fixed : null);
        });
    }

    private boolean isDSep(Query query, Integer maxLag) {
        if (verbose) {
            LOGGER.info("Testing X={} d-sep Y={} given Z={} in TSG", query.x, query.y, query.z);
        }

        int lag = resolveMaxLag(query, maxLag);
        return !dSeparationSearch.hasAnyPath(query.x, query.y, query.z, lag);
    }

    private int resolveMaxLag(Query query, Integer maxLag) {
        if (maxLag != null) {
            checkMaxLag(maxLag);

            if (verbose) {
                LOGGER.info("Set max. time lag to: {}", maxLag);
            }

            return maxLag;
        }

        return getMaxLagFromXYZ(query);
    }

    private int getMaxLagFromXYZ(Query query) {
        int maxLagX = ancestorSearch.horizon(query.x, query.z);
        int maxLagY = ancestorSearch.horizon(query.y, query.z);
        int maxLagZ = ancestorSearch.horizon(query.z, query.z);

        int maxLag = Math.max(maxLagX, Math.max(maxLagY, maxLagZ));

        if (verbose) {
            LOGGER.info("Max. non-repeated ancestral time lag: {}", maxLag);
        }

        // Twice the longest non-repeated ancestral chain.
        return 2 * maxLag;
    }

    private static int checkMaxLag(int maxLag) {
        if (maxLag < 0) {
            throw new MalformedQueryException("max_lag must be non-negative, but is " + maxLag);
        }

        return maxLag;
    }

    /**
     * Translates X, Y, Z to model indices, removes duplicates, removes from Z what occurs in X or Y, and checks that
     * lags are non-positive, indices are in range and one node of Y has lag zero.
     */
    private Query checkXYZ(List<LagNode> X, List<LagNode> Y, List<LagNode> Z) {
        if (X == null || X.isEmpty()) {
            throw new MalformedQueryException("X must contain at least one node of the form (var, -lag)");
        }

        if (Y == null || Y.isEmpty()) {
            throw new MalformedQueryException("Y must contain at least one node of the form (var, -lag)");
        }

        List<LagNode> x = translate(X);
        List<LagNode> y = translate(Y);
        List<LagNode> z = translate(Z == null ? Collections.<LagNode>emptyList() : Z);

        List<LagNode> _z = new ArrayList<>();

        for (LagNode node : z) {
            if (!x.contains(node) && !y.contains(node)) _z.add(node);
        }

        boolean zeroLag = false;

        for (LagNode node : y) {
            if (node.getLag() == 0) zeroLag = true;
        }

        if (!zeroLag) {
            throw new MalformedQueryException("Y-nodes are " + Y + ", but one of the Y-nodes must have zero lag");
        }

        return new Query(x, y, _z);
    }

    private List<LagNode> translate(List<LagNode> nodes) {
        int numObserved = model.getObservedVars().size();
        Set<LagNode> translated = new LinkedHashSet<>();

        for (LagNode node : nodes) {
            if (node == null) {
                throw new MalformedQueryException("X, Y, Z must be lists of nodes in format [(var, -lag),...], "
                        + "eg., [(2, -2), (1, 0), ...]");
            }

            if (node.getLag() > 0) {
                throw new MalformedQueryException("nodes are " + nodes + ", but all lags must be non-positive");
            }

            if (node.getVariable() < 0 || node.getVariable() >= numObserved) {
                throw new MalformedQueryException("var index " + node.getVariable() + " of " + node
                        + " must be in [0, " + (numObserved - 1) + "]");
            }

            translated.add(node.withVariable(model.toInternal(node.getVariable())));
        }

        return Collections.unmodifiableList(new ArrayList<>(translated));
    }

    /**
     * A checked query (X, Y, Z) in model indices.
     */
    private static final class Query {
        private final List<LagNode> x;
        private final List<LagNode> y;
        private final List<LagNode> z;

        Query(List<LagNode> x, List<LagNode> y, List<LagNode> z) {
            this.x = x;
            this.y = y;
            this.z = Collections.unmodifiableList(z);
        }

        public boolean equals(Object o) {
            if (!(o instanceof Query)) return false;
            Query query = (Query) o;
            return x.equals(query.x) && y.equals(query.y) && z.equals(query.z);
        }

        public int hashCode() {
            return Objects.hash(x, y, z);
        }

        public String toString() {
            return "(" + x + ", " + y + ", " + z + ")";
        }
    }
}
