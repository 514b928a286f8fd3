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

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Compiles a time series graph array of shape [N][N][tau_max + 1] into a link model. The array may describe a DAG or
 * a maximal ancestral graph (MAG). Every "&lt;-&gt;" cell gets a fresh latent variable that is a parent of both
 * endpoints, and every "---" cell gets a fresh selection variable that is a child of both endpoints. This is the
 * canonical DAG of the MAG (Richardson and Spirtes 2002), so d-separation in the compiled model is m-separation in the
 * array.
 * <p>
 * Cell (i, j, tau) describes the edge between X^i_{t-tau} and X^j_t. Lag-zero cells must come in consistent pairs
 * (e.g. "--&gt;" at (i, j, 0) requires "&lt;--" at (j, i, 0)) and are compiled once. Lagged cells may only hold
 * "--&gt;", "&lt;-&gt;" or "---". Empty or null cells mean no edge.
 */
public final class GraphCompiler {

    private static final Logger LOGGER = LoggerFactory.getLogger(GraphCompiler.class);

    private boolean verbose = false;

    //==========================PUBLIC METHODS=============================//

    /**
     * @param graph The graph array, indexed [source][target][lag].
     * @return the compiled link model. The first N variables are the observed ones; latent and selection variables
     * follow in the order their cells are encountered.
     * @throws GraphCompilationException if the array is malformed.
     */
    public LinkModel compile(String[][][] graph) {
        int numVars = checkShape(graph);
        int tauMax = numVars == 0 ? -1 : graph[0][0].length - 1;

        Map<Integer, List<Link>> links = new LinkedHashMap<>();
        List<Integer> observedVars = new ArrayList<>();
        List<Integer> selectionVars = new ArrayList<>();

        for (int j = 0; j < numVars; j++) {
            links.put(j, new ArrayList<Link>());
            observedVars.add(j);
        }

        // Synthetic variables are appended after the observed ones.
        int nextFreeIndex = numVars;

        for (int i = 0; i < numVars; i++) {
            for (int j = 0; j < numVars; j++) {
                for (int tau = 0; tau <= tauMax; tau++) {
                    EdgeType edgeType = edgeType(graph, i, j, tau);
                    if (edgeType == null) continue;

                    if (tau == 0) {
                        EdgeType reverse = edgeType(graph, j, i, 0);

                        if (reverse == null || reverse.reverse() != edgeType) {
                            throw new InconsistentGraphException("graph needs to have consistent lag-zero patterns "
                                    + "(eg graph[i][j][0]='-->' requires graph[j][i][0]='<--'), but graph["
                                    + i + "][" + j + "][0]='" + edgeType + "' and graph[" + j + "][" + i
                                    + "][0]='" + (reverse == null ? "" : reverse.getSymbol()) + "'");
                        }

                        // Each contemporaneous pair once.
                        if (j <= i) continue;
                    } else if (!edgeType.isAllowedLagged()) {
                        throw new InvalidLaggedEdgeException("Lagged links can only be in ['-->', '<->', '---'], "
                                + "but graph[" + i + "][" + j + "][" + tau + "]='" + edgeType + "'");
                    }

                    switch (edgeType) {
                        case DIRECTED:
                            links.get(j).add(new Link(i, -tau));
                            break;
                        case REVERSE_DIRECTED:
                            links.get(i).add(new Link(j, -tau));
                            break;
                        case BIDIRECTED:
                            int latent = nextFreeIndex++;
                            links.put(latent, new ArrayList<Link>());
                            links.get(i).add(new Link(latent, 0));
                            links.get(j).add(new Link(latent, -tau));

                            if (verbose) {
                                LOGGER.info("Latent variable {} for {} {} {} at lag {}", latent, i, edgeType, j, tau);
                            }
                            break;
                        case UNDIRECTED:
                            int selection = nextFreeIndex++;
                            List<Link> parents = new ArrayList<>();
                            parents.add(new Link(i, -tau));
                            parents.add(new Link(j, 0));
                            links.put(selection, parents);
                            selectionVars.add(selection);

                            if (verbose) {
                                LOGGER.info("Selection variable {} for {} {} {} at lag {}", selection, i, edgeType, j, tau);
                            }
                            break;
                        default:
                            throw new IllegalStateException("Unexpected edge type: " + edgeType);
                    }
                }
            }
        }

        return new LinkModel(links, observedVars, selectionVars);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    //==========================PRIVATE METHODS============================//

    private static int checkShape(String[][][] graph) {
        if (graph == null) {
            throw new GraphCompilationException("Graph must be specified.");
        }

        int numVars = graph.length;
        int numLags = -1;

        for (int i = 0; i < numVars; i++) {
            if (graph[i] == null || graph[i].length != numVars) {
                throw new GraphCompilationException("Graph must have shape [N][N][tau_max + 1] but row " + i
                        + " does not have " + numVars + " entries.");
            }

            for (int j = 0; j < numVars; j++) {
                if (graph[i][j] == null || graph[i][j].length == 0) {
                    throw new GraphCompilationException("Graph cell [" + i + "][" + j + "] has no lags.");
                }

                if (numLags == -1) {
                    numLags = graph[i][j].length;
                } else if (graph[i][j].length != numLags) {
                    throw new GraphCompilationException("Graph must have the same number of lags in every cell, "
                            + "but cell [" + i + "][" + j + "] has " + graph[i][j].length + " instead of " + numLags);
                }
            }
        }

        return numVars;
    }

    private static EdgeType edgeType(String[][][] graph, int i, int j, int tau) {
        String symbol = graph[i][j][tau];

        if (StringUtils.isBlank(symbol)) {
            return null;
        }

        EdgeType edgeType = EdgeType.fromSymbol(symbol.trim());

        if (edgeType == null) {
            throw new GraphCompilationException("Unrecognized edge type '" + symbol + "' at graph[" + i + "]["
                    + j + "][" + tau + "]; expected one of -->, <--, <->, ---");
        }

        return edgeType;
    }
}
