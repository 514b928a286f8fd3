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

package edu.cmu.tsdsep.test;

import edu.cmu.tsdsep.graph.LagNode;
import edu.cmu.tsdsep.graph.Link;
import edu.cmu.tsdsep.graph.LinkIndex;
import edu.cmu.tsdsep.graph.LinkModel;
import edu.cmu.tsdsep.search.DSeparationSearch;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.junit.Test;

import java.util.*;

import static org.junit.Assert.*;

/**
 * Tests the path search on the truncated time series graph, including a comparison with the moralization criterion
 * on random graphs.
 */
public class TestDSeparationSearch {

    private static final List<LagNode> NONE = Collections.emptyList();

    @Test
    public void testChain() {
        DSeparationSearch search = search(links(new int[][]{{}, {0, 0}, {1, 0}}));

        assertEquals(Arrays.asList(n(0, 0), n(1, 0), n(2, 0)),
                search.findPath(nodes(n(0, 0)), nodes(n(2, 0)), NONE, 0, false));
        assertNull(search.findPath(nodes(n(0, 0)), nodes(n(2, 0)), nodes(n(1, 0)), 0, false));
    }

    @Test
    public void testCollider() {
        DSeparationSearch search = search(links(new int[][]{{}, {0, 0, 2, 0}, {}}));

        assertNull(search.findPath(nodes(n(0, 0)), nodes(n(2, 0)), NONE, 0, false));
        assertEquals(Arrays.asList(n(0, 0), n(1, 0), n(2, 0)),
                search.findPath(nodes(n(0, 0)), nodes(n(2, 0)), nodes(n(1, 0)), 0, false));
    }

    @Test
    public void testColliderOpenedByDescendant() {
        DSeparationSearch search = search(links(new int[][]{{}, {0, 0, 2, 0}, {}, {1, 0}}));

        assertFalse(search.hasAnyPath(nodes(n(0, 0)), nodes(n(2, 0)), NONE, 0));
        assertTrue(search.hasAnyPath(nodes(n(0, 0)), nodes(n(2, 0)), nodes(n(3, 0)), 0));

        List<LagNode> path = search.findPath(nodes(n(0, 0)), nodes(n(2, 0)), nodes(n(3, 0)), 0, false);
        assertEquals(n(0, 0), path.get(0));
        assertEquals(n(2, 0), path.get(path.size() - 1));
        assertTrue(path.contains(n(1, 0)));
    }

    @Test
    public void testAutoregressiveBlockedByPast() {
        DSeparationSearch search = search(links(new int[][]{{0, -1}}));

        assertTrue(search.hasAnyPath(nodes(n(0, -2)), nodes(n(0, 0)), NONE, 3));
        assertFalse(search.hasAnyPath(nodes(n(0, -2)), nodes(n(0, 0)), nodes(n(0, -1)), 3));
    }

    @Test
    public void testHorizonTruncates() {
        // 0 <-- 2 --> 1, with the common cause two steps in the past.
        DSeparationSearch search = search(links(new int[][]{{2, -2}, {2, -2}, {}}));

        assertTrue(search.hasAnyPath(nodes(n(0, 0)), nodes(n(1, 0)), NONE, 2));
        assertFalse(search.hasAnyPath(nodes(n(0, 0)), nodes(n(1, 0)), NONE, 1));
    }

    @Test
    public void testBackdoor() {
        // 0 --> 1 directly and through the confounder 2.
        DSeparationSearch search = search(links(new int[][]{{2, 0}, {0, 0, 2, 0}, {}}));

        assertEquals(Arrays.asList(n(0, 0), n(1, 0)),
                search.findPath(nodes(n(0, 0)), nodes(n(1, 0)), NONE, 0, false));
        assertEquals(Arrays.asList(n(0, 0), n(2, 0), n(1, 0)),
                search.findPath(nodes(n(0, 0)), nodes(n(1, 0)), NONE, 0, true));
        assertNull(search.findPath(nodes(n(0, 0)), nodes(n(1, 0)), nodes(n(2, 0)), 0, true));
    }

    @Test
    public void testBackdoorWithoutConfounder() {
        DSeparationSearch search = search(links(new int[][]{{}, {0, 0}}));

        assertNotNull(search.findPath(nodes(n(0, 0)), nodes(n(1, 0)), NONE, 0, false));
        assertNull(search.findPath(nodes(n(0, 0)), nodes(n(1, 0)), NONE, 0, true));
    }

    @Test
    public void testSelectionVariableIsConditioned() {
        // 0 --> 2 <-- 1 with 2 selected.
        Map<Integer, List<Link>> links = links(new int[][]{{}, {}, {0, 0, 1, 0}});
        LinkModel model = new LinkModel(links, Arrays.asList(0, 1), Collections.singletonList(2));
        DSeparationSearch search = new DSeparationSearch(new LinkIndex(model));

        assertEquals(Arrays.asList(n(0, 0), n(2, 0), n(1, 0)),
                search.findPath(nodes(n(0, 0)), nodes(n(1, 0)), NONE, 0, false));
    }

    @Test
    public void testAddingNonCollidersKeepsSeparation() {
        // 0 --> 1 --> 2 --> 3
        DSeparationSearch search = search(links(new int[][]{{}, {0, 0}, {1, 0}, {2, 0}}));

        List<LagNode> z1 = nodes(n(1, 0));
        List<LagNode> z2 = nodes(n(1, 0), n(2, 0));

        assertFalse(search.hasAnyPath(nodes(n(0, 0)), nodes(n(3, 0)), z1, 0));
        assertFalse(search.hasAnyPath(nodes(n(0, 0)), nodes(n(3, 0)), z2, 0));
        assertFalse(search.hasAnyPath(nodes(n(0, 0)), nodes(n(3, 0)), nodes(n(2, 0)), 0));
    }

    @Test
    public void testAddingCollidersBreaksSeparation() {
        // 0 --> 1 <-- 2, 1 --> 3, 0 --> 4 --> 2
        DSeparationSearch search = search(links(new int[][]{{}, {0, 0, 2, 0}, {4, 0}, {1, 0}, {0, 0}}));

        List<LagNode> x = nodes(n(0, 0));
        List<LagNode> y = nodes(n(2, 0));

        // 4 is a non-collider on the only open path.
        assertFalse(search.hasAnyPath(x, y, nodes(n(4, 0)), 0));

        // Adding the collider 1 or its descendant 3 opens 0 --> 1 <-- 2.
        assertTrue(search.hasAnyPath(x, y, nodes(n(4, 0), n(1, 0)), 0));
        assertTrue(search.hasAnyPath(x, y, nodes(n(4, 0), n(3, 0)), 0));
    }

    @Test
    public void testAnyPairOfSets() {
        // 0 --> 1, 2 isolated.
        DSeparationSearch search = search(links(new int[][]{{}, {0, 0}, {}}));

        assertFalse(search.hasAnyPath(nodes(n(2, 0)), nodes(n(1, 0)), NONE, 0));
        assertTrue(search.hasAnyPath(nodes(n(2, 0), n(0, 0)), nodes(n(1, 0)), NONE, 0));
    }

    @Test
    public void testPathsAreConnected() {
        RandomGenerator random = new MersenneTwister(42);

        for (int trial = 0; trial < 200; trial++) {
            LinkModel model = randomModel(random, 4, 2);
            LinkIndex index = new LinkIndex(model);
            DSeparationSearch search = new DSeparationSearch(index);
            Query query = randomQuery(random, model, 3);

            List<LagNode> path = search.findPath(query.x, query.y, query.z, 3, false);
            if (path == null) continue;

            assertTrue(query.x.contains(path.get(0)));
            assertTrue(query.y.contains(path.get(path.size() - 1)));

            for (int k = 0; k + 1 < path.size(); k++) {
                LagNode a = path.get(k);
                LagNode b = path.get(k + 1);
                assertTrue("Not adjacent: " + a + " " + b + " in " + path,
                        index.parentsOf(a).contains(b) || index.parentsOf(b).contains(a));
            }
        }
    }

    @Test
    public void testSymmetry() {
        RandomGenerator random = new MersenneTwister(17);

        for (int trial = 0; trial < 300; trial++) {
            LinkModel model = randomModel(random, 4, 2);
            DSeparationSearch search = new DSeparationSearch(new LinkIndex(model));
            Query query = randomQuery(random, model, 3);

            assertEquals(search.hasAnyPath(query.x, query.y, query.z, 3),
                    search.hasAnyPath(query.y, query.x, query.z, 3));
        }
    }

    @Test
    public void testAgreesWithMoralization() {
        RandomGenerator random = new MersenneTwister(2020);

        for (int trial = 0; trial < 300; trial++) {
            LinkModel model = randomModel(random, 4, 2);
            DSeparationSearch search = new DSeparationSearch(new LinkIndex(model));
            Query query = randomQuery(random, model, 3);

            boolean connected = search.hasAnyPath(query.x, query.y, query.z, 3);
            boolean expected = moralConnected(model, query, 3);

            assertEquals("Trial " + trial + ": " + model + "\n" + query, expected, connected);
        }
    }

    //==========================PRIVATE METHODS============================//

    private static LagNode n(int var, int lag) {
        return new LagNode(var, lag);
    }

    private static List<LagNode> nodes(LagNode... nodes) {
        return Arrays.asList(nodes);
    }

    private static DSeparationSearch search(Map<Integer, List<Link>> links) {
        return new DSeparationSearch(new LinkIndex(new LinkModel(links)));
    }

    /**
     * Row j lists the parents of j as flattened (source, lag) pairs.
     */
    private static Map<Integer, List<Link>> links(int[][] parents) {
        Map<Integer, List<Link>> links = new HashMap<>();

        for (int j = 0; j < parents.length; j++) {
            List<Link> list = new ArrayList<>();

            for (int k = 0; k < parents[j].length; k += 2) {
                list.add(new Link(parents[j][k], parents[j][k + 1]));
            }

            links.put(j, list);
        }

        return links;
    }

    // Contemporaneous links only go from lower to higher index, so the model is always valid. The last variable is
    // selected in about a third of the models.
    private static LinkModel randomModel(RandomGenerator random, int numVars, int tauMax) {
        Map<Integer, List<Link>> links = new HashMap<>();

        for (int j = 0; j < numVars; j++) {
            List<Link> parents = new ArrayList<>();

            for (int i = 0; i < numVars; i++) {
                for (int tau = 0; tau <= tauMax; tau++) {
                    if (tau == 0 && i >= j) continue;
                    if (random.nextDouble() < 0.2) parents.add(new Link(i, -tau, 0.5));
                }
            }

            links.put(j, parents);
        }

        if (random.nextInt(3) == 0) {
            List<Integer> observed = new ArrayList<>();
            for (int j = 0; j < numVars - 1; j++) observed.add(j);
            return new LinkModel(links, observed, Collections.singletonList(numVars - 1));
        }

        return new LinkModel(links);
    }

    private static Query randomQuery(RandomGenerator random, LinkModel model, int maxLag) {
        int numObserved = model.getObservedVars().size();
        List<LagNode> all = new ArrayList<>();

        for (int var = 0; var < numObserved; var++) {
            for (int lag = 0; lag >= -maxLag; lag--) {
                all.add(n(var, lag));
            }
        }

        Collections.shuffle(all, new Random(random.nextLong()));

        LagNode x = all.get(0);
        LagNode y = all.get(1);
        List<LagNode> z = new ArrayList<>(all.subList(2, 2 + random.nextInt(4)));

        return new Query(Collections.singletonList(x), Collections.singletonList(y), z);
    }

    /**
     * X and Y are d-connected given Z iff they are connected in the moral graph of the ancestral set of X, Y, Z
     * after removing Z. The graph is the time series graph restricted to lags -maxLag..0.
     */
    private static boolean moralConnected(LinkModel model, Query query, int maxLag) {
        LinkIndex index = new LinkIndex(model);

        Set<LagNode> conds = new HashSet<>(query.z);
        for (int s : model.getSelectionVars()) {
            for (int tau = 0; tau <= maxLag; tau++) conds.add(n(s, -tau));
        }
        conds.removeAll(query.x);
        conds.removeAll(query.y);

        Set<LagNode> ancestral = new HashSet<>();
        LinkedList<LagNode> queue = new LinkedList<>();
        queue.addAll(query.x);
        queue.addAll(query.y);
        queue.addAll(conds);

        while (!queue.isEmpty()) {
            LagNode node = queue.removeFirst();
            if (!ancestral.add(node)) continue;

            for (LagNode parent : windowParents(index, node, maxLag)) {
                queue.add(parent);
            }
        }

        Map<LagNode, Set<LagNode>> moral = new HashMap<>();
        for (LagNode node : ancestral) moral.put(node, new HashSet<LagNode>());

        for (LagNode node : ancestral) {
            List<LagNode> parents = windowParents(index, node, maxLag);

            for (LagNode parent : parents) {
                moral.get(node).add(parent);
                moral.get(parent).add(node);
            }

            for (LagNode p1 : parents) {
                for (LagNode p2 : parents) {
                    if (!p1.equals(p2)) moral.get(p1).add(p2);
                }
            }
        }

        Set<LagNode> seen = new HashSet<>(query.x);
        queue = new LinkedList<>(query.x);

        while (!queue.isEmpty()) {
            LagNode node = queue.removeFirst();
            if (query.y.contains(node)) return true;

            for (LagNode next : moral.get(node)) {
                if (!conds.contains(next) && seen.add(next)) queue.add(next);
            }
        }

        return false;
    }

    private static List<LagNode> windowParents(LinkIndex index, LagNode node, int maxLag) {
        List<LagNode> parents = new ArrayList<>();

        for (LagNode parent : index.parentsOf(node)) {
            if (parent.getLag() >= -maxLag) parents.add(parent);
        }

        return parents;
    }

    private static final class Query {
        private final List<LagNode> x;
        private final List<LagNode> y;
        private final List<LagNode> z;

        Query(List<LagNode> x, List<LagNode> y, List<LagNode> z) {
            this.x = x;
            this.y = y;
            this.z = z;
        }

        public String toString() {
            return "X = " + x + " Y = " + y + " Z = " + z;
        }
    }
}
