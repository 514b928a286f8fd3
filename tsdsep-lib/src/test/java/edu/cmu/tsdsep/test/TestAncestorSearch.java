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
import edu.cmu.tsdsep.search.AncestorSearch;
import edu.cmu.tsdsep.search.MissingBoundException;
import org.junit.Test;

import java.util.*;

import static org.junit.Assert.*;

public class TestAncestorSearch {

    @Test
    public void testChainHorizon() {
        for (int length = 1; length <= 5; length++) {
            Map<Integer, List<Link>> links = new HashMap<>();
            links.put(0, Collections.<Link>emptyList());

            for (int j = 1; j <= length; j++) {
                links.put(j, Collections.singletonList(new Link(j - 1, -1)));
            }

            AncestorSearch search = new AncestorSearch(new LinkIndex(new LinkModel(links)));
            LagNode y = new LagNode(length, 0);
            AncestorSearch.Result result = search.nonRepeating(Collections.singletonList(y), null);

            assertEquals(length, result.getMaxLag());
            assertEquals(length, result.getAncestors(y).size());
            assertEquals(new LagNode(0, -length), result.getAncestors(y).get(length - 1));
        }
    }

    @Test
    public void testRepeatedLinksAreNotFollowed() {
        Map<Integer, List<Link>> links = new HashMap<>();
        links.put(0, Collections.singletonList(new Link(0, -1)));
        links.put(1, Arrays.asList(new Link(0, -1), new Link(1, -1)));

        AncestorSearch search = new AncestorSearch(new LinkIndex(new LinkModel(links)));

        LagNode y = new LagNode(1, 0);
        AncestorSearch.Result result = search.nonRepeating(Collections.singletonList(y), null);

        assertEquals(Arrays.asList(new LagNode(0, -1), new LagNode(1, -1), new LagNode(0, -2)),
                result.getAncestors(y));
        assertEquals(2, result.getMaxLag());
    }

    @Test
    public void testSeedLagCountsTowardsHorizon() {
        Map<Integer, List<Link>> links = new HashMap<>();
        links.put(0, Collections.<Link>emptyList());

        AncestorSearch search = new AncestorSearch(new LinkIndex(new LinkModel(links)));
        AncestorSearch.Result result = search.nonRepeating(Collections.singletonList(new LagNode(0, -4)), null);

        assertEquals(4, result.getMaxLag());
        assertTrue(result.getAncestors(new LagNode(0, -4)).isEmpty());
    }

    @Test
    public void testConditionsBlock() {
        Map<Integer, List<Link>> links = new HashMap<>();
        links.put(0, Collections.<Link>emptyList());
        links.put(1, Collections.singletonList(new Link(0, -1)));
        links.put(2, Collections.singletonList(new Link(1, -1)));
        links.put(3, Collections.singletonList(new Link(2, -1)));

        AncestorSearch search = new AncestorSearch(new LinkIndex(new LinkModel(links)));
        LagNode y = new LagNode(3, 0);

        AncestorSearch.Result result = search.nonRepeating(Collections.singletonList(y),
                Collections.singletonList(new LagNode(1, -2)));

        assertEquals(Collections.singletonList(new LagNode(2, -1)), result.getAncestors(y));
        assertEquals(1, result.getMaxLag());
    }

    @Test
    public void testSeedsAreNotConditions() {
        Map<Integer, List<Link>> links = new HashMap<>();
        links.put(0, Collections.<Link>emptyList());
        links.put(1, Collections.singletonList(new Link(0, -1)));

        AncestorSearch search = new AncestorSearch(new LinkIndex(new LinkModel(links)));
        List<LagNode> seeds = Arrays.asList(new LagNode(1, 0), new LagNode(0, -1));

        AncestorSearch.Result result = search.nonRepeating(seeds, seeds);

        assertEquals(Collections.singletonList(new LagNode(0, -1)), result.getAncestors(new LagNode(1, 0)));
    }

    @Test
    public void testSelectionVariablesBlock() {
        Map<Integer, List<Link>> links = new HashMap<>();
        links.put(0, Collections.singletonList(new Link(2, 0)));
        links.put(1, Collections.<Link>emptyList());
        links.put(2, Collections.singletonList(new Link(1, 0)));

        LinkModel model = new LinkModel(links, Arrays.asList(0, 1), Collections.singletonList(2));
        AncestorSearch search = new AncestorSearch(new LinkIndex(model));

        LagNode y = new LagNode(0, 0);
        assertTrue(search.nonRepeating(Collections.singletonList(y), null).getAncestors(y).isEmpty());
        assertTrue(search.upToLag(Collections.singletonList(y), null, 2).getAncestors(y).isEmpty());
    }

    @Test
    public void testUpToLag() {
        Map<Integer, List<Link>> links = new HashMap<>();
        links.put(0, Collections.singletonList(new Link(0, -1)));

        AncestorSearch search = new AncestorSearch(new LinkIndex(new LinkModel(links)));
        LagNode y = new LagNode(0, 0);

        AncestorSearch.Result result = search.upToLag(Collections.singletonList(y), null, 3);

        assertEquals(Arrays.asList(new LagNode(0, -1), new LagNode(0, -2), new LagNode(0, -3)),
                result.getAncestors(y));
        assertEquals(3, result.getMaxLag());

        assertEquals(Collections.singletonList(new LagNode(0, -1)),
                search.nonRepeating(Collections.singletonList(y), null).getAncestors(y));
    }

    @Test
    public void testHorizonFollowsSelection() {
        // 2 is selected with parents (1, -1) and (0, 0); 1 --> 1 at lag one.
        Map<Integer, List<Link>> links = new HashMap<>();
        links.put(0, Collections.<Link>emptyList());
        links.put(1, Collections.singletonList(new Link(1, -1)));
        links.put(2, Arrays.asList(new Link(1, -1), new Link(0, 0)));

        LinkModel model = new LinkModel(links, Arrays.asList(0, 1), Collections.singletonList(2));
        AncestorSearch search = new AncestorSearch(new LinkIndex(model));
        List<LagNode> seeds = Collections.singletonList(new LagNode(0, 0));

        assertEquals(0, search.nonRepeating(seeds, null).getMaxLag());
        assertEquals(2, search.horizon(seeds, null));

        // Conditioning on the other parent blocks the walk there.
        assertEquals(0, search.horizon(seeds, Collections.singletonList(new LagNode(1, -1))));
    }

    @Test(expected = MissingBoundException.class)
    public void testMaxLagModeNeedsBound() {
        Map<Integer, List<Link>> links = new HashMap<>();
        links.put(0, Collections.singletonList(new Link(0, -1)));

        new AncestorSearch(new LinkIndex(new LinkModel(links)))
                .search(Collections.singletonList(new LagNode(0, 0)), null, AncestorSearch.Mode.MAX_LAG, null);
    }
}
