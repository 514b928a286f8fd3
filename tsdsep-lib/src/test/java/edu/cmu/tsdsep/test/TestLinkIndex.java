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

import edu.cmu.tsdsep.graph.*;
import org.junit.Test;

import java.util.*;

import static org.junit.Assert.*;

public class TestLinkIndex {

    private LinkIndex index() {
        Map<Integer, List<Link>> links = new HashMap<>();
        links.put(0, Collections.singletonList(new Link(0, -1, 0.5)));
        links.put(1, Arrays.asList(new Link(0, 0, 0.3), new Link(1, -2, 0.0)));
        links.put(2, Collections.singletonList(new Link(1, -1, -0.4, x -> 2 * x)));
        return new LinkIndex(new LinkModel(links));
    }

    @Test
    public void testParents() {
        LinkIndex index = index();

        assertEquals(Collections.singletonList(new LagNode(0, -2)), index.parentsOf(new LagNode(0, -1)));
        assertEquals(Collections.singletonList(new LagNode(0, -1)), index.parentsOf(new LagNode(1, -1)));
        assertEquals(Collections.singletonList(new LagNode(1, -1)), index.parentsOf(new LagNode(2, 0)));
    }

    @Test
    public void testZeroCoefficientIsNoEdge() {
        LinkIndex index = index();

        assertFalse(index.parentsOf(new LagNode(1, 0)).contains(new LagNode(1, -2)));
        assertFalse(index.childrenOf(new LagNode(1, -2)).contains(new LagNode(1, 0)));
    }

    @Test
    public void testExcludeContemporaneous() {
        LinkIndex index = index();

        assertTrue(index.parentsOf(new LagNode(1, 0), true).isEmpty());
        assertEquals(Collections.singletonList(new LagNode(1, -1)), index.parentsOf(new LagNode(2, 0), true));

        assertEquals(Arrays.asList(new LagNode(0, 0), new LagNode(1, -1)), index.childrenOf(new LagNode(0, -1)));
        assertEquals(Collections.singletonList(new LagNode(0, 0)), index.childrenOf(new LagNode(0, -1), true));
    }

    @Test
    public void testChildrenMayLieInTheFuture() {
        LinkIndex index = index();

        assertEquals(Collections.singletonList(new LagNode(2, 1)), index.childrenOf(new LagNode(1, 0)));
    }

    @Test
    public void testFunctionIsCarried() {
        Link link = new Link(1, -1, -0.4, x -> 2 * x);

        assertEquals(6.0, link.getFunction().applyAsDouble(3.0), 0.0);
        assertNull(new Link(1, -1).getFunction());
        assertEquals(1.0, new Link(1, -1).getCoefficient(), 0.0);
    }
}
