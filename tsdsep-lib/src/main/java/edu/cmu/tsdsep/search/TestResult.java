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

import java.util.Locale;

/**
 * The outcome of a conditional independence test: test statistic value and p-value.
 */
public final class TestResult {

    private final double value;
    private final double pValue;

    public TestResult(double value, double pValue) {
        this.value = value;
        this.pValue = pValue;
    }

    public double getValue() {
        return value;
    }

    public double getPValue() {
        return pValue;
    }

    /**
     * @return true if the test did not reject independence at the given significance level.
     */
    public boolean isIndependent(double alpha) {
        return pValue > alpha;
    }

    public boolean equals(Object o) {
        if (!(o instanceof TestResult)) return false;
        TestResult result = (TestResult) o;
        return Double.compare(value, result.value) == 0 && Double.compare(pValue, result.pValue) == 0;
    }

    public int hashCode() {
        return 31 * Double.hashCode(value) + Double.hashCode(pValue);
    }

    public String toString() {
        return String.format(Locale.US, "val = %.3f | pval = %.5f", value, pValue);
    }
}
