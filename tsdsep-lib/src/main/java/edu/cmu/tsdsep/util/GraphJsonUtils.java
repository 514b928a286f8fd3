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

package edu.cmu.tsdsep.util;

import com.google.gson.*;
import edu.cmu.tsdsep.graph.LagNode;
import edu.cmu.tsdsep.graph.Link;
import edu.cmu.tsdsep.graph.LinkModel;
import edu.cmu.tsdsep.search.ShortestPathResult;

import java.io.Reader;
import java.util.*;

/**
 * Reads time series graphs from JSON and writes oracle paths to JSON.
 * <p>
 * A graph array is a nested array [[["", "--&gt;"], ...], ...] indexed [source][target][lag]. A links object maps
 * each variable to its incoming links, each written [source, lag], [source, lag, coefficient] or
 * [[source, lag], coefficient]:
 * <pre>
 * {"links": {"0": [[0, -1, 0.5]], "1": [[0, -1], [[1, -1], 0.8]]},
 *  "observed_vars": [0, 1], "selection_vars": []}
 * </pre>
 */
public class GraphJsonUtils {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    public static String[][][] parseGraph(String json) {
        return parseGraph(JsonParser.parseString(json));
    }

    public static String[][][] parseGraph(Reader reader) {
        return parseGraph(JsonParser.parseReader(reader));
    }

    public static LinkModel parseLinkModel(String json) {
        return parseLinkModel(JsonParser.parseString(json));
    }

    public static LinkModel parseLinkModel(Reader reader) {
        return parseLinkModel(JsonParser.parseReader(reader));
    }

    /**
     * Parses a links object of the form {"0": [...], "1": [...]}.
     */
    public static Map<Integer, List<Link>> parseLinks(JsonObject jObj) {
        Map<Integer, List<Link>> links = new TreeMap<>();

        for (Map.Entry<String, JsonElement> entry : jObj.entrySet()) {
            int j;

            try {
                j = Integer.parseInt(entry.getKey().trim());
            } catch (NumberFormatException e) {
                throw new JsonParseException("Links keys must be variable indices, not '" + entry.getKey() + "'", e);
            }

            List<Link> parents = new ArrayList<>();

            for (JsonElement element : entry.getValue().getAsJsonArray()) {
                parents.add(parseLink(element.getAsJsonArray()));
            }

            links.put(j, parents);
        }

        return links;
    }

    public static String toJson(ShortestPathResult result) {
        JsonObject jObj = new JsonObject();
        jObj.addProperty("connected", result.isConnected());
        jObj.addProperty("maxLag", result.getMaxLag());

        if (result.isConnected()) {
            jObj.add("path", nodesToJson(result.getPath()));
            jObj.add("fullPath", nodesToJson(result.getFullPath()));
        } else {
            jObj.add("path", JsonNull.INSTANCE);
        }

        if (result.hasAncestors()) {
            jObj.add("ancestorsOfX", ancestorsToJson(result.getAncestorsOfX()));
            jObj.add("ancestorsOfY", ancestorsToJson(result.getAncestorsOfY()));
            jObj.add("ancestorsOfZ", ancestorsToJson(result.getAncestorsOfZ()));
        }

        return GSON.toJson(jObj);
    }

    //==========================PRIVATE METHODS============================//

    private static String[][][] parseGraph(JsonElement element) {
        String[][][] graph = GSON.fromJson(element, String[][][].class);

        if (graph == null) {
            throw new JsonParseException("Graph must be a nested array of edge symbols.");
        }

        return graph;
    }

    private static LinkModel parseLinkModel(JsonElement element) {
        JsonObject jObj = element.getAsJsonObject();

        if (!jObj.has("links") || jObj.get("links").isJsonNull()) {
            throw new JsonParseException("Expecting a 'links' object.");
        }

        Map<Integer, List<Link>> links = parseLinks(jObj.getAsJsonObject("links"));
        List<Integer> observedVars = parseIntList(jObj, "observed_vars");
        List<Integer> selectionVars = parseIntList(jObj, "selection_vars");

        return new LinkModel(links, observedVars, selectionVars);
    }

    private static Link parseLink(JsonArray jArray) {
        if (jArray.size() > 0 && jArray.get(0).isJsonArray()) {
            JsonArray sourceLag = jArray.get(0).getAsJsonArray();
            double coefficient = jArray.size() > 1 ? jArray.get(1).getAsDouble() : 1.0;
            return new Link(sourceLag.get(0).getAsInt(), sourceLag.get(1).getAsInt(), coefficient);
        }

        if (jArray.size() == 2) {
            return new Link(jArray.get(0).getAsInt(), jArray.get(1).getAsInt());
        } else if (jArray.size() == 3) {
            return new Link(jArray.get(0).getAsInt(), jArray.get(1).getAsInt(), jArray.get(2).getAsDouble());
        }

        throw new JsonParseException("Links must be [source, lag], [source, lag, coefficient] or "
                + "[[source, lag], coefficient], not " + jArray);
    }

    private static List<Integer> parseIntList(JsonObject jObj, String name) {
        if (!jObj.has(name) || jObj.get(name).isJsonNull()) {
            return null;
        }

        List<Integer> list = new ArrayList<>();

        for (JsonElement element : jObj.getAsJsonArray(name)) {
            list.add(element.getAsInt());
        }

        return list;
    }

    private static JsonArray nodesToJson(List<LagNode> nodes) {
        JsonArray jArray = new JsonArray();

        for (LagNode node : nodes) {
            JsonArray pair = new JsonArray();
            pair.add(node.getVariable());
            pair.add(node.getLag());
            jArray.add(pair);
        }

        return jArray;
    }

    private static JsonObject ancestorsToJson(Map<LagNode, List<LagNode>> ancestors) {
        JsonObject jObj = new JsonObject();

        for (Map.Entry<LagNode, List<LagNode>> entry : ancestors.entrySet()) {
            jObj.add(entry.getKey().toString(), nodesToJson(entry.getValue()));
        }

        return jObj;
    }
}
