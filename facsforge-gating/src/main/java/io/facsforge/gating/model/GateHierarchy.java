package io.facsforge.gating.model;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * An immutable, single-rooted tree of gates stored as an arena.
 *
 * <h2>Structure</h2>
 *
 * <pre>{@code
 *  id  parent  path
 *  0   -1      All Events          (ungated root)
 *  1    0      Lymphocytes
 *  2    1      Lymphocytes/Singlets
 *  3    2      Lymphocytes/Singlets/CD3+
 *  4    0      Debris
 * }</pre>
 *
 * <p>Nodes are linked by integer id rather than object references. After
 * {@link Builder#build()} ids are dense and in depth-first pre-order, so iterating
 * {@code 0..size()-1} visits every parent before its children, with siblings in
 * source order.
 *
 * <p>A root with a shape is part of the path of its descendants; an ungated root is
 * not, since it stands for "all events".
 */
public final class GateHierarchy {

    private final List<GateNode> nodes;
    private final Map<String, Integer> idsByPath;

    private GateHierarchy(List<GateNode> nodes) {
        this.nodes = Collections.unmodifiableList(nodes);
        Map<String, Integer> byPath = new LinkedHashMap<>();
        for (GateNode node : nodes) {
            byPath.put(node.path(), node.id());
        }
        this.idsByPath = Collections.unmodifiableMap(byPath);
    }

    /**
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the root node
     */
    public GateNode root() {
        return nodes.get(0);
    }

    /**
     * @param id arena index
     * @return the node
     * @throws IndexOutOfBoundsException for an unknown id
     */
    public GateNode node(int id) {
        return nodes.get(id);
    }

    /**
     * @return the number of nodes including the root
     */
    public int size() {
        return nodes.size();
    }

    /**
     * @return all nodes in depth-first pre-order
     */
    public List<GateNode> depthFirst() {
        return nodes;
    }

    /**
     * @param id a node id
     * @return its children in source order
     */
    public List<GateNode> children(int id) {
        List<GateNode> children = new ArrayList<>();
        for (int childId : nodes.get(id).childIds()) {
            children.add(nodes.get(childId));
        }
        return children;
    }

    /**
     * @param id a node id
     * @return its parent, empty for the root
     */
    public Optional<GateNode> parent(int id) {
        int parentId = nodes.get(id).parentId();
        return parentId == GateNode.NO_PARENT ? Optional.empty() : Optional.of(nodes.get(parentId));
    }

    /**
     * @param path a population path
     * @return the node with that path
     */
    public Optional<GateNode> findByPath(String path) {
        Integer id = idsByPath.get(path);
        return id == null ? Optional.empty() : Optional.of(nodes.get(id));
    }

    /**
     * @return every channel referenced by a gate shape or marker rule, in first-use order
     */
    public Set<String> channels() {
        Set<String> channels = new LinkedHashSet<>();
        for (GateNode node : nodes) {
            channels.addAll(node.channels());
            channels.addAll(node.markerRules().channels());
        }
        return channels;
    }

    /**
     * @return channels referenced by marker rules only
     */
    public Set<String> markerChannels() {
        Set<String> channels = new LinkedHashSet<>();
        for (GateNode node : nodes) {
            channels.addAll(node.markerRules().channels());
        }
        return channels;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (GateNode node : nodes) {
            int depth = 0;
            for (int p = node.parentId(); p != GateNode.NO_PARENT; p = nodes.get(p).parentId()) {
                depth++;
            }
            sb.append("  ".repeat(depth)).append(node.name());
            if (node.shape() != null) {
                sb.append(" ").append(node.shape());
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Collects node declarations and validates them into a {@link GateHierarchy}.
     *
     * <p>Declarations carry caller-chosen ids and parent ids, in any order, so trees can
     * be assembled straight from documents that link populations by reference.
     * {@link #build()} rejects:
     * <ul>
     *   <li>zero or several roots</li>
     *   <li>an id declared twice</li>
     *   <li>a parent id that was never declared</li>
     *   <li>cycles</li>
     *   <li>a gate-less node other than the root</li>
     *   <li>blank names, names containing {@code /}, and duplicate sibling names</li>
     * </ul>
     */
    public static final class Builder {

        private final List<Declaration> declarations = new ArrayList<>();
        private int nextId = 0;

        private Builder() {
        }

        /**
         * Declares a node with the next free id.
         *
         * @return the id to use as {@code parentId} for children
         */
        public int add(int parentId, String name, GateShape shape) {
            return add(parentId, name, shape, MarkerRules.none());
        }

        /**
         * Declares a node with marker rules and the next free id.
         *
         * @return the id to use as {@code parentId} for children
         */
        public int add(int parentId, String name, GateShape shape, MarkerRules rules) {
            int id = nextId;
            declare(id, parentId, name, shape, rules);
            return id;
        }

        /**
         * Declares a node with an explicit id.
         *
         * @param id       caller-chosen id, must be unique
         * @param parentId the parent's id, or {@link GateNode#NO_PARENT} for the root
         * @param name     population name
         * @param shape    gate region, null only for the root
         * @param rules    marker rules, may be null
         * @return this builder
         */
        public Builder declare(int id, int parentId, String name, GateShape shape, MarkerRules rules) {
            declarations.add(new Declaration(id, parentId, name, shape, rules == null ? MarkerRules.none() : rules));
            nextId = Math.max(nextId, id + 1);
            return this;
        }

        /**
         * @return the validated, renumbered hierarchy
         * @throws InvalidHierarchyException if the declarations do not form a valid tree
         */
        public GateHierarchy build() {
            Map<Integer, Declaration> byId = new HashMap<>();
            Map<Integer, List<Declaration>> childrenOf = new HashMap<>();
            Declaration root = null;

            for (Declaration d : declarations) {
                if (byId.put(d.id, d) != null) {
                    throw new InvalidHierarchyException("Node id " + d.id + " is declared more than once");
                }
                if (d.name == null || d.name.isBlank()) {
                    throw new InvalidHierarchyException("Node " + d.id + " has no name");
                }
                if (d.name.contains("/")) {
                    throw new InvalidHierarchyException("Population name '" + d.name + "' must not contain '/'");
                }
                if (d.parentId == GateNode.NO_PARENT) {
                    if (root != null) {
                        throw new InvalidHierarchyException(
                            "Gate tree has more than one root: '" + root.name + "' and '" + d.name + "'");
                    }
                    root = d;
                } else {
                    if (d.shape == null) {
                        throw new InvalidHierarchyException("Population '" + d.name + "' has no gate");
                    }
                    childrenOf.computeIfAbsent(d.parentId, k -> new ArrayList<>()).add(d);
                }
            }
            if (root == null) {
                throw new InvalidHierarchyException(declarations.isEmpty()
                    ? "Gate tree is empty" : "Gate tree has no root (every node has a parent)");
            }
            for (Declaration d : declarations) {
                if (d.parentId != GateNode.NO_PARENT && !byId.containsKey(d.parentId)) {
                    throw new InvalidHierarchyException(
                        "Population '" + d.name + "' references parent id " + d.parentId + ", which does not exist");
                }
            }

            // pre-order walk; anything not reached hangs off a cycle
            List<Declaration> order = new ArrayList<>();
            Map<Integer, Integer> newIds = new HashMap<>();
            Deque<Declaration> stack = new ArrayDeque<>();
            stack.push(root);
            while (!stack.isEmpty()) {
                Declaration d = stack.pop();
                newIds.put(d.id, order.size());
                order.add(d);
                List<Declaration> children = childrenOf.getOrDefault(d.id, List.of());
                Set<String> siblingNames = new HashSet<>();
                for (Declaration child : children) {
                    if (!siblingNames.add(child.name)) {
                        throw new InvalidHierarchyException(
                            "Population '" + d.name + "' has two children named '" + child.name + "'");
                    }
                }
                for (int i = children.size() - 1; i >= 0; i--) {
                    stack.push(children.get(i));
                }
            }
            if (order.size() != declarations.size()) {
                List<String> stranded = new ArrayList<>();
                for (Declaration d : declarations) {
                    if (!newIds.containsKey(d.id)) {
                        stranded.add(d.name);
                    }
                }
                throw new InvalidHierarchyException("Gate tree contains a cycle through " + stranded);
            }

            List<GateNode> nodes = new ArrayList<>(order.size());
            for (Declaration d : order) {
                int id = newIds.get(d.id);
                int parentId = d.parentId == GateNode.NO_PARENT ? GateNode.NO_PARENT : newIds.get(d.parentId);
                List<Integer> childIds = new ArrayList<>();
                for (Declaration child : childrenOf.getOrDefault(d.id, List.of())) {
                    childIds.add(newIds.get(child.id));
                }
                String path;
                if (parentId == GateNode.NO_PARENT) {
                    path = d.name;
                } else {
                    GateNode parent = nodes.get(parentId);
                    boolean parentInPath = !parent.isRoot() || parent.shape() != null;
                    path = parentInPath ? parent.path() + "/" + d.name : d.name;
                }
                nodes.add(new GateNode(id, d.name, path, d.shape, parentId, childIds, d.rules));
            }
            Set<String> paths = new HashSet<>();
            for (GateNode node : nodes) {
                if (!paths.add(node.path())) {
                    throw new InvalidHierarchyException("Population path '" + node.path() + "' is not unique");
                }
            }
            return new GateHierarchy(nodes);
        }

        private static final class Declaration {
            final int id;
            final int parentId;
            final String name;
            final GateShape shape;
            final MarkerRules rules;

            Declaration(int id, int parentId, String name, GateShape shape, MarkerRules rules) {
                this.id = id;
                this.parentId = parentId;
                this.name = name;
                this.shape = shape;
                this.rules = rules;
            }
        }
    }
}
