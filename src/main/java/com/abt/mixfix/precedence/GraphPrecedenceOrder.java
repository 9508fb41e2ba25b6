package com.abt.mixfix.precedence;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.graph.GraphBuilder;
import com.google.common.graph.Graphs;
import com.google.common.graph.MutableGraph;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * {@link PrecedenceOrder} backed by a directed graph with an edge
 * {@code lo -> hi} for every declared inequality.
 *
 * {@code a <= b} holds when {@code b} is reachable from {@code a}, when some
 * position reachable from {@code a} is a declared bottom, or when {@code b}
 * is reachable from a declared top. Declared bottoms and tops are not stored
 * as edges, so they also cover positions registered after them.
 */
public class GraphPrecedenceOrder implements PrecedenceOrder {
    private static final Logger log = LoggerFactory.getLogger(GraphPrecedenceOrder.class);

    private final MutableGraph<CursorPosition> graph = GraphBuilder.directed().allowsSelfLoops(true).build();
    private final Set<CursorPosition> bottoms = new HashSet<>();
    private final Set<CursorPosition> tops = new HashSet<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public GraphPrecedenceOrder() {
        addBottom(CursorPosition.BOTTOM);
        addTop(CursorPosition.TOP);
    }

    @Override
    public void addToken(CursorPosition token) {
        lock.writeLock().lock();
        try {
            graph.addNode(token);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void addBottom(CursorPosition token) {
        lock.writeLock().lock();
        try {
            graph.addNode(token);
            bottoms.add(token);
            log.debug("Declared bottom: {}", token);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void addTop(CursorPosition token) {
        lock.writeLock().lock();
        try {
            graph.addNode(token);
            tops.add(token);
            log.debug("Declared top: {}", token);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void add(CursorPosition lo, CursorPosition hi) {
        lock.writeLock().lock();
        try {
            checkArgument(graph.nodes().contains(lo), "Unknown cursor position: %s", lo);
            checkArgument(graph.nodes().contains(hi), "Unknown cursor position: %s", hi);
            graph.putEdge(lo, hi);
            log.debug("Declared {} <= {}", lo, hi);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean lessOrEqual(CursorPosition a, CursorPosition b) {
        if (a.equals(b)) {
            return true;
        }
        lock.readLock().lock();
        try {
            if (!graph.nodes().contains(a) || !graph.nodes().contains(b)) {
                return bottoms.contains(a) || tops.contains(b);
            }
            Set<CursorPosition> above = Graphs.reachableNodes(graph, a);
            if (above.contains(b)) {
                return true;
            }
            for (CursorPosition reached : above) {
                if (bottoms.contains(reached)) {
                    return true;
                }
            }
            for (CursorPosition top : tops) {
                if (Graphs.reachableNodes(graph, top).contains(b)) {
                    return true;
                }
            }
            return false;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean contains(CursorPosition token) {
        lock.readLock().lock();
        try {
            return graph.nodes().contains(token);
        } finally {
            lock.readLock().unlock();
        }
    }
}
