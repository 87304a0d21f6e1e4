package com.dynop.roadnet.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Tarjan's strongly connected components over a {@link RoadGraph}.
 * 
 * <p>The depth-first search keeps its own explicit stack, so long chains of junctions (common in
 * rural networks) cannot overflow the thread stack. Roots are visited in ascending node id order,
 * which makes the order of the returned components reproducible.
 */
public final class StronglyConnectedComponents {
    
    private StronglyConnectedComponents() {
        // Utility class
    }
    
    /**
     * @param graph Graph to partition
     * @return Components in the order Tarjan completes them; together they contain every node exactly once
     */
    public static List<SortedSet<Long>> of(RoadGraph graph) {
        Map<Long, Integer> index = new HashMap<>();
        Map<Long, Integer> lowLink = new HashMap<>();
        Deque<Long> stack = new ArrayDeque<>();
        Set<Long> onStack = new HashSet<>();
        List<SortedSet<Long>> components = new ArrayList<>();
        int counter = 0;
        
        for (Long root : graph.getNodes()) {
            if (index.containsKey(root)) {
                continue;
            }
            
            Deque<Frame> callStack = new ArrayDeque<>();
            index.put(root, counter);
            lowLink.put(root, counter);
            counter++;
            stack.push(root);
            onStack.add(root);
            callStack.push(new Frame(root, graph.getSuccessors(root).iterator()));
            
            while (!callStack.isEmpty()) {
                Frame frame = callStack.peek();
                if (frame.successors.hasNext()) {
                    Long next = frame.successors.next();
                    if (!index.containsKey(next)) {
                        index.put(next, counter);
                        lowLink.put(next, counter);
                        counter++;
                        stack.push(next);
                        onStack.add(next);
                        callStack.push(new Frame(next, graph.getSuccessors(next).iterator()));
                    } else if (onStack.contains(next)) {
                        lowLink.put(frame.node, Math.min(lowLink.get(frame.node), index.get(next)));
                    }
                    continue;
                }
                
                callStack.pop();
                Long node = frame.node;
                if (lowLink.get(node).equals(index.get(node))) {
                    SortedSet<Long> component = new TreeSet<>();
                    Long member;
                    do {
                        member = stack.pop();
                        onStack.remove(member);
                        component.add(member);
                    } while (!member.equals(node));
                    components.add(Collections.unmodifiableSortedSet(component));
                }
                if (!callStack.isEmpty()) {
                    Long parent = callStack.peek().node;
                    lowLink.put(parent, Math.min(lowLink.get(parent), lowLink.get(node)));
                }
            }
        }
        return components;
    }
    
    private static final class Frame {
        final Long node;
        final Iterator<Long> successors;
        
        Frame(Long node, Iterator<Long> successors) {
            this.node = node;
            this.successors = successors;
        }
    }
}
