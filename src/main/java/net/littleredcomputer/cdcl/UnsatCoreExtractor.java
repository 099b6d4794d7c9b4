package net.littleredcomputer.cdcl;

import com.google.common.collect.ImmutableSortedSet;

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;
import java.util.Optional;

/**
 * Walks the resolution proof of a derived clause back to the original clauses it rests on.
 */
class UnsatCoreExtractor {
    private final ClauseStore store;
    private final ResolutionTracer tracer;

    UnsatCoreExtractor(ClauseStore store, ResolutionTracer tracer) {
        this.store = store;
        this.tracer = tracer;
    }

    /**
     * @param root a clause in the store, usually the derived empty clause
     * @return ids of the original clauses at the leaves of root's derivation
     */
    ImmutableSortedSet<Integer> extract(int root) {
        ImmutableSortedSet.Builder<Integer> core = ImmutableSortedSet.naturalOrder();
        BitSet visited = new BitSet(store.size());
        // An explicit stack: proofs can be far deeper than the call stack.
        Deque<Integer> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            int c = pending.pop();
            if (visited.get(c)) continue;
            visited.set(c);
            Optional<ResolutionTracer.Record> r = tracer.lookup(c);
            if (r.isPresent()) {
                r.get().antecedents().forEach(pending::push);
            } else if (store.kind(c) == ClauseStore.Kind.ORIGINAL) {
                core.add(c);
            } else {
                throw new IllegalStateException("learned clause " + c + " has no derivation");
            }
        }
        return core.build();
    }
}
