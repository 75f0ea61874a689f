package dev.drtheo.lux.interpreter;

import dev.drtheo.lux.ast.Expr;

import java.util.IdentityHashMap;
import java.util.Map;

// Scope distance of each local variable, assignment, this and super node.
// Absent nodes are globals. Nodes are records, so keys compare by identity.
public class Resolution {

    private final Map<Expr, Integer> depths = new IdentityHashMap<>();

    void put(Expr expr, int depth) {
        depths.put(expr, depth);
    }

    public Integer depth(Expr expr) {
        return depths.get(expr);
    }

    public boolean isGlobal(Expr expr) {
        return !depths.containsKey(expr);
    }

    public void putAll(Resolution other) {
        depths.putAll(other.depths);
    }

    public int size() {
        return depths.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;

        if (!(o instanceof Resolution other) || other.depths.size() != depths.size())
            return false;

        for (Map.Entry<Expr, Integer> entry : depths.entrySet()) {
            if (!entry.getValue().equals(other.depths.get(entry.getKey())))
                return false;
        }

        return true;
    }

    @Override
    public int hashCode() {
        int hash = 0;

        for (Map.Entry<Expr, Integer> entry : depths.entrySet()) {
            hash += System.identityHashCode(entry.getKey()) ^ entry.getValue();
        }

        return hash;
    }
}
