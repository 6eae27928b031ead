package db.compiler.exec;

import java.util.Arrays;
import java.util.List;

/**
 * CompoundPredicate composes child predicates with logical AND / OR.
 * Children are evaluated left to right and evaluation stops at the first
 * child that decides the result.
 */
public final class CompoundPredicate implements Predicate {
    public enum Type { AND, OR }

    private final Type type;
    private final List<Predicate> children;

    private CompoundPredicate(Type type, List<Predicate> children) {
        if (children.size() < 2) {
            throw new IllegalArgumentException(type + " requires at least two child predicates");
        }
        this.type = type;
        this.children = children;
    }

    public static CompoundPredicate and(Predicate... predicates) {
        return new CompoundPredicate(Type.AND, List.copyOf(Arrays.asList(predicates)));
    }

    public static CompoundPredicate or(Predicate... predicates) {
        return new CompoundPredicate(Type.OR, List.copyOf(Arrays.asList(predicates)));
    }

    public Type type() { return type; }
    public List<Predicate> children() { return children; }

    @Override
    public boolean test(Row row) {
        return switch (type) {
            case AND -> {
                for (Predicate p : children) if (!p.test(row)) { yield false; }
                yield true;
            }
            case OR -> {
                for (Predicate p : children) if (p.test(row)) { yield true; }
                yield false;
            }
        };
    }

    // For debugging
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) sb.append(' ').append(type).append(' ');
            sb.append(children.get(i));
        }
        sb.append(')');
        return sb.toString();
    }
}
